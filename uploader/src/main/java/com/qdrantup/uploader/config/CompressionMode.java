package com.qdrantup.uploader.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Wire compression requested for calls to the store. Each mode names the gRPC codec
 * it asks for; {@link #NONE} asks for none.
 */
public enum CompressionMode {

    NONE(null),
    GZIP("gzip"),
    ZSTD("zstd"),
    LZ4("lz4");

    private final String codecName;

    CompressionMode(String codecName) {
        this.codecName = codecName;
    }

    /**
     * @return the gRPC codec name, or {@code null} for {@link #NONE}
     */
    public String codecName() {
        return codecName;
    }

    /**
     * Parses a mode name case-insensitively.
     *
     * @throws IllegalArgumentException if the name is not a recognized mode
     */
    public static CompressionMode parse(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (CompressionMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown compression mode '" + value + "' (expected one of: "
                + Arrays.stream(values()).map(CompressionMode::label).collect(Collectors.joining(", ")) + ")");
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
