package com.qdrantup.uploader.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Resolved, immutable uploader configuration. Every setting is looked up in the
 * command line first, then in the process environment, then in a {@code .env} file
 * read with dotenv-java, and finally falls back to its default.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    static final String DEFAULT_COLLECTION = "documents";
    static final int DEFAULT_DIMENSIONS = 768;
    static final int DEFAULT_BATCH_SIZE = 100;
    static final int DEFAULT_TIMEOUT_SECONDS = 30;
    static final int DEFAULT_POOL_SIZE = 3;

    /**
     * Maps each CLI flag to the environment variable that backs it.
     */
    static final Map<String, String> FLAG_TO_ENV = Map.of(
            "url", "QDRANT_URL",
            "api-key", "QDRANT_API_KEY",
            "input", "QDRANT_INPUT",
            "collection", "QDRANT_COLLECTION",
            "dimensions", "QDRANT_DIMENSIONS",
            "batch-size", "QDRANT_BATCH_SIZE",
            "timeout", "QDRANT_TIMEOUT",
            "pool-size", "QDRANT_POOL_SIZE",
            "compression", "QDRANT_COMPRESSION"
    );

    private final String url;
    private final String apiKey;
    private final Path inputPath;
    private final String collection;
    private final int dimensions;
    private final int batchSize;
    private final Duration timeout;
    private final int poolSize;
    private final CompressionMode compression;

    /**
     * Resolves configuration from CLI arguments, the environment and {@code .env}.
     */
    public static AppConfig fromArgs(String[] args) {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        return resolve(parseArgs(args), System.getenv(), dotenv);
    }

    static AppConfig resolve(Map<String, String> cliArgs, Map<String, String> env, Dotenv dotenv) {
        Map<String, String> values = new HashMap<>();
        for (Map.Entry<String, String> entry : FLAG_TO_ENV.entrySet()) {
            String flag = entry.getKey();
            String envKey = entry.getValue();
            String value = cliArgs.get(flag);
            if (isBlank(value)) {
                value = env.get(envKey);
            }
            if (isBlank(value) && dotenv != null) {
                value = dotenv.get(envKey);
            }
            if (!isBlank(value)) {
                values.put(flag, value.trim());
            }
        }

        String input = values.get("input");
        AppConfig config = new AppConfig(
                values.get("url"),
                values.getOrDefault("api-key", ""),
                input != null ? Path.of(input) : null,
                values.getOrDefault("collection", DEFAULT_COLLECTION),
                parsePositiveInt(values, "dimensions", DEFAULT_DIMENSIONS),
                parsePositiveInt(values, "batch-size", DEFAULT_BATCH_SIZE),
                Duration.ofSeconds(parsePositiveInt(values, "timeout", DEFAULT_TIMEOUT_SECONDS)),
                parsePositiveInt(values, "pool-size", DEFAULT_POOL_SIZE),
                CompressionMode.parse(values.get("compression")));

        logger.info("Configuration loaded: {}", config);
        return config;
    }

    /**
     * Constructor for testing, and for callers that already hold resolved values.
     */
    public AppConfig(String url, String apiKey, Path inputPath, String collection, int dimensions,
                     int batchSize, Duration timeout, int poolSize, CompressionMode compression) {
        this.url = url;
        this.apiKey = apiKey != null ? apiKey : "";
        this.inputPath = inputPath;
        this.collection = collection;
        this.dimensions = dimensions;
        this.batchSize = batchSize;
        this.timeout = timeout;
        this.poolSize = poolSize;
        this.compression = compression != null ? compression : CompressionMode.NONE;

        validate();
    }

    private void validate() {
        StringBuilder missing = new StringBuilder();
        if (isBlank(url)) missing.append("QDRANT_URL ");
        if (inputPath == null) missing.append("QDRANT_INPUT ");
        if (isBlank(collection)) missing.append("QDRANT_COLLECTION ");

        if (!missing.isEmpty()) {
            throw new IllegalStateException(
                    "Missing required settings: " + missing.toString().trim());
        }

        requirePositive("dimensions", dimensions);
        requirePositive("batch size", batchSize);
        requirePositive("pool size", poolSize);
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration, got: " + timeout);
        }
    }

    /**
     * Collects {@code --flag value} and {@code --flag=value} pairs. Unknown flags are
     * kept so that resolution can ignore them; a flag with no value is rejected.
     */
    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> parsed = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
            String flag = arg.substring(2);
            int eq = flag.indexOf('=');
            if (eq >= 0) {
                parsed.put(flag.substring(0, eq), flag.substring(eq + 1));
            } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                parsed.put(flag, args[++i]);
            } else {
                throw new IllegalArgumentException("Missing value for --" + flag);
            }
        }
        return parsed;
    }

    private static int parsePositiveInt(Map<String, String> values, String flag, int defaultValue) {
        String raw = values.get(flag);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + flag + " must be an integer, got: " + raw, e);
        }
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be at least 1, got: " + value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getUrl() {
        return url;
    }

    public String getApiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return !apiKey.isBlank();
    }

    public Path getInputPath() {
        return inputPath;
    }

    public String getCollection() {
        return collection;
    }

    public int getDimensions() {
        return dimensions;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public CompressionMode getCompression() {
        return compression;
    }

    @Override
    public String toString() {
        return "AppConfig{url=" + url
                + ", apiKey=" + (hasApiKey() ? "[REDACTED]" : "<none>")
                + ", input=" + inputPath
                + ", collection=" + collection
                + ", dimensions=" + dimensions
                + ", batchSize=" + batchSize
                + ", timeout=" + timeout.toSeconds() + "s"
                + ", poolSize=" + poolSize
                + ", compression=" + compression.label()
                + "}";
    }
}
