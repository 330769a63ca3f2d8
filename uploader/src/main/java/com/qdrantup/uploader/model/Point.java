package com.qdrantup.uploader.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * A single vector record to ingest. The payload is forwarded to the store verbatim.
 */
public record Point(
        String id,
        List<Float> vector,
        ObjectNode payload
) {

    public Point {
        vector = List.copyOf(vector);
    }
}
