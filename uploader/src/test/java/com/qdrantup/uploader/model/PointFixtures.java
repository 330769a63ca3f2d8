package com.qdrantup.uploader.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Builders for point fixtures.
 */
public final class PointFixtures {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PointFixtures() {}

    public static Point point(String id, float... components) {
        List<Float> vector = new ArrayList<>(components.length);
        for (float c : components) {
            vector.add(c);
        }
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("text", "chunk " + id);
        return new Point(id, vector, payload);
    }

    public static InputDataset dataset(int size) {
        List<Point> points = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            points.add(point(new UUID(0L, i).toString(), i, i + 0.5f));
        }
        return new InputDataset(points);
    }
}
