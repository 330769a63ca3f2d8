package com.qdrantup.uploader.input;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qdrantup.uploader.exception.InputLoadException;
import com.qdrantup.uploader.exception.InputParseException;
import com.qdrantup.uploader.model.InputDataset;
import com.qdrantup.uploader.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the embeddings file and turns it into an {@link InputDataset}.
 *
 * <p>Expected shape:
 * <pre>
 *   {"points": [{"id": "...", "vector": [0.1, 0.2], "payload": {...}}, ...]}
 * </pre>
 * Other top-level and per-point fields are ignored. Anything after the root object is an error. Loading is all-or-nothing: the first
 * malformed record fails the whole file.
 */
public class InputLoader {

    private static final Logger logger = LoggerFactory.getLogger(InputLoader.class);

    static final String FIELD_POINTS = "points";
    static final String FIELD_ID = "id";
    static final String FIELD_VECTOR = "vector";
    static final String FIELD_PAYLOAD = "payload";

    private final ObjectMapper objectMapper;

    public InputLoader() {
        this(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    public InputLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reads and parses the file at {@code path}.
     *
     * @throws InputLoadException  if the file cannot be read
     * @throws InputParseException if the content is not the expected JSON shape
     */
    public InputDataset load(Path path) throws InputLoadException, InputParseException {
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new InputLoadException("Failed to read input file: " + path, e);
        }

        InputDataset dataset = parse(content);
        logger.info("Loaded {} points from input file", dataset.size());
        return dataset;
    }

    /**
     * Parses raw file content.
     */
    public InputDataset parse(byte[] content) throws InputParseException {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new InputParseException("Failed to parse input JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new InputParseException("Failed to parse input JSON: " + e.getMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new InputParseException("Input JSON must be an object with a '" + FIELD_POINTS + "' array");
        }

        JsonNode pointsNode = root.get(FIELD_POINTS);
        if (pointsNode == null || !pointsNode.isArray()) {
            throw new InputParseException("Input JSON is missing the '" + FIELD_POINTS + "' array");
        }

        List<Point> points = new ArrayList<>(pointsNode.size());
        for (int i = 0; i < pointsNode.size(); i++) {
            points.add(parsePoint(pointsNode.get(i), i));
        }
        return new InputDataset(points);
    }

    private Point parsePoint(JsonNode node, int index) throws InputParseException {
        if (!node.isObject()) {
            throw new InputParseException("points[" + index + "] must be an object");
        }

        JsonNode idNode = node.get(FIELD_ID);
        if (idNode == null || !idNode.isTextual()) {
            throw new InputParseException("points[" + index + "]." + FIELD_ID + " must be a string");
        }

        JsonNode vectorNode = node.get(FIELD_VECTOR);
        if (vectorNode == null || !vectorNode.isArray()) {
            throw new InputParseException("points[" + index + "]." + FIELD_VECTOR + " must be an array of numbers");
        }
        List<Float> vector = new ArrayList<>(vectorNode.size());
        for (int j = 0; j < vectorNode.size(); j++) {
            JsonNode component = vectorNode.get(j);
            if (!component.isNumber()) {
                throw new InputParseException("points[" + index + "]." + FIELD_VECTOR + "[" + j
                        + "] must be a number, got: " + component.getNodeType());
            }
            vector.add(component.floatValue());
        }

        JsonNode payloadNode = node.get(FIELD_PAYLOAD);
        ObjectNode payload;
        if (payloadNode == null || payloadNode.isNull()) {
            payload = objectMapper.createObjectNode();
        } else if (payloadNode.isObject()) {
            payload = (ObjectNode) payloadNode;
        } else {
            throw new InputParseException("points[" + index + "]." + FIELD_PAYLOAD
                    + " must be an object, got: " + payloadNode.getNodeType());
        }

        return new Point(idNode.textValue(), vector, payload);
    }
}
