package com.qdrantup.uploader.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.qdrantup.uploader.model.Point;
import io.qdrant.client.VectorsFactory;
import io.qdrant.client.grpc.JsonWithInt.ListValue;
import io.qdrant.client.grpc.JsonWithInt.NullValue;
import io.qdrant.client.grpc.JsonWithInt.Struct;
import io.qdrant.client.grpc.JsonWithInt.Value;
import io.qdrant.client.grpc.Points.PointId;
import io.qdrant.client.grpc.Points.PointStruct;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts input points into Qdrant {@link PointStruct}s. The JSON payload is mapped
 * structurally: integers that fit in a long become integer values, every other number
 * a double, and arrays and objects are converted recursively.
 */
public class PointConverter {

    public PointStruct toPointStruct(Point point) {
        return PointStruct.newBuilder()
                .setId(PointId.newBuilder().setUuid(point.id()).build())
                .setVectors(VectorsFactory.vectors(point.vector()))
                .putAllPayload(toPayload(point.payload()))
                .build();
    }

    Map<String, Value> toPayload(JsonNode payload) {
        Map<String, Value> fields = new LinkedHashMap<>();
        if (payload == null) {
            return fields;
        }
        Iterator<Map.Entry<String, JsonNode>> it = payload.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            fields.put(entry.getKey(), toValue(entry.getValue()));
        }
        return fields;
    }

    Value toValue(JsonNode node) {
        Value.Builder value = Value.newBuilder();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return value.setNullValue(NullValue.NULL_VALUE).build();
        }
        if (node.isTextual()) {
            return value.setStringValue(node.textValue()).build();
        }
        if (node.isBoolean()) {
            return value.setBoolValue(node.booleanValue()).build();
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return value.setIntegerValue(node.longValue()).build();
        }
        if (node.isNumber()) {
            return value.setDoubleValue(node.doubleValue()).build();
        }
        if (node.isArray()) {
            ListValue.Builder list = ListValue.newBuilder();
            for (JsonNode element : node) {
                list.addValues(toValue(element));
            }
            return value.setListValue(list).build();
        }
        if (node.isObject()) {
            return value.setStructValue(Struct.newBuilder().putAllFields(toPayload(node))).build();
        }
        // binary and POJO nodes only come from programmatic trees, never from parsed input
        return value.setStringValue(node.asText()).build();
    }
}
