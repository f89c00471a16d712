package com.whereq.orchestra.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.orchestra.model.PersistentRecord;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * JSON document mapping shared by the record store implementations. Attribute fields are split
 * out of the document on write and laid back over it on read.
 */
class RecordCodec<T extends PersistentRecord> {

    private final ObjectMapper objectMapper;
    private final Class<T> type;
    private final Set<String> attributeFields;

    RecordCodec(ObjectMapper objectMapper, Class<T> type, Set<String> attributeFields) {
        this.objectMapper = objectMapper;
        this.type = type;
        this.attributeFields = Set.copyOf(attributeFields);
    }

    String toJson(T record) {
        ObjectNode document = objectMapper.valueToTree(record);
        attributeFields.forEach(document::remove);
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + type.getSimpleName() + " " + record.getId(), e);
        }
    }

    /**
     * Attribute values of a freshly created record, as strings
     */
    Map<String, String> initialAttributes(T record) {
        if (attributeFields.isEmpty()) {
            return Map.of();
        }
        JsonNode tree = objectMapper.valueToTree(record);
        Map<String, String> attributes = new LinkedHashMap<>();
        for (String field : attributeFields) {
            JsonNode value = tree.get(field);
            if (value != null && !value.isNull()) {
                attributes.put(field, value.asText());
            }
        }
        return attributes;
    }

    T fromJson(String json, Map<String, String> attributes) {
        try {
            ObjectNode document = (ObjectNode) objectMapper.readTree(json);
            attributes.forEach((field, value) -> {
                if (!attributeFields.contains(field) || value == null) {
                    return;
                }
                try {
                    document.put(field, Long.parseLong(value));
                } catch (NumberFormatException notNumeric) {
                    document.put(field, value);
                }
            });
            return objectMapper.treeToValue(document, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    boolean isAttribute(String field) {
        return attributeFields.contains(field);
    }
}
