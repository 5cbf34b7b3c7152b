package com.stowrage.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stowrage.core.errors.MirrorException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts store values to and from the JSON text kept in the mirror's data column, and
 * applies keyed changes to structured values.
 *
 * <p>A value is structured when Jackson writes it as a JSON object or array: any {@link Map},
 * bean, record, {@link List} or Java array. Objects are keyed by field name, arrays by the
 * decimal index of an existing element. Everything else (strings, numbers, booleans, null) is
 * scalar.
 */
public final class ValueCodec<T> {
    static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final JavaType type;

    private ValueCodec(JavaType type) {
        this.type = type;
    }

    public static <T> ValueCodec<T> of(Class<T> type) {
        return new ValueCodec<>(OBJECT_MAPPER.constructType(type));
    }

    public static <T> ValueCodec<T> of(TypeReference<T> type) {
        return new ValueCodec<>(OBJECT_MAPPER.getTypeFactory().constructType(type));
    }

    public String encode(T value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new MirrorException("Error serializing value to JSON", e);
        }
    }

    public T decode(String json) {
        try {
            return OBJECT_MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new MirrorException("Error deserializing value as " + type, e);
        }
    }

    /**
     * Converts an arbitrary replacement value to the store's value type.
     *
     * @throws IllegalArgumentException if the value can not be represented as the value type
     */
    public T coerce(Object value) {
        return OBJECT_MAPPER.convertValue(value, type);
    }

    public boolean isStructured(T value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Map || value instanceof List) {
            return true;
        }
        JsonNode tree = OBJECT_MAPPER.valueToTree(value);
        return tree.isObject() || tree.isArray();
    }

    public boolean hasKey(T value, String key) {
        if (value instanceof Map) {
            return ((Map<?, ?>) value).containsKey(key);
        }
        if (value instanceof List) {
            return index(key, ((List<?>) value).size()) >= 0;
        }
        JsonNode tree = OBJECT_MAPPER.valueToTree(value);
        if (tree.isArray()) {
            return index(key, tree.size()) >= 0;
        }
        return tree.has(key);
    }

    /**
     * Returns a copy of {@code value} with {@code key} replaced. The original is left untouched.
     *
     * @throws IllegalArgumentException if the value is an array and {@code key} is not one of its indices
     */
    public T withKey(T value, String key, Object replacement) {
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>((Map<?, ?>) value);
            copy.put(key, replacement);
            return coerce(copy);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>((List<?>) value);
            copy.set(requireIndex(key, copy.size()), replacement);
            return coerce(copy);
        }
        JsonNode tree = OBJECT_MAPPER.valueToTree(value);
        if (tree.isArray()) {
            ((ArrayNode) tree).set(requireIndex(key, tree.size()), OBJECT_MAPPER.valueToTree(replacement));
        } else {
            ((ObjectNode) tree).set(key, OBJECT_MAPPER.valueToTree(replacement));
        }
        try {
            return OBJECT_MAPPER.treeToValue(tree, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Can not set " + key + " on " + type, e);
        }
    }

    private static int requireIndex(String key, int size) {
        int index = index(key, size);
        if (index < 0) {
            throw new IllegalArgumentException(key + " is not an index below " + size);
        }
        return index;
    }

    // -1 unless key is the decimal index of an existing element
    private static int index(String key, int size) {
        if (key == null) {
            return -1;
        }
        try {
            int index = Integer.parseInt(key);
            return index >= 0 && index < size ? index : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
