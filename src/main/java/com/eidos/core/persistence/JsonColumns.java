package com.eidos.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encodes and decodes the JSON text columns. Decoding never throws: missing or
 * unparseable text yields an empty container.
 */
public final class JsonColumns {

    private static final Logger log = LoggerFactory.getLogger(JsonColumns.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonColumns() {}

    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize JSON column", e);
        }
    }

    public static List<String> readList(String json) {
        List<String> out = new ArrayList<>();
        if (json == null || json.isBlank()) return out;
        try {
            Object parsed = MAPPER.readValue(json, Object.class);
            if (parsed instanceof List<?> list) {
                for (Object item : list) {
                    if (item != null) out.add(String.valueOf(item));
                }
            }
        } catch (JsonProcessingException e) {
            log.debug("Unparseable JSON list column, using empty list: {}", e.getOriginalMessage());
        }
        return out;
    }

    public static Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) return new LinkedHashMap<>();
        try {
            Object parsed = MAPPER.readValue(json, Object.class);
            if (parsed instanceof Map<?, ?> m) {
                Map<String, Object> out = new LinkedHashMap<>();
                m.forEach((k, v) -> out.put(String.valueOf(k), v));
                return out;
            }
        } catch (JsonProcessingException e) {
            log.debug("Unparseable JSON object column, using empty map: {}", e.getOriginalMessage());
        }
        return new LinkedHashMap<>();
    }

    public static Map<String, Integer> readCounts(String json) {
        Map<String, Integer> out = new LinkedHashMap<>();
        readMap(json).forEach((k, v) -> {
            if (v instanceof Number n) out.put(k, n.intValue());
        });
        return out;
    }
}
