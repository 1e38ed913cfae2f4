package com.dcruver.docvalidator.domain;

import lombok.Data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsed metadata block: recognized key to raw YAML value (String, Number, Boolean, List, Map or null).
 */
@Data
public class Metadata {
    private final Map<String, Object> fields;

    public static Metadata empty() {
        return new Metadata(Map.of());
    }

    public static Metadata of(Map<String, Object> fields) {
        return new Metadata(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    public boolean has(String key) {
        return fields.containsKey(key);
    }

    public Object get(String key) {
        return fields.get(key);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
