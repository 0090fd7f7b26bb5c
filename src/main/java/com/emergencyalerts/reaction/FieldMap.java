package com.emergencyalerts.reaction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Insertion-ordered field set used for dashboard payloads and correlation metadata. Null
 * values are kept so the dashboard sees every field.
 */
public final class FieldMap {

    private final Map<String, Object> fields = new LinkedHashMap<>();

    private FieldMap() {}

    public static FieldMap create() {
        return new FieldMap();
    }

    public FieldMap with(String name, Object value) {
        fields.put(name, value);
        return this;
    }

    public Map<String, Object> toMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
