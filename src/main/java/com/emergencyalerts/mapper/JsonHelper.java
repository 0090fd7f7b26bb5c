package com.emergencyalerts.mapper;

import com.emergencyalerts.domain.vo.GeoPoint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static JSON conversions used by the MapStruct mappers for TEXT columns (polygon rings,
 * alert id lists) and by the reaction layer for correlation metadata.
 *
 * <p>Rings are stored GeoJSON-style as arrays of {@code [longitude, latitude]} pairs.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<List<double[]>> RING_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    static {
        OBJECT_MAPPER.findAndRegisterModules();
    }

    private JsonHelper() {}

    /** Serialize an object to JSON string. Returns null if input is null. */
    public static String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize to JSON: {}", value.getClass().getSimpleName(), e);
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    /** Deserialize a JSON array string to a List. Returns empty list if input is null. */
    public static <T> List<T> fromJsonList(String json, Class<T> elementType) {
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }
        try {
            return OBJECT_MAPPER.readValue(
                    json, OBJECT_MAPPER.getTypeFactory().constructCollectionType(List.class, elementType));
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize JSON list of {}: {}", elementType.getSimpleName(), json, e);
            throw new IllegalStateException("JSON list deserialization failed", e);
        }
    }

    /** Deserialize a JSON object string to a map. Returns an empty map if input is null. */
    public static Map<String, Object> fromJsonMap(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return OBJECT_MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize JSON object: {}", json, e);
            throw new IllegalStateException("JSON map deserialization failed", e);
        }
    }

    public static String ringToJson(List<GeoPoint> ring) {
        if (ring == null) {
            return null;
        }
        List<double[]> pairs = new ArrayList<>(ring.size());
        for (GeoPoint point : ring) {
            pairs.add(new double[] {point.getLongitude(), point.getLatitude()});
        }
        return toJson(pairs);
    }

    public static List<GeoPoint> ringFromJson(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }
        try {
            List<double[]> pairs = OBJECT_MAPPER.readValue(json, RING_TYPE);
            List<GeoPoint> ring = new ArrayList<>(pairs.size());
            for (double[] pair : pairs) {
                ring.add(GeoPoint.of(pair[0], pair[1]));
            }
            return ring;
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize polygon ring: {}", json, e);
            throw new IllegalStateException("Polygon deserialization failed", e);
        }
    }
}
