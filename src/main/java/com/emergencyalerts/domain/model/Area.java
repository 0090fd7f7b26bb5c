package com.emergencyalerts.domain.model;

import com.emergencyalerts.domain.IdGenerator;
import com.emergencyalerts.domain.vo.GeoPoint;
import com.emergencyalerts.exception.InvalidPolygonException;
import com.emergencyalerts.exception.ValidationException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * A named polygon an alert is targeted at. Owned by exactly one alert.
 *
 * <p>The polygon is a closed ring: first and last points are equal and at least three
 * distinct vertices are present.
 */
@Value
@Builder
public class Area {

    private static final int MIN_DISTINCT_VERTICES = 3;
    private static final int REGION_CODE_MAX_LENGTH = 50;

    String id;
    String description;
    List<GeoPoint> polygon;
    String regionCode;

    public static Area create(int index, AreaDraft draft, AlertPolicy policy, IdGenerator ids) {
        if (draft == null) {
            throw new ValidationException("areas[" + index + "]", "Area must not be null");
        }
        String description = draft.getDescription() == null ? "" : draft.getDescription().trim();
        if (description.isEmpty()) {
            throw new ValidationException("areas[" + index + "].description", "Area description is required");
        }
        if (description.length() > policy.getAreaDescriptionMaxLength()) {
            throw new ValidationException(
                    "areas[" + index + "].description",
                    "Area description must be at most " + policy.getAreaDescriptionMaxLength() + " characters");
        }
        String regionCode = normalizeRegionCode(draft.getRegionCode());
        if (regionCode != null && regionCode.length() > REGION_CODE_MAX_LENGTH) {
            throw new ValidationException(
                    "areas[" + index + "].regionCode",
                    "Region code must be at most " + REGION_CODE_MAX_LENGTH + " characters");
        }
        validateRing(index, draft.getPolygon());

        return Area.builder()
                .id(ids.newId())
                .description(description)
                .polygon(List.copyOf(draft.getPolygon()))
                .regionCode(regionCode)
                .build();
    }

    /**
     * Checks that {@code ring} is a closed ring of in-range coordinates with at least three
     * distinct vertices.
     *
     * @throws InvalidPolygonException on the first violation found
     */
    public static void validateRing(int index, List<GeoPoint> ring) {
        if (ring == null || ring.isEmpty()) {
            throw new InvalidPolygonException(index, "Area " + index + " has no polygon");
        }
        for (int i = 0; i < ring.size(); i++) {
            GeoPoint point = ring.get(i);
            if (point == null) {
                throw new InvalidPolygonException(index, "Area " + index + " has a null point at position " + i);
            }
            if (!point.isInRange()) {
                throw new InvalidPolygonException(
                        index,
                        String.format(
                                "Area %d point %d (%s, %s) is outside valid longitude/latitude ranges",
                                index, i, point.getLongitude(), point.getLatitude()));
            }
        }
        if (ring.size() < MIN_DISTINCT_VERTICES + 1) {
            throw new InvalidPolygonException(
                    index, "Area " + index + " polygon needs at least 4 points forming a closed ring");
        }
        if (!ring.get(0).equals(ring.get(ring.size() - 1))) {
            throw new InvalidPolygonException(
                    index, "Area " + index + " polygon is not closed: first and last points differ");
        }
        Set<GeoPoint> distinct = new HashSet<>(ring);
        if (distinct.size() < MIN_DISTINCT_VERTICES) {
            throw new InvalidPolygonException(
                    index, "Area " + index + " polygon needs at least 3 distinct vertices");
        }
    }

    private static String normalizeRegionCode(String regionCode) {
        if (regionCode == null || regionCode.isBlank()) {
            return null;
        }
        return regionCode.trim();
    }
}
