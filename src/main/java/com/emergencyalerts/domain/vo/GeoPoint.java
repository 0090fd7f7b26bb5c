package com.emergencyalerts.domain.vo;

import lombok.Value;

/**
 * A WGS84 position. Longitude first, matching GeoJSON ring ordering.
 */
@Value
public class GeoPoint {

    double longitude;
    double latitude;

    public static GeoPoint of(double longitude, double latitude) {
        return new GeoPoint(longitude, latitude);
    }

    public boolean isInRange() {
        return Double.isFinite(longitude)
                && Double.isFinite(latitude)
                && longitude >= -180.0
                && longitude <= 180.0
                && latitude >= -90.0
                && latitude <= 90.0;
    }
}
