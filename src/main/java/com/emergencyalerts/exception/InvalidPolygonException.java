package com.emergencyalerts.exception;

import java.util.Map;

/**
 * Area geometry is unusable: open ring, too few distinct vertices or coordinates out of range.
 */
public class InvalidPolygonException extends ValidationException {

    public InvalidPolygonException(int areaIndex, String message) {
        super(ErrorCode.INVALID_POLYGON, message, Map.of("areaIndex", areaIndex));
    }
}
