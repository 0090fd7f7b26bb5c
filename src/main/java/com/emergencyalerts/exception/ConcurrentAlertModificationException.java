package com.emergencyalerts.exception;

import java.util.HashMap;
import java.util.Map;

/**
 * Another writer changed the alert first. Either the caller's precondition token is stale
 * or the compare-and-swap lost a race. Reported to the caller, never retried.
 */
public class ConcurrentAlertModificationException extends BaseException {

    public ConcurrentAlertModificationException(String alertId, String expectedVersion, String actualVersion) {
        super(
                ErrorCode.CONCURRENT_MODIFICATION,
                String.format("Alert %s was modified concurrently", alertId),
                details(alertId, expectedVersion, actualVersion));
    }

    private static Map<String, Object> details(String alertId, String expectedVersion, String actualVersion) {
        Map<String, Object> details = new HashMap<>();
        details.put("alertId", alertId);
        if (expectedVersion != null) {
            details.put("expectedVersion", expectedVersion);
        }
        if (actualVersion != null) {
            details.put("currentVersion", actualVersion);
        }
        return details;
    }
}
