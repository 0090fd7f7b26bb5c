package com.emergencyalerts.event;

/**
 * What happened to an alert in an {@link AlertStatusChangedEvent}.
 */
public enum AlertEventType {
    CREATED,
    SUBMITTED,
    APPROVED,
    REJECTED,
    CANCELLED,
    DELIVERED,
    EXPIRED
}
