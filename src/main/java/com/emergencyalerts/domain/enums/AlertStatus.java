package com.emergencyalerts.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of an alert.
 *
 * <pre>
 *   DRAFT -> PENDING_APPROVAL -> APPROVED -> DELIVERED
 *                             -> REJECTED
 *   PENDING_APPROVAL | APPROVED -> CANCELLED
 *   any non-terminal            -> EXPIRED   (once expiresAt has passed)
 * </pre>
 *
 * <p>Terminal statuses are kept forever for audit and correlation.
 */
public enum AlertStatus {
    DRAFT,
    PENDING_APPROVAL,
    APPROVED,
    REJECTED,
    DELIVERED,
    CANCELLED,
    EXPIRED;

    private static final Set<AlertStatus> TERMINAL = EnumSet.of(REJECTED, DELIVERED, CANCELLED, EXPIRED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /** Statuses whose effective value flips to EXPIRED once the alert's expiry has passed. */
    public boolean expiresWithTime() {
        return !isTerminal();
    }

    public boolean canTransitionTo(AlertStatus target) {
        return switch (this) {
            case DRAFT -> target == PENDING_APPROVAL || target == EXPIRED;
            case PENDING_APPROVAL -> target == APPROVED
                    || target == REJECTED
                    || target == CANCELLED
                    || target == EXPIRED;
            case APPROVED -> target == DELIVERED || target == CANCELLED || target == EXPIRED;
            case REJECTED, DELIVERED, CANCELLED, EXPIRED -> false;
        };
    }
}
