package com.emergencyalerts.domain.enums;

/**
 * Kind of pattern recorded as a {@link com.emergencyalerts.domain.model.CorrelationEvent}.
 */
public enum PatternType {
    GEOGRAPHIC_CLUSTER,
    REGIONAL_HOTSPOT,
    SEVERITY_ESCALATION,
    DUPLICATE_SUPPRESSION,
    AREA_EXPANSION_SUGGESTION,
    RATE_SPIKE,
    EXPIRY_WARNING,
    SLA_BREACH,
    APPROVAL_TIMEOUT
}
