package com.emergencyalerts.domain.enums;

/** Severity of an alert, ordered from least to most severe. */
public enum Severity {
    UNKNOWN,
    MINOR,
    MODERATE,
    SEVERE,
    EXTREME
}
