package com.emergencyalerts.domain.enums;

public enum AttemptOutcome {
    SUCCESS,
    FAILURE
}
