package com.emergencyalerts.domain.enums;

/** Roles carried in the operator JWT's {@code roles} claim. */
public enum UserRole {
    OPERATOR,
    APPROVER,
    ADMIN
}
