package com.emergencyalerts.exception;

import java.util.Map;

public class ForbiddenException extends BaseException {

    public ForbiddenException(String userId, String requiredRole) {
        super(
                ErrorCode.FORBIDDEN,
                String.format("User %s lacks role %s", userId, requiredRole),
                Map.of("requiredRole", requiredRole));
    }
}
