package com.emergencyalerts.auth;

import com.emergencyalerts.domain.enums.UserRole;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Restricts a controller method to users holding at least one of the given roles.
 * Enforced by {@link RoleGuard}; ADMIN always passes.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequiresRole {

    UserRole[] value();
}
