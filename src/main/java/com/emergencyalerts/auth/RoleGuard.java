package com.emergencyalerts.auth;

import com.emergencyalerts.domain.enums.UserRole;
import com.emergencyalerts.exception.ForbiddenException;
import com.emergencyalerts.exception.UnauthorizedException;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.stream.Collectors;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;

/**
 * AOP aspect that enforces {@link RequiresRole}.
 *
 * <p>Reads the {@link AuthenticatedUser} that {@link JwtAuthFilter} stored on the current
 * request and throws {@link ForbiddenException} when it lacks every listed role.
 */
@Aspect
@Component
public class RoleGuard {

    private static final Logger log = LoggerFactory.getLogger(RoleGuard.class);

    @Around("@annotation(com.emergencyalerts.auth.RequiresRole)")
    public Object guardRole(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        RequiresRole annotation = method.getAnnotation(RequiresRole.class);

        AuthenticatedUser user = currentUser();
        if (user == null) {
            throw new UnauthorizedException("Authentication required");
        }

        if (!user.hasAnyRole(annotation.value())) {
            String required = Arrays.stream(annotation.value()).map(UserRole::name).collect(Collectors.joining(" or "));
            log.warn("User {} blocked from {}: requires {}", user.getUserId(), method.getName(), required);
            throw new ForbiddenException(user.getUserId(), required);
        }

        return joinPoint.proceed();
    }

    private static AuthenticatedUser currentUser() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            return null;
        }
        Object user = attributes.getAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        return user instanceof AuthenticatedUser authenticatedUser ? authenticatedUser : null;
    }
}
