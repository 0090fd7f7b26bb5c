package com.emergencyalerts.config;

import com.emergencyalerts.auth.JwtAuthFilter;
import com.emergencyalerts.auth.ReactionTokenFilter;
import com.emergencyalerts.observability.CorrelationIdFilter;
import com.emergencyalerts.observability.RequestLoggingFilter;
import com.emergencyalerts.ratelimit.RateLimitFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS and servlet filter order: correlation id, request logging, reaction token or JWT,
 * then per-user rate limiting.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${emergency-alerts.cors.allowed-origin}")
    private String allowedOrigin;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns(allowedOrigin)
                .allowedMethods("*")
                .allowedHeaders("*")
                .exposedHeaders(
                        "ETag",
                        CorrelationIdFilter.HEADER,
                        "Retry-After",
                        "X-RateLimit-Limit",
                        "X-RateLimit-Remaining")
                .allowCredentials(true);
    }

    @Bean
    public FilterRegistrationBean<CorrelationIdFilter> correlationIdFilterRegistration(
            CorrelationIdFilter correlationIdFilter) {
        FilterRegistrationBean<CorrelationIdFilter> registration = new FilterRegistrationBean<>(correlationIdFilter);
        registration.addUrlPatterns("/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<RequestLoggingFilter> requestLoggingFilterRegistration(
            RequestLoggingFilter requestLoggingFilter) {
        FilterRegistrationBean<RequestLoggingFilter> registration = new FilterRegistrationBean<>(requestLoggingFilter);
        registration.addUrlPatterns("/api/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 1);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<ReactionTokenFilter> reactionTokenFilterRegistration(
            ReactionTokenFilter reactionTokenFilter) {
        FilterRegistrationBean<ReactionTokenFilter> registration = new FilterRegistrationBean<>(reactionTokenFilter);
        registration.addUrlPatterns("/api/reactions/*");
        registration.setOrder(1);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<JwtAuthFilter> jwtAuthFilterRegistration(JwtAuthFilter jwtAuthFilter) {
        FilterRegistrationBean<JwtAuthFilter> registration = new FilterRegistrationBean<>(jwtAuthFilter);
        registration.addUrlPatterns("/api/*");
        registration.setOrder(2);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration(RateLimitFilter rateLimitFilter) {
        FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>(rateLimitFilter);
        registration.addUrlPatterns("/api/alerts", "/api/alerts/*");
        registration.setOrder(3);
        return registration;
    }
}
