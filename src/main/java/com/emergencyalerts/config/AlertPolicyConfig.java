package com.emergencyalerts.config;

import com.emergencyalerts.domain.model.AlertPolicy;
import com.emergencyalerts.domain.model.ReactionSettings;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the immutable {@link AlertPolicy} and {@link ReactionSettings} snapshots from
 * application.properties. Services hand these snapshots to domain calls explicitly.
 *
 * <p>Properties prefixes: {@code emergency-alerts.policy.*}, {@code emergency-alerts.reactions.*}
 */
@Configuration
public class AlertPolicyConfig {

    @Bean
    public AlertPolicy alertPolicy(
            @Value("${emergency-alerts.policy.headline-max-length:100}") int headlineMaxLength,
            @Value("${emergency-alerts.policy.description-max-length:1395}") int descriptionMaxLength,
            @Value("${emergency-alerts.policy.area-description-max-length:255}") int areaDescriptionMaxLength,
            @Value("${emergency-alerts.policy.rejection-reason-max-length:500}") int rejectionReasonMaxLength,
            @Value("${emergency-alerts.policy.default-language-code:en-GB}") String defaultLanguageCode,
            @Value("${emergency-alerts.policy.approval-timeout:PT5M}") Duration approvalTimeout,
            @Value("${emergency-alerts.policy.delivery-sla:PT60S}") Duration deliverySla,
            @Value("${emergency-alerts.policy.default-page-size:50}") int defaultPageSize,
            @Value("${emergency-alerts.policy.max-page-size:200}") int maxPageSize) {
        return AlertPolicy.builder()
                .headlineMaxLength(headlineMaxLength)
                .descriptionMaxLength(descriptionMaxLength)
                .areaDescriptionMaxLength(areaDescriptionMaxLength)
                .rejectionReasonMaxLength(rejectionReasonMaxLength)
                .defaultLanguageCode(defaultLanguageCode)
                .approvalTimeout(approvalTimeout)
                .deliverySla(deliverySla)
                .defaultPageSize(defaultPageSize)
                .maxPageSize(maxPageSize)
                .build();
    }

    @Bean
    public ReactionSettings reactionSettings(
            @Value("${emergency-alerts.reactions.dedup-ttl:PT2H}") Duration dedupTtl,
            @Value("${emergency-alerts.reactions.correlation-window:PT15M}") Duration correlationWindow,
            @Value("${emergency-alerts.reactions.expiry-warning-lead:PT15M}") Duration expiryWarningLead,
            @Value("${emergency-alerts.reactions.rate-spike-critical-threshold:100}") double rateSpikeCriticalThreshold,
            @Value("${emergency-alerts.reactions.duplicate-window-minutes:15}") int duplicateWindowMinutes) {
        return ReactionSettings.builder()
                .dedupTtl(dedupTtl)
                .correlationWindow(correlationWindow)
                .expiryWarningLead(expiryWarningLead)
                .rateSpikeCriticalThreshold(rateSpikeCriticalThreshold)
                .duplicateWindowMinutes(duplicateWindowMinutes)
                .build();
    }
}
