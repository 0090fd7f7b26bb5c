package com.emergencyalerts.entity;

import com.emergencyalerts.domain.enums.PatternType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the correlation_events table.
 *
 * <p>The unique constraint on {@code idempotency_key} is what makes concurrent re-deliveries of
 * the same detection collapse to one row. Alert ids are a JSON array.
 */
@Entity
@Table(
        name = "correlation_events",
        uniqueConstraints = @UniqueConstraint(name = "uk_correlation_idempotency_key", columnNames = "idempotency_key"),
        indexes = @Index(name = "idx_correlation_detected_at", columnList = "detected_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CorrelationEventEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "pattern_type", nullable = false, columnDefinition = "varchar(50)")
    private PatternType patternType;

    @Column(name = "alert_ids", columnDefinition = "TEXT", nullable = false)
    private String alertIds;

    @Column(name = "region_code", length = 50)
    private String regionCode;

    @Column(name = "cluster_severity", length = 20)
    private String clusterSeverity;

    @Column(columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "idempotency_key", nullable = false, length = 255)
    private String idempotencyKey;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;
}
