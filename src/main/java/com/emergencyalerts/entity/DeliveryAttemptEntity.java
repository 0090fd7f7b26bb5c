package com.emergencyalerts.entity;

import com.emergencyalerts.domain.enums.AttemptOutcome;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the delivery_attempts table. Append-only: rows are inserted once and never
 * updated or deleted. {@code alertId} is a logical reference with no foreign key.
 */
@Entity
@Table(
        name = "delivery_attempts",
        indexes = {
            @Index(name = "idx_delivery_attempts_alert", columnList = "alert_id"),
            @Index(name = "idx_delivery_attempts_time", columnList = "attempted_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeliveryAttemptEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "alert_id", nullable = false, length = 36)
    private String alertId;

    @Column(name = "recipient_id", nullable = false, length = 36)
    private String recipientId;

    @Column(name = "attempt_number", nullable = false)
    private int attemptNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, columnDefinition = "varchar(10)")
    private AttemptOutcome outcome;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @Column(name = "provider_operation_id", length = 1000)
    private String providerOperationId;

    @Column(name = "attempted_at", nullable = false)
    private Instant attemptedAt;
}
