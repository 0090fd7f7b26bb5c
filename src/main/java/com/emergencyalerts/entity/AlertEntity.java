package com.emergencyalerts.entity;

import com.emergencyalerts.domain.enums.AlertStatus;
import com.emergencyalerts.domain.enums.ChannelType;
import com.emergencyalerts.domain.enums.Severity;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the alerts table.
 *
 * <p>{@code version} is the compare-and-swap token used by every status write; it is not a JPA
 * {@code @Version} column because writes go through a conditional bulk update rather than
 * entity merges. Rows are never deleted.
 */
@Entity
@Table(
        name = "alerts",
        indexes = {
            @Index(name = "idx_alerts_status", columnList = "status"),
            @Index(name = "idx_alerts_created_at", columnList = "created_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 100)
    private String headline;

    @Column(nullable = false, length = 1395)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, columnDefinition = "varchar(20)")
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(name = "channel_type", nullable = false, columnDefinition = "varchar(20)")
    private ChannelType channelType;

    @Column(name = "language_code", length = 10)
    private String languageCode;

    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @JoinColumn(name = "alert_id", nullable = false)
    @OrderColumn(name = "area_order")
    @Builder.Default
    private List<AreaEntity> areas = new ArrayList<>();

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, columnDefinition = "varchar(30)")
    private AlertStatus status;

    @Column(name = "created_by", nullable = false, length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "approver_id", length = 100)
    private String approverId;

    @Column(name = "rejection_reason", length = 500)
    private String rejectionReason;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(name = "cancelled_by", length = 100)
    private String cancelledBy;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(nullable = false)
    private long version;
}
