package com.emergencyalerts.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the alert_areas table. Lifetime is owned by the parent {@link AlertEntity}.
 * The polygon ring is stored as a JSON array of [longitude, latitude] pairs.
 */
@Entity
@Table(name = "alert_areas")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AreaEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 255)
    private String description;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String polygon;

    @Column(name = "region_code", length = 50)
    private String regionCode;
}
