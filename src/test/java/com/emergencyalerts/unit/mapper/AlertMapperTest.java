package com.emergencyalerts.unit.mapper;

import static org.assertj.core.api.Assertions.assertThat;

import com.emergencyalerts.api.dto.response.AlertResponse;
import com.emergencyalerts.domain.enums.AlertStatus;
import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.entity.AlertEntity;
import com.emergencyalerts.mapper.AlertMapper;
import com.emergencyalerts.support.AlertFixtures;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

class AlertMapperTest {

    private final AlertMapper alertMapper = Mappers.getMapper(AlertMapper.class);

    @Test
    @DisplayName("Polygon is stored as a JSON array of [lon, lat] pairs and read back intact")
    void polygonStoredAsJson() {
        Alert alert = AlertFixtures.pending("op-1");

        AlertEntity entity = alertMapper.toEntity(alert);

        assertThat(entity.getAreas()).hasSize(1);
        assertThat(entity.getAreas().get(0).getPolygon()).startsWith("[[-0.15,51.5],[-0.1,51.5]");
        assertThat(entity.getVersion()).isEqualTo(1L);

        Alert restored = alertMapper.toDomain(entity);
        assertThat(restored.getAreas().get(0).getPolygon()).isEqualTo(alert.getAreas().get(0).getPolygon());
        assertThat(restored.getAreas().get(0).getRegionCode()).isEqualTo("LDN");
        assertThat(restored.versionToken()).isEqualTo(alert.versionToken());
    }

    @Test
    @DisplayName("Response carries the effective status and the version token")
    void responseUsesEffectiveStatus() {
        Alert alert = AlertFixtures.pending("op-1");

        AlertResponse live = alertMapper.toResponse(alert, AlertFixtures.NOW.plus(Duration.ofMinutes(1)));
        AlertResponse lapsed = alertMapper.toResponse(alert, alert.getExpiresAt());

        assertThat(live.getStatus()).isEqualTo(AlertStatus.PENDING_APPROVAL);
        assertThat(lapsed.getStatus()).isEqualTo(AlertStatus.EXPIRED);
        assertThat(live.getVersionToken()).isEqualTo("1");
        assertThat(live.getAreas().get(0).getPolygon().get(0)).containsExactly(-0.15, 51.50);
    }
}
