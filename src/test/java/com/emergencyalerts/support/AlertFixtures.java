package com.emergencyalerts.support;

import com.emergencyalerts.domain.enums.ChannelType;
import com.emergencyalerts.domain.enums.Severity;
import com.emergencyalerts.domain.model.Alert;
import com.emergencyalerts.domain.model.AlertDraft;
import com.emergencyalerts.domain.model.AlertPolicy;
import com.emergencyalerts.domain.model.AreaDraft;
import com.emergencyalerts.domain.vo.GeoPoint;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Builders for valid alerts and drafts used across tests. */
public final class AlertFixtures {

    public static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private AlertFixtures() {}

    /** A closed square around central London. */
    public static List<GeoPoint> square() {
        return List.of(
                GeoPoint.of(-0.15, 51.50),
                GeoPoint.of(-0.10, 51.50),
                GeoPoint.of(-0.10, 51.53),
                GeoPoint.of(-0.15, 51.53),
                GeoPoint.of(-0.15, 51.50));
    }

    public static AreaDraft area(String regionCode) {
        return AreaDraft.builder()
                .description("Central London")
                .polygon(square())
                .regionCode(regionCode)
                .build();
    }

    public static AlertDraft.AlertDraftBuilder draft() {
        return AlertDraft.builder()
                .headline("Flood warning")
                .description("River levels rising near the embankment")
                .severity(Severity.SEVERE)
                .channelType(ChannelType.TEST)
                .expiresAt(NOW.plus(Duration.ofHours(2)))
                .areas(List.of(area("LDN")));
    }

    public static Alert pending(String creatorId) {
        return Alert.create(
                draft().submit(true).build(),
                creatorId,
                AlertPolicy.defaults(),
                NOW,
                new SequentialIdGenerator("a"));
    }

    public static Alert draftAlert(String creatorId) {
        return Alert.create(draft().build(), creatorId, AlertPolicy.defaults(), NOW, new SequentialIdGenerator("a"));
    }
}
