package com.emergencyalerts.reaction;

import com.emergencyalerts.api.websocket.DashboardMessage;
import com.emergencyalerts.domain.model.CorrelationEvent;
import java.util.Optional;

/**
 * What a reaction wants done: an optional correlation event to persist and the dashboard
 * message to broadcast once the reaction is known to be new.
 */
public final class ReactionOutcome {

    private final CorrelationEvent correlationEvent;
    private final DashboardMessage message;

    private ReactionOutcome(CorrelationEvent correlationEvent, DashboardMessage message) {
        this.correlationEvent = correlationEvent;
        this.message = message;
    }

    public static ReactionOutcome broadcast(DashboardMessage message) {
        return new ReactionOutcome(null, message);
    }

    public static ReactionOutcome persistAndBroadcast(CorrelationEvent correlationEvent, DashboardMessage message) {
        return new ReactionOutcome(correlationEvent, message);
    }

    public Optional<CorrelationEvent> getCorrelationEvent() {
        return Optional.ofNullable(correlationEvent);
    }

    public DashboardMessage getMessage() {
        return message;
    }
}
