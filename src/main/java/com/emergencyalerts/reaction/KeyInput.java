package com.emergencyalerts.reaction;

import com.emergencyalerts.domain.model.ReactionSettings;
import java.time.Instant;
import lombok.Value;

/**
 * Entity id and window start a reaction's idempotency key is built from. Hourly keys ignore
 * the window start.
 */
@Value(staticConstructor = "of")
public class KeyInput {

    String entityId;
    Instant windowStart;

    public static KeyInput entity(String entityId) {
        return of(entityId, null);
    }

    /** Derives the key input from a payload. */
    @FunctionalInterface
    public interface Source<P> {

        KeyInput from(P payload, Instant now, ReactionSettings settings);
    }
}
