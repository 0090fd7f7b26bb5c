package com.emergencyalerts.reaction;

import com.emergencyalerts.domain.model.ReactionSettings;
import java.time.Instant;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import lombok.Builder;
import lombok.Value;

/**
 * How one {@link ReactionKind} is processed. All members are pure functions; I/O is left to
 * {@link ReactionDispatcher}.
 *
 * @param <P> payload type
 */
@Value
@Builder
public class ReactionDefinition<P> {

    ReactionKind kind;
    Class<P> payloadType;

    /** Throws {@link com.emergencyalerts.exception.ValidationException} on a bad payload. */
    Consumer<P> validator;

    /** Null for event-keyed kinds. */
    KeyInput.Source<P> keyInput;

    /** Alert to look up for enrichment; null function or null result means no lookup. */
    Function<P, String> alertRef;

    BiFunction<P, ReactionContext, ReactionOutcome> handler;

    public String idempotencyKey(P payload, Instant now, String eventId, ReactionSettings settings) {
        String patternId = kind.getRoute();
        return switch (kind.getKeyStrategy()) {
            case EVENT -> IdempotencyKeys.event(patternId, eventId);
            case HOURLY -> IdempotencyKeys.hourly(
                    patternId, keyInput.from(payload, now, settings).getEntityId(), now);
            case WINDOW -> {
                KeyInput input = keyInput.from(payload, now, settings);
                yield IdempotencyKeys.window(patternId, input.getEntityId(), input.getWindowStart());
            }
        };
    }

    public String alertIdFor(P payload) {
        return alertRef == null ? null : alertRef.apply(payload);
    }
}
