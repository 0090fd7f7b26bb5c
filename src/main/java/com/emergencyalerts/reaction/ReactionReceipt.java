package com.emergencyalerts.reaction;

import lombok.Value;

/** Result of one reaction delivery. */
@Value
public class ReactionReceipt {

    ReactionKind kind;
    String idempotencyKey;

    /** True when the key had already been seen and nothing was persisted or broadcast. */
    boolean duplicate;

    public static ReactionReceipt processed(ReactionKind kind, String idempotencyKey) {
        return new ReactionReceipt(kind, idempotencyKey, false);
    }

    public static ReactionReceipt duplicate(ReactionKind kind, String idempotencyKey) {
        return new ReactionReceipt(kind, idempotencyKey, true);
    }
}
