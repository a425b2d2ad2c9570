// file: core/src/main/java/io/rowstore/core/retry/AlwaysRetryMutationPolicy.java
package io.rowstore.core.retry;

import io.rowstore.core.ConditionalRowMutation;
import io.rowstore.core.Mutation;

/**
 * Treats every mutation as idempotent, including server-stamped writes and
 * conditional mutations.
 * Only for applications that accept at-least-once application of every write.
 */
public final class AlwaysRetryMutationPolicy implements IdempotentMutationPolicy {

    @Override
    public boolean isIdempotent(Mutation mutation) {
        return true;
    }

    @Override
    public boolean isIdempotent(ConditionalRowMutation mutation) {
        return true;
    }

    @Override
    public AlwaysRetryMutationPolicy clone() {
        return new AlwaysRetryMutationPolicy();
    }
}
