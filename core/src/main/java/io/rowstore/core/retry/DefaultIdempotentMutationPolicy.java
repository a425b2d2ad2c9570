// file: core/src/main/java/io/rowstore/core/retry/DefaultIdempotentMutationPolicy.java
package io.rowstore.core.retry;

import io.rowstore.core.ConditionalRowMutation;
import io.rowstore.core.Mutation;

/**
 * SetCell is idempotent when the caller fixed its timestamp. A server-stamped
 * SetCell could create a second cell at another time, so it is not.
 * Deletes carry explicit ranges (0 meaning unbounded) and are always idempotent.
 * Conditional mutations never are: a first attempt that was applied may have
 * changed what the predicate sees.
 */
public final class DefaultIdempotentMutationPolicy implements IdempotentMutationPolicy {

    @Override
    public boolean isIdempotent(Mutation mutation) {
        return !mutation.hasServerAssignedTimestamp();
    }

    @Override
    public boolean isIdempotent(ConditionalRowMutation mutation) {
        return false;
    }

    @Override
    public DefaultIdempotentMutationPolicy clone() {
        return new DefaultIdempotentMutationPolicy();
    }
}
