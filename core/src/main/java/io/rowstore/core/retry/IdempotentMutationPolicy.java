// file: core/src/main/java/io/rowstore/core/retry/IdempotentMutationPolicy.java
package io.rowstore.core.retry;

import io.rowstore.core.ConditionalRowMutation;
import io.rowstore.core.Mutation;
import io.rowstore.core.SingleRowMutation;

/**
 * Classifies mutations as safe to resend (idempotent) or not.
 */
public interface IdempotentMutationPolicy {

    boolean isIdempotent(Mutation mutation);

    /**
     * Whether a read-check-write may be resent. Its outcome depends on the row
     * as the server last saw it, so a resent one may pick the other branch.
     */
    boolean isIdempotent(ConditionalRowMutation mutation);

    IdempotentMutationPolicy clone();

    /** An entry is idempotent only if every one of its mutations is. */
    default boolean isIdempotent(SingleRowMutation entry) {
        for (var m : entry.mutations()) {
            if (!isIdempotent(m)) {
                return false;
            }
        }
        return true;
    }
}
