// file: client/src/main/java/io/rowstore/client/ClientOptions.java
package io.rowstore.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.rowstore.client.dto.JsonBackoffPolicy;
import io.rowstore.client.dto.JsonClientOptions;
import io.rowstore.client.dto.JsonRetryPolicy;
import io.rowstore.core.retry.AlwaysRetryMutationPolicy;
import io.rowstore.core.retry.BackoffPolicy;
import io.rowstore.core.retry.DefaultIdempotentMutationPolicy;
import io.rowstore.core.retry.ExponentialBackoffPolicy;
import io.rowstore.core.retry.IdempotentMutationPolicy;
import io.rowstore.core.retry.LimitedErrorCountRetryPolicy;
import io.rowstore.core.retry.LimitedTimeRetryPolicy;
import io.rowstore.core.retry.RetryPolicy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Retry and timeout settings shared by the operations of a {@link Table}.
 * <p>
 * The policies are prototypes: each operation works on its own {@code clone()}.
 *
 * @param retryPolicy      decides whether a failed attempt is retried
 * @param backoffPolicy    delay before each retry
 * @param idempotentPolicy which mutations are safe to send twice
 * @param attemptTimeout   deadline of a single RPC attempt
 */
public record ClientOptions(
        RetryPolicy retryPolicy,
        BackoffPolicy backoffPolicy,
        IdempotentMutationPolicy idempotentPolicy,
        Duration attemptTimeout
) {

    public static final Duration DEFAULT_RETRY_DURATION = Duration.ofMinutes(10);
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(10);
    public static final Duration DEFAULT_MAXIMUM_BACKOFF = Duration.ofMinutes(5);
    public static final Duration DEFAULT_ATTEMPT_TIMEOUT = Duration.ofSeconds(20);

    public ClientOptions {
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        Objects.requireNonNull(backoffPolicy, "backoffPolicy");
        Objects.requireNonNull(idempotentPolicy, "idempotentPolicy");
        Objects.requireNonNull(attemptTimeout, "attemptTimeout");
        if (attemptTimeout.isNegative() || attemptTimeout.isZero()) {
            throw new IllegalArgumentException("attemptTimeout must be > 0");
        }
    }

    public static ClientOptions defaults() {
        return new ClientOptions(
                new LimitedTimeRetryPolicy(DEFAULT_RETRY_DURATION),
                new ExponentialBackoffPolicy(DEFAULT_INITIAL_BACKOFF, DEFAULT_MAXIMUM_BACKOFF),
                new DefaultIdempotentMutationPolicy(),
                DEFAULT_ATTEMPT_TIMEOUT
        );
    }

    public ClientOptions withRetryPolicy(RetryPolicy p) {
        return new ClientOptions(p, backoffPolicy, idempotentPolicy, attemptTimeout);
    }

    public ClientOptions withBackoffPolicy(BackoffPolicy p) {
        return new ClientOptions(retryPolicy, p, idempotentPolicy, attemptTimeout);
    }

    public ClientOptions withIdempotentPolicy(IdempotentMutationPolicy p) {
        return new ClientOptions(retryPolicy, backoffPolicy, p, attemptTimeout);
    }

    public ClientOptions withAttemptTimeout(Duration d) {
        return new ClientOptions(retryPolicy, backoffPolicy, idempotentPolicy, d);
    }

    /**
     * Load options from JSON. Missing sections keep their defaults.
     *
     * <pre>
     * {
     *   "retry":   {"kind": "errorCount", "maxFailures": 5},
     *   "backoff": {"initialMillis": 10, "maximumMillis": 1000},
     *   "idempotency": "default",
     *   "attemptTimeoutMillis": 5000
     * }
     * </pre>
     *
     * @throws UncheckedIOException     when the file cannot be read or parsed
     * @throws IllegalArgumentException when a value is out of range
     */
    public static ClientOptions fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        JsonClientOptions cfg;
        try {
            cfg = mapper.readValue(path.toFile(), JsonClientOptions.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load ClientOptions from " + path, e);
        }

        ClientOptions out = defaults();
        if (cfg.retry != null) {
            out = out.withRetryPolicy(toRetryPolicy(cfg.retry));
        }
        if (cfg.backoff != null) {
            out = out.withBackoffPolicy(toBackoffPolicy(cfg.backoff));
        }
        if (cfg.idempotency != null) {
            out = out.withIdempotentPolicy(toIdempotentPolicy(cfg.idempotency));
        }
        if (cfg.attemptTimeoutMillis != null) {
            out = out.withAttemptTimeout(Duration.ofMillis(cfg.attemptTimeoutMillis));
        }
        return out;
    }

    private static RetryPolicy toRetryPolicy(JsonRetryPolicy r) {
        String kind = r.kind == null ? "time" : r.kind;
        return switch (kind) {
            case "errorCount" -> {
                if (r.maxFailures == null) {
                    throw new IllegalArgumentException("retry.maxFailures is required for kind errorCount");
                }
                yield new LimitedErrorCountRetryPolicy(r.maxFailures);
            }
            case "time" -> new LimitedTimeRetryPolicy(r.maxDurationMillis == null
                    ? DEFAULT_RETRY_DURATION
                    : Duration.ofMillis(r.maxDurationMillis));
            default -> throw new IllegalArgumentException("unknown retry kind: " + kind);
        };
    }

    private static BackoffPolicy toBackoffPolicy(JsonBackoffPolicy b) {
        return new ExponentialBackoffPolicy(Duration.ofMillis(b.initialMillis), Duration.ofMillis(b.maximumMillis));
    }

    private static IdempotentMutationPolicy toIdempotentPolicy(String name) {
        return switch (name) {
            case "default" -> new DefaultIdempotentMutationPolicy();
            case "always" -> new AlwaysRetryMutationPolicy();
            default -> throw new IllegalArgumentException("unknown idempotency policy: " + name);
        };
    }
}
