package it.aboutbits.clustersecret.core;

import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/// Bounded refresh-then-write loop for objects guarded by `metadata.resourceVersion`.
///
/// Each attempt first re-reads the object, so a write never reuses a copy that lost the previous
/// compare-and-swap. Only conflicts (409) are retried.
@NullMarked
@Slf4j
public class OptimisticConcurrencyRetry {
    @Getter
    private final int maxAttempts;

    public OptimisticConcurrencyRetry(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1 [maxAttempts=%d]".formatted(maxAttempts));
        }

        this.maxAttempts = maxAttempts;
    }

    public <R, T> RetryOutcome<T> run(
            Supplier<Optional<R>> refresh,
            Function<R, T> attempt
    ) {
        KubernetesClientException lastConflict = null;

        for (var attemptNumber = 1; attemptNumber <= maxAttempts; attemptNumber++) {
            if (lastConflict != null) {
                log.debug(
                        "Write lost an optimistic concurrency check, retrying [attempt={}, maxAttempts={}, error={}]",
                        attemptNumber,
                        maxAttempts,
                        lastConflict.getMessage()
                );
            }

            try {
                var current = refresh.get();

                if (current.isEmpty()) {
                    return new RetryOutcome.Gone<>();
                }

                return new RetryOutcome.Success<>(
                        attempt.apply(current.get())
                );
            } catch (KubernetesClientException e) {
                if (KubernetesUtil.isNotFound(e)) {
                    return new RetryOutcome.Gone<>();
                }

                if (!KubernetesUtil.isConflict(e)) {
                    return new RetryOutcome.Failed<>(e);
                }

                lastConflict = e;
            } catch (RuntimeException e) {
                return new RetryOutcome.Failed<>(e);
            }
        }

        return new RetryOutcome.ConflictExhausted<>(
                maxAttempts,
                requireConflict(lastConflict)
        );
    }

    private static KubernetesClientException requireConflict(@Nullable KubernetesClientException conflict) {
        if (conflict == null) {
            throw new IllegalStateException("Retries exhausted without a recorded conflict");
        }

        return conflict;
    }
}
