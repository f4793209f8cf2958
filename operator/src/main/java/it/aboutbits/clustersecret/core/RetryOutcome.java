package it.aboutbits.clustersecret.core;

import io.fabric8.kubernetes.client.KubernetesClientException;
import org.jspecify.annotations.NullMarked;

/// Result of an {@link OptimisticConcurrencyRetry} run.
@NullMarked
public sealed interface RetryOutcome<T> {
    /// The write went through.
    record Success<T>(T value) implements RetryOutcome<T> {
    }

    /// The object disappeared while retrying; there is nothing left to write to.
    record Gone<T>() implements RetryOutcome<T> {
    }

    /// Every attempt lost the compare-and-swap on `metadata.resourceVersion`.
    record ConflictExhausted<T>(
            int attempts,
            KubernetesClientException lastConflict
    ) implements RetryOutcome<T> {
    }

    /// A failure that retrying cannot fix.
    record Failed<T>(RuntimeException cause) implements RetryOutcome<T> {
    }
}
