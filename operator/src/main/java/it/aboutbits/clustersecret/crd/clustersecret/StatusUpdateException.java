package it.aboutbits.clustersecret.crd.clustersecret;

import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.Getter;
import org.jspecify.annotations.NullMarked;

/// Every attempt to write the status of a ClusterSecret lost an optimistic concurrency check.
@NullMarked
@Getter
public class StatusUpdateException extends RuntimeException {
    private final String resourceName;
    private final int attempts;

    public StatusUpdateException(
            String resourceName,
            int attempts,
            KubernetesClientException lastConflict
    ) {
        super(
                "Unable to update ClusterSecret status [resource=%s, attempts=%d]".formatted(resourceName, attempts),
                lastConflict
        );
        this.resourceName = resourceName;
        this.attempts = attempts;
    }
}
