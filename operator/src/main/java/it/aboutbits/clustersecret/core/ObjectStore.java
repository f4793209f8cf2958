package it.aboutbits.clustersecret.core;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.Secret;
import it.aboutbits.clustersecret.crd.clustersecret.ClusterSecret;
import org.jspecify.annotations.NullMarked;

import java.util.List;
import java.util.Optional;

/// Access to the objects the operator reads and writes.
///
/// Writes use optimistic concurrency: an update carrying a stale `metadata.resourceVersion`
/// fails with a `KubernetesClientException` of code 409. Every other failure is reported as a
/// `KubernetesClientException` as well.
@NullMarked
public interface ObjectStore {
    Optional<ClusterSecret> getClusterSecret(String name);

    /// Persist metadata changes (finalizers, annotations) of a ClusterSecret.
    ClusterSecret updateClusterSecret(ClusterSecret clusterSecret);

    /// Persist the status subresource of a ClusterSecret.
    ClusterSecret updateClusterSecretStatus(ClusterSecret clusterSecret);

    List<Namespace> listNamespaces();

    Optional<Secret> getSecret(String namespace, String name);

    Secret createSecret(Secret secret);

    Secret updateSecret(Secret secret);

    /// Delete a secret. A secret that is already gone is not an error.
    void deleteSecret(String namespace, String name);
}
