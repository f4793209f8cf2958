package it.aboutbits.clustersecret.core;

import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClient;
import it.aboutbits.clustersecret.crd.clustersecret.ClusterSecret;
import jakarta.inject.Singleton;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NullMarked;

import java.util.List;
import java.util.Optional;

@NullMarked
@Slf4j
@Singleton
@RequiredArgsConstructor
public class KubernetesObjectStore implements ObjectStore {
    private final KubernetesClient kubernetesClient;

    @Override
    public Optional<ClusterSecret> getClusterSecret(String name) {
        return Optional.ofNullable(
                kubernetesClient.resources(ClusterSecret.class)
                        .withName(name)
                        .get()
        );
    }

    @Override
    public ClusterSecret updateClusterSecret(ClusterSecret clusterSecret) {
        return kubernetesClient.resources(ClusterSecret.class)
                .resource(clusterSecret)
                .update();
    }

    @Override
    public ClusterSecret updateClusterSecretStatus(ClusterSecret clusterSecret) {
        return kubernetesClient.resources(ClusterSecret.class)
                .resource(clusterSecret)
                .updateStatus();
    }

    @Override
    public List<Namespace> listNamespaces() {
        return kubernetesClient.namespaces()
                .list()
                .getItems();
    }

    @Override
    public Optional<Secret> getSecret(
            String namespace,
            String name
    ) {
        return Optional.ofNullable(
                kubernetesClient.secrets()
                        .inNamespace(namespace)
                        .withName(name)
                        .get()
        );
    }

    @Override
    public Secret createSecret(Secret secret) {
        return kubernetesClient.secrets()
                .inNamespace(secret.getMetadata().getNamespace())
                .resource(secret)
                .create();
    }

    @Override
    public Secret updateSecret(Secret secret) {
        return kubernetesClient.secrets()
                .inNamespace(secret.getMetadata().getNamespace())
                .resource(secret)
                .update();
    }

    @Override
    public void deleteSecret(
            String namespace,
            String name
    ) {
        var deleted = kubernetesClient.secrets()
                .inNamespace(namespace)
                .withName(name)
                .withPropagationPolicy(DeletionPropagation.BACKGROUND)
                .delete();

        if (deleted.isEmpty()) {
            log.debug(
                    "Secret was already gone [secret={}/{}]",
                    namespace,
                    name
            );
        }
    }
}
