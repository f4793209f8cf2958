package it.aboutbits.clustersecret.crd.clustersecret;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.Secret;
import io.javaoperatorsdk.operator.processing.event.ResourceID;
import it.aboutbits.clustersecret.core.KubernetesUtil;
import it.aboutbits.clustersecret.selector.InvalidRequirementException;
import it.aboutbits.clustersecret.selector.NamespaceSelector;
import jakarta.inject.Singleton;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NullMarked;

import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/// Finds the ClusterSecrets to reconcile when a Namespace or Secret changes.
@NullMarked
@Slf4j
@Singleton
@RequiredArgsConstructor
public class ClusterSecretEventMapper {
    private final NamespaceSelector namespaceSelector;
    private final DesiredSecretService desiredSecretService;

    /// ClusterSecrets whose selector matches the namespace. A ClusterSecret with an invalid
    /// selector is skipped; its own reconciliation reports the problem.
    public Set<ResourceID> clusterSecretsSelecting(
            Namespace namespace,
            Collection<ClusterSecret> clusterSecrets
    ) {
        return clusterSecrets.stream()
                .filter(clusterSecret -> selects(clusterSecret, namespace))
                .map(ResourceID::fromResource)
                .collect(Collectors.toSet());
    }

    /// ClusterSecrets that control the Secret, would create a Secret with its name, or read data from it.
    /// The controller is taken from the owner reference, so it is found even before it reaches the cache.
    public Set<ResourceID> clusterSecretsConcerning(
            Secret secret,
            Collection<ClusterSecret> clusterSecrets
    ) {
        var result = clusterSecrets.stream()
                .filter(clusterSecret -> Objects.equals(desiredSecretService.desiredName(clusterSecret), secret.getMetadata().getName())
                        || references(clusterSecret, secret)
                )
                .map(ResourceID::fromResource)
                .collect(Collectors.toCollection(HashSet::new));

        KubernetesUtil.clusterSecretController(secret)
                .ifPresent(ref -> result.add(new ResourceID(ref.getName())));

        return result;
    }

    private boolean selects(
            ClusterSecret clusterSecret,
            Namespace namespace
    ) {
        try {
            return namespaceSelector.matches(
                    clusterSecret.getSpec().getNamespaceSelectorTerms(),
                    namespace
            );
        } catch (InvalidRequirementException e) {
            log.warn(
                    "Skipping ClusterSecret with an invalid namespace selector [resource={}, namespace={}, error={}]",
                    clusterSecret.getMetadata().getName(),
                    namespace.getMetadata().getName(),
                    e.getMessage()
            );

            return false;
        }
    }

    static boolean references(
            ClusterSecret clusterSecret,
            Secret secret
    ) {
        var namespace = secret.getMetadata().getNamespace();
        var name = secret.getMetadata().getName();
        var spec = clusterSecret.getSpec();

        //noinspection ConstantConditions
        var fromWholeSecret = spec.getDataFrom() != null && spec.getDataFrom().stream()
                .map(DataFrom::getSecretRef)
                .filter(Objects::nonNull)
                .anyMatch(ref -> Objects.equals(ref.getNamespace(), namespace)
                        && Objects.equals(ref.getName(), name)
                );

        //noinspection ConstantConditions
        var fromSingleKey = spec.getDataValueFrom() != null && spec.getDataValueFrom().values().stream()
                .map(DataValueFrom::getSecretKeyRef)
                .filter(Objects::nonNull)
                .anyMatch(ref -> Objects.equals(ref.getNamespace(), namespace)
                        && Objects.equals(ref.getName(), name)
                );

        return fromWholeSecret || fromSingleKey;
    }
}
