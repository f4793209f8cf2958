package it.aboutbits.clustersecret.crd.clustersecret;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import it.aboutbits.clustersecret.core.ClusterSecretMarkers;
import it.aboutbits.clustersecret.core.KubernetesUtil;
import it.aboutbits.clustersecret.core.ObjectStore;
import jakarta.inject.Singleton;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NullMarked;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * Writes the managed Secrets of a ClusterSecret according to a {@link ReconcilePlan}.
 * <p>
 * A failing write is recorded in the returned {@link ApplyReport} and never stops the remaining
 * writes. Deletes run first, then updates of out-of-sync Secrets, then creates.
 */
@NullMarked
@Slf4j
@Singleton
@RequiredArgsConstructor
public class ManagedSecretService {
    private final ObjectStore objectStore;
    private final ClusterSecretMarkers markers;
    private final Clock clock;

    public ApplyReport apply(
            ClusterSecret owner,
            ReconcilePlan plan,
            Secret desired
    ) {
        var results = new ArrayList<ApplyResult>();
        var ready = plan.upToDate();

        for (var secret : plan.unwanted()) {
            results.add(deleteUnwanted(secret));
        }

        for (var outOfSync : plan.outOfSync()) {
            var result = syncOutOfDate(owner, outOfSync, desired);
            results.add(result);

            if (result.isSuccess()) {
                ready++;
            }
        }

        for (var namespace : plan.missingNamespaces()) {
            var result = createMissing(owner, namespace, desired);
            results.add(result);

            if (result.isSuccess()) {
                ready++;
            }
        }

        return new ApplyReport(List.copyOf(results), ready);
    }

    ApplyResult deleteUnwanted(Secret secret) {
        var namespace = secret.getMetadata().getNamespace();
        var name = secret.getMetadata().getName();

        try {
            objectStore.deleteSecret(namespace, name);
        } catch (KubernetesClientException e) {
            log.error(
                    "Failed to delete Secret [secret={}/{}]",
                    namespace,
                    name,
                    e
            );

            return ApplyResult.failure(ApplyResult.Action.DELETE, namespace, name, e.getMessage());
        }

        log.info(
                "Deleted Secret [secret={}/{}]",
                namespace,
                name
        );

        return ApplyResult.success(ApplyResult.Action.DELETE, namespace, name);
    }

    ApplyResult syncOutOfDate(
            ClusterSecret owner,
            ReconcilePlan.OutOfSyncSecret outOfSync,
            Secret desired
    ) {
        var observed = outOfSync.secret();
        var namespace = observed.getMetadata().getNamespace();
        var observedName = observed.getMetadata().getName();
        var desiredName = desired.getMetadata().getName();

        log.debug(
                "Secret out of sync [secret={}/{}, cause={}]",
                namespace,
                observedName,
                outOfSync.reason()
        );

        if (!Objects.equals(observedName, desiredName)) {
            return rename(owner, observed, desired);
        }

        var updated = new SecretBuilder(observed)
                .editMetadata()
                .withLabels(new LinkedHashMap<>(desired.getMetadata().getLabels()))
                .withAnnotations(stampLastSync(desired))
                .endMetadata()
                .withType(desired.getType())
                .withData(new LinkedHashMap<>(desired.getData()))
                .build();

        try {
            objectStore.updateSecret(updated);
        } catch (KubernetesClientException e) {
            log.error(
                    "Failed to update Secret [secret={}/{}]",
                    namespace,
                    observedName,
                    e
            );

            return ApplyResult.failure(
                    ApplyResult.Action.UPDATE,
                    namespace,
                    observedName,
                    "updating secret: unable to update secret: %s".formatted(e.getMessage())
            );
        }

        log.info(
                "Updated Secret [secret={}/{}, cause={}]",
                namespace,
                observedName,
                outOfSync.reason()
        );

        return ApplyResult.success(ApplyResult.Action.UPDATE, namespace, observedName);
    }

    ApplyResult createMissing(
            ClusterSecret owner,
            String namespace,
            Secret desired
    ) {
        var name = desired.getMetadata().getName();

        try {
            replaceLegacySecret(namespace, name);
        } catch (KubernetesClientException e) {
            log.error(
                    "Failed to replace Secret created by a previous operator [secret={}/{}]",
                    namespace,
                    name,
                    e
            );

            return ApplyResult.failure(
                    ApplyResult.Action.CREATE,
                    namespace,
                    name,
                    "replace existing secret that was already managed by ClusterSecret: %s".formatted(e.getMessage())
            );
        }

        try {
            objectStore.createSecret(newManagedSecret(owner, namespace, desired));
        } catch (KubernetesClientException e) {
            log.error(
                    "Failed to create Secret [secret={}/{}]",
                    namespace,
                    name,
                    e
            );

            return ApplyResult.failure(
                    ApplyResult.Action.CREATE,
                    namespace,
                    name,
                    "unable to create secret: %s".formatted(e.getMessage())
            );
        }

        log.info(
                "Created Secret [secret={}/{}]",
                namespace,
                name
        );

        return ApplyResult.success(ApplyResult.Action.CREATE, namespace, name);
    }

    private ApplyResult rename(
            ClusterSecret owner,
            Secret observed,
            Secret desired
    ) {
        var namespace = observed.getMetadata().getNamespace();
        var oldName = observed.getMetadata().getName();
        var newName = desired.getMetadata().getName();

        try {
            objectStore.deleteSecret(namespace, oldName);
        } catch (KubernetesClientException e) {
            log.error(
                    "Failed to delete Secret before renaming it [secret={}/{}, newName={}]",
                    namespace,
                    oldName,
                    newName,
                    e
            );

            return ApplyResult.failure(
                    ApplyResult.Action.UPDATE,
                    namespace,
                    oldName,
                    "renaming secret: unable to delete old secret: %s".formatted(e.getMessage())
            );
        }

        log.debug(
                "Deleted old Secret to rename it [secret={}/{}, newName={}]",
                namespace,
                oldName,
                newName
        );

        try {
            objectStore.createSecret(newManagedSecret(owner, namespace, desired));
        } catch (KubernetesClientException e) {
            log.error(
                    "Failed to create renamed Secret [secret={}/{}]",
                    namespace,
                    newName,
                    e
            );

            return ApplyResult.failure(
                    ApplyResult.Action.UPDATE,
                    namespace,
                    newName,
                    "renaming secret: unable to create new secret: %s".formatted(e.getMessage())
            );
        }

        log.info(
                "Renamed Secret [secret={}/{}, newName={}]",
                namespace,
                oldName,
                newName
        );

        return ApplyResult.success(ApplyResult.Action.UPDATE, namespace, newName);
    }

    /// A Secret with the desired name that a previous operator created (marked by annotation, not by
    /// owner reference) is deleted so it can be recreated under this operator's control. A Secret
    /// controlled by any ClusterSecret is never taken over, even when it carries the marker.
    private void replaceLegacySecret(
            String namespace,
            String name
    ) {
        var existing = objectStore.getSecret(namespace, name);

        if (existing.isEmpty()) {
            return;
        }

        if (KubernetesUtil.clusterSecretController(existing.get()).isPresent()) {
            log.debug(
                    "Secret with the desired name is managed by another ClusterSecret [secret={}/{}]",
                    namespace,
                    name
            );
            return;
        }

        var annotations = existing.get().getMetadata().getAnnotations();

        //noinspection ConstantConditions
        if (annotations == null || !markers.createdByValue().equals(annotations.get(markers.createdByAnnotation()))) {
            return;
        }

        objectStore.deleteSecret(namespace, name);

        log.debug(
                "Deleted Secret that was probably created by an older ClusterSecret operator [secret={}/{}]",
                namespace,
                name
        );
    }

    private Secret newManagedSecret(
            ClusterSecret owner,
            String namespace,
            Secret desired
    ) {
        return new SecretBuilder(desired)
                .editMetadata()
                .withNamespace(namespace)
                .withAnnotations(stampLastSync(desired))
                .withOwnerReferences(KubernetesUtil.controllerReference(owner))
                .endMetadata()
                .build();
    }

    private LinkedHashMap<String, String> stampLastSync(Secret desired) {
        var annotations = new LinkedHashMap<>(desired.getMetadata().getAnnotations());
        annotations.put(
                markers.lastSyncAnnotation(),
                DateTimeFormatter.ISO_INSTANT.format(clock.instant())
        );

        return annotations;
    }
}
