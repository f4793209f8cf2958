package it.aboutbits.clustersecret.crd.clustersecret;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.javaoperatorsdk.operator.api.config.informer.InformerEventSourceConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.EventSourceContext;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import io.javaoperatorsdk.operator.processing.event.source.EventSource;
import io.javaoperatorsdk.operator.processing.event.source.SecondaryToPrimaryMapper;
import io.javaoperatorsdk.operator.processing.event.source.informer.InformerEventSource;
import it.aboutbits.clustersecret.core.ClusterSecretMarkers;
import it.aboutbits.clustersecret.core.KubernetesUtil;
import it.aboutbits.clustersecret.core.ObjectStore;
import it.aboutbits.clustersecret.core.OptimisticConcurrencyRetry;
import it.aboutbits.clustersecret.core.ReadyStatus;
import it.aboutbits.clustersecret.core.RetryOutcome;
import it.aboutbits.clustersecret.selector.NamespacePartition;
import it.aboutbits.clustersecret.selector.NamespaceSelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NullMarked;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;

@NullMarked
@Slf4j
@RequiredArgsConstructor
public class ClusterSecretReconciler implements Reconciler<ClusterSecret> {
    static final String REASON_RECONCILING = "Reconciling";
    static final String REASON_SYNTHESIS_FAILED = "SynthesisFailed";
    static final String REASON_RECONCILED = "Reconciled";
    static final String REASON_PARTIALLY_RECONCILED = "PartiallyReconciled";

    private final ObjectStore objectStore;
    private final NamespaceSelector namespaceSelector;
    private final DesiredSecretService desiredSecretService;
    private final ManagedSecretService managedSecretService;
    private final ClusterSecretEventMapper eventMapper;
    private final ClusterSecretMarkers markers;
    private final OptimisticConcurrencyRetry statusUpdateRetry;
    private final Clock clock;

    @Override
    public UpdateControl<ClusterSecret> reconcile(
            ClusterSecret resource,
            Context<ClusterSecret> context
    ) {
        reconcile(
                resource.getMetadata().getName(),
                OwnedSecretLookup.fromInformerCache(context)
        );

        // The cycle writes the status itself
        return UpdateControl.noUpdate();
    }

    /**
     * Watches Namespaces (creation and deletion) and Secrets in all namespaces, so that a
     * ClusterSecret converges when its matched namespaces change, when one of its managed Secrets
     * is modified or deleted, or when a Secret it reads data from changes.
     */
    @Override
    public List<EventSource<?, ClusterSecret>> prepareEventSources(EventSourceContext<ClusterSecret> context) {
        SecondaryToPrimaryMapper<Namespace> namespaceToClusterSecretMapper = (Namespace namespace) -> eventMapper.clusterSecretsSelecting(
                namespace,
                context.getPrimaryCache().list().toList()
        );

        var namespaceEventSourceConfig = InformerEventSourceConfiguration.from(Namespace.class, ClusterSecret.class)
                .withSecondaryToPrimaryMapper(namespaceToClusterSecretMapper)
                .withWatchAllNamespaces()
                // Label changes are picked up by the next reconciliation, only creation and deletion trigger one
                .withOnUpdateFilter((newNamespace, oldNamespace) -> false)
                .build();

        SecondaryToPrimaryMapper<Secret> secretToClusterSecretMapper = (Secret secret) -> eventMapper.clusterSecretsConcerning(
                secret,
                context.getPrimaryCache().list().toList()
        );

        var secretEventSourceConfig = InformerEventSourceConfiguration.from(Secret.class, ClusterSecret.class)
                .withSecondaryToPrimaryMapper(secretToClusterSecretMapper)
                .withWatchAllNamespaces()
                .build();

        return List.of(
                new InformerEventSource<>(namespaceEventSourceConfig, context),
                new InformerEventSource<>(secretEventSourceConfig, context)
        );
    }

    /// Run one reconciliation cycle for the ClusterSecret with the given name.
    ///
    /// @param ownedSecrets lookup of the Secrets the ClusterSecret currently controls
    /// @throws it.aboutbits.clustersecret.selector.InvalidRequirementException if a selector requirement is invalid
    /// @throws StatusUpdateException if the status could not be written
    void reconcile(
            String name,
            OwnedSecretLookup ownedSecrets
    ) {
        var fetched = objectStore.getClusterSecret(name);

        if (fetched.isEmpty()) {
            log.debug("ClusterSecret no longer exists [resource={}]", name);
            return;
        }

        var clusterSecret = fetched.get();

        log.info(
                "Reconciling ClusterSecret [resource={}, status.ready={}]",
                name,
                readyStatusOf(clusterSecret).orElse("<none>")
        );

        if (readyStatusOf(clusterSecret).isEmpty()) {
            var written = writeStatus(name, current -> initializeStatus(current).setReadyCondition(
                    ReadyStatus.UNKNOWN,
                    REASON_RECONCILING,
                    "Starting reconciliation",
                    generationOf(current),
                    clock.instant()
            ));

            if (!written) {
                return;
            }

            fetched = objectStore.getClusterSecret(name);
            if (fetched.isEmpty()) {
                return;
            }

            clusterSecret = fetched.get();
        }

        if (removeLegacyMarkers(clusterSecret)) {
            try {
                objectStore.updateClusterSecret(clusterSecret);
            } catch (KubernetesClientException e) {
                if (KubernetesUtil.isNotFound(e)) {
                    return;
                }

                throw e;
            }

            log.debug("Removed markers of the older kopf-based ClusterSecret operator [resource={}]", name);

            fetched = objectStore.getClusterSecret(name);
            if (fetched.isEmpty()) {
                return;
            }

            clusterSecret = fetched.get();
        }

        var namespaces = objectStore.listNamespaces();
        var owned = ownedSecrets.ownedBy(clusterSecret);

        var partition = namespaceSelector.partition(
                clusterSecret.getSpec().getNamespaceSelectorTerms(),
                namespaces
        );

        Secret desired;

        try {
            desired = desiredSecretService.synthesize(clusterSecret);
        } catch (SecretSynthesisException e) {
            log.error(
                    "Failed to construct Secret [resource={}, secret={}]",
                    name,
                    e.getSecretName(),
                    e
            );

            var message = "Failed to construct secret (%s) for custom resource (%s): %s".formatted(
                    e.getSecretName(),
                    name,
                    e.getMessage()
            );

            writeStatus(name, current -> {
                var status = initializeStatus(current);

                status.setCounts(status.getDataCount(), partition.matched(), 0)
                        .setReadyCondition(
                                ReadyStatus.FALSE,
                                REASON_SYNTHESIS_FAILED,
                                message,
                                generationOf(current),
                                clock.instant()
                        );
            });

            return;
        }

        var plan = ReconcilePlan.classify(
                owned,
                partition,
                desired,
                markers.lastSyncAnnotation()
        );

        log.debug(
                "Planned Secret changes [resource={}, unwanted={}, outOfSync={}, missing={}, upToDate={}]",
                name,
                plan.unwanted().size(),
                plan.outOfSync().size(),
                plan.missingNamespaces().size(),
                plan.upToDate()
        );

        var report = managedSecretService.apply(clusterSecret, plan, desired);

        writeResult(name, partition, desired, report);
    }

    private void writeResult(
            String name,
            NamespacePartition partition,
            Secret desired,
            ApplyReport report
    ) {
        var secretName = desired.getMetadata().getName();
        var dataCount = desired.getData() == null ? 0 : desired.getData().size();

        String reason;
        String message;

        if (report.hasFailures()) {
            reason = REASON_PARTIALLY_RECONCILED;
            message = "Failed to reconcile secret (%s) for custom resource (%s):\n%s".formatted(
                    secretName,
                    name,
                    report.failures().stream()
                            .map(ApplyResult::describeFailure)
                            .collect(Collectors.joining("\n"))
            );

            log.warn(
                    "ClusterSecret partially reconciled [resource={}, failures={}, ready={}/{}]",
                    name,
                    report.failures().size(),
                    report.readyCount(),
                    partition.matched().size()
            );
        } else {
            reason = REASON_RECONCILED;
            message = "Secrets for custom resource (%s) on %d namespaces created successfully".formatted(
                    name,
                    partition.matched().size()
            );

            log.info(
                    "ClusterSecret reconciled [resource={}, ready={}/{}]",
                    name,
                    report.readyCount(),
                    partition.matched().size()
            );
        }

        writeStatus(name, current -> initializeStatus(current)
                .setCounts(dataCount, partition.matched(), report.readyCount())
                .setReadyCondition(
                        ReadyStatus.TRUE,
                        reason,
                        message,
                        generationOf(current),
                        clock.instant()
                )
        );
    }

    /// Re-fetch the ClusterSecret, apply the mutation to it and write its status, retrying on conflicts.
    ///
    /// @return `false` if the ClusterSecret disappeared
    private boolean writeStatus(
            String name,
            Consumer<ClusterSecret> mutation
    ) {
        RetryOutcome<ClusterSecret> outcome = statusUpdateRetry.run(
                () -> objectStore.getClusterSecret(name),
                current -> {
                    mutation.accept(current);

                    return objectStore.updateClusterSecretStatus(current);
                }
        );

        if (outcome instanceof RetryOutcome.ConflictExhausted<ClusterSecret> exhausted) {
            log.error(
                    "Unable to update ClusterSecret status [resource={}, attempts={}]",
                    name,
                    exhausted.attempts(),
                    exhausted.lastConflict()
            );

            throw new StatusUpdateException(name, exhausted.attempts(), exhausted.lastConflict());
        }

        if (outcome instanceof RetryOutcome.Failed<ClusterSecret> failed) {
            throw failed.cause();
        }

        if (outcome instanceof RetryOutcome.Gone<ClusterSecret>) {
            log.debug("ClusterSecret disappeared while updating its status [resource={}]", name);

            return false;
        }

        return true;
    }

    /// Strip the finalizer and annotation the older kopf-based operator left behind.
    ///
    /// @return whether anything was removed
    boolean removeLegacyMarkers(ClusterSecret clusterSecret) {
        var metadata = clusterSecret.getMetadata();
        var changed = false;

        var finalizers = metadata.getFinalizers();
        //noinspection ConstantConditions
        if (finalizers != null && finalizers.contains(markers.legacyFinalizer())) {
            var remaining = new ArrayList<>(finalizers);
            remaining.remove(markers.legacyFinalizer());
            metadata.setFinalizers(remaining);
            changed = true;
        }

        var annotations = metadata.getAnnotations();
        //noinspection ConstantConditions
        if (annotations != null && annotations.containsKey(markers.legacyAnnotation())) {
            annotations.remove(markers.legacyAnnotation());
            changed = true;
        }

        return changed;
    }

    private static ClusterSecretStatus initializeStatus(ClusterSecret resource) {
        var status = resource.getStatus();

        //noinspection ConstantConditions
        if (status == null) {
            status = new ClusterSecretStatus();
            resource.setStatus(status);
        }

        return status;
    }

    private static Optional<String> readyStatusOf(ClusterSecret resource) {
        var status = resource.getStatus();

        //noinspection ConstantConditions
        if (status == null) {
            return Optional.empty();
        }

        return status.getReadyCondition().map(Condition::getStatus);
    }

    private static long generationOf(ClusterSecret resource) {
        var generation = resource.getMetadata().getGeneration();

        //noinspection ConstantConditions
        return generation == null ? 0L : generation;
    }
}
