package it.aboutbits.clustersecret.core;

import org.jspecify.annotations.NullMarked;

/// Annotation, label and finalizer keys the operator stamps on or looks for.
///
/// @param createdByAnnotation   annotation marking a secret as created by a ClusterSecret operator (current or legacy)
/// @param createdByValue        value of {@code createdByAnnotation}
/// @param versionAnnotation     annotation carrying the operator version that produced the secret
/// @param version               operator version written to {@code versionAnnotation}
/// @param lastSyncAnnotation    annotation holding the time of the last write, excluded from diffs
/// @param managedByLabel        label naming the managing application
/// @param managedByValue        value of {@code managedByLabel}
/// @param legacyFinalizer       finalizer left on ClusterSecrets by the legacy kopf-based operator
/// @param legacyAnnotation      annotation left on ClusterSecrets by the legacy kopf-based operator
@NullMarked
public record ClusterSecretMarkers(
        String createdByAnnotation,
        String createdByValue,
        String versionAnnotation,
        String version,
        String lastSyncAnnotation,
        String managedByLabel,
        String managedByValue,
        String legacyFinalizer,
        String legacyAnnotation
) {
    public static final String CREATED_BY_ANNOTATION = "clustersecret.io/created-by";
    public static final String CREATED_BY_VALUE = "ClusterSecrets";
    public static final String VERSION_ANNOTATION = "clustersecret.io/version";
    public static final String LAST_SYNC_ANNOTATION = "clustersecret.io/last-sync";
    public static final String MANAGED_BY_LABEL = "app.kubernetes.io/managed-by";
    public static final String MANAGED_BY_VALUE = "ClusterSecrets";
    public static final String LEGACY_FINALIZER = "kopf.zalando.org/KopfFinalizerMarker";
    public static final String LEGACY_ANNOTATION = "kopf.zalando.org/last-handled-configuration";

    public static ClusterSecretMarkers defaults(String version) {
        return new ClusterSecretMarkers(
                CREATED_BY_ANNOTATION,
                CREATED_BY_VALUE,
                VERSION_ANNOTATION,
                version,
                LAST_SYNC_ANNOTATION,
                MANAGED_BY_LABEL,
                MANAGED_BY_VALUE,
                LEGACY_FINALIZER,
                LEGACY_ANNOTATION
        );
    }
}
