package it.aboutbits.clustersecret.crd.clustersecret;

import io.fabric8.kubernetes.api.model.Secret;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import it.aboutbits.clustersecret.core.KubernetesUtil;
import org.jspecify.annotations.NullMarked;

import java.util.List;

/// Finds the Secrets, in any namespace, whose controller owner reference points at a ClusterSecret.
@NullMarked
@FunctionalInterface
public interface OwnedSecretLookup {
    List<Secret> ownedBy(ClusterSecret owner);

    /// Reads the Secret informer cache through the secondary-resource index the framework keeps
    /// for the mapper registered in {@link ClusterSecretReconciler#prepareEventSources}. That index
    /// also holds Secrets a ClusterSecret only reads from or shares a name with, so it is narrowed
    /// to the controlled ones.
    static OwnedSecretLookup fromInformerCache(Context<ClusterSecret> context) {
        return owner -> context.getSecondaryResourcesAsStream(Secret.class)
                .filter(secret -> KubernetesUtil.isControlledBy(secret, owner))
                .toList();
    }
}
