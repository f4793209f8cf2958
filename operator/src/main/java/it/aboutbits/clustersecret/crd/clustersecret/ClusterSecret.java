package it.aboutbits.clustersecret.crd.clustersecret;

import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.ShortNames;
import io.fabric8.kubernetes.model.annotation.Version;
import org.jspecify.annotations.NullMarked;

/// A Secret to replicate into every namespace matched by its namespace selector.
///
/// Cluster-scoped: it does not implement `Namespaced`.
@NullMarked
@Version("v2")
@Group("clustersecret.io")
@ShortNames("csec")
public class ClusterSecret
        extends CustomResource<ClusterSecretSpec, ClusterSecretStatus> {
}
