package it.aboutbits.clustersecret.crd.clustersecret;

import io.fabric8.kubernetes.api.model.Secret;
import it.aboutbits.clustersecret.selector.NamespacePartition;
import org.jspecify.annotations.NullMarked;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;

/// The changes needed to bring the managed Secrets of one ClusterSecret in line with the desired Secret.
///
/// @param unwanted          managed Secrets in namespaces that are no longer matched
/// @param outOfSync         managed Secrets in matched namespaces that differ from the desired Secret
/// @param missingNamespaces matched namespaces without a managed Secret
/// @param upToDate          number of managed Secrets that need no change
@NullMarked
public record ReconcilePlan(
        List<Secret> unwanted,
        List<OutOfSyncSecret> outOfSync,
        List<String> missingNamespaces,
        int upToDate
) {
    public record OutOfSyncSecret(
            Secret secret,
            String reason
    ) {
    }

    public boolean isEmpty() {
        return unwanted.isEmpty() && outOfSync.isEmpty() && missingNamespaces.isEmpty();
    }

    public static ReconcilePlan classify(
            List<Secret> ownedSecrets,
            NamespacePartition partition,
            Secret desired,
            String lastSyncAnnotation
    ) {
        var unwanted = new ArrayList<Secret>();
        var outOfSync = new ArrayList<OutOfSyncSecret>();
        var covered = new HashSet<String>();
        var upToDate = 0;

        var sorted = ownedSecrets.stream()
                .sorted(Comparator
                        .comparing((Secret secret) -> secret.getMetadata().getNamespace())
                        .thenComparing(secret -> secret.getMetadata().getName())
                )
                .toList();

        for (var secret : sorted) {
            var namespace = secret.getMetadata().getNamespace();

            if (!partition.isMatched(namespace)) {
                unwanted.add(secret);
                continue;
            }

            covered.add(namespace);

            var reason = SecretDiff.diff(secret, desired, lastSyncAnnotation);

            if (reason.isEmpty()) {
                upToDate++;
            } else {
                outOfSync.add(new OutOfSyncSecret(secret, reason));
            }
        }

        var missing = partition.matched().stream()
                .filter(namespace -> !covered.contains(namespace))
                .toList();

        return new ReconcilePlan(
                List.copyOf(unwanted),
                List.copyOf(outOfSync),
                missing,
                upToDate
        );
    }
}
