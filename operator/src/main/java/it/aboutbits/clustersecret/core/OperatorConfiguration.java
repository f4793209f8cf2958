package it.aboutbits.clustersecret.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jspecify.annotations.NullMarked;

import java.time.Clock;

@NullMarked
@ApplicationScoped
public class OperatorConfiguration {
    @ConfigProperty(name = "cluster-secret.version", defaultValue = "unknown")
    String version;

    @ConfigProperty(name = "cluster-secret.status-update-attempts", defaultValue = "3")
    int statusUpdateAttempts;

    @Produces
    @Singleton
    public ClusterSecretMarkers clusterSecretMarkers() {
        return ClusterSecretMarkers.defaults(
                version.isBlank() ? "unknown" : version
        );
    }

    @Produces
    @Singleton
    public OptimisticConcurrencyRetry statusUpdateRetry() {
        return new OptimisticConcurrencyRetry(statusUpdateAttempts);
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }
}
