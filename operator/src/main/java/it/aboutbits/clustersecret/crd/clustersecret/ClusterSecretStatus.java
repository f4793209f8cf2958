package it.aboutbits.clustersecret.crd.clustersecret;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;
import it.aboutbits.clustersecret.core.ReadyStatus;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;
import org.jspecify.annotations.NullMarked;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Status Object for the ClusterSecret Custom Resource.
 * <p>
 * This object captures how far the replication of the Secret got, as observed by the reconciler.
 */
@NullMarked
@Getter
@Setter
@Accessors(chain = true)
public class ClusterSecretStatus {
    public static final String CONDITION_READY = "Ready";

    /**
     * Holds a single {@value #CONDITION_READY} condition once the reconciler has seen the resource.
     */
    private List<Condition> conditions = new ArrayList<>();

    /**
     * Number of keys in the data of the desired Secret.
     */
    private int dataCount = 0;

    /**
     * Sorted names of the namespaces the Secret is replicated into.
     */
    private List<String> matchingNamespaces = new ArrayList<>();

    /**
     * Number of namespaces the Secret is replicated into.
     */
    private int matchingNamespacesCount = 0;

    /**
     * Number of managed Secrets that are up-to-date.
     */
    private int readySecretsCount = 0;

    /**
     * {@code readySecretsCount/matchingNamespacesCount}, e.g. {@code 3/3}.
     */
    private String readySecretsRatio = "0/0";

    @JsonIgnore
    public Optional<Condition> getReadyCondition() {
        //noinspection ConstantConditions
        if (conditions == null) {
            return Optional.empty();
        }

        return conditions.stream()
                .filter(condition -> CONDITION_READY.equals(condition.getType()))
                .findFirst();
    }

    /**
     * Set the {@value #CONDITION_READY} condition. The {@code lastTransitionTime} only moves when
     * the condition status changes.
     *
     * @return this status instance
     */
    public ClusterSecretStatus setReadyCondition(
            ReadyStatus status,
            String reason,
            String message,
            long observedGeneration,
            Instant now
    ) {
        var transitionTime = DateTimeFormatter.ISO_INSTANT.format(now.truncatedTo(ChronoUnit.SECONDS));
        var existing = getReadyCondition();

        if (existing.isPresent()) {
            var condition = existing.get();

            if (!Objects.equals(condition.getStatus(), status.toValue())) {
                condition.setStatus(status.toValue());
                condition.setLastTransitionTime(transitionTime);
            }

            condition.setReason(reason);
            condition.setMessage(message);
            condition.setObservedGeneration(observedGeneration);

            return this;
        }

        //noinspection ConstantConditions
        if (conditions == null) {
            conditions = new ArrayList<>();
        }

        conditions.add(new ConditionBuilder()
                .withType(CONDITION_READY)
                .withStatus(status.toValue())
                .withReason(reason)
                .withMessage(message)
                .withObservedGeneration(observedGeneration)
                .withLastTransitionTime(transitionTime)
                .build()
        );

        return this;
    }

    /**
     * Update the counters. The ratio is derived from the two counts.
     *
     * @return this status instance
     */
    public ClusterSecretStatus setCounts(
            int dataCount,
            List<String> matchingNamespaces,
            int readySecretsCount
    ) {
        this.dataCount = dataCount;
        this.matchingNamespaces = new ArrayList<>(matchingNamespaces);
        this.matchingNamespacesCount = matchingNamespaces.size();
        this.readySecretsCount = readySecretsCount;
        this.readySecretsRatio = "%d/%d".formatted(readySecretsCount, matchingNamespaces.size());

        return this;
    }
}
