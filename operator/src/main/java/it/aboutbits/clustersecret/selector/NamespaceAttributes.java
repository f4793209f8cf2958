package it.aboutbits.clustersecret.selector;

import io.fabric8.kubernetes.api.model.Namespace;
import org.jspecify.annotations.NullMarked;

import java.util.Map;

/// The two read-only attribute sets a selector can look at.
@NullMarked
public record NamespaceAttributes(
        Map<String, String> fields,
        Map<String, String> labels
) {
    public static final String FIELD_NAME = "metadata.name";
    public static final String FIELD_PHASE = "status.phase";

    public static NamespaceAttributes of(Namespace namespace) {
        var metadata = namespace.getMetadata();
        var status = namespace.getStatus();

        //noinspection ConstantConditions
        var phase = status == null || status.getPhase() == null ? "" : status.getPhase();
        //noinspection ConstantConditions
        var labels = metadata.getLabels() == null ? Map.<String, String>of() : Map.copyOf(metadata.getLabels());

        return new NamespaceAttributes(
                Map.of(
                        FIELD_NAME, metadata.getName(),
                        FIELD_PHASE, phase
                ),
                labels
        );
    }
}
