package it.aboutbits.clustersecret.crd.clustersecret;

import it.aboutbits.clustersecret.selector.InvalidRequirementException;
import it.aboutbits.clustersecret.selector.NamespaceSelector;
import it.aboutbits.clustersecret.selector.NamespaceSelectorRequirement;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks a {@link ClusterSecretSpec} before it is accepted.
 * <p>
 * Every selector requirement goes through the same operator validation the matching engine
 * runs, and every Secret reference must name its Secret, namespace and (for single keys) key.
 * All problems are reported, each as a message prefixed with its field path.
 * <p>
 * This is the entry point for an admission adapter: a validating webhook hands the incoming spec
 * to {@link #validate(ClusterSecretSpec)} and rejects the request when the result is not empty.
 */
@NullMarked
@Slf4j
@Singleton
public class ClusterSecretValidator {
    public List<String> validate(ClusterSecretSpec spec) {
        var errors = new ArrayList<String>();

        var terms = nullToEmpty(spec.getNamespaceSelectorTerms());
        for (var termIndex = 0; termIndex < terms.size(); termIndex++) {
            var term = terms.get(termIndex);
            var termPath = "%s[%d]".formatted(NamespaceSelector.TERMS_PATH, termIndex);

            validateRequirements(errors, term.getMatchFields(), "%s.matchFields".formatted(termPath));
            validateRequirements(errors, term.getMatchExpressions(), "%s.matchExpressions".formatted(termPath));
        }

        var dataFrom = nullToEmpty(spec.getDataFrom());
        for (var index = 0; index < dataFrom.size(); index++) {
            var path = "spec.dataFrom[%d]".formatted(index);
            var ref = dataFrom.get(index).getSecretRef();

            if (ref == null) {
                errors.add("%s: field .secretRef must be set".formatted(path));
                continue;
            }

            requireField(errors, ref.getName(), "%s.secretRef.name".formatted(path));
            requireField(errors, ref.getNamespace(), "%s.secretRef.namespace".formatted(path));
        }

        var dataValueFrom = spec.getDataValueFrom();
        //noinspection ConstantConditions
        if (dataValueFrom != null) {
            for (Map.Entry<String, DataValueFrom> entry : dataValueFrom.entrySet()) {
                var path = "spec.dataValueFrom.%s".formatted(entry.getKey());
                var ref = entry.getValue().getSecretKeyRef();

                if (ref == null) {
                    errors.add("%s: field .secretKeyRef must be set".formatted(path));
                    continue;
                }

                requireField(errors, ref.getName(), "%s.secretKeyRef.name".formatted(path));
                requireField(errors, ref.getNamespace(), "%s.secretKeyRef.namespace".formatted(path));
                requireField(errors, ref.getKey(), "%s.secretKeyRef.key".formatted(path));
            }
        }

        if (!errors.isEmpty()) {
            log.debug("ClusterSecret spec rejected [errors={}]", errors.size());
        }

        return List.copyOf(errors);
    }

    private static void validateRequirements(
            List<String> errors,
            @Nullable List<NamespaceSelectorRequirement> requirements,
            String listPath
    ) {
        var list = nullToEmpty(requirements);

        for (var index = 0; index < list.size(); index++) {
            try {
                NamespaceSelector.validateRequirement(
                        list.get(index),
                        "%s[%d]".formatted(listPath, index)
                );
            } catch (InvalidRequirementException e) {
                errors.add(e.getMessage());
            }
        }
    }

    private static void requireField(
            List<String> errors,
            @Nullable String value,
            String path
    ) {
        if (value == null || value.isBlank()) {
            errors.add("%s: Required value".formatted(path));
        }
    }

    private static <T> List<T> nullToEmpty(@Nullable List<T> list) {
        return list == null ? List.of() : list;
    }
}
