package it.aboutbits.clustersecret.selector;

import io.fabric8.kubernetes.api.model.Namespace;
import jakarta.inject.Singleton;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates namespace selector terms.
 * <p>
 * Terms are ORed and evaluation stops at the first matching term. Inside a term, the
 * {@code matchFields} requirements are checked against the namespace fields first, then the
 * {@code matchExpressions} requirements against the namespace labels, all ANDed. An empty list of
 * terms matches nothing, as does a missing list; a term without any requirement matches
 * everything.
 * <p>
 * The first requirement that cannot be evaluated aborts the evaluation with an
 * {@link InvalidRequirementException}.
 */
@NullMarked
@Singleton
public class NamespaceSelector {
    public static final String TERMS_PATH = "spec.namespaceSelectorTerm";

    public boolean matches(
            @Nullable List<NamespaceSelectorTerm> terms,
            Namespace namespace
    ) {
        if (terms == null) {
            return false;
        }

        var attributes = NamespaceAttributes.of(namespace);

        for (var termIndex = 0; termIndex < terms.size(); termIndex++) {
            var termPath = "%s[%d]".formatted(TERMS_PATH, termIndex);

            if (matchesTerm(terms.get(termIndex), attributes, termPath)) {
                return true;
            }
        }

        return false;
    }

    /// Split the given namespaces into sorted matched and avoided name lists.
    public NamespacePartition partition(
            @Nullable List<NamespaceSelectorTerm> terms,
            Collection<Namespace> namespaces
    ) {
        var matched = new ArrayList<String>();
        var avoided = new ArrayList<String>();

        for (var namespace : namespaces) {
            var name = namespace.getMetadata().getName();

            if (matches(terms, namespace)) {
                matched.add(name);
            } else {
                avoided.add(name);
            }
        }

        matched.sort(null);
        avoided.sort(null);

        return new NamespacePartition(
                List.copyOf(matched),
                List.copyOf(avoided)
        );
    }

    private boolean matchesTerm(
            NamespaceSelectorTerm term,
            NamespaceAttributes attributes,
            String termPath
    ) {
        var matchFields = nullToEmpty(term.getMatchFields());
        for (var index = 0; index < matchFields.size(); index++) {
            var requirementPath = "%s.matchFields[%d]".formatted(termPath, index);

            if (!matchesRequirement(matchFields.get(index), attributes.fields(), requirementPath)) {
                return false;
            }
        }

        var matchExpressions = nullToEmpty(term.getMatchExpressions());
        for (var index = 0; index < matchExpressions.size(); index++) {
            var requirementPath = "%s.matchExpressions[%d]".formatted(termPath, index);

            if (!matchesRequirement(matchExpressions.get(index), attributes.labels(), requirementPath)) {
                return false;
            }
        }

        return true;
    }

    private static boolean matchesRequirement(
            NamespaceSelectorRequirement requirement,
            Map<String, String> attributes,
            String requirementPath
    ) {
        var operator = NamespaceSelectorOperator.fromValue(
                requirement.getOperator(),
                "%s.operator".formatted(requirementPath)
        );

        return operator.matches(
                attributes,
                requirement.getKey(),
                nullToEmpty(requirement.getValues()),
                "%s.values".formatted(requirementPath)
        );
    }

    /// Run the operator validation of a single requirement without evaluating it.
    ///
    /// @throws InvalidRequirementException if the operator is unknown or the values do not fit it
    public static void validateRequirement(
            NamespaceSelectorRequirement requirement,
            String requirementPath
    ) {
        NamespaceSelectorOperator.fromValue(
                requirement.getOperator(),
                "%s.operator".formatted(requirementPath)
        ).validate(
                nullToEmpty(requirement.getValues()),
                "%s.values".formatted(requirementPath)
        );
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        //noinspection ConstantConditions
        return Objects.requireNonNullElse(list, List.of());
    }
}
