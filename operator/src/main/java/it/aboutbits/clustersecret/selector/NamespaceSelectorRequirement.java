package it.aboutbits.clustersecret.selector;

import io.fabric8.generator.annotation.Required;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.jspecify.annotations.NullMarked;

import java.util.ArrayList;
import java.util.List;

/// A single predicate over one attribute set of a namespace.
@NullMarked
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class NamespaceSelectorRequirement {
    /// The label key (for matchExpressions) or field path (for matchFields) the requirement applies to.
    @Required
    private String key = "";

    /// One of In, NotIn, InRegex, NotInRegex, Exists, DoesNotExist, Gt, Lt.
    /// Kept as the raw token so that an unknown operator is reported as a validation error.
    @Required
    private String operator = "";

    /// In/NotIn: non-empty. InRegex/NotInRegex: non-empty list of regular expressions.
    /// Exists/DoesNotExist: empty. Gt/Lt: exactly one integer.
    @io.fabric8.generator.annotation.Nullable
    private List<String> values = new ArrayList<>();
}
