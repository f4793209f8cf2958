package it.aboutbits.clustersecret.selector;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.jspecify.annotations.NullMarked;

import java.util.ArrayList;
import java.util.List;

/// One OR-branch of a namespace selector. All requirements of both lists must hold.
@NullMarked
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class NamespaceSelectorTerm {
    /// Requirements evaluated against the namespace's labels.
    @io.fabric8.generator.annotation.Nullable
    private List<NamespaceSelectorRequirement> matchExpressions = new ArrayList<>();

    /// Requirements evaluated against the namespace's fields (metadata.name, status.phase).
    @io.fabric8.generator.annotation.Nullable
    private List<NamespaceSelectorRequirement> matchFields = new ArrayList<>();
}
