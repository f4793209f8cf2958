package it.aboutbits.clustersecret.selector;

import org.jspecify.annotations.NullMarked;

import java.util.List;

/// Namespace names split by whether a selector admits them, each list sorted.
@NullMarked
public record NamespacePartition(
        List<String> matched,
        List<String> avoided
) {
    public boolean isMatched(String namespace) {
        return matched.contains(namespace);
    }
}
