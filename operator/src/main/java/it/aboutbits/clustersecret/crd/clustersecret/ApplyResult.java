package it.aboutbits.clustersecret.crd.clustersecret;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/// Outcome of one write against a managed Secret.
///
/// @param error {@code null} when the write succeeded
@NullMarked
public record ApplyResult(
        Action action,
        String namespace,
        String secretName,
        @Nullable String error
) {
    @Getter
    @RequiredArgsConstructor
    public enum Action {
        DELETE("remove secret from namespace"),
        UPDATE("update outdated secret in namespace"),
        CREATE("add secret to namespace");

        private final String description;
    }

    public static ApplyResult success(
            Action action,
            String namespace,
            String secretName
    ) {
        return new ApplyResult(action, namespace, secretName, null);
    }

    public static ApplyResult failure(
            Action action,
            String namespace,
            String secretName,
            String error
    ) {
        return new ApplyResult(action, namespace, secretName, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /// Failure line as listed in the Ready condition message, e.g. {@code - add secret to namespace (team-a): ...}.
    public String describeFailure() {
        return "- %s (%s): %s".formatted(action.getDescription(), namespace, error);
    }
}
