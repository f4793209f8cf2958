package it.aboutbits.clustersecret.crd.clustersecret;

import org.jspecify.annotations.NullMarked;

import java.util.List;

/// @param results    one entry per attempted write, in the order they ran
/// @param readyCount managed Secrets that are up-to-date after applying the plan
@NullMarked
public record ApplyReport(
        List<ApplyResult> results,
        int readyCount
) {
    public List<ApplyResult> failures() {
        return results.stream()
                .filter(result -> !result.isSuccess())
                .toList();
    }

    public boolean hasFailures() {
        return results.stream().anyMatch(result -> !result.isSuccess());
    }
}
