package it.aboutbits.clustersecret.core;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.RequiredArgsConstructor;
import org.jspecify.annotations.NullMarked;

import java.util.Arrays;
import java.util.Optional;

/// Values of the `status` field of the `Ready` condition.
@NullMarked
@RequiredArgsConstructor
public enum ReadyStatus {
    UNKNOWN("Unknown"),
    TRUE("True"),
    FALSE("False");

    private final String status;

    @JsonValue
    public String toValue() {
        return status;
    }

    public static Optional<ReadyStatus> fromValue(String value) {
        return Arrays.stream(values())
                .filter(candidate -> candidate.status.equals(value))
                .findFirst();
    }
}
