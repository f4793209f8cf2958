package it.aboutbits.clustersecret.selector;

import lombok.Getter;
import org.jspecify.annotations.NullMarked;

import java.util.List;
import java.util.stream.Collectors;

/// A namespace selector requirement that cannot be evaluated.
@NullMarked
@Getter
public class InvalidRequirementException extends IllegalArgumentException {
    private final String path;

    public InvalidRequirementException(
            String path,
            String detail
    ) {
        super("%s: %s".formatted(path, detail));
        this.path = path;
    }

    public InvalidRequirementException(
            String path,
            String detail,
            Throwable cause
    ) {
        super("%s: %s".formatted(path, detail), cause);
        this.path = path;
    }

    static InvalidRequirementException invalid(
            String path,
            String value,
            String detail
    ) {
        return new InvalidRequirementException(
                path,
                "Invalid value: \"%s\": %s".formatted(value, detail)
        );
    }

    static InvalidRequirementException required(
            String path,
            String detail
    ) {
        return new InvalidRequirementException(
                path,
                "Required value: %s".formatted(detail)
        );
    }

    static InvalidRequirementException tooMany(
            String path,
            int actual,
            int max
    ) {
        return new InvalidRequirementException(
                path,
                "Too many: %d: must have at most %d items".formatted(actual, max)
        );
    }

    static InvalidRequirementException notSupported(
            String path,
            String value,
            List<String> supported
    ) {
        return new InvalidRequirementException(
                path,
                "Unsupported value: \"%s\": supported values: %s".formatted(
                        value,
                        supported.stream()
                                .map("\"%s\""::formatted)
                                .collect(Collectors.joining(", "))
                )
        );
    }
}
