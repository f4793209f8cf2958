package it.aboutbits.clustersecret.selector;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.RequiredArgsConstructor;
import org.jspecify.annotations.NullMarked;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.function.BiPredicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// The operators a {@link NamespaceSelectorRequirement} may use.
///
/// Every operator validates its values and evaluates itself against one attribute set. Regex
/// operators search for the pattern anywhere in the value (no implicit anchoring), so `prod`
/// matches `production` as well as `not-prod-x`.
@NullMarked
@RequiredArgsConstructor
public enum NamespaceSelectorOperator {
    IN("In") {
        @Override
        public void validate(List<String> values, String valuesPath) {
            requireNonEmpty(values, valuesPath);
        }

        @Override
        boolean evaluate(Map<String, String> attributes, String key, List<String> values, String valuesPath) {
            return attributes.containsKey(key) && values.contains(attributes.get(key));
        }
    },
    NOT_IN("NotIn") {
        @Override
        public void validate(List<String> values, String valuesPath) {
            requireNonEmpty(values, valuesPath);
        }

        @Override
        boolean evaluate(Map<String, String> attributes, String key, List<String> values, String valuesPath) {
            return !attributes.containsKey(key) || !values.contains(attributes.get(key));
        }
    },
    IN_REGEX("InRegex") {
        @Override
        public void validate(List<String> values, String valuesPath) {
            requireNonEmpty(values, valuesPath);
            compileAll(values, valuesPath);
        }

        @Override
        boolean evaluate(Map<String, String> attributes, String key, List<String> values, String valuesPath) {
            return attributes.containsKey(key) && findsAny(values, attributes.get(key), valuesPath);
        }
    },
    NOT_IN_REGEX("NotInRegex") {
        @Override
        public void validate(List<String> values, String valuesPath) {
            requireNonEmpty(values, valuesPath);
            compileAll(values, valuesPath);
        }

        @Override
        boolean evaluate(Map<String, String> attributes, String key, List<String> values, String valuesPath) {
            return !attributes.containsKey(key) || !findsAny(values, attributes.get(key), valuesPath);
        }
    },
    EXISTS("Exists") {
        @Override
        public void validate(List<String> values, String valuesPath) {
            requireEmpty(values, valuesPath);
        }

        @Override
        boolean evaluate(Map<String, String> attributes, String key, List<String> values, String valuesPath) {
            return attributes.containsKey(key);
        }
    },
    DOES_NOT_EXIST("DoesNotExist") {
        @Override
        public void validate(List<String> values, String valuesPath) {
            requireEmpty(values, valuesPath);
        }

        @Override
        boolean evaluate(Map<String, String> attributes, String key, List<String> values, String valuesPath) {
            return !attributes.containsKey(key);
        }
    },
    GT("Gt") {
        @Override
        public void validate(List<String> values, String valuesPath) {
            parseSingleInteger(values, valuesPath);
        }

        @Override
        boolean evaluate(Map<String, String> attributes, String key, List<String> values, String valuesPath) {
            return compare(attributes, key, values, valuesPath, (actual, bound) -> actual > bound);
        }
    },
    LT("Lt") {
        @Override
        public void validate(List<String> values, String valuesPath) {
            parseSingleInteger(values, valuesPath);
        }

        @Override
        boolean evaluate(Map<String, String> attributes, String key, List<String> values, String valuesPath) {
            return compare(attributes, key, values, valuesPath, (actual, bound) -> actual < bound);
        }
    };

    private final String operator;

    @JsonValue
    public String toValue() {
        return operator;
    }

    /// Check the value list against the arity and syntax this operator needs.
    ///
    /// @param valuesPath field path of the values list, used in error messages
    /// @throws InvalidRequirementException if the values are not acceptable
    public abstract void validate(List<String> values, String valuesPath);

    /// Evaluate an already validated requirement.
    abstract boolean evaluate(
            Map<String, String> attributes,
            String key,
            List<String> values,
            String valuesPath
    );

    /// Validate, then evaluate.
    ///
    /// @throws InvalidRequirementException if the values are not acceptable for this operator
    public boolean matches(
            Map<String, String> attributes,
            String key,
            List<String> values,
            String valuesPath
    ) {
        validate(values, valuesPath);

        return evaluate(attributes, key, values, valuesPath);
    }

    /// @throws InvalidRequirementException if the token names no operator
    public static NamespaceSelectorOperator fromValue(
            String value,
            String operatorPath
    ) {
        return Arrays.stream(values())
                .filter(candidate -> candidate.operator.equals(value))
                .findFirst()
                .orElseThrow(() -> InvalidRequirementException.notSupported(
                        operatorPath,
                        value,
                        supportedValues()
                ));
    }

    public static List<String> supportedValues() {
        return Arrays.stream(values())
                .map(NamespaceSelectorOperator::toValue)
                .toList();
    }

    private static void requireNonEmpty(List<String> values, String valuesPath) {
        if (values.isEmpty()) {
            throw InvalidRequirementException.required(valuesPath, "must have one element");
        }
    }

    private static void requireEmpty(List<String> values, String valuesPath) {
        if (!values.isEmpty()) {
            throw InvalidRequirementException.tooMany(valuesPath, values.size(), 0);
        }
    }

    private static long parseSingleInteger(List<String> values, String valuesPath) {
        requireNonEmpty(values, valuesPath);

        if (values.size() > 1) {
            throw InvalidRequirementException.tooMany(valuesPath, values.size(), 1);
        }

        var value = values.get(0);

        return parseInteger(value).orElseThrow(() -> InvalidRequirementException.invalid(
                "%s[0]".formatted(valuesPath),
                value,
                "must be a base-10 integer"
        ));
    }

    private static OptionalLong parseInteger(String value) {
        try {
            return OptionalLong.of(Long.parseLong(value, 10));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    private static boolean compare(
            Map<String, String> attributes,
            String key,
            List<String> values,
            String valuesPath,
            BiPredicate<Long, Long> comparison
    ) {
        if (!attributes.containsKey(key)) {
            return false;
        }

        var bound = parseSingleInteger(values, valuesPath);

        // A non-numeric attribute never satisfies a numeric comparison
        var actual = parseInteger(attributes.get(key));

        return actual.isPresent() && comparison.test(actual.getAsLong(), bound);
    }

    private static void compileAll(List<String> patterns, String valuesPath) {
        for (var index = 0; index < patterns.size(); index++) {
            compile(patterns.get(index), "%s[%d]".formatted(valuesPath, index));
        }
    }

    private static boolean findsAny(
            List<String> patterns,
            String value,
            String valuesPath
    ) {
        for (var index = 0; index < patterns.size(); index++) {
            var pattern = compile(patterns.get(index), "%s[%d]".formatted(valuesPath, index));

            if (pattern.matcher(value).find()) {
                return true;
            }
        }

        return false;
    }

    private static Pattern compile(String pattern, String path) {
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new InvalidRequirementException(
                    path,
                    "Invalid value: \"%s\": %s".formatted(pattern, e.getDescription()),
                    e
            );
        }
    }
}
