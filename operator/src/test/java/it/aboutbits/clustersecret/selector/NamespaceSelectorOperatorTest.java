package it.aboutbits.clustersecret.selector;

import org.jspecify.annotations.NullMarked;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

@NullMarked
class NamespaceSelectorOperatorTest {
    private static final String PATH = "spec.namespaceSelectorTerm[0].matchExpressions[0].values";

    private static final Map<String, String> LABELS = Map.of(
            "env", "production",
            "tier", "3",
            "team", "payments"
    );

    @Nested
    class FromValue {
        @ParameterizedTest
        @ValueSource(strings = {"In", "NotIn", "InRegex", "NotInRegex", "Exists", "DoesNotExist", "Gt", "Lt"})
        @DisplayName("when the token is known, should resolve the operator")
        void whenKnownToken_shouldResolve(String token) {
            // when
            var operator = NamespaceSelectorOperator.fromValue(token, "op");

            // then
            assertThat(operator.toValue()).isEqualTo(token);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "in", "Matches", "NOTIN"})
        @DisplayName("when the token is unknown, should reject it with the operator path")
        void whenUnknownToken_shouldReject(String token) {
            // when / then
            assertThatExceptionOfType(InvalidRequirementException.class)
                    .isThrownBy(() -> NamespaceSelectorOperator.fromValue(token, "spec.namespaceSelectorTerm[0].matchFields[1].operator"))
                    .satisfies(e -> {
                        assertThat(e.getPath()).isEqualTo("spec.namespaceSelectorTerm[0].matchFields[1].operator");
                        assertThat(e.getMessage()).contains("Unsupported value: \"%s\"".formatted(token));
                        assertThat(e.getMessage()).contains("\"InRegex\"");
                    });
        }
    }

    @Nested
    class In {
        @Test
        @DisplayName("when the value is listed, should match")
        void whenListed_shouldMatch() {
            assertThat(NamespaceSelectorOperator.IN.matches(LABELS, "env", List.of("staging", "production"), PATH)).isTrue();
        }

        @Test
        @DisplayName("when the value is not listed, should not match")
        void whenNotListed_shouldNotMatch() {
            assertThat(NamespaceSelectorOperator.IN.matches(LABELS, "env", List.of("staging"), PATH)).isFalse();
        }

        @Test
        @DisplayName("when the key is absent, should not match")
        void whenKeyAbsent_shouldNotMatch() {
            assertThat(NamespaceSelectorOperator.IN.matches(LABELS, "region", List.of("eu"), PATH)).isFalse();
        }

        @Test
        @DisplayName("when values are empty, should fail validation")
        void whenValuesEmpty_shouldFail() {
            assertThatExceptionOfType(InvalidRequirementException.class)
                    .isThrownBy(() -> NamespaceSelectorOperator.IN.matches(LABELS, "env", List.of(), PATH))
                    .satisfies(e -> {
                        assertThat(e.getPath()).isEqualTo(PATH);
                        assertThat(e.getMessage()).isEqualTo(PATH + ": Required value: must have one element");
                    });
        }
    }

    @Nested
    class NotIn {
        @Test
        @DisplayName("when the key is absent, should match")
        void whenKeyAbsent_shouldMatch() {
            assertThat(NamespaceSelectorOperator.NOT_IN.matches(LABELS, "region", List.of("eu"), PATH)).isTrue();
        }

        @Test
        @DisplayName("when the value is listed, should not match")
        void whenListed_shouldNotMatch() {
            assertThat(NamespaceSelectorOperator.NOT_IN.matches(LABELS, "env", List.of("production"), PATH)).isFalse();
        }

        @Test
        @DisplayName("when the value is not listed, should match")
        void whenNotListed_shouldMatch() {
            assertThat(NamespaceSelectorOperator.NOT_IN.matches(LABELS, "env", List.of("staging", "dev"), PATH)).isTrue();
        }
    }

    @Nested
    class InRegex {
        @Test
        @DisplayName("when a pattern is found anywhere in the value, should match")
        void whenPatternFoundUnanchored_shouldMatch() {
            assertThat(NamespaceSelectorOperator.IN_REGEX.matches(LABELS, "env", List.of("duct"), PATH)).isTrue();
        }

        @Test
        @DisplayName("when an anchored pattern does not cover the value, should not match")
        void whenAnchoredPatternDiffers_shouldNotMatch() {
            assertThat(NamespaceSelectorOperator.IN_REGEX.matches(LABELS, "env", List.of("^prod$"), PATH)).isFalse();
        }

        @Test
        @DisplayName("when the key is absent, should not match")
        void whenKeyAbsent_shouldNotMatch() {
            assertThat(NamespaceSelectorOperator.IN_REGEX.matches(LABELS, "region", List.of(".*"), PATH)).isFalse();
        }

        @Test
        @DisplayName("when a pattern does not compile, should fail with the element path")
        void whenPatternInvalid_shouldFail() {
            assertThatExceptionOfType(InvalidRequirementException.class)
                    .isThrownBy(() -> NamespaceSelectorOperator.IN_REGEX.matches(LABELS, "env", List.of("prod", "(unclosed"), PATH))
                    .satisfies(e -> assertThat(e.getPath()).isEqualTo(PATH + "[1]"));
        }

        @Test
        @DisplayName("when a later pattern is invalid but the key is absent, should still fail")
        void whenPatternInvalidAndKeyAbsent_shouldFail() {
            assertThatExceptionOfType(InvalidRequirementException.class)
                    .isThrownBy(() -> NamespaceSelectorOperator.IN_REGEX.matches(LABELS, "region", List.of("["), PATH));
        }
    }

    @Nested
    class NotInRegex {
        @Test
        @DisplayName("when the key is absent, should match")
        void whenKeyAbsent_shouldMatch() {
            assertThat(NamespaceSelectorOperator.NOT_IN_REGEX.matches(LABELS, "region", List.of("eu"), PATH)).isTrue();
        }

        @Test
        @DisplayName("when a pattern is found, should not match")
        void whenPatternFound_shouldNotMatch() {
            assertThat(NamespaceSelectorOperator.NOT_IN_REGEX.matches(LABELS, "team", List.of("^pay"), PATH)).isFalse();
        }

        @Test
        @DisplayName("when no pattern is found, should match")
        void whenNoPatternFound_shouldMatch() {
            assertThat(NamespaceSelectorOperator.NOT_IN_REGEX.matches(LABELS, "team", List.of("^ops", "search"), PATH)).isTrue();
        }
    }

    @Nested
    class ExistsAndDoesNotExist {
        @Test
        @DisplayName("when the key is present, Exists should match and DoesNotExist should not")
        void whenKeyPresent() {
            assertThat(NamespaceSelectorOperator.EXISTS.matches(LABELS, "env", List.of(), PATH)).isTrue();
            assertThat(NamespaceSelectorOperator.DOES_NOT_EXIST.matches(LABELS, "env", List.of(), PATH)).isFalse();
        }

        @Test
        @DisplayName("when the key is absent, DoesNotExist should match and Exists should not")
        void whenKeyAbsent() {
            assertThat(NamespaceSelectorOperator.EXISTS.matches(LABELS, "region", List.of(), PATH)).isFalse();
            assertThat(NamespaceSelectorOperator.DOES_NOT_EXIST.matches(LABELS, "region", List.of(), PATH)).isTrue();
        }

        @Test
        @DisplayName("when values are given, should fail validation")
        void whenValuesGiven_shouldFail() {
            assertThatExceptionOfType(InvalidRequirementException.class)
                    .isThrownBy(() -> NamespaceSelectorOperator.EXISTS.matches(LABELS, "env", List.of("x"), PATH))
                    .withMessage(PATH + ": Too many: 1: must have at most 0 items");
        }
    }

    @Nested
    class GtAndLt {
        @ParameterizedTest
        @CsvSource({
                "2, true, false",
                "3, false, false",
                "4, false, true",
                "-10, true, false"
        })
        @DisplayName("when comparing a numeric label, should compare as integers")
        void whenNumericLabel_shouldCompare(String bound, boolean greater, boolean less) {
            assertThat(NamespaceSelectorOperator.GT.matches(LABELS, "tier", List.of(bound), PATH)).isEqualTo(greater);
            assertThat(NamespaceSelectorOperator.LT.matches(LABELS, "tier", List.of(bound), PATH)).isEqualTo(less);
        }

        @Test
        @DisplayName("when the label is not numeric, should not match")
        void whenLabelNotNumeric_shouldNotMatch() {
            assertThat(NamespaceSelectorOperator.GT.matches(LABELS, "env", List.of("1"), PATH)).isFalse();
            assertThat(NamespaceSelectorOperator.LT.matches(LABELS, "env", List.of("1"), PATH)).isFalse();
        }

        @Test
        @DisplayName("when the key is absent, should not match")
        void whenKeyAbsent_shouldNotMatch() {
            assertThat(NamespaceSelectorOperator.GT.matches(LABELS, "region", List.of("1"), PATH)).isFalse();
        }

        @Test
        @DisplayName("when the value is not an integer, should fail with the element path")
        void whenValueNotInteger_shouldFail() {
            assertThatExceptionOfType(InvalidRequirementException.class)
                    .isThrownBy(() -> NamespaceSelectorOperator.GT.matches(LABELS, "tier", List.of("three"), PATH))
                    .satisfies(e -> {
                        assertThat(e.getPath()).isEqualTo(PATH + "[0]");
                        assertThat(e.getMessage()).contains("Invalid value: \"three\": must be a base-10 integer");
                    });
        }

        @Test
        @DisplayName("when more than one value is given, should fail validation")
        void whenMoreThanOneValue_shouldFail() {
            assertThatExceptionOfType(InvalidRequirementException.class)
                    .isThrownBy(() -> NamespaceSelectorOperator.LT.matches(LABELS, "tier", List.of("1", "2"), PATH))
                    .withMessage(PATH + ": Too many: 2: must have at most 1 items");
        }

        @Test
        @DisplayName("when no value is given, should fail validation")
        void whenNoValue_shouldFail() {
            assertThatExceptionOfType(InvalidRequirementException.class)
                    .isThrownBy(() -> NamespaceSelectorOperator.LT.matches(LABELS, "tier", List.of(), PATH))
                    .withMessage(PATH + ": Required value: must have one element");
        }
    }
}
