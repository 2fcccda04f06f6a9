package io.logscope.engine.query.sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RegexGuardTest {

    @ParameterizedTest
    @ValueSource(strings = {"((a+))+", "((ab)+)+", "(((a|b)))*", "(x(y(z+)))+", "(a{3,})*", "(a|b){1,}"})
    void detectsQuantifiersHiddenBehindInnerGroups(String pattern) {
        assertThat(RegexGuard.hasNestedQuantifier(pattern)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"^err.*", "(ab)+", "(a+)", "(a|b)", "(\\d{3})-(\\d{4})", "[(+*)]+", "\\(a+\\)+",
            "(a){2,5}", "(a+){2}", "timeout after \\d+ms"})
    void acceptsBoundedOrFlatPatterns(String pattern) {
        assertThat(RegexGuard.hasNestedQuantifier(pattern)).isFalse();
        assertThatCode(() -> RegexGuard.check(pattern)).doesNotThrowAnyException();
    }
}
