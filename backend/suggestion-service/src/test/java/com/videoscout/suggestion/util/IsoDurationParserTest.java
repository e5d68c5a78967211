package com.videoscout.suggestion.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class IsoDurationParserTest {

    @ParameterizedTest(name = "{0} -> {1}s")
    @DisplayName("ISO-8601 길이를 초 단위로 변환")
    @CsvSource({
            "PT1H2M3S, 3723",
            "PT10M, 600",
            "PT45S, 45",
            "P1DT2H, 93600",
            "P0D, 0"
    })
    void parses(String input, long expected) {
        assertThat(IsoDurationParser.toSeconds(input)).isEqualTo(expected);
    }

    @ParameterizedTest
    @DisplayName("잘못된 값은 0")
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "10 minutes", "PTXM", "-PT5M"})
    void malformedIsZero(String input) {
        assertThat(IsoDurationParser.toSeconds(input)).isZero();
    }
}
