package com.keystone.container.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("Environment")
class EnvironmentTest {

    @ParameterizedTest(name = "\"{0}\" is {1}")
    @CsvSource({
            "dev, DEVELOPMENT",
            "Development, DEVELOPMENT",
            "stage, STAGING",
            "STAGING, STAGING",
            "prod, PRODUCTION",
            "' production ', PRODUCTION",
            "test, TESTING",
            "testing, TESTING"
    })
    void parsesKnownSpellings(String raw, Environment expected) {
        assertThat(Environment.parse(raw)).contains(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"qa", "live"})
    void rejectsUnknownValues(String raw) {
        assertThat(Environment.parse(raw)).isEmpty();
    }
}
