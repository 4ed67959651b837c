package com.keystone.utilities.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SerializationUtility")
class SerializationUtilityTest {

    record Quote(String symbol, double price, Instant at) { }

    private final SerializationUtility serialization = new SerializationUtility();

    @Test
    @DisplayName("should write instants as ISO-8601 strings")
    void shouldWriteIsoInstants() {
        String json = serialization.toJson(new Quote("ACME", 12.5, Instant.parse("2024-01-02T03:04:05Z")));

        assertThat(json).contains("\"at\":\"2024-01-02T03:04:05Z\"");
        assertThat(serialization.fromJson(json, Quote.class).symbol()).isEqualTo("ACME");
    }

    @Test
    @DisplayName("should ignore unknown properties by default")
    void shouldIgnoreUnknown() {
        Quote quote = serialization.fromJson("{\"symbol\":\"ACME\",\"price\":1,\"venue\":\"X\"}", Quote.class);

        assertThat(quote.price()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should fail on unknown properties when configured strict")
    void shouldRejectUnknownWhenStrict() {
        var strict = new SerializationUtility(false, true);

        assertThatThrownBy(() -> strict.fromJson("{\"symbol\":\"A\",\"venue\":\"X\"}", Quote.class))
                .isInstanceOf(SerializationException.class);
    }

    @Test
    @DisplayName("should convert between maps and typed values")
    void shouldConvertMaps() {
        Quote quote = serialization.fromMap(Map.of("symbol", "ACME", "price", 3), Quote.class);

        assertThat(quote.price()).isEqualTo(3.0);
        assertThat(serialization.toMap(quote)).containsEntry("symbol", "ACME");
    }

    @Test
    @DisplayName("should return empty for malformed payloads")
    void shouldTolerateMalformed() {
        assertThat(serialization.tryFromJson("{not json", Quote.class)).isEmpty();
        assertThatThrownBy(() -> serialization.fromJson("{not json", Quote.class))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("Quote");
    }
}
