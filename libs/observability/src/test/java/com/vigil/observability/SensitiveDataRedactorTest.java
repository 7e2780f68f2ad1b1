package com.vigil.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Nested
    @DisplayName("redact")
    class Redact {

        @Test
        @DisplayName("should mask credential-like keys case-insensitively")
        void shouldMaskCredentials() {
            Map<String, Object> result = redactor.redact(Map.of(
                    "twilioAuthToken", "abc",
                    "DB_PASSWORD", "pw",
                    "destination", "acme"));

            assertThat(result)
                    .containsEntry("twilioAuthToken", SensitiveDataRedactor.REDACTED)
                    .containsEntry("DB_PASSWORD", SensitiveDataRedactor.REDACTED)
                    .containsEntry("destination", "acme");
        }

        @Test
        @DisplayName("should redact nested maps and lists")
        void shouldRedactNested() {
            Map<String, Object> result = redactor.redact(Map.of(
                    "context", Map.of("apiKey", "k", "queue", "email"),
                    "targets", List.of(Map.of("secret", "s"))));

            assertThat(result.get("context")).isEqualTo(Map.of("apiKey", SensitiveDataRedactor.REDACTED, "queue", "email"));
            assertThat(result.get("targets")).isEqualTo(List.of(Map.of("secret", SensitiveDataRedactor.REDACTED)));
        }

        @Test
        @DisplayName("should stringify non-string keys of nested maps")
        void shouldStringifyKeys() {
            Map<String, Object> result = redactor.redact(Map.of(
                    "byPort", Map.of(6379, "redis", "token", "t")));

            assertThat(result.get("byPort")).isEqualTo(Map.of("6379", "redis", "token", SensitiveDataRedactor.REDACTED));
        }

        @Test
        @DisplayName("should return an empty map for null input")
        void shouldHandleNull() {
            assertThat(redactor.redact(null)).isEmpty();
        }

        @Test
        @DisplayName("should honour custom patterns")
        void shouldUseCustomPatterns() {
            var custom = new SensitiveDataRedactor(Set.of("phone"));

            assertThat(custom.redact(Map.of("adminPhone", "+1555", "password", "x")))
                    .containsEntry("adminPhone", SensitiveDataRedactor.REDACTED)
                    .containsEntry("password", "x");
        }
    }

    @Test
    @DisplayName("should keep only a short prefix when masking")
    void shouldMaskPrefix() {
        assertThat(SensitiveDataRedactor.mask("AC1234567890", 6)).isEqualTo("AC1234...");
        assertThat(SensitiveDataRedactor.mask("AC", 6)).isEqualTo("***");
        assertThat(SensitiveDataRedactor.mask(null, 6)).isEmpty();
    }
}
