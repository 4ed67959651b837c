package com.keystone.container.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ConfigurationLoader")
class ConfigurationLoaderTest {

    private static ConfigurationLoader loader(Map<String, String> defaults, Map<String, String> env,
                                              Map<String, String> secrets) {
        return new ConfigurationLoader(ConfigSource.of(defaults), ConfigSource.of(env), ConfigSource.of(secrets));
    }

    @Nested
    @DisplayName("Layer precedence")
    class Precedence {

        @Test
        @DisplayName("should let each higher layer win on key collision")
        void shouldApplyAscendingPrecedence() {
            var loader = loader(
                    Map.of("a", "default", "b", "default", "c", "default", "d", "default"),
                    Map.of("b", "env", "c", "env", "d", "env"),
                    Map.of("c", "secret", "d", "secret"));

            ConfigurationSnapshot snapshot = loader.load("svc", Map.of("d", "override"));

            assertThat(snapshot.values()).containsEntry("a", "default")
                    .containsEntry("b", "env")
                    .containsEntry("c", "secret")
                    .containsEntry("d", "override");
            assertThat(snapshot.origin("a")).contains(ConfigLayer.DEFAULTS);
            assertThat(snapshot.origin("b")).contains(ConfigLayer.ENVIRONMENT);
            assertThat(snapshot.origin("c")).contains(ConfigLayer.SECRETS);
            assertThat(snapshot.origin("d")).contains(ConfigLayer.OVERRIDES);
        }

        @Test
        @DisplayName("should not let a blank higher-layer value erase a lower one")
        void shouldKeepNonBlankLowerValue() {
            var loader = loader(Map.of("log.level", "INFO"), Map.of("log.level", "  "), Map.of());

            ConfigurationSnapshot snapshot = loader.load("svc", Map.of());

            assertThat(snapshot.get("log.level")).contains("INFO");
            assertThat(snapshot.origin("log.level")).contains(ConfigLayer.DEFAULTS);
        }

        @Test
        @DisplayName("should accept null overrides")
        void shouldAcceptNullOverrides() {
            var snapshot = ConfigurationLoader.fixed(Map.of("x", "1")).load("svc", null);

            assertThat(snapshot.get("x")).contains("1");
            assertThat(snapshot.serviceName()).isEqualTo("svc");
        }

        @Test
        @DisplayName("should produce an immutable snapshot")
        void shouldProduceImmutableSnapshot() {
            var snapshot = ConfigurationLoader.fixed(Map.of("x", "1")).load("svc", Map.of());

            assertThatThrownBy(() -> snapshot.values().put("y", "2"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Environment detection")
    class EnvironmentDetection {

        @Test
        @DisplayName("should default to development")
        void shouldDefaultToDevelopment() {
            var snapshot = ConfigurationLoader.fixed(Map.of()).load("svc", Map.of());

            assertThat(snapshot.environment()).isEqualTo(Environment.DEVELOPMENT);
        }

        @Test
        @DisplayName("should detect short environment names")
        void shouldDetectShortNames() {
            var loader = ConfigurationLoader.fixed(Map.of("environment", "prod"));

            assertThat(loader.load("svc", Map.of()).environment()).isEqualTo(Environment.PRODUCTION);
            assertThat(loader.load("svc", Map.of("environment", "TEST")).environment())
                    .isEqualTo(Environment.TESTING);
        }

        @Test
        @DisplayName("should fall back to development for unknown names")
        void shouldFallBackForUnknown() {
            var snapshot = ConfigurationLoader.fixed(Map.of("environment", "moon")).load("svc", Map.of());

            assertThat(snapshot.environment()).isEqualTo(Environment.DEVELOPMENT);
        }
    }

    @Nested
    @DisplayName("Required keys")
    class RequiredKeys {

        @Test
        @DisplayName("should fail with MISSING_REQUIRED when no layer supplies a key")
        void shouldFailOnMissingKey() {
            var loader = ConfigurationLoader.fixed(Map.of());

            assertThatThrownBy(() -> loader.load("svc", Map.of(),
                    List.of(ConfigKey.required("database.url", ConfigType.STRING))))
                    .isInstanceOf(ConfigException.class)
                    .satisfies(e -> {
                        ConfigException ce = (ConfigException) e;
                        assertThat(ce.kind()).isEqualTo(ConfigException.Kind.MISSING_REQUIRED);
                        assertThat(ce.key()).isEqualTo("database.url");
                    });
        }

        @Test
        @DisplayName("should fail with TYPE_MISMATCH when a value does not coerce")
        void shouldFailOnTypeMismatch() {
            var loader = ConfigurationLoader.fixed(Map.of("pool.size", "many"));

            assertThatThrownBy(() -> loader.load("svc", Map.of(),
                    List.of(ConfigKey.required("pool.size", ConfigType.INT))))
                    .isInstanceOf(ConfigException.class)
                    .extracting(e -> ((ConfigException) e).kind())
                    .isEqualTo(ConfigException.Kind.TYPE_MISMATCH);
        }

        @Test
        @DisplayName("should pass when every required key resolves")
        void shouldPassWhenSatisfied() {
            var loader = ConfigurationLoader.fixed(Map.of("pool.size", "4"));

            var snapshot = loader.load("svc", Map.of(), List.of(ConfigKey.required("pool.size", ConfigType.INT)));

            assertThat(snapshot.get("pool.size")).contains("4");
        }
    }

    @Nested
    @DisplayName("Sources")
    class Sources {

        @Test
        @DisplayName("should read only prefixed environment variables and normalise their names")
        void shouldNormaliseEnvironmentVariables() {
            ConfigSource source = ConfigSource.environment(() -> Map.of(
                    "KEYSTONE_TELEMETRY_SAMPLE_RATIO", "0.5",
                    "KEYSTONE_ENVIRONMENT", "staging",
                    "PATH", "/usr/bin"));

            assertThat(source.read())
                    .containsOnly(Map.entry("telemetry.sample.ratio", "0.5"), Map.entry("environment", "staging"));
        }

        @Test
        @DisplayName("should read a secrets file, skipping comments and blank lines")
        void shouldReadSecretsFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve(".env.secrets");
            Files.writeString(file, "# secrets\n\nAPI_TOKEN=abc=123\nmalformed\n");

            assertThat(ConfigSource.envFile(file).read()).containsOnly(Map.entry("api.token", "abc=123"));
        }

        @Test
        @DisplayName("should report a secrets file that cannot be decoded as an unreadable source")
        void shouldRejectUnreadableFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve(".env.secrets");
            Files.write(file, new byte[] {'K', '=', (byte) 0xC3, (byte) 0x28});

            assertThatThrownBy(() -> ConfigSource.envFile(file).read())
                    .isInstanceOfSatisfying(ConfigException.class, e -> {
                        assertThat(e.kind()).isEqualTo(ConfigException.Kind.SOURCE_UNREADABLE);
                        assertThat(e.key()).isEqualTo(file.toString());
                    })
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("should treat a missing secrets file as empty")
        void shouldTreatMissingFileAsEmpty(@TempDir Path dir) {
            assertThat(ConfigSource.envFile(dir.resolve("absent")).read()).isEmpty();
        }
    }
}
