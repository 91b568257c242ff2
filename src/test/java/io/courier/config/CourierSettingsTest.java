package io.courier.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

final class CourierSettingsTest {

    @Test
    void missingFileYieldsDefaults(@TempDir Path dir) {
        CourierSettings settings = CourierSettings.load(dir.resolve(CourierSettings.DEFAULT_FILE_NAME));
        Assertions.assertEquals(CourierSettings.defaults(), settings);
        Assertions.assertEquals(30, settings.maxRequestRate());
        Assertions.assertEquals(Duration.ofSeconds(10), settings.requestTimeout());
        Assertions.assertTrue(settings.enableRateLimiting());
        Assertions.assertFalse(settings.enableRequestLogging());
    }

    @Test
    void secondsAreConvertedToMillis(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, "{\"maxRequestRate\":5,\"rateLimitWindow\":2.5,\"requestTimeout\":0.75,"
                + "\"throttleInterval\":0,\"enableRequestLogging\":true,\"unknownKey\":1}", StandardCharsets.UTF_8);

        CourierSettings settings = CourierSettings.load(file);

        Assertions.assertEquals(5, settings.maxRequestRate());
        Assertions.assertEquals(2_500L, settings.rateLimitWindowMs());
        Assertions.assertEquals(750L, settings.requestTimeoutMs());
        Assertions.assertEquals(0L, settings.throttleIntervalMs());
        Assertions.assertTrue(settings.enableRequestLogging());
        Assertions.assertEquals(CourierSettings.DEFAULT_MAX_REQUEST_AGE_MS, settings.maxRequestAgeMs());
    }

    @Test
    void invalidValuesFallBackToDefaults(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, "{\"maxRequestRate\":0,\"requestTimeout\":-1,\"retryMaxAttempts\":-3,"
                + "\"retryBaseBackoff\":4,\"retryMaxBackoff\":1}", StandardCharsets.UTF_8);

        CourierSettings settings = CourierSettings.load(file);

        Assertions.assertEquals(CourierSettings.DEFAULT_MAX_REQUEST_RATE, settings.maxRequestRate());
        Assertions.assertEquals(CourierSettings.DEFAULT_REQUEST_TIMEOUT_MS, settings.requestTimeoutMs());
        Assertions.assertEquals(CourierSettings.DEFAULT_RETRY_MAX_ATTEMPTS, settings.retryMaxAttempts());
        Assertions.assertEquals(4_000L, settings.retryBaseBackoffMs());
        Assertions.assertEquals(4_000L, settings.retryMaxBackoffMs());
    }

    @Test
    void unreadableFileFailsLoudly(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, "{not json", StandardCharsets.UTF_8);
        RuntimeException error = Assertions.assertThrows(RuntimeException.class, () -> CourierSettings.load(file));
        Assertions.assertTrue(error.getMessage().contains("settings.json"));
    }

    @Test
    void fileViewUsesSeconds() {
        CourierSettings settings = CourierSettings.defaults().withRateLimit(10, 500L);
        Assertions.assertEquals(10, settings.toFileView().get("maxRequestRate"));
        Assertions.assertEquals(0.5, settings.toFileView().get("rateLimitWindow"));
        Assertions.assertEquals(10.0, settings.toFileView().get("requestTimeout"));
    }

    @Test
    void constructorRejectsNonsense() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> CourierSettings.defaults().withRateLimit(0, 1_000L));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> CourierSettings.defaults().withRequestTimeoutMs(0L));
    }
}
