package com.github.anirbanmu.discorder.config;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.lang.System.Logger.Level;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

    @Test
    void testLoadConfig() {
        String toml = """
            [gateway]
            api_version = 9
            intents = 513
            os = "freebsd"
            browser = "my-bot"

            [control_plane]
            doctor_poll_interval = "PT2S"
            doctor_grace_period = "PT0.5S"
            stop_timeout = "PT10S"
            hello_timeout = "PT15S"
            reconnect_max_delay = "PT1M"

            [log]
            level = "debug"
            """;

        DiscorderConfig config = ConfigLoader.load(toml);

        GatewayConfig gateway = config.gateway();
        assertEquals(9, gateway.apiVersion());
        assertEquals(513, gateway.intents());
        assertEquals("freebsd", gateway.os());
        assertEquals("my-bot", gateway.browser());
        assertEquals("discorder", gateway.device()); // default when not specified

        ControlPlaneTimings timings = config.timings();
        assertEquals(Duration.ofSeconds(2), timings.doctorPollInterval());
        assertEquals(Duration.ofMillis(500), timings.doctorGracePeriod());
        assertEquals(Duration.ofSeconds(10), timings.stopTimeout());
        assertEquals(Duration.ofSeconds(15), timings.helloTimeout());
        assertEquals(Duration.ofMinutes(1), timings.reconnectMaxDelay());
        assertEquals(ControlPlaneTimings.DEFAULTS.stopPollInterval(), timings.stopPollInterval());
        assertEquals(ControlPlaneTimings.DEFAULTS.scheduleTimeout(), timings.scheduleTimeout());

        assertEquals(Level.DEBUG, config.logLevel());
    }

    @Test
    void emptyConfigUsesDefaults() {
        DiscorderConfig config = ConfigLoader.load("");

        assertEquals(GatewayConfig.DEFAULTS, config.gateway());
        assertEquals(ControlPlaneTimings.DEFAULTS, config.timings());
        assertEquals(Level.INFO, config.logLevel());
    }

    @Test
    void missingFileUsesDefaults(@TempDir Path dir) throws Exception {
        assertEquals(DiscorderConfig.DEFAULTS, ConfigLoader.load(dir.resolve("absent.toml")));
    }

    @Test
    void loadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("discorder.toml");
        Files.writeString(file, "[log]\nlevel = \"warn\"\n");

        assertEquals(Level.WARNING, ConfigLoader.load(file).logLevel());
    }

    @Test
    void loadFromStream() throws Exception {
        byte[] bytes = "[gateway]\nintents = 1\n".getBytes(StandardCharsets.UTF_8);

        DiscorderConfig config = ConfigLoader.load(new ByteArrayInputStream(bytes));

        assertEquals(1, config.gateway().intents());
    }

    @Test
    void testInvalidToml() {
        ConfigException ex = assertThrows(ConfigException.class, () -> ConfigLoader.load("[gateway\napi_version = "));
        assertTrue(ex.getMessage().startsWith("Failed to parse TOML configuration"));
    }

    @Test
    void testNonIntegerIntents() {
        ConfigException ex = assertThrows(ConfigException.class, () -> ConfigLoader.load("[gateway]\nintents = \"all\"\n"));
        assertTrue(ex.getMessage().contains("intents"));
    }

    @Test
    void testNegativeIntents() {
        assertThrows(ConfigException.class, () -> ConfigLoader.load("[gateway]\nintents = -1\n"));
    }

    @Test
    void testNonPositiveApiVersion() {
        assertThrows(ConfigException.class, () -> ConfigLoader.load("[gateway]\napi_version = 0\n"));
    }

    @Test
    void testInvalidDuration() {
        ConfigException ex = assertThrows(ConfigException.class,
            () -> ConfigLoader.load("[control_plane]\nstop_timeout = \"5 seconds\"\n"));
        assertTrue(ex.getMessage().contains("stop_timeout"));
    }

    @Test
    void testZeroPollInterval() {
        assertThrows(ConfigException.class, () -> ConfigLoader.load("[control_plane]\ndoctor_poll_interval = \"PT0S\"\n"));
    }

    @Test
    void testZeroHelloTimeout() {
        ConfigException ex = assertThrows(ConfigException.class, () -> ConfigLoader.load("[control_plane]\nhello_timeout = \"PT0S\"\n"));
        assertTrue(ex.getMessage().contains("helloTimeout"));
    }

    @Test
    void testUnknownLogLevel() {
        ConfigException ex = assertThrows(ConfigException.class, () -> ConfigLoader.load("[log]\nlevel = \"loud\"\n"));
        assertEquals("Unknown log level: loud", ex.getMessage());
    }

    @Test
    void reconnectDelayDoublesUpToCap() {
        ControlPlaneTimings timings = ControlPlaneTimings.DEFAULTS;

        assertEquals(Duration.ofMillis(200), timings.reconnectDelay(1));
        assertEquals(Duration.ofMillis(400), timings.reconnectDelay(2));
        assertEquals(Duration.ofMillis(800), timings.reconnectDelay(3));
        assertEquals(Duration.ofSeconds(30), timings.reconnectDelay(50));
    }

    @Test
    void connectionUrlCarriesVersionAndEncoding() {
        assertEquals("wss://gateway.discord.gg?v=10&encoding=json",
            GatewayConfig.DEFAULTS.connectionUrl("wss://gateway.discord.gg"));
    }
}
