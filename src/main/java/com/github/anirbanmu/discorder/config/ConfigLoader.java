package com.github.anirbanmu.discorder.config;

import com.github.anirbanmu.discorder.log.Log;
import java.io.IOException;
import java.io.InputStream;
import java.lang.System.Logger.Level;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

public class ConfigLoader {
    // a missing file is not an error, every key has a default
    public static DiscorderConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            return DiscorderConfig.DEFAULTS;
        }
        TomlParseResult result = Toml.parse(path);
        return parse(result);
    }

    public static DiscorderConfig load(InputStream stream) throws IOException {
        TomlParseResult result = Toml.parse(stream);
        return parse(result);
    }

    public static DiscorderConfig load(String content) {
        TomlParseResult result = Toml.parse(content);
        return parse(result);
    }

    private static DiscorderConfig parse(TomlParseResult result) {
        if (result.hasErrors()) {
            StringBuilder sb = new StringBuilder("Failed to parse TOML configuration:\n");
            result.errors().forEach(error -> sb.append("- ").append(error.toString()).append("\n"));
            throw new ConfigException(sb.toString());
        }

        GatewayConfig gateway = result.isTable("gateway")
            ? parseGateway(result.getTable("gateway"))
            : GatewayConfig.DEFAULTS;

        ControlPlaneTimings timings = result.isTable("control_plane")
            ? parseTimings(result.getTable("control_plane"))
            : ControlPlaneTimings.DEFAULTS;

        Level level = Level.INFO;
        if (result.isTable("log")) {
            String levelStr = result.getTable("log").getString("level");
            if (levelStr != null) {
                try {
                    level = Log.parseLevel(levelStr);
                } catch (IllegalArgumentException e) {
                    throw new ConfigException("Unknown log level: " + levelStr);
                }
            }
        }

        return new DiscorderConfig(gateway, timings, level);
    }

    private static GatewayConfig parseGateway(TomlTable table) {
        GatewayConfig d = GatewayConfig.DEFAULTS;

        int apiVersion = intOr(table, "api_version", d.apiVersion());
        if (apiVersion <= 0) {
            throw new ConfigException("gateway.api_version must be positive, got " + apiVersion);
        }

        int intents = intOr(table, "intents", d.intents());
        if (intents < 0) {
            throw new ConfigException("gateway.intents must not be negative, got " + intents);
        }

        return new GatewayConfig(
            apiVersion,
            intents,
            stringOr(table, "os", d.os()),
            stringOr(table, "browser", d.browser()),
            stringOr(table, "device", d.device()));
    }

    private static ControlPlaneTimings parseTimings(TomlTable table) {
        ControlPlaneTimings d = ControlPlaneTimings.DEFAULTS;
        return new ControlPlaneTimings(
            durationOr(table, "doctor_poll_interval", d.doctorPollInterval()),
            durationOr(table, "doctor_grace_period", d.doctorGracePeriod()),
            durationOr(table, "stop_timeout", d.stopTimeout()),
            durationOr(table, "stop_poll_interval", d.stopPollInterval()),
            durationOr(table, "schedule_timeout", d.scheduleTimeout()),
            durationOr(table, "hello_timeout", d.helloTimeout()),
            durationOr(table, "reconnect_base_delay", d.reconnectBaseDelay()),
            durationOr(table, "reconnect_max_delay", d.reconnectMaxDelay()));
    }

    private static int intOr(TomlTable table, String key, int fallback) {
        if (!table.contains(key)) {
            return fallback;
        }
        if (!table.isLong(key)) {
            throw new ConfigException("'" + key + "' must be an integer.");
        }
        long value = table.getLong(key);
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new ConfigException("'" + key + "' is out of range: " + value);
        }
        return (int) value;
    }

    private static String stringOr(TomlTable table, String key, String fallback) {
        String value = table.getString(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static Duration durationOr(TomlTable table, String key, Duration fallback) {
        String str = table.getString(key);
        if (str == null) {
            return fallback;
        }
        try {
            // ISO-8601, e.g. "PT1S", "PT0.1S"
            return Duration.parse(str);
        } catch (Exception e) {
            throw new ConfigException("'" + key + "' has invalid duration: " + str);
        }
    }
}
