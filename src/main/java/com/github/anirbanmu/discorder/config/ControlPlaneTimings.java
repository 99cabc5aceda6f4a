package com.github.anirbanmu.discorder.config;

import java.time.Duration;

// timing knobs of the control plane. tests shrink them.
//   doctorPollInterval  how often the doctor checks session health
//   doctorGracePeriod   wait between an unhealthy check and tearing the session down
//   stopTimeout         total budget for a worker to honour cancellation
//   stopPollInterval    re-interrupt period while waiting for a worker to stop
//   scheduleTimeout     how long bootstrap waits for a worker to report scheduled
//   helloTimeout        how long the handshake waits for the first frame
//   reconnectBaseDelay  first back-off between attempts
//   reconnectMaxDelay   back-off cap
public record ControlPlaneTimings(
    Duration doctorPollInterval,
    Duration doctorGracePeriod,
    Duration stopTimeout,
    Duration stopPollInterval,
    Duration scheduleTimeout,
    Duration helloTimeout,
    Duration reconnectBaseDelay,
    Duration reconnectMaxDelay) {

    public static final ControlPlaneTimings DEFAULTS = new ControlPlaneTimings(
        Duration.ofSeconds(1),
        Duration.ofSeconds(5),
        Duration.ofSeconds(5),
        Duration.ofMillis(100),
        Duration.ofSeconds(30),
        Duration.ofSeconds(30),
        Duration.ofMillis(200),
        Duration.ofSeconds(30));

    public ControlPlaneTimings {
        requirePositive("doctorPollInterval", doctorPollInterval);
        requirePositive("stopTimeout", stopTimeout);
        requirePositive("stopPollInterval", stopPollInterval);
        requirePositive("scheduleTimeout", scheduleTimeout);
        requirePositive("helloTimeout", helloTimeout);
        requireNonNegative("doctorGracePeriod", doctorGracePeriod);
        requireNonNegative("reconnectBaseDelay", reconnectBaseDelay);
        requireNonNegative("reconnectMaxDelay", reconnectMaxDelay);
    }

    // exponential back-off for the given 1-based consecutive attempt count
    public Duration reconnectDelay(int attempt) {
        long base = reconnectBaseDelay.toMillis();
        long delay = base * (1L << Math.min(Math.max(attempt - 1, 0), 8));
        return Duration.ofMillis(Math.min(delay, reconnectMaxDelay.toMillis()));
    }

    private static void requirePositive(String name, Duration d) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new ConfigException("'" + name + "' must be a positive duration, got " + d);
        }
    }

    private static void requireNonNegative(String name, Duration d) {
        if (d == null || d.isNegative()) {
            throw new ConfigException("'" + name + "' must not be negative, got " + d);
        }
    }
}
