package com.github.anirbanmu.discorder.config;

import java.lang.System.Logger.Level;

public record DiscorderConfig(GatewayConfig gateway, ControlPlaneTimings timings, Level logLevel) {
    public static final DiscorderConfig DEFAULTS =
        new DiscorderConfig(GatewayConfig.DEFAULTS, ControlPlaneTimings.DEFAULTS, Level.INFO);
}
