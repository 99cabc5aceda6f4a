package com.github.anirbanmu.discorder.config;

// identify parameters and connection url shape
public record GatewayConfig(int apiVersion, int intents, String os, String browser, String device) {
    public static final int DEFAULT_API_VERSION = 10;
    public static final int ALL_UNPRIVILEGED_AND_PRIVILEGED_INTENTS = 0x01ffff;

    public static final GatewayConfig DEFAULTS = new GatewayConfig(
        DEFAULT_API_VERSION, ALL_UNPRIVILEGED_AND_PRIVILEGED_INTENTS, "linux", "discorder", "discorder");

    public String connectionUrl(String baseUrl) {
        return baseUrl + "?v=" + apiVersion + "&encoding=json";
    }
}
