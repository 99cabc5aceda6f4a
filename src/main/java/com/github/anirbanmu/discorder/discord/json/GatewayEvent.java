package com.github.anirbanmu.discorder.discord.json;

// decoded event handed to consumers. payload is a schema record, the generic json tree for
// unmapped names, or null for synthetic events.
public record GatewayEvent(String name, Object payload) {
    public static final String RESUME = "RESUME";
    public static final String RECONNECT = "RECONNECT";
    public static final String INVALID_SESSION = "INVALID_SESSION";

    public static GatewayEvent synthetic(String name) {
        return new GatewayEvent(name, null);
    }
}
