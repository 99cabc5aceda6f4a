package com.github.anirbanmu.discorder.discord.json;

// one inbound frame. data is the generic json tree of "d", typed decoding happens later.
public record Envelope(GatewayOpcode opcode, Long sequence, String eventName, Object data) {

    public boolean isDispatch() {
        return eventName != null && data != null;
    }
}
