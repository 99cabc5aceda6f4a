package com.github.anirbanmu.discorder.discord.json;

// https://discord.com/developers/docs/topics/opcodes-and-status-codes#gateway-gateway-opcodes
public enum GatewayOpcode {
    DISPATCH(0),
    HEARTBEAT(1),
    IDENTIFY(2),
    PRESENCE_UPDATE(3),
    VOICE_STATE_UPDATE(4),
    RESUME(6),
    RECONNECT(7),
    REQUEST_GUILD_MEMBERS(8),
    INVALID_SESSION(9),
    HELLO(10),
    HEARTBEAT_ACK(11),
    UNKNOWN(-1);

    private static final GatewayOpcode[] BY_CODE = new GatewayOpcode[12];

    static {
        for (GatewayOpcode op : values()) {
            if (op.code >= 0) {
                BY_CODE[op.code] = op;
            }
        }
    }

    private final int code;

    GatewayOpcode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    // anything outside the table, including values past int range, is UNKNOWN
    public static GatewayOpcode fromCode(long code) {
        if (code < 0 || code >= BY_CODE.length || BY_CODE[(int) code] == null) {
            return UNKNOWN;
        }
        return BY_CODE[(int) code];
    }
}
