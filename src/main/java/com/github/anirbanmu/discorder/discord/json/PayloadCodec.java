package com.github.anirbanmu.discorder.discord.json;

import com.github.anirbanmu.discorder.util.Json;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

// gateway wire format. inbound frames become Envelopes with the "d" field kept as a
// generic json tree; typed decoding goes through EventSchemas on demand.
public final class PayloadCodec {

    public PayloadCodec() {
    }

    public Envelope decode(String frame) throws IOException {
        byte[] bytes = frame.getBytes(StandardCharsets.UTF_8);

        @SuppressWarnings("unchecked")
        Map<String, Object> root = Json.DSL.deserialize(Map.class, bytes, bytes.length);
        if (root == null) {
            throw new IOException("Frame is not a json object");
        }

        Object op = root.get("op");
        Long opCode = integral(op);
        if (opCode == null) {
            throw new IOException("Frame has no integral opcode: " + op);
        }

        Object t = root.get("t");
        String eventName = t instanceof String s ? s : null;

        return new Envelope(GatewayOpcode.fromCode(opCode), integral(root.get("s")), eventName, root.get("d"));
    }

    public String heartbeat(long sequence) {
        return sequence < 0 ? "{\"op\":1,\"d\":null}" : "{\"op\":1,\"d\":" + sequence + "}";
    }

    public String identify(Identify identify) throws IOException {
        return "{\"op\":" + GatewayOpcode.IDENTIFY.code() + ",\"d\":" + Json.write(identify) + "}";
    }

    // re-encodes the generic tree and reads it back as the requested type
    public <T> T decodeData(Object data, Class<T> type) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Json.DSL.serialize(data, out);
        byte[] bytes = out.toByteArray();

        T value = Json.DSL.deserialize(type, bytes, bytes.length);
        if (value == null) {
            throw new IOException("No " + type.getSimpleName() + " in payload");
        }
        return value;
    }

    public GatewayEvent decodeEvent(String eventName, Object data) throws IOException {
        Optional<Class<?>> schema = EventSchemas.schemaFor(eventName);
        if (schema.isEmpty()) {
            return new GatewayEvent(eventName, data);
        }
        return new GatewayEvent(eventName, decodeData(data, schema.get()));
    }

    // s must be an integer on the wire; anything else counts as absent
    static Long integral(Object value) {
        if (value instanceof Long l) {
            return l;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger b && b.bitLength() < 64) {
            return b.longValue();
        }
        if (value instanceof BigDecimal d && d.scale() <= 0) {
            try {
                return d.longValueExact();
            } catch (ArithmeticException e) {
                return null;
            }
        }
        return null;
    }
}
