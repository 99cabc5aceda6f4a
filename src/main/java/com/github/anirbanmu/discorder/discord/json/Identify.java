package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;
import com.github.anirbanmu.discorder.config.GatewayConfig;

// opcode 2 identify payload - sent after receiving hello
@CompiledJson
public record Identify(String token, int intents, Properties properties) {

    public static Identify create(String token, GatewayConfig config) {
        return new Identify(token, config.intents(), new Properties(config.os(), config.browser(), config.device()));
    }

    // connection properties for identify
    @CompiledJson
    public record Properties(String os, String browser, String device) {
    }
}
