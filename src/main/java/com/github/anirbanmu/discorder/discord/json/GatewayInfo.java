package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;

// GET /gateway response
@CompiledJson
public record GatewayInfo(String url) {
}
