package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// GUILD_DELETE data, also the guild stubs in READY
@CompiledJson
public record UnavailableGuild(String id, @JsonAttribute(nullable = true) Boolean unavailable) {
}
