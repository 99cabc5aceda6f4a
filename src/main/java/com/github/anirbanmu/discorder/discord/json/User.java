package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

@CompiledJson
public record User(String id, @JsonAttribute(nullable = true) String username, @JsonAttribute(name = "global_name", nullable = true) String globalName, @JsonAttribute(nullable = true) String discriminator, @JsonAttribute(nullable = true) Boolean bot) {
}
