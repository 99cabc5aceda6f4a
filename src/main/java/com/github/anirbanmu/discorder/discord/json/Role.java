package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

@CompiledJson
public record Role(String id, String name, int color, int position, @JsonAttribute(nullable = true) String permissions) {
}
