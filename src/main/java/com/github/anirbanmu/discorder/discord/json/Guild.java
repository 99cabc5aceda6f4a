package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.List;

// GUILD_CREATE / GUILD_UPDATE data. only the fields we read, the rest is skipped.
@CompiledJson
public record Guild(String id, @JsonAttribute(nullable = true) String name, @JsonAttribute(name = "owner_id", nullable = true) String ownerId, @JsonAttribute(name = "member_count", nullable = true) Integer memberCount, @JsonAttribute(nullable = true) Boolean unavailable, @JsonAttribute(nullable = true) List<Role> roles, @JsonAttribute(nullable = true) List<Channel> channels) {
}
