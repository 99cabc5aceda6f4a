package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// INVITE_CREATE data
@CompiledJson
public record Invite(@JsonAttribute(name = "channel_id") String channelId, String code, @JsonAttribute(name = "created_at", nullable = true) String createdAt, @JsonAttribute(name = "guild_id", nullable = true) String guildId, @JsonAttribute(nullable = true) User inviter, @JsonAttribute(name = "max_age", nullable = true) Integer maxAge, @JsonAttribute(name = "max_uses", nullable = true) Integer maxUses, @JsonAttribute(nullable = true) Boolean temporary, @JsonAttribute(nullable = true) Integer uses) {

    // INVITE_DELETE data
    @CompiledJson
    public record Delete(@JsonAttribute(name = "channel_id") String channelId, @JsonAttribute(name = "guild_id", nullable = true) String guildId, String code) {
    }
}
