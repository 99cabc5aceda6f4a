package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.List;

// GUILD_MEMBER_ADD / GUILD_MEMBER_UPDATE data
@CompiledJson
public record GuildMemberEvent(@JsonAttribute(name = "guild_id") String guildId, User user, @JsonAttribute(nullable = true) String nick, @JsonAttribute(nullable = true) List<String> roles, @JsonAttribute(name = "joined_at", nullable = true) String joinedAt) {

    // GUILD_MEMBER_REMOVE data, also GUILD_BAN_ADD / GUILD_BAN_REMOVE
    @CompiledJson
    public record Removed(@JsonAttribute(name = "guild_id") String guildId, User user) {
    }
}
