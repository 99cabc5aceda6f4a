package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// GUILD_ROLE_CREATE / GUILD_ROLE_UPDATE data
@CompiledJson
public record GuildRoleEvent(@JsonAttribute(name = "guild_id") String guildId, Role role) {

    // GUILD_ROLE_DELETE data
    @CompiledJson
    public record Delete(@JsonAttribute(name = "guild_id") String guildId, @JsonAttribute(name = "role_id") String roleId) {
    }
}
