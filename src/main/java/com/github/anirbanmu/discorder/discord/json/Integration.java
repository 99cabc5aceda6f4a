package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// INTEGRATION_CREATE / _UPDATE data
@CompiledJson
public record Integration(String id, String name, String type, @JsonAttribute(nullable = true) Boolean enabled, @JsonAttribute(nullable = true) User user, @JsonAttribute(name = "guild_id", nullable = true) String guildId) {

    // INTEGRATION_DELETE data
    @CompiledJson
    public record Delete(String id, @JsonAttribute(name = "guild_id") String guildId, @JsonAttribute(name = "application_id", nullable = true) String applicationId) {
    }

    // GUILD_INTEGRATIONS_UPDATE data
    @CompiledJson
    public record GuildUpdate(@JsonAttribute(name = "guild_id") String guildId) {
    }
}
