package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.List;

// PRESENCE_UPDATE data. user is partial, only id is guaranteed.
@CompiledJson
public record PresenceUpdate(User user, @JsonAttribute(name = "guild_id", nullable = true) String guildId, @JsonAttribute(nullable = true) String status, @JsonAttribute(nullable = true) List<Activity> activities, @JsonAttribute(name = "client_status", nullable = true) ClientStatus clientStatus) {

    @CompiledJson
    public record Activity(String name, int type, @JsonAttribute(nullable = true) String url, @JsonAttribute(nullable = true) String state, @JsonAttribute(nullable = true) String details) {
    }

    // per-platform status, a platform is absent when the user is not on it
    @CompiledJson
    public record ClientStatus(@JsonAttribute(nullable = true) String desktop, @JsonAttribute(nullable = true) String mobile, @JsonAttribute(nullable = true) String web) {
    }
}
