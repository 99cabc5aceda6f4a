package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// GUILD_SCHEDULED_EVENT_CREATE / _UPDATE / _DELETE data
@CompiledJson
public record GuildScheduledEvent(String id, @JsonAttribute(name = "guild_id") String guildId, @JsonAttribute(name = "channel_id", nullable = true) String channelId, @JsonAttribute(name = "creator_id", nullable = true) String creatorId, String name, @JsonAttribute(nullable = true) String description, @JsonAttribute(name = "scheduled_start_time") String scheduledStartTime, @JsonAttribute(name = "scheduled_end_time", nullable = true) String scheduledEndTime, @JsonAttribute(name = "privacy_level") int privacyLevel, int status, @JsonAttribute(name = "entity_type") int entityType, @JsonAttribute(name = "entity_id", nullable = true) String entityId, @JsonAttribute(name = "user_count", nullable = true) Integer userCount) {

    // GUILD_SCHEDULED_EVENT_USER_ADD / _USER_REMOVE data
    @CompiledJson
    public record UserEvent(@JsonAttribute(name = "guild_scheduled_event_id") String guildScheduledEventId, @JsonAttribute(name = "user_id") String userId, @JsonAttribute(name = "guild_id") String guildId) {
    }
}
