package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// STAGE_INSTANCE_CREATE / _UPDATE / _DELETE data
@CompiledJson
public record StageInstance(String id, @JsonAttribute(name = "guild_id") String guildId, @JsonAttribute(name = "channel_id") String channelId, String topic, @JsonAttribute(name = "privacy_level") int privacyLevel, @JsonAttribute(name = "guild_scheduled_event_id", nullable = true) String guildScheduledEventId) {
}
