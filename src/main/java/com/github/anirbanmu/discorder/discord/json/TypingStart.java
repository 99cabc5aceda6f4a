package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// TYPING_START data. timestamp is unix seconds.
@CompiledJson
public record TypingStart(@JsonAttribute(name = "channel_id") String channelId, @JsonAttribute(name = "guild_id", nullable = true) String guildId, @JsonAttribute(name = "user_id") String userId, long timestamp) {
}
