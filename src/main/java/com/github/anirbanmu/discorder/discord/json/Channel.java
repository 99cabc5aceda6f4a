package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// CHANNEL_* and THREAD_* data
@CompiledJson
public record Channel(String id, int type, @JsonAttribute(name = "guild_id", nullable = true) String guildId, @JsonAttribute(nullable = true) String name, @JsonAttribute(name = "parent_id", nullable = true) String parentId, @JsonAttribute(nullable = true) String topic) {

    // CHANNEL_PINS_UPDATE data
    @CompiledJson
    public record PinsUpdate(@JsonAttribute(name = "guild_id", nullable = true) String guildId, @JsonAttribute(name = "channel_id") String channelId, @JsonAttribute(name = "last_pin_timestamp", nullable = true) String lastPinTimestamp) {
    }
}
