package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// MESSAGE_REACTION_ADD / _REMOVE / _REMOVE_ALL / _REMOVE_EMOJI data.
// user_id and emoji are absent for REMOVE_ALL, user_id is absent for REMOVE_EMOJI.
@CompiledJson
public record Reaction(@JsonAttribute(name = "user_id", nullable = true) String userId, @JsonAttribute(name = "channel_id") String channelId, @JsonAttribute(name = "message_id") String messageId, @JsonAttribute(name = "guild_id", nullable = true) String guildId, @JsonAttribute(nullable = true) Emoji emoji) {

    @CompiledJson
    public record Emoji(@JsonAttribute(nullable = true) String id, @JsonAttribute(nullable = true) String name) {
    }
}
