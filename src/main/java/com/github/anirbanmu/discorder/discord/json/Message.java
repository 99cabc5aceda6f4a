package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.List;

// MESSAGE_CREATE / MESSAGE_UPDATE data. updates may be partial, so almost everything is nullable.
@CompiledJson
public record Message(String id, @JsonAttribute(name = "channel_id") String channelId, @JsonAttribute(name = "guild_id", nullable = true) String guildId, @JsonAttribute(nullable = true) User author, @JsonAttribute(nullable = true) String content, @JsonAttribute(nullable = true) String timestamp, @JsonAttribute(name = "edited_timestamp", nullable = true) String editedTimestamp, @JsonAttribute(nullable = true) Boolean tts, @JsonAttribute(nullable = true) List<User> mentions) {

    // MESSAGE_DELETE data
    @CompiledJson
    public record Delete(String id, @JsonAttribute(name = "channel_id") String channelId, @JsonAttribute(name = "guild_id", nullable = true) String guildId) {
    }

    // MESSAGE_DELETE_BULK data
    @CompiledJson
    public record DeleteBulk(List<String> ids, @JsonAttribute(name = "channel_id") String channelId, @JsonAttribute(name = "guild_id", nullable = true) String guildId) {
    }
}
