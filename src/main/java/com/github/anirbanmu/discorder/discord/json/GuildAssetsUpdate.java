package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.List;

// GUILD_EMOJIS_UPDATE and GUILD_STICKERS_UPDATE carry the full new list, not a diff
public final class GuildAssetsUpdate {
    private GuildAssetsUpdate() {
    }

    @CompiledJson
    public record Emojis(@JsonAttribute(name = "guild_id") String guildId, List<Reaction.Emoji> emojis) {
    }

    @CompiledJson
    public record Stickers(@JsonAttribute(name = "guild_id") String guildId, List<Sticker> stickers) {
    }

    @CompiledJson
    public record Sticker(String id, String name, @JsonAttribute(nullable = true) String description, @JsonAttribute(name = "format_type") int formatType) {
    }
}
