package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.List;

// THREAD_MEMBER_UPDATE data. id and user_id are omitted inside GUILD_CREATE.
@CompiledJson
public record ThreadMember(@JsonAttribute(nullable = true) String id, @JsonAttribute(name = "user_id", nullable = true) String userId, @JsonAttribute(name = "join_timestamp") String joinTimestamp, int flags, @JsonAttribute(name = "guild_id", nullable = true) String guildId) {

    // THREAD_LIST_SYNC data
    @CompiledJson
    public record ListSync(@JsonAttribute(name = "guild_id") String guildId, @JsonAttribute(name = "channel_ids", nullable = true) List<String> channelIds, List<Channel> threads, List<ThreadMember> members) {
    }

    // THREAD_MEMBERS_UPDATE data
    @CompiledJson
    public record MembersUpdate(String id, @JsonAttribute(name = "guild_id") String guildId, @JsonAttribute(name = "member_count") int memberCount, @JsonAttribute(name = "added_members", nullable = true) List<ThreadMember> addedMembers, @JsonAttribute(name = "removed_member_ids", nullable = true) List<String> removedMemberIds) {
    }
}
