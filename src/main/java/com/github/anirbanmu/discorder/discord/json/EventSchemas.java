package com.github.anirbanmu.discorder.discord.json;

import java.util.Map;
import java.util.Optional;

// dispatch event name -> payload type. names missing here are decoded generically.
// https://discord.com/developers/docs/topics/gateway-events#receive-events
public final class EventSchemas {
    private static final Map<String, Class<?>> SCHEMAS = Map.ofEntries(
        Map.entry("READY", Ready.class),

        Map.entry("GUILD_CREATE", Guild.class),
        Map.entry("GUILD_UPDATE", Guild.class),
        Map.entry("GUILD_DELETE", UnavailableGuild.class),
        Map.entry("GUILD_ROLE_CREATE", GuildRoleEvent.class),
        Map.entry("GUILD_ROLE_UPDATE", GuildRoleEvent.class),
        Map.entry("GUILD_ROLE_DELETE", GuildRoleEvent.Delete.class),

        Map.entry("CHANNEL_CREATE", Channel.class),
        Map.entry("CHANNEL_UPDATE", Channel.class),
        Map.entry("CHANNEL_DELETE", Channel.class),
        Map.entry("CHANNEL_PINS_UPDATE", Channel.PinsUpdate.class),
        Map.entry("THREAD_CREATE", Channel.class),
        Map.entry("THREAD_UPDATE", Channel.class),
        Map.entry("THREAD_DELETE", Channel.class),
        Map.entry("THREAD_LIST_SYNC", ThreadMember.ListSync.class),
        Map.entry("THREAD_MEMBER_UPDATE", ThreadMember.class),
        Map.entry("THREAD_MEMBERS_UPDATE", ThreadMember.MembersUpdate.class),

        Map.entry("STAGE_INSTANCE_CREATE", StageInstance.class),
        Map.entry("STAGE_INSTANCE_UPDATE", StageInstance.class),
        Map.entry("STAGE_INSTANCE_DELETE", StageInstance.class),

        Map.entry("GUILD_MEMBER_ADD", GuildMemberEvent.class),
        Map.entry("GUILD_MEMBER_UPDATE", GuildMemberEvent.class),
        Map.entry("GUILD_MEMBER_REMOVE", GuildMemberEvent.Removed.class),
        Map.entry("GUILD_BAN_ADD", GuildMemberEvent.Removed.class),
        Map.entry("GUILD_BAN_REMOVE", GuildMemberEvent.Removed.class),
        Map.entry("GUILD_EMOJIS_UPDATE", GuildAssetsUpdate.Emojis.class),
        Map.entry("GUILD_STICKERS_UPDATE", GuildAssetsUpdate.Stickers.class),

        Map.entry("GUILD_INTEGRATIONS_UPDATE", Integration.GuildUpdate.class),
        Map.entry("INTEGRATION_CREATE", Integration.class),
        Map.entry("INTEGRATION_UPDATE", Integration.class),
        Map.entry("INTEGRATION_DELETE", Integration.Delete.class),

        Map.entry("INVITE_CREATE", Invite.class),
        Map.entry("INVITE_DELETE", Invite.Delete.class),

        Map.entry("PRESENCE_UPDATE", PresenceUpdate.class),

        Map.entry("MESSAGE_CREATE", Message.class),
        Map.entry("MESSAGE_UPDATE", Message.class),
        Map.entry("MESSAGE_DELETE", Message.Delete.class),
        Map.entry("MESSAGE_DELETE_BULK", Message.DeleteBulk.class),

        Map.entry("MESSAGE_REACTION_ADD", Reaction.class),
        Map.entry("MESSAGE_REACTION_REMOVE", Reaction.class),
        Map.entry("MESSAGE_REACTION_REMOVE_ALL", Reaction.class),
        Map.entry("MESSAGE_REACTION_REMOVE_EMOJI", Reaction.class),

        Map.entry("TYPING_START", TypingStart.class),

        Map.entry("GUILD_SCHEDULED_EVENT_CREATE", GuildScheduledEvent.class),
        Map.entry("GUILD_SCHEDULED_EVENT_UPDATE", GuildScheduledEvent.class),
        Map.entry("GUILD_SCHEDULED_EVENT_DELETE", GuildScheduledEvent.class),
        Map.entry("GUILD_SCHEDULED_EVENT_USER_ADD", GuildScheduledEvent.UserEvent.class),
        Map.entry("GUILD_SCHEDULED_EVENT_USER_REMOVE", GuildScheduledEvent.UserEvent.class),

        Map.entry("INTERACTION_CREATE", Interaction.class));

    private EventSchemas() {
    }

    public static Optional<Class<?>> schemaFor(String eventName) {
        return Optional.ofNullable(SCHEMAS.get(eventName));
    }

    public static boolean isMapped(String eventName) {
        return SCHEMAS.containsKey(eventName);
    }
}
