package com.jeffdisher.murmur.data;

import java.util.List;


/**
 * The complete contents of a GUILD_CREATE payload:  the guild object along with every owned collection the gateway sent
 * with it.  The collections may be empty (GUILD_UPDATE does not send members, channels, presences, or voice states).
 */
public record GuildDefinition(GatewayGuild guild
		, List<Role> roles
		, List<KnownCustomEmoji> emojis
		, List<Member> members
		, List<GuildChannel> channels
		, List<MemberPresence> presences
		, List<VoiceState> voiceStates
)
{
	public GuildDefinition
	{
		roles = List.copyOf(roles);
		emojis = List.copyOf(emojis);
		members = List.copyOf(members);
		channels = List.copyOf(channels);
		presences = List.copyOf(presences);
		voiceStates = List.copyOf(voiceStates);
	}
}
