package com.jeffdisher.murmur.data;

import com.jeffdisher.murmur.types.Snowflake;


/**
 * A user's voice connection state within a guild.  A null channelId means the user has disconnected from voice.
 */
public record VoiceState(Snowflake guildId
		, Snowflake channelIdOrNull
		, Snowflake userId
		, Member member
		, String sessionId
		, boolean isGuildDeafened
		, boolean isGuildMuted
		, boolean isSelfDeafened
		, boolean isSelfMuted
		, boolean isStreaming
		, boolean isSuppressed
		, boolean isVideoEnabled
)
{
}
