package com.jeffdisher.murmur.projection;

import com.jeffdisher.murmur.types.Snowflake;


/**
 * The cached form of a VoiceState.  The member is not stored here but rebuilt from the member record of the same
 * guild.
 */
public record VoiceStateData(Snowflake channelIdOrNull
		, Snowflake guildId
		, boolean isGuildDeafened
		, boolean isGuildMuted
		, boolean isSelfDeafened
		, boolean isSelfMuted
		, boolean isStreaming
		, boolean isSuppressed
		, boolean isVideoEnabled
		, Snowflake userId
		, String sessionId
)
{
}
