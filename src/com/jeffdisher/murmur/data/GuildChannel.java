package com.jeffdisher.murmur.data;

import com.jeffdisher.murmur.types.Snowflake;


/**
 * A channel owned by a guild.  The fields at the end are type-specific:  topic, lastMessageId, and rateLimitPerUser
 * only apply to text and news channels while bitrate and userLimit only apply to voice channels.
 */
public record GuildChannel(Snowflake id
		, Snowflake guildId
		, ChannelType type
		, String name
		, int position
		, Snowflake parentIdOrNull
		, boolean isNsfw
		, String topicOrNull
		, Snowflake lastMessageIdOrNull
		, Integer rateLimitPerUserOrNull
		, Integer bitrateOrNull
		, Integer userLimitOrNull
)
{
}
