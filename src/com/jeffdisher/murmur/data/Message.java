package com.jeffdisher.murmur.data;

import java.time.Instant;
import java.util.List;

import com.jeffdisher.murmur.types.Snowflake;


/**
 * A message posted to a guild channel or DM channel.
 */
public record Message(Snowflake id
		, Snowflake channelId
		, Snowflake guildIdOrNull
		, User author
		, String content
		, Instant timestamp
		, Instant editedTimestampOrNull
		, boolean isTts
		, boolean isMentioningEveryone
		, List<Snowflake> userMentions
		, List<Snowflake> roleMentions
		, boolean isPinned
		, Snowflake webhookIdOrNull
		, int type
		, int flags
)
{
	public Message
	{
		userMentions = List.copyOf(userMentions);
		roleMentions = List.copyOf(roleMentions);
	}
}
