package com.jeffdisher.murmur.projection;

import java.time.Instant;
import java.util.List;

import com.jeffdisher.murmur.types.Snowflake;


/**
 * The cached form of a Message.  The author is held as a user id.
 */
public record MessageData(Snowflake id
		, Snowflake channelId
		, Snowflake guildIdOrNull
		, Snowflake authorId
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
	public MessageData
	{
		userMentions = List.copyOf(userMentions);
		roleMentions = List.copyOf(roleMentions);
	}
}
