package com.jeffdisher.murmur.projection;

import java.util.Set;

import com.jeffdisher.murmur.types.Snowflake;


/**
 * The cached form of a KnownCustomEmoji.  The creator, when known, is held as a user id.
 */
public record KnownCustomEmojiData(Snowflake id
		, Snowflake guildId
		, String name
		, boolean isAnimated
		, Set<Snowflake> roleIds
		, Snowflake creatorIdOrNull
		, boolean isColonsRequired
		, boolean isManaged
		, boolean isAvailable
)
{
	public KnownCustomEmojiData
	{
		roleIds = Set.copyOf(roleIds);
	}
}
