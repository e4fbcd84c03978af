package com.jeffdisher.murmur.data;

import java.util.Set;

import com.jeffdisher.murmur.types.Snowflake;


/**
 * A custom emoji owned by a guild.  The creator is only sent to sessions with the permission to manage emojis, so it
 * is often null.
 */
public record KnownCustomEmoji(Snowflake id
		, Snowflake guildId
		, String name
		, boolean isAnimated
		, Set<Snowflake> roleIds
		, User creatorOrNull
		, boolean isColonsRequired
		, boolean isManaged
		, boolean isAvailable
)
{
	public KnownCustomEmoji
	{
		roleIds = Set.copyOf(roleIds);
	}
}
