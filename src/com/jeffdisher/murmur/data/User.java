package com.jeffdisher.murmur.data;

import com.jeffdisher.murmur.types.Snowflake;


/**
 * A user as seen by the gateway.  Users are shared between every guild member, DM channel, message, and emoji which
 * names them so the cache stores exactly one instance per id and replaces it wholesale when it changes.
 */
public record User(Snowflake id
		, String discriminator
		, String username
		, String avatarHashOrNull
		, boolean isBot
		, boolean isSystem
		, int publicFlags
)
{
}
