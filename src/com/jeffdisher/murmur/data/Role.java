package com.jeffdisher.murmur.data;

import com.jeffdisher.murmur.types.Snowflake;


/**
 * A permission role within a guild.  Roles name no users so they are stored in the guild record as-is.
 */
public record Role(Snowflake id
		, Snowflake guildId
		, String name
		, int color
		, boolean isHoisted
		, int position
		, long permissions
		, boolean isManaged
		, boolean isMentionable
)
{
}
