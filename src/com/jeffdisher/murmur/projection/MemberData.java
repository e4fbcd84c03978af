package com.jeffdisher.murmur.projection;

import java.time.Instant;
import java.util.List;

import com.jeffdisher.murmur.types.Snowflake;


/**
 * The cached form of a Member.  The id is the user's id and the user object itself is looked up on read.
 */
public record MemberData(Snowflake id
		, Snowflake guildId
		, String nicknameOrNull
		, List<Snowflake> roleIds
		, Instant joinedAt
		, Instant premiumSinceOrNull
		, boolean isDeaf
		, boolean isMute
)
{
	public MemberData
	{
		roleIds = List.copyOf(roleIds);
	}
}
