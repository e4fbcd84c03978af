package com.jeffdisher.murmur.data;

import java.time.Instant;
import java.util.List;

import com.jeffdisher.murmur.types.Snowflake;


/**
 * A user's membership in a specific guild.
 * Note that roleIds is kept in the order the gateway sent it.
 */
public record Member(User user
		, Snowflake guildId
		, String nicknameOrNull
		, List<Snowflake> roleIds
		, Instant joinedAt
		, Instant premiumSinceOrNull
		, boolean isDeaf
		, boolean isMute
)
{
	public Member
	{
		roleIds = List.copyOf(roleIds);
	}
}
