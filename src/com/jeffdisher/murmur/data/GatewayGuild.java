package com.jeffdisher.murmur.data;

import java.time.Instant;
import java.util.Set;

import com.jeffdisher.murmur.types.Snowflake;


/**
 * The guild object itself, without any of the owned collections (roles, emojis, members, channels, ...) which the
 * gateway sends alongside it.  Those are stored in the guild's record, independently of this object.
 */
public record GatewayGuild(Snowflake id
		, String name
		, String iconHashOrNull
		, Set<String> features
		, Snowflake ownerId
		, String region
		, Snowflake afkChannelIdOrNull
		, int afkTimeoutSeconds
		, int verificationLevel
		, Integer memberCountOrNull
		, boolean isLarge
		, Instant joinedAtOrNull
		, int premiumTier
		, String descriptionOrNull
		, String preferredLocale
)
{
	public GatewayGuild
	{
		features = Set.copyOf(features);
	}
}
