package com.jeffdisher.murmur.data;

import com.jeffdisher.murmur.types.Snowflake;


/**
 * The user the session is logged in as.  This carries the private account fields the gateway only sends for the
 * current user (on READY and USER_UPDATE).
 */
public record OwnUser(Snowflake id
		, String discriminator
		, String username
		, String avatarHashOrNull
		, boolean isBot
		, boolean isSystem
		, int flags
		, boolean isMfaEnabled
		, String localeOrNull
		, Boolean isVerifiedOrNull
		, String emailOrNull
		, Integer premiumTypeOrNull
)
{
	/**
	 * @return The public part of the receiver, as the other users in the system would see it.
	 */
	public User asUser()
	{
		return new User(id, discriminator, username, avatarHashOrNull, isBot, isSystem, flags);
	}
}
