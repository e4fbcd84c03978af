package com.jeffdisher.murmur.data;

import java.time.Instant;
import java.util.List;

import com.jeffdisher.murmur.types.Snowflake;


/**
 * A member's presence in a guild.  The gateway only sends a partial user with presences so only the id is kept (the
 * full user is available through the member, if cached).
 * Only the names of activities are retained.
 */
public record MemberPresence(Snowflake userId
		, Snowflake guildId
		, List<Snowflake> roleIdsOrNull
		, PresenceStatus visibleStatus
		, List<String> activityNames
		, PresenceStatus desktopStatus
		, PresenceStatus mobileStatus
		, PresenceStatus webStatus
		, Instant premiumSinceOrNull
		, String nicknameOrNull
)
{
	public MemberPresence
	{
		roleIdsOrNull = (null != roleIdsOrNull) ? List.copyOf(roleIdsOrNull) : null;
		activityNames = List.copyOf(activityNames);
	}
}
