package com.jeffdisher.murmur.data;

import com.jeffdisher.murmur.types.Snowflake;


/**
 * A private channel between the session's user and one recipient.
 */
public record DMChannel(Snowflake id
		, String nameOrNull
		, Snowflake lastMessageIdOrNull
		, User recipient
)
{
	/**
	 * @return Always DM.
	 */
	public ChannelType type()
	{
		return ChannelType.DM;
	}
}
