package com.jeffdisher.murmur.projection;

import com.jeffdisher.murmur.types.Snowflake;


/**
 * The cached form of a DMChannel:  the recipient is held as an id and resolved against the user cache on read.
 */
public record DMChannelData(Snowflake id
		, String nameOrNull
		, Snowflake lastMessageIdOrNull
		, Snowflake recipientId
)
{
}
