package com.jeffdisher.murmur.types;


/**
 * Thrown when a guild is known to the cache but is currently marked as unavailable (an outage on the gateway side).
 * This is distinct from the guild being unknown, which is reported as a null lookup.
 */
public class UnavailableGuildException extends MurmurException
{
	private static final long serialVersionUID = 1L;

	private final Snowflake _guildId;

	public UnavailableGuildException(Snowflake guildId)
	{
		super("Guild is currently unavailable: " + guildId);
		_guildId = guildId;
	}

	public Snowflake getGuildId()
	{
		return _guildId;
	}
}
