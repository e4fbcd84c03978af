package com.jeffdisher.murmur.data;


/**
 * The channel types, with their gateway integer encoding.
 */
public enum ChannelType
{
	GUILD_TEXT(0),
	DM(1),
	GUILD_VOICE(2),
	GROUP_DM(3),
	GUILD_CATEGORY(4),
	GUILD_NEWS(5),
	GUILD_STORE(6),
	;

	/**
	 * @param value The gateway encoding.
	 * @return The matching type or null if the value is unknown.
	 */
	public static ChannelType fromValue(int value)
	{
		ChannelType match = null;
		for (ChannelType type : values())
		{
			if (type.value == value)
			{
				match = type;
				break;
			}
		}
		return match;
	}


	public final int value;

	private ChannelType(int value)
	{
		this.value = value;
	}

	/**
	 * @return True if this is a private channel type (not owned by a guild).
	 */
	public boolean isPrivate()
	{
		return (DM == this) || (GROUP_DM == this);
	}
}
