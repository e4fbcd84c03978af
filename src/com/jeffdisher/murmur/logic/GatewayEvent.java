package com.jeffdisher.murmur.logic;


/**
 * The gateway dispatch events the cache consumes, keyed by their wire name.
 */
public enum GatewayEvent
{
	READY,
	GUILD_CREATE,
	GUILD_UPDATE,
	GUILD_DELETE,
	GUILD_MEMBER_ADD,
	GUILD_MEMBER_UPDATE,
	GUILD_MEMBER_REMOVE,
	GUILD_ROLE_CREATE,
	GUILD_ROLE_UPDATE,
	GUILD_ROLE_DELETE,
	GUILD_EMOJIS_UPDATE,
	CHANNEL_CREATE,
	CHANNEL_UPDATE,
	CHANNEL_DELETE,
	MESSAGE_CREATE,
	MESSAGE_UPDATE,
	MESSAGE_DELETE,
	PRESENCE_UPDATE,
	VOICE_STATE_UPDATE,
	USER_UPDATE,
	;

	/**
	 * @param name The event name, as sent by the gateway.
	 * @return The matching event or null if the cache doesn't consume this event.
	 */
	public static GatewayEvent fromName(String name)
	{
		GatewayEvent match = null;
		for (GatewayEvent event : values())
		{
			if (event.name().equals(name))
			{
				match = event;
				break;
			}
		}
		return match;
	}
}
