package com.jeffdisher.murmur.data;


/**
 * The status values of a presence, with their gateway string encoding.
 */
public enum PresenceStatus
{
	ONLINE("online"),
	IDLE("idle"),
	DND("dnd"),
	OFFLINE("offline"),
	;

	/**
	 * @param value The gateway encoding.
	 * @return The matching status or null if the value is unknown.
	 */
	public static PresenceStatus fromValue(String value)
	{
		PresenceStatus match = null;
		for (PresenceStatus status : values())
		{
			if (status.value.equals(value))
			{
				match = status;
				break;
			}
		}
		return match;
	}


	public final String value;

	private PresenceStatus(String value)
	{
		this.value = value;
	}
}
