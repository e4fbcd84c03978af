package com.jeffdisher.murmur.projection;

import java.util.LinkedHashMap;
import java.util.Map;

import com.jeffdisher.murmur.data.GatewayGuild;
import com.jeffdisher.murmur.data.GuildChannel;
import com.jeffdisher.murmur.data.MemberPresence;
import com.jeffdisher.murmur.data.Role;
import com.jeffdisher.murmur.types.Snowflake;


/**
 * Everything the cache knows about a single guild.  The record can exist before the guild object itself is known (the
 * gateway may send members or voice states first, or READY may only list the guild as unavailable) and can outlive
 * the guild object, so long as it still owns data.
 * The record instance is never replaced while it is in the cache, only its contents.  Each owned map is keyed by the
 * id of the entity (user id for members, voice states, and presences) and holds compact records which are replaced
 * wholesale on update.
 * The maps returned are the live maps:  only the guild cache is expected to mutate them.
 */
public class GuildRecord
{
	private final Snowflake _guildId;
	private GatewayGuild _guild;
	private Availability _availability;
	private final Map<Snowflake, MemberData> _members;
	private final Map<Snowflake, VoiceStateData> _voiceStates;
	private final Map<Snowflake, Role> _roles;
	private final Map<Snowflake, KnownCustomEmojiData> _emojis;
	private final Map<Snowflake, GuildChannel> _channels;
	private final Map<Snowflake, MemberPresence> _presences;

	/**
	 * Creates an empty placeholder record for the given guild.
	 * 
	 * @param guildId The id of the guild this record describes.
	 */
	public GuildRecord(Snowflake guildId)
	{
		_guildId = guildId;
		_guild = null;
		_availability = Availability.UNKNOWN;
		_members = new LinkedHashMap<>();
		_voiceStates = new LinkedHashMap<>();
		_roles = new LinkedHashMap<>();
		_emojis = new LinkedHashMap<>();
		_channels = new LinkedHashMap<>();
		_presences = new LinkedHashMap<>();
	}

	public Snowflake getGuildId()
	{
		return _guildId;
	}

	/**
	 * @return The guild object or null, if it isn't known (yet or any more).
	 */
	public GatewayGuild getGuild()
	{
		return _guild;
	}

	public void setGuild(GatewayGuild guild)
	{
		_guild = guild;
	}

	public Availability getAvailability()
	{
		return _availability;
	}

	public void setAvailability(Availability availability)
	{
		_availability = availability;
	}

	public Map<Snowflake, MemberData> members()
	{
		return _members;
	}

	public Map<Snowflake, VoiceStateData> voiceStates()
	{
		return _voiceStates;
	}

	public Map<Snowflake, Role> roles()
	{
		return _roles;
	}

	public Map<Snowflake, KnownCustomEmojiData> emojis()
	{
		return _emojis;
	}

	public Map<Snowflake, GuildChannel> channels()
	{
		return _channels;
	}

	public Map<Snowflake, MemberPresence> presences()
	{
		return _presences;
	}

	/**
	 * A record is empty when it has neither a guild object nor any owned entries.  Since every user reference a guild
	 * holds comes from one of its owned entries, an empty record also holds no references.
	 * Note that availability is not considered:  an empty record marked unavailable is still empty.
	 * 
	 * @return True if the record holds nothing and can be dropped.
	 */
	public boolean isEmpty()
	{
		return (null == _guild)
				&& _members.isEmpty()
				&& _voiceStates.isEmpty()
				&& _roles.isEmpty()
				&& _emojis.isEmpty()
				&& _channels.isEmpty()
				&& _presences.isEmpty()
		;
	}
}
