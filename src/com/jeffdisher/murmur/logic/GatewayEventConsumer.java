package com.jeffdisher.murmur.logic;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.jeffdisher.murmur.caches.StatefulCache;
import com.jeffdisher.murmur.data.ChannelType;
import com.jeffdisher.murmur.data.DMChannel;
import com.jeffdisher.murmur.data.GatewayGuild;
import com.jeffdisher.murmur.data.GuildChannel;
import com.jeffdisher.murmur.data.GuildDefinition;
import com.jeffdisher.murmur.data.KnownCustomEmoji;
import com.jeffdisher.murmur.data.Member;
import com.jeffdisher.murmur.data.MemberPresence;
import com.jeffdisher.murmur.data.Message;
import com.jeffdisher.murmur.data.OwnUser;
import com.jeffdisher.murmur.data.Role;
import com.jeffdisher.murmur.data.User;
import com.jeffdisher.murmur.data.VoiceState;
import com.jeffdisher.murmur.types.FailedDeserializationException;
import com.jeffdisher.murmur.types.ILogger;
import com.jeffdisher.murmur.types.Snowflake;


/**
 * Applies gateway dispatch events to a StatefulCache.
 * Each event is decoded with the EntityFactory and then handed to the matching cache operations.  Events the cache
 * doesn't know about are logged and ignored, as are events whose payloads can't be decoded, so the caller can feed
 * every dispatch it receives through here.
 */
public class GatewayEventConsumer
{
	private final StatefulCache _cache;
	private final ILogger _logger;
	private final EnumMap<GatewayEvent, IEventHandler> _handlers;

	public GatewayEventConsumer(StatefulCache cache, ILogger logger)
	{
		_cache = cache;
		_logger = logger;
		_handlers = new EnumMap<>(GatewayEvent.class);
		_handlers.put(GatewayEvent.READY, this::_ready);
		_handlers.put(GatewayEvent.GUILD_CREATE, this::_guildCreate);
		_handlers.put(GatewayEvent.GUILD_UPDATE, this::_guildUpdate);
		_handlers.put(GatewayEvent.GUILD_DELETE, this::_guildDelete);
		_handlers.put(GatewayEvent.GUILD_MEMBER_ADD, this::_memberAdd);
		_handlers.put(GatewayEvent.GUILD_MEMBER_UPDATE, this::_memberUpdate);
		_handlers.put(GatewayEvent.GUILD_MEMBER_REMOVE, this::_memberRemove);
		_handlers.put(GatewayEvent.GUILD_ROLE_CREATE, this::_roleCreate);
		_handlers.put(GatewayEvent.GUILD_ROLE_UPDATE, this::_roleUpdate);
		_handlers.put(GatewayEvent.GUILD_ROLE_DELETE, this::_roleDelete);
		_handlers.put(GatewayEvent.GUILD_EMOJIS_UPDATE, this::_emojisUpdate);
		_handlers.put(GatewayEvent.CHANNEL_CREATE, this::_channelCreate);
		_handlers.put(GatewayEvent.CHANNEL_UPDATE, this::_channelUpdate);
		_handlers.put(GatewayEvent.CHANNEL_DELETE, this::_channelDelete);
		_handlers.put(GatewayEvent.MESSAGE_CREATE, this::_messageCreate);
		_handlers.put(GatewayEvent.MESSAGE_UPDATE, this::_messageUpdate);
		_handlers.put(GatewayEvent.MESSAGE_DELETE, this::_messageDelete);
		_handlers.put(GatewayEvent.PRESENCE_UPDATE, this::_presenceUpdate);
		_handlers.put(GatewayEvent.VOICE_STATE_UPDATE, this::_voiceStateUpdate);
		_handlers.put(GatewayEvent.USER_UPDATE, this::_userUpdate);
	}

	/**
	 * Applies a single dispatch event to the cache.
	 *
	 * @param eventName The event name, as sent by the gateway.
	 * @param payload The event's data object.
	 * @return True if the event was applied, false if it was unknown or couldn't be decoded.
	 */
	public boolean consume(String eventName, JsonObject payload)
	{
		GatewayEvent event = GatewayEvent.fromName(eventName);
		boolean didApply = false;
		if (null != event)
		{
			ILogger log = _logger.logStart("Event: " + event);
			try
			{
				_handlers.get(event).handle(payload, log);
				didApply = true;
				log.logFinish("Applied");
			}
			catch (FailedDeserializationException e)
			{
				log.logError("Malformed " + event + " payload: " + e.getLocalizedMessage());
				log.logFinish("Ignored");
			}
		}
		else
		{
			_logger.logError("Unknown event: " + eventName);
		}
		return didApply;
	}


	private void _ready(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		OwnUser me = EntityFactory.deserializeOwnUser(_requireObject(payload, "user", OwnUser.class));
		// The guilds are all listed as unavailable here and then each is streamed in with GUILD_CREATE.
		List<Snowflake> guildIds = new ArrayList<>();
		for (JsonObject guild : _objectList(payload, "guilds", GatewayGuild.class))
		{
			guildIds.add(EntityFactory.requireSnowflake(guild, "id", GatewayGuild.class));
		}
		List<DMChannel> dmChannels = new ArrayList<>();
		for (JsonObject channel : _objectList(payload, "private_channels", DMChannel.class))
		{
			if (ChannelType.DM == _channelType(channel))
			{
				dmChannels.add(EntityFactory.deserializeDMChannel(channel));
			}
		}
		_cache.startSession(me, guildIds, dmChannels);
		log.logOperation("Session user: " + me.username() + "#" + me.discriminator());
		log.logOperation("Guilds pending: " + guildIds.size() + ", DM channels: " + dmChannels.size());
	}

	private void _guildCreate(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		if (payload.getBoolean("unavailable", false))
		{
			Snowflake guildId = EntityFactory.requireSnowflake(payload, "id", GatewayGuild.class);
			_cache.setGuildAvailability(guildId, false);
			log.logOperation("Guild unavailable: " + guildId);
		}
		else
		{
			GuildDefinition definition = EntityFactory.deserializeGuildDefinition(payload);
			Snowflake guildId = definition.guild().id();
			// A guild is streamed in whole so anything left from before an outage is stale.
			_cache.replaceGuild(definition);
			log.logOperation("Guild " + guildId + " (" + definition.guild().name() + "): " + definition.members().size() + " members, " + definition.channels().size() + " channels");
		}
	}

	private void _guildUpdate(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		GuildDefinition definition = EntityFactory.deserializeGuildDefinition(payload);
		_cache.updateGuildAndRoles(definition.guild(), definition.roles());
		log.logOperation("Guild updated: " + definition.guild().id());
	}

	private void _guildDelete(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		Snowflake guildId = EntityFactory.requireSnowflake(payload, "id", GatewayGuild.class);
		if (payload.getBoolean("unavailable", false))
		{
			// An outage:  the contents are kept until the guild is streamed in again.
			_cache.setGuildAvailability(guildId, false);
			log.logOperation("Guild outage: " + guildId);
		}
		else
		{
			_cache.clearGuildRecord(guildId);
			log.logOperation("Left guild: " + guildId);
		}
	}

	private void _memberAdd(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		Member member = EntityFactory.deserializeMember(payload, null);
		_cache.setMember(member);
		log.logOperation("Member joined " + member.guildId() + ": " + member.user().id());
	}

	private void _memberUpdate(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		Snowflake guildId = EntityFactory.requireSnowflake(payload, "guild_id", Member.class);
		User user = EntityFactory.deserializeUser(_requireObject(payload, "user", Member.class));
		Member existing = _cache.getMember(guildId, user.id());
		// Member updates don't carry voice flags so those come from the existing member.
		JsonObject merged = new JsonObject(payload);
		if (null == merged.get("deaf"))
		{
			merged.set("deaf", (null != existing) && existing.isDeaf());
		}
		if (null == merged.get("mute"))
		{
			merged.set("mute", (null != existing) && existing.isMute());
		}
		if ((null == merged.get("joined_at")) && (null != existing))
		{
			merged.set("joined_at", existing.joinedAt().toString());
		}
		_cache.updateMember(EntityFactory.deserializeMember(merged, guildId));
		log.logOperation("Member updated in " + guildId + ": " + user.id());
	}

	private void _memberRemove(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		Snowflake guildId = EntityFactory.requireSnowflake(payload, "guild_id", Member.class);
		User user = EntityFactory.deserializeUser(_requireObject(payload, "user", Member.class));
		_cache.removeMember(guildId, user.id());
		log.logOperation("Member left " + guildId + ": " + user.id());
	}

	private void _roleCreate(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		Role role = _decodeRole(payload);
		_cache.setRole(role);
		log.logOperation("Role created: " + role.id());
	}

	private void _roleUpdate(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		Role role = _decodeRole(payload);
		_cache.updateRole(role);
		log.logOperation("Role updated: " + role.id());
	}

	private void _roleDelete(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		Snowflake guildId = EntityFactory.requireSnowflake(payload, "guild_id", Role.class);
		Snowflake roleId = EntityFactory.requireSnowflake(payload, "role_id", Role.class);
		Role removed = _cache.deleteRole(guildId, roleId);
		if (null == removed)
		{
			log.logVerbose("Role was not cached: " + roleId);
		}
		log.logOperation("Role deleted: " + roleId);
	}

	private void _emojisUpdate(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		Snowflake guildId = EntityFactory.requireSnowflake(payload, "guild_id", KnownCustomEmoji.class);
		// Decode everything first so a malformed payload leaves the existing emojis alone.
		List<KnownCustomEmoji> emojis = new ArrayList<>();
		for (JsonObject elt : _objectList(payload, "emojis", KnownCustomEmoji.class))
		{
			emojis.add(EntityFactory.deserializeEmoji(elt, guildId));
		}
		_cache.replaceEmojis(guildId, emojis);
		log.logOperation("Emojis replaced in " + guildId + ": " + emojis.size());
	}

	private void _channelCreate(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		ChannelType type = _channelType(payload);
		if (ChannelType.DM == type)
		{
			DMChannel channel = EntityFactory.deserializeDMChannel(payload);
			_cache.setDMChannel(channel);
			log.logOperation("DM channel created: " + channel.id());
		}
		else if (type.isPrivate())
		{
			log.logVerbose("Ignoring group DM channel");
		}
		else
		{
			GuildChannel channel = EntityFactory.deserializeGuildChannel(payload, null);
			_cache.setGuildChannel(channel);
			log.logOperation("Channel created: " + channel.id());
		}
	}

	private void _channelUpdate(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		ChannelType type = _channelType(payload);
		if (ChannelType.DM == type)
		{
			DMChannel channel = EntityFactory.deserializeDMChannel(payload);
			_cache.updateDMChannel(channel);
			log.logOperation("DM channel updated: " + channel.id());
		}
		else if (type.isPrivate())
		{
			log.logVerbose("Ignoring group DM channel");
		}
		else
		{
			GuildChannel channel = EntityFactory.deserializeGuildChannel(payload, null);
			_cache.updateGuildChannel(channel);
			log.logOperation("Channel updated: " + channel.id());
		}
	}

	private void _channelDelete(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		ChannelType type = _channelType(payload);
		if (ChannelType.DM == type)
		{
			DMChannel channel = EntityFactory.deserializeDMChannel(payload);
			_cache.deleteDMChannel(channel.recipient().id());
			log.logOperation("DM channel deleted: " + channel.id());
		}
		else if (type.isPrivate())
		{
			log.logVerbose("Ignoring group DM channel");
		}
		else
		{
			Snowflake channelId = EntityFactory.requireSnowflake(payload, "id", GuildChannel.class);
			_cache.deleteGuildChannel(channelId);
			log.logOperation("Channel deleted: " + channelId);
		}
	}

	private void _messageCreate(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		Message message = EntityFactory.deserializeMessage(payload);
		_cache.addNewMessage(message);
		log.logVerbose("Message created: " + message.id());
	}

	private void _messageUpdate(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		// Updates which only attach embeds don't carry the message body so there is nothing to replace.
		if ((null != payload.get("author")) && (null != payload.get("timestamp")))
		{
			Message message = EntityFactory.deserializeMessage(payload);
			_cache.updateMessage(message);
			log.logVerbose("Message updated: " + message.id());
		}
		else
		{
			log.logVerbose("Skipped partial message update");
		}
	}

	private void _messageDelete(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		Snowflake messageId = EntityFactory.requireSnowflake(payload, "id", Message.class);
		_cache.deleteMessage(messageId);
		log.logVerbose("Message deleted: " + messageId);
	}

	private void _presenceUpdate(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		MemberPresence presence = EntityFactory.deserializePresence(payload, null);
		_cache.updatePresence(presence);
		log.logVerbose("Presence of " + presence.userId() + " in " + presence.guildId() + ": " + presence.visibleStatus());
	}

	private void _voiceStateUpdate(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		if (null == payload.get("guild_id"))
		{
			log.logVerbose("Ignoring voice state outside a guild");
		}
		else
		{
			Snowflake guildId = EntityFactory.requireSnowflake(payload, "guild_id", VoiceState.class);
			Snowflake userId = EntityFactory.requireSnowflake(payload, "user_id", VoiceState.class);
			JsonValue channelId = payload.get("channel_id");
			if ((null == channelId) || channelId.isNull())
			{
				_cache.deleteVoiceState(guildId, userId);
				log.logOperation("Voice disconnected in " + guildId + ": " + userId);
			}
			else
			{
				VoiceState voiceState = EntityFactory.deserializeVoiceState(payload, guildId, _cache.getMember(guildId, userId));
				_cache.updateVoiceState(voiceState);
				log.logOperation("Voice state in " + guildId + ": " + userId + " -> " + voiceState.channelIdOrNull());
			}
		}
	}

	private void _userUpdate(JsonObject payload, ILogger log) throws FailedDeserializationException
	{
		OwnUser me = EntityFactory.deserializeOwnUser(payload);
		_cache.updateMe(me);
		log.logOperation("Session user updated");
	}

	private static Role _decodeRole(JsonObject payload) throws FailedDeserializationException
	{
		Snowflake guildId = EntityFactory.requireSnowflake(payload, "guild_id", Role.class);
		return EntityFactory.deserializeRole(_requireObject(payload, "role", Role.class), guildId);
	}

	private static ChannelType _channelType(JsonObject payload) throws FailedDeserializationException
	{
		JsonValue raw = payload.get("type");
		ChannelType type = ((null != raw) && raw.isNumber())
				? ChannelType.fromValue(raw.asInt())
				: null
		;
		if (null == type)
		{
			throw new FailedDeserializationException(ChannelType.class);
		}
		return type;
	}

	private static JsonObject _requireObject(JsonObject payload, String name, Class<?> type) throws FailedDeserializationException
	{
		JsonValue value = payload.get(name);
		if ((null == value) || !value.isObject())
		{
			throw new FailedDeserializationException(type);
		}
		return value.asObject();
	}

	private static List<JsonObject> _objectList(JsonObject payload, String name, Class<?> type) throws FailedDeserializationException
	{
		List<JsonObject> objects = new ArrayList<>();
		JsonValue value = payload.get(name);
		if ((null != value) && !value.isNull())
		{
			if (!value.isArray())
			{
				throw new FailedDeserializationException(type);
			}
			for (JsonValue elt : value.asArray())
			{
				if (!elt.isObject())
				{
					throw new FailedDeserializationException(type);
				}
				objects.add(elt.asObject());
			}
		}
		return objects;
	}


	@java.lang.FunctionalInterface
	private static interface IEventHandler
	{
		public void handle(JsonObject payload, ILogger log) throws FailedDeserializationException;
	}
}
