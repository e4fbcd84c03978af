package com.jeffdisher.murmur.logic;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.eclipsesource.json.Json;
import com.eclipsesource.json.JsonArray;
import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.eclipsesource.json.ParseException;
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
import com.jeffdisher.murmur.data.PresenceStatus;
import com.jeffdisher.murmur.data.Role;
import com.jeffdisher.murmur.data.User;
import com.jeffdisher.murmur.data.VoiceState;
import com.jeffdisher.murmur.types.FailedDeserializationException;
import com.jeffdisher.murmur.types.Snowflake;


/**
 * Decodes the gateway's JSON entity payloads into the entity objects the cache stores.
 * Only the entity kinds the cache knows about are handled and only the fields the entity model keeps are read.
 * Any missing required field, or field of the wrong JSON type, results in a FailedDeserializationException naming the
 * entity being decoded.
 */
public class EntityFactory
{
	/**
	 * Parses raw JSON text as an object.
	 *
	 * @param json The JSON text.
	 * @return The parsed object.
	 * @throws FailedDeserializationException The text wasn't valid JSON or wasn't an object.
	 */
	public static JsonObject parseObject(String json) throws FailedDeserializationException
	{
		try
		{
			return Json.parse(json).asObject();
		}
		catch (ParseException | UnsupportedOperationException e)
		{
			throw new FailedDeserializationException(JsonObject.class, e);
		}
	}

	public static User deserializeUser(JsonObject payload) throws FailedDeserializationException
	{
		try
		{
			return new User(_snowflake(payload, "id")
					, _string(payload, "discriminator")
					, _string(payload, "username")
					, _stringOrNull(payload, "avatar")
					, payload.getBoolean("bot", false)
					, payload.getBoolean("system", false)
					, payload.getInt("public_flags", 0)
			);
		}
		catch (UnsupportedOperationException | IllegalArgumentException e)
		{
			throw new FailedDeserializationException(User.class, e);
		}
	}

	public static OwnUser deserializeOwnUser(JsonObject payload) throws FailedDeserializationException
	{
		try
		{
			JsonValue verified = payload.get("verified");
			JsonValue premiumType = payload.get("premium_type");
			return new OwnUser(_snowflake(payload, "id")
					, _string(payload, "discriminator")
					, _string(payload, "username")
					, _stringOrNull(payload, "avatar")
					, payload.getBoolean("bot", false)
					, payload.getBoolean("system", false)
					, payload.getInt("flags", 0)
					, _require(payload, "mfa_enabled").asBoolean()
					, _stringOrNull(payload, "locale")
					, _isNull(verified) ? null : verified.asBoolean()
					, _stringOrNull(payload, "email")
					, _isNull(premiumType) ? null : premiumType.asInt()
			);
		}
		catch (UnsupportedOperationException | IllegalArgumentException e)
		{
			throw new FailedDeserializationException(OwnUser.class, e);
		}
	}

	/**
	 * Decodes a member.  Members embedded in a guild payload don't carry their guild id so the caller must provide it in
	 * that case.
	 *
	 * @param payload The member payload.
	 * @param guildIdOrNull The guild id to use if the payload doesn't have one.
	 * @return The member.
	 * @throws FailedDeserializationException The payload was malformed.
	 */
	public static Member deserializeMember(JsonObject payload, Snowflake guildIdOrNull) throws FailedDeserializationException
	{
		User user = deserializeUser(_object(payload, "user", Member.class));
		try
		{
			return new Member(user
					, _guildId(payload, guildIdOrNull)
					, _stringOrNull(payload, "nick")
					, _snowflakeList(_require(payload, "roles").asArray())
					, _instant(payload, "joined_at")
					, _instantOrNull(payload, "premium_since")
					, _require(payload, "deaf").asBoolean()
					, _require(payload, "mute").asBoolean()
			);
		}
		catch (UnsupportedOperationException | IllegalArgumentException | DateTimeParseException e)
		{
			throw new FailedDeserializationException(Member.class, e);
		}
	}

	public static Role deserializeRole(JsonObject payload, Snowflake guildId) throws FailedDeserializationException
	{
		try
		{
			return new Role(_snowflake(payload, "id")
					, guildId
					, _string(payload, "name")
					, _require(payload, "color").asInt()
					, _require(payload, "hoist").asBoolean()
					, _require(payload, "position").asInt()
					, _permissions(_require(payload, "permissions"))
					, _require(payload, "managed").asBoolean()
					, _require(payload, "mentionable").asBoolean()
			);
		}
		catch (UnsupportedOperationException | IllegalArgumentException e)
		{
			throw new FailedDeserializationException(Role.class, e);
		}
	}

	public static KnownCustomEmoji deserializeEmoji(JsonObject payload, Snowflake guildId) throws FailedDeserializationException
	{
		JsonValue rawUser = payload.get("user");
		User creator = _isNull(rawUser)
				? null
				: deserializeUser(_asObject(rawUser, KnownCustomEmoji.class))
		;
		try
		{
			JsonValue roles = payload.get("roles");
			Set<Snowflake> roleIds = _isNull(roles)
					? Set.of()
					: new HashSet<>(_snowflakeList(roles.asArray()))
			;
			return new KnownCustomEmoji(_snowflake(payload, "id")
					, guildId
					, _string(payload, "name")
					, payload.getBoolean("animated", false)
					, roleIds
					, creator
					, payload.getBoolean("require_colons", true)
					, payload.getBoolean("managed", false)
					, payload.getBoolean("available", true)
			);
		}
		catch (UnsupportedOperationException | IllegalArgumentException e)
		{
			throw new FailedDeserializationException(KnownCustomEmoji.class, e);
		}
	}

	public static GatewayGuild deserializeGatewayGuild(JsonObject payload) throws FailedDeserializationException
	{
		try
		{
			Set<String> features = new HashSet<>();
			JsonValue rawFeatures = payload.get("features");
			if (!_isNull(rawFeatures))
			{
				for (JsonValue feature : rawFeatures.asArray())
				{
					features.add(feature.asString());
				}
			}
			JsonValue memberCount = payload.get("member_count");
			return new GatewayGuild(_snowflake(payload, "id")
					, _string(payload, "name")
					, _stringOrNull(payload, "icon")
					, features
					, _snowflake(payload, "owner_id")
					, _string(payload, "region")
					, _snowflakeOrNull(payload, "afk_channel_id")
					, _require(payload, "afk_timeout").asInt()
					, _require(payload, "verification_level").asInt()
					, _isNull(memberCount) ? null : memberCount.asInt()
					, payload.getBoolean("large", false)
					, _instantOrNull(payload, "joined_at")
					, payload.getInt("premium_tier", 0)
					, _stringOrNull(payload, "description")
					, payload.getString("preferred_locale", "en-US")
			);
		}
		catch (UnsupportedOperationException | IllegalArgumentException | DateTimeParseException e)
		{
			throw new FailedDeserializationException(GatewayGuild.class, e);
		}
	}

	/**
	 * Decodes a full GUILD_CREATE (or GUILD_UPDATE) payload, including every owned collection present.
	 * Voice states in a guild payload don't carry their member so they are matched against the members in the same
	 * payload.  Any voice state whose member isn't in the payload is dropped.
	 *
	 * @param payload The guild payload.
	 * @return The guild and its owned entities.
	 * @throws FailedDeserializationException The payload was malformed.
	 */
	public static GuildDefinition deserializeGuildDefinition(JsonObject payload) throws FailedDeserializationException
	{
		GatewayGuild guild = deserializeGatewayGuild(payload);
		Snowflake guildId = guild.id();

		List<Role> roles = new ArrayList<>();
		for (JsonObject elt : _objectList(payload, "roles", GuildDefinition.class))
		{
			roles.add(deserializeRole(elt, guildId));
		}
		List<KnownCustomEmoji> emojis = new ArrayList<>();
		for (JsonObject elt : _objectList(payload, "emojis", GuildDefinition.class))
		{
			emojis.add(deserializeEmoji(elt, guildId));
		}
		List<Member> members = new ArrayList<>();
		Map<Snowflake, Member> membersById = new HashMap<>();
		for (JsonObject elt : _objectList(payload, "members", GuildDefinition.class))
		{
			Member member = deserializeMember(elt, guildId);
			members.add(member);
			membersById.put(member.user().id(), member);
		}
		List<GuildChannel> channels = new ArrayList<>();
		for (JsonObject elt : _objectList(payload, "channels", GuildDefinition.class))
		{
			channels.add(deserializeGuildChannel(elt, guildId));
		}
		List<MemberPresence> presences = new ArrayList<>();
		for (JsonObject elt : _objectList(payload, "presences", GuildDefinition.class))
		{
			presences.add(deserializePresence(elt, guildId));
		}
		List<VoiceState> voiceStates = new ArrayList<>();
		for (JsonObject elt : _objectList(payload, "voice_states", GuildDefinition.class))
		{
			JsonValue rawUserId = elt.get("user_id");
			Snowflake userId = ((null != rawUserId) && rawUserId.isString())
					? Snowflake.fromString(rawUserId.asString())
					: null
			;
			Member member = (null != userId) ? membersById.get(userId) : null;
			if (null != member)
			{
				voiceStates.add(deserializeVoiceState(elt, guildId, member));
			}
		}
		return new GuildDefinition(guild, roles, emojis, members, channels, presences, voiceStates);
	}

	public static GuildChannel deserializeGuildChannel(JsonObject payload, Snowflake guildIdOrNull) throws FailedDeserializationException
	{
		try
		{
			int rawType = _require(payload, "type").asInt();
			ChannelType type = ChannelType.fromValue(rawType);
			if ((null == type) || type.isPrivate())
			{
				throw new IllegalArgumentException("Not a guild channel type: " + rawType);
			}
			JsonValue rateLimit = payload.get("rate_limit_per_user");
			JsonValue bitrate = payload.get("bitrate");
			JsonValue userLimit = payload.get("user_limit");
			return new GuildChannel(_snowflake(payload, "id")
					, _guildId(payload, guildIdOrNull)
					, type
					, _string(payload, "name")
					, _require(payload, "position").asInt()
					, _snowflakeOrNull(payload, "parent_id")
					, payload.getBoolean("nsfw", false)
					, _stringOrNull(payload, "topic")
					, _snowflakeOrNull(payload, "last_message_id")
					, _isNull(rateLimit) ? null : rateLimit.asInt()
					, _isNull(bitrate) ? null : bitrate.asInt()
					, _isNull(userLimit) ? null : userLimit.asInt()
			);
		}
		catch (UnsupportedOperationException | IllegalArgumentException e)
		{
			throw new FailedDeserializationException(GuildChannel.class, e);
		}
	}

	public static DMChannel deserializeDMChannel(JsonObject payload) throws FailedDeserializationException
	{
		List<JsonObject> recipients = _objectList(payload, "recipients", DMChannel.class);
		if (1 != recipients.size())
		{
			throw new FailedDeserializationException(DMChannel.class);
		}
		User recipient = deserializeUser(recipients.get(0));
		try
		{
			if (ChannelType.DM != ChannelType.fromValue(_require(payload, "type").asInt()))
			{
				throw new IllegalArgumentException("Not a DM channel");
			}
			return new DMChannel(_snowflake(payload, "id")
					, _stringOrNull(payload, "name")
					, _snowflakeOrNull(payload, "last_message_id")
					, recipient
			);
		}
		catch (UnsupportedOperationException | IllegalArgumentException e)
		{
			throw new FailedDeserializationException(DMChannel.class, e);
		}
	}

	public static Message deserializeMessage(JsonObject payload) throws FailedDeserializationException
	{
		User author = deserializeUser(_object(payload, "author", Message.class));
		try
		{
			List<Snowflake> userMentions = new ArrayList<>();
			JsonValue mentions = payload.get("mentions");
			if (!_isNull(mentions))
			{
				for (JsonValue mention : mentions.asArray())
				{
					userMentions.add(_snowflake(mention.asObject(), "id"));
				}
			}
			JsonValue roleMentions = payload.get("mention_roles");
			return new Message(_snowflake(payload, "id")
					, _snowflake(payload, "channel_id")
					, _snowflakeOrNull(payload, "guild_id")
					, author
					, payload.getString("content", "")
					, _instant(payload, "timestamp")
					, _instantOrNull(payload, "edited_timestamp")
					, payload.getBoolean("tts", false)
					, payload.getBoolean("mention_everyone", false)
					, userMentions
					, _isNull(roleMentions) ? List.of() : _snowflakeList(roleMentions.asArray())
					, payload.getBoolean("pinned", false)
					, _snowflakeOrNull(payload, "webhook_id")
					, payload.getInt("type", 0)
					, payload.getInt("flags", 0)
			);
		}
		catch (UnsupportedOperationException | IllegalArgumentException | DateTimeParseException e)
		{
			throw new FailedDeserializationException(Message.class, e);
		}
	}

	/**
	 * Decodes a voice state.  The payload's own guild id and member take precedence over the ones given.
	 *
	 * @param payload The voice state payload.
	 * @param guildIdOrNull The guild id to use if the payload doesn't have one.
	 * @param memberOrNull The member to use if the payload doesn't have one.
	 * @return The voice state.
	 * @throws FailedDeserializationException The payload was malformed or there was no member.
	 */
	public static VoiceState deserializeVoiceState(JsonObject payload, Snowflake guildIdOrNull, Member memberOrNull) throws FailedDeserializationException
	{
		Snowflake guildId;
		try
		{
			guildId = _guildId(payload, guildIdOrNull);
		}
		catch (UnsupportedOperationException | IllegalArgumentException e)
		{
			throw new FailedDeserializationException(VoiceState.class, e);
		}
		JsonValue rawMember = payload.get("member");
		Member member = _isNull(rawMember)
				? memberOrNull
				: deserializeMember(_asObject(rawMember, VoiceState.class), guildId)
		;
		if (null == member)
		{
			throw new FailedDeserializationException(VoiceState.class);
		}
		try
		{
			Snowflake userId = _snowflake(payload, "user_id");
			if (!userId.equals(member.user().id()))
			{
				throw new IllegalArgumentException("Voice state of " + userId + " carries member " + member.user().id());
			}
			return new VoiceState(guildId
					, _snowflakeOrNull(payload, "channel_id")
					, userId
					, member
					, _string(payload, "session_id")
					, _require(payload, "deaf").asBoolean()
					, _require(payload, "mute").asBoolean()
					, _require(payload, "self_deaf").asBoolean()
					, _require(payload, "self_mute").asBoolean()
					, payload.getBoolean("self_stream", false)
					, _require(payload, "suppress").asBoolean()
					, payload.getBoolean("self_video", false)
			);
		}
		catch (UnsupportedOperationException | IllegalArgumentException e)
		{
			throw new FailedDeserializationException(VoiceState.class, e);
		}
	}

	public static MemberPresence deserializePresence(JsonObject payload, Snowflake guildIdOrNull) throws FailedDeserializationException
	{
		try
		{
			JsonObject user = _require(payload, "user").asObject();
			JsonValue roles = payload.get("roles");
			List<String> activityNames = new ArrayList<>();
			JsonValue activities = payload.get("activities");
			if (!_isNull(activities))
			{
				for (JsonValue activity : activities.asArray())
				{
					activityNames.add(_string(activity.asObject(), "name"));
				}
			}
			JsonValue rawClientStatus = payload.get("client_status");
			JsonObject clientStatus = _isNull(rawClientStatus)
					? new JsonObject()
					: rawClientStatus.asObject()
			;
			return new MemberPresence(_snowflake(user, "id")
					, _guildId(payload, guildIdOrNull)
					, _isNull(roles) ? null : _snowflakeList(roles.asArray())
					, _status(_string(payload, "status"))
					, activityNames
					, _status(clientStatus.getString("desktop", PresenceStatus.OFFLINE.value))
					, _status(clientStatus.getString("mobile", PresenceStatus.OFFLINE.value))
					, _status(clientStatus.getString("web", PresenceStatus.OFFLINE.value))
					, _instantOrNull(payload, "premium_since")
					, _stringOrNull(payload, "nick")
			);
		}
		catch (UnsupportedOperationException | IllegalArgumentException | DateTimeParseException e)
		{
			throw new FailedDeserializationException(MemberPresence.class, e);
		}
	}

	/**
	 * Reads a required id field from a payload.
	 *
	 * @param payload The payload.
	 * @param name The field name.
	 * @param type The entity type to name in the exception, if this fails.
	 * @return The id.
	 * @throws FailedDeserializationException The field was missing or not an id.
	 */
	public static Snowflake requireSnowflake(JsonObject payload, String name, Class<?> type) throws FailedDeserializationException
	{
		try
		{
			return _snowflake(payload, name);
		}
		catch (UnsupportedOperationException | IllegalArgumentException e)
		{
			throw new FailedDeserializationException(type, e);
		}
	}


	private static boolean _isNull(JsonValue value)
	{
		return (null == value) || value.isNull();
	}

	private static JsonValue _require(JsonObject payload, String name)
	{
		JsonValue value = payload.get(name);
		if (null == value)
		{
			throw new IllegalArgumentException("Missing field: " + name);
		}
		return value;
	}

	private static String _string(JsonObject payload, String name)
	{
		return _require(payload, name).asString();
	}

	private static String _stringOrNull(JsonObject payload, String name)
	{
		JsonValue value = payload.get(name);
		return _isNull(value)
				? null
				: value.asString()
		;
	}

	private static Snowflake _snowflake(JsonObject payload, String name)
	{
		String raw = _string(payload, name);
		Snowflake id = Snowflake.fromString(raw);
		if (null == id)
		{
			throw new IllegalArgumentException("Invalid id in " + name + ": " + raw);
		}
		return id;
	}

	private static Snowflake _snowflakeOrNull(JsonObject payload, String name)
	{
		JsonValue value = payload.get(name);
		return _isNull(value)
				? null
				: _snowflake(payload, name)
		;
	}

	private static Snowflake _guildId(JsonObject payload, Snowflake fallbackOrNull)
	{
		Snowflake guildId = _snowflakeOrNull(payload, "guild_id");
		if (null == guildId)
		{
			guildId = fallbackOrNull;
		}
		if (null == guildId)
		{
			throw new IllegalArgumentException("No guild id");
		}
		return guildId;
	}

	private static List<Snowflake> _snowflakeList(JsonArray array)
	{
		List<Snowflake> ids = new ArrayList<>();
		for (JsonValue value : array)
		{
			Snowflake id = Snowflake.fromString(value.asString());
			if (null == id)
			{
				throw new IllegalArgumentException("Invalid id in list: " + value);
			}
			ids.add(id);
		}
		return ids;
	}

	private static Instant _instant(JsonObject payload, String name)
	{
		return OffsetDateTime.parse(_string(payload, name)).toInstant();
	}

	private static Instant _instantOrNull(JsonObject payload, String name)
	{
		String raw = _stringOrNull(payload, name);
		return (null != raw)
				? OffsetDateTime.parse(raw).toInstant()
				: null
		;
	}

	private static long _permissions(JsonValue value)
	{
		// Newer gateway versions send permissions as a string since they no longer fit in a JSON-safe integer.
		return value.isString()
				? Long.parseLong(value.asString())
				: value.asLong()
		;
	}

	private static PresenceStatus _status(String raw)
	{
		PresenceStatus status = PresenceStatus.fromValue(raw);
		if (null == status)
		{
			throw new IllegalArgumentException("Unknown status: " + raw);
		}
		return status;
	}

	private static JsonObject _object(JsonObject payload, String name, Class<?> type) throws FailedDeserializationException
	{
		return _asObject(payload.get(name), type);
	}

	private static JsonObject _asObject(JsonValue value, Class<?> type) throws FailedDeserializationException
	{
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
		if (!_isNull(value))
		{
			if (!value.isArray())
			{
				throw new FailedDeserializationException(type);
			}
			for (JsonValue elt : value.asArray())
			{
				objects.add(_asObject(elt, type));
			}
		}
		return objects;
	}
}
