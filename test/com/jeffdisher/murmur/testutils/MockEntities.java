package com.jeffdisher.murmur.testutils;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import com.jeffdisher.murmur.data.ChannelType;
import com.jeffdisher.murmur.data.DMChannel;
import com.jeffdisher.murmur.data.GatewayGuild;
import com.jeffdisher.murmur.data.GuildChannel;
import com.jeffdisher.murmur.data.KnownCustomEmoji;
import com.jeffdisher.murmur.data.Member;
import com.jeffdisher.murmur.data.MemberPresence;
import com.jeffdisher.murmur.data.Message;
import com.jeffdisher.murmur.data.OwnUser;
import com.jeffdisher.murmur.data.PresenceStatus;
import com.jeffdisher.murmur.data.Role;
import com.jeffdisher.murmur.data.User;
import com.jeffdisher.murmur.data.VoiceState;
import com.jeffdisher.murmur.types.Snowflake;


/**
 * Factories for entities with plausible field values, so tests only need to name the ids they care about.
 */
public class MockEntities
{
	public static final Instant JOINED = Instant.parse("2020-07-09T13:11:18Z");
	public static final Snowflake G1 = Snowflake.fromLong(1001L);
	public static final Snowflake G2 = Snowflake.fromLong(1002L);

	public static Snowflake id(long raw)
	{
		return Snowflake.fromLong(raw);
	}

	public static User user(long id)
	{
		return new User(id(id), "0001", "user" + id, null, false, false, 0);
	}

	public static OwnUser ownUser(long id)
	{
		return new OwnUser(id(id), "0001", "me" + id, null, true, false, 0, false, "en-US", true, null, null);
	}

	public static Member member(Snowflake guildId, User user)
	{
		return new Member(user, guildId, null, List.of(), JOINED, null, false, false);
	}

	public static GatewayGuild guild(Snowflake guildId, String name)
	{
		return new GatewayGuild(guildId, name, null, Set.of(), id(1L), "us-west", null, 300, 1, 1, false, JOINED, 0, null, "en-US");
	}

	public static Role role(long id, Snowflake guildId)
	{
		return new Role(id(id), guildId, "role" + id, 0, false, 1, 0L, false, true);
	}

	public static KnownCustomEmoji emoji(long id, Snowflake guildId, User creatorOrNull)
	{
		return new KnownCustomEmoji(id(id), guildId, "emoji" + id, false, Set.of(), creatorOrNull, true, false, true);
	}

	public static GuildChannel textChannel(long id, Snowflake guildId)
	{
		return new GuildChannel(id(id), guildId, ChannelType.GUILD_TEXT, "channel" + id, 0, null, false, null, null, 0, null, null);
	}

	public static DMChannel dmChannel(long id, User recipient)
	{
		return new DMChannel(id(id), null, null, recipient);
	}

	public static Message message(long id, long channelId, User author)
	{
		return new Message(id(id), id(channelId), null, author, "message " + id, JOINED, null, false, false, List.of(), List.of(), false, null, 0, 0);
	}

	public static VoiceState voiceState(Member member, Snowflake channelIdOrNull)
	{
		return new VoiceState(member.guildId(), channelIdOrNull, member.user().id(), member, "session" + member.user().id(), false, false, false, false, false, false, false);
	}

	public static MemberPresence presence(Snowflake guildId, long userId, PresenceStatus status)
	{
		return new MemberPresence(id(userId), guildId, null, status, List.of(), status, PresenceStatus.OFFLINE, PresenceStatus.OFFLINE, null, null);
	}
}
