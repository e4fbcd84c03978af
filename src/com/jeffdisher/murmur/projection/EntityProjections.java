package com.jeffdisher.murmur.projection;

import java.util.function.Function;

import com.jeffdisher.murmur.data.DMChannel;
import com.jeffdisher.murmur.data.KnownCustomEmoji;
import com.jeffdisher.murmur.data.Member;
import com.jeffdisher.murmur.data.Message;
import com.jeffdisher.murmur.data.User;
import com.jeffdisher.murmur.data.VoiceState;
import com.jeffdisher.murmur.types.Snowflake;


/**
 * The mapping between full entities and the compact records the cache stores.
 * Each "to*Data" helper drops the shared objects an entity embeds, keeping only their ids, and each "build*" helper
 * is its exact inverse, resolving those ids through the given lookup.  A build returns null if a referenced entity
 * can't be resolved, which callers treat as "not cached" rather than as an error.
 * None of these helpers have side-effects.
 */
public class EntityProjections
{
	public static DMChannelData toDMChannelData(DMChannel channel)
	{
		return new DMChannelData(channel.id()
				, channel.nameOrNull()
				, channel.lastMessageIdOrNull()
				, channel.recipient().id()
		);
	}

	public static DMChannel buildDMChannel(DMChannelData data, Function<Snowflake, User> userLookup)
	{
		User recipient = userLookup.apply(data.recipientId());
		return (null != recipient)
				? new DMChannel(data.id(), data.nameOrNull(), data.lastMessageIdOrNull(), recipient)
				: null
		;
	}

	public static MemberData toMemberData(Member member)
	{
		return new MemberData(member.user().id()
				, member.guildId()
				, member.nicknameOrNull()
				, member.roleIds()
				, member.joinedAt()
				, member.premiumSinceOrNull()
				, member.isDeaf()
				, member.isMute()
		);
	}

	public static Member buildMember(MemberData data, Function<Snowflake, User> userLookup)
	{
		User user = userLookup.apply(data.id());
		return (null != user)
				? new Member(user, data.guildId(), data.nicknameOrNull(), data.roleIds(), data.joinedAt(), data.premiumSinceOrNull(), data.isDeaf(), data.isMute())
				: null
		;
	}

	public static VoiceStateData toVoiceStateData(VoiceState voiceState)
	{
		return new VoiceStateData(voiceState.channelIdOrNull()
				, voiceState.guildId()
				, voiceState.isGuildDeafened()
				, voiceState.isGuildMuted()
				, voiceState.isSelfDeafened()
				, voiceState.isSelfMuted()
				, voiceState.isStreaming()
				, voiceState.isSuppressed()
				, voiceState.isVideoEnabled()
				, voiceState.userId()
				, voiceState.sessionId()
		);
	}

	/**
	 * Rebuilds a voice state.  Note that the lookup here resolves the member (of the same guild) for the user id, not
	 * just the user.
	 * 
	 * @param data The cached voice state.
	 * @param memberLookup Resolves a user id to that user's member object in the voice state's guild.
	 * @return The voice state or null, if the member couldn't be resolved.
	 */
	public static VoiceState buildVoiceState(VoiceStateData data, Function<Snowflake, Member> memberLookup)
	{
		Member member = memberLookup.apply(data.userId());
		return (null != member)
				? new VoiceState(data.guildId()
						, data.channelIdOrNull()
						, data.userId()
						, member
						, data.sessionId()
						, data.isGuildDeafened()
						, data.isGuildMuted()
						, data.isSelfDeafened()
						, data.isSelfMuted()
						, data.isStreaming()
						, data.isSuppressed()
						, data.isVideoEnabled()
				)
				: null
		;
	}

	public static KnownCustomEmojiData toEmojiData(KnownCustomEmoji emoji)
	{
		Snowflake creatorId = (null != emoji.creatorOrNull())
				? emoji.creatorOrNull().id()
				: null
		;
		return new KnownCustomEmojiData(emoji.id()
				, emoji.guildId()
				, emoji.name()
				, emoji.isAnimated()
				, emoji.roleIds()
				, creatorId
				, emoji.isColonsRequired()
				, emoji.isManaged()
				, emoji.isAvailable()
		);
	}

	public static KnownCustomEmoji buildEmoji(KnownCustomEmojiData data, Function<Snowflake, User> userLookup)
	{
		// An emoji without a creator is complete as-is but a missing creator we expected is a dangling reference.
		User creator = null;
		boolean isResolved = true;
		if (null != data.creatorIdOrNull())
		{
			creator = userLookup.apply(data.creatorIdOrNull());
			isResolved = (null != creator);
		}
		return isResolved
				? new KnownCustomEmoji(data.id(), data.guildId(), data.name(), data.isAnimated(), data.roleIds(), creator, data.isColonsRequired(), data.isManaged(), data.isAvailable())
				: null
		;
	}

	public static MessageData toMessageData(Message message)
	{
		return new MessageData(message.id()
				, message.channelId()
				, message.guildIdOrNull()
				, message.author().id()
				, message.content()
				, message.timestamp()
				, message.editedTimestampOrNull()
				, message.isTts()
				, message.isMentioningEveryone()
				, message.userMentions()
				, message.roleMentions()
				, message.isPinned()
				, message.webhookIdOrNull()
				, message.type()
				, message.flags()
		);
	}

	public static Message buildMessage(MessageData data, Function<Snowflake, User> userLookup)
	{
		User author = userLookup.apply(data.authorId());
		return (null != author)
				? new Message(data.id()
						, data.channelId()
						, data.guildIdOrNull()
						, author
						, data.content()
						, data.timestamp()
						, data.editedTimestampOrNull()
						, data.isTts()
						, data.isMentioningEveryone()
						, data.userMentions()
						, data.roleMentions()
						, data.isPinned()
						, data.webhookIdOrNull()
						, data.type()
						, data.flags()
				)
				: null
		;
	}
}
