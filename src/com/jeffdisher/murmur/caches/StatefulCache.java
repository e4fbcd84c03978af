package com.jeffdisher.murmur.caches;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import com.jeffdisher.murmur.CacheSettings;
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
import com.jeffdisher.murmur.projection.DMChannelData;
import com.jeffdisher.murmur.projection.EntityProjections;
import com.jeffdisher.murmur.projection.MessageData;
import com.jeffdisher.murmur.types.ILogger;
import com.jeffdisher.murmur.types.Snowflake;
import com.jeffdisher.murmur.types.UnavailableGuildException;
import com.jeffdisher.murmur.utils.Pair;


/**
 * The single entry point into the entity cache:  holds the session's own user and owns the user store, the guild
 * store, and the bounded DM channel and message caches.
 * Operations are named per entity type since each type has a different ownership shape:  users are shared and
 * reference-counted, guild-owned entities live in their guild's record, and DM channels and messages live in LRU caches
 * which release their user references on eviction.
 * Every call is synchronized, so a reader on another thread never sees a mutation half-applied.  Everything returned
 * is either an immutable entity or a point-in-time copy, so callers can hold them without seeing later changes.
 */
public class StatefulCache
{
	private final ILogger _logger;
	private final UserCache _users;
	private final GuildCache _guilds;
	// DM channels are keyed by recipient id since there is at most one per recipient.
	private final LruCache<Snowflake, DMChannelData> _dmChannels;
	private final LruCache<Snowflake, MessageData> _messages;
	private OwnUser _me;

	/**
	 * Creates an empty cache.
	 *
	 * @param settings The capacities of the bounded caches.
	 * @param logger The logger for eviction and consistency reports.
	 */
	public StatefulCache(CacheSettings settings, ILogger logger)
	{
		_logger = logger;
		_users = new UserCache();
		_guilds = new GuildCache(_users, logger);
		_dmChannels = new LruCache<>(settings.dmChannelCacheSize);
		_messages = new LruCache<>(settings.messageCacheSize);
		_me = null;
	}

	// ----- Own user -----

	public synchronized OwnUser getMe()
	{
		return _me;
	}

	public synchronized void setMe(OwnUser me)
	{
		_me = me;
	}

	public synchronized OwnUser deleteMe()
	{
		OwnUser old = _me;
		_me = null;
		return old;
	}

	public synchronized Pair<OwnUser, OwnUser> updateMe(OwnUser me)
	{
		OwnUser old = _me;
		_me = me;
		return new Pair<>(old, _me);
	}

	/**
	 * Applies the state announced when a session starts:  the session's own user, the guilds it is part of (all
	 * unavailable until they are streamed in), and its DM channels.
	 *
	 * @param me The session's own user.
	 * @param guildIds The guilds the session is part of.
	 * @param dmChannels The session's DM channels.
	 */
	public synchronized void startSession(OwnUser me, Collection<Snowflake> guildIds, Collection<DMChannel> dmChannels)
	{
		_me = me;
		_guilds.setInitialUnavailableGuilds(guildIds);
		for (DMChannel channel : dmChannels)
		{
			setDMChannel(channel);
		}
	}

	// ----- Users -----

	public synchronized User getUser(Snowflake userId)
	{
		return _users.getUser(userId);
	}

	public synchronized void setUser(User user)
	{
		_users.setUser(user);
	}

	public synchronized User deleteUser(Snowflake userId)
	{
		return _users.deleteUser(userId);
	}

	public synchronized Pair<User, User> updateUser(User user)
	{
		return _users.updateUser(user);
	}

	public synchronized Map<Snowflake, User> getUsersView()
	{
		return _users.getUsersView();
	}

	public synchronized Map<Snowflake, User> clearUsers()
	{
		return _users.clearUsers();
	}

	/**
	 * @param userId The user.
	 * @return The number of cached records currently naming this user.
	 */
	public synchronized int getUserReferenceCount(Snowflake userId)
	{
		return _users.getReferenceCount(userId);
	}

	// ----- Guilds -----

	/**
	 * @param guildId The guild.
	 * @return The guild or null, if not known.
	 * @throws UnavailableGuildException The guild is known but currently unavailable.
	 */
	public synchronized GatewayGuild getGuild(Snowflake guildId) throws UnavailableGuildException
	{
		return _guilds.getGuild(guildId);
	}

	public synchronized void setGuild(GatewayGuild guild)
	{
		_guilds.setGuild(guild);
	}

	public synchronized Pair<GatewayGuild, GatewayGuild> updateGuild(GatewayGuild guild)
	{
		return _guilds.updateGuild(guild);
	}

	public synchronized GatewayGuild deleteGuild(Snowflake guildId)
	{
		return _guilds.deleteGuild(guildId);
	}

	public synchronized void setGuildAvailability(Snowflake guildId, boolean isAvailable)
	{
		_guilds.setGuildAvailability(guildId, isAvailable);
	}

	public synchronized void setInitialUnavailableGuilds(Collection<Snowflake> guildIds)
	{
		_guilds.setInitialUnavailableGuilds(guildIds);
	}

	public synchronized Map<Snowflake, GatewayGuild> clearGuilds()
	{
		return _guilds.clearGuilds();
	}

	public synchronized Map<Snowflake, GatewayGuild> getAvailableGuildsView()
	{
		return _guilds.getAvailableGuildsView();
	}

	public synchronized Map<Snowflake, GatewayGuild> getUnavailableGuildsView()
	{
		return _guilds.getUnavailableGuildsView();
	}

	/**
	 * Removes the guild along with everything it owns (members, voice states, roles, emojis, channels, presences).
	 *
	 * @param guildId The guild.
	 * @return The removed guild or null, if the guild object wasn't known.
	 */
	public synchronized GatewayGuild clearGuildRecord(Snowflake guildId)
	{
		return _guilds.clearGuildRecord(guildId);
	}

	/**
	 * Replaces everything known about the guild with the given definition, clearing any state left from before.
	 *
	 * @param definition The complete guild state.
	 * @return The previous guild object or null, if it wasn't known.
	 */
	public synchronized GatewayGuild replaceGuild(GuildDefinition definition)
	{
		return _guilds.replaceGuild(definition);
	}

	public synchronized Pair<GatewayGuild, GatewayGuild> updateGuildAndRoles(GatewayGuild guild, Collection<Role> roles)
	{
		return _guilds.updateGuildAndRoles(guild, roles);
	}

	/**
	 * @param guildId The guild.
	 * @return True if the cache holds a record (possibly only a placeholder) for this guild.
	 */
	public synchronized boolean hasGuildRecord(Snowflake guildId)
	{
		return (null != _guilds.getRecord(guildId));
	}

	// ----- Members -----

	public synchronized void setMember(Member member)
	{
		_guilds.setMember(member);
	}

	public synchronized Member getMember(Snowflake guildId, Snowflake userId)
	{
		return _guilds.getMember(guildId, userId);
	}

	public synchronized Map<Snowflake, Member> getMembersView(Snowflake guildId)
	{
		return _guilds.getMembersView(guildId);
	}

	public synchronized Member deleteMember(Snowflake guildId, Snowflake userId)
	{
		return _guilds.deleteMember(guildId, userId);
	}

	public synchronized Pair<Member, Member> updateMember(Member member)
	{
		return _guilds.updateMember(member);
	}

	public synchronized Map<Snowflake, Member> clearMembers(Snowflake guildId)
	{
		return _guilds.clearMembers(guildId);
	}

	/**
	 * Removes the member along with its voice state and presence in the guild.
	 *
	 * @param guildId The guild.
	 * @param userId The member's user id.
	 * @return The removed member or null, if not cached.
	 */
	public synchronized Member removeMember(Snowflake guildId, Snowflake userId)
	{
		return _guilds.removeMember(guildId, userId);
	}

	// ----- Voice states -----

	public synchronized void setVoiceState(VoiceState voiceState)
	{
		_guilds.setVoiceState(voiceState);
	}

	public synchronized VoiceState getVoiceState(Snowflake guildId, Snowflake userId)
	{
		return _guilds.getVoiceState(guildId, userId);
	}

	public synchronized Map<Snowflake, VoiceState> getVoiceStatesView(Snowflake guildId)
	{
		return _guilds.getVoiceStatesView(guildId);
	}

	public synchronized Map<Snowflake, VoiceState> getVoiceStatesViewForChannel(Snowflake guildId, Snowflake channelId)
	{
		return _guilds.getVoiceStatesViewForChannel(guildId, channelId);
	}

	/**
	 * Removes the voice state, releasing its reference on the user.  Returns null if the member was already deleted,
	 * even though the voice state record was still removed.
	 *
	 * @param guildId The guild.
	 * @param userId The user.
	 * @return The removed voice state or null, if not cached or its member is no longer cached.
	 */
	public synchronized VoiceState deleteVoiceState(Snowflake guildId, Snowflake userId)
	{
		return _guilds.deleteVoiceState(guildId, userId);
	}

	public synchronized Pair<VoiceState, VoiceState> updateVoiceState(VoiceState voiceState)
	{
		return _guilds.updateVoiceState(voiceState);
	}

	public synchronized Map<Snowflake, VoiceState> clearVoiceStates(Snowflake guildId)
	{
		return _guilds.clearVoiceStates(guildId);
	}

	// ----- Roles -----

	public synchronized void setRole(Role role)
	{
		_guilds.setRole(role);
	}

	public synchronized Role getRole(Snowflake roleId)
	{
		return _guilds.getRole(roleId);
	}

	public synchronized Map<Snowflake, Role> getRolesView(Snowflake guildId)
	{
		return _guilds.getRolesView(guildId);
	}

	public synchronized Role deleteRole(Snowflake roleId)
	{
		return _guilds.deleteRole(roleId);
	}

	public synchronized Role getRole(Snowflake guildId, Snowflake roleId)
	{
		return _guilds.getRole(guildId, roleId);
	}

	public synchronized Role deleteRole(Snowflake guildId, Snowflake roleId)
	{
		return _guilds.deleteRole(guildId, roleId);
	}

	public synchronized Pair<Role, Role> updateRole(Role role)
	{
		return _guilds.updateRole(role);
	}

	public synchronized Map<Snowflake, Role> clearRoles(Snowflake guildId)
	{
		return _guilds.clearRoles(guildId);
	}

	// ----- Emojis -----

	public synchronized void setEmoji(KnownCustomEmoji emoji)
	{
		_guilds.setEmoji(emoji);
	}

	public synchronized KnownCustomEmoji getEmoji(Snowflake emojiId)
	{
		return _guilds.getEmoji(emojiId);
	}

	public synchronized Map<Snowflake, KnownCustomEmoji> getEmojisView(Snowflake guildId)
	{
		return _guilds.getEmojisView(guildId);
	}

	public synchronized KnownCustomEmoji deleteEmoji(Snowflake emojiId)
	{
		return _guilds.deleteEmoji(emojiId);
	}

	public synchronized KnownCustomEmoji getEmoji(Snowflake guildId, Snowflake emojiId)
	{
		return _guilds.getEmoji(guildId, emojiId);
	}

	public synchronized KnownCustomEmoji deleteEmoji(Snowflake guildId, Snowflake emojiId)
	{
		return _guilds.deleteEmoji(guildId, emojiId);
	}

	public synchronized Pair<KnownCustomEmoji, KnownCustomEmoji> updateEmoji(KnownCustomEmoji emoji)
	{
		return _guilds.updateEmoji(emoji);
	}

	public synchronized Map<Snowflake, KnownCustomEmoji> clearEmojis(Snowflake guildId)
	{
		return _guilds.clearEmojis(guildId);
	}

	/**
	 * @param guildId The guild.
	 * @param emojis The guild's complete emoji set.
	 * @return The emojis the guild had before, by id.
	 */
	public synchronized Map<Snowflake, KnownCustomEmoji> replaceEmojis(Snowflake guildId, Collection<KnownCustomEmoji> emojis)
	{
		return _guilds.replaceEmojis(guildId, emojis);
	}

	// ----- Guild channels -----

	public synchronized void setGuildChannel(GuildChannel channel)
	{
		_guilds.setGuildChannel(channel);
	}

	public synchronized GuildChannel getGuildChannel(Snowflake channelId)
	{
		return _guilds.getGuildChannel(channelId);
	}

	public synchronized Map<Snowflake, GuildChannel> getGuildChannelsView(Snowflake guildId)
	{
		return _guilds.getGuildChannelsView(guildId);
	}

	public synchronized GuildChannel deleteGuildChannel(Snowflake channelId)
	{
		return _guilds.deleteGuildChannel(channelId);
	}

	public synchronized GuildChannel getGuildChannel(Snowflake guildId, Snowflake channelId)
	{
		return _guilds.getGuildChannel(guildId, channelId);
	}

	public synchronized GuildChannel deleteGuildChannel(Snowflake guildId, Snowflake channelId)
	{
		return _guilds.deleteGuildChannel(guildId, channelId);
	}

	public synchronized Pair<GuildChannel, GuildChannel> updateGuildChannel(GuildChannel channel)
	{
		return _guilds.updateGuildChannel(channel);
	}

	public synchronized Map<Snowflake, GuildChannel> clearGuildChannels(Snowflake guildId)
	{
		return _guilds.clearGuildChannels(guildId);
	}

	// ----- Presences -----

	public synchronized void setPresence(MemberPresence presence)
	{
		_guilds.setPresence(presence);
	}

	public synchronized MemberPresence getPresence(Snowflake guildId, Snowflake userId)
	{
		return _guilds.getPresence(guildId, userId);
	}

	public synchronized Map<Snowflake, MemberPresence> getPresencesView(Snowflake guildId)
	{
		return _guilds.getPresencesView(guildId);
	}

	public synchronized MemberPresence deletePresence(Snowflake guildId, Snowflake userId)
	{
		return _guilds.deletePresence(guildId, userId);
	}

	public synchronized Pair<MemberPresence, MemberPresence> updatePresence(MemberPresence presence)
	{
		return _guilds.updatePresence(presence);
	}

	public synchronized Map<Snowflake, MemberPresence> clearPresences(Snowflake guildId)
	{
		return _guilds.clearPresences(guildId);
	}

	// ----- DM channels -----

	/**
	 * Stores the DM channel as the most recently used, evicting the least recently used one if the cache is full.
	 *
	 * @param channel The channel.
	 */
	public synchronized void setDMChannel(DMChannel channel)
	{
		_users.addReference(channel.recipient());
		DMChannelData previous = _dmChannels.put(channel.recipient().id(), EntityProjections.toDMChannelData(channel), (Snowflake recipientId, DMChannelData evicted) ->
		{
			_logger.logVerbose("Evicted DM channel " + evicted.id() + " (recipient " + recipientId + ")");
			_users.releaseReference(evicted.recipientId());
		});
		if (null != previous)
		{
			_users.releaseReference(previous.recipientId());
		}
	}

	/**
	 * @param recipientId The user on the other side of the DM.
	 * @return The DM channel or null, if not cached.
	 */
	public synchronized DMChannel getDMChannel(Snowflake recipientId)
	{
		DMChannelData data = _dmChannels.get(recipientId);
		return (null != data)
				? EntityProjections.buildDMChannel(data, _users::getUser)
				: null
		;
	}

	/**
	 * @return Every cached DM channel which could be rebuilt, by recipient id, from least to most recently used.
	 */
	public synchronized Map<Snowflake, DMChannel> getDMChannelsView()
	{
		Map<Snowflake, DMChannel> view = new LinkedHashMap<>();
		for (Map.Entry<Snowflake, DMChannelData> elt : _dmChannels.snapshot().entrySet())
		{
			DMChannel channel = EntityProjections.buildDMChannel(elt.getValue(), _users::getUser);
			if (null != channel)
			{
				view.put(elt.getKey(), channel);
			}
			else
			{
				_logger.logVerbose("Skipped DM channel " + elt.getValue().id() + " with missing recipient " + elt.getKey());
			}
		}
		return view;
	}

	/**
	 * Removes the DM channel, releasing its reference on the recipient.
	 *
	 * @param recipientId The user on the other side of the DM.
	 * @return The removed channel or null, if not cached.
	 */
	public synchronized DMChannel deleteDMChannel(Snowflake recipientId)
	{
		DMChannelData data = _dmChannels.remove(recipientId);
		DMChannel channel = null;
		if (null != data)
		{
			channel = EntityProjections.buildDMChannel(data, _users::getUser);
			_users.releaseReference(data.recipientId());
		}
		return channel;
	}

	public synchronized Pair<DMChannel, DMChannel> updateDMChannel(DMChannel channel)
	{
		DMChannel old = getDMChannel(channel.recipient().id());
		setDMChannel(channel);
		return new Pair<>(old, getDMChannel(channel.recipient().id()));
	}

	/**
	 * Removes every DM channel, releasing every recipient reference.
	 *
	 * @return The removed channels which could be rebuilt, by recipient id.
	 */
	public synchronized Map<Snowflake, DMChannel> clearDMChannels()
	{
		Map<Snowflake, DMChannel> cleared = getDMChannelsView();
		for (DMChannelData data : _dmChannels.clear().values())
		{
			_users.releaseReference(data.recipientId());
		}
		return cleared;
	}

	// ----- Messages -----

	/**
	 * Stores the message as the most recently used, evicting the least recently used one if the cache is full.
	 *
	 * @param message The message.
	 */
	public synchronized void setMessage(Message message)
	{
		_users.addReference(message.author());
		MessageData previous = _messages.put(message.id(), EntityProjections.toMessageData(message), (Snowflake messageId, MessageData evicted) ->
		{
			_logger.logVerbose("Evicted message " + messageId);
			_users.releaseReference(evicted.authorId());
		});
		if (null != previous)
		{
			_users.releaseReference(previous.authorId());
		}
	}

	public synchronized Message getMessage(Snowflake messageId)
	{
		MessageData data = _messages.get(messageId);
		return (null != data)
				? EntityProjections.buildMessage(data, _users::getUser)
				: null
		;
	}

	/**
	 * @return Every cached message which could be rebuilt, by id, from least to most recently used.
	 */
	public synchronized Map<Snowflake, Message> getMessagesView()
	{
		Map<Snowflake, Message> view = new LinkedHashMap<>();
		for (Map.Entry<Snowflake, MessageData> elt : _messages.snapshot().entrySet())
		{
			Message message = EntityProjections.buildMessage(elt.getValue(), _users::getUser);
			if (null != message)
			{
				view.put(elt.getKey(), message);
			}
			else
			{
				_logger.logVerbose("Skipped message " + elt.getKey() + " with missing author " + elt.getValue().authorId());
			}
		}
		return view;
	}

	public synchronized Message deleteMessage(Snowflake messageId)
	{
		MessageData data = _messages.remove(messageId);
		Message message = null;
		if (null != data)
		{
			message = EntityProjections.buildMessage(data, _users::getUser);
			_users.releaseReference(data.authorId());
		}
		return message;
	}

	public synchronized Pair<Message, Message> updateMessage(Message message)
	{
		Message old = getMessage(message.id());
		setMessage(message);
		return new Pair<>(old, getMessage(message.id()));
	}

	/**
	 * Stores a newly posted message and records it as the last message of its channel, if that channel is cached.
	 * A DM channel keeps its place in the usage order since only the message was used.
	 *
	 * @param message The new message.
	 */
	public synchronized void addNewMessage(Message message)
	{
		setMessage(message);
		if (null != message.guildIdOrNull())
		{
			GuildChannel channel = _guilds.getGuildChannel(message.guildIdOrNull(), message.channelId());
			if (null != channel)
			{
				_guilds.updateGuildChannel(new GuildChannel(channel.id()
						, channel.guildId()
						, channel.type()
						, channel.name()
						, channel.position()
						, channel.parentIdOrNull()
						, channel.isNsfw()
						, channel.topicOrNull()
						, message.id()
						, channel.rateLimitPerUserOrNull()
						, channel.bitrateOrNull()
						, channel.userLimitOrNull()
				));
			}
		}
		else
		{
			// DM channels are keyed by recipient so find the one with this channel id.
			for (Map.Entry<Snowflake, DMChannelData> elt : _dmChannels.snapshot().entrySet())
			{
				DMChannelData data = elt.getValue();
				if (data.id().equals(message.channelId()))
				{
					_dmChannels.replace(elt.getKey(), new DMChannelData(data.id(), data.nameOrNull(), message.id(), data.recipientId()));
					break;
				}
			}
		}
	}

	public synchronized Map<Snowflake, Message> clearMessages()
	{
		Map<Snowflake, Message> cleared = getMessagesView();
		for (MessageData data : _messages.clear().values())
		{
			_users.releaseReference(data.authorId());
		}
		return cleared;
	}
}
