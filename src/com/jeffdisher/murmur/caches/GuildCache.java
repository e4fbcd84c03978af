package com.jeffdisher.murmur.caches;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import com.jeffdisher.murmur.data.GatewayGuild;
import com.jeffdisher.murmur.data.GuildChannel;
import com.jeffdisher.murmur.data.GuildDefinition;
import com.jeffdisher.murmur.data.KnownCustomEmoji;
import com.jeffdisher.murmur.data.Member;
import com.jeffdisher.murmur.data.MemberPresence;
import com.jeffdisher.murmur.data.Role;
import com.jeffdisher.murmur.data.User;
import com.jeffdisher.murmur.data.VoiceState;
import com.jeffdisher.murmur.projection.Availability;
import com.jeffdisher.murmur.projection.EntityProjections;
import com.jeffdisher.murmur.projection.GuildRecord;
import com.jeffdisher.murmur.projection.KnownCustomEmojiData;
import com.jeffdisher.murmur.projection.MemberData;
import com.jeffdisher.murmur.projection.VoiceStateData;
import com.jeffdisher.murmur.types.ILogger;
import com.jeffdisher.murmur.types.Snowflake;
import com.jeffdisher.murmur.types.UnavailableGuildException;
import com.jeffdisher.murmur.utils.Assert;
import com.jeffdisher.murmur.utils.Pair;


/**
 * The store of guild records and everything they own.
 * Owned entities which name a user (members, voice states, emojis with a creator) hold a reference on that user in the
 * shared UserCache for as long as their compact record is stored here.  When a record is replaced, the reference for
 * the new record is added before the old one is released, so a user named by both is never dropped in between.
 * Roles, emojis, and guild channels can also be found by their own id alone, through indexes maintained here.
 * A guild record is dropped once a removal leaves it with no guild object and no owned entries, unless it is
 * explicitly marked unavailable (that marker is what lets getGuild() report the outage).
 * NOTE:  This class is not synchronized.  It is only accessed through StatefulCache, which serializes all access.
 */
public class GuildCache
{
	private final UserCache _users;
	private final ILogger _logger;
	private final Map<Snowflake, GuildRecord> _records;
	// Owned-entity id -> owning guild id.
	private final Map<Snowflake, Snowflake> _roleIndex;
	private final Map<Snowflake, Snowflake> _emojiIndex;
	private final Map<Snowflake, Snowflake> _channelIndex;

	/**
	 * Creates an empty store.
	 *
	 * @param users The shared user store where references are counted.
	 * @param logger The logger for reporting skipped records.
	 */
	public GuildCache(UserCache users, ILogger logger)
	{
		_users = users;
		_logger = logger;
		_records = new LinkedHashMap<>();
		_roleIndex = new HashMap<>();
		_emojiIndex = new HashMap<>();
		_channelIndex = new HashMap<>();
	}

	/**
	 * @param guildId The guild.
	 * @return The guild's record or null, if there isn't one.
	 */
	public GuildRecord getRecord(Snowflake guildId)
	{
		return _records.get(guildId);
	}

	/**
	 * @param guildId The guild.
	 * @return The guild's record, creating an empty placeholder if there wasn't one.
	 */
	public GuildRecord getOrCreateRecord(Snowflake guildId)
	{
		GuildRecord record = _records.get(guildId);
		if (null == record)
		{
			record = new GuildRecord(guildId);
			_records.put(guildId, record);
		}
		return record;
	}

	// ----- Guilds -----

	/**
	 * @param guildId The guild.
	 * @return The guild or null, if not known.
	 * @throws UnavailableGuildException The guild is known but is currently marked unavailable.
	 */
	public GatewayGuild getGuild(Snowflake guildId) throws UnavailableGuildException
	{
		GuildRecord record = _records.get(guildId);
		GatewayGuild guild = null;
		if (null != record)
		{
			if (Availability.UNAVAILABLE == record.getAvailability())
			{
				throw new UnavailableGuildException(guildId);
			}
			guild = record.getGuild();
		}
		return guild;
	}

	/**
	 * Stores the guild object, marking the guild as available.
	 *
	 * @param guild The guild.
	 */
	public void setGuild(GatewayGuild guild)
	{
		GuildRecord record = getOrCreateRecord(guild.id());
		record.setGuild(guild);
		record.setAvailability(Availability.AVAILABLE);
	}

	/**
	 * Stores the guild object, returning the guild before and after.  Unlike getGuild(), this doesn't care about
	 * availability.
	 *
	 * @param guild The guild.
	 * @return The previous guild (null if not known) and the new guild.
	 */
	public Pair<GatewayGuild, GatewayGuild> updateGuild(GatewayGuild guild)
	{
		GatewayGuild old = _peekGuild(guild.id());
		setGuild(guild);
		return new Pair<>(old, _peekGuild(guild.id()));
	}

	/**
	 * Removes the guild object, but not the data it owns.  The record itself is only removed if it owns nothing.
	 *
	 * @param guildId The guild.
	 * @return The removed guild or null, if it wasn't known.
	 */
	public GatewayGuild deleteGuild(Snowflake guildId)
	{
		GuildRecord record = _records.get(guildId);
		GatewayGuild guild = null;
		if ((null != record) && (null != record.getGuild()))
		{
			guild = record.getGuild();
			record.setGuild(null);
			record.setAvailability(Availability.UNKNOWN);
			_dropIfEmpty(record);
		}
		return guild;
	}

	/**
	 * Sets the availability of the guild, creating its record if needed.
	 *
	 * @param guildId The guild.
	 * @param isAvailable True if the guild is available, false if it is in an outage.
	 */
	public void setGuildAvailability(Snowflake guildId, boolean isAvailable)
	{
		getOrCreateRecord(guildId).setAvailability(isAvailable ? Availability.AVAILABLE : Availability.UNAVAILABLE);
	}

	/**
	 * Marks each of the given guilds as unavailable.  This is used when the session starts, as the guilds are listed
	 * before their contents are streamed in.
	 *
	 * @param guildIds The guilds the session is part of.
	 */
	public void setInitialUnavailableGuilds(Collection<Snowflake> guildIds)
	{
		for (Snowflake guildId : guildIds)
		{
			setGuildAvailability(guildId, false);
		}
	}

	/**
	 * Removes every guild object, leaving the records of any guild which still owns data.
	 *
	 * @return The removed guilds, by id.
	 */
	public Map<Snowflake, GatewayGuild> clearGuilds()
	{
		Map<Snowflake, GatewayGuild> cleared = new LinkedHashMap<>();
		for (GuildRecord record : new ArrayList<>(_records.values()))
		{
			if (null != record.getGuild())
			{
				cleared.put(record.getGuildId(), record.getGuild());
				record.setGuild(null);
				record.setAvailability(Availability.UNKNOWN);
				_dropIfEmpty(record);
			}
		}
		return cleared;
	}

	/**
	 * @return Every known guild which isn't marked unavailable, by id.
	 */
	public Map<Snowflake, GatewayGuild> getAvailableGuildsView()
	{
		return _guildsView(false);
	}

	/**
	 * @return Every known guild which is marked unavailable, by id.
	 */
	public Map<Snowflake, GatewayGuild> getUnavailableGuildsView()
	{
		return _guildsView(true);
	}

	/**
	 * Removes the guild and everything it owns, releasing every user reference its records held, and drops the record.
	 *
	 * @param guildId The guild.
	 * @return The removed guild object or null, if it wasn't known.
	 */
	public GatewayGuild clearGuildRecord(Snowflake guildId)
	{
		GatewayGuild guild = null;
		GuildRecord record = _records.get(guildId);
		if (null != record)
		{
			guild = record.getGuild();
			// Voice states first since they are rebuilt through the members.
			clearVoiceStates(guildId);
			clearMembers(guildId);
			clearEmojis(guildId);
			clearRoles(guildId);
			clearGuildChannels(guildId);
			clearPresences(guildId);
			_records.remove(guildId);
		}
		return guild;
	}

	/**
	 * Replaces everything known about a guild with the given definition, as sent when the guild is streamed in whole.
	 * Anything left from before (such as the state kept through an outage) is cleared first, so the references held by
	 * the old records are released and those of the new records are added exactly once.
	 *
	 * @param definition The complete guild state.
	 * @return The previous guild object or null, if it wasn't known.
	 */
	public GatewayGuild replaceGuild(GuildDefinition definition)
	{
		GatewayGuild previous = clearGuildRecord(definition.guild().id());
		setGuild(definition.guild());
		for (Role role : definition.roles())
		{
			setRole(role);
		}
		for (KnownCustomEmoji emoji : definition.emojis())
		{
			setEmoji(emoji);
		}
		for (Member member : definition.members())
		{
			setMember(member);
		}
		for (GuildChannel channel : definition.channels())
		{
			setGuildChannel(channel);
		}
		for (MemberPresence presence : definition.presences())
		{
			setPresence(presence);
		}
		// Voice states last since they are rebuilt through the members.
		for (VoiceState voiceState : definition.voiceStates())
		{
			setVoiceState(voiceState);
		}
		return previous;
	}

	/**
	 * Stores the guild object along with its roles.  Roles not in the list are left in place.
	 *
	 * @param guild The guild.
	 * @param roles The guild's roles.
	 * @return The previous guild (null if not known) and the new guild.
	 */
	public Pair<GatewayGuild, GatewayGuild> updateGuildAndRoles(GatewayGuild guild, Collection<Role> roles)
	{
		Pair<GatewayGuild, GatewayGuild> update = updateGuild(guild);
		for (Role role : roles)
		{
			setRole(role);
		}
		return update;
	}

	// ----- Members -----

	/**
	 * Stores the member, adding a reference to its user.
	 *
	 * @param member The member.
	 */
	public void setMember(Member member)
	{
		GuildRecord record = getOrCreateRecord(member.guildId());
		_users.addReference(member.user());
		MemberData previous = record.members().put(member.user().id(), EntityProjections.toMemberData(member));
		if (null != previous)
		{
			_users.releaseReference(previous.id());
		}
	}

	/**
	 * @param guildId The guild.
	 * @param userId The member's user id.
	 * @return The member or null, if not cached.
	 */
	public Member getMember(Snowflake guildId, Snowflake userId)
	{
		GuildRecord record = _records.get(guildId);
		MemberData data = (null != record) ? record.members().get(userId) : null;
		return (null != data)
				? EntityProjections.buildMember(data, _users::getUser)
				: null
		;
	}

	/**
	 * @param guildId The guild.
	 * @return Every member of the guild which could be rebuilt, by user id.
	 */
	public Map<Snowflake, Member> getMembersView(Snowflake guildId)
	{
		GuildRecord record = _records.get(guildId);
		return (null != record)
				? _buildView(record.members(), (MemberData data) -> EntityProjections.buildMember(data, _users::getUser), "member")
				: new LinkedHashMap<>()
		;
	}

	/**
	 * Removes the member, releasing the reference on its user.
	 *
	 * @param guildId The guild.
	 * @param userId The member's user id.
	 * @return The removed member or null, if not cached.
	 */
	public Member deleteMember(Snowflake guildId, Snowflake userId)
	{
		GuildRecord record = _records.get(guildId);
		MemberData data = (null != record) ? record.members().remove(userId) : null;
		Member member = null;
		if (null != data)
		{
			// Build before releasing since the release may drop the user.
			member = EntityProjections.buildMember(data, _users::getUser);
			_users.releaseReference(data.id());
			_dropIfEmpty(record);
		}
		return member;
	}

	/**
	 * @param member The new member state.
	 * @return The previous member (null if not cached) and the new member, both as rebuilt from the cache.
	 */
	public Pair<Member, Member> updateMember(Member member)
	{
		Member old = getMember(member.guildId(), member.user().id());
		setMember(member);
		return new Pair<>(old, getMember(member.guildId(), member.user().id()));
	}

	/**
	 * Removes every member of the guild, releasing their references.
	 *
	 * @param guildId The guild.
	 * @return The removed members which could be rebuilt, by user id.
	 */
	public Map<Snowflake, Member> clearMembers(Snowflake guildId)
	{
		GuildRecord record = _records.get(guildId);
		Map<Snowflake, Member> cleared = new LinkedHashMap<>();
		if (null != record)
		{
			cleared = getMembersView(guildId);
			for (MemberData data : record.members().values())
			{
				_users.releaseReference(data.id());
			}
			record.members().clear();
			_dropIfEmpty(record);
		}
		return cleared;
	}

	/**
	 * Removes everything the guild holds for one member:  voice state, member, and presence.
	 *
	 * @param guildId The guild.
	 * @param userId The member's user id.
	 * @return The removed member or null, if not cached.
	 */
	public Member removeMember(Snowflake guildId, Snowflake userId)
	{
		deleteVoiceState(guildId, userId);
		Member member = deleteMember(guildId, userId);
		deletePresence(guildId, userId);
		return member;
	}

	// ----- Voice states -----

	/**
	 * Stores the voice state and the member it carries.  The voice state holds its own reference on the user.
	 *
	 * @param voiceState The voice state.
	 */
	public void setVoiceState(VoiceState voiceState)
	{
		// The reference is added through the member's user and released through the record's user id.
		User user = voiceState.member().user();
		Assert.assertTrue(user.id().equals(voiceState.userId()));
		Assert.assertTrue(voiceState.guildId().equals(voiceState.member().guildId()));
		GuildRecord record = getOrCreateRecord(voiceState.guildId());
		setMember(voiceState.member());
		_users.addReference(user);
		VoiceStateData previous = record.voiceStates().put(user.id(), EntityProjections.toVoiceStateData(voiceState));
		if (null != previous)
		{
			_users.releaseReference(previous.userId());
		}
	}

	/**
	 * @param guildId The guild.
	 * @param userId The user.
	 * @return The user's voice state in the guild or null, if not cached (or if the member isn't cached).
	 */
	public VoiceState getVoiceState(Snowflake guildId, Snowflake userId)
	{
		GuildRecord record = _records.get(guildId);
		VoiceStateData data = (null != record) ? record.voiceStates().get(userId) : null;
		return (null != data)
				? EntityProjections.buildVoiceState(data, (Snowflake memberId) -> getMember(guildId, memberId))
				: null
		;
	}

	/**
	 * @param guildId The guild.
	 * @return Every voice state in the guild which could be rebuilt, by user id.
	 */
	public Map<Snowflake, VoiceState> getVoiceStatesView(Snowflake guildId)
	{
		GuildRecord record = _records.get(guildId);
		return (null != record)
				? _buildView(record.voiceStates(), (VoiceStateData data) -> EntityProjections.buildVoiceState(data, (Snowflake memberId) -> getMember(guildId, memberId)), "voice state")
				: new LinkedHashMap<>()
		;
	}

	/**
	 * @param guildId The guild.
	 * @param channelId The voice channel.
	 * @return Every voice state connected to the given channel, by user id.
	 */
	public Map<Snowflake, VoiceState> getVoiceStatesViewForChannel(Snowflake guildId, Snowflake channelId)
	{
		Map<Snowflake, VoiceState> view = getVoiceStatesView(guildId);
		view.values().removeIf((VoiceState state) -> !channelId.equals(state.channelIdOrNull()));
		return view;
	}

	/**
	 * Removes the voice state, releasing its reference on the user.  The member is left in place.
	 * Voice states are rebuilt through the member record, so if the member was already deleted the voice state record
	 * is still removed and its reference released, but null is returned since there is nothing to rebuild it with.
	 * This means a null return is not proof that nothing was removed.
	 *
	 * @param guildId The guild.
	 * @param userId The user.
	 * @return The removed voice state or null, if not cached or its member is no longer cached.
	 */
	public VoiceState deleteVoiceState(Snowflake guildId, Snowflake userId)
	{
		GuildRecord record = _records.get(guildId);
		VoiceStateData data = (null != record) ? record.voiceStates().remove(userId) : null;
		VoiceState voiceState = null;
		if (null != data)
		{
			voiceState = EntityProjections.buildVoiceState(data, (Snowflake memberId) -> getMember(guildId, memberId));
			_users.releaseReference(data.userId());
			_dropIfEmpty(record);
		}
		return voiceState;
	}

	/**
	 * @param voiceState The new voice state.
	 * @return The previous voice state (null if not cached) and the new one, both as rebuilt from the cache.
	 */
	public Pair<VoiceState, VoiceState> updateVoiceState(VoiceState voiceState)
	{
		VoiceState old = getVoiceState(voiceState.guildId(), voiceState.userId());
		setVoiceState(voiceState);
		return new Pair<>(old, getVoiceState(voiceState.guildId(), voiceState.userId()));
	}

	/**
	 * Removes every voice state in the guild, releasing their references.
	 *
	 * @param guildId The guild.
	 * @return The removed voice states which could be rebuilt, by user id.
	 */
	public Map<Snowflake, VoiceState> clearVoiceStates(Snowflake guildId)
	{
		GuildRecord record = _records.get(guildId);
		Map<Snowflake, VoiceState> cleared = new LinkedHashMap<>();
		if (null != record)
		{
			cleared = getVoiceStatesView(guildId);
			for (VoiceStateData data : record.voiceStates().values())
			{
				_users.releaseReference(data.userId());
			}
			record.voiceStates().clear();
			_dropIfEmpty(record);
		}
		return cleared;
	}

	// ----- Roles -----

	public void setRole(Role role)
	{
		_putIndexed(_roleIndex, GuildRecord::roles, role.guildId(), role.id(), role);
	}

	public Role getRole(Snowflake roleId)
	{
		GuildRecord record = _indexedRecord(_roleIndex, roleId);
		return (null != record)
				? record.roles().get(roleId)
				: null
		;
	}

	public Map<Snowflake, Role> getRolesView(Snowflake guildId)
	{
		GuildRecord record = _records.get(guildId);
		return (null != record)
				? new LinkedHashMap<>(record.roles())
				: new LinkedHashMap<>()
		;
	}

	public Role deleteRole(Snowflake roleId)
	{
		return _removeIndexed(_roleIndex, GuildRecord::roles, roleId);
	}

	/**
	 * @param guildId The guild expected to own the role.
	 * @param roleId The role.
	 * @return The role or null, if not cached in this guild.
	 */
	public Role getRole(Snowflake guildId, Snowflake roleId)
	{
		return guildId.equals(_roleIndex.get(roleId))
				? getRole(roleId)
				: null
		;
	}

	public Role deleteRole(Snowflake guildId, Snowflake roleId)
	{
		return guildId.equals(_roleIndex.get(roleId))
				? deleteRole(roleId)
				: null
		;
	}

	public Pair<Role, Role> updateRole(Role role)
	{
		Role old = getRole(role.id());
		setRole(role);
		return new Pair<>(old, getRole(role.id()));
	}

	public Map<Snowflake, Role> clearRoles(Snowflake guildId)
	{
		Map<Snowflake, Role> cleared = getRolesView(guildId);
		for (Snowflake roleId : cleared.keySet())
		{
			deleteRole(roleId);
		}
		return cleared;
	}

	// ----- Emojis -----

	/**
	 * Stores the emoji, adding a reference to its creator, if it has one.
	 *
	 * @param emoji The emoji.
	 */
	public void setEmoji(KnownCustomEmoji emoji)
	{
		if (null != emoji.creatorOrNull())
		{
			_users.addReference(emoji.creatorOrNull());
		}
		KnownCustomEmojiData previous = _putIndexed(_emojiIndex, GuildRecord::emojis, emoji.guildId(), emoji.id(), EntityProjections.toEmojiData(emoji));
		if ((null != previous) && (null != previous.creatorIdOrNull()))
		{
			_users.releaseReference(previous.creatorIdOrNull());
		}
	}

	public KnownCustomEmoji getEmoji(Snowflake emojiId)
	{
		GuildRecord record = _indexedRecord(_emojiIndex, emojiId);
		KnownCustomEmojiData data = (null != record) ? record.emojis().get(emojiId) : null;
		return (null != data)
				? EntityProjections.buildEmoji(data, _users::getUser)
				: null
		;
	}

	public Map<Snowflake, KnownCustomEmoji> getEmojisView(Snowflake guildId)
	{
		GuildRecord record = _records.get(guildId);
		return (null != record)
				? _buildView(record.emojis(), (KnownCustomEmojiData data) -> EntityProjections.buildEmoji(data, _users::getUser), "emoji")
				: new LinkedHashMap<>()
		;
	}

	/**
	 * Removes the emoji, releasing the reference on its creator, if it has one.
	 *
	 * @param emojiId The emoji.
	 * @return The removed emoji or null, if not cached.
	 */
	public KnownCustomEmoji deleteEmoji(Snowflake emojiId)
	{
		GuildRecord record = _indexedRecord(_emojiIndex, emojiId);
		KnownCustomEmojiData data = (null != record) ? record.emojis().get(emojiId) : null;
		KnownCustomEmoji emoji = null;
		if (null != data)
		{
			emoji = EntityProjections.buildEmoji(data, _users::getUser);
			_removeIndexed(_emojiIndex, GuildRecord::emojis, emojiId);
			if (null != data.creatorIdOrNull())
			{
				_users.releaseReference(data.creatorIdOrNull());
			}
		}
		return emoji;
	}

	public KnownCustomEmoji getEmoji(Snowflake guildId, Snowflake emojiId)
	{
		return guildId.equals(_emojiIndex.get(emojiId))
				? getEmoji(emojiId)
				: null
		;
	}

	public KnownCustomEmoji deleteEmoji(Snowflake guildId, Snowflake emojiId)
	{
		return guildId.equals(_emojiIndex.get(emojiId))
				? deleteEmoji(emojiId)
				: null
		;
	}

	public Pair<KnownCustomEmoji, KnownCustomEmoji> updateEmoji(KnownCustomEmoji emoji)
	{
		KnownCustomEmoji old = getEmoji(emoji.id());
		setEmoji(emoji);
		return new Pair<>(old, getEmoji(emoji.id()));
	}

	public Map<Snowflake, KnownCustomEmoji> clearEmojis(Snowflake guildId)
	{
		Map<Snowflake, KnownCustomEmoji> cleared = getEmojisView(guildId);
		GuildRecord record = _records.get(guildId);
		if (null != record)
		{
			for (Snowflake emojiId : new ArrayList<>(record.emojis().keySet()))
			{
				deleteEmoji(emojiId);
			}
		}
		return cleared;
	}

	/**
	 * Replaces the guild's whole emoji set.  Emojis in the new set are stored (replacing any with the same id) before
	 * the ones missing from it are removed, so a creator named by both sets keeps its reference throughout.
	 *
	 * @param guildId The guild.
	 * @param emojis The guild's complete emoji set.
	 * @return The emojis the guild had before, by id.
	 */
	public Map<Snowflake, KnownCustomEmoji> replaceEmojis(Snowflake guildId, Collection<KnownCustomEmoji> emojis)
	{
		Map<Snowflake, KnownCustomEmoji> previous = getEmojisView(guildId);
		Set<Snowflake> kept = new HashSet<>();
		for (KnownCustomEmoji emoji : emojis)
		{
			Assert.assertTrue(guildId.equals(emoji.guildId()));
			setEmoji(emoji);
			kept.add(emoji.id());
		}
		GuildRecord record = _records.get(guildId);
		if (null != record)
		{
			for (Snowflake emojiId : new ArrayList<>(record.emojis().keySet()))
			{
				if (!kept.contains(emojiId))
				{
					deleteEmoji(emojiId);
				}
			}
		}
		return previous;
	}

	// ----- Guild channels -----

	public void setGuildChannel(GuildChannel channel)
	{
		_putIndexed(_channelIndex, GuildRecord::channels, channel.guildId(), channel.id(), channel);
	}

	public GuildChannel getGuildChannel(Snowflake channelId)
	{
		GuildRecord record = _indexedRecord(_channelIndex, channelId);
		return (null != record)
				? record.channels().get(channelId)
				: null
		;
	}

	public Map<Snowflake, GuildChannel> getGuildChannelsView(Snowflake guildId)
	{
		GuildRecord record = _records.get(guildId);
		return (null != record)
				? new LinkedHashMap<>(record.channels())
				: new LinkedHashMap<>()
		;
	}

	public GuildChannel deleteGuildChannel(Snowflake channelId)
	{
		return _removeIndexed(_channelIndex, GuildRecord::channels, channelId);
	}

	public GuildChannel getGuildChannel(Snowflake guildId, Snowflake channelId)
	{
		return guildId.equals(_channelIndex.get(channelId))
				? getGuildChannel(channelId)
				: null
		;
	}

	public GuildChannel deleteGuildChannel(Snowflake guildId, Snowflake channelId)
	{
		return guildId.equals(_channelIndex.get(channelId))
				? deleteGuildChannel(channelId)
				: null
		;
	}

	public Pair<GuildChannel, GuildChannel> updateGuildChannel(GuildChannel channel)
	{
		GuildChannel old = getGuildChannel(channel.id());
		setGuildChannel(channel);
		return new Pair<>(old, getGuildChannel(channel.id()));
	}

	public Map<Snowflake, GuildChannel> clearGuildChannels(Snowflake guildId)
	{
		Map<Snowflake, GuildChannel> cleared = getGuildChannelsView(guildId);
		for (Snowflake channelId : cleared.keySet())
		{
			deleteGuildChannel(channelId);
		}
		return cleared;
	}

	// ----- Presences -----

	public void setPresence(MemberPresence presence)
	{
		getOrCreateRecord(presence.guildId()).presences().put(presence.userId(), presence);
	}

	public MemberPresence getPresence(Snowflake guildId, Snowflake userId)
	{
		GuildRecord record = _records.get(guildId);
		return (null != record)
				? record.presences().get(userId)
				: null
		;
	}

	public Map<Snowflake, MemberPresence> getPresencesView(Snowflake guildId)
	{
		GuildRecord record = _records.get(guildId);
		return (null != record)
				? new LinkedHashMap<>(record.presences())
				: new LinkedHashMap<>()
		;
	}

	public MemberPresence deletePresence(Snowflake guildId, Snowflake userId)
	{
		GuildRecord record = _records.get(guildId);
		MemberPresence presence = (null != record) ? record.presences().remove(userId) : null;
		if (null != presence)
		{
			_dropIfEmpty(record);
		}
		return presence;
	}

	public Pair<MemberPresence, MemberPresence> updatePresence(MemberPresence presence)
	{
		MemberPresence old = getPresence(presence.guildId(), presence.userId());
		setPresence(presence);
		return new Pair<>(old, getPresence(presence.guildId(), presence.userId()));
	}

	public Map<Snowflake, MemberPresence> clearPresences(Snowflake guildId)
	{
		GuildRecord record = _records.get(guildId);
		Map<Snowflake, MemberPresence> cleared = new LinkedHashMap<>();
		if (null != record)
		{
			cleared.putAll(record.presences());
			record.presences().clear();
			_dropIfEmpty(record);
		}
		return cleared;
	}


	private GatewayGuild _peekGuild(Snowflake guildId)
	{
		GuildRecord record = _records.get(guildId);
		return (null != record)
				? record.getGuild()
				: null
		;
	}

	private Map<Snowflake, GatewayGuild> _guildsView(boolean unavailable)
	{
		Map<Snowflake, GatewayGuild> view = new LinkedHashMap<>();
		for (GuildRecord record : _records.values())
		{
			boolean isUnavailable = (Availability.UNAVAILABLE == record.getAvailability());
			if ((null != record.getGuild()) && (unavailable == isUnavailable))
			{
				view.put(record.getGuildId(), record.getGuild());
			}
		}
		return view;
	}

	private void _dropIfEmpty(GuildRecord record)
	{
		if (record.isEmpty() && (Availability.UNAVAILABLE != record.getAvailability()))
		{
			_records.remove(record.getGuildId());
		}
	}

	private <D, T> Map<Snowflake, T> _buildView(Map<Snowflake, D> records, Function<D, T> builder, String kind)
	{
		Map<Snowflake, T> view = new LinkedHashMap<>();
		List<Snowflake> skipped = new ArrayList<>();
		for (Map.Entry<Snowflake, D> elt : records.entrySet())
		{
			T built = builder.apply(elt.getValue());
			if (null != built)
			{
				view.put(elt.getKey(), built);
			}
			else
			{
				skipped.add(elt.getKey());
			}
		}
		if (!skipped.isEmpty())
		{
			_logger.logVerbose("Skipped " + skipped.size() + " " + kind + " record(s) with unresolved references: " + skipped);
		}
		return view;
	}

	private GuildRecord _indexedRecord(Map<Snowflake, Snowflake> index, Snowflake id)
	{
		Snowflake guildId = index.get(id);
		return (null != guildId)
				? _records.get(guildId)
				: null
		;
	}

	private <T> T _putIndexed(Map<Snowflake, Snowflake> index, Function<GuildRecord, Map<Snowflake, T>> collection, Snowflake guildId, Snowflake id, T value)
	{
		T previous = null;
		Snowflake oldGuildId = index.get(id);
		if ((null != oldGuildId) && !oldGuildId.equals(guildId))
		{
			// The entity moved between guilds (not expected from the gateway) so treat the old one as replaced.
			previous = _removeIndexed(index, collection, id);
		}
		GuildRecord record = getOrCreateRecord(guildId);
		T replaced = collection.apply(record).put(id, value);
		if (null != replaced)
		{
			previous = replaced;
		}
		index.put(id, guildId);
		return previous;
	}

	private <T> T _removeIndexed(Map<Snowflake, Snowflake> index, Function<GuildRecord, Map<Snowflake, T>> collection, Snowflake id)
	{
		Snowflake guildId = index.remove(id);
		T removed = null;
		if (null != guildId)
		{
			GuildRecord record = _records.get(guildId);
			// The index is only ever populated alongside the record.
			Assert.assertTrue(null != record);
			removed = collection.apply(record).remove(id);
			Assert.assertTrue(null != removed);
			_dropIfEmpty(record);
		}
		return removed;
	}
}
