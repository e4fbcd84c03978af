package com.jeffdisher.murmur.caches;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.murmur.data.GatewayGuild;
import com.jeffdisher.murmur.data.GuildDefinition;
import com.jeffdisher.murmur.data.KnownCustomEmoji;
import com.jeffdisher.murmur.data.Member;
import com.jeffdisher.murmur.data.MemberPresence;
import com.jeffdisher.murmur.data.PresenceStatus;
import com.jeffdisher.murmur.data.Role;
import com.jeffdisher.murmur.data.User;
import com.jeffdisher.murmur.data.VoiceState;
import com.jeffdisher.murmur.projection.Availability;
import com.jeffdisher.murmur.testutils.MockEntities;
import com.jeffdisher.murmur.testutils.SilentLogger;
import com.jeffdisher.murmur.types.Snowflake;
import com.jeffdisher.murmur.types.UnavailableGuildException;
import com.jeffdisher.murmur.utils.Pair;


public class TestGuildCache
{
	public static final Snowflake G1 = MockEntities.G1;
	public static final Snowflake G2 = MockEntities.G2;
	public static final User U1 = MockEntities.user(1L);
	public static final User U2 = MockEntities.user(2L);

	@Test
	public void testEmpty() throws Throwable
	{
		GuildCache cache = new GuildCache(new UserCache(), new SilentLogger());
		Assert.assertNull(cache.getGuild(G1));
		Assert.assertNull(cache.getRecord(G1));
		Assert.assertNull(cache.getMember(G1, U1.id()));
		Assert.assertTrue(cache.getMembersView(G1).isEmpty());
		Assert.assertNull(cache.deleteGuild(G1));
	}

	@Test
	public void testMemberRoundTrip() throws Throwable
	{
		UserCache users = new UserCache();
		GuildCache cache = new GuildCache(users, new SilentLogger());
		Member member = new Member(U1, G1, "nick", List.of(MockEntities.id(5L), MockEntities.id(6L)), MockEntities.JOINED, null, true, false);
		cache.setMember(member);
		Assert.assertEquals(member, cache.getMember(G1, U1.id()));
		Assert.assertEquals(U1, users.getUser(U1.id()));
		Assert.assertEquals(1, users.getReferenceCount(U1.id()));
		Assert.assertEquals(Map.of(U1.id(), member), cache.getMembersView(G1));
	}

	@Test
	public void testReplaceMemberKeepsCount() throws Throwable
	{
		UserCache users = new UserCache();
		GuildCache cache = new GuildCache(users, new SilentLogger());
		cache.setMember(MockEntities.member(G1, U1));
		Member renamed = new Member(U1, G1, "other", List.of(), MockEntities.JOINED, null, false, false);
		Pair<Member, Member> update = cache.updateMember(renamed);
		Assert.assertEquals(MockEntities.member(G1, U1), update.first());
		Assert.assertEquals(renamed, update.second());
		Assert.assertEquals(1, users.getReferenceCount(U1.id()));
	}

	@Test
	public void testDeleteGuild() throws Throwable
	{
		GuildCache cache = new GuildCache(new UserCache(), new SilentLogger());
		GatewayGuild guild = MockEntities.guild(G1, "one");
		cache.setGuild(guild);
		Assert.assertEquals(guild, cache.getGuild(G1));
		Assert.assertEquals(guild, cache.deleteGuild(G1));
		Assert.assertNull(cache.getGuild(G1));
		// Nothing else was owned so the record is gone.
		Assert.assertNull(cache.getRecord(G1));
	}

	@Test
	public void testDeleteGuildKeepsOwnedData() throws Throwable
	{
		GuildCache cache = new GuildCache(new UserCache(), new SilentLogger());
		cache.setGuild(MockEntities.guild(G1, "one"));
		cache.setMember(MockEntities.member(G1, U1));
		cache.deleteGuild(G1);
		Assert.assertNull(cache.getGuild(G1));
		Assert.assertNotNull(cache.getRecord(G1));
		Assert.assertEquals(Availability.UNKNOWN, cache.getRecord(G1).getAvailability());
		Assert.assertNotNull(cache.getMember(G1, U1.id()));
		// Removing the last owned entry drops the record.
		cache.deleteMember(G1, U1.id());
		Assert.assertNull(cache.getRecord(G1));
	}

	@Test
	public void testSharedUserAcrossGuilds() throws Throwable
	{
		UserCache users = new UserCache();
		GuildCache cache = new GuildCache(users, new SilentLogger());
		cache.setMember(MockEntities.member(G1, U1));
		cache.setMember(MockEntities.member(G2, U1));
		Assert.assertEquals(2, users.getReferenceCount(U1.id()));
		Assert.assertEquals(MockEntities.member(G1, U1), cache.deleteMember(G1, U1.id()));
		Assert.assertEquals(U1, users.getUser(U1.id()));
		Assert.assertEquals(MockEntities.member(G2, U1), cache.deleteMember(G2, U1.id()));
		Assert.assertNull(users.getUser(U1.id()));
	}

	@Test
	public void testUnavailableGuilds() throws Throwable
	{
		GuildCache cache = new GuildCache(new UserCache(), new SilentLogger());
		cache.setInitialUnavailableGuilds(List.of(MockEntities.id(1L), MockEntities.id(2L), MockEntities.id(3L)));
		try
		{
			cache.getGuild(MockEntities.id(2L));
			Assert.fail();
		}
		catch (UnavailableGuildException e)
		{
			Assert.assertEquals(MockEntities.id(2L), e.getGuildId());
		}
		// No guild objects yet so neither view has them.
		Assert.assertTrue(cache.getAvailableGuildsView().isEmpty());
		Assert.assertTrue(cache.getUnavailableGuildsView().isEmpty());

		GatewayGuild guild = MockEntities.guild(MockEntities.id(2L), "two");
		cache.setGuild(guild);
		Assert.assertEquals(guild, cache.getGuild(MockEntities.id(2L)));
		Assert.assertEquals(Map.of(guild.id(), guild), cache.getAvailableGuildsView());
	}

	@Test
	public void testOutageKeepsGuild() throws Throwable
	{
		GuildCache cache = new GuildCache(new UserCache(), new SilentLogger());
		GatewayGuild guild = MockEntities.guild(G1, "one");
		cache.setGuild(guild);
		cache.setGuildAvailability(G1, false);
		Assert.assertEquals(Map.of(G1, guild), cache.getUnavailableGuildsView());
		Assert.assertTrue(cache.getAvailableGuildsView().isEmpty());
		Pair<GatewayGuild, GatewayGuild> update = cache.updateGuild(MockEntities.guild(G1, "renamed"));
		Assert.assertEquals(guild, update.first());
		Assert.assertEquals("renamed", update.second().name());
		Assert.assertEquals("renamed", cache.getGuild(G1).name());
	}

	@Test
	public void testUnavailableRecordSurvivesEmptying() throws Throwable
	{
		GuildCache cache = new GuildCache(new UserCache(), new SilentLogger());
		cache.setGuildAvailability(G1, false);
		cache.setMember(MockEntities.member(G1, U1));
		cache.deleteMember(G1, U1.id());
		Assert.assertNotNull(cache.getRecord(G1));
		Assert.assertEquals(Availability.UNAVAILABLE, cache.getRecord(G1).getAvailability());
	}

	@Test
	public void testClearGuilds() throws Throwable
	{
		GuildCache cache = new GuildCache(new UserCache(), new SilentLogger());
		cache.setGuild(MockEntities.guild(G1, "one"));
		cache.setGuild(MockEntities.guild(G2, "two"));
		cache.setMember(MockEntities.member(G1, U1));
		Map<Snowflake, GatewayGuild> cleared = cache.clearGuilds();
		Assert.assertEquals(Set.of(G1, G2), cleared.keySet());
		Assert.assertNull(cache.getGuild(G1));
		// G1 still owns a member so its record is left as a shell.
		Assert.assertNotNull(cache.getRecord(G1));
		Assert.assertNull(cache.getRecord(G2));
	}

	@Test
	public void testRolesById() throws Throwable
	{
		GuildCache cache = new GuildCache(new UserCache(), new SilentLogger());
		Role role = MockEntities.role(50L, G1);
		cache.setRole(role);
		Assert.assertEquals(role, cache.getRole(role.id()));
		Assert.assertEquals(Map.of(role.id(), role), cache.getRolesView(G1));
		Assert.assertTrue(cache.getRolesView(G2).isEmpty());
		// The guild-scoped forms only see roles of that guild.
		Assert.assertEquals(role, cache.getRole(G1, role.id()));
		Assert.assertNull(cache.getRole(G2, role.id()));
		Assert.assertNull(cache.deleteRole(G2, role.id()));
		Assert.assertEquals(role, cache.deleteRole(G1, role.id()));
		Assert.assertNull(cache.getRole(role.id()));
		Assert.assertNull(cache.getRecord(G1));
	}

	@Test
	public void testEmojiCreator() throws Throwable
	{
		UserCache users = new UserCache();
		GuildCache cache = new GuildCache(users, new SilentLogger());
		KnownCustomEmoji withCreator = MockEntities.emoji(60L, G1, U1);
		KnownCustomEmoji withoutCreator = MockEntities.emoji(61L, G1, null);
		cache.setEmoji(withCreator);
		cache.setEmoji(withoutCreator);
		Assert.assertEquals(1, users.getReferenceCount(U1.id()));
		Assert.assertEquals(withCreator, cache.getEmoji(G1, withCreator.id()));
		Assert.assertNull(cache.deleteEmoji(G2, withCreator.id()));
		Assert.assertEquals(2, cache.getEmojisView(G1).size());

		// Replacing the creator moves the reference.
		cache.updateEmoji(MockEntities.emoji(60L, G1, U2));
		Assert.assertNull(users.getUser(U1.id()));
		Assert.assertEquals(1, users.getReferenceCount(U2.id()));

		Map<Snowflake, KnownCustomEmoji> cleared = cache.clearEmojis(G1);
		Assert.assertEquals(2, cleared.size());
		Assert.assertNull(users.getUser(U2.id()));
		Assert.assertNull(cache.getRecord(G1));
	}

	@Test
	public void testVoiceStates() throws Throwable
	{
		UserCache users = new UserCache();
		GuildCache cache = new GuildCache(users, new SilentLogger());
		Snowflake channel1 = MockEntities.id(70L);
		Snowflake channel2 = MockEntities.id(71L);
		VoiceState state1 = MockEntities.voiceState(MockEntities.member(G1, U1), channel1);
		VoiceState state2 = MockEntities.voiceState(MockEntities.member(G1, U2), channel2);
		cache.setVoiceState(state1);
		cache.setVoiceState(state2);
		// The member and the voice state each hold a reference.
		Assert.assertEquals(2, users.getReferenceCount(U1.id()));
		Assert.assertEquals(state1, cache.getVoiceState(G1, U1.id()));
		Assert.assertEquals(MockEntities.member(G1, U1), cache.getMember(G1, U1.id()));
		Assert.assertEquals(Map.of(U1.id(), state1), cache.getVoiceStatesViewForChannel(G1, channel1));
		Assert.assertEquals(2, cache.getVoiceStatesView(G1).size());

		Assert.assertEquals(state1, cache.deleteVoiceState(G1, U1.id()));
		Assert.assertEquals(1, users.getReferenceCount(U1.id()));
		Assert.assertNotNull(cache.getMember(G1, U1.id()));

		Assert.assertEquals(1, cache.clearVoiceStates(G1).size());
		Assert.assertEquals(1, users.getReferenceCount(U2.id()));
	}

	@Test
	public void testVoiceStateNeedsMember() throws Throwable
	{
		UserCache users = new UserCache();
		GuildCache cache = new GuildCache(users, new SilentLogger());
		cache.setVoiceState(MockEntities.voiceState(MockEntities.member(G1, U1), MockEntities.id(70L)));
		cache.deleteMember(G1, U1.id());
		Assert.assertNull(cache.getVoiceState(G1, U1.id()));
		Assert.assertTrue(cache.getVoiceStatesView(G1).isEmpty());
		Assert.assertEquals(1, users.getReferenceCount(U1.id()));

		// The record is still removed and its reference released, even though nothing can be rebuilt.
		Assert.assertNull(cache.deleteVoiceState(G1, U1.id()));
		Assert.assertEquals(0, users.getReferenceCount(U1.id()));
		Assert.assertNull(users.getUser(U1.id()));
		Assert.assertNull(cache.getRecord(G1));
	}

	@Test(expected = AssertionError.class)
	public void testVoiceStateUserMustMatchMember() throws Throwable
	{
		GuildCache cache = new GuildCache(new UserCache(), new SilentLogger());
		Member member = MockEntities.member(G1, U1);
		cache.setVoiceState(new VoiceState(G1, MockEntities.id(70L), U2.id(), member, "session", false, false, false, false, false, false, false));
	}

	@Test
	public void testRemoveMember() throws Throwable
	{
		UserCache users = new UserCache();
		GuildCache cache = new GuildCache(users, new SilentLogger());
		Member member = MockEntities.member(G1, U1);
		cache.setVoiceState(MockEntities.voiceState(member, MockEntities.id(70L)));
		cache.setPresence(MockEntities.presence(G1, 1L, PresenceStatus.ONLINE));
		Assert.assertEquals(member, cache.removeMember(G1, U1.id()));
		Assert.assertNull(cache.getPresence(G1, U1.id()));
		Assert.assertNull(users.getUser(U1.id()));
		Assert.assertNull(cache.getRecord(G1));
		Assert.assertNull(cache.removeMember(G1, U1.id()));
	}

	@Test
	public void testReplaceGuild() throws Throwable
	{
		UserCache users = new UserCache();
		GuildCache cache = new GuildCache(users, new SilentLogger());
		GatewayGuild old = MockEntities.guild(G1, "old");
		cache.setGuild(old);
		cache.setRole(MockEntities.role(50L, G1));
		cache.setEmoji(MockEntities.emoji(60L, G1, U2));
		cache.setMember(MockEntities.member(G1, U1));
		cache.setGuildAvailability(G1, false);

		Member member = MockEntities.member(G1, U1);
		GuildDefinition definition = new GuildDefinition(MockEntities.guild(G1, "new")
				, List.of(MockEntities.role(51L, G1))
				, List.of()
				, List.of(member)
				, List.of(MockEntities.textChannel(80L, G1))
				, List.of(MockEntities.presence(G1, 1L, PresenceStatus.ONLINE))
				, List.of(MockEntities.voiceState(member, MockEntities.id(70L)))
		);
		Assert.assertEquals(old, cache.replaceGuild(definition));
		Assert.assertEquals("new", cache.getGuild(G1).name());
		Assert.assertNull(cache.getRole(MockEntities.id(50L)));
		Assert.assertNotNull(cache.getRole(MockEntities.id(51L)));
		Assert.assertNull(cache.getEmoji(MockEntities.id(60L)));
		Assert.assertNull(users.getUser(U2.id()));
		// Member and voice state, counted once each.
		Assert.assertEquals(2, users.getReferenceCount(U1.id()));
		Assert.assertNotNull(cache.getVoiceState(G1, U1.id()));
		Assert.assertNotNull(cache.getGuildChannel(G1, MockEntities.id(80L)));
	}

	@Test
	public void testUpdateGuildAndRoles() throws Throwable
	{
		GuildCache cache = new GuildCache(new UserCache(), new SilentLogger());
		cache.setGuild(MockEntities.guild(G1, "old"));
		cache.setRole(MockEntities.role(50L, G1));
		Pair<GatewayGuild, GatewayGuild> update = cache.updateGuildAndRoles(MockEntities.guild(G1, "new"), List.of(MockEntities.role(51L, G1)));
		Assert.assertEquals("old", update.first().name());
		Assert.assertEquals("new", update.second().name());
		Assert.assertEquals(Set.of(MockEntities.id(50L), MockEntities.id(51L)), cache.getRolesView(G1).keySet());
	}

	@Test
	public void testReplaceEmojis() throws Throwable
	{
		UserCache users = new UserCache();
		GuildCache cache = new GuildCache(users, new SilentLogger());
		cache.setEmoji(MockEntities.emoji(60L, G1, U2));
		cache.setEmoji(MockEntities.emoji(61L, G1, U1));

		Map<Snowflake, KnownCustomEmoji> previous = cache.replaceEmojis(G1, List.of(MockEntities.emoji(60L, G1, U2), MockEntities.emoji(62L, G1, null)));
		Assert.assertEquals(Set.of(MockEntities.id(60L), MockEntities.id(61L)), previous.keySet());
		Assert.assertEquals(Set.of(MockEntities.id(60L), MockEntities.id(62L)), cache.getEmojisView(G1).keySet());
		// The creator named by both sets is still counted once.
		Assert.assertEquals(U2, users.getUser(U2.id()));
		Assert.assertEquals(1, users.getReferenceCount(U2.id()));
		Assert.assertNull(users.getUser(U1.id()));

		Assert.assertEquals(2, cache.replaceEmojis(G1, List.of()).size());
		Assert.assertNull(users.getUser(U2.id()));
		Assert.assertNull(cache.getRecord(G1));
	}

	@Test
	public void testDanglingMemberSkipped() throws Throwable
	{
		UserCache users = new UserCache();
		SilentLogger logger = new SilentLogger();
		GuildCache cache = new GuildCache(users, logger);
		cache.setMember(MockEntities.member(G1, U1));
		cache.setMember(MockEntities.member(G1, U2));
		users.deleteUser(U1.id());
		Assert.assertNull(cache.getMember(G1, U1.id()));
		Assert.assertEquals(Set.of(U2.id()), cache.getMembersView(G1).keySet());
		Assert.assertFalse(logger.didErrorOccur());
	}

	@Test
	public void testChannelsAndPresences() throws Throwable
	{
		GuildCache cache = new GuildCache(new UserCache(), new SilentLogger());
		cache.setGuildChannel(MockEntities.textChannel(80L, G1));
		cache.setPresence(MockEntities.presence(G1, 1L, PresenceStatus.ONLINE));
		Assert.assertEquals(G1, cache.getGuildChannel(MockEntities.id(80L)).guildId());
		Assert.assertNull(cache.getGuildChannel(G2, MockEntities.id(80L)));
		Assert.assertNotNull(cache.getGuildChannel(G1, MockEntities.id(80L)));
		Pair<MemberPresence, MemberPresence> update = cache.updatePresence(MockEntities.presence(G1, 1L, PresenceStatus.IDLE));
		Assert.assertEquals(PresenceStatus.ONLINE, update.first().visibleStatus());
		Assert.assertEquals(PresenceStatus.IDLE, cache.getPresence(G1, MockEntities.id(1L)).visibleStatus());
		Assert.assertEquals(1, cache.clearGuildChannels(G1).size());
		Assert.assertNotNull(cache.deletePresence(G1, MockEntities.id(1L)));
		Assert.assertNull(cache.getRecord(G1));
	}

	@Test
	public void testClearGuildRecord() throws Throwable
	{
		UserCache users = new UserCache();
		GuildCache cache = new GuildCache(users, new SilentLogger());
		GatewayGuild guild = MockEntities.guild(G1, "one");
		cache.setGuild(guild);
		cache.setRole(MockEntities.role(50L, G1));
		cache.setEmoji(MockEntities.emoji(60L, G1, U2));
		cache.setGuildChannel(MockEntities.textChannel(80L, G1));
		cache.setPresence(MockEntities.presence(G1, 1L, PresenceStatus.ONLINE));
		cache.setVoiceState(MockEntities.voiceState(MockEntities.member(G1, U1), MockEntities.id(70L)));
		// Something outside the guild keeps U2 alive.
		users.addReference(U2);

		Assert.assertEquals(guild, cache.clearGuildRecord(G1));
		Assert.assertNull(cache.getRecord(G1));
		Assert.assertNull(cache.getRole(MockEntities.id(50L)));
		Assert.assertNull(cache.getEmoji(MockEntities.id(60L)));
		Assert.assertNull(cache.getGuildChannel(MockEntities.id(80L)));
		Assert.assertNull(users.getUser(U1.id()));
		Assert.assertEquals(1, users.getReferenceCount(U2.id()));
		Assert.assertNull(cache.clearGuildRecord(G1));
	}
}
