package com.jeffdisher.murmur.caches;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import com.jeffdisher.murmur.data.User;
import com.jeffdisher.murmur.types.Snowflake;
import com.jeffdisher.murmur.utils.Assert;
import com.jeffdisher.murmur.utils.Pair;


/**
 * The store of users, shared by everything else in the cache which names a user.
 * Users are reference-counted:  every compact record which names a user id (members, voice states, emojis with a known
 * creator, DM channels, messages) holds one reference, added when the record is stored and released when it is
 * removed, replaced, or evicted.  When a release brings a user's count to zero, the user is dropped.
 * The counts are tracked independently of the user objects since users are immutable and replaced wholesale on update.
 * NOTE:  This class is not synchronized.  It is only accessed through StatefulCache, which serializes all access.
 */
public class UserCache
{
	private final Map<Snowflake, User> _users;
	private final Map<Snowflake, Integer> _refCounts;

	/**
	 * Creates an empty cache.
	 */
	public UserCache()
	{
		_users = new LinkedHashMap<>();
		_refCounts = new HashMap<>();
	}

	/**
	 * @param userId The user to look up.
	 * @return The cached user or null, if not cached.
	 */
	public User getUser(Snowflake userId)
	{
		return _users.get(userId);
	}

	/**
	 * Adds or replaces the user.  This does not change the user's reference count.
	 * 
	 * @param user The user to store.
	 */
	public void setUser(User user)
	{
		Assert.assertTrue(null != user);
		_users.put(user.id(), user);
	}

	/**
	 * Removes the user object, whatever its reference count.  The count itself is left alone so that the eventual
	 * releases from the records naming this user still balance.
	 * 
	 * @param userId The user to remove.
	 * @return The previously cached user or null, if not cached.
	 */
	public User deleteUser(Snowflake userId)
	{
		return _users.remove(userId);
	}

	/**
	 * Replaces the user, returning the state before and after.
	 * 
	 * @param user The new user object.
	 * @return The previous user (null if not cached) and the newly cached user.
	 */
	public Pair<User, User> updateUser(User user)
	{
		User old = getUser(user.id());
		setUser(user);
		return new Pair<>(old, getUser(user.id()));
	}

	/**
	 * @return A point-in-time copy of every cached user, by id.
	 */
	public Map<Snowflake, User> getUsersView()
	{
		return new LinkedHashMap<>(_users);
	}

	/**
	 * Removes every user object.  Reference counts are retained, as with deleteUser().
	 * 
	 * @return The users which were removed, by id.
	 */
	public Map<Snowflake, User> clearUsers()
	{
		Map<Snowflake, User> cleared = new LinkedHashMap<>(_users);
		_users.clear();
		return cleared;
	}

	/**
	 * Adds a reference to the given user, storing it (replacing any older version of the same user).
	 * 
	 * @param user The user being referenced.
	 */
	public void addReference(User user)
	{
		setUser(user);
		Integer value = _refCounts.get(user.id());
		int newValue = (null != value)
				? value + 1
				: 1
		;
		_refCounts.put(user.id(), newValue);
	}

	/**
	 * Releases a reference to the given user, dropping the user if this was the last reference.
	 * 
	 * @param userId The user being released.
	 * @return True if this was the last reference and the user was dropped.
	 */
	public boolean releaseReference(Snowflake userId)
	{
		Integer value = _refCounts.get(userId);
		// A release without a matching add means the bookkeeping is broken somewhere.
		Assert.assertTrue(null != value);
		int newValue = value - 1;
		Assert.assertTrue(newValue >= 0);
		boolean didDrop = false;
		if (newValue > 0)
		{
			_refCounts.put(userId, newValue);
		}
		else
		{
			_refCounts.remove(userId);
			_users.remove(userId);
			didDrop = true;
		}
		return didDrop;
	}

	/**
	 * @param userId The user to check.
	 * @return The number of records currently referencing this user (0 if none).
	 */
	public int getReferenceCount(Snowflake userId)
	{
		Integer value = _refCounts.get(userId);
		return (null != value)
				? value
				: 0
		;
	}
}
