package com.jeffdisher.murmur.caches;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

import com.jeffdisher.murmur.utils.Assert;


/**
 * A fixed-capacity map which evicts its least recently used entry when a new key would take it over capacity.
 * Both put() and get() calls count as a use, while replace() and snapshot() do not change the order.
 * Eviction is reported to a callback passed into put(), since evicted values may hold references which the caller must
 * release.
 * NOTE:  This class is not synchronized.
 * 
 * @param <K> The key type.
 * @param <V> The value type.
 */
public class LruCache<K, V>
{
	// Iteration order of an access-ordered LinkedHashMap is least to most recently used.
	private final LinkedHashMap<K, V> _map;
	private final int _capacity;

	/**
	 * Creates an empty cache.
	 * 
	 * @param capacity The maximum number of entries (must not be negative).
	 */
	public LruCache(int capacity)
	{
		Assert.assertTrue(capacity >= 0);
		_map = new LinkedHashMap<>(16, 0.75f, true);
		_capacity = capacity;
	}

	/**
	 * @return The number of entries currently held.
	 */
	public int size()
	{
		return _map.size();
	}

	/**
	 * Reads the value for the given key, marking it as most recently used.
	 * 
	 * @param key The key to look up.
	 * @return The value or null, if not present.
	 */
	public V get(K key)
	{
		return _map.get(key);
	}

	/**
	 * Stores the value as the most recently used entry.  If the key is new and the cache is full, the least recently used
	 * entries are removed and passed to the eviction callback before this returns.
	 * Replacing the value of an existing key never evicts anything.
	 * 
	 * @param key The key.
	 * @param value The value.
	 * @param evicted Called with each entry evicted to make room.
	 * @return The previous value of this key or null, if it was new.
	 */
	public V put(K key, V value, BiConsumer<K, V> evicted)
	{
		V previous = _map.put(key, value);
		Iterator<Map.Entry<K, V>> iterator = _map.entrySet().iterator();
		while (_map.size() > _capacity)
		{
			Map.Entry<K, V> eldest = iterator.next();
			iterator.remove();
			evicted.accept(eldest.getKey(), eldest.getValue());
		}
		return previous;
	}

	/**
	 * Replaces the value of a key which is already present, leaving its position in the usage order alone.
	 *
	 * @param key The key.
	 * @param value The new value.
	 * @return The previous value or null, if the key wasn't present (in which case nothing is stored).
	 */
	public V replace(K key, V value)
	{
		// Map.replace() counts as an access in an access-ordered map but Entry.setValue() does not.
		V previous = null;
		for (Map.Entry<K, V> elt : _map.entrySet())
		{
			if (elt.getKey().equals(key))
			{
				previous = elt.setValue(value);
				break;
			}
		}
		return previous;
	}

	/**
	 * @param key The key to remove.
	 * @return The removed value or null, if not present.
	 */
	public V remove(K key)
	{
		return _map.remove(key);
	}

	/**
	 * @return A copy of the entries, from least to most recently used (does not change the usage order).
	 */
	public Map<K, V> snapshot()
	{
		return new LinkedHashMap<>(_map);
	}

	/**
	 * Removes every entry.
	 * 
	 * @return The removed entries, from least to most recently used.
	 */
	public Map<K, V> clear()
	{
		Map<K, V> removed = new LinkedHashMap<>(_map);
		_map.clear();
		return removed;
	}
}
