package com.jeffdisher.murmur.caches;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;


public class TestLruCache
{
	@Test
	public void testEvictsLeastRecentlyUsed() throws Throwable
	{
		List<String> evicted = new ArrayList<>();
		LruCache<String, Integer> cache = new LruCache<>(3);
		for (int i = 0; i < 4; ++i)
		{
			cache.put("k" + i, i, (String key, Integer value) -> evicted.add(key));
		}
		Assert.assertEquals(3, cache.size());
		Assert.assertEquals(List.of("k0"), evicted);
		Assert.assertFalse(cache.snapshot().containsKey("k0"));
		Assert.assertEquals(Integer.valueOf(3), cache.get("k3"));
	}

	@Test
	public void testGetTouches() throws Throwable
	{
		List<String> evicted = new ArrayList<>();
		LruCache<String, Integer> cache = new LruCache<>(2);
		cache.put("a", 1, (String key, Integer value) -> evicted.add(key));
		cache.put("b", 2, (String key, Integer value) -> evicted.add(key));
		Assert.assertEquals(Integer.valueOf(1), cache.get("a"));
		cache.put("c", 3, (String key, Integer value) -> evicted.add(key));
		Assert.assertEquals(List.of("b"), evicted);
		Assert.assertEquals(List.of("a", "c"), new ArrayList<>(cache.snapshot().keySet()));
	}

	@Test
	public void testSnapshotDoesNotTouch() throws Throwable
	{
		List<String> evicted = new ArrayList<>();
		LruCache<String, Integer> cache = new LruCache<>(2);
		cache.put("a", 1, (String key, Integer value) -> evicted.add(key));
		cache.put("b", 2, (String key, Integer value) -> evicted.add(key));
		Assert.assertTrue(cache.snapshot().containsKey("a"));
		cache.put("c", 3, (String key, Integer value) -> evicted.add(key));
		Assert.assertEquals(List.of("a"), evicted);
	}

	@Test
	public void testReplaceDoesNotEvict() throws Throwable
	{
		List<String> evicted = new ArrayList<>();
		LruCache<String, Integer> cache = new LruCache<>(2);
		cache.put("a", 1, (String key, Integer value) -> evicted.add(key));
		cache.put("b", 2, (String key, Integer value) -> evicted.add(key));
		Integer previous = cache.put("a", 10, (String key, Integer value) -> evicted.add(key));
		Assert.assertEquals(Integer.valueOf(1), previous);
		Assert.assertTrue(evicted.isEmpty());
		Assert.assertEquals(2, cache.size());
		// "a" is now the most recent.
		Assert.assertEquals(List.of("b", "a"), new ArrayList<>(cache.snapshot().keySet()));
	}

	@Test
	public void testRemoveAndClear() throws Throwable
	{
		LruCache<String, Integer> cache = new LruCache<>(5);
		cache.put("a", 1, (String key, Integer value) -> Assert.fail());
		cache.put("b", 2, (String key, Integer value) -> Assert.fail());
		cache.put("c", 3, (String key, Integer value) -> Assert.fail());
		Assert.assertEquals(Integer.valueOf(2), cache.remove("b"));
		Assert.assertNull(cache.remove("b"));
		Map<String, Integer> cleared = cache.clear();
		Assert.assertEquals(List.of("a", "c"), new ArrayList<>(cleared.keySet()));
		Assert.assertEquals(0, cache.size());
	}

	@Test
	public void testReplaceKeepsOrder() throws Throwable
	{
		List<String> evicted = new ArrayList<>();
		LruCache<String, Integer> cache = new LruCache<>(2);
		cache.put("a", 1, (String key, Integer value) -> evicted.add(key));
		cache.put("b", 2, (String key, Integer value) -> evicted.add(key));
		Assert.assertEquals(Integer.valueOf(1), cache.replace("a", 10));
		Assert.assertNull(cache.replace("z", 26));
		Assert.assertEquals(List.of("a", "b"), new ArrayList<>(cache.snapshot().keySet()));
		cache.put("c", 3, (String key, Integer value) -> evicted.add(key));
		// "a" was still the least recently used.
		Assert.assertEquals(List.of("a"), evicted);
		Assert.assertEquals(2, cache.size());
	}

	@Test
	public void testZeroCapacity() throws Throwable
	{
		List<String> evicted = new ArrayList<>();
		LruCache<String, Integer> cache = new LruCache<>(0);
		cache.put("a", 1, (String key, Integer value) -> evicted.add(key));
		Assert.assertEquals(0, cache.size());
		Assert.assertEquals(List.of("a"), evicted);
	}
}
