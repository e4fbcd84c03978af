package com.jeffdisher.murmur.types;

import org.junit.Assert;
import org.junit.Test;


public class TestSnowflake
{
	@Test
	public void testParseAndPrint() throws Throwable
	{
		Snowflake id = Snowflake.fromString("175928847299117063");
		Assert.assertEquals(175928847299117063L, id.toLong());
		Assert.assertEquals("175928847299117063", id.toString());
		Assert.assertEquals(id, Snowflake.fromLong(175928847299117063L));
		Assert.assertEquals(id.hashCode(), Snowflake.fromLong(175928847299117063L).hashCode());
	}

	@Test
	public void testUnsignedRange() throws Throwable
	{
		Snowflake max = Snowflake.fromString("18446744073709551615");
		Assert.assertEquals(-1L, max.toLong());
		Assert.assertEquals("18446744073709551615", max.toString());
		// Unsigned order means the "negative" raw value is the largest.
		Assert.assertTrue(max.compareTo(Snowflake.fromLong(Long.MAX_VALUE)) > 0);
		Assert.assertTrue(Snowflake.fromLong(1L).compareTo(max) < 0);
		Assert.assertEquals(0, max.compareTo(Snowflake.fromLong(-1L)));
	}

	@Test
	public void testInvalid() throws Throwable
	{
		Assert.assertNull(Snowflake.fromString(null));
		Assert.assertNull(Snowflake.fromString(""));
		Assert.assertNull(Snowflake.fromString("abc"));
		Assert.assertNull(Snowflake.fromString("-1"));
		Assert.assertNull(Snowflake.fromString("18446744073709551616"));
	}
}
