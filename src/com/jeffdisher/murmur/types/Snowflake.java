package com.jeffdisher.murmur.types;


/**
 * The unsigned 64-bit identifier the gateway uses for every entity.
 * The gateway sends these as decimal strings since they can exceed the signed range, so the raw long held here must
 * always be interpreted as unsigned (for printing, parsing, and ordering).
 */
public final class Snowflake implements Comparable<Snowflake>
{
	/**
	 * @param decimal The unsigned decimal encoding of the id.
	 * @return The Snowflake or null if the encoding was invalid.
	 */
	public static Snowflake fromString(String decimal)
	{
		Snowflake id = null;
		if (null != decimal)
		{
			try
			{
				id = new Snowflake(Long.parseUnsignedLong(decimal));
			}
			catch (NumberFormatException e)
			{
				// Not a valid unsigned decimal - treat as invalid.
				id = null;
			}
		}
		return id;
	}

	/**
	 * @param raw The raw bits of the id.
	 * @return The Snowflake wrapping these bits.
	 */
	public static Snowflake fromLong(long raw)
	{
		return new Snowflake(raw);
	}


	private final long _raw;

	private Snowflake(long raw)
	{
		_raw = raw;
	}

	/**
	 * @return The raw bits of the id (negative values are ids above Long.MAX_VALUE).
	 */
	public long toLong()
	{
		return _raw;
	}

	@Override
	public int compareTo(Snowflake other)
	{
		return Long.compareUnsigned(_raw, other._raw);
	}

	@Override
	public boolean equals(Object obj)
	{
		boolean isEqual = false;
		if (obj instanceof Snowflake)
		{
			isEqual = (_raw == ((Snowflake)obj)._raw);
		}
		return isEqual;
	}

	@Override
	public int hashCode()
	{
		return Long.hashCode(_raw);
	}

	@Override
	public String toString()
	{
		return Long.toUnsignedString(_raw);
	}
}
