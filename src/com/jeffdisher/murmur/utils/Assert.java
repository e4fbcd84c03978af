package com.jeffdisher.murmur.utils;


/**
 * Utility class to make common assertion statement idioms more meaningful (and not something which can be disabled).
 */
public class Assert
{
	/**
	 * A traditional assertion:  States that something must be true, failing if it isn't.
	 * 
	 * @param flag The statement which must be true.
	 */
	public static void assertTrue(boolean flag)
	{
		if (!flag)
		{
			throw new AssertionError("Expected true");
		}
	}
}
