package com.jeffdisher.murmur;


/**
 * Just contains the environment variables the system checks.
 */
public class EnvVars
{
	/**
	 * The maximum number of messages kept in the message cache.  Defaults to 500 if not set.  0 disables message
	 * caching.
	 */
	public static final String ENV_VAR_MURMUR_MESSAGE_CACHE_SIZE = "MURMUR_MESSAGE_CACHE_SIZE";

	/**
	 * The maximum number of DM channels kept in the DM channel cache.  Defaults to 100 if not set.
	 */
	public static final String ENV_VAR_MURMUR_DM_CHANNEL_CACHE_SIZE = "MURMUR_DM_CHANNEL_CACHE_SIZE";

	/**
	 * Enables verbose console logging (evictions, skipped records, every handled event).  If not set, verbose logs will
	 * not be written to the console.
	 */
	public static final String ENV_VAR_MURMUR_VERBOSE = "MURMUR_VERBOSE";
}
