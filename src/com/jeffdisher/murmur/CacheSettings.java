package com.jeffdisher.murmur;

import java.util.function.Function;

import com.jeffdisher.murmur.types.UsageException;


/**
 * The tunable settings of the cache.
 */
public class CacheSettings
{
	// Messages are high-volume and usually only interesting for a short while after they are posted.
	public static final int DEFAULT_MESSAGE_CACHE_SIZE = 500;
	public static final int DEFAULT_DM_CHANNEL_CACHE_SIZE = 100;

	public static CacheSettings defaultSettings()
	{
		CacheSettings settings = new CacheSettings();
		settings.messageCacheSize = DEFAULT_MESSAGE_CACHE_SIZE;
		settings.dmChannelCacheSize = DEFAULT_DM_CHANNEL_CACHE_SIZE;
		settings.isVerbose = false;
		return settings;
	}

	/**
	 * Reads the settings from the environment, using the defaults for anything not set.
	 * 
	 * @param environment Resolves an environment variable name to its value (null if not set), normally System::getenv.
	 * @return The settings.
	 * @throws UsageException One of the variables was set to an invalid value.
	 */
	public static CacheSettings fromEnvironment(Function<String, String> environment) throws UsageException
	{
		CacheSettings settings = defaultSettings();
		settings.messageCacheSize = _readSize(environment, EnvVars.ENV_VAR_MURMUR_MESSAGE_CACHE_SIZE, settings.messageCacheSize);
		settings.dmChannelCacheSize = _readSize(environment, EnvVars.ENV_VAR_MURMUR_DM_CHANNEL_CACHE_SIZE, settings.dmChannelCacheSize);
		settings.isVerbose = (null != environment.apply(EnvVars.ENV_VAR_MURMUR_VERBOSE));
		return settings;
	}

	private static int _readSize(Function<String, String> environment, String name, int defaultValue) throws UsageException
	{
		String raw = environment.apply(name);
		int value = defaultValue;
		if (null != raw)
		{
			try
			{
				value = Integer.parseInt(raw.trim());
			}
			catch (NumberFormatException e)
			{
				throw new UsageException(name + " must be an integer: \"" + raw + "\"");
			}
			if (value < 0)
			{
				throw new UsageException(name + " cannot be negative: " + value);
			}
		}
		return value;
	}


	// These are exposed just as public fields since this is effectively a mutable struct.
	/**
	 * The capacity of the message LRU cache.
	 */
	public int messageCacheSize;

	/**
	 * The capacity of the DM channel LRU cache.
	 */
	public int dmChannelCacheSize;

	/**
	 * True if verbose log messages should be written.
	 */
	public boolean isVerbose;
}
