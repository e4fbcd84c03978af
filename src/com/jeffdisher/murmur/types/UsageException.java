package com.jeffdisher.murmur.types;


/**
 * This exception type is used when the cache has been configured with invalid settings (typically, from the
 * environment).
 */
public class UsageException extends MurmurException
{
	private static final long serialVersionUID = 1L;

	public UsageException(String message)
	{
		super(message);
	}
}
