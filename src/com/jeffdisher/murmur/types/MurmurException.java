package com.jeffdisher.murmur.types;


/**
 * Superclass of all Murmur's internal exceptions.
 */
public class MurmurException extends Exception
{
	private static final long serialVersionUID = 1L;

	public MurmurException(String message)
	{
		super(message);
	}

	public MurmurException(String message, Exception exception)
	{
		super(message, exception);
	}
}
