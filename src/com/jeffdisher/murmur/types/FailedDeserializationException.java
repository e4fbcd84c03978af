package com.jeffdisher.murmur.types;


/**
 * This exception is used in the case where a gateway payload couldn't be decoded since it appeared to be malformed.
 * This typically means a required field was missing or had the wrong JSON type.
 */
public class FailedDeserializationException extends MurmurException
{
	private static final long serialVersionUID = 1L;

	public FailedDeserializationException(Class<?> expectedType)
	{
		super("Data could not be deserialized as " + expectedType.getName());
	}

	public FailedDeserializationException(Class<?> expectedType, Exception cause)
	{
		super("Data could not be deserialized as " + expectedType.getName(), cause);
	}
}
