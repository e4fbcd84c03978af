package com.jeffdisher.murmur.projection;


/**
 * The availability of a guild record.  Records created only to hold owned data before the guild arrives start as
 * UNKNOWN.
 */
public enum Availability
{
	UNKNOWN,
	AVAILABLE,
	UNAVAILABLE,
}
