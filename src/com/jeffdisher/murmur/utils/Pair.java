package com.jeffdisher.murmur.utils;


/**
 * We often need short-lived pairs of objects so this type is provided as a basic utility.
 * The update operations of the caches use this to return the before and after state of an entity.
 * 
 * @param <A> The first element type.
 * @param <B> The second element type.
 */
public record Pair<A, B>(A first, B second)
{
}
