package com.jeffdisher.meridian.types;


/**
 * The broad kinds of entity a dimension tracks.  Only PLAYER has special handling in the indexes.
 */
public enum EntityKind
{
	PLAYER,
	CREATURE,
	ITEM,
	PROJECTILE,
}
