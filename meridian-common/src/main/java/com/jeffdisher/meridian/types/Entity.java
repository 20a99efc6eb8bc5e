package com.jeffdisher.meridian.types;


/**
 * An immutable snapshot of an entity as seen by the dimension indexes.  The simulation publishes changes by
 * re-adding a new snapshot with the same id.
 * 
 * @param id The process-unique id.
 * @param kind The kind of entity.
 * @param location The base location of the entity.
 * @param sleeping True if the entity is in a bed (only meaningful for players).
 */
public record Entity(int id
		, EntityKind kind
		, EntityLocation location
		, boolean sleeping
)
{
	public boolean isPlayer()
	{
		return EntityKind.PLAYER == this.kind;
	}

	public Entity withLocation(EntityLocation newLocation)
	{
		return new Entity(this.id, this.kind, newLocation, this.sleeping);
	}

	public Entity withSleeping(boolean isSleeping)
	{
		return new Entity(this.id, this.kind, this.location, isSleeping);
	}
}
