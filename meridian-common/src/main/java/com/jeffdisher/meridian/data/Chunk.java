package com.jeffdisher.meridian.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.jeffdisher.meridian.types.AbsoluteLocation;
import com.jeffdisher.meridian.types.ChunkAddress;
import com.jeffdisher.meridian.types.Entity;
import com.jeffdisher.meridian.types.Tile;
import com.jeffdisher.meridian.utils.Encoding;


/**
 * The loaded state of one chunk column which the dimension indexes care about:  the entities standing in it and the
 * tiles placed in it.  Terrain is owned by the chunk store and the protocol codec, so it is carried as an opaque
 * payload.
 * Instances are mutable and NOT thread-safe:  they are only touched from the tick thread which owns the dimension.
 */
public class Chunk
{
	private final ChunkAddress _address;
	private final byte[] _terrain;
	private final Map<Integer, Entity> _entities;
	private final Map<Integer, Tile> _tilesById;
	private final Map<AbsoluteLocation, Tile> _tilesByLocation;

	public Chunk(ChunkAddress address, byte[] terrain)
	{
		_address = address;
		_terrain = terrain;
		// Linked maps so that iteration order follows insertion order.
		_entities = new LinkedHashMap<>();
		_tilesById = new LinkedHashMap<>();
		_tilesByLocation = new HashMap<>();
	}

	public ChunkAddress getAddress()
	{
		return _address;
	}

	public byte[] getTerrain()
	{
		return _terrain;
	}

	/**
	 * Adds or replaces (by id) an entity in this chunk.
	 * 
	 * @param entity The entity (must be located within this chunk).
	 */
	public void addEntity(Entity entity)
	{
		if (!_address.equals(entity.location().getChunkAddress()))
		{
			throw new IllegalArgumentException("Entity " + entity.id() + " is not in chunk " + _address);
		}
		_entities.put(entity.id(), entity);
	}

	public boolean removeEntity(int entityId)
	{
		return (null != _entities.remove(entityId));
	}

	public List<Entity> getEntities()
	{
		return Collections.unmodifiableList(new ArrayList<>(_entities.values()));
	}

	/**
	 * Adds or replaces a tile in this chunk.  A block holds at most one tile so a different tile already at the same
	 * location is displaced.
	 * 
	 * @param tile The tile (must be located within this chunk).
	 * @return The tile displaced from the same location (null if there wasn't one or it had the same id).
	 */
	public Tile addTile(Tile tile)
	{
		if (!_address.equals(tile.location().getChunkAddress()))
		{
			throw new IllegalArgumentException("Tile " + tile.id() + " is not in chunk " + _address);
		}
		Tile previousById = _tilesById.put(tile.id(), tile);
		if (null != previousById)
		{
			_tilesByLocation.remove(previousById.location());
		}
		Tile displaced = _tilesByLocation.put(tile.location(), tile);
		if ((null != displaced) && (displaced.id() != tile.id()))
		{
			_tilesById.remove(displaced.id());
		}
		else
		{
			displaced = null;
		}
		return displaced;
	}

	public boolean removeTile(int tileId)
	{
		Tile removed = _tilesById.remove(tileId);
		if (null != removed)
		{
			_tilesByLocation.remove(removed.location());
		}
		return (null != removed);
	}

	/**
	 * Looks up a tile by its position relative to this chunk.
	 * 
	 * @param localX The x within the chunk [0..15].
	 * @param y The absolute y.
	 * @param localZ The z within the chunk [0..15].
	 * @return The tile at that block, or null.
	 */
	public Tile getTile(int localX, int y, int localZ)
	{
		int baseX = _address.x() << Encoding.CHUNK_SHIFT;
		int baseZ = _address.z() << Encoding.CHUNK_SHIFT;
		AbsoluteLocation location = new AbsoluteLocation(baseX + (localX & Encoding.LOCAL_MASK), y, baseZ + (localZ & Encoding.LOCAL_MASK));
		return _tilesByLocation.get(location);
	}

	public List<Tile> getTiles()
	{
		return Collections.unmodifiableList(new ArrayList<>(_tilesById.values()));
	}

	/**
	 * Drops every entity and tile from this chunk, leaving only its terrain.  Membership is rebuilt from the
	 * dimension's indexes whenever the chunk becomes resident.
	 */
	public void clearMembership()
	{
		_entities.clear();
		_tilesById.clear();
		_tilesByLocation.clear();
	}
}
