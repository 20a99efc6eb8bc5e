package com.jeffdisher.meridian.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import com.jeffdisher.meridian.data.Chunk;
import com.jeffdisher.meridian.types.ChunkAddress;
import com.jeffdisher.meridian.types.Entity;


/**
 * The entities of a dimension, by id, and their membership in resident chunks.
 * Every mutation also updates the player index in the same call:  an entity of kind PLAYER is in the player index if
 * and only if it is in this index.
 * Removing an entity never finalizes it:  it may simply be moving to another dimension.
 * The chunk of every entity is tracked even when that chunk isn't resident so that membership can be rebuilt when it
 * is loaded.
 */
public class EntityIndex
{
	private final ChunkIndex _chunks;
	private final PlayerIndex _players;
	private final Consumer<Entity> _playerRemovedListener;
	private final Map<Integer, Entity> _entities;
	private final Map<Long, Set<Integer>> _idsByChunk;

	/**
	 * @param chunks The chunk index used for chunk membership.
	 * @param playerRemovedListener Called after a player has left this index (or stopped being a player).
	 */
	public EntityIndex(ChunkIndex chunks, Consumer<Entity> playerRemovedListener)
	{
		_chunks = chunks;
		_players = new PlayerIndex();
		_playerRemovedListener = playerRemovedListener;
		_entities = new LinkedHashMap<>();
		_idsByChunk = new HashMap<>();
		_chunks.addResidentListener((Chunk chunk) -> _chunkBecameResident(chunk));
	}

	public PlayerIndex getPlayerIndex()
	{
		return _players;
	}

	/**
	 * Adds an entity, replacing any existing entity with the same id.  A replaced entity's chunk membership moves
	 * to the chunk of the new snapshot.
	 * 
	 * @param entity The entity to add.
	 */
	public void add(Entity entity)
	{
		Entity previous = _entities.put(entity.id(), entity);
		if (null != previous)
		{
			_detachFromChunk(previous);
		}
		_attachToChunk(entity);
		
		if (entity.isPlayer())
		{
			_players.put(entity);
		}
		else if ((null != previous) && previous.isPlayer())
		{
			_players.remove(entity.id());
			_playerRemovedListener.accept(previous);
		}
	}

	/**
	 * Removes the entity with the given id.
	 * 
	 * @param entityId The id to remove.
	 * @return The removed entity, or null if there was none.
	 */
	public Entity remove(int entityId)
	{
		Entity removed = _entities.remove(entityId);
		if (null != removed)
		{
			_detachFromChunk(removed);
			if (removed.isPlayer())
			{
				_players.remove(entityId);
				_playerRemovedListener.accept(removed);
			}
		}
		return removed;
	}

	public Entity get(int entityId)
	{
		return _entities.get(entityId);
	}

	public boolean contains(int entityId)
	{
		return _entities.containsKey(entityId);
	}

	public Collection<Entity> getAll()
	{
		return Collections.unmodifiableList(new ArrayList<>(_entities.values()));
	}

	public int size()
	{
		return _entities.size();
	}

	/**
	 * Returns the entities in the given chunk.  Only resident chunks are consulted.
	 * 
	 * @param chunkX The chunk x.
	 * @param chunkZ The chunk z.
	 * @return The entities (empty if the chunk isn't resident).
	 */
	public List<Entity> byChunk(int chunkX, int chunkZ)
	{
		Chunk chunk = _chunks.getIfResident(chunkX, chunkZ);
		return (null != chunk)
				? chunk.getEntities()
				: List.of()
		;
	}


	private void _chunkBecameResident(Chunk chunk)
	{
		Set<Integer> ids = _idsByChunk.get(chunk.getAddress().key());
		if (null != ids)
		{
			for (int id : ids)
			{
				chunk.addEntity(_entities.get(id));
			}
		}
	}

	private void _attachToChunk(Entity entity)
	{
		ChunkAddress address = entity.location().getChunkAddress();
		_idsByChunk.computeIfAbsent(address.key(), (Long key) -> new LinkedHashSet<>()).add(entity.id());
		Chunk chunk = _chunks.getIfResident(address.x(), address.z());
		if (null != chunk)
		{
			chunk.addEntity(entity);
		}
	}

	private void _detachFromChunk(Entity entity)
	{
		ChunkAddress address = entity.location().getChunkAddress();
		long key = address.key();
		Set<Integer> ids = _idsByChunk.get(key);
		ids.remove(entity.id());
		if (ids.isEmpty())
		{
			_idsByChunk.remove(key);
		}
		Chunk chunk = _chunks.getIfResident(address.x(), address.z());
		if (null != chunk)
		{
			chunk.removeEntity(entity.id());
		}
	}
}
