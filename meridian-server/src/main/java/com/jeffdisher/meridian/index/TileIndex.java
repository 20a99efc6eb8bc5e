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

import com.jeffdisher.meridian.broadcast.PacketBroadcastQueue;
import com.jeffdisher.meridian.data.Chunk;
import com.jeffdisher.meridian.types.AbsoluteLocation;
import com.jeffdisher.meridian.types.ChunkAddress;
import com.jeffdisher.meridian.types.Tile;


/**
 * The tiles of a dimension, by id, and their membership in resident chunks.
 * Any change to the tiles of a chunk drops that chunk's compiled packet, in the same call.
 * A block holds at most one tile:  adding a tile where a different one sits removes the old one.
 * As with entities, the chunk of every tile is tracked even when that chunk isn't resident.
 */
public class TileIndex
{
	private final ChunkIndex _chunks;
	private final PacketBroadcastQueue _packets;
	private final Map<Integer, Tile> _tiles;
	private final Map<AbsoluteLocation, Integer> _idsByLocation;
	private final Map<Long, Set<Integer>> _idsByChunk;

	public TileIndex(ChunkIndex chunks, PacketBroadcastQueue packets)
	{
		_chunks = chunks;
		_packets = packets;
		_tiles = new LinkedHashMap<>();
		_idsByLocation = new HashMap<>();
		_idsByChunk = new HashMap<>();
		_chunks.addResidentListener((Chunk chunk) -> _chunkBecameResident(chunk));
	}

	/**
	 * Adds a tile, replacing any existing tile with the same id or at the same location.
	 * 
	 * @param tile The tile to add.
	 */
	public void add(Tile tile)
	{
		Integer displacedId = _idsByLocation.get(tile.location());
		if ((null != displacedId) && (displacedId != tile.id()))
		{
			remove(displacedId);
		}
		Tile previous = _tiles.put(tile.id(), tile);
		if (null != previous)
		{
			_idsByLocation.remove(previous.location());
			_detachFromChunk(previous);
		}
		_idsByLocation.put(tile.location(), tile.id());
		ChunkAddress address = tile.location().getChunkAddress();
		_idsByChunk.computeIfAbsent(address.key(), (Long key) -> new LinkedHashSet<>()).add(tile.id());
		Chunk chunk = _chunks.getIfResident(address.x(), address.z());
		if (null != chunk)
		{
			chunk.addTile(tile);
		}
		_packets.invalidate(address.x(), address.z());
	}

	/**
	 * Removes the tile with the given id.
	 * 
	 * @param tileId The id to remove.
	 * @return The removed tile, or null if there was none.
	 */
	public Tile remove(int tileId)
	{
		Tile removed = _tiles.remove(tileId);
		if (null != removed)
		{
			_idsByLocation.remove(removed.location());
			_detachFromChunk(removed);
		}
		return removed;
	}

	public Tile get(int tileId)
	{
		return _tiles.get(tileId);
	}

	public Collection<Tile> getAll()
	{
		return Collections.unmodifiableList(new ArrayList<>(_tiles.values()));
	}

	public int size()
	{
		return _tiles.size();
	}

	/**
	 * Finds the tile at a block through its resident chunk.
	 * 
	 * @param location The block location.
	 * @return The tile, or null if there is none or the chunk isn't resident.
	 */
	public Tile getTileAt(AbsoluteLocation location)
	{
		ChunkAddress address = location.getChunkAddress();
		Chunk chunk = _chunks.getIfResident(address.x(), address.z());
		return (null != chunk)
				? chunk.getTile(location.getLocalX(), location.y(), location.getLocalZ())
				: null
		;
	}

	/**
	 * Returns the tiles in the given chunk.  Only resident chunks are consulted.
	 * 
	 * @param chunkX The chunk x.
	 * @param chunkZ The chunk z.
	 * @return The tiles (empty if the chunk isn't resident).
	 */
	public List<Tile> byChunk(int chunkX, int chunkZ)
	{
		Chunk chunk = _chunks.getIfResident(chunkX, chunkZ);
		return (null != chunk)
				? chunk.getTiles()
				: List.of()
		;
	}


	private void _chunkBecameResident(Chunk chunk)
	{
		ChunkAddress address = chunk.getAddress();
		Set<Integer> ids = _idsByChunk.get(address.key());
		if (null != ids)
		{
			for (int id : ids)
			{
				chunk.addTile(_tiles.get(id));
			}
		}
		_packets.invalidate(address.x(), address.z());
	}

	private void _detachFromChunk(Tile tile)
	{
		ChunkAddress address = tile.location().getChunkAddress();
		Set<Integer> ids = _idsByChunk.get(address.key());
		ids.remove(tile.id());
		if (ids.isEmpty())
		{
			_idsByChunk.remove(address.key());
		}
		Chunk chunk = _chunks.getIfResident(address.x(), address.z());
		if (null != chunk)
		{
			chunk.removeTile(tile.id());
		}
		_packets.invalidate(address.x(), address.z());
	}
}
