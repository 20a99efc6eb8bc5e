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

import com.jeffdisher.meridian.types.ChunkAddress;
import com.jeffdisher.meridian.types.Entity;
import com.jeffdisher.meridian.utils.Assert;
import com.jeffdisher.meridian.utils.Encoding;


/**
 * The players of a dimension and the chunks each of them is watching.
 * Membership is only changed by EntityIndex, in the same call which changes the entity map, so a player is here if
 * and only if it is also in the entity index.  The watched chunk sets are set by the transport's view-distance logic.
 */
public class PlayerIndex
{
	private final Map<Integer, Entity> _players;
	private final Map<Integer, Set<Long>> _watchedByPlayer;
	private final Map<Long, Set<Integer>> _watchersByChunk;

	PlayerIndex()
	{
		_players = new LinkedHashMap<>();
		_watchedByPlayer = new HashMap<>();
		_watchersByChunk = new HashMap<>();
	}

	public Entity get(int playerId)
	{
		return _players.get(playerId);
	}

	public boolean contains(int playerId)
	{
		return _players.containsKey(playerId);
	}

	public Collection<Entity> getAll()
	{
		return Collections.unmodifiableList(new ArrayList<>(_players.values()));
	}

	public int size()
	{
		return _players.size();
	}

	/**
	 * Replaces the set of chunks the given player is watching.
	 * 
	 * @param playerId The player.
	 * @param chunks The complete set of chunks now watched (can be empty).
	 * @return True if the watch set was updated, false if the player isn't in this index.
	 */
	public boolean setWatchedChunks(int playerId, Collection<ChunkAddress> chunks)
	{
		boolean isKnown = _players.containsKey(playerId);
		if (isKnown)
		{
			_clearWatches(playerId);
			Set<Long> keys = new LinkedHashSet<>();
			for (ChunkAddress address : chunks)
			{
				long key = address.key();
				keys.add(key);
				_watchersByChunk.computeIfAbsent(key, (Long k) -> new LinkedHashSet<>()).add(playerId);
			}
			if (!keys.isEmpty())
			{
				_watchedByPlayer.put(playerId, keys);
			}
		}
		return isKnown;
	}

	public Set<ChunkAddress> getWatchedChunks(int playerId)
	{
		Set<ChunkAddress> addresses = new LinkedHashSet<>();
		for (long key : _watchedByPlayer.getOrDefault(playerId, Set.of()))
		{
			addresses.add(ChunkAddress.fromKey(key));
		}
		return Collections.unmodifiableSet(addresses);
	}

	/**
	 * Returns the players watching the given chunk.
	 * 
	 * @param chunkX The chunk x.
	 * @param chunkZ The chunk z.
	 * @return The players (never null, empty if nobody is watching).
	 */
	public List<Entity> chunkPlayers(int chunkX, int chunkZ)
	{
		Set<Integer> watchers = _watchersByChunk.get(Encoding.chunkKey(chunkX, chunkZ));
		List<Entity> players = new ArrayList<>();
		if (null != watchers)
		{
			for (int id : watchers)
			{
				players.add(Assert.assertNotNull(_players.get(id)));
			}
		}
		return Collections.unmodifiableList(players);
	}


	void put(Entity player)
	{
		Assert.assertTrue(player.isPlayer());
		// A re-add replaces the snapshot but keeps whatever the player was watching.
		_players.put(player.id(), player);
	}

	void remove(int playerId)
	{
		_players.remove(playerId);
		_clearWatches(playerId);
	}


	private void _clearWatches(int playerId)
	{
		Set<Long> previous = _watchedByPlayer.remove(playerId);
		if (null != previous)
		{
			for (long key : previous)
			{
				Set<Integer> watchers = _watchersByChunk.get(key);
				watchers.remove(playerId);
				if (watchers.isEmpty())
				{
					_watchersByChunk.remove(key);
				}
			}
		}
	}
}
