package com.jeffdisher.meridian.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.function.Consumer;

import com.jeffdisher.meridian.data.Chunk;
import com.jeffdisher.meridian.persistence.IChunkStore;
import com.jeffdisher.meridian.utils.Assert;
import com.jeffdisher.meridian.utils.Encoding;


/**
 * Maps packed chunk keys to the resident chunks of one dimension, loading from the chunk store on a miss.
 * A resident hit is a single map lookup.  A miss goes to the store, and at most one load per key is in flight at a
 * time:  a caller which misses while another load of the same key is running waits for that load and gets the same
 * instance.
 * Chunks never carry entity or tile membership across residency:  it is cleared when a chunk is unloaded and when
 * it becomes resident, and the residency listeners then rebuild it from the dimension's indexes.
 */
public class ChunkIndex
{
	private final IChunkStore _store;
	private final ConcurrentMap<Long, Chunk> _chunks;
	private final ConcurrentMap<Long, _Load> _inFlight;
	private final List<Consumer<Chunk>> _residentListeners;

	public ChunkIndex(IChunkStore store)
	{
		_store = store;
		_chunks = new ConcurrentHashMap<>();
		_inFlight = new ConcurrentHashMap<>();
		_residentListeners = new ArrayList<>();
	}

	/**
	 * Adds a listener called whenever a chunk becomes resident, after its membership has been cleared.  Listeners
	 * are only added while the owning dimension is being built.
	 * 
	 * @param listener Called with the newly-resident chunk.
	 */
	public void addResidentListener(Consumer<Chunk> listener)
	{
		_residentListeners.add(listener);
	}

	/**
	 * Returns the chunk at the given chunk coordinates, loading it from the store if it isn't resident.
	 * 
	 * @param chunkX The chunk x.
	 * @param chunkZ The chunk z.
	 * @param generate True if a chunk which can't be loaded should be generated.
	 * @return The chunk, or null if it isn't resident and couldn't be loaded (or generated, if requested).
	 */
	public Chunk get(int chunkX, int chunkZ, boolean generate)
	{
		long key = Encoding.chunkKey(chunkX, chunkZ);
		Chunk chunk = _chunks.get(key);
		if (null == chunk)
		{
			chunk = _loadSingleFlight(key, chunkX, chunkZ, generate);
		}
		return chunk;
	}

	/**
	 * Returns the chunk only if it is already resident, never touching the store.
	 * 
	 * @param chunkX The chunk x.
	 * @param chunkZ The chunk z.
	 * @return The resident chunk or null.
	 */
	public Chunk getIfResident(int chunkX, int chunkZ)
	{
		return _chunks.get(Encoding.chunkKey(chunkX, chunkZ));
	}

	public boolean isResident(int chunkX, int chunkZ)
	{
		return _chunks.containsKey(Encoding.chunkKey(chunkX, chunkZ));
	}

	public Collection<Chunk> getResidentChunks()
	{
		return Collections.unmodifiableCollection(new ArrayList<>(_chunks.values()));
	}

	public int getResidentCount()
	{
		return _chunks.size();
	}

	/**
	 * Makes a chunk loaded elsewhere (by the prefetcher, for example) resident.  An already-resident instance is never
	 * replaced.
	 * 
	 * @param chunk The loaded chunk.
	 * @return The instance which is now resident for that key (which is not chunk if one was already resident).
	 */
	public Chunk absorb(Chunk chunk)
	{
		Chunk previous = _chunks.putIfAbsent(chunk.getAddress().key(), chunk);
		Chunk resident;
		if (null != previous)
		{
			resident = previous;
		}
		else
		{
			// Whatever the store handed us may be stale so the indexes decide what is in this chunk.
			chunk.clearMembership();
			for (Consumer<Chunk> listener : _residentListeners)
			{
				listener.accept(chunk);
			}
			resident = chunk;
		}
		return resident;
	}

	/**
	 * Drops the chunk from the index, clearing its entity and tile membership.  Persisting its terrain is the
	 * caller's concern.
	 * 
	 * @param chunkX The chunk x.
	 * @param chunkZ The chunk z.
	 * @return The chunk which was resident, or null.
	 */
	public Chunk unload(int chunkX, int chunkZ)
	{
		Chunk chunk = _chunks.remove(Encoding.chunkKey(chunkX, chunkZ));
		if (null != chunk)
		{
			chunk.clearMembership();
		}
		return chunk;
	}


	private Chunk _loadSingleFlight(long key, int chunkX, int chunkZ, boolean generate)
	{
		_Load ours = new _Load(new FutureTask<>(() -> _loadOrGenerate(key, chunkX, chunkZ, generate)), generate);
		_Load existing = _inFlight.putIfAbsent(key, ours);
		Chunk chunk;
		if (null == existing)
		{
			try
			{
				ours.task.run();
				chunk = _await(ours.task);
			}
			finally
			{
				_inFlight.remove(key, ours);
			}
		}
		else
		{
			chunk = _await(existing.task);
			if ((null == chunk) && generate && !existing.generate)
			{
				// The load we joined wasn't allowed to generate so try again, now that it is done.
				chunk = get(chunkX, chunkZ, true);
			}
		}
		return chunk;
	}

	private Chunk _loadOrGenerate(long key, int chunkX, int chunkZ, boolean generate)
	{
		// Another load may have completed between our miss and taking the in-flight slot.
		Chunk chunk = _chunks.get(key);
		if (null == chunk)
		{
			chunk = _store.load(chunkX, chunkZ);
			if ((null == chunk) && generate)
			{
				chunk = _store.generate(chunkX, chunkZ);
				if (null == chunk)
				{
					System.out.println("WARNING: failed to generate chunk (" + chunkX + ", " + chunkZ + ")");
				}
			}
			if (null != chunk)
			{
				if (key != chunk.getAddress().key())
				{
					throw new IllegalStateException("Store returned chunk " + chunk.getAddress() + " for (" + chunkX + ", " + chunkZ + ")");
				}
				chunk = absorb(chunk);
			}
		}
		return chunk;
	}

	private static Chunk _await(FutureTask<Chunk> task)
	{
		try
		{
			return task.get();
		}
		catch (InterruptedException e)
		{
			// We don't use interruption.
			throw Assert.unexpected(e);
		}
		catch (ExecutionException e)
		{
			// The store failed so pass its exception on to every caller waiting on this load.
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException)
			{
				throw (RuntimeException) cause;
			}
			else if (cause instanceof Error)
			{
				throw (Error) cause;
			}
			throw Assert.unexpected(cause);
		}
	}


	private record _Load(FutureTask<Chunk> task, boolean generate)
	{
	}
}
