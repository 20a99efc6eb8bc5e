package com.jeffdisher.meridian.persistence;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import com.jeffdisher.meridian.data.Chunk;
import com.jeffdisher.meridian.utils.Assert;
import com.jeffdisher.meridian.utils.Encoding;
import com.jeffdisher.meridian.utils.MessageQueue;


/**
 * Loads (or generates) chunks on a background thread so that the tick thread doesn't need to block on a cache miss
 * for chunks it can predict it will need.  Results are exposed as call-return in order to keep the cross-thread
 * details out of the interface:  the tick thread drains whatever has completed, once per tick.
 */
public class ChunkPrefetcher
{
	private final IChunkStore _store;
	private final MessageQueue _queue;
	private final Thread _background;

	// Shared data for passing information back from the background thread.
	private final ReentrantLock _sharedDataLock;
	private final Set<Long> _shared_pending;
	private List<Chunk> _shared_loaded;

	public ChunkPrefetcher(IChunkStore store, String name)
	{
		_store = store;
		_queue = new MessageQueue();
		_background = new Thread(() -> {
			_background_main();
		}, "Chunk Prefetcher (" + name + ")");
		_sharedDataLock = new ReentrantLock();
		_shared_pending = new HashSet<>();
		_shared_loaded = new ArrayList<>();
		
		_background.start();
	}

	/**
	 * Requests that the given chunk be loaded or generated in the background.  Requests for a chunk which is already
	 * pending are ignored.
	 * 
	 * @param chunkX The chunk x.
	 * @param chunkZ The chunk z.
	 * @return True if a new background load was queued.
	 */
	public boolean request(int chunkX, int chunkZ)
	{
		long key = Encoding.chunkKey(chunkX, chunkZ);
		boolean isNew;
		_sharedDataLock.lock();
		try
		{
			isNew = _shared_pending.add(key);
		}
		finally
		{
			_sharedDataLock.unlock();
		}
		if (isNew)
		{
			boolean didEnqueue = _queue.enqueue(() -> {
				Chunk chunk = _store.load(chunkX, chunkZ);
				if (null == chunk)
				{
					chunk = _store.generate(chunkX, chunkZ);
				}
				if (null == chunk)
				{
					System.out.println("WARNING: prefetch failed for chunk (" + chunkX + ", " + chunkZ + ")");
				}
				_background_finish(key, chunk);
			});
			// Requests after shutdown are a usage error.
			Assert.assertTrue(didEnqueue);
		}
		return isNew;
	}

	/**
	 * Returns every chunk which has completed loading since the last call.
	 * 
	 * @return The loaded chunks (never null, often empty).
	 */
	public List<Chunk> drainLoaded()
	{
		List<Chunk> loaded;
		_sharedDataLock.lock();
		try
		{
			loaded = _shared_loaded;
			_shared_loaded = new ArrayList<>();
		}
		finally
		{
			_sharedDataLock.unlock();
		}
		return loaded;
	}

	/**
	 * Completes any outstanding requests and stops the background thread.
	 */
	public void shutdown()
	{
		_queue.waitForEmptyQueue();
		_queue.shutdown();
		try
		{
			_background.join();
		}
		catch (InterruptedException e)
		{
			// We don't use interruption.
			throw Assert.unexpected(e);
		}
	}


	private void _background_main()
	{
		Runnable toRun = _queue.pollForNext();
		while (null != toRun)
		{
			toRun.run();
			toRun = _queue.pollForNext();
		}
	}

	private void _background_finish(long key, Chunk chunk)
	{
		_sharedDataLock.lock();
		try
		{
			_shared_pending.remove(key);
			if (null != chunk)
			{
				_shared_loaded.add(chunk);
			}
		}
		finally
		{
			_sharedDataLock.unlock();
		}
	}
}
