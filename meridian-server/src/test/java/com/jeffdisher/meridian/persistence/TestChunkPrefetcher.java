package com.jeffdisher.meridian.persistence;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.meridian.data.Chunk;
import com.jeffdisher.meridian.types.ChunkAddress;


public class TestChunkPrefetcher
{
	@Test
	public void emptyShutdown() throws Throwable
	{
		ChunkPrefetcher prefetcher = new ChunkPrefetcher(new _LatchedStore(null, true), "test");
		Assert.assertTrue(prefetcher.drainLoaded().isEmpty());
		prefetcher.shutdown();
	}

	@Test
	public void duplicateRequests() throws Throwable
	{
		CountDownLatch release = new CountDownLatch(1);
		_LatchedStore store = new _LatchedStore(release, true);
		ChunkPrefetcher prefetcher = new ChunkPrefetcher(store, "test");
		
		// The store is blocked so the first request is still pending when the second arrives.
		Assert.assertTrue(prefetcher.request(1, -1));
		Assert.assertFalse(prefetcher.request(1, -1));
		Assert.assertTrue(prefetcher.request(2, -1));
		release.countDown();
		
		// Shutdown waits for outstanding requests.
		prefetcher.shutdown();
		List<Chunk> loaded = prefetcher.drainLoaded();
		Assert.assertEquals(2, loaded.size());
		Assert.assertEquals(new ChunkAddress(1, -1), loaded.get(0).getAddress());
		Assert.assertEquals(new ChunkAddress(2, -1), loaded.get(1).getAddress());
		Assert.assertEquals(2, store.generates.get());
		Assert.assertTrue(prefetcher.drainLoaded().isEmpty());
	}

	@Test
	public void failedGeneration() throws Throwable
	{
		_LatchedStore store = new _LatchedStore(null, false);
		ChunkPrefetcher prefetcher = new ChunkPrefetcher(store, "test");
		Assert.assertTrue(prefetcher.request(0, 0));
		prefetcher.shutdown();
		Assert.assertTrue(prefetcher.drainLoaded().isEmpty());
		Assert.assertEquals(1, store.generates.get());
	}

	@Test
	public void pollUntilLoaded() throws Throwable
	{
		ChunkPrefetcher prefetcher = new ChunkPrefetcher(new _LatchedStore(null, true), "test");
		prefetcher.request(3, 3);
		
		// We should see this satisfied, but not necessarily on the first call (we will use 10 tries, with sleeps).
		List<Chunk> loaded = prefetcher.drainLoaded();
		for (int i = 0; loaded.isEmpty() && (i < 10); ++i)
		{
			Thread.sleep(10L);
			loaded = prefetcher.drainLoaded();
		}
		Assert.assertEquals(1, loaded.size());
		// Once complete, the same chunk can be requested again.
		Assert.assertTrue(prefetcher.request(3, 3));
		prefetcher.shutdown();
	}


	private static class _LatchedStore implements IChunkStore
	{
		private final CountDownLatch _release;
		private final boolean _canGenerate;
		public final AtomicInteger generates = new AtomicInteger();
		public _LatchedStore(CountDownLatch release, boolean canGenerate)
		{
			_release = release;
			_canGenerate = canGenerate;
		}
		@Override
		public Chunk load(int chunkX, int chunkZ)
		{
			if (null != _release)
			{
				try
				{
					_release.await();
				}
				catch (InterruptedException e)
				{
					throw new AssertionError(e);
				}
			}
			return null;
		}
		@Override
		public Chunk generate(int chunkX, int chunkZ)
		{
			this.generates.incrementAndGet();
			return _canGenerate
					? new Chunk(new ChunkAddress(chunkX, chunkZ), new byte[0])
					: null
			;
		}
	}
}
