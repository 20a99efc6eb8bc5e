package com.jeffdisher.meridian.utils;

import java.util.ArrayDeque;
import java.util.Queue;


/**
 * A blocking queue of Runnable objects used to hand work to a single background thread.
 */
public class MessageQueue
{
	private final Queue<Runnable> _queue = new ArrayDeque<>();
	private boolean _running = true;

	/**
	 * Blocks until there is a Runnable to return or the queue is shut down.
	 * Note that this returns null on shutdown, even if there are still Runnable objects in the queue.
	 *
	 * @return The next Runnable or null, if the queue is shut down.
	 */
	public synchronized Runnable pollForNext()
	{
		while (_running && _queue.isEmpty())
		{
			try
			{
				this.wait();
			}
			catch (InterruptedException e)
			{
				// We don't use interruption.
				throw Assert.unexpected(e);
			}
		}
		Runnable runnable = _running
				? _queue.remove()
				: null
		;
		// Anyone in waitForEmptyQueue() needs to see the drain.
		if (_queue.isEmpty())
		{
			this.notifyAll();
		}
		return runnable;
	}

	/**
	 * Enqueues the next runnable task.
	 *
	 * @param r The runnable task.
	 * @return True if this was enqueued, false if the receiver has been shut down.
	 */
	public synchronized boolean enqueue(Runnable r)
	{
		if (_running)
		{
			_queue.add(r);
			this.notifyAll();
		}
		return _running;
	}

	/**
	 * Blocks the calling thread until the consumer has drained the queue.  The queue must NOT be shut down while
	 * anyone is waiting here.
	 */
	public synchronized void waitForEmptyQueue()
	{
		while (!_queue.isEmpty())
		{
			Assert.assertTrue(_running);
			try
			{
				this.wait();
			}
			catch (InterruptedException e)
			{
				// We don't use interruption.
				throw Assert.unexpected(e);
			}
		}
	}

	/**
	 * Shuts down the queue:  future enqueue() calls fail and any thread blocked in pollForNext() returns null.
	 */
	public synchronized void shutdown()
	{
		_running = false;
		this.notifyAll();
	}
}
