package com.jeffdisher.meridian.persistence;

import com.jeffdisher.meridian.data.Chunk;


/**
 * The storage and generation back-end of a dimension's chunks.  Implementations may block on I/O:  the dimension
 * only calls into this on a cache miss.
 */
public interface IChunkStore
{
	/**
	 * Loads a previously-saved chunk.
	 * 
	 * @param chunkX The chunk x.
	 * @param chunkZ The chunk z.
	 * @return The chunk, or null if it was never saved.
	 */
	Chunk load(int chunkX, int chunkZ);

	/**
	 * Generates a new chunk.  Only called after load() missed.
	 * 
	 * @param chunkX The chunk x.
	 * @param chunkZ The chunk z.
	 * @return The chunk, or null if generation failed.
	 */
	Chunk generate(int chunkX, int chunkZ);
}
