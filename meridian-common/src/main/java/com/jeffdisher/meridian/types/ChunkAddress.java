package com.jeffdisher.meridian.types;

import com.jeffdisher.meridian.utils.Encoding;


/**
 * The address of a chunk column in units of chunks.  These coordinates are SIGNED.
 * All chunk-scoped maps are keyed by the packed form returned by key(), so this record is mostly used at API edges.
 */
public record ChunkAddress(int x, int z)
{
	/**
	 * Finds the chunk containing the given block coordinates.
	 * 
	 * @param blockX The absolute block x.
	 * @param blockZ The absolute block z.
	 * @return The address of the chunk containing that column.
	 */
	public static ChunkAddress fromBlock(int blockX, int blockZ)
	{
		return new ChunkAddress(Encoding.getChunkFromBlock(blockX), Encoding.getChunkFromBlock(blockZ));
	}

	public static ChunkAddress fromKey(long key)
	{
		return new ChunkAddress(Encoding.chunkKeyX(key), Encoding.chunkKeyZ(key));
	}

	public long key()
	{
		return Encoding.chunkKey(x, z);
	}
}
