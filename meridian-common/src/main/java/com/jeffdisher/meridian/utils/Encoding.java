package com.jeffdisher.meridian.utils;


/**
 * Helpers for the fixed-width encodings used to address chunks and the blocks within them.
 * Chunks are 16x16 columns, addressed by SIGNED (x, z) chunk coordinates.  The packed chunk key places x in the high
 * 32 bits and z in the low 32 bits so every (x, z) pair maps to exactly one long and back.
 */
public class Encoding
{
	public static final int CHUNK_SHIFT = 4;
	public static final int CHUNK_EDGE_SIZE = 1 << CHUNK_SHIFT;
	public static final int LOCAL_MASK = CHUNK_EDGE_SIZE - 1;

	public static long chunkKey(int chunkX, int chunkZ)
	{
		return (((long)chunkX) << 32) | (chunkZ & 0xFFFF_FFFFL);
	}

	public static int chunkKeyX(long key)
	{
		return (int)(key >> 32);
	}

	public static int chunkKeyZ(long key)
	{
		// Truncation recovers the signed low word.
		return (int)key;
	}

	public static int getChunkFromBlock(int blockCoordinate)
	{
		// Arithmetic shift so that negative blocks land in negative chunks (-1 is in chunk -1, not 0).
		return blockCoordinate >> CHUNK_SHIFT;
	}

	public static int getChunkFromEntity(float coordinate)
	{
		return getChunkFromBlock((int)Math.floor(coordinate));
	}

	public static int getLocalBlock(int blockCoordinate)
	{
		return blockCoordinate & LOCAL_MASK;
	}
}
