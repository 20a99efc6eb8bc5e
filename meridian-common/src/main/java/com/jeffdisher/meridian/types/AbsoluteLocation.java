package com.jeffdisher.meridian.types;

import com.jeffdisher.meridian.utils.Encoding;


/**
 * The location of a single block, in absolute block coordinates.
 */
public record AbsoluteLocation(int x, int y, int z)
{
	public ChunkAddress getChunkAddress()
	{
		return ChunkAddress.fromBlock(x, z);
	}

	public int getLocalX()
	{
		return Encoding.getLocalBlock(x);
	}

	public int getLocalZ()
	{
		return Encoding.getLocalBlock(z);
	}
}
