package com.jeffdisher.meridian.types;

import com.jeffdisher.meridian.utils.Encoding;


/**
 * The location of an entity's base, in block units.  Unlike AbsoluteLocation, these are continuous.
 */
public record EntityLocation(float x, float y, float z)
{
	public ChunkAddress getChunkAddress()
	{
		return new ChunkAddress(Encoding.getChunkFromEntity(x), Encoding.getChunkFromEntity(z));
	}

	public AbsoluteLocation getBlockLocation()
	{
		return new AbsoluteLocation((int)Math.floor(x), (int)Math.floor(y), (int)Math.floor(z));
	}
}
