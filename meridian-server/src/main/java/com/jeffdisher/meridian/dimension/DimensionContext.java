package com.jeffdisher.meridian.dimension;

import java.util.Random;

import com.jeffdisher.meridian.broadcast.IChunkPacketCompiler;
import com.jeffdisher.meridian.broadcast.ITransportAdapter;
import com.jeffdisher.meridian.persistence.IChunkStore;
import com.jeffdisher.meridian.persistence.ServerConfig;
import com.jeffdisher.meridian.registries.DimensionTypeRegistry;


/**
 * Everything a dimension needs from its surroundings, handed to its constructor by a factory.
 * 
 * @param registeredId The class registry id the dimension is being created for (Dimension.ID_UNASSIGNED in a
 * template which hasn't been stamped yet).
 * @param types The dimension types.
 * @param chunkStore Where chunks are loaded from or generated.
 * @param compiler Turns chunks into packets for clients.
 * @param transport Delivers packets to players.
 * @param config The server options.
 * @param random The source of randomness for weather.
 */
public record DimensionContext(int registeredId
		, DimensionTypeRegistry types
		, IChunkStore chunkStore
		, IChunkPacketCompiler compiler
		, ITransportAdapter transport
		, ServerConfig config
		, Random random
)
{
	public DimensionContext withRegisteredId(int id)
	{
		return new DimensionContext(id, this.types, this.chunkStore, this.compiler, this.transport, this.config, this.random);
	}
}
