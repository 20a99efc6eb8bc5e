package com.jeffdisher.meridian.broadcast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.jeffdisher.meridian.data.Chunk;
import com.jeffdisher.meridian.net.Packet;
import com.jeffdisher.meridian.net.Packet_ChunkData;
import com.jeffdisher.meridian.types.ChunkAddress;
import com.jeffdisher.meridian.utils.Assert;
import com.jeffdisher.meridian.utils.Encoding;


/**
 * Holds the per-chunk outbound packets of a dimension until the transport drains them at the end of the tick, and
 * the compiled chunk packet of each chunk until that chunk changes.
 * Batches preserve arrival order and are never de-duplicated.  There is no bound on the queue:  it is expected to be
 * drained every tick.
 * Only the tick thread may call into this.
 */
public class PacketBroadcastQueue
{
	private final IChunkPacketCompiler _compiler;
	private Map<Long, List<Packet>> _pending;
	private final Map<Long, Packet_ChunkData> _compiled;

	public PacketBroadcastQueue(IChunkPacketCompiler compiler)
	{
		_compiler = compiler;
		_pending = new LinkedHashMap<>();
		_compiled = new HashMap<>();
	}

	/**
	 * Appends packets to the batch for the given chunk.  Passing no packets does nothing.
	 * 
	 * @param chunkX The chunk x.
	 * @param chunkZ The chunk z.
	 * @param packets The packets to append, in order.
	 */
	public void enqueue(int chunkX, int chunkZ, Packet... packets)
	{
		if (packets.length > 0)
		{
			List<Packet> batch = _pending.computeIfAbsent(Encoding.chunkKey(chunkX, chunkZ), (Long key) -> new ArrayList<>());
			for (Packet packet : packets)
			{
				Assert.assertNotNull(packet);
				batch.add(packet);
			}
		}
	}

	/**
	 * Removes and returns every pending batch.
	 * 
	 * @return The batches by chunk, in the order each chunk first received a packet (empty if nothing was pending).
	 */
	public Map<ChunkAddress, List<Packet>> drainAll()
	{
		Map<Long, List<Packet>> drained = _pending;
		_pending = new LinkedHashMap<>();
		
		Map<ChunkAddress, List<Packet>> result = new LinkedHashMap<>();
		for (Map.Entry<Long, List<Packet>> elt : drained.entrySet())
		{
			result.put(ChunkAddress.fromKey(elt.getKey()), Collections.unmodifiableList(elt.getValue()));
		}
		return result;
	}

	public boolean hasPending()
	{
		return !_pending.isEmpty();
	}

	/**
	 * Returns the compiled packet for the given chunk, compiling it if nothing is cached.
	 * 
	 * @param chunk The resident chunk.
	 * @return The compiled packet.
	 */
	public Packet_ChunkData getCompiledChunkPacket(Chunk chunk)
	{
		ChunkAddress address = chunk.getAddress();
		return _compiled.computeIfAbsent(address.key(), (Long key) -> Assert.assertNotNull(_compiler.compile(chunk)));
	}

	/**
	 * Drops the compiled packet for the given chunk, if there is one.
	 * 
	 * @param chunkX The chunk x.
	 * @param chunkZ The chunk z.
	 */
	public void invalidate(int chunkX, int chunkZ)
	{
		_compiled.remove(Encoding.chunkKey(chunkX, chunkZ));
	}

	public boolean hasCompiledChunkPacket(int chunkX, int chunkZ)
	{
		return _compiled.containsKey(Encoding.chunkKey(chunkX, chunkZ));
	}
}
