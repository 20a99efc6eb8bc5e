package com.jeffdisher.meridian.broadcast;

import com.jeffdisher.meridian.data.Chunk;
import com.jeffdisher.meridian.net.Packet_ChunkData;


/**
 * The protocol codec's hook for turning a loaded chunk into the packet clients receive.  Compilation is expensive so
 * results are cached by PacketBroadcastQueue until the chunk changes.
 */
public interface IChunkPacketCompiler
{
	Packet_ChunkData compile(Chunk chunk);
}
