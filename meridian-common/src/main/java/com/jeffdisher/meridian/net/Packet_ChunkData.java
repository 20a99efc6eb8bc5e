package com.jeffdisher.meridian.net;

import com.jeffdisher.meridian.types.ChunkAddress;


/**
 * A compiled chunk, ready to send to any client watching it.  The payload is produced by the protocol codec and is
 * treated as opaque (and immutable) once built.
 */
public class Packet_ChunkData extends Packet
{
	public static final PacketType TYPE = PacketType.CHUNK_DATA;

	public final ChunkAddress address;
	public final byte[] payload;

	public Packet_ChunkData(ChunkAddress address, byte[] payload)
	{
		super(TYPE);
		this.address = address;
		this.payload = payload;
	}
}
