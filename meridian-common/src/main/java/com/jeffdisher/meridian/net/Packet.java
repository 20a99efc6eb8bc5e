package com.jeffdisher.meridian.net;


/**
 * The common base of all packets routed by the server.  Encoding packets to bytes belongs to the transport's codec,
 * so these are only typed carriers of the data to encode.
 */
public abstract class Packet
{
	public final PacketType type;

	protected Packet(PacketType type)
	{
		this.type = type;
	}
}
