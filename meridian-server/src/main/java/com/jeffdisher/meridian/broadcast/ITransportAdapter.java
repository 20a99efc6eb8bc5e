package com.jeffdisher.meridian.broadcast;

import com.jeffdisher.meridian.net.Packet;
import com.jeffdisher.meridian.types.Entity;


/**
 * The outbound side of the transport, as seen by a dimension.  Calls are made on the tick thread and are expected to
 * only buffer the packet, not block on the network.
 */
public interface ITransportAdapter
{
	/**
	 * Sends a packet to the client controlling the given player.
	 * 
	 * @param player The player entity (always of kind PLAYER).
	 * @param packet The packet to send.
	 */
	void sendPacket(Entity player, Packet packet);
}
