package com.jeffdisher.meridian.net;


public enum PacketType
{
	/**
	 * A dimension-wide event with a single integer of data (weather changes, for example).
	 */
	LEVEL_EVENT,
	/**
	 * The full compiled contents of one chunk column, including its tiles.
	 */
	CHUNK_DATA,
}
