package com.jeffdisher.meridian.net;


/**
 * A dimension-wide event sent to a set of clients.  The meaning of data depends on the event id.
 */
public class Packet_LevelEvent extends Packet
{
	public static final PacketType TYPE = PacketType.LEVEL_EVENT;

	public static final int EVENT_START_RAIN = 3001;
	public static final int EVENT_START_THUNDER = 3002;
	public static final int EVENT_STOP_RAIN = 3003;
	public static final int EVENT_STOP_THUNDER = 3004;

	public final int eventId;
	public final int data;

	public Packet_LevelEvent(int eventId, int data)
	{
		super(TYPE);
		this.eventId = eventId;
		this.data = data;
	}
}
