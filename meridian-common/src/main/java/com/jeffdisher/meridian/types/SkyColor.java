package com.jeffdisher.meridian.types;


/**
 * The sky rendering mode a client uses for a dimension.
 */
public enum SkyColor
{
	BLUE,
	RED,
	PURPLE_STATIC,
}
