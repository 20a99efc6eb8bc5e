package com.jeffdisher.meridian.types;


/**
 * The immutable properties of a kind of dimension.  Many dimensions can share one type.
 * 
 * @param id The small positive id used to look this type up.
 * @param name The human-readable name (also the key in the type data file).
 * @param skyColor The sky rendering mode.
 * @param maxBuildHeight The exclusive upper bound of buildable y.
 * @param distanceMultiplier How many overworld blocks one block in this type of dimension spans horizontally.
 */
public record DimensionType(int id
		, String name
		, SkyColor skyColor
		, int maxBuildHeight
		, float distanceMultiplier
)
{
}
