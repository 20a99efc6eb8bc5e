package com.jeffdisher.meridian.dimension;


/**
 * Creates a new, detached, dimension instance.
 */
public interface IDimensionFactory
{
	Dimension create(DimensionContext context);
}
