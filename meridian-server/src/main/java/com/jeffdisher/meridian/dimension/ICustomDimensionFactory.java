package com.jeffdisher.meridian.dimension;


/**
 * The factory type accepted for custom registrations.  The bound on T means only concrete dimensions which are
 * marked ICustomDimension can be registered through it.
 * 
 * @param <T> The custom dimension type created.
 */
public interface ICustomDimensionFactory<T extends Dimension & ICustomDimension> extends IDimensionFactory
{
	@Override
	T create(DimensionContext context);
}
