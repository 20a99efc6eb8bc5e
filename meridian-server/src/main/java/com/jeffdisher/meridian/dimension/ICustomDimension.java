package com.jeffdisher.meridian.dimension;


/**
 * Marks a Dimension subclass as a custom (non built-in) dimension which may be bound in the DimensionClassRegistry.
 */
public interface ICustomDimension
{
}
