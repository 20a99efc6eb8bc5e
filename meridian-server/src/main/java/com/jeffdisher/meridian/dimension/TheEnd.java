package com.jeffdisher.meridian.dimension;

import com.jeffdisher.meridian.registries.DimensionTypeRegistry;


public class TheEnd extends Dimension
{
	public TheEnd(DimensionContext context)
	{
		super(context, DimensionTypeRegistry.THE_END);
	}

	@Override
	public String getDimensionName()
	{
		return "The End";
	}
}
