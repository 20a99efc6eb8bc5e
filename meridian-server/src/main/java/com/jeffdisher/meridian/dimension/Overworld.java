package com.jeffdisher.meridian.dimension;

import com.jeffdisher.meridian.registries.DimensionTypeRegistry;


public class Overworld extends Dimension
{
	public Overworld(DimensionContext context)
	{
		super(context, DimensionTypeRegistry.OVERWORLD);
	}

	@Override
	public String getDimensionName()
	{
		return "Overworld";
	}
}
