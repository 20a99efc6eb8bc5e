package com.jeffdisher.meridian.dimension;

import com.jeffdisher.meridian.registries.DimensionTypeRegistry;


public class Nether extends Dimension
{
	public Nether(DimensionContext context)
	{
		super(context, DimensionTypeRegistry.NETHER);
	}

	@Override
	public String getDimensionName()
	{
		return "Nether";
	}
}
