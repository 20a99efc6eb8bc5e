package com.jeffdisher.meridian.registries;


/**
 * Thrown when a dimension type id is looked up which was never registered.  This is a caller bug so it is unchecked.
 */
public class InvalidDimensionTypeException extends IllegalArgumentException
{
	private static final long serialVersionUID = 1L;

	public final int typeId;

	public InvalidDimensionTypeException(int typeId)
	{
		super("Invalid dimension type ID " + typeId);
		this.typeId = typeId;
	}
}
