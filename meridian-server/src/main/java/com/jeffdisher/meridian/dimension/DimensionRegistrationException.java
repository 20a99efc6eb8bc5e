package com.jeffdisher.meridian.dimension;


/**
 * Thrown when a dimension class can't be bound in the DimensionClassRegistry.  The registry is unchanged so the
 * caller can retry with different parameters.
 */
public class DimensionRegistrationException extends Exception
{
	private static final long serialVersionUID = 1L;

	public enum Reason
	{
		/**
		 * The explicit id is already bound and overriding wasn't requested.
		 */
		ID_ALREADY_BOUND,
		/**
		 * The explicit id is negative.
		 */
		INVALID_ID,
		/**
		 * The class isn't a concrete ICustomDimension subclass of Dimension with a public (DimensionContext)
		 * constructor.
		 */
		INVALID_DIMENSION_CLASS,
	}

	public final Reason reason;

	public DimensionRegistrationException(Reason reason, String message)
	{
		super(message);
		this.reason = reason;
	}
}
