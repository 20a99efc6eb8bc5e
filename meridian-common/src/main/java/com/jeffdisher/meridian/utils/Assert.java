package com.jeffdisher.meridian.utils;


/**
 * Internal invariant checks.  These describe programmer errors, not runtime conditions, so they always throw
 * AssertionError.
 */
public class Assert
{
	public static void assertTrue(boolean flag)
	{
		if (!flag)
		{
			throw new AssertionError("Condition expected to be true");
		}
	}

	public static <T> T assertNotNull(T value)
	{
		if (null == value)
		{
			throw new AssertionError("Value expected to be non-null");
		}
		return value;
	}

	public static AssertionError unexpected(Throwable t)
	{
		throw new AssertionError("Unexpected exception", t);
	}
}
