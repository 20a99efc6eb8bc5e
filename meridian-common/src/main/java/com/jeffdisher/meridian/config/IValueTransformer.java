package com.jeffdisher.meridian.config;


/**
 * Used to transform a string value from a tab list into a specific type.
 * 
 * @param <T> The output type.
 */
public interface IValueTransformer<T>
{
	T transform(String value) throws TabListReader.TabListException;

	/**
	 * Decodes the given data as an Integer in [min..max].
	 */
	public static class IntegerTransformer implements IValueTransformer<Integer>
	{
		private final String _name;
		private final int _min;
		private final int _max;
		public IntegerTransformer(String numberName, int min, int max)
		{
			_name = numberName;
			_min = min;
			_max = max;
		}
		@Override
		public Integer transform(String value) throws TabListReader.TabListException
		{
			int parsed;
			try
			{
				parsed = Integer.parseInt(value);
			}
			catch (NumberFormatException e)
			{
				throw new TabListReader.TabListException("Not a valid " + _name + ": \"" + value + "\"");
			}
			if ((parsed < _min) || (parsed > _max))
			{
				throw new TabListReader.TabListException("Values for " + _name + " must be in [" + _min + ".." + _max + "]: " + parsed);
			}
			return parsed;
		}
	}

	/**
	 * Decodes the given data as a strictly positive Float.
	 */
	public static class PositiveFloatTransformer implements IValueTransformer<Float>
	{
		private final String _name;
		public PositiveFloatTransformer(String numberName)
		{
			_name = numberName;
		}
		@Override
		public Float transform(String value) throws TabListReader.TabListException
		{
			float parsed;
			try
			{
				parsed = Float.parseFloat(value);
			}
			catch (NumberFormatException e)
			{
				throw new TabListReader.TabListException("Not a valid " + _name + ": \"" + value + "\"");
			}
			// The negated comparison also rejects NaN.
			if (!(parsed > 0.0f) || Float.isInfinite(parsed))
			{
				throw new TabListReader.TabListException("Values for " + _name + " must be positive: " + value);
			}
			return parsed;
		}
	}

	/**
	 * Decodes the given data as a constant of the given enum, by name.
	 */
	public static class EnumTransformer<E extends Enum<E>> implements IValueTransformer<E>
	{
		private final Class<E> _type;
		public EnumTransformer(Class<E> type)
		{
			_type = type;
		}
		@Override
		public E transform(String value) throws TabListReader.TabListException
		{
			try
			{
				return Enum.valueOf(_type, value);
			}
			catch (IllegalArgumentException e)
			{
				throw new TabListReader.TabListException("Unknown " + _type.getSimpleName() + ": \"" + value + "\"");
			}
		}
	}
}
