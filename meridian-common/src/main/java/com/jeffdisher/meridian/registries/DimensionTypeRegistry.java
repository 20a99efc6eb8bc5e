package com.jeffdisher.meridian.registries;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.jeffdisher.meridian.config.IValueTransformer;
import com.jeffdisher.meridian.config.TabListReader;
import com.jeffdisher.meridian.config.TabListReader.TabListException;
import com.jeffdisher.meridian.types.DimensionType;
import com.jeffdisher.meridian.types.SkyColor;
import com.jeffdisher.meridian.utils.Assert;


/**
 * The append-only table of dimension types, looked up by id.  Types are never changed or removed once registered.
 * The built-in types are described by the DEFAULTS_RESOURCE data file.
 */
public class DimensionTypeRegistry
{
	public static final int OVERWORLD = 0;
	public static final int NETHER = 1;
	public static final int THE_END = 2;

	public static final String DEFAULTS_RESOURCE = "dimension_types.tablist";
	public static final String SUB_SKY = "sky";
	public static final String SUB_MAX_HEIGHT = "max_height";
	public static final String SUB_DISTANCE_MULTIPLIER = "distance_multiplier";

	/**
	 * Loads the registry of built-in types from the bundled resource.
	 * 
	 * @return A registry containing at least OVERWORLD, NETHER, and THE_END.
	 * @throws IOException The resource couldn't be read.
	 * @throws TabListException The resource was malformed.
	 */
	public static DimensionTypeRegistry loadDefaults() throws IOException, TabListException
	{
		InputStream stream = DimensionTypeRegistry.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE);
		Assert.assertNotNull(stream);
		DimensionTypeRegistry registry = load(stream);
		// The rest of the system assumes these are always present.
		Assert.assertTrue(registry.isRegistered(OVERWORLD));
		Assert.assertTrue(registry.isRegistered(NETHER));
		Assert.assertTrue(registry.isRegistered(THE_END));
		return registry;
	}

	/**
	 * Loads a registry from the given tab list stream.  Each record is "name<TAB>id" with the required sub-records
	 * SUB_SKY, SUB_MAX_HEIGHT, and SUB_DISTANCE_MULTIPLIER.
	 * 
	 * @param stream The stream to read (will be closed).
	 * @return The new registry.
	 * @throws IOException The stream couldn't be read.
	 * @throws TabListException The data was malformed or contained duplicate ids.
	 */
	public static DimensionTypeRegistry load(InputStream stream) throws IOException, TabListException
	{
		DimensionTypeRegistry registry = new DimensionTypeRegistry();
		TabListReader.readEntireFile(new _TypeCallbacks(registry), stream);
		return registry;
	}


	private final Map<Integer, DimensionType> _types;

	public DimensionTypeRegistry()
	{
		_types = new HashMap<>();
	}

	/**
	 * Adds a new type to the registry.
	 * 
	 * @param type The type to add.
	 * @return True if it was added, false if its id is already taken (the existing type is unchanged).
	 */
	public boolean register(DimensionType type)
	{
		return (null == _types.putIfAbsent(type.id(), type));
	}

	/**
	 * Looks up a type by id.
	 * 
	 * @param id The type id.
	 * @return The type (never null).
	 * @throws InvalidDimensionTypeException There is no type with this id.
	 */
	public DimensionType get(int id)
	{
		DimensionType type = _types.get(id);
		if (null == type)
		{
			throw new InvalidDimensionTypeException(id);
		}
		return type;
	}

	public boolean isRegistered(int id)
	{
		return _types.containsKey(id);
	}

	/**
	 * @return All registered types, in ascending id order.
	 */
	public List<DimensionType> getAll()
	{
		List<DimensionType> all = new ArrayList<>(_types.values());
		all.sort(Comparator.comparingInt(DimensionType::id));
		return Collections.unmodifiableList(all);
	}


	private static class _TypeCallbacks implements TabListReader.IParseCallbacks
	{
		private final DimensionTypeRegistry _registry;
		private final IValueTransformer<Integer> _ids = new IValueTransformer.IntegerTransformer("dimension type id", 0, Integer.MAX_VALUE);
		private final IValueTransformer<Integer> _heights = new IValueTransformer.IntegerTransformer(SUB_MAX_HEIGHT, 1, Integer.MAX_VALUE);
		private final IValueTransformer<Float> _multipliers = new IValueTransformer.PositiveFloatTransformer(SUB_DISTANCE_MULTIPLIER);
		private final IValueTransformer<SkyColor> _colours = new IValueTransformer.EnumTransformer<>(SkyColor.class);
		
		private String _name;
		private int _id;
		private SkyColor _sky;
		private Integer _maxHeight;
		private Float _multiplier;
		
		public _TypeCallbacks(DimensionTypeRegistry registry)
		{
			_registry = registry;
		}
		@Override
		public void startNewRecord(String name, String[] parameters) throws TabListException
		{
			if (1 != parameters.length)
			{
				throw new TabListException("Dimension type \"" + name + "\" needs exactly 1 parameter (id)");
			}
			_name = name;
			_id = _ids.transform(parameters[0]);
			_sky = null;
			_maxHeight = null;
			_multiplier = null;
		}
		@Override
		public void processSubRecord(String name, String[] parameters) throws TabListException
		{
			if (1 != parameters.length)
			{
				throw new TabListException("Sub-record \"" + name + "\" needs exactly 1 parameter in: " + _name);
			}
			String value = parameters[0];
			switch (name)
			{
			case SUB_SKY:
				_sky = _colours.transform(value);
				break;
			case SUB_MAX_HEIGHT:
				_maxHeight = _heights.transform(value);
				break;
			case SUB_DISTANCE_MULTIPLIER:
				_multiplier = _multipliers.transform(value);
				break;
			default:
				throw new TabListException("Unexpected sub-record \"" + name + "\" in: " + _name);
			}
		}
		@Override
		public void endRecord() throws TabListException
		{
			if ((null == _sky) || (null == _maxHeight) || (null == _multiplier))
			{
				throw new TabListException("Missing sub-records in: " + _name);
			}
			DimensionType type = new DimensionType(_id, _name, _sky, _maxHeight, _multiplier);
			if (!_registry.register(type))
			{
				throw new TabListException("Duplicate dimension type id " + _id + " in: " + _name);
			}
		}
	}
}
