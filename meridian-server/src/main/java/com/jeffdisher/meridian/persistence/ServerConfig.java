package com.jeffdisher.meridian.persistence;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

import com.jeffdisher.meridian.config.IValueTransformer;
import com.jeffdisher.meridian.config.TabListReader;
import com.jeffdisher.meridian.config.TabListReader.TabListException;
import com.jeffdisher.meridian.dimension.Dimension;
import com.jeffdisher.meridian.dimension.DimensionClassRegistry;
import com.jeffdisher.meridian.utils.Assert;


/**
 * The tunable options of the dimension core.  Starts with defaults which can be overridden from a flat tab list
 * (one "key<TAB>value" record per line).  Unknown keys are ignored so that one file can be shared with other layers.
 */
public class ServerConfig
{
	public static final String DEFAULTS_RESOURCE = "server_config.tablist";

	public static final String KEY_AUTO_DIMENSION_ID_SEED = "auto_dimension_id_seed";
	public int autoDimensionIdSeed;
	public static final String KEY_WEATHER_MIN_TICKS = "weather_min_ticks";
	public int weatherMinTicks;
	public static final String KEY_WEATHER_MAX_TICKS = "weather_max_ticks";
	public int weatherMaxTicks;
	public static final String KEY_THUNDER_CHANCE_PERCENT = "thunder_chance_percent";
	public int thunderChancePercent;
	public static final String KEY_MAX_RAIN_LEVEL = "max_rain_level";
	public int maxRainLevel;

	/**
	 * Reads the bundled defaults file.
	 * 
	 * @return The config described by DEFAULTS_RESOURCE.
	 * @throws IOException The resource couldn't be read.
	 * @throws TabListException The resource was malformed.
	 */
	public static ServerConfig loadDefaults() throws IOException, TabListException
	{
		InputStream stream = ServerConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE);
		Assert.assertNotNull(stream);
		return load(stream);
	}

	/**
	 * Reads a config from a flat tab list, starting from the built-in defaults.
	 * 
	 * @param stream The stream to read (will be closed).
	 * @return The config.
	 * @throws IOException The stream couldn't be read.
	 * @throws TabListException The data was malformed or a value was out of range.
	 */
	public static ServerConfig load(InputStream stream) throws IOException, TabListException
	{
		_OptionCallbacks callbacks = new _OptionCallbacks();
		TabListReader.readEntireFile(callbacks, stream);
		ServerConfig config = new ServerConfig();
		config.loadOverrides(callbacks.options);
		return config;
	}


	/**
	 * Creates a config with all default options.
	 */
	public ServerConfig()
	{
		this.autoDimensionIdSeed = DimensionClassRegistry.DEFAULT_AUTO_ID_SEED;
		// Half a day to seven and a half days, in ticks.
		this.weatherMinTicks = 12_000;
		this.weatherMaxTicks = 180_000;
		this.thunderChancePercent = 30;
		this.maxRainLevel = 100_000;
	}

	public void loadOverrides(Map<String, String> overrides) throws TabListException
	{
		// Automatic ids must never collide with the built-in dimensions.
		this.autoDimensionIdSeed = _readInt(overrides, KEY_AUTO_DIMENSION_ID_SEED, Dimension.ID_THE_END + 1, Integer.MAX_VALUE, this.autoDimensionIdSeed);
		this.weatherMinTicks = _readInt(overrides, KEY_WEATHER_MIN_TICKS, 1, Integer.MAX_VALUE, this.weatherMinTicks);
		this.weatherMaxTicks = _readInt(overrides, KEY_WEATHER_MAX_TICKS, 1, Integer.MAX_VALUE, this.weatherMaxTicks);
		this.thunderChancePercent = _readInt(overrides, KEY_THUNDER_CHANCE_PERCENT, 0, 100, this.thunderChancePercent);
		this.maxRainLevel = _readInt(overrides, KEY_MAX_RAIN_LEVEL, 1, Integer.MAX_VALUE, this.maxRainLevel);
		if (this.weatherMinTicks > this.weatherMaxTicks)
		{
			throw new TabListException(KEY_WEATHER_MIN_TICKS + " (" + this.weatherMinTicks + ") cannot exceed " + KEY_WEATHER_MAX_TICKS + " (" + this.weatherMaxTicks + ")");
		}
	}

	public Map<String, String> getRawOptions()
	{
		return Map.of(
				KEY_AUTO_DIMENSION_ID_SEED, Integer.toString(this.autoDimensionIdSeed),
				KEY_WEATHER_MIN_TICKS, Integer.toString(this.weatherMinTicks),
				KEY_WEATHER_MAX_TICKS, Integer.toString(this.weatherMaxTicks),
				KEY_THUNDER_CHANCE_PERCENT, Integer.toString(this.thunderChancePercent),
				KEY_MAX_RAIN_LEVEL, Integer.toString(this.maxRainLevel)
		);
	}


	private static int _readInt(Map<String, String> overrides, String key, int min, int max, int current) throws TabListException
	{
		String raw = overrides.get(key);
		return (null != raw)
				? new IValueTransformer.IntegerTransformer(key, min, max).transform(raw)
				: current
		;
	}


	private static class _OptionCallbacks implements TabListReader.IParseCallbacks
	{
		public final Map<String, String> options = new LinkedHashMap<>();
		
		@Override
		public void startNewRecord(String name, String[] parameters) throws TabListException
		{
			if (1 != parameters.length)
			{
				throw new TabListException("Option \"" + name + "\" needs exactly 1 value");
			}
			if (null != this.options.putIfAbsent(name, parameters[0]))
			{
				throw new TabListException("Option \"" + name + "\" is set more than once");
			}
		}
		@Override
		public void endRecord() throws TabListException
		{
		}
		@Override
		public void processSubRecord(String name, String[] parameters) throws TabListException
		{
			throw new TabListException("Options don't take sub-records: \"" + name + "\"");
		}
	}
}
