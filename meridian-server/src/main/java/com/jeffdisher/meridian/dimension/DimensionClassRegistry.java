package com.jeffdisher.meridian.dimension;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.HashMap;
import java.util.Map;

import com.jeffdisher.meridian.persistence.ServerConfig;
import com.jeffdisher.meridian.utils.Assert;


/**
 * Binds numeric dimension ids to the factories which create the dimension for that id.
 * The built-in dimensions are bound to ID_OVERWORLD, ID_NETHER, and ID_THE_END when the registry is created.  Custom
 * dimensions are bound at startup (or plugin load), either to an explicit id or to the next automatic id, counting up
 * from a seed above every built-in id.
 * One instance is created per process and passed to whatever needs it.  There is no internal locking:  registration
 * is expected to happen on one thread before the registry is shared for reading.
 */
public class DimensionClassRegistry
{
	public static final int DEFAULT_AUTO_ID_SEED = 1000;

	private final Map<Integer, IDimensionFactory> _factories;
	private int _nextAutoId;

	/**
	 * Creates a registry with the built-in dimensions bound, counting automatic ids from the configured seed.
	 *
	 * @param config The server options.
	 */
	public DimensionClassRegistry(ServerConfig config)
	{
		this(config.autoDimensionIdSeed);
	}

	/**
	 * Creates a registry with the built-in dimensions bound.
	 *
	 * @param autoIdSeed The first automatically-assigned id (must be greater than every built-in id).
	 */
	public DimensionClassRegistry(int autoIdSeed)
	{
		if (autoIdSeed <= Dimension.ID_THE_END)
		{
			throw new IllegalArgumentException("Automatic dimension ids must start above the built-in ids: " + autoIdSeed);
		}
		_factories = new HashMap<>();
		_factories.put(Dimension.ID_OVERWORLD, (DimensionContext context) -> new Overworld(context));
		_factories.put(Dimension.ID_NETHER, (DimensionContext context) -> new Nether(context));
		_factories.put(Dimension.ID_THE_END, (DimensionContext context) -> new TheEnd(context));
		_nextAutoId = autoIdSeed;
	}

	/**
	 * Binds a custom dimension factory to the next automatic id.
	 *
	 * @param factory The factory.
	 * @return The assigned id.
	 */
	public int register(ICustomDimensionFactory<?> factory)
	{
		int id = _takeNextAutoId();
		_factories.put(id, factory);
		return id;
	}

	/**
	 * Binds a custom dimension factory to an explicit id.
	 *
	 * @param factory The factory.
	 * @param id The id to bind (>= 0).
	 * @param overrideExisting True if an existing binding (even a built-in one) may be replaced.
	 * @return The id (always the one requested).
	 * @throws DimensionRegistrationException The id is negative or already bound without overrideExisting.
	 */
	public int register(ICustomDimensionFactory<?> factory, int id, boolean overrideExisting) throws DimensionRegistrationException
	{
		_checkExplicitId(id, overrideExisting);
		_factories.put(id, factory);
		return id;
	}

	/**
	 * Binds a custom dimension class to the next automatic id.  The class must be a concrete subclass of Dimension,
	 * implement ICustomDimension, and have a public constructor taking a DimensionContext.
	 *
	 * @param type The class.
	 * @return The assigned id.
	 * @throws DimensionRegistrationException The class doesn't have the required shape.
	 */
	public int registerClass(Class<?> type) throws DimensionRegistrationException
	{
		IDimensionFactory factory = _factoryForClass(type);
		int id = _takeNextAutoId();
		_factories.put(id, factory);
		System.out.println("Registered dimension class " + type.getName() + " as " + id);
		return id;
	}

	/**
	 * Binds a custom dimension class to an explicit id.  See registerClass(Class) for the requirements of the class.
	 *
	 * @param type The class.
	 * @param id The id to bind (>= 0).
	 * @param overrideExisting True if an existing binding (even a built-in one) may be replaced.
	 * @return The id (always the one requested).
	 * @throws DimensionRegistrationException The class doesn't have the required shape, the id is negative, or the id
	 * is already bound without overrideExisting.
	 */
	public int registerClass(Class<?> type, int id, boolean overrideExisting) throws DimensionRegistrationException
	{
		// Check the class before the id so that the failure reason never depends on the id.
		IDimensionFactory factory = _factoryForClass(type);
		_checkExplicitId(id, overrideExisting);
		_factories.put(id, factory);
		System.out.println("Registered dimension class " + type.getName() + " as " + id);
		return id;
	}

	public boolean isBound(int id)
	{
		return _factories.containsKey(id);
	}

	public IDimensionFactory getFactory(int id)
	{
		return _factories.get(id);
	}

	/**
	 * Creates a new, detached, dimension for the given id.
	 *
	 * @param id The registered id.
	 * @param template The context to use, stamped with id.
	 * @return The new dimension, or null if nothing is bound to id.
	 */
	public Dimension createDimension(int id, DimensionContext template)
	{
		IDimensionFactory factory = _factories.get(id);
		return (null != factory)
				? factory.create(template.withRegisteredId(id))
				: null
		;
	}

	/**
	 * @return The id the next automatic registration would receive.
	 */
	public int peekNextAutoId()
	{
		int id = _nextAutoId;
		while (_factories.containsKey(id))
		{
			id += 1;
		}
		return id;
	}


	private int _takeNextAutoId()
	{
		// Skip anything bound explicitly in the automatic range.
		int id = peekNextAutoId();
		_nextAutoId = id + 1;
		return id;
	}

	private void _checkExplicitId(int id, boolean overrideExisting) throws DimensionRegistrationException
	{
		if (id < 0)
		{
			throw new DimensionRegistrationException(DimensionRegistrationException.Reason.INVALID_ID, "Dimension ids cannot be negative: " + id);
		}
		if (!overrideExisting && _factories.containsKey(id))
		{
			throw new DimensionRegistrationException(DimensionRegistrationException.Reason.ID_ALREADY_BOUND, "Dimension id already bound: " + id);
		}
	}

	private static IDimensionFactory _factoryForClass(Class<?> type) throws DimensionRegistrationException
	{
		boolean isShapeValid = Dimension.class.isAssignableFrom(type)
				&& ICustomDimension.class.isAssignableFrom(type)
				&& !type.isInterface()
				&& !Modifier.isAbstract(type.getModifiers())
		;
		if (!isShapeValid)
		{
			throw new DimensionRegistrationException(DimensionRegistrationException.Reason.INVALID_DIMENSION_CLASS, "Not a concrete custom dimension: " + type.getName());
		}
		Constructor<?> constructor;
		try
		{
			constructor = type.getConstructor(DimensionContext.class);
		}
		catch (NoSuchMethodException e)
		{
			throw new DimensionRegistrationException(DimensionRegistrationException.Reason.INVALID_DIMENSION_CLASS, "Missing public (DimensionContext) constructor: " + type.getName());
		}
		return (DimensionContext context) -> {
			try
			{
				return (Dimension) constructor.newInstance(context);
			}
			catch (InvocationTargetException e)
			{
				Throwable cause = e.getCause();
				if (cause instanceof RuntimeException)
				{
					throw (RuntimeException) cause;
				}
				throw Assert.unexpected(cause);
			}
			catch (InstantiationException | IllegalAccessException e)
			{
				// We checked that the class is concrete and the constructor public.
				throw Assert.unexpected(e);
			}
		};
	}
}
