package com.jeffdisher.meridian.dimension;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.jeffdisher.meridian.types.Entity;


/**
 * The parent of a set of dimensions (a "level").  It assigns each attached dimension its id, ticks them, and owns the
 * time of day, which skips to morning once every player of some dimension is asleep.
 * Each attached dimension is given the id its class is registered under so that saves stay stable across restarts.
 * Like its dimensions, a world is only called from its tick thread.
 */
public class World
{
	public static final long TICKS_PER_DAY = 24_000L;

	private final String _name;
	private final DimensionClassRegistry _registry;
	private final DimensionContext _template;
	private final Map<Integer, Dimension> _dimensions;
	private final Set<Integer> _sleepingDimensions;
	private long _timeOfDay;

	/**
	 * @param name The name of the world.
	 * @param registry The dimension classes which can be created in this world.
	 * @param template The context for dimensions created through createDimension() (its registered id is replaced).
	 */
	public World(String name, DimensionClassRegistry registry, DimensionContext template)
	{
		_name = name;
		_registry = registry;
		_template = template;
		_dimensions = new TreeMap<>();
		_sleepingDimensions = new HashSet<>();
	}

	public String getName()
	{
		return _name;
	}

	/**
	 * Creates the dimension bound to the given id in the registry and attaches it to this world.
	 *
	 * @param registeredId The class registry id.
	 * @return The attached dimension, or null if nothing is bound to that id or this world already has that id.
	 */
	public Dimension createDimension(int registeredId)
	{
		Dimension dimension = null;
		if (!_dimensions.containsKey(registeredId))
		{
			Dimension created = _registry.createDimension(registeredId, _template);
			if ((null != created) && created.attachTo(this))
			{
				dimension = created;
			}
		}
		return dimension;
	}

	public Dimension getDimension(int id)
	{
		return _dimensions.get(id);
	}

	/**
	 * @return The attached dimensions, in id order.
	 */
	public Collection<Dimension> getDimensions()
	{
		return Collections.unmodifiableList(new ArrayList<>(_dimensions.values()));
	}

	public long getTimeOfDay()
	{
		return _timeOfDay;
	}

	public void setTimeOfDay(long timeOfDay)
	{
		_timeOfDay = timeOfDay;
	}

	/**
	 * Ticks every attached dimension, in id order, advances the time of day and then skips the night if a
	 * dimension's sleep condition still holds.
	 *
	 * @param currentTick The server tick number.
	 */
	public void doTick(long currentTick)
	{
		for (Dimension dimension : _dimensions.values())
		{
			dimension.doTick(currentTick);
		}
		_timeOfDay += 1L;
		
		boolean shouldSkip = false;
		for (int id : _sleepingDimensions)
		{
			shouldSkip |= _isEveryoneSleeping(_dimensions.get(id));
		}
		_sleepingDimensions.clear();
		if (shouldSkip)
		{
			_timeOfDay = ((_timeOfDay / TICKS_PER_DAY) + 1L) * TICKS_PER_DAY;
			System.out.println("All players asleep in \"" + _name + "\": skipping to morning");
		}
	}

	/**
	 * Re-evaluates whether every player of the given dimension is asleep.  Dimensions call this whenever their set of
	 * players, or a player's snapshot, changes.
	 *
	 * @param dimension An attached dimension.
	 * @return True if the dimension's sleep condition now holds.
	 */
	public boolean checkSleep(Dimension dimension)
	{
		boolean isSleeping = _isEveryoneSleeping(dimension);
		if (isSleeping)
		{
			_sleepingDimensions.add(dimension.getId());
		}
		else
		{
			_sleepingDimensions.remove(dimension.getId());
		}
		return isSleeping;
	}

	/**
	 * Stops background work in every dimension.
	 */
	public void shutdown()
	{
		for (Dimension dimension : _dimensions.values())
		{
			dimension.shutdown();
		}
	}


	/**
	 * Called by Dimension.attachTo() to assign the dimension's id.
	 *
	 * @param dimension The dimension attaching.
	 * @return The assigned id, or Dimension.ID_UNASSIGNED if the registered id is invalid or already used here.
	 */
	int addDimension(Dimension dimension)
	{
		int id = dimension.getRegisteredId();
		int assigned = Dimension.ID_UNASSIGNED;
		if ((id >= 0) && !_dimensions.containsKey(id))
		{
			_dimensions.put(id, dimension);
			assigned = id;
		}
		return assigned;
	}


	private static boolean _isEveryoneSleeping(Dimension dimension)
	{
		Collection<Entity> players = dimension.getPlayers();
		boolean allAsleep = !players.isEmpty();
		for (Entity player : players)
		{
			allAsleep &= player.sleeping();
		}
		return allAsleep;
	}
}
