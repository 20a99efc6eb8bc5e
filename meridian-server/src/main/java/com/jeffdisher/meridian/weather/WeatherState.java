package com.jeffdisher.meridian.weather;

import java.util.Collection;
import java.util.List;
import java.util.Random;
import java.util.function.Supplier;

import com.jeffdisher.meridian.broadcast.ITransportAdapter;
import com.jeffdisher.meridian.net.Packet_LevelEvent;
import com.jeffdisher.meridian.types.Entity;


/**
 * The rain and thunder of one dimension.  Intensities are 0 when inactive and positive when active.
 * The weather changes at scheduled ticks:  either to a target set with scheduleChange() or, by default, along the
 * natural cycle (clear turns to rain, possibly with thunder, and rain turns to clear).  Every change is broadcast to
 * the dimension's players.
 */
public class WeatherState
{
	public static final long NOTHING_SCHEDULED = -1L;

	private final Random _random;
	private final int _minDurationTicks;
	private final int _maxDurationTicks;
	private final int _thunderChancePercent;
	private final int _maxRainLevel;
	private final Supplier<Collection<Entity>> _allPlayers;
	private final ITransportAdapter _transport;

	private int _rainLevel;
	private int _thunderLevel;
	private long _nextChangeTick;
	private boolean _hasScheduledTarget;
	private int _targetRainLevel;
	private int _targetThunderLevel;

	public WeatherState(Random random
			, int minDurationTicks
			, int maxDurationTicks
			, int thunderChancePercent
			, int maxRainLevel
			, Supplier<Collection<Entity>> allPlayers
			, ITransportAdapter transport
	)
	{
		if ((minDurationTicks <= 0) || (minDurationTicks > maxDurationTicks))
		{
			throw new IllegalArgumentException("Invalid weather duration range: [" + minDurationTicks + ".." + maxDurationTicks + "]");
		}
		_random = random;
		_minDurationTicks = minDurationTicks;
		_maxDurationTicks = maxDurationTicks;
		_thunderChancePercent = thunderChancePercent;
		_maxRainLevel = maxRainLevel;
		_allPlayers = allPlayers;
		_transport = transport;
		_nextChangeTick = NOTHING_SCHEDULED;
	}

	/**
	 * Applies the scheduled change if it is due, broadcasting the new weather.  The first call only schedules the
	 * first change.
	 * 
	 * @param currentTick The current server tick.
	 * @return True if the weather changed.
	 */
	public boolean tick(long currentTick)
	{
		boolean didChange = false;
		if (NOTHING_SCHEDULED == _nextChangeTick)
		{
			_nextChangeTick = currentTick + _randomDuration();
		}
		else if (currentTick >= _nextChangeTick)
		{
			if (_hasScheduledTarget)
			{
				_rainLevel = _targetRainLevel;
				_thunderLevel = _targetThunderLevel;
				_hasScheduledTarget = false;
			}
			else if (_rainLevel > 0)
			{
				_rainLevel = 0;
				_thunderLevel = 0;
			}
			else
			{
				_rainLevel = 1 + _random.nextInt(_maxRainLevel);
				_thunderLevel = (_random.nextInt(100) < _thunderChancePercent)
						? 1 + _random.nextInt(_maxRainLevel)
						: 0
				;
			}
			_nextChangeTick = currentTick + _randomDuration();
			broadcast();
			didChange = true;
		}
		return didChange;
	}

	/**
	 * Replaces the next scheduled change with an explicit target.
	 * 
	 * @param changeTick The tick when the change should apply (>= 0).
	 * @param rainLevel The rain level to apply (>= 0).
	 * @param thunderLevel The thunder level to apply (>= 0).
	 */
	public void scheduleChange(long changeTick, int rainLevel, int thunderLevel)
	{
		if (changeTick < 0L)
		{
			throw new IllegalArgumentException("Weather changes cannot be scheduled at a negative tick: " + changeTick);
		}
		_checkLevel(rainLevel);
		_checkLevel(thunderLevel);
		_nextChangeTick = changeTick;
		_hasScheduledTarget = true;
		_targetRainLevel = rainLevel;
		_targetThunderLevel = thunderLevel;
	}

	public long getNextChangeTick()
	{
		return _nextChangeTick;
	}

	public int getRainLevel()
	{
		return _rainLevel;
	}

	/**
	 * Sets the rain level immediately, broadcasting to all players if it changed.
	 * 
	 * @param level The new level (>= 0).
	 */
	public void setRainLevel(int level)
	{
		_checkLevel(level);
		if (level != _rainLevel)
		{
			_rainLevel = level;
			broadcast();
		}
	}

	public int getThunderLevel()
	{
		return _thunderLevel;
	}

	/**
	 * Sets the thunder level immediately, broadcasting to all players if it changed.
	 * 
	 * @param level The new level (>= 0).
	 */
	public void setThunderLevel(int level)
	{
		_checkLevel(level);
		if (level != _thunderLevel)
		{
			_thunderLevel = level;
			broadcast();
		}
	}

	/**
	 * Sends the current rain and thunder to the given players or, if none are given, to every player in the
	 * dimension.  This doesn't change any state.
	 * 
	 * @param targets The players to send to (all players if empty).
	 */
	public void broadcast(Entity... targets)
	{
		Packet_LevelEvent rain = (_rainLevel > 0)
				? new Packet_LevelEvent(Packet_LevelEvent.EVENT_START_RAIN, _rainLevel)
				: new Packet_LevelEvent(Packet_LevelEvent.EVENT_STOP_RAIN, 0)
		;
		Packet_LevelEvent thunder = (_thunderLevel > 0)
				? new Packet_LevelEvent(Packet_LevelEvent.EVENT_START_THUNDER, _thunderLevel)
				: new Packet_LevelEvent(Packet_LevelEvent.EVENT_STOP_THUNDER, 0)
		;
		Collection<Entity> recipients = (0 == targets.length)
				? _allPlayers.get()
				: List.of(targets)
		;
		for (Entity player : recipients)
		{
			_transport.sendPacket(player, rain);
			_transport.sendPacket(player, thunder);
		}
	}


	private int _randomDuration()
	{
		return _minDurationTicks + _random.nextInt(_maxDurationTicks - _minDurationTicks + 1);
	}

	private static void _checkLevel(int level)
	{
		if (level < 0)
		{
			throw new IllegalArgumentException("Weather levels cannot be negative: " + level);
		}
	}
}
