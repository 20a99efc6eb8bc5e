package com.jeffdisher.meridian.dimension;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import com.jeffdisher.meridian.broadcast.ITransportAdapter;
import com.jeffdisher.meridian.broadcast.PacketBroadcastQueue;
import com.jeffdisher.meridian.data.Chunk;
import com.jeffdisher.meridian.index.ChunkIndex;
import com.jeffdisher.meridian.index.EntityIndex;
import com.jeffdisher.meridian.index.PlayerIndex;
import com.jeffdisher.meridian.index.TileIndex;
import com.jeffdisher.meridian.net.Packet;
import com.jeffdisher.meridian.net.Packet_ChunkData;
import com.jeffdisher.meridian.persistence.ChunkPrefetcher;
import com.jeffdisher.meridian.persistence.IChunkStore;
import com.jeffdisher.meridian.persistence.ServerConfig;
import com.jeffdisher.meridian.registries.DimensionTypeRegistry;
import com.jeffdisher.meridian.types.AbsoluteLocation;
import com.jeffdisher.meridian.types.ChunkAddress;
import com.jeffdisher.meridian.types.DimensionType;
import com.jeffdisher.meridian.types.Entity;
import com.jeffdisher.meridian.types.EntityLocation;
import com.jeffdisher.meridian.types.SkyColor;
import com.jeffdisher.meridian.types.Tile;
import com.jeffdisher.meridian.utils.Assert;
import com.jeffdisher.meridian.weather.WeatherState;


/**
 * One layer of a world (the overworld, the nether, or a custom layer) and everything indexed within it:  resident
 * chunks, entities, tiles, players, the outbound per-chunk packets, and the weather.
 * A dimension is created detached and becomes usable once attachTo() has succeeded, which assigns its id.  It can
 * never be re-attached.
 * Like the indexes it owns, a dimension is only called from the tick thread of its world.
 */
public abstract class Dimension
{
	public static final int ID_UNASSIGNED = -1;
	public static final int ID_OVERWORLD = 0;
	public static final int ID_NETHER = 1;
	public static final int ID_THE_END = 2;

	private final int _registeredId;
	private final DimensionTypeRegistry _types;
	private final IChunkStore _chunkStore;
	private final ITransportAdapter _transport;
	private final ChunkIndex _chunks;
	private final PacketBroadcastQueue _packets;
	private final EntityIndex _entities;
	private final TileIndex _tiles;
	private final WeatherState _weather;

	private DimensionType _dimensionType;
	private Float _distanceMultiplierOverride;
	private World _world;
	private int _dimensionId;
	private ChunkPrefetcher _prefetcher;

	/**
	 * Dimensions which will be attached to a world must be created through DimensionClassRegistry.createDimension()
	 * (or World.createDimension()), which stamps the context with the registered id.  A dimension built from an
	 * unstamped context keeps ID_UNASSIGNED as its registered id and every attachTo() will fail.
	 *
	 * @param context The collaborators and options of the dimension.
	 * @param typeId The initial dimension type.
	 * @throws com.jeffdisher.meridian.registries.InvalidDimensionTypeException The type id is unknown.
	 */
	protected Dimension(DimensionContext context, int typeId)
	{
		_registeredId = context.registeredId();
		_types = context.types();
		_chunkStore = context.chunkStore();
		_transport = context.transport();
		_chunks = new ChunkIndex(_chunkStore);
		_packets = new PacketBroadcastQueue(context.compiler());
		_entities = new EntityIndex(_chunks, (Entity player) -> _playerRemoved(player));
		_tiles = new TileIndex(_chunks, _packets);
		ServerConfig config = context.config();
		_weather = new WeatherState(context.random()
				, config.weatherMinTicks
				, config.weatherMaxTicks
				, config.thunderChancePercent
				, config.maxRainLevel
				, () -> _entities.getPlayerIndex().getAll()
				, _transport
		);

		setDimensionType(typeId);
		_dimensionId = ID_UNASSIGNED;
	}

	/**
	 * @return The friendly name of this dimension.
	 */
	public abstract String getDimensionName();

	/**
	 * @return The parent world, or null if this dimension hasn't been attached.
	 */
	public World getWorld()
	{
		return _world;
	}

	/**
	 * Attaches this dimension to a world, which assigns its id.  This can only succeed once.
	 *
	 * @param world The parent world.
	 * @return True if attached, false if this dimension was already attached or the world refused it.
	 */
	public boolean attachTo(World world)
	{
		boolean didAttach = false;
		if (null == _world)
		{
			int id = world.addDimension(this);
			if (ID_UNASSIGNED != id)
			{
				_world = world;
				_dimensionId = id;
				didAttach = true;
				System.out.println("Dimension \"" + getDimensionName() + "\" attached to \"" + world.getName() + "\" as " + id);
			}
		}
		return didAttach;
	}

	/**
	 * @return The id within the parent world, or ID_UNASSIGNED if not yet attached.
	 */
	public final int getId()
	{
		return _dimensionId;
	}

	/**
	 * @return The id this dimension's class is bound to in the DimensionClassRegistry.
	 */
	public final int getRegisteredId()
	{
		return _registeredId;
	}

	public DimensionType getDimensionType()
	{
		return _dimensionType;
	}

	/**
	 * Changes the type of this dimension.
	 *
	 * @param typeId The id of the new type.
	 * @throws com.jeffdisher.meridian.registries.InvalidDimensionTypeException The type id is unknown.
	 */
	public void setDimensionType(int typeId)
	{
		_dimensionType = _types.get(typeId);
	}

	/**
	 * Returns how many overworld blocks one block of this dimension spans, horizontally (8 for the nether).  This is
	 * the type's multiplier unless overridden.
	 *
	 * @return The distance multiplier.
	 */
	public float getDistanceMultiplier()
	{
		return (null != _distanceMultiplierOverride)
				? _distanceMultiplierOverride
				: _dimensionType.distanceMultiplier()
		;
	}

	/**
	 * @param multiplier The new multiplier (must be positive) or null to go back to the type's.
	 */
	public void setDistanceMultiplier(Float multiplier)
	{
		if ((null != multiplier) && !(multiplier > 0.0f))
		{
			throw new IllegalArgumentException("Distance multiplier must be positive: " + multiplier);
		}
		_distanceMultiplierOverride = multiplier;
	}

	public final SkyColor getSkyColor()
	{
		return _dimensionType.skyColor();
	}

	public final int getMaxBuildHeight()
	{
		return _dimensionType.maxBuildHeight();
	}

	/**
	 * Runs one tick of this dimension:  absorbs any prefetched chunks and then advances the weather.
	 *
	 * @param currentTick The server tick number.
	 */
	public void doTick(long currentTick)
	{
		if (null != _prefetcher)
		{
			for (Chunk chunk : _prefetcher.drainLoaded())
			{
				_chunks.absorb(chunk);
			}
		}
		_weather.tick(currentTick);
	}

	// ----- Chunks -----

	/**
	 * @see ChunkIndex#get(int, int, boolean)
	 */
	public Chunk getChunk(int chunkX, int chunkZ, boolean generate)
	{
		return _chunks.get(chunkX, chunkZ, generate);
	}

	public Chunk getChunk(int chunkX, int chunkZ)
	{
		return _chunks.get(chunkX, chunkZ, false);
	}

	public Collection<Chunk> getChunks()
	{
		return _chunks.getResidentChunks();
	}

	public boolean isChunkResident(int chunkX, int chunkZ)
	{
		return _chunks.isResident(chunkX, chunkZ);
	}

	/**
	 * Drops a resident chunk (and its compiled packet).  Entities and tiles stay indexed by id.
	 *
	 * @param chunkX The chunk x.
	 * @param chunkZ The chunk z.
	 * @return True if the chunk was resident.
	 */
	public boolean unloadChunk(int chunkX, int chunkZ)
	{
		_packets.invalidate(chunkX, chunkZ);
		return (null != _chunks.unload(chunkX, chunkZ));
	}

	/**
	 * Starts background loading of chunks requested through prefetchChunk().  Loaded chunks become resident at the
	 * start of the next tick.
	 */
	public void enablePrefetching()
	{
		Assert.assertTrue(null == _prefetcher);
		_prefetcher = new ChunkPrefetcher(_chunkStore, getDimensionName());
	}

	/**
	 * @param chunkX The chunk x.
	 * @param chunkZ The chunk z.
	 * @return True if a background load was started (false if resident, already pending, or prefetching is off).
	 */
	public boolean prefetchChunk(int chunkX, int chunkZ)
	{
		return (null != _prefetcher) && !_chunks.isResident(chunkX, chunkZ) && _prefetcher.request(chunkX, chunkZ);
	}

	/**
	 * Stops any background work.  The dimension must not be ticked after this.
	 */
	public void shutdown()
	{
		if (null != _prefetcher)
		{
			_prefetcher.shutdown();
			_prefetcher = null;
		}
	}

	// ----- Entities and players -----

	/**
	 * Adds (or replaces, by id) an entity.  Players are also added to the player index.
	 *
	 * @param entity The entity.
	 */
	public void addEntity(Entity entity)
	{
		_entities.add(entity);
		if (entity.isPlayer() && (null != _world))
		{
			// Players change their sleeping state by re-adding so re-evaluate the world's sleep condition.
			_world.checkSleep(this);
		}
	}

	/**
	 * Removes an entity from this dimension's indexes.  The entity is NOT finalized as it may be moving to another
	 * dimension.
	 *
	 * @param entity The entity (only its id is used).
	 * @return True if it was present.
	 */
	public boolean removeEntity(Entity entity)
	{
		return (null != _entities.remove(entity.id()));
	}

	/**
	 * Moves an entity from another dimension into this one, scaling its horizontal position by the ratio of the
	 * distance multipliers.
	 *
	 * @param entity The entity to move.
	 * @param source The dimension currently holding it.
	 * @return The moved entity, or null if source didn't hold it.
	 */
	public Entity transferEntity(Entity entity, Dimension source)
	{
		Assert.assertTrue(this != source);
		Entity moved = null;
		Entity current = source._entities.get(entity.id());
		if ((null != current) && source.removeEntity(current))
		{
			float ratio = source.getDistanceMultiplier() / getDistanceMultiplier();
			EntityLocation old = current.location();
			moved = current.withLocation(new EntityLocation(old.x() * ratio, old.y(), old.z() * ratio));
			addEntity(moved);
		}
		return moved;
	}

	public Entity getEntity(int entityId)
	{
		return _entities.get(entityId);
	}

	public Collection<Entity> getEntities()
	{
		return _entities.getAll();
	}

	public List<Entity> getChunkEntities(int chunkX, int chunkZ)
	{
		return _entities.byChunk(chunkX, chunkZ);
	}

	public Collection<Entity> getPlayers()
	{
		return _entities.getPlayerIndex().getAll();
	}

	public PlayerIndex getPlayerIndex()
	{
		return _entities.getPlayerIndex();
	}

	public List<Entity> getChunkPlayers(int chunkX, int chunkZ)
	{
		return _entities.getPlayerIndex().chunkPlayers(chunkX, chunkZ);
	}

	// ----- Tiles -----

	/**
	 * Adds (or replaces) a tile, dropping the compiled packet of its chunk.
	 *
	 * @param tile The tile.
	 */
	public void addTile(Tile tile)
	{
		_tiles.add(tile);
	}

	/**
	 * Removes a tile, dropping the compiled packet of its chunk.
	 *
	 * @param tile The tile (only its id is used).
	 * @return True if it was present.
	 */
	public boolean removeTile(Tile tile)
	{
		return (null != _tiles.remove(tile.id()));
	}

	public Tile getTileById(int tileId)
	{
		return _tiles.get(tileId);
	}

	public Tile getTile(AbsoluteLocation location)
	{
		return _tiles.getTileAt(location);
	}

	public Collection<Tile> getTiles()
	{
		return _tiles.getAll();
	}

	public List<Tile> getChunkTiles(int chunkX, int chunkZ)
	{
		return _tiles.byChunk(chunkX, chunkZ);
	}

	// ----- Packets -----

	/**
	 * Queues packets for every player watching the given chunk, sent on the next flush.
	 *
	 * @param chunkX The chunk x.
	 * @param chunkZ The chunk z.
	 * @param packets The packets, in order.
	 */
	public void addChunkPacket(int chunkX, int chunkZ, Packet... packets)
	{
		_packets.enqueue(chunkX, chunkZ, packets);
	}

	/**
	 * Removes and returns all queued per-chunk packets, for a transport which fans them out itself.
	 *
	 * @return The batches by chunk.
	 */
	public Map<ChunkAddress, List<Packet>> drainChunkPackets()
	{
		return _packets.drainAll();
	}

	/**
	 * Drains all queued per-chunk packets and sends each batch, in order, to the players watching its chunk.
	 *
	 * @return The number of packets handed to the transport.
	 */
	public int flushChunkPackets()
	{
		int sent = 0;
		for (Map.Entry<ChunkAddress, List<Packet>> elt : _packets.drainAll().entrySet())
		{
			ChunkAddress address = elt.getKey();
			List<Entity> watchers = getChunkPlayers(address.x(), address.z());
			for (Packet packet : elt.getValue())
			{
				for (Entity player : watchers)
				{
					_transport.sendPacket(player, packet);
					sent += 1;
				}
			}
		}
		return sent;
	}

	/**
	 * Returns the compiled packet of a resident chunk, compiling it if it changed since the last call.
	 *
	 * @param chunkX The chunk x.
	 * @param chunkZ The chunk z.
	 * @return The packet, or null if the chunk isn't resident.
	 */
	public Packet_ChunkData getCompiledChunkPacket(int chunkX, int chunkZ)
	{
		Chunk chunk = _chunks.getIfResident(chunkX, chunkZ);
		return (null != chunk)
				? _packets.getCompiledChunkPacket(chunk)
				: null
		;
	}

	public boolean hasCompiledChunkPacket(int chunkX, int chunkZ)
	{
		return _packets.hasCompiledChunkPacket(chunkX, chunkZ);
	}

	/**
	 * Called after a block changed so that the compiled packet of its chunk is rebuilt.
	 *
	 * @param location The changed block.
	 */
	public void blockChanged(AbsoluteLocation location)
	{
		ChunkAddress address = location.getChunkAddress();
		_packets.invalidate(address.x(), address.z());
	}

	// ----- Weather -----

	public WeatherState getWeather()
	{
		return _weather;
	}

	public int getRainLevel()
	{
		return _weather.getRainLevel();
	}

	public void setRainLevel(int level)
	{
		_weather.setRainLevel(level);
	}

	public int getThunderLevel()
	{
		return _weather.getThunderLevel();
	}

	public void setThunderLevel(int level)
	{
		_weather.setThunderLevel(level);
	}

	/**
	 * Sends the current weather to the given players, or to all players in the dimension if none are given.
	 *
	 * @param targets The players to send to.
	 */
	public void sendWeather(Entity... targets)
	{
		_weather.broadcast(targets);
	}


	private void _playerRemoved(Entity player)
	{
		if (null != _world)
		{
			_world.checkSleep(this);
		}
	}
}
