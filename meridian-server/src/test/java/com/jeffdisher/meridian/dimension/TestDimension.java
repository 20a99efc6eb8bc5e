package com.jeffdisher.meridian.dimension;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;

import com.jeffdisher.meridian.broadcast.IChunkPacketCompiler;
import com.jeffdisher.meridian.broadcast.ITransportAdapter;
import com.jeffdisher.meridian.data.Chunk;
import com.jeffdisher.meridian.net.Packet;
import com.jeffdisher.meridian.net.Packet_ChunkData;
import com.jeffdisher.meridian.net.Packet_LevelEvent;
import com.jeffdisher.meridian.persistence.IChunkStore;
import com.jeffdisher.meridian.persistence.ServerConfig;
import com.jeffdisher.meridian.registries.DimensionTypeRegistry;
import com.jeffdisher.meridian.registries.InvalidDimensionTypeException;
import com.jeffdisher.meridian.types.AbsoluteLocation;
import com.jeffdisher.meridian.types.ChunkAddress;
import com.jeffdisher.meridian.types.Entity;
import com.jeffdisher.meridian.types.EntityKind;
import com.jeffdisher.meridian.types.EntityLocation;
import com.jeffdisher.meridian.types.SkyColor;
import com.jeffdisher.meridian.types.Tile;


public class TestDimension
{
	private static DimensionTypeRegistry TYPES;
	@BeforeClass
	public static void setup() throws Throwable
	{
		TYPES = DimensionTypeRegistry.loadDefaults();
	}

	@Test
	public void attachOnce() throws Throwable
	{
		DimensionClassRegistry registry = new DimensionClassRegistry(DimensionClassRegistry.DEFAULT_AUTO_ID_SEED);
		DimensionContext template = _template(new _CapturingTransport(), new _CountingStore());
		World world = new World("world", registry, template);
		World other = new World("other", registry, template);
		Dimension nether = registry.createDimension(Dimension.ID_NETHER, template);
		Assert.assertNull(nether.getWorld());
		Assert.assertEquals(Dimension.ID_UNASSIGNED, nether.getId());
		
		Assert.assertTrue(nether.attachTo(world));
		Assert.assertSame(world, nether.getWorld());
		Assert.assertEquals(Dimension.ID_NETHER, nether.getId());
		Assert.assertSame(nether, world.getDimension(Dimension.ID_NETHER));
		
		// A dimension can't be re-attached, not even to another world.
		Assert.assertFalse(nether.attachTo(other));
		Assert.assertFalse(nether.attachTo(world));
		Assert.assertSame(world, nether.getWorld());
		Assert.assertNull(other.getDimension(Dimension.ID_NETHER));
	}

	@Test
	public void dimensionTypes() throws Throwable
	{
		Dimension overworld = new Overworld(_template(new _CapturingTransport(), new _CountingStore()));
		Assert.assertEquals(SkyColor.BLUE, overworld.getSkyColor());
		Assert.assertEquals(256, overworld.getMaxBuildHeight());
		try
		{
			overworld.setDimensionType(99);
			Assert.fail();
		}
		catch (InvalidDimensionTypeException e)
		{
			Assert.assertEquals(99, e.typeId);
		}
		// The failed change left the type alone.
		Assert.assertEquals(DimensionTypeRegistry.OVERWORLD, overworld.getDimensionType().id());
		
		overworld.setDimensionType(DimensionTypeRegistry.THE_END);
		Assert.assertEquals(SkyColor.PURPLE_STATIC, overworld.getSkyColor());
		
		overworld.setDistanceMultiplier(4.0f);
		Assert.assertEquals(4.0f, overworld.getDistanceMultiplier(), 0.0f);
		overworld.setDistanceMultiplier(null);
		Assert.assertEquals(1.0f, overworld.getDistanceMultiplier(), 0.0f);
	}

	@Test
	public void transferScalesPosition() throws Throwable
	{
		DimensionClassRegistry registry = new DimensionClassRegistry(DimensionClassRegistry.DEFAULT_AUTO_ID_SEED);
		World world = new World("world", registry, _template(new _CapturingTransport(), new _CountingStore()));
		Dimension overworld = world.createDimension(Dimension.ID_OVERWORLD);
		Dimension nether = world.createDimension(Dimension.ID_NETHER);
		Entity pig = new Entity(5, EntityKind.CREATURE, new EntityLocation(10.0f, 70.0f, -4.0f), false);
		nether.addEntity(pig);
		
		Entity moved = overworld.transferEntity(pig, nether);
		Assert.assertEquals(new EntityLocation(80.0f, 70.0f, -32.0f), moved.location());
		Assert.assertNull(nether.getEntity(5));
		Assert.assertSame(moved, overworld.getEntity(5));
		
		Entity back = nether.transferEntity(moved, overworld);
		Assert.assertEquals(new EntityLocation(10.0f, 70.0f, -4.0f), back.location());
		
		// Nothing to move from a dimension which doesn't hold the entity.
		Assert.assertNull(nether.transferEntity(pig, overworld));
		Assert.assertSame(back, nether.getEntity(5));
	}

	@Test
	public void playersAndEntities() throws Throwable
	{
		Dimension overworld = new Overworld(_template(new _CapturingTransport(), new _CountingStore()));
		overworld.getChunk(0, 0, true);
		Entity player = _player(1, 2.0f, 2.0f, false);
		Entity cow = new Entity(2, EntityKind.CREATURE, new EntityLocation(4.0f, 64.0f, 4.0f), false);
		overworld.addEntity(player);
		overworld.addEntity(cow);
		
		Assert.assertEquals(List.of(player, cow), overworld.getChunkEntities(0, 0));
		Assert.assertEquals(List.of(player), List.copyOf(overworld.getPlayers()));
		Assert.assertEquals(2, overworld.getEntities().size());
		
		// Removing an entity isn't finalizing it:  it can be added back.
		Assert.assertTrue(overworld.removeEntity(player));
		Assert.assertFalse(overworld.removeEntity(player));
		Assert.assertTrue(overworld.getPlayers().isEmpty());
		overworld.addEntity(player);
		Assert.assertSame(player, overworld.getPlayerIndex().get(1));
	}

	@Test
	public void flushToWatchers() throws Throwable
	{
		_CapturingTransport transport = new _CapturingTransport();
		Dimension overworld = new Overworld(_template(transport, new _CountingStore()));
		Entity first = _player(1, 0.0f, 0.0f, false);
		Entity second = _player(2, 0.0f, 0.0f, false);
		overworld.addEntity(first);
		overworld.addEntity(second);
		overworld.getPlayerIndex().setWatchedChunks(1, List.of(new ChunkAddress(0, 0)));
		overworld.getPlayerIndex().setWatchedChunks(2, List.of(new ChunkAddress(0, 0), new ChunkAddress(1, 0)));
		Assert.assertEquals(List.of(first, second), overworld.getChunkPlayers(0, 0));
		
		Packet a = new Packet_LevelEvent(1, 0);
		Packet b = new Packet_LevelEvent(2, 0);
		Packet c = new Packet_LevelEvent(3, 0);
		overworld.addChunkPacket(0, 0, a, b);
		overworld.addChunkPacket(1, 0, c);
		// Nobody watches this chunk so these packets are dropped.
		overworld.addChunkPacket(5, 5, new Packet_LevelEvent(4, 0));
		
		Assert.assertEquals(5, overworld.flushChunkPackets());
		Assert.assertEquals(List.of(first, second, first, second, second), transport.recipients);
		Assert.assertEquals(List.of(a, a, b, b, c), transport.packets);
		Assert.assertEquals(0, overworld.flushChunkPackets());
		Assert.assertTrue(overworld.drainChunkPackets().isEmpty());
	}

	@Test
	public void compiledChunkPackets() throws Throwable
	{
		_CountingStore store = new _CountingStore();
		Dimension overworld = new Overworld(_template(new _CapturingTransport(), store));
		Assert.assertNull(overworld.getCompiledChunkPacket(0, 0));
		Chunk chunk = overworld.getChunk(0, 0, true);
		Assert.assertTrue(overworld.isChunkResident(0, 0));
		overworld.getChunk(1, 0, true);
		
		Packet_ChunkData compiled = overworld.getCompiledChunkPacket(0, 0);
		Assert.assertEquals(chunk.getAddress(), compiled.address);
		Assert.assertSame(compiled, overworld.getCompiledChunkPacket(0, 0));
		overworld.getCompiledChunkPacket(1, 0);
		Assert.assertEquals(2, store.compiles);
		
		// Tile changes drop only their own chunk's packet.
		Tile chest = new Tile(1, "chest", new AbsoluteLocation(3, 64, 3));
		overworld.addTile(chest);
		Assert.assertFalse(overworld.hasCompiledChunkPacket(0, 0));
		Assert.assertTrue(overworld.hasCompiledChunkPacket(1, 0));
		Assert.assertSame(chest, overworld.getTile(new AbsoluteLocation(3, 64, 3)));
		Assert.assertSame(chest, overworld.getTileById(1));
		Assert.assertEquals(List.of(chest), overworld.getChunkTiles(0, 0));
		Assert.assertNotSame(compiled, overworld.getCompiledChunkPacket(0, 0));
		Assert.assertEquals(3, store.compiles);
		
		Assert.assertTrue(overworld.removeTile(chest));
		Assert.assertFalse(overworld.removeTile(chest));
		Assert.assertFalse(overworld.hasCompiledChunkPacket(0, 0));
		Assert.assertTrue(overworld.getTiles().isEmpty());
		
		// Block changes do the same.
		overworld.getCompiledChunkPacket(1, 0);
		overworld.blockChanged(new AbsoluteLocation(17, 10, 0));
		Assert.assertFalse(overworld.hasCompiledChunkPacket(1, 0));
		
		overworld.getCompiledChunkPacket(1, 0);
		Assert.assertTrue(overworld.unloadChunk(1, 0));
		Assert.assertFalse(overworld.hasCompiledChunkPacket(1, 0));
		Assert.assertFalse(overworld.isChunkResident(1, 0));
		Assert.assertFalse(overworld.unloadChunk(1, 0));
		Assert.assertEquals(1, overworld.getChunks().size());
	}

	@Test
	public void weather() throws Throwable
	{
		_CapturingTransport transport = new _CapturingTransport();
		Dimension overworld = new Overworld(_template(transport, new _CountingStore()));
		overworld.addEntity(_player(1, 0.0f, 0.0f, false));
		overworld.addEntity(_player(2, 0.0f, 0.0f, false));
		overworld.addEntity(_player(3, 0.0f, 0.0f, false));
		
		overworld.setRainLevel(5);
		Assert.assertEquals(5, overworld.getRainLevel());
		Assert.assertEquals(6, transport.packets.size());
		Packet_LevelEvent rain = (Packet_LevelEvent) transport.packets.get(0);
		Assert.assertEquals(Packet_LevelEvent.EVENT_START_RAIN, rain.eventId);
		Assert.assertEquals(5, rain.data);
		Packet_LevelEvent thunder = (Packet_LevelEvent) transport.packets.get(1);
		Assert.assertEquals(Packet_LevelEvent.EVENT_STOP_THUNDER, thunder.eventId);
		
		// A joining player can be sent just the current state.
		Entity joining = _player(4, 0.0f, 0.0f, false);
		overworld.sendWeather(joining);
		Assert.assertEquals(8, transport.packets.size());
		Assert.assertSame(joining, transport.recipients.get(7));
	}

	@Test
	public void prefetching() throws Throwable
	{
		_CountingStore store = new _CountingStore();
		Dimension overworld = new Overworld(_template(new _CapturingTransport(), store));
		// Prefetching is off until enabled.
		Assert.assertFalse(overworld.prefetchChunk(3, 3));
		overworld.enablePrefetching();
		Assert.assertTrue(overworld.prefetchChunk(3, 3));
		
		// We should see this become resident at the start of some tick (we will use 10 tries, with sleeps).
		long tick = 0L;
		overworld.doTick(tick);
		for (int i = 0; !overworld.isChunkResident(3, 3) && (i < 10); ++i)
		{
			Thread.sleep(10L);
			tick += 1L;
			overworld.doTick(tick);
		}
		Assert.assertTrue(overworld.isChunkResident(3, 3));
		Assert.assertFalse(overworld.prefetchChunk(3, 3));
		overworld.shutdown();
	}


	private static DimensionContext _template(ITransportAdapter transport, _CountingStore store)
	{
		return new DimensionContext(Dimension.ID_UNASSIGNED
				, TYPES
				, store
				, store
				, transport
				, new ServerConfig()
				, new Random(1L)
		);
	}

	private static Entity _player(int id, float x, float z, boolean sleeping)
	{
		return new Entity(id, EntityKind.PLAYER, new EntityLocation(x, 64.0f, z), sleeping);
	}


	private static class _CountingStore implements IChunkStore, IChunkPacketCompiler
	{
		public int compiles = 0;
		@Override
		public Chunk load(int chunkX, int chunkZ)
		{
			return null;
		}
		@Override
		public Chunk generate(int chunkX, int chunkZ)
		{
			return new Chunk(new ChunkAddress(chunkX, chunkZ), new byte[0]);
		}
		@Override
		public Packet_ChunkData compile(Chunk chunk)
		{
			this.compiles += 1;
			return new Packet_ChunkData(chunk.getAddress(), chunk.getTerrain());
		}
	}

	private static class _CapturingTransport implements ITransportAdapter
	{
		public final List<Entity> recipients = new ArrayList<>();
		public final List<Packet> packets = new ArrayList<>();
		@Override
		public void sendPacket(Entity player, Packet packet)
		{
			this.recipients.add(player);
			this.packets.add(packet);
		}
	}
}
