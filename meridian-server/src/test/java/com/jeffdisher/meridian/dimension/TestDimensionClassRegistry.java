package com.jeffdisher.meridian.dimension;

import java.util.Map;
import java.util.Random;

import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;

import com.jeffdisher.meridian.data.Chunk;
import com.jeffdisher.meridian.net.Packet_ChunkData;
import com.jeffdisher.meridian.persistence.IChunkStore;
import com.jeffdisher.meridian.persistence.ServerConfig;
import com.jeffdisher.meridian.registries.DimensionTypeRegistry;


public class TestDimensionClassRegistry
{
	private static DimensionTypeRegistry TYPES;
	@BeforeClass
	public static void setup() throws Throwable
	{
		TYPES = DimensionTypeRegistry.loadDefaults();
	}

	@Test
	public void builtIns() throws Throwable
	{
		DimensionClassRegistry registry = new DimensionClassRegistry(DimensionClassRegistry.DEFAULT_AUTO_ID_SEED);
		Assert.assertTrue(registry.isBound(Dimension.ID_OVERWORLD));
		Assert.assertTrue(registry.isBound(Dimension.ID_NETHER));
		Assert.assertTrue(registry.isBound(Dimension.ID_THE_END));
		Assert.assertFalse(registry.isBound(3));
		
		Dimension nether = registry.createDimension(Dimension.ID_NETHER, _template());
		Assert.assertTrue(nether instanceof Nether);
		Assert.assertEquals(Dimension.ID_NETHER, nether.getRegisteredId());
		Assert.assertEquals(Dimension.ID_UNASSIGNED, nether.getId());
		Assert.assertEquals(8.0f, nether.getDistanceMultiplier(), 0.0f);
		Assert.assertTrue(registry.createDimension(Dimension.ID_THE_END, _template()) instanceof TheEnd);
		Assert.assertNull(registry.createDimension(3, _template()));
	}

	@Test
	public void rebindRequiresOverride() throws Throwable
	{
		DimensionClassRegistry registry = new DimensionClassRegistry(DimensionClassRegistry.DEFAULT_AUTO_ID_SEED);
		try
		{
			registry.registerClass(SkylandsDimension.class, Dimension.ID_NETHER, false);
			Assert.fail();
		}
		catch (DimensionRegistrationException e)
		{
			Assert.assertEquals(DimensionRegistrationException.Reason.ID_ALREADY_BOUND, e.reason);
		}
		// The built-in binding is untouched.
		Assert.assertTrue(registry.createDimension(Dimension.ID_NETHER, _template()) instanceof Nether);
		
		Assert.assertEquals(Dimension.ID_NETHER, registry.registerClass(SkylandsDimension.class, Dimension.ID_NETHER, true));
		Dimension replaced = registry.createDimension(Dimension.ID_NETHER, _template());
		Assert.assertTrue(replaced instanceof SkylandsDimension);
		Assert.assertEquals(Dimension.ID_NETHER, replaced.getRegisteredId());
	}

	@Test
	public void invalidClasses() throws Throwable
	{
		DimensionClassRegistry registry = new DimensionClassRegistry(DimensionClassRegistry.DEFAULT_AUTO_ID_SEED);
		_expectInvalidClass(registry, AbstractCustomDimension.class);
		_expectInvalidClass(registry, UnmarkedDimension.class);
		_expectInvalidClass(registry, NoContextDimension.class);
		_expectInvalidClass(registry, String.class);
		// Failed registrations don't use up automatic ids.
		Assert.assertEquals(1000, registry.peekNextAutoId());
		Assert.assertFalse(registry.isBound(7));
	}

	@Test
	public void invalidClassOnBoundId() throws Throwable
	{
		DimensionClassRegistry registry = new DimensionClassRegistry(DimensionClassRegistry.DEFAULT_AUTO_ID_SEED);
		try
		{
			registry.registerClass(UnmarkedDimension.class, Dimension.ID_OVERWORLD, false);
			Assert.fail();
		}
		catch (DimensionRegistrationException e)
		{
			Assert.assertEquals(DimensionRegistrationException.Reason.INVALID_DIMENSION_CLASS, e.reason);
		}
		Assert.assertTrue(registry.createDimension(Dimension.ID_OVERWORLD, _template()) instanceof Overworld);
	}

	@Test
	public void configuredSeed() throws Throwable
	{
		ServerConfig config = new ServerConfig();
		config.loadOverrides(Map.of(ServerConfig.KEY_AUTO_DIMENSION_ID_SEED, "5000"));
		DimensionClassRegistry registry = new DimensionClassRegistry(config);
		Assert.assertEquals(5000, registry.peekNextAutoId());
		Assert.assertEquals(5000, registry.registerClass(SkylandsDimension.class));
		Assert.assertEquals(DimensionClassRegistry.DEFAULT_AUTO_ID_SEED, new DimensionClassRegistry(new ServerConfig()).peekNextAutoId());
	}

	@Test
	public void negativeId() throws Throwable
	{
		DimensionClassRegistry registry = new DimensionClassRegistry(DimensionClassRegistry.DEFAULT_AUTO_ID_SEED);
		ICustomDimensionFactory<SkylandsDimension> factory = (DimensionContext context) -> new SkylandsDimension(context);
		try
		{
			registry.register(factory, -5, true);
			Assert.fail();
		}
		catch (DimensionRegistrationException e)
		{
			Assert.assertEquals(DimensionRegistrationException.Reason.INVALID_ID, e.reason);
		}
	}

	@Test
	public void automaticIds() throws Throwable
	{
		DimensionClassRegistry registry = new DimensionClassRegistry(DimensionClassRegistry.DEFAULT_AUTO_ID_SEED);
		ICustomDimensionFactory<SkylandsDimension> factory = (DimensionContext context) -> new SkylandsDimension(context);
		Assert.assertEquals(1000, registry.register(factory));
		Assert.assertEquals(1001, registry.registerClass(SkylandsDimension.class));
		
		// Explicit ids in the automatic range are skipped over.
		Assert.assertEquals(1002, registry.register(factory, 1002, false));
		Assert.assertEquals(1003, registry.peekNextAutoId());
		Assert.assertEquals(1003, registry.register(factory));
		
		Dimension custom = registry.createDimension(1001, _template());
		Assert.assertEquals("Skylands", custom.getDimensionName());
		Assert.assertEquals(1001, custom.getRegisteredId());
	}

	@Test(expected=IllegalArgumentException.class)
	public void seedTooLow() throws Throwable
	{
		new DimensionClassRegistry(Dimension.ID_THE_END);
	}


	private static DimensionContext _template()
	{
		IChunkStore store = new IChunkStore() {
			@Override
			public Chunk load(int chunkX, int chunkZ)
			{
				return null;
			}
			@Override
			public Chunk generate(int chunkX, int chunkZ)
			{
				return null;
			}
		};
		return new DimensionContext(Dimension.ID_UNASSIGNED
				, TYPES
				, store
				, (Chunk chunk) -> new Packet_ChunkData(chunk.getAddress(), new byte[0])
				, (player, packet) -> {}
				, new ServerConfig()
				, new Random(1L)
		);
	}

	private static void _expectInvalidClass(DimensionClassRegistry registry, Class<?> type)
	{
		try
		{
			registry.registerClass(type, 7, true);
			Assert.fail(type.getName());
		}
		catch (DimensionRegistrationException e)
		{
			Assert.assertEquals(DimensionRegistrationException.Reason.INVALID_DIMENSION_CLASS, e.reason);
		}
		try
		{
			registry.registerClass(type);
			Assert.fail(type.getName());
		}
		catch (DimensionRegistrationException e)
		{
			Assert.assertEquals(DimensionRegistrationException.Reason.INVALID_DIMENSION_CLASS, e.reason);
		}
	}


	// These are public since the registry instantiates them reflectively.
	public static class SkylandsDimension extends Dimension implements ICustomDimension
	{
		public SkylandsDimension(DimensionContext context)
		{
			super(context, DimensionTypeRegistry.OVERWORLD);
		}
		@Override
		public String getDimensionName()
		{
			return "Skylands";
		}
	}

	public static abstract class AbstractCustomDimension extends Dimension implements ICustomDimension
	{
		public AbstractCustomDimension(DimensionContext context)
		{
			super(context, DimensionTypeRegistry.OVERWORLD);
		}
	}

	public static class UnmarkedDimension extends Dimension
	{
		public UnmarkedDimension(DimensionContext context)
		{
			super(context, DimensionTypeRegistry.OVERWORLD);
		}
		@Override
		public String getDimensionName()
		{
			return "Unmarked";
		}
	}

	public static class NoContextDimension extends Dimension implements ICustomDimension
	{
		public NoContextDimension(int ignored, DimensionContext context)
		{
			super(context, DimensionTypeRegistry.OVERWORLD);
		}
		@Override
		public String getDimensionName()
		{
			return "No context";
		}
	}
}
