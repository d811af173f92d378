package org.metricshub.compatrandom;

import static org.junit.Assert.*;

import org.junit.Test;

/**
 * Tests of {@link CompatRandom} subclasses, whose composite values are built
 * from the overridable primitives.
 */
public class DerivedCompatRandomTest {

	/**
	 * Always samples {@code 0.5}.
	 */
	private static class HalfRandom extends CompatRandom {
		HalfRandom(int seed) {
			super(seed);
		}

		@Override
		protected double sample() {
			return 0.5;
		}
	}

	/**
	 * Replays the specified samples, in a loop.
	 */
	private static class ScriptedRandom extends CompatRandom {
		private final double[] samples;
		private int index;

		ScriptedRandom(double... samples) {
			super(42);
			this.samples = samples;
		}

		@Override
		protected double sample() {
			double value = samples[index];
			index = (index + 1) % samples.length;
			return value;
		}
	}

	/**
	 * Returns a constant from {@link #nextInt()}.
	 */
	private static class ConstantIntRandom extends CompatRandom {
		ConstantIntRandom(int seed) {
			super(seed);
		}

		@Override
		public int nextInt() {
			return 0x1234;
		}
	}

	@Test
	public void testSubclassIsDerived() {
		assertTrue(new CompatRandom(42) {}.isDerived());
		assertTrue(new CompatRandom() {}.isDerived());
	}

	@Test
	public void testWithoutOverrideMatchesSeededSequence() {
		CompatRandom seeded = new CompatRandom(42);
		CompatRandom derived = new CompatRandom(42) {};
		byte[] seededBytes = new byte[7];
		byte[] derivedBytes = new byte[7];
		for (int i = 0; i < 2000; i++) {
			assertEquals(seeded.nextInt(), derived.nextInt());
			assertEquals(seeded.nextInt(i), derived.nextInt(i));
			assertEquals(seeded.nextInt(-i, i), derived.nextInt(-i, i));
			assertEquals(seeded.nextInt(Integer.MIN_VALUE, i), derived.nextInt(Integer.MIN_VALUE, i));
			assertEquals(seeded.nextLong(), derived.nextLong());
			assertEquals(seeded.nextLong(i * 1_000_003L), derived.nextLong(i * 1_000_003L));
			assertEquals(seeded.nextLong(Long.MIN_VALUE, i), derived.nextLong(Long.MIN_VALUE, i));
			assertEquals(seeded.nextDouble(), derived.nextDouble(), 0);
			assertEquals(seeded.nextFloat(), derived.nextFloat(), 0);
			seeded.nextBytes(seededBytes);
			derived.nextBytes(derivedBytes);
			assertArrayEquals(seededBytes, derivedBytes);
			seeded.nextBytes(seededBytes, 1, 5);
			derived.nextBytes(derivedBytes, 1, 5);
			assertArrayEquals(seededBytes, derivedBytes);
		}
	}

	@Test
	public void testSampleOverridePropagates() {
		CompatRandom random = new HalfRandom(42);
		assertEquals(50, random.nextInt(100));
		assertEquals(15, random.nextInt(10, 20));
		assertEquals(0.5, random.nextDouble(), 0);
		assertEquals(0.5f, random.nextFloat(), 0);
		// (2^21 | 2^21 << 22 | 2^19 << 44) >>> 1
		assertEquals(4611690416474947584L, random.nextLong());
		assertEquals(512L, random.nextLong(1000));
		assertEquals(24L, random.nextLong(-1000, 1000));
	}

	@Test
	public void testSampleOverrideLeavesEngineUntouched() {
		CompatRandom random = new HalfRandom(42);
		random.nextInt(100);
		random.nextLong();
		random.nextDouble();
		// nextInt() and the whole-buffer bytes are read from the engine itself
		assertEquals(1434747710, random.nextInt());
		byte[] buffer = new byte[2];
		random.nextBytes(buffer);
		assertArrayEquals(new byte[] { 23, (byte) 186 }, buffer);
	}

	@Test
	public void testLargeRangeIgnoresSampleOverride() {
		CompatRandom random = new HalfRandom(42);
		assertEquals(1434747709, random.nextInt(Integer.MIN_VALUE, Integer.MAX_VALUE));
	}

	@Test
	public void testScriptedSamples() {
		CompatRandom random = new ScriptedRandom(0.0, 0.25, 0.999);
		assertEquals(0, random.nextInt(8));
		assertEquals(2, random.nextInt(8));
		assertEquals(7, random.nextInt(8));
		assertEquals(0, random.nextInt(8));
	}

	@Test
	public void testNextFloatRejectsRoundingToOne() {
		// 0.99999999 narrows to 1.0f and must be redrawn
		CompatRandom random = new ScriptedRandom(0.99999999, 0.25);
		assertEquals(0.25f, random.nextFloat(), 0);
	}

	@Test
	public void testNextLongRejectsMaxValue() {
		// the first draw is all ones, the second one is all zeros
		CompatRandom random = new ScriptedRandom(0.9999999999, 0.9999999999, 0.9999999999, 0.0, 0.0, 0.0);
		assertEquals(0L, random.nextLong());
	}

	@Test
	public void testNextLongRejectsDrawsOutsideRange() {
		// top 2 bits of the first draw are 3, rejected for a range of 3; second draw gives 2
		CompatRandom random = new ScriptedRandom(0.0, 0.0, 0.9999999999, 0.0, 0.0, 0.5);
		assertEquals(12L, random.nextLong(10, 13));
	}

	@Test
	public void testSeededInstanceUnaffectedByOverridesElsewhere() {
		new HalfRandom(42).nextInt(100);
		CompatRandom seeded = new CompatRandom(42);
		assertEquals(66, seeded.nextInt(100));
	}

	@Test
	public void testNextIntOverrideDrivesByteWindow() {
		CompatRandom random = new ConstantIntRandom(42);
		byte[] buffer = new byte[5];
		random.nextBytes(buffer, 1, 3);
		assertArrayEquals(new byte[] { 0, 0x34, 0x34, 0x34, 0 }, buffer);
	}

	@Test
	public void testNextIntOverrideIgnoredByWholeBuffer() {
		CompatRandom random = new ConstantIntRandom(42);
		byte[] buffer = new byte[4];
		random.nextBytes(buffer);
		assertArrayEquals(new byte[] { 62, 23, (byte) 186, (byte) 150 }, buffer);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testArgumentsValidatedForSubclasses() {
		new HalfRandom(42).nextInt(3, 2);
	}
}
