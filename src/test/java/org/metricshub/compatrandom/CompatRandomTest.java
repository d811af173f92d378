package org.metricshub.compatrandom;

import static org.junit.Assert.*;

import org.junit.Test;

/**
 * Unit tests for {@link CompatRandom} instantiated directly, i.e. reading its
 * values straight from the seeded engine.
 */
public class CompatRandomTest {

	@Test
	public void testSeededInstanceIsNotDerived() {
		CompatRandom random = new CompatRandom(42);
		assertFalse(random.isDerived());
		assertEquals(42, random.getSeed());
	}

	@Test
	public void testNextInt() {
		CompatRandom random = new CompatRandom(42);
		assertEquals(1434747710, random.nextInt());
		assertEquals(302596119, random.nextInt());
	}

	@Test
	public void testNextIntMax() {
		CompatRandom random = new CompatRandom(42);
		int[] expected = { 66, 14, 12, 52, 16, 26, 72, 51, 17, 76 };
		for (int expectedValue : expected) {
			assertEquals(expectedValue, random.nextInt(100));
		}
	}

	@Test
	public void testNextIntMinMax() {
		CompatRandom random = new CompatRandom(42);
		int[] expected = { 16, 11, 11, 15, 11 };
		for (int expectedValue : expected) {
			assertEquals(expectedValue, random.nextInt(10, 20));
		}

		random = new CompatRandom(42);
		expected = new int[] { 1, -4, -4, 0, -4, -3, 2, 0, -4, 2 };
		for (int expectedValue : expected) {
			assertEquals(expectedValue, random.nextInt(-5, 5));
		}
	}

	@Test
	public void testNextIntLargeRange() {
		CompatRandom random = new CompatRandom(42);
		int[] expected = { 1434747709, -269548476, -361709744, 1555655116, -372913051 };
		for (int expectedValue : expected) {
			assertEquals(expectedValue, random.nextInt(Integer.MIN_VALUE, Integer.MAX_VALUE));
		}
	}

	@Test
	public void testNextLong() {
		CompatRandom random = new CompatRandom(42);
		assertEquals(1157699022552916256L, random.nextLong());
		assertEquals(2421988103042415228L, random.nextLong());
		assertEquals(1601649905759628890L, random.nextLong());
	}

	@Test
	public void testNextLongMax() {
		CompatRandom random = new CompatRandom(42);
		long[] expected = { 128, 268, 177, 263, 390 };
		for (long expectedValue : expected) {
			assertEquals(expectedValue, random.nextLong(1000));
		}
	}

	@Test
	public void testNextLongMinMax() {
		CompatRandom random = new CompatRandom(42);
		long[] expected = { -743, -463, -645, -474, -220 };
		for (long expectedValue : expected) {
			assertEquals(expectedValue, random.nextLong(-1000, 1000));
		}
	}

	@Test
	public void testNextLongFullRange() {
		CompatRandom random = new CompatRandom(42);
		assertEquals(-6907973991748943295L, random.nextLong(Long.MIN_VALUE, Long.MAX_VALUE));
		assertEquals(-4379395830769945352L, random.nextLong(Long.MIN_VALUE, Long.MAX_VALUE));
		assertEquals(-6020072225335518028L, random.nextLong(Long.MIN_VALUE, Long.MAX_VALUE));
	}

	@Test
	public void testNextDouble() {
		CompatRandom random = new CompatRandom(42);
		assertEquals(0.6681064659115423, random.nextDouble(), 0);
		assertEquals(0.14090729837348093, random.nextDouble(), 0);
		assertEquals(0.12551828945312568, random.nextDouble(), 0);
	}

	@Test
	public void testNextFloat() {
		CompatRandom random = new CompatRandom(42);
		assertEquals(0.6681064367294312, random.nextFloat(), 0);
		assertEquals(0.14090730249881744, random.nextFloat(), 0);
		assertEquals(0.1255182921886444, random.nextFloat(), 0);
	}

	@Test
	public void testNextBytes() {
		CompatRandom random = new CompatRandom(42);
		byte[] buffer = new byte[8];
		random.nextBytes(buffer);
		assertArrayEquals(new byte[] { 62, 23, (byte) 186, (byte) 150, (byte) 174, 4, (byte) 205, 59 }, buffer);
	}

	@Test
	public void testNextBytesWindowMatchesWholeBuffer() {
		byte[] whole = new byte[16];
		new CompatRandom(42).nextBytes(whole);

		byte[] window = new byte[20];
		new CompatRandom(42).nextBytes(window, 4, 16);
		for (int i = 0; i < 16; i++) {
			assertEquals(whole[i], window[i + 4]);
		}
	}

	@Test
	public void testMixedOperationSequence() {
		CompatRandom random = new CompatRandom(42);
		assertEquals(1434747710, random.nextInt());
		assertEquals(0.14090729837348093, random.nextDouble(), 0);
		assertEquals(1553535363493135422L, random.nextLong());
		assertEquals(6, random.nextInt(5, 10));
		byte[] buffer = new byte[3];
		random.nextBytes(buffer);
		assertArrayEquals(new byte[] { (byte) 205, 59, (byte) 153 }, buffer);
		assertEquals(0, random.nextInt(0));
		// single-value range: nothing consumed
		assertEquals(7, random.nextLong(7, 8));
		assertEquals(234, random.nextInt(1000));
	}

	@Test
	public void testDegenerateRanges() {
		CompatRandom random = new CompatRandom(42);
		assertEquals(5, random.nextLong(5, 5));
		assertEquals(-3, random.nextLong(-3, -2));
		assertEquals(0, random.nextLong(0));
		assertEquals(1434747710, random.nextInt());

		random = new CompatRandom(42);
		assertEquals(9, random.nextInt(9, 9));
		assertEquals(302596119, random.nextInt());
	}

	@Test
	public void testSameSeedSameSequence() {
		CompatRandom first = new CompatRandom(2025);
		CompatRandom second = new CompatRandom(2025);
		for (int i = 0; i < 10_000; i++) {
			assertEquals(first.nextInt(), second.nextInt());
			assertEquals(first.nextLong(-i, i), second.nextLong(-i, i));
			assertEquals(first.nextDouble(), second.nextDouble(), 0);
		}
	}

	@Test
	public void testUnseededConstructorUsesNonNegativeSeed() {
		CompatRandom random = new CompatRandom();
		assertTrue(random.getSeed() >= 0);
		assertFalse(random.isDerived());

		CompatRandom replay = new CompatRandom(random.getSeed());
		for (int i = 0; i < 100; i++) {
			assertEquals(replay.nextInt(), random.nextInt());
		}
	}

	@Test
	public void testDoubleAndFloatNeverReachOne() {
		CompatRandom random = new CompatRandom(1);
		for (int i = 0; i < 1_000_000; i++) {
			double d = random.nextDouble();
			assertTrue(d >= 0.0 && d < 1.0);
			float f = random.nextFloat();
			assertTrue(f >= 0.0f && f < 1.0f);
		}
	}

	@Test
	public void testNextLongNeverReachesMaxValue() {
		CompatRandom random = new CompatRandom(1);
		for (int i = 0; i < 1_000_000; i++) {
			long value = random.nextLong();
			assertTrue(value >= 0);
			assertTrue(value != Long.MAX_VALUE);
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNextIntNegativeMax() {
		new CompatRandom(42).nextInt(-1);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNextIntMinGreaterThanMax() {
		new CompatRandom(42).nextInt(10, 9);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNextLongNegativeMax() {
		new CompatRandom(42).nextLong(-1L);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNextLongMinGreaterThanMax() {
		new CompatRandom(42).nextLong(Long.MAX_VALUE, Long.MIN_VALUE);
	}

	@Test(expected = NullPointerException.class)
	public void testNextBytesNullBuffer() {
		new CompatRandom(42).nextBytes(null);
	}

	@Test
	public void testRejectedArgumentsDoNotConsume() {
		CompatRandom random = new CompatRandom(42);
		try {
			random.nextInt(-5);
			fail("Expected an IllegalArgumentException");
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().contains("maxValue"));
		}
		assertEquals(1434747710, random.nextInt());
	}
}
