package org.metricshub.compatrandom.engine;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * CompatRandom
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

/**
 * Implementation used when a seed is specified and nothing can override the
 * generator primitives: every value is read straight from the engine, which
 * is seeded at construction.
 * <p>
 * Not thread-safe.
 */
public final class SeededRandomImpl extends RandomImpl {

	private final SubtractivePrng prng = new SubtractivePrng();

	/**
	 * Creates the implementation and seeds its engine.
	 *
	 * @param seed seed of the sequence
	 */
	public SeededRandomImpl(int seed) {
		prng.ensureInitialized(seed);
	}

	@Override
	public double sample() {
		return prng.sample();
	}

	@Override
	public int nextInt() {
		return prng.internalSample();
	}

	@Override
	public int nextInt(int maxValue) {
		// sample() * maxValue is below 2^31, so the cast truncates exactly
		return (int) (prng.sample() * maxValue);
	}

	@Override
	public int nextInt(int minValue, int maxValue) {
		long range = (long) maxValue - minValue;
		if (range <= Integer.MAX_VALUE) {
			return (int) (prng.sample() * range) + minValue;
		}
		return (int) ((long) (prng.sampleForLargeRange() * range) + minValue);
	}

	@Override
	public long nextLong() {
		return nextNonNegativeLong(this::nextUInt64);
	}

	@Override
	public long nextLong(long minValue, long maxValue) {
		long exclusiveRange = maxValue - minValue;
		if (Long.compareUnsigned(exclusiveRange, 1) > 0) {
			return nextBelow(exclusiveRange, this::nextUInt64) + minValue;
		}
		return minValue;
	}

	/**
	 * Produces a value covering the whole unsigned 64-bit range.
	 */
	private long nextUInt64() {
		return (long) nextInt(1 << 22) | (long) nextInt(1 << 22) << 22 | (long) nextInt(1 << 20) << 44;
	}

	@Override
	public double nextDouble() {
		return prng.sample();
	}

	@Override
	public float nextFloat() {
		while (true) {
			float f = (float) prng.sample();
			// Narrowing may round up to 1.0f
			if (f < 1.0f) {
				return f;
			}
		}
	}

	@Override
	public void nextBytes(byte[] buffer) {
		prng.nextBytes(buffer);
	}

	@Override
	public void nextBytes(byte[] buffer, int offset, int length) {
		prng.nextBytes(buffer, offset, length);
	}
}
