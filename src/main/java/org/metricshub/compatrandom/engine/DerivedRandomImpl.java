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

import java.util.Objects;
import org.metricshub.compatrandom.util.CompatLogger;
import org.slf4j.Logger;

/**
 * Implementation used when the generator is a subclass that may have
 * overridden its primitives. Composite values are built from the primitives
 * exposed by {@link SampleSource}, so an override of {@code sample()} (or of
 * {@code nextInt}) shows through every derived operation. Without any
 * override, the values are the ones {@link SeededRandomImpl} produces for the
 * same seed.
 * <p>
 * The engine is seeded on first use, behind a plain {@code null} check.
 * Concurrent first use of one instance is not supported, nor is any other
 * concurrent use.
 */
public final class DerivedRandomImpl extends RandomImpl {

	private static final Logger LOGGER = CompatLogger.getLogger(DerivedRandomImpl.class);

	private final SampleSource parent;
	private final int seed;
	private final SubtractivePrng prng = new SubtractivePrng();

	/**
	 * Creates the implementation. The engine is not seeded until a value is
	 * requested.
	 *
	 * @param parent primitives of the owning generator, overrides included
	 * @param seed seed of the sequence
	 */
	public DerivedRandomImpl(SampleSource parent, int seed) {
		this.parent = Objects.requireNonNull(parent, "parent");
		this.seed = seed;
	}

	private void ensureInitialized() {
		if (!prng.isInitialized()) {
			LOGGER.debug("Seeding subtractive generator with {}", seed);
			prng.ensureInitialized(seed);
		}
	}

	@Override
	public double sample() {
		ensureInitialized();
		return prng.sample();
	}

	@Override
	public int nextInt() {
		ensureInitialized();
		return prng.internalSample();
	}

	@Override
	public int nextInt(int maxValue) {
		ensureInitialized();
		return (int) (parent.sample() * maxValue);
	}

	@Override
	public int nextInt(int minValue, int maxValue) {
		ensureInitialized();
		long range = (long) maxValue - minValue;
		if (range <= Integer.MAX_VALUE) {
			return (int) (parent.sample() * range) + minValue;
		}
		// The wide range has always been drawn from the engine itself
		return (int) ((long) (prng.sampleForLargeRange() * range) + minValue);
	}

	@Override
	public long nextLong() {
		ensureInitialized();
		return nextNonNegativeLong(this::nextUInt64);
	}

	@Override
	public long nextLong(long minValue, long maxValue) {
		long exclusiveRange = maxValue - minValue;
		if (Long.compareUnsigned(exclusiveRange, 1) > 0) {
			ensureInitialized();
			return nextBelow(exclusiveRange, this::nextUInt64) + minValue;
		}
		return minValue;
	}

	private long nextUInt64() {
		return (long) parent.nextInt(1 << 22) | (long) parent.nextInt(1 << 22) << 22 | (long) parent.nextInt(1 << 20) << 44;
	}

	@Override
	public double nextDouble() {
		ensureInitialized();
		return parent.sample();
	}

	@Override
	public float nextFloat() {
		ensureInitialized();
		while (true) {
			float f = (float) parent.sample();
			if (f < 1.0f) {
				return f;
			}
		}
	}

	/**
	 * Fills the buffer from the engine, ignoring overrides.
	 */
	@Override
	public void nextBytes(byte[] buffer) {
		ensureInitialized();
		prng.nextBytes(buffer);
	}

	/**
	 * Fills the window with the low-order bytes of successive
	 * {@link SampleSource#nextInt()} values.
	 */
	@Override
	public void nextBytes(byte[] buffer, int offset, int length) {
		Objects.checkFromIndexSize(offset, length, buffer.length);
		ensureInitialized();
		for (int i = offset; i < offset + length; i++) {
			buffer[i] = (byte) parent.nextInt();
		}
	}
}
