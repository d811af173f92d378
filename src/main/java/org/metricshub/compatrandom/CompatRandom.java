package org.metricshub.compatrandom;

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

import org.metricshub.compatrandom.engine.DerivedRandomImpl;
import org.metricshub.compatrandom.engine.RandomImpl;
import org.metricshub.compatrandom.engine.SampleSource;
import org.metricshub.compatrandom.engine.SeededRandomImpl;
import org.metricshub.compatrandom.engine.SharedSeedSource;
import org.metricshub.compatrandom.util.CompatLogger;
import org.slf4j.Logger;

/**
 * Pseudo-random number generator reproducing the historical sequence of a
 * modified Knuth subtractive generator for a given seed.
 * <p>
 * When this exact class is instantiated, all values are read directly from the
 * seeded engine. When a subclass is instantiated, the generator honors the
 * subclass overrides: {@link #sample()}, {@link #nextInt()} and
 * {@link #nextInt(int)} are the primitives from which the other values are
 * built, so overriding {@link #sample()} alone changes the bounded ints, the
 * longs, the doubles and the floats. Without overrides, a subclass produces
 * the same values as this class for the same seed.
 * <p>
 * This generator is not cryptographically strong, and an instance must not
 * be used by several threads without external synchronization. This includes
 * the first call on a subclass instance, which seeds the engine lazily.
 */
public class CompatRandom {

	private static final Logger LOGGER = CompatLogger.getLogger(CompatRandom.class);

	private final int seed;
	private final RandomImpl impl;

	/**
	 * Creates a generator seeded from the process-wide seed source.
	 */
	public CompatRandom() {
		this(SharedSeedSource.nextSeed());
	}

	/**
	 * Creates a generator producing the historical sequence of {@code seed}.
	 * A negative seed produces the same sequence as its absolute value.
	 *
	 * @param seed seed of the sequence
	 */
	public CompatRandom(int seed) {
		this.seed = seed;
		if (getClass() == CompatRandom.class) {
			impl = new SeededRandomImpl(seed);
		} else {
			impl = new DerivedRandomImpl(new Primitives(), seed);
		}
		LOGGER.debug("Created {} with seed {} ({})", getClass().getName(), seed, impl.getClass().getSimpleName());
	}

	/**
	 * @return the seed of this generator's sequence
	 */
	public int getSeed() {
		return seed;
	}

	/**
	 * Whether this generator reads its composite values through the
	 * overridable primitives.
	 *
	 * @return {@code true} for instances of a subclass
	 */
	public boolean isDerived() {
		return impl instanceof DerivedRandomImpl;
	}

	/**
	 * Returns the next double of the sequence. Subclasses may override this
	 * method to alter every other value but {@link #nextInt()} and the bytes
	 * of {@link #nextBytes(byte[])}.
	 *
	 * @return a double in {@code [0.0,1.0)}
	 */
	protected double sample() {
		return impl.sample();
	}

	/**
	 * @return an int in {@code [0, Integer.MAX_VALUE)}
	 */
	public int nextInt() {
		return impl.nextInt();
	}

	/**
	 * @param maxValue exclusive upper bound
	 * @return an int in {@code [0, maxValue)}, or {@code 0} when {@code maxValue} is {@code 0}
	 * @throws IllegalArgumentException if {@code maxValue} is negative
	 */
	public int nextInt(int maxValue) {
		if (maxValue < 0) {
			throw new IllegalArgumentException("maxValue must be non-negative: " + maxValue);
		}
		return impl.nextInt(maxValue);
	}

	/**
	 * @param minValue inclusive lower bound
	 * @param maxValue exclusive upper bound
	 * @return an int in {@code [minValue, maxValue)}, or {@code minValue} when both are equal
	 * @throws IllegalArgumentException if {@code minValue} is greater than {@code maxValue}
	 */
	public int nextInt(int minValue, int maxValue) {
		if (minValue > maxValue) {
			throw new IllegalArgumentException("minValue (" + minValue + ") must not be greater than maxValue (" + maxValue + ")");
		}
		return impl.nextInt(minValue, maxValue);
	}

	/**
	 * @return a long in {@code [0, Long.MAX_VALUE)}
	 */
	public long nextLong() {
		return impl.nextLong();
	}

	/**
	 * @param maxValue exclusive upper bound
	 * @return a long in {@code [0, maxValue)}, or {@code 0} when {@code maxValue} is {@code 0}
	 * @throws IllegalArgumentException if {@code maxValue} is negative
	 */
	public long nextLong(long maxValue) {
		if (maxValue < 0) {
			throw new IllegalArgumentException("maxValue must be non-negative: " + maxValue);
		}
		return impl.nextLong(maxValue);
	}

	/**
	 * @param minValue inclusive lower bound
	 * @param maxValue exclusive upper bound
	 * @return a long in {@code [minValue, maxValue)}, or {@code minValue} when both are equal
	 * @throws IllegalArgumentException if {@code minValue} is greater than {@code maxValue}
	 */
	public long nextLong(long minValue, long maxValue) {
		if (minValue > maxValue) {
			throw new IllegalArgumentException("minValue (" + minValue + ") must not be greater than maxValue (" + maxValue + ")");
		}
		return impl.nextLong(minValue, maxValue);
	}

	/**
	 * @return a double in {@code [0.0,1.0)}
	 */
	public double nextDouble() {
		return impl.nextDouble();
	}

	/**
	 * @return a float in {@code [0.0f,1.0f)}
	 */
	public float nextFloat() {
		return impl.nextFloat();
	}

	/**
	 * Fills the buffer with the low-order bytes of successive raw values of
	 * the engine. Overrides are never consulted.
	 *
	 * @param buffer the array to fill
	 */
	public void nextBytes(byte[] buffer) {
		impl.nextBytes(buffer);
	}

	/**
	 * Fills {@code length} bytes of the buffer, starting at {@code offset}.
	 * For a subclass, each byte is the low-order byte of one
	 * {@link #nextInt()} call.
	 *
	 * @param buffer the array to fill
	 * @param offset index of the first byte to fill
	 * @param length number of bytes to fill
	 * @throws IndexOutOfBoundsException if the window does not fit in {@code buffer}
	 */
	public void nextBytes(byte[] buffer, int offset, int length) {
		impl.nextBytes(buffer, offset, length);
	}

	/**
	 * Exposes the overridable methods of the enclosing generator, resolved
	 * against its runtime class.
	 */
	private final class Primitives implements SampleSource {

		@Override
		public double sample() {
			return CompatRandom.this.sample();
		}

		@Override
		public int nextInt() {
			return CompatRandom.this.nextInt();
		}

		@Override
		public int nextInt(int maxValue) {
			return CompatRandom.this.nextInt(maxValue);
		}
	}
}
