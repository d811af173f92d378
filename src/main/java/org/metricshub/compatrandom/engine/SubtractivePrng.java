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

/**
 * Modified version of Knuth's subtractive random number generator, producing
 * the exact sequence historically relied upon by seeded callers.
 * <p>
 * The state is a 56-slot array of which index {@code 0} is never used, and two
 * rotating cursors. Every sample writes back into the state, so any call
 * perturbs all subsequent values.
 * <p>
 * The state array is created by {@link #ensureInitialized(int)} and is never
 * reset afterwards. Instances are not thread-safe: callers sharing one
 * instance between threads must synchronize externally.
 */
public final class SubtractivePrng {

	private static final int STATE_SIZE = 56;

	/** Knuth's magic number, derived from the golden ratio. */
	private static final int MSEED = 161803398;

	private static final int INITIAL_INEXTP = 21;

	private int[] seedArray;
	private int inext;
	private int inextp;

	/**
	 * Whether the state array has been populated.
	 *
	 * @return {@code true} once {@link #ensureInitialized(int)} has run
	 */
	public boolean isInitialized() {
		return seedArray != null;
	}

	/**
	 * Populates the state from the specified seed, unless it has already been
	 * populated. Subsequent calls are no-ops, whatever their seed.
	 *
	 * @param seed seed of the sequence
	 */
	public void ensureInitialized(int seed) {
		if (seedArray == null) {
			initialize(seed);
		}
	}

	private void initialize(int seed) {
		int[] state = new int[STATE_SIZE];

		int subtraction = seed == Integer.MIN_VALUE ? Integer.MAX_VALUE : Math.abs(seed);
		int mj = MSEED - subtraction;
		state[55] = mj;
		int mk = 1;

		// Index 0 is skipped: Knuth's algorithm works on [1..55]
		int ii = 0;
		for (int i = 1; i < 55; i++) {
			ii += 21;
			if (ii >= 55) {
				ii -= 55;
			}
			state[ii] = mk;
			mk = mj - mk;
			if (mk < 0) {
				mk += Integer.MAX_VALUE;
			}
			mj = state[ii];
		}

		for (int k = 1; k < 5; k++) {
			for (int i = 1; i < STATE_SIZE; i++) {
				int n = i + 30;
				if (n >= 55) {
					n -= 55;
				}
				state[i] -= state[1 + n];
				if (state[i] < 0) {
					state[i] += Integer.MAX_VALUE;
				}
			}
		}

		inext = 0;
		inextp = INITIAL_INEXTP;
		seedArray = state;
	}

	/**
	 * Returns the next raw value of the sequence.
	 *
	 * @return a value in {@code [0, Integer.MAX_VALUE - 1]}
	 */
	public int internalSample() {
		int[] state = requireState();

		int locINext = inext + 1;
		if (locINext >= STATE_SIZE) {
			locINext = 1;
		}
		int locINextp = inextp + 1;
		if (locINextp >= STATE_SIZE) {
			locINextp = 1;
		}

		int retVal = state[locINext] - state[locINextp];
		if (retVal == Integer.MAX_VALUE) {
			retVal--;
		}
		if (retVal < 0) {
			retVal += Integer.MAX_VALUE;
		}

		state[locINext] = retVal;
		inext = locINext;
		inextp = locINextp;
		return retVal;
	}

	/**
	 * Returns the next value of the sequence scaled into {@code [0.0,1.0)}.
	 *
	 * @return a double in {@code [0.0,1.0)}
	 */
	public double sample() {
		return internalSample() * (1.0 / Integer.MAX_VALUE);
	}

	/**
	 * Returns a double in {@code [0.0,1.0)} with enough resolution to scale
	 * a range wider than {@link Integer#MAX_VALUE}. {@link #sample()} only
	 * yields even numbers once scaled to such a range.
	 * <p>
	 * Consumes two raw values: the first is the magnitude, the parity of the
	 * second one decides the sign.
	 *
	 * @return a double in {@code [0.0,1.0)}
	 */
	public double sampleForLargeRange() {
		int result = internalSample();

		// An addition of the two samples would skew the distribution
		if (internalSample() % 2 == 0) {
			result = -result;
		}

		double d = result;
		d += Integer.MAX_VALUE - 1;
		d /= 2.0 * Integer.MAX_VALUE - 1;
		return d;
	}

	/**
	 * Fills the whole buffer, one raw value per byte.
	 *
	 * @param buffer the array to fill
	 */
	public void nextBytes(byte[] buffer) {
		nextBytes(buffer, 0, buffer.length);
	}

	/**
	 * Fills {@code length} bytes of the buffer starting at {@code offset}, each
	 * with the low-order byte of one raw value.
	 *
	 * @param buffer the array to fill
	 * @param offset index of the first byte to fill
	 * @param length number of bytes to fill
	 */
	public void nextBytes(byte[] buffer, int offset, int length) {
		Objects.checkFromIndexSize(offset, length, buffer.length);
		for (int i = offset; i < offset + length; i++) {
			buffer[i] = (byte) internalSample();
		}
	}

	private int[] requireState() {
		if (seedArray == null) {
			throw new IllegalStateException("The generator has not been seeded");
		}
		return seedArray;
	}
}
