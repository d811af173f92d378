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
 * Algorithm backing a {@code CompatRandom}. Arguments are validated by the
 * caller before reaching any of these methods.
 */
public abstract class RandomImpl {

	/**
	 * Number of bits in a {@code long}, used to narrow 64-bit draws.
	 */
	protected static final int LONG_BITS = 64;

	/**
	 * @return a double in {@code [0.0,1.0)}
	 */
	public abstract double sample();

	/**
	 * @return an int in {@code [0, Integer.MAX_VALUE - 1]}
	 */
	public abstract int nextInt();

	/**
	 * @param maxValue exclusive upper bound, {@code >= 0}
	 * @return an int in {@code [0, maxValue)}, or {@code 0} if {@code maxValue} is {@code 0}
	 */
	public abstract int nextInt(int maxValue);

	/**
	 * @param minValue inclusive lower bound
	 * @param maxValue exclusive upper bound, {@code >= minValue}
	 * @return an int in {@code [minValue, maxValue)}, or {@code minValue} if both are equal
	 */
	public abstract int nextInt(int minValue, int maxValue);

	/**
	 * @return a long in {@code [0, Long.MAX_VALUE)}
	 */
	public abstract long nextLong();

	/**
	 * @param maxValue exclusive upper bound, {@code >= 0}
	 * @return a long in {@code [0, maxValue)}
	 */
	public long nextLong(long maxValue) {
		return nextLong(0, maxValue);
	}

	/**
	 * @param minValue inclusive lower bound
	 * @param maxValue exclusive upper bound, {@code >= minValue}
	 * @return a long in {@code [minValue, maxValue)}
	 */
	public abstract long nextLong(long minValue, long maxValue);

	/**
	 * @return a double in {@code [0.0,1.0)}
	 */
	public abstract double nextDouble();

	/**
	 * @return a float in {@code [0.0f,1.0f)}
	 */
	public abstract float nextFloat();

	/**
	 * Fills the whole buffer.
	 *
	 * @param buffer array to fill
	 */
	public abstract void nextBytes(byte[] buffer);

	/**
	 * Fills a window of the buffer.
	 *
	 * @param buffer array to fill
	 * @param offset index of the first byte to fill
	 * @param length number of bytes to fill
	 */
	public abstract void nextBytes(byte[] buffer, int offset, int length);

	/**
	 * Draws the smallest power-of-two range containing {@code exclusiveRange}
	 * from {@code source} until the value falls within it.
	 *
	 * @param exclusiveRange unsigned width of the range, greater than 1
	 * @param source the 64-bit primitive to draw from
	 * @return an unsigned value below {@code exclusiveRange}
	 */
	protected static long nextBelow(long exclusiveRange, UInt64Source source) {
		// ceil(log2(exclusiveRange))
		int bits = LONG_BITS - Long.numberOfLeadingZeros(exclusiveRange - 1);
		while (true) {
			long result = source.nextUInt64() >>> (LONG_BITS - bits);
			if (Long.compareUnsigned(result, exclusiveRange) < 0) {
				return result;
			}
		}
	}

	/**
	 * Keeps the top 63 bits of {@code source} draws, rejecting
	 * {@link Long#MAX_VALUE}.
	 *
	 * @param source the 64-bit primitive to draw from
	 * @return a long in {@code [0, Long.MAX_VALUE)}
	 */
	protected static long nextNonNegativeLong(UInt64Source source) {
		while (true) {
			long result = source.nextUInt64() >>> 1;
			if (result != Long.MAX_VALUE) {
				return result;
			}
		}
	}

	/**
	 * Unsigned 64-bit values assembled from three bounded int draws.
	 */
	protected interface UInt64Source {

		/**
		 * @return a value covering all 64 bits
		 */
		long nextUInt64();
	}
}
