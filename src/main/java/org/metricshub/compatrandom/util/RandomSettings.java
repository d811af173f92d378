package org.metricshub.compatrandom.util;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * A simple container for the parameters of a single sequence dump.
 * These values have defaults, which may be changed through command line
 * arguments or programmatically.
 */
public class RandomSettings {

	/**
	 * Kinds of values that can be dumped.
	 */
	public enum Operation {
		/** {@code nextInt()}, {@code nextInt(max)} or {@code nextInt(min, max)} */
		INT("int", 2),
		/** {@code nextLong()}, {@code nextLong(max)} or {@code nextLong(min, max)} */
		LONG("long", 2),
		/** {@code nextDouble()} */
		DOUBLE("double", 0),
		/** {@code nextFloat()} */
		FLOAT("float", 0),
		/** {@code nextBytes(byte[])} */
		BYTES("bytes", 0);

		private final String keyword;
		private final int maxBounds;

		Operation(String keyword, int maxBounds) {
			this.keyword = keyword;
			this.maxBounds = maxBounds;
		}

		/**
		 * @return the name of the operation on the command line
		 */
		public String getKeyword() {
			return keyword;
		}

		/**
		 * @return how many bounds the operation accepts
		 */
		public int getMaxBounds() {
			return maxBounds;
		}

		/**
		 * @param keyword name of the operation on the command line
		 * @return the matching operation
		 * @throws IllegalArgumentException if no operation has this name
		 */
		public static Operation fromKeyword(String keyword) {
			for (Operation operation : values()) {
				if (operation.keyword.equals(keyword)) {
					return operation;
				}
			}
			throw new IllegalArgumentException("Unknown operation: " + keyword);
		}
	}

	/**
	 * Seed of the sequence;
	 * <code>null</code> means a seed from the shared seed source.
	 */
	private Integer seed = null;

	/**
	 * Number of values to print; 10 by default.
	 */
	private int count = 10;

	/**
	 * Whether to draw through the overridable primitives of a subclass;
	 * <code>false</code> by default.
	 */
	private boolean derived = false;

	/**
	 * Kind of values to print; ints by default.
	 */
	private Operation operation = Operation.INT;

	/**
	 * Bounds passed to the operation, lower bound first when there are two.
	 */
	private List<Long> bounds = new ArrayList<Long>();

	/**
	 * Output stream;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("seed = ").append(getSeed()).append(newLine);
		desc.append("count = ").append(getCount()).append(newLine);
		desc.append("derived = ").append(isDerived()).append(newLine);
		desc.append("operation = ").append(getOperation().getKeyword()).append(newLine);
		desc.append("bounds = ").append(getBounds()).append(newLine);

		return desc.toString();
	}

	/**
	 * @return the seed, or <code>null</code> to use the shared seed source
	 */
	public Integer getSeed() {
		return seed;
	}

	/**
	 * @param seed the seed to set, <code>null</code> to use the shared seed source
	 */
	public void setSeed(Integer seed) {
		this.seed = seed;
	}

	/**
	 * @return the number of values to print
	 */
	public int getCount() {
		return count;
	}

	/**
	 * @param count the number of values to print
	 * @throws IllegalArgumentException if {@code count} is negative
	 */
	public void setCount(int count) {
		if (count < 0) {
			throw new IllegalArgumentException("count must be non-negative: " + count);
		}
		this.count = count;
	}

	/**
	 * @return whether values are drawn through the overridable primitives
	 */
	public boolean isDerived() {
		return derived;
	}

	/**
	 * @param derived whether values are drawn through the overridable primitives
	 */
	public void setDerived(boolean derived) {
		this.derived = derived;
	}

	/**
	 * @return the kind of values to print
	 */
	public Operation getOperation() {
		return operation;
	}

	/**
	 * @param operation the kind of values to print
	 */
	public void setOperation(Operation operation) {
		this.operation = operation;
	}

	/**
	 * @return the bounds passed to the operation
	 */
	public List<Long> getBounds() {
		return new ArrayList<Long>(bounds);
	}

	/**
	 * @param bound a bound to append to the operation arguments
	 */
	public void addBound(long bound) {
		bounds.add(bound);
	}

	/**
	 * @return the output stream
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * @param pOutputStream the output stream to set
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream pOutputStream) {
		outputStream = pOutputStream;
	}
}
