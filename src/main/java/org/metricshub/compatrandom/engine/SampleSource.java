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
 * The primitives of a generator as seen by its callers, possibly overridden.
 * <p>
 * {@link DerivedRandomImpl} reads every composite value through this
 * interface instead of its own engine, so that replacing one of these
 * primitives changes everything built on top of it.
 */
public interface SampleSource {

	/**
	 * @return a double in {@code [0.0,1.0)}
	 */
	double sample();

	/**
	 * @return a non-negative int
	 */
	int nextInt();

	/**
	 * @param maxValue exclusive upper bound, non-negative
	 * @return an int in {@code [0, maxValue)}
	 */
	int nextInt(int maxValue);
}
