package org.metricshub.indy.frontend.ast;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Indy
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
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
 * Declared number of iterations of a <code>loop</code>: a non-negative
 * integer, or <code>forever</code>.
 */
public final class LoopCount {

	/** <code>loop forever</code> */
	public static final LoopCount FOREVER = new LoopCount(-1);

	private final long count;

	private LoopCount(long count) {
		this.count = count;
	}

	/**
	 * @param count number of iterations
	 * @return a new LoopCount
	 * @throws IllegalArgumentException if count is negative
	 */
	public static LoopCount of(long count) {
		if (count < 0) {
			throw new IllegalArgumentException("Loop count must not be negative: " + count);
		}
		return new LoopCount(count);
	}

	public boolean isForever() {
		return count < 0;
	}

	/**
	 * @return the number of iterations
	 * @throws IllegalStateException for <code>forever</code>
	 */
	public long getCount() {
		if (isForever()) {
			throw new IllegalStateException("forever has no count");
		}
		return count;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof LoopCount && ((LoopCount) obj).count == count;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(count);
	}

	@Override
	public String toString() {
		return isForever() ? "forever" : Long.toString(count);
	}
}
