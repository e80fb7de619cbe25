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
 * <code>wait seconds</code>, where seconds may be fractional.
 */
public class WaitCommand extends Node {

	private final double seconds;

	public WaitCommand(int lineNumber, double seconds) {
		super(lineNumber);
		this.seconds = seconds;
	}

	public double getSeconds() {
		return seconds;
	}

	/**
	 * @return the duration of the wait, truncated to whole milliseconds
	 */
	public long getMillis() {
		return (long) (seconds * 1000.0);
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.WAIT;
	}

	@Override
	public String toString() {
		return "Wait " + seconds + "s";
	}
}
