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
 * A line that is not a command. Kept in the tree so that it can be reported
 * when diagnostics are enabled; it has no effect on the script otherwise.
 */
public class UnknownLine extends Node {

	private final String raw;

	public UnknownLine(int lineNumber, String raw) {
		super(lineNumber);
		this.raw = raw;
	}

	/**
	 * @return the line as written in the script
	 */
	public String getRaw() {
		return raw;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.UNKNOWN;
	}

	@Override
	public String toString() {
		return "Unknown '" + raw.trim() + "'";
	}
}
