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
 * <code>Name="literal"</code> or <code>Name=literal</code>: stores the
 * interpolated literal into the variable.
 */
public class AssignCommand extends Node {

	private final String name;
	private final String literal;

	/**
	 * @param lineNumber line number
	 * @param name name of the assigned variable
	 * @param literal value, with surrounding quotes already removed
	 */
	public AssignCommand(int lineNumber, String name, String literal) {
		super(lineNumber);
		this.name = name;
		this.literal = literal;
	}

	public String getName() {
		return name;
	}

	public String getLiteral() {
		return literal;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.ASSIGN;
	}

	@Override
	public String toString() {
		return "Assign " + name + " = \"" + literal + "\"";
	}
}
