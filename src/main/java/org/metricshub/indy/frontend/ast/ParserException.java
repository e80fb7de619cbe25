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
 * Raised when the structure of an Indy script is invalid: a block left open,
 * a terminator that does not close the innermost block, a second
 * <code>else</code>, and the like. Always thrown before any command executes.
 */
public class ParserException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String sourceDescription;
	private final int lineNumber;

	/**
	 * <p>
	 * Constructor for ParserException.
	 * </p>
	 *
	 * @param msg description of the problem
	 * @param sourceDescription description of the script source (file name)
	 * @param lineNumber 1-based line number of the offending line
	 */
	public ParserException(String msg, String sourceDescription, int lineNumber) {
		super(msg);
		this.sourceDescription = sourceDescription;
		this.lineNumber = lineNumber;
	}

	/**
	 * @return the description of the script source (file name)
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}

	/**
	 * @return the 1-based line number of the offending line
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
