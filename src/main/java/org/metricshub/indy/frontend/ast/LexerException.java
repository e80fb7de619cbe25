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
 * Raised when a keyword line carries an argument that cannot be understood,
 * like <code>wait soon</code> or <code>loop -2</code>.
 */
public class LexerException extends ParserException {

	private static final long serialVersionUID = 1L;

	private final String reason;
	private final String rawLine;

	/**
	 * <p>
	 * Constructor for LexerException.
	 * </p>
	 *
	 * @param msg description of the problem
	 * @param sourceDescription description of the script source (file name)
	 * @param lineNumber 1-based line number of the offending line
	 * @param rawLine text of the offending line, as written in the script
	 */
	public LexerException(String msg, String sourceDescription, int lineNumber, String rawLine) {
		super(msg + ": '" + rawLine.trim() + "'", sourceDescription, lineNumber);
		this.reason = msg;
		this.rawLine = rawLine;
	}

	/**
	 * @return the description of the problem, without the offending line
	 */
	public String getReason() {
		return reason;
	}

	/**
	 * @return the text of the offending line
	 */
	public String getRawLine() {
		return rawLine;
	}
}
