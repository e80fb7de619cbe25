package org.metricshub.indy.frontend;

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

import org.metricshub.indy.frontend.ast.Comparison;
import org.metricshub.indy.frontend.ast.LexerException;
import org.metricshub.indy.frontend.ast.LoopCount;
import org.metricshub.indy.frontend.ast.Node;
import org.metricshub.indy.frontend.ast.UnknownLine;

/**
 * One classified line, as produced by {@link IndyLexer}.
 * <p>
 * Lines that are a command on their own (comments, blanks, assignments,
 * <code>say</code>, <code>wait</code>, <code>prompt</code> and unknown lines)
 * carry the corresponding {@link Node}. <code>if</code> lines carry their
 * condition, <code>loop</code> lines their count.
 */
public final class Line {

	private final Token token;
	private final int lineNumber;
	private final String raw;
	private final Node command;
	private final Comparison condition;
	private final LoopCount loopCount;
	private final LexerException error;

	private Line(
			Token token,
			int lineNumber,
			String raw,
			Node command,
			Comparison condition,
			LoopCount loopCount,
			LexerException error) {
		this.token = token;
		this.lineNumber = lineNumber;
		this.raw = raw;
		this.command = command;
		this.condition = condition;
		this.loopCount = loopCount;
		this.error = error;
	}

	static Line command(Token token, String raw, Node command) {
		return new Line(token, command.getLineNumber(), raw, command, null, null, null);
	}

	static Line keyword(Token token, int lineNumber, String raw) {
		return new Line(token, lineNumber, raw, null, null, null, null);
	}

	static Line ifLine(int lineNumber, String raw, Comparison condition) {
		return new Line(Token.KW_IF, lineNumber, raw, null, condition, null, null);
	}

	static Line loopLine(int lineNumber, String raw, LoopCount loopCount) {
		return new Line(Token.KW_LOOP, lineNumber, raw, null, null, loopCount, null);
	}

	/**
	 * A keyword line whose argument could not be parsed. A malformed
	 * <code>wait</code> keeps an {@link UnknownLine} as its command, a
	 * malformed <code>if</code> or <code>loop</code> still opens its block, with
	 * no condition or count.
	 */
	static Line malformed(Token token, int lineNumber, String raw, LexerException error) {
		Node command = token == Token.KW_WAIT ? new UnknownLine(lineNumber, raw) : null;
		return new Line(token, lineNumber, raw, command, null, null, error);
	}

	public Token getToken() {
		return token;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return the line as written in the script
	 */
	public String getRaw() {
		return raw;
	}

	/**
	 * @return the command node, or <code>null</code> for block keywords
	 */
	public Node getCommand() {
		return command;
	}

	/**
	 * @return the condition of an <code>if</code> line, <code>null</code> otherwise
	 */
	public Comparison getCondition() {
		return condition;
	}

	/**
	 * @return the count of a <code>loop</code> line, <code>null</code> otherwise
	 */
	public LoopCount getLoopCount() {
		return loopCount;
	}

	/**
	 * @return why the argument of this line is malformed, or <code>null</code>
	 */
	public LexerException getError() {
		return error;
	}

	/**
	 * @return whether the argument of this line could not be parsed
	 */
	public boolean isMalformed() {
		return error != null;
	}

	@Override
	public String toString() {
		return lineNumber + ": " + token + " " + raw.trim();
	}
}
