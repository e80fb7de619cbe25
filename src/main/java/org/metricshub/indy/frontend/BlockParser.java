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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.metricshub.indy.backend.Diagnostics;
import org.metricshub.indy.frontend.ast.Comparison;
import org.metricshub.indy.frontend.ast.IfElseBlock;
import org.metricshub.indy.frontend.ast.LoopBlock;
import org.metricshub.indy.frontend.ast.LoopCount;
import org.metricshub.indy.frontend.ast.Node;
import org.metricshub.indy.frontend.ast.ParserException;
import org.metricshub.indy.frontend.ast.ScriptBlock;
import org.metricshub.indy.util.IndyLogger;
import org.slf4j.Logger;

/**
 * Builds the block tree of an Indy script out of its classified lines.
 * <p>
 * Open blocks are kept on an explicit stack: <code>start</code>,
 * <code>if</code> and <code>loop</code> push, their terminators pop. Any
 * structural problem raises a {@link ParserException}, so that a script with
 * a broken structure never starts.
 * <p>
 * Lines before <code>start</code> and after the final <code>end</code> are
 * ignored, and reported to the {@link Diagnostics} sink unless they are
 * comments or blank lines.
 * <p>
 * A malformed line (see {@link Line#getError()}) is fatal when it may be
 * executed. Inside a <code>loop</code> body, which never runs, it is reported
 * and kept in the tree: a malformed <code>wait</code> becomes an unknown line,
 * a malformed <code>if</code> or <code>loop</code> still opens its block so
 * that its terminator is matched.
 */
public class BlockParser {

	private static final Logger LOGGER = IndyLogger.getLogger(BlockParser.class);

	private final String sourceDescription;
	private final Diagnostics diagnostics;

	/**
	 * <p>
	 * Constructor for BlockParser.
	 * </p>
	 *
	 * @param sourceDescription description of the script source, for error messages
	 * @param diagnostics where to report ignored lines
	 */
	public BlockParser(String sourceDescription, Diagnostics diagnostics) {
		this.sourceDescription = sourceDescription;
		this.diagnostics = diagnostics;
	}

	/**
	 * Builds the block tree.
	 *
	 * @param lines all the lines of the script, in order
	 * @return the <code>start ... end</code> block
	 * @throws ParserException if the structure of the script is invalid, or
	 *         if a malformed line may be executed
	 */
	public ScriptBlock parse(List<Line> lines) {
		Deque<OpenBlock> stack = new ArrayDeque<OpenBlock>();
		ScriptBlock script = null;
		int lastLineNumber = 0;
		int openLoops = 0;

		for (Line line : lines) {
			lastLineNumber = line.getLineNumber();
			Token token = line.getToken();

			// Outside of start ... end
			if (stack.isEmpty()) {
				if (script == null && token == Token.KW_START) {
					stack.push(new OpenBlock(line));
				} else if (token != Token.COMMENT && token != Token.BLANK) {
					String where = script == null ? "before 'start'" : "after the final 'end'";
					String message = "Ignoring line " + where + ": '" + line.getRaw().trim() + "'";
					if (line.isMalformed()) {
						message += " (" + line.getError().getReason() + ")";
					}
					diagnostics.report(line.getLineNumber(), message);
				}
				continue;
			}

			if (line.isMalformed()) {
				if (openLoops == 0) {
					throw line.getError();
				}
				diagnostics
						.report(
								line.getLineNumber(),
								"Ignoring malformed line in a loop body (" + line.getError().getReason() + "): '"
										+ line.getRaw().trim() + "'");
			}

			OpenBlock current = stack.peek();
			switch (token) {
			case KW_START:
				throw parserException(
						"Unexpected 'start': the script block opened on line " + stack.getLast().lineNumber + " is still open",
						line.getLineNumber());
			case KW_IF:
				stack.push(new OpenBlock(line));
				break;
			case KW_LOOP:
				stack.push(new OpenBlock(line));
				openLoops++;
				break;
			case KW_ELSE:
				if (current.opener != Token.KW_IF) {
					throw parserException(
							"'else' without matching 'if' (innermost open block is '"
									+ current.opener.getKeyword() + "' opened on line " + current.lineNumber + ")",
							line.getLineNumber());
				}
				if (current.elseLineNumber > 0) {
					throw parserException(
							"Duplicate 'else' for 'if' opened on line " + current.lineNumber
									+ " (first 'else' on line " + current.elseLineNumber + ")",
							line.getLineNumber());
				}
				current.elseLineNumber = line.getLineNumber();
				break;
			case KW_END:
			case KW_END_IF:
			case KW_END_LOOP:
				Token expected = current.opener.terminator();
				if (token != expected) {
					throw parserException(
							"Mismatched terminator '" + token.getKeyword() + "': expected '" + expected.getKeyword()
									+ "' to close '" + current.opener.getKeyword() + "' opened on line " + current.lineNumber,
							line.getLineNumber());
				}
				stack.pop();
				if (current.opener == Token.KW_LOOP) {
					openLoops--;
				}
				Node block = current.close(line.getLineNumber());
				if (stack.isEmpty()) {
					script = (ScriptBlock) block;
				} else {
					stack.peek().target().add(block);
				}
				break;
			default:
				current.target().add(line.getCommand());
				break;
			}
		}

		if (!stack.isEmpty()) {
			OpenBlock unterminated = stack.peek();
			throw parserException(
					"Unterminated '" + unterminated.opener.getKeyword() + "' block opened on line "
							+ unterminated.lineNumber + ": expected '" + unterminated.opener.terminator().getKeyword()
							+ "' before the end of the script",
					unterminated.lineNumber);
		}
		if (script == null) {
			throw parserException("Missing 'start': the script has no 'start ... end' block", Math.max(1, lastLineNumber));
		}

		LOGGER.debug("Parsed {}: {} top-level nodes", sourceDescription, script.getBody().size());
		return script;
	}

	private ParserException parserException(String msg, int lineNumber) {
		return new ParserException(msg, sourceDescription, lineNumber);
	}

	/**
	 * A block whose terminator has not been reached yet.
	 */
	private final class OpenBlock {

		private final Token opener;
		private final int lineNumber;
		private final Comparison condition;
		private final LoopCount loopCount;
		private final List<Node> body = new ArrayList<Node>();
		private final List<Node> elseBody = new ArrayList<Node>();
		private int elseLineNumber = -1;

		private OpenBlock(Line line) {
			this.opener = line.getToken();
			this.lineNumber = line.getLineNumber();
			this.condition = line.getCondition();
			this.loopCount = line.getLoopCount();
		}

		/**
		 * @return the body that receives the next nodes
		 */
		private List<Node> target() {
			return elseLineNumber > 0 ? elseBody : body;
		}

		private Node close(int endLineNumber) {
			switch (opener) {
			case KW_START:
				return new ScriptBlock(sourceDescription, lineNumber, endLineNumber, body);
			case KW_IF:
				return new IfElseBlock(lineNumber, endLineNumber, condition, body, elseLineNumber, elseBody);
			case KW_LOOP:
				return new LoopBlock(lineNumber, endLineNumber, loopCount, body);
			default:
				throw new IllegalStateException("Not a block: " + opener);
			}
		}
	}
}
