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

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.indy.frontend.ast.AssignCommand;
import org.metricshub.indy.frontend.ast.BlankLine;
import org.metricshub.indy.frontend.ast.CommentLine;
import org.metricshub.indy.frontend.ast.Comparison;
import org.metricshub.indy.frontend.ast.ComparisonOperator;
import org.metricshub.indy.frontend.ast.LexerException;
import org.metricshub.indy.frontend.ast.LoopCount;
import org.metricshub.indy.frontend.ast.PromptCommand;
import org.metricshub.indy.frontend.ast.SayCommand;
import org.metricshub.indy.frontend.ast.UnknownLine;
import org.metricshub.indy.frontend.ast.WaitCommand;

/**
 * Classifies each line of an Indy script into a {@link Line}.
 * <p>
 * Rules are applied in this order:
 * <ol>
 * <li>first non-blank character is <code>#</code>: comment
 * <li>empty or all-whitespace: blank
 * <li><code>Identifier=value</code>: assignment
 * <li>first word is a keyword: parsed according to the keyword
 * <li>anything else: unknown (never fatal)
 * </ol>
 * Keywords are case-sensitive. A keyword line with an argument that cannot be
 * understood (<code>wait</code> and <code>loop</code> numbers,
 * <code>if</code> conditions) is returned as a malformed line carrying its
 * {@link LexerException}: whether it is fatal depends on where the line sits,
 * which only {@link BlockParser} knows. The lexer has no other state than the
 * description of the source, used in error messages.
 */
public class IndyLexer {

	private static final String IDENTIFIER = "[_a-zA-Z][_0-9a-zA-Z]*";

	private static final Pattern IDENTIFIER_PATTERN = Pattern.compile(IDENTIFIER);

	/** <code>Name="value"</code>, but not <code>Name=="value"</code> */
	private static final Pattern ASSIGNMENT_PATTERN = Pattern.compile("(" + IDENTIFIER + ")\\s*=(?!=)(.*)");

	private static final Pattern SECONDS_PATTERN = Pattern.compile("\\d+(\\.\\d*)?|\\.\\d+");

	private static final Pattern COUNT_PATTERN = Pattern.compile("\\d+");

	private static final String FOREVER = "forever";

	/**
	 * Keywords recognized as the first word of a line. The two-word
	 * terminators (<code>end if</code>, <code>end loop</code>) are resolved
	 * from <code>end</code>.
	 */
	private static final Map<String, Token> KEYWORDS = new HashMap<String, Token>();

	static {
		KEYWORDS.put("start", Token.KW_START);
		KEYWORDS.put("end", Token.KW_END);
		KEYWORDS.put("say", Token.KW_SAY);
		KEYWORDS.put("wait", Token.KW_WAIT);
		KEYWORDS.put("prompt", Token.KW_PROMPT);
		KEYWORDS.put("if", Token.KW_IF);
		KEYWORDS.put("else", Token.KW_ELSE);
		KEYWORDS.put("loop", Token.KW_LOOP);
	}

	private final String sourceDescription;

	/**
	 * <p>
	 * Constructor for IndyLexer.
	 * </p>
	 *
	 * @param sourceDescription description of the script source, for error messages
	 */
	public IndyLexer(String sourceDescription) {
		this.sourceDescription = sourceDescription;
	}

	/**
	 * Classifies one line.
	 *
	 * @param lineNumber 1-based number of the line
	 * @param raw the line, without its terminator
	 * @return the classified line, possibly malformed
	 */
	public Line classify(int lineNumber, String raw) {
		String trimmed = raw.trim();

		if (trimmed.startsWith("#")) {
			return Line.command(Token.COMMENT, raw, new CommentLine(lineNumber, trimmed.substring(1).trim()));
		}
		if (trimmed.isEmpty()) {
			return Line.command(Token.BLANK, raw, new BlankLine(lineNumber));
		}

		Matcher assignment = ASSIGNMENT_PATTERN.matcher(trimmed);
		if (assignment.matches()) {
			return Line
					.command(
							Token.ASSIGN,
							raw,
							new AssignCommand(lineNumber, assignment.group(1), cleanStringValue(assignment.group(2))));
		}

		String[] words = trimmed.split("\\s+", 2);
		String rest = words.length > 1 ? words[1] : "";
		Token token = KEYWORDS.get(words[0]);
		if (token == null) {
			return unknown(lineNumber, raw);
		}

		switch (token) {
		case KW_START:
		case KW_ELSE:
			return rest.isEmpty() ? Line.keyword(token, lineNumber, raw) : unknown(lineNumber, raw);
		case KW_END:
			if (rest.isEmpty()) {
				return Line.keyword(Token.KW_END, lineNumber, raw);
			} else if (rest.equals("if")) {
				return Line.keyword(Token.KW_END_IF, lineNumber, raw);
			} else if (rest.equals("loop")) {
				return Line.keyword(Token.KW_END_LOOP, lineNumber, raw);
			}
			return unknown(lineNumber, raw);
		case KW_SAY:
			return Line.command(token, raw, new SayCommand(lineNumber, cleanStringValue(rest)));
		case KW_WAIT:
			try {
				return Line.command(token, raw, new WaitCommand(lineNumber, parseSeconds(lineNumber, raw, rest)));
			} catch (LexerException e) {
				return Line.malformed(token, lineNumber, raw, e);
			}
		case KW_PROMPT:
			Matcher prompt = ASSIGNMENT_PATTERN.matcher(rest);
			if (!prompt.matches()) {
				// prompt without "Name=" does not capture anything: report it, do not fail
				return unknown(lineNumber, raw);
			}
			return Line
					.command(
							token,
							raw,
							new PromptCommand(lineNumber, prompt.group(1), cleanStringValue(prompt.group(2))));
		case KW_IF:
			try {
				return Line.ifLine(lineNumber, raw, parseCondition(lineNumber, raw, rest));
			} catch (LexerException e) {
				return Line.malformed(token, lineNumber, raw, e);
			}
		case KW_LOOP:
			try {
				return Line.loopLine(lineNumber, raw, parseLoopCount(lineNumber, raw, rest));
			} catch (LexerException e) {
				return Line.malformed(token, lineNumber, raw, e);
			}
		default:
			return unknown(lineNumber, raw);
		}
	}

	private static Line unknown(int lineNumber, String raw) {
		return Line.command(Token.UNKNOWN, raw, new UnknownLine(lineNumber, raw));
	}

	private double parseSeconds(int lineNumber, String raw, String argument) {
		if (!SECONDS_PATTERN.matcher(argument).matches()) {
			throw lexerException("Invalid duration for 'wait', expected a non-negative number of seconds", lineNumber, raw);
		}
		return Double.parseDouble(argument);
	}

	private LoopCount parseLoopCount(int lineNumber, String raw, String argument) {
		if (FOREVER.equals(argument)) {
			return LoopCount.FOREVER;
		}
		if (COUNT_PATTERN.matcher(argument).matches()) {
			try {
				return LoopCount.of(Long.parseLong(argument));
			} catch (NumberFormatException e) {
				throw lexerException("Loop count is too large", lineNumber, raw);
			}
		}
		throw lexerException(
				"Invalid count for 'loop', expected a non-negative integer or '" + FOREVER + "'",
				lineNumber,
				raw);
	}

	/**
	 * Parses <code>left == right</code> or <code>left != right</code>.
	 * A bare identifier on the left stands for the value of that variable.
	 */
	private Comparison parseCondition(int lineNumber, String raw, String argument) {
		ComparisonOperator operator;
		int index = argument.indexOf(ComparisonOperator.EQ.getSymbol());
		if (index >= 0) {
			operator = ComparisonOperator.EQ;
		} else {
			index = argument.indexOf(ComparisonOperator.NE.getSymbol());
			operator = ComparisonOperator.NE;
		}
		if (index < 0) {
			throw lexerException("Invalid condition, expected 'Name == \"value\"' or 'Name != \"value\"'", lineNumber, raw);
		}

		String left = argument.substring(0, index).trim();
		String right = argument.substring(index + operator.getSymbol().length()).trim();
		if (left.isEmpty()) {
			throw lexerException("Missing left-hand side in condition", lineNumber, raw);
		}

		String leftTemplate = IDENTIFIER_PATTERN.matcher(left).matches() ? "{" + left + "}" : cleanStringValue(left);
		return new Comparison(leftTemplate, operator, cleanStringValue(right), isQuoted(right));
	}

	private LexerException lexerException(String msg, int lineNumber, String raw) {
		return new LexerException(msg, sourceDescription, lineNumber, raw);
	}

	private static boolean isQuoted(String value) {
		return value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"");
	}

	/**
	 * Trims the value, and removes its surrounding double quotes when it has
	 * both an opening and a closing one. Inner quotes are kept as is.
	 *
	 * @param value value as written in the script
	 * @return the cleaned value
	 */
	static String cleanStringValue(String value) {
		String result = value.trim();
		if (isQuoted(result)) {
			result = result.substring(1, result.length() - 1);
		}
		return result;
	}
}
