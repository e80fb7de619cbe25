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
 * Condition of an <code>if</code> block.
 * <p>
 * The left operand is a template (a bare variable name is turned into
 * <code>{Name}</code> by the lexer). The right operand is a literal; when it
 * was written without quotes and names a defined variable, the value of that
 * variable is used instead.
 */
public class Comparison {

	private final String left;
	private final ComparisonOperator operator;
	private final String right;
	private final boolean rightQuoted;

	/**
	 * @param left template of the left operand
	 * @param operator comparison operator
	 * @param right right operand, without surrounding quotes
	 * @param rightQuoted whether the right operand was written between quotes
	 */
	public Comparison(String left, ComparisonOperator operator, String right, boolean rightQuoted) {
		this.left = left;
		this.operator = operator;
		this.right = right;
		this.rightQuoted = rightQuoted;
	}

	public String getLeft() {
		return left;
	}

	public ComparisonOperator getOperator() {
		return operator;
	}

	public String getRight() {
		return right;
	}

	public boolean isRightQuoted() {
		return rightQuoted;
	}

	@Override
	public String toString() {
		String rightText = rightQuoted ? "\"" + right + "\"" : right;
		return "\"" + left + "\" " + operator.getSymbol() + " " + rightText;
	}
}
