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
 * Operators allowed in an <code>if</code> condition. Both compare strings
 * exactly, without any normalization.
 */
public enum ComparisonOperator {
	EQ("==") {
		@Override
		public boolean test(String left, String right) {
			return left.equals(right);
		}
	},
	NE("!=") {
		@Override
		public boolean test(String left, String right) {
			return !left.equals(right);
		}
	};

	private final String symbol;

	ComparisonOperator(String symbol) {
		this.symbol = symbol;
	}

	/**
	 * @return the operator as written in scripts
	 */
	public String getSymbol() {
		return symbol;
	}

	/**
	 * @param left interpolated left operand
	 * @param right resolved right operand
	 * @return the outcome of the comparison
	 */
	public abstract boolean test(String left, String right);
}
