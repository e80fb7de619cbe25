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

/**
 * Classification of one line of an Indy script.
 * Keyword tokens carry the keyword as written in scripts.
 */
public enum Token {
	COMMENT(null),
	BLANK(null),
	ASSIGN(null),
	UNKNOWN(null),

	KW_START("start"),
	KW_END("end"),
	KW_SAY("say"),
	KW_WAIT("wait"),
	KW_PROMPT("prompt"),
	KW_IF("if"),
	KW_ELSE("else"),
	KW_END_IF("end if"),
	KW_LOOP("loop"),
	KW_END_LOOP("end loop");

	private final String keyword;

	Token(String keyword) {
		this.keyword = keyword;
	}

	/**
	 * @return the keyword, or <code>null</code> for non-keyword tokens
	 */
	public String getKeyword() {
		return keyword;
	}

	/**
	 * @return the terminator of the block opened by this token
	 * @throws IllegalStateException if this token does not open a block
	 */
	public Token terminator() {
		switch (this) {
		case KW_START:
			return KW_END;
		case KW_IF:
			return KW_END_IF;
		case KW_LOOP:
			return KW_END_LOOP;
		default:
			throw new IllegalStateException(this + " does not open a block");
		}
	}
}
