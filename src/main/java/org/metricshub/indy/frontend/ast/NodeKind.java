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
 * Kinds of nodes of the Indy syntax tree. The executor dispatches on these.
 */
public enum NodeKind {
	/** <code>Name="value"</code> */
	ASSIGN,
	/** <code>say "template"</code> */
	SAY,
	/** <code>wait seconds</code> */
	WAIT,
	/** <code>prompt Name="message"</code> */
	PROMPT,
	/** <code># ...</code> */
	COMMENT,
	/** empty line */
	BLANK,
	/** anything the lexer could not recognize */
	UNKNOWN,
	/** <code>start ... end</code> */
	SCRIPT,
	/** <code>if ... else ... end if</code> */
	IF_ELSE,
	/** <code>loop ... end loop</code> */
	LOOP
}
