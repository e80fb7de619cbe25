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

import java.util.Deque;
import java.util.List;

/**
 * <code>loop count ... end loop</code>. The body is parsed and validated
 * like any other block body, but it is not executed: loops are simulated.
 */
public class LoopBlock extends BlockNode {

	private final LoopCount count;
	private final List<Node> body;

	public LoopBlock(int lineNumber, int endLineNumber, LoopCount count, List<Node> body) {
		super(lineNumber, endLineNumber);
		this.count = count;
		this.body = freeze(body);
	}

	public LoopCount getCount() {
		return count;
	}

	public List<Node> getBody() {
		return body;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.LOOP;
	}

	@Override
	protected void pushDump(Deque<DumpEntry> pending, int depth) {
		pushLine(pending, "End Loop", depth);
		pushBody(pending, body, depth + 1);
		pushLine(pending, toString(), depth);
	}

	@Override
	public String toString() {
		return "Loop " + (count == null ? "<malformed count>" : count);
	}
}
