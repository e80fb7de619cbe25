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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;

/**
 * Base class of the nodes that group other nodes.
 */
public abstract class BlockNode extends Node {

	private final int endLineNumber;

	protected BlockNode(int lineNumber, int endLineNumber) {
		super(lineNumber);
		this.endLineNumber = endLineNumber;
	}

	/**
	 * @return the line number of the terminator closing this block
	 */
	public int getEndLineNumber() {
		return endLineNumber;
	}

	protected static List<Node> freeze(List<Node> body) {
		return Collections.unmodifiableList(new ArrayList<Node>(body));
	}

	protected static void pushLine(Deque<DumpEntry> pending, String text, int depth) {
		pending.push(new DumpEntry(null, text, depth));
	}

	protected static void pushBody(Deque<DumpEntry> pending, List<Node> body, int depth) {
		ListIterator<Node> nodes = body.listIterator(body.size());
		while (nodes.hasPrevious()) {
			pending.push(new DumpEntry(nodes.previous(), null, depth));
		}
	}
}
