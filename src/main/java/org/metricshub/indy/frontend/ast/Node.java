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

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * A node of the Indy syntax tree: either a single command line, or a block
 * grouping other nodes.
 */
public abstract class Node {

	private final int lineNumber;

	/**
	 * @param lineNumber 1-based line number where this node starts
	 */
	protected Node(int lineNumber) {
		this.lineNumber = lineNumber;
	}

	/**
	 * @return the 1-based line number where this node starts
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return the kind of this node
	 */
	public abstract NodeKind getKind();

	/**
	 * Prints this node, and its children, one per line, indented by nesting
	 * depth. The tree is walked with an explicit stack, so any depth can be
	 * printed.
	 *
	 * @param ps where to print
	 */
	public void dump(PrintStream ps) {
		Deque<DumpEntry> pending = new ArrayDeque<DumpEntry>();
		pending.push(new DumpEntry(this, null, 0));
		while (!pending.isEmpty()) {
			DumpEntry entry = pending.pop();
			if (entry.node != null) {
				entry.node.pushDump(pending, entry.depth);
				continue;
			}
			StringBuilder line = new StringBuilder();
			for (int i = 0; i < entry.depth; i++) {
				line.append("  ");
			}
			ps.println(line.append(entry.text));
		}
	}

	/**
	 * Pushes what must be printed for this node onto the stack of pending
	 * entries. Entries are popped in reverse order: the last line first.
	 *
	 * @param pending entries still to print
	 * @param depth nesting depth of this node
	 */
	protected void pushDump(Deque<DumpEntry> pending, int depth) {
		pending.push(new DumpEntry(null, toString(), depth));
	}

	/**
	 * Either a node still to expand, or a line of text.
	 */
	protected static final class DumpEntry {

		private final Node node;
		private final String text;
		private final int depth;

		DumpEntry(Node node, String text, int depth) {
			this.node = node;
			this.text = text;
			this.depth = depth;
		}
	}
}
