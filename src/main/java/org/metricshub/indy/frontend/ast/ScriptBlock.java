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
 * The top-level <code>start ... end</code> region. There is exactly one per
 * script, and it wraps all executable content.
 */
public class ScriptBlock extends BlockNode {

	private final String sourceDescription;
	private final List<Node> body;

	/**
	 * @param sourceDescription description of the script source (file name)
	 * @param lineNumber line of <code>start</code>
	 * @param endLineNumber line of the final <code>end</code>
	 * @param body nodes between both
	 */
	public ScriptBlock(String sourceDescription, int lineNumber, int endLineNumber, List<Node> body) {
		super(lineNumber, endLineNumber);
		this.sourceDescription = sourceDescription;
		this.body = freeze(body);
	}

	public String getSourceDescription() {
		return sourceDescription;
	}

	/**
	 * @return the unmodifiable list of nodes of the script
	 */
	public List<Node> getBody() {
		return body;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.SCRIPT;
	}

	@Override
	protected void pushDump(Deque<DumpEntry> pending, int depth) {
		pushLine(pending, "End", depth);
		pushBody(pending, body, depth + 1);
		pushLine(pending, "Script", depth);
	}

	@Override
	public String toString() {
		return "Script (" + body.size() + " nodes)";
	}
}
