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
 * <code>if condition ... else ... end if</code>, where the <code>else</code>
 * part is optional.
 */
public class IfElseBlock extends BlockNode {

	private final Comparison condition;
	private final List<Node> thenBody;
	private final List<Node> elseBody;
	private final int elseLineNumber;

	/**
	 * @param lineNumber line of <code>if</code>
	 * @param endLineNumber line of <code>end if</code>
	 * @param condition condition, <code>null</code> when it could not be parsed
	 *        (only inside a loop body, which never runs)
	 * @param thenBody nodes executed when the condition holds
	 * @param elseLineNumber line of <code>else</code>, or -1 when there is none
	 * @param elseBody nodes executed otherwise, possibly empty
	 */
	public IfElseBlock(
			int lineNumber,
			int endLineNumber,
			Comparison condition,
			List<Node> thenBody,
			int elseLineNumber,
			List<Node> elseBody) {
		super(lineNumber, endLineNumber);
		this.condition = condition;
		this.thenBody = freeze(thenBody);
		this.elseLineNumber = elseLineNumber;
		this.elseBody = freeze(elseBody);
	}

	public Comparison getCondition() {
		return condition;
	}

	public List<Node> getThenBody() {
		return thenBody;
	}

	public List<Node> getElseBody() {
		return elseBody;
	}

	public boolean hasElse() {
		return elseLineNumber > 0;
	}

	public int getElseLineNumber() {
		return elseLineNumber;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.IF_ELSE;
	}

	@Override
	protected void pushDump(Deque<DumpEntry> pending, int depth) {
		pushLine(pending, "End If", depth);
		if (hasElse()) {
			pushBody(pending, elseBody, depth + 1);
			pushLine(pending, "Else", depth);
		}
		pushBody(pending, thenBody, depth + 1);
		pushLine(pending, toString(), depth);
	}

	@Override
	public String toString() {
		return "If " + (condition == null ? "<malformed condition>" : condition);
	}
}
