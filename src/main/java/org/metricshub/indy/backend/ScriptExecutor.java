package org.metricshub.indy.backend;

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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import org.metricshub.indy.ExecutionStatus;
import org.metricshub.indy.frontend.ast.AssignCommand;
import org.metricshub.indy.frontend.ast.Comparison;
import org.metricshub.indy.frontend.ast.IfElseBlock;
import org.metricshub.indy.frontend.ast.LoopBlock;
import org.metricshub.indy.frontend.ast.Node;
import org.metricshub.indy.frontend.ast.PromptCommand;
import org.metricshub.indy.frontend.ast.SayCommand;
import org.metricshub.indy.frontend.ast.ScriptBlock;
import org.metricshub.indy.frontend.ast.UnknownLine;
import org.metricshub.indy.frontend.ast.WaitCommand;
import org.metricshub.indy.jrt.Environment;
import org.metricshub.indy.jrt.IndyRuntimeException;
import org.metricshub.indy.jrt.Interpolator;
import org.metricshub.indy.util.IndyLogger;
import org.metricshub.indy.util.IndySettings;
import org.slf4j.Logger;

/**
 * Walks the block tree of a script and performs each command.
 * <p>
 * Execution is single-threaded and strictly sequential: a nested block runs
 * to completion before the next node of the enclosing body. Bodies being
 * executed are kept on an explicit stack, so nesting depth is not limited by
 * the Java call stack. <code>wait</code>
 * and <code>prompt</code> block the calling thread.
 * <p>
 * <code>loop</code> blocks are simulated: they are recognized and skipped,
 * their body is never executed.
 */
public class ScriptExecutor implements IndyInterpreter {

	private static final Logger LOGGER = IndyLogger.getLogger(ScriptExecutor.class);

	/** Printed after the message of a <code>prompt</code>. */
	public static final String PROMPT_SEPARATOR = ": ";

	private final Environment environment;
	private final PrintStream out;
	private final BufferedReader in;
	private final Sleeper sleeper;
	private final Diagnostics diagnostics;

	/**
	 * Creates an executor with a fresh environment holding the initial
	 * variables of the settings.
	 *
	 * @param settings I/O handles, sleep primitive and diagnostics to use
	 */
	public ScriptExecutor(IndySettings settings) {
		this(settings, new Environment(settings.getVariables()));
	}

	/**
	 * @param settings I/O handles, sleep primitive and diagnostics to use
	 * @param environment variables, updated by the script
	 */
	public ScriptExecutor(IndySettings settings, Environment environment) {
		this.environment = environment;
		this.out = settings.getOutputStream();
		this.in = new BufferedReader(new InputStreamReader(settings.getInput(), StandardCharsets.UTF_8));
		this.sleeper = settings.getSleeper();
		this.diagnostics = settings.getDiagnostics();
	}

	/**
	 * @return the variables of the script
	 */
	public Environment getEnvironment() {
		return environment;
	}

	/** {@inheritDoc} */
	@Override
	public ExecutionStatus interpret(ScriptBlock script) {
		LOGGER.debug("Executing {}", script.getSourceDescription());
		diagnostics.report(script.getLineNumber(), "Script started.");
		try {
			execute(script.getBody());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			LOGGER.debug("Execution of {} interrupted", script.getSourceDescription());
			diagnostics.report(-1, "Script interrupted.");
			return ExecutionStatus.INTERRUPTED;
		} finally {
			out.flush();
		}
		diagnostics.report(script.getEndLineNumber(), "Script finished.");
		return ExecutionStatus.COMPLETED;
	}

	private void execute(List<Node> body) throws InterruptedException {
		Deque<Iterator<Node>> bodies = new ArrayDeque<Iterator<Node>>();
		bodies.push(body.iterator());
		while (!bodies.isEmpty()) {
			Iterator<Node> current = bodies.peek();
			if (!current.hasNext()) {
				bodies.pop();
				continue;
			}
			Node node = current.next();
			switch (node.getKind()) {
			case ASSIGN: {
				AssignCommand assign = (AssignCommand) node;
				environment.set(assign.getName(), interpolate(assign.getLiteral()));
				break;
			}
			case SAY: {
				out.println(interpolate(((SayCommand) node).getTemplate()));
				break;
			}
			case WAIT: {
				WaitCommand wait = (WaitCommand) node;
				diagnostics.report(node.getLineNumber(), "Waiting for " + wait.getSeconds() + " seconds...");
				long millis = wait.getMillis();
				if (millis > 0) {
					out.flush();
					sleeper.sleep(millis);
				}
				break;
			}
			case PROMPT: {
				prompt((PromptCommand) node);
				break;
			}
			case IF_ELSE: {
				IfElseBlock ifElse = (IfElseBlock) node;
				bodies.push((evaluate(ifElse.getCondition()) ? ifElse.getThenBody() : ifElse.getElseBody()).iterator());
				break;
			}
			case LOOP: {
				LoopBlock loop = (LoopBlock) node;
				diagnostics
						.report(
								node.getLineNumber(),
								"Loop encountered (" + loop.getCount() + "). Simulation: skipping block to continue execution");
				break;
			}
			case UNKNOWN: {
				diagnostics.report(node.getLineNumber(), "Unknown command or bad syntax: '" + ((UnknownLine) node).getRaw().trim() + "'");
				break;
			}
			case COMMENT:
			case BLANK:
				break;
			default:
				throw new IllegalStateException("Unexpected node " + node.getKind() + " on line " + node.getLineNumber());
			}
		}
	}

	private void prompt(PromptCommand prompt) {
		out.print(interpolate(prompt.getMessage()) + PROMPT_SEPARATOR);
		out.flush();
		String answer;
		try {
			answer = in.readLine();
		} catch (IOException e) {
			throw new IndyRuntimeException(prompt.getLineNumber(), "Failed to read input for prompt: " + e.getMessage(), e);
		}
		if (answer == null) {
			diagnostics
					.report(
							prompt.getLineNumber(),
							"End of input reached while prompting for '" + prompt.getName() + "', storing an empty value");
			answer = "";
		}
		environment.set(prompt.getName(), answer);
	}

	/**
	 * The left operand is interpolated. An unquoted right operand naming a
	 * defined variable is replaced by its value, any other right operand is
	 * compared as written.
	 */
	private boolean evaluate(Comparison condition) {
		String left = interpolate(condition.getLeft());
		String right = condition.getRight();
		if (!condition.isRightQuoted() && environment.isDefined(right)) {
			right = environment.get(right);
		}
		return condition.getOperator().test(left, right);
	}

	private String interpolate(String template) {
		return Interpolator.interpolate(template, environment);
	}
}
