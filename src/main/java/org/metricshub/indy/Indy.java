package org.metricshub.indy;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.indy.backend.Diagnostics;
import org.metricshub.indy.backend.ScriptExecutor;
import org.metricshub.indy.frontend.BlockParser;
import org.metricshub.indy.frontend.IndyLexer;
import org.metricshub.indy.frontend.Line;
import org.metricshub.indy.frontend.ast.ScriptBlock;
import org.metricshub.indy.util.IndyLogger;
import org.metricshub.indy.util.IndySettings;
import org.metricshub.indy.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the parsing and execution of an Indy script.
 * This entry point is used both when Indy is embedded as a library and when
 * invoked from the command line.
 * <p>
 * The overall process to execute an Indy script is as follows:
 * <ul>
 * <li>Classify each line of the script ({@link IndyLexer}).
 * <li>Build the block tree out of the classified lines ({@link BlockParser}).
 * Structural errors are raised at this point, before anything runs.
 * <li>Walk the block tree, performing each command ({@link ScriptExecutor}).
 * </ul>
 *
 * @see org.metricshub.indy.backend.ScriptExecutor
 */
public class Indy {

	private static final Logger LOGGER = IndyLogger.getLogger(Indy.class);

	/** Version of the interpreter */
	public static final String VERSION = "0.5.2";

	/**
	 * The last script produced by {@link #compile(ScriptSource)}.
	 */
	private ScriptBlock lastScript;

	/**
	 * Returns the last script parsed by this instance.
	 *
	 * @return the last {@link ScriptBlock}, or {@code null} if nothing was compiled
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ScriptBlock getLastScript() {
		return lastScript;
	}

	/**
	 * Parses the specified script without reporting ignored lines.
	 *
	 * @param source script to parse
	 * @return the block tree of the script
	 * @throws IOException if the script cannot be read
	 * @throws org.metricshub.indy.frontend.ast.ParserException if the script is invalid
	 */
	public ScriptBlock compile(ScriptSource source) throws IOException {
		return compile(source, Diagnostics.NONE);
	}

	/**
	 * Parses the specified script.
	 *
	 * @param source script to parse
	 * @param diagnostics where to report lines outside of <code>start ... end</code>
	 * @return the block tree of the script
	 * @throws IOException if the script cannot be read
	 * @throws org.metricshub.indy.frontend.ast.ParserException if the script is invalid
	 */
	public ScriptBlock compile(ScriptSource source, Diagnostics diagnostics) throws IOException {
		IndyLexer lexer = new IndyLexer(source.getDescription());
		List<Line> lines = new ArrayList<Line>();
		try (BufferedReader reader = new BufferedReader(source.getReader())) {
			String raw;
			int lineNumber = 0;
			while ((raw = reader.readLine()) != null) {
				lines.add(lexer.classify(++lineNumber, raw));
			}
		}
		LOGGER.debug("Read {} lines from {}", lines.size(), source.getDescription());
		lastScript = new BlockParser(source.getDescription(), diagnostics).parse(lines);
		return lastScript;
	}

	/**
	 * Parses and executes the specified script text.
	 *
	 * @param script text of the script
	 * @param settings I/O handles, verbose flag, sleep primitive
	 * @return how the run ended
	 * @throws IOException if the script cannot be read
	 */
	public ExecutionStatus invoke(String script, IndySettings settings) throws IOException {
		return invoke(ScriptSource.inline(script), settings);
	}

	/**
	 * Parses and executes the specified script. Nothing is executed when the
	 * script is invalid.
	 *
	 * @param source script to parse and execute
	 * @param settings I/O handles, verbose flag, sleep primitive
	 * @return how the run ended
	 * @throws IOException if the script cannot be read
	 */
	public ExecutionStatus invoke(ScriptSource source, IndySettings settings) throws IOException {
		ScriptBlock script = compile(source, settings.getDiagnostics());
		return invoke(script, settings);
	}

	/**
	 * Executes a parsed script.
	 *
	 * @param script parsed script
	 * @param settings I/O handles, verbose flag, sleep primitive
	 * @return how the run ended
	 */
	public ExecutionStatus invoke(ScriptBlock script, IndySettings settings) {
		ExecutionStatus status = new ScriptExecutor(settings).interpret(script);
		LOGGER.debug("{} ended with status {}", script.getSourceDescription(), status);
		return status;
	}

	/**
	 * Executes the specified script, answering its prompts with the lines of
	 * the given input, and returns what it printed.
	 *
	 * @param script text of the script
	 * @param input answers to the prompts, one per line
	 * @return the output of the script
	 * @throws IOException if an I/O error occurs
	 */
	public String run(String script, String input) throws IOException {
		return run(new StringReader(script), input);
	}

	/**
	 * Executes the specified script, answering its prompts with the lines of
	 * the given input, and returns what it printed.
	 *
	 * @param script script contents
	 * @param input answers to the prompts, one per line
	 * @return the output of the script
	 * @throws IOException if an I/O error occurs
	 */
	public String run(Reader script, String input) throws IOException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		run(script, input, out);
		return out.toString(StandardCharsets.UTF_8.name());
	}

	/**
	 * Executes the specified script, answering its prompts with the lines of
	 * the given input, and writes what it printed to the given stream.
	 *
	 * @param script script contents
	 * @param input answers to the prompts, one per line
	 * @param output destination of the output of the script
	 * @return how the run ended
	 * @throws IOException if an I/O error occurs
	 */
	public ExecutionStatus run(Reader script, String input, OutputStream output) throws IOException {
		IndySettings settings = new IndySettings();
		settings.setInput(new ByteArrayInputStream(input == null ? new byte[0] : input.getBytes(StandardCharsets.UTF_8)));
		settings.setOutputStream(new PrintStream(output, true, StandardCharsets.UTF_8.name()));
		return invoke(ScriptSource.inline(script), settings);
	}
}
