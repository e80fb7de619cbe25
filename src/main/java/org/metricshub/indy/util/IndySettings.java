package org.metricshub.indy.util;

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
import java.io.InputStream;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import org.metricshub.indy.backend.ConsoleDiagnostics;
import org.metricshub.indy.backend.Diagnostics;
import org.metricshub.indy.backend.Sleeper;

/**
 * A simple container for the parameters of a single Indy script run.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking Indy programmatically, from within Java code.
 */
public class IndySettings {

	/**
	 * Where <code>prompt</code> answers are read from.
	 * By default, this is {@link System#in}.
	 */
	private InputStream input = System.in;

	/**
	 * Where <code>say</code> and <code>prompt</code> write to;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Where verbose diagnostics are written to;
	 * <code>System.err</code> by default.
	 */
	private PrintStream diagnosticStream = System.err;

	/**
	 * Whether verbose diagnostics are shown;
	 * <code>false</code> by default.
	 */
	private boolean verbose = false;

	/**
	 * Variable assignments applied to the environment prior to
	 * executing the script (-v assignments).
	 */
	private Map<String, String> variables = new LinkedHashMap<String, String>();

	/**
	 * Sleep primitive used by <code>wait</code>.
	 */
	private Sleeper sleeper = Sleeper.THREAD;

	/**
	 * Diagnostics sink. <code>null</code> means a {@link ConsoleDiagnostics}
	 * bound to the diagnostic stream and the verbose flag.
	 */
	private Diagnostics diagnostics = null;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("variables = ").append(getVariables()).append(newLine);
		desc.append("verbose = ").append(isVerbose()).append(newLine);
		desc.append("sleeper = ").append(sleeper == Sleeper.THREAD ? "thread" : sleeper.getClass().getName()).append(newLine);
		desc.append("diagnostics = ").append(diagnostics == null ? "console" : diagnostics.getClass().getName()).append(newLine);

		return desc.toString();
	}

	/**
	 * Where <code>prompt</code> answers are read from.
	 *
	 * @return the input
	 */
	public InputStream getInput() {
		return input;
	}

	/**
	 * Where <code>prompt</code> answers are read from.
	 *
	 * @param input the input to set
	 */
	public void setInput(InputStream input) {
		this.input = input;
	}

	/**
	 * Output stream of the script;
	 * <code>System.out</code> by default.
	 *
	 * @return the output stream
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "OutputStream reference is intentionally shared so callers can control output.")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * Sets the PrintStream to print to (instead of System.out by default)
	 *
	 * @param pOutputStream PrintStream to use for say and prompt
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly; no defensive copy possible.")
	public void setOutputStream(PrintStream pOutputStream) {
		outputStream = pOutputStream;
	}

	/**
	 * @return the stream receiving verbose diagnostics
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "PrintStream reference is intentionally shared.")
	public PrintStream getDiagnosticStream() {
		return diagnosticStream;
	}

	/**
	 * @param pDiagnosticStream stream receiving verbose diagnostics
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly; no defensive copy possible.")
	public void setDiagnosticStream(PrintStream pDiagnosticStream) {
		diagnosticStream = pDiagnosticStream;
	}

	/**
	 * @return whether verbose diagnostics are shown
	 */
	public boolean isVerbose() {
		return verbose;
	}

	/**
	 * @param verbose whether verbose diagnostics are shown
	 */
	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

	/**
	 * Variable assignments applied prior to executing the script.
	 *
	 * @return a copy of the variables
	 */
	public Map<String, String> getVariables() {
		return new LinkedHashMap<String, String>(variables);
	}

	/**
	 * @param variables the variables to set
	 */
	public void setVariables(Map<String, String> variables) {
		this.variables = new LinkedHashMap<String, String>(variables);
	}

	/**
	 * Put or replace a variable entry.
	 *
	 * @param name Variable name
	 * @param value Variable value
	 */
	public void putVariable(String name, String value) {
		variables.put(name, value);
	}

	/**
	 * @return the sleep primitive used by <code>wait</code>
	 */
	public Sleeper getSleeper() {
		return sleeper;
	}

	/**
	 * @param sleeper the sleep primitive used by <code>wait</code>
	 */
	public void setSleeper(Sleeper sleeper) {
		this.sleeper = sleeper;
	}

	/**
	 * Returns the diagnostics sink to use for this run: the one set with
	 * {@link #setDiagnostics(Diagnostics)}, or a console sink honoring
	 * the verbose flag.
	 *
	 * @return the diagnostics sink, never <code>null</code>
	 */
	public Diagnostics getDiagnostics() {
		if (diagnostics != null) {
			return diagnostics;
		}
		return new ConsoleDiagnostics(diagnosticStream, verbose);
	}

	/**
	 * @param diagnostics the diagnostics sink, or <code>null</code> for the console default
	 */
	public void setDiagnostics(Diagnostics diagnostics) {
		this.diagnostics = diagnostics;
	}
}
