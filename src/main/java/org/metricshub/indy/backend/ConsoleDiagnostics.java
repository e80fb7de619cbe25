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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;
import org.metricshub.indy.util.IndyLogger;
import org.slf4j.Logger;

/**
 * Prints diagnostics to a stream, prefixed with <code>[Indy Engine]</code>,
 * when verbose mode is enabled. Every diagnostic is also logged at debug level.
 */
public class ConsoleDiagnostics implements Diagnostics {

	private static final Logger LOGGER = IndyLogger.getLogger(ConsoleDiagnostics.class);

	static final String PREFIX = "[Indy Engine] ";

	private final PrintStream stream;
	private final boolean verbose;

	/**
	 * @param stream where to print
	 * @param verbose whether to print at all
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly.")
	public ConsoleDiagnostics(PrintStream stream, boolean verbose) {
		this.stream = stream;
		this.verbose = verbose;
	}

	@Override
	public void report(int lineNumber, String message) {
		LOGGER.debug("line {}: {}", lineNumber, message);
		if (!verbose) {
			return;
		}
		if (lineNumber > 0) {
			stream.println(PREFIX + "(line " + lineNumber + ") " + message);
		} else {
			stream.println(PREFIX + message);
		}
		stream.flush();
	}
}
