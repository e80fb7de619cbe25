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

/**
 * How a script run ended. Parse errors never produce a status: they are
 * raised before the script starts.
 */
public enum ExecutionStatus {

	/** The final <code>end</code> was reached. */
	COMPLETED(0),

	/** The thread running the script was interrupted during a <code>wait</code>. */
	INTERRUPTED(130);

	private final int exitCode;

	ExecutionStatus(int exitCode) {
		this.exitCode = exitCode;
	}

	/**
	 * @return the process exit code the command line uses for this status
	 */
	public int getExitCode() {
		return exitCode;
	}
}
