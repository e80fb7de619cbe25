package org.metricshub.indy.jrt;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Variables of a running Indy script.
 * <p>
 * The environment is flat: there is a single scope for the whole script.
 * All values are strings. A variable is created by its first assignment (or
 * <code>prompt</code>) and lives until the end of the run. Reading a variable
 * that was never assigned yields the empty string, it is never an error.
 */
public class Environment {

	private final Map<String, String> variables = new LinkedHashMap<String, String>();

	/**
	 * Creates an empty environment.
	 */
	public Environment() {}

	/**
	 * Creates an environment with initial variables (-v assignments).
	 *
	 * @param initialVariables variables to define before the script runs
	 */
	public Environment(Map<String, String> initialVariables) {
		for (Map.Entry<String, String> entry : initialVariables.entrySet()) {
			set(entry.getKey(), entry.getValue());
		}
	}

	/**
	 * @param name variable name
	 * @return the value of the variable, or an empty string when it is undefined
	 */
	public String get(String name) {
		String value = variables.get(name);
		return value == null ? "" : value;
	}

	/**
	 * Creates or overwrites a variable.
	 *
	 * @param name variable name
	 * @param value new value, <code>null</code> is stored as an empty string
	 */
	public void set(String name, String value) {
		variables.put(name, value == null ? "" : value);
	}

	/**
	 * @param name variable name
	 * @return whether the variable has been assigned
	 */
	public boolean isDefined(String name) {
		return variables.containsKey(name);
	}

	/**
	 * @return a read-only view of the variables, in order of creation
	 */
	public Map<String, String> toMap() {
		return Collections.unmodifiableMap(variables);
	}

	@Override
	public String toString() {
		return variables.toString();
	}
}
