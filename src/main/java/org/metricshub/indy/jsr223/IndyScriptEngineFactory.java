package org.metricshub.indy.jsr223;

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

import java.util.Arrays;
import java.util.List;
import javax.script.ScriptEngine;
import javax.script.ScriptEngineFactory;
import org.metricshub.indy.Indy;

/** ScriptEngineFactory for Indy. */
public class IndyScriptEngineFactory implements ScriptEngineFactory {

	@Override
	public String getEngineName() {
		return "Indy";
	}

	@Override
	public String getEngineVersion() {
		return Indy.VERSION;
	}

	@Override
	public List<String> getExtensions() {
		return Arrays.asList("indy");
	}

	@Override
	public List<String> getMimeTypes() {
		return Arrays.asList("application/x-indy");
	}

	@Override
	public List<String> getNames() {
		return Arrays.asList("indy", "Indy");
	}

	@Override
	public String getLanguageName() {
		return "indy";
	}

	@Override
	public String getLanguageVersion() {
		return "1";
	}

	@Override
	public Object getParameter(String key) {
		if (ScriptEngine.NAME.equals(key) || ScriptEngine.ENGINE.equals(key)) {
			return getEngineName();
		}
		if (ScriptEngine.ENGINE_VERSION.equals(key)) {
			return getEngineVersion();
		}
		if (ScriptEngine.LANGUAGE.equals(key)) {
			return getLanguageName();
		}
		if (ScriptEngine.LANGUAGE_VERSION.equals(key)) {
			return getLanguageVersion();
		}
		return null;
	}

	/** Indy has no method calls. */
	@Override
	public String getMethodCallSyntax(String obj, String m, String... args) {
		throw new UnsupportedOperationException("Indy has no method calls");
	}

	@Override
	public String getOutputStatement(String toDisplay) {
		return "say \"" + toDisplay + "\"";
	}

	/**
	 * Wraps the statements in a <code>start ... end</code> block.
	 */
	@Override
	public String getProgram(String... statements) {
		StringBuilder sb = new StringBuilder();
		sb.append("start\n");
		for (String s : statements) {
			sb.append(s).append('\n');
		}
		sb.append("end\n");
		return sb.toString();
	}

	@Override
	public ScriptEngine getScriptEngine() {
		return new IndyScriptEngine(this);
	}
}
