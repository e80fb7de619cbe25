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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

/**
 * Where the text of an Indy script comes from, and how it is named in error
 * messages (<code>ParserException (greeting.indy, line 12): ...</code>).
 * <p>
 * Scripts passed as text by an embedding application or the JSR-223 engine
 * are named {@value #DESCRIPTION_INLINE_SCRIPT}. Script files given on the
 * command line are {@link ScriptFileSource}s.
 */
public class ScriptSource {

	/** Name of the scripts that do not come from a file */
	public static final String DESCRIPTION_INLINE_SCRIPT = "<inline-script>";

	private final String description;
	private final Reader reader;

	/**
	 * @param description name of the script, used in error messages
	 * @param reader the text of the script, read once by the compiler
	 */
	public ScriptSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * @param script the text of the script
	 * @return a source named {@value #DESCRIPTION_INLINE_SCRIPT}
	 */
	public static ScriptSource inline(String script) {
		return inline(new StringReader(script));
	}

	/**
	 * @param script reader of the text of the script
	 * @return a source named {@value #DESCRIPTION_INLINE_SCRIPT}
	 */
	public static ScriptSource inline(Reader script) {
		return new ScriptSource(DESCRIPTION_INLINE_SCRIPT, script);
	}

	/**
	 * @return the name of the script, used in error messages
	 */
	public final String getDescription() {
		return description;
	}

	/**
	 * @return the text of the script; closed by the compiler once read
	 * @throws IOException if the script cannot be opened
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	@Override
	public String toString() {
		return description;
	}
}
