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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import javax.script.AbstractScriptEngine;
import javax.script.Bindings;
import javax.script.ScriptContext;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptException;
import javax.script.SimpleBindings;
import org.metricshub.indy.Indy;
import org.metricshub.indy.frontend.ast.ParserException;
import org.metricshub.indy.util.IndySettings;
import org.metricshub.indy.util.ScriptSource;

/**
 * Simple JSR-223 script engine for Indy.
 * <p>
 * The <code>input</code> attribute of the context (a String or an
 * InputStream) answers the prompts of the script. The output of the script
 * is written to the writer of the context, and returned.
 */
public class IndyScriptEngine extends AbstractScriptEngine {

	private final ScriptEngineFactory factory;

	public IndyScriptEngine(ScriptEngineFactory factory) {
		this.factory = factory;
	}

	@Override
	public Object eval(Reader scriptReader, ScriptContext context) throws ScriptException {
		try {
			IndySettings settings = new IndySettings();
			Object inObj = context.getAttribute("input");
			if (inObj instanceof InputStream) {
				settings.setInput((InputStream) inObj);
			} else if (inObj instanceof String) {
				settings.setInput(new ByteArrayInputStream(((String) inObj).getBytes(StandardCharsets.UTF_8)));
			} else {
				settings.setInput(new ByteArrayInputStream(new byte[0]));
			}
			ByteArrayOutputStream result = new ByteArrayOutputStream();
			settings.setOutputStream(new PrintStream(result, true, StandardCharsets.UTF_8.name()));
			new Indy().invoke(ScriptSource.inline(scriptReader), settings);
			String out = result.toString(StandardCharsets.UTF_8.name());
			Writer writer = context.getWriter();
			if (writer != null) {
				writer.write(out);
				writer.flush();
			}
			return out;
		} catch (ParserException e) {
			ScriptException se = new ScriptException(e.getMessage(), e.getSourceDescription(), e.getLineNumber());
			se.initCause(e);
			throw se;
		} catch (Exception e) {
			throw new ScriptException(e);
		}
	}

	@Override
	public Object eval(String script, ScriptContext context) throws ScriptException {
		return eval(new StringReader(script), context);
	}

	@Override
	public Bindings createBindings() {
		return new SimpleBindings();
	}

	@Override
	public ScriptEngineFactory getFactory() {
		return factory;
	}
}
