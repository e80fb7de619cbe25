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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands <code>{Name}</code> placeholders against an {@link Environment}.
 * <p>
 * Substitution is done in a single pass, from left to right, and substituted
 * values are not scanned again. Undefined variables expand to an empty string.
 * Braces that do not surround an identifier are copied as they are.
 */
public final class Interpolator {

	private static final Pattern PLACEHOLDER = Pattern.compile("\\{([_a-zA-Z][_0-9a-zA-Z]*)\\}");

	private Interpolator() {}

	/**
	 * @param template text with zero or more placeholders
	 * @param environment variables to substitute
	 * @return the template with all placeholders replaced
	 */
	public static String interpolate(String template, Environment environment) {
		if (template.indexOf('{') < 0) {
			return template;
		}
		Matcher matcher = PLACEHOLDER.matcher(template);
		StringBuilder result = new StringBuilder(template.length());
		int last = 0;
		while (matcher.find()) {
			result.append(template, last, matcher.start());
			result.append(environment.get(matcher.group(1)));
			last = matcher.end();
		}
		result.append(template, last, template.length());
		return result.toString();
	}
}
