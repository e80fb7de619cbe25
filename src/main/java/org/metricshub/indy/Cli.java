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
import java.io.File;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.indy.frontend.ast.ParserException;
import org.metricshub.indy.frontend.ast.ScriptBlock;
import org.metricshub.indy.jrt.IndyRuntimeException;
import org.metricshub.indy.util.IndyLogger;
import org.metricshub.indy.util.IndySettings;
import org.metricshub.indy.util.ScriptFileSource;
import org.metricshub.indy.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Command-line interface for Indy.
 */
public final class Cli {

	private static final Logger LOGGER = IndyLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "indy.jar";
		}
		JAR_NAME = myName;
	}

	private final IndySettings settings = new IndySettings();
	private final PrintStream out;

	private ScriptSource scriptSource;
	private boolean dumpSyntaxTree;
	private boolean printUsage;
	private boolean printVersion;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in stream from which prompt answers are read
	 * @param out stream where the script output is written
	 * @param err stream where verbose diagnostics are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err) {
		this.out = out;
		settings.setInput(in);
		settings.setOutputStream(out);
		settings.setDiagnosticStream(err);
	}

	/**
	 * Returns the mutable {@link IndySettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public IndySettings getSettings() {
		return settings;
	}

	/**
	 * @return the script given on the command line, or {@code null}
	 */
	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		for (int argIdx = 0; argIdx < args.length; argIdx++) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// the script file
				if (scriptSource != null) {
					throw new IllegalArgumentException("Only one script can be executed, got '" + arg + "' after '"
							+ scriptSource.getDescription() + "'");
				}
				scriptSource = new ScriptFileSource(arg);
			} else if (arg.equals("--verbose")) {
				settings.setVerbose(true);
			} else if (arg.equals("-v")) {
				// -v name=val : assign a variable before execution
				checkParameterHasArgument(args, argIdx);
				addVariable(settings, args[++argIdx]);
			} else if (arg.equals("--dump-syntax")) {
				dumpSyntaxTree = true;
			} else if (arg.equals("--version")) {
				printVersion = true;
			} else if (arg.equals("-h") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
		}

		if (scriptSource == null && !printVersion) {
			throw new IllegalArgumentException("Missing input file.");
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static final Pattern INITIAL_VAR_PATTERN = Pattern.compile("([_a-zA-Z][_0-9a-zA-Z]*)=(.*)");

	/**
	 * Parses a variable assignment passed via <code>-v</code> and stores it in the
	 * provided settings instance. All values are strings.
	 *
	 * @param settings settings to mutate
	 * @param keyValue string of the form {@code name=value}
	 */
	private static void addVariable(IndySettings settings, String keyValue) {
		Matcher m = INITIAL_VAR_PATTERN.matcher(keyValue);
		if (!m.matches()) {
			throw new IllegalArgumentException("keyValue \"" + keyValue + "\" must be of the form \"name=value\"");
		}
		settings.putVariable(m.group(1), m.group(2));
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @return how the script run ended
	 * @throws Exception if the script cannot be read, parsed or executed
	 */
	public ExecutionStatus run() throws Exception {
		if (printUsage) {
			usage(out);
			return ExecutionStatus.COMPLETED;
		}
		if (printVersion) {
			out.println("Indy-lang Interpreter v" + Indy.VERSION);
			return ExecutionStatus.COMPLETED;
		}
		if (settings.isVerbose()) {
			out.println("--- Indy-lang Interpreter v" + Indy.VERSION + " ---");
			LOGGER.debug("Settings:\n{}", settings.toDescriptionString());
		}

		Indy indy = new Indy();
		if (dumpSyntaxTree) {
			// Only dumping the tree, no need to execute the script
			ScriptBlock script = indy.compile(scriptSource, settings.getDiagnostics());
			script.dump(out);
			return ExecutionStatus.COMPLETED;
		}
		return indy.invoke(scriptSource, settings);
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [--verbose]" +
								" [--dump-syntax]" +
								" [-v name=val]..." +
								" script.indy");
		dest.println();
		dest.println("java -jar " + JAR_NAME + " --version");
		dest.println();
		dest.println(" --verbose = Show interpreter diagnostics on the error stream.");
		dest.println(" --dump-syntax = Print the parsed block tree instead of running the script.");
		dest.println(" -v name=val = Initial variable assignments.");
		dest.println(" --version = Print the interpreter version.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses the arguments, executes the script and maps the outcome to a
	 * process exit code. Errors are reported on the error stream.
	 *
	 * @param args command-line arguments
	 * @param is input stream for prompt answers
	 * @param os output stream for script output
	 * @param es error stream for errors and diagnostics
	 * @return the exit code
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static int execute(String[] args, InputStream is, PrintStream os, PrintStream es) {
		try {
			Cli cli = new Cli(is, os, es);
			cli.parse(args);
			return cli.run().getExitCode();
		} catch (ParserException e) {
			es.printf("%s (%s, line %d): %s\n", e.getClass().getSimpleName(), e.getSourceDescription(), e.getLineNumber(), e.getMessage());
		} catch (IndyRuntimeException e) {
			es.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
		} catch (IllegalArgumentException e) {
			es.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			es.println(e.getMessage());
		} catch (Exception e) {
			es.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
		}
		return 1;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	public static void main(String[] args) {
		System.exit(execute(args, System.in, System.out, System.err));
	}
}
