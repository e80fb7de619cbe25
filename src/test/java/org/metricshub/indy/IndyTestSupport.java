package org.metricshub.indy;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.indy.util.IndySettings;
import org.metricshub.indy.util.ScriptSource;

/**
 * Reusable helpers for building and executing Indy tests. All tests share the
 * same approach for providing prompt answers, capturing the output,
 * diagnostics and sleeps of either {@link Indy} or {@link Cli} executions.
 * The class exposes fluent builders ({@link #indyTest(String)} and
 * {@link #cliTest(String)}) that let tests describe their scripts, inputs, and
 * expectations declaratively before executing or asserting the results.
 * <p>
 * {@link Indy} tests never really sleep: <code>wait</code> durations are
 * recorded instead.
 */
public final class IndyTestSupport {

	private static final Path SHARED_TEMP_DIR;

	static {
		try {
			SHARED_TEMP_DIR = Files.createTempDirectory("indy-shared");
			SHARED_TEMP_DIR.toFile().deleteOnExit();
		} catch (IOException ex) {
			throw new ExceptionInInitializerError(ex);
		}
	}

	private IndyTestSupport() {}

	/**
	 * Creates a builder for a unit test that exercises the {@link Indy} API directly.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static IndyTestBuilder indyTest(String description) {
		return new IndyTestBuilder(description);
	}

	/**
	 * Creates a builder for a unit test that exercises the {@link Cli} entry
	 * point. The script is written to a temporary file whose path is passed as
	 * the last argument.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	/**
	 * Reads a script from the test resources.
	 *
	 * @param resource absolute resource path, like <code>/scripts/greeting.indy</code>
	 * @return the contents of the script
	 * @throws IOException if the resource does not exist
	 */
	public static String scriptResource(String resource) throws IOException {
		InputStream stream = IndyTestSupport.class.getResourceAsStream(resource);
		if (stream == null) {
			throw new IOException("Resource not found: " + resource);
		}
		try (InputStreamReader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
			StringBuilder sb = new StringBuilder();
			char[] buffer = new char[4096];
			int read;
			while ((read = reader.read(buffer)) >= 0) {
				sb.append(buffer, 0, read);
			}
			return sb.toString();
		}
	}

	/**
	 * Captures the outcome of executing a configured test including the raw
	 * output, diagnostics, exit code, and the expectations configured on the builder.
	 */
	public static final class TestResult {
		private final String description;
		private final String output;
		private final String errorOutput;
		private final List<String> diagnostics;
		private final List<Long> sleeps;
		private final int exitCode;
		private final BaseTestBuilder<?> expectations;
		private final Throwable thrownException;

		TestResult(
				String description,
				String output,
				String errorOutput,
				List<String> diagnostics,
				List<Long> sleeps,
				int exitCode,
				BaseTestBuilder<?> expectations,
				Throwable thrownException) {
			this.description = description;
			this.output = output;
			this.errorOutput = errorOutput;
			this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
			this.sleeps = Collections.unmodifiableList(new ArrayList<>(sleeps));
			this.exitCode = exitCode;
			this.expectations = expectations;
			this.thrownException = thrownException;
		}

		public String output() {
			return output;
		}

		/**
		 * @return what was written to the error stream (CLI tests only)
		 */
		public String errorOutput() {
			return errorOutput;
		}

		/**
		 * @return the diagnostics reported during the run, as "line: message"
		 */
		public List<String> diagnostics() {
			return diagnostics;
		}

		/**
		 * @return the durations, in milliseconds, of each wait
		 */
		public List<Long> sleeps() {
			return sleeps;
		}

		public int exitCode() {
			return exitCode;
		}

		public Throwable thrownException() {
			return thrownException;
		}

		/**
		 * Returns the captured output split into individual lines. Trailing
		 * newline characters are ignored and Windows style line endings are
		 * normalised.
		 *
		 * @return the output split into lines
		 */
		public List<String> lines() {
			return normalizeOutputLines(output);
		}

		/**
		 * Verifies that the captured output, exit code, or thrown exception match
		 * the expectations defined in the builder.
		 */
		public void assertExpected() {
			if (expectations.expectedException != null) {
				if (thrownException == null) {
					throw new AssertionError(
							"Expected exception "
									+ expectations.expectedException.getName()
									+ " for "
									+ description
									+ " but execution completed successfully");
				}
				if (!expectations.expectedException.isInstance(thrownException)) {
					throw new AssertionError(
							"Expected exception "
									+ expectations.expectedException.getName()
									+ " for "
									+ description
									+ " but got "
									+ thrownException);
				}
				return;
			}
			if (thrownException != null) {
				throw new AssertionError("Unexpected exception for " + description, thrownException);
			}
			if (expectations.expectedLines != null) {
				assertEquals("Unexpected output for " + description, expectations.expectedLines, lines());
			} else if (expectations.expectedOutput != null) {
				assertEquals("Unexpected output for " + description, expectations.expectedOutput, output);
			}
			for (String fragment : expectations.expectedDiagnostics) {
				boolean found = false;
				for (String diagnostic : diagnostics) {
					found |= diagnostic.contains(fragment);
				}
				assertTrue("Missing diagnostic '" + fragment + "' for " + description + " in " + diagnostics, found);
			}
			assertEquals("Unexpected exit code for " + description, expectations.expectedExitCode, exitCode);
		}

		private static List<String> normalizeOutputLines(String output) {
			if (output.isEmpty()) {
				return Collections.emptyList();
			}
			String normalized = output.replace("\r\n", "\n").replace("\r", "\n");
			if (normalized.endsWith("\n")) {
				normalized = normalized.substring(0, normalized.length() - 1);
			}
			return Arrays.asList(normalized.split("\n", -1));
		}
	}

	/**
	 * Expectations and inputs shared by both builders.
	 */
	public abstract static class BaseTestBuilder<B extends BaseTestBuilder<B>> {
		protected final String description;
		protected String script;
		protected String input = "";
		protected final Map<String, String> preAssignments = new LinkedHashMap<>();
		protected boolean verbose;
		private String expectedOutput;
		private List<String> expectedLines;
		private final List<String> expectedDiagnostics = new ArrayList<>();
		private int expectedExitCode;
		private Class<? extends Throwable> expectedException;

		protected BaseTestBuilder(String description) {
			this.description = description;
		}

		@SuppressWarnings("unchecked")
		private B self() {
			return (B) this;
		}

		/**
		 * @param scriptText the Indy script to execute
		 * @return this builder for method chaining
		 */
		public B script(String scriptText) {
			this.script = scriptText;
			return self();
		}

		/**
		 * @param answers lines typed by the user, one per prompt
		 * @return this builder for method chaining
		 */
		public B input(String... answers) {
			StringBuilder sb = new StringBuilder();
			for (String answer : answers) {
				sb.append(answer).append('\n');
			}
			this.input = sb.toString();
			return self();
		}

		/**
		 * Registers a value to pre-assign to a variable before the script is
		 * executed.
		 *
		 * @param name the variable name
		 * @param value the value to expose to the script
		 * @return this builder for method chaining
		 */
		public B preassign(String name, String value) {
			preAssignments.put(name, value);
			return self();
		}

		public B verbose() {
			this.verbose = true;
			return self();
		}

		public B expect(String output) {
			this.expectedOutput = output;
			return self();
		}

		public B expectLines(String... lines) {
			this.expectedLines = Arrays.asList(lines);
			return self();
		}

		/**
		 * @param fragment text that one of the diagnostics must contain
		 * @return this builder for method chaining
		 */
		public B expectDiagnostic(String fragment) {
			this.expectedDiagnostics.add(fragment);
			return self();
		}

		public B expectExitCode(int exitCode) {
			this.expectedExitCode = exitCode;
			return self();
		}

		public B expectThrow(Class<? extends Throwable> exceptionClass) {
			this.expectedException = exceptionClass;
			return self();
		}

		/**
		 * Executes the configured test case and returns the captured result
		 * without asserting it.
		 *
		 * @return the captured result
		 * @throws Exception when preparing the test fails unexpectedly
		 */
		public abstract TestResult run() throws Exception;

		/**
		 * Executes the configured test case and immediately asserts that the
		 * observed result matches the configured expectations.
		 *
		 * @return the captured result, for further assertions
		 * @throws Exception when preparing the test fails unexpectedly
		 */
		public TestResult runAndAssert() throws Exception {
			TestResult result = run();
			result.assertExpected();
			return result;
		}
	}

	/**
	 * Fluent builder for tests that execute {@link Indy} directly.
	 */
	public static final class IndyTestBuilder extends BaseTestBuilder<IndyTestBuilder> {

		private IndyTestBuilder(String description) {
			super(description);
		}

		@Override
		public TestResult run() throws Exception {
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			List<String> diagnostics = new ArrayList<>();
			List<Long> sleeps = new ArrayList<>();

			IndySettings settings = new IndySettings();
			settings.setInput(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)));
			settings.setOutputStream(new PrintStream(out, true, StandardCharsets.UTF_8.name()));
			settings.setVariables(preAssignments);
			settings.setVerbose(verbose);
			settings.setSleeper(sleeps::add);
			settings.setDiagnostics((lineNumber, message) -> diagnostics.add(lineNumber + ": " + message));

			int exitCode = -1;
			Throwable thrown = null;
			try {
				exitCode = new Indy()
						.invoke(new ScriptSource(description, new StringReader(script)), settings)
						.getExitCode();
			} catch (RuntimeException e) {
				thrown = e;
			}
			return new TestResult(
					description,
					out.toString(StandardCharsets.UTF_8.name()),
					"",
					diagnostics,
					sleeps,
					exitCode,
					this,
					thrown);
		}
	}

	/**
	 * Fluent builder for tests that exercise the {@link Cli} entry point.
	 */
	public static final class CliTestBuilder extends BaseTestBuilder<CliTestBuilder> {
		private final List<String> arguments = new ArrayList<>();

		private CliTestBuilder(String description) {
			super(description);
		}

		/**
		 * Adds raw command-line arguments, placed before the script path.
		 *
		 * @param args the arguments to add
		 * @return this builder for method chaining
		 */
		public CliTestBuilder argument(String... args) {
			arguments.addAll(Arrays.asList(args));
			return this;
		}

		@Override
		public TestResult run() throws Exception {
			List<String> args = new ArrayList<>(arguments);
			if (verbose) {
				args.add("--verbose");
			}
			for (Map.Entry<String, String> entry : preAssignments.entrySet()) {
				args.add("-v");
				args.add(entry.getKey() + "=" + entry.getValue());
			}
			if (script != null) {
				Path scriptFile = Files.createTempFile(SHARED_TEMP_DIR, "cli", ".indy");
				scriptFile.toFile().deleteOnExit();
				Files.write(scriptFile, script.getBytes(StandardCharsets.UTF_8));
				args.add(scriptFile.toString());
			}

			ByteArrayOutputStream out = new ByteArrayOutputStream();
			ByteArrayOutputStream err = new ByteArrayOutputStream();
			int exitCode = Cli
					.execute(
							args.toArray(new String[0]),
							new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
							new PrintStream(out, true, StandardCharsets.UTF_8.name()),
							new PrintStream(err, true, StandardCharsets.UTF_8.name()));
			String errorOutput = err.toString(StandardCharsets.UTF_8.name());
			return new TestResult(
					description,
					out.toString(StandardCharsets.UTF_8.name()),
					errorOutput,
					normalizedErrorLines(errorOutput),
					Collections.<Long>emptyList(),
					exitCode,
					this,
					null);
		}

		private static List<String> normalizedErrorLines(String errorOutput) {
			List<String> lines = new ArrayList<>();
			for (String line : errorOutput.replace("\r\n", "\n").split("\n")) {
				if (!line.isEmpty()) {
					lines.add(line);
				}
			}
			return lines;
		}
	}
}
