package org.metricshub.indy;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.StringReader;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.indy.backend.Diagnostics;
import org.metricshub.indy.frontend.ast.LexerException;
import org.metricshub.indy.frontend.ast.ParserException;
import org.metricshub.indy.frontend.ast.ScriptBlock;
import org.metricshub.indy.util.IndySettings;
import org.metricshub.indy.util.ScriptSource;

public class IndyTest {

	private static final Indy INDY = new Indy();

	@Test
	public void testGreetingYes() throws Exception {
		IndyTestSupport.TestResult result = IndyTestSupport
				.indyTest("greeting.indy, yes")
				.script(IndyTestSupport.scriptResource("/scripts/greeting.indy"))
				.input("Alice", "yes")
				.expectLines(
						"Welcome to Indy!",
						"What is your name: Hello, Alice!",
						"Do you want to continue? (yes/no): Great, let's go on, Alice.",
						"Goodbye!")
				.expectDiagnostic("2: Ignoring line before 'start': 'Name=\"nobody\"'")
				.expectDiagnostic("18: Loop encountered (3)")
				.expectDiagnostic("22: Script finished.")
				.runAndAssert();
		assertEquals(Collections.singletonList(500L), result.sleeps());
	}

	@Test
	public void testGreetingNo() throws Exception {
		IndyTestSupport
				.indyTest("greeting.indy, no")
				.script(IndyTestSupport.scriptResource("/scripts/greeting.indy"))
				.input("Bob", "no")
				.expectLines(
						"Welcome to Indy!",
						"What is your name: Hello, Bob!",
						"Do you want to continue? (yes/no): Maybe next time.",
						"Goodbye!")
				.runAndAssert();
	}

	@Test
	public void testGreetingWithoutInput() throws Exception {
		IndyTestSupport
				.indyTest("greeting.indy, no input")
				.script(IndyTestSupport.scriptResource("/scripts/greeting.indy"))
				.expectLines(
						"Welcome to Indy!",
						"What is your name: Hello, !",
						"Do you want to continue? (yes/no): Maybe next time.",
						"Goodbye!")
				.expectDiagnostic("6: End of input reached while prompting for 'Name'")
				.runAndAssert();
	}

	@Test
	public void testUndefinedVariable() throws Exception {
		IndyTestSupport
				.indyTest("undefined variable")
				.script("start\nsay \"Hi {Ghost}!\"\nend\n")
				.expect("Hi !\n")
				.runAndAssert();
	}

	@Test
	public void testPreassignedVariable() throws Exception {
		IndyTestSupport
				.indyTest("preassigned variable")
				.script("start\nif Mode == \"fast\"\nsay \"Running {Mode}\"\nend if\nend\n")
				.preassign("Mode", "fast")
				.expect("Running fast\n")
				.runAndAssert();
	}

	@Test
	public void testCrlfScript() throws Exception {
		IndyTestSupport
				.indyTest("CRLF line endings")
				.script("start\r\nX=\"1\"\r\nif X == \"1\"\r\nsay \"one\"\r\nend if\r\nend\r\n")
				.expect("one\n")
				.runAndAssert();
	}

	@Test
	public void testStructuralErrorPreventsOutput() throws Exception {
		IndyTestSupport.TestResult result = IndyTestSupport
				.indyTest("missing end if")
				.script("start\nsay \"never printed\"\nif A == \"1\"\nsay \"x\"\n")
				.expectThrow(ParserException.class)
				.runAndAssert();
		assertEquals("", result.output());
		assertEquals(3, ((ParserException) result.thrownException()).getLineNumber());
	}

	@Test
	public void testMalformedWaitPreventsOutput() throws Exception {
		IndyTestSupport.TestResult result = IndyTestSupport
				.indyTest("malformed wait")
				.script("start\nsay \"never printed\"\nwait soon\nend\n")
				.expectThrow(LexerException.class)
				.runAndAssert();
		assertEquals("", result.output());
		assertTrue(result.sleeps().isEmpty());
	}

	@Test
	public void testMalformedLineBeforeStartIsIgnored() throws Exception {
		IndyTestSupport
				.indyTest("malformed wait before start")
				.script("wait soon\nstart\nsay \"hi\"\nend\nloop many\n")
				.expect("hi\n")
				.expectDiagnostic("1: Ignoring line before 'start': 'wait soon'")
				.expectDiagnostic("5: Ignoring line after the final 'end': 'loop many'")
				.runAndAssert();
	}

	@Test
	public void testMalformedLineInLoopBodyIsSkipped() throws Exception {
		IndyTestSupport.TestResult result = IndyTestSupport
				.indyTest("malformed wait in a loop body")
				.script("start\nsay \"a\"\nloop 3\nwait soon\nend loop\nsay \"b\"\nend\n")
				.expect("a\nb\n")
				.expectDiagnostic("4: Ignoring malformed line in a loop body")
				.runAndAssert();
		assertTrue(result.sleeps().isEmpty());
	}

	@Test
	public void testInlineScriptDescription() throws Exception {
		assertEquals(ScriptSource.DESCRIPTION_INLINE_SCRIPT, ScriptSource.inline("start\nend").getDescription());
		IndySettings settings = new IndySettings();
		settings.setDiagnostics(Diagnostics.NONE);
		ParserException e = assertThrows(ParserException.class, () -> INDY.invoke("say \"no start\"", settings));
		assertEquals("<inline-script>", e.getSourceDescription());
	}

	@Test
	public void testRun() throws Exception {
		assertEquals("Hello, Dave\n", INDY.run("start\nprompt N=\"Name\"\nsay \"Hello, {N}\"\nend", "Dave\n").replace("Name: ", ""));
		assertEquals("", INDY.run("start\nend", null));
	}

	@Test
	public void testCompileKeepsLastScript() throws Exception {
		ScriptBlock script = INDY.compile(new ScriptSource("compiled.indy", new StringReader("start\nsay \"a\"\nend")));
		assertSame(script, INDY.getLastScript());
		assertEquals("compiled.indy", script.getSourceDescription());
		assertEquals(1, script.getBody().size());
	}

	@Test
	public void testLexerErrorLocation() {
		LexerException e = assertThrows(
				LexerException.class,
				() -> INDY.compile(new ScriptSource("loop.indy", new StringReader("start\n\nloop many\nend loop\nend"))));
		assertEquals("loop.indy", e.getSourceDescription());
		assertEquals(3, e.getLineNumber());
		assertEquals("loop many", e.getRawLine());
	}

	@Test
	public void testExitCodes() {
		assertEquals(Arrays.asList(0, 130), Arrays.asList(ExecutionStatus.COMPLETED.getExitCode(), ExecutionStatus.INTERRUPTED.getExitCode()));
	}
}
