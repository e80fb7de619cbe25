package org.metricshub.indy.frontend;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.indy.frontend.ast.AssignCommand;
import org.metricshub.indy.frontend.ast.Comparison;
import org.metricshub.indy.frontend.ast.ComparisonOperator;
import org.metricshub.indy.frontend.ast.LexerException;
import org.metricshub.indy.frontend.ast.LoopCount;
import org.metricshub.indy.frontend.ast.PromptCommand;
import org.metricshub.indy.frontend.ast.SayCommand;
import org.metricshub.indy.frontend.ast.UnknownLine;
import org.metricshub.indy.frontend.ast.WaitCommand;

public class IndyLexerTest {

	private final IndyLexer lexer = new IndyLexer("test.indy");

	private Token tokenOf(String raw) {
		return lexer.classify(1, raw).getToken();
	}

	@Test
	public void testCommentsAndBlanks() {
		assertEquals(Token.COMMENT, tokenOf("# a comment"));
		assertEquals(Token.COMMENT, tokenOf("   # indented say \"not executed\""));
		assertEquals(Token.BLANK, tokenOf(""));
		assertEquals(Token.BLANK, tokenOf(" \t  "));
	}

	@Test
	public void testAssignment() {
		Line line = lexer.classify(4, "  Name=\"bob\"");
		assertEquals(Token.ASSIGN, line.getToken());
		AssignCommand assign = (AssignCommand) line.getCommand();
		assertEquals(4, assign.getLineNumber());
		assertEquals("Name", assign.getName());
		assertEquals("bob", assign.getLiteral());

		assign = (AssignCommand) lexer.classify(1, "Count = 42").getCommand();
		assertEquals("Count", assign.getName());
		assertEquals("42", assign.getLiteral());

		assign = (AssignCommand) lexer.classify(1, "Quote=\"say \"hi\"\"").getCommand();
		assertEquals("only the outer quotes are removed", "say \"hi\"", assign.getLiteral());

		assign = (AssignCommand) lexer.classify(1, "Empty=").getCommand();
		assertEquals("", assign.getLiteral());
	}

	@Test
	public void testAssignmentTakesPrecedenceOverKeywords() {
		Line line = lexer.classify(1, "wait=\"later\"");
		assertEquals(Token.ASSIGN, line.getToken());
		assertEquals("wait", ((AssignCommand) line.getCommand()).getName());
	}

	@Test
	public void testSay() {
		Line line = lexer.classify(2, "say \"Hello {Name}!\"");
		assertEquals(Token.KW_SAY, line.getToken());
		assertEquals("Hello {Name}!", ((SayCommand) line.getCommand()).getTemplate());

		assertEquals("bare text", ((SayCommand) lexer.classify(1, "say bare text").getCommand()).getTemplate());
		assertEquals("a = b", ((SayCommand) lexer.classify(1, "say \"a = b\"").getCommand()).getTemplate());
		assertEquals("", ((SayCommand) lexer.classify(1, "say").getCommand()).getTemplate());
	}

	@Test
	public void testWait() {
		assertEquals(2.0, ((WaitCommand) lexer.classify(1, "wait 2").getCommand()).getSeconds(), 0.0);
		WaitCommand wait = (WaitCommand) lexer.classify(1, "wait 0.25").getCommand();
		assertEquals(0.25, wait.getSeconds(), 0.0);
		assertEquals(250L, wait.getMillis());
		assertEquals(0L, ((WaitCommand) lexer.classify(1, "wait 0").getCommand()).getMillis());
		assertEquals(500L, ((WaitCommand) lexer.classify(1, "wait .5").getCommand()).getMillis());
	}

	private void assertMalformed(Token expectedToken, String raw) {
		Line line = lexer.classify(1, raw);
		assertTrue(raw, line.isMalformed());
		assertEquals(raw, expectedToken, line.getToken());
	}

	@Test
	public void testMalformedWait() {
		Line line = lexer.classify(7, "wait soon");
		assertTrue(line.isMalformed());
		assertEquals(Token.KW_WAIT, line.getToken());
		assertTrue(line.getCommand() instanceof UnknownLine);
		LexerException e = line.getError();
		assertEquals(7, e.getLineNumber());
		assertEquals("test.indy", e.getSourceDescription());
		assertEquals("wait soon", e.getRawLine());
		assertTrue(e.getMessage(), e.getMessage().contains("wait soon"));
		assertFalse(e.getReason(), e.getReason().contains("wait soon"));
		assertMalformed(Token.KW_WAIT, "wait");
		assertMalformed(Token.KW_WAIT, "wait -1");
		assertMalformed(Token.KW_WAIT, "wait 1 2");
		assertMalformed(Token.KW_WAIT, "wait NaN");
		assertFalse(lexer.classify(1, "wait 2").isMalformed());
	}

	@Test
	public void testPrompt() {
		Line line = lexer.classify(1, "prompt Name=\"What is your name\"");
		assertEquals(Token.KW_PROMPT, line.getToken());
		PromptCommand prompt = (PromptCommand) line.getCommand();
		assertEquals("Name", prompt.getName());
		assertEquals("What is your name", prompt.getMessage());

		prompt = (PromptCommand) lexer.classify(1, "prompt Age = \"Age of {Name}\"").getCommand();
		assertEquals("Age", prompt.getName());
		assertEquals("Age of {Name}", prompt.getMessage());
	}

	@Test
	public void testMalformedPromptIsUnknown() {
		Line line = lexer.classify(3, "prompt \"no variable\"");
		assertEquals(Token.UNKNOWN, line.getToken());
		assertEquals("prompt \"no variable\"", ((UnknownLine) line.getCommand()).getRaw());
	}

	@Test
	public void testBlockKeywords() {
		assertEquals(Token.KW_START, tokenOf("start"));
		assertEquals(Token.KW_END, tokenOf("  end  "));
		assertEquals(Token.KW_ELSE, tokenOf("else"));
		assertEquals(Token.KW_END_IF, tokenOf("end if"));
		assertEquals(Token.KW_END_IF, tokenOf("end   if"));
		assertEquals(Token.KW_END_LOOP, tokenOf("\tend loop"));
		assertNull(lexer.classify(1, "end if").getCommand());
	}

	@Test
	public void testKeywordsAreCaseSensitive() {
		assertEquals(Token.UNKNOWN, tokenOf("Start"));
		assertEquals(Token.UNKNOWN, tokenOf("SAY \"hi\""));
		assertEquals(Token.UNKNOWN, tokenOf("End If"));
	}

	@Test
	public void testKeywordsWithTrailingGarbageAreUnknown() {
		assertEquals(Token.UNKNOWN, tokenOf("start now"));
		assertEquals(Token.UNKNOWN, tokenOf("else if"));
		assertEquals(Token.UNKNOWN, tokenOf("end while"));
	}

	@Test
	public void testUnknown() {
		assertEquals(Token.UNKNOWN, tokenOf("plug colors"));
		assertEquals(Token.UNKNOWN, tokenOf("print \"hello\""));
		assertEquals(Token.UNKNOWN, tokenOf("Bad Name = 3"));
	}

	@Test
	public void testIfCondition() {
		Line line = lexer.classify(5, "if UserDecision == \"yes\"");
		assertEquals(Token.KW_IF, line.getToken());
		Comparison condition = line.getCondition();
		assertEquals("{UserDecision}", condition.getLeft());
		assertEquals(ComparisonOperator.EQ, condition.getOperator());
		assertEquals("yes", condition.getRight());
		assertTrue(condition.isRightQuoted());

		condition = lexer.classify(1, "if \"{A}-{B}\" != other").getCondition();
		assertEquals("{A}-{B}", condition.getLeft());
		assertEquals(ComparisonOperator.NE, condition.getOperator());
		assertEquals("other", condition.getRight());
		assertFalse(condition.isRightQuoted());

		condition = lexer.classify(1, "if X==\"a b\"").getCondition();
		assertEquals("{X}", condition.getLeft());
		assertEquals("a b", condition.getRight());
	}

	@Test
	public void testMalformedIfCondition() {
		assertMalformed(Token.KW_IF, "if UserDecision");
		assertMalformed(Token.KW_IF, "if == \"yes\"");
		assertMalformed(Token.KW_IF, "if X > 3");
		assertNull(lexer.classify(1, "if X > 3").getCondition());
	}

	@Test
	public void testLoopCount() {
		Line line = lexer.classify(1, "loop 3");
		assertEquals(Token.KW_LOOP, line.getToken());
		assertEquals(LoopCount.of(3), line.getLoopCount());
		assertEquals(LoopCount.of(0), lexer.classify(1, "loop 0").getLoopCount());
		assertTrue(lexer.classify(1, "loop forever").getLoopCount().isForever());
	}

	@Test
	public void testMalformedLoopCount() {
		Line line = lexer.classify(9, "loop many");
		assertEquals(9, line.getError().getLineNumber());
		assertNull(line.getLoopCount());
		assertMalformed(Token.KW_LOOP, "loop");
		assertMalformed(Token.KW_LOOP, "loop -3");
		assertMalformed(Token.KW_LOOP, "loop 2.5");
		assertEquals("Loop count is too large", lexer.classify(1, "loop 99999999999999999999").getError().getReason());
	}

	@Test
	public void testCleanStringValue() {
		assertEquals("abc", IndyLexer.cleanStringValue("  \"abc\"  "));
		assertEquals("\"abc", IndyLexer.cleanStringValue("\"abc"));
		assertEquals("\"", IndyLexer.cleanStringValue("\""));
		assertEquals("", IndyLexer.cleanStringValue("\"\""));
	}
}
