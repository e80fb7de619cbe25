package org.metricshub.indy.jrt;

import static org.junit.Assert.*;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;

public class EnvironmentTest {

	@Test
	public void testUndefinedIsEmpty() {
		Environment env = new Environment();
		assertEquals("", env.get("Nobody"));
		assertFalse(env.isDefined("Nobody"));
	}

	@Test
	public void testOverwrite() {
		Environment env = new Environment();
		env.set("A", "1");
		env.set("A", "2");
		assertEquals("2", env.get("A"));
		assertEquals(1, env.toMap().size());
	}

	@Test
	public void testNamesAreCaseSensitive() {
		Environment env = new Environment();
		env.set("name", "lower");
		env.set("Name", "upper");
		assertEquals("lower", env.get("name"));
		assertEquals("upper", env.get("Name"));
	}

	@Test
	public void testEmptyValueIsDefined() {
		Environment env = new Environment();
		env.set("Empty", null);
		assertTrue(env.isDefined("Empty"));
		assertEquals("", env.get("Empty"));
	}

	@Test
	public void testInitialVariables() {
		Map<String, String> initial = new LinkedHashMap<String, String>();
		initial.put("B", "2");
		initial.put("A", "1");
		Environment env = new Environment(initial);
		initial.put("C", "3");
		assertEquals("[B, A]", env.toMap().keySet().toString());
		assertFalse(env.isDefined("C"));
	}

	@Test(expected = UnsupportedOperationException.class)
	public void testMapViewIsReadOnly() {
		new Environment().toMap().put("X", "1");
	}
}
