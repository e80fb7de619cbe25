package org.metricshub.indy.jrt;

import static org.junit.Assert.*;

import org.junit.Before;
import org.junit.Test;

public class InterpolatorTest {

	private Environment env;

	@Before
	public void setUp() {
		env = new Environment();
		env.set("Name", "Alice");
		env.set("Age", "30");
	}

	@Test
	public void testSubstitution() {
		assertEquals("Hello, Alice!", Interpolator.interpolate("Hello, {Name}!", env));
		assertEquals("Alice is 30, really 30", Interpolator.interpolate("{Name} is {Age}, really {Age}", env));
		assertEquals("Alice30", Interpolator.interpolate("{Name}{Age}", env));
	}

	@Test
	public void testUndefinedBecomesEmpty() {
		assertEquals("Hi !", Interpolator.interpolate("Hi {Ghost}!", env));
		assertEquals("", Interpolator.interpolate("{name}", env));
	}

	@Test
	public void testNoPlaceholder() {
		String template = "plain text";
		assertSame(template, Interpolator.interpolate(template, env));
		assertEquals("", Interpolator.interpolate("", env));
	}

	@Test
	public void testSingleLevel() {
		env.set("Template", "{Name}");
		assertEquals("{Name}", Interpolator.interpolate("{Template}", env));
	}

	@Test
	public void testMalformedBracesStayLiteral() {
		assertEquals("{ Name }", Interpolator.interpolate("{ Name }", env));
		assertEquals("{Name", Interpolator.interpolate("{Name", env));
		assertEquals("Name}", Interpolator.interpolate("Name}", env));
		assertEquals("{}", Interpolator.interpolate("{}", env));
		assertEquals("{1st}", Interpolator.interpolate("{1st}", env));
		assertEquals("{Alice}", Interpolator.interpolate("{{Name}}", env));
	}
}
