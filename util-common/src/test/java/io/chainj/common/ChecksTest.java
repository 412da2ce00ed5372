package io.chainj.common;

import io.chainj.common.exception.CodecException;
import io.chainj.common.exception.TruncatedDataException;
import io.chainj.common.tuple.TupleConstructor2;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;
import static org.junit.Assume.assumeTrue;

public final class ChecksTest {
	@Before
	public void setUp() {
		System.getProperties().stringPropertyNames().stream()
				.filter(s -> s.startsWith("chk:"))
				.forEach(System::clearProperty);
		assumeTrue(Checks.isEnabled(ChecksTest.class));
	}

	@Test
	public void testDisablingClass() {
		assertTrue(Checks.isEnabled(ChecksTest.class));

		System.setProperty("chk:" + ChecksTest.class.getName(), "off");
		assertFalse(Checks.isEnabled(ChecksTest.class));
	}

	@Test
	public void testDisablingClassBySimpleName() {
		assertTrue(Checks.isEnabled(ChecksTest.class));

		System.setProperty("chk:" + ChecksTest.class.getSimpleName(), "off");
		assertFalse(Checks.isEnabled(ChecksTest.class));
	}

	@Test
	public void testDisablingPackageButEnablingSubpackage() {
		assertTrue(Checks.isEnabled(ApplicationSettings.class));
		assertTrue(Checks.isEnabled(CodecException.class));
		assertTrue(Checks.isEnabled(TupleConstructor2.class));

		System.setProperty("chk:io.chainj.common", "off");
		assertFalse(Checks.isEnabled(ApplicationSettings.class));
		assertFalse(Checks.isEnabled(CodecException.class));

		System.setProperty("chk:io.chainj.common.exception", "on");
		assertFalse(Checks.isEnabled(ApplicationSettings.class));
		assertTrue(Checks.isEnabled(CodecException.class));
		assertTrue(Checks.isEnabled(TruncatedDataException.class));
		assertFalse(Checks.isEnabled(TupleConstructor2.class));
	}

	@Test(expected = IllegalStateException.class)
	public void testAnonymousClass() {
		Checks.isEnabled(new Object() {}.getClass());
	}

	@Test
	public void testPreconditions() {
		Checks.checkArgument(true, "unused");
		Checks.checkState(true, () -> "unused");

		IllegalArgumentException argumentException = assertThrows(IllegalArgumentException.class,
				() -> Checks.checkArgument(false, () -> "Value " + 42 + " is out of range"));
		assertEquals("Value 42 is out of range", argumentException.getMessage());

		IllegalStateException stateException = assertThrows(IllegalStateException.class,
				() -> Checks.checkState(false, "Broken"));
		assertEquals("Broken", stateException.getMessage());
	}
}
