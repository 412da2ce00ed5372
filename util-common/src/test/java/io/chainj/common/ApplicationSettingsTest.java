package io.chainj.common;

import org.junit.Test;

import static org.junit.Assert.*;

public class ApplicationSettingsTest {

	@Test
	public void testDefaultValue() {
		assertEquals(17, ApplicationSettings.getInt(ApplicationSettingsTest.class, "missingInt", 17));
		assertEquals(17L, ApplicationSettings.getLong(ApplicationSettingsTest.class, "missingLong", 17L));
		assertTrue(ApplicationSettings.getBoolean(ApplicationSettingsTest.class, "missingBoolean", true));
	}

	@Test
	public void testHexadecimalLong() {
		System.setProperty(ApplicationSettingsTest.class.getName() + ".hexLong", "0x02000000");
		System.setProperty(ApplicationSettingsTest.class.getName() + ".decimalLong", " 1000 ");
		assertEquals(33554432L, ApplicationSettings.getLong(ApplicationSettingsTest.class, "hexLong", 0));
		assertEquals(1000L, ApplicationSettings.getLong(ApplicationSettingsTest.class, "decimalLong", 0));
	}

	@Test
	public void testSimpleClassName() {
		System.setProperty(ApplicationSettingsTest.class.getSimpleName() + ".shortName", "5");
		assertEquals(5, ApplicationSettings.getInt(ApplicationSettingsTest.class, "shortName", 0));
	}

	@Test
	public void testBoolean() {
		System.setProperty(ApplicationSettingsTest.class.getName() + ".flag", "");
		System.setProperty(ApplicationSettingsTest.class.getName() + ".disabledFlag", "false");
		assertTrue(ApplicationSettings.getBoolean(ApplicationSettingsTest.class, "flag", false));
		assertFalse(ApplicationSettings.getBoolean(ApplicationSettingsTest.class, "disabledFlag", true));
	}

	@Test
	public void testUpdateAfterLookup() {
		ApplicationSettings.getInt(ApplicationSettingsTest.class, "anything", 0);
		assertThrows(IllegalStateException.class, () -> ApplicationSettings.set(ApplicationSettingsTest.class, "late", 1));
	}
}
