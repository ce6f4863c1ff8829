package org.metricshub.romanloop.util;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.romanloop.frontend.LrParser;
import org.slf4j.Logger;

public class RomanloopLoggerTest {

	@Test
	public void testLoggerIsNamedAfterClass() {
		Logger logger = RomanloopLogger.getLogger(LrParser.class);
		assertEquals(LrParser.class.getName(), logger.getName());
	}

	@Test
	public void testProviderLookupIsQuiet() {
		RomanloopLogger.getLogger(RomanloopLoggerTest.class);
		assertEquals("WARN", System.getProperty("slf4j.internal.verbosity"));
	}

	@Test
	public void testParserLoggingFollowsConfiguration() {
		Logger logger = RomanloopLogger.getLogger(LrParser.class);
		// simplelogger.properties in the test resources sets the project to info
		assertTrue(logger.isInfoEnabled());
		assertFalse(logger.isTraceEnabled());
	}
}
