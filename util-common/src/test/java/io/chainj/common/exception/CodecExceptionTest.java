package io.chainj.common.exception;

import org.junit.Test;

import static org.junit.Assert.*;
import static org.junit.Assume.assumeFalse;

public class CodecExceptionTest {

	@Test
	public void testHierarchy() {
		assertTrue(MalformedDataException.class.isAssignableFrom(TruncatedDataException.class));
		assertTrue(MalformedDataException.class.isAssignableFrom(VarIntOverflowException.class));
		assertTrue(MalformedDataException.class.isAssignableFrom(NonCanonicalEncodingException.class));
		assertTrue(MalformedDataException.class.isAssignableFrom(TypeMismatchException.class));
		assertFalse(MalformedDataException.class.isAssignableFrom(SizeLimitExceededException.class));
		assertTrue(CodecException.class.isAssignableFrom(SizeLimitExceededException.class));
	}

	@Test
	public void testNoStackTraceByDefault() {
		assumeFalse(CodecException.WITH_STACK_TRACE);
		assertEquals(0, new TruncatedDataException("Requested 4 bytes, but only 3 remain").getStackTrace().length);
	}
}
