package io.chainj.protocol;

import org.junit.Test;

import java.util.TreeSet;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.*;

public class Hash256Test {

	@Test
	public void testCopiesBytes() {
		byte[] bytes = new byte[Hash256.SIZE];
		Hash256 hash = Hash256.of(bytes);
		bytes[0] = 1;
		assertTrue(hash.isZero());
		assertEquals(Hash256.ZERO, hash);

		hash.getBytes()[0] = 1;
		assertTrue(hash.isZero());
	}

	@Test
	public void testWrongLength() {
		assertThrows(IllegalArgumentException.class, () -> Hash256.of(new byte[31]));
	}

	@Test
	public void testToStringAndOrder() {
		byte[] bytes = new byte[Hash256.SIZE];
		bytes[0] = (byte) 0xF0;
		Hash256 high = Hash256.of(bytes);
		bytes[0] = 0x0F;
		Hash256 low = Hash256.of(bytes);

		assertThat(high.toString(), startsWith("f000"));
		assertEquals(64, high.toString().length());

		TreeSet<Hash256> set = new TreeSet<>();
		set.add(high);
		set.add(low);
		set.add(Hash256.ZERO);
		assertEquals(Hash256.ZERO, set.first());
		assertEquals(high, set.last());
	}
}
