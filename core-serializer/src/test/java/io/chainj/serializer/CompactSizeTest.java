package io.chainj.serializer;

import io.chainj.bytebuf.ByteBuf;
import io.chainj.common.exception.NonCanonicalEncodingException;
import io.chainj.common.exception.SizeLimitExceededException;
import io.chainj.common.exception.TruncatedDataException;
import org.junit.Test;

import static org.junit.Assert.*;

public class CompactSizeTest {
	private static final long MAX_SIZE = 0x02000000L;

	private final CompactSize compactSize = CompactSize.create(MAX_SIZE);
	private final CompactSize unlimited = CompactSize.create(Long.MAX_VALUE);

	@Test
	public void testDefaultMaximum() {
		assertEquals(MAX_SIZE, CompactSize.getDefault().getMaxSize());
	}

	@Test
	public void testForms() throws Exception {
		assertEquals("00", hex(0));
		assertEquals("fc", hex(0xFC));
		assertEquals("fdfd00", hex(0xFD));
		assertEquals("fdffff", hex(0xFFFF));
		assertEquals("fe00000100", hex(0x10000));
		assertEquals("feffffffff", hex(0xFFFFFFFFL));
		assertEquals("ff0000000001000000", hex(0x100000000L));
	}

	@Test
	public void testSizes() {
		assertEquals(1, CompactSize.sizeOf(0));
		assertEquals(1, CompactSize.sizeOf(0xFC));
		assertEquals(3, CompactSize.sizeOf(0xFD));
		assertEquals(3, CompactSize.sizeOf(0xFFFF));
		assertEquals(5, CompactSize.sizeOf(0x10000));
		assertEquals(5, CompactSize.sizeOf(0xFFFFFFFFL));
		assertEquals(9, CompactSize.sizeOf(0x100000000L));
		assertEquals(9, CompactSize.sizeOf(-1L));
	}

	@Test
	public void testPowersOfTwo() throws Exception {
		ByteBuf buf = ByteBuf.create();
		for (long i = 1; i <= MAX_SIZE; i *= 2) {
			compactSize.write(buf, i - 1);
			compactSize.write(buf, i);
		}
		for (long i = 1; i <= MAX_SIZE; i *= 2) {
			assertEquals(i - 1, compactSize.read(buf));
			assertEquals(i, compactSize.read(buf));
		}

		compactSize.write(buf, MAX_SIZE);
		assertEquals(MAX_SIZE, compactSize.read(buf));
		assertFalse(buf.canRead());
	}

	@Test
	public void testEncodingAboveMaximum() {
		ByteBuf buf = ByteBuf.create();
		assertThrows(SizeLimitExceededException.class, () -> compactSize.write(buf, MAX_SIZE + 1));
		assertThrows(SizeLimitExceededException.class, () -> compactSize.write(buf, Long.MAX_VALUE));
		assertThrows(SizeLimitExceededException.class, () -> compactSize.write(buf, -1L));
		assertEquals(0, buf.readRemaining());
	}

	@Test
	public void testDecodingAboveMaximum() throws Exception {
		ByteBuf buf = ByteBuf.create();
		unlimited.write(buf, MAX_SIZE + 1);
		assertThrows(SizeLimitExceededException.class, () -> compactSize.read(buf));

		assertThrows(SizeLimitExceededException.class, () -> unlimited.read(wrap("ffffffffffffffffff")));
	}

	@Test
	public void testCountAboveIntRange() throws Exception {
		assertEquals(0x80000000L, unlimited.read(wrap("fe00000080")));
		assertEquals(Integer.MAX_VALUE, unlimited.readCount(wrap("feffffff7f")));
		assertThrows(SizeLimitExceededException.class, () -> unlimited.readCount(wrap("fe00000080")));
	}

	@Test
	public void testNonCanonical() throws Exception {
		assertThrows(NonCanonicalEncodingException.class, () -> compactSize.read(wrap("fd0000")));
		assertThrows(NonCanonicalEncodingException.class, () -> compactSize.read(wrap("fdfc00")));
		assertEquals(0xFD, compactSize.read(wrap("fdfd00")));
		assertThrows(NonCanonicalEncodingException.class, () -> compactSize.read(wrap("fe00000000")));
		assertThrows(NonCanonicalEncodingException.class, () -> compactSize.read(wrap("feffff0000")));
		assertThrows(NonCanonicalEncodingException.class, () -> compactSize.read(wrap("ff0000000000000000")));
		assertThrows(NonCanonicalEncodingException.class, () -> compactSize.read(wrap("ffffffffff00000000")));
	}

	@Test
	public void testTruncated() {
		assertThrows(TruncatedDataException.class, () -> compactSize.read(wrap("fd01")));
		assertThrows(TruncatedDataException.class, () -> compactSize.read(wrap("fe010000")));
		assertThrows(TruncatedDataException.class, () -> compactSize.read(ByteBuf.create()));
	}

	private String hex(long size) throws Exception {
		ByteBuf buf = ByteBuf.create();
		unlimited.write(buf, size);
		assertEquals(CompactSize.sizeOf(size), buf.readRemaining());
		String hex = buf.toHexString();
		assertEquals(size, unlimited.read(buf));
		return hex;
	}

	static ByteBuf wrap(String hex) {
		byte[] bytes = new byte[hex.length() / 2];
		for (int i = 0; i < bytes.length; i++) {
			bytes[i] = (byte) Integer.parseInt(hex.substring(i * 2, i * 2 + 2), 16);
		}
		return ByteBuf.wrapForReading(bytes);
	}
}
