package io.chainj.serializer;

import io.chainj.bytebuf.ByteBuf;
import io.chainj.common.exception.TruncatedDataException;
import io.chainj.common.exception.VarIntOverflowException;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class VarIntsTest {

	@Test
	public void testVectors() {
		assertEquals("00", hex(0L));
		assertEquals("7f", hex(0x7FL));
		assertEquals("8000", hex(0x80L));
		assertEquals("a334", hex(0x1234L));
		assertEquals("82fe7f", hex(0xFFFFL));
		assertEquals("c7e756", hex(0x123456L));
		assertEquals("86ffc7e756", hex(0x80123456L));
		assertEquals("8efefefe7f", hex(0xFFFFFFFFL));
		assertEquals("fefefefefefefefe7f", hex(0x7FFFFFFFFFFFFFFFL));
		assertEquals("80fefefefefefefefe7f", hex(0xFFFFFFFFFFFFFFFFL));
	}

	@Test
	public void testRoundTripAndSize() throws Exception {
		ByteBuf buf = ByteBuf.create();
		long expectedSize = 0;
		for (long i = 0; i < 100000; i++) {
			VarInts.write(buf, i, VarIntType.INT32);
			expectedSize += VarInts.sizeOf(i, VarIntType.INT32);
			assertEquals(expectedSize, buf.readRemaining());
		}
		List<Long> large = new ArrayList<>();
		for (long i = 0; i < 100000000000L; i += 999999937L) {
			VarInts.write(buf, i, VarIntType.UINT64);
			expectedSize += VarInts.sizeOf(i);
			assertEquals(expectedSize, buf.readRemaining());
			large.add(i);
		}

		for (long i = 0; i < 100000; i++) {
			assertEquals(i, VarInts.read(buf, VarIntType.INT32));
		}
		for (long i : large) {
			assertEquals(i, VarInts.read(buf, VarIntType.UINT64));
		}
		assertFalse(buf.canRead());
	}

	@Test
	public void testMaximumOfEachWidth() throws Exception {
		for (VarIntType type : VarIntType.values()) {
			ByteBuf buf = ByteBuf.create();
			VarInts.write(buf, type.maxMagnitude());
			assertEquals(type.maxMagnitude(), type.toMagnitude(VarInts.read(buf, type)));
		}
	}

	@Test
	public void testSignedValuesCarryTheirBitPattern() throws Exception {
		assertEquals("8efefefe7f", hex(-1, VarIntType.INT32));
		assertEquals("80fefefefefefefefe7f", hex(-1, VarIntType.INT64));
		assertEquals("807f", hex(-1, VarIntType.INT8));

		long[] values = {-1, Integer.MIN_VALUE, Integer.MAX_VALUE, -12345, 0};
		for (long value : values) {
			ByteBuf buf = ByteBuf.create();
			VarInts.write(buf, value, VarIntType.INT32);
			assertEquals(value, VarInts.read(buf, VarIntType.INT32));
		}

		ByteBuf buf = ByteBuf.create();
		VarInts.write(buf, Byte.MIN_VALUE, VarIntType.INT8);
		VarInts.write(buf, Short.MIN_VALUE, VarIntType.INT16);
		VarInts.write(buf, Long.MIN_VALUE, VarIntType.INT64);
		assertEquals(Byte.MIN_VALUE, VarInts.read(buf, VarIntType.INT8));
		assertEquals(Short.MIN_VALUE, VarInts.read(buf, VarIntType.INT16));
		assertEquals(Long.MIN_VALUE, VarInts.read(buf, VarIntType.INT64));
	}

	@Test
	public void testValueOutsideOfWidth() {
		ByteBuf buf = ByteBuf.create();
		assertThrows(IllegalArgumentException.class, () -> VarInts.write(buf, 256, VarIntType.UINT8));
		assertThrows(IllegalArgumentException.class, () -> VarInts.write(buf, 128, VarIntType.INT8));
		assertThrows(IllegalArgumentException.class, () -> VarInts.write(buf, -1, VarIntType.UINT32));
		assertThrows(IllegalArgumentException.class, () -> VarInts.write(buf, 1L << 32, VarIntType.INT32));
		assertEquals(0, buf.readRemaining());
	}

	@Test
	public void testOverflow() {
		assertThrows(VarIntOverflowException.class, () -> VarInts.read(filled(0x80, 64), VarIntType.UINT32));
		assertThrows(VarIntOverflowException.class, () -> VarInts.read(filled(0x80, 64), VarIntType.UINT64));
		assertThrows(VarIntOverflowException.class, () -> VarInts.read(filled(0xFF, 4), VarIntType.UINT16));
	}

	@Test
	public void testMaximumPlusOne() {
		for (VarIntType type : VarIntType.values()) {
			if (type.getBits() == 64) continue;
			ByteBuf buf = ByteBuf.create();
			VarInts.write(buf, type.maxMagnitude() + 1);
			assertThrows(type.toString(), VarIntOverflowException.class, () -> VarInts.read(buf, type));
		}
	}

	@Test
	public void testTruncated() {
		assertThrows(TruncatedDataException.class, () -> VarInts.read(ByteBuf.wrapForReading(new byte[]{(byte) 0x80}), VarIntType.UINT64));
		assertThrows(TruncatedDataException.class, () -> VarInts.read(ByteBuf.create(), VarIntType.UINT8));
	}

	@Test
	public void testSizes() {
		assertEquals(1, VarInts.sizeOf(0));
		assertEquals(1, VarInts.sizeOf(0x7F));
		assertEquals(2, VarInts.sizeOf(0x80));
		assertEquals(5, VarInts.sizeOf(0xFFFFFFFFL));
		assertEquals(VarInts.MAX_SIZE, VarInts.sizeOf(-1L));
	}

	private static ByteBuf filled(int b, int count) {
		byte[] bytes = new byte[count];
		Arrays.fill(bytes, (byte) b);
		return ByteBuf.wrapForReading(bytes);
	}

	private static String hex(long magnitude) {
		ByteBuf buf = ByteBuf.create();
		VarInts.write(buf, magnitude);
		assertEquals(VarInts.sizeOf(magnitude), buf.readRemaining());
		return buf.toHexString();
	}

	private static String hex(long value, VarIntType type) {
		ByteBuf buf = ByteBuf.create();
		VarInts.write(buf, value, type);
		return buf.toHexString();
	}
}
