package io.chainj.serializer;

import io.chainj.common.Checks;
import io.chainj.common.exception.CodecException;
import org.junit.Test;

import java.util.List;

import static io.chainj.serializer.BinaryCodecs.*;
import static org.junit.Assert.*;
import static org.junit.Assume.assumeTrue;

public class SerializedSizeTest {

	@Test
	public void testEmpty() {
		assertEquals(0, SerializedSize.create().get());
	}

	@Test
	public void testAccumulation() throws CodecException {
		long size = SerializedSize.create()
				.add(ofInt(), 100)
				.add(ofBoolean(), true)
				.add(ofString(), "testing")
				.add(ofFixedBytes(15), new byte[15])
				.get();
		assertEquals(4 + 1 + 8 + 15, size);

		byte[] list = ofList(ofString()).toByteArray(List.of("a", "bc"));
		assertEquals(list.length, SerializedSize.of(ofList(ofString()), List.of("a", "bc")));
	}

	@Test
	public void testAddBytes() {
		assertEquals(12, SerializedSize.create().addBytes(4).add(ofLong(), 1L).get());
	}

	@Test
	public void testDisagreementIsDetected() {
		assumeTrue(Checks.isEnabled(SerializedSize.class));

		BinaryCodec<Integer> lying = BinaryCodec.of(
				(buf, item) -> buf.writeIntLE(item),
				item -> 3,
				buf -> buf.readIntLE());
		assertThrows(IllegalStateException.class, () -> lying.toByteArray(1));
	}
}
