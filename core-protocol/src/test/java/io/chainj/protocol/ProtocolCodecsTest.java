package io.chainj.protocol;

import io.chainj.common.exception.CodecException;
import io.chainj.common.exception.SizeLimitExceededException;
import io.chainj.serializer.BinaryCodec;
import io.chainj.serializer.CompactSize;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.chainj.serializer.BinaryCodecs.*;
import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.junit.Assert.*;

public class ProtocolCodecsTest {
	private final ProtocolCodecs codecs = ProtocolCodecs.create(CompactSize.create(0x02000000));

	@Test
	public void testTxInSize() {
		TxIn empty = TxIn.create(OutPoint.NULL, new byte[0]);
		assertEquals(41, codecs.txIn().sizeOf(empty));

		TxIn withScript = TxIn.create(OutPoint.NULL, script(253));
		assertEquals(296, codecs.txIn().sizeOf(withScript));
	}

	@Test
	public void testTxOutSize() {
		assertEquals(9, codecs.txOut().sizeOf(new TxOut(0, new byte[0])));
		assertEquals(264, codecs.txOut().sizeOf(new TxOut(0, script(253))));
	}

	@Test
	public void testTransactionSize() {
		assertEquals(10, codecs.transaction().sizeOf(transaction(0, 0)));
		assertEquals(60, codecs.transaction().sizeOf(transaction(1, 1)));
		assertEquals(12664, codecs.transaction().sizeOf(transaction(253, 253)));
	}

	@Test
	public void testBlockTransactionsSize() {
		BinaryCodec<BlockTransactions> codec = codecs.blockTransactions();
		assertEquals(33, codec.sizeOf(new BlockTransactions(Hash256.ZERO, List.of())));
		assertEquals(43, codec.sizeOf(new BlockTransactions(Hash256.ZERO, List.of(transaction(0, 0)))));

		List<Transaction> transactions = new ArrayList<>();
		for (int i = 0; i < 253; i++) {
			transactions.add(transaction(0, 0));
		}
		assertEquals(2565, codec.sizeOf(new BlockTransactions(Hash256.ZERO, transactions)));
	}

	@Test
	public void testInvSize() {
		Inv inv = new Inv(Inv.MSG_TX, Hash256.ZERO);
		assertEquals(36, codecs.inv().sizeOf(inv));

		List<Inv> invs = new ArrayList<>();
		for (int i = 0; i < 10; i++) {
			invs.add(inv);
		}
		assertEquals(361, codecs.invList().sizeOf(invs));
	}

	@Test
	public void testTransactionRoundTrip() throws CodecException {
		byte[] txId = new byte[Hash256.SIZE];
		Arrays.fill(txId, (byte) 0xAB);
		Transaction transaction = new Transaction(2,
				List.of(new TxIn(new OutPoint(Hash256.of(txId), 3), script(5), 0xFFFFFFFEL)),
				List.of(new TxOut(5000000000L, script(25)), new TxOut(1, new byte[0])),
				700000);

		byte[] bytes = codecs.transaction().toByteArray(transaction);
		assertEquals(codecs.transaction().sizeOf(transaction), bytes.length);
		assertEquals(transaction, codecs.transaction().fromByteArray(bytes));
	}

	@Test
	public void testNullOutPoint() throws CodecException {
		byte[] bytes = codecs.outPoint().toByteArray(OutPoint.NULL);
		assertEquals(36, bytes.length);
		assertEquals((byte) 0xFF, bytes[32]);
		assertEquals((byte) 0xFF, bytes[35]);
		assertTrue(codecs.outPoint().fromByteArray(bytes).isNull());
	}

	@Test
	public void testScriptAboveMaximum() {
		ProtocolCodecs restricted = ProtocolCodecs.create(CompactSize.create(100));
		assertThrows(SizeLimitExceededException.class, () -> restricted.txOut().toByteArray(new TxOut(0, script(101))));
	}

	@Test
	public void testRecordOfMixedFields() throws CodecException {
		BinaryCodec<MethodsRecord> single = BinaryCodec.create(MethodsRecord::new,
				MethodsRecord::intValue, ofInt(),
				MethodsRecord::boolValue, ofBoolean(),
				MethodsRecord::stringValue, ofString(),
				MethodsRecord::charsValue, ofFixedBytes(15),
				MethodsRecord::transaction, codecs.transaction());

		MethodsRecord record = new MethodsRecord(100, true, "testing",
				"testing charstr".getBytes(US_ASCII), transaction(0, 0));

		byte[] bytes = single.toByteArray(record);
		MethodsRecord decoded = single.fromByteArray(bytes);
		assertEquals(record.intValue(), decoded.intValue());
		assertEquals(record.boolValue(), decoded.boolValue());
		assertEquals(record.stringValue(), decoded.stringValue());
		assertArrayEquals(record.charsValue(), decoded.charsValue());
		assertEquals(record.transaction(), decoded.transaction());

		byte[] concatenated = concat(
				ofInt().toByteArray(100),
				ofBoolean().toByteArray(true),
				ofString().toByteArray("testing"),
				ofFixedBytes(15).toByteArray("testing charstr".getBytes(US_ASCII)),
				codecs.transaction().toByteArray(transaction(0, 0)));
		assertArrayEquals(bytes, concatenated);
	}

	private static Transaction transaction(int inputs, int outputs) {
		List<TxIn> txIns = new ArrayList<>();
		for (int i = 0; i < inputs; i++) {
			txIns.add(TxIn.create(OutPoint.NULL, new byte[0]));
		}
		List<TxOut> txOuts = new ArrayList<>();
		for (int i = 0; i < outputs; i++) {
			txOuts.add(new TxOut(0, new byte[0]));
		}
		return new Transaction(1, txIns, txOuts, 0);
	}

	private static byte[] script(int length) {
		byte[] script = new byte[length];
		Arrays.fill(script, (byte) 0x51);
		return script;
	}

	private static byte[] concat(byte[]... arrays) {
		int length = 0;
		for (byte[] array : arrays) {
			length += array.length;
		}
		byte[] result = new byte[length];
		int offset = 0;
		for (byte[] array : arrays) {
			System.arraycopy(array, 0, result, offset, array.length);
			offset += array.length;
		}
		return result;
	}

	record MethodsRecord(int intValue, boolean boolValue, String stringValue, byte[] charsValue, Transaction transaction) {
	}
}
