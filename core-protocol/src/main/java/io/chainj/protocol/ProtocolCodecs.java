/*
 * Copyright (C) 2020 ActiveJ LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.chainj.protocol;

import io.chainj.serializer.BinaryCodec;
import io.chainj.serializer.CompactSize;

import java.util.List;

import static io.chainj.serializer.BinaryCodecs.*;

/**
 * Codecs of transaction, inventory and block transaction messages.
 * All length prefixes share one {@link CompactSize} policy.
 */
public final class ProtocolCodecs {
	private final CompactSize compactSize;

	private final BinaryCodec<Hash256> hash256;
	private final BinaryCodec<OutPoint> outPoint;
	private final BinaryCodec<TxIn> txIn;
	private final BinaryCodec<TxOut> txOut;
	private final BinaryCodec<Transaction> transaction;
	private final BinaryCodec<Inv> inv;
	private final BinaryCodec<List<Inv>> invList;
	private final BinaryCodec<BlockTransactions> blockTransactions;

	private ProtocolCodecs(CompactSize compactSize) {
		this.compactSize = compactSize;
		this.hash256 = ofFixedBytes(Hash256.SIZE).transform(Hash256::of, Hash256::getBytes);
		this.outPoint = BinaryCodec.create(OutPoint::new,
				OutPoint::txId, hash256,
				OutPoint::index, ofUnsignedInt());
		this.txIn = BinaryCodec.create(TxIn::new,
				TxIn::prevOut, outPoint,
				TxIn::scriptSig, ofBytes(compactSize),
				TxIn::sequence, ofUnsignedInt());
		this.txOut = BinaryCodec.create(TxOut::new,
				TxOut::value, ofLong(),
				TxOut::scriptPubKey, ofBytes(compactSize));
		this.transaction = BinaryCodec.create(Transaction::new,
				Transaction::version, ofInt(),
				Transaction::inputs, ofList(txIn, compactSize),
				Transaction::outputs, ofList(txOut, compactSize),
				Transaction::lockTime, ofUnsignedInt());
		this.inv = BinaryCodec.create(Inv::new,
				Inv::type, ofInt(),
				Inv::hash, hash256);
		this.invList = ofList(inv, compactSize);
		this.blockTransactions = BinaryCodec.create(BlockTransactions::new,
				BlockTransactions::blockHash, hash256,
				BlockTransactions::transactions, ofList(transaction, compactSize));
	}

	public static ProtocolCodecs create(CompactSize compactSize) {
		return new ProtocolCodecs(compactSize);
	}

	public static ProtocolCodecs create() {
		return new ProtocolCodecs(CompactSize.getDefault());
	}

	public CompactSize getCompactSize() {
		return compactSize;
	}

	public BinaryCodec<Hash256> hash256() {
		return hash256;
	}

	public BinaryCodec<OutPoint> outPoint() {
		return outPoint;
	}

	public BinaryCodec<TxIn> txIn() {
		return txIn;
	}

	public BinaryCodec<TxOut> txOut() {
		return txOut;
	}

	public BinaryCodec<Transaction> transaction() {
		return transaction;
	}

	public BinaryCodec<Inv> inv() {
		return inv;
	}

	public BinaryCodec<List<Inv>> invList() {
		return invList;
	}

	public BinaryCodec<BlockTransactions> blockTransactions() {
		return blockTransactions;
	}
}
