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

package io.chainj.serializer;

import io.chainj.bytebuf.ByteBuf;
import io.chainj.common.exception.TruncatedDataException;
import io.chainj.common.exception.VarIntOverflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * General-purpose variable-length integer encoding.
 * <p>
 * A magnitude is written in 7-bit groups, most significant group first,
 * every byte but the last one has bit 7 set. Each more significant group is decremented
 * by one before it is emitted, so there are no redundant encodings:
 * every byte sequence decodes to a distinct integer.
 * <pre>
 * 0x00 -> 00
 * 0x7f -> 7f
 * 0x80 -> 80 00
 * 0x1234 -> a3 34
 * 0xffffffff -> 8e fe fe fe 7f
 * </pre>
 */
public final class VarInts {
	private static final Logger logger = LoggerFactory.getLogger(VarInts.class);

	/**
	 * Maximum length of an encoded 64-bit magnitude
	 */
	public static final int MAX_SIZE = 10;

	private VarInts() {
	}

	/**
	 * Writes an unsigned 64-bit magnitude
	 */
	public static void write(ByteBuf buf, long magnitude) {
		byte[] tmp = new byte[MAX_SIZE];
		int pos = MAX_SIZE;
		long n = magnitude;
		boolean last = true;
		while (true) {
			tmp[--pos] = (byte) ((n & 0x7F) | (last ? 0x00 : 0x80));
			if (Long.compareUnsigned(n, 0x7F) <= 0) break;
			n = (n >>> 7) - 1;
			last = false;
		}
		buf.put(tmp, pos, MAX_SIZE - pos);
	}

	/**
	 * Writes a value of a given width
	 *
	 * @throws IllegalArgumentException if the value does not fit the width
	 */
	public static void write(ByteBuf buf, long value, VarIntType type) {
		write(buf, type.toMagnitude(value));
	}

	/**
	 * Reads a value of a given width
	 *
	 * @throws VarIntOverflowException if the encoded magnitude does not fit the width
	 * @throws TruncatedDataException  if the encoding ends prematurely
	 */
	public static long read(ByteBuf buf, VarIntType type) throws VarIntOverflowException, TruncatedDataException {
		return type.fromMagnitude(readMagnitude(buf, type.maxMagnitude()));
	}

	/**
	 * Reads a magnitude not greater than the given unsigned maximum.
	 * The maximum must be of form {@code 2^k - 1}.
	 *
	 * @throws VarIntOverflowException if the encoded magnitude exceeds the maximum
	 * @throws TruncatedDataException  if the encoding ends prematurely
	 */
	public static long readMagnitude(ByteBuf buf, long maxMagnitude) throws VarIntOverflowException, TruncatedDataException {
		long limit = maxMagnitude >>> 7;
		long n = 0;
		while (true) {
			int b = buf.readUnsignedByte();
			if (Long.compareUnsigned(n, limit) > 0) {
				throw overflow(maxMagnitude);
			}
			n = (n << 7) | (b & 0x7F);
			if ((b & 0x80) == 0) {
				return n;
			}
			if (n == maxMagnitude) {
				throw overflow(maxMagnitude);
			}
			n++;
		}
	}

	/**
	 * Returns the number of bytes {@link #write(ByteBuf, long)} emits for a given magnitude
	 */
	public static int sizeOf(long magnitude) {
		int size = 1;
		long n = magnitude;
		while (Long.compareUnsigned(n, 0x7F) > 0) {
			n = (n >>> 7) - 1;
			size++;
		}
		return size;
	}

	public static int sizeOf(long value, VarIntType type) {
		return sizeOf(type.toMagnitude(value));
	}

	private static VarIntOverflowException overflow(long maxMagnitude) {
		logger.trace("VarInt magnitude exceeds {}", Long.toUnsignedString(maxMagnitude));
		return new VarIntOverflowException("VarInt magnitude exceeds " + Long.toUnsignedString(maxMagnitude));
	}
}
