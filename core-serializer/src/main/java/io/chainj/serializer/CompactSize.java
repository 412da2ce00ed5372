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
import io.chainj.common.ApplicationSettings;
import io.chainj.common.exception.CodecException;
import io.chainj.common.exception.NonCanonicalEncodingException;
import io.chainj.common.exception.SizeLimitExceededException;
import io.chainj.common.exception.TruncatedDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.chainj.common.Checks.checkArgument;

/**
 * Canonical length prefix used for all lengths and counts.
 * <pre>
 * n &lt; 0xfd                   one byte n
 * n &lt;= 0xffff                 0xfd + 2 bytes little-endian
 * n &lt;= 0xffffffff             0xfe + 4 bytes little-endian
 * otherwise                   0xff + 8 bytes little-endian
 * </pre>
 * Only the shortest form is accepted on decode. Values above {@link #getMaxSize()}
 * are rejected both on encode and on decode.
 * <p>
 * The maximum is a policy of the embedding system, it is passed to {@link #create(long)}.
 * {@link #getDefault()} takes it from {@code CompactSize.maxSize} setting, 32 MiB if not set.
 */
public final class CompactSize {
	private static final Logger logger = LoggerFactory.getLogger(CompactSize.class);

	public static final long DEFAULT_MAX_SIZE = ApplicationSettings.getLong(CompactSize.class, "maxSize", 0x02000000L);

	private static final CompactSize DEFAULT = create(DEFAULT_MAX_SIZE);

	private final long maxSize;

	private CompactSize(long maxSize) {
		this.maxSize = maxSize;
	}

	/**
	 * Creates a codec that accepts sizes up to a given maximum, inclusive
	 */
	public static CompactSize create(long maxSize) {
		checkArgument(maxSize >= 0, () -> "Maximum size should not be negative: " + maxSize);
		logger.debug("CompactSize maximum is {}", maxSize);
		return new CompactSize(maxSize);
	}

	/**
	 * Returns a codec with maximum taken from {@code CompactSize.maxSize} setting
	 */
	public static CompactSize getDefault() {
		return DEFAULT;
	}

	public long getMaxSize() {
		return maxSize;
	}

	/**
	 * Writes a size in its shortest form
	 *
	 * @throws SizeLimitExceededException if the size is negative or exceeds the maximum
	 */
	public void write(ByteBuf buf, long size) throws SizeLimitExceededException {
		if (size < 0 || size > maxSize) {
			throw tooLarge(Long.toUnsignedString(size));
		}
		if (size < 0xFD) {
			buf.writeByte((byte) size);
		} else if (size <= 0xFFFF) {
			buf.writeByte((byte) 0xFD);
			buf.writeShortLE((short) size);
		} else if (size <= 0xFFFFFFFFL) {
			buf.writeByte((byte) 0xFE);
			buf.writeIntLE((int) size);
		} else {
			buf.writeByte((byte) 0xFF);
			buf.writeLongLE(size);
		}
	}

	/**
	 * Reads a size, accepting only its shortest form
	 *
	 * @throws NonCanonicalEncodingException if the size could have been encoded in a shorter form
	 * @throws SizeLimitExceededException    if the size exceeds the maximum
	 * @throws TruncatedDataException        if the encoding ends prematurely
	 */
	public long read(ByteBuf buf) throws CodecException {
		int prefix = buf.readUnsignedByte();
		long size;
		if (prefix < 0xFD) {
			size = prefix;
		} else if (prefix == 0xFD) {
			size = buf.readUnsignedShortLE();
			if (size < 0xFD) throw nonCanonical(size);
		} else if (prefix == 0xFE) {
			size = buf.readUnsignedIntLE();
			if (size <= 0xFFFF) throw nonCanonical(size);
		} else {
			size = buf.readLongLE();
			if (Long.compareUnsigned(size, 0xFFFFFFFFL) <= 0) throw nonCanonical(size);
		}
		if (Long.compareUnsigned(size, maxSize) > 0) {
			throw tooLarge(Long.toUnsignedString(size));
		}
		return size;
	}

	/**
	 * Reads a size of an in-memory collection or array
	 *
	 * @throws SizeLimitExceededException if the size does not fit an {@code int}
	 * @see #read(ByteBuf)
	 */
	public int readCount(ByteBuf buf) throws CodecException {
		long size = read(buf);
		if (size > Integer.MAX_VALUE) {
			throw tooLarge(Long.toString(size));
		}
		return (int) size;
	}

	/**
	 * Returns the number of bytes a given size occupies when encoded
	 */
	public static int sizeOf(long size) {
		if (size >= 0 && size < 0xFD) return 1;
		if (size >= 0 && size <= 0xFFFF) return 3;
		if (size >= 0 && size <= 0xFFFFFFFFL) return 5;
		return 9;
	}

	private SizeLimitExceededException tooLarge(String size) {
		logger.trace("CompactSize {} exceeds maximum {}", size, maxSize);
		return new SizeLimitExceededException("CompactSize " + size + " exceeds maximum " + maxSize);
	}

	private static NonCanonicalEncodingException nonCanonical(long size) {
		logger.trace("Non-canonical CompactSize encoding of {}", size);
		return new NonCanonicalEncodingException("Non-canonical CompactSize encoding of " + size);
	}

	@Override
	public String toString() {
		return "CompactSize{maxSize=" + maxSize + '}';
	}
}
