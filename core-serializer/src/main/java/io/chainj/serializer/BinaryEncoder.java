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
import io.chainj.common.exception.CodecException;

import java.util.function.ToLongFunction;

import static io.chainj.common.Checks.checkArgument;

public interface BinaryEncoder<T> {
	void encode(ByteBuf buf, T item) throws CodecException;

	/**
	 * Returns the exact number of bytes {@link #encode(ByteBuf, Object)} writes for a given item
	 */
	long sizeOf(T item);

	default byte[] toByteArray(T item) throws CodecException {
		long size = sizeOf(item);
		checkArgument(size <= Integer.MAX_VALUE, () -> "Serialized size " + size + " does not fit a byte array");
		ByteBuf buf = ByteBuf.create((int) size);
		encode(buf, item);
		SerializedSize.verify(size, buf.readRemaining(), item);
		return buf.takeAndClear();
	}

	static <T> BinaryEncoder<T> of(Writer<T> writer, ToLongFunction<T> sizer) {
		return new BinaryEncoder<>() {
			@Override
			public void encode(ByteBuf buf, T item) throws CodecException {
				writer.write(buf, item);
			}

			@Override
			public long sizeOf(T item) {
				return sizer.applyAsLong(item);
			}
		};
	}

	@FunctionalInterface
	interface Writer<T> {
		void write(ByteBuf buf, T item) throws CodecException;
	}
}
