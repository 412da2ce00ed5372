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
import io.chainj.common.exception.MalformedDataException;

@FunctionalInterface
public interface BinaryDecoder<T> {
	T decode(ByteBuf buf) throws CodecException;

	/**
	 * Decodes a single item that should occupy the whole array
	 *
	 * @throws MalformedDataException if bytes remain after the item is decoded
	 */
	default T fromByteArray(byte[] bytes) throws CodecException {
		ByteBuf buf = ByteBuf.wrapForReading(bytes);
		T item = decode(buf);
		if (buf.canRead()) {
			throw new MalformedDataException(buf.readRemaining() + " trailing bytes after decoded item");
		}
		return item;
	}
}
