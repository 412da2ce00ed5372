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

import io.chainj.common.Checks;
import org.jetbrains.annotations.Nullable;

import static io.chainj.common.Checks.checkState;

/**
 * Accumulates serialized sizes of several items, as if they were written one after another.
 * An empty accumulator yields zero.
 */
public final class SerializedSize {
	private static final boolean CHECK = Checks.isEnabled(SerializedSize.class);

	private long size;

	private SerializedSize() {
	}

	public static SerializedSize create() {
		return new SerializedSize();
	}

	public static <T> long of(BinaryEncoder<T> encoder, T item) {
		return encoder.sizeOf(item);
	}

	public <T> SerializedSize add(BinaryEncoder<T> encoder, T item) {
		size += encoder.sizeOf(item);
		return this;
	}

	public SerializedSize addBytes(long bytes) {
		size += bytes;
		return this;
	}

	public long get() {
		return size;
	}

	static void verify(long expected, long actual, @Nullable Object item) {
		if (CHECK) {
			checkState(expected == actual, () -> "Computed size " + expected + " differs from " + actual + " bytes written for " + item);
		}
	}

	@Override
	public String toString() {
		return "SerializedSize{" + size + '}';
	}
}
