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

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

import static io.chainj.common.Checks.checkArgument;

/**
 * 32 bytes of a double SHA-256 digest, in the order they appear on the wire
 */
public final class Hash256 implements Comparable<Hash256> {
	public static final int SIZE = 32;

	public static final Hash256 ZERO = new Hash256(new byte[SIZE]);

	private static final char[] HEX = "0123456789abcdef".toCharArray();

	private final byte[] bytes;

	private Hash256(byte[] bytes) {
		this.bytes = bytes;
	}

	public static Hash256 of(byte[] bytes) {
		checkArgument(bytes.length == SIZE, () -> "Hash should be " + SIZE + " bytes long, got " + bytes.length);
		return new Hash256(bytes.clone());
	}

	public byte[] getBytes() {
		return bytes.clone();
	}

	public boolean isZero() {
		for (byte b : bytes) {
			if (b != 0) return false;
		}
		return true;
	}

	@Override
	public int compareTo(@NotNull Hash256 other) {
		return Arrays.compareUnsigned(bytes, other.bytes);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Hash256 that = (Hash256) o;
		return Arrays.equals(bytes, that.bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(bytes);
	}

	@Override
	public String toString() {
		char[] chars = new char[SIZE * 2];
		for (int i = 0; i < SIZE; i++) {
			chars[i * 2] = HEX[(bytes[i] >> 4) & 0x0F];
			chars[i * 2 + 1] = HEX[bytes[i] & 0x0F];
		}
		return new String(chars);
	}
}
