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

import static io.chainj.common.Checks.checkArgument;

/**
 * Native integer widths a VarInt can be decoded into.
 * <p>
 * A value is encoded through its bit pattern within the native width
 * (so {@code -1} of {@link #INT32} is encoded as magnitude {@code 0xFFFFFFFF}),
 * and a decoded magnitude that exceeds the unsigned range of the width is an overflow.
 */
public enum VarIntType {
	UINT8(8, false),
	INT8(8, true),
	UINT16(16, false),
	INT16(16, true),
	UINT32(32, false),
	INT32(32, true),
	UINT64(64, false),
	INT64(64, true);

	private final int bits;
	private final boolean signed;

	VarIntType(int bits, boolean signed) {
		this.bits = bits;
		this.signed = signed;
	}

	public int getBits() {
		return bits;
	}

	public boolean isSigned() {
		return signed;
	}

	/**
	 * Returns the largest magnitude that fits this width, as an unsigned 64-bit value
	 */
	public long maxMagnitude() {
		return bits == 64 ? -1L : (1L << bits) - 1;
	}

	/**
	 * Converts a Java value of this width into an unsigned magnitude
	 *
	 * @throws IllegalArgumentException if the value is out of range of this width
	 */
	public long toMagnitude(long value) {
		if (bits == 64) return value;
		if (signed) {
			long min = -(1L << (bits - 1));
			long max = (1L << (bits - 1)) - 1;
			checkArgument(value >= min && value <= max, () -> "Value " + value + " does not fit " + this);
		} else {
			checkArgument(value >= 0 && value <= maxMagnitude(), () -> "Value " + value + " does not fit " + this);
		}
		return value & maxMagnitude();
	}

	/**
	 * Converts a magnitude that fits this width back into a Java value,
	 * sign-extending it for signed widths
	 */
	public long fromMagnitude(long magnitude) {
		if (!signed || bits == 64) return magnitude;
		int shift = 64 - bits;
		return (magnitude << shift) >> shift;
	}
}
