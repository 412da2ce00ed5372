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

package io.chainj.bytebuf;

import io.chainj.common.ApplicationSettings;
import io.chainj.common.Checks;
import io.chainj.common.exception.TruncatedDataException;
import org.jetbrains.annotations.Contract;

import java.util.Arrays;

import static io.chainj.common.Checks.checkArgument;
import static io.chainj.common.Checks.checkState;
import static java.lang.Math.max;
import static java.lang.Math.min;

/**
 * Represents a growable byte array with 2 positions: {@link #head} and {@link #tail}.
 * <p>
 * When you write data to {@code ByteBuf}, its {@link #tail} increases by the amount of bytes written,
 * the underlying array grows as needed.
 * <p>
 * When you read data from {@code ByteBuf}, its {@link #head} increases by the amount of bytes read.
 * Reading more bytes than {@link #readRemaining()} fails with {@link TruncatedDataException},
 * a partial result is never returned.
 * <p>
 * Positional operations ({@link #at(int)}, {@link #set(int, byte)}, {@link #insert(int, byte[])},
 * {@link #erase(int, int)}) address the unread bytes: position {@code 0} is the byte at {@link #head},
 * position {@link #readRemaining()} is the end of the data.
 * <p>
 * All multibyte primitives are encoded in little-endian byte order.
 * <p>
 * {@code ByteBuf} is not thread-safe. It is owned by a single caller at a time,
 * a fully built message is handed off with {@link #takeAndClear()}.
 */
@SuppressWarnings({"WeakerAccess", "unused"})
public final class ByteBuf {
	private static final boolean CHECK = Checks.isEnabled(ByteBuf.class);

	/**
	 * Capacity of buffers created with {@link #create()}, 64 bytes by default.
	 */
	public static final int INITIAL_CAPACITY = ApplicationSettings.getInt(ByteBuf.class, "initialCapacity", 64);

	private static final byte[] ZERO_ARRAY = new byte[0];

	private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

	/**
	 * Stores bytes of this {@code ByteBuf}.
	 */
	private byte[] array;

	/**
	 * Stores <i>head</i> of this {@code ByteBuf}, the read cursor.
	 */
	int head;

	/**
	 * Stores <i>tail</i> of this {@code ByteBuf}, the end of written data.
	 */
	int tail;

	private ByteBuf(byte[] array, int head, int tail) {
		this.array = array;
		this.head = head;
		this.tail = tail;
	}

	// region creators

	/**
	 * Creates an empty {@code ByteBuf} of {@link #INITIAL_CAPACITY}.
	 *
	 * @return an empty {@code ByteBuf}
	 */
	@Contract("-> new")
	public static ByteBuf create() {
		return create(INITIAL_CAPACITY);
	}

	/**
	 * Creates an empty {@code ByteBuf} with given initial capacity.
	 *
	 * @param capacity initial length of the underlying array
	 * @return an empty {@code ByteBuf}
	 */
	@Contract("_ -> new")
	public static ByteBuf create(int capacity) {
		checkArgument(capacity >= 0, () -> "Capacity should not be negative: " + capacity);
		return new ByteBuf(capacity == 0 ? ZERO_ARRAY : new byte[capacity], 0, 0);
	}

	/**
	 * Creates a {@code ByteBuf} that is ready for reading given bytes.
	 * The bytes are copied, so later changes to the passed array are not visible to this {@code ByteBuf}.
	 *
	 * @param bytes bytes to be read
	 * @return {@code ByteBuf} with {@link #tail} equal to the length of given bytes
	 */
	@Contract("_ -> new")
	public static ByteBuf wrapForReading(byte[] bytes) {
		return new ByteBuf(bytes.length == 0 ? ZERO_ARRAY : bytes.clone(), 0, bytes.length);
	}
	// endregion

	// region getters

	/**
	 * Returns {@link #head} of this {@code ByteBuf}, a number of bytes consumed so far.
	 */
	@Contract(pure = true)
	public int head() {
		return head;
	}

	/**
	 * Returns {@link #tail} of this {@code ByteBuf}.
	 */
	@Contract(pure = true)
	public int tail() {
		return tail;
	}

	/**
	 * Returns length of the underlying array.
	 */
	@Contract(pure = true)
	public int capacity() {
		return array.length;
	}

	/**
	 * Returns the amount of bytes which are available for reading.
	 *
	 * @return amount of bytes available for reading
	 */
	@Contract(pure = true)
	public int readRemaining() {
		return tail - head;
	}

	/**
	 * Checks if there are bytes available for reading.
	 *
	 * @return {@code true} if {@link #head} is less than {@link #tail}, otherwise {@code false}
	 */
	@Contract(pure = true)
	public boolean canRead() {
		return head != tail;
	}
	// endregion

	// region life cycle

	/**
	 * Truncates this {@code ByteBuf} to empty and resets the read cursor.
	 * The underlying array is kept for reuse.
	 */
	public void clear() {
		head = 0;
		tail = 0;
	}

	/**
	 * Returns unread bytes of this {@code ByteBuf} and resets it to empty.
	 * <p>
	 * If the data occupies the whole underlying array, the array itself is handed off
	 * without copying and this {@code ByteBuf} starts over with a new array.
	 *
	 * @return bytes from {@link #head} to {@link #tail}
	 */
	@Contract(value = "-> !null")
	public byte[] takeAndClear() {
		byte[] bytes;
		if (head == 0 && tail == array.length) {
			bytes = array;
			array = ZERO_ARRAY;
		} else {
			bytes = Arrays.copyOfRange(array, head, tail);
		}
		clear();
		return bytes;
	}

	/**
	 * Returns a copy of unread bytes, from {@link #head} to {@link #tail}.
	 * Does not change this {@code ByteBuf}.
	 */
	@Contract(value = "-> !null", pure = true)
	public byte[] getArray() {
		return Arrays.copyOfRange(array, head, tail);
	}

	/**
	 * Drops bytes that have already been read, moving unread bytes to the start of the underlying array.
	 */
	public void compact() {
		if (head == 0) return;
		System.arraycopy(array, head, array, 0, tail - head);
		tail -= head;
		head = 0;
		checkInvariants();
	}
	// endregion

	// region positional access

	/**
	 * Returns the byte at given position, counting from {@link #head}.
	 *
	 * @param pos position of a byte, must be less than {@link #readRemaining()}
	 * @return the byte at the given position
	 */
	@Contract(pure = true)
	public byte at(int pos) {
		checkPosition(pos, readRemaining() - 1);
		return array[head + pos];
	}

	/**
	 * Replaces the byte at given position, counting from {@link #head}.
	 *
	 * @param pos position of a byte, must be less than {@link #readRemaining()}
	 * @param b   new value of a byte
	 */
	public void set(int pos, byte b) {
		checkPosition(pos, readRemaining() - 1);
		array[head + pos] = b;
	}

	/**
	 * Inserts a single byte at given position, shifting bytes at and after the position towards the tail.
	 *
	 * @param pos position to insert at, from {@code 0} (begin) to {@link #readRemaining()} (end) inclusive
	 * @param b   byte to be inserted
	 */
	public void insert(int pos, byte b) {
		checkPosition(pos, readRemaining());
		ensureWriteRemaining(1);
		int index = head + pos;
		System.arraycopy(array, index, array, index + 1, tail - index);
		array[index] = b;
		tail++;
		checkInvariants();
	}

	/**
	 * Inserts bytes at given position, shifting bytes at and after the position towards the tail.
	 *
	 * @param pos   position to insert at, from {@code 0} (begin) to {@link #readRemaining()} (end) inclusive
	 * @param bytes bytes to be inserted
	 */
	public void insert(int pos, byte[] bytes) {
		insert(pos, bytes, 0, bytes.length);
	}

	/**
	 * Inserts a range of bytes at given position, shifting bytes at and after the position towards the tail.
	 *
	 * @param pos    position to insert at, from {@code 0} (begin) to {@link #readRemaining()} (end) inclusive
	 * @param bytes  source of bytes
	 * @param offset offset in the source array
	 * @param length number of bytes to be inserted
	 */
	public void insert(int pos, byte[] bytes, int offset, int length) {
		checkPosition(pos, readRemaining());
		checkRange(bytes, offset, length);
		ensureWriteRemaining(length);
		int index = head + pos;
		System.arraycopy(array, index, array, index + length, tail - index);
		System.arraycopy(bytes, offset, array, index, length);
		tail += length;
		checkInvariants();
	}

	/**
	 * Erases a single byte at given position, shifting the following bytes towards the head.
	 *
	 * @param pos position of a byte, must be less than {@link #readRemaining()}
	 */
	public void erase(int pos) {
		erase(pos, pos + 1);
	}

	/**
	 * Erases bytes in range {@code [from, to)}, shifting the following bytes towards the head.
	 *
	 * @param from position of the first erased byte
	 * @param to   position after the last erased byte, at most {@link #readRemaining()}
	 */
	public void erase(int from, int to) {
		checkPosition(to, readRemaining());
		checkArgument(from >= 0 && from <= to, () -> "Invalid range to erase: [" + from + ", " + to + ")");
		int length = to - from;
		if (length == 0) return;
		System.arraycopy(array, head + to, array, head + from, tail - head - to);
		tail -= length;
		checkInvariants();
	}
	// endregion

	// region writing

	/**
	 * Appends a single byte to the end of this {@code ByteBuf}.
	 */
	public void put(byte b) {
		ensureWriteRemaining(1);
		array[tail++] = b;
	}

	/**
	 * Appends given bytes to the end of this {@code ByteBuf}.
	 */
	public void put(byte[] bytes) {
		put(bytes, 0, bytes.length);
	}

	/**
	 * Appends a range of given bytes to the end of this {@code ByteBuf}.
	 *
	 * @param bytes  source of bytes
	 * @param offset offset in the source array
	 * @param length number of bytes to be appended
	 */
	public void put(byte[] bytes, int offset, int length) {
		checkRange(bytes, offset, length);
		ensureWriteRemaining(length);
		System.arraycopy(bytes, offset, array, tail, length);
		tail += length;
	}

	/**
	 * Drains unread bytes of another {@code ByteBuf} to the end of this {@code ByteBuf}.
	 * The {@link #head} of the other buf is moved to its {@link #tail}.
	 */
	public void put(ByteBuf buf) {
		checkArgument(buf != this, "Cannot put ByteBuf into itself");
		int length = buf.readRemaining();
		ensureWriteRemaining(length);
		System.arraycopy(buf.array, buf.head, array, tail, length);
		tail += length;
		buf.head = buf.tail;
	}

	public void writeBoolean(boolean v) {
		put(v ? (byte) 1 : (byte) 0);
	}

	public void writeByte(byte v) {
		put(v);
	}

	public void writeShortLE(short v) {
		ensureWriteRemaining(2);
		array[tail] = (byte) v;
		array[tail + 1] = (byte) (v >>> 8);
		tail += 2;
	}

	public void writeIntLE(int v) {
		ensureWriteRemaining(4);
		array[tail] = (byte) v;
		array[tail + 1] = (byte) (v >>> 8);
		array[tail + 2] = (byte) (v >>> 16);
		array[tail + 3] = (byte) (v >>> 24);
		tail += 4;
	}

	public void writeLongLE(long v) {
		ensureWriteRemaining(8);
		for (int i = 0; i < 8; i++) {
			array[tail + i] = (byte) (v >>> (i << 3));
		}
		tail += 8;
	}

	/**
	 * Writes IEEE-754 bit pattern of a given {@code float} as a little-endian 32-bit integer.
	 */
	public void writeFloatLE(float v) {
		writeIntLE(Float.floatToRawIntBits(v));
	}

	/**
	 * Writes IEEE-754 bit pattern of a given {@code double} as a little-endian 64-bit integer.
	 */
	public void writeDoubleLE(double v) {
		writeLongLE(Double.doubleToRawLongBits(v));
	}
	// endregion

	// region reading

	/**
	 * Returns the byte at {@link #head} without moving the read cursor.
	 *
	 * @throws TruncatedDataException if there are no bytes to read
	 */
	@Contract(pure = true)
	public byte peek() throws TruncatedDataException {
		return peek(0);
	}

	/**
	 * Returns the byte at {@link #head} increased by the offset without moving the read cursor.
	 *
	 * @param offset offset from {@link #head}
	 * @throws TruncatedDataException if the offset points outside of unread bytes
	 */
	@Contract(pure = true)
	public byte peek(int offset) throws TruncatedDataException {
		checkArgument(offset >= 0, () -> "Offset should not be negative: " + offset);
		if (offset >= tail - head) {
			throw new TruncatedDataException("Requested byte at offset " + offset + ", but only " + (tail - head) + " remain");
		}
		return array[head + offset];
	}

	/**
	 * Reads exactly {@code length} bytes and moves the read cursor past them.
	 *
	 * @param length number of bytes to read
	 * @return a new array of read bytes
	 * @throws TruncatedDataException if fewer than {@code length} bytes remain
	 */
	public byte[] read(int length) throws TruncatedDataException {
		checkArgument(length >= 0, () -> "Length should not be negative: " + length);
		ensureReadRemaining(length);
		byte[] bytes = Arrays.copyOfRange(array, head, head + length);
		head += length;
		return bytes;
	}

	/**
	 * Fills the whole given array with bytes of this {@code ByteBuf}.
	 *
	 * @throws TruncatedDataException if fewer than {@code b.length} bytes remain
	 */
	public void read(byte[] b) throws TruncatedDataException {
		read(b, 0, b.length);
	}

	public void read(byte[] b, int offset, int length) throws TruncatedDataException {
		checkRange(b, offset, length);
		ensureReadRemaining(length);
		System.arraycopy(array, head, b, offset, length);
		head += length;
	}

	/**
	 * Moves the read cursor forward by given number of bytes.
	 *
	 * @throws TruncatedDataException if fewer than {@code length} bytes remain
	 */
	public void skip(int length) throws TruncatedDataException {
		checkArgument(length >= 0, () -> "Length should not be negative: " + length);
		ensureReadRemaining(length);
		head += length;
	}

	/**
	 * Reads a byte and interprets any non-zero value as {@code true}.
	 */
	public boolean readBoolean() throws TruncatedDataException {
		return readByte() != 0;
	}

	public byte readByte() throws TruncatedDataException {
		ensureReadRemaining(1);
		return array[head++];
	}

	public int readUnsignedByte() throws TruncatedDataException {
		return readByte() & 0xFF;
	}

	public short readShortLE() throws TruncatedDataException {
		ensureReadRemaining(2);
		short result = (short) (array[head] & 0xFF | (array[head + 1] & 0xFF) << 8);
		head += 2;
		return result;
	}

	public int readUnsignedShortLE() throws TruncatedDataException {
		return readShortLE() & 0xFFFF;
	}

	public int readIntLE() throws TruncatedDataException {
		ensureReadRemaining(4);
		int result = array[head] & 0xFF |
				(array[head + 1] & 0xFF) << 8 |
				(array[head + 2] & 0xFF) << 16 |
				(array[head + 3] & 0xFF) << 24;
		head += 4;
		return result;
	}

	public long readUnsignedIntLE() throws TruncatedDataException {
		return readIntLE() & 0xFFFFFFFFL;
	}

	public long readLongLE() throws TruncatedDataException {
		ensureReadRemaining(8);
		long result = 0;
		for (int i = 0; i < 8; i++) {
			result |= (array[head + i] & 0xFFL) << (i << 3);
		}
		head += 8;
		return result;
	}

	public float readFloatLE() throws TruncatedDataException {
		return Float.intBitsToFloat(readIntLE());
	}

	public double readDoubleLE() throws TruncatedDataException {
		return Double.longBitsToDouble(readLongLE());
	}
	// endregion

	/**
	 * Checks if unread bytes of this {@code ByteBuf} are equal to given bytes.
	 */
	@Contract(pure = true)
	public boolean isContentEqual(byte[] bytes) {
		return Arrays.equals(array, head, tail, bytes, 0, bytes.length);
	}

	/**
	 * Returns unread bytes as a lowercase hex string, two digits per byte.
	 */
	@Contract(pure = true)
	public String toHexString() {
		return toHexString(tail - head);
	}

	private String toHexString(int length) {
		char[] chars = new char[length * 2];
		for (int i = 0; i < length; i++) {
			int b = array[head + i] & 0xFF;
			chars[i * 2] = HEX_DIGITS[b >>> 4];
			chars[i * 2 + 1] = HEX_DIGITS[b & 0x0F];
		}
		return new String(chars);
	}

	private void ensureReadRemaining(int size) throws TruncatedDataException {
		if (tail - head < size) {
			throw new TruncatedDataException("Requested " + size + " bytes, but only " + (tail - head) + " remain");
		}
	}

	private void ensureWriteRemaining(int size) {
		if (array.length - tail < size) {
			int required = tail + size;
			if (required < 0) throw new OutOfMemoryError("ByteBuf exceeds maximum array size");
			int newCapacity = max(required, array.length <= Integer.MAX_VALUE / 2 ? array.length * 2 : Integer.MAX_VALUE);
			array = Arrays.copyOf(array, max(newCapacity, 16));
		}
	}

	private static void checkPosition(int pos, int max) {
		checkArgument(pos >= 0 && pos <= max, () -> "Position " + pos + " is out of range [0, " + max + "]");
	}

	private static void checkRange(byte[] bytes, int offset, int length) {
		checkArgument(offset >= 0 && length >= 0 && length <= bytes.length - offset,
				() -> "Range [" + offset + ", " + offset + " + " + length + ") is outside of array of length " + bytes.length);
	}

	private void checkInvariants() {
		if (CHECK) {
			checkState(0 <= head && head <= tail && tail <= array.length,
					() -> "Wrong ByteBuf boundaries - head: " + head + ", tail: " + tail + ", array.length: " + array.length);
		}
	}

	@Override
	@Contract(pure = true)
	public String toString() {
		int length = min(tail - head, 256);
		return "ByteBuf{head=" + head + ", tail=" + tail + ", data=" + toHexString(length) + (length < tail - head ? "...}" : "}");
	}
}
