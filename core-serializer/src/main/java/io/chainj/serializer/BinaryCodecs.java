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
import io.chainj.common.exception.MalformedDataException;
import io.chainj.common.exception.TruncatedDataException;
import io.chainj.common.exception.TypeMismatchException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.util.*;
import java.util.function.IntFunction;

import static io.chainj.common.Checks.checkArgument;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Factory of {@link BinaryCodec}s for primitives, byte strings, enums, optionals and containers.
 * <p>
 * Multi-byte numbers are little-endian. Lengths and counts are written as {@link CompactSize},
 * codecs that are not given a {@link CompactSize} use {@link CompactSize#getDefault()}.
 * <p>
 * Hash-based containers have no inherent order, so their entries are written in ascending
 * unsigned lexicographic order of the encoded element (or key) bytes. Equal containers
 * therefore always produce equal bytes.
 * <p>
 * Elements of sequences, sets and maps occupy at least one byte each, so a count
 * that exceeds the remaining input fails with {@link TruncatedDataException} before anything is allocated.
 */
public final class BinaryCodecs {
	private static final Logger logger = LoggerFactory.getLogger(BinaryCodecs.class);

	/**
	 * Whether flag bytes other than {@code 0} and {@code 1} are rejected by default
	 */
	public static final boolean STRICT_BOOLEANS = ApplicationSettings.getBoolean(BinaryCodecs.class, "strictBooleans", false);

	private static final BinaryCodec<Boolean> BOOLEAN_CODEC = ofBoolean(STRICT_BOOLEANS);

	private static final BinaryCodec<Byte> BYTE_CODEC = BinaryCodec.of(
			(buf, item) -> buf.writeByte(item),
			item -> Byte.BYTES,
			ByteBuf::readByte);

	private static final BinaryCodec<Integer> UNSIGNED_BYTE_CODEC = BinaryCodec.of(
			(buf, item) -> {
				checkArgument(item >= 0 && item <= 0xFF, () -> "Value " + item + " does not fit an unsigned byte");
				buf.writeByte((byte) (int) item);
			},
			item -> Byte.BYTES,
			ByteBuf::readUnsignedByte);

	private static final BinaryCodec<Short> SHORT_CODEC = BinaryCodec.of(
			(buf, item) -> buf.writeShortLE(item),
			item -> Short.BYTES,
			ByteBuf::readShortLE);

	private static final BinaryCodec<Integer> UNSIGNED_SHORT_CODEC = BinaryCodec.of(
			(buf, item) -> {
				checkArgument(item >= 0 && item <= 0xFFFF, () -> "Value " + item + " does not fit an unsigned short");
				buf.writeShortLE((short) (int) item);
			},
			item -> Short.BYTES,
			ByteBuf::readUnsignedShortLE);

	private static final BinaryCodec<Integer> INT_CODEC = BinaryCodec.of(
			(buf, item) -> buf.writeIntLE(item),
			item -> Integer.BYTES,
			ByteBuf::readIntLE);

	private static final BinaryCodec<Long> UNSIGNED_INT_CODEC = BinaryCodec.of(
			(buf, item) -> {
				checkArgument(item >= 0 && item <= 0xFFFFFFFFL, () -> "Value " + item + " does not fit an unsigned int");
				buf.writeIntLE((int) (long) item);
			},
			item -> Integer.BYTES,
			ByteBuf::readUnsignedIntLE);

	private static final BinaryCodec<Long> LONG_CODEC = BinaryCodec.of(
			(buf, item) -> buf.writeLongLE(item),
			item -> Long.BYTES,
			ByteBuf::readLongLE);

	private static final BinaryCodec<Float> FLOAT_CODEC = BinaryCodec.of(
			(buf, item) -> buf.writeFloatLE(item),
			item -> Float.BYTES,
			ByteBuf::readFloatLE);

	private static final BinaryCodec<Double> DOUBLE_CODEC = BinaryCodec.of(
			(buf, item) -> buf.writeDoubleLE(item),
			item -> Double.BYTES,
			ByteBuf::readDoubleLE);

	private BinaryCodecs() {
	}

	// region primitives
	public static BinaryCodec<Boolean> ofBoolean() {
		return BOOLEAN_CODEC;
	}

	/**
	 * A single flag byte. A permissive codec reads any nonzero byte as {@code true},
	 * a strict one fails with {@link TypeMismatchException} on bytes other than {@code 0} and {@code 1}.
	 */
	public static BinaryCodec<Boolean> ofBoolean(boolean strict) {
		return BinaryCodec.of(
				(buf, item) -> buf.writeBoolean(item),
				item -> 1,
				buf -> readFlag(buf, strict));
	}

	public static BinaryCodec<Byte> ofByte() {
		return BYTE_CODEC;
	}

	public static BinaryCodec<Integer> ofUnsignedByte() {
		return UNSIGNED_BYTE_CODEC;
	}

	public static BinaryCodec<Short> ofShort() {
		return SHORT_CODEC;
	}

	public static BinaryCodec<Integer> ofUnsignedShort() {
		return UNSIGNED_SHORT_CODEC;
	}

	public static BinaryCodec<Integer> ofInt() {
		return INT_CODEC;
	}

	public static BinaryCodec<Long> ofUnsignedInt() {
		return UNSIGNED_INT_CODEC;
	}

	public static BinaryCodec<Long> ofLong() {
		return LONG_CODEC;
	}

	public static BinaryCodec<Float> ofFloat() {
		return FLOAT_CODEC;
	}

	public static BinaryCodec<Double> ofDouble() {
		return DOUBLE_CODEC;
	}
	// endregion

	// region variable-length integers
	/**
	 * @see VarInts
	 */
	public static BinaryCodec<Long> ofVarInt(VarIntType type) {
		return BinaryCodec.of(
				(buf, item) -> VarInts.write(buf, item, type),
				item -> VarInts.sizeOf(item, type),
				buf -> VarInts.read(buf, type));
	}

	public static BinaryCodec<Long> ofVarLong() {
		return ofVarInt(VarIntType.UINT64);
	}

	public static BinaryCodec<Long> ofCompactSize() {
		return ofCompactSize(CompactSize.getDefault());
	}

	public static BinaryCodec<Long> ofCompactSize(CompactSize compactSize) {
		return BinaryCodec.of(
				compactSize::write,
				CompactSize::sizeOf,
				compactSize::read);
	}
	// endregion

	// region byte strings
	/**
	 * Raw bytes of a length known to both sides, written with no length prefix
	 */
	public static BinaryCodec<byte[]> ofFixedBytes(int length) {
		checkArgument(length > 0, () -> "Length should be positive: " + length);
		return BinaryCodec.of(
				(buf, item) -> {
					checkArgument(item.length == length, () -> "Expected " + length + " bytes, got " + item.length);
					buf.put(item);
				},
				item -> length,
				buf -> buf.read(length));
	}

	public static BinaryCodec<byte[]> ofBytes() {
		return ofBytes(CompactSize.getDefault());
	}

	/**
	 * Length-prefixed raw bytes
	 */
	public static BinaryCodec<byte[]> ofBytes(CompactSize compactSize) {
		return BinaryCodec.of(
				(buf, item) -> {
					compactSize.write(buf, item.length);
					buf.put(item);
				},
				item -> CompactSize.sizeOf(item.length) + item.length,
				buf -> buf.read(compactSize.readCount(buf)));
	}

	public static BinaryCodec<String> ofString() {
		return ofString(CompactSize.getDefault());
	}

	/**
	 * Length-prefixed UTF-8 bytes of a string.
	 * A string with an unpaired surrogate cannot be encoded and bytes that are not valid UTF-8
	 * cannot be decoded, both fail with {@link MalformedDataException}.
	 */
	public static BinaryCodec<String> ofString(CompactSize compactSize) {
		return BinaryCodec.of(
				(buf, item) -> {
					byte[] bytes = encodeUtf8(item);
					compactSize.write(buf, bytes.length);
					buf.put(bytes);
				},
				item -> {
					int length = utf8Length(item);
					return CompactSize.sizeOf(length) + length;
				},
				buf -> decodeUtf8(buf.read(compactSize.readCount(buf))));
	}
	// endregion

	// region enums and optionals
	/**
	 * An enum constant written as its ordinal in a single byte
	 */
	public static <E extends Enum<E>> BinaryCodec<E> ofEnum(Class<E> enumType) {
		E[] values = enumType.getEnumConstants();
		checkArgument(values.length <= 0x100, () -> "Enum " + enumType.getName() + " has too many constants");
		return BinaryCodec.of(
				(buf, item) -> buf.writeByte((byte) item.ordinal()),
				item -> 1,
				buf -> {
					int ordinal = buf.readUnsignedByte();
					if (ordinal >= values.length) {
						throw typeMismatch("Unknown ordinal " + ordinal + " of " + enumType.getSimpleName());
					}
					return values[ordinal];
				});
	}

	public static <T> BinaryCodec<Optional<T>> ofOptional(BinaryCodec<T> codec) {
		return ofOptional(codec, STRICT_BOOLEANS);
	}

	/**
	 * A presence flag byte followed by the value, if present
	 *
	 * @see #ofBoolean(boolean)
	 */
	public static <T> BinaryCodec<Optional<T>> ofOptional(BinaryCodec<T> codec, boolean strict) {
		return BinaryCodec.of(
				(buf, item) -> {
					buf.writeBoolean(item.isPresent());
					if (item.isPresent()) {
						codec.encode(buf, item.get());
					}
				},
				item -> item.isPresent() ? 1 + codec.sizeOf(item.get()) : 1,
				buf -> readFlag(buf, strict) ? Optional.of(codec.decode(buf)) : Optional.empty());
	}

	/**
	 * Same format as {@link #ofOptional(BinaryCodec)}, with {@code null} for an absent value
	 */
	public static <T> BinaryCodec<T> ofNullable(BinaryCodec<T> codec) {
		return BinaryCodec.of(
				(buf, item) -> {
					buf.writeBoolean(item != null);
					if (item != null) {
						codec.encode(buf, item);
					}
				},
				item -> item != null ? 1 + codec.sizeOf(item) : 1,
				buf -> readFlag(buf, STRICT_BOOLEANS) ? codec.decode(buf) : null);
	}
	// endregion

	// region sequences
	public static <T> BinaryCodec<List<T>> ofList(BinaryCodec<T> itemCodec) {
		return ofList(itemCodec, CompactSize.getDefault());
	}

	public static <T> BinaryCodec<List<T>> ofList(BinaryCodec<T> itemCodec, CompactSize compactSize) {
		return ofCollection(itemCodec, ArrayList::new, compactSize);
	}

	/**
	 * A count followed by the elements in iteration order of the collection
	 */
	public static <T, C extends Collection<T>> BinaryCodec<C> ofCollection(BinaryCodec<T> itemCodec,
			IntFunction<C> factory, CompactSize compactSize) {
		return BinaryCodec.of(
				(buf, item) -> {
					compactSize.write(buf, item.size());
					for (T element : item) {
						itemCodec.encode(buf, element);
					}
				},
				item -> sizeOfElements(itemCodec, item),
				buf -> {
					int count = readCount(buf, compactSize);
					C collection = factory.apply(count);
					for (int i = 0; i < count; i++) {
						collection.add(itemCodec.decode(buf));
					}
					return collection;
				});
	}

	public static <T extends Comparable<? super T>> BinaryCodec<NavigableSet<T>> ofSortedSet(BinaryCodec<T> itemCodec) {
		return ofSortedSet(itemCodec, Comparator.naturalOrder(), CompactSize.getDefault());
	}

	/**
	 * A count followed by the elements in the order of a comparator
	 */
	public static <T> BinaryCodec<NavigableSet<T>> ofSortedSet(BinaryCodec<T> itemCodec,
			Comparator<? super T> comparator, CompactSize compactSize) {
		return BinaryCodec.of(
				(buf, item) -> {
					compactSize.write(buf, item.size());
					for (T element : item) {
						itemCodec.encode(buf, element);
					}
				},
				item -> sizeOfElements(itemCodec, item),
				buf -> decodeSet(buf, itemCodec, compactSize, $ -> new TreeSet<>(comparator)));
	}

	public static <T> BinaryCodec<Set<T>> ofHashSet(BinaryCodec<T> itemCodec) {
		return ofHashSet(itemCodec, CompactSize.getDefault());
	}

	/**
	 * A count followed by the elements in ascending order of their encoded bytes
	 */
	public static <T> BinaryCodec<Set<T>> ofHashSet(BinaryCodec<T> itemCodec, CompactSize compactSize) {
		return BinaryCodec.of(
				(buf, item) -> {
					compactSize.write(buf, item.size());
					List<byte[]> encoded = new ArrayList<>(item.size());
					for (T element : item) {
						encoded.add(itemCodec.toByteArray(element));
					}
					encoded.sort(Arrays::compareUnsigned);
					for (byte[] bytes : encoded) {
						buf.put(bytes);
					}
				},
				item -> sizeOfElements(itemCodec, item),
				buf -> decodeSet(buf, itemCodec, compactSize, HashSet::new));
	}
	// endregion

	// region maps
	public static <K extends Comparable<? super K>, V> BinaryCodec<NavigableMap<K, V>> ofSortedMap(
			BinaryCodec<K> keyCodec, BinaryCodec<V> valueCodec) {
		return ofSortedMap(keyCodec, valueCodec, Comparator.naturalOrder(), CompactSize.getDefault());
	}

	/**
	 * A count followed by key-value pairs in the order of a comparator of keys
	 */
	public static <K, V> BinaryCodec<NavigableMap<K, V>> ofSortedMap(BinaryCodec<K> keyCodec, BinaryCodec<V> valueCodec,
			Comparator<? super K> comparator, CompactSize compactSize) {
		return BinaryCodec.of(
				(buf, item) -> {
					compactSize.write(buf, item.size());
					for (Map.Entry<K, V> entry : item.entrySet()) {
						keyCodec.encode(buf, entry.getKey());
						valueCodec.encode(buf, entry.getValue());
					}
				},
				item -> sizeOfEntries(keyCodec, valueCodec, item),
				buf -> decodeMap(buf, keyCodec, valueCodec, compactSize, $ -> new TreeMap<>(comparator)));
	}

	public static <K, V> BinaryCodec<Map<K, V>> ofHashMap(BinaryCodec<K> keyCodec, BinaryCodec<V> valueCodec) {
		return ofHashMap(keyCodec, valueCodec, CompactSize.getDefault());
	}

	/**
	 * A count followed by key-value pairs in ascending order of encoded key bytes
	 */
	public static <K, V> BinaryCodec<Map<K, V>> ofHashMap(BinaryCodec<K> keyCodec, BinaryCodec<V> valueCodec,
			CompactSize compactSize) {
		return BinaryCodec.of(
				(buf, item) -> {
					compactSize.write(buf, item.size());
					List<EncodedKey<V>> encoded = new ArrayList<>(item.size());
					for (Map.Entry<K, V> entry : item.entrySet()) {
						encoded.add(new EncodedKey<>(keyCodec.toByteArray(entry.getKey()), entry.getValue()));
					}
					encoded.sort((a, b) -> Arrays.compareUnsigned(a.key, b.key));
					for (EncodedKey<V> entry : encoded) {
						buf.put(entry.key);
						valueCodec.encode(buf, entry.value);
					}
				},
				item -> sizeOfEntries(keyCodec, valueCodec, item),
				buf -> decodeMap(buf, keyCodec, valueCodec, compactSize, HashMap::new));
	}
	// endregion

	private static boolean readFlag(ByteBuf buf, boolean strict) throws CodecException {
		int b = buf.readUnsignedByte();
		if (strict && b > 1) {
			throw typeMismatch("Invalid flag byte " + b);
		}
		return b != 0;
	}

	/**
	 * Reads a count of elements, each element occupies at least one byte
	 */
	private static int readCount(ByteBuf buf, CompactSize compactSize) throws CodecException {
		int count = compactSize.readCount(buf);
		if (count > buf.readRemaining()) {
			logger.trace("Count {} exceeds {} remaining bytes", count, buf.readRemaining());
			throw new TruncatedDataException("Count " + count + " exceeds " + buf.readRemaining() + " remaining bytes");
		}
		return count;
	}

	private static byte[] encodeUtf8(String s) throws MalformedDataException {
		try {
			ByteBuffer encoded = UTF_8.newEncoder()
					.onMalformedInput(CodingErrorAction.REPORT)
					.onUnmappableCharacter(CodingErrorAction.REPORT)
					.encode(CharBuffer.wrap(s));
			byte[] bytes = new byte[encoded.remaining()];
			encoded.get(bytes);
			return bytes;
		} catch (CharacterCodingException e) {
			throw malformed("String is not valid UTF-16: " + e);
		}
	}

	private static String decodeUtf8(byte[] bytes) throws MalformedDataException {
		try {
			return UTF_8.newDecoder()
					.onMalformedInput(CodingErrorAction.REPORT)
					.onUnmappableCharacter(CodingErrorAction.REPORT)
					.decode(ByteBuffer.wrap(bytes))
					.toString();
		} catch (CharacterCodingException e) {
			throw malformed("Bytes are not valid UTF-8: " + e);
		}
	}

	private static <T> long sizeOfElements(BinaryCodec<T> itemCodec, Collection<T> collection) {
		long size = CompactSize.sizeOf(collection.size());
		for (T element : collection) {
			size += itemCodec.sizeOf(element);
		}
		return size;
	}

	private static <K, V> long sizeOfEntries(BinaryCodec<K> keyCodec, BinaryCodec<V> valueCodec, Map<K, V> map) {
		long size = CompactSize.sizeOf(map.size());
		for (Map.Entry<K, V> entry : map.entrySet()) {
			size += keyCodec.sizeOf(entry.getKey());
			size += valueCodec.sizeOf(entry.getValue());
		}
		return size;
	}

	private static <T, S extends Set<T>> S decodeSet(ByteBuf buf, BinaryCodec<T> itemCodec, CompactSize compactSize,
			IntFunction<S> factory) throws CodecException {
		int count = readCount(buf, compactSize);
		S set = factory.apply(count);
		for (int i = 0; i < count; i++) {
			T element = itemCodec.decode(buf);
			if (!set.add(element)) {
				throw malformed("Duplicate set element " + element);
			}
		}
		return set;
	}

	private static <K, V, M extends Map<K, V>> M decodeMap(ByteBuf buf, BinaryCodec<K> keyCodec, BinaryCodec<V> valueCodec,
			CompactSize compactSize, IntFunction<M> factory) throws CodecException {
		int count = readCount(buf, compactSize);
		M map = factory.apply(count);
		for (int i = 0; i < count; i++) {
			K key = keyCodec.decode(buf);
			V value = valueCodec.decode(buf);
			if (map.containsKey(key)) {
				throw malformed("Duplicate map key " + key);
			}
			map.put(key, value);
		}
		return map;
	}

	static int utf8Length(String s) {
		int length = 0;
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (c < 0x80) {
				length += 1;
			} else if (c < 0x800) {
				length += 2;
			} else if (Character.isHighSurrogate(c) && i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1))) {
				length += 4;
				i++;
			} else {
				length += 3;
			}
		}
		return length;
	}

	private static TypeMismatchException typeMismatch(@NotNull String message) {
		logger.trace(message);
		return new TypeMismatchException(message);
	}

	private static MalformedDataException malformed(@NotNull String message) {
		logger.trace(message);
		return new MalformedDataException(message);
	}

	private record EncodedKey<V>(byte[] key, V value) {
	}
}
