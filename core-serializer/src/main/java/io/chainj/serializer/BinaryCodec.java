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
import io.chainj.common.tuple.*;

import java.util.List;
import java.util.function.Function;
import java.util.function.ToLongFunction;

/**
 * A codec of values of type {@code T} that is able to compute
 * the exact serialized size of a value without serializing it.
 * <p>
 * Records are composed out of their fields' codecs with {@code create(...)} methods,
 * fields are written one after another in declaration order, with no framing or tags.
 */
public interface BinaryCodec<T> extends BinaryEncoder<T>, BinaryDecoder<T> {

	static <T> BinaryCodec<T> of(BinaryEncoder<? super T> encoder, BinaryDecoder<? extends T> decoder) {
		return new BinaryCodec<>() {
			@Override
			public void encode(ByteBuf buf, T item) throws CodecException {
				encoder.encode(buf, item);
			}

			@Override
			public long sizeOf(T item) {
				return encoder.sizeOf(item);
			}

			@Override
			public T decode(ByteBuf buf) throws CodecException {
				return decoder.decode(buf);
			}
		};
	}

	static <T> BinaryCodec<T> of(Writer<T> writer, ToLongFunction<T> sizer, BinaryDecoder<? extends T> decoder) {
		return of(BinaryEncoder.of(writer, sizer), decoder);
	}

	static <T1, T> BinaryCodec<T> create(TupleConstructor1<T1, T> constructor1,
			Function<T, T1> getter1, BinaryCodec<T1> codec1
	) {
		return BinaryCodec.of(
				(buf, item) -> codec1.encode(buf, getter1.apply(item)),
				item -> codec1.sizeOf(getter1.apply(item)),
				buf -> constructor1.create(codec1.decode(buf))
		);
	}

	static <T1, T2, T> BinaryCodec<T> create(TupleConstructor2<T1, T2, T> constructor2,
			Function<T, T1> getter1, BinaryCodec<T1> codec1,
			Function<T, T2> getter2, BinaryCodec<T2> codec2
	) {
		return BinaryCodec.of(
				(buf, item) -> {
					codec1.encode(buf, getter1.apply(item));
					codec2.encode(buf, getter2.apply(item));
				},
				item ->
						codec1.sizeOf(getter1.apply(item))
							+ codec2.sizeOf(getter2.apply(item)),
				buf -> constructor2.create(
						codec1.decode(buf),
						codec2.decode(buf)
				)
		);
	}

	static <T1, T2, T3, T> BinaryCodec<T> create(TupleConstructor3<T1, T2, T3, T> constructor3,
			Function<T, T1> getter1, BinaryCodec<T1> codec1,
			Function<T, T2> getter2, BinaryCodec<T2> codec2,
			Function<T, T3> getter3, BinaryCodec<T3> codec3
	) {
		return BinaryCodec.of(
				(buf, item) -> {
					codec1.encode(buf, getter1.apply(item));
					codec2.encode(buf, getter2.apply(item));
					codec3.encode(buf, getter3.apply(item));
				},
				item ->
						codec1.sizeOf(getter1.apply(item))
							+ codec2.sizeOf(getter2.apply(item))
							+ codec3.sizeOf(getter3.apply(item)),
				buf -> constructor3.create(
						codec1.decode(buf),
						codec2.decode(buf),
						codec3.decode(buf)
				)
		);
	}

	static <T1, T2, T3, T4, T> BinaryCodec<T> create(TupleConstructor4<T1, T2, T3, T4, T> constructor4,
			Function<T, T1> getter1, BinaryCodec<T1> codec1,
			Function<T, T2> getter2, BinaryCodec<T2> codec2,
			Function<T, T3> getter3, BinaryCodec<T3> codec3,
			Function<T, T4> getter4, BinaryCodec<T4> codec4
	) {
		return BinaryCodec.of(
				(buf, item) -> {
					codec1.encode(buf, getter1.apply(item));
					codec2.encode(buf, getter2.apply(item));
					codec3.encode(buf, getter3.apply(item));
					codec4.encode(buf, getter4.apply(item));
				},
				item ->
						codec1.sizeOf(getter1.apply(item))
							+ codec2.sizeOf(getter2.apply(item))
							+ codec3.sizeOf(getter3.apply(item))
							+ codec4.sizeOf(getter4.apply(item)),
				buf -> constructor4.create(
						codec1.decode(buf),
						codec2.decode(buf),
						codec3.decode(buf),
						codec4.decode(buf)
				)
		);
	}

	static <T1, T2, T3, T4, T5, T> BinaryCodec<T> create(TupleConstructor5<T1, T2, T3, T4, T5, T> constructor5,
			Function<T, T1> getter1, BinaryCodec<T1> codec1,
			Function<T, T2> getter2, BinaryCodec<T2> codec2,
			Function<T, T3> getter3, BinaryCodec<T3> codec3,
			Function<T, T4> getter4, BinaryCodec<T4> codec4,
			Function<T, T5> getter5, BinaryCodec<T5> codec5
	) {
		return BinaryCodec.of(
				(buf, item) -> {
					codec1.encode(buf, getter1.apply(item));
					codec2.encode(buf, getter2.apply(item));
					codec3.encode(buf, getter3.apply(item));
					codec4.encode(buf, getter4.apply(item));
					codec5.encode(buf, getter5.apply(item));
				},
				item ->
						codec1.sizeOf(getter1.apply(item))
							+ codec2.sizeOf(getter2.apply(item))
							+ codec3.sizeOf(getter3.apply(item))
							+ codec4.sizeOf(getter4.apply(item))
							+ codec5.sizeOf(getter5.apply(item)),
				buf -> constructor5.create(
						codec1.decode(buf),
						codec2.decode(buf),
						codec3.decode(buf),
						codec4.decode(buf),
						codec5.decode(buf)
				)
		);
	}

	static <T1, T2, T3, T4, T5, T6, T> BinaryCodec<T> create(TupleConstructor6<T1, T2, T3, T4, T5, T6, T> constructor6,
			Function<T, T1> getter1, BinaryCodec<T1> codec1,
			Function<T, T2> getter2, BinaryCodec<T2> codec2,
			Function<T, T3> getter3, BinaryCodec<T3> codec3,
			Function<T, T4> getter4, BinaryCodec<T4> codec4,
			Function<T, T5> getter5, BinaryCodec<T5> codec5,
			Function<T, T6> getter6, BinaryCodec<T6> codec6
	) {
		return BinaryCodec.of(
				(buf, item) -> {
					codec1.encode(buf, getter1.apply(item));
					codec2.encode(buf, getter2.apply(item));
					codec3.encode(buf, getter3.apply(item));
					codec4.encode(buf, getter4.apply(item));
					codec5.encode(buf, getter5.apply(item));
					codec6.encode(buf, getter6.apply(item));
				},
				item ->
						codec1.sizeOf(getter1.apply(item))
							+ codec2.sizeOf(getter2.apply(item))
							+ codec3.sizeOf(getter3.apply(item))
							+ codec4.sizeOf(getter4.apply(item))
							+ codec5.sizeOf(getter5.apply(item))
							+ codec6.sizeOf(getter6.apply(item)),
				buf -> constructor6.create(
						codec1.decode(buf),
						codec2.decode(buf),
						codec3.decode(buf),
						codec4.decode(buf),
						codec5.decode(buf),
						codec6.decode(buf)
				)
		);
	}

	static <T> BinaryCodec<T> create(TupleConstructorN<T> constructorN,
			List<CodecAndGetter<T, ?>> codecsAndGetters
	) {
		//noinspection unchecked
		CodecAndGetter<T, Object>[] codecsAndGettersArray = codecsAndGetters.toArray(CodecAndGetter[]::new);
		return BinaryCodec.of(
				(buf, item) -> {
					for (CodecAndGetter<T, Object> codecAndGetter : codecsAndGettersArray) {
						codecAndGetter.codec.encode(buf, codecAndGetter.getter.apply(item));
					}
				},
				item -> {
					long size = 0;
					for (CodecAndGetter<T, Object> codecAndGetter : codecsAndGettersArray) {
						size += codecAndGetter.codec.sizeOf(codecAndGetter.getter.apply(item));
					}
					return size;
				},
				buf -> {
					Object[] args = new Object[codecsAndGettersArray.length];
					for (int i = 0; i < codecsAndGettersArray.length; i++) {
						args[i] = codecsAndGettersArray[i].codec.decode(buf);
					}
					return constructorN.create(args);
				}
		);
	}

	/**
	 * Maps values of this codec to values of another type and back
	 */
	default <R> BinaryCodec<R> transform(Function<T, R> to, Function<R, T> from) {
		BinaryCodec<T> self = this;
		return BinaryCodec.of(
				(buf, item) -> self.encode(buf, from.apply(item)),
				item -> self.sizeOf(from.apply(item)),
				buf -> to.apply(self.decode(buf))
		);
	}

	record CodecAndGetter<T, U>(BinaryCodec<U> codec, Function<T, U> getter) {
	}
}
