package com.paramkit.codec;

import java.util.function.Function;

/**
 * Bidirectional conversion between a typed value and its canonical text form.
 *
 * Implementations must satisfy {@code decode(encode(v)).equals(v)} for every value
 * they can represent. Decoding never fails: text that does not describe a value
 * yields the type's zero value.
 *
 * @param <T> the native value type
 */
public interface ValueCodec<T> {

    /**
     * Short name of the value type, e.g. "double" or "integer-list".
     */
    String getName();

    String encode(T value);

    T decode(String text);

    static <T> ValueCodec<T> of(String name, Function<T, String> encoder, Function<String, T> decoder) {
        return new ValueCodec<>() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public String encode(T value) {
                return encoder.apply(value);
            }

            @Override
            public T decode(String text) {
                return decoder.apply(text == null ? "" : text);
            }

            @Override
            public String toString() {
                return "ValueCodec[" + name + "]";
            }
        };
    }
}
