package com.paramkit.model;

import com.paramkit.codec.ValueCodec;

/**
 * A native value together with the codec that owns its text form.
 *
 * Typed access through a different codec goes through the canonical text, so a
 * value can be read or written with any static type without a cast.
 */
final class ParamValue<T> {

    private final ValueCodec<T> codec;
    private T value;

    private ParamValue(ValueCodec<T> codec, T value) {
        this.codec = codec;
        this.value = value;
    }

    static <T> ParamValue<T> initial(ValueCodec<T> codec) {
        return new ParamValue<>(codec, codec.decode(""));
    }

    String getText() {
        return codec.encode(value);
    }

    void setText(String text) {
        value = codec.decode(text);
    }

    <U> U read(ValueCodec<U> target) {
        return target.decode(getText());
    }

    <U> void write(ValueCodec<U> source, U newValue) {
        setText(source.encode(newValue));
    }
}
