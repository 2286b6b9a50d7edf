package com.paramkit.codec;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The codecs for every value type a parameter can hold.
 *
 * Sequences are written as comma-joined scalar text. When reading, an empty text is an
 * empty sequence and a trailing empty item is dropped, so neither empty strings at the
 * end of a string sequence nor items containing commas survive a round trip.
 */
@UtilityClass
public class ValueCodecs {

    public static final String SEQUENCE_DELIMITER = ",";

    public static final ValueCodec<Boolean> BOOLEAN = ValueCodec.of("boolean",
            value -> Boolean.TRUE.equals(value) ? "true" : "false",
            ScalarText::parseBoolean);

    public static final ValueCodec<Integer> INTEGER = ValueCodec.of("integer",
            value -> Integer.toString(value == null ? 0 : value),
            ScalarText::parseInt);

    public static final ValueCodec<Float> FLOAT = ValueCodec.of("float",
            value -> Float.toString(value == null ? 0.0f : value),
            ScalarText::parseFloat);

    public static final ValueCodec<Double> DOUBLE = ValueCodec.of("double",
            value -> Double.toString(value == null ? 0.0 : value),
            ScalarText::parseDouble);

    public static final ValueCodec<String> STRING = ValueCodec.of("string",
            value -> value == null ? "" : value,
            text -> text);

    public static final ValueCodec<List<Integer>> INTEGER_LIST = listOf(INTEGER);

    public static final ValueCodec<List<Float>> FLOAT_LIST = listOf(FLOAT);

    public static final ValueCodec<List<Double>> DOUBLE_LIST = listOf(DOUBLE);

    public static final ValueCodec<List<String>> STRING_LIST = listOf(STRING);

    /**
     * Builds a comma-separated sequence codec on top of a scalar codec.
     */
    public static <E> ValueCodec<List<E>> listOf(ValueCodec<E> element) {
        return ValueCodec.of(element.getName() + "-list",
                values -> encodeList(values, element::encode),
                text -> decodeList(text, element::decode));
    }

    private static <E> String encodeList(List<E> values, Function<E, String> encoder) {
        if (values == null || values.isEmpty()) {
            return "";
        }
        return values.stream().map(encoder).collect(Collectors.joining(SEQUENCE_DELIMITER));
    }

    private static <E> List<E> decodeList(String text, Function<String, E> decoder) {
        List<E> values = new ArrayList<>();
        if (text.isEmpty()) {
            return values;
        }
        String[] items = text.split(SEQUENCE_DELIMITER, -1);
        int count = items[items.length - 1].isEmpty() ? items.length - 1 : items.length;
        for (int i = 0; i < count; i++) {
            values.add(decoder.apply(items[i]));
        }
        return values;
    }
}
