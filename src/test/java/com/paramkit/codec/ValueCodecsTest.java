package com.paramkit.codec;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the value codecs and lenient scalar parsing.
 */
class ValueCodecsTest {

    @ParameterizedTest
    @CsvSource({
        "true, true",
        "yes, true",
        "TRUE, true",
        "false, false",
        "no, false",
        "1, true",
        "7, true",
        "0, false",
        "-3, false",
        "garbage, false"
    })
    void testDecodeBoolean(String text, boolean expected) {
        assertThat(ValueCodecs.BOOLEAN.decode(text)).isEqualTo(expected);
    }

    @Test
    void testEncodeBoolean() {
        assertThat(ValueCodecs.BOOLEAN.encode(true)).isEqualTo("true");
        assertThat(ValueCodecs.BOOLEAN.encode(false)).isEqualTo("false");
    }

    @ParameterizedTest
    @CsvSource({
        "42, 42",
        "'  -17', -17",
        "+5, 5",
        "12abc, 12",
        "abc, 0",
        "'', 0",
        "99999999999, 0"
    })
    void testDecodeIntegerIsLenient(String text, int expected) {
        assertThat(ValueCodecs.INTEGER.decode(text)).isEqualTo(expected);
    }

    @Test
    void testDecodeDouble() {
        assertThat(ValueCodecs.DOUBLE.decode("0.333")).isEqualTo(0.333);
        assertThat(ValueCodecs.DOUBLE.decode("1e3")).isEqualTo(1000.0);
        assertThat(ValueCodecs.DOUBLE.decode(".5")).isEqualTo(0.5);
        assertThat(ValueCodecs.DOUBLE.decode("2.5 meters")).isEqualTo(2.5);
        assertThat(ValueCodecs.DOUBLE.decode("n/a")).isEqualTo(0.0);
    }

    @Test
    void testScalarRoundTrip() {
        for (double d : new double[] {0.0, -0.0, 0.333, 1.0 / 3, 1e-300, Double.MAX_VALUE, Double.NaN,
                Double.NEGATIVE_INFINITY}) {
            assertThat(ValueCodecs.DOUBLE.decode(ValueCodecs.DOUBLE.encode(d))).isEqualTo(d);
        }
        for (float f : new float[] {0.1f, -2.75f, 3.4e38f, Float.POSITIVE_INFINITY}) {
            assertThat(ValueCodecs.FLOAT.decode(ValueCodecs.FLOAT.encode(f))).isEqualTo(f);
        }
        for (int n : new int[] {0, -1, Integer.MAX_VALUE, Integer.MIN_VALUE}) {
            assertThat(ValueCodecs.INTEGER.decode(ValueCodecs.INTEGER.encode(n))).isEqualTo(n);
        }
        assertThat(ValueCodecs.STRING.decode(ValueCodecs.STRING.encode("Bruce Wayne"))).isEqualTo("Bruce Wayne");
    }

    @Test
    void testListsAreCommaJoined() {
        assertThat(ValueCodecs.INTEGER_LIST.encode(List.of(1, 2, 3))).isEqualTo("1,2,3");
        assertThat(ValueCodecs.DOUBLE_LIST.encode(List.of(0.5, 2.0))).isEqualTo("0.5,2.0");
        assertThat(ValueCodecs.STRING_LIST.encode(List.of())).isEmpty();
    }

    @Test
    void testDecodeLists() {
        assertThat(ValueCodecs.DOUBLE_LIST.decode("1,2,3,4")).containsExactly(1.0, 2.0, 3.0, 4.0);
        assertThat(ValueCodecs.INTEGER_LIST.decode("1, 2,x")).containsExactly(1, 2, 0);
        assertThat(ValueCodecs.STRING_LIST.decode("a,,b")).containsExactly("a", "", "b");
        assertThat(ValueCodecs.STRING_LIST.decode("a,b,")).containsExactly("a", "b");
        assertThat(ValueCodecs.FLOAT_LIST.decode("")).isEmpty();
    }

    @Test
    void testListRoundTrip() {
        List<Float> floats = List.of(0.1f, -1.5f, 100.0f);
        assertThat(ValueCodecs.FLOAT_LIST.decode(ValueCodecs.FLOAT_LIST.encode(floats))).isEqualTo(floats);

        List<String> words = List.of("left", "", "right");
        assertThat(ValueCodecs.STRING_LIST.decode(ValueCodecs.STRING_LIST.encode(words))).isEqualTo(words);
    }

    @Test
    void testDecodeNullIsZero() {
        assertThat(ValueCodecs.INTEGER.decode(null)).isZero();
        assertThat(ValueCodecs.STRING.decode(null)).isEmpty();
    }
}
