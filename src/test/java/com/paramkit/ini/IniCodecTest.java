package com.paramkit.ini;

import com.paramkit.codec.ValueCodecs;
import com.paramkit.model.ParamAddress;
import com.paramkit.model.ParamKind;
import com.paramkit.model.ParamRecord;
import com.paramkit.registry.ParamRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for IniCodec.
 */
class IniCodecTest {

    @TempDir
    Path tempDir;

    private ParamRegistry registry;
    private IniCodec codec;

    @BeforeEach
    void setUp() {
        registry = new ParamRegistry();
        codec = new IniCodec(registry, "Global");
    }

    private ParamRecord declare(String section, String key, ParamKind kind) {
        return registry.insertOrReplace(section, key, new ParamRecord(kind));
    }

    @Test
    void testSerialize() {
        declare("Basic Types", "Bool Param", ParamKind.BOOLEAN).setText("true");
        declare("Basic Types", "Count", ParamKind.INTEGER).setText("12");
        declare("Vector Types", "Double Vec", ParamKind.DOUBLE_VECTOR).setText("1,2,3,4");

        assertThat(codec.serialize()).isEqualTo(
                "[Basic Types]\n\n"
                        + "Bool Param = true\n"
                        + "Count = 12\n\n"
                        + "[Vector Types]\n\n"
                        + "Double Vec = 1.0,2.0,3.0,4.0\n\n");
    }

    @Test
    void testSerializeEmptyRegistry() {
        assertThat(codec.serialize()).isEmpty();
    }

    @Test
    void testParseSkipsCommentsAndShortLines() {
        ParamRecord count = declare("Basic", "Count", ParamKind.INTEGER);

        IniParseResult result = codec.parse(String.join("\n",
                "# Count = 99",
                "",
                "x",
                "   ",
                "[Basic]",
                "Count=  5  "));

        assertThat(count.getText()).isEqualTo("5");
        assertThat(result.getAppliedCount()).isEqualTo(1);
        assertThat(result.hasErrors()).isFalse();
    }

    @Test
    void testParseWindowsLineEndings() {
        ParamRecord name = declare("Basic", "Name", ParamKind.STRING);

        codec.parse("[Basic]\r\nName = Bruce Wayne\r\n");

        assertThat(name.getText()).isEqualTo("Bruce Wayne");
    }

    @Test
    void testLinesBeforeHeaderUseDefaultSection() {
        ParamRecord global = declare("Global", "Verbose", ParamKind.BOOLEAN);

        codec.parse("Verbose = yes\n");

        assertThat(global.getValue(ValueCodecs.BOOLEAN)).isTrue();
    }

    @Test
    void testValueMayContainEquals() {
        ParamRecord expr = declare("Basic", "Expr", ParamKind.STRING);

        codec.parse("[Basic]\nExpr = a=b\n");

        assertThat(expr.getText()).isEqualTo("a=b");
    }

    @Test
    void testUndeclaredKeyIsReportedAndSkipped() {
        IniParseResult result = codec.parse("[Basic]\nGhost = 1\n");

        assertThat(result.getUnknownKeys()).containsExactly(new ParamAddress("Basic", "Ghost"));
        assertThat(result.hasUnknownKeys()).isTrue();
        assertThat(result.getAppliedCount()).isZero();
        assertThat(registry.contains("Basic", "Ghost")).isFalse();
    }

    @Test
    void testMalformedLineIsAnError() {
        declare("Basic", "Count", ParamKind.INTEGER);

        IniParseResult result = codec.parse("[Basic]\nCount 5\n");

        assertThat(result.getErrors()).hasSize(1);
        assertThat(result.getErrors().get(0)).startsWith("Line 2:");
    }

    @Test
    void testSaveLoadRoundTrip() throws Exception {
        ParamRecord flag = declare("Basic Types", "Bool Param", ParamKind.BOOLEAN);
        ParamRecord ratio = declare("Basic Types", "Ratio", ParamKind.DOUBLE);
        ParamRecord words = declare("Vector Types", "Words", ParamKind.STRING_VECTOR);
        ParamRecord file = declare("Special", "File", ParamKind.FILE);
        flag.setValue(ValueCodecs.BOOLEAN, true);
        ratio.setValue(ValueCodecs.DOUBLE, 1.0 / 3);
        words.setValue(ValueCodecs.STRING_LIST, List.of("alpha", "beta"));
        file.setText("/tmp/input file.txt");
        Path ini = tempDir.resolve("params.ini");

        codec.save(ini);
        String saved = Files.readString(ini);

        flag.setText("false");
        ratio.setText("0");
        words.setText("");
        file.setText("");

        assertThat(codec.load(ini)).isTrue();
        assertThat(flag.getText()).isEqualTo("true");
        assertThat(ratio.getValue(ValueCodecs.DOUBLE)).isEqualTo(1.0 / 3);
        assertThat(words.getValue(ValueCodecs.STRING_LIST)).containsExactly("alpha", "beta");
        assertThat(file.getText()).isEqualTo("/tmp/input file.txt");
        assertThat(codec.serialize()).isEqualTo(saved);
    }

    @Test
    void testLoadMissingFile() {
        ParamRecord count = declare("Basic", "Count", ParamKind.INTEGER);
        count.setText("4");

        assertThat(codec.load(tempDir.resolve("absent.ini"))).isFalse();
        assertThat(codec.load(tempDir)).isFalse();
        assertThat(count.getText()).isEqualTo("4");
    }
}
