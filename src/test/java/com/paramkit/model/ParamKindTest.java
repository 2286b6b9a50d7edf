package com.paramkit.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ParamKind.
 */
class ParamKindTest {

    @Test
    void testLabelsMatchManifestElementNames() {
        assertThat(ParamKind.BOOLEAN.getLabel()).isEqualTo("boolean");
        assertThat(ParamKind.STRING_VECTOR.getLabel()).isEqualTo("string-vector");
        assertThat(ParamKind.DOUBLE_ENUMERATION.getLabel()).isEqualTo("double-enumeration");
        assertThat(ParamKind.FILE.getLabel()).isEqualTo("file");
    }

    @Test
    void testFromLabel() {
        assertThat(ParamKind.fromLabel("region")).contains(ParamKind.REGION);
        assertThat(ParamKind.fromLabel("integer-vector")).contains(ParamKind.INTEGER_VECTOR);
        assertThat(ParamKind.fromLabel("quaternion")).isEmpty();
    }

    @Test
    void testLabelsAreUnique() {
        for (ParamKind kind : ParamKind.values()) {
            assertThat(ParamKind.fromLabel(kind.getLabel())).contains(kind);
        }
    }

    @Test
    void testDecorations() {
        assertThat(ParamKind.FILE.supports(ParamDecoration.FILE_EXTENSIONS)).isTrue();
        assertThat(ParamKind.FILE.supports(ParamDecoration.TYPE)).isFalse();
        assertThat(ParamKind.IMAGE.supports(ParamDecoration.TYPE)).isTrue();
        assertThat(ParamKind.POINT.supports(ParamDecoration.COORDINATE_SYSTEM)).isTrue();
        assertThat(ParamKind.STRING_ENUMERATION.supports(ParamDecoration.ENUMERATION)).isTrue();
        assertThat(ParamKind.DOUBLE.supports(ParamDecoration.RANGE)).isTrue();
        assertThat(ParamKind.INTEGER.supports(ParamDecoration.RANGE)).isFalse();
        assertThat(ParamKind.DIRECTORY.supports(ParamDecoration.FILE_EXTENSIONS)).isFalse();
    }

    @Test
    void testOnlyBooleanToggles() {
        assertThat(ParamKind.BOOLEAN.isBoolean()).isTrue();
        assertThat(ParamKind.INTEGER.isBoolean()).isFalse();
        assertThat(ParamKind.STRING.isBoolean()).isFalse();
    }
}
