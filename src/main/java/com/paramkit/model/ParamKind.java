package com.paramkit.model;

import com.paramkit.codec.ValueCodec;
import com.paramkit.codec.ValueCodecs;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * The closed set of parameter kinds.
 *
 * A kind fixes the native value type of a parameter (through its codec), the element
 * name used in the XML manifest and the decorations a declaration may attach.
 * New kinds are added here.
 */
public enum ParamKind {

    BOOLEAN("boolean", ValueCodecs.BOOLEAN),
    INTEGER("integer", ValueCodecs.INTEGER),
    FLOAT("float", ValueCodecs.FLOAT),
    DOUBLE("double", ValueCodecs.DOUBLE, ParamDecoration.RANGE),
    STRING("string", ValueCodecs.STRING),

    INTEGER_VECTOR("integer-vector", ValueCodecs.INTEGER_LIST),
    FLOAT_VECTOR("float-vector", ValueCodecs.FLOAT_LIST),
    DOUBLE_VECTOR("double-vector", ValueCodecs.DOUBLE_LIST),
    STRING_VECTOR("string-vector", ValueCodecs.STRING_LIST),

    INTEGER_ENUMERATION("integer-enumeration", ValueCodecs.INTEGER, ParamDecoration.ENUMERATION),
    FLOAT_ENUMERATION("float-enumeration", ValueCodecs.FLOAT, ParamDecoration.ENUMERATION),
    DOUBLE_ENUMERATION("double-enumeration", ValueCodecs.DOUBLE, ParamDecoration.ENUMERATION),
    STRING_ENUMERATION("string-enumeration", ValueCodecs.STRING, ParamDecoration.ENUMERATION),

    FILE("file", ValueCodecs.STRING, ParamDecoration.FILE_EXTENSIONS),
    DIRECTORY("directory", ValueCodecs.STRING),
    IMAGE("image", ValueCodecs.STRING, ParamDecoration.TYPE, ParamDecoration.FILE_EXTENSIONS),
    GEOMETRY("geometry", ValueCodecs.STRING, ParamDecoration.TYPE, ParamDecoration.FILE_EXTENSIONS),
    POINT("point", ValueCodecs.STRING_LIST, ParamDecoration.MULTIPLE, ParamDecoration.COORDINATE_SYSTEM),
    REGION("region", ValueCodecs.STRING_LIST, ParamDecoration.MULTIPLE, ParamDecoration.COORDINATE_SYSTEM);

    private final String label;
    private final ValueCodec<?> codec;
    private final Set<ParamDecoration> decorations;

    ParamKind(String label, ValueCodec<?> codec, ParamDecoration... decorations) {
        this.label = label;
        this.codec = codec;
        this.decorations = decorations.length == 0
                ? EnumSet.noneOf(ParamDecoration.class)
                : EnumSet.copyOf(Arrays.asList(decorations));
    }

    /**
     * Label used as manifest element name and in help output, e.g. "string-vector".
     */
    public String getLabel() {
        return label;
    }

    public ValueCodec<?> getCodec() {
        return codec;
    }

    public boolean supports(ParamDecoration decoration) {
        return decorations.contains(decoration);
    }

    /**
     * Boolean parameters toggle on the command line instead of consuming a value.
     */
    public boolean isBoolean() {
        return this == BOOLEAN;
    }

    public static Optional<ParamKind> fromLabel(String label) {
        return Arrays.stream(values())
                .filter(kind -> kind.label.equals(label))
                .findFirst();
    }

    @Override
    public String toString() {
        return label;
    }
}
