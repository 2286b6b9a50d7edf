package com.paramkit.model;

import com.paramkit.codec.ValueCodec;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;

import java.util.Map;
import java.util.TreeMap;

/**
 * Holds the value of one parameter plus the metadata rendered into the manifest.
 *
 * The kind is fixed at construction. Tags become child elements in the manifest
 * (e.g. "description", "longflag", "index"; the "name" tag is rendered once as the
 * parameter's name element), attributes become XML attributes of the
 * parameter element and constraints are grouped under a "constraints" element.
 * All three are iterated in key order.
 */
@Getter
public final class ParamRecord {

    public static final String TAG_NAME = "name";
    public static final String TAG_DESCRIPTION = "description";
    public static final String TAG_LABEL = "label";
    public static final String TAG_CHANNEL = "channel";
    public static final String TAG_LONG_FLAG = "longflag";
    public static final String TAG_FLAG = "flag";
    public static final String TAG_INDEX = "index";
    public static final String TAG_ENUMERATION = "enumeration";

    private final ParamKind kind;

    @Getter(AccessLevel.NONE)
    private final ParamValue<?> value;

    private final Map<String, String> tags = new TreeMap<>();
    private final Map<String, String> attributes = new TreeMap<>();
    private final Map<String, String> constraints = new TreeMap<>();

    public ParamRecord(@NonNull ParamKind kind) {
        this.kind = kind;
        this.value = ParamValue.initial(kind.getCodec());
    }

    /**
     * Current value in canonical text form.
     */
    public String getText() {
        return value.getText();
    }

    /**
     * Sets the value from text using this record's kind.
     */
    public void setText(String text) {
        value.setText(text);
    }

    /**
     * Reads the value as the given type, converting through text when the
     * record's kind holds a different type.
     */
    public <T> T getValue(ValueCodec<T> codec) {
        return value.read(codec);
    }

    public <T> void setValue(ValueCodec<T> codec, T newValue) {
        value.write(codec, newValue);
    }

    /**
     * Returns the tag value or an empty string.
     */
    public String getTag(String name) {
        return tags.getOrDefault(name, "");
    }

    public boolean hasTag(String name) {
        return !getTag(name).isEmpty();
    }

    @Override
    public String toString() {
        return "ParamRecord{" + kind.getLabel() + "=" + getText() + "}";
    }
}
