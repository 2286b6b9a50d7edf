package com.paramkit.model;

import lombok.NonNull;
import lombok.Value;

import java.util.Locale;

/**
 * The (section, key) pair that names one parameter.
 */
@Value
public class ParamAddress {

    @NonNull
    String section;

    @NonNull
    String key;

    /**
     * Flag name derived from section and key: "Basic Types"/"Bool Param" becomes
     * "basic-types-bool-param".
     */
    public String getNormalizedName() {
        return (section + "-" + key).toLowerCase(Locale.ROOT).replace(' ', '-');
    }

    @Override
    public String toString() {
        return "[" + section + "] " + key;
    }
}
