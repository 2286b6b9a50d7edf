package com.paramkit.manifest.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A child element of a parameter. Enumeration tags carry their items as elements
 * instead of a text value.
 */
@Value
@Builder
public class ManifestTag {

    @NonNull
    String name;

    @NonNull
    @Builder.Default
    String value = "";

    boolean enumeration;

    @NonNull
    @Singular
    List<String> elements;
}
