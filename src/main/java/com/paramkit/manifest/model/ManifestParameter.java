package com.paramkit.manifest.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One parameter element of the manifest, named after the parameter's kind.
 */
@Value
@Builder
public class ManifestParameter {

    /**
     * Element name, e.g. "file" or "double-vector".
     */
    @NonNull
    String kind;

    @NonNull
    String name;

    /**
     * Current value of the parameter in text form.
     */
    @NonNull
    String defaultValue;

    @NonNull
    @Singular
    List<ManifestEntry> attributes;

    @NonNull
    @Singular
    List<ManifestTag> tags;

    @NonNull
    @Singular
    List<ManifestEntry> constraints;
}
