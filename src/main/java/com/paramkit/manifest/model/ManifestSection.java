package com.paramkit.manifest.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A "parameters" group holding the parameters of one section.
 */
@Value
@Builder
public class ManifestSection {

    @NonNull
    String label;

    @NonNull
    String description;

    @NonNull
    @Singular
    List<ManifestParameter> parameters;
}
