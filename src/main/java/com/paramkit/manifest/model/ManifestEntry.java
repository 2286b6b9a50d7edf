package com.paramkit.manifest.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A name/value pair rendered as an element or attribute.
 */
@Value
public class ManifestEntry {
    @NonNull
    String name;

    @NonNull
    String value;
}
