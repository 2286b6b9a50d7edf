package com.paramkit.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kind-specific metadata a declaration may attach to a parameter.
 */
@Getter
@RequiredArgsConstructor
public enum ParamDecoration {

    /**
     * Comma-separated list of loadable file extensions (attribute).
     */
    FILE_EXTENSIONS("fileExtensions", Target.ATTRIBUTE),

    /**
     * Pixel or mesh type of an image or geometry (attribute).
     */
    TYPE("type", Target.ATTRIBUTE),

    /**
     * Whether several points or regions may be given (attribute).
     */
    MULTIPLE("multiple", Target.ATTRIBUTE),

    /**
     * Coordinate system of points and regions (attribute).
     */
    COORDINATE_SYSTEM("coordinateSystem", Target.ATTRIBUTE),

    /**
     * Comma-separated list of admissible values (tag, expanded in the manifest).
     */
    ENUMERATION("enumeration", Target.TAG),

    /**
     * Slider range: minimum, maximum and step (constraints).
     */
    RANGE("range", Target.CONSTRAINT);

    private final String name;
    private final Target target;

    /**
     * Which of a record's metadata mappings the decoration is written to.
     */
    public enum Target {
        TAG,
        ATTRIBUTE,
        CONSTRAINT
    }
}
