package com.paramkit.exception;

/**
 * The XML manifest template could not be loaded or processed.
 */
public class ManifestRenderException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ManifestRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
