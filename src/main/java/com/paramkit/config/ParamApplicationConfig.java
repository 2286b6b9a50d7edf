package com.paramkit.config;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.io.PrintStream;
import java.util.Set;

/**
 * Settings of a parameter application: the reserved command line tokens, the section
 * used for ini lines before the first header, the streams for generated output and
 * diagnostics, and the layout of the help text.
 */
@Value
@Builder(toBuilder = true)
public class ParamApplicationConfig {

    /**
     * Prints the XML manifest.
     */
    @NonNull
    @Builder.Default
    Set<String> manifestTokens = Set.of("--xml");

    /**
     * Prints the synopsis.
     */
    @NonNull
    @Builder.Default
    Set<String> helpTokens = Set.of("-h", "--help");

    /**
     * Writes every parameter to the ini file named by the next token.
     */
    @NonNull
    @Builder.Default
    String saveIniToken = "--ctk-save-ini";

    /**
     * Reads parameters from the ini file named by the next token.
     */
    @NonNull
    @Builder.Default
    String loadIniToken = "--ctk-load-ini";

    /**
     * Section of key/value lines that appear before any [section] header.
     */
    @NonNull
    @Builder.Default
    String defaultIniSection = "Global";

    /**
     * Receives the manifest and the synopsis.
     */
    @NonNull
    @Builder.Default
    PrintStream out = System.out;

    /**
     * Receives command line diagnostics.
     */
    @NonNull
    @Builder.Default
    PrintStream err = System.err;

    /**
     * Width of the flag column in the per-section help listing.
     */
    @Builder.Default
    int helpFlagColumnWidth = 44;

    /**
     * Width of the description column in the per-section help listing.
     */
    @Builder.Default
    int helpDescriptionColumnWidth = 36;

    public static ParamApplicationConfig defaults() {
        return ParamApplicationConfig.builder().build();
    }
}
