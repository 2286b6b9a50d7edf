package com.paramkit.cli;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one command line scan.
 */
@Value
@Builder
public class ParseResult {

    int originalCount;

    int handledCount;

    /**
     * Arguments left for the caller, in their original relative order.
     */
    @NonNull
    @Singular("remainingArgument")
    List<String> remaining;

    /**
     * Diagnostics written to the error stream, one per problem.
     */
    @NonNull
    @Singular
    List<String> diagnostics;

    public int getRemainingCount() {
        return remaining.size();
    }

    public String[] remainingArray() {
        return remaining.toArray(new String[0]);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
