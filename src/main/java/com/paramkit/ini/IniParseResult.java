package com.paramkit.ini;

import com.paramkit.model.ParamAddress;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of reading ini text into a registry.
 *
 * Lines naming an undeclared parameter are not applied; they are listed in
 * {@link #getUnknownKeys()}. Lines that are neither comments, section headers nor
 * key/value pairs are listed in {@link #getErrors()}.
 */
@Data
public class IniParseResult {
    private int appliedCount;
    private final List<ParamAddress> unknownKeys = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();

    public void recordApplied() {
        appliedCount++;
    }

    public void addUnknownKey(ParamAddress address) {
        unknownKeys.add(address);
    }

    public void addError(String error) {
        errors.add(error);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasUnknownKeys() {
        return !unknownKeys.isEmpty();
    }
}
