package com.paramkit.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descriptive fields of the application, rendered into the manifest and the help text.
 */
public class ApplicationMetadata {

    private final Map<Field, String> values = new EnumMap<>(Field.class);

    /**
     * The metadata fields, declared in the order the manifest schema requires.
     */
    @Getter
    @RequiredArgsConstructor
    public enum Field {
        CATEGORY("category"),
        TITLE("title"),
        DESCRIPTION("description"),
        VERSION("version"),
        DOCUMENTATION_URL("documentation-url"),
        LICENSE("license"),
        CONTRIBUTOR("contributor"),
        ACKNOWLEDGEMENTS("acknowledgements");

        private final String key;
    }

    public String get(Field field) {
        return values.getOrDefault(field, "");
    }

    public ApplicationMetadata set(Field field, String value) {
        if (value == null || value.isEmpty()) {
            values.remove(field);
        } else {
            values.put(field, value);
        }
        return this;
    }

    /**
     * Non-empty fields keyed by their manifest name, in schema order.
     */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (Field field : Field.values()) {
            String value = get(field);
            if (!value.isEmpty()) {
                map.put(field.getKey(), value);
            }
        }
        return map;
    }

    public String getTitle() {
        return get(Field.TITLE);
    }

    public ApplicationMetadata setTitle(String title) {
        return set(Field.TITLE, title);
    }

    public String getDescription() {
        return get(Field.DESCRIPTION);
    }

    public ApplicationMetadata setDescription(String description) {
        return set(Field.DESCRIPTION, description);
    }

    public ApplicationMetadata setCategory(String category) {
        return set(Field.CATEGORY, category);
    }

    public ApplicationMetadata setVersion(String version) {
        return set(Field.VERSION, version);
    }

    public ApplicationMetadata setDocumentationUrl(String url) {
        return set(Field.DOCUMENTATION_URL, url);
    }

    public ApplicationMetadata setLicense(String license) {
        return set(Field.LICENSE, license);
    }

    public String getContributor() {
        return get(Field.CONTRIBUTOR);
    }

    public ApplicationMetadata setContributor(String contributor) {
        return set(Field.CONTRIBUTOR, contributor);
    }

    public String getAcknowledgements() {
        return get(Field.ACKNOWLEDGEMENTS);
    }

    public ApplicationMetadata setAcknowledgements(String acknowledgements) {
        return set(Field.ACKNOWLEDGEMENTS, acknowledgements);
    }
}
