package com.paramkit.registry;

import com.paramkit.model.ParamAddress;
import com.paramkit.model.ParamRecord;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Owns every parameter record, indexed by section and key.
 *
 * Both levels keep first-insertion order. That order drives the ini file, the
 * manifest and the help text.
 */
public class ParamRegistry {
    private static final Logger log = LoggerFactory.getLogger(ParamRegistry.class);

    private final Map<String, Map<String, ParamRecord>> sections = new LinkedHashMap<>();

    /**
     * Returns the record for the pair, never creating one.
     */
    public Optional<ParamRecord> lookup(String section, String key) {
        Map<String, ParamRecord> keys = sections.get(section);
        return keys == null ? Optional.empty() : Optional.ofNullable(keys.get(key));
    }

    public Optional<ParamRecord> lookup(ParamAddress address) {
        return lookup(address.getSection(), address.getKey());
    }

    public boolean contains(String section, String key) {
        return lookup(section, key).isPresent();
    }

    /**
     * Installs a record for the pair. If one already exists, its text value is carried
     * over into the new record (when non-empty) and the old record is dropped; the pair
     * keeps its position in iteration order.
     *
     * @return the installed record
     */
    public ParamRecord insertOrReplace(String section, String key, @NonNull ParamRecord record) {
        Map<String, ParamRecord> keys = sections.computeIfAbsent(section, s -> new LinkedHashMap<>());
        ParamRecord previous = keys.put(key, record);
        if (previous != null) {
            String text = previous.getText();
            if (!text.isEmpty()) {
                record.setText(text);
            }
            log.debug("Replaced {} parameter [{}] {} with {} (value '{}')",
                    previous.getKind(), section, key, record.getKind(), text);
        } else {
            log.debug("Declared {} parameter [{}] {}", record.getKind(), section, key);
        }
        return record;
    }

    /**
     * Section names in first-insertion order.
     */
    public List<String> sections() {
        return List.copyOf(sections.keySet());
    }

    /**
     * Records of one section in first-insertion order; empty for an unknown section.
     */
    public Map<String, ParamRecord> section(String section) {
        Map<String, ParamRecord> keys = sections.get(section);
        return keys == null ? Map.of() : Collections.unmodifiableMap(keys);
    }

    /**
     * Visits every record, section by section.
     */
    public void forEach(BiConsumer<ParamAddress, ParamRecord> visitor) {
        sections.forEach((section, keys) ->
                keys.forEach((key, record) -> visitor.accept(new ParamAddress(section, key), record)));
    }

    public List<ParamAddress> addresses() {
        List<ParamAddress> addresses = new ArrayList<>();
        forEach((address, record) -> addresses.add(address));
        return addresses;
    }

    public int size() {
        return sections.values().stream().mapToInt(Map::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Drops every record.
     */
    public void clear() {
        log.debug("Clearing {} parameters", size());
        sections.clear();
    }
}
