package com.paramkit.ini;

import com.paramkit.model.ParamAddress;
import com.paramkit.model.ParamRecord;
import com.paramkit.registry.ParamRegistry;
import com.paramkit.util.FileWriteUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes all parameter values in ini format.
 *
 * Format:
 * - Section header: [Basic Types]
 * - Value: Bool Param = true
 * - Comments: # comment
 *
 * Lines before the first header belong to the default section. Values are trimmed, so
 * text values with leading or trailing blanks do not survive a round trip.
 */
public class IniCodec {
    private static final Logger log = LoggerFactory.getLogger(IniCodec.class);

    private final ParamRegistry registry;
    private final String defaultSection;

    public IniCodec(ParamRegistry registry, String defaultSection) {
        this.registry = registry;
        this.defaultSection = defaultSection;
    }

    /**
     * Renders every parameter, section by section in registry order.
     */
    public String serialize() {
        StringBuilder sb = new StringBuilder();
        for (String section : registry.sections()) {
            sb.append('[').append(section).append("]\n\n");
            for (Map.Entry<String, ParamRecord> entry : registry.section(section).entrySet()) {
                sb.append(entry.getKey()).append(" = ").append(entry.getValue().getText()).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Applies ini text to the declared parameters.
     */
    public IniParseResult parse(String ini) {
        IniParseResult result = new IniParseResult();
        String section = defaultSection;

        int lineNum = 0;
        for (String line : ini.split("\\r?\\n", -1)) {
            lineNum++;

            // Skip short lines and comments
            if (line.length() < 2 || line.startsWith("#") || line.isBlank()) {
                continue;
            }

            if (line.startsWith("[")) {
                section = sectionName(line);
                continue;
            }

            int separator = line.indexOf('=');
            if (separator < 0) {
                result.addError("Line " + lineNum + ": expected 'key = value' but found: " + line);
                log.warn("Skipping malformed ini line {}: {}", lineNum, line);
                continue;
            }

            String key = line.substring(0, separator).trim();
            String value = line.substring(separator + 1).trim();

            Optional<ParamRecord> record = registry.lookup(section, key);
            if (record.isEmpty()) {
                result.addUnknownKey(new ParamAddress(section, key));
                log.warn("Ignoring undeclared parameter [{}] {} at line {}", section, key, lineNum);
                continue;
            }
            record.get().setText(value);
            result.recordApplied();
        }

        return result;
    }

    /**
     * Reads an ini file and applies it.
     *
     * @return false if the file does not exist or cannot be read; the registry is then unchanged
     */
    public boolean load(Path iniFile) {
        if (!Files.isRegularFile(iniFile) || !Files.isReadable(iniFile)) {
            log.warn("Ini file does not exist or is not readable: {}", iniFile);
            return false;
        }
        String content;
        try {
            content = Files.readString(iniFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to read ini file {}: {}", iniFile, e.getMessage());
            return false;
        }
        IniParseResult result = parse(content);
        log.info("Loaded {} parameters from {}", result.getAppliedCount(), iniFile);
        return true;
    }

    /**
     * Writes every parameter to an ini file, creating parent directories if needed.
     */
    public void save(Path iniFile) throws IOException {
        FileWriteUtil.safeWriteString(iniFile, serialize());
        log.info("Saved {} parameters to {}", registry.size(), iniFile);
    }

    private static String sectionName(String line) {
        String trimmed = line.trim();
        int end = trimmed.lastIndexOf(']');
        return end > 0 ? trimmed.substring(1, end) : trimmed.substring(1);
    }
}
