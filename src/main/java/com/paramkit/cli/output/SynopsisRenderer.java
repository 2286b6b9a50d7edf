package com.paramkit.cli.output;

import com.paramkit.codec.ValueCodecs;
import com.paramkit.config.ParamApplicationConfig;
import com.paramkit.model.ApplicationMetadata;
import com.paramkit.model.ParamRecord;
import com.paramkit.registry.ParamRegistry;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Help.Column;
import picocli.CommandLine.Help.TextTable;
import picocli.CommandLine.Help;

import java.util.Map;
import java.util.TreeMap;

/**
 * Formats the help text printed for "-h" / "--help".
 *
 * Layout: a usage block with one bracketed entry per flag and the positional
 * arguments, then the flags of every section with their descriptions, then the
 * positional arguments, then the application description and credits.
 */
public class SynopsisRenderer {

    private static final String LEADING = "   ";

    private final ParamRegistry registry;
    private final ApplicationMetadata metadata;
    private final ParamApplicationConfig config;

    public SynopsisRenderer(ParamRegistry registry, ApplicationMetadata metadata, ParamApplicationConfig config) {
        this.registry = registry;
        this.metadata = metadata;
        this.config = config;
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        String title = metadata.getTitle();
        String indent = " ".repeat(LEADING.length() + 3 + title.length());

        // Usage: reserved tokens first
        sb.append("USAGE:\n\n");
        sb.append(LEADING).append("./").append(title).append(" [-h] [--xml]\n");
        sb.append(indent).append("[").append(config.getSaveIniToken()).append(" <file>] [")
                .append(config.getLoadIniToken()).append(" <file>]\n");

        Map<Integer, ParamRecord> positional = new TreeMap<>();
        registry.forEach((address, record) -> {
            if (record.hasTag(ParamRecord.TAG_INDEX)) {
                positional.put(ValueCodecs.INTEGER.decode(record.getTag(ParamRecord.TAG_INDEX)), record);
            } else if (record.hasTag(ParamRecord.TAG_FLAG)) {
                sb.append(indent).append("[-").append(record.getTag(ParamRecord.TAG_FLAG))
                        .append(' ').append(placeholder(record)).append("]\n");
            } else if (record.hasTag(ParamRecord.TAG_LONG_FLAG)) {
                sb.append(indent).append("[--").append(record.getTag(ParamRecord.TAG_LONG_FLAG))
                        .append(' ').append(placeholder(record)).append("]\n");
            }
        });
        for (ParamRecord record : positional.values()) {
            sb.append(indent).append(placeholder(record)).append('\n');
        }

        // Verbose listing per section
        for (String section : registry.sections()) {
            TextTable table = newTable();
            registry.section(section).forEach((key, record) -> {
                if (!record.hasTag(ParamRecord.TAG_INDEX)) {
                    String option = optionSummary(record);
                    if (!option.isEmpty()) {
                        table.addRowValues(option, record.getTag(ParamRecord.TAG_DESCRIPTION));
                    }
                }
            });
            sb.append('\n').append(section).append(":\n\n").append(table);
        }

        for (Map.Entry<Integer, ParamRecord> entry : positional.entrySet()) {
            ParamRecord record = entry.getValue();
            sb.append('\n').append(record.getKind().getLabel()).append('(').append(entry.getKey()).append("):\n");
            sb.append("    ").append(record.getTag(ParamRecord.TAG_DESCRIPTION)).append('\n');
        }

        // Description and credits
        if (!metadata.getDescription().isEmpty()) {
            sb.append('\n').append(metadata.getDescription()).append('\n');
        }
        if (!metadata.getContributor().isEmpty()) {
            sb.append("\nAuthor: ").append(metadata.getContributor()).append('\n');
        }
        if (!metadata.getAcknowledgements().isEmpty()) {
            sb.append("\nAcknowledgements: ").append(metadata.getAcknowledgements()).append('\n');
        }
        return sb.toString();
    }

    private TextTable newTable() {
        return TextTable.forColumns(Help.defaultColorScheme(Ansi.OFF),
                new Column(config.getHelpFlagColumnWidth(), 1, Column.Overflow.SPAN),
                new Column(config.getHelpDescriptionColumnWidth(), 1, Column.Overflow.WRAP));
    }

    /**
     * "[-b|--basic-bool <boolean>]", "[--basic-bool <boolean>]" or empty when unbound.
     */
    static String optionSummary(ParamRecord record) {
        String shortFlag = record.getTag(ParamRecord.TAG_FLAG);
        String longFlag = record.getTag(ParamRecord.TAG_LONG_FLAG);
        if (shortFlag.isEmpty() && longFlag.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("[");
        if (!shortFlag.isEmpty()) {
            sb.append('-').append(shortFlag);
            if (!longFlag.isEmpty()) {
                sb.append('|');
            }
        }
        if (!longFlag.isEmpty()) {
            sb.append("--").append(longFlag);
        }
        return sb.append(' ').append(placeholder(record)).append(']').toString();
    }

    private static String placeholder(ParamRecord record) {
        return "<" + record.getKind().getLabel() + ">";
    }
}
