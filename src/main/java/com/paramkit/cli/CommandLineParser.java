package com.paramkit.cli;

import com.paramkit.cli.output.SynopsisRenderer;
import com.paramkit.codec.ValueCodecs;
import com.paramkit.config.ParamApplicationConfig;
import com.paramkit.exception.ManifestRenderException;
import com.paramkit.ini.IniCodec;
import com.paramkit.manifest.ManifestGenerator;
import com.paramkit.model.ParamRecord;
import com.paramkit.registry.ParamRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Assigns command line arguments to declared parameters.
 *
 * Syntax:
 * - Flag: --section-key value, -s value
 * - Boolean flag: --section-key (toggles, takes no value)
 * - Positional: value (matched by its position among non-flag arguments)
 * - Reserved: --xml, -h/--help, --ctk-save-ini file, --ctk-load-ini file
 *
 * Handled arguments are removed from the list; everything else stays in place for
 * the caller. Problems are reported to the error stream and never abort the program.
 */
public class CommandLineParser {
    private static final Logger log = LoggerFactory.getLogger(CommandLineParser.class);

    static final String MISSING_VALUE = "Expected value but found end of argument list. Ignored command line argument ";
    static final String IGNORED = "Ignored command line argument ";

    private final ParamRegistry registry;
    private final FlagBinder binder;
    private final IniCodec iniCodec;
    private final ManifestGenerator manifestGenerator;
    private final SynopsisRenderer synopsisRenderer;
    private final ParamApplicationConfig config;

    public CommandLineParser(ParamRegistry registry, FlagBinder binder, IniCodec iniCodec,
                             ManifestGenerator manifestGenerator, SynopsisRenderer synopsisRenderer,
                             ParamApplicationConfig config) {
        this.registry = registry;
        this.binder = binder;
        this.iniCodec = iniCodec;
        this.manifestGenerator = manifestGenerator;
        this.synopsisRenderer = synopsisRenderer;
        this.config = config;
    }

    /**
     * Parses the arguments and removes the handled ones from {@code args}.
     *
     * @param args mutable argument list
     */
    public ParseResult parse(List<String> args) {
        int count = args.size();
        boolean[] handled = new boolean[count];
        ParseResult.ParseResultBuilder result = ParseResult.builder().originalCount(count);

        int position = 0; // next positional index
        int i = 0;
        while (i < count) {
            String token = args.get(i);

            if (config.getManifestTokens().contains(token)) {
                emitManifest(result);
                handled[i++] = true;
                continue;
            }
            if (config.getHelpTokens().contains(token)) {
                config.getOut().print(synopsisRenderer.render());
                handled[i++] = true;
                continue;
            }

            boolean save = config.getSaveIniToken().equals(token);
            if (save || config.getLoadIniToken().equals(token)) {
                if (i == count - 1) {
                    report(result, MISSING_VALUE + token);
                    break;
                }
                handled[i] = true;
                handled[i + 1] = true;
                if (save) {
                    saveIni(args.get(i + 1), result);
                } else {
                    loadIni(args.get(i + 1), result);
                }
                i += 2;
                continue;
            }

            boolean flag = isFlag(token);
            String lookup = flag ? token : Integer.toString(position);
            Optional<ParamRecord> bound = binder.resolve(lookup).flatMap(registry::lookup);

            if (bound.isEmpty()) {
                if (flag) {
                    report(result, IGNORED + token);
                }
                // unbound positional arguments belong to the caller
                i++;
                continue;
            }

            ParamRecord record = bound.get();
            if (!flag) {
                position++;
            }

            if (record.getKind().isBoolean()) {
                boolean current = record.getValue(ValueCodecs.BOOLEAN);
                record.setValue(ValueCodecs.BOOLEAN, !current);
                log.debug("{} toggled {} to {}", token, lookup, !current);
                handled[i++] = true;
                continue;
            }

            if (!flag) {
                record.setText(token);
                log.debug("Positional {} set to '{}'", lookup, token);
                handled[i++] = true;
                continue;
            }

            if (i == count - 1) {
                report(result, MISSING_VALUE + token);
                break;
            }
            record.setText(args.get(i + 1));
            log.debug("{} set to '{}'", token, args.get(i + 1));
            handled[i] = true;
            handled[i + 1] = true;
            i += 2;
        }

        // Remove handled arguments, keeping the order of the rest
        List<String> remaining = new ArrayList<>();
        for (int j = 0; j < count; j++) {
            if (!handled[j]) {
                remaining.add(args.get(j));
            }
        }
        args.clear();
        args.addAll(remaining);

        return result.handledCount(count - remaining.size())
                .remaining(remaining)
                .build();
    }

    /**
     * Parses an argument array and returns the unhandled arguments in the result.
     */
    public ParseResult parse(String[] argv) {
        return parse(new ArrayList<>(Arrays.asList(argv)));
    }

    static boolean isFlag(String token) {
        return token.length() > 1 && token.startsWith("-");
    }

    private void emitManifest(ParseResult.ParseResultBuilder result) {
        try {
            config.getOut().print(manifestGenerator.generate());
        } catch (ManifestRenderException e) {
            log.error("Manifest generation failed", e);
            report(result, e.getMessage());
        }
    }

    private void saveIni(String file, ParseResult.ParseResultBuilder result) {
        try {
            iniCodec.save(Path.of(file));
        } catch (IOException | InvalidPathException e) {
            report(result, "Could not save ini file " + file + ": " + e.getMessage());
        }
    }

    private void loadIni(String file, ParseResult.ParseResultBuilder result) {
        boolean loaded;
        try {
            loaded = iniCodec.load(Path.of(file));
        } catch (InvalidPathException e) {
            loaded = false;
        }
        if (!loaded) {
            report(result, "Could not load ini file " + file);
        }
    }

    private void report(ParseResult.ParseResultBuilder result, String diagnostic) {
        PrintStream err = config.getErr();
        err.println(diagnostic);
        result.diagnostic(diagnostic);
        log.warn("Command line diagnostic: {}", diagnostic);
    }
}
