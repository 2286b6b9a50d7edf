package com.paramkit;

import com.paramkit.cli.CommandLineParser;
import com.paramkit.cli.FlagBinder;
import com.paramkit.cli.ParseResult;
import com.paramkit.cli.output.SynopsisRenderer;
import com.paramkit.codec.ValueCodec;
import com.paramkit.config.ParamApplicationConfig;
import com.paramkit.declare.ParamDeclaration;
import com.paramkit.exception.ParameterNotFoundException;
import com.paramkit.ini.IniCodec;
import com.paramkit.ini.IniParseResult;
import com.paramkit.manifest.ManifestGenerator;
import com.paramkit.model.ApplicationMetadata;
import com.paramkit.model.ParamAddress;
import com.paramkit.model.ParamKind;
import com.paramkit.model.ParamRecord;
import com.paramkit.registry.ParamRegistry;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * A command line application with self-describing parameters.
 *
 * Parameters are declared by section and key:
 *
 * <pre>
 * ParamApplication app = ParamApplication.create("The Big Test", "Does absolutely nothing.");
 * app.declare("Airplane", "Speed", ParamKind.DOUBLE).flag("Cruising speed", "s").value(2.5);
 * app.parseCommandLine(args);             // ./myapp --airplane-speed 123.456
 * double speed = app.get("Airplane", "Speed", ValueCodecs.DOUBLE);
 * </pre>
 *
 * Values can also be saved to and loaded from ini files, and the whole parameter set
 * is described by an XML manifest ("--xml") that host tools turn into a GUI.
 * Several applications may coexist; none of them is safe for concurrent use.
 */
@Getter
public class ParamApplication {
    private static final Logger log = LoggerFactory.getLogger(ParamApplication.class);

    private final ParamApplicationConfig config;
    private final ParamRegistry registry;
    private final FlagBinder binder;
    private final ApplicationMetadata metadata;
    private final IniCodec iniCodec;
    private final ManifestGenerator manifestGenerator;
    private final SynopsisRenderer synopsisRenderer;
    private final CommandLineParser commandLineParser;

    public ParamApplication(@NonNull ParamApplicationConfig config) {
        this.config = config;
        this.registry = new ParamRegistry();
        this.binder = new FlagBinder();
        this.metadata = new ApplicationMetadata();
        this.iniCodec = new IniCodec(registry, config.getDefaultIniSection());
        this.manifestGenerator = new ManifestGenerator(registry, metadata);
        this.synopsisRenderer = new SynopsisRenderer(registry, metadata, config);
        this.commandLineParser = new CommandLineParser(registry, binder, iniCodec,
                manifestGenerator, synopsisRenderer, config);
    }

    public static ParamApplication create(String title, String description) {
        return create(title, description, ParamApplicationConfig.defaults());
    }

    public static ParamApplication create(String title, String description, ParamApplicationConfig config) {
        ParamApplication app = new ParamApplication(config);
        app.metadata.setTitle(title).setDescription(description);
        return app;
    }

    // ---- Declaration ----

    /**
     * Declares a parameter of the given kind.
     *
     * The first declaration creates the record, tags it with its normalized name and
     * binds the long flag "--section-key". Declaring again with the same kind only returns a new handle;
     * declaring with another kind replaces the record, keeping its text value.
     */
    public ParamDeclaration declare(String section, String key, @NonNull ParamKind kind) {
        ParamAddress address = new ParamAddress(section, key);
        Optional<ParamRecord> existing = registry.lookup(address);
        if (existing.isEmpty() || existing.get().getKind() != kind) {
            existing.ifPresent(old -> log.debug("Re-declaring {} as {} (was {})", address, kind, old.getKind()));
            ParamRecord record = registry.insertOrReplace(section, key, new ParamRecord(kind));
            String name = address.getNormalizedName();
            binder.bindLongFlag(name, address);
            record.getTags().put(ParamRecord.TAG_NAME, name);
            record.getTags().put(ParamRecord.TAG_LONG_FLAG, name);
        }
        return new ParamDeclaration(registry, binder, address);
    }

    /**
     * Handle for an already declared parameter.
     *
     * @throws ParameterNotFoundException if the parameter was never declared
     */
    public ParamDeclaration param(String section, String key) {
        ParamAddress address = new ParamAddress(section, key);
        require(address);
        return new ParamDeclaration(registry, binder, address);
    }

    // ---- Value access ----

    /**
     * Reads a value as the codec's type, whatever kind the parameter was declared with.
     */
    public <T> T get(String section, String key, ValueCodec<T> codec) {
        return require(new ParamAddress(section, key)).getValue(codec);
    }

    public <T> void set(String section, String key, ValueCodec<T> codec, T value) {
        require(new ParamAddress(section, key)).setValue(codec, value);
    }

    public String getText(String section, String key) {
        return require(new ParamAddress(section, key)).getText();
    }

    public void setText(String section, String key, String text) {
        require(new ParamAddress(section, key)).setText(text);
    }

    // ---- Surfaces ----

    /**
     * Assigns command line arguments to parameters. Handled arguments are removed
     * from the list.
     */
    public ParseResult parseCommandLine(List<String> args) {
        return commandLineParser.parse(args);
    }

    public ParseResult parseCommandLine(String[] argv) {
        return commandLineParser.parse(argv);
    }

    /**
     * Applies ini text ("[Section]" headers and "key = value" lines).
     */
    public IniParseResult parseIni(String ini) {
        return iniCodec.parse(ini);
    }

    /**
     * @return false if the file could not be read; no parameter changes then
     */
    public boolean load(Path iniFile) {
        return iniCodec.load(iniFile);
    }

    public void save(Path iniFile) throws IOException {
        iniCodec.save(iniFile);
    }

    public String toIni() {
        return iniCodec.serialize();
    }

    public String getXmlDescription() {
        return manifestGenerator.generate();
    }

    public String getSynopsis() {
        return synopsisRenderer.render();
    }

    private ParamRecord require(ParamAddress address) {
        return registry.lookup(address).orElseThrow(() -> new ParameterNotFoundException(address));
    }
}
