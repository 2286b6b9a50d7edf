package com.paramkit.declare;

import com.paramkit.cli.FlagBinder;
import com.paramkit.codec.ValueCodec;
import com.paramkit.codec.ValueCodecs;
import com.paramkit.exception.ParameterNotFoundException;
import com.paramkit.model.ParamAddress;
import com.paramkit.model.ParamDecoration;
import com.paramkit.model.ParamKind;
import com.paramkit.model.ParamRecord;
import com.paramkit.registry.ParamRegistry;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Chained builder that describes one declared parameter.
 *
 * A declaration holds no value; every call looks the record up in the registry, so it
 * keeps working after the parameter was re-declared with another kind. Do not keep it
 * beyond the lifetime of its application.
 *
 * <pre>
 * app.declare("Special", "File", ParamKind.FILE)
 *         .fileExtensions("bli,bla,blbub")
 *         .index("Input File", 0)
 *         .channel(true);
 * </pre>
 */
public class ParamDeclaration {

    static final double DEFAULT_STEP = 0.01;

    private final ParamRegistry registry;
    private final FlagBinder binder;
    private final ParamAddress address;

    public ParamDeclaration(ParamRegistry registry, FlagBinder binder, ParamAddress address) {
        this.registry = registry;
        this.binder = binder;
        this.address = address;
    }

    public ParamAddress getAddress() {
        return address;
    }

    /**
     * Kind of the record currently installed for this parameter.
     */
    public ParamKind getKind() {
        return record().getKind();
    }

    // ---- Free-text metadata ----

    /**
     * Verbose description of what this parameter is good for.
     */
    public ParamDeclaration description(String description) {
        return tag(ParamRecord.TAG_DESCRIPTION, description);
    }

    public ParamDeclaration label(String label) {
        return tag(ParamRecord.TAG_LABEL, label);
    }

    /**
     * Marks the parameter as input or output of the application.
     */
    public ParamDeclaration channel(boolean input) {
        return tag(ParamRecord.TAG_CHANNEL, input ? "input" : "output");
    }

    public ParamDeclaration tag(String name, String value) {
        record().getTags().put(name, value == null ? "" : value);
        return this;
    }

    public ParamDeclaration attribute(String name, String value) {
        record().getAttributes().put(name, value == null ? "" : value);
        return this;
    }

    public ParamDeclaration constraint(String name, String value) {
        record().getConstraints().put(name, value == null ? "" : value);
        return this;
    }

    // ---- Command line binding ----

    /**
     * Binds the long flag "--section-key" and records the description.
     */
    public ParamDeclaration flag(String description) {
        return flag(description, "");
    }

    /**
     * Binds the long flag "--section-key" and, if given, the single-character short flag.
     */
    public ParamDeclaration flag(String description, String shortFlag) {
        ParamRecord record = record();
        String name = address.getNormalizedName();
        binder.bindLongFlag(name, address);
        record.getTags().put(ParamRecord.TAG_LONG_FLAG, name);
        record.getTags().put(ParamRecord.TAG_DESCRIPTION, description == null ? "" : description);
        if (shortFlag != null && !shortFlag.isEmpty()) {
            Optional<ParamAddress> previousOwner = binder.resolve(FlagBinder.SHORT_FLAG_PREFIX + shortFlag);
            binder.bindShortFlag(shortFlag, address);
            releaseTag(previousOwner, ParamRecord.TAG_FLAG, shortFlag);
            record.getTags().put(ParamRecord.TAG_FLAG, shortFlag);
        }
        return this;
    }

    /**
     * Binds a positional argument. The current long flag name is kept as "flag" tag.
     */
    public ParamDeclaration index(String description, int index) {
        ParamRecord record = record();
        String token = Integer.toString(index);
        Optional<ParamAddress> previousOwner = binder.resolve(token);
        binder.bindIndex(index, address);
        releaseTag(previousOwner, ParamRecord.TAG_INDEX, token);
        record.getTags().put(ParamRecord.TAG_FLAG, record.getTag(ParamRecord.TAG_LONG_FLAG));
        record.getTags().put(ParamRecord.TAG_INDEX, Integer.toString(index));
        record.getTags().put(ParamRecord.TAG_DESCRIPTION, description == null ? "" : description);
        return this;
    }

    /**
     * Drops the tag that advertised a token from the parameter that held it before.
     */
    private void releaseTag(Optional<ParamAddress> previousOwner, String tagName, String tagValue) {
        previousOwner.filter(owner -> !owner.equals(address))
                .flatMap(registry::lookup)
                .ifPresent(owner -> owner.getTags().remove(tagName, tagValue));
    }

    // ---- Kind-specific decorations ----

    public ParamDeclaration fileExtensions(String extensions) {
        return decorate(ParamDecoration.FILE_EXTENSIONS, extensions);
    }

    public ParamDeclaration type(String type) {
        return decorate(ParamDecoration.TYPE, type);
    }

    public ParamDeclaration multiple(boolean multiple) {
        return decorate(ParamDecoration.MULTIPLE, ValueCodecs.BOOLEAN.encode(multiple));
    }

    public ParamDeclaration coordinateSystem(String coordinateSystem) {
        return decorate(ParamDecoration.COORDINATE_SYSTEM, coordinateSystem);
    }

    /**
     * Admissible values, e.g. {@code enumeration("0.1,0.2,0.3")} or {@code enumeration("a", "b")}.
     */
    public ParamDeclaration enumeration(String... items) {
        String joined = Arrays.stream(items).collect(Collectors.joining(ValueCodecs.SEQUENCE_DELIMITER));
        return decorate(ParamDecoration.ENUMERATION, joined);
    }

    /**
     * Slider range with the default step of 0.01.
     */
    public ParamDeclaration range(double minimum, double maximum) {
        return range(minimum, maximum, DEFAULT_STEP);
    }

    public ParamDeclaration range(double minimum, double maximum, double step) {
        requireDecoration(ParamDecoration.RANGE);
        return constraint("minimum", ValueCodecs.DOUBLE.encode(minimum))
                .constraint("maximum", ValueCodecs.DOUBLE.encode(maximum))
                .constraint("step", ValueCodecs.DOUBLE.encode(step));
    }

    // ---- Value access ----

    public String getText() {
        return record().getText();
    }

    public ParamDeclaration text(String text) {
        record().setText(text);
        return this;
    }

    public <T> T get(ValueCodec<T> codec) {
        return record().getValue(codec);
    }

    public <T> ParamDeclaration value(ValueCodec<T> codec, T value) {
        record().setValue(codec, value);
        return this;
    }

    public ParamDeclaration value(boolean value) {
        return value(ValueCodecs.BOOLEAN, value);
    }

    public ParamDeclaration value(int value) {
        return value(ValueCodecs.INTEGER, value);
    }

    public ParamDeclaration value(float value) {
        return value(ValueCodecs.FLOAT, value);
    }

    public ParamDeclaration value(double value) {
        return value(ValueCodecs.DOUBLE, value);
    }

    public ParamDeclaration value(String value) {
        return value(ValueCodecs.STRING, value);
    }

    private ParamDeclaration decorate(ParamDecoration decoration, String value) {
        requireDecoration(decoration);
        switch (decoration.getTarget()) {
            case TAG -> tag(decoration.getName(), value);
            case ATTRIBUTE -> attribute(decoration.getName(), value);
            case CONSTRAINT -> constraint(decoration.getName(), value);
        }
        return this;
    }

    private void requireDecoration(ParamDecoration decoration) {
        ParamKind kind = getKind();
        if (!kind.supports(decoration)) {
            throw new IllegalStateException("Parameter " + address + " of kind " + kind.getLabel()
                    + " does not support " + decoration.getName());
        }
    }

    private ParamRecord record() {
        return registry.lookup(address).orElseThrow(() -> new ParameterNotFoundException(address));
    }
}
