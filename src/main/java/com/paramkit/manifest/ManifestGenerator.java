package com.paramkit.manifest;

import com.paramkit.codec.ValueCodecs;
import com.paramkit.exception.ManifestRenderException;
import com.paramkit.manifest.model.ManifestEntry;
import com.paramkit.manifest.model.ManifestParameter;
import com.paramkit.manifest.model.ManifestSection;
import com.paramkit.manifest.model.ManifestTag;
import com.paramkit.model.ApplicationMetadata;
import com.paramkit.model.ParamRecord;
import com.paramkit.registry.ParamRegistry;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the XML description of all parameters that host tools use to build a GUI.
 *
 * The document lists the application metadata in schema order, then one
 * "parameters" group per section. Only reads the registry.
 */
public class ManifestGenerator {
    private static final Logger log = LoggerFactory.getLogger(ManifestGenerator.class);

    static final String TEMPLATE_NAME = "manifest.ftlx";

    private final ParamRegistry registry;
    private final ApplicationMetadata metadata;
    private final Configuration freemarkerConfig;

    public ManifestGenerator(ParamRegistry registry, ApplicationMetadata metadata) {
        this.registry = registry;
        this.metadata = metadata;
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * Generates the manifest document.
     *
     * @throws ManifestRenderException if the template cannot be loaded or processed
     */
    public String generate() {
        Map<String, Object> model = new HashMap<>();
        model.put("metadata", buildMetadata());
        model.put("sections", buildSections());

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            StringWriter writer = new StringWriter();
            template.process(model, writer);
            log.debug("Rendered manifest for {} parameters", registry.size());
            return writer.toString();
        } catch (IOException | TemplateException e) {
            throw new ManifestRenderException("Failed to render manifest: " + e.getMessage(), e);
        }
    }

    List<ManifestEntry> buildMetadata() {
        List<ManifestEntry> entries = new ArrayList<>();
        metadata.asMap().forEach((name, value) -> entries.add(new ManifestEntry(name, value)));
        return entries;
    }

    List<ManifestSection> buildSections() {
        List<ManifestSection> sections = new ArrayList<>();
        for (String section : registry.sections()) {
            ManifestSection.ManifestSectionBuilder builder = ManifestSection.builder()
                    .label(section)
                    .description(section + " - Section");
            registry.section(section).forEach((key, record) -> builder.parameter(toParameter(key, record)));
            sections.add(builder.build());
        }
        return sections;
    }

    private ManifestParameter toParameter(String key, ParamRecord record) {
        ManifestParameter.ManifestParameterBuilder builder = ManifestParameter.builder()
                .kind(record.getKind().getLabel())
                .name(key)
                .defaultValue(record.getText());

        record.getAttributes().forEach((name, value) -> {
            if (!value.isEmpty()) {
                builder.attribute(new ManifestEntry(name, value));
            }
        });

        record.getTags().forEach((name, value) -> {
            // the name element comes from the key
            if (value.isEmpty() || ParamRecord.TAG_NAME.equals(name)) {
                return;
            }
            if (ParamRecord.TAG_ENUMERATION.equals(name)) {
                List<String> elements = ValueCodecs.STRING_LIST.decode(value);
                if (!elements.isEmpty()) {
                    builder.tag(ManifestTag.builder().name(name).enumeration(true).elements(elements).build());
                }
            } else {
                builder.tag(ManifestTag.builder().name(name).value(value).build());
            }
        });

        record.getConstraints().forEach((name, value) -> builder.constraint(new ManifestEntry(name, value)));
        return builder.build();
    }
}
