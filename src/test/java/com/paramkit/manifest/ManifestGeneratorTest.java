package com.paramkit.manifest;

import com.paramkit.ParamApplication;
import com.paramkit.manifest.model.ManifestParameter;
import com.paramkit.manifest.model.ManifestSection;
import com.paramkit.manifest.model.ManifestTag;
import com.paramkit.model.ParamKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ManifestGenerator.
 */
class ManifestGeneratorTest {

    private ParamApplication app;

    @BeforeEach
    void setUp() {
        app = ParamApplication.create("The Big Test", "Does absolutely nothing.");
    }

    @Test
    void testFileParameterWithExtensions() {
        app.declare("Special", "File", ParamKind.FILE)
                .fileExtensions("bli,bla,blbub")
                .index("Input File", 0);

        String xml = app.getXmlDescription();

        assertThat(xml)
                .startsWith("<?xml version=\"1.0\" encoding=\"utf-8\"?>")
                .contains("<file fileExtensions=\"bli,bla,blbub\">")
                .contains("<name>File</name>")
                .contains("<label>Special</label>")
                .contains("<description>Special - Section</description>")
                .contains("<index>0</index>")
                .contains("</file>")
                .doesNotContain("<constraints>");
    }

    @Test
    void testMetadataInSchemaOrder() {
        app.getMetadata().setContributor("Santa").setVersion("1.0").setCategory("Toys");

        String xml = app.getXmlDescription();

        assertThat(xml).containsSubsequence(
                "<executable>",
                "<category>Toys</category>",
                "<title>The Big Test</title>",
                "<description>Does absolutely nothing.</description>",
                "<version>1.0</version>",
                "<contributor>Santa</contributor>",
                "</executable>");
        assertThat(xml).doesNotContain("<license>");
    }

    @Test
    void testEnumerationIsExpanded() {
        app.declare("EnumTypes", "Double Enum", ParamKind.DOUBLE_ENUMERATION)
                .enumeration("0.1,0.2,0.3")
                .value(0.2);

        String xml = app.getXmlDescription();

        assertThat(xml).containsSubsequence(
                "<double-enumeration>",
                "<default>0.2</default>",
                "<enumeration>",
                "<element>0.1</element>",
                "<element>0.2</element>",
                "<element>0.3</element>",
                "</enumeration>",
                "</double-enumeration>");
    }

    @Test
    void testRangeConstraints() {
        app.declare("Special", "Slider", ParamKind.DOUBLE).range(0, 1).value(0.333);

        String xml = app.getXmlDescription();

        assertThat(xml).containsSubsequence(
                "<double>",
                "<default>0.333</default>",
                "<constraints>",
                "<maximum>1.0</maximum>",
                "<minimum>0.0</minimum>",
                "<step>0.01</step>",
                "</constraints>",
                "</double>");
    }

    @Test
    void testTextIsEscaped() {
        app.declare("Basic", "Expr", ParamKind.STRING)
                .flag("a < b & c")
                .value("x<y");

        String xml = app.getXmlDescription();

        assertThat(xml)
                .contains("<description>a &lt; b &amp; c</description>")
                .contains("<default>x&lt;y</default>");
    }

    @Test
    void testSectionsFollowDeclarationOrder() {
        app.declare("Zeta", "A", ParamKind.INTEGER);
        app.declare("Alpha", "B", ParamKind.INTEGER);
        app.declare("Zeta", "C", ParamKind.INTEGER);

        List<ManifestSection> sections = app.getManifestGenerator().buildSections();

        assertThat(sections).extracting(ManifestSection::getLabel).containsExactly("Zeta", "Alpha");
        assertThat(sections.get(0).getParameters()).extracting(ManifestParameter::getName).containsExactly("A", "C");
    }

    @Test
    void testEmptyTagsAreSkipped() {
        app.declare("Basic", "Name", ParamKind.STRING).label("").tag("channel", "input");

        ManifestParameter parameter = app.getManifestGenerator().buildSections().get(0).getParameters().get(0);

        assertThat(parameter.getTags()).extracting(ManifestTag::getName).containsExactly("channel", "longflag");
    }
}
