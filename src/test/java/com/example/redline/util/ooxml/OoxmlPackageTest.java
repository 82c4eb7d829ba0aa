package com.example.redline.util.ooxml;

import com.example.redline.exception.RedlineException;
import com.example.redline.support.OoxmlFixtures;
import com.example.redline.util.xml.XmlUtils;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OoxmlPackageTest {

    @Test
    void resolvesMainDocumentAndReadsParts() {
        try (OoxmlPackage pkg = OoxmlPackage.open(OoxmlFixtures.docx("Hello"))) {
            String main = pkg.getMainDocumentPath();
            assertThat(main).isEqualTo("word/document.xml");
            Document doc = pkg.getXmlPart(main);
            assertThat(XmlUtils.collectText(XmlUtils.rootElement(doc), "w:t")).isEqualTo("Hello");
            assertThat(pkg.getPart("word/missing.xml")).isNull();
            assertThat(pkg.getOptionalXmlPart("word/missing.xml")).isNull();
        }
    }

    @Test
    void missingXmlPartThrows() {
        try (OoxmlPackage pkg = OoxmlPackage.open(OoxmlFixtures.docx("Hello"))) {
            assertThatThrownBy(() -> pkg.getXmlPart("word/styles.xml"))
                    .isInstanceOf(RedlineException.class)
                    .extracting(e -> ((RedlineException) e).getKind())
                    .isEqualTo(RedlineException.ErrorKind.MISSING_PART);
        }
    }

    @Test
    void garbageBytesArePackageErrors() {
        assertThatThrownBy(() -> OoxmlPackage.open("not a zip".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(RedlineException.class)
                .satisfies(e -> assertThat(((RedlineException) e).isInputError()).isTrue());
        assertThatThrownBy(() -> OoxmlPackage.open(new byte[0])).isInstanceOf(RedlineException.class);
    }

    @Test
    void createdPartsAndRelationshipsSurviveSave() {
        byte[] saved;
        try (OoxmlPackage pkg = OoxmlPackage.open(OoxmlFixtures.docx("Hello"))) {
            pkg.createPart("word/extra.xml", "application/xml", "<extra/>".getBytes(StandardCharsets.UTF_8));
            String relId = pkg.addRelationship("word/document.xml", "word/extra.xml",
                    "http://example.com/relationships/extra");
            assertThat(relId).isNotEmpty();
            saved = pkg.save();
        }
        try (OoxmlPackage pkg = OoxmlPackage.open(saved)) {
            assertThat(pkg.partExists("word/extra.xml")).isTrue();
            assertThat(pkg.getRelatedPart("word/document.xml", "http://example.com/relationships/extra"))
                    .isEqualTo("word/extra.xml");
            assertThat(pkg.listParts()).contains("word/document.xml", "word/extra.xml");
        }
    }

    @Test
    void readsCoreProperties() {
        byte[] docx = OoxmlFixtures.docxBody(OoxmlFixtures.paragraph("x"), "Alice");
        try (OoxmlPackage pkg = OoxmlPackage.open(docx)) {
            assertThat(pkg.getCoreProperty("lastModifiedBy")).isEqualTo("Alice");
            assertThat(pkg.getCoreProperty("creator")).isEqualTo("creator");
            assertThat(pkg.getCoreProperty("modified")).isEqualTo("2024-01-02T03:04:05Z");
            assertThat(pkg.getCoreProperty("title")).isNull();
        }
    }

    @Test
    void directoryOfStripsFileName() {
        assertThat(OoxmlPackage.directoryOf("word/document.xml")).isEqualTo("word");
        assertThat(OoxmlPackage.directoryOf("document.xml")).isEmpty();
    }
}
