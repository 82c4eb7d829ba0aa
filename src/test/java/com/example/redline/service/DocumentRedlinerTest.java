package com.example.redline.service;

import com.example.redline.model.DocumentType;
import com.example.redline.model.RedlineOptions;
import com.example.redline.model.RedlineOutcome;
import com.example.redline.util.ooxml.OoxmlPackage;
import com.example.redline.util.sml.SmlComparer;
import com.example.redline.util.wml.WmlComparerSettings;
import com.example.redline.util.xml.XmlUtils;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static com.example.redline.support.OoxmlFixtures.docx;
import static com.example.redline.support.OoxmlFixtures.pptx;
import static com.example.redline.support.OoxmlFixtures.titleShape;
import static com.example.redline.support.OoxmlFixtures.xlsx;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentRedlinerTest {

    private final DocumentRedliner redliner = new DocumentRedliner();

    @Test
    void revisionIdsAcceptNumbersStringsAndObjects() {
        String json = "[3, \"7\", {\"revision_id\": 11}, {\"revision_ids\": [12, 13]}]";

        assertThat(redliner.readRevisionIds(json.getBytes(StandardCharsets.UTF_8)))
                .containsExactly(3, 7, 11, 12, 13);
    }

    @Test
    void revisionIdsRejectMalformedInput() {
        assertThatThrownBy(() -> redliner.readRevisionIds("{\"a\":1}".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> redliner.readRevisionIds("[1,".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> redliner.readRevisionIds("[true]".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void optionsMapOntoWordSettings() {
        RedlineOptions options = new RedlineOptions("Reviewer", "2024-05-06T07:08:09Z", 0.3, true);

        WmlComparerSettings settings = redliner.wmlSettings(options);

        assertThat(settings.getAuthor()).isEqualTo("Reviewer");
        assertThat(settings.getDateTime()).isEqualTo("2024-05-06T07:08:09Z");
        assertThat(settings.getDetailThreshold()).isEqualTo(0.3);
        assertThat(settings.isTrackFormattingChanges()).isTrue();
        assertThat(redliner.smlSettings(options).getAuthorForChanges()).isEqualTo("Reviewer");
        assertThat(redliner.pmlSettings(options).isCompareTextFormatting()).isTrue();
    }

    @Test
    void wordCompareThenApplyAndRevertAllRevisions() {
        byte[] older = docx("The lazy dog.");
        byte[] newer = docx("The active cat.");

        RedlineOutcome outcome = redliner.compare(DocumentType.WORD, older, newer, null);
        byte[] json = redliner.toJson(outcome.getChanges()).getBytes(StandardCharsets.UTF_8);

        assertThat(outcome.getRevisionCount()).isPositive();
        assertThat(outcome.getItems()).isNotEmpty();
        assertThat(bodyText(redliner.apply(DocumentType.WORD, outcome.getDocument(), json))).isEqualTo("The active cat.");
        assertThat(bodyText(redliner.revert(DocumentType.WORD, outcome.getDocument(), json))).isEqualTo("The lazy dog.");
    }

    @Test
    void wordChangesOmitTheDocument() {
        RedlineOutcome outcome = redliner.changes(DocumentType.WORD, docx("one"), docx("two"), null);

        assertThat(outcome.getDocument()).isNull();
        assertThat(outcome.getChanges()).isNotEmpty();
    }

    @Test
    void excelChangesRoundTripThroughJson() {
        byte[] older = xlsx().sheet("Sheet1", "A1=100", "B1=keep").build();
        byte[] newer = xlsx().sheet("Sheet1", "A1=200", "B1=keep", "C1=added").build();

        RedlineOutcome outcome = redliner.changes(DocumentType.EXCEL, older, newer, null);
        byte[] json = redliner.toJson(outcome.getChanges()).getBytes(StandardCharsets.UTF_8);
        byte[] patched = redliner.apply(DocumentType.EXCEL, older, json);

        assertThat(outcome.getDocument()).isNull();
        assertThat(outcome.getRevisionCount()).isEqualTo(2);
        assertThat(SmlComparer.diff(patched, newer, null).getChanges()).isEmpty();
    }

    @Test
    void powerPointCompareProducesDocument() {
        byte[] older = pptx().slide(titleShape(2, "Title 1", "Intro")).build();
        byte[] newer = pptx().slide(titleShape(2, "Title 1", "Welcome")).build();

        RedlineOutcome outcome = redliner.compare(DocumentType.POWERPOINT, older, newer, new RedlineOptions());
        byte[] json = redliner.toJson(outcome.getChanges()).getBytes(StandardCharsets.UTF_8);
        byte[] reverted = redliner.revert(DocumentType.POWERPOINT, newer, json);

        assertThat(outcome.getType()).isEqualTo(DocumentType.POWERPOINT);
        assertThat(outcome.getRevisionCount()).isEqualTo(1);
        assertThat(outcome.getDocument()).isNotNull();
        assertThat(redliner.changes(DocumentType.POWERPOINT, reverted, older, null).getRevisionCount()).isZero();
    }

    private static String bodyText(byte[] document) {
        try (OoxmlPackage pkg = OoxmlPackage.open(document)) {
            Element root = XmlUtils.rootElement(pkg.getXmlPart(pkg.getMainDocumentPath()));
            List<String> texts = new ArrayList<>();
            for (Element p : XmlUtils.descendants(XmlUtils.child(root, "w:body"), "w:p")) {
                texts.add(XmlUtils.collectText(p, "w:t"));
            }
            return String.join("\n", texts);
        }
    }
}
