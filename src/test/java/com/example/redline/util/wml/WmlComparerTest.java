package com.example.redline.util.wml;

import com.example.redline.util.ooxml.OoxmlPackage;
import com.example.redline.util.wml.dto.WmlChange;
import com.example.redline.util.wml.dto.WmlChangeType;
import com.example.redline.util.wml.dto.WmlComparisonResult;
import com.example.redline.util.xml.XmlUtils;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.redline.support.OoxmlFixtures.docx;
import static com.example.redline.support.OoxmlFixtures.docxBody;
import static com.example.redline.support.OoxmlFixtures.docxParts;
import static com.example.redline.support.OoxmlFixtures.docxWithImages;
import static com.example.redline.support.OoxmlFixtures.drawing;
import static com.example.redline.support.OoxmlFixtures.paragraph;
import static com.example.redline.support.OoxmlFixtures.run;
import static com.example.redline.support.OoxmlFixtures.table;
import static com.example.redline.support.OoxmlFixtures.vmlTextbox;
import static org.assertj.core.api.Assertions.assertThat;

class WmlComparerTest {

    @Test
    void identicalDocumentsProduceNoRevisions() {
        byte[] doc = docx("The quick brown fox.", "Second paragraph.");

        WmlComparisonResult result = WmlComparer.compare(doc, doc);

        assertThat(result.getChanges()).isEmpty();
        assertThat(result.getRevisionCount()).isZero();
        assertThat(paragraphTexts(result.getDocument())).containsExactly("The quick brown fox.", "Second paragraph.");
    }

    @Test
    void replacedWordsBecomeDeletionsAndInsertions() {
        byte[] older = docx("The quick brown fox jumps over the lazy dog.");
        byte[] newer = docx("The quick brown fox jumps over the active cat.");

        WmlComparisonResult result = WmlComparer.compare(older, newer);

        String deleted = joined(result.getChanges(), WmlChangeType.TextDeleted, true);
        String inserted = joined(result.getChanges(), WmlChangeType.TextInserted, false);
        assertThat(deleted).contains("lazy").contains("dog").doesNotContain("quick");
        assertThat(inserted).contains("active").contains("cat").doesNotContain("quick");
        assertThat(result.getRevisionCount()).isGreaterThanOrEqualTo(2);
        for (WmlChange change : result.getChanges()) {
            assertThat(change.getParagraphIndex()).isEqualTo(1);
        }
    }

    @Test
    void changesStayInsideTheEditedParagraphs() {
        byte[] older = docx("Alpha one.", "12,34 items", "Gamma three.", "Test.", "Epsilon five.");
        byte[] newer = docx("Alpha one.", "12,4 items", "Gamma three.", "st.", "Epsilon five.");

        WmlComparisonResult result = WmlComparer.compare(older, newer);

        Set<Integer> touched = new HashSet<>();
        for (WmlChange change : result.getChanges()) {
            touched.add(change.getParagraphIndex());
        }
        assertThat(touched).containsExactlyInAnyOrder(2, 4);
        assertThat(inParagraph(result.getChanges(), 2)).extracting(WmlChange::getChangeType)
                .containsExactly(WmlChangeType.TextDeleted);
        assertThat(inParagraph(result.getChanges(), 2)).extracting(WmlChange::getOldText).containsExactly("3");
        assertThat(inParagraph(result.getChanges(), 4)).extracting(WmlChange::getChangeType)
                .containsExactly(WmlChangeType.TextDeleted);
        assertThat(inParagraph(result.getChanges(), 4)).extracting(WmlChange::getOldText).containsExactly("Te");
        assertThat(result.getChanges()).noneMatch(c -> c.getChangeType() == WmlChangeType.TextInserted);
    }

    @Test
    void acceptAndRejectRestoreEachSide() {
        byte[] older = docx("Alpha one.", "12,34 items", "Test.");
        byte[] newer = docx("Alpha one.", "12,4 items", "st.");

        byte[] redline = WmlComparer.compare(older, newer).getDocument();

        assertThat(paragraphTexts(WmlRevisionProcessor.acceptAll(redline)))
                .containsExactly("Alpha one.", "12,4 items", "st.");
        assertThat(paragraphTexts(WmlRevisionProcessor.rejectAll(redline)))
                .containsExactly("Alpha one.", "12,34 items", "Test.");
    }

    @Test
    void revisionIdsAreUniqueAndStartFromSetting() {
        WmlComparerSettings settings = new WmlComparerSettings();
        settings.setStartingRevisionId(100);
        byte[] older = docx("one two three", "four five six");
        byte[] newer = docx("one 2 three", "four five seven", "eight");

        WmlComparisonResult result = WmlComparer.compare(older, newer, settings);

        List<Integer> ids = new ArrayList<>();
        for (WmlChange change : result.getChanges()) {
            ids.add(change.getRevisionId());
        }
        assertThat(ids).isNotEmpty().doesNotHaveDuplicates();
        assertThat(ids).allMatch(id -> id >= 100);
    }

    @Test
    void explicitAuthorAndDateAreStamped() {
        WmlComparerSettings settings = new WmlComparerSettings();
        settings.setAuthor("Reviewer");
        settings.setDateTime("2024-05-06T07:08:09Z");

        WmlComparisonResult result = WmlComparer.compare(docx("red apple"), docx("green apple"), settings);

        assertThat(result.getChanges()).isNotEmpty();
        for (WmlChange change : result.getChanges()) {
            assertThat(change.getAuthor()).isEqualTo("Reviewer");
            assertThat(change.getDateTime()).isEqualTo("2024-05-06T07:08:09Z");
        }
    }

    @Test
    void authorFallsBackToLastModifiedByOfNewerDocument() {
        byte[] older = docxBody(paragraph("red apple"), "Bob");
        byte[] newer = docxBody(paragraph("green apple"), "Alice");

        WmlComparisonResult result = WmlComparer.compare(older, newer);

        assertThat(result.getChanges()).isNotEmpty();
        assertThat(result.getChanges()).allMatch(c -> "Alice".equals(c.getAuthor()));
    }

    @Test
    void footnoteReferenceSurvivesAlongsideTextEdit() {
        String footnotes = "<w:footnote w:type=\"separator\" w:id=\"-1\"><w:p><w:r><w:separator/></w:r></w:p></w:footnote>"
                + "<w:footnote w:type=\"continuationSeparator\" w:id=\"0\"><w:p><w:r><w:continuationSeparator/></w:r></w:p></w:footnote>"
                + "<w:footnote w:id=\"1\"><w:p>" + run(null, "A note.") + "</w:p></w:footnote>";
        String ref = "<w:r><w:rPr><w:rStyle w:val=\"FootnoteReference\"/></w:rPr><w:footnoteReference w:id=\"1\"/></w:r>";
        byte[] older = docxParts("<w:p>" + run(null, "The original sentence") + ref + run(null, " ends here.") + "</w:p>",
                null, footnotes);
        byte[] newer = docxParts("<w:p>" + run(null, "The modified sentence") + ref + run(null, " ends here.") + "</w:p>",
                null, footnotes);

        WmlComparisonResult result = WmlComparer.compare(older, newer);

        assertThat(joined(result.getChanges(), WmlChangeType.TextDeleted, true)).contains("original");
        assertThat(joined(result.getChanges(), WmlChangeType.TextInserted, false)).contains("modified");
        assertThat(result.getChanges()).noneMatch(WmlChange::isInFootnote);
        try (OoxmlPackage pkg = OoxmlPackage.open(result.getDocument())) {
            Element body = XmlUtils.rootElement(pkg.getXmlPart(pkg.getMainDocumentPath()));
            List<Element> refs = XmlUtils.descendants(body, "w:footnoteReference");
            assertThat(refs).hasSize(1);
            assertThat(XmlUtils.ancestor(refs.get(0), "w:ins")).isNull();
            assertThat(XmlUtils.ancestor(refs.get(0), "w:del")).isNull();
        }
    }

    @Test
    void formattingChangeIsTrackedWhenEnabled() {
        WmlComparerSettings settings = new WmlComparerSettings();
        settings.setTrackFormattingChanges(true);
        byte[] older = docxBody("<w:p>" + run("<w:b/>", "Hello") + "</w:p>", null);
        byte[] newer = docxBody("<w:p>" + run("<w:i/>", "Hello") + "</w:p>", null);

        WmlComparisonResult result = WmlComparer.compare(older, newer, settings);

        assertThat(result.getChanges()).isNotEmpty()
                .allMatch(c -> c.getChangeType() == WmlChangeType.FormatChanged);
        assertThat(result.getFormatChanges()).isPositive();
        try (OoxmlPackage pkg = OoxmlPackage.open(result.getDocument())) {
            Element body = XmlUtils.rootElement(pkg.getXmlPart(pkg.getMainDocumentPath()));
            Element change = XmlUtils.firstDescendant(body, "w:rPrChange");
            assertThat(change).isNotNull();
            assertThat(XmlUtils.child(change.parent(), "w:i")).isNotNull();
            assertThat(XmlUtils.child(XmlUtils.child(change, "w:rPr"), "w:b")).isNotNull();
        }
    }

    @Test
    void formattingChangeIsIgnoredByDefault() {
        byte[] older = docxBody("<w:p>" + run("<w:b/>", "Hello") + "</w:p>", null);
        byte[] newer = docxBody("<w:p>" + run("<w:i/>", "Hello") + "</w:p>", null);

        WmlComparisonResult result = WmlComparer.compare(older, newer);

        assertThat(result.getChanges()).isEmpty();
    }

    @Test
    void propertiesComeFirstInParagraphsAndRuns() {
        byte[] older = docxBody("<w:p><w:pPr><w:jc w:val=\"center\"/></w:pPr>" + run("<w:b/>", "bold words here") + "</w:p>",
                null);
        byte[] newer = docxBody("<w:p><w:pPr><w:jc w:val=\"center\"/></w:pPr>" + run("<w:b/>", "bold text here") + "</w:p>"
                + paragraph("tail"), null);

        byte[] redline = WmlComparer.compare(older, newer).getDocument();

        try (OoxmlPackage pkg = OoxmlPackage.open(redline)) {
            Element body = XmlUtils.rootElement(pkg.getXmlPart(pkg.getMainDocumentPath()));
            for (Element p : XmlUtils.descendants(body, "w:p")) {
                if (XmlUtils.child(p, "w:pPr") != null) {
                    assertThat(p.child(0).tagName()).isEqualTo("w:pPr");
                }
            }
            for (Element r : XmlUtils.descendants(body, "w:r")) {
                if (XmlUtils.child(r, "w:rPr") != null) {
                    assertThat(r.child(0).tagName()).isEqualTo("w:rPr");
                }
            }
        }
    }

    @Test
    void changesCanBeReadBackFromTheRedline() {
        WmlComparisonResult result = WmlComparer.compare(docx("one two"), docx("one three"));

        List<WmlChange> reread = WmlComparer.getChanges(result.getDocument());

        assertThat(reread).hasSameSizeAs(result.getChanges());
        assertThat(WmlRevisionProcessor.countRevisions(result.getDocument()).getTotal()).isPositive();
    }

    // —— 表格 —— //

    @Test
    void cellEditStaysInsideItsCell() {
        byte[] older = docxBody(table(new String[]{"a1", "b1"}, new String[]{"a2", "b2"}, new String[]{"a3", "b3"}), null);
        byte[] newer = docxBody(table(new String[]{"a1", "b1"}, new String[]{"a2", "CHANGED"}, new String[]{"a3", "b3"}),
                null);

        WmlComparisonResult result = WmlComparer.compare(older, newer);

        Element body = bodyOf(result.getDocument());
        List<Element> tables = XmlUtils.descendants(body, "w:tbl");
        assertThat(tables).hasSize(1);
        List<Element> rows = XmlUtils.children(tables.get(0), "w:tr");
        assertThat(rows).hasSize(3);
        for (Element tr : rows) {
            assertThat(XmlUtils.children(tr, "w:tc")).hasSize(2);
            Element trPr = XmlUtils.child(tr, "w:trPr");
            if (trPr != null) {
                assertThat(XmlUtils.child(trPr, "w:ins")).isNull();
                assertThat(XmlUtils.child(trPr, "w:del")).isNull();
            }
        }
        Element edited = XmlUtils.children(rows.get(1), "w:tc").get(1);
        List<Element> cellParagraphs = XmlUtils.children(edited, "w:p");
        assertThat(cellParagraphs).hasSize(1);
        assertThat(XmlUtils.child(cellParagraphs.get(0), "w:del")).isNotNull();
        assertThat(XmlUtils.child(cellParagraphs.get(0), "w:ins")).isNotNull();
        assertThat(XmlUtils.collectText(XmlUtils.children(rows.get(1), "w:tc").get(0), "w:t")).isEqualTo("a2");

        assertThat(result.getChanges()).noneMatch(c -> c.getChangeType() == WmlChangeType.TableRowInserted
                || c.getChangeType() == WmlChangeType.TableRowDeleted);
        assertThat(joined(result.getChanges(), WmlChangeType.TextDeleted, true)).contains("b2");
        assertThat(joined(result.getChanges(), WmlChangeType.TextInserted, false)).contains("CHANGED");
    }

    @Test
    void insertedRowIsMarkedOnItsRowProperties() {
        byte[] older = docxBody(table(new String[]{"a1", "b1"}, new String[]{"a3", "b3"}), null);
        byte[] newer = docxBody(table(new String[]{"a1", "b1"}, new String[]{"a2", "b2"}, new String[]{"a3", "b3"}), null);

        WmlComparisonResult result = WmlComparer.compare(older, newer);

        List<Element> rows = XmlUtils.children(XmlUtils.firstDescendant(bodyOf(result.getDocument()), "w:tbl"), "w:tr");
        assertThat(rows).hasSize(3);
        for (int i = 0; i < rows.size(); i++) {
            Element trPr = XmlUtils.child(rows.get(i), "w:trPr");
            Element ins = trPr == null ? null : XmlUtils.child(trPr, "w:ins");
            if (i == 1) {
                assertThat(ins).isNotNull();
            } else {
                assertThat(ins).isNull();
            }
            assertThat(XmlUtils.children(rows.get(i), "w:tc")).hasSize(2);
        }
        assertThat(result.getChanges()).filteredOn(c -> c.getChangeType() == WmlChangeType.TableRowInserted).hasSize(1);
        assertThat(result.getChanges()).noneMatch(c -> c.getChangeType() == WmlChangeType.TableRowDeleted);
    }

    // —— 脚注 —— //

    @Test
    void footnoteTextEditKeepsOneParagraph() {
        String ref = "<w:r><w:rPr><w:rStyle w:val=\"FootnoteReference\"/></w:rPr><w:footnoteReference w:id=\"1\"/></w:r>";
        String body = "<w:p>" + run(null, "Body text") + ref + "</w:p>";
        byte[] older = docxParts(body, null, "<w:footnote w:id=\"1\"><w:p>" + run(null, "The note says alpha here.")
                + "</w:p></w:footnote>");
        byte[] newer = docxParts(body, null, "<w:footnote w:id=\"1\"><w:p>" + run(null, "The note says beta here.")
                + "</w:p></w:footnote>");

        WmlComparisonResult result = WmlComparer.compare(older, newer);

        try (OoxmlPackage pkg = OoxmlPackage.open(result.getDocument())) {
            Element root = XmlUtils.rootElement(pkg.getXmlPart("word/footnotes.xml"));
            Element note = null;
            for (Element footnote : XmlUtils.children(root, "w:footnote")) {
                if ("1".equals(XmlUtils.attr(footnote, "w:id"))) {
                    note = footnote;
                }
            }
            assertThat(note).isNotNull();
            List<Element> paragraphs = XmlUtils.children(note, "w:p");
            assertThat(paragraphs).hasSize(1);
            assertThat(XmlUtils.child(paragraphs.get(0), "w:del")).isNotNull();
            assertThat(XmlUtils.child(paragraphs.get(0), "w:ins")).isNotNull();
        }
        assertThat(result.getChanges()).isNotEmpty().allMatch(WmlChange::isInFootnote);
        assertThat(joined(result.getChanges(), WmlChangeType.TextDeleted, true)).contains("alpha");
        assertThat(joined(result.getChanges(), WmlChangeType.TextInserted, false)).contains("beta");
    }

    // —— 文本框 —— //

    @Test
    void editedTextboxIsNotSplit() {
        byte[] older = docxBody("<w:p>" + run(null, "Before box ") + vmlTextbox("Box says hello there.") + "</w:p>", null);
        byte[] newer = docxBody("<w:p>" + run(null, "Before box ") + vmlTextbox("Box says goodbye there.") + "</w:p>", null);

        WmlComparisonResult result = WmlComparer.compare(older, newer);

        Element body = bodyOf(result.getDocument());
        List<Element> picts = XmlUtils.descendants(body, "w:pict");
        assertThat(picts).hasSize(1);
        assertThat(XmlUtils.descendants(body, "v:textbox")).hasSize(1);
        assertThat(XmlUtils.ancestor(picts.get(0), "w:ins")).isNull();
        assertThat(XmlUtils.ancestor(picts.get(0), "w:del")).isNull();
        Element content = XmlUtils.firstDescendant(picts.get(0), "w:txbxContent");
        assertThat(XmlUtils.collectText(content, "w:t")).isEqualTo("Box says goodbye there.");
        assertThat(XmlUtils.descendants(content, "w:ins")).isEmpty();
        assertThat(XmlUtils.descendants(content, "w:del")).isEmpty();
    }

    @Test
    void insertedTextboxIsMarkedOnItsRun() {
        byte[] older = docxBody("<w:p>" + run(null, "Before box ") + "</w:p>", null);
        byte[] newer = docxBody("<w:p>" + run(null, "Before box ") + vmlTextbox("A brand new box.") + "</w:p>", null);

        WmlComparisonResult result = WmlComparer.compare(older, newer);

        Element body = bodyOf(result.getDocument());
        List<Element> picts = XmlUtils.descendants(body, "w:pict");
        assertThat(picts).hasSize(1);
        assertThat(XmlUtils.ancestor(picts.get(0), "w:ins")).isNotNull();
        Element content = XmlUtils.firstDescendant(picts.get(0), "w:txbxContent");
        assertThat(XmlUtils.collectText(content, "w:t")).isEqualTo("A brand new box.");
        assertThat(XmlUtils.descendants(content, "w:ins")).isEmpty();
    }

    // —— 图片 —— //

    @Test
    void sameImageUnderDifferentRelationshipIdIsUnchanged() {
        Map<String, String[]> images1 = new LinkedHashMap<>();
        images1.put("rId5", new String[]{"media/image1.png", "PNG-BYTES-LOGO"});
        Map<String, String[]> images2 = new LinkedHashMap<>();
        images2.put("rId9", new String[]{"media/image7.png", "PNG-BYTES-LOGO"});
        byte[] older = docxWithImages("<w:p>" + run(null, "Logo: ") + drawing("rId5") + "</w:p>", images1);
        byte[] newer = docxWithImages("<w:p>" + run(null, "Logo: ") + drawing("rId9") + "</w:p>", images2);

        WmlComparisonResult result = WmlComparer.compare(older, newer);

        assertThat(result.getChanges()).isEmpty();
        try (OoxmlPackage pkg = OoxmlPackage.open(result.getDocument())) {
            String main = pkg.getMainDocumentPath();
            Element body = XmlUtils.rootElement(pkg.getXmlPart(main));
            List<Element> drawings = XmlUtils.descendants(body, "w:drawing");
            assertThat(drawings).hasSize(1);
            assertThat(XmlUtils.ancestor(drawings.get(0), "w:ins")).isNull();
            assertThat(XmlUtils.ancestor(drawings.get(0), "w:del")).isNull();
            String relId = XmlUtils.attr(XmlUtils.firstDescendant(drawings.get(0), "a:blip"), "r:embed");
            String target = pkg.resolveRelationshipTarget(main, relId);
            assertThat(target).isNotNull();
            assertThat(pkg.partExists(target)).isTrue();
        }
    }

    @Test
    void replacedImageBytesAreReported() {
        Map<String, String[]> images1 = new LinkedHashMap<>();
        images1.put("rId5", new String[]{"media/image1.png", "PNG-BYTES-OLD"});
        Map<String, String[]> images2 = new LinkedHashMap<>();
        images2.put("rId5", new String[]{"media/image1.png", "PNG-BYTES-NEW"});
        byte[] older = docxWithImages("<w:p>" + run(null, "Logo: ") + drawing("rId5") + "</w:p>", images1);
        byte[] newer = docxWithImages("<w:p>" + run(null, "Logo: ") + drawing("rId5") + "</w:p>", images2);

        WmlComparisonResult result = WmlComparer.compare(older, newer);

        assertThat(result.getChanges()).extracting(WmlChange::getChangeType)
                .containsAnyOf(WmlChangeType.ImageDeleted, WmlChangeType.ImageInserted, WmlChangeType.ImageReplaced);
        assertThat(XmlUtils.descendants(bodyOf(result.getDocument()), "w:drawing")).hasSize(2);
    }

    // —— 属性顺序 —— //

    @Test
    void propertyChildrenFollowSchemaOrder() {
        String pPr = "<w:pPr><w:jc w:val=\"center\"/><w:spacing w:after=\"0\"/><w:keepNext/></w:pPr>";
        String rPr = "<w:sz w:val=\"28\"/><w:color w:val=\"FF0000\"/><w:b/>";
        byte[] older = docxBody("<w:p>" + pPr + run(rPr, "ordered words here") + "</w:p>", null);
        byte[] newer = docxBody("<w:p>" + pPr + run(rPr, "ordered text here") + "</w:p>", null);

        byte[] redline = WmlComparer.compare(older, newer).getDocument();

        Element body = bodyOf(redline);
        for (Element props : XmlUtils.descendants(body, "w:pPr")) {
            assertThat(childNames(props)).containsSubsequence("w:keepNext", "w:spacing", "w:jc");
        }
        List<Element> runProps = new ArrayList<>();
        for (Element r : XmlUtils.descendants(body, "w:r")) {
            Element props = XmlUtils.child(r, "w:rPr");
            if (props != null) {
                runProps.add(props);
            }
        }
        assertThat(runProps).isNotEmpty();
        for (Element props : runProps) {
            assertThat(childNames(props)).containsExactly("w:b", "w:color", "w:sz");
        }
    }

    // ==================== 工具 ====================

    private static String joined(List<WmlChange> changes, WmlChangeType type, boolean old) {
        StringBuilder sb = new StringBuilder();
        for (WmlChange change : changes) {
            if (change.getChangeType() == type) {
                String text = old ? change.getOldText() : change.getNewText();
                sb.append(text == null ? "" : text).append('|');
            }
        }
        return sb.toString();
    }

    private static List<WmlChange> inParagraph(List<WmlChange> changes, int index) {
        List<WmlChange> result = new ArrayList<>();
        for (WmlChange change : changes) {
            if (change.getParagraphIndex() != null && change.getParagraphIndex() == index) {
                result.add(change);
            }
        }
        return result;
    }

    private static Element bodyOf(byte[] document) {
        try (OoxmlPackage pkg = OoxmlPackage.open(document)) {
            return XmlUtils.child(XmlUtils.rootElement(pkg.getXmlPart(pkg.getMainDocumentPath())), "w:body");
        }
    }

    private static List<String> childNames(Element el) {
        List<String> names = new ArrayList<>();
        for (Element child : el.children()) {
            names.add(child.tagName());
        }
        return names;
    }

    /**
     * 正文段落的可见文本（w:t），不含删除文本
     */
    static List<String> paragraphTexts(byte[] document) {
        try (OoxmlPackage pkg = OoxmlPackage.open(document)) {
            Element root = XmlUtils.rootElement(pkg.getXmlPart(pkg.getMainDocumentPath()));
            Element body = XmlUtils.child(root, "w:body");
            List<String> texts = new ArrayList<>();
            for (Element p : XmlUtils.descendants(body, "w:p")) {
                texts.add(XmlUtils.collectText(p, "w:t"));
            }
            return texts;
        }
    }
}
