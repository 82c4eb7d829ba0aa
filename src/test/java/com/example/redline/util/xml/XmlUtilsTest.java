package com.example.redline.util.xml;

import com.example.redline.exception.RedlineException;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class XmlUtilsTest {

    @Test
    void parseRewritesNonCanonicalPrefixes() {
        Document doc = XmlUtils.parse("<x:document xmlns:x=\"" + Namespaces.W + "\"><x:body>"
                + "<x:p><x:r><x:t x:space=\"keep\">Hi</x:t></x:r></x:p></x:body></x:document>");
        Element root = XmlUtils.rootElement(doc);

        assertThat(root.tagName()).isEqualTo("w:document");
        assertThat(root.hasAttr("xmlns:w")).isTrue();
        assertThat(root.hasAttr("xmlns:x")).isFalse();
        Element t = XmlUtils.firstDescendant(root, "w:t");
        assertThat(t).isNotNull();
        assertThat(XmlUtils.attr(t, "w:space")).isEqualTo("keep");
        assertThat(XmlUtils.ownText(t)).isEqualTo("Hi");
    }

    @Test
    void spreadsheetDefaultNamespaceHasNoPrefix() {
        Document doc = XmlUtils.parse("<workbook xmlns=\"" + Namespaces.S + "\"><sheets><sheet name=\"A\"/></sheets></workbook>");
        Element sheets = XmlUtils.child(XmlUtils.rootElement(doc), "sheets");
        assertThat(XmlUtils.children(sheets, "sheet")).hasSize(1);
    }

    @Test
    void pathAndAncestorNavigate() {
        Document doc = XmlUtils.parse("<w:document xmlns:w=\"" + Namespaces.W + "\"><w:body><w:tbl><w:tr><w:tc>"
                + "<w:p><w:r><w:t>cell</w:t></w:r></w:p></w:tc></w:tr></w:tbl></w:body></w:document>");
        Element root = XmlUtils.rootElement(doc);
        Element tc = XmlUtils.path(root, "w:body", "w:tbl", "w:tr", "w:tc");
        assertThat(tc).isNotNull();
        Element t = XmlUtils.firstDescendant(tc, "w:t");
        assertThat(XmlUtils.ancestor(t, "w:tbl")).isNotNull();
        assertThat(XmlUtils.path(root, "w:body", "w:p")).isNull();
        assertThat(XmlUtils.collectText(root, "w:t")).isEqualTo("cell");
    }

    @Test
    void attrReturnsNullWhenMissing() {
        Element el = XmlUtils.newElement("w:rStyle", "w:val", "Strong");
        assertThat(XmlUtils.attr(el, "w:val")).isEqualTo("Strong");
        assertThat(XmlUtils.attr(el, "w:other")).isNull();
        assertThat(XmlUtils.attr(null, "w:val")).isNull();
    }

    @Test
    void serializeKeepsWhitespaceAndEscapes() {
        Document doc = XmlUtils.parse("<w:t xmlns:w=\"" + Namespaces.W + "\" xml:space=\"preserve\">  a &amp; b  </w:t>");
        String xml = new String(XmlUtils.serialize(doc), StandardCharsets.UTF_8);
        assertThat(xml).contains("  a &amp; b  ");
    }

    @Test
    void canonicalStringSkipsNamespaceDeclarations() {
        Document doc = XmlUtils.parse("<w:rPr xmlns:w=\"" + Namespaces.W + "\"><w:b/><w:sz w:val=\"24\"/></w:rPr>");
        String canonical = XmlUtils.canonicalString(XmlUtils.rootElement(doc), XmlUtils.KEEP_ALL);
        assertThat(canonical).isEqualTo("<w:rPr><w:b/><w:sz w:val=\"24\"/></w:rPr>");
    }

    @Test
    void moveAttributeFirstReordersAttributes() {
        Element ins = XmlUtils.newElement("w:ins", "w:author", "A");
        XmlUtils.setAttr(ins, "w:id", "7");
        XmlUtils.moveAttributeFirst(ins, "w:id");
        assertThat(ins.attributes().asList().get(0).getKey()).isEqualTo("w:id");
    }

    @Test
    void malformedXmlIsReportedAsParseError() {
        assertThatThrownBy(() -> XmlUtils.parse(new byte[0], "word/document.xml"))
                .isInstanceOf(RedlineException.class)
                .satisfies(e -> assertThat(((RedlineException) e).getLocator()).isEqualTo("word/document.xml"));
    }
}
