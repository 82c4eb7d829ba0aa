package com.example.redline.util.wml;

import com.example.redline.util.xml.XmlUtils;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ElementOrderTest {

    @Test
    void sortsParagraphAndRunProperties() {
        Element root = XmlUtils.rootElement(XmlUtils.parse("<w:p>"
                + "<w:r><w:t>x</w:t><w:rPr><w:lang w:val=\"en-US\"/><w:sz w:val=\"24\"/><w:b/><w:rFonts w:ascii=\"Arial\"/></w:rPr></w:r>"
                + "<w:pPr><w:rPr><w:i/></w:rPr><w:jc w:val=\"left\"/><w:pStyle w:val=\"Heading1\"/></w:pPr>"
                + "</w:p>"));

        ElementOrder.apply(root);

        assertThat(names(root)).containsExactly("w:pPr", "w:r");
        assertThat(names(XmlUtils.child(root, "w:pPr"))).containsExactly("w:pStyle", "w:jc", "w:rPr");
        Element r = XmlUtils.child(root, "w:r");
        assertThat(names(r)).containsExactly("w:rPr", "w:t");
        assertThat(names(XmlUtils.child(r, "w:rPr"))).containsExactly("w:rFonts", "w:b", "w:sz", "w:lang");
    }

    @Test
    void unknownChildrenGoLastInOriginalOrder() {
        Element root = XmlUtils.rootElement(XmlUtils.parse(
                "<w:tcPr><w:foo/><w:vAlign w:val=\"center\"/><w:bar/><w:tcW w:w=\"100\"/></w:tcPr>"));

        ElementOrder.apply(root);

        assertThat(names(root)).containsExactly("w:tcW", "w:vAlign", "w:foo", "w:bar");
        assertThat(ElementOrder.rankOf("w:tcPr", "w:foo")).isEqualTo(999);
        assertThat(ElementOrder.rankOf("w:rPr", "w:b")).isLessThan(ElementOrder.rankOf("w:rPr", "w:sz"));
    }

    @Test
    void tableRowPropertiesComeFirst() {
        Element root = XmlUtils.rootElement(XmlUtils.parse(
                "<w:tbl><w:tr><w:tc><w:p/></w:tc><w:trPr><w:cantSplit/></w:trPr></w:tr>"
                        + "<w:tblGrid><w:gridCol/></w:tblGrid><w:tblPr><w:tblW w:w=\"0\"/></w:tblPr></w:tbl>"));

        ElementOrder.apply(root);

        assertThat(names(root)).containsExactly("w:tblPr", "w:tblGrid", "w:tr");
        assertThat(names(XmlUtils.child(root, "w:tr"))).containsExactly("w:trPr", "w:tc");
    }

    private static List<String> names(Element el) {
        List<String> names = new ArrayList<>();
        for (Element child : el.children()) {
            names.add(child.tagName());
        }
        return names;
    }
}
