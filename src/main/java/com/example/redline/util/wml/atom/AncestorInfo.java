package com.example.redline.util.wml.atom;

import com.example.redline.util.xml.Namespaces;
import com.example.redline.util.xml.XmlUtils;
import org.jsoup.nodes.Element;

/**
 * 祖先链上的一个元素
 *
 * 同一个源元素在一次原子化过程中只对应一个 AncestorInfo 实例，
 * 所有原子共享它；重建 Unid 时修改这里即可同时作用于所有原子。
 */
public class AncestorInfo {

    private final Element element;
    private final String name;
    private String unid;
    private final boolean mergedCells;

    public AncestorInfo(Element element) {
        this.element = element;
        this.name = element.tagName();
        String u = XmlUtils.attr(element, Namespaces.PT_UNID);
        this.unid = u == null ? "" : u;
        this.mergedCells = "w:tc".equals(name) && hasMergeMarker(element);
    }

    private static boolean hasMergeMarker(Element tc) {
        Element tcPr = XmlUtils.child(tc, "w:tcPr");
        return XmlUtils.child(tcPr, "w:vMerge") != null || XmlUtils.child(tcPr, "w:gridSpan") != null;
    }

    public Element getElement() {
        return element;
    }

    /**
     * 带前缀的元素名，如 w:p
     */
    public String getName() {
        return name;
    }

    public String getLocalName() {
        return XmlUtils.localName(name);
    }

    public String getUnid() {
        return unid;
    }

    public void setUnid(String unid) {
        this.unid = unid;
    }

    public boolean hasMergedCells() {
        return mergedCells;
    }

    @Override
    public String toString() {
        return name + ":" + unid;
    }
}
