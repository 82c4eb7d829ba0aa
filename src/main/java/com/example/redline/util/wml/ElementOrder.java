package com.example.redline.util.wml;

import com.example.redline.util.xml.XmlUtils;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 按 WordprocessingML schema 规定的顺序重排属性子元素
 *
 * 未登记的元素排在最后，原有相对顺序不变。
 */
public class ElementOrder {

    private static final int UNKNOWN = 999;

    private static final Map<String, Map<String, Integer>> TABLES = new HashMap<>();

    /** 容器中必须排在最前的属性元素 */
    private static final Map<String, String[]> LEADING = new HashMap<>();

    static {
        TABLES.put("w:pPr", ranks("pStyle", "keepNext", "keepLines", "pageBreakBefore", "framePr",
                "widowControl", "numPr", "suppressLineNumbers", "pBdr", "shd", "tabs", "suppressAutoHyphens",
                "kinsoku", "wordWrap", "overflowPunct", "topLinePunct", "autoSpaceDE", "autoSpaceDN", "bidi",
                "adjustRightInd", "snapToGrid", "spacing", "ind", "contextualSpacing", "mirrorIndents",
                "suppressOverlap", "jc", "textDirection", "textAlignment", "textboxTightWrap", "outlineLvl",
                "divId", "cnfStyle", "rPr", "sectPr", "pPrChange"));
        Map<String, Integer> rPr = ranks("moveFrom", "moveTo", "ins", "del", "rStyle", "rFonts", "b", "bCs",
                "i", "iCs", "caps", "smallCaps", "strike", "dstrike", "outline", "shadow", "emboss", "imprint",
                "noProof", "snapToGrid", "vanish", "webHidden", "color", "spacing", "w", "kern", "position",
                "sz", "w14:shadow", "w14:textOutline", "w14:textFill", "w14:scene3d", "w14:props3d", "szCs",
                "highlight", "u", "effect", "bdr", "shd", "fitText", "vertAlign", "rtl", "cs", "em", "lang",
                "eastAsianLayout", "specVanish", "oMath", "rPrChange");
        TABLES.put("w:rPr", rPr);
        TABLES.put("w:tblPr", ranks("tblStyle", "tblpPr", "tblOverlap", "bidiVisual", "tblStyleRowBandSize",
                "tblStyleColBandSize", "tblW", "jc", "tblCellSpacing", "tblInd", "tblBorders", "shd",
                "tblLayout", "tblCellMar", "tblLook", "tblCaption", "tblDescription", "tblPrChange"));
        TABLES.put("w:tcPr", ranks("cnfStyle", "tcW", "gridSpan", "hMerge", "vMerge", "tcBorders", "shd",
                "noWrap", "tcMar", "textDirection", "tcFitText", "vAlign", "hideMark", "headers", "cellIns",
                "cellDel", "cellMerge", "tcPrChange"));
        TABLES.put("w:tblBorders", ranks("top", "left", "start", "bottom", "right", "end", "insideH", "insideV"));
        TABLES.put("w:tcBorders", ranks("top", "start", "left", "bottom", "right", "end", "insideH", "insideV",
                "tl2br", "tr2bl"));
        TABLES.put("w:pBdr", ranks("top", "left", "bottom", "right", "between", "bar"));

        LEADING.put("w:p", new String[]{"w:pPr"});
        LEADING.put("w:r", new String[]{"w:rPr"});
        LEADING.put("w:tbl", new String[]{"w:tblPr", "w:tblGrid"});
        LEADING.put("w:tr", new String[]{"w:tblPrEx", "w:trPr"});
        LEADING.put("w:tc", new String[]{"w:tcPr"});
    }

    private static Map<String, Integer> ranks(String... names) {
        Map<String, Integer> m = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            String name = names[i].indexOf(':') < 0 ? "w:" + names[i] : names[i];
            m.put(name, (i + 1) * 10);
        }
        return m;
    }

    private ElementOrder() {
    }

    /**
     * 重排整棵树
     */
    public static void apply(Element root) {
        for (Element el : root.getAllElements()) {
            String name = el.tagName();
            Map<String, Integer> table = TABLES.get(name);
            if (table != null) {
                sortChildren(el, table);
            }
            String[] leading = LEADING.get(name);
            if (leading != null) {
                moveLeading(el, leading);
            }
        }
    }

    /**
     * 元素在属性容器中的排序值，未登记返回 999
     */
    public static int rankOf(String container, String name) {
        Map<String, Integer> table = TABLES.get(container);
        if (table == null) {
            return UNKNOWN;
        }
        Integer rank = table.get(name);
        return rank == null ? UNKNOWN : rank;
    }

    private static void sortChildren(Element el, final Map<String, Integer> table) {
        List<Element> children = new ArrayList<>(el.children());
        if (children.size() < 2) {
            return;
        }
        List<Element> sorted = new ArrayList<>(children);
        Collections.sort(sorted, new Comparator<Element>() {
            @Override
            public int compare(Element a, Element b) {
                Integer ra = table.get(a.tagName());
                Integer rb = table.get(b.tagName());
                return Integer.compare(ra == null ? UNKNOWN : ra, rb == null ? UNKNOWN : rb);
            }
        });
        if (sorted.equals(children)) {
            return;
        }
        for (Element child : sorted) {
            el.appendChild(child);
        }
    }

    private static void moveLeading(Element el, String[] leading) {
        for (int i = leading.length - 1; i >= 0; i--) {
            Element child = XmlUtils.child(el, leading[i]);
            if (child != null && el.child(0) != child) {
                el.prependChild(child);
            }
        }
    }
}
