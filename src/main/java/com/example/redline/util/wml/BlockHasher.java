package com.example.redline.util.wml;

import com.example.redline.util.common.HashUtils;
import com.example.redline.util.xml.Namespaces;
import com.example.redline.util.xml.XmlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 块级内容哈希（段落、表格、行、文本框）
 *
 * 哈希在接受修订后的树上计算，按 Unid 写回目标树的 pt14:CorrelatedSHA1Hash，
 * 比对时内容相同的块可以整块配对。
 */
@Slf4j
public class BlockHasher {

    private final boolean caseInsensitive;
    private final boolean conflateSpaces;
    private final boolean trackFormatting;

    private BlockHasher(WmlComparerSettings settings) {
        this.caseInsensitive = settings.isCaseInsensitive();
        this.conflateSpaces = settings.isConflateSpaces();
        this.trackFormatting = settings.isTrackFormattingChanges();
    }

    /**
     * 计算 processed 中各块的哈希并写回 target 中同 Unid 的元素
     */
    public static int apply(Element target, Element processed, WmlComparerSettings settings) {
        Map<String, Element> byUnid = new HashMap<>();
        for (Element el : target.getAllElements()) {
            String unid = XmlUtils.attr(el, Namespaces.PT_UNID);
            if (unid != null && isBlock(el)) {
                byUnid.put(unid, el);
            }
        }
        BlockHasher hasher = new BlockHasher(settings);
        int count = 0;
        for (Element el : processed.getAllElements()) {
            if (!isBlock(el)) {
                continue;
            }
            Element dest = byUnid.get(XmlUtils.attr(el, Namespaces.PT_UNID));
            if (dest != null) {
                XmlUtils.setAttr(dest, Namespaces.PT_CORRELATED_SHA1, hasher.hash(el));
                count++;
            }
        }
        log.debug("块级哈希: blocks={}", count);
        return count;
    }

    private static boolean isBlock(Element el) {
        String name = el.tagName();
        return name.equals("w:p") || name.equals("w:tbl") || name.equals("w:tr") || name.equals("w:txbxContent");
    }

    String hash(Element block) {
        StringBuilder sb = new StringBuilder();
        write(block, sb);
        return HashUtils.sha1(sb.toString());
    }

    // ==================== 规范化序列化 ====================

    private void write(Node node, StringBuilder sb) {
        if (node instanceof TextNode) {
            sb.append(XmlUtils.escape(normalizeText(((TextNode) node).getWholeText())));
            return;
        }
        if (!(node instanceof Element)) {
            return;
        }
        Element el = (Element) node;
        String name = el.tagName();
        switch (name) {
            case "w:bookmarkStart":
            case "w:bookmarkEnd":
            case "w:pPr":
            case "w:rPr":
                return;
            case "w:p":
                writeParagraph(el, sb);
                return;
            case "w:r":
                writeRun(el, sb);
                return;
            case "w:tbl":
                writeFiltered(el, "w:tr", sb);
                return;
            case "w:tr":
                writeFiltered(el, "w:tc", sb);
                return;
            case "w:tcPr":
                writeFiltered(el, "w:gridSpan", sb);
                return;
            case "w:gridSpan":
                sb.append("<w:gridSpan val=\"").append(XmlUtils.escape(nullToEmpty(XmlUtils.attr(el, "w:val"))))
                        .append("\"/>");
                return;
            case "w:pict":
            case "w:drawing": {
                List<Element> boxes = XmlUtils.descendants(el, "w:txbxContent");
                if (!boxes.isEmpty()) {
                    sb.append('<').append(name).append('>');
                    for (Element box : boxes) {
                        write(box, sb);
                    }
                    sb.append("</").append(name).append('>');
                    return;
                }
                break;
            }
            default:
                break;
        }

        sb.append('<').append(name);
        if (!name.equals("w:tc") && !name.equals("w:txbxContent")) {
            for (Attribute a : el.attributes()) {
                if (skipAttribute(a.getKey())) {
                    continue;
                }
                sb.append(' ').append(XmlUtils.localName(a.getKey())).append("=\"")
                        .append(XmlUtils.escape(a.getValue())).append('"');
            }
        }
        if (el.childNodeSize() == 0) {
            sb.append("/>");
            return;
        }
        sb.append('>');
        for (Node child : el.childNodes()) {
            write(child, sb);
        }
        sb.append("</").append(name).append('>');
    }

    private void writeFiltered(Element el, String childName, StringBuilder sb) {
        sb.append('<').append(el.tagName()).append('>');
        for (Element child : el.children()) {
            if (child.tagName().equals(childName)) {
                write(child, sb);
            }
        }
        sb.append("</").append(el.tagName()).append('>');
    }

    /**
     * 段落：只含文本的相邻运行拼成一个文本运行，拆分方式不影响哈希
     */
    private void writeParagraph(Element p, StringBuilder sb) {
        sb.append("<w:p>");
        StringBuilder text = new StringBuilder();
        for (Element child : p.children()) {
            if (child.tagName().equals("w:pPr")) {
                continue;
            }
            if (child.tagName().equals("w:r") && isTextOnly(child)) {
                text.append(XmlUtils.collectText(child, "w:t"));
                continue;
            }
            flush(text, sb);
            write(child, sb);
        }
        flush(text, sb);
        sb.append("</w:p>");
    }

    private void writeRun(Element r, StringBuilder sb) {
        if (trackFormatting) {
            sb.append("<w:r>");
        }
        for (Node child : r.childNodes()) {
            write(child, sb);
        }
        if (trackFormatting) {
            sb.append("</w:r>");
        }
    }

    private static boolean isTextOnly(Element r) {
        boolean hasText = false;
        for (Element c : r.children()) {
            String name = c.tagName();
            if (name.equals("w:t")) {
                hasText = true;
            } else if (!name.equals("w:rPr")) {
                return false;
            }
        }
        return hasText;
    }

    private void flush(StringBuilder text, StringBuilder sb) {
        if (text.length() == 0) {
            return;
        }
        sb.append("<w:r><w:t>").append(XmlUtils.escape(normalizeText(text.toString()))).append("</w:t></w:r>");
        text.setLength(0);
    }

    private String normalizeText(String text) {
        String s = text;
        if (caseInsensitive) {
            s = s.toUpperCase(Locale.ROOT);
        }
        if (conflateSpaces) {
            s = s.replace(' ', '\u00a0');
        }
        return s;
    }

    private static boolean skipAttribute(String key) {
        if (key.startsWith("xmlns") || key.startsWith(Namespaces.PT_PREFIX + ":")) {
            return true;
        }
        return key.startsWith("w:rsid") || key.equals("w14:paraId") || key.equals("w14:textId");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
