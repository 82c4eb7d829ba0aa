package com.example.redline.util.wml;

import com.example.redline.util.xml.Namespaces;
import com.example.redline.util.xml.XmlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 把重建树上的 pt14:Status 标记转换为修订标记
 *
 * <ul>
 *   <li>连续的同状态运行包进一个 w:ins / w:del</li>
 *   <li>段落标记的修订写入 pPr/rPr，整行修订写入 trPr</li>
 *   <li>w:rPrChange 补齐 id、作者、日期</li>
 *   <li>合并格式相同的相邻运行，删除空 rPr，按 schema 重排，清除 pt14 辅助属性</li>
 * </ul>
 */
@Slf4j
public class RevisionDecorator {

    private static final String INSERTED = "Inserted";
    private static final String DELETED = "Deleted";

    private final String author;
    private final String date;
    private final RevisionIdGenerator ids;

    public RevisionDecorator(String author, String date, RevisionIdGenerator ids) {
        this.author = author;
        this.date = date;
        this.ids = ids;
    }

    public void decorate(Element root) {
        int before = ids.peek();
        splitMixedRuns(root);
        markContent(root);
        markParagraphMarks(root);
        markRows(root);
        markFormatChanges(root);
        mergeAdjacentRuns(root);
        removeEmptyProperties(root);
        ElementOrder.apply(root);
        XmlUtils.removeAttributesWithPrefix(root, Namespaces.PT_PREFIX);
        log.debug("修订标记完成: revisions={}", ids.peek() - before);
    }

    /**
     * 新建修订元素，w:id 在第一位
     */
    Element revision(String name) {
        Element el = XmlUtils.newElement(name);
        XmlUtils.setAttr(el, "w:id", String.valueOf(ids.next()));
        XmlUtils.setAttr(el, "w:author", author);
        XmlUtils.setAttr(el, "w:date", date);
        return el;
    }

    // ==================== 运行 ====================

    /**
     * 内容状态不一致的运行拆成多个运行
     */
    private void splitMixedRuns(Element root) {
        for (Element r : XmlUtils.descendants(root, "w:r")) {
            List<Element> content = runContent(r);
            boolean mixed = false;
            for (int i = 1; i < content.size(); i++) {
                if (!Objects.equals(statusOf(content.get(i)), statusOf(content.get(0)))) {
                    mixed = true;
                    break;
                }
            }
            if (!mixed) {
                continue;
            }
            Element rPr = XmlUtils.child(r, "w:rPr");
            Element current = null;
            String currentStatus = null;
            Element anchor = r;
            for (Element c : content) {
                String status = statusOf(c);
                if (current == null || !Objects.equals(status, currentStatus)) {
                    current = shellOf(r);
                    if (rPr != null) {
                        current.appendChild(rPr.clone());
                    }
                    anchor.after(current);
                    anchor = current;
                    currentStatus = status;
                }
                current.appendChild(c);
            }
            r.remove();
        }
    }

    private static Element shellOf(Element r) {
        Element copy = XmlUtils.newElement(r.tagName());
        for (Attribute a : r.attributes()) {
            XmlUtils.setAttr(copy, a.getKey(), a.getValue());
        }
        return copy;
    }

    private static List<Element> runContent(Element r) {
        List<Element> content = new ArrayList<>();
        for (Element c : r.children()) {
            if (!c.tagName().equals("w:rPr")) {
                content.add(c);
            }
        }
        return content;
    }

    private static String statusOf(Element el) {
        String s = XmlUtils.attr(el, Namespaces.PT_STATUS);
        return INSERTED.equals(s) || DELETED.equals(s) ? s : null;
    }

    /**
     * 运行的修订状态：所有内容同为插入或同为删除时返回该状态
     */
    private static String runStatus(Element r) {
        List<Element> content = runContent(r);
        if (content.isEmpty()) {
            return null;
        }
        String status = statusOf(content.get(0));
        for (Element c : content) {
            if (!Objects.equals(statusOf(c), status)) {
                return null;
            }
        }
        return status;
    }

    private void markContent(Element root) {
        List<Element> parents = new ArrayList<>();
        for (Element el : root.getAllElements()) {
            if (el.tagName().equals("w:p") || el.tagName().equals("w:hyperlink") || el.tagName().equals("w:fldSimple")
                    || el.tagName().equals("w:sdtContent") || el.tagName().equals("w:smartTag")) {
                parents.add(el);
            }
        }
        for (Element parent : parents) {
            List<Element> children = new ArrayList<>(parent.children());
            Element wrapper = null;
            String wrapperStatus = null;
            for (Element child : children) {
                String status = wrappable(child);
                if (status == null) {
                    wrapper = null;
                    continue;
                }
                if (wrapper == null || !status.equals(wrapperStatus)) {
                    wrapper = revision(status.equals(INSERTED) ? "w:ins" : "w:del");
                    wrapperStatus = status;
                    child.before(wrapper);
                }
                clearStatus(child);
                wrapper.appendChild(child);
            }
        }
    }

    /**
     * 可包进修订元素的子元素的状态（运行或直接位于段落中的公式）
     */
    private static String wrappable(Element child) {
        String name = child.tagName();
        if (name.equals("w:r")) {
            return runStatus(child);
        }
        if (name.equals("m:oMath") || name.equals("m:oMathPara")) {
            return statusOf(child);
        }
        return null;
    }

    private static void clearStatus(Element el) {
        el.removeAttr(Namespaces.PT_STATUS);
        for (Element c : el.children()) {
            if (!c.tagName().equals("w:rPr")) {
                c.removeAttr(Namespaces.PT_STATUS);
            }
        }
    }

    // ==================== 段落标记 / 行 / 格式 ====================

    private void markParagraphMarks(Element root) {
        for (Element pPr : XmlUtils.descendants(root, "w:pPr")) {
            String status = statusOf(pPr);
            pPr.removeAttr(Namespaces.PT_STATUS);
            if (status == null) {
                continue;
            }
            Element rPr = XmlUtils.child(pPr, "w:rPr");
            if (rPr == null) {
                rPr = XmlUtils.newElement("w:rPr");
                pPr.appendChild(rPr);
            }
            rPr.prependChild(revision(status.equals(INSERTED) ? "w:ins" : "w:del"));
        }
    }

    private void markRows(Element root) {
        for (Element tr : XmlUtils.descendants(root, "w:tr")) {
            String status = statusOf(tr);
            tr.removeAttr(Namespaces.PT_STATUS);
            if (status == null) {
                continue;
            }
            Element trPr = XmlUtils.child(tr, "w:trPr");
            if (trPr == null) {
                trPr = XmlUtils.newElement("w:trPr");
                tr.prependChild(trPr);
            }
            trPr.appendChild(revision(status.equals(INSERTED) ? "w:ins" : "w:del"));
        }
    }

    private void markFormatChanges(Element root) {
        for (Element change : XmlUtils.descendants(root, "w:rPrChange")) {
            if (!change.hasAttr(Namespaces.PT_STATUS)) {
                continue;
            }
            change.removeAttr(Namespaces.PT_STATUS);
            Element fresh = revision("w:rPrChange");
            for (Node n : new ArrayList<>(change.childNodes())) {
                fresh.appendChild(n);
            }
            change.replaceWith(fresh);
        }
    }

    // ==================== 整理 ====================

    /**
     * 合并格式相同、只含一个文本元素的相邻运行
     */
    private static void mergeAdjacentRuns(Element root) {
        List<Element> parents = new ArrayList<>();
        for (Element el : root.getAllElements()) {
            String name = el.tagName();
            if (name.equals("w:p") || name.equals("w:ins") || name.equals("w:del")) {
                parents.add(el);
            }
        }
        for (Element parent : parents) {
            Element previous = null;
            String previousKey = null;
            for (Element child : new ArrayList<>(parent.children())) {
                String key = mergeKey(child);
                if (key != null && key.equals(previousKey)) {
                    Element into = textOf(previous);
                    Element from = textOf(child);
                    String text = XmlUtils.ownText(into) + XmlUtils.ownText(from);
                    XmlUtils.setText(into, text);
                    if (!text.isEmpty() && (Character.isWhitespace(text.charAt(0))
                            || Character.isWhitespace(text.charAt(text.length() - 1)))) {
                        XmlUtils.setAttr(into, "xml:space", "preserve");
                    }
                    child.remove();
                    continue;
                }
                previous = child;
                previousKey = key;
            }
        }
    }

    private static String mergeKey(Element run) {
        if (!run.tagName().equals("w:r")) {
            return null;
        }
        Element text = textOf(run);
        if (text == null || text.hasAttr(Namespaces.PT_STATUS)) {
            return null;
        }
        Element rPr = XmlUtils.child(run, "w:rPr");
        return text.tagName() + "|" + (rPr == null ? "" : XmlUtils.canonicalString(rPr, XmlUtils.KEEP_ALL));
    }

    /**
     * 运行中唯一的 w:t / w:delText（除 rPr 外还有别的子元素时返回 null）
     */
    private static Element textOf(Element run) {
        Element text = null;
        for (Element c : run.children()) {
            String name = c.tagName();
            if (name.equals("w:rPr")) {
                continue;
            }
            if ((name.equals("w:t") || name.equals("w:delText")) && text == null) {
                text = c;
            } else {
                return null;
            }
        }
        if (text != null) {
            for (Node n : text.childNodes()) {
                if (!(n instanceof TextNode)) {
                    return null;
                }
            }
        }
        return text;
    }

    private static void removeEmptyProperties(Element root) {
        for (Element el : root.getAllElements()) {
            String name = el.tagName();
            Element parent = el.parent();
            boolean original = parent != null && parent.tagName().endsWith("PrChange");
            if ((name.equals("w:rPr") || name.equals("w:pPr")) && !original && el.childNodeSize() == 0
                    && !hasRealAttributes(el)) {
                el.remove();
            }
        }
    }

    private static boolean hasRealAttributes(Element el) {
        for (Attribute a : el.attributes()) {
            if (!a.getKey().startsWith(Namespaces.PT_PREFIX + ":")) {
                return true;
            }
        }
        return false;
    }
}
