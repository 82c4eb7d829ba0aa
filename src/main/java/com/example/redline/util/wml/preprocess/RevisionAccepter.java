package com.example.redline.util.wml.preprocess;

import com.example.redline.util.xml.XmlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 接受 / 拒绝修订
 *
 * <ul>
 *   <li>接受：解包 ins / moveTo，删除 del / moveFrom 及其内容，删除 *Change 与移动范围标记；
 *       整行删除的行删掉，段落标记被删除的段落与下一段合并</li>
 *   <li>拒绝：与接受相反，删除 ins / moveTo，解包 del / moveFrom 并把 delText 还原为 t，
 *       rPr / pPr 等属性从 *Change 中恢复</li>
 * </ul>
 * 所有方法都在副本上操作，不修改传入的树。无法识别的修订保持原样。
 */
@Slf4j
public class RevisionAccepter {

    private static final Set<String> INSERTIONS = new HashSet<>(Arrays.asList("w:ins", "w:moveTo"));
    private static final Set<String> DELETIONS = new HashSet<>(Arrays.asList("w:del", "w:moveFrom"));

    private static final Set<String> RANGE_MARKERS = new HashSet<>(Arrays.asList(
            "w:moveFromRangeStart", "w:moveFromRangeEnd", "w:moveToRangeStart", "w:moveToRangeEnd",
            "w:customXmlInsRangeStart", "w:customXmlInsRangeEnd", "w:customXmlDelRangeStart",
            "w:customXmlDelRangeEnd", "w:customXmlMoveFromRangeStart", "w:customXmlMoveFromRangeEnd",
            "w:customXmlMoveToRangeStart", "w:customXmlMoveToRangeEnd"));

    private static final Set<String> PROPERTY_CHANGES = new HashSet<>(Arrays.asList(
            "w:rPrChange", "w:pPrChange", "w:tblPrChange", "w:tblGridChange", "w:trPrChange", "w:tcPrChange",
            "w:sectPrChange", "w:tblPrExChange", "w:numberingChange"));

    /** 修订标记所在的属性容器（标记本身不带内容） */
    private static final Set<String> MARKER_PARENTS = new HashSet<>(Arrays.asList(
            "w:rPr", "w:trPr", "w:tcPr", "w:numPr"));

    /**
     * 修订选择：ids 为 null 时选择全部
     */
    private static final class Selection {
        private final Set<String> ids;

        private Selection(Set<String> ids) {
            this.ids = ids;
        }

        boolean matches(Element revision) {
            return ids == null || ids.contains(XmlUtils.attr(revision, "w:id"));
        }
    }

    private RevisionAccepter() {
    }

    // ==================== 对外接口 ====================

    public static Element acceptAll(Element root) {
        return accept(root.clone(), new Selection(null));
    }

    public static Element acceptByIds(Element root, Set<String> ids) {
        return accept(root.clone(), new Selection(Collections.unmodifiableSet(new HashSet<>(ids))));
    }

    public static Element rejectAll(Element root) {
        return reject(root.clone(), new Selection(null));
    }

    public static Element rejectByIds(Element root, Set<String> ids) {
        return reject(root.clone(), new Selection(Collections.unmodifiableSet(new HashSet<>(ids))));
    }

    /**
     * 在原树上接受全部修订（比对预处理使用，调用方持有的已是副本）
     */
    public static void acceptAllInPlace(Element root) {
        accept(root, new Selection(null));
    }

    // ==================== 接受 ====================

    private static Element accept(Element root, Selection selection) {
        int count = 0;
        for (Element el : snapshot(root)) {
            if (el.parent() == null || el == root) {
                continue;
            }
            String name = el.tagName();
            if (RANGE_MARKERS.contains(name)) {
                el.remove();
                continue;
            }
            if (PROPERTY_CHANGES.contains(name)) {
                if (selection.matches(el)) {
                    el.remove();
                    count++;
                }
                continue;
            }
            if (!INSERTIONS.contains(name) && !DELETIONS.contains(name) && !name.equals("w:cellIns")
                    && !name.equals("w:cellDel")) {
                continue;
            }
            if (!selection.matches(el)) {
                continue;
            }
            count++;
            Element parent = el.parent();
            String parentName = parent.tagName();
            boolean deletion = DELETIONS.contains(name) || name.equals("w:cellDel");

            if (parentName.equals("w:trPr")) {
                el.remove();
                if (deletion) {
                    removeRow(parent);
                }
            } else if (name.equals("w:cellIns") || name.equals("w:cellDel")) {
                el.remove();
                if (deletion) {
                    Element tc = XmlUtils.ancestor(parent, "w:tc");
                    if (tc != null) {
                        tc.remove();
                    }
                }
            } else if (MARKER_PARENTS.contains(parentName)) {
                el.remove();
                if (deletion && isParagraphMarkProperties(parent)) {
                    mergeWithNext(XmlUtils.ancestor(parent, "w:p"));
                }
            } else if (deletion) {
                el.remove();
            } else {
                XmlUtils.unwrap(el);
            }
        }
        log.debug("接受修订: {}", count);
        return root;
    }

    // ==================== 拒绝 ====================

    private static Element reject(Element root, Selection selection) {
        int count = 0;
        for (Element el : snapshot(root)) {
            if (el.parent() == null || el == root) {
                continue;
            }
            String name = el.tagName();
            if (RANGE_MARKERS.contains(name)) {
                el.remove();
                continue;
            }
            if (PROPERTY_CHANGES.contains(name)) {
                if (selection.matches(el)) {
                    restoreProperties(el);
                    count++;
                }
                continue;
            }
            if (!INSERTIONS.contains(name) && !DELETIONS.contains(name) && !name.equals("w:cellIns")
                    && !name.equals("w:cellDel")) {
                continue;
            }
            if (!selection.matches(el)) {
                continue;
            }
            count++;
            Element parent = el.parent();
            String parentName = parent.tagName();
            boolean insertion = INSERTIONS.contains(name) || name.equals("w:cellIns");

            if (parentName.equals("w:trPr")) {
                el.remove();
                if (insertion) {
                    removeRow(parent);
                }
            } else if (name.equals("w:cellIns") || name.equals("w:cellDel")) {
                el.remove();
                if (insertion) {
                    Element tc = XmlUtils.ancestor(parent, "w:tc");
                    if (tc != null) {
                        tc.remove();
                    }
                }
            } else if (MARKER_PARENTS.contains(parentName)) {
                el.remove();
                if (insertion && isParagraphMarkProperties(parent)) {
                    mergeWithNext(XmlUtils.ancestor(parent, "w:p"));
                }
            } else if (insertion) {
                el.remove();
            } else {
                for (Element text : XmlUtils.descendants(el, "w:delText")) {
                    XmlUtils.rename(text, "w:t");
                }
                for (Element instr : XmlUtils.descendants(el, "w:delInstrText")) {
                    XmlUtils.rename(instr, "w:instrText");
                }
                XmlUtils.unwrap(el);
            }
        }
        log.debug("拒绝修订: {}", count);
        return root;
    }

    /**
     * 用 *Change 中记录的原属性替换当前属性
     */
    private static void restoreProperties(Element change) {
        Element props = change.parent();
        Element original = change.children().isEmpty() ? null : change.child(0);
        change.remove();
        if (props == null || original == null) {
            return;
        }
        if (change.tagName().equals("w:tblGridChange")) {
            props.empty();
            for (Node n : new ArrayList<>(original.childNodes())) {
                props.appendChild(n);
            }
            return;
        }
        List<Element> keep = new ArrayList<>();
        if (props.tagName().equals("w:pPr")) {
            // 段落标记的运行属性和节属性不在 pPrChange 范围内
            Element rPr = XmlUtils.child(props, "w:rPr");
            Element sectPr = XmlUtils.child(props, "w:sectPr");
            if (rPr != null) {
                keep.add(rPr);
            }
            if (sectPr != null) {
                keep.add(sectPr);
            }
        }
        if (props.tagName().equals("w:rPr")) {
            for (Element c : props.children()) {
                if (INSERTIONS.contains(c.tagName()) || DELETIONS.contains(c.tagName())) {
                    keep.add(c);
                }
            }
        }
        for (Element c : new ArrayList<>(props.children())) {
            c.remove();
        }
        for (Node n : new ArrayList<>(original.childNodes())) {
            props.appendChild(n);
        }
        for (Element k : keep) {
            props.appendChild(k);
        }
    }

    // ==================== 结构调整 ====================

    private static List<Element> snapshot(Element root) {
        return new ArrayList<>(root.getAllElements());
    }

    private static void removeRow(Element trPr) {
        Element tr = trPr.parent();
        if (tr != null && tr.tagName().equals("w:tr")) {
            Element tbl = tr.parent();
            tr.remove();
            if (tbl != null && XmlUtils.child(tbl, "w:tr") == null) {
                tbl.remove();
            }
        }
    }

    private static boolean isParagraphMarkProperties(Element rPr) {
        Element pPr = rPr.parent();
        return rPr.tagName().equals("w:rPr") && pPr != null && pPr.tagName().equals("w:pPr");
    }

    /**
     * 段落标记消失：本段内容并入下一段开头，使用下一段的段落属性
     */
    private static void mergeWithNext(Element p) {
        if (p == null) {
            return;
        }
        Element next = p.nextElementSibling();
        if (next == null || !next.tagName().equals("w:p")) {
            return;
        }
        List<Element> content = new ArrayList<>();
        for (Element c : p.children()) {
            if (!c.tagName().equals("w:pPr")) {
                content.add(c);
            }
        }
        Element nextPPr = XmlUtils.child(next, "w:pPr");
        int index = nextPPr == null ? 0 : nextPPr.siblingIndex() + 1;
        next.insertChildren(index, content);
        p.remove();
    }
}
