package com.example.redline.util.wml;

import com.example.redline.exception.RedlineException;
import com.example.redline.util.wml.atom.AncestorInfo;
import com.example.redline.util.wml.atom.Atom;
import com.example.redline.util.wml.lcs.CorrelationStatus;
import com.example.redline.util.xml.Namespaces;
import com.example.redline.util.xml.XmlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 由带状态的原子流重建内容树
 *
 * 每一层按祖先 Unid 分组，组内再按 (子层 Unid, 状态, 格式签名) 切分相邻片段：
 * 叶子片段生成内容元素（w:t / w:delText / 克隆的图片、制表符等），其余片段递归到下一层。
 * 非 Equal 的内容带 pt14:Status 标记，由 {@link RevisionDecorator} 转换为修订标记。
 */
@Slf4j
public class Coalescer {

    /** 重建时按 WordprocessingML 容器处理的元素 */
    private static final Set<String> CONTAINERS = new HashSet<>(Arrays.asList(
            "w:tbl", "w:tr", "w:tc", "w:txbxContent", "w:sdt", "w:sdtContent", "w:hyperlink", "w:fldSimple",
            "w:smartTag", "w:customXml", "w:ruby", "w:rubyBase", "w:rt", "w:footnote", "w:endnote"));

    /** 容器重建时从源元素克隆的属性类子元素 */
    private static final Set<String> PROPERTY_CHILDREN = new HashSet<>(Arrays.asList(
            "w:tblPr", "w:tblGrid", "w:tblPrEx", "w:trPr", "w:tcPr", "w:sdtPr", "w:sdtEndPr",
            "w:rubyPr", "w:smartTagPr", "w:customXmlPr"));

    /** 承载文本框的运行内容元素 */
    private static final Set<String> TEXTBOX_HOSTS = new HashSet<>(Arrays.asList(
            "w:pict", "w:drawing", "mc:AlternateContent", "w:object"));

    private final WmlComparerSettings settings;
    /** 最外层 w:txbxContent 的 Unid → 文本框整体状态（只记录整体插入或整体删除） */
    private final Map<String, CorrelationStatus> textboxStatus = new LinkedHashMap<>();

    private Coalescer(WmlComparerSettings settings) {
        this.settings = settings;
    }

    // —— 文本框 —— //

    /**
     * 文本框内容一律按 Equal 输出：
     * 内容有增有删时丢弃旧内容，只保留新文本框的内容；整体插入或删除时，状态记到外层的绘图元素上。
     */
    private List<Atom> normalizeTextboxes(List<Atom> atoms) {
        Map<String, List<Atom>> boxes = new LinkedHashMap<>();
        for (Atom atom : atoms) {
            String unid = outerTextboxUnid(atom);
            if (unid == null) {
                continue;
            }
            List<Atom> list = boxes.get(unid);
            if (list == null) {
                list = new ArrayList<>();
                boxes.put(unid, list);
            }
            list.add(atom);
        }
        if (boxes.isEmpty()) {
            return atoms;
        }

        Set<Atom> dropped = new HashSet<>();
        for (Map.Entry<String, List<Atom>> entry : boxes.entrySet()) {
            CorrelationStatus uniform = uniformChange(entry.getValue());
            if (uniform != null) {
                textboxStatus.put(entry.getKey(), uniform);
            }
            for (Atom atom : entry.getValue()) {
                if (uniform == null && atom.getStatus() == CorrelationStatus.DELETED) {
                    dropped.add(atom);
                }
                atom.setStatus(CorrelationStatus.EQUAL);
            }
        }
        List<Atom> kept = new ArrayList<>(atoms.size() - dropped.size());
        for (Atom atom : atoms) {
            if (!dropped.contains(atom)) {
                kept.add(atom);
            }
        }
        log.debug("文本框内容按 Equal 输出: textboxes={}, dropped={}", boxes.size(), dropped.size());
        return kept;
    }

    private static String outerTextboxUnid(Atom atom) {
        List<AncestorInfo> chain = atom.getAncestors();
        List<String> unids = atom.getAncestorUnids();
        for (int i = 0; i < chain.size() && i < unids.size(); i++) {
            if (chain.get(i).getName().equals("w:txbxContent")) {
                return unids.get(i);
            }
        }
        return null;
    }

    /**
     * 绘图元素内所有文本框同为整体插入或整体删除时返回该状态
     */
    private CorrelationStatus hostStatus(List<Atom> group) {
        CorrelationStatus status = null;
        for (Atom atom : group) {
            String unid = outerTextboxUnid(atom);
            CorrelationStatus s = unid == null ? null : textboxStatus.get(unid);
            if (s == null || (status != null && status != s)) {
                return null;
            }
            status = s;
        }
        return status;
    }

    /**
     * 重建内容
     *
     * @param atoms         已计算祖先 Unid 的原子
     * @param containerName 承载重建结果的元素名（w:body、w:footnotes …）
     */
    public static Element coalesce(List<Atom> atoms, WmlComparerSettings settings, String containerName) {
        Element container = XmlUtils.newElement(containerName);
        Coalescer coalescer = new Coalescer(settings);
        coalescer.recurse(container, coalescer.normalizeTextboxes(atoms), 0);
        log.debug("重建完成: container={}, children={}", containerName, container.childrenSize());
        return container;
    }

    // ==================== 分层递归 ====================

    private void recurse(Element parent, List<Atom> atoms, int level) {
        Map<String, List<Atom>> groups = new LinkedHashMap<>();
        String lastTextboxUnid = null;
        int textboxRun = 0;
        for (Atom atom : atoms) {
            List<String> unids = atom.getAncestorUnids();
            if (level >= unids.size() || unids.get(level).isEmpty()) {
                continue;
            }
            String unid = unids.get(level);
            String key = unid;
            // 文本框内部按相邻分组：新旧内容的 Unid 交错出现，按 Unid 归并会打乱顺序
            if (insideTextbox(atom, level)) {
                if (!unid.equals(lastTextboxUnid)) {
                    textboxRun++;
                    lastTextboxUnid = unid;
                }
                key = unid + "#" + textboxRun;
            } else {
                lastTextboxUnid = null;
            }
            List<Atom> list = groups.get(key);
            if (list == null) {
                list = new ArrayList<>();
                groups.put(key, list);
            }
            list.add(atom);
        }

        for (List<Atom> group : groups.values()) {
            AncestorInfo info = ancestorAt(group, level);
            if (info == null) {
                continue;
            }
            String unid = group.get(0).getAncestorUnids().get(level);
            Element source = info.getElement();
            String name = source.tagName();

            if (source == group.get(0).getContentElement()) {
                emitContent(parent, group, level);
            } else if (name.equals("w:p")) {
                parent.appendChild(buildParagraph(source, unid, group, level));
            } else if (name.equals("w:r")) {
                parent.appendChild(buildRun(source, group, level));
            } else if (CONTAINERS.contains(name)) {
                parent.appendChild(buildContainer(source, unid, group, level));
            } else {
                parent.appendChild(buildWrapper(source, group, level));
            }
        }
    }

    /**
     * 当前层位于 w:txbxContent 之下
     */
    private static boolean insideTextbox(Atom atom, int level) {
        List<AncestorInfo> chain = atom.getAncestors();
        for (int i = 0; i < level && i < chain.size(); i++) {
            if (chain.get(i).getName().equals("w:txbxContent")) {
                return true;
            }
        }
        return false;
    }

    private static AncestorInfo ancestorAt(List<Atom> group, int level) {
        for (Atom atom : group) {
            if (level < atom.getAncestors().size()) {
                return atom.getAncestors().get(level);
            }
        }
        return null;
    }

    // —— 相邻切分 —— //

    private static final class Slice {
        private final boolean leaf;
        private final List<Atom> atoms = new ArrayList<>();

        private Slice(boolean leaf) {
            this.leaf = leaf;
        }
    }

    private List<Slice> sliceAdjacent(List<Atom> atoms, int level) {
        List<Slice> slices = new ArrayList<>();
        String lastKey = null;
        Slice current = null;
        for (Atom atom : atoms) {
            List<String> unids = atom.getAncestorUnids();
            String childUnid = level + 1 < unids.size() ? unids.get(level + 1) : "";
            boolean textbox = hasTextbox(atom);
            StringBuilder key = new StringBuilder();
            key.append(textbox && !childUnid.isEmpty() ? "TXBX" : childUnid);
            CorrelationStatus status = textbox ? CorrelationStatus.EQUAL : atom.getStatus();
            key.append('|').append(status);
            if (settings.isTrackFormattingChanges() && !textbox) {
                if (atom.getStatus() == CorrelationStatus.FORMAT_CHANGED) {
                    key.append("|FMT:").append(atom.getBeforeFormattingSignature())
                            .append("|TO:").append(atom.getFormattingSignature());
                } else if (atom.getStatus() == CorrelationStatus.EQUAL) {
                    key.append("|SIG:").append(atom.getFormattingSignature());
                }
            }
            String k = key.toString();
            if (current == null || !k.equals(lastKey)) {
                current = new Slice(childUnid.isEmpty());
                slices.add(current);
                lastKey = k;
            }
            current.atoms.add(atom);
        }
        return slices;
    }

    /**
     * 原子位于文本框内：文本框外壳和内容都不按状态、格式切分
     */
    private static boolean hasTextbox(Atom atom) {
        for (AncestorInfo a : atom.getAncestors()) {
            if (a.getName().equals("w:txbxContent")) {
                return true;
            }
        }
        return false;
    }

    // ==================== 段落 / 运行 ====================

    private Element buildParagraph(Element source, String unid, List<Atom> group, int level) {
        Element p = copyShell(source, "w:p");
        XmlUtils.setAttr(p, Namespaces.PT_UNID, unid);
        Element pPr = null;
        for (Slice slice : sliceAdjacent(group, level)) {
            if (!slice.leaf) {
                recurse(p, slice.atoms, level + 1);
                continue;
            }
            for (Atom atom : slice.atoms) {
                if (atom.isParagraphMark() && pPr == null) {
                    pPr = paragraphProperties(atom);
                }
            }
        }
        if (pPr != null) {
            p.prependChild(pPr);
        }
        return p;
    }

    private static Element paragraphProperties(Atom mark) {
        Element pPr = mark.getContentElement().clone();
        String marker = mark.getStatus().markerText();
        boolean changed = mark.getStatus() == CorrelationStatus.INSERTED || mark.getStatus() == CorrelationStatus.DELETED;
        if (changed && !insideVml(mark)) {
            XmlUtils.setAttr(pPr, Namespaces.PT_STATUS, marker);
        }
        if (!changed && pPr.childrenSize() == 0) {
            return null;
        }
        return pPr;
    }

    private static boolean insideVml(Atom atom) {
        for (AncestorInfo a : atom.getAncestors()) {
            if (a.getName().startsWith("v:")) {
                return true;
            }
        }
        return false;
    }

    private Element buildRun(Element source, List<Atom> group, int level) {
        Element r = copyShell(source, "w:r");
        Element rPr = XmlUtils.child(source, "w:rPr");
        Element newRPr = rPr == null ? null : rPr.clone();

        if (settings.isTrackFormattingChanges()) {
            Atom changed = null;
            for (Atom atom : group) {
                if (atom.getStatus() == CorrelationStatus.FORMAT_CHANGED) {
                    changed = atom;
                    break;
                }
            }
            if (changed != null) {
                if (newRPr == null) {
                    newRPr = XmlUtils.newElement("w:rPr");
                }
                newRPr.appendChild(formatChange(changed));
            }
        }
        if (newRPr != null) {
            r.appendChild(newRPr);
        }

        for (Slice slice : sliceAdjacent(group, level)) {
            if (!slice.leaf) {
                recurse(r, slice.atoms, level + 1);
            }
        }
        return r;
    }

    /**
     * w:rPrChange：内容为修改前的运行属性（不含嵌套的 rPrChange）
     */
    private static Element formatChange(Atom atom) {
        Element change = XmlUtils.newElement("w:rPrChange");
        Element before = XmlUtils.newElement("w:rPr");
        Element oldRPr = atom.getBefore() == null ? null : atom.getBefore().getRunProperties();
        if (oldRPr != null) {
            for (Element child : oldRPr.children()) {
                if (!child.tagName().equals("w:rPrChange")) {
                    before.appendChild(child.clone());
                }
            }
        }
        change.appendChild(before);
        XmlUtils.setAttr(change, Namespaces.PT_STATUS, CorrelationStatus.FORMAT_CHANGED.markerText());
        return change;
    }

    // ==================== 容器 ====================

    private Element buildContainer(Element source, String unid, List<Atom> group, int level) {
        String name = source.tagName();
        Element el = copyShell(source, name);
        XmlUtils.setAttr(el, Namespaces.PT_UNID, unid);
        for (Element child : source.children()) {
            if (PROPERTY_CHILDREN.contains(child.tagName())) {
                el.appendChild(child.clone());
            }
        }
        // 同一容器只生成一个元素，状态切分留给段落和运行
        recurse(el, group, level + 1);

        if (name.equals("w:tr")) {
            CorrelationStatus uniform = uniformChange(group);
            if (uniform != null) {
                XmlUtils.setAttr(el, Namespaces.PT_STATUS, uniform.markerText());
            }
        }
        if ((name.equals("w:tc") || name.equals("w:txbxContent")) && XmlUtils.child(el, "w:p") == null
                && XmlUtils.child(el, "w:tbl") == null) {
            el.appendChild(XmlUtils.newElement("w:p"));
        }
        return el;
    }

    private static CorrelationStatus uniformChange(List<Atom> group) {
        CorrelationStatus status = null;
        for (Atom atom : group) {
            CorrelationStatus s = atom.getStatus();
            if (s != CorrelationStatus.INSERTED && s != CorrelationStatus.DELETED) {
                return null;
            }
            if (status != null && status != s) {
                return null;
            }
            status = s;
        }
        return status;
    }

    /**
     * 绘图 / VML 外壳：原样保留与内容无关的子元素，内容路径上的子元素就地替换为重建结果
     */
    private Element buildWrapper(Element source, List<Atom> group, int level) {
        Element el = copyShell(source, source.tagName());
        Element pathChild = null;
        List<AncestorInfo> chain = group.get(0).getAncestors();
        if (level + 1 < chain.size()) {
            pathChild = chain.get(level + 1).getElement();
        }
        boolean emitted = false;
        for (Node node : source.childNodes()) {
            if (node == pathChild) {
                recurse(el, group, level + 1);
                emitted = true;
            } else if (node instanceof Element) {
                // 备选分支的内容没有参与比对，丢弃
                if (source.tagName().equals("mc:AlternateContent") && ((Element) node).tagName().equals("mc:Choice")) {
                    continue;
                }
                el.appendChild(node.clone());
            } else if (node instanceof TextNode) {
                el.appendChild(node.clone());
            }
        }
        if (!emitted) {
            throw RedlineException.internal(source.tagName(), "重建时找不到内容所在的子元素");
        }
        if (TEXTBOX_HOSTS.contains(source.tagName())) {
            CorrelationStatus status = hostStatus(group);
            if (status != null) {
                XmlUtils.setAttr(el, Namespaces.PT_STATUS, status.markerText());
            }
        }
        return el;
    }

    // ==================== 叶子内容 ====================

    private void emitContent(Element parent, List<Atom> group, int level) {
        Element source = group.get(0).getContentElement();
        String name = source.tagName();
        if (name.equals("w:t") || name.equals("w:delText")) {
            for (Slice slice : sliceAdjacent(group, level)) {
                parent.appendChild(textElement(slice.atoms));
            }
            return;
        }
        for (Atom atom : group) {
            parent.appendChild(contentClone(atom));
        }
    }

    private static Element textElement(List<Atom> atoms) {
        StringBuilder sb = new StringBuilder();
        for (Atom atom : atoms) {
            sb.append(atom.getValue());
        }
        String text = sb.toString();
        CorrelationStatus status = atoms.get(0).getStatus();
        Element t = XmlUtils.newElement(status == CorrelationStatus.DELETED ? "w:delText" : "w:t");
        if (!text.isEmpty() && (Character.isWhitespace(text.charAt(0))
                || Character.isWhitespace(text.charAt(text.length() - 1)))) {
            XmlUtils.setAttr(t, "xml:space", "preserve");
        }
        if (status == CorrelationStatus.DELETED || status == CorrelationStatus.INSERTED) {
            XmlUtils.setAttr(t, Namespaces.PT_STATUS, status.markerText());
        }
        t.appendChild(new TextNode(text));
        return t;
    }

    private static Element contentClone(Atom atom) {
        Element source = atom.getContentElement();
        Element clone;
        if (atom.getStatus() == CorrelationStatus.DELETED && source.tagName().equals("w:instrText")) {
            clone = XmlUtils.newElement("w:delInstrText");
            for (Attribute a : source.attributes()) {
                XmlUtils.setAttr(clone, a.getKey(), a.getValue());
            }
            for (Node n : source.childNodes()) {
                clone.appendChild(n.clone());
            }
        } else {
            clone = source.clone();
        }
        if (atom.getStatus() == CorrelationStatus.DELETED || atom.getStatus() == CorrelationStatus.INSERTED) {
            XmlUtils.setAttr(clone, Namespaces.PT_STATUS, atom.getStatus().markerText());
        }
        return clone;
    }

    /**
     * 新建同名元素并复制属性（pt14 辅助属性除外）
     */
    private static Element copyShell(Element source, String name) {
        Element el = XmlUtils.newElement(name);
        for (Attribute a : source.attributes()) {
            if (!a.getKey().startsWith(Namespaces.PT_PREFIX + ":")) {
                XmlUtils.setAttr(el, a.getKey(), a.getValue());
            }
        }
        return el;
    }
}
