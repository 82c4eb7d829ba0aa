package com.example.redline.util.wml;

import com.example.redline.util.wml.atom.Atom;
import com.example.redline.util.wml.lcs.CorrelationStatus;
import com.example.redline.util.xml.Namespaces;
import com.example.redline.util.xml.XmlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 格式变化识别
 *
 * 只比较与显示相关的运行属性（加粗、斜体、字号、颜色、字体……），
 * 其余属性和 rsid / pt14 等辅助属性全部忽略。
 */
@Slf4j
public class FormattingReconciler {

    private static final Set<String> ALLOWED = new HashSet<>(Arrays.asList(
            "w:b", "w:bCs", "w:i", "w:iCs", "w:u", "w:sz", "w:szCs", "w:color", "w:rFonts",
            "w:highlight", "w:strike", "w:dstrike", "w:caps", "w:smallCaps"));

    /** 只保留取值属性的元素 */
    private static final Set<String> VALUE_PROPS = new HashSet<>(Arrays.asList(
            "w:u", "w:color", "w:sz", "w:szCs", "w:rFonts", "w:highlight"));

    private static final Set<String> FONT_ATTRS = new HashSet<>(Arrays.asList(
            "w:ascii", "w:hAnsi", "w:cs", "w:eastAsia"));

    private FormattingReconciler() {
    }

    /**
     * 规范化的 rPr 副本；没有任何相关格式时返回 null
     */
    public static Element normalize(Element rPr) {
        if (rPr == null) {
            return null;
        }
        Element copy = XmlUtils.newElement("w:rPr");
        for (Element child : rPr.children()) {
            if (!ALLOWED.contains(child.tagName())) {
                continue;
            }
            Element prop = XmlUtils.newElement(child.tagName());
            boolean valueOnly = VALUE_PROPS.contains(child.tagName());
            for (Attribute a : child.attributes()) {
                String key = a.getKey();
                if (isScaffolding(key)) {
                    continue;
                }
                if (valueOnly && !key.equals("w:val") && !FONT_ATTRS.contains(key)) {
                    continue;
                }
                XmlUtils.setAttr(prop, key, a.getValue());
            }
            copy.appendChild(prop);
        }
        return copy.childrenSize() == 0 ? null : copy;
    }

    private static boolean isScaffolding(String key) {
        String local = XmlUtils.localName(key);
        return key.startsWith("xmlns") || key.startsWith(Namespaces.PT_PREFIX + ":")
                || local.equals("Unid") || local.toLowerCase().startsWith("rsid");
    }

    /**
     * 格式签名（规范化 rPr 的紧凑序列化）；没有相关格式时返回 null
     */
    public static String signatureOf(Element rPr) {
        Element normalized = normalize(rPr);
        return normalized == null ? null : XmlUtils.canonicalString(normalized, XmlUtils.KEEP_ALL);
    }

    /**
     * 对有“修改前”配对的 Equal 原子比较格式签名，不同则标为 FormatChanged
     *
     * @return 标为格式变化的原子数
     */
    public static int reconcile(List<Atom> atoms) {
        int changed = 0;
        for (Atom atom : atoms) {
            if (atom.getStatus() != CorrelationStatus.EQUAL || atom.getBefore() == null || atom.isParagraphMark()) {
                continue;
            }
            String after = atom.getFormattingSignature();
            String before = atom.getBefore().getFormattingSignature();
            if (!Objects.equals(after, before)) {
                atom.setStatus(CorrelationStatus.FORMAT_CHANGED);
                atom.setBeforeFormattingSignature(before);
                changed++;
            }
        }
        log.debug("格式变化原子数: {}", changed);
        return changed;
    }

    /**
     * 运行属性的可读描述，如 "b, i, sz=24"
     */
    public static String describe(Element rPr) {
        Element normalized = normalize(rPr);
        if (normalized == null) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (Element prop : normalized.children()) {
            String val = XmlUtils.attr(prop, "w:val");
            String local = XmlUtils.localName(prop.tagName());
            parts.add(val == null ? local : local + "=" + val);
        }
        return String.join(", ", parts);
    }
}
