package com.example.redline.util.wml.preprocess;

import com.example.redline.util.xml.XmlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 比对前的标记简化
 *
 * 去掉与内容无关的标记（书签、权限、校对、批注范围、rsid……），
 * 解包内容控件、智能标记、超链接、customXml，删除域代码只留域结果。
 */
@Slf4j
public class MarkupSimplifier {

    private static final Set<String> REMOVE = new HashSet<>(Arrays.asList(
            "w:bookmarkStart", "w:bookmarkEnd", "w:permStart", "w:permEnd", "w:proofErr",
            "w:lastRenderedPageBreak", "w:commentRangeStart", "w:commentRangeEnd", "w:softHyphen",
            "w:sdtPr", "w:sdtEndPr", "w:smartTagPr", "w:customXmlPr"));

    private static final Set<String> UNWRAP = new HashSet<>(Arrays.asList(
            "w:sdt", "w:sdtContent", "w:smartTag", "w:hyperlink", "w:customXml", "w:fldSimple"));

    /**
     * 简化选项，默认全部开启
     */
    public static class Options {
        private boolean removeRsid = true;
        private boolean removeFieldCodes = true;
        private boolean unwrapHyperlinks = true;

        public boolean isRemoveRsid() { return removeRsid; }
        public Options setRemoveRsid(boolean removeRsid) { this.removeRsid = removeRsid; return this; }

        public boolean isRemoveFieldCodes() { return removeFieldCodes; }
        public Options setRemoveFieldCodes(boolean removeFieldCodes) { this.removeFieldCodes = removeFieldCodes; return this; }

        public boolean isUnwrapHyperlinks() { return unwrapHyperlinks; }
        public Options setUnwrapHyperlinks(boolean unwrapHyperlinks) { this.unwrapHyperlinks = unwrapHyperlinks; return this; }
    }

    private MarkupSimplifier() {
    }

    public static void simplify(Element root) {
        simplify(root, new Options());
    }

    public static void simplify(Element root, Options options) {
        int removed = 0;
        int unwrapped = 0;

        for (Element el : root.getAllElements()) {
            if (el == root) {
                continue;
            }
            String name = el.tagName();
            if (REMOVE.contains(name)) {
                el.remove();
                removed++;
            } else if (name.equals("w:r") && XmlUtils.child(el, "w:commentReference") != null) {
                el.remove();
                removed++;
            }
        }

        if (options.isRemoveFieldCodes()) {
            removed += removeFieldCodes(root);
        }

        // 由内向外解包，保证内层先处理
        List<Element> toUnwrap = new ArrayList<>();
        for (Element el : root.getAllElements()) {
            String name = el.tagName();
            if (el != root && UNWRAP.contains(name) && (options.isUnwrapHyperlinks() || !name.equals("w:hyperlink"))) {
                toUnwrap.add(el);
            }
        }
        for (int i = toUnwrap.size() - 1; i >= 0; i--) {
            Element el = toUnwrap.get(i);
            if (el.parent() != null) {
                XmlUtils.unwrap(el);
                unwrapped++;
            }
        }

        if (options.isRemoveRsid()) {
            removeRsid(root);
        }
        log.debug("标记简化: removed={}, unwrapped={}", removed, unwrapped);
    }

    /**
     * 删除复杂域的 fldChar、instrText 以及域代码部分的内容，域结果保留
     */
    static int removeFieldCodes(Element root) {
        int removed = 0;
        // true 表示处于域代码部分，false 表示处于域结果部分
        Deque<Boolean> stack = new ArrayDeque<>();
        for (Element r : XmlUtils.descendants(root, "w:r")) {
            for (Element child : new ArrayList<>(r.children())) {
                String name = child.tagName();
                if (name.equals("w:rPr")) {
                    continue;
                }
                if (name.equals("w:fldChar")) {
                    String type = XmlUtils.attr(child, "w:fldCharType");
                    if ("begin".equals(type)) {
                        stack.push(Boolean.TRUE);
                    } else if ("separate".equals(type) && !stack.isEmpty()) {
                        stack.pop();
                        stack.push(Boolean.FALSE);
                    } else if ("end".equals(type) && !stack.isEmpty()) {
                        stack.pop();
                    }
                    child.remove();
                    removed++;
                } else if (name.equals("w:instrText") || name.equals("w:delInstrText") || stack.contains(Boolean.TRUE)) {
                    child.remove();
                    removed++;
                }
            }
            if (onlyProperties(r)) {
                r.remove();
            }
        }
        return removed;
    }

    private static boolean onlyProperties(Element r) {
        for (Element c : r.children()) {
            if (!c.tagName().equals("w:rPr")) {
                return false;
            }
        }
        return true;
    }

    /**
     * 删除 rsid 及 w14:paraId / w14:textId 属性
     */
    static void removeRsid(Element root) {
        for (Element el : root.getAllElements()) {
            List<String> keys = new ArrayList<>();
            for (Attribute a : el.attributes()) {
                String key = a.getKey();
                if (key.startsWith("w:rsid") || key.equals("w14:paraId") || key.equals("w14:textId")) {
                    keys.add(key);
                }
            }
            for (String key : keys) {
                el.removeAttr(key);
            }
        }
    }
}
