package com.example.redline.util.wml.atom;

import com.example.redline.exception.RedlineException;
import com.example.redline.util.common.HashUtils;
import com.example.redline.util.ooxml.OoxmlPackage;
import com.example.redline.util.wml.FormattingReconciler;
import com.example.redline.util.wml.WmlComparerSettings;
import com.example.redline.util.xml.Namespaces;
import com.example.redline.util.xml.XmlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 原子化：把正文 / 脚注 / 尾注内容树展开为按文档顺序排列的原子列表
 *
 * 每个原子带完整的祖先链（从 body 的下一层到内容元素本身），
 * 同一源元素的祖先信息在一次原子化中共享同一个实例。
 */
@Slf4j
public class Atomizer {

    /** 直接产生原子的运行子元素 */
    private static final Set<String> RUN_CONTENT = new HashSet<>(Arrays.asList(
            "w:br", "w:cr", "w:tab", "w:ptab", "w:drawing", "w:sym", "w:fldChar", "w:instrText",
            "w:footnoteReference", "w:endnoteReference", "w:noBreakHyphen", "w:softHyphen",
            "w:dayLong", "w:dayShort", "w:monthLong", "w:monthShort", "w:yearLong", "w:yearShort",
            "w:pgNum"));

    /** 丢弃的元素 */
    private static final Set<String> THROW_AWAY = new HashSet<>(Arrays.asList(
            "w:bookmarkStart", "w:bookmarkEnd", "w:commentRangeStart", "w:commentRangeEnd",
            "w:lastRenderedPageBreak", "w:proofErr", "w:tblPr", "w:sectPr", "w:permEnd", "w:permStart",
            "w:footnoteRef", "w:endnoteRef", "w:separator", "w:continuationSeparator"));

    /** 递归元素及其需要跳过的属性类子元素 */
    private static final Map<String, Set<String>> RECURSION = new HashMap<>();

    static {
        recursion("w:del");
        recursion("w:ins");
        recursion("w:tbl", "w:tblPr", "w:tblGrid", "w:tblPrEx");
        recursion("w:tr", "w:trPr", "w:tblPrEx");
        recursion("w:tc", "w:tcPr", "w:tblPrEx");
        recursion("w:pict", "v:shapetype");
        recursion("v:group", "v:fill", "v:stroke", "v:shadow", "v:path", "v:formulas", "v:handles",
                "o:lock", "o:extrusion");
        recursion("v:shape", "v:fill", "v:stroke", "v:shadow", "v:textpath", "v:path", "v:formulas",
                "v:handles", "v:imagedata", "o:lock", "o:extrusion", "w10:wrap");
        recursion("v:rect", "v:fill", "v:stroke", "v:shadow", "v:textpath", "v:path", "v:formulas",
                "v:handles", "o:lock", "o:extrusion");
        recursion("v:textbox");
        recursion("o:lock");
        recursion("w:txbxContent");
        recursion("w10:wrap");
        recursion("w:sdtContent");
        recursion("w:hyperlink");
        recursion("w:fldSimple");
        recursion("w:sdt", "w:sdtPr", "w:sdtEndPr");
        recursion("v:shapetype", "v:stroke", "v:path", "v:fill", "v:shadow", "v:formulas", "v:handles");
        recursion("w:smartTag", "w:smartTagPr");
        recursion("w:ruby", "w:rubyPr");
    }

    private static void recursion(String name, String... skip) {
        RECURSION.put(name, new HashSet<>(Arrays.asList(skip)));
    }

    private final WmlComparerSettings settings;
    private final OoxmlPackage pkg;
    private final String partPath;
    private final String partName;
    private final Map<Element, AncestorInfo> ancestorCache = new IdentityHashMap<>();
    private final List<Atom> atoms = new ArrayList<>();

    private Atomizer(WmlComparerSettings settings, OoxmlPackage pkg, String partPath, String partName) {
        this.settings = settings;
        this.pkg = pkg;
        this.partPath = partPath;
        this.partName = partName;
    }

    /**
     * 原子化一个内容根（w:body、w:footnote、w:endnote）
     *
     * @param contentParent 内容根
     * @param partName      所属部件名（main / footnotes / endnotes）
     * @param partPath      部件路径，用于解析图片关系；可为 null
     * @param pkg           所在包；可为 null（此时图片退回结构哈希）
     */
    public static List<Atom> atomize(Element contentParent, String partName, String partPath,
                                     OoxmlPackage pkg, WmlComparerSettings settings) {
        if (contentParent == null) {
            throw RedlineException.internal(partPath, "原子化的内容根为空");
        }
        Atomizer atomizer = new Atomizer(settings, pkg, partPath, partName);
        atomizer.recurse(contentParent, null);
        log.debug("原子化完成: part={}, atoms={}", partName, atomizer.atoms.size());
        return atomizer.atoms;
    }

    private void recurse(Element el, String runSignature) {
        String name = el.tagName();

        if (name.equals("w:body") || name.equals("w:footnotes") || name.equals("w:endnotes")
                || name.equals("w:footnote") || name.equals("w:endnote")) {
            for (Element child : el.children()) {
                recurse(child, runSignature);
            }
            return;
        }

        if (name.equals("w:p")) {
            for (Element child : el.children()) {
                if (!child.tagName().equals("w:pPr")) {
                    recurse(child, runSignature);
                }
            }
            Element pPr = XmlUtils.child(el, "w:pPr");
            if (pPr == null) {
                pPr = XmlUtils.newElement("w:pPr");
            }
            addAtom(new Atom(ContentKind.PARAGRAPH_MARK, "", pPr, chainOf(el), partName, ""), null);
            return;
        }

        if (name.equals("w:r")) {
            String signature = FormattingReconciler.signatureOf(XmlUtils.child(el, "w:rPr"));
            for (Element child : el.children()) {
                if (!child.tagName().equals("w:rPr")) {
                    recurse(child, signature);
                }
            }
            return;
        }

        if (name.equals("w:t") || name.equals("w:delText")) {
            String text = XmlUtils.ownText(el);
            List<AncestorInfo> chain = chainOf(el);
            int i = 0;
            while (i < text.length()) {
                int cp = text.codePointAt(i);
                String ch = new String(Character.toChars(cp));
                addAtom(new Atom(ContentKind.TEXT, ch, el, chain, partName, normalizeChar(ch)), runSignature);
                i += Character.charCount(cp);
            }
            return;
        }

        if (RUN_CONTENT.contains(name)) {
            addAtom(runContentAtom(el), runSignature);
            return;
        }

        if (name.equals("m:oMath") || name.equals("m:oMathPara")) {
            String hash = elementHash(el);
            addAtom(new Atom(ContentKind.MATH, hash, el, chainOf(el), partName, hash), runSignature);
            return;
        }

        if (name.equals("w:object")) {
            String hash = elementHash(el);
            addAtom(new Atom(ContentKind.OBJECT, hash, el, chainOf(el), partName, hash), runSignature);
            return;
        }

        if (name.equals("w:pict") && XmlUtils.firstDescendant(el, "w:txbxContent") == null) {
            String hash = DrawingIdentity.compute(el, pkg, partPath);
            addAtom(new Atom(ContentKind.PICTURE, hash, el, chainOf(el), partName, hash), runSignature);
            return;
        }

        if (THROW_AWAY.contains(name)) {
            return;
        }

        if (name.equals("mc:AlternateContent")) {
            Element branch = XmlUtils.child(el, "mc:Fallback");
            if (branch == null) {
                branch = XmlUtils.child(el, "mc:Choice");
            }
            if (branch != null) {
                for (Element child : branch.children()) {
                    recurse(child, runSignature);
                }
            }
            return;
        }

        Set<String> skip = RECURSION.get(name);
        for (Element child : el.children()) {
            if (skip == null || !skip.contains(child.tagName())) {
                recurse(child, runSignature);
            }
        }
    }

    private Atom runContentAtom(Element el) {
        String name = el.tagName();
        List<AncestorInfo> chain = chainOf(el);
        switch (name) {
            case "w:br":
            case "w:cr":
                return new Atom(ContentKind.BREAK, "", el, chain, partName, "");
            case "w:tab":
            case "w:ptab":
                return new Atom(ContentKind.TAB, "", el, chain, partName, "");
            case "w:footnoteReference": {
                String id = nullToEmpty(XmlUtils.attr(el, "w:id"));
                return new Atom(ContentKind.FOOTNOTE_REFERENCE, id, el, chain, partName, id);
            }
            case "w:endnoteReference": {
                String id = nullToEmpty(XmlUtils.attr(el, "w:id"));
                return new Atom(ContentKind.ENDNOTE_REFERENCE, id, el, chain, partName, id);
            }
            case "w:drawing": {
                String hash = DrawingIdentity.compute(el, pkg, partPath);
                return new Atom(ContentKind.DRAWING, hash, el, chain, partName, hash);
            }
            case "w:sym": {
                String v = nullToEmpty(XmlUtils.attr(el, "w:font")) + ":" + nullToEmpty(XmlUtils.attr(el, "w:char"));
                return new Atom(ContentKind.SYMBOL, v, el, chain, partName, v);
            }
            case "w:instrText": {
                String instr = XmlUtils.ownText(el);
                return new Atom(ContentKind.SIMPLE_FIELD, instr, el, chain, partName, instr);
            }
            case "w:fldChar": {
                String type = nullToEmpty(XmlUtils.attr(el, "w:fldCharType"));
                if (type.equals("begin")) {
                    return new Atom(ContentKind.FIELD_BEGIN, "", el, chain, partName, "");
                } else if (type.equals("separate")) {
                    return new Atom(ContentKind.FIELD_SEPARATOR, "", el, chain, partName, "");
                } else if (type.equals("end")) {
                    return new Atom(ContentKind.FIELD_END, "", el, chain, partName, "");
                }
                String n = "fldChar:" + type;
                return new Atom(ContentKind.UNKNOWN, n, el, chain, partName, n);
            }
            default: {
                String local = XmlUtils.localName(name);
                return new Atom(ContentKind.UNKNOWN, local, el, chain, partName, local);
            }
        }
    }

    private void addAtom(Atom atom, String runSignature) {
        atom.setFormattingSignature(runSignature);
        atoms.add(atom);
    }

    /**
     * 文本字符的比较形式：可选大小写折叠、不间断空格折叠为普通空格
     */
    private String normalizeChar(String ch) {
        String s = ch;
        if (settings.isConflateSpaces() && s.equals("\u00a0")) {
            s = " ";
        }
        if (settings.isCaseInsensitive()) {
            s = s.toUpperCase(Locale.ROOT);
        }
        return s;
    }

    // —— 祖先链 —— //

    /**
     * 从内容元素向上直到 body / footnotes / endnotes（不含），返回根到叶顺序
     */
    private List<AncestorInfo> chainOf(Element el) {
        List<AncestorInfo> chain = new ArrayList<>();
        Element current = el;
        while (current != null) {
            String name = current.tagName();
            if (name.equals("w:body") || name.equals("w:footnotes") || name.equals("w:endnotes")
                    || name.equals("w:document") || name.startsWith("#")) {
                break;
            }
            chain.add(ancestorInfo(current));
            current = current.parent();
        }
        Collections.reverse(chain);
        return chain;
    }

    private AncestorInfo ancestorInfo(Element el) {
        AncestorInfo info = ancestorCache.get(el);
        if (info == null) {
            info = new AncestorInfo(el);
            ancestorCache.put(el, info);
        }
        return info;
    }

    // —— 元素哈希 —— //

    /**
     * 公式、OLE 对象的内容哈希：元素名 + 属性（不含 pt14 Unid / SHA1Hash）+ 文本
     */
    static String elementHash(Element el) {
        MessageDigest md = HashUtils.sha1Digest();
        hashElement(el, md);
        return HashUtils.toHex(md.digest());
    }

    private static void hashElement(Node node, MessageDigest md) {
        if (node instanceof TextNode) {
            md.update(((TextNode) node).getWholeText().getBytes(StandardCharsets.UTF_8));
            return;
        }
        if (!(node instanceof Element)) {
            return;
        }
        Element el = (Element) node;
        md.update(XmlUtils.localName(el.tagName()).getBytes(StandardCharsets.UTF_8));
        for (Attribute a : el.attributes()) {
            String key = a.getKey();
            if (key.equals(Namespaces.PT_UNID) || key.equals(Namespaces.PT_SHA1) || key.startsWith("xmlns")) {
                continue;
            }
            md.update(XmlUtils.localName(key).getBytes(StandardCharsets.UTF_8));
            md.update(a.getValue().getBytes(StandardCharsets.UTF_8));
        }
        for (Node child : el.childNodes()) {
            hashElement(child, md);
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
