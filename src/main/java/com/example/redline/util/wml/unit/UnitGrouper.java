package com.example.redline.util.wml.unit;

import com.example.redline.util.common.HashUtils;
import com.example.redline.util.wml.WmlComparerSettings;
import com.example.redline.util.wml.atom.AncestorInfo;
import com.example.redline.util.wml.atom.Atom;
import com.example.redline.util.xml.Namespaces;
import com.example.redline.util.xml.XmlUtils;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * 原子 → 词 → 分组
 *
 * 分词：空白、分词符、CJK 表意字（每字一词）、非文本原子（段落标记、图片、制表符……）都会断词；
 * 数字之间的 '.' 和 ','（两侧都是数字）不断词。
 * 分组：按祖先链中的 p / tbl / tr / tc / txbxContent 逐层划分。
 */
public class UnitGrouper {

    private UnitGrouper() {
    }

    public static List<ComparisonUnit> group(List<Atom> atoms, WmlComparerSettings settings) {
        List<Word> words = toWords(atoms, settings);
        List<WordWithPath> withPath = new ArrayList<>(words.size());
        for (Word w : words) {
            withPath.add(new WordWithPath(w, hierarchyOf(w.firstAtom())));
        }
        return build(withPath, 0);
    }

    // ==================== 分词 ====================

    static List<Word> toWords(List<Atom> atoms, WmlComparerSettings settings) {
        List<Word> words = new ArrayList<>();
        List<Atom> current = new ArrayList<>();
        List<String> currentPath = null;

        for (int i = 0; i < atoms.size(); i++) {
            Atom atom = atoms.get(i);
            List<String> path = hierarchyOf(atom);

            if (!current.isEmpty() && !path.equals(currentPath)) {
                words.add(new Word(current));
                current = new ArrayList<>();
            }

            boolean alone;
            if (atom.isText()) {
                int ch = atom.getChar();
                if ((ch == '.' || ch == ',') && isDigitAt(atoms, i - 1) && isDigitAt(atoms, i + 1)) {
                    alone = false;
                } else {
                    alone = isCjk(ch) || settings.isWordSeparator(ch);
                }
            } else {
                alone = atom.getKind().isWordBreak();
            }

            if (alone) {
                if (!current.isEmpty()) {
                    words.add(new Word(current));
                    current = new ArrayList<>();
                }
                List<Atom> single = new ArrayList<>();
                single.add(atom);
                words.add(new Word(single));
                currentPath = path;
                continue;
            }
            current.add(atom);
            currentPath = path;
        }
        if (!current.isEmpty()) {
            words.add(new Word(current));
        }
        return words;
    }

    private static boolean isDigitAt(List<Atom> atoms, int index) {
        if (index < 0 || index >= atoms.size()) {
            return false;
        }
        Atom a = atoms.get(index);
        int ch = a.getChar();
        return a.isText() && ch >= '0' && ch <= '9';
    }

    /**
     * CJK 统一表意文字
     */
    public static boolean isCjk(int ch) {
        return ch >= 0x4e00 && ch <= 0x9fff;
    }

    // ==================== 分组 ====================

    private static class WordWithPath {
        final Word word;
        final List<String> path;

        WordWithPath(Word word, List<String> path) {
            this.word = word;
            this.path = path;
        }

        String keyAt(int level) {
            return level < path.size() ? path.get(level) : "";
        }
    }

    /**
     * 原子的分组路径，如 [tbl:u1, tr:u2, tc:u3, p:u4]
     */
    static List<String> hierarchyOf(Atom atom) {
        List<String> path = new ArrayList<>();
        if (atom == null) {
            return path;
        }
        for (AncestorInfo a : atom.getAncestors()) {
            if (a.getName().startsWith("w:") && GroupKind.fromLocalName(a.getLocalName()) != null) {
                path.add(a.getLocalName() + ":" + a.getUnid());
            }
        }
        return path;
    }

    private static List<ComparisonUnit> build(List<WordWithPath> words, int level) {
        List<ComparisonUnit> result = new ArrayList<>();
        int i = 0;
        while (i < words.size()) {
            String key = words.get(i).keyAt(level);
            int j = i;
            while (j < words.size() && words.get(j).keyAt(level).equals(key)) {
                j++;
            }
            List<WordWithPath> slice = words.subList(i, j);
            if (key.isEmpty()) {
                for (WordWithPath w : slice) {
                    result.add(w.word);
                }
            } else {
                List<ComparisonUnit> children = wrapLooseWords(build(slice, level + 1));
                result.add(createGroup(key, slice.get(0).word.firstAtom(), children));
            }
            i = j;
        }
        return result;
    }

    /**
     * 同时含有词和分组时，把连续的游离词包成伪段落，保证成员同质
     */
    private static List<ComparisonUnit> wrapLooseWords(List<ComparisonUnit> units) {
        boolean hasGroup = false;
        boolean hasWord = false;
        for (ComparisonUnit u : units) {
            if (u.isGroup()) {
                hasGroup = true;
            } else {
                hasWord = true;
            }
        }
        if (!hasGroup || !hasWord) {
            return units;
        }
        List<ComparisonUnit> result = new ArrayList<>();
        List<ComparisonUnit> loose = new ArrayList<>();
        for (ComparisonUnit u : units) {
            if (u.isGroup()) {
                if (!loose.isEmpty()) {
                    result.add(new Group(GroupKind.PARAGRAPH, "", loose, null, null));
                    loose = new ArrayList<>();
                }
                result.add(u);
            } else {
                loose.add(u);
            }
        }
        if (!loose.isEmpty()) {
            result.add(new Group(GroupKind.PARAGRAPH, "", loose, null, null));
        }
        return result;
    }

    private static Group createGroup(String key, Atom firstAtom, List<ComparisonUnit> children) {
        int idx = key.indexOf(':');
        GroupKind kind = GroupKind.fromLocalName(key.substring(0, idx));
        String unid = key.substring(idx + 1);

        Element element = null;
        for (AncestorInfo a : firstAtom.getAncestors()) {
            if (a.getLocalName().equals(kind.getLocalName()) && a.getUnid().equals(unid)) {
                element = a.getElement();
                break;
            }
        }
        String correlated = XmlUtils.attr(element, Namespaces.PT_CORRELATED_SHA1);
        String structure = kind == GroupKind.TABLE && element != null ? tableStructureHash(element) : null;
        return new Group(kind, unid, children, correlated, structure);
    }

    /**
     * 表格结构哈希：每行的单元格数及 gridSpan / vMerge
     */
    static String tableStructureHash(Element tbl) {
        StringBuilder sb = new StringBuilder();
        for (Element tr : XmlUtils.children(tbl, "w:tr")) {
            sb.append("tr[");
            for (Element tc : XmlUtils.children(tr, "w:tc")) {
                Element tcPr = XmlUtils.child(tc, "w:tcPr");
                String span = XmlUtils.childAttr(tcPr, "w:gridSpan", "w:val");
                Element vMerge = XmlUtils.child(tcPr, "w:vMerge");
                sb.append("tc");
                if (span != null) {
                    sb.append(":span=").append(span);
                }
                if (vMerge != null) {
                    String v = XmlUtils.attr(vMerge, "w:val");
                    sb.append(":vMerge=").append(v == null ? "continue" : v);
                }
                sb.append(';');
            }
            sb.append(']');
        }
        return HashUtils.sha1(sb.toString());
    }
}
