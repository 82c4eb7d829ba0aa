package com.example.redline.util.wml;

import com.example.redline.util.wml.atom.AncestorInfo;
import com.example.redline.util.wml.atom.Atom;
import com.example.redline.util.wml.lcs.CorrelationStatus;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 为展开后的原子计算重建用的祖先 Unid 列表
 *
 * 同一段落里的内容必须落到同一个重建段落中：段落内每个原子都继承段落标记的祖先 Unid，
 * 只有比段落标记更深的层级才使用自身的 Unid。文本框内的段落单独处理。
 */
public class AncestorUnidAssembler {

    private AncestorUnidAssembler() {
    }

    public static void assemble(List<Atom> atoms) {
        if (atoms.isEmpty()) {
            return;
        }
        Map<Atom, List<String>> elementUnids = new IdentityHashMap<>();
        for (Atom atom : atoms) {
            elementUnids.put(atom, elementUnidsOf(atom));
        }

        // 脚注 / 尾注的根 Unid 统一使用最后一个原子的
        String deepest = null;
        List<AncestorInfo> lastChain = atoms.get(atoms.size() - 1).getAncestors();
        if (!lastChain.isEmpty()) {
            String root = lastChain.get(0).getName();
            if (root.equals("w:footnote") || root.equals("w:endnote")) {
                deepest = lastChain.get(0).getUnid();
            }
        }

        // 正文段落：逆序扫描，段落标记决定前缀
        List<String> current = new ArrayList<>();
        for (int i = atoms.size() - 1; i >= 0; i--) {
            Atom atom = atoms.get(i);
            List<String> own = elementUnids.get(atom);
            List<String> unids;
            if (atom.isParagraphMark() && !atom.isInTextbox()) {
                current = own;
                unids = new ArrayList<>(current);
            } else {
                unids = new ArrayList<>(current);
                for (int j = current.size(); j < own.size(); j++) {
                    unids.add(own.get(j));
                }
            }
            if (deepest != null && !unids.isEmpty()) {
                unids.set(0, deepest);
            }
            atom.setAncestorUnids(unids);
        }

        // 文本框段落
        current = new ArrayList<>();
        boolean skip = false;
        for (int i = atoms.size() - 1; i >= 0; i--) {
            Atom atom = atoms.get(i);
            List<String> own = elementUnids.get(atom);
            if (!current.isEmpty() && atom.getAncestors().size() < current.size()) {
                skip = true;
                current = new ArrayList<>();
                continue;
            }
            if (atom.isParagraphMark()) {
                if (!atom.isInTextbox()) {
                    skip = true;
                    current = new ArrayList<>();
                    continue;
                }
                skip = false;
                current = own;
                atom.setAncestorUnids(new ArrayList<>(current));
                continue;
            }
            if (skip) {
                continue;
            }
            List<String> unids = new ArrayList<>(current);
            for (int j = current.size(); j < own.size(); j++) {
                unids.add(own.get(j));
            }
            atom.setAncestorUnids(unids);
        }
    }

    /**
     * 原子自身祖先链的 Unid；Equal 段落标记（及文本框内的 Equal 原子）使用修改前原子的
     */
    private static List<String> elementUnidsOf(Atom atom) {
        boolean inTextbox = atom.isInTextbox();
        boolean equal = atom.getStatus() == CorrelationStatus.EQUAL;
        boolean useBefore = atom.isParagraphMark() ? (inTextbox || equal) : (inTextbox && equal);
        List<AncestorInfo> chain = atom.getAncestors();
        if (useBefore && atom.getBefore() != null && atom.getBefore().getAncestors().size() == chain.size()) {
            chain = atom.getBefore().getAncestors();
        }
        List<String> unids = new ArrayList<>(chain.size());
        for (AncestorInfo a : chain) {
            unids.add(a.getUnid());
        }
        return unids;
    }

    // —— 文本框 —— //

    /**
     * 同一文本框内的原子统一外层、段落（混合修订时还有运行）层级的 Unid
     */
    public static void normalizeTextboxes(List<Atom> atoms) {
        int i = 0;
        while (i < atoms.size()) {
            int txIdx = textboxIndex(atoms.get(i));
            if (txIdx < 0) {
                i++;
                continue;
            }
            int end = i;
            while (end < atoms.size() && textboxIndex(atoms.get(end)) == txIdx) {
                end++;
            }
            normalizeGroup(atoms.subList(i, end), txIdx);
            i = end;
        }
    }

    private static int textboxIndex(Atom atom) {
        List<AncestorInfo> chain = atom.getAncestors();
        for (int i = 0; i < chain.size(); i++) {
            if (chain.get(i).getName().equals("w:txbxContent")) {
                return i;
            }
        }
        return -1;
    }

    private static void normalizeGroup(List<Atom> group, int txIdx) {
        Atom outerRef = preferred(group, -1);

        List<List<Atom>> paragraphs = new ArrayList<>();
        List<Atom> para = new ArrayList<>();
        for (Atom atom : group) {
            para.add(atom);
            if (atom.isParagraphMark()) {
                paragraphs.add(para);
                para = new ArrayList<>();
            }
        }
        if (!para.isEmpty()) {
            paragraphs.add(para);
        }

        for (List<Atom> p : paragraphs) {
            boolean hasEqual = false;
            boolean hasChange = false;
            for (Atom atom : p) {
                if (atom.getStatus() == CorrelationStatus.EQUAL) {
                    hasEqual = true;
                } else if (atom.getStatus() == CorrelationStatus.INSERTED
                        || atom.getStatus() == CorrelationStatus.DELETED) {
                    hasChange = true;
                }
            }
            boolean mixed = hasEqual && hasChange;
            Atom paraRef = preferred(p, -1);
            Atom runRef = preferred(p, txIdx + 2);

            int depth = mixed ? txIdx + 3 : txIdx + 2;
            for (Atom atom : p) {
                List<String> unids = atom.getAncestorUnids();
                int limit = Math.min(depth, unids.size());
                for (int level = 0; level < limit; level++) {
                    Atom ref;
                    if (level <= txIdx) {
                        ref = outerRef;
                    } else if (level == txIdx + 1) {
                        ref = paraRef;
                    } else {
                        ref = runRef;
                    }
                    if (ref != null && level < ref.getAncestorUnids().size()) {
                        unids.set(level, ref.getAncestorUnids().get(level));
                    }
                }
            }
        }
    }

    /**
     * 参照原子：优先 Equal，其次 Deleted，最后第一个；minDepth >= 0 时要求 Unid 层数大于它
     */
    private static Atom preferred(List<Atom> atoms, int minDepth) {
        Atom deleted = null;
        Atom any = null;
        for (Atom atom : atoms) {
            if (minDepth >= 0 && atom.getAncestorUnids().size() <= minDepth) {
                continue;
            }
            if (atom.getStatus() == CorrelationStatus.EQUAL) {
                return atom;
            }
            if (deleted == null && atom.getStatus() == CorrelationStatus.DELETED) {
                deleted = atom;
            }
            if (any == null) {
                any = atom;
            }
        }
        return deleted != null ? deleted : any;
    }
}
