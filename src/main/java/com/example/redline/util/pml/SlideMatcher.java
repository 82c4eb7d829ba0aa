package com.example.redline.util.pml;

import com.example.redline.util.pml.signature.PresentationSignature;
import com.example.redline.util.pml.signature.ShapeKind;
import com.example.redline.util.pml.signature.ShapeSignature;
import com.example.redline.util.pml.signature.SlideSignature;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 幻灯片配对
 *
 * 依次：同位置且同版式 → 内容指纹相同 → 标题相同 → 相似度贪心（或按剩余顺序）。
 * 同位置的两张幻灯片标题不同、而另一侧有同标题的幻灯片时，不在第一步配对。
 * 没配上的旧幻灯片为删除，新幻灯片为插入。结果按新位置排序，删除项按旧位置排在最后。
 */
public class SlideMatcher {

    public enum MatchType {
        Matched, Inserted, Deleted
    }

    public static class SlideMatch {
        private final MatchType type;
        private final SlideSignature oldSlide;
        private final SlideSignature newSlide;
        private final double similarity;

        SlideMatch(MatchType type, SlideSignature oldSlide, SlideSignature newSlide, double similarity) {
            this.type = type;
            this.oldSlide = oldSlide;
            this.newSlide = newSlide;
            this.similarity = similarity;
        }

        public boolean wasMoved() {
            return oldSlide != null && newSlide != null && oldSlide.getIndex() != newSlide.getIndex();
        }

        public Integer getOldIndex() { return oldSlide == null ? null : oldSlide.getIndex(); }

        public Integer getNewIndex() { return newSlide == null ? null : newSlide.getIndex(); }

        public MatchType getType() { return type; }

        public SlideSignature getOldSlide() { return oldSlide; }

        public SlideSignature getNewSlide() { return newSlide; }

        public double getSimilarity() { return similarity; }
    }

    private final PmlComparerSettings settings;
    private final List<SlideMatch> matches = new ArrayList<>();
    private final Set<Integer> used1 = new HashSet<>();
    private final Set<Integer> used2 = new HashSet<>();

    private SlideMatcher(PmlComparerSettings settings) {
        this.settings = settings;
    }

    public static List<SlideMatch> match(PresentationSignature p1, PresentationSignature p2, PmlComparerSettings settings) {
        SlideMatcher matcher = new SlideMatcher(settings);
        matcher.matchByIndexAndLayout(p1, p2);
        matcher.matchByFingerprint(p1, p2);
        matcher.matchByTitle(p1, p2);
        if (settings.isUseSlideAlignmentLcs()) {
            matcher.matchBySimilarity(p1, p2);
        } else {
            matcher.matchByPosition(p1, p2);
        }
        for (SlideSignature s : p1.getSlides()) {
            if (!matcher.used1.contains(s.getIndex())) {
                matcher.matches.add(new SlideMatch(MatchType.Deleted, s, null, 0));
            }
        }
        for (SlideSignature s : p2.getSlides()) {
            if (!matcher.used2.contains(s.getIndex())) {
                matcher.matches.add(new SlideMatch(MatchType.Inserted, null, s, 0));
            }
        }
        matcher.matches.sort(Comparator
                .comparing((SlideMatch m) -> m.getNewIndex() == null ? Integer.MAX_VALUE : m.getNewIndex())
                .thenComparing(m -> m.getOldIndex() == null ? Integer.MAX_VALUE : m.getOldIndex()));
        return matcher.matches;
    }

    /**
     * 同一位置、同一版式，且内容相同、标题相同或足够相似
     */
    private void matchByIndexAndLayout(PresentationSignature p1, PresentationSignature p2) {
        Map<Integer, SlideSignature> byIndex = new HashMap<>();
        for (SlideSignature s : p2.getSlides()) {
            byIndex.put(s.getIndex(), s);
        }
        for (SlideSignature s1 : p1.getSlides()) {
            SlideSignature s2 = byIndex.get(s1.getIndex());
            if (s2 == null || !Objects.equals(s1.getLayoutHash(), s2.getLayoutHash())) {
                continue;
            }
            double similarity = similarity(s1, s2);
            boolean compatible = Objects.equals(s1.getContentHash(), s2.getContentHash())
                    || (!isEmpty(s1.getTitleText()) && s1.getTitleText().equals(s2.getTitleText()))
                    || (similarity >= settings.getSlideSimilarityThreshold() && !titledElsewhere(s1, s2, p1, p2));
            if (compatible) {
                add(s1, s2, similarity);
            }
        }
    }

    /**
     * 两张幻灯片标题都非空且不同，而另一侧有标题完全相同的幻灯片（删除、插入或调换了顺序）
     */
    private static boolean titledElsewhere(SlideSignature s1, SlideSignature s2,
                                           PresentationSignature p1, PresentationSignature p2) {
        String t1 = s1.getTitleText();
        String t2 = s2.getTitleText();
        if (isEmpty(t1) || isEmpty(t2) || t1.equals(t2)) {
            return false;
        }
        for (SlideSignature other : p2.getSlides()) {
            if (other != s2 && t1.equals(other.getTitleText())) {
                return true;
            }
        }
        for (SlideSignature other : p1.getSlides()) {
            if (other != s1 && t2.equals(other.getTitleText())) {
                return true;
            }
        }
        return false;
    }

    private void matchByFingerprint(PresentationSignature p1, PresentationSignature p2) {
        Map<Integer, String> fingerprints2 = new HashMap<>();
        for (SlideSignature s2 : p2.getSlides()) {
            if (!used2.contains(s2.getIndex())) {
                fingerprints2.put(s2.getIndex(), s2.computeFingerprint());
            }
        }
        for (SlideSignature s1 : p1.getSlides()) {
            if (used1.contains(s1.getIndex())) {
                continue;
            }
            String fp = s1.computeFingerprint();
            for (SlideSignature s2 : p2.getSlides()) {
                if (!used2.contains(s2.getIndex()) && fp.equals(fingerprints2.get(s2.getIndex()))) {
                    add(s1, s2, 1.0);
                    break;
                }
            }
        }
    }

    private void matchByTitle(PresentationSignature p1, PresentationSignature p2) {
        for (SlideSignature s1 : p1.getSlides()) {
            if (used1.contains(s1.getIndex()) || isEmpty(s1.getTitleText())) {
                continue;
            }
            for (SlideSignature s2 : p2.getSlides()) {
                if (!used2.contains(s2.getIndex()) && s1.getTitleText().equals(s2.getTitleText())) {
                    add(s1, s2, similarity(s1, s2));
                    break;
                }
            }
        }
    }

    /**
     * 剩余幻灯片两两计算相似度，每次取最高的一对，低于阈值停止
     */
    private void matchBySimilarity(PresentationSignature p1, PresentationSignature p2) {
        List<SlideSignature> rest1 = remaining(p1, used1);
        List<SlideSignature> rest2 = remaining(p2, used2);
        if (rest1.isEmpty() || rest2.isEmpty()) {
            return;
        }
        double[][] sim = new double[rest1.size()][rest2.size()];
        for (int i = 0; i < rest1.size(); i++) {
            for (int j = 0; j < rest2.size(); j++) {
                sim[i][j] = similarity(rest1.get(i), rest2.get(j));
            }
        }
        boolean[] done1 = new boolean[rest1.size()];
        boolean[] done2 = new boolean[rest2.size()];
        while (true) {
            double best = 0;
            int bi = -1;
            int bj = -1;
            for (int i = 0; i < rest1.size(); i++) {
                if (done1[i]) {
                    continue;
                }
                for (int j = 0; j < rest2.size(); j++) {
                    if (!done2[j] && sim[i][j] > best) {
                        best = sim[i][j];
                        bi = i;
                        bj = j;
                    }
                }
            }
            if (bi < 0 || best < settings.getSlideSimilarityThreshold()) {
                return;
            }
            done1[bi] = true;
            done2[bj] = true;
            add(rest1.get(bi), rest2.get(bj), best);
        }
    }

    private void matchByPosition(PresentationSignature p1, PresentationSignature p2) {
        List<SlideSignature> rest1 = remaining(p1, used1);
        List<SlideSignature> rest2 = remaining(p2, used2);
        int n = Math.min(rest1.size(), rest2.size());
        for (int i = 0; i < n; i++) {
            add(rest1.get(i), rest2.get(i), similarity(rest1.get(i), rest2.get(i)));
        }
    }

    private void add(SlideSignature s1, SlideSignature s2, double similarity) {
        matches.add(new SlideMatch(MatchType.Matched, s1, s2, similarity));
        used1.add(s1.getIndex());
        used2.add(s2.getIndex());
    }

    private static List<SlideSignature> remaining(PresentationSignature p, Set<Integer> used) {
        List<SlideSignature> result = new ArrayList<>();
        for (SlideSignature s : p.getSlides()) {
            if (!used.contains(s.getIndex())) {
                result.add(s);
            }
        }
        return result;
    }

    /**
     * 加权相似度：标题 3，内容哈希 1，形状数 1，形状类别 1，形状名 2
     */
    static double similarity(SlideSignature s1, SlideSignature s2) {
        double score = 0;
        double max = 0;
        String t1 = s1.getTitleText() == null ? "" : s1.getTitleText();
        String t2 = s2.getTitleText() == null ? "" : s2.getTitleText();
        if (!t1.isEmpty() || !t2.isEmpty()) {
            max += 3;
            if (!t1.isEmpty() && t1.equals(t2)) {
                score += 3;
            } else if (!t1.isEmpty() && !t2.isEmpty()) {
                score += ShapeMatcher.textSimilarity(t1, t2) * 2;
            }
        }

        max += 1;
        if (Objects.equals(s1.getContentHash(), s2.getContentHash())) {
            score += 1;
        }

        max += 1;
        int c1 = s1.getShapes().size();
        int c2 = s2.getShapes().size();
        if (c1 == c2) {
            score += 1;
        } else if (Math.abs(c1 - c2) <= 2) {
            score += 0.5;
        }

        max += 1;
        Set<ShapeKind> kinds1 = new HashSet<>();
        Set<ShapeKind> kinds2 = new HashSet<>();
        for (ShapeSignature s : s1.getShapes()) {
            kinds1.add(s.getKind());
        }
        for (ShapeSignature s : s2.getShapes()) {
            kinds2.add(s.getKind());
        }
        int totalKinds = Math.max(kinds1.size(), kinds2.size());
        if (totalKinds > 0) {
            kinds1.retainAll(kinds2);
            score += (double) kinds1.size() / totalKinds;
        }

        max += 2;
        Set<String> names1 = new HashSet<>();
        Set<String> names2 = new HashSet<>();
        for (ShapeSignature s : s1.getShapes()) {
            if (!s.getName().isEmpty()) {
                names1.add(s.getName());
            }
        }
        for (ShapeSignature s : s2.getShapes()) {
            if (!s.getName().isEmpty()) {
                names2.add(s.getName());
            }
        }
        int totalNames = Math.max(names1.size(), names2.size());
        if (totalNames > 0) {
            names1.retainAll(names2);
            score += 2.0 * names1.size() / totalNames;
        }
        return score / max;
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }
}
