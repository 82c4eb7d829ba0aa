package com.example.redline.util.pml;

import com.example.redline.util.pml.signature.ShapeKind;
import com.example.redline.util.pml.signature.ShapeSignature;
import com.example.redline.util.pml.signature.SlideSignature;
import com.example.redline.util.pml.signature.TransformInfo;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 同一对幻灯片内的形状配对
 *
 * 依次：占位符 (type, idx) → 名称 + 类别 → 类别 + 内容哈希 → 名称 → 模糊匹配（类别、位置、内容）。
 */
public class ShapeMatcher {

    public enum MatchType {
        Matched, Inserted, Deleted
    }

    public enum Method {
        Placeholder, NameAndKind, ContentHash, NameOnly, Fuzzy
    }

    public static class ShapeMatch {
        private final MatchType type;
        private final ShapeSignature oldShape;
        private final ShapeSignature newShape;
        private final double score;
        private final Method method;

        ShapeMatch(MatchType type, ShapeSignature oldShape, ShapeSignature newShape, double score, Method method) {
            this.type = type;
            this.oldShape = oldShape;
            this.newShape = newShape;
            this.score = score;
            this.method = method;
        }

        public MatchType getType() { return type; }

        public ShapeSignature getOldShape() { return oldShape; }

        public ShapeSignature getNewShape() { return newShape; }

        public double getScore() { return score; }

        public Method getMethod() { return method; }
    }

    /**
     * 两个形状能否按某一轮规则配对
     */
    private interface Rule {
        boolean matches(ShapeSignature s1, ShapeSignature s2);
    }

    private final PmlComparerSettings settings;
    private final List<ShapeMatch> matches = new ArrayList<>();
    private final Set<String> used1 = new HashSet<>();
    private final Set<String> used2 = new HashSet<>();

    private ShapeMatcher(PmlComparerSettings settings) {
        this.settings = settings;
    }

    public static List<ShapeMatch> match(SlideSignature slide1, SlideSignature slide2, PmlComparerSettings settings) {
        ShapeMatcher m = new ShapeMatcher(settings);
        List<ShapeSignature> shapes1 = slide1.getShapes();
        List<ShapeSignature> shapes2 = slide2.getShapes();

        m.pass(shapes1, shapes2, 1.0, Method.Placeholder,
                (a, b) -> a.getPlaceholder() != null && a.getPlaceholder().equals(b.getPlaceholder()));
        m.pass(shapes1, shapes2, 0.95, Method.NameAndKind,
                (a, b) -> !a.getName().isEmpty() && a.getName().equals(b.getName()) && a.getKind() == b.getKind());
        m.pass(shapes1, shapes2, 0.9, Method.ContentHash,
                (a, b) -> a.getKind() == b.getKind() && hasContent(a) && Objects.equals(a.getContentHash(), b.getContentHash()));
        m.pass(shapes1, shapes2, 0.8, Method.NameOnly,
                (a, b) -> !a.getName().isEmpty() && a.getName().equals(b.getName()));
        if (settings.isEnableFuzzyShapeMatching()) {
            m.fuzzy(shapes1, shapes2);
        }

        for (ShapeSignature s : shapes1) {
            if (!m.used1.contains(s.getKey())) {
                m.matches.add(new ShapeMatch(MatchType.Deleted, s, null, 0, null));
            }
        }
        for (ShapeSignature s : shapes2) {
            if (!m.used2.contains(s.getKey())) {
                m.matches.add(new ShapeMatch(MatchType.Inserted, null, s, 0, null));
            }
        }
        return m.matches;
    }

    private void pass(List<ShapeSignature> shapes1, List<ShapeSignature> shapes2, double score, Method method, Rule rule) {
        for (ShapeSignature s1 : shapes1) {
            if (used1.contains(s1.getKey())) {
                continue;
            }
            for (ShapeSignature s2 : shapes2) {
                if (!used2.contains(s2.getKey()) && rule.matches(s1, s2)) {
                    add(s1, s2, score, method);
                    break;
                }
            }
        }
    }

    private void fuzzy(List<ShapeSignature> shapes1, List<ShapeSignature> shapes2) {
        for (ShapeSignature s1 : shapes1) {
            if (used1.contains(s1.getKey())) {
                continue;
            }
            double best = 0;
            ShapeSignature bestMatch = null;
            for (ShapeSignature s2 : shapes2) {
                if (used2.contains(s2.getKey())) {
                    continue;
                }
                double score = score(s1, s2);
                if (score > best && score >= settings.getShapeSimilarityThreshold()) {
                    best = score;
                    bestMatch = s2;
                }
            }
            if (bestMatch != null) {
                add(s1, bestMatch, best, Method.Fuzzy);
            }
        }
    }

    private void add(ShapeSignature s1, ShapeSignature s2, double score, Method method) {
        matches.add(new ShapeMatch(MatchType.Matched, s1, s2, score, method));
        used1.add(s1.getKey());
        used2.add(s2.getKey());
    }

    /**
     * 类别相同 0.2；位置接近 0.3（或 5 倍容差内 0.1）；内容 0.5
     */
    double score(ShapeSignature s1, ShapeSignature s2) {
        if (s1.getKind() != s2.getKind()) {
            return 0;
        }
        double score = 0.2;
        TransformInfo t1 = s1.getTransform();
        TransformInfo t2 = s2.getTransform();
        if (t1 != null && t2 != null) {
            if (t1.isNear(t2, settings.getPositionTolerance())) {
                score += 0.3;
            } else if (t1.distanceTo(t2) < settings.getPositionTolerance() * 5.0) {
                score += 0.1;
            }
        }
        if (s1.getKind() == ShapeKind.Picture) {
            if (s1.getImageHash() != null && s1.getImageHash().equals(s2.getImageHash())) {
                score += 0.5;
            }
        } else if (s1.getTextBody() != null && s2.getTextBody() != null) {
            score += textSimilarity(s1.getPlainText(), s2.getPlainText()) * 0.5;
        } else if (Objects.equals(s1.getContentHash(), s2.getContentHash())) {
            score += 0.5;
        }
        return score;
    }

    private static boolean hasContent(ShapeSignature s) {
        return (s.getTextBody() != null && !s.getPlainText().isEmpty())
                || s.getImageHash() != null || s.getTableHash() != null || s.getChartHash() != null;
    }

    /**
     * 1 - 编辑距离 / 较长串长度
     */
    static double textSimilarity(String s1, String s2) {
        if (s1.isEmpty() && s2.isEmpty()) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        int maxLen = Math.max(s1.length(), s2.length());
        return 1.0 - (double) levenshtein(s1, s2) / maxLen;
    }

    static int levenshtein(String s1, String s2) {
        int[] prev = new int[s2.length() + 1];
        int[] curr = new int[s2.length() + 1];
        for (int j = 0; j <= s2.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= s1.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= s2.length(); j++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(prev[j] + 1, curr[j - 1] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[s2.length()];
    }
}
