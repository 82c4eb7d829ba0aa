package com.example.redline.util.wml.lcs;

import com.example.redline.util.lcs.LcsSettings;
import com.example.redline.util.lcs.MatchResult;
import com.example.redline.util.lcs.SequenceAligner;
import com.example.redline.util.wml.WmlComparerSettings;
import com.example.redline.util.wml.atom.AncestorInfo;
import com.example.redline.util.wml.atom.Atom;
import com.example.redline.util.wml.unit.ComparisonUnit;
import com.example.redline.util.wml.unit.Group;
import com.example.redline.util.wml.unit.GroupKind;
import com.example.redline.util.wml.unit.UnitGrouper;
import com.example.redline.util.wml.unit.Word;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Word 文档单元相关性求解
 *
 * 工作列表初始为一个 UNKNOWN(units1, units2)，每轮取第一个 UNKNOWN，
 * 依次尝试：块哈希匹配 → 公共前缀 / 后缀 → 最长公共连续子串（失败时走特殊情况处理），
 * 用结果原位替换，直到没有 UNKNOWN。
 */
@Slf4j
public class WmlCorrelator {

    private final WmlComparerSettings settings;

    private WmlCorrelator(WmlComparerSettings settings) {
        this.settings = settings;
    }

    /**
     * 求解两个单元序列的对齐片段，结果中不含 UNKNOWN
     */
    public static List<CorrelatedSequence> correlate(List<ComparisonUnit> units1, List<ComparisonUnit> units2,
                                                     WmlComparerSettings settings) {
        return new WmlCorrelator(settings).run(units1, units2);
    }

    private List<CorrelatedSequence> run(List<ComparisonUnit> units1, List<ComparisonUnit> units2) {
        List<CorrelatedSequence> unrelated = detectUnrelatedSources(units1, units2);
        if (unrelated != null) {
            log.debug("两侧内容无关，整体删除 + 插入: {} / {}", units1.size(), units2.size());
            return unrelated;
        }

        List<CorrelatedSequence> csl = new ArrayList<>();
        csl.add(CorrelatedSequence.unknown(units1, units2));
        int iterations = 0;
        int scanFrom = 0;

        while (true) {
            int idx = -1;
            for (int i = scanFrom; i < csl.size(); i++) {
                if (csl.get(i).getStatus() == CorrelationStatus.UNKNOWN) {
                    idx = i;
                    break;
                }
            }
            if (idx < 0) {
                break;
            }
            // 之前的片段都已是终态
            scanFrom = idx;
            iterations++;

            CorrelatedSequence unknown = csl.remove(idx);
            List<CorrelatedSequence> replacement = resolve(unknown);
            csl.addAll(idx, replacement);
        }

        log.debug("相关性求解完成: iterations={}, sequences={}", iterations, csl.size());
        return csl;
    }

    private List<CorrelatedSequence> resolve(CorrelatedSequence unknown) {
        List<ComparisonUnit> units1 = unknown.getUnits1() == null
                ? Collections.<ComparisonUnit>emptyList() : unknown.getUnits1();
        List<ComparisonUnit> units2 = unknown.getUnits2() == null
                ? Collections.<ComparisonUnit>emptyList() : unknown.getUnits2();

        List<CorrelatedSequence> result = new ArrayList<>();
        if (units1.isEmpty() || units2.isEmpty()) {
            addRemainder(result, units1, units2);
            return result;
        }

        setAfterUnids(units1, units2);

        result = processCorrelatedHashes(units1, units2);
        if (result == null) {
            result = findCommonAtBeginningAndEnd(units1, units2);
        }
        if (result == null) {
            result = doLcs(units1, units2);
        }
        return result;
    }

    /**
     * 两侧各为一个同类分组时，把新文档一侧从根到该分组的祖先 Unid 改为旧文档的，
     * 使重建时两侧内容落在同一个容器元素中
     */
    private static void setAfterUnids(List<ComparisonUnit> units1, List<ComparisonUnit> units2) {
        if (units1.size() != 1 || units2.size() != 1 || !units1.get(0).isGroup() || !units2.get(0).isGroup()) {
            return;
        }
        Group g1 = (Group) units1.get(0);
        Group g2 = (Group) units2.get(0);
        Atom first1 = g1.firstAtom();
        if (g1.getKind() != g2.getKind() || first1 == null) {
            return;
        }
        String through = "w:" + g1.getKind().getLocalName();
        List<AncestorInfo> chain1 = new ArrayList<>();
        for (AncestorInfo a : first1.getAncestors()) {
            chain1.add(a);
            if (a.getName().equals(through)) {
                break;
            }
        }
        for (Atom atom : g2.getAtoms()) {
            List<AncestorInfo> chain2 = atom.getAncestors();
            for (int i = 0; i < chain1.size() && i < chain2.size(); i++) {
                if (!chain2.get(i).getName().equals(chain1.get(i).getName())) {
                    break;
                }
                chain2.get(i).setUnid(chain1.get(i).getUnid());
            }
        }
    }

    // ==================== 无关内容检测 ====================

    private static List<CorrelatedSequence> detectUnrelatedSources(List<ComparisonUnit> units1,
                                                                   List<ComparisonUnit> units2) {
        List<String> hashes1 = firstGroupHashes(units1, 4);
        List<String> hashes2 = firstGroupHashes(units2, 4);
        if (hashes1.size() <= 3 || hashes2.size() <= 3) {
            return null;
        }
        for (String h : hashes1) {
            if (hashes2.contains(h)) {
                return null;
            }
        }
        List<CorrelatedSequence> result = new ArrayList<>();
        result.add(CorrelatedSequence.deleted(units1));
        result.add(CorrelatedSequence.inserted(units2));
        return result;
    }

    private static List<String> firstGroupHashes(List<ComparisonUnit> units, int limit) {
        List<String> hashes = new ArrayList<>();
        for (ComparisonUnit u : units) {
            if (u.isGroup()) {
                hashes.add(u.getHash());
                if (hashes.size() == limit) {
                    break;
                }
            }
        }
        return hashes;
    }

    // ==================== 匹配器一：块哈希 ====================

    private List<CorrelatedSequence> processCorrelatedHashes(List<ComparisonUnit> units1,
                                                             List<ComparisonUnit> units2) {
        if (Math.min(units1.size(), units2.size()) < 3) {
            return null;
        }
        if (!isBlockGroup(units1.get(0)) || !isBlockGroup(units2.get(0))) {
            return null;
        }

        int bestLength = 0;
        int bestAtomCount = 0;
        int best1 = 0;
        int best2 = 0;
        for (int i1 = 0; i1 < units1.size(); i1++) {
            for (int i2 = 0; i2 < units2.size(); i2++) {
                int length = 0;
                int atomCount = 0;
                while (i1 + length < units1.size() && i2 + length < units2.size()
                        && sameCorrelatedHash(units1.get(i1 + length), units2.get(i2 + length))) {
                    atomCount += units1.get(i1 + length).atomCount();
                    length++;
                }
                if (atomCount > bestAtomCount) {
                    bestLength = length;
                    bestAtomCount = atomCount;
                    best1 = i1;
                    best2 = i2;
                }
            }
        }

        boolean accept;
        if (bestLength == 1) {
            accept = units1.get(best1).atomCount() > 16 && units2.get(best2).atomCount() > 16;
        } else if (bestLength > 1 && bestLength <= 3) {
            accept = atomCount(units1, best1, bestLength) > 32 && atomCount(units2, best2, bestLength) > 32;
        } else {
            accept = bestLength > 3;
        }
        if (!accept) {
            return null;
        }

        List<CorrelatedSequence> result = new ArrayList<>();
        addRemainder(result, units1.subList(0, best1), units2.subList(0, best2));
        for (int i = 0; i < bestLength; i++) {
            result.add(CorrelatedSequence.unknown(
                    Collections.singletonList(units1.get(best1 + i)),
                    Collections.singletonList(units2.get(best2 + i))));
        }
        addRemainder(result, units1.subList(best1 + bestLength, units1.size()),
                units2.subList(best2 + bestLength, units2.size()));
        return result;
    }

    private static boolean isBlockGroup(ComparisonUnit unit) {
        if (!unit.isGroup()) {
            return false;
        }
        GroupKind kind = ((Group) unit).getKind();
        return kind == GroupKind.PARAGRAPH || kind == GroupKind.TABLE || kind == GroupKind.ROW;
    }

    private static boolean sameCorrelatedHash(ComparisonUnit u1, ComparisonUnit u2) {
        if (!u1.isGroup() || !u2.isGroup()) {
            return false;
        }
        Group g1 = (Group) u1;
        Group g2 = (Group) u2;
        return g1.getKind() == g2.getKind() && g1.getCorrelatedHash() != null
                && g1.getCorrelatedHash().equals(g2.getCorrelatedHash());
    }

    private static int atomCount(List<ComparisonUnit> units, int from, int length) {
        int count = 0;
        for (int i = from; i < from + length; i++) {
            count += units.get(i).atomCount();
        }
        return count;
    }

    // ==================== 匹配器二：公共前缀 / 后缀 ====================

    private List<CorrelatedSequence> findCommonAtBeginningAndEnd(List<ComparisonUnit> units1,
                                                                 List<ComparisonUnit> units2) {
        int lengthToCompare = Math.min(units1.size(), units2.size());

        int prefix = SequenceAligner.commonPrefix(units1, units2);
        if (prefix > 0 && (double) prefix / lengthToCompare < settings.getDetailThreshold()) {
            prefix = 0;
        }
        if (prefix > 0) {
            List<CorrelatedSequence> result = new ArrayList<>();
            result.add(CorrelatedSequence.equal(units1.subList(0, prefix), units2.subList(0, prefix)));
            addRemainder(result, units1.subList(prefix, units1.size()), units2.subList(prefix, units2.size()));
            return result;
        }

        int suffix = SequenceAligner.commonSuffix(units1, units2, 0);

        // 公共段不以段落标记开头（除非只剩它）
        while (suffix > 1 && isParagraphMarkWord(units1.get(units1.size() - suffix))) {
            suffix--;
        }

        boolean onlyParagraphMark = false;
        if (suffix == 1) {
            onlyParagraphMark = isParagraphMarkWord(units1.get(units1.size() - 1));
        } else if (suffix == 2) {
            ComparisonUnit first = units1.get(units1.size() - 2);
            ComparisonUnit second = units1.get(units1.size() - 1);
            onlyParagraphMark = first.isWord() && second.isWord() && first.atomCount() == 1
                    && isParagraphMarkWord(second);
        }
        if (!onlyParagraphMark && suffix > 0
                && (double) suffix / lengthToCompare < settings.getDetailThreshold()) {
            suffix = 0;
        }
        if (onlyParagraphMark) {
            suffix = 0;
        }
        if (suffix == 0) {
            return null;
        }

        int commonStart1 = units1.size() - suffix;
        int commonStart2 = units2.size() - suffix;
        int remainingLeft = 0;
        int remainingRight = 0;

        // 公共尾部包含段落标记时，同一段落内剩余的词单独成一个 UNKNOWN
        if (units1.get(commonStart1).isWord() && containsParagraphMark(units1.subList(commonStart1, units1.size()))) {
            remainingLeft = countTrailingInParagraph(units1, commonStart1);
            remainingRight = countTrailingInParagraph(units2, commonStart2);
        }

        int beforeLeft = commonStart1 - remainingLeft;
        int beforeRight = commonStart2 - remainingRight;

        List<CorrelatedSequence> result = new ArrayList<>();
        addRemainder(result, units1.subList(0, beforeLeft), units2.subList(0, beforeRight));
        addRemainder(result, units1.subList(beforeLeft, commonStart1), units2.subList(beforeRight, commonStart2));
        result.add(CorrelatedSequence.equal(units1.subList(commonStart1, units1.size()),
                units2.subList(commonStart2, units2.size())));
        return result;
    }

    private static boolean isParagraphMarkWord(ComparisonUnit unit) {
        return unit.isWord() && ((Word) unit).isParagraphMark();
    }

    private static boolean startsWithParagraphMark(ComparisonUnit unit) {
        if (!unit.isWord()) {
            return false;
        }
        Atom first = unit.firstAtom();
        return first != null && first.isParagraphMark();
    }

    private static boolean containsParagraphMark(List<ComparisonUnit> units) {
        for (ComparisonUnit u : units) {
            if (startsWithParagraphMark(u)) {
                return true;
            }
        }
        return false;
    }

    /**
     * end 之前属于同一段落的词的数量（遇到段落标记或分组停止）
     */
    private static int countTrailingInParagraph(List<ComparisonUnit> units, int end) {
        int count = 0;
        for (int i = end - 1; i >= 0; i--) {
            ComparisonUnit u = units.get(i);
            if (!u.isWord() || startsWithParagraphMark(u)) {
                break;
            }
            count++;
        }
        return count;
    }

    // ==================== 匹配器三：最长公共连续子串 ====================

    private List<CorrelatedSequence> doLcs(List<ComparisonUnit> units1, List<ComparisonUnit> units2) {
        MatchResult match = SequenceAligner.findLongestMatch(units1, units2, LcsSettings.defaults());
        int length = match == null ? 0 : match.getLength();
        int start1 = match == null ? -1 : match.getStart1();
        int start2 = match == null ? -1 : match.getStart2();

        while (length > 1 && isParagraphMarkWord(units1.get(start1))) {
            length--;
            start1++;
            start2++;
        }

        boolean onlyParagraphMark = length == 1 && isParagraphMarkWord(units1.get(start1));

        // 单个空格不作为锚点
        if (length == 1 && units2.get(start2).isWord() && " ".equals(((Word) units2.get(start2)).text())) {
            length = 0;
        }

        // 只有分词符的短匹配不作为锚点
        if (length > 0 && length <= 3 && allWords(units1.subList(start1, start1 + length))
                && !hasContentOtherThanSeparators(units1.subList(start1, start1 + length))) {
            length = 0;
        }

        if (!onlyParagraphMark && length > 0 && allWords(units1) && allWords(units2)) {
            double ratio = (double) length / Math.max(units1.size(), units2.size());
            if (ratio < settings.getDetailThreshold()) {
                length = 0;
            }
        }

        if (length == 0) {
            return handleNoMatch(units1, units2);
        }

        List<CorrelatedSequence> result = new ArrayList<>();
        addRemainder(result, units1.subList(0, start1), units2.subList(0, start2));
        result.add(CorrelatedSequence.equal(units1.subList(start1, start1 + length),
                units2.subList(start2, start2 + length)));
        addRemainder(result, units1.subList(start1 + length, units1.size()),
                units2.subList(start2 + length, units2.size()));
        return result;
    }

    private static boolean allWords(List<ComparisonUnit> units) {
        for (ComparisonUnit u : units) {
            if (!u.isWord()) {
                return false;
            }
        }
        return true;
    }

    private boolean hasContentOtherThanSeparators(List<ComparisonUnit> words) {
        for (ComparisonUnit u : words) {
            for (Atom atom : u.getAtoms()) {
                if (!atom.isText()) {
                    return true;
                }
                int ch = atom.getChar();
                if (!UnitGrouper.isCjk(ch) && !settings.isWordSeparator(ch)) {
                    return true;
                }
            }
        }
        return false;
    }

    // ==================== 无匹配时的特殊情况 ====================

    private List<CorrelatedSequence> handleNoMatch(List<ComparisonUnit> units1, List<ComparisonUnit> units2) {
        List<CorrelatedSequence> split = splitSingleWords(units1, units2);
        if (split != null) {
            return split;
        }

        UnitCounts c1 = UnitCounts.of(units1);
        UnitCounts c2 = UnitCounts.of(units2);

        if ((c1.words > 0 || c2.words > 0)
                && (c1.rows > 0 || c2.rows > 0 || c1.textboxes > 0 || c2.textboxes > 0)
                && c1.onlyWordsRowsTextboxes() && c2.onlyWordsRowsTextboxes()) {
            return pairRuns(runsByType(units1), runsByType(units2), false);
        }

        if (c1.tables > 0 && c2.tables > 0 && c1.paragraphs > 0 && c2.paragraphs > 0
                && (units1.size() > 1 || units2.size() > 1)) {
            return pairRuns(runsByTableOrParagraph(units1), runsByTableOrParagraph(units2), true);
        }

        if (c1.tables == 1 && units1.size() == 1 && c2.tables == 1 && units2.size() == 1) {
            List<CorrelatedSequence> tables = doLcsForTable((Group) units1.get(0), (Group) units2.get(0));
            if (tables != null) {
                return tables;
            }
        }

        if (c1.onlyParagraphsTablesTextboxes() && c2.onlyParagraphsTablesTextboxes()) {
            List<CorrelatedSequence> result = new ArrayList<>();
            result.add(CorrelatedSequence.unknown(flattenOneLevel(units1), flattenOneLevel(units2)));
            return result;
        }

        GroupKind first1 = kindOf(units1.get(0));
        GroupKind first2 = kindOf(units2.get(0));

        if (first1 == GroupKind.ROW && first2 == GroupKind.ROW) {
            return matchRows(units1, units2);
        }

        if (first1 == GroupKind.CELL && first2 == GroupKind.CELL) {
            List<CorrelatedSequence> result = new ArrayList<>();
            result.add(CorrelatedSequence.unknown(((Group) units1.get(0)).getChildren(),
                    ((Group) units2.get(0)).getChildren()));
            addRemainder(result, units1.subList(1, units1.size()), units2.subList(1, units2.size()));
            return result;
        }

        List<CorrelatedSequence> result = new ArrayList<>();
        if (units1.get(0).isWord() && first2 == GroupKind.ROW) {
            result.add(CorrelatedSequence.inserted(units2));
            result.add(CorrelatedSequence.deleted(units1));
            return result;
        }
        if (first1 == GroupKind.ROW && units2.get(0).isWord()) {
            result.add(CorrelatedSequence.deleted(units1));
            result.add(CorrelatedSequence.inserted(units2));
            return result;
        }

        // 以段落标记结尾的一侧排在后面
        Atom last1 = lastAtom(units1);
        Atom last2 = lastAtom(units2);
        if (last1 != null && last2 != null && last1.isParagraphMark() && !last2.isParagraphMark()) {
            result.add(CorrelatedSequence.inserted(units2));
            result.add(CorrelatedSequence.deleted(units1));
            return result;
        }
        result.add(CorrelatedSequence.deleted(units1));
        result.add(CorrelatedSequence.inserted(units2));
        return result;
    }

    /**
     * 两侧各剩一个词，且一个词是另一个去掉一段连续字符的结果时，按原子拆分
     * （Test → st 只删除 Te）
     */
    private static List<CorrelatedSequence> splitSingleWords(List<ComparisonUnit> units1,
                                                             List<ComparisonUnit> units2) {
        if (units1.size() != 1 || units2.size() != 1 || !units1.get(0).isWord() || !units2.get(0).isWord()) {
            return null;
        }
        List<ComparisonUnit> atoms1 = singleAtomWords(units1.get(0));
        List<ComparisonUnit> atoms2 = singleAtomWords(units2.get(0));
        int shorter = Math.min(atoms1.size(), atoms2.size());
        int prefix = SequenceAligner.commonPrefix(atoms1, atoms2);
        int suffix = SequenceAligner.commonSuffix(atoms1, atoms2, prefix);
        if (shorter == 0 || prefix + suffix != shorter) {
            return null;
        }

        List<CorrelatedSequence> result = new ArrayList<>();
        if (prefix > 0) {
            result.add(CorrelatedSequence.equal(atoms1.subList(0, prefix), atoms2.subList(0, prefix)));
        }
        List<ComparisonUnit> middle1 = atoms1.subList(prefix, atoms1.size() - suffix);
        List<ComparisonUnit> middle2 = atoms2.subList(prefix, atoms2.size() - suffix);
        if (!middle1.isEmpty()) {
            result.add(CorrelatedSequence.deleted(middle1));
        }
        if (!middle2.isEmpty()) {
            result.add(CorrelatedSequence.inserted(middle2));
        }
        if (suffix > 0) {
            result.add(CorrelatedSequence.equal(atoms1.subList(atoms1.size() - suffix, atoms1.size()),
                    atoms2.subList(atoms2.size() - suffix, atoms2.size())));
        }
        return result;
    }

    private static List<ComparisonUnit> singleAtomWords(ComparisonUnit word) {
        List<ComparisonUnit> result = new ArrayList<>();
        for (Atom a : word.getAtoms()) {
            result.add(new Word(Collections.singletonList(a)));
        }
        return result;
    }

    // —— 分段配对 —— //

    private static class Run {
        final String key;
        final List<ComparisonUnit> units = new ArrayList<>();

        Run(String key) {
            this.key = key;
        }
    }

    private static List<Run> runsByType(List<ComparisonUnit> units) {
        List<Run> runs = new ArrayList<>();
        for (ComparisonUnit u : units) {
            String key;
            if (u.isWord()) {
                key = "Word";
            } else if (kindOf(u) == GroupKind.ROW) {
                key = "Row";
            } else if (kindOf(u) == GroupKind.TEXTBOX) {
                key = "Textbox";
            } else {
                key = "Other";
            }
            appendToRuns(runs, key, u);
        }
        return runs;
    }

    private static List<Run> runsByTableOrParagraph(List<ComparisonUnit> units) {
        List<Run> runs = new ArrayList<>();
        for (ComparisonUnit u : units) {
            appendToRuns(runs, kindOf(u) == GroupKind.TABLE ? "Table" : "Para", u);
        }
        return runs;
    }

    private static void appendToRuns(List<Run> runs, String key, ComparisonUnit unit) {
        Run last = runs.isEmpty() ? null : runs.get(runs.size() - 1);
        if (last == null || !last.key.equals(key)) {
            last = new Run(key);
            runs.add(last);
        }
        last.units.add(unit);
    }

    /**
     * 相同类型的段配对为 UNKNOWN，其余按删除 / 插入处理
     *
     * @param tableMode true 时按表格 / 段落规则配对，否则按词 / 行 / 文本框规则
     */
    private static List<CorrelatedSequence> pairRuns(List<Run> runs1, List<Run> runs2, boolean tableMode) {
        List<CorrelatedSequence> result = new ArrayList<>();
        int i1 = 0;
        int i2 = 0;
        while (i1 < runs1.size() && i2 < runs2.size()) {
            Run r1 = runs1.get(i1);
            Run r2 = runs2.get(i2);
            if (r1.key.equals(r2.key)) {
                result.add(CorrelatedSequence.unknown(r1.units, r2.units));
                i1++;
                i2++;
            } else if (tableMode) {
                if (r1.key.equals("Para")) {
                    result.add(CorrelatedSequence.deleted(r1.units));
                    i1++;
                } else {
                    result.add(CorrelatedSequence.inserted(r2.units));
                    i2++;
                }
            } else if (r1.key.equals("Word")) {
                result.add(CorrelatedSequence.deleted(r1.units));
                i1++;
            } else if (r2.key.equals("Word")) {
                result.add(CorrelatedSequence.inserted(r2.units));
                i2++;
            } else {
                result.add(CorrelatedSequence.deleted(r1.units));
                i1++;
            }
        }
        for (; i1 < runs1.size(); i1++) {
            result.add(CorrelatedSequence.deleted(runs1.get(i1).units));
        }
        for (; i2 < runs2.size(); i2++) {
            result.add(CorrelatedSequence.inserted(runs2.get(i2).units));
        }
        return result;
    }

    // —— 表格 —— //

    private static List<CorrelatedSequence> doLcsForTable(Group table1, Group table2) {
        List<ComparisonUnit> rows1 = table1.getChildren();
        List<ComparisonUnit> rows2 = table2.getChildren();

        if (rows1.size() == rows2.size()) {
            boolean allRowsMatch = true;
            for (int i = 0; i < rows1.size(); i++) {
                if (!sameCorrelatedHash(rows1.get(i), rows2.get(i))) {
                    allRowsMatch = false;
                    break;
                }
            }
            if (allRowsMatch) {
                return pairwise(rows1, rows2);
            }
        }

        if (table1.hasMergedCells() || table2.hasMergedCells()) {
            if (table1.getStructureHash() != null && table1.getStructureHash().equals(table2.getStructureHash())) {
                return pairwise(rows1, rows2);
            }
            List<CorrelatedSequence> result = new ArrayList<>();
            result.add(CorrelatedSequence.deleted(rows1));
            result.add(CorrelatedSequence.inserted(rows2));
            return result;
        }
        return null;
    }

    private static List<CorrelatedSequence> pairwise(List<ComparisonUnit> units1, List<ComparisonUnit> units2) {
        List<CorrelatedSequence> result = new ArrayList<>();
        int n = Math.min(units1.size(), units2.size());
        for (int i = 0; i < n; i++) {
            result.add(CorrelatedSequence.unknown(Collections.singletonList(units1.get(i)),
                    Collections.singletonList(units2.get(i))));
        }
        addRemainder(result, units1.subList(n, units1.size()), units2.subList(n, units2.size()));
        return result;
    }

    /**
     * 首行按单元格下标配对，其余行作为剩余部分
     */
    private static List<CorrelatedSequence> matchRows(List<ComparisonUnit> units1, List<ComparisonUnit> units2) {
        List<ComparisonUnit> cells1 = ((Group) units1.get(0)).getChildren();
        List<ComparisonUnit> cells2 = ((Group) units2.get(0)).getChildren();
        List<CorrelatedSequence> result = new ArrayList<>();
        int max = Math.max(cells1.size(), cells2.size());
        for (int i = 0; i < max; i++) {
            if (i < cells1.size() && i < cells2.size()) {
                result.add(CorrelatedSequence.unknown(Collections.singletonList(cells1.get(i)),
                        Collections.singletonList(cells2.get(i))));
            } else if (i < cells1.size()) {
                result.add(CorrelatedSequence.deleted(Collections.singletonList(cells1.get(i))));
            } else {
                result.add(CorrelatedSequence.inserted(Collections.singletonList(cells2.get(i))));
            }
        }
        addRemainder(result, units1.subList(1, units1.size()), units2.subList(1, units2.size()));
        return result;
    }

    private static List<ComparisonUnit> flattenOneLevel(List<ComparisonUnit> units) {
        List<ComparisonUnit> result = new ArrayList<>();
        for (ComparisonUnit u : units) {
            if (u.isGroup()) {
                result.addAll(((Group) u).getChildren());
            } else {
                result.add(u);
            }
        }
        return result;
    }

    // —— 工具 —— //

    private static GroupKind kindOf(ComparisonUnit unit) {
        return unit.isGroup() ? ((Group) unit).getKind() : null;
    }

    private static Atom lastAtom(List<ComparisonUnit> units) {
        for (int i = units.size() - 1; i >= 0; i--) {
            Atom a = units.get(i).lastAtom();
            if (a != null) {
                return a;
            }
        }
        return null;
    }

    /**
     * 按两侧是否为空追加 DELETED / INSERTED / UNKNOWN
     */
    private static void addRemainder(List<CorrelatedSequence> result, List<ComparisonUnit> left,
                                     List<ComparisonUnit> right) {
        if (!left.isEmpty() && right.isEmpty()) {
            result.add(CorrelatedSequence.deleted(left));
        } else if (left.isEmpty() && !right.isEmpty()) {
            result.add(CorrelatedSequence.inserted(right));
        } else if (!left.isEmpty()) {
            result.add(CorrelatedSequence.unknown(left, right));
        }
    }

    private static class UnitCounts {
        int tables;
        int rows;
        int cells;
        int paragraphs;
        int textboxes;
        int words;
        int total;

        static UnitCounts of(List<ComparisonUnit> units) {
            UnitCounts c = new UnitCounts();
            c.total = units.size();
            for (ComparisonUnit u : units) {
                GroupKind kind = kindOf(u);
                if (kind == null) {
                    c.words++;
                    continue;
                }
                switch (kind) {
                    case TABLE:
                        c.tables++;
                        break;
                    case ROW:
                        c.rows++;
                        break;
                    case CELL:
                        c.cells++;
                        break;
                    case PARAGRAPH:
                        c.paragraphs++;
                        break;
                    default:
                        c.textboxes++;
                }
            }
            return c;
        }

        boolean onlyWordsRowsTextboxes() {
            return total == words + rows + textboxes;
        }

        boolean onlyParagraphsTablesTextboxes() {
            return total == tables + paragraphs + textboxes;
        }
    }

    // ==================== 展开为原子 ====================

    /**
     * 把对齐片段展开为带状态的原子列表
     *
     * EQUAL 原子取新文档一侧的副本，并记录旧文档对应原子（before）；
     * DELETED 取旧侧原子；INSERTED 取新侧原子。
     */
    public static List<Atom> flattenToAtoms(List<CorrelatedSequence> sequences) {
        List<Atom> result = new ArrayList<>();
        for (CorrelatedSequence seq : sequences) {
            switch (seq.getStatus()) {
                case EQUAL: {
                    List<ComparisonUnit> units1 = seq.getUnits1();
                    List<ComparisonUnit> units2 = seq.getUnits2();
                    for (int i = 0; i < Math.min(units1.size(), units2.size()); i++) {
                        List<Atom> atoms1 = units1.get(i).getAtoms();
                        List<Atom> atoms2 = units2.get(i).getAtoms();
                        for (int j = 0; j < Math.min(atoms1.size(), atoms2.size()); j++) {
                            Atom copy = atoms2.get(j).copy();
                            copy.setStatus(CorrelationStatus.EQUAL);
                            copy.setBefore(atoms1.get(j));
                            result.add(copy);
                        }
                    }
                    break;
                }
                case DELETED:
                    addAll(result, seq.getUnits1(), CorrelationStatus.DELETED);
                    break;
                case INSERTED:
                    addAll(result, seq.getUnits2(), CorrelationStatus.INSERTED);
                    break;
                default:
                    addAll(result, seq.getUnits1(), CorrelationStatus.DELETED);
                    addAll(result, seq.getUnits2(), CorrelationStatus.INSERTED);
            }
        }
        return result;
    }

    private static void addAll(List<Atom> result, List<ComparisonUnit> units, CorrelationStatus status) {
        if (units == null) {
            return;
        }
        for (ComparisonUnit u : units) {
            for (Atom a : u.getAtoms()) {
                Atom copy = a.copy();
                copy.setStatus(status);
                result.add(copy);
            }
        }
    }

    /**
     * 统计各状态的原子数（调试日志用）
     */
    public static String summarize(List<Atom> atoms) {
        int equal = 0;
        int inserted = 0;
        int deleted = 0;
        for (Atom a : atoms) {
            if (a.getStatus() == CorrelationStatus.EQUAL) {
                equal++;
            } else if (a.getStatus() == CorrelationStatus.INSERTED) {
                inserted++;
            } else if (a.getStatus() == CorrelationStatus.DELETED) {
                deleted++;
            }
        }
        return "equal=" + equal + ", inserted=" + inserted + ", deleted=" + deleted;
    }
}
