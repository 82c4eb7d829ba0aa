package com.example.redline.util.sml;

import com.example.redline.util.lcs.SequenceAligner;
import com.example.redline.util.sml.dto.SmlChange;
import com.example.redline.util.sml.dto.SmlChangeType;
import com.example.redline.util.sml.dto.SmlComparisonResult;
import com.example.redline.util.sml.signature.CellSignature;
import com.example.redline.util.sml.signature.CommentSignature;
import com.example.redline.util.sml.signature.DataValidationSignature;
import com.example.redline.util.sml.signature.DefinedNameSignature;
import com.example.redline.util.sml.signature.HyperlinkSignature;
import com.example.redline.util.sml.signature.WorkbookSignature;
import com.example.redline.util.sml.signature.WorksheetSignature;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.util.CellReference;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * 工作簿签名差异计算
 *
 * 工作表先按名字配对，剩余的按内容哈希、再按相似度识别重命名；
 * 配对成功的工作表逐单元格比较，开启行 / 列对齐时先用 LCS 对齐行列签名。
 */
@Slf4j
public class SmlDiffEngine {

    private final SmlComparerSettings settings;

    public SmlDiffEngine(SmlComparerSettings settings) {
        this.settings = settings;
    }

    public SmlComparisonResult diff(WorkbookSignature older, WorkbookSignature newer) {
        SmlComparisonResult result = new SmlComparisonResult();
        List<SheetMatch> matches = matchSheets(older, newer);

        if (settings.isCompareSheetStructure()) {
            for (SheetMatch m : matches) {
                if (m.type == MatchType.ADDED) {
                    result.addChange(new SmlChange(SmlChangeType.SheetAdded, m.newName));
                } else if (m.type == MatchType.DELETED) {
                    result.addChange(new SmlChange(SmlChangeType.SheetDeleted, m.oldName));
                } else if (m.type == MatchType.RENAMED) {
                    SmlChange c = new SmlChange(SmlChangeType.SheetRenamed, m.newName);
                    c.setOldSheetName(m.oldName);
                    result.addChange(c);
                    log.debug("工作表改名: {} -> {}, 相似度={}", m.oldName, m.newName, m.similarity);
                }
            }
        }

        for (SheetMatch m : matches) {
            if (m.type != MatchType.MATCHED && m.type != MatchType.RENAMED) {
                continue;
            }
            WorksheetSignature ws1 = older.getSheets().get(m.oldName);
            WorksheetSignature ws2 = newer.getSheets().get(m.newName);
            compareWorksheets(ws1, ws2, m.newName, result);
            if (settings.isCompareComments()) {
                compareComments(ws1, ws2, m.newName, result);
            }
            if (settings.isCompareDataValidation()) {
                compareDataValidations(ws1, ws2, m.newName, result);
            }
            if (settings.isCompareMergedCells()) {
                compareMergedCells(ws1, ws2, m.newName, result);
            }
            if (settings.isCompareHyperlinks()) {
                compareHyperlinks(ws1, ws2, m.newName, result);
            }
        }

        if (settings.isCompareNamedRanges()) {
            compareNamedRanges(older, newer, result);
        }
        log.debug("工作簿差异计算完成: {} 个工作表配对, {} 条变更", matches.size(), result.getTotalChanges());
        return result;
    }

    // ==================== 工作表配对 ====================

    enum MatchType {
        MATCHED, ADDED, DELETED, RENAMED
    }

    static class SheetMatch {
        final MatchType type;
        final String oldName;
        final String newName;
        final double similarity;

        SheetMatch(MatchType type, String oldName, String newName, double similarity) {
            this.type = type;
            this.oldName = oldName;
            this.newName = newName;
            this.similarity = similarity;
        }
    }

    /**
     * 配对结果按新工作簿顺序排列，删除的工作表排在最后
     */
    List<SheetMatch> matchSheets(WorkbookSignature older, WorkbookSignature newer) {
        List<String> unmatched1 = new ArrayList<>();
        List<String> unmatched2 = new ArrayList<>();
        for (String name : older.getSheets().keySet()) {
            if (!newer.getSheets().containsKey(name)) {
                unmatched1.add(name);
            }
        }
        for (String name : newer.getSheets().keySet()) {
            if (!older.getSheets().containsKey(name)) {
                unmatched2.add(name);
            }
        }

        Map<String, SheetMatch> renames = new HashMap<>();
        if (settings.isEnableSheetRenameDetection() && !unmatched1.isEmpty() && !unmatched2.isEmpty()) {
            for (SheetMatch r : detectRenames(older, newer, unmatched1, unmatched2)) {
                renames.put(r.newName, r);
                unmatched1.remove(r.oldName);
            }
        }

        List<SheetMatch> result = new ArrayList<>();
        for (String name : newer.getSheets().keySet()) {
            if (older.getSheets().containsKey(name)) {
                result.add(new SheetMatch(MatchType.MATCHED, name, name, 1.0));
            } else if (renames.containsKey(name)) {
                result.add(renames.get(name));
            } else {
                result.add(new SheetMatch(MatchType.ADDED, null, name, 0.0));
            }
        }
        for (String name : unmatched1) {
            result.add(new SheetMatch(MatchType.DELETED, name, null, 0.0));
        }
        return result;
    }

    private List<SheetMatch> detectRenames(WorkbookSignature older, WorkbookSignature newer,
                                           List<String> unmatched1, List<String> unmatched2) {
        List<SheetMatch> renames = new ArrayList<>();
        Set<String> used1 = new HashSet<>();
        Set<String> used2 = new HashSet<>();

        Map<String, String> hashes2 = new HashMap<>();
        for (String name : unmatched2) {
            hashes2.put(name, newer.getSheets().get(name).computeContentHash());
        }

        // 内容完全相同
        for (String name1 : unmatched1) {
            String hash1 = older.getSheets().get(name1).computeContentHash();
            for (String name2 : unmatched2) {
                if (!used2.contains(name2) && hashes2.get(name2).equals(hash1)) {
                    renames.add(new SheetMatch(MatchType.RENAMED, name1, name2, 1.0));
                    used1.add(name1);
                    used2.add(name2);
                    break;
                }
            }
        }

        // 相似度达到阈值
        for (String name1 : unmatched1) {
            if (used1.contains(name1)) {
                continue;
            }
            WorksheetSignature ws1 = older.getSheets().get(name1);
            double best = 0.0;
            String bestName = null;
            for (String name2 : unmatched2) {
                if (used2.contains(name2)) {
                    continue;
                }
                double similarity = similarity(ws1, newer.getSheets().get(name2));
                if (similarity > best && similarity >= settings.getSheetRenameSimilarityThreshold()) {
                    best = similarity;
                    bestName = name2;
                }
            }
            if (bestName != null) {
                renames.add(new SheetMatch(MatchType.RENAMED, name1, bestName, best));
                used1.add(name1);
                used2.add(bestName);
            }
        }
        return renames;
    }

    /**
     * 相同地址上值相等的单元格数 / 地址并集大小
     */
    static double similarity(WorksheetSignature ws1, WorksheetSignature ws2) {
        if (ws1.getCells().isEmpty() && ws2.getCells().isEmpty()) {
            return 1.0;
        }
        if (ws1.getCells().isEmpty() || ws2.getCells().isEmpty()) {
            return 0.0;
        }
        Set<String> all = new HashSet<>(ws1.getCells().keySet());
        all.addAll(ws2.getCells().keySet());
        int matching = 0;
        for (String addr : all) {
            CellSignature c1 = ws1.getCells().get(addr);
            CellSignature c2 = ws2.getCells().get(addr);
            if (c1 != null && c2 != null && Objects.equals(c1.getResolvedValue(), c2.getResolvedValue())) {
                matching++;
            }
        }
        return (double) matching / all.size();
    }

    // ==================== 单元格 ====================

    /**
     * 行（列）对齐：旧序号 → 新序号，以及只在一侧出现的序号
     */
    static class Alignment {
        final Map<Integer, Integer> mapping = new HashMap<>();
        final Set<Integer> deleted = new TreeSet<>();
        final Set<Integer> inserted = new TreeSet<>();
        /** 未对齐时按原序号一一对应 */
        final boolean identity;

        Alignment(boolean identity) {
            this.identity = identity;
        }

        Integer map(int index) {
            return identity ? Integer.valueOf(index) : mapping.get(index);
        }
    }

    static Alignment align(TreeSet<Integer> indices1, Map<Integer, String> sigs1,
                           TreeSet<Integer> indices2, Map<Integer, String> sigs2) {
        List<Integer> list1 = new ArrayList<>(indices1);
        List<Integer> list2 = new ArrayList<>(indices2);
        List<String> seq1 = new ArrayList<>();
        List<String> seq2 = new ArrayList<>();
        for (Integer i : list1) {
            seq1.add(sigs1.getOrDefault(i, ""));
        }
        for (Integer j : list2) {
            seq2.add(sigs2.getOrDefault(j, ""));
        }
        Alignment alignment = new Alignment(false);
        for (int[] pair : SequenceAligner.align(seq1, seq2)) {
            if (pair[0] >= 0 && pair[1] >= 0) {
                alignment.mapping.put(list1.get(pair[0]), list2.get(pair[1]));
            } else if (pair[0] >= 0) {
                alignment.deleted.add(list1.get(pair[0]));
            } else {
                alignment.inserted.add(list2.get(pair[1]));
            }
        }
        return alignment;
    }

    private void compareWorksheets(WorksheetSignature ws1, WorksheetSignature ws2, String sheetName,
                                   SmlComparisonResult result) {
        Alignment rows = settings.isEnableRowAlignment()
                ? align(ws1.getPopulatedRows(), ws1.getRowSignatures(), ws2.getPopulatedRows(), ws2.getRowSignatures())
                : new Alignment(true);
        Alignment cols = settings.isEnableColumnAlignment()
                ? align(ws1.getPopulatedColumns(), ws1.getColumnSignatures(),
                ws2.getPopulatedColumns(), ws2.getColumnSignatures())
                : new Alignment(true);

        for (Integer r : rows.deleted) {
            SmlChange c = new SmlChange(SmlChangeType.RowDeleted, sheetName);
            c.setRowIndex(r);
            result.addChange(c);
        }
        for (Integer r : rows.inserted) {
            SmlChange c = new SmlChange(SmlChangeType.RowInserted, sheetName);
            c.setRowIndex(r);
            result.addChange(c);
        }
        for (Integer col : cols.deleted) {
            SmlChange c = new SmlChange(SmlChangeType.ColumnDeleted, sheetName);
            c.setColumnIndex(col);
            result.addChange(c);
        }
        for (Integer col : cols.inserted) {
            SmlChange c = new SmlChange(SmlChangeType.ColumnInserted, sheetName);
            c.setColumnIndex(col);
            result.addChange(c);
        }

        Set<String> visited = new HashSet<>();
        // 按新表的行列顺序输出，便于变更列表合并相邻单元格
        List<SmlChange> cellChanges = new ArrayList<>();
        for (CellSignature c1 : ws1.getSortedCells()) {
            if (rows.deleted.contains(c1.getRow()) || cols.deleted.contains(c1.getColumn())) {
                continue;
            }
            Integer newRow = rows.map(c1.getRow());
            Integer newCol = cols.map(c1.getColumn());
            CellSignature c2 = newRow == null || newCol == null ? null
                    : ws2.getCells().get(address(newCol, newRow));
            if (c2 == null) {
                SmlChange c = new SmlChange(SmlChangeType.CellDeleted, sheetName);
                c.setCellAddress(c1.getAddress());
                c.setRowIndex(c1.getRow());
                c.setColumnIndex(c1.getColumn());
                c.setOldValue(c1.getResolvedValue());
                c.setOldFormula(c1.getFormula());
                c.setOldFormat(c1.getFormat());
                cellChanges.add(c);
                continue;
            }
            visited.add(c2.getAddress());
            SmlChange change = compareCells(c1, c2, sheetName);
            if (change != null) {
                cellChanges.add(change);
            }
        }
        for (CellSignature c2 : ws2.getSortedCells()) {
            if (visited.contains(c2.getAddress())
                    || rows.inserted.contains(c2.getRow()) || cols.inserted.contains(c2.getColumn())) {
                continue;
            }
            SmlChange c = new SmlChange(SmlChangeType.CellAdded, sheetName);
            c.setCellAddress(c2.getAddress());
            c.setRowIndex(c2.getRow());
            c.setColumnIndex(c2.getColumn());
            c.setNewValue(c2.getResolvedValue());
            c.setNewFormula(c2.getFormula());
            c.setNewFormat(c2.getFormat());
            cellChanges.add(c);
        }
        cellChanges.sort((a, b) -> {
            int byRow = Integer.compare(a.getRowIndex(), b.getRowIndex());
            return byRow != 0 ? byRow : Integer.compare(a.getColumnIndex(), b.getColumnIndex());
        });
        for (SmlChange c : cellChanges) {
            result.addChange(c);
        }
    }

    /**
     * 值变化优先于公式变化，公式变化优先于格式变化；无变化返回 null
     */
    SmlChange compareCells(CellSignature c1, CellSignature c2, String sheetName) {
        boolean formatEqual = c1.getFormat().equals(c2.getFormat());
        if (c1.getContentHash().equals(c2.getContentHash()) && (!settings.isCompareFormatting() || formatEqual)) {
            return null;
        }
        SmlChange change = null;
        if (settings.isCompareValues() && !valuesEqual(c1.getResolvedValue(), c2.getResolvedValue())) {
            change = new SmlChange(SmlChangeType.ValueChanged, sheetName);
        } else if (settings.isCompareFormulas()
                && !Objects.equals(nz(c1.getFormula()), nz(c2.getFormula()))) {
            change = new SmlChange(SmlChangeType.FormulaChanged, sheetName);
        } else if (settings.isCompareFormatting() && !formatEqual) {
            change = new SmlChange(SmlChangeType.FormatChanged, sheetName);
            change.setOldFormat(c1.getFormat());
            change.setNewFormat(c2.getFormat());
        }
        if (change == null) {
            return null;
        }
        change.setCellAddress(c2.getAddress());
        change.setRowIndex(c2.getRow());
        change.setColumnIndex(c2.getColumn());
        change.setOldValue(c1.getResolvedValue());
        change.setNewValue(c2.getResolvedValue());
        change.setOldFormula(c1.getFormula());
        change.setNewFormula(c2.getFormula());
        return change;
    }

    boolean valuesEqual(String v1, String v2) {
        String a = nz(v1);
        String b = nz(v2);
        if (settings.isCaseInsensitiveValues()) {
            return a.equalsIgnoreCase(b);
        }
        if (settings.getNumericTolerance() > 0) {
            try {
                return Math.abs(Double.parseDouble(a) - Double.parseDouble(b)) <= settings.getNumericTolerance();
            } catch (NumberFormatException e) {
                return a.equals(b);
            }
        }
        return a.equals(b);
    }

    // ==================== 批注、数据验证、合并单元格、超链接、名称 ====================

    private void compareComments(WorksheetSignature ws1, WorksheetSignature ws2, String sheetName,
                                 SmlComparisonResult result) {
        for (String addr : union(ws1.getComments().keySet(), ws2.getComments().keySet())) {
            CommentSignature c1 = ws1.getComments().get(addr);
            CommentSignature c2 = ws2.getComments().get(addr);
            SmlChange change;
            if (c1 == null) {
                change = cellChange(SmlChangeType.CommentAdded, sheetName, addr);
                change.setNewComment(c2.getText());
                change.setCommentAuthor(c2.getAuthor());
            } else if (c2 == null) {
                change = cellChange(SmlChangeType.CommentDeleted, sheetName, addr);
                change.setOldComment(c1.getText());
                change.setCommentAuthor(c1.getAuthor());
            } else if (!c1.getText().equals(c2.getText()) || !c1.getAuthor().equals(c2.getAuthor())) {
                change = cellChange(SmlChangeType.CommentChanged, sheetName, addr);
                change.setOldComment(c1.getText());
                change.setNewComment(c2.getText());
                change.setCommentAuthor(c2.getAuthor());
            } else {
                continue;
            }
            result.addChange(change);
        }
    }

    private void compareDataValidations(WorksheetSignature ws1, WorksheetSignature ws2, String sheetName,
                                        SmlComparisonResult result) {
        for (String key : union(ws1.getDataValidations().keySet(), ws2.getDataValidations().keySet())) {
            DataValidationSignature d1 = ws1.getDataValidations().get(key);
            DataValidationSignature d2 = ws2.getDataValidations().get(key);
            SmlChange change;
            if (d1 == null) {
                change = cellChange(SmlChangeType.DataValidationAdded, sheetName, key);
                change.setDataValidationType(d2.getValidationType());
                change.setNewDataValidation(d2.toString());
            } else if (d2 == null) {
                change = cellChange(SmlChangeType.DataValidationDeleted, sheetName, key);
                change.setDataValidationType(d1.getValidationType());
                change.setOldDataValidation(d1.toString());
            } else if (!d1.computeHash().equals(d2.computeHash())) {
                change = cellChange(SmlChangeType.DataValidationChanged, sheetName, key);
                change.setDataValidationType(d2.getValidationType());
                change.setOldDataValidation(d1.toString());
                change.setNewDataValidation(d2.toString());
            } else {
                continue;
            }
            result.addChange(change);
        }
    }

    private void compareMergedCells(WorksheetSignature ws1, WorksheetSignature ws2, String sheetName,
                                    SmlComparisonResult result) {
        for (String range : union(ws1.getMergedCellRanges(), ws2.getMergedCellRanges())) {
            boolean has1 = ws1.getMergedCellRanges().contains(range);
            boolean has2 = ws2.getMergedCellRanges().contains(range);
            if (has1 == has2) {
                continue;
            }
            SmlChange change = new SmlChange(has2 ? SmlChangeType.MergedCellAdded : SmlChangeType.MergedCellDeleted,
                    sheetName);
            change.setMergedCellRange(range);
            result.addChange(change);
        }
    }

    private void compareHyperlinks(WorksheetSignature ws1, WorksheetSignature ws2, String sheetName,
                                   SmlComparisonResult result) {
        for (String addr : union(ws1.getHyperlinks().keySet(), ws2.getHyperlinks().keySet())) {
            HyperlinkSignature h1 = ws1.getHyperlinks().get(addr);
            HyperlinkSignature h2 = ws2.getHyperlinks().get(addr);
            SmlChange change;
            if (h1 == null) {
                change = cellChange(SmlChangeType.HyperlinkAdded, sheetName, addr);
                change.setNewHyperlink(h2.getTarget());
            } else if (h2 == null) {
                change = cellChange(SmlChangeType.HyperlinkDeleted, sheetName, addr);
                change.setOldHyperlink(h1.getTarget());
            } else if (!h1.computeHash().equals(h2.computeHash())) {
                change = cellChange(SmlChangeType.HyperlinkChanged, sheetName, addr);
                change.setOldHyperlink(h1.getTarget());
                change.setNewHyperlink(h2.getTarget());
            } else {
                continue;
            }
            result.addChange(change);
        }
    }

    private void compareNamedRanges(WorkbookSignature older, WorkbookSignature newer, SmlComparisonResult result) {
        for (String key : union(older.getDefinedNames().keySet(), newer.getDefinedNames().keySet())) {
            DefinedNameSignature n1 = older.getDefinedNames().get(key);
            DefinedNameSignature n2 = newer.getDefinedNames().get(key);
            SmlChange change;
            if (n1 == null) {
                change = new SmlChange(SmlChangeType.NamedRangeAdded, null);
                change.setNamedRangeName(n2.getName());
                change.setNewNamedRangeValue(n2.getValue());
            } else if (n2 == null) {
                change = new SmlChange(SmlChangeType.NamedRangeDeleted, null);
                change.setNamedRangeName(n1.getName());
                change.setOldNamedRangeValue(n1.getValue());
            } else if (!n1.getValue().equals(n2.getValue())) {
                change = new SmlChange(SmlChangeType.NamedRangeChanged, null);
                change.setNamedRangeName(n2.getName());
                change.setOldNamedRangeValue(n1.getValue());
                change.setNewNamedRangeValue(n2.getValue());
            } else {
                continue;
            }
            result.addChange(change);
        }
    }

    // —— 工具 —— //

    private static SmlChange cellChange(SmlChangeType type, String sheetName, String address) {
        SmlChange change = new SmlChange(type, sheetName);
        change.setCellAddress(address);
        return change;
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> all = new TreeSet<>(a);
        all.addAll(b);
        return all;
    }

    /**
     * 列号、行号（均从 1 开始）→ A1 地址
     */
    static String address(int column, int row) {
        return CellReference.convertNumToColString(column - 1) + row;
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
