package com.example.redline.util.sml.signature;

import com.example.redline.util.common.HashUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 工作表签名
 */
public class WorksheetSignature {

    /** 按行、列排序 */
    public static final Comparator<CellSignature> CELL_ORDER =
            Comparator.comparingInt(CellSignature::getRow).thenComparingInt(CellSignature::getColumn);

    private final String name;
    private final String relationshipId;
    /** 部件路径，如 xl/worksheets/sheet1.xml */
    private final String partPath;

    private final Map<String, CellSignature> cells = new HashMap<>();
    private final TreeSet<Integer> populatedRows = new TreeSet<>();
    private final TreeSet<Integer> populatedColumns = new TreeSet<>();
    private final Map<Integer, String> rowSignatures = new HashMap<>();
    private final Map<Integer, String> columnSignatures = new HashMap<>();

    private final Map<String, CommentSignature> comments = new TreeMap<>();
    private final Map<String, DataValidationSignature> dataValidations = new TreeMap<>();
    private final Set<String> mergedCellRanges = new LinkedHashSet<>();
    private final Map<String, HyperlinkSignature> hyperlinks = new TreeMap<>();

    public WorksheetSignature(String name, String relationshipId, String partPath) {
        this.name = name;
        this.relationshipId = relationshipId;
        this.partPath = partPath;
    }

    public void addCell(CellSignature cell) {
        cells.put(cell.getAddress(), cell);
        populatedRows.add(cell.getRow());
        populatedColumns.add(cell.getColumn());
    }

    public List<CellSignature> getCellsInRow(int row) {
        List<CellSignature> result = new ArrayList<>();
        for (CellSignature c : cells.values()) {
            if (c.getRow() == row) {
                result.add(c);
            }
        }
        result.sort(Comparator.comparingInt(CellSignature::getColumn));
        return result;
    }

    public List<CellSignature> getCellsInColumn(int column) {
        List<CellSignature> result = new ArrayList<>();
        for (CellSignature c : cells.values()) {
            if (c.getColumn() == column) {
                result.add(c);
            }
        }
        result.sort(Comparator.comparingInt(CellSignature::getRow));
        return result;
    }

    public List<CellSignature> getSortedCells() {
        List<CellSignature> result = new ArrayList<>(cells.values());
        result.sort(CELL_ORDER);
        return result;
    }

    /**
     * 整表内容哈希（地址:值|...），用于重命名检测
     */
    public String computeContentHash() {
        StringBuilder sb = new StringBuilder();
        for (CellSignature c : getSortedCells()) {
            sb.append(c.getAddress()).append(':')
                    .append(c.getResolvedValue() == null ? "" : c.getResolvedValue()).append('|');
        }
        return HashUtils.sha256(sb.toString());
    }

    public String getName() { return name; }

    public String getRelationshipId() { return relationshipId; }

    public String getPartPath() { return partPath; }

    public Map<String, CellSignature> getCells() { return cells; }

    public TreeSet<Integer> getPopulatedRows() { return populatedRows; }

    public TreeSet<Integer> getPopulatedColumns() { return populatedColumns; }

    public Map<Integer, String> getRowSignatures() { return rowSignatures; }

    public Map<Integer, String> getColumnSignatures() { return columnSignatures; }

    public Map<String, CommentSignature> getComments() { return comments; }

    public Map<String, DataValidationSignature> getDataValidations() { return dataValidations; }

    public Set<String> getMergedCellRanges() { return mergedCellRanges; }

    public Map<String, HyperlinkSignature> getHyperlinks() { return hyperlinks; }
}
