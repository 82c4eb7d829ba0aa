package com.example.redline.util.sml.dto;

/**
 * Excel 变更类型
 */
public enum SmlChangeType {
    SheetAdded,
    SheetDeleted,
    SheetRenamed,
    RowInserted,
    RowDeleted,
    ColumnInserted,
    ColumnDeleted,
    CellAdded,
    CellDeleted,
    ValueChanged,
    FormulaChanged,
    FormatChanged,
    NamedRangeAdded,
    NamedRangeDeleted,
    NamedRangeChanged,
    CommentAdded,
    CommentDeleted,
    CommentChanged,
    DataValidationAdded,
    DataValidationDeleted,
    DataValidationChanged,
    MergedCellAdded,
    MergedCellDeleted,
    HyperlinkAdded,
    HyperlinkDeleted,
    HyperlinkChanged;

    /**
     * 是否单元格级变更（变更列表按区域合并、批注标注时使用）
     */
    public boolean isCellChange() {
        return this == CellAdded || this == CellDeleted || this == ValueChanged
                || this == FormulaChanged || this == FormatChanged;
    }
}
