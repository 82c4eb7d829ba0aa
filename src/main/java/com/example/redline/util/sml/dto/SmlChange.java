package com.example.redline.util.sml.dto;

import com.example.redline.util.sml.signature.CellFormatSignature;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.poi.ss.util.CellReference;

/**
 * 一条 Excel 变更
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SmlChange {

    /** sml-N，按产生顺序编号，apply / revert 按它选择 */
    private String id;

    @JsonProperty("change_type")
    private SmlChangeType changeType;

    @JsonProperty("sheet_name")
    private String sheetName;

    @JsonProperty("cell_address")
    private String cellAddress;

    /** 从 1 开始 */
    @JsonProperty("row_index")
    private Integer rowIndex;

    /** 从 1 开始 */
    @JsonProperty("column_index")
    private Integer columnIndex;

    @JsonProperty("old_sheet_name")
    private String oldSheetName;

    @JsonProperty("old_value")
    private String oldValue;

    @JsonProperty("new_value")
    private String newValue;

    @JsonProperty("old_formula")
    private String oldFormula;

    @JsonProperty("new_formula")
    private String newFormula;

    @JsonProperty("old_format")
    private CellFormatSignature oldFormat;

    @JsonProperty("new_format")
    private CellFormatSignature newFormat;

    @JsonProperty("named_range_name")
    private String namedRangeName;

    @JsonProperty("old_named_range_value")
    private String oldNamedRangeValue;

    @JsonProperty("new_named_range_value")
    private String newNamedRangeValue;

    @JsonProperty("old_comment")
    private String oldComment;

    @JsonProperty("new_comment")
    private String newComment;

    @JsonProperty("comment_author")
    private String commentAuthor;

    @JsonProperty("data_validation_type")
    private String dataValidationType;

    @JsonProperty("old_data_validation")
    private String oldDataValidation;

    @JsonProperty("new_data_validation")
    private String newDataValidation;

    @JsonProperty("merged_cell_range")
    private String mergedCellRange;

    @JsonProperty("old_hyperlink")
    private String oldHyperlink;

    @JsonProperty("new_hyperlink")
    private String newHyperlink;

    public SmlChange() {
    }

    public SmlChange(SmlChangeType changeType, String sheetName) {
        this.changeType = changeType;
        this.sheetName = sheetName;
    }

    /**
     * 人可读的描述
     */
    @JsonProperty(value = "description", access = JsonProperty.Access.READ_ONLY)
    public String getDescription() {
        String sheet = nz(sheetName);
        String cell = sheet + "!" + nz(cellAddress);
        switch (changeType) {
            case SheetAdded:
                return "Sheet '" + sheet + "' was added";
            case SheetDeleted:
                return "Sheet '" + sheet + "' was deleted";
            case SheetRenamed:
                return "Sheet '" + nz(oldSheetName) + "' was renamed to '" + sheet + "'";
            case RowInserted:
                return "Row " + nz(rowIndex) + " was inserted in sheet '" + sheet + "'";
            case RowDeleted:
                return "Row " + nz(rowIndex) + " was deleted from sheet '" + sheet + "'";
            case ColumnInserted:
                return "Column " + columnLetter() + " was inserted in sheet '" + sheet + "'";
            case ColumnDeleted:
                return "Column " + columnLetter() + " was deleted from sheet '" + sheet + "'";
            case CellAdded:
                return "Cell " + cell + " was added with value '" + nz(newValue) + "'";
            case CellDeleted:
                return "Cell " + cell + " was deleted (had value '" + nz(oldValue) + "')";
            case ValueChanged:
                return "Cell " + cell + " value changed from '" + nz(oldValue) + "' to '" + nz(newValue) + "'";
            case FormulaChanged:
                return "Cell " + cell + " formula changed from '" + nz(oldFormula) + "' to '" + nz(newFormula) + "'";
            case FormatChanged:
                return "Cell " + cell + " formatting changed";
            case NamedRangeAdded:
                return "Named range '" + nz(namedRangeName) + "' was added with value '" + nz(newNamedRangeValue) + "'";
            case NamedRangeDeleted:
                return "Named range '" + nz(namedRangeName) + "' was deleted (had value '" + nz(oldNamedRangeValue) + "')";
            case NamedRangeChanged:
                return "Named range '" + nz(namedRangeName) + "' changed from '" + nz(oldNamedRangeValue)
                        + "' to '" + nz(newNamedRangeValue) + "'";
            case CommentAdded:
                return "Comment added to " + cell + ": '" + truncate(nz(newComment), 50) + "'";
            case CommentDeleted:
                return "Comment deleted from " + cell;
            case CommentChanged:
                return "Comment changed at " + cell;
            case DataValidationAdded:
                return "Data validation (" + nz(dataValidationType) + ") added to " + cell;
            case DataValidationDeleted:
                return "Data validation removed from " + cell;
            case DataValidationChanged:
                return "Data validation changed at " + cell;
            case MergedCellAdded:
                return "Merged cell region " + nz(mergedCellRange) + " added in sheet '" + sheet + "'";
            case MergedCellDeleted:
                return "Merged cell region " + nz(mergedCellRange) + " removed from sheet '" + sheet + "'";
            case HyperlinkAdded:
                return "Hyperlink added to " + cell + ": '" + nz(newHyperlink) + "'";
            case HyperlinkDeleted:
                return "Hyperlink removed from " + cell;
            case HyperlinkChanged:
                return "Hyperlink changed at " + cell;
            default:
                return changeType.name();
        }
    }

    private String columnLetter() {
        return columnIndex == null || columnIndex < 1 ? "" : CellReference.convertNumToColString(columnIndex - 1);
    }

    private static String nz(Object o) {
        return o == null ? "" : o.toString();
    }

    static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max - 3) + "...";
    }

    @Override
    public String toString() {
        return "SmlChange{" + id + ", " + getDescription() + "}";
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public SmlChangeType getChangeType() { return changeType; }
    public void setChangeType(SmlChangeType changeType) { this.changeType = changeType; }

    public String getSheetName() { return sheetName; }
    public void setSheetName(String sheetName) { this.sheetName = sheetName; }

    public String getCellAddress() { return cellAddress; }
    public void setCellAddress(String cellAddress) { this.cellAddress = cellAddress; }

    public Integer getRowIndex() { return rowIndex; }
    public void setRowIndex(Integer rowIndex) { this.rowIndex = rowIndex; }

    public Integer getColumnIndex() { return columnIndex; }
    public void setColumnIndex(Integer columnIndex) { this.columnIndex = columnIndex; }

    public String getOldSheetName() { return oldSheetName; }
    public void setOldSheetName(String oldSheetName) { this.oldSheetName = oldSheetName; }

    public String getOldValue() { return oldValue; }
    public void setOldValue(String oldValue) { this.oldValue = oldValue; }

    public String getNewValue() { return newValue; }
    public void setNewValue(String newValue) { this.newValue = newValue; }

    public String getOldFormula() { return oldFormula; }
    public void setOldFormula(String oldFormula) { this.oldFormula = oldFormula; }

    public String getNewFormula() { return newFormula; }
    public void setNewFormula(String newFormula) { this.newFormula = newFormula; }

    public CellFormatSignature getOldFormat() { return oldFormat; }
    public void setOldFormat(CellFormatSignature oldFormat) { this.oldFormat = oldFormat; }

    public CellFormatSignature getNewFormat() { return newFormat; }
    public void setNewFormat(CellFormatSignature newFormat) { this.newFormat = newFormat; }

    public String getNamedRangeName() { return namedRangeName; }
    public void setNamedRangeName(String namedRangeName) { this.namedRangeName = namedRangeName; }

    public String getOldNamedRangeValue() { return oldNamedRangeValue; }
    public void setOldNamedRangeValue(String oldNamedRangeValue) { this.oldNamedRangeValue = oldNamedRangeValue; }

    public String getNewNamedRangeValue() { return newNamedRangeValue; }
    public void setNewNamedRangeValue(String newNamedRangeValue) { this.newNamedRangeValue = newNamedRangeValue; }

    public String getOldComment() { return oldComment; }
    public void setOldComment(String oldComment) { this.oldComment = oldComment; }

    public String getNewComment() { return newComment; }
    public void setNewComment(String newComment) { this.newComment = newComment; }

    public String getCommentAuthor() { return commentAuthor; }
    public void setCommentAuthor(String commentAuthor) { this.commentAuthor = commentAuthor; }

    public String getDataValidationType() { return dataValidationType; }
    public void setDataValidationType(String dataValidationType) { this.dataValidationType = dataValidationType; }

    public String getOldDataValidation() { return oldDataValidation; }
    public void setOldDataValidation(String oldDataValidation) { this.oldDataValidation = oldDataValidation; }

    public String getNewDataValidation() { return newDataValidation; }
    public void setNewDataValidation(String newDataValidation) { this.newDataValidation = newDataValidation; }

    public String getMergedCellRange() { return mergedCellRange; }
    public void setMergedCellRange(String mergedCellRange) { this.mergedCellRange = mergedCellRange; }

    public String getOldHyperlink() { return oldHyperlink; }
    public void setOldHyperlink(String oldHyperlink) { this.oldHyperlink = oldHyperlink; }

    public String getNewHyperlink() { return newHyperlink; }
    public void setNewHyperlink(String newHyperlink) { this.newHyperlink = newHyperlink; }
}
