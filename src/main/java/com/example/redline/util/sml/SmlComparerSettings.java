package com.example.redline.util.sml;

/**
 * Excel 比对设置
 */
public class SmlComparerSettings {

    private boolean compareValues = true;
    private boolean compareFormulas = true;
    private boolean compareFormatting = true;
    private boolean compareSheetStructure = true;
    private boolean caseInsensitiveValues = false;
    /** 数值比较容差，0 表示精确比较 */
    private double numericTolerance = 0.0;

    /** 批注作者 */
    private String authorForChanges = "Redline";

    // —— 高亮颜色（RRGGBB） —— //
    private String addedCellColor = "90EE90";
    private String deletedCellColor = "FFCCCB";
    private String modifiedValueColor = "FFD700";
    private String modifiedFormulaColor = "87CEEB";
    private String modifiedFormatColor = "E6E6FA";
    private String commentColor = "FFFACD";
    private String dataValidationColor = "FFDAB9";

    // —— 行列对齐 —— //
    private boolean enableRowAlignment = false;
    private boolean enableColumnAlignment = false;
    private boolean enableSheetRenameDetection = true;
    private double sheetRenameSimilarityThreshold = 0.7;
    private int rowSignatureSampleSize = 10;

    private boolean compareNamedRanges = true;
    private boolean compareComments = true;
    private boolean compareDataValidation = true;
    private boolean compareMergedCells = true;
    private boolean compareHyperlinks = true;

    public boolean isCompareValues() { return compareValues; }
    public void setCompareValues(boolean compareValues) { this.compareValues = compareValues; }

    public boolean isCompareFormulas() { return compareFormulas; }
    public void setCompareFormulas(boolean compareFormulas) { this.compareFormulas = compareFormulas; }

    public boolean isCompareFormatting() { return compareFormatting; }
    public void setCompareFormatting(boolean compareFormatting) { this.compareFormatting = compareFormatting; }

    public boolean isCompareSheetStructure() { return compareSheetStructure; }
    public void setCompareSheetStructure(boolean compareSheetStructure) { this.compareSheetStructure = compareSheetStructure; }

    public boolean isCaseInsensitiveValues() { return caseInsensitiveValues; }
    public void setCaseInsensitiveValues(boolean caseInsensitiveValues) { this.caseInsensitiveValues = caseInsensitiveValues; }

    public double getNumericTolerance() { return numericTolerance; }
    public void setNumericTolerance(double numericTolerance) { this.numericTolerance = numericTolerance; }

    public String getAuthorForChanges() { return authorForChanges; }
    public void setAuthorForChanges(String authorForChanges) { this.authorForChanges = authorForChanges; }

    public String getAddedCellColor() { return addedCellColor; }
    public void setAddedCellColor(String addedCellColor) { this.addedCellColor = addedCellColor; }

    public String getDeletedCellColor() { return deletedCellColor; }
    public void setDeletedCellColor(String deletedCellColor) { this.deletedCellColor = deletedCellColor; }

    public String getModifiedValueColor() { return modifiedValueColor; }
    public void setModifiedValueColor(String modifiedValueColor) { this.modifiedValueColor = modifiedValueColor; }

    public String getModifiedFormulaColor() { return modifiedFormulaColor; }
    public void setModifiedFormulaColor(String modifiedFormulaColor) { this.modifiedFormulaColor = modifiedFormulaColor; }

    public String getModifiedFormatColor() { return modifiedFormatColor; }
    public void setModifiedFormatColor(String modifiedFormatColor) { this.modifiedFormatColor = modifiedFormatColor; }

    public String getCommentColor() { return commentColor; }
    public void setCommentColor(String commentColor) { this.commentColor = commentColor; }

    public String getDataValidationColor() { return dataValidationColor; }
    public void setDataValidationColor(String dataValidationColor) { this.dataValidationColor = dataValidationColor; }

    public boolean isEnableRowAlignment() { return enableRowAlignment; }
    public void setEnableRowAlignment(boolean enableRowAlignment) { this.enableRowAlignment = enableRowAlignment; }

    public boolean isEnableColumnAlignment() { return enableColumnAlignment; }
    public void setEnableColumnAlignment(boolean enableColumnAlignment) { this.enableColumnAlignment = enableColumnAlignment; }

    public boolean isEnableSheetRenameDetection() { return enableSheetRenameDetection; }
    public void setEnableSheetRenameDetection(boolean enableSheetRenameDetection) { this.enableSheetRenameDetection = enableSheetRenameDetection; }

    public double getSheetRenameSimilarityThreshold() { return sheetRenameSimilarityThreshold; }
    public void setSheetRenameSimilarityThreshold(double sheetRenameSimilarityThreshold) { this.sheetRenameSimilarityThreshold = sheetRenameSimilarityThreshold; }

    public int getRowSignatureSampleSize() { return rowSignatureSampleSize; }
    public void setRowSignatureSampleSize(int rowSignatureSampleSize) { this.rowSignatureSampleSize = rowSignatureSampleSize; }

    public boolean isCompareNamedRanges() { return compareNamedRanges; }
    public void setCompareNamedRanges(boolean compareNamedRanges) { this.compareNamedRanges = compareNamedRanges; }

    public boolean isCompareComments() { return compareComments; }
    public void setCompareComments(boolean compareComments) { this.compareComments = compareComments; }

    public boolean isCompareDataValidation() { return compareDataValidation; }
    public void setCompareDataValidation(boolean compareDataValidation) { this.compareDataValidation = compareDataValidation; }

    public boolean isCompareMergedCells() { return compareMergedCells; }
    public void setCompareMergedCells(boolean compareMergedCells) { this.compareMergedCells = compareMergedCells; }

    public boolean isCompareHyperlinks() { return compareHyperlinks; }
    public void setCompareHyperlinks(boolean compareHyperlinks) { this.compareHyperlinks = compareHyperlinks; }
}
