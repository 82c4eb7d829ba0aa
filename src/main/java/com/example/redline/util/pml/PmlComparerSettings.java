package com.example.redline.util.pml;

/**
 * PowerPoint 比对设置
 */
public class PmlComparerSettings {

    private boolean compareSlideStructure = true;
    private boolean compareShapeStructure = true;
    private boolean compareTextContent = true;
    private boolean compareTextFormatting = true;
    private boolean compareShapeTransforms = true;
    private boolean compareNotes = true;
    /** 剩余幻灯片按相似度贪心配对；关闭时按位置配对 */
    private boolean useSlideAlignmentLcs = true;

    // —— 模糊匹配 —— //
    private boolean enableFuzzyShapeMatching = true;
    private double slideSimilarityThreshold = 0.4;
    private double shapeSimilarityThreshold = 0.7;
    /** EMU，约 0.1 英寸 */
    private long positionTolerance = 91440;

    // —— 输出 —— //
    private String authorForChanges = "Redline";
    private boolean addSummarySlide = true;
    private boolean addNotesAnnotations = true;

    // —— 标签颜色（RRGGBB） —— //
    private String insertedColor = "00AA00";
    private String deletedColor = "FF0000";
    private String modifiedColor = "FFA500";
    private String movedColor = "0000FF";
    private String formattingColor = "9932CC";

    public boolean isCompareSlideStructure() { return compareSlideStructure; }
    public void setCompareSlideStructure(boolean compareSlideStructure) { this.compareSlideStructure = compareSlideStructure; }

    public boolean isCompareShapeStructure() { return compareShapeStructure; }
    public void setCompareShapeStructure(boolean compareShapeStructure) { this.compareShapeStructure = compareShapeStructure; }

    public boolean isCompareTextContent() { return compareTextContent; }
    public void setCompareTextContent(boolean compareTextContent) { this.compareTextContent = compareTextContent; }

    public boolean isCompareTextFormatting() { return compareTextFormatting; }
    public void setCompareTextFormatting(boolean compareTextFormatting) { this.compareTextFormatting = compareTextFormatting; }

    public boolean isCompareShapeTransforms() { return compareShapeTransforms; }
    public void setCompareShapeTransforms(boolean compareShapeTransforms) { this.compareShapeTransforms = compareShapeTransforms; }

    public boolean isCompareNotes() { return compareNotes; }
    public void setCompareNotes(boolean compareNotes) { this.compareNotes = compareNotes; }

    public boolean isUseSlideAlignmentLcs() { return useSlideAlignmentLcs; }
    public void setUseSlideAlignmentLcs(boolean useSlideAlignmentLcs) { this.useSlideAlignmentLcs = useSlideAlignmentLcs; }

    public boolean isEnableFuzzyShapeMatching() { return enableFuzzyShapeMatching; }
    public void setEnableFuzzyShapeMatching(boolean enableFuzzyShapeMatching) { this.enableFuzzyShapeMatching = enableFuzzyShapeMatching; }

    public double getSlideSimilarityThreshold() { return slideSimilarityThreshold; }
    public void setSlideSimilarityThreshold(double slideSimilarityThreshold) { this.slideSimilarityThreshold = slideSimilarityThreshold; }

    public double getShapeSimilarityThreshold() { return shapeSimilarityThreshold; }
    public void setShapeSimilarityThreshold(double shapeSimilarityThreshold) { this.shapeSimilarityThreshold = shapeSimilarityThreshold; }

    public long getPositionTolerance() { return positionTolerance; }
    public void setPositionTolerance(long positionTolerance) { this.positionTolerance = positionTolerance; }

    public String getAuthorForChanges() { return authorForChanges; }
    public void setAuthorForChanges(String authorForChanges) { this.authorForChanges = authorForChanges; }

    public boolean isAddSummarySlide() { return addSummarySlide; }
    public void setAddSummarySlide(boolean addSummarySlide) { this.addSummarySlide = addSummarySlide; }

    public boolean isAddNotesAnnotations() { return addNotesAnnotations; }
    public void setAddNotesAnnotations(boolean addNotesAnnotations) { this.addNotesAnnotations = addNotesAnnotations; }

    public String getInsertedColor() { return insertedColor; }
    public void setInsertedColor(String insertedColor) { this.insertedColor = insertedColor; }

    public String getDeletedColor() { return deletedColor; }
    public void setDeletedColor(String deletedColor) { this.deletedColor = deletedColor; }

    public String getModifiedColor() { return modifiedColor; }
    public void setModifiedColor(String modifiedColor) { this.modifiedColor = modifiedColor; }

    public String getMovedColor() { return movedColor; }
    public void setMovedColor(String movedColor) { this.movedColor = movedColor; }

    public String getFormattingColor() { return formattingColor; }
    public void setFormattingColor(String formattingColor) { this.formattingColor = formattingColor; }
}
