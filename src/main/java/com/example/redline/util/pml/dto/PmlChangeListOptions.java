package com.example.redline.util.pml.dto;

/**
 * PowerPoint 变更列表选项
 */
public class PmlChangeListOptions {

    /** 同一幻灯片上同一形状的多条变更合成一项 */
    private boolean groupBySlide = true;
    private int maxPreviewLength = 100;

    public static PmlChangeListOptions defaults() {
        return new PmlChangeListOptions();
    }

    public boolean isGroupBySlide() { return groupBySlide; }
    public void setGroupBySlide(boolean groupBySlide) { this.groupBySlide = groupBySlide; }

    public int getMaxPreviewLength() { return maxPreviewLength; }
    public void setMaxPreviewLength(int maxPreviewLength) { this.maxPreviewLength = maxPreviewLength; }
}
