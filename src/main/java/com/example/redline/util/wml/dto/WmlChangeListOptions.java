package com.example.redline.util.wml.dto;

/**
 * 变更列表构建选项
 */
public class WmlChangeListOptions {

    /** 相邻的同类变更（同段落、同作者、同日期）合为一项 */
    private boolean groupAdjacentChanges = true;
    /** 相邻的删除 + 插入合为“替换” */
    private boolean mergeReplacements = true;
    private int maxPreviewLength = 100;

    public static WmlChangeListOptions defaults() {
        return new WmlChangeListOptions();
    }

    public boolean isGroupAdjacentChanges() { return groupAdjacentChanges; }
    public void setGroupAdjacentChanges(boolean groupAdjacentChanges) { this.groupAdjacentChanges = groupAdjacentChanges; }

    public boolean isMergeReplacements() { return mergeReplacements; }
    public void setMergeReplacements(boolean mergeReplacements) { this.mergeReplacements = mergeReplacements; }

    public int getMaxPreviewLength() { return maxPreviewLength; }
    public void setMaxPreviewLength(int maxPreviewLength) { this.maxPreviewLength = maxPreviewLength; }
}
