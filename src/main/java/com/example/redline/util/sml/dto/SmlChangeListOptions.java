package com.example.redline.util.sml.dto;

/**
 * Excel 变更列表构建选项
 */
public class SmlChangeListOptions {

    /** 同一行或同一列上相邻的同类单元格变更合为一个区域 */
    private boolean groupAdjacentCells = true;

    public static SmlChangeListOptions defaults() {
        return new SmlChangeListOptions();
    }

    public boolean isGroupAdjacentCells() { return groupAdjacentCells; }
    public void setGroupAdjacentCells(boolean groupAdjacentCells) { this.groupAdjacentCells = groupAdjacentCells; }
}
