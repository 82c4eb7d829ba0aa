package com.example.redline.util.sml.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Excel 变更列表中的一项
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SmlChangeListItem {

    private String id;

    @JsonProperty("change_type")
    private SmlChangeType changeType;

    @JsonProperty("sheet_name")
    private String sheetName;

    @JsonProperty("cell_address")
    private String cellAddress;

    /** 合并多个单元格时为 A1:C1 */
    @JsonProperty("cell_range")
    private String cellRange;

    @JsonProperty("row_index")
    private Integer rowIndex;

    @JsonProperty("column_index")
    private Integer columnIndex;

    private int count;

    private String summary;

    /** 单条变更时为其完整记录 */
    private SmlChange details;

    /** Sheet!A1 */
    private String anchor;

    /** 本项覆盖的变更 id */
    @JsonProperty("change_ids")
    private List<String> changeIds = new ArrayList<>();

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public SmlChangeType getChangeType() { return changeType; }
    public void setChangeType(SmlChangeType changeType) { this.changeType = changeType; }

    public String getSheetName() { return sheetName; }
    public void setSheetName(String sheetName) { this.sheetName = sheetName; }

    public String getCellAddress() { return cellAddress; }
    public void setCellAddress(String cellAddress) { this.cellAddress = cellAddress; }

    public String getCellRange() { return cellRange; }
    public void setCellRange(String cellRange) { this.cellRange = cellRange; }

    public Integer getRowIndex() { return rowIndex; }
    public void setRowIndex(Integer rowIndex) { this.rowIndex = rowIndex; }

    public Integer getColumnIndex() { return columnIndex; }
    public void setColumnIndex(Integer columnIndex) { this.columnIndex = columnIndex; }

    public int getCount() { return count; }
    public void setCount(int count) { this.count = count; }

    public String getSummary() { return summary; }
    public void setSummary(String summary) { this.summary = summary; }

    public SmlChange getDetails() { return details; }
    public void setDetails(SmlChange details) { this.details = details; }

    public String getAnchor() { return anchor; }
    public void setAnchor(String anchor) { this.anchor = anchor; }

    public List<String> getChangeIds() { return changeIds; }
    public void setChangeIds(List<String> changeIds) { this.changeIds = changeIds; }
}
