package com.example.redline.util.wml.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 从修订标记中提取的一条变更
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WmlChange {

    @JsonProperty("change_type")
    private WmlChangeType changeType;

    /** w:id */
    @JsonProperty("revision_id")
    private int revisionId;

    /** 所在段落序号（从 1 开始） */
    @JsonProperty("paragraph_index")
    private Integer paragraphIndex;

    @JsonProperty("table_row_index")
    private Integer tableRowIndex;

    @JsonProperty("table_cell_index")
    private Integer tableCellIndex;

    @JsonProperty("old_text")
    private String oldText;

    @JsonProperty("new_text")
    private String newText;

    @JsonProperty("word_count")
    private WmlWordCount wordCount;

    @JsonProperty("format_description")
    private String formatDescription;

    private String author;

    @JsonProperty("date_time")
    private String dateTime;

    @JsonProperty("in_footnote")
    private boolean inFootnote;

    @JsonProperty("in_endnote")
    private boolean inEndnote;

    @JsonProperty("in_table")
    private boolean inTable;

    @JsonProperty("in_textbox")
    private boolean inTextbox;

    public WmlChangeType getChangeType() { return changeType; }
    public void setChangeType(WmlChangeType changeType) { this.changeType = changeType; }

    public int getRevisionId() { return revisionId; }
    public void setRevisionId(int revisionId) { this.revisionId = revisionId; }

    public Integer getParagraphIndex() { return paragraphIndex; }
    public void setParagraphIndex(Integer paragraphIndex) { this.paragraphIndex = paragraphIndex; }

    public Integer getTableRowIndex() { return tableRowIndex; }
    public void setTableRowIndex(Integer tableRowIndex) { this.tableRowIndex = tableRowIndex; }

    public Integer getTableCellIndex() { return tableCellIndex; }
    public void setTableCellIndex(Integer tableCellIndex) { this.tableCellIndex = tableCellIndex; }

    public String getOldText() { return oldText; }
    public void setOldText(String oldText) { this.oldText = oldText; }

    public String getNewText() { return newText; }
    public void setNewText(String newText) { this.newText = newText; }

    public WmlWordCount getWordCount() { return wordCount; }
    public void setWordCount(WmlWordCount wordCount) { this.wordCount = wordCount; }

    public String getFormatDescription() { return formatDescription; }
    public void setFormatDescription(String formatDescription) { this.formatDescription = formatDescription; }

    public String getAuthor() { return author; }
    public void setAuthor(String author) { this.author = author; }

    public String getDateTime() { return dateTime; }
    public void setDateTime(String dateTime) { this.dateTime = dateTime; }

    public boolean isInFootnote() { return inFootnote; }
    public void setInFootnote(boolean inFootnote) { this.inFootnote = inFootnote; }

    public boolean isInEndnote() { return inEndnote; }
    public void setInEndnote(boolean inEndnote) { this.inEndnote = inEndnote; }

    public boolean isInTable() { return inTable; }
    public void setInTable(boolean inTable) { this.inTable = inTable; }

    public boolean isInTextbox() { return inTextbox; }
    public void setInTextbox(boolean inTextbox) { this.inTextbox = inTextbox; }

    @Override
    public String toString() {
        return changeType + "#" + revisionId + "(p" + paragraphIndex + ", old=" + oldText + ", new=" + newText + ")";
    }
}
