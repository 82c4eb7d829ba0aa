package com.example.redline.util.pml.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 段落级文字差异
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PmlTextChange {

    public enum Kind {
        Insert, Delete, Replace
    }

    private Kind type;

    /** 新文本中的段落序号（删除时为旧文本中的序号），从 0 开始 */
    @JsonProperty("paragraph_index")
    private int paragraphIndex;

    @JsonProperty("old_text")
    private String oldText;

    @JsonProperty("new_text")
    private String newText;

    public PmlTextChange() {
    }

    public PmlTextChange(Kind type, int paragraphIndex, String oldText, String newText) {
        this.type = type;
        this.paragraphIndex = paragraphIndex;
        this.oldText = oldText;
        this.newText = newText;
    }

    public Kind getType() { return type; }
    public void setType(Kind type) { this.type = type; }

    public int getParagraphIndex() { return paragraphIndex; }
    public void setParagraphIndex(int paragraphIndex) { this.paragraphIndex = paragraphIndex; }

    public String getOldText() { return oldText; }
    public void setOldText(String oldText) { this.oldText = oldText; }

    public String getNewText() { return newText; }
    public void setNewText(String newText) { this.newText = newText; }
}
