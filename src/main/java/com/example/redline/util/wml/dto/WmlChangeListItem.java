package com.example.redline.util.wml.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 变更列表中的一项（审阅侧栏展示用）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WmlChangeListItem {

    /** change-N */
    private String id;

    @JsonProperty("change_type")
    private WmlChangeType changeType;

    private String summary;

    @JsonProperty("preview_text")
    private String previewText;

    @JsonProperty("word_count")
    private WmlWordCount wordCount;

    @JsonProperty("paragraph_index")
    private Integer paragraphIndex;

    @JsonProperty("revision_id")
    private Integer revisionId;

    /** 本项覆盖的全部修订 id（合并替换时有两个以上） */
    @JsonProperty("revision_ids")
    private List<Integer> revisionIds = new ArrayList<>();

    /** revision-<id> */
    private String anchor;

    private WmlChangeDetails details;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public WmlChangeType getChangeType() { return changeType; }
    public void setChangeType(WmlChangeType changeType) { this.changeType = changeType; }

    public String getSummary() { return summary; }
    public void setSummary(String summary) { this.summary = summary; }

    public String getPreviewText() { return previewText; }
    public void setPreviewText(String previewText) { this.previewText = previewText; }

    public WmlWordCount getWordCount() { return wordCount; }
    public void setWordCount(WmlWordCount wordCount) { this.wordCount = wordCount; }

    public Integer getParagraphIndex() { return paragraphIndex; }
    public void setParagraphIndex(Integer paragraphIndex) { this.paragraphIndex = paragraphIndex; }

    public Integer getRevisionId() { return revisionId; }
    public void setRevisionId(Integer revisionId) { this.revisionId = revisionId; }

    public List<Integer> getRevisionIds() { return revisionIds; }
    public void setRevisionIds(List<Integer> revisionIds) { this.revisionIds = revisionIds; }

    public String getAnchor() { return anchor; }
    public void setAnchor(String anchor) { this.anchor = anchor; }

    public WmlChangeDetails getDetails() { return details; }
    public void setDetails(WmlChangeDetails details) { this.details = details; }
}
