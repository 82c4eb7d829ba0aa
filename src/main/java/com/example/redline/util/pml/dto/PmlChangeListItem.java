package com.example.redline.util.pml.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * PowerPoint 变更列表中的一项
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PmlChangeListItem {

    private String id;

    @JsonProperty("change_type")
    private PmlChangeType changeType;

    @JsonProperty("slide_index")
    private Integer slideIndex;

    @JsonProperty("shape_name")
    private String shapeName;

    @JsonProperty("shape_id")
    private String shapeId;

    private String summary;

    @JsonProperty("preview_text")
    private String previewText;

    /** 合并项的变更条数 */
    private Integer count;

    private PmlChange details;

    /** slide-2-shape-4 */
    private String anchor;

    @JsonProperty("change_ids")
    private List<String> changeIds = new ArrayList<>();

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public PmlChangeType getChangeType() { return changeType; }
    public void setChangeType(PmlChangeType changeType) { this.changeType = changeType; }

    public Integer getSlideIndex() { return slideIndex; }
    public void setSlideIndex(Integer slideIndex) { this.slideIndex = slideIndex; }

    public String getShapeName() { return shapeName; }
    public void setShapeName(String shapeName) { this.shapeName = shapeName; }

    public String getShapeId() { return shapeId; }
    public void setShapeId(String shapeId) { this.shapeId = shapeId; }

    public String getSummary() { return summary; }
    public void setSummary(String summary) { this.summary = summary; }

    public String getPreviewText() { return previewText; }
    public void setPreviewText(String previewText) { this.previewText = previewText; }

    public Integer getCount() { return count; }
    public void setCount(Integer count) { this.count = count; }

    public PmlChange getDetails() { return details; }
    public void setDetails(PmlChange details) { this.details = details; }

    public String getAnchor() { return anchor; }
    public void setAnchor(String anchor) { this.anchor = anchor; }

    public List<String> getChangeIds() { return changeIds; }
    public void setChangeIds(List<String> changeIds) { this.changeIds = changeIds; }
}
