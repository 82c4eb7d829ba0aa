package com.example.redline.util.pml.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 一条 PowerPoint 变更
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PmlChange {

    /** pml-N，apply / revert 按它选择 */
    private String id;

    @JsonProperty("change_type")
    private PmlChangeType changeType;

    /** 新演示文稿中的位置，从 1 开始；删除的幻灯片为旧位置 */
    @JsonProperty("slide_index")
    private Integer slideIndex;

    @JsonProperty("old_slide_index")
    private Integer oldSlideIndex;

    @JsonProperty("shape_name")
    private String shapeName;

    @JsonProperty("shape_id")
    private String shapeId;

    /** 旧文字 / 旧备注 / 旧尺寸描述 */
    @JsonProperty("old_value")
    private String oldValue;

    @JsonProperty("new_value")
    private String newValue;

    // —— 变换（EMU） —— //
    @JsonProperty("old_x")
    private Long oldX;
    @JsonProperty("old_y")
    private Long oldY;
    @JsonProperty("old_cx")
    private Long oldCx;
    @JsonProperty("old_cy")
    private Long oldCy;
    @JsonProperty("new_x")
    private Long newX;
    @JsonProperty("new_y")
    private Long newY;
    @JsonProperty("new_cx")
    private Long newCx;
    @JsonProperty("new_cy")
    private Long newCy;
    @JsonProperty("old_rotation")
    private Integer oldRotation;
    @JsonProperty("new_rotation")
    private Integer newRotation;

    @JsonProperty("text_changes")
    private List<PmlTextChange> textChanges;

    /** 形状或幻灯片配对的得分 */
    @JsonProperty("match_confidence")
    private Double matchConfidence;

    public PmlChange() {
    }

    public PmlChange(PmlChangeType changeType, Integer slideIndex) {
        this.changeType = changeType;
        this.slideIndex = slideIndex;
    }

    /**
     * 人可读的描述
     */
    @JsonProperty(value = "description", access = JsonProperty.Access.READ_ONLY)
    public String getDescription() {
        String shape = shapeName == null ? "" : shapeName;
        int slide = slideIndex == null ? 0 : slideIndex;
        switch (changeType) {
            case SlideSizeChanged:
                return "Slide size changed from " + nz(oldValue) + " to " + nz(newValue);
            case ThemeChanged:
                return "Presentation theme changed";
            case SlideInserted:
                return "Slide " + slide + " inserted";
            case SlideDeleted:
                return "Slide " + (oldSlideIndex == null ? slide : oldSlideIndex) + " deleted";
            case SlideMoved:
                return "Slide moved from position " + nz(oldSlideIndex) + " to " + slide;
            case SlideLayoutChanged:
                return "Slide " + slide + " layout changed";
            case SlideBackgroundChanged:
                return "Slide " + slide + " background changed";
            case SlideNotesChanged:
                return "Slide " + slide + " notes changed";
            case ShapeInserted:
                return "Shape '" + shape + "' inserted on slide " + slide;
            case ShapeDeleted:
                return "Shape '" + shape + "' deleted from slide " + slide;
            case ShapeMoved:
                return "Shape '" + shape + "' moved on slide " + slide;
            case ShapeResized:
                return "Shape '" + shape + "' resized on slide " + slide;
            case ShapeRotated:
                return "Shape '" + shape + "' rotated on slide " + slide;
            case ShapeZOrderChanged:
                return "Shape '" + shape + "' z-order changed on slide " + slide;
            case TextChanged:
                return "Text changed in '" + shape + "' on slide " + slide;
            case TextFormattingChanged:
                return "Text formatting changed in '" + shape + "' on slide " + slide;
            case ImageReplaced:
                return "Image replaced in '" + shape + "' on slide " + slide;
            case TableContentChanged:
                return "Table content changed in '" + shape + "' on slide " + slide;
            case ChartDataChanged:
                return "Chart data changed in '" + shape + "' on slide " + slide;
            default:
                return changeType.name() + " on slide " + slide;
        }
    }

    private static String nz(Object o) {
        return o == null ? "" : o.toString();
    }

    @Override
    public String toString() {
        return "PmlChange{" + id + ", " + getDescription() + "}";
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public PmlChangeType getChangeType() { return changeType; }
    public void setChangeType(PmlChangeType changeType) { this.changeType = changeType; }

    public Integer getSlideIndex() { return slideIndex; }
    public void setSlideIndex(Integer slideIndex) { this.slideIndex = slideIndex; }

    public Integer getOldSlideIndex() { return oldSlideIndex; }
    public void setOldSlideIndex(Integer oldSlideIndex) { this.oldSlideIndex = oldSlideIndex; }

    public String getShapeName() { return shapeName; }
    public void setShapeName(String shapeName) { this.shapeName = shapeName; }

    public String getShapeId() { return shapeId; }
    public void setShapeId(String shapeId) { this.shapeId = shapeId; }

    public String getOldValue() { return oldValue; }
    public void setOldValue(String oldValue) { this.oldValue = oldValue; }

    public String getNewValue() { return newValue; }
    public void setNewValue(String newValue) { this.newValue = newValue; }

    public Long getOldX() { return oldX; }
    public void setOldX(Long oldX) { this.oldX = oldX; }

    public Long getOldY() { return oldY; }
    public void setOldY(Long oldY) { this.oldY = oldY; }

    public Long getOldCx() { return oldCx; }
    public void setOldCx(Long oldCx) { this.oldCx = oldCx; }

    public Long getOldCy() { return oldCy; }
    public void setOldCy(Long oldCy) { this.oldCy = oldCy; }

    public Long getNewX() { return newX; }
    public void setNewX(Long newX) { this.newX = newX; }

    public Long getNewY() { return newY; }
    public void setNewY(Long newY) { this.newY = newY; }

    public Long getNewCx() { return newCx; }
    public void setNewCx(Long newCx) { this.newCx = newCx; }

    public Long getNewCy() { return newCy; }
    public void setNewCy(Long newCy) { this.newCy = newCy; }

    public Integer getOldRotation() { return oldRotation; }
    public void setOldRotation(Integer oldRotation) { this.oldRotation = oldRotation; }

    public Integer getNewRotation() { return newRotation; }
    public void setNewRotation(Integer newRotation) { this.newRotation = newRotation; }

    public List<PmlTextChange> getTextChanges() { return textChanges; }
    public void setTextChanges(List<PmlTextChange> textChanges) { this.textChanges = textChanges; }

    public Double getMatchConfidence() { return matchConfidence; }
    public void setMatchConfidence(Double matchConfidence) { this.matchConfidence = matchConfidence; }
}
