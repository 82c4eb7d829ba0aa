package com.example.redline.util.pml.signature;

import com.example.redline.util.common.HashUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 幻灯片签名
 */
public class SlideSignature {

    /** 在 sldIdLst 中的位置，从 1 开始 */
    private final int index;
    private final String relationshipId;
    private final String partPath;
    private String layoutHash;
    private String backgroundHash;
    private String notesText;
    private String titleText;
    private String contentHash;
    private final List<ShapeSignature> shapes = new ArrayList<>();

    public SlideSignature(int index, String relationshipId, String partPath) {
        this.index = index;
        this.relationshipId = relationshipId;
        this.partPath = partPath;
    }

    /**
     * 标题 + 按 z 序排列的 (名称:类别:文字)
     */
    public String computeFingerprint() {
        StringBuilder sb = new StringBuilder();
        sb.append(titleText == null ? "" : titleText).append('|');
        List<ShapeSignature> sorted = new ArrayList<>(shapes);
        sorted.sort(Comparator.comparingInt(ShapeSignature::getZOrder));
        for (ShapeSignature s : sorted) {
            sb.append(s.getName()).append(':').append(s.getKind()).append(':');
            if (s.getTextBody() != null) {
                sb.append(s.getTextBody().getPlainText());
            }
            sb.append('|');
        }
        return HashUtils.sha256(sb.toString());
    }

    public void addShape(ShapeSignature shape) {
        shapes.add(shape);
    }

    public ShapeSignature findShape(int shapeId) {
        for (ShapeSignature s : shapes) {
            if (s.getId() == shapeId) {
                return s;
            }
        }
        return null;
    }

    public int getIndex() { return index; }

    public String getRelationshipId() { return relationshipId; }

    public String getPartPath() { return partPath; }

    public String getLayoutHash() { return layoutHash; }
    public void setLayoutHash(String layoutHash) { this.layoutHash = layoutHash; }

    public String getBackgroundHash() { return backgroundHash; }
    public void setBackgroundHash(String backgroundHash) { this.backgroundHash = backgroundHash; }

    public String getNotesText() { return notesText; }
    public void setNotesText(String notesText) { this.notesText = notesText; }

    public String getTitleText() { return titleText; }
    public void setTitleText(String titleText) { this.titleText = titleText; }

    public String getContentHash() { return contentHash; }
    public void setContentHash(String contentHash) { this.contentHash = contentHash; }

    public List<ShapeSignature> getShapes() { return shapes; }
}
