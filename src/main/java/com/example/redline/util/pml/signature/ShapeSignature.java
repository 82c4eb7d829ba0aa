package com.example.redline.util.pml.signature;

import java.util.ArrayList;
import java.util.List;

/**
 * 形状签名
 */
public class ShapeSignature {

    private String name = "";
    /** p:cNvPr/@id */
    private int id;
    private ShapeKind kind = ShapeKind.Unknown;
    private PlaceholderInfo placeholder;
    private TransformInfo transform;
    private int zOrder;
    /** 预设几何名，或自定义几何的哈希 */
    private String geometryHash;
    private TextBodySignature textBody;
    private String imageHash;
    private String tableHash;
    private String chartHash;
    private List<ShapeSignature> children;
    private String contentHash;

    /**
     * 匹配时区分同一张幻灯片上的形状
     */
    public String getKey() {
        return id + ":" + name;
    }

    public String getPlainText() {
        return textBody == null ? null : textBody.getPlainText();
    }

    public void addChild(ShapeSignature child) {
        if (children == null) {
            children = new ArrayList<>();
        }
        children.add(child);
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name == null ? "" : name; }

    public int getId() { return id; }
    public void setId(int id) { this.id = id; }

    public ShapeKind getKind() { return kind; }
    public void setKind(ShapeKind kind) { this.kind = kind; }

    public PlaceholderInfo getPlaceholder() { return placeholder; }
    public void setPlaceholder(PlaceholderInfo placeholder) { this.placeholder = placeholder; }

    public TransformInfo getTransform() { return transform; }
    public void setTransform(TransformInfo transform) { this.transform = transform; }

    public int getZOrder() { return zOrder; }
    public void setZOrder(int zOrder) { this.zOrder = zOrder; }

    public String getGeometryHash() { return geometryHash; }
    public void setGeometryHash(String geometryHash) { this.geometryHash = geometryHash; }

    public TextBodySignature getTextBody() { return textBody; }
    public void setTextBody(TextBodySignature textBody) { this.textBody = textBody; }

    public String getImageHash() { return imageHash; }
    public void setImageHash(String imageHash) { this.imageHash = imageHash; }

    public String getTableHash() { return tableHash; }
    public void setTableHash(String tableHash) { this.tableHash = tableHash; }

    public String getChartHash() { return chartHash; }
    public void setChartHash(String chartHash) { this.chartHash = chartHash; }

    public List<ShapeSignature> getChildren() { return children; }

    public String getContentHash() { return contentHash; }
    public void setContentHash(String contentHash) { this.contentHash = contentHash; }

    @Override
    public String toString() {
        return "Shape{" + id + ", '" + name + "', " + kind + "}";
    }
}
