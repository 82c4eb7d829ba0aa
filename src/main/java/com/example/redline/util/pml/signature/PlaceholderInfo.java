package com.example.redline.util.pml.signature;

import java.util.Objects;

/**
 * 占位符 (type, idx)；没写 type 的占位符按 body 处理
 */
public class PlaceholderInfo {

    private final String type;
    private final Integer index;

    public PlaceholderInfo(String type, Integer index) {
        this.type = type == null ? "body" : type;
        this.index = index;
    }

    public boolean isTitle() {
        return "title".equals(type) || "ctrTitle".equals(type);
    }

    public String getType() { return type; }

    public Integer getIndex() { return index; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PlaceholderInfo)) {
            return false;
        }
        PlaceholderInfo that = (PlaceholderInfo) o;
        return type.equals(that.type) && Objects.equals(index, that.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, index);
    }

    @Override
    public String toString() {
        return index == null ? type : type + "#" + index;
    }
}
