package com.example.redline.util.lcs;

import java.util.function.Predicate;

/**
 * 最长公共连续子串匹配参数
 */
public class LcsSettings {

    /** 匹配的最小长度 */
    private int minMatchLength = 1;

    /** 匹配长度 / max(两侧长度) 低于该比例时视为无匹配，0 表示不限制 */
    private double detailThreshold = 0.0;

    /** 不能作为匹配起点的单元（按哈希判断），可为 null */
    private Predicate<String> skipAnchor;

    public static LcsSettings defaults() {
        return new LcsSettings();
    }

    public LcsSettings minMatchLength(int len) {
        this.minMatchLength = len;
        return this;
    }

    public LcsSettings detailThreshold(double threshold) {
        this.detailThreshold = threshold;
        return this;
    }

    public LcsSettings skipAnchor(Predicate<String> predicate) {
        this.skipAnchor = predicate;
        return this;
    }

    public int getMinMatchLength() { return minMatchLength; }

    public double getDetailThreshold() { return detailThreshold; }

    public Predicate<String> getSkipAnchor() { return skipAnchor; }
}
