package com.example.redline.util.lcs;

/**
 * 最长匹配：两侧起点 + 长度
 */
public class MatchResult {

    private final int start1;
    private final int start2;
    private final int length;

    public MatchResult(int start1, int start2, int length) {
        this.start1 = start1;
        this.start2 = start2;
        this.length = length;
    }

    public int getStart1() { return start1; }

    public int getStart2() { return start2; }

    public int getLength() { return length; }

    public int getEnd1() { return start1 + length; }

    public int getEnd2() { return start2 + length; }

    @Override
    public String toString() {
        return "Match[" + start1 + "," + start2 + ",len=" + length + "]";
    }
}
