package com.example.redline.util.wml.dto;

/**
 * 修订统计
 */
public class RevisionCounts {

    private final int insertions;
    private final int deletions;
    private final int formatChanges;

    public RevisionCounts(int insertions, int deletions, int formatChanges) {
        this.insertions = insertions;
        this.deletions = deletions;
        this.formatChanges = formatChanges;
    }

    public int getInsertions() { return insertions; }
    public int getDeletions() { return deletions; }
    public int getFormatChanges() { return formatChanges; }

    public int getTotal() {
        return insertions + deletions + formatChanges;
    }

    @Override
    public String toString() {
        return "RevisionCounts{ins=" + insertions + ", del=" + deletions + ", fmt=" + formatChanges + "}";
    }
}
