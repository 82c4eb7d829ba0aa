package com.example.redline.util.wml.dto;

/**
 * 变更涉及的词数（按空白切分）
 */
public class WmlWordCount {

    private int deleted;
    private int inserted;

    public WmlWordCount() {
    }

    public WmlWordCount(int deleted, int inserted) {
        this.deleted = deleted;
        this.inserted = inserted;
    }

    public int getDeleted() { return deleted; }
    public void setDeleted(int deleted) { this.deleted = deleted; }

    public int getInserted() { return inserted; }
    public void setInserted(int inserted) { this.inserted = inserted; }
}
