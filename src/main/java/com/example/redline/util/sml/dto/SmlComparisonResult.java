package com.example.redline.util.sml.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Excel 比对结果
 */
public class SmlComparisonResult {

    private final List<SmlChange> changes = new ArrayList<>();
    /** 带标注的新工作簿，只做比对时为 null */
    private byte[] document;

    /**
     * 追加一条变更并按顺序编号
     */
    public void addChange(SmlChange change) {
        change.setId("sml-" + (changes.size() + 1));
        changes.add(change);
    }

    public int count(SmlChangeType type) {
        int n = 0;
        for (SmlChange c : changes) {
            if (c.getChangeType() == type) {
                n++;
            }
        }
        return n;
    }

    public int getTotalChanges() {
        return changes.size();
    }

    public List<SmlChange> getChanges() { return changes; }

    public byte[] getDocument() { return document; }
    public void setDocument(byte[] document) { this.document = document; }
}
