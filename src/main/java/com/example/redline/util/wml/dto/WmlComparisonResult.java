package com.example.redline.util.wml.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Word 比对结果：带修订标记的文档 + 变更列表 + 统计
 */
public class WmlComparisonResult {

    private byte[] document;
    private List<WmlChange> changes = new ArrayList<>();
    private List<ChangeEvent> events = new ArrayList<>();
    private int insertions;
    private int deletions;
    private int formatChanges;

    public int getRevisionCount() {
        return insertions + deletions + formatChanges;
    }

    public byte[] getDocument() { return document; }
    public void setDocument(byte[] document) { this.document = document; }

    public List<WmlChange> getChanges() { return changes; }
    public void setChanges(List<WmlChange> changes) { this.changes = changes; }

    public List<ChangeEvent> getEvents() { return events; }
    public void setEvents(List<ChangeEvent> events) { this.events = events; }

    public int getInsertions() { return insertions; }
    public void setInsertions(int insertions) { this.insertions = insertions; }

    public int getDeletions() { return deletions; }
    public void setDeletions(int deletions) { this.deletions = deletions; }

    public int getFormatChanges() { return formatChanges; }
    public void setFormatChanges(int formatChanges) { this.formatChanges = formatChanges; }
}
