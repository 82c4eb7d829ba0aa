package com.example.redline.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次比对的结果：标注后的文档、原始变更、汇总后的变更列表
 */
public class RedlineOutcome {

    private final DocumentType type;
    private byte[] document;
    /** WmlChange / SmlChange / PmlChange，可原样回传给 apply / revert */
    private List<?> changes = new ArrayList<>();
    /** WmlChangeListItem / SmlChangeListItem / PmlChangeListItem */
    private List<?> items = new ArrayList<>();
    /** Word 为修订数，Excel / PowerPoint 为变更数 */
    private int revisionCount;

    public RedlineOutcome(DocumentType type) {
        this.type = type;
    }

    public DocumentType getType() { return type; }

    public byte[] getDocument() { return document; }
    public void setDocument(byte[] document) { this.document = document; }

    public List<?> getChanges() { return changes; }
    public void setChanges(List<?> changes) { this.changes = changes; }

    public List<?> getItems() { return items; }
    public void setItems(List<?> items) { this.items = items; }

    public int getRevisionCount() { return revisionCount; }
    public void setRevisionCount(int revisionCount) { this.revisionCount = revisionCount; }
}
