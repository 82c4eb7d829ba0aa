package com.example.redline.util.pml.dto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PowerPoint 比对结果
 */
public class PmlComparisonResult {

    private final List<PmlChange> changes = new ArrayList<>();
    /** 带标注的新演示文稿，只做比对时为 null */
    private byte[] document;

    public void addChange(PmlChange change) {
        change.setId("pml-" + (changes.size() + 1));
        changes.add(change);
    }

    public int count(PmlChangeType type) {
        int n = 0;
        for (PmlChange c : changes) {
            if (c.getChangeType() == type) {
                n++;
            }
        }
        return n;
    }

    public int getTotalChanges() {
        return changes.size();
    }

    public int getTextChanges() {
        return count(PmlChangeType.TextChanged) + count(PmlChangeType.TextFormattingChanged);
    }

    /**
     * 按幻灯片分组（新演示文稿中的位置）
     */
    public Map<Integer, List<PmlChange>> getChangesBySlide() {
        Map<Integer, List<PmlChange>> bySlide = new LinkedHashMap<>();
        for (PmlChange c : changes) {
            if (c.getSlideIndex() != null) {
                bySlide.computeIfAbsent(c.getSlideIndex(), k -> new ArrayList<>()).add(c);
            }
        }
        return bySlide;
    }

    public List<PmlChange> getChanges() { return changes; }

    public byte[] getDocument() { return document; }
    public void setDocument(byte[] document) { this.document = document; }
}
