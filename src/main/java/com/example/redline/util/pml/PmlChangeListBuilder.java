package com.example.redline.util.pml;

import com.example.redline.util.pml.dto.PmlChange;
import com.example.redline.util.pml.dto.PmlChangeListItem;
import com.example.redline.util.pml.dto.PmlChangeListOptions;
import com.example.redline.util.pml.dto.PmlTextChange;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * PowerPoint 变更列表
 *
 * 同一张幻灯片上连续的形状级变更按形状名归并；幻灯片级变更单独成项。
 */
public class PmlChangeListBuilder {

    private PmlChangeListBuilder() {
    }

    public static List<PmlChangeListItem> build(List<PmlChange> changes) {
        return build(changes, PmlChangeListOptions.defaults());
    }

    public static List<PmlChangeListItem> build(List<PmlChange> changes, PmlChangeListOptions options) {
        List<PmlChangeListItem> items = new ArrayList<>();
        List<PmlChange> group = new ArrayList<>();
        for (PmlChange change : changes) {
            if (!group.isEmpty()) {
                PmlChange last = group.get(group.size() - 1);
                boolean canGroup = options.isGroupBySlide()
                        && change.getSlideIndex() != null
                        && Objects.equals(change.getSlideIndex(), last.getSlideIndex())
                        && !change.getChangeType().isSlideLevel()
                        && !last.getChangeType().isSlideLevel();
                if (!canGroup) {
                    flush(group, items, options);
                    group = new ArrayList<>();
                }
            }
            group.add(change);
        }
        flush(group, items, options);
        return items;
    }

    private static void flush(List<PmlChange> group, List<PmlChangeListItem> items, PmlChangeListOptions options) {
        if (group.isEmpty()) {
            return;
        }
        if (!options.isGroupBySlide() || group.size() == 1) {
            for (PmlChange c : group) {
                items.add(singleItem(c, items.size() + 1, options));
            }
            return;
        }
        Map<String, List<PmlChange>> byShape = new LinkedHashMap<>();
        List<PmlChange> ungrouped = new ArrayList<>();
        for (PmlChange c : group) {
            if (c.getShapeName() != null) {
                byShape.computeIfAbsent(c.getShapeName(), k -> new ArrayList<>()).add(c);
            } else {
                ungrouped.add(c);
            }
        }
        for (Map.Entry<String, List<PmlChange>> entry : byShape.entrySet()) {
            List<PmlChange> shapeChanges = entry.getValue();
            if (shapeChanges.size() == 1) {
                items.add(singleItem(shapeChanges.get(0), items.size() + 1, options));
            } else {
                items.add(groupedItem(shapeChanges, entry.getKey(), items.size() + 1));
            }
        }
        for (PmlChange c : ungrouped) {
            items.add(singleItem(c, items.size() + 1, options));
        }
    }

    private static PmlChangeListItem singleItem(PmlChange change, int index, PmlChangeListOptions options) {
        PmlChangeListItem item = baseItem(change, index);
        item.setSummary(change.getDescription());
        item.setDetails(change);
        item.getChangeIds().add(change.getId());

        String preview = null;
        List<PmlTextChange> textChanges = change.getTextChanges();
        if (textChanges != null && !textChanges.isEmpty()) {
            PmlTextChange first = textChanges.get(0);
            preview = first.getNewText() != null ? first.getNewText() : first.getOldText();
        } else if (change.getNewValue() != null) {
            preview = change.getNewValue();
        } else if (change.getOldValue() != null) {
            preview = change.getOldValue();
        }
        if (preview != null) {
            item.setPreviewText(truncate(preview, options.getMaxPreviewLength()));
        }
        return item;
    }

    private static PmlChangeListItem groupedItem(List<PmlChange> group, String shapeName, int index) {
        PmlChange first = group.get(0);
        PmlChangeListItem item = baseItem(first, index);
        item.setCount(group.size());
        item.setSummary(group.size() + " changes in '" + shapeName + "' on slide " + first.getSlideIndex());
        for (PmlChange c : group) {
            item.getChangeIds().add(c.getId());
        }
        return item;
    }

    private static PmlChangeListItem baseItem(PmlChange change, int index) {
        PmlChangeListItem item = new PmlChangeListItem();
        item.setId("change-" + index);
        item.setChangeType(change.getChangeType());
        item.setSlideIndex(change.getSlideIndex());
        item.setShapeName(change.getShapeName());
        item.setShapeId(change.getShapeId());
        if (change.getSlideIndex() != null) {
            item.setAnchor(change.getShapeId() == null
                    ? "slide-" + change.getSlideIndex()
                    : "slide-" + change.getSlideIndex() + "-shape-" + change.getShapeId());
        }
        return item;
    }

    static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= 3) {
            return "...";
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
