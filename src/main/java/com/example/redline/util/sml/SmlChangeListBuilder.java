package com.example.redline.util.sml;

import com.example.redline.util.sml.dto.SmlChange;
import com.example.redline.util.sml.dto.SmlChangeListItem;
import com.example.redline.util.sml.dto.SmlChangeListOptions;
import com.example.redline.util.sml.dto.SmlChangeType;
import org.apache.poi.ss.util.CellReference;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Excel 变更列表
 *
 * 同一工作表中同类的单元格变更，若在同一行横向相邻或同一列纵向相邻，合并为一个区域（如 A1:C1）。
 */
public class SmlChangeListBuilder {

    private static final int HORIZONTAL = 1;
    private static final int VERTICAL = 2;

    private SmlChangeListBuilder() {
    }

    public static List<SmlChangeListItem> build(List<SmlChange> changes) {
        return build(changes, SmlChangeListOptions.defaults());
    }

    public static List<SmlChangeListItem> build(List<SmlChange> changes, SmlChangeListOptions options) {
        List<SmlChangeListItem> items = new ArrayList<>();
        List<SmlChange> group = new ArrayList<>();
        int direction = 0;
        for (SmlChange change : changes) {
            if (group.isEmpty()) {
                group.add(change);
                direction = 0;
                continue;
            }
            SmlChange last = group.get(group.size() - 1);
            int adjacency = adjacency(last, change);
            boolean canGroup = options.isGroupAdjacentCells()
                    && change.getChangeType().isCellChange()
                    && change.getChangeType() == last.getChangeType()
                    && Objects.equals(change.getSheetName(), last.getSheetName())
                    && adjacency != 0
                    && (direction == 0 || direction == adjacency);
            if (canGroup) {
                group.add(change);
                if (direction == 0) {
                    direction = adjacency;
                }
            } else {
                items.add(createItem(group, items.size() + 1));
                group = new ArrayList<>();
                group.add(change);
                direction = 0;
            }
        }
        if (!group.isEmpty()) {
            items.add(createItem(group, items.size() + 1));
        }
        return items;
    }

    /**
     * 0 不相邻，1 同行相邻列，2 同列相邻行
     */
    static int adjacency(SmlChange c1, SmlChange c2) {
        int[] a = parse(c1.getCellAddress());
        int[] b = parse(c2.getCellAddress());
        if (a == null || b == null) {
            return 0;
        }
        if (a[0] == b[0] && Math.abs(a[1] - b[1]) == 1) {
            return HORIZONTAL;
        }
        if (a[1] == b[1] && Math.abs(a[0] - b[0]) == 1) {
            return VERTICAL;
        }
        return 0;
    }

    /**
     * A1 地址 → {行, 列}（从 0 开始），非法时返回 null
     */
    private static int[] parse(String address) {
        if (address == null || address.isEmpty()) {
            return null;
        }
        try {
            CellReference ref = new CellReference(address);
            return new int[]{ref.getRow(), ref.getCol()};
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static SmlChangeListItem createItem(List<SmlChange> group, int index) {
        SmlChange first = group.get(0);
        SmlChangeListItem item = new SmlChangeListItem();
        item.setId("change-" + index);
        item.setChangeType(first.getChangeType());
        item.setSheetName(first.getSheetName());
        item.setCellAddress(first.getCellAddress());
        item.setRowIndex(first.getRowIndex());
        item.setColumnIndex(first.getColumnIndex());
        item.setCount(group.size());
        for (SmlChange c : group) {
            item.getChangeIds().add(c.getId());
        }
        if (group.size() == 1) {
            item.setSummary(first.getDescription());
            item.setDetails(first);
        } else {
            item.setSummary(group.size() + " cells changed (" + summarizeType(first.getChangeType()) + ") in "
                    + (first.getSheetName() == null ? "Sheet" : first.getSheetName()));
            String last = group.get(group.size() - 1).getCellAddress();
            if (first.getCellAddress() != null && last != null) {
                item.setCellRange(first.getCellAddress() + ":" + last);
            }
        }
        if (first.getSheetName() != null && first.getCellAddress() != null) {
            item.setAnchor(first.getSheetName() + "!" + first.getCellAddress());
        }
        return item;
    }

    private static String summarizeType(SmlChangeType type) {
        switch (type) {
            case CellAdded:
                return "Added";
            case CellDeleted:
                return "Deleted";
            case ValueChanged:
                return "Value";
            case FormulaChanged:
                return "Formula";
            case FormatChanged:
                return "Format";
            default:
                return "Changed";
        }
    }
}
