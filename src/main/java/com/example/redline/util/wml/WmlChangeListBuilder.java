package com.example.redline.util.wml;

import com.example.redline.util.wml.dto.WmlChange;
import com.example.redline.util.wml.dto.WmlChangeDetails;
import com.example.redline.util.wml.dto.WmlChangeListItem;
import com.example.redline.util.wml.dto.WmlChangeListOptions;
import com.example.redline.util.wml.dto.WmlChangeType;
import com.example.redline.util.wml.dto.WmlWordCount;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 把提取出的变更整理成审阅侧栏用的列表
 */
public class WmlChangeListBuilder {

    private WmlChangeListBuilder() {
    }

    public static List<WmlChangeListItem> build(List<WmlChange> changes) {
        return build(changes, WmlChangeListOptions.defaults());
    }

    public static List<WmlChangeListItem> build(List<WmlChange> changes, WmlChangeListOptions options) {
        List<Merged> merged = options.isGroupAdjacentChanges() ? groupAdjacent(changes) : wrap(changes);
        List<WmlChangeListItem> items = new ArrayList<>();
        int i = 0;
        while (i < merged.size()) {
            Merged current = merged.get(i);
            Merged next = i + 1 < merged.size() ? merged.get(i + 1) : null;
            if (options.isMergeReplacements() && next != null
                    && current.change.getChangeType() == WmlChangeType.TextDeleted
                    && next.change.getChangeType() == WmlChangeType.TextInserted
                    && Objects.equals(current.change.getParagraphIndex(), next.change.getParagraphIndex())) {
                items.add(replacement(current, next, items.size() + 1, options.getMaxPreviewLength()));
                i += 2;
                continue;
            }
            items.add(toItem(current, items.size() + 1, options.getMaxPreviewLength()));
            i++;
        }
        return items;
    }

    /**
     * 分组后的变更：合并后的记录及其覆盖的修订 id
     */
    private static final class Merged {
        private final WmlChange change;
        private final List<Integer> revisionIds = new ArrayList<>();

        private Merged(WmlChange change) {
            this.change = change;
            this.revisionIds.add(change.getRevisionId());
        }
    }

    private static List<Merged> wrap(List<WmlChange> changes) {
        List<Merged> result = new ArrayList<>();
        for (WmlChange c : changes) {
            result.add(new Merged(c));
        }
        return result;
    }

    /**
     * 同一段落中类型、作者、日期相同且修订 id 连续的文本变更合为一条
     */
    private static List<Merged> groupAdjacent(List<WmlChange> changes) {
        List<Merged> result = new ArrayList<>();
        Merged last = null;
        for (WmlChange c : changes) {
            if (last != null && canGroup(last, c)) {
                WmlChange m = last.change;
                m.setOldText(concat(m.getOldText(), c.getOldText()));
                m.setNewText(concat(m.getNewText(), c.getNewText()));
                m.setWordCount(new WmlWordCount(ChangeExtractor.countWords(m.getOldText()),
                        ChangeExtractor.countWords(m.getNewText())));
                last.revisionIds.add(c.getRevisionId());
                continue;
            }
            last = new Merged(copyOf(c));
            result.add(last);
        }
        return result;
    }

    private static boolean canGroup(Merged last, WmlChange c) {
        WmlChange prev = last.change;
        WmlChangeType type = c.getChangeType();
        if (type != WmlChangeType.TextInserted && type != WmlChangeType.TextDeleted) {
            return false;
        }
        int lastId = last.revisionIds.get(last.revisionIds.size() - 1);
        return prev.getChangeType() == type
                && Objects.equals(prev.getParagraphIndex(), c.getParagraphIndex())
                && Objects.equals(prev.getAuthor(), c.getAuthor())
                && Objects.equals(prev.getDateTime(), c.getDateTime())
                && c.getRevisionId() == lastId + 1;
    }

    private static String concat(String a, String b) {
        if (a == null) {
            return b;
        }
        return b == null ? a : a + b;
    }

    private static WmlChange copyOf(WmlChange c) {
        WmlChange copy = new WmlChange();
        copy.setChangeType(c.getChangeType());
        copy.setRevisionId(c.getRevisionId());
        copy.setParagraphIndex(c.getParagraphIndex());
        copy.setTableRowIndex(c.getTableRowIndex());
        copy.setTableCellIndex(c.getTableCellIndex());
        copy.setOldText(c.getOldText());
        copy.setNewText(c.getNewText());
        copy.setWordCount(c.getWordCount());
        copy.setFormatDescription(c.getFormatDescription());
        copy.setAuthor(c.getAuthor());
        copy.setDateTime(c.getDateTime());
        copy.setInFootnote(c.isInFootnote());
        copy.setInEndnote(c.isInEndnote());
        copy.setInTable(c.isInTable());
        copy.setInTextbox(c.isInTextbox());
        return copy;
    }

    // ==================== 列表项 ====================

    private static WmlChangeListItem replacement(Merged deleted, Merged inserted, int index, int maxPreview) {
        WmlChange del = deleted.change;
        WmlChange ins = inserted.change;
        String oldText = del.getOldText() == null ? "" : del.getOldText();
        String newText = ins.getNewText() == null ? "" : ins.getNewText();

        WmlChangeListItem item = new WmlChangeListItem();
        item.setId("change-" + index);
        item.setChangeType(WmlChangeType.TextReplaced);
        item.setSummary("Replaced");
        item.setPreviewText(truncate(oldText, maxPreview / 2) + " → " + truncate(newText, maxPreview / 2));
        item.setWordCount(new WmlWordCount(
                del.getWordCount() == null ? 0 : del.getWordCount().getDeleted(),
                ins.getWordCount() == null ? 0 : ins.getWordCount().getInserted()));
        item.setParagraphIndex(del.getParagraphIndex());
        item.setRevisionId(del.getRevisionId());
        List<Integer> ids = new ArrayList<>(deleted.revisionIds);
        ids.addAll(inserted.revisionIds);
        item.setRevisionIds(ids);
        item.setAnchor("revision-" + del.getRevisionId());

        WmlChangeDetails details = new WmlChangeDetails();
        details.setOldText(del.getOldText());
        details.setNewText(ins.getNewText());
        details.setAuthor(del.getAuthor());
        details.setDateTime(del.getDateTime());
        details.setLocationContext(locationContext(del));
        item.setDetails(details);
        return item;
    }

    private static WmlChangeListItem toItem(Merged merged, int index, int maxPreview) {
        WmlChange c = merged.change;
        String preview = c.getNewText() != null ? c.getNewText() : c.getOldText() != null ? c.getOldText() : "";

        WmlChangeListItem item = new WmlChangeListItem();
        item.setId("change-" + index);
        item.setChangeType(c.getChangeType());
        item.setSummary(summarize(c.getChangeType()));
        item.setPreviewText(truncate(preview, maxPreview));
        item.setWordCount(c.getWordCount());
        item.setParagraphIndex(c.getParagraphIndex());
        item.setRevisionId(c.getRevisionId());
        item.setRevisionIds(new ArrayList<>(merged.revisionIds));
        item.setAnchor("revision-" + c.getRevisionId());

        WmlChangeDetails details = new WmlChangeDetails();
        details.setOldText(c.getOldText());
        details.setNewText(c.getNewText());
        details.setFormatDescription(c.getFormatDescription());
        details.setAuthor(c.getAuthor());
        details.setDateTime(c.getDateTime());
        details.setLocationContext(locationContext(c));
        item.setDetails(details);
        return item;
    }

    static String summarize(WmlChangeType type) {
        switch (type) {
            case TextInserted:
                return "Inserted";
            case TextDeleted:
                return "Deleted";
            case TextReplaced:
                return "Replaced";
            case ParagraphInserted:
                return "Paragraph inserted";
            case ParagraphDeleted:
                return "Paragraph deleted";
            case FormatChanged:
                return "Format changed";
            case TableRowInserted:
                return "Table row inserted";
            case TableRowDeleted:
                return "Table row deleted";
            case TableCellChanged:
                return "Table cell changed";
            case ImageInserted:
                return "Image inserted";
            case ImageDeleted:
                return "Image deleted";
            case ImageReplaced:
                return "Image replaced";
            case NoteChanged:
                return "Note changed";
            case MovedFrom:
                return "Moved from";
            case MovedTo:
                return "Moved to";
            default:
                return type.name();
        }
    }

    /**
     * 位置说明，如 "In footnote, In table"；没有任何标记时返回 null
     */
    static String locationContext(WmlChange c) {
        List<String> parts = new ArrayList<>();
        if (c.isInFootnote()) {
            parts.add("In footnote");
        }
        if (c.isInEndnote()) {
            parts.add("In endnote");
        }
        if (c.isInTable()) {
            parts.add("In table");
        }
        if (c.isInTextbox()) {
            parts.add("In textbox");
        }
        return parts.isEmpty() ? null : String.join(", ", parts);
    }

    static String truncate(String text, int max) {
        if (text.length() <= max) {
            return text;
        }
        if (max <= 3) {
            return "...";
        }
        return text.substring(0, max - 3) + "...";
    }

    /**
     * 列表项覆盖的全部修订 id
     */
    public static List<Integer> revisionIdsOf(List<WmlChangeListItem> items) {
        List<Integer> ids = new ArrayList<>();
        for (WmlChangeListItem item : items) {
            ids.addAll(item.getRevisionIds());
        }
        Collections.sort(ids);
        return ids;
    }
}
