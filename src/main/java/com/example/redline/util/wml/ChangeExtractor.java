package com.example.redline.util.wml;

import com.example.redline.util.wml.dto.WmlChange;
import com.example.redline.util.wml.dto.WmlChangeType;
import com.example.redline.util.wml.dto.WmlWordCount;
import com.example.redline.util.xml.XmlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * 从带修订标记的文档中提取变更列表
 *
 * 按文档顺序遍历，记录段落序号、表格行 / 单元格序号以及是否位于脚注、尾注、表格、文本框中。
 * w:ins / w:del / w:rPrChange / w:pPrChange 各产生一条变更，不再深入其内部。
 */
@Slf4j
public class ChangeExtractor {

    private final String defaultAuthor;
    private final String defaultDate;
    private final List<WmlChange> changes = new ArrayList<>();

    // —— 遍历上下文 —— //
    private int paragraphIndex;
    private Integer tableRowIndex;
    private Integer tableCellIndex;
    private int tableDepth;
    private boolean inFootnote;
    private boolean inEndnote;
    private boolean inTextbox;

    private ChangeExtractor(String defaultAuthor, String defaultDate) {
        this.defaultAuthor = defaultAuthor;
        this.defaultDate = defaultDate;
    }

    public static List<WmlChange> extract(Element root) {
        return extract(root, null, null);
    }

    /**
     * @param defaultAuthor 修订元素没有 w:author 时使用
     * @param defaultDate   修订元素没有 w:date 时使用
     */
    public static List<WmlChange> extract(Element root, String defaultAuthor, String defaultDate) {
        List<Element> roots = new ArrayList<>();
        roots.add(root);
        return extractAll(roots, defaultAuthor, defaultDate);
    }

    /**
     * 依次遍历多个根（正文、脚注、尾注），段落序号连续计数
     */
    public static List<WmlChange> extractAll(List<Element> roots, String defaultAuthor, String defaultDate) {
        ChangeExtractor extractor = new ChangeExtractor(defaultAuthor, defaultDate);
        for (Element root : roots) {
            if (root != null) {
                extractor.walk(root);
            }
        }
        log.debug("提取变更: {}", extractor.changes.size());
        return extractor.changes;
    }

    private void walk(Element el) {
        String name = el.tagName();
        switch (name) {
            case "w:p":
                paragraphIndex++;
                break;
            case "w:tbl":
                tableDepth++;
                tableRowIndex = null;
                break;
            case "w:tr":
                tableRowIndex = tableRowIndex == null ? 0 : tableRowIndex + 1;
                tableCellIndex = null;
                break;
            case "w:tc":
                tableCellIndex = tableCellIndex == null ? 0 : tableCellIndex + 1;
                break;
            case "w:txbxContent":
                inTextbox = true;
                break;
            case "w:footnote":
                inFootnote = true;
                break;
            case "w:endnote":
                inEndnote = true;
                break;
            default:
                break;
        }

        switch (name) {
            case "w:ins":
            case "w:del":
                changes.add(fromInsOrDel(el));
                return;
            case "w:rPrChange":
            case "w:pPrChange":
                changes.add(fromFormatChange(el));
                return;
            default:
                break;
        }

        for (Element child : el.children()) {
            walk(child);
        }

        switch (name) {
            case "w:tbl":
                tableDepth--;
                tableRowIndex = null;
                tableCellIndex = null;
                break;
            case "w:txbxContent":
                inTextbox = false;
                break;
            case "w:footnote":
                inFootnote = false;
                break;
            case "w:endnote":
                inEndnote = false;
                break;
            default:
                break;
        }
    }

    // ==================== 变更记录 ====================

    private WmlChange fromInsOrDel(Element el) {
        boolean insertion = el.tagName().equals("w:ins");
        Element parent = el.parent();
        String parentName = parent == null ? "" : parent.tagName();
        WmlChange change = newChange(el);

        if (parentName.equals("w:trPr")) {
            change.setChangeType(insertion ? WmlChangeType.TableRowInserted : WmlChangeType.TableRowDeleted);
        } else if (parentName.equals("w:rPr") && parent.parent() != null
                && parent.parent().tagName().equals("w:pPr")) {
            change.setChangeType(insertion ? WmlChangeType.ParagraphInserted : WmlChangeType.ParagraphDeleted);
        } else {
            String text = insertion ? XmlUtils.collectText(el, "w:t") : deletedText(el);
            boolean image = text.isEmpty() && hasImage(el);
            if (insertion) {
                change.setChangeType(image ? WmlChangeType.ImageInserted : WmlChangeType.TextInserted);
                change.setNewText(text);
                change.setWordCount(new WmlWordCount(0, countWords(text)));
            } else {
                change.setChangeType(image ? WmlChangeType.ImageDeleted : WmlChangeType.TextDeleted);
                change.setOldText(text);
                change.setWordCount(new WmlWordCount(countWords(text), 0));
            }
        }
        return change;
    }

    private WmlChange fromFormatChange(Element el) {
        WmlChange change = newChange(el);
        change.setChangeType(WmlChangeType.FormatChanged);
        String description = "Format changed";
        if (el.tagName().equals("w:rPrChange")) {
            String before = FormattingReconciler.describe(XmlUtils.child(el, "w:rPr"));
            String after = FormattingReconciler.describe(el.parent());
            if (!before.equals(after)) {
                description = "Format changed: " + (before.isEmpty() ? "(none)" : before) + " → "
                        + (after.isEmpty() ? "(none)" : after);
            }
        }
        change.setFormatDescription(description);
        return change;
    }

    private WmlChange newChange(Element revision) {
        WmlChange change = new WmlChange();
        String id = XmlUtils.attr(revision, "w:id");
        change.setRevisionId(parseId(id));
        String author = XmlUtils.attr(revision, "w:author");
        String date = XmlUtils.attr(revision, "w:date");
        change.setAuthor(author != null ? author : defaultAuthor);
        change.setDateTime(date != null ? date : defaultDate);
        change.setParagraphIndex(paragraphIndex);
        change.setTableRowIndex(tableRowIndex);
        change.setTableCellIndex(tableCellIndex);
        change.setInTable(tableDepth > 0);
        change.setInFootnote(inFootnote);
        change.setInEndnote(inEndnote);
        change.setInTextbox(inTextbox);
        return change;
    }

    private static int parseId(String id) {
        if (id == null) {
            return 0;
        }
        try {
            return Integer.parseInt(id.trim());
        } catch (NumberFormatException e) {
            log.debug("修订 id 不是整数: {}", id);
            return 0;
        }
    }

    private static String deletedText(Element del) {
        StringBuilder sb = new StringBuilder();
        for (Element el : del.getAllElements()) {
            String name = el.tagName();
            if (name.equals("w:delText") || name.equals("w:t")) {
                sb.append(XmlUtils.ownText(el));
            }
        }
        return sb.toString();
    }

    private static boolean hasImage(Element el) {
        return XmlUtils.firstDescendant(el, "w:drawing") != null || XmlUtils.firstDescendant(el, "w:pict") != null;
    }

    /**
     * 按空白切分的词数
     */
    static int countWords(String text) {
        if (text == null) {
            return 0;
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
