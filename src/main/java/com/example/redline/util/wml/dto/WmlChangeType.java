package com.example.redline.util.wml.dto;

/**
 * Word 变更类型
 */
public enum WmlChangeType {
    TextInserted,
    TextDeleted,
    /** 同一段落中相邻的删除 + 插入 */
    TextReplaced,
    ParagraphInserted,
    ParagraphDeleted,
    FormatChanged,
    TableRowInserted,
    TableRowDeleted,
    TableCellChanged,
    MovedFrom,
    MovedTo,
    NoteChanged,
    ImageInserted,
    ImageDeleted,
    ImageReplaced
}
