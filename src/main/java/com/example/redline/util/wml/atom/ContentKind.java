package com.example.redline.util.wml.atom;

/**
 * 原子内容类别
 */
public enum ContentKind {
    TEXT,
    PARAGRAPH_MARK,
    BREAK,
    TAB,
    DRAWING,
    PICTURE,
    MATH,
    FOOTNOTE_REFERENCE,
    ENDNOTE_REFERENCE,
    FIELD_BEGIN,
    FIELD_SEPARATOR,
    FIELD_END,
    SIMPLE_FIELD,
    SYMBOL,
    OBJECT,
    UNKNOWN;

    /**
     * 原子身份哈希的前缀
     */
    String hashPrefix() {
        switch (this) {
            case TEXT:
                return "t";
            case PARAGRAPH_MARK:
                return "pPr";
            case BREAK:
                return "br";
            case TAB:
                return "tab";
            case DRAWING:
                return "drawing";
            case PICTURE:
                return "pict";
            case MATH:
                return "math";
            case FOOTNOTE_REFERENCE:
                return "footnoteRef";
            case ENDNOTE_REFERENCE:
                return "endnoteRef";
            case FIELD_BEGIN:
                return "fldBegin";
            case FIELD_SEPARATOR:
                return "fldSep";
            case FIELD_END:
                return "fldEnd";
            case SIMPLE_FIELD:
                return "fldSimple";
            case SYMBOL:
                return "sym";
            case OBJECT:
                return "object";
            default:
                return "unknown";
        }
    }

    /**
     * 是否单独成词（段落标记、图片、制表符、域等非文本原子）
     */
    public boolean isWordBreak() {
        return this != TEXT && this != UNKNOWN;
    }
}
