package com.example.redline.util.wml.lcs;

/**
 * 相关性状态
 */
public enum CorrelationStatus {
    NIL,
    NORMAL,
    UNKNOWN,
    EQUAL,
    INSERTED,
    DELETED,
    FORMAT_CHANGED,
    GROUP;

    /**
     * 写入 pt14:Status 的标记文本
     */
    public String markerText() {
        switch (this) {
            case INSERTED:
                return "Inserted";
            case DELETED:
                return "Deleted";
            case FORMAT_CHANGED:
                return "FormatChanged";
            default:
                return "Equal";
        }
    }

    public static CorrelationStatus fromMarker(String marker) {
        if ("Inserted".equals(marker)) {
            return INSERTED;
        }
        if ("Deleted".equals(marker)) {
            return DELETED;
        }
        if ("FormatChanged".equals(marker)) {
            return FORMAT_CHANGED;
        }
        return EQUAL;
    }
}
