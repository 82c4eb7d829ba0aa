package com.example.redline.model;

import java.util.Locale;

/**
 * 支持比对的文档类型，按扩展名判断
 */
public enum DocumentType {

    WORD(".docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
    EXCEL(".xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"),
    POWERPOINT(".pptx", "application/vnd.openxmlformats-officedocument.presentationml.presentation");

    private final String extension;
    private final String mediaType;

    DocumentType(String extension, String mediaType) {
        this.extension = extension;
        this.mediaType = mediaType;
    }

    public String getExtension() {
        return extension;
    }

    public String getMediaType() {
        return mediaType;
    }

    /**
     * @return 不支持的扩展名返回 null
     */
    public static DocumentType fromFileName(String fileName) {
        if (fileName == null) {
            return null;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (DocumentType type : values()) {
            if (lower.endsWith(type.extension)) {
                return type;
            }
        }
        return null;
    }
}
