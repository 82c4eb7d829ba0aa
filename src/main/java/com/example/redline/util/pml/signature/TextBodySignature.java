package com.example.redline.util.pml.signature;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 文本框内容（p:txBody / a:txBody）
 */
public class TextBodySignature {

    private final List<ParagraphSignature> paragraphs = new ArrayList<>();

    public void addParagraph(ParagraphSignature paragraph) {
        paragraphs.add(paragraph);
    }

    /**
     * 段落之间用换行连接
     */
    public String getPlainText() {
        List<String> lines = new ArrayList<>();
        for (ParagraphSignature p : paragraphs) {
            lines.add(p.getPlainText());
        }
        return String.join("\n", lines);
    }

    /**
     * 文字相同时是否有格式差异（对齐、项目符号、段数、各段属性）
     */
    public boolean hasFormattingChanges(TextBodySignature other) {
        if (paragraphs.size() != other.paragraphs.size()) {
            return true;
        }
        for (int i = 0; i < paragraphs.size(); i++) {
            ParagraphSignature p1 = paragraphs.get(i);
            ParagraphSignature p2 = other.paragraphs.get(i);
            if (!Objects.equals(p1.getAlignment(), p2.getAlignment()) || p1.isHasBullet() != p2.isHasBullet()) {
                return true;
            }
            if (p1.getRuns().size() != p2.getRuns().size()) {
                return true;
            }
            for (int j = 0; j < p1.getRuns().size(); j++) {
                if (!Objects.equals(p1.getRuns().get(j).getProperties(), p2.getRuns().get(j).getProperties())) {
                    return true;
                }
            }
        }
        return false;
    }

    public List<ParagraphSignature> getParagraphs() { return paragraphs; }
}
