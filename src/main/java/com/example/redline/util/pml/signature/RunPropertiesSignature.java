package com.example.redline.util.pml.signature;

import java.util.Objects;

/**
 * a:rPr 中参与比较的属性
 */
public class RunPropertiesSignature {

    private boolean bold;
    private boolean italic;
    private boolean underline;
    private boolean strikethrough;
    private String fontName;
    /** 百分之一磅 */
    private Integer fontSize;
    /** RRGGBB */
    private String fontColor;

    public boolean isBold() { return bold; }
    public void setBold(boolean bold) { this.bold = bold; }

    public boolean isItalic() { return italic; }
    public void setItalic(boolean italic) { this.italic = italic; }

    public boolean isUnderline() { return underline; }
    public void setUnderline(boolean underline) { this.underline = underline; }

    public boolean isStrikethrough() { return strikethrough; }
    public void setStrikethrough(boolean strikethrough) { this.strikethrough = strikethrough; }

    public String getFontName() { return fontName; }
    public void setFontName(String fontName) { this.fontName = fontName; }

    public Integer getFontSize() { return fontSize; }
    public void setFontSize(Integer fontSize) { this.fontSize = fontSize; }

    public String getFontColor() { return fontColor; }
    public void setFontColor(String fontColor) { this.fontColor = fontColor; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RunPropertiesSignature)) {
            return false;
        }
        RunPropertiesSignature that = (RunPropertiesSignature) o;
        return bold == that.bold && italic == that.italic && underline == that.underline
                && strikethrough == that.strikethrough && Objects.equals(fontName, that.fontName)
                && Objects.equals(fontSize, that.fontSize) && Objects.equals(fontColor, that.fontColor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bold, italic, underline, strikethrough, fontName, fontSize, fontColor);
    }
}
