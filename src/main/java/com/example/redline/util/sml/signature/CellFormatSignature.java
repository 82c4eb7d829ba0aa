package com.example.redline.util.sml.signature;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 单元格格式签名
 *
 * 把样式索引展开为完整的数字格式、字体、填充、边框、对齐字段，格式是否相同只需比较值。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CellFormatSignature {

    @JsonProperty("number_format_code")
    private String numberFormatCode = "General";

    private boolean bold;
    private boolean italic;
    private boolean underline;
    private boolean strikethrough;

    @JsonProperty("font_name")
    private String fontName = "Calibri";

    @JsonProperty("font_size")
    private Double fontSize = 11.0;

    @JsonProperty("font_color")
    private String fontColor;

    @JsonProperty("fill_pattern")
    private String fillPattern;

    @JsonProperty("fill_foreground_color")
    private String fillForegroundColor;

    @JsonProperty("fill_background_color")
    private String fillBackgroundColor;

    @JsonProperty("border_left_style")
    private String borderLeftStyle;
    @JsonProperty("border_left_color")
    private String borderLeftColor;
    @JsonProperty("border_right_style")
    private String borderRightStyle;
    @JsonProperty("border_right_color")
    private String borderRightColor;
    @JsonProperty("border_top_style")
    private String borderTopStyle;
    @JsonProperty("border_top_color")
    private String borderTopColor;
    @JsonProperty("border_bottom_style")
    private String borderBottomStyle;
    @JsonProperty("border_bottom_color")
    private String borderBottomColor;

    @JsonProperty("horizontal_alignment")
    private String horizontalAlignment = "general";

    @JsonProperty("vertical_alignment")
    private String verticalAlignment = "bottom";

    @JsonProperty("wrap_text")
    private boolean wrapText;

    private Integer indent;

    /**
     * 相对 older 的差异描述（当前对象为新格式）
     */
    public String getDifferenceDescription(CellFormatSignature older) {
        if (this.equals(older)) {
            return "No difference";
        }
        List<String> diffs = new ArrayList<>();
        if (!Objects.equals(numberFormatCode, older.numberFormatCode)) {
            diffs.add("Number format: '" + older.numberFormatCode + "' → '" + numberFormatCode + "'");
        }
        if (bold != older.bold) {
            diffs.add(bold ? "Made bold" : "Removed bold");
        }
        if (italic != older.italic) {
            diffs.add(italic ? "Made italic" : "Removed italic");
        }
        if (underline != older.underline) {
            diffs.add(underline ? "Added underline" : "Removed underline");
        }
        if (strikethrough != older.strikethrough) {
            diffs.add(strikethrough ? "Added strikethrough" : "Removed strikethrough");
        }
        if (!Objects.equals(fontName, older.fontName)) {
            diffs.add("Font: '" + older.fontName + "' → '" + fontName + "'");
        }
        if (!Objects.equals(fontSize, older.fontSize)) {
            diffs.add("Size: " + older.fontSize + " → " + fontSize);
        }
        if (!Objects.equals(fontColor, older.fontColor)) {
            diffs.add("Font color: " + older.fontColor + " → " + fontColor);
        }
        if (!Objects.equals(fillForegroundColor, older.fillForegroundColor)) {
            diffs.add("Fill color: " + older.fillForegroundColor + " → " + fillForegroundColor);
        }
        if (!Objects.equals(horizontalAlignment, older.horizontalAlignment)) {
            diffs.add("Horizontal align: " + older.horizontalAlignment + " → " + horizontalAlignment);
        }
        if (!Objects.equals(verticalAlignment, older.verticalAlignment)) {
            diffs.add("Vertical align: " + older.verticalAlignment + " → " + verticalAlignment);
        }
        if (wrapText != older.wrapText) {
            diffs.add(wrapText ? "Enabled wrap text" : "Disabled wrap text");
        }
        return diffs.isEmpty() ? "Minor formatting change" : String.join("; ", diffs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellFormatSignature)) {
            return false;
        }
        CellFormatSignature that = (CellFormatSignature) o;
        return bold == that.bold
                && italic == that.italic
                && underline == that.underline
                && strikethrough == that.strikethrough
                && wrapText == that.wrapText
                && Objects.equals(numberFormatCode, that.numberFormatCode)
                && Objects.equals(fontName, that.fontName)
                && Objects.equals(fontSize, that.fontSize)
                && Objects.equals(fontColor, that.fontColor)
                && Objects.equals(fillPattern, that.fillPattern)
                && Objects.equals(fillForegroundColor, that.fillForegroundColor)
                && Objects.equals(fillBackgroundColor, that.fillBackgroundColor)
                && Objects.equals(borderLeftStyle, that.borderLeftStyle)
                && Objects.equals(borderLeftColor, that.borderLeftColor)
                && Objects.equals(borderRightStyle, that.borderRightStyle)
                && Objects.equals(borderRightColor, that.borderRightColor)
                && Objects.equals(borderTopStyle, that.borderTopStyle)
                && Objects.equals(borderTopColor, that.borderTopColor)
                && Objects.equals(borderBottomStyle, that.borderBottomStyle)
                && Objects.equals(borderBottomColor, that.borderBottomColor)
                && Objects.equals(horizontalAlignment, that.horizontalAlignment)
                && Objects.equals(verticalAlignment, that.verticalAlignment)
                && Objects.equals(indent, that.indent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numberFormatCode, bold, italic, underline, strikethrough, fontName, fontSize,
                fontColor, fillPattern, fillForegroundColor, fillBackgroundColor, borderLeftStyle, borderRightStyle,
                borderTopStyle, borderBottomStyle, horizontalAlignment, verticalAlignment, wrapText, indent);
    }

    public String getNumberFormatCode() { return numberFormatCode; }
    public void setNumberFormatCode(String numberFormatCode) { this.numberFormatCode = numberFormatCode; }

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

    public Double getFontSize() { return fontSize; }
    public void setFontSize(Double fontSize) { this.fontSize = fontSize; }

    public String getFontColor() { return fontColor; }
    public void setFontColor(String fontColor) { this.fontColor = fontColor; }

    public String getFillPattern() { return fillPattern; }
    public void setFillPattern(String fillPattern) { this.fillPattern = fillPattern; }

    public String getFillForegroundColor() { return fillForegroundColor; }
    public void setFillForegroundColor(String fillForegroundColor) { this.fillForegroundColor = fillForegroundColor; }

    public String getFillBackgroundColor() { return fillBackgroundColor; }
    public void setFillBackgroundColor(String fillBackgroundColor) { this.fillBackgroundColor = fillBackgroundColor; }

    public String getBorderLeftStyle() { return borderLeftStyle; }
    public void setBorderLeftStyle(String borderLeftStyle) { this.borderLeftStyle = borderLeftStyle; }

    public String getBorderLeftColor() { return borderLeftColor; }
    public void setBorderLeftColor(String borderLeftColor) { this.borderLeftColor = borderLeftColor; }

    public String getBorderRightStyle() { return borderRightStyle; }
    public void setBorderRightStyle(String borderRightStyle) { this.borderRightStyle = borderRightStyle; }

    public String getBorderRightColor() { return borderRightColor; }
    public void setBorderRightColor(String borderRightColor) { this.borderRightColor = borderRightColor; }

    public String getBorderTopStyle() { return borderTopStyle; }
    public void setBorderTopStyle(String borderTopStyle) { this.borderTopStyle = borderTopStyle; }

    public String getBorderTopColor() { return borderTopColor; }
    public void setBorderTopColor(String borderTopColor) { this.borderTopColor = borderTopColor; }

    public String getBorderBottomStyle() { return borderBottomStyle; }
    public void setBorderBottomStyle(String borderBottomStyle) { this.borderBottomStyle = borderBottomStyle; }

    public String getBorderBottomColor() { return borderBottomColor; }
    public void setBorderBottomColor(String borderBottomColor) { this.borderBottomColor = borderBottomColor; }

    public String getHorizontalAlignment() { return horizontalAlignment; }
    public void setHorizontalAlignment(String horizontalAlignment) { this.horizontalAlignment = horizontalAlignment; }

    public String getVerticalAlignment() { return verticalAlignment; }
    public void setVerticalAlignment(String verticalAlignment) { this.verticalAlignment = verticalAlignment; }

    public boolean isWrapText() { return wrapText; }
    public void setWrapText(boolean wrapText) { this.wrapText = wrapText; }

    public Integer getIndent() { return indent; }
    public void setIndent(Integer indent) { this.indent = indent; }
}
