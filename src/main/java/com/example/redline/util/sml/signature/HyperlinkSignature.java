package com.example.redline.util.sml.signature;

/**
 * 超链接签名：外部链接取关系目标，内部链接取 location
 */
public class HyperlinkSignature {

    private final String cellAddress;
    private final String target;
    private final String display;
    private final String tooltip;

    public HyperlinkSignature(String cellAddress, String target, String display, String tooltip) {
        this.cellAddress = cellAddress;
        this.target = target == null ? "" : target;
        this.display = display;
        this.tooltip = tooltip;
    }

    public String computeHash() {
        return target + "|" + (display == null ? "" : display);
    }

    public String getCellAddress() { return cellAddress; }

    public String getTarget() { return target; }

    public String getDisplay() { return display; }

    public String getTooltip() { return tooltip; }
}
