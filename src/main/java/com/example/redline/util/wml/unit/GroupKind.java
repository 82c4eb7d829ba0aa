package com.example.redline.util.wml.unit;

/**
 * 分组类别，对应 w:p / w:tbl / w:tr / w:tc / w:txbxContent
 */
public enum GroupKind {
    PARAGRAPH("p"),
    TABLE("tbl"),
    ROW("tr"),
    CELL("tc"),
    TEXTBOX("txbxContent");

    private final String localName;

    GroupKind(String localName) {
        this.localName = localName;
    }

    public String getLocalName() {
        return localName;
    }

    public static GroupKind fromLocalName(String localName) {
        for (GroupKind k : values()) {
            if (k.localName.equals(localName)) {
                return k;
            }
        }
        return null;
    }
}
