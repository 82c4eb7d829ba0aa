package com.example.redline.util.sml.signature;

/**
 * 名称定义（命名区域）
 */
public class DefinedNameSignature {

    private final String name;
    private final String value;
    /** localSheetId，工作簿级名称为 null */
    private final String localSheetId;

    public DefinedNameSignature(String name, String value, String localSheetId) {
        this.name = name;
        this.value = value == null ? "" : value;
        this.localSheetId = localSheetId;
    }

    /**
     * 比较用的键：工作表级名称带上 sheetId 区分同名
     */
    public String getKey() {
        return localSheetId == null ? name : name + "@" + localSheetId;
    }

    public String getName() { return name; }

    public String getValue() { return value; }

    public String getLocalSheetId() { return localSheetId; }
}
