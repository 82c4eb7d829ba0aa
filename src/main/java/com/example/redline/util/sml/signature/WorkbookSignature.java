package com.example.redline.util.sml.signature;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 工作簿签名：工作表按工作簿中的顺序保存
 */
public class WorkbookSignature {

    private final Map<String, WorksheetSignature> sheets = new LinkedHashMap<>();
    private final Map<String, DefinedNameSignature> definedNames = new TreeMap<>();

    public void addSheet(WorksheetSignature sheet) {
        sheets.put(sheet.getName(), sheet);
    }

    public void addDefinedName(DefinedNameSignature name) {
        definedNames.put(name.getKey(), name);
    }

    public Map<String, WorksheetSignature> getSheets() { return sheets; }

    public Map<String, DefinedNameSignature> getDefinedNames() { return definedNames; }
}
