package com.example.redline.util.sml;

import com.example.redline.exception.RedlineException;
import com.example.redline.util.ooxml.OoxmlPackage;
import com.example.redline.util.sml.dto.SmlChange;
import com.example.redline.util.sml.dto.SmlChangeType;
import com.example.redline.util.xml.XmlUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.util.CellReference;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 按变更列表修改工作簿单元格
 *
 * apply 作用在旧工作簿上，把值、公式、增删的单元格改成新版本；
 * revert 作用在新工作簿（或比对结果）上，把它们恢复成旧版本。
 * 只处理 ValueChanged、FormulaChanged、CellAdded、CellDeleted，其余类型忽略。
 */
@Slf4j
public class SmlPatcher {

    private SmlPatcher() {
    }

    public static byte[] apply(byte[] older, List<SmlChange> changes) {
        return patch(older, changes, null, false);
    }

    /**
     * @param ids 只处理这些变更 id，为 null 时处理全部
     */
    public static byte[] apply(byte[] older, List<SmlChange> changes, Set<String> ids) {
        return patch(older, changes, ids, false);
    }

    public static byte[] revert(byte[] newer, List<SmlChange> changes) {
        return patch(newer, changes, null, true);
    }

    public static byte[] revert(byte[] newer, List<SmlChange> changes, Set<String> ids) {
        return patch(newer, changes, ids, true);
    }

    private static byte[] patch(byte[] bytes, List<SmlChange> changes, Set<String> ids, boolean revert) {
        try (OoxmlPackage pkg = OoxmlPackage.open(bytes)) {
            String workbookPath = pkg.getMainDocumentPath();
            Map<String, String> sheets = sheetPaths(pkg, workbookPath);

            // 变更里的工作表名是新名字，旧工作簿上要换回改名前的名字
            Map<String, String> oldNames = new HashMap<>();
            if (!revert) {
                for (SmlChange c : changes) {
                    if (c.getChangeType() == SmlChangeType.SheetRenamed) {
                        oldNames.put(c.getSheetName(), c.getOldSheetName());
                    }
                }
            }

            Map<String, Document> touched = new LinkedHashMap<>();
            int applied = 0;
            boolean formulas = false;
            for (SmlChange change : changes) {
                if (!isPatchable(change) || (ids != null && !ids.contains(change.getId()))) {
                    continue;
                }
                String sheetName = oldNames.getOrDefault(change.getSheetName(), change.getSheetName());
                String sheetPath = sheets.get(sheetName);
                if (sheetPath == null) {
                    log.warn("工作表不存在，跳过变更 {}: {}", change.getId(), sheetName);
                    continue;
                }
                Document doc = touched.get(sheetPath);
                if (doc == null) {
                    doc = pkg.getXmlPart(sheetPath);
                    touched.put(sheetPath, doc);
                }
                formulas |= patchCell(doc, sheetPath, change, revert);
                applied++;
            }

            for (Map.Entry<String, Document> entry : touched.entrySet()) {
                pkg.putXmlPart(entry.getKey(), entry.getValue());
            }
            // 公式单元格变了，计算链作废，由 Excel 重建
            if (formulas) {
                pkg.removeRelatedParts(workbookPath, OoxmlPackage.REL_CALC_CHAIN);
            }
            log.debug("{} 单元格变更 {} 条", revert ? "撤销" : "应用", applied);
            return pkg.save();
        }
    }

    static boolean isPatchable(SmlChange change) {
        SmlChangeType type = change.getChangeType();
        return change.getCellAddress() != null
                && (type == SmlChangeType.ValueChanged || type == SmlChangeType.FormulaChanged
                || type == SmlChangeType.CellAdded || type == SmlChangeType.CellDeleted);
    }

    private static Map<String, String> sheetPaths(OoxmlPackage pkg, String workbookPath) {
        Map<String, String> result = new LinkedHashMap<>();
        Element workbook = XmlUtils.rootElement(pkg.getXmlPart(workbookPath));
        for (Element sheet : XmlUtils.children(XmlUtils.child(workbook, "sheets"), "sheet")) {
            String path = pkg.resolveRelationshipTarget(workbookPath, XmlUtils.attr(sheet, "r:id"));
            if (path != null) {
                result.put(XmlUtils.attr(sheet, "name"), path);
            }
        }
        return result;
    }

    /**
     * 修改一个单元格，返回是否涉及公式
     */
    private static boolean patchCell(Document doc, String sheetPath, SmlChange change, boolean revert) {
        SmlChangeType type = change.getChangeType();
        boolean remove = (type == SmlChangeType.CellDeleted && !revert) || (type == SmlChangeType.CellAdded && revert);
        String value = revert ? change.getOldValue() : change.getNewValue();
        String formula = revert ? change.getOldFormula() : change.getNewFormula();

        Element sheetData = XmlUtils.child(XmlUtils.rootElement(doc), "sheetData");
        if (sheetData == null) {
            throw RedlineException.invalidPackage(sheetPath, "工作表缺少 sheetData");
        }
        CellReference ref;
        try {
            ref = new CellReference(change.getCellAddress());
        } catch (IllegalArgumentException e) {
            throw RedlineException.invalidPackage(sheetPath, "非法单元格地址: " + change.getCellAddress());
        }
        String address = ref.formatAsString();

        if (remove) {
            Element cell = findCell(sheetData, ref);
            boolean hadFormula = false;
            if (cell != null) {
                hadFormula = XmlUtils.child(cell, "f") != null;
                cell.remove();
            }
            return hadFormula;
        }

        Element row = findOrCreateRow(sheetData, ref.getRow() + 1);
        Element cell = findCell(sheetData, ref);
        if (cell == null) {
            cell = XmlUtils.newElement("c", "r", address);
            insertCell(row, cell, ref.getCol());
        }
        boolean hadFormula = XmlUtils.child(cell, "f") != null;
        writeCell(cell, value, formula);
        return hadFormula || formula != null;
    }

    /**
     * 重写单元格内容，保留样式 s
     */
    static void writeCell(Element cell, String value, String formula) {
        for (Element child : new ArrayList<>(cell.children())) {
            child.remove();
        }
        cell.removeAttr("t");
        if (formula != null) {
            Element f = XmlUtils.newElement("f");
            XmlUtils.setText(f, formula);
            cell.appendChild(f);
        }
        if (value == null) {
            return;
        }
        if (isNumeric(value)) {
            cell.appendChild(valueElement(value));
        } else if ("TRUE".equals(value) || "FALSE".equals(value)) {
            XmlUtils.setAttr(cell, "t", "b");
            cell.appendChild(valueElement("TRUE".equals(value) ? "1" : "0"));
        } else if (formula != null) {
            XmlUtils.setAttr(cell, "t", "str");
            cell.appendChild(valueElement(value));
        } else {
            XmlUtils.setAttr(cell, "t", "inlineStr");
            Element is = XmlUtils.newElement("is");
            Element t = XmlUtils.newElement("t");
            XmlUtils.setAttr(t, "xml:space", "preserve");
            XmlUtils.setText(t, value);
            is.appendChild(t);
            cell.appendChild(is);
        }
    }

    private static Element valueElement(String text) {
        Element v = XmlUtils.newElement("v");
        XmlUtils.setText(v, text);
        return v;
    }

    private static boolean isNumeric(String value) {
        if (value.isEmpty() || !Character.isDigit(value.charAt(value.length() - 1))) {
            return false;
        }
        try {
            Double.parseDouble(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    // —— 行列定位 —— //

    private static Element findCell(Element sheetData, CellReference ref) {
        Element row = findRow(sheetData, ref.getRow() + 1);
        if (row == null) {
            return null;
        }
        for (Element c : XmlUtils.children(row, "c")) {
            String r = XmlUtils.attr(c, "r");
            if (r != null && new CellReference(r).getCol() == ref.getCol()) {
                return c;
            }
        }
        return null;
    }

    private static Element findRow(Element sheetData, int rowNum) {
        for (Element row : XmlUtils.children(sheetData, "row")) {
            if (String.valueOf(rowNum).equals(XmlUtils.attr(row, "r"))) {
                return row;
            }
        }
        return null;
    }

    private static Element findOrCreateRow(Element sheetData, int rowNum) {
        Element existing = findRow(sheetData, rowNum);
        if (existing != null) {
            // spans 是可选的提示属性，改动后去掉
            existing.removeAttr("spans");
            return existing;
        }
        Element row = XmlUtils.newElement("row", "r", String.valueOf(rowNum));
        for (Element other : XmlUtils.children(sheetData, "row")) {
            String r = XmlUtils.attr(other, "r");
            if (r != null && Integer.parseInt(r) > rowNum) {
                other.before(row);
                return row;
            }
        }
        sheetData.appendChild(row);
        return row;
    }

    private static void insertCell(Element row, Element cell, int col) {
        for (Element other : XmlUtils.children(row, "c")) {
            String r = XmlUtils.attr(other, "r");
            if (r != null && new CellReference(r).getCol() > col) {
                other.before(cell);
                return;
            }
        }
        row.appendChild(cell);
    }
}
