package com.example.redline.util.sml;

import com.example.redline.exception.RedlineException;
import com.example.redline.util.common.HashUtils;
import com.example.redline.util.ooxml.OoxmlPackage;
import com.example.redline.util.sml.signature.CellFormatSignature;
import com.example.redline.util.sml.signature.CellSignature;
import com.example.redline.util.sml.signature.CommentSignature;
import com.example.redline.util.sml.signature.DataValidationSignature;
import com.example.redline.util.sml.signature.DefinedNameSignature;
import com.example.redline.util.sml.signature.HyperlinkSignature;
import com.example.redline.util.sml.signature.WorkbookSignature;
import com.example.redline.util.sml.signature.WorksheetSignature;
import com.example.redline.util.xml.XmlUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.BuiltinFormats;
import org.apache.poi.ss.util.CellReference;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 把工作簿规整为签名树
 *
 * 值解析：共享字符串取文本，布尔为 TRUE/FALSE，数值统一为不带多余零的十进制串，内联字符串拼接 t。
 */
@Slf4j
public class SmlCanonicalizer {

    private final SmlComparerSettings settings;

    public SmlCanonicalizer(SmlComparerSettings settings) {
        this.settings = settings;
    }

    public WorkbookSignature canonicalize(OoxmlPackage pkg) {
        String workbookPath = pkg.getMainDocumentPath();
        Element workbook = XmlUtils.rootElement(pkg.getXmlPart(workbookPath));

        List<String> sharedStrings = readSharedStrings(pkg, workbookPath);
        StyleTable styles = readStyles(pkg, workbookPath);

        Element sheets = XmlUtils.child(workbook, "sheets");
        if (sheets == null) {
            throw RedlineException.invalidPackage(workbookPath, "工作簿缺少 sheets 元素");
        }

        WorkbookSignature signature = new WorkbookSignature();
        for (Element sheet : XmlUtils.children(sheets, "sheet")) {
            String name = XmlUtils.attr(sheet, "name");
            String relId = XmlUtils.attr(sheet, "r:id");
            if (name == null || relId == null) {
                throw RedlineException.invalidPackage(workbookPath, "sheet 缺少 name 或 r:id");
            }
            String sheetPath = pkg.resolveRelationshipTarget(workbookPath, relId);
            if (sheetPath == null || !pkg.partExists(sheetPath)) {
                throw RedlineException.missingPart(workbookPath, "找不到工作表部件: " + name + " (" + relId + ")");
            }
            signature.addSheet(canonicalizeSheet(pkg, sheetPath, name, relId, sharedStrings, styles));
        }

        Element definedNames = XmlUtils.child(workbook, "definedNames");
        for (Element dn : XmlUtils.children(definedNames, "definedName")) {
            String name = XmlUtils.attr(dn, "name");
            if (name == null || name.isEmpty()) {
                continue;
            }
            signature.addDefinedName(new DefinedNameSignature(name, XmlUtils.ownText(dn), XmlUtils.attr(dn, "localSheetId")));
        }
        log.debug("工作簿规整完成: {} 个工作表, {} 个名称", signature.getSheets().size(), signature.getDefinedNames().size());
        return signature;
    }

    // ==================== 工作表 ====================

    private WorksheetSignature canonicalizeSheet(OoxmlPackage pkg, String sheetPath, String name, String relId,
                                                 List<String> sharedStrings, StyleTable styles) {
        WorksheetSignature ws = new WorksheetSignature(name, relId, sheetPath);
        Element root = XmlUtils.rootElement(pkg.getXmlPart(sheetPath));

        Element sheetData = XmlUtils.child(root, "sheetData");
        int rowNum = 0;
        for (Element row : XmlUtils.children(sheetData, "row")) {
            rowNum = parseInt(XmlUtils.attr(row, "r"), rowNum + 1);
            int colNum = 0;
            for (Element c : XmlUtils.children(row, "c")) {
                String ref = XmlUtils.attr(c, "r");
                if (ref == null || ref.isEmpty()) {
                    // 省略 r 的单元格按位置顺延
                    ref = CellReference.convertNumToColString(colNum) + rowNum;
                }
                CellReference cr = parseReference(ref.replace("$", ""), sheetPath);
                colNum = cr.getCol() + 1;
                ref = cr.formatAsString();
                String value = resolveValue(c, sharedStrings);
                Element f = XmlUtils.child(c, "f");
                String formula = f == null ? null : emptyToNull(XmlUtils.ownText(f));
                int styleIndex = parseInt(XmlUtils.attr(c, "s"), 0);
                ws.addCell(new CellSignature(ref, cr.getRow() + 1, cr.getCol() + 1, value, formula,
                        styles.expand(styleIndex)));
            }
        }

        if (settings.isEnableRowAlignment()) {
            for (int row : ws.getPopulatedRows()) {
                ws.getRowSignatures().put(row, quickHash(sample(ws.getCellsInRow(row))));
            }
        }
        if (settings.isEnableColumnAlignment()) {
            for (int col : ws.getPopulatedColumns()) {
                ws.getColumnSignatures().put(col, quickHash(sample(ws.getCellsInColumn(col))));
            }
        }
        if (settings.isCompareComments()) {
            readComments(pkg, sheetPath, ws);
        }
        if (settings.isCompareDataValidation()) {
            readDataValidations(root, ws);
        }
        if (settings.isCompareMergedCells()) {
            for (Element mc : XmlUtils.children(XmlUtils.child(root, "mergeCells"), "mergeCell")) {
                String ref = XmlUtils.attr(mc, "ref");
                if (ref != null && !ref.isEmpty()) {
                    ws.getMergedCellRanges().add(ref);
                }
            }
        }
        if (settings.isCompareHyperlinks()) {
            readHyperlinks(pkg, sheetPath, root, ws);
        }
        log.debug("工作表 {} 规整完成: {} 个单元格", name, ws.getCells().size());
        return ws;
    }

    /**
     * 单元格显示值，无值时返回 null
     */
    static String resolveValue(Element c, List<String> sharedStrings) {
        String type = XmlUtils.attr(c, "t");
        Element v = XmlUtils.child(c, "v");
        String raw = v == null ? null : XmlUtils.ownText(v);
        if (raw == null || raw.isEmpty()) {
            Element is = XmlUtils.child(c, "is");
            if (is == null) {
                return null;
            }
            return emptyToNull(stringItemText(is));
        }
        if (type == null) {
            type = "n";
        }
        switch (type) {
            case "s": {
                int idx = parseInt(raw.trim(), -1);
                return idx >= 0 && idx < sharedStrings.size() ? sharedStrings.get(idx) : raw;
            }
            case "b":
                return "1".equals(raw.trim()) ? "TRUE" : "FALSE";
            case "str":
            case "e":
            case "inlineStr":
                return raw;
            default:
                return normalizeNumeric(raw);
        }
    }

    /**
     * 数值规范形式：保留 double 全精度，去掉多余的零（100.0 → 100）
     */
    static String normalizeNumeric(String raw) {
        String s = raw.trim();
        try {
            double d = Double.parseDouble(s);
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return s;
            }
            if (d == 0) {
                return "0";
            }
            return new BigDecimal(Double.toString(d)).stripTrailingZeros().toPlainString();
        } catch (NumberFormatException e) {
            return s;
        }
    }

    private List<String> sample(List<CellSignature> cells) {
        int size = Math.max(1, settings.getRowSignatureSampleSize());
        List<String> values = new ArrayList<>();
        if (cells.size() <= size) {
            for (CellSignature c : cells) {
                values.add(c.getResolvedValue() == null ? "" : c.getResolvedValue());
            }
            return values;
        }
        double step = (double) cells.size() / size;
        for (int i = 0; i < size; i++) {
            CellSignature c = cells.get((int) (i * step));
            values.add(c.getResolvedValue() == null ? "" : c.getResolvedValue());
        }
        return values;
    }

    private static String quickHash(List<String> values) {
        return HashUtils.fnv1a(String.join("|", values));
    }

    // ==================== 共享字符串与样式 ====================

    private List<String> readSharedStrings(OoxmlPackage pkg, String workbookPath) {
        List<String> result = new ArrayList<>();
        String path = pkg.getRelatedPart(workbookPath, OoxmlPackage.REL_SHARED_STRINGS);
        if (path == null) {
            return result;
        }
        Document doc = pkg.getOptionalXmlPart(path);
        if (doc == null) {
            return result;
        }
        for (Element si : XmlUtils.children(XmlUtils.rootElement(doc), "si")) {
            result.add(stringItemText(si));
        }
        return result;
    }

    /**
     * si / is 的文本：拼接 t，跳过拼音注音 rPh
     */
    private static String stringItemText(Element item) {
        StringBuilder sb = new StringBuilder();
        for (Element t : XmlUtils.descendants(item, "t")) {
            if (XmlUtils.ancestor(t, "rPh") != null) {
                continue;
            }
            sb.append(XmlUtils.ownText(t));
        }
        return sb.toString();
    }

    private StyleTable readStyles(OoxmlPackage pkg, String workbookPath) {
        StyleTable table = new StyleTable();
        String path = pkg.getRelatedPart(workbookPath, OoxmlPackage.REL_STYLES);
        if (path == null) {
            return table;
        }
        Element root;
        try {
            Document doc = pkg.getOptionalXmlPart(path);
            if (doc == null) {
                return table;
            }
            root = XmlUtils.rootElement(doc);
        } catch (RedlineException e) {
            log.warn("样式部件解析失败，按无样式处理: {}, {}", path, e.getMessage());
            return table;
        }
        for (Element nf : XmlUtils.children(XmlUtils.child(root, "numFmts"), "numFmt")) {
            table.numberFormats.put(parseInt(XmlUtils.attr(nf, "numFmtId"), 0),
                    XmlUtils.attr(nf, "formatCode") == null ? "" : XmlUtils.attr(nf, "formatCode"));
        }
        for (Element font : XmlUtils.children(XmlUtils.child(root, "fonts"), "font")) {
            table.fonts.add(font);
        }
        for (Element fill : XmlUtils.children(XmlUtils.child(root, "fills"), "fill")) {
            table.fills.add(fill);
        }
        for (Element border : XmlUtils.children(XmlUtils.child(root, "borders"), "border")) {
            table.borders.add(border);
        }
        for (Element xf : XmlUtils.children(XmlUtils.child(root, "cellXfs"), "xf")) {
            table.cellXfs.add(xf);
        }
        return table;
    }

    /**
     * 样式表：按索引展开 cellXfs
     */
    static class StyleTable {
        final Map<Integer, String> numberFormats = new HashMap<>();
        final List<Element> fonts = new ArrayList<>();
        final List<Element> fills = new ArrayList<>();
        final List<Element> borders = new ArrayList<>();
        final List<Element> cellXfs = new ArrayList<>();

        CellFormatSignature expand(int styleIndex) {
            CellFormatSignature f = new CellFormatSignature();
            if (styleIndex < 0 || styleIndex >= cellXfs.size()) {
                return f;
            }
            Element xf = cellXfs.get(styleIndex);

            Integer numFmtId = parseInteger(XmlUtils.attr(xf, "numFmtId"));
            String code = null;
            if (numFmtId != null) {
                code = numberFormats.get(numFmtId);
                if (code == null) {
                    code = BuiltinFormats.getBuiltinFormat(numFmtId);
                }
            }
            f.setNumberFormatCode(code == null ? "General" : code);

            Element font = pick(fonts, XmlUtils.attr(xf, "fontId"));
            f.setBold(XmlUtils.child(font, "b") != null && !isFalse(XmlUtils.childAttr(font, "b", "val")));
            f.setItalic(XmlUtils.child(font, "i") != null && !isFalse(XmlUtils.childAttr(font, "i", "val")));
            f.setUnderline(XmlUtils.child(font, "u") != null && !"none".equals(XmlUtils.childAttr(font, "u", "val")));
            f.setStrikethrough(XmlUtils.child(font, "strike") != null
                    && !isFalse(XmlUtils.childAttr(font, "strike", "val")));
            f.setFontName(XmlUtils.childAttr(font, "name", "val"));
            String sz = XmlUtils.childAttr(font, "sz", "val");
            f.setFontSize(sz == null ? null : parseDouble(sz));
            f.setFontColor(color(XmlUtils.child(font, "color")));

            Element fill = pick(fills, XmlUtils.attr(xf, "fillId"));
            Element pattern = XmlUtils.child(fill, "patternFill");
            f.setFillPattern(XmlUtils.attr(pattern, "patternType"));
            f.setFillForegroundColor(color(XmlUtils.child(pattern, "fgColor")));
            f.setFillBackgroundColor(color(XmlUtils.child(pattern, "bgColor")));

            Element border = pick(borders, XmlUtils.attr(xf, "borderId"));
            Element left = XmlUtils.child(border, "left");
            Element right = XmlUtils.child(border, "right");
            Element top = XmlUtils.child(border, "top");
            Element bottom = XmlUtils.child(border, "bottom");
            f.setBorderLeftStyle(XmlUtils.attr(left, "style"));
            f.setBorderLeftColor(color(XmlUtils.child(left, "color")));
            f.setBorderRightStyle(XmlUtils.attr(right, "style"));
            f.setBorderRightColor(color(XmlUtils.child(right, "color")));
            f.setBorderTopStyle(XmlUtils.attr(top, "style"));
            f.setBorderTopColor(color(XmlUtils.child(top, "color")));
            f.setBorderBottomStyle(XmlUtils.attr(bottom, "style"));
            f.setBorderBottomColor(color(XmlUtils.child(bottom, "color")));

            Element alignment = XmlUtils.child(xf, "alignment");
            f.setHorizontalAlignment(XmlUtils.attr(alignment, "horizontal"));
            f.setVerticalAlignment(XmlUtils.attr(alignment, "vertical"));
            String wrap = XmlUtils.attr(alignment, "wrapText");
            f.setWrapText("1".equals(wrap) || "true".equals(wrap));
            f.setIndent(parseInteger(XmlUtils.attr(alignment, "indent")));
            return f;
        }

        private static Element pick(List<Element> list, String index) {
            Integer i = parseInteger(index);
            return i == null || i < 0 || i >= list.size() ? null : list.get(i);
        }

        private static String color(Element el) {
            if (el == null) {
                return null;
            }
            String rgb = XmlUtils.attr(el, "rgb");
            if (rgb != null) {
                return rgb;
            }
            String theme = XmlUtils.attr(el, "theme");
            if (theme != null) {
                return "theme:" + theme;
            }
            String indexed = XmlUtils.attr(el, "indexed");
            return indexed == null ? null : "indexed:" + indexed;
        }

        private static boolean isFalse(String val) {
            return "0".equals(val) || "false".equals(val);
        }
    }

    // ==================== 批注、数据验证、超链接 ====================

    private void readComments(OoxmlPackage pkg, String sheetPath, WorksheetSignature ws) {
        for (String path : pkg.getRelatedParts(sheetPath, OoxmlPackage.REL_COMMENTS).values()) {
            Element root;
            try {
                Document doc = pkg.getOptionalXmlPart(path);
                if (doc == null) {
                    continue;
                }
                root = XmlUtils.rootElement(doc);
            } catch (RedlineException e) {
                log.warn("批注部件解析失败，按无批注处理: {}, {}", path, e.getMessage());
                continue;
            }
            List<String> authors = new ArrayList<>();
            for (Element a : XmlUtils.children(XmlUtils.child(root, "authors"), "author")) {
                authors.add(XmlUtils.ownText(a));
            }
            for (Element comment : XmlUtils.children(XmlUtils.child(root, "commentList"), "comment")) {
                String ref = XmlUtils.attr(comment, "ref");
                if (ref == null) {
                    continue;
                }
                int authorId = parseInt(XmlUtils.attr(comment, "authorId"), -1);
                String author = authorId >= 0 && authorId < authors.size() ? authors.get(authorId) : "";
                Element textEl = XmlUtils.child(comment, "text");
                String text = stringItemText(textEl == null ? comment : textEl);
                ws.getComments().put(ref, new CommentSignature(ref, author, text));
            }
        }
    }

    private static void readDataValidations(Element root, WorksheetSignature ws) {
        for (Element dv : XmlUtils.children(XmlUtils.child(root, "dataValidations"), "dataValidation")) {
            String sqref = XmlUtils.attr(dv, "sqref");
            if (sqref == null || sqref.trim().isEmpty()) {
                continue;
            }
            for (String range : sqref.trim().split("\\s+")) {
                DataValidationSignature sig = new DataValidationSignature();
                sig.setCellRange(range);
                String type = XmlUtils.attr(dv, "type");
                sig.setValidationType(type == null ? "none" : type);
                sig.setOperator(XmlUtils.attr(dv, "operator"));
                Element f1 = XmlUtils.child(dv, "formula1");
                Element f2 = XmlUtils.child(dv, "formula2");
                sig.setFormula1(f1 == null ? null : XmlUtils.ownText(f1));
                sig.setFormula2(f2 == null ? null : XmlUtils.ownText(f2));
                sig.setAllowBlank(isTrue(XmlUtils.attr(dv, "allowBlank")));
                sig.setShowDropDown(isTrue(XmlUtils.attr(dv, "showDropDown")));
                sig.setShowInputMessage(isTrue(XmlUtils.attr(dv, "showInputMessage")));
                sig.setShowErrorMessage(isTrue(XmlUtils.attr(dv, "showErrorMessage")));
                sig.setErrorTitle(XmlUtils.attr(dv, "errorTitle"));
                sig.setError(XmlUtils.attr(dv, "error"));
                sig.setPromptTitle(XmlUtils.attr(dv, "promptTitle"));
                sig.setPrompt(XmlUtils.attr(dv, "prompt"));
                String key = range.contains(":") ? range.substring(0, range.indexOf(':')) : range;
                ws.getDataValidations().put(key, sig);
            }
        }
    }

    private static void readHyperlinks(OoxmlPackage pkg, String sheetPath, Element root, WorksheetSignature ws) {
        for (Element hl : XmlUtils.children(XmlUtils.child(root, "hyperlinks"), "hyperlink")) {
            String ref = XmlUtils.attr(hl, "ref");
            if (ref == null) {
                continue;
            }
            String target = null;
            String relId = XmlUtils.attr(hl, "r:id");
            if (relId != null) {
                target = pkg.getExternalTarget(sheetPath, relId);
            }
            if (target == null) {
                target = XmlUtils.attr(hl, "location");
            }
            ws.getHyperlinks().put(ref, new HyperlinkSignature(ref, target, XmlUtils.attr(hl, "display"),
                    XmlUtils.attr(hl, "tooltip")));
        }
    }

    // —— 工具 —— //

    private static CellReference parseReference(String ref, String sheetPath) {
        try {
            return new CellReference(ref);
        } catch (IllegalArgumentException e) {
            throw RedlineException.invalidPackage(sheetPath, "非法单元格引用: " + ref);
        }
    }

    private static boolean isTrue(String v) {
        return "1".equals(v) || "true".equals(v);
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    private static int parseInt(String s, int dflt) {
        Integer i = parseInteger(s);
        return i == null ? dflt : i;
    }

    private static Integer parseInteger(String s) {
        if (s == null) {
            return null;
        }
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double parseDouble(String s) {
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
