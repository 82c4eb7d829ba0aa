package com.example.redline.util.sml;

import com.example.redline.util.ooxml.OoxmlPackage;
import com.example.redline.util.sml.dto.SmlChange;
import com.example.redline.util.sml.dto.SmlChangeType;
import com.example.redline.util.sml.dto.SmlComparisonResult;
import com.example.redline.util.xml.Namespaces;
import com.example.redline.util.xml.XmlUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.util.CellReference;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 在新工作簿上标注差异
 *
 * 每个有变化的单元格加一条批注（批注部件 + VML 旧式绘图），并追加 _DiffSummary 汇总表。
 * 共享字符串和样式部件保持原样，汇总表一律使用内联字符串。
 */
@Slf4j
public class SmlMarkupRenderer {

    public static final String SUMMARY_SHEET_NAME = "_DiffSummary";

    static final String CT_COMMENTS = "application/vnd.openxmlformats-officedocument.spreadsheetml.comments+xml";
    static final String CT_VML = "application/vnd.openxmlformats-officedocument.vmlDrawing";
    static final String CT_WORKSHEET = "application/vnd.openxmlformats-officedocument.spreadsheetml.worksheet+xml";

    /** legacyDrawing 之后的工作表子元素 */
    private static final List<String> AFTER_LEGACY_DRAWING = Arrays.asList(
            "legacyDrawingHF", "drawingHF", "picture", "oleObjects", "controls", "webPublishItems",
            "tableParts", "extLst");

    private final SmlComparerSettings settings;

    public SmlMarkupRenderer(SmlComparerSettings settings) {
        this.settings = settings;
    }

    /**
     * 在已打开的新工作簿包上写入标注
     */
    public void render(OoxmlPackage pkg, SmlComparisonResult result) {
        String workbookPath = pkg.getMainDocumentPath();
        Map<String, String> sheetPaths = sheetPaths(pkg, workbookPath);

        Map<String, List<SmlChange>> bySheet = new LinkedHashMap<>();
        for (SmlChange change : result.getChanges()) {
            if (change.getCellAddress() == null || change.getSheetName() == null
                    || !sheetPaths.containsKey(change.getSheetName())) {
                continue;
            }
            bySheet.computeIfAbsent(change.getSheetName(), k -> new ArrayList<>()).add(change);
        }

        int sheetIndex = 0;
        for (Map.Entry<String, String> sheet : sheetPaths.entrySet()) {
            sheetIndex++;
            List<SmlChange> changes = bySheet.get(sheet.getKey());
            if (changes == null || changes.isEmpty()) {
                continue;
            }
            annotateSheet(pkg, sheet.getValue(), changes, sheetIndex);
        }
        addSummarySheet(pkg, workbookPath, result);
        log.debug("工作簿标注完成: {} 个工作表有批注", bySheet.size());
    }

    /**
     * 工作表名 → 部件路径（工作簿顺序）
     */
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

    // ==================== 批注 ====================

    private void annotateSheet(OoxmlPackage pkg, String sheetPath, List<SmlChange> changes, int sheetIndex) {
        // 同一单元格的多条变更合成一条批注
        Map<String, List<String>> notes = new LinkedHashMap<>();
        Map<String, String> fills = new LinkedHashMap<>();
        for (SmlChange change : changes) {
            notes.computeIfAbsent(change.getCellAddress(), k -> new ArrayList<>()).add(commentText(change));
            fills.putIfAbsent(change.getCellAddress(), fillColor(change.getChangeType()));
        }

        String commentsPath = pkg.getRelatedPart(sheetPath, OoxmlPackage.REL_COMMENTS);
        Document commentsDoc;
        if (commentsPath == null) {
            commentsPath = uniquePath(pkg, "xl/comments", ".xml");
            commentsDoc = XmlUtils.parse("<comments xmlns=\"" + Namespaces.S + "\"><authors/><commentList/></comments>");
            pkg.createPart(commentsPath, CT_COMMENTS, XmlUtils.serialize(commentsDoc));
            pkg.addRelationship(sheetPath, commentsPath, OoxmlPackage.REL_COMMENTS);
        } else {
            commentsDoc = pkg.getXmlPart(commentsPath);
        }
        Element commentsRoot = XmlUtils.rootElement(commentsDoc);
        int authorId = ensureAuthor(commentsRoot, settings.getAuthorForChanges());
        Element commentList = XmlUtils.child(commentsRoot, "commentList");
        if (commentList == null) {
            commentList = XmlUtils.newElement("commentList");
            commentsRoot.appendChild(commentList);
        }

        Map<String, String> newAnchors = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> note : notes.entrySet()) {
            String text = String.join("\n", note.getValue());
            Element existing = null;
            for (Element c : XmlUtils.children(commentList, "comment")) {
                if (note.getKey().equals(XmlUtils.attr(c, "ref"))) {
                    existing = c;
                    break;
                }
            }
            if (existing != null) {
                Element textEl = XmlUtils.child(existing, "text");
                if (textEl == null) {
                    textEl = XmlUtils.newElement("text");
                    existing.appendChild(textEl);
                }
                textEl.appendChild(run("\n" + text));
                continue;
            }
            Element comment = XmlUtils.newElement("comment");
            XmlUtils.setAttr(comment, "ref", note.getKey());
            XmlUtils.setAttr(comment, "authorId", String.valueOf(authorId));
            Element textEl = XmlUtils.newElement("text");
            textEl.appendChild(run(text));
            comment.appendChild(textEl);
            commentList.appendChild(comment);
            newAnchors.put(note.getKey(), fills.get(note.getKey()));
        }
        pkg.putXmlPart(commentsPath, commentsDoc);

        if (!newAnchors.isEmpty()) {
            addVmlShapes(pkg, sheetPath, newAnchors, sheetIndex);
        }
    }

    private static int ensureAuthor(Element commentsRoot, String author) {
        Element authors = XmlUtils.child(commentsRoot, "authors");
        if (authors == null) {
            authors = XmlUtils.newElement("authors");
            commentsRoot.prependChild(authors);
        }
        List<Element> list = XmlUtils.children(authors, "author");
        for (int i = 0; i < list.size(); i++) {
            if (author.equals(XmlUtils.ownText(list.get(i)))) {
                return i;
            }
        }
        Element a = XmlUtils.newElement("author");
        XmlUtils.setText(a, author);
        authors.appendChild(a);
        return list.size();
    }

    private static Element run(String text) {
        Element r = XmlUtils.newElement("r");
        Element t = XmlUtils.newElement("t");
        XmlUtils.setAttr(t, "xml:space", "preserve");
        XmlUtils.setText(t, text);
        r.appendChild(t);
        return r;
    }

    /**
     * 批注正文：首行为变更类型，后面是新旧值
     */
    static String commentText(SmlChange change) {
        List<String> lines = new ArrayList<>();
        lines.add("[" + change.getChangeType().name() + "]");
        SmlChangeType type = change.getChangeType();
        if (type == SmlChangeType.CellAdded) {
            if (change.getNewValue() != null) {
                lines.add("New value: " + change.getNewValue());
            }
            if (change.getNewFormula() != null) {
                lines.add("Formula: =" + change.getNewFormula());
            }
        } else if (type == SmlChangeType.CellDeleted) {
            if (change.getOldValue() != null) {
                lines.add("Old value: " + change.getOldValue());
            }
        } else if (type == SmlChangeType.ValueChanged) {
            if (change.getOldValue() != null) {
                lines.add("Old value: " + change.getOldValue());
            }
            if (change.getNewValue() != null) {
                lines.add("New value: " + change.getNewValue());
            }
        } else if (type == SmlChangeType.FormulaChanged) {
            if (change.getOldFormula() != null) {
                lines.add("Old formula: =" + change.getOldFormula());
            }
            if (change.getNewFormula() != null) {
                lines.add("New formula: =" + change.getNewFormula());
            }
        } else if (type == SmlChangeType.FormatChanged) {
            if (change.getOldFormat() != null && change.getNewFormat() != null) {
                lines.add(change.getNewFormat().getDifferenceDescription(change.getOldFormat()));
            }
        } else {
            lines.add(change.getDescription());
        }
        return String.join("\n", lines);
    }

    // ==================== VML ====================

    /**
     * 批注框底色
     */
    private String fillColor(SmlChangeType type) {
        switch (type) {
            case CellAdded:
                return settings.getAddedCellColor();
            case CellDeleted:
                return settings.getDeletedCellColor();
            case ValueChanged:
                return settings.getModifiedValueColor();
            case FormulaChanged:
                return settings.getModifiedFormulaColor();
            case FormatChanged:
                return settings.getModifiedFormatColor();
            case CommentAdded:
            case CommentDeleted:
            case CommentChanged:
                return settings.getCommentColor();
            case DataValidationAdded:
            case DataValidationDeleted:
            case DataValidationChanged:
                return settings.getDataValidationColor();
            default:
                return settings.getCommentColor();
        }
    }

    private void addVmlShapes(OoxmlPackage pkg, String sheetPath, Map<String, String> anchors, int sheetIndex) {
        String vmlPath = pkg.getRelatedPart(sheetPath, OoxmlPackage.REL_VML_DRAWING);
        if (vmlPath != null) {
            Document vml = pkg.getXmlPart(vmlPath);
            Element root = XmlUtils.rootElement(vml);
            int existing = XmlUtils.descendants(root, "v:shape").size();
            int base = sheetIndex * 1024 + existing + 1;
            Document shapes = XmlUtils.parse("<xml xmlns:v=\"urn:schemas-microsoft-com:vml\" "
                    + "xmlns:o=\"urn:schemas-microsoft-com:office:office\" "
                    + "xmlns:x=\"urn:schemas-microsoft-com:office:excel\">" + shapeXml(anchors, base) + "</xml>");
            for (Element shape : new ArrayList<>(XmlUtils.rootElement(shapes).children())) {
                root.appendChild(shape);
            }
            pkg.putXmlPart(vmlPath, vml);
            return;
        }

        vmlPath = uniquePath(pkg, "xl/drawings/vmlDrawing", ".vml");
        StringBuilder sb = new StringBuilder();
        sb.append("<xml xmlns:v=\"urn:schemas-microsoft-com:vml\" xmlns:o=\"urn:schemas-microsoft-com:office:office\" ")
                .append("xmlns:x=\"urn:schemas-microsoft-com:office:excel\">")
                .append("<o:shapelayout v:ext=\"edit\"><o:idmap v:ext=\"edit\" data=\"").append(sheetIndex)
                .append("\"/></o:shapelayout>")
                .append("<v:shapetype id=\"_x0000_t202\" coordsize=\"21600,21600\" o:spt=\"202\" ")
                .append("path=\"m,l,21600r21600,l21600,xe\">")
                .append("<v:stroke joinstyle=\"miter\"/><v:path gradientshapeok=\"t\" o:connecttype=\"rect\"/>")
                .append("</v:shapetype>")
                .append(shapeXml(anchors, sheetIndex * 1024 + 1))
                .append("</xml>");
        pkg.createPart(vmlPath, CT_VML, sb.toString().getBytes(StandardCharsets.UTF_8));
        String relId = pkg.addRelationship(sheetPath, vmlPath, OoxmlPackage.REL_VML_DRAWING);

        Document sheetDoc = pkg.getXmlPart(sheetPath);
        Element root = XmlUtils.rootElement(sheetDoc);
        XmlUtils.ensureNamespace(root, "r", Namespaces.R);
        Element legacy = XmlUtils.newElement("legacyDrawing", "r:id", relId);
        Element before = null;
        for (Element child : root.children()) {
            if (AFTER_LEGACY_DRAWING.contains(child.tagName())) {
                before = child;
                break;
            }
        }
        if (before != null) {
            before.before(legacy);
        } else {
            root.appendChild(legacy);
        }
        pkg.putXmlPart(sheetPath, sheetDoc);
    }

    private static String shapeXml(Map<String, String> anchors, int firstId) {
        StringBuilder sb = new StringBuilder();
        int id = firstId;
        for (Map.Entry<String, String> anchor : anchors.entrySet()) {
            CellReference ref = new CellReference(anchor.getKey());
            String fill = "#" + anchor.getValue().toLowerCase();
            int row = ref.getRow();
            int col = ref.getCol();
            sb.append("<v:shape id=\"_x0000_s").append(id++).append("\" type=\"#_x0000_t202\" ")
                    .append("style=\"position:absolute;margin-left:80pt;margin-top:5pt;width:120pt;height:60pt;")
                    .append("z-index:1;visibility:hidden\" fillcolor=\"").append(fill)
                    .append("\" o:insetmode=\"auto\">")
                    .append("<v:fill color2=\"").append(fill).append("\"/><v:shadow on=\"t\" color=\"black\" obscured=\"t\"/>")
                    .append("<v:path o:connecttype=\"none\"/><v:textbox style=\"mso-direction-alt:auto\"/>")
                    .append("<x:ClientData ObjectType=\"Note\"><x:MoveWithCells/><x:SizeWithCells/>")
                    .append("<x:Anchor>").append(col + 1).append(", 15, ").append(Math.max(row - 1, 0))
                    .append(", 2, ").append(col + 3).append(", 15, ").append(row + 3).append(", 16</x:Anchor>")
                    .append("<x:AutoFill>False</x:AutoFill><x:Row>").append(row).append("</x:Row>")
                    .append("<x:Column>").append(col).append("</x:Column></x:ClientData></v:shape>");
        }
        return sb.toString();
    }

    // ==================== 汇总表 ====================

    private void addSummarySheet(OoxmlPackage pkg, String workbookPath, SmlComparisonResult result) {
        List<String[]> rows = new ArrayList<>();
        rows.add(new String[]{"Spreadsheet Comparison Summary"});
        rows.add(new String[]{});
        rows.add(new String[]{"Total Changes:", String.valueOf(result.getTotalChanges())});
        rows.add(new String[]{"Value Changes:", String.valueOf(result.count(SmlChangeType.ValueChanged))});
        rows.add(new String[]{"Formula Changes:", String.valueOf(result.count(SmlChangeType.FormulaChanged))});
        rows.add(new String[]{"Format Changes:", String.valueOf(result.count(SmlChangeType.FormatChanged))});
        rows.add(new String[]{"Cells Added:", String.valueOf(result.count(SmlChangeType.CellAdded))});
        rows.add(new String[]{"Cells Deleted:", String.valueOf(result.count(SmlChangeType.CellDeleted))});
        rows.add(new String[]{"Sheets Added:", String.valueOf(result.count(SmlChangeType.SheetAdded))});
        rows.add(new String[]{"Sheets Deleted:", String.valueOf(result.count(SmlChangeType.SheetDeleted))});
        rows.add(new String[]{});
        rows.add(new String[]{"Change Type", "Sheet", "Cell", "Old Value", "New Value", "Description"});
        for (SmlChange c : result.getChanges()) {
            rows.add(new String[]{
                    c.getChangeType().name(),
                    nz(c.getSheetName()),
                    nz(c.getCellAddress()),
                    nz(c.getOldValue() != null ? c.getOldValue() : c.getOldFormula()),
                    nz(c.getNewValue() != null ? c.getNewValue() : c.getNewFormula()),
                    c.getDescription()});
        }

        Document summary = XmlUtils.parse("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
                + "<worksheet xmlns=\"" + Namespaces.S + "\" xmlns:r=\"" + Namespaces.R + "\"><sheetData/></worksheet>");
        Element sheetData = XmlUtils.child(XmlUtils.rootElement(summary), "sheetData");
        for (int i = 0; i < rows.size(); i++) {
            int rowNum = i + 1;
            Element row = XmlUtils.newElement("row", "r", String.valueOf(rowNum));
            String[] values = rows.get(i);
            for (int col = 0; col < values.length; col++) {
                Element c = XmlUtils.newElement("c", "r", CellReference.convertNumToColString(col) + rowNum);
                XmlUtils.setAttr(c, "t", "inlineStr");
                Element is = XmlUtils.newElement("is");
                Element t = XmlUtils.newElement("t");
                XmlUtils.setAttr(t, "xml:space", "preserve");
                XmlUtils.setText(t, values[col]);
                is.appendChild(t);
                c.appendChild(is);
                row.appendChild(c);
            }
            sheetData.appendChild(row);
        }

        String summaryPath = uniquePath(pkg, "xl/worksheets/diffSummary", ".xml");
        pkg.createPart(summaryPath, CT_WORKSHEET, XmlUtils.serialize(summary));
        String relId = pkg.addRelationship(workbookPath, summaryPath, OoxmlPackage.REL_WORKSHEET);

        Document workbookDoc = pkg.getXmlPart(workbookPath);
        Element workbook = XmlUtils.rootElement(workbookDoc);
        XmlUtils.ensureNamespace(workbook, "r", Namespaces.R);
        Element sheets = XmlUtils.child(workbook, "sheets");
        int maxId = 0;
        List<String> names = new ArrayList<>();
        for (Element sheet : XmlUtils.children(sheets, "sheet")) {
            names.add(XmlUtils.attr(sheet, "name"));
            try {
                maxId = Math.max(maxId, Integer.parseInt(XmlUtils.attr(sheet, "sheetId")));
            } catch (NumberFormatException e) {
                log.debug("忽略非法 sheetId: {}", XmlUtils.attr(sheet, "sheetId"));
            }
        }
        String name = SUMMARY_SHEET_NAME;
        for (int n = 2; names.contains(name); n++) {
            name = SUMMARY_SHEET_NAME + n;
        }
        Element entry = XmlUtils.newElement("sheet");
        XmlUtils.setAttr(entry, "name", name);
        XmlUtils.setAttr(entry, "sheetId", String.valueOf(maxId + 1));
        XmlUtils.setAttr(entry, "r:id", relId);
        sheets.appendChild(entry);
        pkg.putXmlPart(workbookPath, workbookDoc);
    }

    // —— 工具 —— //

    private static String uniquePath(OoxmlPackage pkg, String prefix, String suffix) {
        int n = 1;
        while (pkg.partExists(prefix + n + suffix)) {
            n++;
        }
        return prefix + n + suffix;
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
