package com.example.redline.util.pml;

import com.example.redline.util.ooxml.OoxmlPackage;
import com.example.redline.util.pml.dto.PmlChange;
import com.example.redline.util.pml.dto.PmlChangeType;
import com.example.redline.util.pml.dto.PmlComparisonResult;
import com.example.redline.util.xml.Namespaces;
import com.example.redline.util.xml.XmlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 在新演示文稿上标注变更
 *
 * 形状级变更在形状上方叠加带颜色的文字标签；可选在备注页追加变更说明，并在末尾追加汇总幻灯片。
 */
@Slf4j
public class PmlMarkupRenderer {

    static final String CT_SLIDE = "application/vnd.openxmlformats-officedocument.presentationml.slide+xml";
    static final String LABEL_PREFIX = "ChangeLabel_";

    /** 标签默认位置与尺寸（EMU） */
    private static final long DEFAULT_X = 914400;
    private static final long DEFAULT_Y = 457200;
    private static final long LABEL_CX = 1828800;
    private static final long LABEL_CY = 274320;
    private static final long LABEL_OFFSET_Y = 300000;
    private static final int SUMMARY_MAX_ITEMS = 20;

    private final PmlComparerSettings settings;

    public PmlMarkupRenderer(PmlComparerSettings settings) {
        this.settings = settings;
    }

    public void render(OoxmlPackage pkg, PmlComparisonResult result) {
        if (result.getTotalChanges() == 0) {
            return;
        }
        String presentationPath = pkg.getMainDocumentPath();
        Map<Integer, String> slides = slidePaths(pkg, presentationPath);

        int labels = 0;
        for (Map.Entry<Integer, List<PmlChange>> entry : result.getChangesBySlide().entrySet()) {
            String slidePath = slides.get(entry.getKey());
            if (slidePath == null) {
                continue;
            }
            List<PmlChange> onSlide = new ArrayList<>();
            for (PmlChange c : entry.getValue()) {
                // 删除的幻灯片在新文稿里没有对应页
                if (c.getChangeType() != PmlChangeType.SlideDeleted) {
                    onSlide.add(c);
                }
            }
            labels += addLabels(pkg, slidePath, onSlide);
            if (settings.isAddNotesAnnotations()) {
                annotateNotes(pkg, slidePath, onSlide);
            }
        }
        if (settings.isAddSummarySlide()) {
            addSummarySlide(pkg, presentationPath, slides, result);
        }
        log.debug("演示文稿标注完成: labels={}, summary={}", labels, settings.isAddSummarySlide());
    }

    /**
     * sldIdLst 中的位置（从 1 开始）→ 幻灯片部件路径
     */
    static Map<Integer, String> slidePaths(OoxmlPackage pkg, String presentationPath) {
        Map<Integer, String> result = new LinkedHashMap<>();
        Element presentation = XmlUtils.rootElement(pkg.getXmlPart(presentationPath));
        int index = 1;
        for (Element sldId : XmlUtils.children(XmlUtils.child(presentation, "p:sldIdLst"), "p:sldId")) {
            String path = pkg.resolveRelationshipTarget(presentationPath, XmlUtils.attr(sldId, "r:id"));
            if (path != null) {
                result.put(index, path);
            }
            index++;
        }
        return result;
    }

    // ==================== 变更标签 ====================

    private int addLabels(OoxmlPackage pkg, String slidePath, List<PmlChange> changes) {
        Document slide = pkg.getXmlPart(slidePath);
        Element spTree = XmlUtils.path(XmlUtils.rootElement(slide), "p:cSld", "p:spTree");
        if (spTree == null) {
            log.warn("幻灯片缺少 spTree，跳过标注: {}", slidePath);
            return 0;
        }
        int nextId = maxShapeId(spTree) + 1;
        int added = 0;
        for (PmlChange change : changes) {
            String label = labelText(change.getChangeType());
            if (label == null) {
                continue;
            }
            long x = change.getNewX() != null ? change.getNewX()
                    : change.getOldX() != null ? change.getOldX() : DEFAULT_X;
            Long shapeY = change.getNewY() != null ? change.getNewY() : change.getOldY();
            long y = shapeY == null ? DEFAULT_Y : Math.max(0, shapeY - LABEL_OFFSET_Y);
            spTree.appendChild(labelShape(nextId++, label, labelColor(change.getChangeType()), x, y));
            added++;
        }
        if (added > 0) {
            pkg.putXmlPart(slidePath, slide);
        }
        return added;
    }

    static int maxShapeId(Element spTree) {
        int max = 0;
        for (Element cNvPr : XmlUtils.descendants(spTree, "p:cNvPr")) {
            max = Math.max(max, (int) PmlCanonicalizer.parseLong(XmlUtils.attr(cNvPr, "id")));
        }
        return max;
    }

    static String labelText(PmlChangeType type) {
        switch (type) {
            case ShapeInserted:
                return "NEW";
            case ShapeDeleted:
                return "DELETED";
            case ShapeMoved:
                return "MOVED";
            case ShapeResized:
                return "RESIZED";
            case ShapeRotated:
                return "ROTATED";
            case TextChanged:
                return "TEXT CHANGED";
            case TextFormattingChanged:
                return "FORMATTING";
            case ImageReplaced:
                return "IMAGE REPLACED";
            case TableContentChanged:
                return "TABLE CHANGED";
            case ChartDataChanged:
                return "CHART CHANGED";
            default:
                return null;
        }
    }

    private String labelColor(PmlChangeType type) {
        switch (type) {
            case ShapeInserted:
                return settings.getInsertedColor();
            case ShapeDeleted:
                return settings.getDeletedColor();
            case ShapeMoved:
                return settings.getMovedColor();
            case TextFormattingChanged:
                return settings.getFormattingColor();
            default:
                return settings.getModifiedColor();
        }
    }

    private static Element labelShape(int id, String text, String color, long x, long y) {
        String xml = "<p:sp xmlns:p=\"" + Namespaces.P + "\" xmlns:a=\"" + Namespaces.A + "\">"
                + "<p:nvSpPr><p:cNvPr id=\"" + id + "\" name=\"" + LABEL_PREFIX + id + "\"/>"
                + "<p:cNvSpPr><a:spLocks noGrp=\"1\"/></p:cNvSpPr><p:nvPr/></p:nvSpPr>"
                + "<p:spPr><a:xfrm><a:off x=\"" + x + "\" y=\"" + y + "\"/>"
                + "<a:ext cx=\"" + LABEL_CX + "\" cy=\"" + LABEL_CY + "\"/></a:xfrm>"
                + "<a:prstGeom prst=\"rect\"><a:avLst/></a:prstGeom>"
                + "<a:solidFill><a:srgbClr val=\"" + color + "\"/></a:solidFill>"
                + "<a:ln w=\"9525\"><a:noFill/></a:ln></p:spPr>"
                + "<p:txBody><a:bodyPr wrap=\"square\" rtlCol=\"0\"/><a:lstStyle/>"
                + "<a:p><a:r><a:rPr lang=\"en-US\" sz=\"1100\" b=\"1\"/><a:t>" + XmlUtils.escape(text) + "</a:t></a:r></a:p>"
                + "</p:txBody></p:sp>";
        Element sp = XmlUtils.rootElement(XmlUtils.parse(xml));
        // 命名空间已在幻灯片根元素声明
        sp.removeAttr("xmlns:p");
        sp.removeAttr("xmlns:a");
        return sp;
    }

    // ==================== 备注 ====================

    /**
     * 只追加到已有的备注页正文占位符
     */
    private void annotateNotes(OoxmlPackage pkg, String slidePath, List<PmlChange> changes) {
        if (changes.isEmpty()) {
            return;
        }
        String notesPath = pkg.getRelatedPart(slidePath, OoxmlPackage.REL_NOTES_SLIDE);
        if (notesPath == null) {
            return;
        }
        Document notes = pkg.getOptionalXmlPart(notesPath);
        if (notes == null) {
            return;
        }
        Element body = null;
        for (Element sp : XmlUtils.descendants(XmlUtils.rootElement(notes), "p:sp")) {
            Element ph = XmlUtils.path(sp, "p:nvSpPr", "p:nvPr", "p:ph");
            if (ph != null && "body".equals(XmlUtils.attr(ph, "type"))) {
                body = XmlUtils.child(sp, "p:txBody");
                break;
            }
        }
        if (body == null) {
            return;
        }
        String prefix = "[" + settings.getAuthorForChanges() + "] ";
        for (PmlChange change : changes) {
            body.appendChild(paragraph(prefix + change.getDescription()));
        }
        pkg.putXmlPart(notesPath, notes);
    }

    private static Element paragraph(String text) {
        Element p = XmlUtils.newElement("a:p");
        Element r = XmlUtils.newElement("a:r");
        r.appendChild(XmlUtils.newElement("a:rPr", "lang", "en-US"));
        Element t = XmlUtils.newElement("a:t");
        XmlUtils.setText(t, text);
        r.appendChild(t);
        p.appendChild(r);
        return p;
    }

    // ==================== 汇总幻灯片 ====================

    private void addSummarySlide(OoxmlPackage pkg, String presentationPath, Map<Integer, String> slides,
                                 PmlComparisonResult result) {
        String layoutPath = null;
        for (String slidePath : slides.values()) {
            layoutPath = pkg.getRelatedPart(slidePath, OoxmlPackage.REL_SLIDE_LAYOUT);
            if (layoutPath != null) {
                break;
            }
        }
        if (layoutPath == null) {
            log.warn("找不到可用版式，不生成汇总幻灯片");
            return;
        }

        List<String> lines = new ArrayList<>();
        lines.add("Total Changes: " + result.getTotalChanges());
        lines.add("Slides Inserted: " + result.count(PmlChangeType.SlideInserted));
        lines.add("Slides Deleted: " + result.count(PmlChangeType.SlideDeleted));
        lines.add("Shapes Inserted: " + result.count(PmlChangeType.ShapeInserted));
        lines.add("Shapes Deleted: " + result.count(PmlChangeType.ShapeDeleted));
        lines.add("Shapes Moved: " + result.count(PmlChangeType.ShapeMoved));
        lines.add("Shapes Resized: " + result.count(PmlChangeType.ShapeResized));
        lines.add("Text Changes: " + result.getTextChanges());
        lines.add("");
        lines.add("Changes:");
        List<PmlChange> changes = result.getChanges();
        for (int i = 0; i < changes.size() && i < SUMMARY_MAX_ITEMS; i++) {
            lines.add((i + 1) + ". " + changes.get(i).getDescription());
        }
        if (changes.size() > SUMMARY_MAX_ITEMS) {
            lines.add("... and " + (changes.size() - SUMMARY_MAX_ITEMS) + " more");
        }

        StringBuilder body = new StringBuilder();
        for (String line : lines) {
            body.append("<a:p><a:r><a:rPr lang=\"en-US\" sz=\"1400\"/><a:t>")
                    .append(XmlUtils.escape(line)).append("</a:t></a:r></a:p>");
        }
        String xml = "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
                + "<p:sld xmlns:a=\"" + Namespaces.A + "\" xmlns:r=\"" + Namespaces.R + "\" xmlns:p=\"" + Namespaces.P + "\">"
                + "<p:cSld name=\"Comparison Summary\"><p:spTree>"
                + "<p:nvGrpSpPr><p:cNvPr id=\"1\" name=\"\"/><p:cNvGrpSpPr/><p:nvPr/></p:nvGrpSpPr>"
                + "<p:grpSpPr><a:xfrm><a:off x=\"0\" y=\"0\"/><a:ext cx=\"0\" cy=\"0\"/>"
                + "<a:chOff x=\"0\" y=\"0\"/><a:chExt cx=\"0\" cy=\"0\"/></a:xfrm></p:grpSpPr>"
                + textShape(2, "Title", 457200, 274638, 8229600, 1143000,
                "<a:p><a:r><a:rPr lang=\"en-US\" sz=\"4400\" b=\"1\"/><a:t>Comparison Summary</a:t></a:r></a:p>")
                + textShape(3, "Summary", 457200, 1600200, 8229600, 4525963, body.toString())
                + "</p:spTree></p:cSld><p:clrMapOvr><a:masterClrMapping/></p:clrMapOvr></p:sld>";

        String slidePath = uniquePath(pkg, "ppt/slides/slide", ".xml");
        pkg.createPart(slidePath, CT_SLIDE, XmlUtils.serialize(XmlUtils.parse(xml)));
        pkg.addRelationship(slidePath, layoutPath, OoxmlPackage.REL_SLIDE_LAYOUT);
        String relId = pkg.addRelationship(presentationPath, slidePath, OoxmlPackage.REL_SLIDE);

        Document presentationDoc = pkg.getXmlPart(presentationPath);
        Element presentation = XmlUtils.rootElement(presentationDoc);
        XmlUtils.ensureNamespace(presentation, "r", Namespaces.R);
        Element sldIdLst = XmlUtils.child(presentation, "p:sldIdLst");
        if (sldIdLst == null) {
            sldIdLst = XmlUtils.newElement("p:sldIdLst");
            Element sldMasterIdLst = XmlUtils.child(presentation, "p:sldMasterIdLst");
            Element notesMasterIdLst = XmlUtils.child(presentation, "p:notesMasterIdLst");
            Element anchor = notesMasterIdLst != null ? notesMasterIdLst : sldMasterIdLst;
            if (anchor != null) {
                anchor.after(sldIdLst);
            } else {
                presentation.prependChild(sldIdLst);
            }
        }
        long maxId = 255;
        for (Element sldId : XmlUtils.children(sldIdLst, "p:sldId")) {
            maxId = Math.max(maxId, PmlCanonicalizer.parseLong(XmlUtils.attr(sldId, "id")));
        }
        Element entry = XmlUtils.newElement("p:sldId", "id", String.valueOf(maxId + 1));
        XmlUtils.setAttr(entry, "r:id", relId);
        sldIdLst.appendChild(entry);
        pkg.putXmlPart(presentationPath, presentationDoc);
    }

    private static String textShape(int id, String name, long x, long y, long cx, long cy, String paragraphs) {
        return "<p:sp><p:nvSpPr><p:cNvPr id=\"" + id + "\" name=\"" + name + "\"/><p:cNvSpPr txBox=\"1\"/><p:nvPr/></p:nvSpPr>"
                + "<p:spPr><a:xfrm><a:off x=\"" + x + "\" y=\"" + y + "\"/><a:ext cx=\"" + cx + "\" cy=\"" + cy + "\"/></a:xfrm>"
                + "<a:prstGeom prst=\"rect\"><a:avLst/></a:prstGeom></p:spPr>"
                + "<p:txBody><a:bodyPr wrap=\"square\"/><a:lstStyle/>" + paragraphs + "</p:txBody></p:sp>";
    }

    private static String uniquePath(OoxmlPackage pkg, String prefix, String suffix) {
        int n = 1;
        while (pkg.partExists(prefix + n + suffix)) {
            n++;
        }
        return prefix + n + suffix;
    }
}
