package com.example.redline.util.pml;

import com.example.redline.exception.RedlineException;
import com.example.redline.util.common.HashUtils;
import com.example.redline.util.ooxml.OoxmlPackage;
import com.example.redline.util.pml.signature.ParagraphSignature;
import com.example.redline.util.pml.signature.PlaceholderInfo;
import com.example.redline.util.pml.signature.PresentationSignature;
import com.example.redline.util.pml.signature.RunPropertiesSignature;
import com.example.redline.util.pml.signature.RunSignature;
import com.example.redline.util.pml.signature.ShapeKind;
import com.example.redline.util.pml.signature.ShapeSignature;
import com.example.redline.util.pml.signature.SlideSignature;
import com.example.redline.util.pml.signature.TextBodySignature;
import com.example.redline.util.pml.signature.TransformInfo;
import com.example.redline.util.xml.XmlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * 把演示文稿规整为签名树
 *
 * 幻灯片按 sldIdLst 顺序编号（从 1 开始）；形状只取 spTree 的直接子元素，组合形状递归收集子形状。
 */
@Slf4j
public class PmlCanonicalizer {

    static final String URI_TABLE = "http://schemas.openxmlformats.org/drawingml/2006/table";
    static final String URI_CHART = "http://schemas.openxmlformats.org/drawingml/2006/chart";
    static final String URI_DIAGRAM = "http://schemas.openxmlformats.org/drawingml/2006/diagram";

    private final PmlComparerSettings settings;

    public PmlCanonicalizer(PmlComparerSettings settings) {
        this.settings = settings;
    }

    public PresentationSignature canonicalize(OoxmlPackage pkg) {
        String presentationPath = pkg.getMainDocumentPath();
        Element presentation = XmlUtils.rootElement(pkg.getXmlPart(presentationPath));

        PresentationSignature signature = new PresentationSignature();
        Element sldSz = XmlUtils.child(presentation, "p:sldSz");
        signature.setSlideCx(parseLong(XmlUtils.attr(sldSz, "cx")));
        signature.setSlideCy(parseLong(XmlUtils.attr(sldSz, "cy")));

        String themePath = pkg.getRelatedPart(presentationPath, OoxmlPackage.REL_THEME);
        if (themePath != null) {
            byte[] theme = pkg.getPart(themePath);
            if (theme != null) {
                signature.setThemeHash(HashUtils.sha256(theme));
            }
        }

        Element sldIdLst = XmlUtils.child(presentation, "p:sldIdLst");
        int index = 1;
        for (Element sldId : XmlUtils.children(sldIdLst, "p:sldId")) {
            String relId = XmlUtils.attr(sldId, "r:id");
            if (relId == null || relId.isEmpty()) {
                throw RedlineException.invalidPackage(presentationPath, "sldId 缺少 r:id");
            }
            String slidePath = pkg.resolveRelationshipTarget(presentationPath, relId);
            if (slidePath == null || !pkg.partExists(slidePath)) {
                throw RedlineException.missingPart(presentationPath, "找不到幻灯片部件: " + relId);
            }
            signature.addSlide(canonicalizeSlide(pkg, slidePath, index, relId));
            index++;
        }
        log.debug("演示文稿规整完成: slides={}, size={}x{}", signature.getSlides().size(),
                signature.getSlideCx(), signature.getSlideCy());
        return signature;
    }

    // ==================== 幻灯片 ====================

    private SlideSignature canonicalizeSlide(OoxmlPackage pkg, String slidePath, int index, String relId) {
        Element slide = XmlUtils.rootElement(pkg.getXmlPart(slidePath));
        SlideSignature signature = new SlideSignature(index, relId, slidePath);

        signature.setLayoutHash(layoutHash(pkg, slidePath));

        Element cSld = XmlUtils.child(slide, "p:cSld");
        if (cSld == null) {
            throw RedlineException.invalidPackage(slidePath, "幻灯片缺少 cSld");
        }
        Element bg = XmlUtils.child(cSld, "p:bg");
        if (bg != null) {
            signature.setBackgroundHash(HashUtils.sha256(XmlUtils.canonicalString(bg, XmlUtils.KEEP_ALL)));
        }

        Element spTree = XmlUtils.child(cSld, "p:spTree");
        if (spTree == null) {
            throw RedlineException.invalidPackage(slidePath, "幻灯片缺少 spTree");
        }
        int zOrder = 0;
        for (Element el : spTree.children()) {
            if (!isShapeElement(el)) {
                continue;
            }
            ShapeSignature shape = canonicalizeShape(pkg, slidePath, el, zOrder++);
            if (shape.getPlaceholder() != null && shape.getPlaceholder().isTitle() && shape.getTextBody() != null
                    && signature.getTitleText() == null) {
                signature.setTitleText(shape.getPlainText());
            }
            signature.addShape(shape);
        }

        if (settings.isCompareNotes()) {
            signature.setNotesText(notesText(pkg, slidePath));
        }

        StringBuilder content = new StringBuilder(signature.getTitleText() == null ? "" : signature.getTitleText());
        for (ShapeSignature shape : signature.getShapes()) {
            content.append('|').append(shape.getName()).append(':').append(shape.getKind()).append(':');
            if (shape.getTextBody() != null) {
                content.append(shape.getPlainText());
            }
        }
        signature.setContentHash(HashUtils.sha256(content.toString()));
        return signature;
    }

    /**
     * 版式哈希：版式 type，没有 type 时取 cSld 名称，再退到部件名
     */
    private String layoutHash(OoxmlPackage pkg, String slidePath) {
        String layoutPath = pkg.getRelatedPart(slidePath, OoxmlPackage.REL_SLIDE_LAYOUT);
        if (layoutPath == null) {
            return null;
        }
        Document layout = pkg.getOptionalXmlPart(layoutPath);
        if (layout == null) {
            log.warn("版式部件不存在: {}", layoutPath);
            return HashUtils.sha256(layoutPath);
        }
        Element root = XmlUtils.rootElement(layout);
        String key = XmlUtils.attr(root, "type");
        if (key == null) {
            key = XmlUtils.attr(XmlUtils.child(root, "p:cSld"), "name");
        }
        return HashUtils.sha256(key == null ? layoutPath : key);
    }

    private String notesText(OoxmlPackage pkg, String slidePath) {
        String notesPath = pkg.getRelatedPart(slidePath, OoxmlPackage.REL_NOTES_SLIDE);
        if (notesPath == null) {
            return null;
        }
        Document notes;
        try {
            notes = pkg.getOptionalXmlPart(notesPath);
        } catch (RedlineException e) {
            log.warn("备注页解析失败，按无备注处理: {}, {}", notesPath, e.getMessage());
            return null;
        }
        if (notes == null) {
            return null;
        }
        List<String> lines = new ArrayList<>();
        for (Element sp : XmlUtils.descendants(XmlUtils.rootElement(notes), "p:sp")) {
            Element ph = XmlUtils.firstDescendant(XmlUtils.child(sp, "p:nvSpPr"), "p:ph");
            if (ph == null || !"body".equals(XmlUtils.attr(ph, "type"))) {
                continue;
            }
            Element txBody = XmlUtils.child(sp, "p:txBody");
            if (txBody != null) {
                lines.add(extractTextBody(txBody).getPlainText());
            }
        }
        return lines.isEmpty() ? null : String.join("\n", lines);
    }

    // ==================== 形状 ====================

    static boolean isShapeElement(Element el) {
        String name = el.tagName();
        return "p:sp".equals(name) || "p:pic".equals(name) || "p:graphicFrame".equals(name)
                || "p:grpSp".equals(name) || "p:cxnSp".equals(name);
    }

    private ShapeSignature canonicalizeShape(OoxmlPackage pkg, String slidePath, Element el, int zOrder) {
        ShapeSignature shape = new ShapeSignature();
        shape.setZOrder(zOrder);
        shape.setKind(kindOf(el));

        Element nvPr = nonVisualProperties(el);
        Element cNvPr = XmlUtils.child(nvPr, "p:cNvPr");
        if (cNvPr != null) {
            shape.setName(XmlUtils.attr(cNvPr, "name"));
            shape.setId((int) parseLong(XmlUtils.attr(cNvPr, "id")));
        }
        Element ph = XmlUtils.path(nvPr, "p:nvPr", "p:ph");
        if (ph != null) {
            String idx = XmlUtils.attr(ph, "idx");
            shape.setPlaceholder(new PlaceholderInfo(XmlUtils.attr(ph, "type"),
                    idx == null ? null : (int) parseLong(idx)));
        }

        Element spPr = XmlUtils.child(el, "p:spPr");
        if (spPr == null) {
            spPr = XmlUtils.child(el, "p:grpSpPr");
        }
        Element xfrm = XmlUtils.child(spPr, "a:xfrm");
        if (xfrm == null) {
            // graphicFrame 的位置在 p:xfrm
            xfrm = XmlUtils.child(el, "p:xfrm");
        }
        if (xfrm != null) {
            shape.setTransform(extractTransform(xfrm));
        }
        Element prstGeom = XmlUtils.child(spPr, "a:prstGeom");
        Element custGeom = XmlUtils.child(spPr, "a:custGeom");
        if (prstGeom != null) {
            shape.setGeometryHash(XmlUtils.attr(prstGeom, "prst"));
        } else if (custGeom != null) {
            shape.setGeometryHash(HashUtils.sha256(XmlUtils.canonicalString(custGeom, XmlUtils.KEEP_ALL)));
        }

        Element txBody = XmlUtils.child(el, "p:txBody");
        if (txBody != null) {
            shape.setTextBody(extractTextBody(txBody));
            if (shape.getKind() == ShapeKind.AutoShape && !shape.getPlainText().isEmpty()) {
                shape.setKind(ShapeKind.TextBox);
            }
        }

        switch (shape.getKind()) {
            case Picture:
                shape.setImageHash(imageHash(pkg, slidePath, el));
                break;
            case Table:
                shape.setTableHash(tableHash(el));
                break;
            case Chart:
                shape.setChartHash(chartHash(pkg, slidePath, el));
                break;
            case Group:
                int childOrder = 0;
                for (Element child : el.children()) {
                    if (isShapeElement(child)) {
                        shape.addChild(canonicalizeShape(pkg, slidePath, child, childOrder++));
                    }
                }
                break;
            default:
                break;
        }

        StringBuilder content = new StringBuilder();
        content.append(shape.getKind()).append('|');
        if (shape.getTextBody() != null) {
            content.append(shape.getPlainText());
        }
        content.append('|').append(nz(shape.getImageHash()))
                .append('|').append(nz(shape.getTableHash()))
                .append('|').append(nz(shape.getChartHash()));
        if (shape.getChildren() != null) {
            for (ShapeSignature child : shape.getChildren()) {
                content.append('|').append(child.getContentHash());
            }
        }
        shape.setContentHash(HashUtils.sha256(content.toString()));
        return shape;
    }

    static ShapeKind kindOf(Element el) {
        switch (el.tagName()) {
            case "p:sp":
                return ShapeKind.AutoShape;
            case "p:pic":
                return ShapeKind.Picture;
            case "p:grpSp":
                return ShapeKind.Group;
            case "p:cxnSp":
                return ShapeKind.Connector;
            case "p:graphicFrame":
                String uri = XmlUtils.attr(XmlUtils.path(el, "a:graphic", "a:graphicData"), "uri");
                if (URI_TABLE.equals(uri)) {
                    return ShapeKind.Table;
                }
                if (URI_CHART.equals(uri)) {
                    return ShapeKind.Chart;
                }
                if (URI_DIAGRAM.equals(uri)) {
                    return ShapeKind.SmartArt;
                }
                return ShapeKind.OleObject;
            default:
                return ShapeKind.Unknown;
        }
    }

    static Element nonVisualProperties(Element el) {
        for (String name : new String[]{"p:nvSpPr", "p:nvPicPr", "p:nvGraphicFramePr", "p:nvGrpSpPr", "p:nvCxnSpPr"}) {
            Element nv = XmlUtils.child(el, name);
            if (nv != null) {
                return nv;
            }
        }
        return null;
    }

    static TransformInfo extractTransform(Element xfrm) {
        Element off = XmlUtils.child(xfrm, "a:off");
        Element ext = XmlUtils.child(xfrm, "a:ext");
        return new TransformInfo(
                parseLong(XmlUtils.attr(off, "x")),
                parseLong(XmlUtils.attr(off, "y")),
                parseLong(XmlUtils.attr(ext, "cx")),
                parseLong(XmlUtils.attr(ext, "cy")),
                (int) parseLong(XmlUtils.attr(xfrm, "rot")),
                isTrue(XmlUtils.attr(xfrm, "flipH")),
                isTrue(XmlUtils.attr(xfrm, "flipV")));
    }

    // —— 文本 —— //

    static TextBodySignature extractTextBody(Element txBody) {
        TextBodySignature body = new TextBodySignature();
        for (Element p : XmlUtils.children(txBody, "a:p")) {
            ParagraphSignature paragraph = new ParagraphSignature();
            Element pPr = XmlUtils.child(p, "a:pPr");
            if (pPr != null) {
                paragraph.setAlignment(XmlUtils.attr(pPr, "algn"));
                paragraph.setHasBullet(XmlUtils.child(pPr, "a:buChar") != null
                        || XmlUtils.child(pPr, "a:buAutoNum") != null);
            }
            for (Element r : p.children()) {
                if (XmlUtils.is(r, "a:r")) {
                    Element t = XmlUtils.child(r, "a:t");
                    Element rPr = XmlUtils.child(r, "a:rPr");
                    paragraph.addRun(new RunSignature(t == null ? "" : XmlUtils.ownText(t),
                            rPr == null ? null : extractRunProperties(rPr)));
                } else if (XmlUtils.is(r, "a:fld")) {
                    Element t = XmlUtils.child(r, "a:t");
                    paragraph.addRun(new RunSignature(t == null ? "" : XmlUtils.ownText(t), null));
                }
            }
            body.addParagraph(paragraph);
        }
        return body;
    }

    private static RunPropertiesSignature extractRunProperties(Element rPr) {
        RunPropertiesSignature props = new RunPropertiesSignature();
        props.setBold(isTrue(XmlUtils.attr(rPr, "b")));
        props.setItalic(isTrue(XmlUtils.attr(rPr, "i")));
        String u = XmlUtils.attr(rPr, "u");
        props.setUnderline(u != null && !u.isEmpty() && !"none".equals(u));
        String strike = XmlUtils.attr(rPr, "strike");
        props.setStrikethrough(strike != null && !strike.isEmpty() && !"noStrike".equals(strike));
        String sz = XmlUtils.attr(rPr, "sz");
        props.setFontSize(sz == null ? null : (int) parseLong(sz));
        props.setFontName(XmlUtils.childAttr(rPr, "a:latin", "typeface"));
        props.setFontColor(XmlUtils.attr(XmlUtils.path(rPr, "a:solidFill", "a:srgbClr"), "val"));
        return props;
    }

    // —— 内容哈希 —— //

    /**
     * 图片按被引用部件的字节计算；关系解析失败时退回 blipFill 的结构哈希
     */
    private String imageHash(OoxmlPackage pkg, String slidePath, Element pic) {
        Element blipFill = XmlUtils.child(pic, "p:blipFill");
        Element blip = XmlUtils.child(blipFill, "a:blip");
        String embed = XmlUtils.attr(blip, "r:embed");
        String imagePath = embed == null ? null : pkg.resolveRelationshipTarget(slidePath, embed);
        byte[] bytes = imagePath == null ? null : pkg.getPart(imagePath);
        if (bytes != null) {
            return HashUtils.sha256(bytes);
        }
        log.debug("图片关系无法解析，按结构哈希: {} {}", slidePath, embed);
        return blipFill == null ? null : HashUtils.sha256(XmlUtils.canonicalString(blipFill, XmlUtils.KEEP_ALL));
    }

    /**
     * 单元格文本，行内用 | 分隔，行间换行
     */
    static String tableHash(Element graphicFrame) {
        Element tbl = XmlUtils.firstDescendant(graphicFrame, "a:tbl");
        if (tbl == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (Element tr : XmlUtils.children(tbl, "a:tr")) {
            for (Element tc : XmlUtils.children(tr, "a:tc")) {
                sb.append(XmlUtils.collectText(tc, "a:t")).append('|');
            }
            sb.append('\n');
        }
        return HashUtils.sha256(sb.toString());
    }

    private String chartHash(OoxmlPackage pkg, String slidePath, Element graphicFrame) {
        Element chartRef = XmlUtils.firstDescendant(graphicFrame, "c:chart");
        String relId = XmlUtils.attr(chartRef, "r:id");
        String chartPath = relId == null ? null : pkg.resolveRelationshipTarget(slidePath, relId);
        Document chart = null;
        if (chartPath != null) {
            try {
                chart = pkg.getOptionalXmlPart(chartPath);
            } catch (RedlineException e) {
                log.debug("图表部件解析失败: {}, {}", chartPath, e.getMessage());
            }
        }
        if (chart != null) {
            return HashUtils.sha256(XmlUtils.canonicalString(XmlUtils.rootElement(chart), XmlUtils.KEEP_ALL));
        }
        log.debug("图表关系无法解析，按结构哈希: {} {}", slidePath, relId);
        return HashUtils.sha256(XmlUtils.canonicalString(graphicFrame, XmlUtils.KEEP_ALL));
    }

    // —— 工具 —— //

    static long parseLong(String value) {
        if (value == null || value.isEmpty()) {
            return 0;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static boolean isTrue(String value) {
        return "1".equals(value) || "true".equals(value);
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
