package com.example.redline.util.pml;

import com.example.redline.util.ooxml.OoxmlPackage;
import com.example.redline.util.pml.dto.PmlChange;
import com.example.redline.util.pml.dto.PmlChangeType;
import com.example.redline.util.xml.XmlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 按变更列表修改演示文稿的形状
 *
 * apply 作用在旧演示文稿上，revert 作用在新演示文稿（或比对结果）上。
 * 只处理 TextChanged、ShapeMoved、ShapeResized、ShapeRotated，其余类型忽略。
 */
@Slf4j
public class PmlPatcher {

    private PmlPatcher() {
    }

    public static byte[] apply(byte[] older, List<PmlChange> changes) {
        return patch(older, changes, null, false);
    }

    /**
     * @param ids 只处理这些变更 id，为 null 时处理全部
     */
    public static byte[] apply(byte[] older, List<PmlChange> changes, Set<String> ids) {
        return patch(older, changes, ids, false);
    }

    public static byte[] revert(byte[] newer, List<PmlChange> changes) {
        return patch(newer, changes, null, true);
    }

    public static byte[] revert(byte[] newer, List<PmlChange> changes, Set<String> ids) {
        return patch(newer, changes, ids, true);
    }

    static boolean isPatchable(PmlChange change) {
        PmlChangeType type = change.getChangeType();
        return change.getSlideIndex() != null
                && (type == PmlChangeType.TextChanged || type == PmlChangeType.ShapeMoved
                || type == PmlChangeType.ShapeResized || type == PmlChangeType.ShapeRotated);
    }

    private static byte[] patch(byte[] bytes, List<PmlChange> changes, Set<String> ids, boolean revert) {
        try (OoxmlPackage pkg = OoxmlPackage.open(bytes)) {
            Map<Integer, String> slides = PmlMarkupRenderer.slidePaths(pkg, pkg.getMainDocumentPath());
            Map<String, Document> touched = new LinkedHashMap<>();
            int applied = 0;
            for (PmlChange change : changes) {
                if (!isPatchable(change) || (ids != null && !ids.contains(change.getId()))) {
                    continue;
                }
                int slideIndex = !revert && change.getOldSlideIndex() != null
                        ? change.getOldSlideIndex() : change.getSlideIndex();
                String slidePath = slides.get(slideIndex);
                if (slidePath == null) {
                    log.warn("幻灯片不存在，跳过变更 {}: slide={}", change.getId(), slideIndex);
                    continue;
                }
                Document doc = touched.get(slidePath);
                if (doc == null) {
                    doc = pkg.getXmlPart(slidePath);
                    touched.put(slidePath, doc);
                }
                Element shape = findShape(XmlUtils.rootElement(doc), change, revert);
                if (shape == null) {
                    log.warn("形状不存在，跳过变更 {}: {}", change.getId(), change.getShapeName());
                    continue;
                }
                if (change.getChangeType() == PmlChangeType.TextChanged) {
                    if (!replaceText(shape, revert ? change.getOldValue() : change.getNewValue())) {
                        log.warn("形状没有文本框，跳过变更 {}: {}", change.getId(), change.getShapeName());
                        continue;
                    }
                } else {
                    patchTransform(shape, change, revert);
                }
                applied++;
            }
            for (Map.Entry<String, Document> entry : touched.entrySet()) {
                pkg.putXmlPart(entry.getKey(), entry.getValue());
            }
            log.debug("{} 形状变更 {} 条", revert ? "撤销" : "应用", applied);
            return pkg.save();
        }
    }

    /**
     * 变更记录的是新文稿的形状 id，撤销时按 id 找；应用到旧文稿时按名称找，找不到再按 id
     */
    private static Element findShape(Element root, PmlChange change, boolean revert) {
        Element byId = null;
        Element byName = null;
        for (Element cNvPr : XmlUtils.descendants(XmlUtils.path(root, "p:cSld", "p:spTree"), "p:cNvPr")) {
            Element shape = cNvPr.parent() == null ? null : cNvPr.parent().parent();
            if (shape == null || !PmlCanonicalizer.isShapeElement(shape)) {
                continue;
            }
            if (byId == null && change.getShapeId() != null && change.getShapeId().equals(XmlUtils.attr(cNvPr, "id"))) {
                byId = shape;
            }
            if (byName == null && change.getShapeName() != null && change.getShapeName().equals(XmlUtils.attr(cNvPr, "name"))) {
                byName = shape;
            }
        }
        if (revert) {
            return byId != null ? byId : byName;
        }
        return byName != null ? byName : byId;
    }

    // ==================== 文本 ====================

    /**
     * 用给定文本重写 txBody 的段落，保留首段段落属性和首个文字段的字符属性
     */
    static boolean replaceText(Element shape, String text) {
        Element txBody = XmlUtils.child(shape, "p:txBody");
        if (txBody == null) {
            return false;
        }
        List<Element> paragraphs = XmlUtils.children(txBody, "a:p");
        Element pPr = null;
        Element rPr = null;
        if (!paragraphs.isEmpty()) {
            pPr = XmlUtils.child(paragraphs.get(0), "a:pPr");
            Element firstRun = XmlUtils.firstDescendant(paragraphs.get(0), "a:r");
            rPr = XmlUtils.child(firstRun, "a:rPr");
        }
        for (Element p : new ArrayList<>(paragraphs)) {
            p.remove();
        }
        String[] lines = (text == null ? "" : text).split("\n", -1);
        for (String line : lines) {
            Element p = XmlUtils.newElement("a:p");
            if (pPr != null) {
                p.appendChild(pPr.clone());
            }
            if (!line.isEmpty()) {
                Element r = XmlUtils.newElement("a:r");
                if (rPr != null) {
                    r.appendChild(rPr.clone());
                }
                Element t = XmlUtils.newElement("a:t");
                XmlUtils.setText(t, line);
                r.appendChild(t);
                p.appendChild(r);
            }
            txBody.appendChild(p);
        }
        return true;
    }

    // ==================== 位置 ====================

    private static void patchTransform(Element shape, PmlChange change, boolean revert) {
        Element xfrm = findOrCreateXfrm(shape, change, revert);
        switch (change.getChangeType()) {
            case ShapeMoved: {
                Long x = revert ? change.getOldX() : change.getNewX();
                Long y = revert ? change.getOldY() : change.getNewY();
                Element off = childOrCreate(xfrm, "a:off", true);
                XmlUtils.setAttr(off, "x", String.valueOf(x == null ? 0 : x));
                XmlUtils.setAttr(off, "y", String.valueOf(y == null ? 0 : y));
                break;
            }
            case ShapeResized: {
                Long cx = revert ? change.getOldCx() : change.getNewCx();
                Long cy = revert ? change.getOldCy() : change.getNewCy();
                Element ext = childOrCreate(xfrm, "a:ext", false);
                XmlUtils.setAttr(ext, "cx", String.valueOf(cx == null ? 0 : cx));
                XmlUtils.setAttr(ext, "cy", String.valueOf(cy == null ? 0 : cy));
                break;
            }
            default: {
                Integer rot = revert ? change.getOldRotation() : change.getNewRotation();
                if (rot == null || rot == 0) {
                    xfrm.removeAttr("rot");
                } else {
                    XmlUtils.setAttr(xfrm, "rot", String.valueOf(rot));
                }
                break;
            }
        }
    }

    /**
     * 继承版式位置的占位符没有 xfrm，新建时用变更里记录的完整变换
     */
    private static Element findOrCreateXfrm(Element shape, PmlChange change, boolean revert) {
        Element frameXfrm = XmlUtils.child(shape, "p:xfrm");
        if (frameXfrm != null) {
            return frameXfrm;
        }
        Element spPr = XmlUtils.child(shape, "p:spPr");
        if (spPr == null) {
            spPr = XmlUtils.child(shape, "p:grpSpPr");
        }
        if (spPr == null) {
            spPr = XmlUtils.newElement("p:spPr");
            Element nv = PmlCanonicalizer.nonVisualProperties(shape);
            if (nv != null) {
                nv.after(spPr);
            } else {
                shape.prependChild(spPr);
            }
        }
        Element xfrm = XmlUtils.child(spPr, "a:xfrm");
        if (xfrm != null) {
            return xfrm;
        }
        xfrm = XmlUtils.newElement("a:xfrm");
        Long x = revert ? change.getNewX() : change.getOldX();
        Long y = revert ? change.getNewY() : change.getOldY();
        Long cx = revert ? change.getNewCx() : change.getOldCx();
        Long cy = revert ? change.getNewCy() : change.getOldCy();
        Element off = XmlUtils.newElement("a:off", "x", String.valueOf(x == null ? 0 : x));
        XmlUtils.setAttr(off, "y", String.valueOf(y == null ? 0 : y));
        Element ext = XmlUtils.newElement("a:ext", "cx", String.valueOf(cx == null ? 0 : cx));
        XmlUtils.setAttr(ext, "cy", String.valueOf(cy == null ? 0 : cy));
        xfrm.appendChild(off);
        xfrm.appendChild(ext);
        spPr.prependChild(xfrm);
        return xfrm;
    }

    private static Element childOrCreate(Element xfrm, String name, boolean first) {
        Element child = XmlUtils.child(xfrm, name);
        if (child == null) {
            child = XmlUtils.newElement(name);
            if (first) {
                xfrm.prependChild(child);
            } else {
                xfrm.appendChild(child);
            }
        }
        return child;
    }
}
