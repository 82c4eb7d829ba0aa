package com.example.redline.util.pml;

import com.example.redline.util.lcs.SequenceAligner;
import com.example.redline.util.pml.dto.PmlChange;
import com.example.redline.util.pml.dto.PmlChangeType;
import com.example.redline.util.pml.dto.PmlComparisonResult;
import com.example.redline.util.pml.dto.PmlTextChange;
import com.example.redline.util.pml.signature.ParagraphSignature;
import com.example.redline.util.pml.signature.PresentationSignature;
import com.example.redline.util.pml.signature.ShapeSignature;
import com.example.redline.util.pml.signature.SlideSignature;
import com.example.redline.util.pml.signature.TextBodySignature;
import com.example.redline.util.pml.signature.TransformInfo;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 演示文稿签名比对
 *
 * 先比较幻灯片尺寸和主题，再逐对比较配对的幻灯片与形状。
 */
@Slf4j
public class PmlDiffEngine {

    private final PmlComparerSettings settings;

    public PmlDiffEngine(PmlComparerSettings settings) {
        this.settings = settings;
    }

    public PmlComparisonResult diff(PresentationSignature p1, PresentationSignature p2) {
        PmlComparisonResult result = new PmlComparisonResult();

        if (p1.getSlideCx() != p2.getSlideCx() || p1.getSlideCy() != p2.getSlideCy()) {
            PmlChange change = new PmlChange(PmlChangeType.SlideSizeChanged, null);
            change.setOldValue(p1.getSlideCx() + "x" + p1.getSlideCy());
            change.setNewValue(p2.getSlideCx() + "x" + p2.getSlideCy());
            result.addChange(change);
        }
        if (!Objects.equals(p1.getThemeHash(), p2.getThemeHash())) {
            result.addChange(new PmlChange(PmlChangeType.ThemeChanged, null));
        }

        List<SlideMatcher.SlideMatch> matches = SlideMatcher.match(p1, p2, settings);
        log.debug("幻灯片配对: slides1={}, slides2={}, matches={}",
                p1.getSlides().size(), p2.getSlides().size(), matches.size());
        for (SlideMatcher.SlideMatch match : matches) {
            switch (match.getType()) {
                case Inserted:
                    if (settings.isCompareSlideStructure()) {
                        result.addChange(new PmlChange(PmlChangeType.SlideInserted, match.getNewIndex()));
                    }
                    break;
                case Deleted:
                    if (settings.isCompareSlideStructure()) {
                        PmlChange change = new PmlChange(PmlChangeType.SlideDeleted, match.getOldIndex());
                        change.setOldSlideIndex(match.getOldIndex());
                        result.addChange(change);
                    }
                    break;
                default:
                    if (settings.isCompareSlideStructure() && match.wasMoved()) {
                        PmlChange change = new PmlChange(PmlChangeType.SlideMoved, match.getNewIndex());
                        change.setOldSlideIndex(match.getOldIndex());
                        change.setMatchConfidence(match.getSimilarity());
                        result.addChange(change);
                    }
                    int before = result.getChanges().size();
                    compareSlides(match.getOldSlide(), match.getNewSlide(), result);
                    // 移动过的幻灯片，其下变更一律带旧位置
                    if (match.wasMoved()) {
                        for (PmlChange c : result.getChanges().subList(before, result.getChanges().size())) {
                            c.setOldSlideIndex(match.getOldIndex());
                        }
                    }
                    break;
            }
        }
        return result;
    }

    // ==================== 幻灯片 ====================

    private void compareSlides(SlideSignature s1, SlideSignature s2, PmlComparisonResult result) {
        int slideIndex = s2.getIndex();
        if (!Objects.equals(s1.getLayoutHash(), s2.getLayoutHash())) {
            result.addChange(slideChange(PmlChangeType.SlideLayoutChanged, s1, s2));
        }
        if (!Objects.equals(s1.getBackgroundHash(), s2.getBackgroundHash())) {
            result.addChange(slideChange(PmlChangeType.SlideBackgroundChanged, s1, s2));
        }
        if (settings.isCompareNotes() && !Objects.equals(nz(s1.getNotesText()), nz(s2.getNotesText()))) {
            PmlChange change = slideChange(PmlChangeType.SlideNotesChanged, s1, s2);
            change.setOldValue(s1.getNotesText());
            change.setNewValue(s2.getNotesText());
            result.addChange(change);
        }
        if (!settings.isCompareShapeStructure()) {
            return;
        }

        List<ShapeMatcher.ShapeMatch> shapeMatches = ShapeMatcher.match(s1, s2, settings);
        Map<ShapeSignature, Integer> oldRanks = new HashMap<>();
        Map<ShapeSignature, Integer> newRanks = new HashMap<>();
        rankMatched(shapeMatches, oldRanks, newRanks);

        for (ShapeMatcher.ShapeMatch match : shapeMatches) {
            switch (match.getType()) {
                case Inserted:
                    result.addChange(shapeChange(PmlChangeType.ShapeInserted, slideIndex, match.getNewShape()));
                    break;
                case Deleted:
                    PmlChange deleted = shapeChange(PmlChangeType.ShapeDeleted, slideIndex, match.getOldShape());
                    deleted.setOldValue(match.getOldShape().getPlainText());
                    result.addChange(deleted);
                    break;
                default:
                    ShapeSignature sh1 = match.getOldShape();
                    ShapeSignature sh2 = match.getNewShape();
                    compareShapes(sh1, sh2, slideIndex, match.getScore(), result);
                    if (!Objects.equals(oldRanks.get(sh1), newRanks.get(sh2))) {
                        PmlChange z = shapeChange(PmlChangeType.ShapeZOrderChanged, slideIndex, sh2);
                        z.setOldValue(String.valueOf(sh1.getZOrder()));
                        z.setNewValue(String.valueOf(sh2.getZOrder()));
                        z.setMatchConfidence(match.getScore());
                        result.addChange(z);
                    }
                    break;
            }
        }
    }

    /**
     * 只在配对成功的形状之间比较层次，插入或删除形状引起的位移不算层次变化
     */
    private static void rankMatched(List<ShapeMatcher.ShapeMatch> matches,
                                    Map<ShapeSignature, Integer> oldRanks, Map<ShapeSignature, Integer> newRanks) {
        List<ShapeMatcher.ShapeMatch> matched = new ArrayList<>();
        for (ShapeMatcher.ShapeMatch m : matches) {
            if (m.getType() == ShapeMatcher.MatchType.Matched) {
                matched.add(m);
            }
        }
        matched.sort(Comparator.comparingInt(m -> m.getOldShape().getZOrder()));
        for (int i = 0; i < matched.size(); i++) {
            oldRanks.put(matched.get(i).getOldShape(), i);
        }
        matched.sort(Comparator.comparingInt(m -> m.getNewShape().getZOrder()));
        for (int i = 0; i < matched.size(); i++) {
            ShapeMatcher.ShapeMatch m = matched.get(i);
            newRanks.put(m.getNewShape(), i);
        }
    }

    // ==================== 形状 ====================

    private void compareShapes(ShapeSignature sh1, ShapeSignature sh2, int slideIndex, double score,
                               PmlComparisonResult result) {
        TransformInfo t1 = sh1.getTransform();
        TransformInfo t2 = sh2.getTransform();
        if (settings.isCompareShapeTransforms() && t1 != null && t2 != null) {
            long tolerance = settings.getPositionTolerance();
            if (!t1.isNear(t2, tolerance)) {
                result.addChange(transformChange(PmlChangeType.ShapeMoved, slideIndex, sh2, t1, t2, score));
            }
            if (!t1.isSameSize(t2, tolerance)) {
                result.addChange(transformChange(PmlChangeType.ShapeResized, slideIndex, sh2, t1, t2, score));
            }
            if (t1.getRotation() != t2.getRotation()) {
                result.addChange(transformChange(PmlChangeType.ShapeRotated, slideIndex, sh2, t1, t2, score));
            }
        }

        switch (sh1.getKind()) {
            case TextBox:
            case AutoShape:
                if (settings.isCompareTextContent()) {
                    compareText(sh1, sh2, slideIndex, score, result);
                }
                break;
            case Picture:
                if (!Objects.equals(sh1.getImageHash(), sh2.getImageHash())) {
                    result.addChange(shapeChange(PmlChangeType.ImageReplaced, slideIndex, sh2));
                }
                break;
            case Table:
                if (!Objects.equals(sh1.getTableHash(), sh2.getTableHash())) {
                    result.addChange(shapeChange(PmlChangeType.TableContentChanged, slideIndex, sh2));
                }
                break;
            case Chart:
                if (!Objects.equals(sh1.getChartHash(), sh2.getChartHash())) {
                    result.addChange(shapeChange(PmlChangeType.ChartDataChanged, slideIndex, sh2));
                }
                break;
            default:
                // 组合、连接线等：文本变化按文本报告，其余内容变化不细分
                if (settings.isCompareTextContent() && !Objects.equals(sh1.getContentHash(), sh2.getContentHash())
                        && (sh1.getTextBody() != null || sh2.getTextBody() != null)) {
                    compareText(sh1, sh2, slideIndex, score, result);
                }
                break;
        }
    }

    private void compareText(ShapeSignature sh1, ShapeSignature sh2, int slideIndex, double score,
                             PmlComparisonResult result) {
        TextBodySignature b1 = sh1.getTextBody();
        TextBodySignature b2 = sh2.getTextBody();
        if (b1 == null && b2 == null) {
            return;
        }
        String text1 = b1 == null ? "" : b1.getPlainText();
        String text2 = b2 == null ? "" : b2.getPlainText();
        if (!text1.equals(text2)) {
            PmlChange change = shapeChange(PmlChangeType.TextChanged, slideIndex, sh2);
            change.setOldValue(text1);
            change.setNewValue(text2);
            change.setTextChanges(paragraphChanges(b1, b2));
            change.setMatchConfidence(score);
            result.addChange(change);
        } else if (settings.isCompareTextFormatting() && b1 != null && b2 != null && b1.hasFormattingChanges(b2)) {
            PmlChange change = shapeChange(PmlChangeType.TextFormattingChanged, slideIndex, sh2);
            change.setMatchConfidence(score);
            result.addChange(change);
        }
    }

    /**
     * 按段落文本对齐；相邻的删除加插入合成替换
     */
    static List<PmlTextChange> paragraphChanges(TextBodySignature b1, TextBodySignature b2) {
        List<String> paras1 = paragraphTexts(b1);
        List<String> paras2 = paragraphTexts(b2);
        List<PmlTextChange> changes = new ArrayList<>();
        PmlTextChange pendingDelete = null;
        for (int[] pair : SequenceAligner.align(paras1, paras2)) {
            if (pair[0] >= 0 && pair[1] >= 0) {
                pendingDelete = null;
                continue;
            }
            if (pair[1] < 0) {
                pendingDelete = new PmlTextChange(PmlTextChange.Kind.Delete, pair[0], paras1.get(pair[0]), null);
                changes.add(pendingDelete);
            } else if (pendingDelete != null) {
                pendingDelete.setType(PmlTextChange.Kind.Replace);
                pendingDelete.setParagraphIndex(pair[1]);
                pendingDelete.setNewText(paras2.get(pair[1]));
                pendingDelete = null;
            } else {
                changes.add(new PmlTextChange(PmlTextChange.Kind.Insert, pair[1], null, paras2.get(pair[1])));
            }
        }
        return changes;
    }

    private static List<String> paragraphTexts(TextBodySignature body) {
        List<String> result = new ArrayList<>();
        if (body != null) {
            for (ParagraphSignature p : body.getParagraphs()) {
                result.add(p.getPlainText());
            }
        }
        return result;
    }

    // —— 变更构造 —— //

    private static PmlChange slideChange(PmlChangeType type, SlideSignature s1, SlideSignature s2) {
        PmlChange change = new PmlChange(type, s2.getIndex());
        if (s1.getIndex() != s2.getIndex()) {
            change.setOldSlideIndex(s1.getIndex());
        }
        return change;
    }

    private static PmlChange shapeChange(PmlChangeType type, int slideIndex, ShapeSignature shape) {
        PmlChange change = new PmlChange(type, slideIndex);
        change.setShapeName(shape.getName());
        change.setShapeId(String.valueOf(shape.getId()));
        TransformInfo t = shape.getTransform();
        if (t != null && type == PmlChangeType.ShapeDeleted) {
            change.setOldX(t.getX());
            change.setOldY(t.getY());
            change.setOldCx(t.getCx());
            change.setOldCy(t.getCy());
        } else if (t != null) {
            change.setNewX(t.getX());
            change.setNewY(t.getY());
            change.setNewCx(t.getCx());
            change.setNewCy(t.getCy());
        }
        return change;
    }

    private static PmlChange transformChange(PmlChangeType type, int slideIndex, ShapeSignature shape,
                                             TransformInfo t1, TransformInfo t2, double score) {
        PmlChange change = shapeChange(type, slideIndex, shape);
        change.setOldX(t1.getX());
        change.setOldY(t1.getY());
        change.setOldCx(t1.getCx());
        change.setOldCy(t1.getCy());
        change.setOldRotation(t1.getRotation());
        change.setNewRotation(t2.getRotation());
        change.setMatchConfidence(score);
        return change;
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
