package com.example.redline.util.wml;

import com.example.redline.exception.RedlineException;
import com.example.redline.util.ooxml.OoxmlPackage;
import com.example.redline.util.wml.atom.Atom;
import com.example.redline.util.wml.atom.Atomizer;
import com.example.redline.util.wml.dto.ChangeEvent;
import com.example.redline.util.wml.dto.RevisionCounts;
import com.example.redline.util.wml.dto.WmlChange;
import com.example.redline.util.wml.dto.WmlChangeListItem;
import com.example.redline.util.wml.dto.WmlChangeListOptions;
import com.example.redline.util.wml.dto.WmlComparisonResult;
import com.example.redline.util.wml.lcs.CorrelatedSequence;
import com.example.redline.util.wml.lcs.WmlCorrelator;
import com.example.redline.util.wml.preprocess.MarkupSimplifier;
import com.example.redline.util.wml.preprocess.RevisionAccepter;
import com.example.redline.util.wml.preprocess.UnidAssigner;
import com.example.redline.util.wml.unit.ComparisonUnit;
import com.example.redline.util.wml.unit.UnitGrouper;
import com.example.redline.util.xml.Namespaces;
import com.example.redline.util.xml.XmlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Word 文档比对
 *
 * 流程：预处理 → 原子化 → 分组 → 相关性求解 → 格式比对 → 重建 → 修订标记 → 提取变更。
 * 输出建立在新文档的包上，只替换正文、脚注、尾注部件。
 */
@Slf4j
public class WmlComparer {

    private WmlComparer() {
    }

    public static WmlComparisonResult compare(byte[] older, byte[] newer) {
        return compare(older, newer, new WmlComparerSettings());
    }

    public static WmlComparisonResult compare(byte[] older, byte[] newer, WmlComparerSettings settings) {
        long start = System.currentTimeMillis();
        WmlComparerSettings s = settings == null ? new WmlComparerSettings() : settings;

        try (OoxmlPackage pkg1 = OoxmlPackage.open(older); OoxmlPackage pkg2 = OoxmlPackage.open(newer)) {
            String main1 = pkg1.getMainDocumentPath();
            String main2 = pkg2.getMainDocumentPath();
            Document doc1 = pkg1.getXmlPart(main1);
            Document doc2 = pkg2.getXmlPart(main2);
            Element body1 = bodyOf(doc1, main1);
            Element body2 = bodyOf(doc2, main2);

            String author = resolveAuthor(s, pkg2);
            String date = resolveDate(s, pkg2);

            Element prepared1 = prepare(body1, s);
            Element prepared2 = prepare(body2, s);
            List<Atom> atoms1 = Atomizer.atomize(prepared1, "main", main1, pkg1, s);
            List<Atom> atoms2 = Atomizer.atomize(prepared2, "main", main2, pkg2, s);
            log.info("Word比对: atoms1={}, atoms2={}", atoms1.size(), atoms2.size());

            WmlComparisonResult result = new WmlComparisonResult();
            if (atoms1.isEmpty() && atoms2.isEmpty()) {
                result.setDocument(newer);
                return result;
            }

            new RelationshipMigrator(pkg1, main1, pkg2, main2).migrate(prepared1);

            List<Atom> atoms = correlateAtoms(atoms1, atoms2, s);
            List<ChangeEvent> events = new ArrayList<>(ChangeEvents.emit(atoms, author, date));

            // 重建正文
            Element newBody = Coalescer.coalesce(atoms, s, "w:body");
            RevisionDecorator decorator = new RevisionDecorator(author, date,
                    new RevisionIdGenerator(s.getStartingRevisionId()));
            decorator.decorate(newBody);
            Element sectPr = XmlUtils.child(body2, "w:sectPr");
            if (sectPr != null) {
                newBody.appendChild(sectPr.clone());
            }
            body2.replaceWith(newBody);
            declareNamespaces(XmlUtils.rootElement(doc2));

            // 脚注 / 尾注
            List<Element> roots = new ArrayList<>();
            roots.add(newBody);
            for (NoteProcessor.NoteKind kind : NoteProcessor.NoteKind.values()) {
                NoteProcessor notes = new NoteProcessor(kind, s, decorator, author, date);
                Element notesRoot = notes.process(pkg1, main1, pkg2, main2);
                if (notesRoot != null) {
                    roots.add(notesRoot);
                    events.addAll(notes.getEvents());
                }
            }

            pkg2.putXmlPart(main2, doc2);
            result.setDocument(pkg2.save());

            List<WmlChange> changes = ChangeExtractor.extractAll(roots, author, date);
            RevisionCounts counts = ChangeEvents.count(events);
            result.setChanges(changes);
            result.setEvents(events);
            result.setInsertions(counts.getInsertions());
            result.setDeletions(counts.getDeletions());
            result.setFormatChanges(counts.getFormatChanges());
            log.info("Word比对完成: changes={}, revisions={}, 耗时={}ms", changes.size(),
                    result.getRevisionCount(), System.currentTimeMillis() - start);
            return result;
        }
    }

    /**
     * 提取带修订标记的文档中的变更（正文、脚注、尾注）
     */
    public static List<WmlChange> getChanges(byte[] document) {
        try (OoxmlPackage pkg = OoxmlPackage.open(document)) {
            String main = pkg.getMainDocumentPath();
            Document doc = pkg.getXmlPart(main);
            List<Element> roots = new ArrayList<>();
            roots.add(bodyOf(doc, main));
            for (NoteProcessor.NoteKind kind : NoteProcessor.NoteKind.values()) {
                String path = pkg.getRelatedPart(main, kind.getRelationshipType());
                Document notes = path == null ? null : pkg.getOptionalXmlPart(path);
                if (notes != null) {
                    roots.add(XmlUtils.rootElement(notes));
                }
            }
            return ChangeExtractor.extractAll(roots, null, null);
        }
    }

    public static List<WmlChangeListItem> getChangeList(byte[] document, WmlChangeListOptions options) {
        return WmlChangeListBuilder.build(getChanges(document),
                options == null ? WmlChangeListOptions.defaults() : options);
    }

    // ==================== 流水线步骤 ====================

    /**
     * 预处理内容根的副本：简化标记、分配 Unid、接受已有修订、计算块哈希
     */
    static Element prepare(Element content, WmlComparerSettings settings) {
        Element copy = content.clone();
        MarkupSimplifier.simplify(copy);
        UnidAssigner.assign(copy);
        RevisionAccepter.acceptAllInPlace(copy);
        UnidAssigner.assign(copy);
        BlockHasher.apply(copy, copy, settings);
        return copy;
    }

    /**
     * 分组、求解相关性并展开为带状态的原子序列，计算重建用的祖先 Unid
     */
    static List<Atom> correlateAtoms(List<Atom> atoms1, List<Atom> atoms2, WmlComparerSettings settings) {
        List<ComparisonUnit> units1 = UnitGrouper.group(atoms1, settings);
        List<ComparisonUnit> units2 = UnitGrouper.group(atoms2, settings);
        List<CorrelatedSequence> sequences = WmlCorrelator.correlate(units1, units2, settings);
        List<Atom> atoms = WmlCorrelator.flattenToAtoms(sequences);
        AncestorUnidAssembler.assemble(atoms);
        AncestorUnidAssembler.normalizeTextboxes(atoms);
        if (settings.isTrackFormattingChanges()) {
            FormattingReconciler.reconcile(atoms);
        }
        if (log.isDebugEnabled()) {
            log.debug("相关性结果: {}", WmlCorrelator.summarize(atoms));
        }
        return atoms;
    }

    private static Element bodyOf(Document doc, String path) {
        Element root = XmlUtils.rootElement(doc);
        Element body = XmlUtils.child(root, "w:body");
        if (body == null) {
            throw RedlineException.invalidPackage(path, "主文档缺少 w:body");
        }
        return body;
    }

    private static void declareNamespaces(Element root) {
        XmlUtils.ensureNamespace(root, "w", Namespaces.W);
        XmlUtils.ensureNamespace(root, "r", Namespaces.R);
        XmlUtils.ensureNamespace(root, "m", Namespaces.M);
        XmlUtils.ensureNamespace(root, "mc", Namespaces.MC);
        XmlUtils.ensureNamespace(root, "wp", Namespaces.WP);
        XmlUtils.ensureNamespace(root, "a", Namespaces.A);
        XmlUtils.ensureNamespace(root, "pic", Namespaces.PIC);
        XmlUtils.ensureNamespace(root, "v", Namespaces.V);
        XmlUtils.ensureNamespace(root, "o", Namespaces.O);
        XmlUtils.ensureNamespace(root, "w14", Namespaces.W14);
    }

    // —— 作者 / 日期 —— //

    static String resolveAuthor(WmlComparerSettings settings, OoxmlPackage pkg) {
        if (settings.getAuthor() != null && !settings.getAuthor().trim().isEmpty()) {
            return settings.getAuthor();
        }
        String modifiedBy = pkg.getCoreProperty("lastModifiedBy");
        if (modifiedBy != null) {
            return modifiedBy;
        }
        String creator = pkg.getCoreProperty("creator");
        return creator != null ? creator : "Unknown";
    }

    static String resolveDate(WmlComparerSettings settings, OoxmlPackage pkg) {
        if (settings.getDateTime() != null && !settings.getDateTime().trim().isEmpty()) {
            return settings.getDateTime();
        }
        String modified = pkg.getCoreProperty("modified");
        if (modified != null) {
            return modified;
        }
        return Instant.now().truncatedTo(ChronoUnit.SECONDS).toString();
    }
}
