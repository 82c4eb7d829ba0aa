package com.example.redline.util.wml;

import com.example.redline.util.ooxml.OoxmlPackage;
import com.example.redline.util.wml.dto.RevisionCounts;
import com.example.redline.util.wml.preprocess.RevisionAccepter;
import com.example.redline.util.xml.XmlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 对整个 Word 包接受 / 拒绝修订（正文、脚注、尾注）
 */
@Slf4j
public class WmlRevisionProcessor {

    private WmlRevisionProcessor() {
    }

    private interface TreeOperation {
        Element apply(Element root);
    }

    public static byte[] acceptAll(byte[] document) {
        return process(document, RevisionAccepter::acceptAll);
    }

    public static byte[] rejectAll(byte[] document) {
        return process(document, RevisionAccepter::rejectAll);
    }

    public static byte[] acceptRevisions(byte[] document, Collection<Integer> revisionIds) {
        Set<String> ids = toStrings(revisionIds);
        return process(document, root -> RevisionAccepter.acceptByIds(root, ids));
    }

    public static byte[] rejectRevisions(byte[] document, Collection<Integer> revisionIds) {
        Set<String> ids = toStrings(revisionIds);
        return process(document, root -> RevisionAccepter.rejectByIds(root, ids));
    }

    private static Set<String> toStrings(Collection<Integer> ids) {
        Set<String> result = new HashSet<>();
        for (Integer id : ids) {
            result.add(String.valueOf(id));
        }
        return result;
    }

    private static byte[] process(byte[] document, TreeOperation operation) {
        try (OoxmlPackage pkg = OoxmlPackage.open(document)) {
            for (String path : revisionParts(pkg)) {
                Document doc = pkg.getXmlPart(path);
                Element root = XmlUtils.rootElement(doc);
                Element processed = operation.apply(root);
                root.replaceWith(processed);
                pkg.putXmlPart(path, doc);
            }
            return pkg.save();
        }
    }

    private static List<String> revisionParts(OoxmlPackage pkg) {
        List<String> parts = new ArrayList<>();
        String main = pkg.getMainDocumentPath();
        parts.add(main);
        for (NoteProcessor.NoteKind kind : NoteProcessor.NoteKind.values()) {
            String path = pkg.getRelatedPart(main, kind.getRelationshipType());
            if (path != null && pkg.partExists(path)) {
                parts.add(path);
            }
        }
        return parts;
    }

    // ==================== 统计 ====================

    /**
     * 统计修订数：相邻兄弟修订的类型、作者、日期都相同时只计一次
     */
    public static RevisionCounts countRevisions(byte[] document) {
        int insertions = 0;
        int deletions = 0;
        int formatChanges = 0;
        try (OoxmlPackage pkg = OoxmlPackage.open(document)) {
            for (String path : revisionParts(pkg)) {
                RevisionCounts part = countRevisions(XmlUtils.rootElement(pkg.getXmlPart(path)));
                insertions += part.getInsertions();
                deletions += part.getDeletions();
                formatChanges += part.getFormatChanges();
            }
        }
        RevisionCounts counts = new RevisionCounts(insertions, deletions, formatChanges);
        log.debug("修订统计: {}", counts);
        return counts;
    }

    public static RevisionCounts countRevisions(Element root) {
        int insertions = 0;
        int deletions = 0;
        int formatChanges = 0;
        for (Element el : root.getAllElements()) {
            String type = typeOf(el);
            if (type == null || continuesPrevious(el, type)) {
                continue;
            }
            if (type.equals("ins")) {
                insertions++;
            } else if (type.equals("del")) {
                deletions++;
            } else {
                formatChanges++;
            }
        }
        return new RevisionCounts(insertions, deletions, formatChanges);
    }

    private static String typeOf(Element el) {
        String name = el.tagName();
        if (name.equals("w:ins") || name.equals("w:moveTo")) {
            return "ins";
        }
        if (name.equals("w:del") || name.equals("w:moveFrom")) {
            return "del";
        }
        if (name.startsWith("w:") && name.endsWith("PrChange")) {
            return "fmt";
        }
        return null;
    }

    private static boolean continuesPrevious(Element el, String type) {
        Element previous = el.previousElementSibling();
        if (previous == null || !type.equals(typeOf(previous))) {
            return false;
        }
        return equal(XmlUtils.attr(previous, "w:author"), XmlUtils.attr(el, "w:author"))
                && equal(XmlUtils.attr(previous, "w:date"), XmlUtils.attr(el, "w:date"));
    }

    private static boolean equal(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }
}
