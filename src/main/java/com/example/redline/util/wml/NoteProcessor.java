package com.example.redline.util.wml;

import com.example.redline.util.ooxml.OoxmlPackage;
import com.example.redline.util.wml.atom.Atom;
import com.example.redline.util.wml.atom.Atomizer;
import com.example.redline.util.wml.dto.ChangeEvent;
import com.example.redline.util.wml.lcs.CorrelationStatus;
import com.example.redline.util.xml.XmlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 脚注 / 尾注比对
 *
 * 按注释 id 成对比较，每一对走与正文相同的流程，重建结果替换新文档中的同 id 注释。
 * 只存在于旧文档的注释整体标为删除后追加，保证被删除的引用仍能找到注释。
 */
@Slf4j
public class NoteProcessor {

    public enum NoteKind {
        FOOTNOTE("w:footnotes", "w:footnote", "w:footnoteRef", OoxmlPackage.REL_FOOTNOTES, "footnotes"),
        ENDNOTE("w:endnotes", "w:endnote", "w:endnoteRef", OoxmlPackage.REL_ENDNOTES, "endnotes");

        private final String containerName;
        private final String noteName;
        private final String refMarkName;
        private final String relationshipType;
        private final String partName;

        NoteKind(String containerName, String noteName, String refMarkName, String relationshipType,
                 String partName) {
            this.containerName = containerName;
            this.noteName = noteName;
            this.refMarkName = refMarkName;
            this.relationshipType = relationshipType;
            this.partName = partName;
        }

        public String getRelationshipType() {
            return relationshipType;
        }
    }

    private final NoteKind kind;
    private final WmlComparerSettings settings;
    private final RevisionDecorator decorator;
    private final String author;
    private final String date;
    private final List<ChangeEvent> events = new ArrayList<>();

    public NoteProcessor(NoteKind kind, WmlComparerSettings settings, RevisionDecorator decorator, String author,
                         String date) {
        this.kind = kind;
        this.settings = settings;
        this.decorator = decorator;
        this.author = author;
        this.date = date;
    }

    /**
     * 比较两个包的注释部件并写回新包
     *
     * @return 写回后的注释根元素；新文档没有该部件时返回 null
     */
    public Element process(OoxmlPackage pkg1, String main1, OoxmlPackage pkg2, String main2) {
        String path2 = pkg2.getRelatedPart(main2, kind.relationshipType);
        if (path2 == null) {
            log.debug("新文档没有{}部件", kind.partName);
            return null;
        }
        String path1 = pkg1.getRelatedPart(main1, kind.relationshipType);
        Document doc2 = pkg2.getXmlPart(path2);
        Document doc1 = path1 == null ? null : pkg1.getOptionalXmlPart(path1);
        Element root2 = XmlUtils.rootElement(doc2);
        Map<String, Element> notes1 = doc1 == null
                ? new LinkedHashMap<String, Element>() : notesById(XmlUtils.rootElement(doc1));
        RelationshipMigrator migrator = path1 == null ? null : new RelationshipMigrator(pkg1, path1, pkg2, path2);

        int changed = 0;
        for (Element note2 : notesById(root2).values()) {
            Element note1 = notes1.remove(XmlUtils.attr(note2, "w:id"));
            Element rebuilt = compareNote(note1, note2, pkg1, path1, pkg2, path2, migrator);
            if (rebuilt != null) {
                note2.replaceWith(rebuilt);
                changed++;
            }
        }
        for (Element deleted : notes1.values()) {
            Element rebuilt = compareNote(deleted, null, pkg1, path1, pkg2, path2, migrator);
            if (rebuilt != null) {
                root2.appendChild(rebuilt);
                changed++;
            }
        }

        if (changed > 0) {
            pkg2.putXmlPart(path2, doc2);
        }
        log.debug("{}比对: changed={}, events={}", kind.partName, changed, events.size());
        return root2;
    }

    public List<ChangeEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    /**
     * 比较一对注释，没有变化时返回 null（保留原注释）
     */
    private Element compareNote(Element note1, Element note2, OoxmlPackage pkg1, String path1, OoxmlPackage pkg2,
                                String path2, RelationshipMigrator migrator) {
        List<Atom> atoms1 = Collections.emptyList();
        List<Atom> atoms2 = Collections.emptyList();
        if (note1 != null) {
            Element prepared1 = WmlComparer.prepare(note1, settings);
            atoms1 = Atomizer.atomize(prepared1, kind.partName, path1, pkg1, settings);
            if (migrator != null) {
                migrator.migrate(prepared1);
            }
        }
        if (note2 != null) {
            Element prepared2 = WmlComparer.prepare(note2, settings);
            atoms2 = Atomizer.atomize(prepared2, kind.partName, path2, pkg2, settings);
        }
        if (atoms1.isEmpty() && atoms2.isEmpty()) {
            return null;
        }

        List<Atom> atoms = WmlComparer.correlateAtoms(atoms1, atoms2, settings);
        if (allEqual(atoms)) {
            return null;
        }
        events.addAll(ChangeEvents.emit(atoms, author, date));

        Element container = Coalescer.coalesce(atoms, settings, kind.containerName);
        decorator.decorate(container);
        Element rebuilt = XmlUtils.child(container, kind.noteName);
        if (rebuilt == null) {
            return null;
        }
        restoreReferenceMark(note2 != null ? note2 : note1, rebuilt);
        return rebuilt;
    }

    private static boolean allEqual(List<Atom> atoms) {
        for (Atom atom : atoms) {
            if (atom.getStatus() != CorrelationStatus.EQUAL) {
                return false;
            }
        }
        return true;
    }

    /**
     * 注释编号（w:footnoteRef 运行）不参与比较，重建后放回第一个段落开头
     */
    private void restoreReferenceMark(Element source, Element rebuilt) {
        Element mark = XmlUtils.firstDescendant(source, kind.refMarkName);
        if (mark == null || XmlUtils.firstDescendant(rebuilt, kind.refMarkName) != null) {
            return;
        }
        Element run = XmlUtils.ancestor(mark, "w:r");
        Element p = XmlUtils.child(rebuilt, "w:p");
        if (run == null || p == null) {
            return;
        }
        Element pPr = XmlUtils.child(p, "w:pPr");
        p.insertChildren(pPr == null ? 0 : pPr.siblingIndex() + 1, Collections.singletonList(run.clone()));
    }

    /**
     * 普通注释（不含分隔符类注释），按 id
     */
    private Map<String, Element> notesById(Element root) {
        Map<String, Element> notes = new LinkedHashMap<>();
        for (Element note : XmlUtils.children(root, kind.noteName)) {
            String type = XmlUtils.attr(note, "w:type");
            if (type != null && !type.equals("normal")) {
                continue;
            }
            String id = XmlUtils.attr(note, "w:id");
            if (id != null) {
                notes.put(id, note);
            }
        }
        return notes;
    }
}
