package com.example.redline.util.wml;

import com.example.redline.util.wml.atom.Atom;
import com.example.redline.util.wml.dto.ChangeEvent;
import com.example.redline.util.wml.dto.RevisionCounts;
import com.example.redline.util.wml.lcs.CorrelationStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * 从相关性求解后的原子序列生成变更事件并统计修订数
 */
public class ChangeEvents {

    private ChangeEvents() {
    }

    /**
     * 连续的删除 / 插入原子合为一个事件；删除后紧跟插入合为替换。
     * 段落序号从 1 开始，按已经过的段落标记计数。
     */
    public static List<ChangeEvent> emit(List<Atom> atoms, String author, String dateTime) {
        List<ChangeEvent> events = new ArrayList<>();
        List<Atom> deleted = new ArrayList<>();
        List<Atom> inserted = new ArrayList<>();
        int paragraph = 1;
        int pendingParagraph = 1;

        for (Atom atom : atoms) {
            CorrelationStatus status = atom.getStatus();
            if (status == CorrelationStatus.DELETED || status == CorrelationStatus.INSERTED) {
                if (deleted.isEmpty() && inserted.isEmpty()) {
                    pendingParagraph = paragraph;
                }
                if (status == CorrelationStatus.DELETED && !inserted.isEmpty()) {
                    flush(events, deleted, inserted, author, dateTime, pendingParagraph);
                    pendingParagraph = paragraph;
                }
                (status == CorrelationStatus.DELETED ? deleted : inserted).add(atom);
            } else {
                flush(events, deleted, inserted, author, dateTime, pendingParagraph);
                if (status == CorrelationStatus.FORMAT_CHANGED) {
                    Atom before = atom.getBefore();
                    events.add(ChangeEvent.formatChange(atom, before == null ? null : before.getRunProperties(),
                            atom.getRunProperties(), author, dateTime, paragraph));
                }
            }
            if (atom.isParagraphMark() && status != CorrelationStatus.DELETED) {
                paragraph++;
            }
        }
        flush(events, deleted, inserted, author, dateTime, pendingParagraph);
        return events;
    }

    private static void flush(List<ChangeEvent> events, List<Atom> deleted, List<Atom> inserted, String author,
                              String dateTime, int paragraph) {
        if (!deleted.isEmpty() && !inserted.isEmpty()) {
            events.add(ChangeEvent.replace(new ArrayList<>(deleted), new ArrayList<>(inserted), author, dateTime,
                    paragraph));
        } else if (!deleted.isEmpty()) {
            events.add(ChangeEvent.delete(new ArrayList<>(deleted), author, dateTime, paragraph));
        } else if (!inserted.isEmpty()) {
            events.add(ChangeEvent.insert(new ArrayList<>(inserted), author, dateTime, paragraph));
        }
        deleted.clear();
        inserted.clear();
    }

    /**
     * 相邻且分组键相同的事件只计一次；替换同时计一次插入和一次删除
     */
    public static RevisionCounts count(List<ChangeEvent> events) {
        int insertions = 0;
        int deletions = 0;
        int formatChanges = 0;
        String previousKey = null;
        for (ChangeEvent e : events) {
            String key = e.groupingKey();
            if (key.equals(previousKey)) {
                continue;
            }
            previousKey = key;
            switch (e.getKind()) {
                case INSERT:
                    insertions++;
                    break;
                case DELETE:
                    deletions++;
                    break;
                case REPLACE:
                    insertions++;
                    deletions++;
                    break;
                default:
                    formatChanges++;
                    break;
            }
        }
        return new RevisionCounts(insertions, deletions, formatChanges);
    }
}
