package com.example.redline.util.wml.dto;

import com.example.redline.util.wml.atom.Atom;
import org.jsoup.nodes.Element;

import java.util.Collections;
import java.util.List;

/**
 * 由比对原子序列得到的一次变更事件
 *
 * 插入 / 删除携带原子列表，替换同时携带新旧两侧，格式变更携带前后 rPr。
 */
public class ChangeEvent {

    public enum Kind {
        INSERT,
        DELETE,
        REPLACE,
        FORMAT_CHANGE
    }

    private final Kind kind;
    private final List<Atom> oldAtoms;
    private final List<Atom> newAtoms;
    private final String author;
    private final String dateTime;
    private final int paragraphIndex;
    private Element beforeRunProperties;
    private Element afterRunProperties;

    private ChangeEvent(Kind kind, List<Atom> oldAtoms, List<Atom> newAtoms, String author, String dateTime,
                        int paragraphIndex) {
        this.kind = kind;
        this.oldAtoms = oldAtoms;
        this.newAtoms = newAtoms;
        this.author = author;
        this.dateTime = dateTime;
        this.paragraphIndex = paragraphIndex;
    }

    public static ChangeEvent insert(List<Atom> atoms, String author, String dateTime, int paragraphIndex) {
        return new ChangeEvent(Kind.INSERT, Collections.<Atom>emptyList(), atoms, author, dateTime, paragraphIndex);
    }

    public static ChangeEvent delete(List<Atom> atoms, String author, String dateTime, int paragraphIndex) {
        return new ChangeEvent(Kind.DELETE, atoms, Collections.<Atom>emptyList(), author, dateTime, paragraphIndex);
    }

    public static ChangeEvent replace(List<Atom> oldAtoms, List<Atom> newAtoms, String author, String dateTime,
                                      int paragraphIndex) {
        return new ChangeEvent(Kind.REPLACE, oldAtoms, newAtoms, author, dateTime, paragraphIndex);
    }

    public static ChangeEvent formatChange(Atom atom, Element before, Element after, String author,
                                           String dateTime, int paragraphIndex) {
        ChangeEvent e = new ChangeEvent(Kind.FORMAT_CHANGE, Collections.<Atom>emptyList(),
                Collections.singletonList(atom), author, dateTime, paragraphIndex);
        e.beforeRunProperties = before;
        e.afterRunProperties = after;
        return e;
    }

    /**
     * 计数分组键：相邻的同键事件算一次修订
     */
    public String groupingKey() {
        return kind + "|" + author + "|" + dateTime;
    }

    public String getOldText() {
        return textOf(oldAtoms);
    }

    public String getNewText() {
        return textOf(newAtoms);
    }

    private static String textOf(List<Atom> atoms) {
        StringBuilder sb = new StringBuilder();
        for (Atom a : atoms) {
            if (a.isText()) {
                sb.append(a.getValue());
            }
        }
        return sb.toString();
    }

    public Kind getKind() { return kind; }
    public List<Atom> getOldAtoms() { return oldAtoms; }
    public List<Atom> getNewAtoms() { return newAtoms; }
    public String getAuthor() { return author; }
    public String getDateTime() { return dateTime; }
    public int getParagraphIndex() { return paragraphIndex; }
    public Element getBeforeRunProperties() { return beforeRunProperties; }
    public Element getAfterRunProperties() { return afterRunProperties; }

    @Override
    public String toString() {
        return kind + "(p" + paragraphIndex + ", old=" + getOldText() + ", new=" + getNewText() + ")";
    }
}
