package com.example.redline.util.wml;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Word 比对设置
 */
public class WmlComparerSettings {

    /** 默认分词符（空白字符总是分词符，不在此列） */
    public static final String DEFAULT_WORD_SEPARATORS = "-();,.（），、；。：";

    /** 为空时取新文档的 lastModifiedBy / creator */
    private String author;
    /** ISO-8601 UTC；为空时取新文档的修改时间，没有则用比对时刻 */
    private String dateTime;
    private boolean caseInsensitive = false;
    private boolean conflateSpaces = false;
    private boolean trackFormattingChanges = false;
    private double detailThreshold = 0.0;
    private Set<Character> wordSeparators = defaultSeparators();
    private int startingRevisionId = 0;

    private static Set<Character> defaultSeparators() {
        Set<Character> set = new LinkedHashSet<>();
        for (char c : DEFAULT_WORD_SEPARATORS.toCharArray()) {
            set.add(c);
        }
        return set;
    }

    /**
     * 是否分词符
     */
    public boolean isWordSeparator(int ch) {
        if (Character.isWhitespace(ch) || ch == 0x3000) {
            return true;
        }
        if (ch == 0x00a0) {
            return conflateSpaces;
        }
        return ch <= 0xffff && wordSeparators.contains((char) ch);
    }

    public WmlComparerSettings copy() {
        WmlComparerSettings s = new WmlComparerSettings();
        s.author = author;
        s.dateTime = dateTime;
        s.caseInsensitive = caseInsensitive;
        s.conflateSpaces = conflateSpaces;
        s.trackFormattingChanges = trackFormattingChanges;
        s.detailThreshold = detailThreshold;
        s.wordSeparators = new LinkedHashSet<>(wordSeparators);
        s.startingRevisionId = startingRevisionId;
        return s;
    }

    public String getAuthor() { return author; }
    public void setAuthor(String author) { this.author = author; }

    public String getDateTime() { return dateTime; }
    public void setDateTime(String dateTime) { this.dateTime = dateTime; }

    public boolean isCaseInsensitive() { return caseInsensitive; }
    public void setCaseInsensitive(boolean caseInsensitive) { this.caseInsensitive = caseInsensitive; }

    public boolean isConflateSpaces() { return conflateSpaces; }
    public void setConflateSpaces(boolean conflateSpaces) { this.conflateSpaces = conflateSpaces; }

    public boolean isTrackFormattingChanges() { return trackFormattingChanges; }
    public void setTrackFormattingChanges(boolean trackFormattingChanges) { this.trackFormattingChanges = trackFormattingChanges; }

    public double getDetailThreshold() { return detailThreshold; }
    public void setDetailThreshold(double detailThreshold) { this.detailThreshold = detailThreshold; }

    public Set<Character> getWordSeparators() { return wordSeparators; }
    public void setWordSeparators(Set<Character> wordSeparators) { this.wordSeparators = wordSeparators; }

    public int getStartingRevisionId() { return startingRevisionId; }
    public void setStartingRevisionId(int startingRevisionId) { this.startingRevisionId = startingRevisionId; }
}
