package com.example.redline.util.wml.atom;

import com.example.redline.util.common.HashUtils;
import com.example.redline.util.lcs.Hashable;
import com.example.redline.util.wml.lcs.CorrelationStatus;
import com.example.redline.util.xml.XmlUtils;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 比对原子：一个字符、一个段落标记、一张图片……
 *
 * 原子相等只看身份哈希，不比较结构。
 */
public class Atom implements Hashable {

    private final ContentKind kind;
    /** 文本字符、图片哈希、脚注 id、元素名等载荷 */
    private final String value;
    /** 源内容元素（w:t、w:br、w:drawing、段落的 w:pPr …），重建时克隆 */
    private final Element contentElement;
    private final List<AncestorInfo> ancestors;
    private final String partName;
    private final String hash;

    private String formattingSignature;
    private CorrelationStatus status = CorrelationStatus.NIL;

    // —— 相关性求解后写入 —— //
    private Atom before;
    private String beforeFormattingSignature;
    private List<String> ancestorUnids = new ArrayList<>();

    public Atom(ContentKind kind, String value, Element contentElement, List<AncestorInfo> ancestors,
                String partName, String hashValue) {
        this.kind = kind;
        this.value = value == null ? "" : value;
        this.contentElement = contentElement;
        this.ancestors = ancestors;
        this.partName = partName;
        this.hash = HashUtils.sha1(kind.hashPrefix() + (hashValue == null ? "" : hashValue));
    }

    /**
     * 复制一个原子（相关性展开时每个原子要有独立的状态）
     */
    public Atom copy() {
        Atom a = new Atom(this);
        a.formattingSignature = formattingSignature;
        a.status = status;
        a.before = before;
        a.beforeFormattingSignature = beforeFormattingSignature;
        a.ancestorUnids = new ArrayList<>(ancestorUnids);
        return a;
    }

    private Atom(Atom other) {
        this.kind = other.kind;
        this.value = other.value;
        this.contentElement = other.contentElement;
        this.ancestors = other.ancestors;
        this.partName = other.partName;
        this.hash = other.hash;
    }

    @Override
    public String getHash() {
        return hash;
    }

    public ContentKind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    public Element getContentElement() {
        return contentElement;
    }

    public List<AncestorInfo> getAncestors() {
        return Collections.unmodifiableList(ancestors);
    }

    public String getPartName() {
        return partName;
    }

    public boolean isText() {
        return kind == ContentKind.TEXT;
    }

    public boolean isParagraphMark() {
        return kind == ContentKind.PARAGRAPH_MARK;
    }

    /**
     * 文本字符（非文本原子返回 0）
     */
    public int getChar() {
        return kind == ContentKind.TEXT && !value.isEmpty() ? value.codePointAt(0) : 0;
    }

    /**
     * 最近的指定名字的祖先
     */
    public AncestorInfo findAncestor(String name) {
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            if (ancestors.get(i).getName().equals(name)) {
                return ancestors.get(i);
            }
        }
        return null;
    }

    public boolean hasAncestor(String name) {
        return findAncestor(name) != null;
    }

    /**
     * 是否位于文本框内容中
     */
    public boolean isInTextbox() {
        return hasAncestor("w:txbxContent");
    }

    /**
     * 所在 w:r 的 rPr（非运行内容返回 null）
     */
    public Element getRunProperties() {
        AncestorInfo r = findAncestor("w:r");
        return r == null ? null : XmlUtils.child(r.getElement(), "w:rPr");
    }

    /**
     * 显示用文本
     */
    public String displayValue() {
        switch (kind) {
            case TEXT:
                return value;
            case PARAGRAPH_MARK:
                return "¶";
            case BREAK:
                return "⏎";
            case TAB:
                return "→";
            default:
                return "";
        }
    }

    // —— 状态 —— //

    public CorrelationStatus getStatus() {
        return status;
    }

    public void setStatus(CorrelationStatus status) {
        this.status = status;
    }

    public String getFormattingSignature() {
        return formattingSignature;
    }

    public void setFormattingSignature(String formattingSignature) {
        this.formattingSignature = formattingSignature;
    }

    public Atom getBefore() {
        return before;
    }

    public void setBefore(Atom before) {
        this.before = before;
    }

    public String getBeforeFormattingSignature() {
        return beforeFormattingSignature;
    }

    public void setBeforeFormattingSignature(String beforeFormattingSignature) {
        this.beforeFormattingSignature = beforeFormattingSignature;
    }

    public List<String> getAncestorUnids() {
        return ancestorUnids;
    }

    public void setAncestorUnids(List<String> ancestorUnids) {
        this.ancestorUnids = ancestorUnids;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind).append('[').append(displayValue()).append("] ").append(status);
        for (AncestorInfo a : ancestors) {
            sb.append(' ').append(a.getLocalName());
        }
        return sb.toString();
    }
}
