package com.example.redline.util.wml.unit;

import com.example.redline.util.common.HashUtils;
import com.example.redline.util.wml.atom.AncestorInfo;
import com.example.redline.util.wml.atom.Atom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 分组：段落 / 表格 / 行 / 单元格 / 文本框
 *
 * 成员要么全是词，要么全是子分组。比较时优先使用块哈希（CorrelatedHash）。
 */
public class Group extends ComparisonUnit {

    private final GroupKind kind;
    private final String unid;
    private final List<ComparisonUnit> children;
    private final String contentHash;
    private final String correlatedHash;
    private final String structureHash;

    public Group(GroupKind kind, String unid, List<ComparisonUnit> children, String correlatedHash,
                 String structureHash) {
        this.kind = kind;
        this.unid = unid;
        this.children = new ArrayList<>(children);
        StringBuilder sb = new StringBuilder(kind.getLocalName());
        for (ComparisonUnit c : children) {
            sb.append(c.getHash());
        }
        this.contentHash = HashUtils.sha1(sb.toString());
        this.correlatedHash = correlatedHash;
        this.structureHash = structureHash;
    }

    @Override
    public String getHash() {
        return correlatedHash != null ? correlatedHash : contentHash;
    }

    public String getContentHash() {
        return contentHash;
    }

    public String getCorrelatedHash() {
        return correlatedHash;
    }

    public String getStructureHash() {
        return structureHash;
    }

    public GroupKind getKind() {
        return kind;
    }

    public String getUnid() {
        return unid;
    }

    public List<ComparisonUnit> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean containsGroups() {
        return !children.isEmpty() && children.get(0).isGroup();
    }

    @Override
    public List<Atom> getAtoms() {
        List<Atom> result = new ArrayList<>();
        for (ComparisonUnit c : children) {
            result.addAll(c.getAtoms());
        }
        return result;
    }

    /**
     * 表格中是否存在合并单元格
     */
    public boolean hasMergedCells() {
        for (Atom atom : getAtoms()) {
            for (AncestorInfo a : atom.getAncestors()) {
                if (a.hasMergedCells()) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return kind + "[" + unid + ", " + children.size() + "]";
    }
}
