package com.example.redline.util.wml.unit;

import com.example.redline.util.common.HashUtils;
import com.example.redline.util.wml.atom.Atom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 词：同属一个词的连续原子
 */
public class Word extends ComparisonUnit {

    private final List<Atom> atoms;
    private final String hash;

    public Word(List<Atom> atoms) {
        this.atoms = new ArrayList<>(atoms);
        StringBuilder sb = new StringBuilder();
        for (Atom a : atoms) {
            sb.append(a.getHash());
        }
        this.hash = HashUtils.sha1(sb.toString());
    }

    @Override
    public String getHash() {
        return hash;
    }

    @Override
    public List<Atom> getAtoms() {
        return Collections.unmodifiableList(atoms);
    }

    public String text() {
        StringBuilder sb = new StringBuilder();
        for (Atom a : atoms) {
            sb.append(a.displayValue());
        }
        return sb.toString();
    }

    /**
     * 仅由一个段落标记组成
     */
    public boolean isParagraphMark() {
        return atoms.size() == 1 && atoms.get(0).isParagraphMark();
    }

    /**
     * 全部由文本原子组成
     */
    public boolean isTextOnly() {
        for (Atom a : atoms) {
            if (!a.isText()) {
                return false;
            }
        }
        return !atoms.isEmpty();
    }

    @Override
    public String toString() {
        return "Word[" + text() + "]";
    }
}
