package com.example.redline.util.wml.unit;

import com.example.redline.util.lcs.Hashable;
import com.example.redline.util.wml.atom.Atom;

import java.util.List;

/**
 * 比对单元：词或分组
 */
public abstract class ComparisonUnit implements Hashable {

    /**
     * 所有后代原子（文档顺序）
     */
    public abstract List<Atom> getAtoms();

    public int atomCount() {
        return getAtoms().size();
    }

    public Atom firstAtom() {
        List<Atom> atoms = getAtoms();
        return atoms.isEmpty() ? null : atoms.get(0);
    }

    public Atom lastAtom() {
        List<Atom> atoms = getAtoms();
        return atoms.isEmpty() ? null : atoms.get(atoms.size() - 1);
    }

    public boolean isGroup() {
        return this instanceof Group;
    }

    public boolean isWord() {
        return this instanceof Word;
    }
}
