package com.example.redline.util.wml.lcs;

import com.example.redline.util.wml.unit.ComparisonUnit;

import java.util.ArrayList;
import java.util.List;

/**
 * 对齐片段：(状态, 旧文档单元, 新文档单元)
 *
 * EQUAL 两侧长度相同；DELETED 只有旧侧；INSERTED 只有新侧。
 */
public class CorrelatedSequence {

    private final CorrelationStatus status;
    private final List<ComparisonUnit> units1;
    private final List<ComparisonUnit> units2;

    private CorrelatedSequence(CorrelationStatus status, List<ComparisonUnit> units1, List<ComparisonUnit> units2) {
        this.status = status;
        this.units1 = units1 == null ? null : new ArrayList<>(units1);
        this.units2 = units2 == null ? null : new ArrayList<>(units2);
    }

    public static CorrelatedSequence unknown(List<ComparisonUnit> units1, List<ComparisonUnit> units2) {
        return new CorrelatedSequence(CorrelationStatus.UNKNOWN, units1, units2);
    }

    public static CorrelatedSequence equal(List<ComparisonUnit> units1, List<ComparisonUnit> units2) {
        return new CorrelatedSequence(CorrelationStatus.EQUAL, units1, units2);
    }

    public static CorrelatedSequence deleted(List<ComparisonUnit> units1) {
        return new CorrelatedSequence(CorrelationStatus.DELETED, units1, null);
    }

    public static CorrelatedSequence inserted(List<ComparisonUnit> units2) {
        return new CorrelatedSequence(CorrelationStatus.INSERTED, null, units2);
    }

    public CorrelationStatus getStatus() { return status; }

    public List<ComparisonUnit> getUnits1() { return units1; }

    public List<ComparisonUnit> getUnits2() { return units2; }

    public int length1() {
        return units1 == null ? 0 : units1.size();
    }

    public int length2() {
        return units2 == null ? 0 : units2.size();
    }

    @Override
    public String toString() {
        return status + "(" + length1() + ", " + length2() + ")";
    }
}
