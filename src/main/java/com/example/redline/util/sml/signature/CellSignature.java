package com.example.redline.util.sml.signature;

import com.example.redline.util.common.HashUtils;

/**
 * 单元格签名
 */
public class CellSignature {

    private final String address;
    /** 行号，从 1 开始 */
    private final int row;
    /** 列号，从 1 开始 */
    private final int column;
    private final String resolvedValue;
    private final String formula;
    private final String contentHash;
    private final CellFormatSignature format;

    public CellSignature(String address, int row, int column, String resolvedValue, String formula,
                         CellFormatSignature format) {
        this.address = address;
        this.row = row;
        this.column = column;
        this.resolvedValue = resolvedValue;
        this.formula = formula;
        this.contentHash = computeHash(resolvedValue, formula);
        this.format = format == null ? new CellFormatSignature() : format;
    }

    /**
     * SHA-256(value|formula)
     */
    public static String computeHash(String value, String formula) {
        return HashUtils.sha256((value == null ? "" : value) + "|" + (formula == null ? "" : formula));
    }

    public String getAddress() { return address; }

    public int getRow() { return row; }

    public int getColumn() { return column; }

    public String getResolvedValue() { return resolvedValue; }

    public String getFormula() { return formula; }

    public String getContentHash() { return contentHash; }

    public CellFormatSignature getFormat() { return format; }

    @Override
    public String toString() {
        return address + "=" + resolvedValue + (formula == null ? "" : " [=" + formula + "]");
    }
}
