package com.example.redline.util.xml;

import java.util.HashMap;
import java.util.Map;

/**
 * OOXML 命名空间与规范前缀
 *
 * 解析后的树统一使用这里的前缀（w:、a:、r: 等），
 * SpreadsheetML 主命名空间统一为无前缀。
 */
public final class Namespaces {

    public static final String W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    public static final String R = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";
    public static final String A = "http://schemas.openxmlformats.org/drawingml/2006/main";
    public static final String WP = "http://schemas.openxmlformats.org/drawingml/2006/wordprocessingDrawing";
    public static final String PIC = "http://schemas.openxmlformats.org/drawingml/2006/picture";
    public static final String M = "http://schemas.openxmlformats.org/officeDocument/2006/math";
    public static final String MC = "http://schemas.openxmlformats.org/markup-compatibility/2006";
    public static final String V = "urn:schemas-microsoft-com:vml";
    public static final String O = "urn:schemas-microsoft-com:office:office";
    public static final String X = "urn:schemas-microsoft-com:office:excel";
    public static final String WPS = "http://schemas.microsoft.com/office/word/2010/wordprocessingShape";
    public static final String WP14 = "http://schemas.microsoft.com/office/word/2010/wordprocessingDrawing";
    public static final String W14 = "http://schemas.microsoft.com/office/word/2010/wordml";
    public static final String P = "http://schemas.openxmlformats.org/presentationml/2006/main";
    public static final String S = "http://schemas.openxmlformats.org/spreadsheetml/2006/main";
    public static final String C = "http://schemas.openxmlformats.org/drawingml/2006/chart";
    public static final String PT14 = "http://powertools.codeplex.com/2011";

    /** PowerTools 辅助属性前缀，输出前全部清除 */
    public static final String PT_PREFIX = "pt14";

    public static final String PT_UNID = "pt14:Unid";
    public static final String PT_STATUS = "pt14:Status";
    public static final String PT_SHA1 = "pt14:SHA1Hash";
    public static final String PT_CORRELATED_SHA1 = "pt14:CorrelatedSHA1Hash";

    private static final Map<String, String> CANONICAL_PREFIX = new HashMap<>();

    static {
        CANONICAL_PREFIX.put(W, "w");
        CANONICAL_PREFIX.put(R, "r");
        CANONICAL_PREFIX.put(A, "a");
        CANONICAL_PREFIX.put(WP, "wp");
        CANONICAL_PREFIX.put(PIC, "pic");
        CANONICAL_PREFIX.put(M, "m");
        CANONICAL_PREFIX.put(MC, "mc");
        CANONICAL_PREFIX.put(V, "v");
        CANONICAL_PREFIX.put(O, "o");
        CANONICAL_PREFIX.put(X, "x");
        CANONICAL_PREFIX.put(WPS, "wps");
        CANONICAL_PREFIX.put(WP14, "wp14");
        CANONICAL_PREFIX.put(W14, "w14");
        CANONICAL_PREFIX.put(P, "p");
        CANONICAL_PREFIX.put(S, "");
        CANONICAL_PREFIX.put(C, "c");
        CANONICAL_PREFIX.put(PT14, PT_PREFIX);
    }

    private Namespaces() {
    }

    /**
     * 返回命名空间对应的规范前缀，未知命名空间返回 null
     */
    public static String canonicalPrefix(String namespaceUri) {
        return CANONICAL_PREFIX.get(namespaceUri);
    }
}
