package com.example.redline.exception;

/**
 * 比对过程中的统一异常
 *
 * 每个异常都带有错误类别（{@link ErrorKind}）和定位信息（部件路径或文档内定位），
 * 由 Controller / CLI 统一映射为 HTTP 状态码或退出码。
 */
public class RedlineException extends RuntimeException {

    /**
     * 错误类别
     */
    public enum ErrorKind {
        /** 容器读写失败：ZIP 损坏、缺少内容类型等 */
        PACKAGE,
        /** 部件 XML 格式错误 */
        XML_PARSE,
        /** 必需的关系目标不存在 */
        MISSING_PART,
        /** 文档结构不符合规范，无法比对 */
        INVALID_PACKAGE,
        /** 未实现的功能路径 */
        UNSUPPORTED_FEATURE,
        /** 内部契约被破坏（程序缺陷） */
        INTERNAL
    }

    private final ErrorKind kind;
    private final String locator;

    public RedlineException(ErrorKind kind, String locator, String message) {
        super(message);
        this.kind = kind;
        this.locator = locator;
    }

    public RedlineException(ErrorKind kind, String locator, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.locator = locator;
    }

    public static RedlineException packageError(String locator, String message, Throwable cause) {
        return new RedlineException(ErrorKind.PACKAGE, locator, message, cause);
    }

    public static RedlineException missingPart(String locator, String message) {
        return new RedlineException(ErrorKind.MISSING_PART, locator, message);
    }

    public static RedlineException invalidPackage(String locator, String message) {
        return new RedlineException(ErrorKind.INVALID_PACKAGE, locator, message);
    }

    public static RedlineException internal(String locator, String message) {
        return new RedlineException(ErrorKind.INTERNAL, locator, message);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getLocator() {
        return locator;
    }

    /**
     * 是否属于输入文档本身的问题（而非写出失败或程序缺陷）
     */
    public boolean isInputError() {
        return kind == ErrorKind.PACKAGE || kind == ErrorKind.XML_PARSE
                || kind == ErrorKind.MISSING_PART || kind == ErrorKind.INVALID_PACKAGE;
    }

    @Override
    public String getMessage() {
        String base = super.getMessage();
        if (locator == null || locator.isEmpty()) {
            return "[" + kind + "] " + base;
        }
        return "[" + kind + "] " + base + " (" + locator + ")";
    }
}
