package com.example.redline.util.pml.signature;

/**
 * 文本段（a:r 或 a:fld）
 */
public class RunSignature {

    private final String text;
    /** 没有 a:rPr 时为 null */
    private final RunPropertiesSignature properties;

    public RunSignature(String text, RunPropertiesSignature properties) {
        this.text = text == null ? "" : text;
        this.properties = properties;
    }

    public String getText() { return text; }

    public RunPropertiesSignature getProperties() { return properties; }
}
