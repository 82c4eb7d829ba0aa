package com.example.redline.util.sml.signature;

/**
 * 单元格批注签名
 */
public class CommentSignature {

    private final String cellAddress;
    private final String author;
    private final String text;

    public CommentSignature(String cellAddress, String author, String text) {
        this.cellAddress = cellAddress;
        this.author = author == null ? "" : author;
        this.text = text == null ? "" : text;
    }

    public String getCellAddress() { return cellAddress; }

    public String getAuthor() { return author; }

    public String getText() { return text; }
}
