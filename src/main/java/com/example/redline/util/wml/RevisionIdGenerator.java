package com.example.redline.util.wml;

/**
 * 修订 id 生成器，每次比对新建一个
 */
public class RevisionIdGenerator {

    private int next;

    public RevisionIdGenerator(int start) {
        this.next = start;
    }

    public int next() {
        return next++;
    }

    /**
     * 下一个将要分配的 id
     */
    public int peek() {
        return next;
    }
}
