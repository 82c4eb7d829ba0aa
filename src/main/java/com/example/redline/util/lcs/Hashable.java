package com.example.redline.util.lcs;

/**
 * 可参与序列比对的单元，相等性只看哈希
 */
public interface Hashable {

    String getHash();
}
