package com.example.redline.util.common;

import com.example.redline.exception.RedlineException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * 哈希工具类
 */
public class HashUtils {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private HashUtils() {
    }

    public static String sha1(String text) {
        return sha1(text.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha1(byte[] bytes) {
        MessageDigest md = sha1Digest();
        md.update(bytes);
        return toHex(md.digest());
    }

    public static String sha256(String text) {
        return sha256(text.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256(byte[] bytes) {
        MessageDigest md = digest("SHA-256");
        md.update(bytes);
        return toHex(md.digest());
    }

    /**
     * 新建 SHA-1 摘要器，供需要分段 update 的调用方使用
     */
    public static MessageDigest sha1Digest() {
        return digest("SHA-1");
    }

    private static MessageDigest digest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new RedlineException(RedlineException.ErrorKind.INTERNAL, algorithm, "摘要算法不可用", e);
        }
    }

    /**
     * 小写十六进制
     */
    public static String toHex(byte[] hashBytes) {
        StringBuilder hexString = new StringBuilder(hashBytes.length * 2);
        for (byte b : hashBytes) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }

    /**
     * FNV-1a 64 位快速哈希（行/列签名用）
     */
    public static String fnv1a(String text) {
        long hash = FNV_OFFSET;
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        for (byte b : bytes) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return Long.toHexString(hash);
    }
}
