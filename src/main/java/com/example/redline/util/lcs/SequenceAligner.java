package com.example.redline.util.lcs;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 序列对齐基础算法
 *
 * 1) findLongestMatch：最长公共连续子串（按哈希，取 items1 最左、再取 items2 最左）
 * 2) commonPrefix / commonSuffix：按哈希的公共前后缀
 * 3) align：经典 LCS 动态规划 + 回溯，输出 (i, j) 对，-1 表示缺失（行/列/段落对齐用）
 */
public class SequenceAligner {

    private SequenceAligner() {
    }

    // —— 最长公共连续子串 —— //

    /**
     * 查找最长公共连续子串
     *
     * @return 匹配结果；没有满足设置的匹配时返回 null
     */
    public static MatchResult findLongestMatch(List<? extends Hashable> items1, List<? extends Hashable> items2,
                                               LcsSettings settings) {
        int n = items1.size();
        int m = items2.size();
        int bestLength = 0;
        int best1 = 0;
        int best2 = 0;

        for (int i1 = 0; i1 < n - bestLength; i1++) {
            for (int i2 = 0; i2 < m - bestLength; i2++) {
                int len = 0;
                while (i1 + len < n && i2 + len < m
                        && items1.get(i1 + len).getHash().equals(items2.get(i2 + len).getHash())) {
                    len++;
                }
                if (len > bestLength) {
                    bestLength = len;
                    best1 = i1;
                    best2 = i2;
                }
            }
        }

        if (bestLength < Math.max(1, settings.getMinMatchLength())) {
            return null;
        }

        // 不适合作锚点的单元从匹配头部剔除
        if (settings.getSkipAnchor() != null) {
            while (bestLength > 0 && settings.getSkipAnchor().test(items1.get(best1).getHash())) {
                best1++;
                best2++;
                bestLength--;
            }
        }
        if (bestLength == 0) {
            return null;
        }

        if (settings.getDetailThreshold() > 0.0) {
            int maxLen = Math.max(n, m);
            if (maxLen > 0 && (double) bestLength / maxLen < settings.getDetailThreshold()) {
                return null;
            }
        }
        return new MatchResult(best1, best2, bestLength);
    }

    /**
     * 公共前缀长度（按哈希）
     */
    public static int commonPrefix(List<? extends Hashable> items1, List<? extends Hashable> items2) {
        int len = Math.min(items1.size(), items2.size());
        int i = 0;
        while (i < len && items1.get(i).getHash().equals(items2.get(i).getHash())) {
            i++;
        }
        return i;
    }

    /**
     * 公共后缀长度（按哈希），不与 prefix 重叠
     */
    public static int commonSuffix(List<? extends Hashable> items1, List<? extends Hashable> items2, int prefix) {
        int max = Math.min(items1.size(), items2.size()) - prefix;
        int i = 0;
        while (i < max && items1.get(items1.size() - 1 - i).getHash()
                .equals(items2.get(items2.size() - 1 - i).getHash())) {
            i++;
        }
        return i;
    }

    // —— LCS 对齐 —— //

    /**
     * 经典 LCS（非连续）对齐
     *
     * @return pairs：(i, j)，其中 i 或 j 可为 -1 表示缺失；相等元素尽量配对
     */
    public static List<int[]> align(List<String> seq1, List<String> seq2) {
        int n = seq1.size();
        int m = seq2.size();
        int[][] dp = new int[n + 1][m + 1];

        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                if (Objects.equals(seq1.get(i), seq2.get(j))) {
                    dp[i][j] = dp[i + 1][j + 1] + 1;
                } else {
                    dp[i][j] = Math.max(dp[i + 1][j], dp[i][j + 1]);
                }
            }
        }

        // 正向回溯：删除优先于插入，保证结果稳定
        List<int[]> pairs = new ArrayList<>();
        int i = 0, j = 0;
        while (i < n || j < m) {
            if (i < n && j < m && Objects.equals(seq1.get(i), seq2.get(j))) {
                pairs.add(new int[]{i, j});
                i++;
                j++;
            } else if (i < n && (j == m || dp[i + 1][j] >= dp[i][j + 1])) {
                pairs.add(new int[]{i, -1});
                i++;
            } else {
                pairs.add(new int[]{-1, j});
                j++;
            }
        }
        return pairs;
    }
}
