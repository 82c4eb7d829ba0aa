package com.example.redline.util.lcs;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SequenceAlignerTest {

    private static List<Hashable> units(String... hashes) {
        List<Hashable> list = new ArrayList<>();
        for (String h : hashes) {
            list.add(() -> h);
        }
        return list;
    }

    @Test
    void findsLongestRunPreferringLeftmost() {
        MatchResult match = SequenceAligner.findLongestMatch(
                units("a", "b", "c", "x", "b", "c", "d"),
                units("b", "c", "d", "y"),
                LcsSettings.defaults());

        assertThat(match).isNotNull();
        assertThat(match.getStart1()).isEqualTo(4);
        assertThat(match.getStart2()).isEqualTo(0);
        assertThat(match.getLength()).isEqualTo(3);
    }

    @Test
    void noMatchReturnsNull() {
        assertThat(SequenceAligner.findLongestMatch(units("a"), units("b"), LcsSettings.defaults())).isNull();
    }

    @Test
    void detailThresholdRejectsShortMatches() {
        LcsSettings settings = LcsSettings.defaults().detailThreshold(0.5);
        assertThat(SequenceAligner.findLongestMatch(units("a", "b", "c", "d"), units("a", "x", "y", "z"), settings))
                .isNull();
    }

    @Test
    void skipAnchorTrimsLeadingUnits() {
        LcsSettings settings = LcsSettings.defaults().skipAnchor(" "::equals);
        MatchResult match = SequenceAligner.findLongestMatch(units(" ", "dog"), units(" ", "dog"), settings);
        assertThat(match.getStart1()).isEqualTo(1);
        assertThat(match.getLength()).isEqualTo(1);
    }

    @Test
    void prefixAndSuffixDoNotOverlap() {
        List<Hashable> a = units("x", "y", "x");
        List<Hashable> b = units("x", "x");
        int prefix = SequenceAligner.commonPrefix(a, b);
        assertThat(prefix).isEqualTo(1);
        assertThat(SequenceAligner.commonSuffix(a, b, prefix)).isEqualTo(1);
    }

    @Test
    void alignPairsEqualElementsAndMarksGaps() {
        List<int[]> pairs = SequenceAligner.align(Arrays.asList("a", "b", "c"), Arrays.asList("a", "c", "d"));

        assertThat(pairs).hasSize(4);
        assertThat(pairs.get(0)).containsExactly(0, 0);
        assertThat(pairs.get(1)).containsExactly(1, -1);
        assertThat(pairs.get(2)).containsExactly(2, 1);
        assertThat(pairs.get(3)).containsExactly(-1, 2);
    }
}
