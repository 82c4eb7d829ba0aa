package com.example.redline.util.wml;

import com.example.redline.util.wml.dto.WmlChange;
import com.example.redline.util.wml.dto.WmlChangeListItem;
import com.example.redline.util.wml.dto.WmlChangeListOptions;
import com.example.redline.util.wml.dto.WmlChangeType;
import com.example.redline.util.wml.dto.WmlWordCount;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WmlChangeListBuilderTest {

    @Test
    void deleteFollowedByInsertInSameParagraphBecomesReplacement() {
        List<WmlChange> changes = Arrays.asList(
                change(WmlChangeType.TextDeleted, 1, 1, "lazy dog"),
                change(WmlChangeType.TextInserted, 2, 1, "active cat"));

        List<WmlChangeListItem> items = WmlChangeListBuilder.build(changes);

        assertThat(items).hasSize(1);
        WmlChangeListItem item = items.get(0);
        assertThat(item.getId()).isEqualTo("change-1");
        assertThat(item.getChangeType()).isEqualTo(WmlChangeType.TextReplaced);
        assertThat(item.getPreviewText()).isEqualTo("lazy dog → active cat");
        assertThat(item.getRevisionIds()).containsExactly(1, 2);
        assertThat(item.getWordCount().getDeleted()).isEqualTo(2);
        assertThat(item.getWordCount().getInserted()).isEqualTo(2);
        assertThat(item.getAnchor()).isEqualTo("revision-1");
    }

    @Test
    void adjacentInsertionsWithConsecutiveIdsAreGrouped() {
        List<WmlChange> changes = Arrays.asList(
                change(WmlChangeType.TextInserted, 5, 2, "one "),
                change(WmlChangeType.TextInserted, 6, 2, "two"),
                change(WmlChangeType.TextInserted, 9, 2, "far"));

        List<WmlChangeListItem> items = WmlChangeListBuilder.build(changes);

        assertThat(items).hasSize(2);
        assertThat(items.get(0).getDetails().getNewText()).isEqualTo("one two");
        assertThat(items.get(0).getRevisionIds()).containsExactly(5, 6);
        assertThat(items.get(1).getRevisionIds()).containsExactly(9);
    }

    @Test
    void groupingAndMergingCanBeSwitchedOff() {
        WmlChangeListOptions options = WmlChangeListOptions.defaults();
        options.setGroupAdjacentChanges(false);
        options.setMergeReplacements(false);
        List<WmlChange> changes = Arrays.asList(
                change(WmlChangeType.TextDeleted, 1, 1, "a"),
                change(WmlChangeType.TextInserted, 2, 1, "b"));

        List<WmlChangeListItem> items = WmlChangeListBuilder.build(changes, options);

        assertThat(items).extracting(WmlChangeListItem::getSummary).containsExactly("Deleted", "Inserted");
        assertThat(WmlChangeListBuilder.revisionIdsOf(items)).containsExactly(1, 2);
    }

    @Test
    void previewIsTruncatedAndLocationDescribed() {
        WmlChangeListOptions options = WmlChangeListOptions.defaults();
        options.setMaxPreviewLength(10);
        WmlChange inserted = change(WmlChangeType.TextInserted, 3, 4, "a long inserted sentence");
        inserted.setInFootnote(true);
        inserted.setInTable(true);

        List<WmlChangeListItem> items = WmlChangeListBuilder.build(new ArrayList<>(Arrays.asList(inserted)), options);

        assertThat(items.get(0).getPreviewText()).isEqualTo("a long ...");
        assertThat(items.get(0).getDetails().getLocationContext()).isEqualTo("In footnote, In table");
    }

    private static WmlChange change(WmlChangeType type, int revisionId, int paragraph, String text) {
        WmlChange change = new WmlChange();
        change.setChangeType(type);
        change.setRevisionId(revisionId);
        change.setParagraphIndex(paragraph);
        change.setAuthor("Alice");
        change.setDateTime("2024-01-02T03:04:05Z");
        if (type == WmlChangeType.TextDeleted) {
            change.setOldText(text);
            change.setWordCount(new WmlWordCount(ChangeExtractor.countWords(text), 0));
        } else {
            change.setNewText(text);
            change.setWordCount(new WmlWordCount(0, ChangeExtractor.countWords(text)));
        }
        return change;
    }
}
