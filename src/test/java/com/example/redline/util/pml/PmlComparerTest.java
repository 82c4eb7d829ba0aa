package com.example.redline.util.pml;

import com.example.redline.util.ooxml.OoxmlPackage;
import com.example.redline.util.pml.dto.PmlChange;
import com.example.redline.util.pml.dto.PmlChangeListItem;
import com.example.redline.util.pml.dto.PmlChangeType;
import com.example.redline.util.pml.dto.PmlComparisonResult;
import com.example.redline.util.xml.XmlUtils;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.example.redline.support.OoxmlFixtures.pptx;
import static com.example.redline.support.OoxmlFixtures.textShape;
import static com.example.redline.support.OoxmlFixtures.titleShape;
import static org.assertj.core.api.Assertions.assertThat;

class PmlComparerTest {

    @Test
    void editedTitleIsSingleTextChange() {
        byte[] older = pptx().slide(titleShape(2, "Title 1", "Agenda")).slide(titleShape(2, "Title 1", "Intro")).build();
        byte[] newer = pptx().slide(titleShape(2, "Title 1", "Agenda")).slide(titleShape(2, "Title 1", "Welcome")).build();

        PmlComparisonResult result = PmlComparer.diff(older, newer, null);

        assertThat(result.getChanges()).hasSize(1);
        PmlChange change = result.getChanges().get(0);
        assertThat(change.getId()).isEqualTo("pml-1");
        assertThat(change.getChangeType()).isEqualTo(PmlChangeType.TextChanged);
        assertThat(change.getSlideIndex()).isEqualTo(2);
        assertThat(change.getShapeName()).isEqualTo("Title 1");
        assertThat(change.getOldValue()).isEqualTo("Intro");
        assertThat(change.getNewValue()).isEqualTo("Welcome");
        assertThat(change.getDescription()).isEqualTo("Text changed in 'Title 1' on slide 2");
    }

    @Test
    void identicalPresentationsHaveNoChanges() {
        byte[] deck = pptx().slide(titleShape(2, "Title 1", "Agenda"), textShape(3, "Box", "Body", 1000000, 2000000)).build();

        PmlComparisonResult result = PmlComparer.compare(deck, deck);

        assertThat(result.getChanges()).isEmpty();
        assertThat(result.getDocument()).isSameAs(deck);
    }

    @Test
    void movedShapeKeepsOldAndNewOffsets() {
        byte[] older = pptx().slide(textShape(3, "Box", "Hello", 1000000, 1000000)).build();
        byte[] newer = pptx().slide(textShape(3, "Box", "Hello", 3000000, 1000000)).build();

        List<PmlChange> changes = PmlComparer.diff(older, newer, null).getChanges();

        assertThat(changes).extracting(PmlChange::getChangeType).containsExactly(PmlChangeType.ShapeMoved);
        assertThat(changes.get(0).getOldX()).isEqualTo(1000000L);
        assertThat(changes.get(0).getNewX()).isEqualTo(3000000L);
    }

    @Test
    void movementWithinToleranceIsIgnored() {
        byte[] older = pptx().slide(textShape(3, "Box", "Hello", 1000000, 1000000)).build();
        byte[] newer = pptx().slide(textShape(3, "Box", "Hello", 1000100, 1000000)).build();

        assertThat(PmlComparer.diff(older, newer, null).getChanges()).isEmpty();
    }

    @Test
    void appendedSlideIsInserted() {
        byte[] older = pptx().slide(titleShape(2, "Title 1", "Agenda")).build();
        byte[] newer = pptx().slide(titleShape(2, "Title 1", "Agenda")).slide(titleShape(2, "Title 1", "Extra")).build();

        List<PmlChange> changes = PmlComparer.diff(older, newer, null).getChanges();

        assertThat(changes).hasSize(1);
        assertThat(changes.get(0).getChangeType()).isEqualTo(PmlChangeType.SlideInserted);
        assertThat(changes.get(0).getSlideIndex()).isEqualTo(2);
    }

    @Test
    void swappedSlidesAreMovesNotTextEdits() {
        byte[] older = pptx().slide(titleShape(2, "Title 1", "One")).slide(titleShape(2, "Title 1", "Two"))
                .slide(titleShape(2, "Title 1", "Three")).build();
        byte[] newer = pptx().slide(titleShape(2, "Title 1", "One")).slide(titleShape(2, "Title 1", "Three"))
                .slide(titleShape(2, "Title 1", "Two")).build();

        List<PmlChange> changes = PmlComparer.diff(older, newer, null).getChanges();

        assertThat(changes).extracting(PmlChange::getChangeType)
                .containsExactly(PmlChangeType.SlideMoved, PmlChangeType.SlideMoved);
        assertThat(changes.get(0).getSlideIndex()).isEqualTo(2);
        assertThat(changes.get(0).getOldSlideIndex()).isEqualTo(3);
        assertThat(changes.get(1).getSlideIndex()).isEqualTo(3);
        assertThat(changes.get(1).getOldSlideIndex()).isEqualTo(2);
    }

    @Test
    void deletedMiddleSlideIsNotReportedAsTextEdit() {
        byte[] older = pptx().slide(titleShape(2, "Title 1", "One")).slide(titleShape(2, "Title 1", "Two"))
                .slide(titleShape(2, "Title 1", "Three")).build();
        byte[] newer = pptx().slide(titleShape(2, "Title 1", "One")).slide(titleShape(2, "Title 1", "Three")).build();

        List<PmlChange> changes = PmlComparer.diff(older, newer, null).getChanges();

        assertThat(changes).noneMatch(c -> c.getChangeType() == PmlChangeType.TextChanged);
        assertThat(changes).extracting(PmlChange::getChangeType)
                .containsExactlyInAnyOrder(PmlChangeType.SlideDeleted, PmlChangeType.SlideMoved);
        for (PmlChange change : changes) {
            if (change.getChangeType() == PmlChangeType.SlideDeleted) {
                assertThat(change.getOldSlideIndex()).isEqualTo(2);
            } else {
                assertThat(change.getSlideIndex()).isEqualTo(2);
                assertThat(change.getOldSlideIndex()).isEqualTo(3);
            }
        }
    }

    @Test
    void addedAndRemovedShapesOnMatchedSlide() {
        byte[] older = pptx().slide(titleShape(2, "Title 1", "Agenda"), textShape(3, "Old box", "gone", 0, 0)).build();
        byte[] newer = pptx().slide(titleShape(2, "Title 1", "Agenda"), textShape(4, "New box", "fresh", 4000000, 4000000)).build();

        List<PmlChange> changes = PmlComparer.diff(older, newer, null).getChanges();

        assertThat(changes).extracting(PmlChange::getChangeType)
                .containsExactlyInAnyOrder(PmlChangeType.ShapeInserted, PmlChangeType.ShapeDeleted);
    }

    @Test
    void compareAddsLabelsAndSummarySlide() {
        byte[] older = pptx().slide(titleShape(2, "Title 1", "Agenda")).slide(titleShape(2, "Title 1", "Intro")).build();
        byte[] newer = pptx().slide(titleShape(2, "Title 1", "Agenda")).slide(titleShape(2, "Title 1", "Welcome")).build();

        PmlComparisonResult result = PmlComparer.compare(older, newer);

        try (OoxmlPackage pkg = OoxmlPackage.open(result.getDocument())) {
            Map<Integer, String> slides = PmlMarkupRenderer.slidePaths(pkg, pkg.getMainDocumentPath());
            assertThat(slides).hasSize(3);
            assertThat(shapeNames(pkg, slides.get(2))).anyMatch(n -> n.startsWith(PmlMarkupRenderer.LABEL_PREFIX));
            assertThat(shapeNames(pkg, slides.get(1))).noneMatch(n -> n.startsWith(PmlMarkupRenderer.LABEL_PREFIX));
        }
    }

    @Test
    void summarySlideCanBeSwitchedOff() {
        PmlComparerSettings settings = new PmlComparerSettings();
        settings.setAddSummarySlide(false);
        byte[] older = pptx().slide(titleShape(2, "Title 1", "Intro")).build();
        byte[] newer = pptx().slide(titleShape(2, "Title 1", "Welcome")).build();

        PmlComparisonResult result = PmlComparer.compare(older, newer, settings);

        try (OoxmlPackage pkg = OoxmlPackage.open(result.getDocument())) {
            assertThat(PmlMarkupRenderer.slidePaths(pkg, pkg.getMainDocumentPath())).hasSize(1);
        }
    }

    @Test
    void applyAndRevertTextAndPosition() {
        byte[] older = pptx().slide(titleShape(2, "Title 1", "Intro"), textShape(3, "Box", "Hello", 1000000, 1000000)).build();
        byte[] newer = pptx().slide(titleShape(2, "Title 1", "Welcome"), textShape(3, "Box", "Hello", 3000000, 1000000)).build();
        List<PmlChange> changes = PmlComparer.diff(older, newer, null).getChanges();
        assertThat(changes).extracting(PmlChange::getChangeType)
                .containsExactlyInAnyOrder(PmlChangeType.TextChanged, PmlChangeType.ShapeMoved);

        byte[] applied = PmlPatcher.apply(older, changes);
        byte[] reverted = PmlPatcher.revert(newer, changes);

        assertThat(PmlComparer.diff(applied, newer, null).getChanges()).isEmpty();
        assertThat(PmlComparer.diff(reverted, older, null).getChanges()).isEmpty();
    }

    @Test
    void changeListGroupsChangesOfOneShape() {
        byte[] older = pptx().slide(textShape(3, "Box", "Hello", 1000000, 1000000)).build();
        byte[] newer = pptx().slide(textShape(3, "Box", "Goodbye", 3000000, 1000000)).build();

        List<PmlChangeListItem> items = PmlComparer.getChangeList(older, newer, null, null);

        assertThat(items).hasSize(1);
        assertThat(items.get(0).getCount()).isEqualTo(2);
        assertThat(items.get(0).getSummary()).isEqualTo("2 changes in 'Box' on slide 1");
        assertThat(items.get(0).getChangeIds()).containsExactly("pml-1", "pml-2");
        assertThat(items.get(0).getAnchor()).isEqualTo("slide-1-shape-3");
    }

    private static List<String> shapeNames(OoxmlPackage pkg, String slidePath) {
        List<String> names = new ArrayList<>();
        Element root = XmlUtils.rootElement(pkg.getXmlPart(slidePath));
        for (Element cNvPr : XmlUtils.descendants(root, "p:cNvPr")) {
            names.add(XmlUtils.attr(cNvPr, "name"));
        }
        return names;
    }
}
