package com.example.redline.util.sml;

import com.example.redline.util.ooxml.OoxmlPackage;
import com.example.redline.util.sml.dto.SmlChange;
import com.example.redline.util.sml.dto.SmlChangeListItem;
import com.example.redline.util.sml.dto.SmlChangeType;
import com.example.redline.util.sml.dto.SmlComparisonResult;
import com.example.redline.util.xml.XmlUtils;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.example.redline.support.OoxmlFixtures.xlsx;
import static org.assertj.core.api.Assertions.assertThat;

class SmlComparerTest {

    @Test
    void changedNumberIsReportedAsValueChange() {
        byte[] older = xlsx().sheet("Sheet1", "A1=100", "B1=label").build();
        byte[] newer = xlsx().sheet("Sheet1", "A1=200", "B1=label").build();

        SmlComparisonResult result = SmlComparer.diff(older, newer, new SmlComparerSettings());

        assertThat(result.getChanges()).hasSize(1);
        SmlChange change = result.getChanges().get(0);
        assertThat(change.getId()).isEqualTo("sml-1");
        assertThat(change.getChangeType()).isEqualTo(SmlChangeType.ValueChanged);
        assertThat(change.getSheetName()).isEqualTo("Sheet1");
        assertThat(change.getCellAddress()).isEqualTo("A1");
        assertThat(change.getOldValue()).isEqualTo("100");
        assertThat(change.getNewValue()).isEqualTo("200");
        assertThat(change.getDescription()).isEqualTo("Cell Sheet1!A1 value changed from '100' to '200'");
    }

    @Test
    void identicalWorkbooksHaveNoChanges() {
        byte[] doc = xlsx().sheet("Sheet1", "A1=1", "A2=two", "A3==A1*2").build();

        assertThat(SmlComparer.diff(doc, doc, null).getChanges()).isEmpty();
    }

    @Test
    void equivalentNumbersAreNotChanges() {
        byte[] older = xlsx().sheet("Sheet1", "A1=100.0").build();
        byte[] newer = xlsx().sheet("Sheet1", "A1=100").build();

        assertThat(SmlComparer.diff(older, newer, null).getChanges()).isEmpty();
    }

    @Test
    void addedDeletedAndFormulaCellsAreSortedByPosition() {
        byte[] older = xlsx().sheet("Sheet1", "A1=1", "B2=gone", "C3==SUM(A1)").build();
        byte[] newer = xlsx().sheet("Sheet1", "A1=1", "C3==SUM(A1:A2)", "D4=new").build();

        List<SmlChange> changes = SmlComparer.diff(older, newer, null).getChanges();

        assertThat(changes).extracting(SmlChange::getChangeType).containsExactly(
                SmlChangeType.CellDeleted, SmlChangeType.FormulaChanged, SmlChangeType.CellAdded);
        assertThat(changes).extracting(SmlChange::getCellAddress).containsExactly("B2", "C3", "D4");
        assertThat(changes.get(1).getOldFormula()).isEqualTo("SUM(A1)");
        assertThat(changes.get(1).getNewFormula()).isEqualTo("SUM(A1:A2)");
    }

    @Test
    void sheetsAddedAndDeletedByName() {
        byte[] older = xlsx().sheet("Keep", "A1=1").sheet("Old", "A1=x", "B1=y", "C1=z").build();
        byte[] newer = xlsx().sheet("Keep", "A1=1").sheet("Fresh", "A1=p", "B1=q").build();
        SmlComparerSettings settings = new SmlComparerSettings();
        settings.setEnableSheetRenameDetection(false);

        List<SmlChange> changes = SmlComparer.diff(older, newer, settings).getChanges();

        assertThat(changes).extracting(SmlChange::getChangeType)
                .contains(SmlChangeType.SheetAdded, SmlChangeType.SheetDeleted)
                .doesNotContain(SmlChangeType.SheetRenamed);
    }

    @Test
    void renamedSheetWithSameContentIsDetected() {
        byte[] older = xlsx().sheet("Data", "A1=1", "A2=2", "A3=3").build();
        byte[] newer = xlsx().sheet("Numbers", "A1=1", "A2=2", "A3=3").build();

        List<SmlChange> changes = SmlComparer.diff(older, newer, null).getChanges();

        assertThat(changes).hasSize(1);
        assertThat(changes.get(0).getChangeType()).isEqualTo(SmlChangeType.SheetRenamed);
        assertThat(changes.get(0).getOldSheetName()).isEqualTo("Data");
        assertThat(changes.get(0).getSheetName()).isEqualTo("Numbers");
    }

    @Test
    void compareRendersCommentsAndSummarySheet() {
        byte[] older = xlsx().sheet("Sheet1", "A1=100").build();
        byte[] newer = xlsx().sheet("Sheet1", "A1=200").build();

        SmlComparisonResult result = SmlComparer.compare(older, newer);

        assertThat(result.getDocument()).isNotNull();
        try (OoxmlPackage pkg = OoxmlPackage.open(result.getDocument())) {
            List<String> sheetNames = new ArrayList<>();
            Element workbook = XmlUtils.rootElement(pkg.getXmlPart(pkg.getMainDocumentPath()));
            for (Element sheet : XmlUtils.children(XmlUtils.child(workbook, "sheets"), "sheet")) {
                sheetNames.add(XmlUtils.attr(sheet, "name"));
            }
            assertThat(sheetNames).containsExactly("Sheet1", SmlMarkupRenderer.SUMMARY_SHEET_NAME);
            assertThat(pkg.getRelatedPart("xl/worksheets/sheet1.xml", OoxmlPackage.REL_COMMENTS)).isNotNull();
            assertThat(pkg.getRelatedPart("xl/worksheets/sheet1.xml", OoxmlPackage.REL_VML_DRAWING)).isNotNull();
        }
    }

    @Test
    void applyAndRevertPatchCellsBothWays() {
        byte[] older = xlsx().sheet("Sheet1", "A1=100", "B1=old", "C1=drop").build();
        byte[] newer = xlsx().sheet("Sheet1", "A1=200", "B1=new", "D1=add").build();
        List<SmlChange> changes = SmlComparer.diff(older, newer, null).getChanges();

        byte[] applied = SmlPatcher.apply(older, changes);
        byte[] reverted = SmlPatcher.revert(newer, changes);

        assertThat(SmlComparer.diff(applied, newer, null).getChanges()).isEmpty();
        assertThat(SmlComparer.diff(reverted, older, null).getChanges()).isEmpty();
    }

    @Test
    void applySelectedChangesOnly() {
        byte[] older = xlsx().sheet("Sheet1", "A1=1", "B1=2").build();
        byte[] newer = xlsx().sheet("Sheet1", "A1=10", "B1=20").build();
        List<SmlChange> changes = SmlComparer.diff(older, newer, null).getChanges();

        byte[] applied = SmlPatcher.apply(older, changes, Collections.singleton("sml-1"));

        List<SmlChange> remaining = SmlComparer.diff(applied, newer, null).getChanges();
        assertThat(remaining).extracting(SmlChange::getCellAddress).containsExactly("B1");
    }

    @Test
    void changeListGroupsAdjacentCells() {
        byte[] older = xlsx().sheet("Sheet1", "A1=1", "B1=2", "C1=3", "A5=x").build();
        byte[] newer = xlsx().sheet("Sheet1", "A1=4", "B1=5", "C1=6", "A5=y").build();

        List<SmlChangeListItem> items = SmlComparer.getChangeList(older, newer, null, null);

        assertThat(items).hasSize(2);
        assertThat(items.get(0).getCount()).isEqualTo(3);
        assertThat(items.get(0).getCellRange()).isEqualTo("A1:C1");
        assertThat(items.get(0).getChangeIds()).containsExactly("sml-1", "sml-2", "sml-3");
        assertThat(items.get(0).getAnchor()).isEqualTo("Sheet1!A1");
        assertThat(items.get(1).getCount()).isEqualTo(1);
        assertThat(items.get(1).getSummary()).isEqualTo("Cell Sheet1!A5 value changed from 'x' to 'y'");
    }

    @Test
    void insertedRowIsAlignedInsteadOfShiftingValues() {
        SmlComparerSettings settings = new SmlComparerSettings();
        settings.setEnableRowAlignment(true);
        byte[] older = xlsx().sheet("Sheet1", "A1=id", "B1=name", "A2=1", "B2=apple", "A3=2", "B3=pear").build();
        byte[] newer = xlsx().sheet("Sheet1", "A1=id", "B1=name", "A2=9", "B2=kiwi",
                "A3=1", "B3=apple", "A4=2", "B4=pear").build();

        List<SmlChange> changes = SmlComparer.diff(older, newer, settings).getChanges();

        assertThat(changes).hasSize(1);
        assertThat(changes.get(0).getChangeType()).isEqualTo(SmlChangeType.RowInserted);
        assertThat(changes.get(0).getRowIndex()).isEqualTo(2);
    }

    @Test
    void withoutRowAlignmentShiftedRowsAreCellEdits() {
        byte[] older = xlsx().sheet("Sheet1", "A1=id", "A2=apple", "A3=pear").build();
        byte[] newer = xlsx().sheet("Sheet1", "A1=id", "A2=kiwi", "A3=apple", "A4=pear").build();

        List<SmlChange> changes = SmlComparer.diff(older, newer, null).getChanges();

        assertThat(changes).extracting(SmlChange::getChangeType)
                .doesNotContain(SmlChangeType.RowInserted)
                .contains(SmlChangeType.ValueChanged, SmlChangeType.CellAdded);
    }

    @Test
    void insertedColumnIsAlignedInsteadOfShiftingValues() {
        SmlComparerSettings settings = new SmlComparerSettings();
        settings.setEnableColumnAlignment(true);
        byte[] older = xlsx().sheet("Sheet1", "A1=x", "A2=y", "B1=p", "B2=q").build();
        byte[] newer = xlsx().sheet("Sheet1", "A1=x", "A2=y", "B1=m", "B2=n", "C1=p", "C2=q").build();

        List<SmlChange> changes = SmlComparer.diff(older, newer, settings).getChanges();

        assertThat(changes).hasSize(1);
        assertThat(changes.get(0).getChangeType()).isEqualTo(SmlChangeType.ColumnInserted);
        assertThat(changes.get(0).getColumnIndex()).isEqualTo(2);
    }
}
