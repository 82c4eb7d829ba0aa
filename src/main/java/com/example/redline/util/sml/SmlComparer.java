package com.example.redline.util.sml;

import com.example.redline.util.ooxml.OoxmlPackage;
import com.example.redline.util.sml.dto.SmlChangeListItem;
import com.example.redline.util.sml.dto.SmlChangeListOptions;
import com.example.redline.util.sml.dto.SmlComparisonResult;
import com.example.redline.util.sml.signature.WorkbookSignature;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Excel 工作簿比对
 *
 * 流程：规范化两个工作簿 → 逐表逐格比对 → 在新工作簿上标注批注和汇总表。
 */
@Slf4j
public class SmlComparer {

    private SmlComparer() {
    }

    public static SmlComparisonResult compare(byte[] older, byte[] newer) {
        return compare(older, newer, new SmlComparerSettings());
    }

    /**
     * 比对并生成带标注的新工作簿
     */
    public static SmlComparisonResult compare(byte[] older, byte[] newer, SmlComparerSettings settings) {
        long start = System.currentTimeMillis();
        SmlComparerSettings s = settings == null ? new SmlComparerSettings() : settings;
        SmlComparisonResult result = diff(older, newer, s);
        try (OoxmlPackage pkg = OoxmlPackage.open(newer)) {
            new SmlMarkupRenderer(s).render(pkg, result);
            result.setDocument(pkg.save());
        }
        log.info("Excel比对完成: changes={}, 耗时={}ms", result.getTotalChanges(), System.currentTimeMillis() - start);
        return result;
    }

    /**
     * 只比对，不生成文档
     */
    public static SmlComparisonResult diff(byte[] older, byte[] newer, SmlComparerSettings settings) {
        SmlComparerSettings s = settings == null ? new SmlComparerSettings() : settings;
        SmlCanonicalizer canonicalizer = new SmlCanonicalizer(s);
        WorkbookSignature wb1;
        WorkbookSignature wb2;
        try (OoxmlPackage pkg1 = OoxmlPackage.open(older); OoxmlPackage pkg2 = OoxmlPackage.open(newer)) {
            wb1 = canonicalizer.canonicalize(pkg1);
            wb2 = canonicalizer.canonicalize(pkg2);
        }
        log.info("Excel比对: sheets1={}, sheets2={}", wb1.getSheets().size(), wb2.getSheets().size());
        return new SmlDiffEngine(s).diff(wb1, wb2);
    }

    public static List<SmlChangeListItem> getChangeList(byte[] older, byte[] newer, SmlComparerSettings settings,
                                                        SmlChangeListOptions options) {
        SmlComparisonResult result = diff(older, newer, settings);
        return SmlChangeListBuilder.build(result.getChanges(), options == null ? SmlChangeListOptions.defaults() : options);
    }
}
