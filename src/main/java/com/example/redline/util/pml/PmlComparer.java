package com.example.redline.util.pml;

import com.example.redline.util.ooxml.OoxmlPackage;
import com.example.redline.util.pml.dto.PmlChangeListItem;
import com.example.redline.util.pml.dto.PmlChangeListOptions;
import com.example.redline.util.pml.dto.PmlComparisonResult;
import com.example.redline.util.pml.signature.PresentationSignature;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * PowerPoint 演示文稿比对
 *
 * 流程：规范化两个演示文稿 → 幻灯片配对 → 形状配对与比较 → 在新演示文稿上叠加标签。
 */
@Slf4j
public class PmlComparer {

    private PmlComparer() {
    }

    public static PmlComparisonResult compare(byte[] older, byte[] newer) {
        return compare(older, newer, new PmlComparerSettings());
    }

    /**
     * 比对并生成带标注的新演示文稿；没有差异时原样返回新演示文稿
     */
    public static PmlComparisonResult compare(byte[] older, byte[] newer, PmlComparerSettings settings) {
        long start = System.currentTimeMillis();
        PmlComparerSettings s = settings == null ? new PmlComparerSettings() : settings;
        PmlComparisonResult result = diff(older, newer, s);
        if (result.getTotalChanges() == 0) {
            result.setDocument(newer);
        } else {
            try (OoxmlPackage pkg = OoxmlPackage.open(newer)) {
                new PmlMarkupRenderer(s).render(pkg, result);
                result.setDocument(pkg.save());
            }
        }
        log.info("PPT比对完成: changes={}, 耗时={}ms", result.getTotalChanges(), System.currentTimeMillis() - start);
        return result;
    }

    /**
     * 只比对，不生成文档
     */
    public static PmlComparisonResult diff(byte[] older, byte[] newer, PmlComparerSettings settings) {
        PmlComparerSettings s = settings == null ? new PmlComparerSettings() : settings;
        PmlCanonicalizer canonicalizer = new PmlCanonicalizer(s);
        PresentationSignature p1;
        PresentationSignature p2;
        try (OoxmlPackage pkg1 = OoxmlPackage.open(older); OoxmlPackage pkg2 = OoxmlPackage.open(newer)) {
            p1 = canonicalizer.canonicalize(pkg1);
            p2 = canonicalizer.canonicalize(pkg2);
        }
        log.info("PPT比对: slides1={}, slides2={}", p1.getSlides().size(), p2.getSlides().size());
        return new PmlDiffEngine(s).diff(p1, p2);
    }

    public static List<PmlChangeListItem> getChangeList(byte[] older, byte[] newer, PmlComparerSettings settings,
                                                        PmlChangeListOptions options) {
        PmlComparisonResult result = diff(older, newer, settings);
        return PmlChangeListBuilder.build(result.getChanges(), options == null ? PmlChangeListOptions.defaults() : options);
    }
}
