package com.example.redline.util.wml;

import com.example.redline.util.common.HashUtils;
import com.example.redline.util.ooxml.OoxmlPackage;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 把旧文档内容引用的关系（图片、图表、外部链接）迁移到输出包
 *
 * 输出建立在新文档的包上，被删除的旧内容仍引用旧包的关系 id，
 * 这里把目标部件复制过去（字节相同则复用）并改写 r:* 属性。
 */
@Slf4j
public class RelationshipMigrator {

    private final OoxmlPackage from;
    private final String fromPart;
    private final OoxmlPackage to;
    private final String toPart;
    private final Map<String, String> mapped = new HashMap<>();
    private int copied;

    public RelationshipMigrator(OoxmlPackage from, String fromPart, OoxmlPackage to, String toPart) {
        this.from = from;
        this.fromPart = fromPart;
        this.to = to;
        this.toPart = toPart;
    }

    /**
     * 改写 root 下所有 r:* 关系属性
     *
     * @return 改写的属性数
     */
    public int migrate(Element root) {
        int rewritten = 0;
        for (Element el : root.getAllElements()) {
            List<Attribute> refs = new ArrayList<>();
            for (Attribute a : el.attributes()) {
                if (a.getKey().startsWith("r:")) {
                    refs.add(a);
                }
            }
            for (Attribute a : refs) {
                String newId = map(a.getValue());
                if (newId != null && !newId.equals(a.getValue())) {
                    el.attr(a.getKey(), newId);
                    rewritten++;
                }
            }
        }
        log.debug("关系迁移: rewritten={}, copiedParts={}", rewritten, copied);
        return rewritten;
    }

    private String map(String relId) {
        if (mapped.containsKey(relId)) {
            return mapped.get(relId);
        }
        String newId = doMap(relId);
        mapped.put(relId, newId);
        return newId;
    }

    private String doMap(String relId) {
        String type = from.getRelationshipType(fromPart, relId);
        if (type == null) {
            return null;
        }
        if (type.startsWith("external:")) {
            String target = from.getExternalTarget(fromPart, relId);
            return target == null ? null : to.addExternalRelationship(toPart, target, type.substring("external:".length()));
        }
        String target = from.resolveRelationshipTarget(fromPart, relId);
        byte[] bytes = target == null ? null : from.getPart(target);
        if (bytes == null) {
            log.debug("关系目标不存在，保持原样: {}", relId);
            return null;
        }

        // 新包中已有同一目标且内容一致时复用关系
        for (Map.Entry<String, String> rel : to.getRelatedParts(toPart, type).entrySet()) {
            byte[] existing = to.getPart(rel.getValue());
            if (existing != null && Arrays.equals(existing, bytes)) {
                return rel.getKey();
            }
        }

        String path = target;
        byte[] existing = to.getPart(path);
        if (existing == null || !Arrays.equals(existing, bytes)) {
            if (existing != null) {
                path = uniquePath(target, bytes);
            }
            to.createPart(path, from.getContentType(target), bytes);
            copied++;
        }
        return to.addRelationship(toPart, path, type);
    }

    private String uniquePath(String target, byte[] bytes) {
        String dir = OoxmlPackage.directoryOf(target);
        String file = target.substring(dir.isEmpty() ? 0 : dir.length() + 1);
        String prefix = "old" + HashUtils.sha1(bytes).substring(0, 8) + "_";
        return dir.isEmpty() ? prefix + file : dir + "/" + prefix + file;
    }
}
