package com.example.redline.service;

import com.example.redline.model.DocumentType;
import com.example.redline.model.RedlineOptions;
import com.example.redline.model.RedlineOutcome;
import com.example.redline.util.pml.PmlChangeListBuilder;
import com.example.redline.util.pml.PmlComparer;
import com.example.redline.util.pml.PmlComparerSettings;
import com.example.redline.util.pml.PmlPatcher;
import com.example.redline.util.pml.dto.PmlChange;
import com.example.redline.util.pml.dto.PmlComparisonResult;
import com.example.redline.util.sml.SmlChangeListBuilder;
import com.example.redline.util.sml.SmlComparer;
import com.example.redline.util.sml.SmlComparerSettings;
import com.example.redline.util.sml.SmlPatcher;
import com.example.redline.util.sml.dto.SmlChange;
import com.example.redline.util.sml.dto.SmlComparisonResult;
import com.example.redline.util.wml.WmlChangeListBuilder;
import com.example.redline.util.wml.WmlComparer;
import com.example.redline.util.wml.WmlComparerSettings;
import com.example.redline.util.wml.WmlRevisionProcessor;
import com.example.redline.util.wml.dto.WmlComparisonResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 按文档类型分派到 Word / Excel / PowerPoint 比对器
 *
 * 不依赖 Spring，HTTP 服务和命令行共用。
 */
@Slf4j
public class DocumentRedliner {

    private final ObjectMapper objectMapper;

    public DocumentRedliner() {
        this(new ObjectMapper());
    }

    public DocumentRedliner(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * 比对并生成标注文档
     */
    public RedlineOutcome compare(DocumentType type, byte[] older, byte[] newer, RedlineOptions options) {
        RedlineOptions o = options == null ? new RedlineOptions() : options;
        RedlineOutcome outcome = new RedlineOutcome(type);
        switch (type) {
            case WORD: {
                WmlComparisonResult result = WmlComparer.compare(older, newer, wmlSettings(o));
                outcome.setDocument(result.getDocument());
                outcome.setChanges(result.getChanges());
                outcome.setItems(WmlChangeListBuilder.build(result.getChanges()));
                outcome.setRevisionCount(result.getRevisionCount());
                break;
            }
            case EXCEL: {
                SmlComparisonResult result = SmlComparer.compare(older, newer, smlSettings(o));
                outcome.setDocument(result.getDocument());
                outcome.setChanges(result.getChanges());
                outcome.setItems(SmlChangeListBuilder.build(result.getChanges()));
                outcome.setRevisionCount(result.getTotalChanges());
                break;
            }
            default: {
                PmlComparisonResult result = PmlComparer.compare(older, newer, pmlSettings(o));
                outcome.setDocument(result.getDocument());
                outcome.setChanges(result.getChanges());
                outcome.setItems(PmlChangeListBuilder.build(result.getChanges()));
                outcome.setRevisionCount(result.getTotalChanges());
                break;
            }
        }
        log.info("{} 比对完成: revisionCount={}", type, outcome.getRevisionCount());
        return outcome;
    }

    /**
     * 只列出变更；Excel / PowerPoint 不生成标注文档
     */
    public RedlineOutcome changes(DocumentType type, byte[] older, byte[] newer, RedlineOptions options) {
        RedlineOptions o = options == null ? new RedlineOptions() : options;
        if (type == DocumentType.WORD) {
            RedlineOutcome outcome = compare(type, older, newer, o);
            outcome.setDocument(null);
            return outcome;
        }
        RedlineOutcome outcome = new RedlineOutcome(type);
        if (type == DocumentType.EXCEL) {
            SmlComparisonResult result = SmlComparer.diff(older, newer, smlSettings(o));
            outcome.setChanges(result.getChanges());
            outcome.setItems(SmlChangeListBuilder.build(result.getChanges()));
            outcome.setRevisionCount(result.getTotalChanges());
        } else {
            PmlComparisonResult result = PmlComparer.diff(older, newer, pmlSettings(o));
            outcome.setChanges(result.getChanges());
            outcome.setItems(PmlChangeListBuilder.build(result.getChanges()));
            outcome.setRevisionCount(result.getTotalChanges());
        }
        return outcome;
    }

    /**
     * Word：base 为比对结果，接受列出的修订；Excel / PowerPoint：base 为旧文档，应用列出的变更
     *
     * @param changesJson 变更 JSON 数组
     */
    public byte[] apply(DocumentType type, byte[] base, byte[] changesJson) {
        switch (type) {
            case WORD:
                return WmlRevisionProcessor.acceptRevisions(base, readRevisionIds(changesJson));
            case EXCEL:
                return SmlPatcher.apply(base, readChanges(changesJson, new TypeReference<List<SmlChange>>() { }));
            default:
                return PmlPatcher.apply(base, readChanges(changesJson, new TypeReference<List<PmlChange>>() { }));
        }
    }

    /**
     * Word：拒绝列出的修订；Excel / PowerPoint：在比对结果上撤销列出的变更
     */
    public byte[] revert(DocumentType type, byte[] result, byte[] changesJson) {
        switch (type) {
            case WORD:
                return WmlRevisionProcessor.rejectRevisions(result, readRevisionIds(changesJson));
            case EXCEL:
                return SmlPatcher.revert(result, readChanges(changesJson, new TypeReference<List<SmlChange>>() { }));
            default:
                return PmlPatcher.revert(result, readChanges(changesJson, new TypeReference<List<PmlChange>>() { }));
        }
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("变更序列化失败: " + e.getMessage(), e);
        }
    }

    // ==================== 设置 ====================

    WmlComparerSettings wmlSettings(RedlineOptions o) {
        WmlComparerSettings settings = new WmlComparerSettings();
        settings.setAuthor(o.getAuthor());
        settings.setDateTime(o.getDateTime());
        if (o.getDetailThreshold() != null) {
            settings.setDetailThreshold(o.getDetailThreshold());
        }
        if (o.getTrackFormatting() != null) {
            settings.setTrackFormattingChanges(o.getTrackFormatting());
        }
        return settings;
    }

    SmlComparerSettings smlSettings(RedlineOptions o) {
        SmlComparerSettings settings = new SmlComparerSettings();
        if (hasText(o.getAuthor())) {
            settings.setAuthorForChanges(o.getAuthor());
        }
        if (o.getTrackFormatting() != null) {
            settings.setCompareFormatting(o.getTrackFormatting());
        }
        return settings;
    }

    PmlComparerSettings pmlSettings(RedlineOptions o) {
        PmlComparerSettings settings = new PmlComparerSettings();
        if (hasText(o.getAuthor())) {
            settings.setAuthorForChanges(o.getAuthor());
        }
        if (o.getTrackFormatting() != null) {
            settings.setCompareTextFormatting(o.getTrackFormatting());
        }
        return settings;
    }

    // ==================== 变更 JSON ====================

    /**
     * 数组元素可以是修订号，也可以是变更 / 变更列表项对象（取 revision_id、revision_ids）
     */
    Set<Integer> readRevisionIds(byte[] changesJson) {
        JsonNode root = readTree(changesJson);
        Set<Integer> ids = new LinkedHashSet<>();
        for (JsonNode node : root) {
            if (node.isIntegralNumber()) {
                ids.add(node.asInt());
            } else if (node.isTextual() && node.asText().matches("\\d+")) {
                ids.add(Integer.parseInt(node.asText()));
            } else if (node.isObject()) {
                if (node.hasNonNull("revision_id")) {
                    ids.add(node.get("revision_id").asInt());
                }
                for (JsonNode id : node.path("revision_ids")) {
                    ids.add(id.asInt());
                }
            } else {
                throw new IllegalArgumentException("无法识别的修订号: " + node);
            }
        }
        log.debug("待处理修订号: {}", ids);
        return ids;
    }

    private <T> List<T> readChanges(byte[] changesJson, TypeReference<List<T>> typeRef) {
        JsonNode root = readTree(changesJson);
        return objectMapper.convertValue(root, typeRef);
    }

    private JsonNode readTree(byte[] changesJson) {
        JsonNode root;
        try {
            root = objectMapper.readTree(changesJson);
        } catch (IOException e) {
            throw new IllegalArgumentException("变更 JSON 格式错误: " + e.getMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("变更 JSON 必须是数组");
        }
        return root;
    }

    private static boolean hasText(String s) {
        return s != null && !s.trim().isEmpty();
    }
}
