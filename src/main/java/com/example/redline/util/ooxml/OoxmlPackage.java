package com.example.redline.util.ooxml;

import com.example.redline.exception.RedlineException;
import com.example.redline.util.xml.XmlUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.opc.PackagePart;
import org.apache.poi.openxml4j.opc.PackagePartName;
import org.apache.poi.openxml4j.opc.PackageProperties;
import org.apache.poi.openxml4j.opc.PackageRelationship;
import org.apache.poi.openxml4j.opc.PackageRelationshipCollection;
import org.apache.poi.openxml4j.opc.PackagingURIHelper;
import org.apache.poi.openxml4j.opc.TargetMode;
import org.jsoup.nodes.Document;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * OOXML 包（基于 POI OPCPackage）
 *
 * 部件路径统一使用 ZIP 内部路径（不带前导斜杠，如 word/document.xml）。
 * 包完全在内存中打开和组装，save() 时一次性输出。
 */
@Slf4j
public class OoxmlPackage implements AutoCloseable {

    public static final String REL_OFFICE_DOCUMENT =
            "http://schemas.openxmlformats.org/officeDocument/2006/relationships/officeDocument";
    public static final String REL_OFFICE_DOCUMENT_STRICT =
            "http://purl.oclc.org/ooxml/officeDocument/relationships/officeDocument";
    public static final String REL_IMAGE =
            "http://schemas.openxmlformats.org/officeDocument/2006/relationships/image";
    public static final String REL_FOOTNOTES =
            "http://schemas.openxmlformats.org/officeDocument/2006/relationships/footnotes";
    public static final String REL_ENDNOTES =
            "http://schemas.openxmlformats.org/officeDocument/2006/relationships/endnotes";
    public static final String REL_WORKSHEET =
            "http://schemas.openxmlformats.org/officeDocument/2006/relationships/worksheet";
    public static final String REL_SHARED_STRINGS =
            "http://schemas.openxmlformats.org/officeDocument/2006/relationships/sharedStrings";
    public static final String REL_STYLES =
            "http://schemas.openxmlformats.org/officeDocument/2006/relationships/styles";
    public static final String REL_COMMENTS =
            "http://schemas.openxmlformats.org/officeDocument/2006/relationships/comments";
    public static final String REL_VML_DRAWING =
            "http://schemas.openxmlformats.org/officeDocument/2006/relationships/vmlDrawing";
    public static final String REL_HYPERLINK =
            "http://schemas.openxmlformats.org/officeDocument/2006/relationships/hyperlink";
    public static final String REL_SLIDE =
            "http://schemas.openxmlformats.org/officeDocument/2006/relationships/slide";
    public static final String REL_SLIDE_LAYOUT =
            "http://schemas.openxmlformats.org/officeDocument/2006/relationships/slideLayout";
    public static final String REL_NOTES_SLIDE =
            "http://schemas.openxmlformats.org/officeDocument/2006/relationships/notesSlide";
    public static final String REL_THEME =
            "http://schemas.openxmlformats.org/officeDocument/2006/relationships/theme";
    public static final String REL_CHART =
            "http://schemas.openxmlformats.org/officeDocument/2006/relationships/chart";
    public static final String REL_CALC_CHAIN =
            "http://schemas.openxmlformats.org/officeDocument/2006/relationships/calcChain";

    private final OPCPackage pkg;

    private OoxmlPackage(OPCPackage pkg) {
        this.pkg = pkg;
    }

    /**
     * 从字节打开包
     */
    public static OoxmlPackage open(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw RedlineException.packageError("", "文档内容为空", null);
        }
        try {
            return new OoxmlPackage(OPCPackage.open(new ByteArrayInputStream(bytes)));
        } catch (InvalidFormatException e) {
            throw RedlineException.packageError("", "无效的OOXML包: " + e.getMessage(), e);
        } catch (IOException e) {
            throw RedlineException.packageError("", "读取OOXML包失败: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // POI 对损坏的 ZIP 会抛出各种运行时异常
            throw RedlineException.packageError("", "无法打开OOXML包: " + e.getMessage(), e);
        }
    }

    public static OoxmlPackage open(InputStream in) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[8192];
        int n;
        while ((n = in.read(chunk)) != -1) {
            buffer.write(chunk, 0, n);
        }
        return open(buffer.toByteArray());
    }

    // ==================== 部件读写 ====================

    /**
     * 读取部件字节，不存在时返回 null
     */
    public byte[] getPart(String path) {
        PackagePart part = findPart(path);
        if (part == null) {
            return null;
        }
        try (InputStream is = part.getInputStream()) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            byte[] chunk = new byte[8192];
            int n;
            while ((n = is.read(chunk)) != -1) {
                buffer.write(chunk, 0, n);
            }
            return buffer.toByteArray();
        } catch (IOException e) {
            throw RedlineException.packageError(path, "读取部件失败: " + e.getMessage(), e);
        }
    }

    public boolean partExists(String path) {
        return findPart(path) != null;
    }

    /**
     * 覆盖已有部件的内容
     */
    public void putPart(String path, byte[] bytes) {
        PackagePart part = findPart(path);
        if (part == null) {
            throw RedlineException.missingPart(path, "部件不存在，无法写入");
        }
        try (OutputStream os = part.getOutputStream()) {
            os.write(bytes);
        } catch (IOException e) {
            throw RedlineException.packageError(path, "写入部件失败: " + e.getMessage(), e);
        }
    }

    /**
     * 新建部件（已存在则覆盖内容）
     */
    public void createPart(String path, String contentType, byte[] bytes) {
        if (partExists(path)) {
            putPart(path, bytes);
            return;
        }
        try {
            PackagePart part = pkg.createPart(partName(path), contentType);
            try (OutputStream os = part.getOutputStream()) {
                os.write(bytes);
            }
        } catch (IOException e) {
            throw RedlineException.packageError(path, "创建部件失败: " + e.getMessage(), e);
        }
    }

    public Document getXmlPart(String path) {
        byte[] bytes = getPart(path);
        if (bytes == null) {
            throw RedlineException.missingPart(path, "XML部件不存在");
        }
        return XmlUtils.parse(bytes, path);
    }

    /**
     * 读取可选 XML 部件，不存在时返回 null
     */
    public Document getOptionalXmlPart(String path) {
        byte[] bytes = getPart(path);
        return bytes == null ? null : XmlUtils.parse(bytes, path);
    }

    public void putXmlPart(String path, Document tree) {
        putPart(path, XmlUtils.serialize(tree));
    }

    /**
     * 保存为字节
     */
    public byte[] save() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            pkg.save(out);
        } catch (IOException e) {
            throw RedlineException.packageError("", "保存OOXML包失败: " + e.getMessage(), e);
        }
        return out.toByteArray();
    }

    public List<String> listParts() {
        List<String> result = new ArrayList<>();
        try {
            for (PackagePart part : pkg.getParts()) {
                result.add(toPath(part.getPartName()));
            }
        } catch (InvalidFormatException e) {
            throw RedlineException.packageError("", "枚举部件失败: " + e.getMessage(), e);
        }
        return result;
    }

    public String getContentType(String path) {
        PackagePart part = findPart(path);
        return part == null ? null : part.getContentType();
    }

    /**
     * 核心属性（docProps/core.xml）：lastModifiedBy、creator、modified；没有时返回 null
     *
     * 核心属性部件由 POI 单独解析，不能按普通部件读取。
     */
    public String getCoreProperty(String name) {
        PackageProperties props;
        try {
            props = pkg.getPackageProperties();
        } catch (InvalidFormatException | RuntimeException e) {
            log.warn("核心属性读取失败，忽略: {}", e.getMessage());
            return null;
        }
        Optional<String> value;
        switch (name) {
            case "lastModifiedBy":
                value = props.getLastModifiedByProperty();
                break;
            case "creator":
                value = props.getCreatorProperty();
                break;
            case "modified":
                value = props.getModifiedProperty()
                        .map(d -> d.toInstant().truncatedTo(ChronoUnit.SECONDS).toString());
                break;
            default:
                return null;
        }
        return value.map(String::trim).filter(v -> !v.isEmpty()).orElse(null);
    }

    // ==================== 关系 ====================

    /**
     * 主文档部件路径（通过包级 officeDocument 关系）
     */
    public String getMainDocumentPath() {
        PackageRelationshipCollection rels = pkg.getRelationshipsByType(REL_OFFICE_DOCUMENT);
        if (rels.size() == 0) {
            rels = pkg.getRelationshipsByType(REL_OFFICE_DOCUMENT_STRICT);
        }
        if (rels.size() == 0) {
            throw RedlineException.invalidPackage("_rels/.rels", "缺少officeDocument关系");
        }
        URI target = rels.getRelationship(0).getTargetURI();
        return trimSlash(target.toString());
    }

    /**
     * 解析部件内的关系 id，返回目标部件路径；外部目标或无法解析时返回 null
     */
    public String resolveRelationshipTarget(String sourcePath, String relId) {
        PackagePart source = findPart(sourcePath);
        if (source == null || relId == null || relId.isEmpty()) {
            return null;
        }
        try {
            PackageRelationship rel = source.getRelationship(relId);
            if (rel == null || rel.getTargetMode() == TargetMode.EXTERNAL) {
                return null;
            }
            URI resolved = PackagingURIHelper.resolvePartUri(source.getPartName().getURI(), rel.getTargetURI());
            return trimSlash(resolved.toString());
        } catch (RuntimeException e) {
            log.debug("关系解析失败: {} -> {}, {}", sourcePath, relId, e.getMessage());
            return null;
        }
    }

    /**
     * 外部关系目标（如超链接地址），不存在时返回 null
     */
    public String getExternalTarget(String sourcePath, String relId) {
        PackagePart source = findPart(sourcePath);
        if (source == null || relId == null) {
            return null;
        }
        try {
            PackageRelationship rel = source.getRelationship(relId);
            if (rel == null) {
                return null;
            }
            return rel.getTargetURI().toString();
        } catch (RuntimeException e) {
            log.debug("外部关系解析失败: {} -> {}", sourcePath, relId);
            return null;
        }
    }

    /**
     * 关系类型，关系不存在时返回 null；外部关系的类型前加 "external:"
     */
    public String getRelationshipType(String sourcePath, String relId) {
        PackagePart source = findPart(sourcePath);
        if (source == null || relId == null) {
            return null;
        }
        try {
            PackageRelationship rel = source.getRelationship(relId);
            if (rel == null) {
                return null;
            }
            String type = rel.getRelationshipType();
            return rel.getTargetMode() == TargetMode.EXTERNAL ? "external:" + type : type;
        } catch (RuntimeException e) {
            log.debug("关系类型读取失败: {} -> {}", sourcePath, relId);
            return null;
        }
    }

    /**
     * 添加一条外部关系（超链接等），返回新关系 id
     */
    public String addExternalRelationship(String sourcePath, String target, String relType) {
        PackagePart source = findPart(sourcePath);
        if (source == null) {
            throw RedlineException.missingPart(sourcePath, "源部件不存在，无法添加关系");
        }
        return source.addExternalRelationship(target, relType).getId();
    }

    /**
     * 源部件指定类型关系的目标路径（按关系顺序，只含内部目标），键为关系 id
     */
    public Map<String, String> getRelatedParts(String sourcePath, String relType) {
        Map<String, String> result = new LinkedHashMap<>();
        PackagePart source = findPart(sourcePath);
        if (source == null) {
            return result;
        }
        try {
            for (PackageRelationship rel : source.getRelationshipsByType(relType)) {
                if (rel.getTargetMode() == TargetMode.EXTERNAL) {
                    continue;
                }
                URI resolved = PackagingURIHelper.resolvePartUri(source.getPartName().getURI(), rel.getTargetURI());
                result.put(rel.getId(), trimSlash(resolved.toString()));
            }
        } catch (InvalidFormatException e) {
            throw RedlineException.packageError(sourcePath, "读取关系失败: " + e.getMessage(), e);
        }
        return result;
    }

    /**
     * 第一个指定类型关系的目标路径，不存在时返回 null
     */
    public String getRelatedPart(String sourcePath, String relType) {
        Map<String, String> related = getRelatedParts(sourcePath, relType);
        return related.isEmpty() ? null : related.values().iterator().next();
    }

    /**
     * 为源部件添加一条内部关系，返回新关系 id
     */
    public String addRelationship(String sourcePath, String targetPath, String relType) {
        PackagePart source = findPart(sourcePath);
        if (source == null) {
            throw RedlineException.missingPart(sourcePath, "源部件不存在，无法添加关系");
        }
        PackageRelationship rel = source.addRelationship(partName(targetPath), TargetMode.INTERNAL, relType);
        return rel.getId();
    }

    /**
     * 删除源部件指定类型的关系及其目标部件，返回删除的部件数
     */
    public int removeRelatedParts(String sourcePath, String relType) {
        PackagePart source = findPart(sourcePath);
        if (source == null) {
            return 0;
        }
        Map<String, String> related = getRelatedParts(sourcePath, relType);
        for (Map.Entry<String, String> entry : related.entrySet()) {
            source.removeRelationship(entry.getKey());
            PackagePart target = findPart(entry.getValue());
            if (target != null) {
                pkg.removePart(target);
            }
        }
        return related.size();
    }

    // ==================== 内部 ====================

    private PackagePart findPart(String path) {
        try {
            return pkg.getPart(partName(path));
        } catch (RedlineException e) {
            return null;
        }
    }

    private static PackagePartName partName(String path) {
        String p = path.startsWith("/") ? path : "/" + path;
        try {
            return PackagingURIHelper.createPartName(p);
        } catch (InvalidFormatException e) {
            throw RedlineException.packageError(path, "非法部件名: " + e.getMessage(), e);
        }
    }

    private static String toPath(PackagePartName name) {
        return trimSlash(name.getName());
    }

    private static String trimSlash(String path) {
        return path.startsWith("/") ? path.substring(1) : path;
    }

    @Override
    public void close() {
        pkg.revert();
    }

    /**
     * 目录路径（如 word/document.xml → word）
     */
    public static String directoryOf(String path) {
        int idx = path.lastIndexOf('/');
        return idx < 0 ? "" : path.substring(0, idx);
    }
}
