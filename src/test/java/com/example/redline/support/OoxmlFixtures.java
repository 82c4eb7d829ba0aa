package com.example.redline.support;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * 在内存中组装最小的 docx / xlsx / pptx
 */
public final class OoxmlFixtures {

    public static final String NS_W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    public static final String NS_R = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";
    public static final String NS_S = "http://schemas.openxmlformats.org/spreadsheetml/2006/main";
    public static final String NS_P = "http://schemas.openxmlformats.org/presentationml/2006/main";
    public static final String NS_A = "http://schemas.openxmlformats.org/drawingml/2006/main";
    public static final String NS_WP = "http://schemas.openxmlformats.org/drawingml/2006/wordprocessingDrawing";
    public static final String NS_PIC = "http://schemas.openxmlformats.org/drawingml/2006/picture";
    public static final String NS_V = "urn:schemas-microsoft-com:vml";

    private static final String REL_DOC = "http://schemas.openxmlformats.org/officeDocument/2006/relationships/officeDocument";
    private static final String REL_CORE = "http://schemas.openxmlformats.org/package/2006/relationships/metadata/core-properties";
    private static final String REL_BASE = "http://schemas.openxmlformats.org/officeDocument/2006/relationships/";

    private OoxmlFixtures() {
    }

    // ==================== 通用 ====================

    public static byte[] zip(Map<String, String> parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(out)) {
            for (Map.Entry<String, String> part : parts.entrySet()) {
                zos.putNextEntry(new ZipEntry(part.getKey()));
                zos.write(part.getValue().getBytes(StandardCharsets.UTF_8));
                zos.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    static String contentTypes(Map<String, String> overrides) {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>")
                .append("<Types xmlns=\"http://schemas.openxmlformats.org/package/2006/content-types\">")
                .append("<Default Extension=\"rels\" ContentType=\"application/vnd.openxmlformats-package.relationships+xml\"/>")
                .append("<Default Extension=\"xml\" ContentType=\"application/xml\"/>")
                .append("<Default Extension=\"png\" ContentType=\"image/png\"/>");
        for (Map.Entry<String, String> o : overrides.entrySet()) {
            sb.append("<Override PartName=\"/").append(o.getKey()).append("\" ContentType=\"").append(o.getValue()).append("\"/>");
        }
        return sb.append("</Types>").toString();
    }

    /**
     * @param rels 每项为 {id, 类型后缀或完整类型, 目标}
     */
    static String relationships(List<String[]> rels) {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>")
                .append("<Relationships xmlns=\"http://schemas.openxmlformats.org/package/2006/relationships\">");
        for (String[] rel : rels) {
            String type = rel[1].startsWith("http") ? rel[1] : REL_BASE + rel[1];
            sb.append("<Relationship Id=\"").append(rel[0]).append("\" Type=\"").append(type)
                    .append("\" Target=\"").append(rel[2]).append("\"/>");
        }
        return sb.append("</Relationships>").toString();
    }

    private static List<String[]> rels(String[]... items) {
        List<String[]> list = new ArrayList<>();
        for (String[] item : items) {
            list.add(item);
        }
        return list;
    }

    public static String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }

    // ==================== Word ====================

    /**
     * 每个参数一个段落，单个文字段
     */
    public static byte[] docx(String... paragraphs) {
        StringBuilder body = new StringBuilder();
        for (String text : paragraphs) {
            body.append(paragraph(text));
        }
        return docxBody(body.toString(), null);
    }

    public static String paragraph(String text) {
        return "<w:p>" + run(null, text) + "</w:p>";
    }

    /**
     * @param rPr 运行属性子元素，如 "&lt;w:b/&gt;"；为 null 时不写 w:rPr
     */
    public static String run(String rPr, String text) {
        StringBuilder sb = new StringBuilder("<w:r>");
        if (rPr != null) {
            sb.append("<w:rPr>").append(rPr).append("</w:rPr>");
        }
        return sb.append("<w:t xml:space=\"preserve\">").append(escape(text)).append("</w:t></w:r>").toString();
    }

    public static byte[] docxBody(String bodyXml, String lastModifiedBy) {
        return docxParts(bodyXml, lastModifiedBy, null);
    }

    /**
     * @param footnotesXml w:footnotes 的内容（不含根元素），为 null 时没有脚注部件
     */
    public static byte[] docxParts(String bodyXml, String lastModifiedBy, String footnotesXml) {
        return docxPackage(bodyXml, lastModifiedBy, footnotesXml, new LinkedHashMap<String, String[]>());
    }

    /**
     * 带图片的文档
     *
     * @param images 关系 id → {媒体部件路径（相对 word/）, 部件内容}
     */
    public static byte[] docxWithImages(String bodyXml, Map<String, String[]> images) {
        return docxPackage(bodyXml, null, null, images);
    }

    /**
     * 内联图片运行，r:embed 指向给定关系
     */
    public static String drawing(String relId) {
        return "<w:r><w:drawing><wp:inline><wp:extent cx=\"914400\" cy=\"914400\"/>"
                + "<wp:docPr id=\"1\" name=\"Picture 1\"/><a:graphic><a:graphicData uri=\"" + NS_PIC + "\">"
                + "<pic:pic><pic:nvPicPr><pic:cNvPr id=\"0\" name=\"image.png\"/><pic:cNvPicPr/></pic:nvPicPr>"
                + "<pic:blipFill><a:blip r:embed=\"" + relId + "\"/></pic:blipFill><pic:spPr/></pic:pic>"
                + "</a:graphicData></a:graphic></wp:inline></w:drawing></w:r>";
    }

    /**
     * 内含 VML 文本框的运行，文本框里一个段落
     */
    public static String vmlTextbox(String text) {
        return "<w:r><w:pict><v:shape id=\"box1\" style=\"width:200pt;height:50pt\"><v:textbox><w:txbxContent>"
                + "<w:p>" + run(null, text) + "</w:p></w:txbxContent></v:textbox></v:shape></w:pict></w:r>";
    }

    /**
     * 每行一个数组，每格一个段落
     */
    public static String table(String[]... rows) {
        StringBuilder sb = new StringBuilder("<w:tbl><w:tblPr><w:tblW w:w=\"0\" w:type=\"auto\"/></w:tblPr><w:tblGrid>");
        for (int i = 0; i < rows[0].length; i++) {
            sb.append("<w:gridCol w:w=\"2000\"/>");
        }
        sb.append("</w:tblGrid>");
        for (String[] row : rows) {
            sb.append("<w:tr>");
            for (String cell : row) {
                sb.append("<w:tc><w:tcPr><w:tcW w:w=\"2000\" w:type=\"dxa\"/></w:tcPr>").append(paragraph(cell))
                        .append("</w:tc>");
            }
            sb.append("</w:tr>");
        }
        return sb.append("</w:tbl>").toString();
    }

    private static byte[] docxPackage(String bodyXml, String lastModifiedBy, String footnotesXml,
                                      Map<String, String[]> images) {
        Map<String, String> overrides = new LinkedHashMap<>();
        overrides.put("word/document.xml", "application/vnd.openxmlformats-officedocument.wordprocessingml.document.main+xml");
        List<String[]> packageRels = rels(new String[]{"rId1", REL_DOC, "word/document.xml"});
        if (lastModifiedBy != null) {
            overrides.put("docProps/core.xml", "application/vnd.openxmlformats-package.core-properties+xml");
            packageRels.add(new String[]{"rId2", REL_CORE, "docProps/core.xml"});
        }
        List<String[]> documentRels = new ArrayList<>();
        if (footnotesXml != null) {
            overrides.put("word/footnotes.xml", "application/vnd.openxmlformats-officedocument.wordprocessingml.footnotes+xml");
            documentRels.add(new String[]{"rId1", "footnotes", "footnotes.xml"});
        }
        for (Map.Entry<String, String[]> image : images.entrySet()) {
            documentRels.add(new String[]{image.getKey(), "image", image.getValue()[0]});
        }

        Map<String, String> parts = new LinkedHashMap<>();
        parts.put("[Content_Types].xml", contentTypes(overrides));
        parts.put("_rels/.rels", relationships(packageRels));
        parts.put("word/document.xml", "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
                + "<w:document xmlns:w=\"" + NS_W + "\" xmlns:r=\"" + NS_R + "\" xmlns:wp=\"" + NS_WP
                + "\" xmlns:a=\"" + NS_A + "\" xmlns:pic=\"" + NS_PIC + "\" xmlns:v=\"" + NS_V + "\"><w:body>"
                + bodyXml + "<w:sectPr/></w:body></w:document>");
        if (!documentRels.isEmpty()) {
            parts.put("word/_rels/document.xml.rels", relationships(documentRels));
        }
        for (String[] image : images.values()) {
            parts.put("word/" + image[0], image[1]);
        }
        if (footnotesXml != null) {
            parts.put("word/footnotes.xml", "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
                    + "<w:footnotes xmlns:w=\"" + NS_W + "\" xmlns:r=\"" + NS_R + "\">" + footnotesXml + "</w:footnotes>");
        }
        if (lastModifiedBy != null) {
            parts.put("docProps/core.xml", "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
                    + "<cp:coreProperties xmlns:cp=\"http://schemas.openxmlformats.org/package/2006/metadata/core-properties\""
                    + " xmlns:dc=\"http://purl.org/dc/elements/1.1/\" xmlns:dcterms=\"http://purl.org/dc/terms/\""
                    + " xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\">"
                    + "<dc:creator>creator</dc:creator>"
                    + "<cp:lastModifiedBy>" + escape(lastModifiedBy) + "</cp:lastModifiedBy>"
                    + "<dcterms:modified xsi:type=\"dcterms:W3CDTF\">2024-01-02T03:04:05Z</dcterms:modified>"
                    + "</cp:coreProperties>");
        }
        return zip(parts);
    }

    // ==================== Excel ====================

    public static XlsxBuilder xlsx() {
        return new XlsxBuilder();
    }

    /**
     * 单元格写成 "A1=100"；能解析为数字的写成数值，"=" 开头的值写成公式，其余写成内联字符串
     */
    public static final class XlsxBuilder {

        private final Map<String, String[]> sheets = new LinkedHashMap<>();

        public XlsxBuilder sheet(String name, String... cells) {
            sheets.put(name, cells);
            return this;
        }

        public byte[] build() {
            Map<String, String> overrides = new LinkedHashMap<>();
            overrides.put("xl/workbook.xml", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet.main+xml");
            StringBuilder sheetList = new StringBuilder();
            List<String[]> workbookRels = new ArrayList<>();
            Map<String, String> sheetParts = new LinkedHashMap<>();
            int index = 0;
            for (Map.Entry<String, String[]> sheet : sheets.entrySet()) {
                index++;
                String path = "xl/worksheets/sheet" + index + ".xml";
                overrides.put(path, "application/vnd.openxmlformats-officedocument.spreadsheetml.worksheet+xml");
                workbookRels.add(new String[]{"rId" + index, "worksheet", "worksheets/sheet" + index + ".xml"});
                sheetList.append("<sheet name=\"").append(escape(sheet.getKey())).append("\" sheetId=\"").append(index)
                        .append("\" r:id=\"rId").append(index).append("\"/>");
                sheetParts.put(path, worksheet(sheet.getValue()));
            }

            Map<String, String> parts = new LinkedHashMap<>();
            parts.put("[Content_Types].xml", contentTypes(overrides));
            parts.put("_rels/.rels", relationships(rels(new String[]{"rId1", REL_DOC, "xl/workbook.xml"})));
            parts.put("xl/workbook.xml", "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
                    + "<workbook xmlns=\"" + NS_S + "\" xmlns:r=\"" + NS_R + "\"><sheets>" + sheetList + "</sheets></workbook>");
            parts.put("xl/_rels/workbook.xml.rels", relationships(workbookRels));
            parts.putAll(sheetParts);
            return zip(parts);
        }

        private static String worksheet(String[] cells) {
            Map<Integer, StringBuilder> rows = new java.util.TreeMap<>();
            for (String cell : cells) {
                int eq = cell.indexOf('=');
                String ref = cell.substring(0, eq);
                String value = cell.substring(eq + 1);
                int row = Integer.parseInt(ref.replaceAll("[A-Z]", ""));
                StringBuilder sb = rows.computeIfAbsent(row, k -> new StringBuilder());
                if (value.startsWith("=")) {
                    sb.append("<c r=\"").append(ref).append("\"><f>").append(escape(value.substring(1))).append("</f></c>");
                } else if (value.matches("-?\\d+(\\.\\d+)?")) {
                    sb.append("<c r=\"").append(ref).append("\"><v>").append(value).append("</v></c>");
                } else {
                    sb.append("<c r=\"").append(ref).append("\" t=\"inlineStr\"><is><t>").append(escape(value))
                            .append("</t></is></c>");
                }
            }
            StringBuilder data = new StringBuilder();
            for (Map.Entry<Integer, StringBuilder> row : rows.entrySet()) {
                data.append("<row r=\"").append(row.getKey()).append("\">").append(row.getValue()).append("</row>");
            }
            return "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
                    + "<worksheet xmlns=\"" + NS_S + "\" xmlns:r=\"" + NS_R + "\"><sheetData>" + data
                    + "</sheetData></worksheet>";
        }
    }

    // ==================== PowerPoint ====================

    public static PptxBuilder pptx() {
        return new PptxBuilder();
    }

    /**
     * 标题占位符
     */
    public static String titleShape(int id, String name, String text) {
        return "<p:sp><p:nvSpPr><p:cNvPr id=\"" + id + "\" name=\"" + escape(name) + "\"/><p:cNvSpPr/>"
                + "<p:nvPr><p:ph type=\"title\"/></p:nvPr></p:nvSpPr><p:spPr/>"
                + textBody(text) + "</p:sp>";
    }

    /**
     * 带位置的文本框
     */
    public static String textShape(int id, String name, String text, long x, long y) {
        return "<p:sp><p:nvSpPr><p:cNvPr id=\"" + id + "\" name=\"" + escape(name) + "\"/><p:cNvSpPr txBox=\"1\"/>"
                + "<p:nvPr/></p:nvSpPr><p:spPr><a:xfrm><a:off x=\"" + x + "\" y=\"" + y + "\"/>"
                + "<a:ext cx=\"2000000\" cy=\"500000\"/></a:xfrm><a:prstGeom prst=\"rect\"><a:avLst/></a:prstGeom></p:spPr>"
                + textBody(text) + "</p:sp>";
    }

    private static String textBody(String text) {
        return "<p:txBody><a:bodyPr/><a:lstStyle/><a:p><a:r><a:rPr lang=\"en-US\"/><a:t>" + escape(text)
                + "</a:t></a:r></a:p></p:txBody>";
    }

    public static final class PptxBuilder {

        private final List<String> slides = new ArrayList<>();

        /**
         * @param shapes p:spTree 里的形状 XML
         */
        public PptxBuilder slide(String... shapes) {
            slides.add(String.join("", shapes));
            return this;
        }

        public byte[] build() {
            Map<String, String> overrides = new LinkedHashMap<>();
            overrides.put("ppt/presentation.xml", "application/vnd.openxmlformats-officedocument.presentationml.presentation.main+xml");
            overrides.put("ppt/slideLayouts/slideLayout1.xml", "application/vnd.openxmlformats-officedocument.presentationml.slideLayout+xml");
            overrides.put("ppt/theme/theme1.xml", "application/vnd.openxmlformats-officedocument.theme+xml");

            List<String[]> presentationRels = new ArrayList<>();
            presentationRels.add(new String[]{"rId1", "theme", "theme/theme1.xml"});
            StringBuilder sldIdLst = new StringBuilder();
            Map<String, String> slideParts = new LinkedHashMap<>();
            for (int i = 0; i < slides.size(); i++) {
                int n = i + 1;
                String path = "ppt/slides/slide" + n + ".xml";
                overrides.put(path, "application/vnd.openxmlformats-officedocument.presentationml.slide+xml");
                presentationRels.add(new String[]{"rId" + (n + 1), "slide", "slides/slide" + n + ".xml"});
                sldIdLst.append("<p:sldId id=\"").append(255 + n).append("\" r:id=\"rId").append(n + 1).append("\"/>");
                slideParts.put(path, "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
                        + "<p:sld xmlns:p=\"" + NS_P + "\" xmlns:a=\"" + NS_A + "\" xmlns:r=\"" + NS_R + "\">"
                        + "<p:cSld><p:spTree><p:nvGrpSpPr><p:cNvPr id=\"1\" name=\"\"/><p:cNvGrpSpPr/><p:nvPr/></p:nvGrpSpPr>"
                        + "<p:grpSpPr/>" + slides.get(i) + "</p:spTree></p:cSld></p:sld>");
                slideParts.put("ppt/slides/_rels/slide" + n + ".xml.rels",
                        relationships(rels(new String[]{"rId1", "slideLayout", "../slideLayouts/slideLayout1.xml"})));
            }

            Map<String, String> parts = new LinkedHashMap<>();
            parts.put("[Content_Types].xml", contentTypes(overrides));
            parts.put("_rels/.rels", relationships(rels(new String[]{"rId1", REL_DOC, "ppt/presentation.xml"})));
            parts.put("ppt/presentation.xml", "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
                    + "<p:presentation xmlns:p=\"" + NS_P + "\" xmlns:a=\"" + NS_A + "\" xmlns:r=\"" + NS_R + "\">"
                    + "<p:sldIdLst>" + sldIdLst + "</p:sldIdLst>"
                    + "<p:sldSz cx=\"9144000\" cy=\"6858000\"/><p:notesSz cx=\"6858000\" cy=\"9144000\"/></p:presentation>");
            parts.put("ppt/_rels/presentation.xml.rels", relationships(presentationRels));
            parts.put("ppt/theme/theme1.xml", "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
                    + "<a:theme xmlns:a=\"" + NS_A + "\" name=\"Office Theme\"><a:themeElements/></a:theme>");
            parts.put("ppt/slideLayouts/slideLayout1.xml", "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
                    + "<p:sldLayout xmlns:p=\"" + NS_P + "\" xmlns:a=\"" + NS_A + "\" xmlns:r=\"" + NS_R + "\" type=\"title\">"
                    + "<p:cSld name=\"Title Slide\"><p:spTree><p:nvGrpSpPr><p:cNvPr id=\"1\" name=\"\"/><p:cNvGrpSpPr/><p:nvPr/>"
                    + "</p:nvGrpSpPr><p:grpSpPr/></p:spTree></p:cSld></p:sldLayout>");
            parts.putAll(slideParts);
            return zip(parts);
        }
    }
}
