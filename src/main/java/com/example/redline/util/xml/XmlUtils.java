package com.example.redline.util.xml;

import com.example.redline.exception.RedlineException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.ParseSettings;
import org.jsoup.parser.Parser;
import org.jsoup.parser.Tag;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * XML 工具类（基于 jsoup XML 模式）
 *
 * 元素名一律使用带前缀的限定名（如 w:p），解析时把非规范前缀改写为规范前缀，
 * 因此业务代码可以直接按 "w:p" 这样的名字查找。
 */
public class XmlUtils {

    private XmlUtils() {
    }

    // ==================== 解析与序列化 ====================

    /**
     * 解析 XML 部件
     *
     * @param bytes    部件字节
     * @param partPath 部件路径（用于错误定位）
     * @return jsoup Document（XML 模式）
     */
    public static Document parse(byte[] bytes, String partPath) {
        if (bytes == null) {
            throw RedlineException.missingPart(partPath, "XML部件不存在");
        }
        Document doc;
        try {
            doc = Jsoup.parse(new ByteArrayInputStream(bytes), null, "", Parser.xmlParser());
        } catch (IOException e) {
            throw new RedlineException(RedlineException.ErrorKind.XML_PARSE, partPath, "XML解析失败: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new RedlineException(RedlineException.ErrorKind.XML_PARSE, partPath, "XML解析失败: " + e.getMessage(), e);
        }
        if (rootElement(doc) == null) {
            throw new RedlineException(RedlineException.ErrorKind.XML_PARSE, partPath, "XML没有根元素");
        }
        configureOutput(doc);
        normalizePrefixes(doc);
        return doc;
    }

    /**
     * 从字符串解析（测试、片段构造用）
     */
    public static Document parse(String xml) {
        return parse(xml.getBytes(StandardCharsets.UTF_8), "<inline>");
    }

    /**
     * 序列化为 UTF-8 字节
     */
    public static byte[] serialize(Document doc) {
        configureOutput(doc);
        return doc.outerHtml().getBytes(StandardCharsets.UTF_8);
    }

    private static void configureOutput(Document doc) {
        doc.outputSettings()
                .syntax(Document.OutputSettings.Syntax.xml)
                .escapeMode(Entities.EscapeMode.xhtml)
                .prettyPrint(false)
                .charset(StandardCharsets.UTF_8);
    }

    /**
     * 文档根元素（跳过 XML 声明等非元素节点）
     */
    public static Element rootElement(Document doc) {
        for (Node node : doc.childNodes()) {
            if (node instanceof Element) {
                return (Element) node;
            }
        }
        return null;
    }

    /**
     * 把根元素上声明的非规范前缀改写为规范前缀
     */
    static void normalizePrefixes(Document doc) {
        Element root = rootElement(doc);
        Map<String, String> rename = new HashMap<>();
        for (Attribute attr : root.attributes()) {
            String key = attr.getKey();
            String declared;
            if (key.equals("xmlns")) {
                declared = "";
            } else if (key.startsWith("xmlns:")) {
                declared = key.substring(6);
            } else {
                continue;
            }
            String canonical = Namespaces.canonicalPrefix(attr.getValue());
            if (canonical != null && !canonical.equals(declared)) {
                rename.put(declared, canonical);
            }
        }
        if (rename.isEmpty()) {
            return;
        }
        for (Element el : root.getAllElements()) {
            String name = el.tagName();
            String newName = renamePrefix(name, rename);
            if (!newName.equals(name)) {
                el.tagName(newName);
            }
            List<Attribute> attrs = new ArrayList<>(el.attributes().asList());
            for (Attribute attr : attrs) {
                String key = attr.getKey();
                if (key.indexOf(':') < 0 || key.startsWith("xmlns")) {
                    continue;
                }
                String newKey = renamePrefix(key, rename);
                if (!newKey.equals(key)) {
                    el.removeAttr(key);
                    setAttr(el, newKey, attr.getValue());
                }
            }
        }
        // 改写声明本身
        List<Attribute> decls = new ArrayList<>(root.attributes().asList());
        for (Attribute attr : decls) {
            String key = attr.getKey();
            String declared = key.equals("xmlns") ? "" : key.startsWith("xmlns:") ? key.substring(6) : null;
            if (declared == null || !rename.containsKey(declared)) {
                continue;
            }
            root.removeAttr(key);
            String canonical = rename.get(declared);
            setAttr(root, canonical.isEmpty() ? "xmlns" : "xmlns:" + canonical, attr.getValue());
        }
    }

    private static String renamePrefix(String qname, Map<String, String> rename) {
        int idx = qname.indexOf(':');
        String prefix = idx < 0 ? "" : qname.substring(0, idx);
        String canonical = rename.get(prefix);
        if (canonical == null) {
            return qname;
        }
        String local = idx < 0 ? qname : qname.substring(idx + 1);
        return canonical.isEmpty() ? local : canonical + ":" + local;
    }

    // ==================== 元素构造 ====================

    /**
     * 新建一个保留大小写的元素
     */
    public static Element newElement(String qname) {
        return new Element(Tag.valueOf(qname, ParseSettings.preserveCase), "");
    }

    /**
     * 新建带单个 w:val 之类属性的元素
     */
    public static Element newElement(String qname, String attrName, String attrValue) {
        Element el = newElement(qname);
        setAttr(el, attrName, attrValue);
        return el;
    }

    /**
     * 设置属性（保留大小写；游离元素上的 Element.attr 会按 HTML 规则转小写）
     */
    public static Element setAttr(Element el, String name, String value) {
        el.attributes().put(name, value);
        return el;
    }

    // ==================== 查找 ====================

    public static String localName(String qname) {
        int idx = qname.indexOf(':');
        return idx < 0 ? qname : qname.substring(idx + 1);
    }

    public static String prefix(String qname) {
        int idx = qname.indexOf(':');
        return idx < 0 ? "" : qname.substring(0, idx);
    }

    public static boolean is(Element el, String qname) {
        return el != null && el.tagName().equals(qname);
    }

    /**
     * 第一个指定名字的直接子元素
     */
    public static Element child(Element parent, String qname) {
        if (parent == null) {
            return null;
        }
        for (Element c : parent.children()) {
            if (c.tagName().equals(qname)) {
                return c;
            }
        }
        return null;
    }

    /**
     * 所有指定名字的直接子元素
     */
    public static List<Element> children(Element parent, String qname) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        for (Element c : parent.children()) {
            if (c.tagName().equals(qname)) {
                result.add(c);
            }
        }
        return result;
    }

    /**
     * 所有指定名字的后代元素（不含自身，文档顺序）
     */
    public static List<Element> descendants(Element parent, String qname) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        for (Element e : parent.getAllElements()) {
            if (e != parent && e.tagName().equals(qname)) {
                result.add(e);
            }
        }
        return result;
    }

    public static Element firstDescendant(Element parent, String qname) {
        if (parent == null) {
            return null;
        }
        for (Element e : parent.getAllElements()) {
            if (e != parent && e.tagName().equals(qname)) {
                return e;
            }
        }
        return null;
    }

    /**
     * 沿路径查找子元素，如 path(root, "p:cSld", "p:spTree")
     */
    public static Element path(Element start, String... names) {
        Element current = start;
        for (String name : names) {
            current = child(current, name);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * 最近的指定名字的祖先元素
     */
    public static Element ancestor(Element el, String qname) {
        Element p = el == null ? null : el.parent();
        while (p != null) {
            if (p.tagName().equals(qname)) {
                return p;
            }
            p = p.parent();
        }
        return null;
    }

    /**
     * 属性值，不存在时返回 null
     */
    public static String attr(Element el, String name) {
        if (el == null || !el.hasAttr(name)) {
            return null;
        }
        return el.attr(name);
    }

    /**
     * 子元素的某个属性，如 childAttr(rPr, "w:sz", "w:val")
     */
    public static String childAttr(Element parent, String childName, String attrName) {
        return attr(child(parent, childName), attrName);
    }

    /**
     * 直接文本（不做空白规整）
     */
    public static String ownText(Element el) {
        StringBuilder sb = new StringBuilder();
        for (Node n : el.childNodes()) {
            if (n instanceof TextNode) {
                sb.append(((TextNode) n).getWholeText());
            }
        }
        return sb.toString();
    }

    /**
     * 拼接所有指定名字后代元素的文本，如 collectText(p, "w:t")
     */
    public static String collectText(Element parent, String textElementName) {
        StringBuilder sb = new StringBuilder();
        for (Element e : parent.getAllElements()) {
            if (e.tagName().equals(textElementName)) {
                sb.append(ownText(e));
            }
        }
        return sb.toString();
    }

    /**
     * 设置元素的唯一文本内容
     */
    public static void setText(Element el, String text) {
        el.empty();
        el.appendChild(new TextNode(text));
    }

    // ==================== 修改 ====================

    /**
     * 用子节点替换元素本身（解包）
     */
    public static void unwrap(Element el) {
        el.unwrap();
    }

    /**
     * 改名：新建元素替换原元素，属性和子节点原样搬过去
     */
    public static Element rename(Element el, String newName) {
        Element renamed = newElement(newName);
        for (Attribute a : el.attributes()) {
            setAttr(renamed, a.getKey(), a.getValue());
        }
        for (Node n : new ArrayList<>(el.childNodes())) {
            renamed.appendChild(n);
        }
        el.replaceWith(renamed);
        return renamed;
    }

    /**
     * 删除所有带指定前缀的属性
     */
    public static void removeAttributesWithPrefix(Element root, String prefix) {
        String p = prefix + ":";
        for (Element e : root.getAllElements()) {
            List<String> keys = new ArrayList<>();
            for (Attribute a : e.attributes()) {
                if (a.getKey().startsWith(p) || a.getKey().equals("xmlns:" + prefix)) {
                    keys.add(a.getKey());
                }
            }
            for (String k : keys) {
                e.removeAttr(k);
            }
        }
    }

    /**
     * 确保根元素声明了命名空间
     */
    public static void ensureNamespace(Element root, String prefix, String uri) {
        String key = prefix.isEmpty() ? "xmlns" : "xmlns:" + prefix;
        if (!root.hasAttr(key)) {
            setAttr(root, key, uri);
        }
    }

    /**
     * 把属性移到第一个位置（修订元素要求 w:id 在首位）
     */
    public static void moveAttributeFirst(Element el, String name) {
        if (!el.hasAttr(name)) {
            return;
        }
        List<Attribute> attrs = new ArrayList<>(el.attributes().asList());
        for (Attribute a : attrs) {
            el.removeAttr(a.getKey());
        }
        setAttr(el, name, valueOf(attrs, name));
        for (Attribute a : attrs) {
            if (!a.getKey().equals(name)) {
                setAttr(el, a.getKey(), a.getValue());
            }
        }
    }

    private static String valueOf(List<Attribute> attrs, String name) {
        for (Attribute a : attrs) {
            if (a.getKey().equals(name)) {
                return a.getValue();
            }
        }
        return "";
    }

    // ==================== 规范化字符串 ====================

    /**
     * 元素过滤器：决定规范化序列化时保留哪些属性
     */
    public interface AttributeFilter {
        boolean keep(Element owner, String attrName);
    }

    public static final AttributeFilter KEEP_ALL = new AttributeFilter() {
        @Override
        public boolean keep(Element owner, String attrName) {
            return true;
        }
    };

    /**
     * 不依赖文档输出设置的紧凑序列化，用于计算哈希和签名
     */
    public static String canonicalString(Element el, AttributeFilter filter) {
        StringBuilder sb = new StringBuilder();
        writeCanonical(el, filter, sb);
        return sb.toString();
    }

    private static void writeCanonical(Element el, AttributeFilter filter, StringBuilder sb) {
        sb.append('<').append(el.tagName());
        for (Attribute a : el.attributes()) {
            if (a.getKey().startsWith("xmlns") || !filter.keep(el, a.getKey())) {
                continue;
            }
            sb.append(' ').append(a.getKey()).append("=\"").append(escape(a.getValue())).append('"');
        }
        if (el.childNodeSize() == 0) {
            sb.append("/>");
            return;
        }
        sb.append('>');
        for (Node n : el.childNodes()) {
            if (n instanceof Element) {
                writeCanonical((Element) n, filter, sb);
            } else if (n instanceof TextNode) {
                sb.append(escape(((TextNode) n).getWholeText()));
            }
        }
        sb.append("</").append(el.tagName()).append('>');
    }

    public static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&':
                    sb.append("&amp;");
                    break;
                case '<':
                    sb.append("&lt;");
                    break;
                case '>':
                    sb.append("&gt;");
                    break;
                case '"':
                    sb.append("&quot;");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }
}
