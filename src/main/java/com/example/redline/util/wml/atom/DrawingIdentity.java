package com.example.redline.util.wml.atom;

import com.example.redline.util.common.HashUtils;
import com.example.redline.util.ooxml.OoxmlPackage;
import com.example.redline.util.xml.Namespaces;
import com.example.redline.util.xml.XmlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 图片 / 文本框的稳定身份
 *
 * 1) 含 w:txbxContent：SHA1("TEXTBOX:" + 文本框内容)
 * 2) a:blip/@r:embed 或 v:imagedata/@r:id：通过关系解析到媒体部件，对字节做 SHA1
 * 3) 关系无法解析：对 XML 结构做 SHA1（排除关系 id、pt14、wp14 编辑 id）
 *
 * 同一张图片即使 rId 不同也得到相同的身份。
 */
@Slf4j
public class DrawingIdentity {

    static final String TEXTBOX_PREFIX = "TEXTBOX:";

    private DrawingIdentity() {
    }

    public static String compute(Element drawing, OoxmlPackage pkg, String partPath) {
        List<Element> textboxes = XmlUtils.descendants(drawing, "w:txbxContent");
        if (!textboxes.isEmpty()) {
            return textboxIdentity(textboxes);
        }

        if (pkg != null && partPath != null) {
            Element blip = XmlUtils.firstDescendant(drawing, "a:blip");
            String hash = resolveAndHash(pkg, partPath, XmlUtils.attr(blip, "r:embed"));
            if (hash != null) {
                return hash;
            }
            Element imageData = XmlUtils.firstDescendant(drawing, "v:imagedata");
            String relId = XmlUtils.attr(imageData, "r:id");
            if (relId == null) {
                relId = XmlUtils.attr(imageData, "o:relid");
            }
            hash = resolveAndHash(pkg, partPath, relId);
            if (hash != null) {
                return hash;
            }
        }
        return structureHash(drawing);
    }

    private static String resolveAndHash(OoxmlPackage pkg, String partPath, String relId) {
        if (relId == null || relId.isEmpty()) {
            return null;
        }
        String target = pkg.resolveRelationshipTarget(partPath, relId);
        if (target == null) {
            log.debug("图片关系无法解析，退回结构哈希: {} {}", partPath, relId);
            return null;
        }
        byte[] bytes = pkg.getPart(target);
        if (bytes == null) {
            log.debug("图片部件不存在，退回结构哈希: {}", target);
            return null;
        }
        return HashUtils.sha1(bytes);
    }

    // —— 文本框 —— //

    static String textboxIdentity(List<Element> textboxes) {
        MessageDigest md = HashUtils.sha1Digest();
        update(md, TEXTBOX_PREFIX);
        for (Element txbx : textboxes) {
            hashTextbox(txbx, md);
        }
        return HashUtils.toHex(md.digest());
    }

    private static void hashTextbox(Node node, MessageDigest md) {
        if (node instanceof Element) {
            update(md, XmlUtils.localName(((Element) node).tagName()));
            for (Node child : node.childNodes()) {
                hashTextbox(child, md);
            }
        } else if (node instanceof TextNode) {
            update(md, ((TextNode) node).getWholeText());
        }
    }

    // —— 结构哈希 —— //

    static String structureHash(Element el) {
        MessageDigest md = HashUtils.sha1Digest();
        hashStructure(el, md);
        return HashUtils.toHex(md.digest());
    }

    private static void hashStructure(Node node, MessageDigest md) {
        if (node instanceof TextNode) {
            update(md, ((TextNode) node).getWholeText());
            return;
        }
        if (!(node instanceof Element)) {
            return;
        }
        Element el = (Element) node;
        update(md, XmlUtils.localName(el.tagName()));

        List<Attribute> attrs = new ArrayList<>();
        for (Attribute a : el.attributes()) {
            if (isVolatile(a.getKey())) {
                continue;
            }
            attrs.add(a);
        }
        Collections.sort(attrs, new Comparator<Attribute>() {
            @Override
            public int compare(Attribute a1, Attribute a2) {
                int c = a1.getKey().compareTo(a2.getKey());
                return c != 0 ? c : a1.getValue().compareTo(a2.getValue());
            }
        });
        for (Attribute a : attrs) {
            update(md, XmlUtils.localName(a.getKey()));
            update(md, a.getValue());
        }
        for (Node child : el.childNodes()) {
            hashStructure(child, md);
        }
    }

    /**
     * 每次保存都可能变化的属性：关系 id、pt14 辅助属性、wp14 编辑 id、VML 形状 id
     */
    private static boolean isVolatile(String key) {
        if (key.startsWith("xmlns")) {
            return true;
        }
        String prefix = XmlUtils.prefix(key);
        if (prefix.equals(Namespaces.PT_PREFIX) || prefix.equals("r") || prefix.equals("wp14")) {
            return true;
        }
        return prefix.isEmpty() && (key.equals("ObjectID") || key.equals("ShapeID")
                || key.equals("id") || key.equals("type"));
    }

    private static void update(MessageDigest md, String s) {
        md.update(s.getBytes(StandardCharsets.UTF_8));
    }
}
