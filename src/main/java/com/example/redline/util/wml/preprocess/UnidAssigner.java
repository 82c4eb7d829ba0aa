package com.example.redline.util.wml.preprocess;

import com.example.redline.util.xml.Namespaces;
import com.example.redline.util.xml.XmlUtils;
import org.jsoup.nodes.Element;

import java.util.UUID;

/**
 * 为每个元素分配 pt14:Unid（已有的保留）
 */
public class UnidAssigner {

    private UnidAssigner() {
    }

    /**
     * @return 新分配的数量
     */
    public static int assign(Element root) {
        int count = 0;
        for (Element el : root.getAllElements()) {
            if (!el.hasAttr(Namespaces.PT_UNID)) {
                XmlUtils.setAttr(el, Namespaces.PT_UNID, newUnid());
                count++;
            }
        }
        return count;
    }

    public static String newUnid() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
