package io.github.yok.ciflink.metadata;

import io.github.yok.ciflink.codec.XmlSupport;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Parses an XML schema (XSD) into {@link SchemaMetadata}.
 *
 * <p>
 * Every top-level {@code complexType} named {@code <category>Type} describes one category. Its row
 * element is the nested {@code element} named {@code <category>}; when there is none the type
 * itself is the row definition.
 * </p>
 *
 * <ul>
 * <li>{@code attribute} of the row type: {@link ItemLocation#ATTRIBUTE}</li>
 * <li>{@code element} under {@code sequence}/{@code all}/{@code choice}:
 * {@link ItemLocation#ELEMENT}</li>
 * <li>{@code simpleContent} of the row type: {@link ItemLocation#ELEMENT_CONTENT}, item
 * {@value #CONTENT_ITEM}</li>
 * </ul>
 *
 * <p>
 * The type of a field is its {@code type} attribute, or the {@code base} of an inline
 * {@code restriction} or {@code extension}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class XsdSchemaParser {

    /** Item name used for the text content of a simple-content row element. */
    public static final String CONTENT_ITEM = "value";

    private static final String XS = XMLConstants.W3C_XML_SCHEMA_NS_URI;

    private static final String TYPE_SUFFIX = "Type";

    // document root type; describes the container, not a category
    private static final String ROOT_ELEMENT = "datablock";

    /**
     * Parses a schema file.
     *
     * @param file XSD file
     * @return parsed metadata
     * @throws MetadataException if the file cannot be read or parsed
     */
    public SchemaMetadata parse(File file) {
        Document doc;
        try {
            doc = XmlSupport.newDocumentBuilder().parse(file);
        } catch (IOException | SAXException | ParserConfigurationException e) {
            throw new MetadataException("Cannot parse schema " + file + ": " + e.getMessage(), e);
        }
        SchemaMetadata meta = parse(doc);
        log.info("Parsed schema {}: {} categories", file.getName(), meta.getCategories().size());
        return meta;
    }

    /**
     * Extracts schema metadata from a parsed XSD document.
     *
     * @param doc namespace-aware DOM of the schema
     * @return metadata
     */
    public SchemaMetadata parse(Document doc) {
        SchemaMetadata meta = new SchemaMetadata();
        for (Element type : children(doc.getDocumentElement(), "complexType")) {
            String typeName = type.getAttribute("name");
            if (!typeName.endsWith(TYPE_SUFFIX) || typeName.length() == TYPE_SUFFIX.length()) {
                continue;
            }
            String category = StringUtils.removeEnd(typeName, TYPE_SUFFIX);
            if (ROOT_ELEMENT.equals(category)) {
                continue;
            }
            Element row = findRowType(type, category);
            SchemaCategory sc = new SchemaCategory(category);
            readRowType(row, sc);
            meta.getCategories().put(category, sc);
        }
        return meta;
    }

    private Element findRowType(Element type, String category) {
        NodeList elements = type.getElementsByTagNameNS(XS, "element");
        for (int i = 0; i < elements.getLength(); i++) {
            Element e = (Element) elements.item(i);
            if (category.equals(e.getAttribute("name"))) {
                List<Element> inline = children(e, "complexType");
                if (!inline.isEmpty()) {
                    return inline.get(0);
                }
            }
        }
        return type;
    }

    private void readRowType(Element rowType, SchemaCategory sc) {
        for (Element attr : children(rowType, "attribute")) {
            addAttribute(attr, sc);
        }
        for (Element content : children(rowType, "simpleContent")) {
            for (Element ext : childrenOf(content, "extension", "restriction")) {
                sc.getFields().put(CONTENT_ITEM, new SchemaField(CONTENT_ITEM,
                        ItemLocation.ELEMENT_CONTENT, ext.getAttribute("base"), false));
                for (Element attr : children(ext, "attribute")) {
                    addAttribute(attr, sc);
                }
            }
        }
        for (Element compositor : childrenOf(rowType, "sequence", "all", "choice")) {
            for (Element element : children(compositor, "element")) {
                String name = element.getAttribute("name");
                if (name.isEmpty()) {
                    continue;
                }
                boolean required = !"0".equals(element.getAttribute("minOccurs"));
                sc.getFields().put(name,
                        new SchemaField(name, ItemLocation.ELEMENT, typeOf(element), required));
            }
        }
    }

    private void addAttribute(Element attr, SchemaCategory sc) {
        String name = attr.getAttribute("name");
        if (name.isEmpty()) {
            return;
        }
        boolean required = "required".equals(attr.getAttribute("use"));
        sc.getFields().put(name,
                new SchemaField(name, ItemLocation.ATTRIBUTE, typeOf(attr), required));
    }

    private String typeOf(Element declaration) {
        String type = declaration.getAttribute("type");
        if (!type.isEmpty()) {
            return type;
        }
        for (String tag : new String[] {"restriction", "extension"}) {
            NodeList nested = declaration.getElementsByTagNameNS(XS, tag);
            if (nested.getLength() > 0) {
                String base = ((Element) nested.item(0)).getAttribute("base");
                if (!base.isEmpty()) {
                    return base;
                }
            }
        }
        return "xs:string";
    }

    private static List<Element> children(Element parent, String localName) {
        return childrenOf(parent, localName);
    }

    private static List<Element> childrenOf(Element parent, String... localNames) {
        List<Element> result = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() != Node.ELEMENT_NODE || !XS.equals(n.getNamespaceURI())) {
                continue;
            }
            for (String localName : localNames) {
                if (localName.equals(n.getLocalName())) {
                    result.add((Element) n);
                }
            }
        }
        return result;
    }
}
