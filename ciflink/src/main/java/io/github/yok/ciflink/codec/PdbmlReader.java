package io.github.yok.ciflink.codec;

import io.github.yok.ciflink.mapping.CategoryMapping;
import io.github.yok.ciflink.mapping.MappingRules;
import io.github.yok.ciflink.metadata.ItemLocation;
import io.github.yok.ciflink.metadata.XsdSchemaParser;
import io.github.yok.ciflink.model.Category;
import io.github.yok.ciflink.model.DataBlock;
import io.github.yok.ciflink.model.DataContainer;
import io.github.yok.ciflink.model.NullValues;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * Reads a PDBML-style XML document written by {@link PdbmlWriter} back into records.
 *
 * <p>
 * Attributes and child elements of a row element become items; the row element's own text
 * becomes the content item when the mapping declares one. XML names are mapped back to the
 * category's item names. Items missing from a row are restored as {@code ?}. Elements marked
 * {@code xsi:nil="true"} read as {@code ?}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PdbmlReader {

    /** Block name used when the document does not carry one. */
    public static final String DEFAULT_BLOCK_NAME = "XML_DATA";

    /**
     * Parses XML text.
     *
     * @param xml XML text
     * @param rules mapping rules
     * @return container with one block
     * @throws IOException if the text is not well-formed or the root element is unexpected
     */
    public DataContainer read(String xml, MappingRules rules) throws IOException {
        Document doc;
        try {
            doc = XmlSupport.newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
        } catch (SAXException e) {
            throw new IOException("Malformed XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
        Element root = doc.getDocumentElement();
        if (!PdbmlWriter.ROOT_ELEMENT.equals(localName(root))) {
            throw new IOException("Unexpected root element <" + localName(root) + ">, expected <"
                    + PdbmlWriter.ROOT_ELEMENT + ">");
        }
        String blockName = root.getAttribute(PdbmlWriter.BLOCK_NAME_ATTRIBUTE);
        DataBlock block = new DataBlock(blockName.isEmpty() ? DEFAULT_BLOCK_NAME : blockName);

        for (Element container : childElements(root)) {
            String containerName = localName(container);
            if (!containerName.endsWith(PdbmlWriter.CATEGORY_SUFFIX)) {
                log.warn("Skipping unexpected element <{}> in block {}", containerName,
                        block.getName());
                continue;
            }
            CategoryMapping mapping = rules.categoryForContainer(containerName);
            String name = mapping != null ? mapping.getName()
                    : StringUtils.removeEnd(containerName, PdbmlWriter.CATEGORY_SUFFIX);
            List<Map<String, String>> records = new ArrayList<>();
            for (Element row : childElements(container)) {
                records.add(readRow(row, mapping));
            }
            block.addCategory(Category.fromRecords(name, records));
        }
        return new DataContainer().addBlock(block);
    }

    private Map<String, String> readRow(Element row, CategoryMapping mapping) {
        Map<String, String> record = new LinkedHashMap<>();
        if (mapping != null) {
            for (String item : mapping.getItems().keySet()) {
                String xmlName = CategoryMapping.xmlName(item);
                if (mapping.getItem(item).getLocation() == ItemLocation.ATTRIBUTE
                        && row.hasAttribute(xmlName)) {
                    record.put(item, row.getAttribute(xmlName));
                }
            }
        }
        NamedNodeMap attributes = row.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())
                    || XMLConstants.W3C_XML_SCHEMA_INSTANCE_NS_URI.equals(attr.getNamespaceURI())) {
                continue;
            }
            record.putIfAbsent(itemName(mapping, localName(attr)), attr.getValue());
        }
        StringBuilder text = new StringBuilder();
        for (Node n = row.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE) {
                Element child = (Element) n;
                String nil = child.getAttributeNS(XMLConstants.W3C_XML_SCHEMA_INSTANCE_NS_URI,
                        "nil");
                record.put(itemName(mapping, localName(child)),
                        "true".equals(nil) ? NullValues.UNKNOWN : child.getTextContent());
            } else if (n.getNodeType() == Node.TEXT_NODE
                    || n.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(n.getNodeValue());
            }
        }
        String content = text.toString().trim();
        if (!content.isEmpty() && mapping != null
                && mapping.getItem(XsdSchemaParser.CONTENT_ITEM) != null) {
            record.put(XsdSchemaParser.CONTENT_ITEM, content);
        }
        return record;
    }

    private static String itemName(CategoryMapping mapping, String xmlName) {
        return mapping == null ? xmlName : mapping.itemForXmlName(xmlName);
    }

    private static List<Element> childElements(Element parent) {
        List<Element> result = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) n);
            }
        }
        return result;
    }

    private static String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }
}
