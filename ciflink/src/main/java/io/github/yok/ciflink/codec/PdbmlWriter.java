package io.github.yok.ciflink.codec;

import io.github.yok.ciflink.mapping.CategoryMapping;
import io.github.yok.ciflink.mapping.ItemMapping;
import io.github.yok.ciflink.mapping.MappingRules;
import io.github.yok.ciflink.metadata.ItemLocation;
import io.github.yok.ciflink.model.Category;
import io.github.yok.ciflink.model.DataBlock;
import io.github.yok.ciflink.model.NullValues;
import io.github.yok.ciflink.model.Row;
import java.util.ArrayList;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.TransformerException;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Renders a data block as a PDBML-style XML document.
 *
 * <pre>
 * &lt;datablock datablockName="1ABC" xmlns="http://pdbml.pdb.org/schema/pdbx-v50.xsd"&gt;
 *   &lt;entityCategory&gt;
 *     &lt;entity id="1"&gt;
 *       &lt;pdbx_description&gt;...&lt;/pdbx_description&gt;
 *     &lt;/entity&gt;
 *   &lt;/entityCategory&gt;
 * &lt;/datablock&gt;
 * </pre>
 *
 * <p>
 * Items are placed by their {@link ItemLocation}. Child elements follow the mapping's item order;
 * items the mapping does not know are appended as child elements. Null tokens are omitted.
 * Category and item names are written through {@link CategoryMapping#xmlName(String)}, so CIF
 * names such as {@code U[1][1]} appear as {@code U_1__1_}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PdbmlWriter {

    public static final String NAMESPACE = "http://pdbml.pdb.org/schema/pdbx-v50.xsd";

    public static final String ROOT_ELEMENT = "datablock";

    public static final String BLOCK_NAME_ATTRIBUTE = "datablockName";

    public static final String CATEGORY_SUFFIX = "Category";

    /**
     * Renders one block.
     *
     * @param block records
     * @param rules mapping rules
     * @return XML text
     * @throws IllegalStateException if the XML runtime fails
     */
    public String write(DataBlock block, MappingRules rules) {
        Document doc;
        try {
            doc = XmlSupport.newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
        Element root = doc.createElementNS(NAMESPACE, ROOT_ELEMENT);
        root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns", NAMESPACE);
        root.setAttribute(BLOCK_NAME_ATTRIBUTE, block.getName());
        doc.appendChild(root);

        for (Category category : block.getCategories()) {
            CategoryMapping mapping = rules.getCategory(category.getName());
            String containerName = mapping == null
                    ? CategoryMapping.xmlName(category.getName() + CATEGORY_SUFFIX)
                    : mapping.getContainerElementName();
            Element container = doc.createElementNS(NAMESPACE, containerName);
            root.appendChild(container);
            List<String> order = elementOrder(category, mapping);
            for (Row row : category.getRows()) {
                container.appendChild(writeRow(doc, row, mapping, order));
            }
        }
        try {
            String xml = XmlSupport.toString(doc);
            log.debug("Rendered block {} as XML ({} categories)", block.getName(),
                    block.getCategoryNames().size());
            return xml;
        } catch (TransformerException e) {
            throw new IllegalStateException("Cannot serialize XML for block " + block.getName(),
                    e);
        }
    }

    private Element writeRow(Document doc, Row row, CategoryMapping mapping, List<String> order) {
        Category category = row.getCategory();
        Element element = doc.createElementNS(NAMESPACE,
                mapping == null ? CategoryMapping.xmlName(category.getName())
                        : mapping.getElementName());
        for (String item : category.getItemNames()) {
            String value = row.get(item);
            if (NullValues.isNull(value)) {
                continue;
            }
            ItemLocation location = locationOf(mapping, item);
            if (location == ItemLocation.ATTRIBUTE) {
                element.setAttribute(CategoryMapping.xmlName(item), value);
            } else if (location == ItemLocation.ELEMENT_CONTENT) {
                element.appendChild(doc.createTextNode(value));
            }
        }
        for (String item : order) {
            String value = row.get(item);
            if (NullValues.isNull(value)) {
                continue;
            }
            Element child = doc.createElementNS(NAMESPACE, CategoryMapping.xmlName(item));
            child.setTextContent(value);
            element.appendChild(child);
        }
        return element;
    }

    private static List<String> elementOrder(Category category, CategoryMapping mapping) {
        List<String> order = new ArrayList<>();
        if (mapping != null) {
            for (ItemMapping im : mapping.getItems().values()) {
                if (im.getLocation() == ItemLocation.ELEMENT && category.hasItem(im.getName())) {
                    order.add(im.getName());
                }
            }
        }
        for (String item : category.getItemNames()) {
            if (!order.contains(item) && locationOf(mapping, item) == ItemLocation.ELEMENT) {
                order.add(item);
            }
        }
        return order;
    }

    static ItemLocation locationOf(CategoryMapping mapping, String item) {
        ItemMapping im = mapping == null ? null : mapping.getItem(item);
        return im == null ? ItemLocation.ELEMENT : im.getLocation();
    }
}
