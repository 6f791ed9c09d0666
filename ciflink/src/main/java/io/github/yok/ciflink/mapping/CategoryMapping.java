package io.github.yok.ciflink.mapping;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

/**
 * Mapping of one category: element names, key items and item mappings sorted by name.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public class CategoryMapping {

    private static final Pattern INVALID_XML_NAME_CHARS = Pattern.compile("[^A-Za-z0-9_.\\-]");

    private static final Pattern XML_NAME_START = Pattern.compile("^[A-Za-z_]");

    private final String name;

    // row element, e.g. "entity"
    private final String elementName;

    // container element, e.g. "entityCategory"
    private final String containerElementName;

    private final List<String> keyItems;

    private final GroupingStrategy grouping;

    private final Map<String, ItemMapping> items;

    // whether the dictionary defines this category (schema-only otherwise)
    private final boolean defined;

    // XML name -> item name
    @Getter(AccessLevel.NONE)
    @ToString.Exclude
    private final Map<String, String> itemsByXmlName = new HashMap<>();

    CategoryMapping(String name, List<String> keyItems, Map<String, ItemMapping> items,
            boolean defined) {
        this.name = name;
        this.elementName = xmlName(name);
        this.containerElementName = xmlName(name + "Category");
        this.keyItems = Collections.unmodifiableList(keyItems);
        this.grouping =
                keyItems.size() > 1 ? GroupingStrategy.COMPOSITE_KEY : GroupingStrategy.SINGLE_KEY;
        this.items = Collections.unmodifiableMap(items);
        this.defined = defined;
        for (String item : items.keySet()) {
            itemsByXmlName.putIfAbsent(xmlName(item), item);
        }
    }

    /**
     * Converts a CIF name to a valid XML name. Characters outside letters, digits, {@code _},
     * {@code -} and {@code .} become {@code _}; a name that does not start with a letter or
     * {@code _} is prefixed with {@code x_}.
     *
     * <p>
     * Example: {@code U[1][1]} becomes {@code U_1__1_}.
     * </p>
     *
     * @param name CIF category or item name
     * @return XML element or attribute name
     */
    public static String xmlName(String name) {
        String safe = INVALID_XML_NAME_CHARS.matcher(name).replaceAll("_");
        if (!XML_NAME_START.matcher(safe).find()) {
            safe = "x_" + safe;
        }
        return safe;
    }

    /**
     * Returns the item written under an XML name.
     *
     * @param xmlName attribute or element name
     * @return item name, or {@code xmlName} itself if no item of this category maps to it
     */
    public String itemForXmlName(String xmlName) {
        return itemsByXmlName.getOrDefault(xmlName, xmlName);
    }

    public ItemMapping getItem(String item) {
        return items.get(item);
    }

    public boolean isKey(String item) {
        return keyItems.contains(item);
    }
}
