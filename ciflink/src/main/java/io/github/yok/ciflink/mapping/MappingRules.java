package io.github.yok.ciflink.mapping;

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Derived, read-only mapping between the flat and hierarchical forms.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class MappingRules {

    // category name -> mapping, sorted by name
    private final Map<String, CategoryMapping> categories;

    private final FkMap fkMap;

    // child category -> relations to other categories, sorted by parent name
    private final Map<String, List<ParentRelation>> relations;

    // links dropped because a category is not part of the mapping
    private final List<String> warnings;

    MappingRules(Map<String, CategoryMapping> categories, FkMap fkMap,
            Map<String, List<ParentRelation>> relations, List<String> warnings) {
        this.categories = Collections.unmodifiableMap(categories);
        this.fkMap = fkMap;
        this.relations = Collections.unmodifiableMap(relations);
        this.warnings = ImmutableList.copyOf(warnings);
    }

    public CategoryMapping getCategory(String name) {
        return categories.get(name);
    }

    public boolean hasCategory(String name) {
        return categories.containsKey(name);
    }

    /**
     * Returns the category written under an XML container element.
     *
     * @param containerElementName element name, e.g. {@code entityCategory}
     * @return mapping, or {@code null} if no category uses that element
     */
    public CategoryMapping categoryForContainer(String containerElementName) {
        for (CategoryMapping mapping : categories.values()) {
            if (mapping.getContainerElementName().equals(containerElementName)) {
                return mapping;
            }
        }
        return null;
    }

    /**
     * Returns the candidate parent relations of a category, self-relations excluded.
     *
     * @param childCategory category name
     * @return relations, possibly empty
     */
    public List<ParentRelation> parentRelations(String childCategory) {
        return relations.getOrDefault(childCategory, Collections.emptyList());
    }

    /**
     * Returns whether an item holds numbers.
     *
     * @param category category name
     * @param item item name
     * @return {@code true} if the item is mapped with a numeric type
     */
    public boolean isNumeric(String category, String item) {
        CategoryMapping mapping = categories.get(category);
        ItemMapping im = mapping == null ? null : mapping.getItem(item);
        return im != null && im.isNumeric();
    }
}
