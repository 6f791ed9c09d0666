package io.github.yok.ciflink.metadata;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Metadata parsed from a CIF dictionary: categories with their items and keys, declared
 * parent-child links and the item type table.
 *
 * <p>
 * Instances are plain beans so they can be persisted by the on-disk cache.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
public class DictionaryMetadata implements Metadata {

    private Map<String, CategoryDefinition> categories = new LinkedHashMap<>();

    private List<LinkDeclaration> links = new ArrayList<>();

    private Map<String, ItemTypeDefinition> itemTypes = new LinkedHashMap<>();

    @Override
    public Set<String> categoryNames() {
        return categories.keySet();
    }

    /**
     * Returns an item definition.
     *
     * @param category category name
     * @param item item name
     * @return definition or {@code null}
     */
    @JsonIgnore
    public ItemDefinition getItem(String category, String item) {
        CategoryDefinition def = categories.get(category);
        return def == null ? null : def.getItems().get(item);
    }
}
