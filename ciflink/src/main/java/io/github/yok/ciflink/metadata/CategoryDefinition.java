package io.github.yok.ciflink.metadata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dictionary definition of one category.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CategoryDefinition {

    private String name;

    private String description;

    private boolean mandatory;

    // key item names (without category prefix), in declaration order
    private List<String> keyItems = new ArrayList<>();

    // item name -> definition
    private Map<String, ItemDefinition> items = new LinkedHashMap<>();

    public CategoryDefinition(String name) {
        this.name = name;
    }
}
