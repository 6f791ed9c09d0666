package io.github.yok.ciflink.model;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Read-only view of one row of a {@link Category}.
 *
 * @author Yasuharu.Okawauchi
 */
public class Row {

    @Getter
    private final Category category;

    @Getter
    private final int index;

    Row(Category category, int index) {
        this.category = category;
        this.index = index;
    }

    /**
     * Returns the value of an item in this row.
     *
     * @param item item name
     * @return value, or {@code null} if the category has no such item
     */
    public String get(String item) {
        return category.getValue(index, item);
    }

    /**
     * Returns an ordered copy of this row.
     *
     * @return item name to value
     */
    public Map<String, String> toMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (String item : category.getItemNames()) {
            map.put(item, get(item));
        }
        return map;
    }

    @Override
    public String toString() {
        return category.getName() + "#" + index + toMap();
    }
}
