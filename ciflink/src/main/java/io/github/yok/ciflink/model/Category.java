package io.github.yok.ciflink.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import org.apache.commons.lang3.Validate;

/**
 * A named table of items, stored column-wise.
 *
 * <p>
 * Every item column holds exactly {@link #getRowCount()} values. The invariant is checked on each
 * mutation; a mutation that would break it is rejected with {@link IllegalArgumentException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class Category {

    @Getter
    private final String name;

    // item name -> column values, in declaration order
    private final Map<String, List<String>> columns = new LinkedHashMap<>();

    @Getter
    private int rowCount;

    /**
     * Creates an empty category.
     *
     * @param name category name without leading underscore
     */
    public Category(String name) {
        Validate.notBlank(name, "category name must not be blank.");
        this.name = stripUnderscore(name);
    }

    /**
     * Adds an item column. The column length must equal the current row count, unless the category
     * has no items yet, in which case the column defines the row count.
     *
     * @param item item name
     * @param values column values
     * @return this category
     */
    public Category addItem(String item, List<String> values) {
        Validate.notBlank(item, "item name must not be blank.");
        Preconditions.checkNotNull(values, "values");
        Validate.isTrue(!columns.containsKey(item), "Duplicate item '%s' in category '%s'.", item,
                name);
        if (columns.isEmpty()) {
            rowCount = values.size();
        } else {
            Validate.isTrue(values.size() == rowCount,
                    "Item '%s' has %s values but category '%s' has %s rows.", item,
                    values.size(), name, rowCount);
        }
        columns.put(item, new ArrayList<>(values));
        return this;
    }

    /**
     * Appends one row. Every item of the category must be present in the row and the row must not
     * carry unknown items. On an empty category the row defines the items.
     *
     * @param row item name to value
     * @return this category
     */
    public Category addRow(Map<String, String> row) {
        Preconditions.checkNotNull(row, "row");
        if (columns.isEmpty()) {
            for (String item : row.keySet()) {
                Validate.notBlank(item, "item name must not be blank.");
                columns.put(item, new ArrayList<>());
            }
        } else {
            Validate.isTrue(row.keySet().equals(columns.keySet()),
                    "Row items %s do not match items %s of category '%s'.", row.keySet(),
                    columns.keySet(), name);
        }
        for (Map.Entry<String, List<String>> e : columns.entrySet()) {
            e.getValue().add(row.get(e.getKey()));
        }
        rowCount++;
        return this;
    }

    /**
     * Returns the item names in declaration order.
     *
     * @return immutable item list
     */
    public List<String> getItemNames() {
        return ImmutableList.copyOf(columns.keySet());
    }

    /**
     * Returns whether the category has the given item.
     *
     * @param item item name
     * @return {@code true} if present
     */
    public boolean hasItem(String item) {
        return columns.containsKey(item);
    }

    /**
     * Returns the values of one item.
     *
     * @param item item name
     * @return unmodifiable column, or an empty list if the item is absent
     */
    public List<String> getValues(String item) {
        List<String> column = columns.get(item);
        return column == null ? Collections.emptyList() : Collections.unmodifiableList(column);
    }

    /**
     * Returns a value by row index and item name.
     *
     * @param index row index
     * @param item item name
     * @return value, or {@code null} if the item is absent
     */
    public String getValue(int index, String item) {
        Preconditions.checkElementIndex(index, rowCount);
        List<String> column = columns.get(item);
        return column == null ? null : column.get(index);
    }

    /**
     * Returns a row view.
     *
     * @param index row index
     * @return row view backed by this category
     */
    public Row getRow(int index) {
        Preconditions.checkElementIndex(index, rowCount);
        return new Row(this, index);
    }

    /**
     * Returns all rows as views.
     *
     * @return row views in order
     */
    public List<Row> getRows() {
        List<Row> rows = new ArrayList<>(rowCount);
        for (int i = 0; i < rowCount; i++) {
            rows.add(new Row(this, i));
        }
        return rows;
    }

    /**
     * Builds a category from records that may carry different items. Items are taken in
     * first-seen order and values missing from a record are filled with {@code ?}.
     *
     * @param name category name
     * @param records item name to value, one map per row
     * @return category with {@code records.size()} rows
     */
    public static Category fromRecords(String name, List<Map<String, String>> records) {
        Set<String> items = new LinkedHashSet<>();
        for (Map<String, String> record : records) {
            items.addAll(record.keySet());
        }
        Category category = new Category(name);
        for (String item : items) {
            List<String> column = new ArrayList<>(records.size());
            for (Map<String, String> record : records) {
                column.add(record.getOrDefault(item, NullValues.UNKNOWN));
            }
            category.addItem(item, column);
        }
        if (items.isEmpty()) {
            category.rowCount = records.size();
        }
        return category;
    }

    static String stripUnderscore(String name) {
        return name.startsWith("_") ? name.substring(1) : name;
    }

    @Override
    public String toString() {
        return "Category[" + name + ", items=" + columns.keySet() + ", rows=" + rowCount + "]";
    }
}
