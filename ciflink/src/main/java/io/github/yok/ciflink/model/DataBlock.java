package io.github.yok.ciflink.model;

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import org.apache.commons.lang3.Validate;

/**
 * A named data block: an ordered set of categories plus optional save frames.
 *
 * <p>
 * Save frames only occur in dictionary sources. Each frame is itself represented as a block.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class DataBlock {

    @Getter
    private final String name;

    private final Map<String, Category> categories = new LinkedHashMap<>();

    private final Map<String, DataBlock> saveFrames = new LinkedHashMap<>();

    /**
     * Creates an empty block.
     *
     * @param name block name
     */
    public DataBlock(String name) {
        Validate.notBlank(name, "block name must not be blank.");
        this.name = name;
    }

    /**
     * Adds a category, replacing none. Category names are unique within a block.
     *
     * @param category category to add
     * @return this block
     */
    public DataBlock addCategory(Category category) {
        Validate.isTrue(!categories.containsKey(category.getName()),
                "Duplicate category '%s' in block '%s'.", category.getName(), name);
        categories.put(category.getName(), category);
        return this;
    }

    /**
     * Returns a category by name; a leading underscore is ignored.
     *
     * @param categoryName name
     * @return category or {@code null}
     */
    public Category getCategory(String categoryName) {
        return categories.get(Category.stripUnderscore(categoryName));
    }

    public boolean hasCategory(String categoryName) {
        return categories.containsKey(Category.stripUnderscore(categoryName));
    }

    public List<String> getCategoryNames() {
        return ImmutableList.copyOf(categories.keySet());
    }

    public Collection<Category> getCategories() {
        return ImmutableList.copyOf(categories.values());
    }

    /**
     * Adds a save frame.
     *
     * @param frame frame represented as a block
     * @return this block
     */
    public DataBlock addSaveFrame(DataBlock frame) {
        saveFrames.put(frame.getName(), frame);
        return this;
    }

    public List<DataBlock> getSaveFrames() {
        return ImmutableList.copyOf(saveFrames.values());
    }

    public DataBlock getSaveFrame(String frameName) {
        return saveFrames.get(frameName);
    }
}
