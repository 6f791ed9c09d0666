package io.github.yok.ciflink.mapping;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * All links from one child category to one parent category, used as a join when nesting.
 *
 * <p>
 * {@code childItems.get(i)} references {@code parentItems.get(i)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public class ParentRelation {

    private final String childCategory;

    private final String parentCategory;

    private final List<String> childItems;

    private final List<String> parentItems;

    private final Multiplicity multiplicity;

    // number of child items that are key items of the child category
    private final int keyOverlap;

    ParentRelation(String childCategory, String parentCategory, List<String> childItems,
            List<String> parentItems, Multiplicity multiplicity, int keyOverlap) {
        this.childCategory = childCategory;
        this.parentCategory = parentCategory;
        this.childItems = ImmutableList.copyOf(childItems);
        this.parentItems = ImmutableList.copyOf(parentItems);
        this.multiplicity = multiplicity;
        this.keyOverlap = keyOverlap;
    }

    public boolean isSingle() {
        return multiplicity == Multiplicity.SINGLE;
    }
}
