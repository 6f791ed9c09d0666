package io.github.yok.ciflink.mapping;

import io.github.yok.ciflink.metadata.LinkSource;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A resolved foreign-key link from a child item to the parent item it references.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor
public class FkLink {

    private final String childCategory;

    private final String childItem;

    private final String parentCategory;

    private final String parentItem;

    private final LinkSource source;

    public boolean isSelfLink() {
        return childCategory.equals(parentCategory);
    }

    @Override
    public String toString() {
        return "_" + childCategory + "." + childItem + " -> _" + parentCategory + "."
                + parentItem + " (" + source + ")";
    }
}
