package io.github.yok.ciflink.mapping;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Foreign-key map: at most one {@link FkLink} per (child category, child item).
 *
 * <p>
 * Iteration order is sorted by child category, then child item.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class FkMap {

    private final Map<String, FkLink> links = new TreeMap<>();

    void put(FkLink link) {
        links.put(key(link.getChildCategory(), link.getChildItem()), link);
    }

    /**
     * Returns the link of a child item.
     *
     * @param childCategory child category
     * @param childItem child item
     * @return link or {@code null}
     */
    public FkLink get(String childCategory, String childItem) {
        return links.get(key(childCategory, childItem));
    }

    /**
     * Returns the links whose child is the given category, self-links included.
     *
     * @param childCategory child category
     * @return links sorted by child item
     */
    public List<FkLink> linksFrom(String childCategory) {
        List<FkLink> result = new ArrayList<>();
        for (FkLink link : links.values()) {
            if (link.getChildCategory().equals(childCategory)) {
                result.add(link);
            }
        }
        return result;
    }

    /**
     * Returns the links from one category to another.
     *
     * @param childCategory child category
     * @param parentCategory parent category
     * @return links sorted by child item
     */
    public List<FkLink> linksBetween(String childCategory, String parentCategory) {
        List<FkLink> result = new ArrayList<>();
        for (FkLink link : linksFrom(childCategory)) {
            if (link.getParentCategory().equals(parentCategory)) {
                result.add(link);
            }
        }
        return result;
    }

    public List<FkLink> all() {
        return ImmutableList.copyOf(links.values());
    }

    public int size() {
        return links.size();
    }

    public boolean isEmpty() {
        return links.isEmpty();
    }

    // '\u0000' cannot occur in names, so keys sort by category before item
    private static String key(String category, String item) {
        return category + '\u0000' + item;
    }
}
