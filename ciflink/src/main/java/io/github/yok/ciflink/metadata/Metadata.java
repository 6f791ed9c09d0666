package io.github.yok.ciflink.metadata;

import java.util.Set;

/**
 * Common view of parsed metadata, either a dictionary or a schema.
 *
 * @author Yasuharu.Okawauchi
 */
public interface Metadata {

    /**
     * Returns the names of the categories this metadata declares.
     *
     * @return category names
     */
    Set<String> categoryNames();
}
