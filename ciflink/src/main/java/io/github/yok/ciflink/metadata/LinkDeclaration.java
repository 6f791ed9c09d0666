package io.github.yok.ciflink.metadata;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One declared parent-child link between two items.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LinkDeclaration {

    private String childCategory;

    private String childItem;

    private String parentCategory;

    private String parentItem;

    private LinkSource source;

    // pdbx_item_linked_group_list.link_group_id, null for general links
    private String linkGroupId;
}
