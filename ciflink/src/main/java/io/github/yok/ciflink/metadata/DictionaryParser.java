package io.github.yok.ciflink.metadata;

import io.github.yok.ciflink.codec.CifReader;
import io.github.yok.ciflink.codec.CifSyntaxException;
import io.github.yok.ciflink.model.Category;
import io.github.yok.ciflink.model.DataBlock;
import io.github.yok.ciflink.model.DataContainer;
import io.github.yok.ciflink.model.NullValues;
import io.github.yok.ciflink.model.Row;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * Parses a CIF dictionary into {@link DictionaryMetadata}.
 *
 * <p>
 * <strong>Recognized content:</strong>
 * </p>
 * <ul>
 * <li>Category save frames: {@code category.id}, {@code category.description},
 * {@code category.mandatory_code}, {@code category_key.name}.</li>
 * <li>Item save frames: {@code item.name}, {@code item.category_id},
 * {@code item.mandatory_code}, {@code item_type.code}, {@code item_description.description},
 * {@code item_enumeration.value}.</li>
 * <li>General links: {@code item_linked.child_name} / {@code item_linked.parent_name}.</li>
 * <li>Grouped links: the block-level {@code pdbx_item_linked_group_list} loop.</li>
 * <li>Type table: the block-level {@code item_type_list} loop.</li>
 * </ul>
 *
 * <p>
 * An item frame's type, description and enumerations belong to the item the frame is named after.
 * Other items listed in the same frame only inherit the type when no frame of their own sets one.
 * Null tokens are ignored.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DictionaryParser {

    private final CifReader reader = new CifReader();

    /**
     * Parses a dictionary file.
     *
     * @param file dictionary source
     * @return parsed metadata
     * @throws MetadataException if the file cannot be read or is not valid CIF
     */
    public DictionaryMetadata parse(File file) {
        try {
            DictionaryMetadata meta = parse(reader.read(file));
            log.info("Parsed dictionary {}: {} categories, {} links", file.getName(),
                    meta.getCategories().size(), meta.getLinks().size());
            return meta;
        } catch (IOException e) {
            throw new MetadataException("Cannot read dictionary " + file, e);
        } catch (CifSyntaxException e) {
            throw new MetadataException("Invalid dictionary " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Extracts dictionary metadata from already parsed CIF content.
     *
     * @param container parsed dictionary
     * @return metadata
     */
    public DictionaryMetadata parse(DataContainer container) {
        DictionaryMetadata meta = new DictionaryMetadata();
        List<InheritedType> inherited = new ArrayList<>();
        for (DataBlock block : container.getBlocks()) {
            for (DataBlock frame : block.getSaveFrames()) {
                readCategoryFrame(frame, meta);
            }
            for (DataBlock frame : block.getSaveFrames()) {
                readItemFrame(frame, meta, inherited);
                readGeneralLinks(frame, meta);
            }
            readGeneralLinks(block, meta);
            readGroupedLinks(block, meta);
            readTypeList(block, meta);
        }
        for (InheritedType t : inherited) {
            ItemDefinition item = meta.getItem(t.category, t.item);
            if (item != null && item.getTypeCode() == null) {
                item.setTypeCode(t.typeCode);
            }
        }
        return meta;
    }

    private void readCategoryFrame(DataBlock frame, DictionaryMetadata meta) {
        Category category = frame.getCategory("category");
        if (category == null || !category.hasItem("id")) {
            return;
        }
        String id = value(category, 0, "id");
        if (id == null) {
            return;
        }
        CategoryDefinition def = categoryOf(meta, id);
        def.setDescription(value(category, 0, "description"));
        def.setMandatory(isYes(value(category, 0, "mandatory_code")));
        Category keys = frame.getCategory("category_key");
        if (keys != null) {
            for (String keyName : keys.getValues("name")) {
                String[] tag = splitTag(keyName);
                if (tag != null && !def.getKeyItems().contains(tag[1])) {
                    def.getKeyItems().add(tag[1]);
                }
            }
        }
    }

    private void readItemFrame(DataBlock frame, DictionaryMetadata meta,
            List<InheritedType> inherited) {
        Category items = frame.getCategory("item");
        if (items == null) {
            return;
        }
        String[] own = splitTag(frame.getName());
        String typeCode = first(frame, "item_type", "code");
        for (Row row : items.getRows()) {
            String[] tag = splitTag(row.get("name"));
            if (tag == null) {
                continue;
            }
            String categoryId = NullValues.isNull(row.get("category_id")) ? tag[0]
                    : row.get("category_id").toLowerCase(Locale.ROOT);
            ItemDefinition item = itemOf(meta, categoryId, tag[1]);
            if (row.getCategory().hasItem("mandatory_code")) {
                item.setMandatory(isYes(row.get("mandatory_code")));
            }
            boolean isOwn = own != null && own[0].equals(tag[0]) && own[1].equals(tag[1]);
            if (isOwn || items.getRowCount() == 1) {
                if (typeCode != null) {
                    item.setTypeCode(typeCode);
                }
                String description = first(frame, "item_description", "description");
                if (description != null) {
                    item.setDescription(description);
                }
                Category enumeration = frame.getCategory("item_enumeration");
                if (enumeration != null) {
                    for (String v : enumeration.getValues("value")) {
                        if (!NullValues.isNull(v) && !item.getEnumerations().contains(v)) {
                            item.getEnumerations().add(v);
                        }
                    }
                }
            } else if (typeCode != null) {
                inherited.add(new InheritedType(categoryId, tag[1], typeCode));
            }
        }
    }

    private void readGeneralLinks(DataBlock frame, DictionaryMetadata meta) {
        Category linked = frame.getCategory("item_linked");
        if (linked == null) {
            return;
        }
        for (Row row : linked.getRows()) {
            String[] child = splitTag(row.get("child_name"));
            String[] parent = splitTag(row.get("parent_name"));
            if (child == null || parent == null) {
                continue;
            }
            meta.getLinks().add(new LinkDeclaration(child[0], child[1], parent[0], parent[1],
                    LinkSource.GENERAL, null));
        }
    }

    private void readGroupedLinks(DataBlock block, DictionaryMetadata meta) {
        Category group = block.getCategory("pdbx_item_linked_group_list");
        if (group == null) {
            return;
        }
        for (Row row : group.getRows()) {
            String[] child = splitTag(row.get("child_name"));
            String[] parent = splitTag(row.get("parent_name"));
            if (child == null || parent == null) {
                continue;
            }
            String childCategory = NullValues.isNull(row.get("child_category_id")) ? child[0]
                    : row.get("child_category_id").toLowerCase(Locale.ROOT);
            String parentCategory = NullValues.isNull(row.get("parent_category_id")) ? parent[0]
                    : row.get("parent_category_id").toLowerCase(Locale.ROOT);
            String groupId = NullValues.isNull(row.get("link_group_id")) ? null
                    : row.get("link_group_id");
            meta.getLinks().add(new LinkDeclaration(childCategory, child[1], parentCategory,
                    parent[1], LinkSource.GROUPED, groupId));
        }
    }

    private void readTypeList(DataBlock block, DictionaryMetadata meta) {
        Category types = block.getCategory("item_type_list");
        if (types == null) {
            return;
        }
        for (Row row : types.getRows()) {
            String code = row.get("code");
            if (NullValues.isNull(code)) {
                continue;
            }
            meta.getItemTypes().put(code, new ItemTypeDefinition(code,
                    nullToNull(row.get("primitive_code")), nullToNull(row.get("construct"))));
        }
    }

    private static CategoryDefinition categoryOf(DictionaryMetadata meta, String name) {
        String key = name.toLowerCase(Locale.ROOT);
        return meta.getCategories().computeIfAbsent(key, CategoryDefinition::new);
    }

    private static ItemDefinition itemOf(DictionaryMetadata meta, String category, String item) {
        CategoryDefinition def = categoryOf(meta, category);
        return def.getItems().computeIfAbsent(item, n -> {
            ItemDefinition created = new ItemDefinition();
            created.setName(n);
            created.setCategory(def.getName());
            return created;
        });
    }

    private static String first(DataBlock frame, String category, String item) {
        Category c = frame.getCategory(category);
        if (c == null || c.getRowCount() == 0) {
            return null;
        }
        return value(c, 0, item);
    }

    private static String value(Category category, int row, String item) {
        return nullToNull(category.getValue(row, item));
    }

    private static String nullToNull(String v) {
        return NullValues.isNull(v) ? null : v;
    }

    private static boolean isYes(String code) {
        return code != null && code.trim().equalsIgnoreCase("yes");
    }

    /**
     * Splits {@code _category.item} into its two parts. Category names are lower-cased.
     *
     * @param tag tag or frame name
     * @return {@code [category, item]}, or {@code null} if the tag is malformed or null
     */
    static String[] splitTag(String tag) {
        if (NullValues.isNull(tag)) {
            return null;
        }
        String t = tag.trim();
        if (t.startsWith("_")) {
            t = t.substring(1);
        }
        int dot = t.indexOf('.');
        if (dot <= 0 || dot == t.length() - 1) {
            return null;
        }
        return new String[] {t.substring(0, dot).toLowerCase(Locale.ROOT), t.substring(dot + 1)};
    }

    private static final class InheritedType {
        private final String category;
        private final String item;
        private final String typeCode;

        private InheritedType(String category, String item, String typeCode) {
            this.category = category;
            this.item = item;
            this.typeCode = typeCode;
        }
    }
}
