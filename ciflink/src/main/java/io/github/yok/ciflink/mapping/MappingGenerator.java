package io.github.yok.ciflink.mapping;

import io.github.yok.ciflink.metadata.CacheManager;
import io.github.yok.ciflink.metadata.CategoryDefinition;
import io.github.yok.ciflink.metadata.DictionaryMetadata;
import io.github.yok.ciflink.metadata.ItemDefinition;
import io.github.yok.ciflink.metadata.ItemLocation;
import io.github.yok.ciflink.metadata.LinkDeclaration;
import io.github.yok.ciflink.metadata.MetadataCache;
import io.github.yok.ciflink.metadata.MetadataException;
import io.github.yok.ciflink.metadata.SchemaCategory;
import io.github.yok.ciflink.metadata.SchemaField;
import io.github.yok.ciflink.metadata.SchemaMetadata;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * Derives {@link MappingRules} from dictionary and schema metadata.
 *
 * <h2>Categories and items</h2>
 *
 * <p>
 * The mapped categories are the union of dictionary categories and schema-only categories; items
 * are the union of dictionary items and schema fields. Both are sorted by name.
 * </p>
 *
 * <h2>Item location</h2>
 *
 * <ul>
 * <li>A location declared by the schema is used as is.</li>
 * <li>Otherwise key items are attributes, {@code text}-typed items are child elements, and all
 * other items are attributes.</li>
 * </ul>
 *
 * <h2>Foreign-key map</h2>
 *
 * <p>
 * At most one link is kept per child item. A grouped declaration beats a general one; among
 * declarations of equal specificity the smallest (parent category, parent item) wins, so the
 * result does not depend on declaration order. Links to or from unmapped categories are dropped
 * and reported as warnings.
 * </p>
 *
 * <h2>Relations</h2>
 *
 * <p>
 * The links from one child category to one other category form a {@link ParentRelation}. It is
 * {@link Multiplicity#SINGLE} when the linked child items cover the child's whole key.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MappingGenerator {

    private static final Comparator<LinkDeclaration> LEXICAL =
            Comparator.comparing(LinkDeclaration::getParentCategory)
                    .thenComparing(LinkDeclaration::getParentItem);

    private final MetadataCache metadataCache;

    public MappingGenerator(MetadataCache metadataCache) {
        this.metadataCache = metadataCache;
    }

    /**
     * Returns the mapping for a dictionary and schema pair, memoised per source versions.
     *
     * @param dictionary dictionary file, or {@code null}
     * @param schema XSD file, or {@code null}
     * @return mapping rules
     */
    public MappingRules getMappingRules(Path dictionary, Path schema) {
        CacheManager cache = metadataCache.getCacheManager();
        String key = "mapping_" + DigestUtils.sha256Hex(sourceKey("dictionary", dictionary)
                + "|" + sourceKey("schema", schema));
        return cache.getInMemory(key, MappingRules.class, () -> {
            DictionaryMetadata dict = dictionary == null ? new DictionaryMetadata()
                    : metadataCache.loadDictionary(dictionary);
            SchemaMetadata xsd =
                    schema == null ? new SchemaMetadata() : metadataCache.loadSchema(schema);
            return generate(dict, xsd);
        });
    }

    private static String sourceKey(String kind, Path source) {
        if (source == null || !Files.isRegularFile(source)) {
            return kind + "_none";
        }
        try {
            return CacheManager.keyOf(kind, source);
        } catch (IOException e) {
            throw new MetadataException("Cannot stat metadata source " + source, e);
        }
    }

    /**
     * Generates mapping rules.
     *
     * @param dictionary dictionary metadata
     * @param schema schema metadata
     * @return mapping rules
     */
    public MappingRules generate(DictionaryMetadata dictionary, SchemaMetadata schema) {
        TreeSet<String> names = new TreeSet<>(dictionary.getCategories().keySet());
        names.addAll(schema.getCategories().keySet());

        Map<String, CategoryMapping> categories = new TreeMap<>();
        for (String name : names) {
            categories.put(name, mapCategory(name, dictionary.getCategories().get(name),
                    schema.getCategories().get(name)));
        }

        List<String> warnings = new ArrayList<>();
        FkMap fkMap = buildFkMap(dictionary.getLinks(), categories, warnings);
        Map<String, List<ParentRelation>> relations = buildRelations(fkMap, categories);

        log.info("Generated mapping rules: {} categories, {} FK links, {} relations",
                categories.size(), fkMap.size(),
                relations.values().stream().mapToInt(List::size).sum());
        for (String w : warnings) {
            log.warn(w);
        }
        return new MappingRules(categories, fkMap, relations, warnings);
    }

    private CategoryMapping mapCategory(String name, CategoryDefinition def, SchemaCategory sc) {
        List<String> keys = def == null ? new ArrayList<>() : new ArrayList<>(def.getKeyItems());
        TreeSet<String> itemNames = new TreeSet<>();
        if (def != null) {
            itemNames.addAll(def.getItems().keySet());
            itemNames.addAll(keys);
        }
        if (sc != null) {
            itemNames.addAll(sc.getFields().keySet());
        }
        Map<String, ItemMapping> items = new LinkedHashMap<>();
        for (String item : itemNames) {
            ItemDefinition id = def == null ? null : def.getItems().get(item);
            SchemaField field = sc == null ? null : sc.getFields().get(item);
            String typeCode = id != null && id.getTypeCode() != null ? id.getTypeCode()
                    : field != null ? field.getType() : null;
            ItemLocation location;
            if (field != null) {
                location = field.getLocation();
            } else if (keys.contains(item)) {
                location = ItemLocation.ATTRIBUTE;
            } else if ("text".equalsIgnoreCase(typeCode)) {
                location = ItemLocation.ELEMENT;
            } else {
                location = ItemLocation.ATTRIBUTE;
            }
            boolean numeric = NumericTypes.isNumeric(typeCode)
                    || (field != null && NumericTypes.isNumeric(field.getType()));
            List<String> enumerations =
                    id == null ? Collections.emptyList() : new ArrayList<>(id.getEnumerations());
            boolean mandatory = (id != null && id.isMandatory())
                    || (field != null && field.isRequired());
            items.put(item,
                    new ItemMapping(item, location, typeCode, numeric, enumerations, mandatory));
        }
        return new CategoryMapping(name, keys, items, def != null);
    }

    private FkMap buildFkMap(List<LinkDeclaration> declarations,
            Map<String, CategoryMapping> categories, List<String> warnings) {
        Map<String, LinkDeclaration> chosen = new HashMap<>();
        for (LinkDeclaration decl : declarations) {
            if (!categories.containsKey(decl.getChildCategory())
                    || !categories.containsKey(decl.getParentCategory())) {
                warnings.add("Dropped link _" + decl.getChildCategory() + "."
                        + decl.getChildItem() + " -> _" + decl.getParentCategory() + "."
                        + decl.getParentItem() + ": category not mapped");
                continue;
            }
            String key = decl.getChildCategory() + "." + decl.getChildItem();
            LinkDeclaration current = chosen.get(key);
            if (current == null || precedes(decl, current)) {
                chosen.put(key, decl);
            }
        }
        FkMap fkMap = new FkMap();
        for (LinkDeclaration decl : chosen.values()) {
            fkMap.put(new FkLink(decl.getChildCategory(), decl.getChildItem(),
                    decl.getParentCategory(), decl.getParentItem(), decl.getSource()));
        }
        return fkMap;
    }

    private static boolean precedes(LinkDeclaration candidate, LinkDeclaration current) {
        if (candidate.getSource() != current.getSource()) {
            return candidate.getSource().isMoreSpecificThan(current.getSource());
        }
        return LEXICAL.compare(candidate, current) < 0;
    }

    private Map<String, List<ParentRelation>> buildRelations(FkMap fkMap,
            Map<String, CategoryMapping> categories) {
        Map<String, Map<String, List<FkLink>>> grouped = new TreeMap<>();
        for (FkLink link : fkMap.all()) {
            if (link.isSelfLink()) {
                continue;
            }
            grouped.computeIfAbsent(link.getChildCategory(), k -> new TreeMap<>())
                    .computeIfAbsent(link.getParentCategory(), k -> new ArrayList<>()).add(link);
        }
        Map<String, List<ParentRelation>> relations = new TreeMap<>();
        for (Map.Entry<String, Map<String, List<FkLink>>> child : grouped.entrySet()) {
            CategoryMapping childMapping = categories.get(child.getKey());
            List<ParentRelation> list = new ArrayList<>();
            for (Map.Entry<String, List<FkLink>> parent : child.getValue().entrySet()) {
                List<String> childItems = new ArrayList<>();
                List<String> parentItems = new ArrayList<>();
                int overlap = 0;
                for (FkLink link : parent.getValue()) {
                    childItems.add(link.getChildItem());
                    parentItems.add(link.getParentItem());
                    if (childMapping.isKey(link.getChildItem())) {
                        overlap++;
                    }
                }
                List<String> keys = childMapping.getKeyItems();
                Multiplicity multiplicity = !keys.isEmpty() && childItems.containsAll(keys)
                        ? Multiplicity.SINGLE
                        : Multiplicity.MULTIPLE;
                list.add(new ParentRelation(child.getKey(), parent.getKey(), childItems,
                        parentItems, multiplicity, overlap));
            }
            relations.put(child.getKey(), list);
        }
        return relations;
    }
}
