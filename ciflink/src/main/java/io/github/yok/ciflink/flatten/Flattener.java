package io.github.yok.ciflink.flatten;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.yok.ciflink.codec.JsonValues;
import io.github.yok.ciflink.mapping.CategoryMapping;
import io.github.yok.ciflink.mapping.FkLink;
import io.github.yok.ciflink.mapping.MappingRules;
import io.github.yok.ciflink.model.Category;
import io.github.yok.ciflink.model.DataBlock;
import io.github.yok.ciflink.model.DataContainer;
import io.github.yok.ciflink.model.NullValues;
import io.github.yok.ciflink.validation.StructuralValidationException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Turns a nested JSON tree back into flat categories.
 *
 * <p>
 * The tree is walked depth-first. Inside a record, object- and array-valued keys naming a mapped
 * category are child records; their foreign-key items are filled from the enclosing record when
 * the child does not carry them. Items missing from some records of a category are filled with
 * {@code ?}.
 * </p>
 *
 * <p>
 * Every structural problem of one pass is reported together in a
 * {@link StructuralValidationException}; no partial result is returned.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class Flattener {

    /**
     * Flattens a nested tree.
     *
     * @param root {@code {block: {category: object | [objects]}}}
     * @param rules mapping rules
     * @return flat records
     * @throws StructuralValidationException if the tree has an unexpected shape
     */
    public DataContainer flatten(JsonNode root, MappingRules rules) {
        Validate.notNull(root, "root must not be null.");
        Validate.notNull(rules, "rules must not be null.");
        List<String> violations = new ArrayList<>();
        if (!root.isObject()) {
            violations.add("Document root must be an object of data blocks");
            throw new StructuralValidationException(violations);
        }
        DataContainer container = new DataContainer();
        Set<String> blockNames = new HashSet<>();
        Iterator<Map.Entry<String, JsonNode>> blocks = root.fields();
        while (blocks.hasNext()) {
            Map.Entry<String, JsonNode> block = blocks.next();
            String blockName = strip(block.getKey());
            if (!blockNames.add(blockName)) {
                violations.add("Duplicate data block '" + blockName + "'");
                continue;
            }
            if (!block.getValue().isObject()) {
                violations.add("Data block '" + blockName + "' must be an object");
                continue;
            }
            Map<String, List<Map<String, String>>> records = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> categories = block.getValue().fields();
            while (categories.hasNext()) {
                Map.Entry<String, JsonNode> e = categories.next();
                String category = strip(e.getKey());
                String path = blockName + "/" + category;
                if (!e.getValue().isContainerNode()) {
                    violations.add("Category '" + path + "' must be an object or a list, got "
                            + e.getValue().getNodeType());
                    continue;
                }
                visitCategory(category, e.getValue(), null, null, rules, records, violations,
                        path);
            }
            if (violations.isEmpty()) {
                container.addBlock(toBlock(blockName, records));
            }
        }
        if (!violations.isEmpty()) {
            throw new StructuralValidationException(violations);
        }
        log.debug("Flattened {} block(s)", container.getBlocks().size());
        return container;
    }

    private void visitCategory(String category, JsonNode value, String parentCategory,
            Map<String, String> parentRow, MappingRules rules,
            Map<String, List<Map<String, String>>> records, List<String> violations,
            String path) {
        records.computeIfAbsent(category, k -> new ArrayList<>());
        if (value.isObject()) {
            visitRecord(category, value, parentCategory, parentRow, rules, records, violations,
                    path);
            return;
        }
        int i = 0;
        for (JsonNode element : value) {
            if (!element.isObject()) {
                violations.add("Record " + path + "[" + i + "] must be an object, got "
                        + element.getNodeType());
            } else {
                visitRecord(category, element, parentCategory, parentRow, rules, records,
                        violations, path + "[" + i + "]");
            }
            i++;
        }
    }

    private void visitRecord(String category, JsonNode record, String parentCategory,
            Map<String, String> parentRow, MappingRules rules,
            Map<String, List<Map<String, String>>> records, List<String> violations,
            String path) {
        CategoryMapping mapping = rules.getCategory(category);
        Map<String, String> row = new LinkedHashMap<>();
        Map<String, JsonNode> children = new LinkedHashMap<>();

        Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            String key = strip(f.getKey());
            JsonNode value = f.getValue();
            boolean isItem = mapping != null && mapping.getItem(key) != null;
            if (value.isContainerNode()) {
                if (rules.hasCategory(key) && !isItem) {
                    children.put(key, value);
                } else {
                    violations.add("Unknown nested key '" + key + "' in " + path);
                }
            } else if (!isItem && rules.hasCategory(key)) {
                violations.add("Category '" + key + "' in " + path
                        + " must be an object or a list, got " + value.getNodeType());
            } else {
                row.put(key, JsonValues.toText(value));
            }
        }

        if (parentCategory != null) {
            for (FkLink link : rules.getFkMap().linksBetween(category, parentCategory)) {
                if (!row.containsKey(link.getChildItem())) {
                    String v = parentRow.get(link.getParentItem());
                    row.put(link.getChildItem(), v == null ? NullValues.UNKNOWN : v);
                }
            }
        }
        records.get(category).add(row);

        for (Map.Entry<String, JsonNode> child : children.entrySet()) {
            visitCategory(child.getKey(), child.getValue(), category, row, rules, records,
                    violations, path + "/" + child.getKey());
        }
    }

    private DataBlock toBlock(String name, Map<String, List<Map<String, String>>> records) {
        DataBlock block = new DataBlock(name);
        for (Map.Entry<String, List<Map<String, String>>> e : records.entrySet()) {
            block.addCategory(Category.fromRecords(e.getKey(), e.getValue()));
        }
        return block;
    }

    private static String strip(String key) {
        return StringUtils.removeStart(key, "_");
    }
}
