package io.github.yok.ciflink.resolve;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.yok.ciflink.codec.JsonValues;
import io.github.yok.ciflink.config.ConversionMode;
import io.github.yok.ciflink.mapping.MappingRules;
import io.github.yok.ciflink.mapping.ParentRelation;
import io.github.yok.ciflink.model.Category;
import io.github.yok.ciflink.model.DataBlock;
import io.github.yok.ciflink.model.DataContainer;
import io.github.yok.ciflink.model.NullValues;
import io.github.yok.ciflink.model.Row;
import io.github.yok.ciflink.model.RowGroup;
import io.github.yok.ciflink.util.CategoryDependencyResolver;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.EqualsAndHashCode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Nests the flat records of a {@link DataContainer} into a JSON tree.
 *
 * <h2>Parent selection</h2>
 *
 * <p>
 * Each category gets at most one parent category per block, chosen among the relations to other
 * categories that are present with rows and carry every join item. Candidates are ranked by:
 * </p>
 * <ol>
 * <li>number of join items that are key items of the child, descending</li>
 * <li>depth of the parent in the already chosen parent chain, descending</li>
 * <li>number of join items, descending</li>
 * <li>parent name, ascending</li>
 * </ol>
 * <p>
 * Categories are visited parent-first so a parent's depth is known before its children choose.
 * </p>
 *
 * <h2>Record placement</h2>
 *
 * <ul>
 * <li>A record whose join values contain a null token has no parent and stays top-level.</li>
 * <li>A record with complete join values is attached to the first parent record with equal
 * values. Without one it is an orphan: top-level in permissive mode, a violation in strict
 * mode.</li>
 * <li>Several children under a single-valued relation: list in permissive mode, a violation in
 * strict mode.</li>
 * <li>A reference cycle between records is always rejected.</li>
 * </ul>
 *
 * <h2>Output</h2>
 *
 * <p>
 * {@code {block: {category: object | [objects]}}}. Inside a record the items come first, then the
 * nested child categories in block order.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RelationshipResolver {

    private static final Comparator<Candidate> RANKING =
            Comparator.comparingInt((Candidate c) -> c.relation.getKeyOverlap()).reversed()
                    .thenComparing(Comparator.comparingInt((Candidate c) -> c.parentDepth)
                            .reversed())
                    .thenComparing(Comparator
                            .comparingInt((Candidate c) -> c.relation.getChildItems().size())
                            .reversed())
                    .thenComparing(c -> c.relation.getParentCategory());

    /**
     * Nests all blocks of a container.
     *
     * @param container flat records
     * @param rules mapping rules
     * @param mode strict or permissive
     * @return JSON tree keyed by block name
     * @throws RelationshipResolutionException on a record cycle, or in strict mode on orphans and
     *         duplicate single children
     */
    public ObjectNode resolve(DataContainer container, MappingRules rules, ConversionMode mode) {
        Validate.notNull(container, "container must not be null.");
        Validate.notNull(rules, "rules must not be null.");
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        List<String> violations = new ArrayList<>();
        for (DataBlock block : container.getBlocks()) {
            root.set(block.getName(), resolveBlock(block, rules, mode, violations));
        }
        if (!violations.isEmpty()) {
            throw new RelationshipResolutionException(violations);
        }
        return root;
    }

    private ObjectNode resolveBlock(DataBlock block, MappingRules rules, ConversionMode mode,
            List<String> violations) {
        Map<String, ParentRelation> chosen = chooseParents(block, rules);

        // child record -> parent record
        Map<RecordRef, RecordRef> parentOf = new HashMap<>();
        // parent record -> child category -> children
        Map<RecordRef, Map<String, List<Row>>> childrenOf = new HashMap<>();
        for (Map.Entry<String, ParentRelation> e : chosen.entrySet()) {
            attach(block, e.getValue(), mode, parentOf, childrenOf, violations);
        }
        rejectCycles(block, parentOf);

        ObjectNode out = JsonNodeFactory.instance.objectNode();
        for (Category category : block.getCategories()) {
            List<Row> topLevel = new ArrayList<>();
            for (Row row : category.getRows()) {
                if (!parentOf.containsKey(RecordRef.of(row))) {
                    topLevel.add(row);
                }
            }
            if (chosen.containsKey(category.getName()) && topLevel.isEmpty()) {
                continue;
            }
            if (category.getRowCount() == 1 && topLevel.size() == 1) {
                out.set(category.getName(), render(topLevel.get(0), block, rules, chosen,
                        childrenOf));
            } else {
                ArrayNode array = out.putArray(category.getName());
                for (Row row : topLevel) {
                    array.add(render(row, block, rules, chosen, childrenOf));
                }
            }
        }
        log.debug("Nested block {}: {} categories, {} attached records", block.getName(),
                block.getCategoryNames().size(), parentOf.size());
        return out;
    }

    private Map<String, ParentRelation> chooseParents(DataBlock block, MappingRules rules) {
        Map<String, List<ParentRelation>> usable = new LinkedHashMap<>();
        Map<String, List<String>> parentNames = new HashMap<>();
        for (Category child : block.getCategories()) {
            List<ParentRelation> list = new ArrayList<>();
            for (ParentRelation r : rules.parentRelations(child.getName())) {
                Category parent = block.getCategory(r.getParentCategory());
                if (parent == null || parent.getRowCount() == 0 || child.getRowCount() == 0) {
                    continue;
                }
                if (!hasAll(child, r.getChildItems()) || !hasAll(parent, r.getParentItems())) {
                    log.debug("Relation {} -> {} skipped: join items missing", child.getName(),
                            r.getParentCategory());
                    continue;
                }
                list.add(r);
            }
            if (!list.isEmpty()) {
                usable.put(child.getName(), list);
                List<String> names = new ArrayList<>();
                for (ParentRelation r : list) {
                    names.add(r.getParentCategory());
                }
                parentNames.put(child.getName(), names);
            }
        }

        List<String> order =
                CategoryDependencyResolver.resolveOrder(block.getCategoryNames(), parentNames);
        Map<String, Integer> depth = new HashMap<>();
        Map<String, ParentRelation> chosen = new TreeMap<>();
        for (String name : order) {
            List<ParentRelation> candidates = usable.get(name);
            if (candidates == null) {
                depth.put(name, 0);
                continue;
            }
            List<Candidate> ranked = new ArrayList<>();
            for (ParentRelation r : candidates) {
                ranked.add(new Candidate(r, depth.getOrDefault(r.getParentCategory(), 0)));
            }
            ranked.sort(RANKING);
            Candidate best = ranked.get(0);
            chosen.put(name, best.relation);
            depth.put(name, best.parentDepth + 1);
            log.debug("Parent of {} is {} via {} -> {}", name,
                    best.relation.getParentCategory(), best.relation.getChildItems(),
                    best.relation.getParentItems());
        }
        return chosen;
    }

    private void attach(DataBlock block, ParentRelation relation, ConversionMode mode,
            Map<RecordRef, RecordRef> parentOf,
            Map<RecordRef, Map<String, List<Row>>> childrenOf, List<String> violations) {
        Category child = block.getCategory(relation.getChildCategory());
        Category parent = block.getCategory(relation.getParentCategory());

        Map<List<String>, Row> index = new HashMap<>();
        for (Row row : parent.getRows()) {
            index.putIfAbsent(tuple(row, relation.getParentItems()), row);
        }

        for (Row row : child.getRows()) {
            List<String> values = tuple(row, relation.getChildItems());
            if (values.stream().anyMatch(NullValues::isNull)) {
                continue;
            }
            Row parentRow = index.get(values);
            if (parentRow == null) {
                String msg = "Orphan record " + row + ": no " + relation.getParentCategory()
                        + " with " + relation.getParentItems() + " = " + values + " in block "
                        + block.getName();
                if (mode == ConversionMode.STRICT) {
                    violations.add(msg);
                } else {
                    log.warn("{}; kept as top-level record", msg);
                }
                continue;
            }
            RecordRef parentRef = RecordRef.of(parentRow);
            List<Row> siblings = childrenOf.computeIfAbsent(parentRef, k -> new HashMap<>())
                    .computeIfAbsent(child.getName(), k -> new ArrayList<>());
            if (relation.isSingle() && siblings.size() == 1) {
                String msg = "Duplicate " + child.getName() + " records for single-valued parent "
                        + parentRow;
                if (mode == ConversionMode.STRICT) {
                    violations.add(msg);
                } else {
                    log.warn("{}; rendering as a list", msg);
                }
            }
            siblings.add(row);
            parentOf.put(RecordRef.of(row), parentRef);
        }
    }

    private void rejectCycles(DataBlock block, Map<RecordRef, RecordRef> parentOf) {
        Set<RecordRef> acyclic = new HashSet<>();
        List<String> cycles = new ArrayList<>();
        for (RecordRef start : parentOf.keySet()) {
            Set<RecordRef> path = new HashSet<>();
            RecordRef current = start;
            while (current != null && !acyclic.contains(current)) {
                if (!path.add(current)) {
                    cycles.add("Reference cycle through " + current + " in block "
                            + block.getName());
                    break;
                }
                current = parentOf.get(current);
            }
            if (current == null || acyclic.contains(current)) {
                acyclic.addAll(path);
            }
        }
        if (!cycles.isEmpty()) {
            throw new RelationshipResolutionException(cycles);
        }
    }

    private ObjectNode render(Row row, DataBlock block, MappingRules rules,
            Map<String, ParentRelation> chosen, Map<RecordRef, Map<String, List<Row>>> childrenOf) {
        String categoryName = row.getCategory().getName();
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        for (String item : row.getCategory().getItemNames()) {
            node.set(item, JsonValues.toJson(row.get(item), rules.isNumeric(categoryName, item)));
        }
        Map<String, List<Row>> children = childrenOf.get(RecordRef.of(row));
        if (children == null) {
            return node;
        }
        for (String childName : block.getCategoryNames()) {
            List<Row> rows = children.get(childName);
            if (rows == null) {
                continue;
            }
            ParentRelation relation = chosen.get(childName);
            RowGroup group = RowGroup.of(relation.isSingle() && rows.size() == 1, rows);
            if (group.isList()) {
                ArrayNode array = node.putArray(childName);
                for (Row child : group.getRows()) {
                    array.add(render(child, block, rules, chosen, childrenOf));
                }
            } else {
                node.set(childName,
                        render(group.getRows().get(0), block, rules, chosen, childrenOf));
            }
        }
        return node;
    }

    private static boolean hasAll(Category category, List<String> items) {
        for (String item : items) {
            if (!category.hasItem(item)) {
                return false;
            }
        }
        return true;
    }

    private static List<String> tuple(Row row, List<String> items) {
        List<String> values = new ArrayList<>(items.size());
        for (String item : items) {
            values.add(row.get(item));
        }
        return values;
    }

    private static final class Candidate {
        private final ParentRelation relation;
        private final int parentDepth;

        private Candidate(ParentRelation relation, int parentDepth) {
            this.relation = relation;
            this.parentDepth = parentDepth;
        }
    }

    @EqualsAndHashCode
    private static final class RecordRef {
        private final String category;
        private final int index;

        private RecordRef(String category, int index) {
            this.category = category;
            this.index = index;
        }

        static RecordRef of(Row row) {
            return new RecordRef(row.getCategory().getName(), row.getIndex());
        }

        @Override
        public String toString() {
            return category + "#" + index;
        }
    }
}
