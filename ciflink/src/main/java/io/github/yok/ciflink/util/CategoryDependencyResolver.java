package io.github.yok.ciflink.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Resolves a deterministic parent-first order of categories.
 *
 * <h2>Algorithm</h2>
 *
 * <p>
 * Builds a directed graph with an edge {@code parent -> child} for every dependency and applies
 * Kahn's topological sort. When several categories are eligible at the same time they are taken
 * in alphabetical order.
 * </p>
 *
 * <h2>Rules / limitations</h2>
 *
 * <ul>
 * <li>Dependencies on categories outside the given list are ignored.</li>
 * <li>Self-dependencies are ignored.</li>
 * <li>If a cycle exists, the acyclic portion is sorted first, then the cyclic categories are
 * appended in alphabetical order.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class CategoryDependencyResolver {

    /**
     * Prevents instantiation.
     */
    private CategoryDependencyResolver() {
        throw new AssertionError("CategoryDependencyResolver must not be instantiated.");
    }

    /**
     * Resolves a parent-first order.
     *
     * @param categories category names to order; duplicates are ignored
     * @param parents child category -> its parent categories
     * @return category names, parents before children, deterministic
     * @throws IllegalArgumentException if {@code categories} contains blank names
     */
    public static List<String> resolveOrder(Collection<String> categories,
            Map<String, ? extends Collection<String>> parents) {
        if (categories == null || categories.isEmpty()) {
            return new ArrayList<>();
        }
        for (String c : categories) {
            Validate.notBlank(c, "categories must not contain null/blank names.");
        }
        Set<String> nodes = new LinkedHashSet<>(categories);

        Map<String, Set<String>> edges = new LinkedHashMap<>();
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String c : nodes) {
            edges.put(c, new HashSet<>());
            inDegree.put(c, 0);
        }
        for (String child : nodes) {
            Collection<String> ps = parents.get(child);
            if (ps == null) {
                continue;
            }
            for (String parent : ps) {
                if (!nodes.contains(parent) || parent.equals(child)) {
                    continue;
                }
                if (edges.get(parent).add(child)) {
                    inDegree.merge(child, 1, Integer::sum);
                }
            }
        }

        PriorityQueue<String> queue = new PriorityQueue<>();
        for (String c : nodes) {
            if (inDegree.get(c) == 0) {
                queue.offer(c);
            }
        }
        List<String> sorted = new ArrayList<>(nodes.size());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            sorted.add(current);
            for (String child : edges.get(current)) {
                if (inDegree.merge(child, -1, Integer::sum) == 0) {
                    queue.offer(child);
                }
            }
        }

        if (sorted.size() < nodes.size()) {
            Set<String> sortedSet = new HashSet<>(sorted);
            List<String> cyclic = nodes.stream().filter(c -> !sortedSet.contains(c)).sorted()
                    .collect(Collectors.toList());
            log.warn("Circular category dependency detected for categories: {}. "
                    + "These categories will be appended in alphabetical order.", cyclic);
            sorted.addAll(cyclic);
        }
        log.debug("Resolved category order (parent-first): {}", sorted);
        return sorted;
    }
}
