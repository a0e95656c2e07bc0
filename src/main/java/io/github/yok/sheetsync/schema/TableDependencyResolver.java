package io.github.yok.sheetsync.schema;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Resolves a deterministic table sync order based on the foreign keys declared in the schemas.
 *
 * <h2>Purpose</h2>
 *
 * <p>
 * Referenced tables must be fully loaded before the tables that reference them, because the
 * foreign-key check of a table reads the keys already present in the store. This class returns a
 * parent-first ordering of the given schemas.
 * </p>
 *
 * <h2>Algorithm</h2>
 *
 * <p>
 * This class builds a directed graph where an edge {@code parent -> child} exists if {@code child}
 * declares a foreign key referencing {@code parent}. It then applies Kahn's topological sort.
 * </p>
 *
 * <h2>Determinism</h2>
 *
 * <p>
 * When multiple tables are eligible at the same time, they are processed in the order they were
 * given (declaration order), so operators control the order of independent tables.
 * </p>
 *
 * <h2>Rules / limitations</h2>
 *
 * <ul>
 * <li>Foreign keys referencing tables outside the provided list are ignored.</li>
 * <li>Self-referencing foreign keys are ignored.</li>
 * <li>Several foreign keys from the same child to the same parent are treated as one edge.</li>
 * <li>If the input contains duplicate table names case-insensitively, the first occurrence is used
 * and later duplicates are ignored.</li>
 * <li>If a cycle exists among the provided tables, the acyclic portion is sorted first, then the
 * cyclic tables are appended in declaration order.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class TableDependencyResolver {

    /**
     * Prevents instantiation.
     */
    private TableDependencyResolver() {
        throw new AssertionError("TableDependencyResolver must not be instantiated.");
    }

    /**
     * Resolves a parent-first sync order for the given schemas.
     *
     * @param tables schemas to order; may be {@code null} or empty (returns empty list)
     * @return schemas in sync order (parent-first), deterministic
     * @throws IllegalArgumentException if {@code tables} contains {@code null}
     */
    public static List<TableSchema> resolveLoadOrder(List<TableSchema> tables) {
        if (tables == null || tables.isEmpty()) {
            return new ArrayList<>();
        }
        Validate.noNullElements(tables, "tables must not contain null schemas.");

        // Step 1: case-insensitive normalization (first occurrence wins), remembering positions.
        Map<String, TableSchema> normalizedMap = new LinkedHashMap<>();
        for (TableSchema t : tables) {
            String lower = t.getName().toLowerCase(Locale.ROOT);
            if (normalizedMap.containsKey(lower)) {
                log.warn("Duplicate table name detected (case-insensitive): '{}' and '{}'. "
                        + "Using the first occurrence.", normalizedMap.get(lower).getName(),
                        t.getName());
                continue;
            }
            normalizedMap.put(lower, t);
        }
        Map<String, Integer> position = new HashMap<>();
        int index = 0;
        for (String lower : normalizedMap.keySet()) {
            position.put(lower, index++);
        }

        // Step 2: collect FK edges (parent -> child).
        Map<String, Set<String>> edges = new HashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        for (String lower : normalizedMap.keySet()) {
            edges.put(lower, new LinkedHashSet<>());
            inDegree.put(lower, 0);
        }
        for (Map.Entry<String, TableSchema> entry : normalizedMap.entrySet()) {
            String childLower = entry.getKey();
            for (ForeignKey fk : entry.getValue().getForeignKeys().values()) {
                String parentLower = fk.getReferencedTable().toLowerCase(Locale.ROOT);
                if (!normalizedMap.containsKey(parentLower) || parentLower.equals(childLower)) {
                    continue;
                }
                if (edges.get(parentLower).add(childLower)) {
                    inDegree.merge(childLower, 1, Integer::sum);
                    log.debug("FK dependency detected: parent='{}' -> child='{}'",
                            normalizedMap.get(parentLower).getName(),
                            entry.getValue().getName());
                }
            }
        }

        // Step 3: Kahn's topological sort with declaration-order tie-break.
        PriorityQueue<String> queue =
                new PriorityQueue<>(Comparator.comparingInt(position::get));
        for (String lower : normalizedMap.keySet()) {
            if (inDegree.get(lower) == 0) {
                queue.offer(lower);
            }
        }
        List<String> sorted = new ArrayList<>(normalizedMap.size());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            sorted.add(current);
            for (String child : edges.get(current)) {
                int newDegree = inDegree.merge(child, -1, Integer::sum);
                if (newDegree == 0) {
                    queue.offer(child);
                }
            }
        }

        // Step 4: handle cycles (append remaining tables in declaration order).
        if (sorted.size() < normalizedMap.size()) {
            Set<String> sortedSet = new LinkedHashSet<>(sorted);
            List<String> cyclic = normalizedMap.keySet().stream()
                    .filter(lower -> !sortedSet.contains(lower)).collect(Collectors.toList());
            log.warn("Circular foreign key reference detected for tables: {}. "
                    + "These tables will be appended in declaration order.",
                    cyclic.stream().map(l -> normalizedMap.get(l).getName())
                            .collect(Collectors.toList()));
            sorted.addAll(cyclic);
        }

        List<TableSchema> result =
                sorted.stream().map(normalizedMap::get).collect(Collectors.toList());
        log.info("Resolved table order (parent-first): {}",
                result.stream().map(TableSchema::getName).collect(Collectors.toList()));
        return result;
    }
}
