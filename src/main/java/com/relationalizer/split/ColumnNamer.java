package com.relationalizer.split;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.relationalizer.model.ColumnNameCollision;

import lombok.Value;

/**
 * Gives every source path of a table a distinct column name. Candidates are tried in order:
 * {@code a_b_c}, {@code a__b__c}, {@code Table__a__b__c}. Shorter paths, then lexically smaller
 * ones, pick first. Names are compared case-insensitively, as SQLite does.
 */
public class ColumnNamer {

    public static final String SEPARATOR = "_";
    private static final String WIDE_SEPARATOR = "__";

    private static final Comparator<List<String>> CLAIM_ORDER = Comparator
            .<List<String>>comparingInt(List::size)
            .thenComparing(path -> String.join(".", path));

    public Assignment assign(String tableName, Collection<List<String>> sourcePaths) {
        List<List<String>> ordered = new ArrayList<>(sourcePaths);
        ordered.sort(CLAIM_ORDER);

        Set<String> taken = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        Map<List<String>, String> names = new LinkedHashMap<>();
        List<ColumnNameCollision> collisions = new ArrayList<>();

        for (List<String> path : ordered) {
            List<String> candidates = candidates(tableName, path);
            String chosen = candidates.stream().filter(c -> !taken.contains(c)).findFirst().orElse(null);
            if (chosen == null) {
                collisions.add(new ColumnNameCollision(tableName, List.copyOf(path), candidates));
                continue;
            }
            taken.add(chosen);
            names.put(path, chosen);
        }
        return new Assignment(names, collisions);
    }

    public static List<String> candidates(String tableName, List<String> path) {
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(String.join(SEPARATOR, path));
        candidates.add(String.join(WIDE_SEPARATOR, path));
        candidates.add(tableName + WIDE_SEPARATOR + String.join(WIDE_SEPARATOR, path));
        return List.copyOf(candidates);
    }

    @Value
    public static class Assignment {
        Map<List<String>, String> names;
        List<ColumnNameCollision> collisions;
    }
}
