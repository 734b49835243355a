package com.relationalizer.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.NonNull;
import lombok.Value;

/**
 * Merge of the type profiles of every document in a corpus.
 */
@Value
public class AggregateSchema {

    public static final String ROOT_PATH = "$";

    @NonNull TypeProfile root;

    public static AggregateSchema empty() {
        return new AggregateSchema(TypeProfile.empty());
    }

    /**
     * Corpus size; every profiled document contributes one root object observation.
     */
    public long getDocumentCount() {
        return root.count(TypeTag.OBJECT);
    }

    public Optional<TypeProfile> profileAt(String... segments) {
        return root.at(segments);
    }

    /**
     * Every non-root path in depth-first order, fields sorted by name.
     */
    public List<PathStatistic> paths() {
        List<PathStatistic> paths = new ArrayList<>();
        collectPaths(ROOT_PATH, root, paths);
        return paths;
    }

    public List<ShapeConflict> shapeConflicts() {
        List<ShapeConflict> conflicts = new ArrayList<>();
        if (root.hasShapeConflict()) {
            conflicts.add(new ShapeConflict(ROOT_PATH, root.getCounts()));
        }
        for (PathStatistic stat : paths()) {
            if (stat.getProfile().hasShapeConflict()) {
                conflicts.add(new ShapeConflict(stat.getPath(), stat.getProfile().getCounts()));
            }
        }
        return conflicts;
    }

    private static void collectPaths(String path, TypeProfile node, List<PathStatistic> out) {
        for (Map.Entry<String, TypeProfile> field : node.getFields().entrySet()) {
            String childPath = path + "." + field.getKey();
            out.add(new PathStatistic(childPath, field.getValue(), node.count(TypeTag.OBJECT)));
            collectPaths(childPath, field.getValue(), out);
        }
        node.getElement().ifPresent(element -> {
            String elementPath = path + "[]";
            out.add(new PathStatistic(elementPath, element, node.getPopulatedLists()));
            collectPaths(elementPath, element, out);
        });
    }
}
