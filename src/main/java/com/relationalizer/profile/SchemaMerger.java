package com.relationalizer.profile;

import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

import com.relationalizer.model.AggregateSchema;
import com.relationalizer.model.TypeProfile;
import com.relationalizer.model.TypeTag;

/**
 * Folds type profiles into one. The merge is associative and commutative and the empty
 * profile is its identity, so profiles can be combined in any grouping or order.
 */
public class SchemaMerger {

    public TypeProfile merge(TypeProfile a, TypeProfile b) {
        if (a.isEmpty()) {
            return b;
        }
        if (b.isEmpty()) {
            return a;
        }

        Map<TypeTag, Long> counts = new EnumMap<>(TypeTag.class);
        counts.putAll(a.getCounts());
        b.getCounts().forEach((tag, count) -> counts.merge(tag, count, Long::sum));

        Map<String, TypeProfile> fields = new TreeMap<>(a.getFields());
        b.getFields().forEach((name, profile) -> fields.merge(name, profile, this::merge));

        TypeProfile element = mergeElements(a, b);

        return TypeProfile.of(counts, fields, element, a.getPopulatedLists() + b.getPopulatedLists());
    }

    public AggregateSchema merge(AggregateSchema a, AggregateSchema b) {
        return new AggregateSchema(merge(a.getRoot(), b.getRoot()));
    }

    /**
     * Folds document profiles into an aggregate; a parallel stream is combined the same way.
     */
    public AggregateSchema aggregate(Stream<TypeProfile> profiles) {
        return new AggregateSchema(profiles.reduce(TypeProfile.empty(), this::merge, this::merge));
    }

    private TypeProfile mergeElements(TypeProfile a, TypeProfile b) {
        if (a.getElement().isEmpty()) {
            return b.getElement().orElse(null);
        }
        if (b.getElement().isEmpty()) {
            return a.getElement().get();
        }
        return merge(a.getElement().get(), b.getElement().get());
    }
}
