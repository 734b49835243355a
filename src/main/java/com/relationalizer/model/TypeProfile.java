package com.relationalizer.model;

import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableSortedMap;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Type observations for one position of a document shape. Objects carry a sorted map of child
 * profiles, lists carry one merged element profile and the number of non-empty list observations.
 * Instances are immutable; {@link #empty()} is the merge identity.
 */
@EqualsAndHashCode
@ToString
public final class TypeProfile {

    private static final TypeProfile EMPTY =
            new TypeProfile(ImmutableSortedMap.of(), ImmutableSortedMap.of(), null, 0);

    private final ImmutableSortedMap<TypeTag, Long> counts;
    private final ImmutableSortedMap<String, TypeProfile> fields;
    private final TypeProfile element;
    private final long populatedLists;

    private TypeProfile(ImmutableSortedMap<TypeTag, Long> counts,
                        ImmutableSortedMap<String, TypeProfile> fields,
                        TypeProfile element,
                        long populatedLists) {
        this.counts = counts;
        this.fields = fields;
        this.element = element;
        this.populatedLists = populatedLists;
    }

    public static TypeProfile empty() {
        return EMPTY;
    }

    public static TypeProfile leaf(TypeTag tag) {
        return new TypeProfile(ImmutableSortedMap.of(tag, 1L), ImmutableSortedMap.of(), null, 0);
    }

    public static TypeProfile object(Map<String, TypeProfile> fields) {
        return new TypeProfile(ImmutableSortedMap.of(TypeTag.OBJECT, 1L),
                ImmutableSortedMap.copyOf(fields), null, 0);
    }

    /**
     * @param element merged profile of the list members, null for an empty list
     */
    public static TypeProfile list(TypeProfile element) {
        return new TypeProfile(ImmutableSortedMap.of(TypeTag.LIST, 1L), ImmutableSortedMap.of(),
                element, element == null ? 0 : 1);
    }

    public static TypeProfile of(Map<TypeTag, Long> counts,
                                 Map<String, TypeProfile> fields,
                                 TypeProfile element,
                                 long populatedLists) {
        return new TypeProfile(ImmutableSortedMap.copyOf(counts), ImmutableSortedMap.copyOf(fields),
                element, populatedLists);
    }

    public Map<TypeTag, Long> getCounts() {
        return counts;
    }

    public Map<String, TypeProfile> getFields() {
        return fields;
    }

    public Optional<TypeProfile> getElement() {
        return Optional.ofNullable(element);
    }

    public long getPopulatedLists() {
        return populatedLists;
    }

    public long count(TypeTag tag) {
        return counts.getOrDefault(tag, 0L);
    }

    /**
     * Number of observations at this position, whatever their type.
     */
    public long total() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }

    public long nonNullScalarCount() {
        return counts.entrySet().stream()
                .filter(e -> e.getKey().isScalarValue())
                .mapToLong(Map.Entry::getValue)
                .sum();
    }

    public Set<TypeTag> scalarValueTags() {
        return counts.keySet().stream()
                .filter(TypeTag::isScalarValue)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(TypeTag.class)));
    }

    public boolean hasScalarObservations() {
        return nonNullScalarCount() > 0 || count(TypeTag.NULL) > 0;
    }

    public boolean isEmpty() {
        return counts.isEmpty() && fields.isEmpty() && element == null && populatedLists == 0;
    }

    /**
     * True when this position was seen with more than one of: a scalar value, an object, a list.
     */
    public boolean hasShapeConflict() {
        int shapes = 0;
        if (nonNullScalarCount() > 0) {
            shapes++;
        }
        if (count(TypeTag.OBJECT) > 0) {
            shapes++;
        }
        if (count(TypeTag.LIST) > 0) {
            shapes++;
        }
        return shapes > 1;
    }

    public Optional<TypeProfile> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    /**
     * Navigates a dotted path relative to this profile, where {@code []} steps into a list element.
     */
    public Optional<TypeProfile> at(String... segments) {
        TypeProfile current = this;
        for (String segment : segments) {
            Optional<TypeProfile> next = "[]".equals(segment) ? current.getElement() : current.field(segment);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    public String describeCounts() {
        if (counts.isEmpty()) {
            return "-";
        }
        return counts.entrySet().stream()
                .map(e -> e.getKey().getLabel() + ": " + e.getValue())
                .collect(Collectors.joining(", "));
    }
}
