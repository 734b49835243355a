package com.relationalizer.rules;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.relationalizer.rules.TransformRule.Effect;

import lombok.Data;

/**
 * Parsed transformation rules, queried by key and path while documents are traversed.
 */
@Data
public class TransformRules {

    private static final Set<Effect> VALUE_EFFECTS =
            EnumSet.of(Effect.FIRST, Effect.WRAP_LIST, Effect.JOIN, Effect.DIGITS, Effect.DATE);

    private final List<TransformRule> allRules = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public static TransformRules empty() {
        return new TransformRules();
    }

    public void addRule(TransformRule rule) {
        boolean duplicate = allRules.stream()
                .anyMatch(r -> r.getTarget().equals(rule.getTarget()) && r.getEffect() == rule.getEffect());
        if (duplicate) {
            addWarning("Line " + rule.getLineNumber() + ": duplicate " + rule.getEffect()
                    + " rule for " + rule.getTarget() + " ignored");
            return;
        }
        allRules.add(rule);
    }

    public boolean shouldDrop(String key, String path) {
        return allRules.stream()
                .anyMatch(r -> r.getEffect() == Effect.DROP && r.matches(key, path));
    }

    /**
     * Rules rewriting the value found at the key, in file order.
     */
    public List<TransformRule> valueRules(String key, String path) {
        return allRules.stream()
                .filter(r -> VALUE_EFFECTS.contains(r.getEffect()) && r.matches(key, path))
                .toList();
    }

    public Optional<TransformRule> generateIdRule(String key, String path) {
        return allRules.stream()
                .filter(r -> r.getEffect() == Effect.GENERATE_ID && r.matches(key, path))
                .findFirst();
    }

    public boolean isMinimal(String path) {
        return allRules.stream()
                .anyMatch(r -> r.getEffect() == Effect.MINIMAL && r.getTarget().equals(path));
    }

    public List<TransformRule> getMinimalRules() {
        return allRules.stream()
                .filter(r -> r.getEffect() == Effect.MINIMAL)
                .toList();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public void addError(String error) {
        errors.add(error);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }
}
