package com.relationalizer.normalize;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.relationalizer.exception.RuleConfigurationException;

/**
 * Paths to a single value of the root object, written {@code $.Property.Price}. Lists cannot be
 * crossed.
 */
public final class DocumentPaths {

    private static final Pattern VALUE_PATH = Pattern.compile("\\$(\\.[^.\\[\\]]+)+");

    private DocumentPaths() {
        // Utility class
    }

    public static boolean isValuePath(String path) {
        return path != null && VALUE_PATH.matcher(path).matches();
    }

    /**
     * @throws RuleConfigurationException if {@code path} is not a {@code $.a.b} path
     */
    public static List<String> segments(String path) {
        if (!isValuePath(path)) {
            throw new RuleConfigurationException(List.of("Not a value path (expected $.Key or $.Key.Nested): " + path));
        }
        return List.of(path.substring(2).split("\\."));
    }

    /**
     * Value at {@code segments}, or a missing node when any step is absent or not an object.
     */
    public static JsonNode resolve(JsonNode root, List<String> segments) {
        JsonNode current = root;
        for (String segment : segments) {
            if (current == null || !current.isObject()) {
                return MissingNode.getInstance();
            }
            current = current.get(segment);
        }
        return current == null ? MissingNode.getInstance() : current;
    }

    /**
     * Number held by a numeric node or by text such as {@code "1200"} or {@code "1,200.50"}.
     */
    public static Optional<BigDecimal> number(JsonNode value) {
        if (value.isNumber()) {
            return Optional.of(value.decimalValue());
        }
        if (value.isTextual()) {
            String digits = value.textValue().replace(",", "").trim();
            try {
                return Optional.of(new BigDecimal(digits));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
