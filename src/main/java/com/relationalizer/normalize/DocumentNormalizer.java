package com.relationalizer.normalize;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relationalizer.exception.MalformedDocumentException;
import com.relationalizer.model.AggregateSchema;
import com.relationalizer.model.NormalizedDocument;
import com.relationalizer.model.RawDocument;
import com.relationalizer.pipeline.RelationalizerConfig;
import com.relationalizer.rules.TransformRule;
import com.relationalizer.rules.TransformRules;

/**
 * Turns a raw listing into its canonical tree: transformation rules applied, short scalar lists
 * collapsed, other lists made of row objects, and every row object given an identity.
 */
public class DocumentNormalizer {
    private static final Logger log = LoggerFactory.getLogger(DocumentNormalizer.class);

    /** Field holding a scalar list member once it is wrapped into an object. */
    public static final String VALUE_FIELD = "Value";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectReader reader;
    private final RelationalizerConfig config;
    private final TransformRules rules;
    private final ContentHasher hasher;
    private final ComputedColumns computedColumns;

    public DocumentNormalizer(RelationalizerConfig config, ObjectMapper mapper) {
        this.config = config;
        this.rules = config.getRules();
        this.reader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.hasher = new ContentHasher(mapper);
        this.computedColumns = config.isComputedColumns() ? new ComputedColumns(config) : null;
    }

    public NormalizedDocument normalize(RawDocument raw) {
        JsonNode body;
        try {
            body = reader.readTree(raw.getJson());
        } catch (JsonProcessingException e) {
            throw new MalformedDocumentException(raw.getId(), "invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (body == null || !body.isObject()) {
            String found = body == null || body.isMissingNode() ? "empty" : body.getNodeType().name().toLowerCase(Locale.ROOT);
            throw new MalformedDocumentException(raw.getId(), "root must be an object but was " + found);
        }

        ObjectNode root = normalizeObject((ObjectNode) body, AggregateSchema.ROOT_PATH);
        String rootTable = config.getRootTableName();
        assignIdentity(root, rootTable, rules.generateIdRule(rootTable, AggregateSchema.ROOT_PATH));
        // after identity: the generated root id must not change from one scrape to the next
        if (computedColumns != null) {
            computedColumns.apply(root, raw.getLastUpdated());
        }
        return new NormalizedDocument(raw.getId(), root, raw.getLastUpdated());
    }

    private ObjectNode normalizeObject(ObjectNode source, String path) {
        ObjectNode out = NODES.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            String childPath = path + "." + key;
            if (rules.shouldDrop(key, childPath)) {
                log.trace("Dropping {}", childPath);
                continue;
            }
            JsonNode value = applyValueRules(key, childPath, field.getValue());
            out.set(key, normalizeValue(value, key, childPath));
        }
        return out;
    }

    private JsonNode normalizeValue(JsonNode value, String key, String path) {
        if (value.isObject()) {
            return normalizeObject((ObjectNode) value, path);
        }
        if (value.isArray()) {
            return normalizeList((ArrayNode) value, key, path);
        }
        return value;
    }

    private JsonNode normalizeList(ArrayNode list, String key, String path) {
        if (list.isEmpty()) {
            return NODES.arrayNode();
        }
        Optional<TransformRule> idRule = rules.generateIdRule(key, path);
        if (idRule.isEmpty() && isCollapsible(list)) {
            return NODES.textNode(joinScalars(list));
        }

        String elementPath = path + "[]";
        ArrayNode members = NODES.arrayNode();
        for (JsonNode element : list) {
            ObjectNode source;
            if (element.isObject()) {
                source = (ObjectNode) element;
            } else {
                source = NODES.objectNode();
                source.set(VALUE_FIELD, element);
            }
            ObjectNode member = normalizeObject(source, elementPath);
            assignIdentity(member, key, idRule);
            members.add(member);
        }
        return members;
    }

    private boolean isCollapsible(ArrayNode list) {
        if (list.size() > config.getCollapseThreshold()) {
            return false;
        }
        for (JsonNode element : list) {
            if (element.isContainerNode()) {
                return false;
            }
        }
        return true;
    }

    private String joinScalars(ArrayNode list) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) {
                sb.append(config.getDelimiter());
            }
            JsonNode element = list.get(i);
            sb.append(element.isNull() ? "" : element.asText());
        }
        return sb.toString();
    }

    /**
     * Gives a row object its {@code <owner>GeneratedId} unless one of its own ids already
     * identifies it.
     * A null placeholder for the generated id is overwritten in place.
     */
    private void assignIdentity(ObjectNode row, String owner, Optional<TransformRule> idRule) {
        String idKey = IdentifierKeys.generatedIdKey(owner);
        if (idRule.isPresent()) {
            List<String> fields = idRule.get().getFields();
            long id = fields == null || fields.isEmpty() ? hasher.hash(row, idKey) : hasher.hash(row, fields);
            row.put(idKey, id);
            return;
        }
        if (IdentifierKeys.hasNaturalIdentity(row, owner)) {
            return;
        }
        row.put(idKey, hasher.hash(row, idKey));
    }

    private JsonNode applyValueRules(String key, String path, JsonNode value) {
        JsonNode current = value;
        for (TransformRule rule : rules.valueRules(key, path)) {
            current = switch (rule.getEffect()) {
                case FIRST -> first(current);
                case WRAP_LIST -> wrapList(current);
                case JOIN -> join(current, rule.getArgument());
                case DIGITS -> digits(current);
                case DATE -> reformatDate(current, rule.getArgument(), path);
                default -> current;
            };
        }
        return current;
    }

    private static JsonNode first(JsonNode value) {
        if (!value.isArray()) {
            return value;
        }
        return value.isEmpty() ? NODES.nullNode() : value.get(0);
    }

    private static JsonNode wrapList(JsonNode value) {
        if (value.isArray()) {
            return value;
        }
        ArrayNode wrapped = NODES.arrayNode();
        if (!value.isNull()) {
            wrapped.add(value);
        }
        return wrapped;
    }

    private JsonNode join(JsonNode value, String field) {
        if (!value.isArray()) {
            return value;
        }
        StringBuilder sb = new StringBuilder();
        for (JsonNode element : value) {
            JsonNode part = element.isObject() ? element.get(field) : element;
            if (part == null || part.isNull() || part.isContainerNode()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(config.getDelimiter());
            }
            sb.append(part.asText());
        }
        return sb.length() == 0 ? NODES.nullNode() : NODES.textNode(sb.toString());
    }

    private static JsonNode digits(JsonNode value) {
        if (!value.isTextual()) {
            return value;
        }
        String digits = value.asText().replaceAll("\\D", "");
        if (digits.isEmpty()) {
            return NODES.nullNode();
        }
        BigInteger number = new BigInteger(digits);
        return number.bitLength() < Long.SIZE ? NODES.numberNode(number.longValue()) : NODES.numberNode(number);
    }

    private static JsonNode reformatDate(JsonNode value, String pattern, String path) {
        if (!value.isTextual()) {
            return value;
        }
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(pattern, Locale.ROOT);
        String text = value.asText();
        try {
            return NODES.textNode(LocalDateTime.parse(text, formatter).toString());
        } catch (DateTimeParseException notDateTime) {
            try {
                return NODES.textNode(LocalDate.parse(text, formatter).toString());
            } catch (DateTimeParseException e) {
                log.warn("Value '{}' at {} does not match date pattern '{}', keeping it as is", text, path, pattern);
                return value;
            }
        }
    }
}
