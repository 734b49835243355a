package com.relationalizer.rules;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.relationalizer.exception.RuleConfigurationException;
import com.relationalizer.rules.TransformRule.Effect;

/**
 * Parser for transformation rules files.
 *
 * Format:
 * - Noise key anywhere: Distance = DROP
 * - Exact path: $.Property.OwnershipTypeGroupIds = DROP
 * - Keep first list member: $.Property.Photo = FIRST
 * - Join a list of objects: $.Property.Parking = JOIN:Name
 * - Hash selected fields: $.Individual[].Phones = GENERATE_ID:AreaCode+PhoneNumber
 * - Date reformat: $.InsertedDateUTC = DATE:yyyy-MM-dd HH:mm
 * - Comments: # comment
 */
public class TransformRuleParser {
    private static final Logger log = LoggerFactory.getLogger(TransformRuleParser.class);

    private static final Pattern RULE_PATTERN = Pattern.compile(
            "^([^=\\s]+)\\s*=\\s*([A-Za-z_]+)(?:\\s*:\\s*(.*))?$"
    );

    private static final Pattern PATH_PATTERN = Pattern.compile(
            "^\\$(\\.[^.\\[\\]\\s]+(\\[\\])?)*$"
    );

    public TransformRules parse(Path rulesFile) throws IOException {
        List<String> lines = Files.readAllLines(rulesFile);
        return parse(lines);
    }

    public TransformRules parse(List<String> lines) {
        TransformRules rules = new TransformRules();

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            try {
                TransformRule rule = parseLine(trimmed, lineNum);
                rules.addRule(rule);
                log.debug("Parsed rule: {} -> {} ({})", rule.getTarget(), rule.getEffect(), rule.getArgument());
            } catch (IllegalArgumentException e) {
                rules.addError("Line " + lineNum + ": " + e.getMessage());
                log.warn("Failed to parse rule line {}: {}", lineNum, e.getMessage());
            }
        }

        return rules;
    }

    /**
     * Parses the file and fails with every collected error when any line is invalid.
     */
    public TransformRules parseStrict(Path rulesFile) throws IOException {
        TransformRules rules = parse(rulesFile);
        if (rules.hasErrors()) {
            throw new RuleConfigurationException(rules.getErrors());
        }
        return rules;
    }

    private TransformRule parseLine(String line, int lineNum) {
        Matcher matcher = RULE_PATTERN.matcher(line);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid rule format: " + line);
        }

        String target = normalizeTarget(matcher.group(1));
        Effect effect = parseEffect(matcher.group(2));
        String argument = matcher.group(3) == null || matcher.group(3).isBlank() ? null : matcher.group(3).trim();

        if (target.startsWith("$") && !PATH_PATTERN.matcher(target).matches()) {
            throw new IllegalArgumentException("Invalid path: " + target);
        }
        if ("$".equals(target) && effect != Effect.GENERATE_ID) {
            throw new IllegalArgumentException(effect + " cannot target the document root");
        }

        List<String> fields = List.of();
        switch (effect) {
            case JOIN -> {
                requireArgument(effect, argument);
                fields = List.of(argument);
            }
            case DATE -> {
                requireArgument(effect, argument);
                try {
                    DateTimeFormatter.ofPattern(argument, Locale.ROOT);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Invalid date pattern '" + argument + "': " + e.getMessage());
                }
            }
            case GENERATE_ID -> {
                if (argument != null) {
                    fields = Arrays.stream(argument.split("\\+"))
                            .map(String::trim)
                            .filter(s -> !s.isEmpty())
                            .toList();
                    if (fields.isEmpty()) {
                        throw new IllegalArgumentException("GENERATE_ID needs at least one field after ':'");
                    }
                }
            }
            case MINIMAL -> {
                rejectArgument(effect, argument);
                if (!target.startsWith("$")) {
                    throw new IllegalArgumentException("MINIMAL needs a path target starting with '$': " + target);
                }
            }
            default -> rejectArgument(effect, argument);
        }

        return TransformRule.builder()
                .target(target)
                .effect(effect)
                .argument(argument)
                .fields(fields)
                .lineNumber(lineNum)
                .build();
    }

    /**
     * Accepts {@code $.Individual.[]} as a spelling of {@code $.Individual[]}.
     */
    private static String normalizeTarget(String target) {
        return target.replace(".[]", "[]");
    }

    private static Effect parseEffect(String name) {
        try {
            return Effect.valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown effect: " + name);
        }
    }

    private static void requireArgument(Effect effect, String argument) {
        if (argument == null) {
            throw new IllegalArgumentException(effect + " requires an argument, e.g. " + effect + ":value");
        }
    }

    private static void rejectArgument(Effect effect, String argument) {
        if (argument != null) {
            throw new IllegalArgumentException(effect + " takes no argument");
        }
    }
}
