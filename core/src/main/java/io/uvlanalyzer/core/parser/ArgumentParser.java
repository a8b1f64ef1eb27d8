package io.uvlanalyzer.core.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.uvlanalyzer.core.error.InvalidArgumentException;
import io.uvlanalyzer.core.model.SelectionCriteria;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses the single extra parameter that some operations take. The parameter arrives as free
 * text from the caller, so every form accepts either JSON or a lightweight token syntax:
 *
 * <ul>
 * <li>feature name: the trimmed text;
 * <li>selection: {@code ["A", "B"]} or {@code A, B} or {@code A B};
 * <li>criteria: {@code {"A": true, "B": false}} or tokens {@code A}, {@code +A}, {@code !A},
 * {@code -A}, {@code A=true}, {@code A=false}, or one {@code A,True} pair per line;
 * <li>sample count: a positive integer.
 * </ul>
 *
 * Names are not checked against a model here.
 */
public final class ArgumentParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** {@code Name,True}; a quoted name may contain commas. */
    private static final Pattern CSV_PAIR = Pattern.compile("(?:\"[^\"]*\"|[^,=\"])+,\\s*(?i:true|false)");

    private ArgumentParser() {}

    /**
     * Parses a feature-name parameter.
     *
     * @throws InvalidArgumentException if the parameter is missing or blank
     */
    public static String featureName(String argument, String operation) {
        return require(argument, operation, "a feature name");
    }

    /**
     * Parses a selection of feature names. An empty JSON array is an empty selection.
     *
     * @throws InvalidArgumentException if the parameter is missing or not a list of names
     */
    public static Set<String> selection(String argument, String operation) {
        if (argument != null && argument.strip().equals("[]")) {
            return Set.of();
        }
        String text = require(argument, operation, "a list of selected features");
        Set<String> names = new LinkedHashSet<>();
        if (text.startsWith("[")) {
            List<String> values;
            try {
                values = MAPPER.readValue(text, new TypeReference<List<String>>() {});
            } catch (JsonProcessingException e) {
                throw new InvalidArgumentException(
                        "Selection must be a JSON array of feature names: " + e.getOriginalMessage(), e, operation);
            }
            for (String value : values) {
                if (value == null || value.isBlank()) {
                    throw new InvalidArgumentException("Selection contains a blank feature name", operation);
                }
                names.add(value.strip());
            }
            return names;
        }
        for (String token : split(text)) {
            names.add(token);
        }
        return names;
    }

    /**
     * Parses filter criteria.
     *
     * @throws InvalidArgumentException if the parameter is missing or malformed
     */
    public static SelectionCriteria criteria(String argument, String operation) {
        String text = require(argument, operation, "filter criteria");
        Map<String, Boolean> forced = new LinkedHashMap<>();
        if (text.startsWith("{")) {
            Map<String, Boolean> values;
            try {
                values = MAPPER.readValue(text, new TypeReference<Map<String, Boolean>>() {});
            } catch (JsonProcessingException e) {
                throw new InvalidArgumentException(
                        "Criteria must be a JSON object of feature name to boolean: " + e.getOriginalMessage(),
                        e,
                        operation);
            }
            values.forEach((name, value) -> {
                if (value == null) {
                    throw new InvalidArgumentException("Criterion for '" + name + "' must be true or false", operation);
                }
                forced.put(name.strip(), value);
            });
        } else if (isPairPerLine(text)) {
            for (String line : text.split("\\R")) {
                if (!line.isBlank()) {
                    String pair = line.strip();
                    int comma = pair.lastIndexOf(',');
                    boolean value = "true".equalsIgnoreCase(pair.substring(comma + 1).strip());
                    putCriterion(pair.substring(0, comma).strip(), value, pair, forced, operation);
                }
            }
        } else {
            for (String token : split(text)) {
                parseCriterion(token, forced, operation);
            }
        }

        Set<String> selected = new LinkedHashSet<>();
        Set<String> deselected = new LinkedHashSet<>();
        forced.forEach((name, value) -> (value ? selected : deselected).add(name));
        return new SelectionCriteria(selected, deselected);
    }

    private static boolean isPairPerLine(String text) {
        return text.lines()
                .filter(line -> !line.isBlank())
                .allMatch(line -> CSV_PAIR.matcher(line.strip()).matches());
    }

    private static void parseCriterion(String token, Map<String, Boolean> forced, String operation) {
        String name;
        boolean value;
        int equals = token.indexOf('=');
        if (equals >= 0) {
            name = token.substring(0, equals).strip();
            String flag = token.substring(equals + 1).strip();
            if ("true".equalsIgnoreCase(flag)) {
                value = true;
            } else if ("false".equalsIgnoreCase(flag)) {
                value = false;
            } else {
                throw new InvalidArgumentException(
                        "Criterion '" + token + "' must end in =true or =false", operation);
            }
        } else if (token.startsWith("!") || token.startsWith("-")) {
            name = token.substring(1).strip();
            value = false;
        } else if (token.startsWith("+")) {
            name = token.substring(1).strip();
            value = true;
        } else {
            name = token;
            value = true;
        }
        putCriterion(name, value, token, forced, operation);
    }

    private static void putCriterion(
            String name, boolean value, String token, Map<String, Boolean> forced, String operation) {
        if (name.isEmpty()) {
            throw new InvalidArgumentException("Criterion '" + token + "' names no feature", operation);
        }
        Boolean previous = forced.put(name, value);
        if (previous != null && previous != value) {
            throw new InvalidArgumentException(
                    "Feature '" + name + "' is both selected and deselected", operation);
        }
    }

    /**
     * Parses a sample size.
     *
     * @throws InvalidArgumentException if the parameter is not a positive integer
     */
    public static int sampleCount(String argument, String operation) {
        String text = require(argument, operation, "a sample size");
        int count;
        try {
            count = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Sample size must be an integer, got '" + text + "'", e, operation);
        }
        if (count < 1) {
            throw new InvalidArgumentException("Sample size must be at least 1, got " + count, operation);
        }
        return count;
    }

    private static String require(String argument, String operation, String what) {
        if (argument == null || argument.isBlank()) {
            throw new InvalidArgumentException("Operation '" + operation + "' requires " + what, operation);
        }
        return argument.strip();
    }

    /** Commas separate names when present, so names may contain spaces; otherwise whitespace does. */
    private static List<String> split(String text) {
        String[] parts = text.indexOf(',') >= 0 ? text.split(",") : text.split("\\s+");
        return Arrays.stream(parts)
                .map(String::strip)
                .filter(part -> !part.isEmpty())
                .toList();
    }
}
