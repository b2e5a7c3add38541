package com.helios.sketchbook.io;

import com.helios.sketchbook.core.error.ValidationException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects entity blocks of the form {@code #!type: ID: #`value`#} from annotated text.
 *
 * <p>Entities of a type are kept sorted by ID. A block must carry a non-empty value directly under
 * its ID; nested paths such as {@code #!type: ID: field: ...} are rejected.
 */
public class EntityBlockReader {

    static final String BLOCK_PREFIX = "#!";
    private static final String VALUE_OPEN = "#`";
    private static final String VALUE_CLOSE = "`#";

    private static final Pattern HEADER = Pattern.compile(
            "^#!\\s*([a-zA-Z_][a-zA-Z0-9_]*)\\s*:\\s*([a-zA-Z_][a-zA-Z0-9_]*)\\s*:(.*)$");
    private static final Pattern NESTED_PATH = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*\\s*:.*$");

    private final Map<String, SortedMap<String, String>> entities = new HashMap<>();

    public static boolean isEntityBlock(String line) {
        return line.trim().startsWith(BLOCK_PREFIX);
    }

    /**
     * Registers one block line.
     *
     * @throws ValidationException if the line is malformed, nested, empty or repeats an ID of its type.
     */
    public void accept(String line) {
        Matcher matcher = HEADER.matcher(line.trim());
        if (!matcher.matches()) {
            throw new ValidationException("Malformed entity block: " + line.trim());
        }
        String type = matcher.group(1);
        String id = matcher.group(2);
        String raw = matcher.group(3).trim();

        String value;
        if (raw.startsWith(VALUE_OPEN)) {
            if (!raw.endsWith(VALUE_CLOSE) || raw.length() < VALUE_OPEN.length() + VALUE_CLOSE.length()) {
                throw new ValidationException("Unterminated value of entity '" + type + ":" + id + "'");
            }
            value = raw.substring(VALUE_OPEN.length(), raw.length() - VALUE_CLOSE.length()).trim();
        } else if (NESTED_PATH.matcher(raw).matches()) {
            throw new ValidationException("Entity '" + type + ":" + id + "' has a nested value, which is not supported");
        } else {
            value = raw;
        }
        if (value.isEmpty()) {
            throw new ValidationException("Entity '" + type + ":" + id + "' has an empty value");
        }

        SortedMap<String, String> ofType = entities.computeIfAbsent(type, t -> new TreeMap<>());
        if (ofType.containsKey(id)) {
            throw new ValidationException("Duplicate entity '" + type + ":" + id + "'");
        }
        ofType.put(id, value);
    }

    /**
     * @return the values of all entities of a type, sorted by ID (empty if the type never appeared).
     */
    public SortedMap<String, String> entities(String type) {
        SortedMap<String, String> ofType = entities.get(type);
        return ofType != null ? Collections.unmodifiableSortedMap(ofType) : Collections.emptySortedMap();
    }

    public Map<String, SortedMap<String, String>> allEntities() {
        return Collections.unmodifiableMap(entities);
    }

    public static String formatBlock(String type, String id, String value) {
        return BLOCK_PREFIX + type + ": " + id + ": " + VALUE_OPEN + value + VALUE_CLOSE;
    }
}
