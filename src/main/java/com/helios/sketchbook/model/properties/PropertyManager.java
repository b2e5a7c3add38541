package com.helios.sketchbook.model.properties;

import com.helios.sketchbook.core.error.ReferenceException;
import com.helios.sketchbook.core.error.ValidationException;
import com.helios.sketchbook.model.ids.DynPropertyId;
import com.helios.sketchbook.model.ids.Identifier;
import com.helios.sketchbook.model.ids.StatPropertyId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registry of the dynamic and static properties of a sketch.
 *
 * <p>The two collections are independent: a dynamic and a static property may share an id string.
 * Insertion order is preserved for iteration; {@link #sortedDynProps()} and
 * {@link #sortedStatProps()} give the deterministic order used by evaluation.
 */
public class PropertyManager {

    private static final String FALLBACK_ID = "property";

    private final Map<DynPropertyId, DynProperty> dynProperties = new LinkedHashMap<>();
    private final Map<StatPropertyId, StatProperty> statProperties = new LinkedHashMap<>();

    // ==================== Dynamic properties ====================

    public void addDynamic(DynPropertyId id, DynProperty property) {
        if (dynProperties.containsKey(id)) {
            throw new ValidationException("Dynamic property '" + id + "' already exists");
        }
        dynProperties.put(id, Objects.requireNonNull(property, "Property cannot be null"));
    }

    public void addDynamicByStr(String id, DynProperty property) {
        addDynamic(DynPropertyId.of(id), property);
    }

    public DynProperty getDynamic(DynPropertyId id) {
        DynProperty property = dynProperties.get(id);
        if (property == null) {
            throw new ReferenceException("Dynamic property '" + id + "' does not exist");
        }
        return property;
    }

    public boolean isValidDynamic(DynPropertyId id) {
        return dynProperties.containsKey(id);
    }

    public void removeDynamic(DynPropertyId id) {
        if (dynProperties.remove(id) == null) {
            throw new ReferenceException("Dynamic property '" + id + "' does not exist");
        }
    }

    /**
     * Renames a dynamic property, keeping its position in insertion order.
     */
    public void setDynamicId(DynPropertyId originalId, DynPropertyId newId) {
        rename(dynProperties, originalId, newId, "Dynamic");
    }

    /**
     * Exchanges the contents of two dynamic properties while their ids stay in place.
     */
    public void swapDynamicContent(DynPropertyId first, DynPropertyId second) {
        DynProperty a = getDynamic(first);
        DynProperty b = getDynamic(second);
        dynProperties.put(first, b);
        dynProperties.put(second, a);
    }

    public Map<DynPropertyId, DynProperty> dynProps() {
        return Collections.unmodifiableMap(dynProperties);
    }

    public List<Map.Entry<DynPropertyId, DynProperty>> sortedDynProps() {
        return dynProperties.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> Map.entry(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }

    public int numDynamic() {
        return dynProperties.size();
    }

    /**
     * Proposes an unused dynamic property id derived from {@code idealId}. Does not modify the manager.
     */
    public DynPropertyId generateDynId(String idealId, int startIndex) {
        return DynPropertyId.of(generateId(idealId, startIndex, dynIdStrings()));
    }

    public DynPropertyId generateDynId(String idealId) {
        return generateDynId(idealId, 0);
    }

    // ==================== Static properties ====================

    public void addStatic(StatPropertyId id, StatProperty property) {
        if (statProperties.containsKey(id)) {
            throw new ValidationException("Static property '" + id + "' already exists");
        }
        statProperties.put(id, Objects.requireNonNull(property, "Property cannot be null"));
    }

    public void addStaticByStr(String id, StatProperty property) {
        addStatic(StatPropertyId.of(id), property);
    }

    public StatProperty getStatic(StatPropertyId id) {
        StatProperty property = statProperties.get(id);
        if (property == null) {
            throw new ReferenceException("Static property '" + id + "' does not exist");
        }
        return property;
    }

    public boolean isValidStatic(StatPropertyId id) {
        return statProperties.containsKey(id);
    }

    public void removeStatic(StatPropertyId id) {
        if (statProperties.remove(id) == null) {
            throw new ReferenceException("Static property '" + id + "' does not exist");
        }
    }

    public void setStaticId(StatPropertyId originalId, StatPropertyId newId) {
        rename(statProperties, originalId, newId, "Static");
    }

    public Map<StatPropertyId, StatProperty> statProps() {
        return Collections.unmodifiableMap(statProperties);
    }

    public List<Map.Entry<StatPropertyId, StatProperty>> sortedStatProps() {
        return statProperties.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> Map.entry(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }

    public int numStatic() {
        return statProperties.size();
    }

    public StatPropertyId generateStatId(String idealId, int startIndex) {
        return StatPropertyId.of(generateId(idealId, startIndex, statIdStrings()));
    }

    public StatPropertyId generateStatId(String idealId) {
        return generateStatId(idealId, 0);
    }

    // ==================== Helpers ====================

    /**
     * Id generation steps:
     * <ol>
     *   <li>{@code idealId} verbatim, if valid and unused.</li>
     *   <li>{@code idealId} reduced to alphanumerics and underscores, if valid and unused.</li>
     *   <li>The reduced id with suffix {@code _n}, for {@code n = startIndex, startIndex + 1, ...}.</li>
     * </ol>
     */
    static String generateId(String idealId, int startIndex, Set<String> taken) {
        if (startIndex < 0) {
            throw new ValidationException("Id suffix start index must be non-negative, got " + startIndex);
        }
        if (Identifier.isValid(idealId) && !taken.contains(idealId)) {
            return idealId;
        }
        String transformed = sanitize(idealId);
        if (!taken.contains(transformed)) {
            return transformed;
        }
        // At most |taken| candidates can collide.
        long last = (long) startIndex + taken.size();
        for (long n = startIndex; n <= last; n++) {
            String candidate = transformed + "_" + n;
            if (!taken.contains(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Unreachable: no free id for " + idealId);
    }

    private static String sanitize(String idealId) {
        String kept = idealId == null ? "" : idealId.chars()
                .filter(c -> (c < 128 && Character.isLetterOrDigit(c)) || c == '_')
                .collect(StringBuilder::new, StringBuilder::appendCodePoint, StringBuilder::append)
                .toString();
        if (kept.isEmpty()) {
            return FALLBACK_ID;
        }
        if (Character.isDigit(kept.charAt(0))) {
            return "p_" + kept;
        }
        return kept;
    }

    private Set<String> dynIdStrings() {
        return dynProperties.keySet().stream().map(Identifier::asStr).collect(Collectors.toSet());
    }

    private Set<String> statIdStrings() {
        return statProperties.keySet().stream().map(Identifier::asStr).collect(Collectors.toSet());
    }

    private static <K extends Identifier, V> void rename(Map<K, V> map, K originalId, K newId, String kind) {
        if (!map.containsKey(originalId)) {
            throw new ReferenceException(kind + " property '" + originalId + "' does not exist");
        }
        if (originalId.equals(newId)) {
            return;
        }
        if (map.containsKey(newId)) {
            throw new ValidationException(kind + " property '" + newId + "' already exists");
        }
        Map<K, V> reordered = new LinkedHashMap<>();
        for (Map.Entry<K, V> entry : map.entrySet()) {
            K key = entry.getKey().equals(originalId) ? newId : entry.getKey();
            reordered.put(key, entry.getValue());
        }
        map.clear();
        map.putAll(reordered);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertyManager other)) return false;
        return dynProperties.equals(other.dynProperties) && statProperties.equals(other.statProperties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dynProperties, statProperties);
    }
}
