package com.example.dndcombat.condition;

import com.example.dndcombat.error.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Static reference data: condition name to mechanical effects.
 * Loaded once from YAML and read-only afterwards, so one instance can be shared by every encounter.
 */
public class ConditionsLibrary {

    private static final Logger logger = LoggerFactory.getLogger(ConditionsLibrary.class);

    public static final String DEFAULT_RESOURCE = "/data/conditions.yaml";

    private final Map<String, ConditionDefinition> byName;

    public ConditionsLibrary(Collection<ConditionDefinition> definitions) {
        Map<String, ConditionDefinition> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (ConditionDefinition def : definitions) {
            map.put(def.getName(), def);
        }
        this.byName = Collections.unmodifiableMap(map);
    }

    /**
     * Load the bundled 5E conditions.
     */
    public static ConditionsLibrary loadDefault() {
        return loadFromYamlResource(DEFAULT_RESOURCE);
    }

    public static ConditionsLibrary loadFromYamlResource(String resourcePath) {
        try (InputStream in = ConditionsLibrary.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalStateException("Conditions resource not found: " + resourcePath);
            }
            ConditionsLibrary library = fromYaml(in);
            logger.info("[ConditionsLibrary] Loaded {} conditions from {}", library.size(), resourcePath);
            return library;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read conditions resource " + resourcePath, e);
        }
    }

    @SuppressWarnings("unchecked")
    public static ConditionsLibrary fromYaml(InputStream in) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(in);
        List<ConditionDefinition> defs = new ArrayList<>();
        if (root == null || !root.containsKey("conditions")) {
            return new ConditionsLibrary(defs);
        }
        List<Map<String, Object>> entries = (List<Map<String, Object>>) root.get("conditions");
        for (Map<String, Object> entry : entries) {
            defs.add(parseDefinition(entry));
        }
        return new ConditionsLibrary(defs);
    }

    @SuppressWarnings("unchecked")
    private static ConditionDefinition parseDefinition(Map<String, Object> entry) {
        String name = str(entry.get("name"));
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Condition entry without a name: " + entry);
        }

        List<RollModifier> rolls = new ArrayList<>();
        Object rollsObj = entry.get("rolls");
        if (rollsObj instanceof Map) {
            for (Map.Entry<String, Object> r : ((Map<String, Object>) rollsObj).entrySet()) {
                RollTarget target = RollTarget.fromKey(r.getKey());
                RollEffect effect = RollEffect.fromKey(str(r.getValue()));
                if (target == null || effect == null) {
                    throw new IllegalArgumentException("Bad roll modifier on " + name + ": " + r.getKey() + "=" + r.getValue());
                }
                rolls.add(new RollModifier(target, effect));
            }
        }

        Set<Restriction> restrictions = EnumSet.noneOf(Restriction.class);
        for (String key : strList(entry.get("restrictions"))) {
            Restriction restriction = Restriction.fromKey(key);
            if (restriction == null) {
                throw new IllegalArgumentException("Unknown restriction on " + name + ": " + key);
            }
            restrictions.add(restriction);
        }

        return new ConditionDefinition(name, str(entry.get("description")), str(entry.get("icon")),
            rolls, restrictions,
            new LinkedHashSet<>(strList(entry.get("includes"))),
            new LinkedHashSet<>(strList(entry.get("incompatible_with"))));
    }

    public Optional<ConditionDefinition> find(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(byName.get(name.trim()));
    }

    /**
     * @throws NotFoundException if no condition has that name
     */
    public ConditionDefinition get(String name) {
        return find(name).orElseThrow(() -> new NotFoundException("Condition", name));
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    /** All conditions, ordered by name. */
    public List<ConditionDefinition> all() {
        return List.copyOf(byName.values());
    }

    public int size() {
        return byName.size();
    }

    private static String str(Object o) {
        return o == null ? null : o.toString();
    }

    private static List<String> strList(Object o) {
        List<String> out = new ArrayList<>();
        if (o instanceof Collection) {
            for (Object item : (Collection<?>) o) {
                if (item != null) out.add(item.toString());
            }
        }
        return out;
    }
}
