package com.example.dndcombat.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Properties;

/**
 * Engine settings. Defaults come from {@code /combat-engine.yaml} on the classpath; any key can
 * be overridden with a {@code combat.*} system property, e.g. {@code -Dcombat.strictTurnOrder=true}.
 */
public final class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String DEFAULT_RESOURCE = "/combat-engine.yaml";

    public static final String PROP_STRICT_TURN_ORDER = "combat.strictTurnOrder";
    public static final String PROP_MASSIVE_DAMAGE = "combat.massiveDamage";
    public static final String PROP_DICE_SEED = "combat.dice.seed";
    public static final String PROP_ARCHIVE_ENABLED = "combat.archive.enabled";
    public static final String PROP_ARCHIVE_URL = "combat.archive.url";
    public static final String PROP_EVENT_THREAD = "combat.events.threadName";

    public static final String DEFAULT_ARCHIVE_URL = "jdbc:h2:mem:combat_archive;DB_CLOSE_DELAY=-1";

    private final boolean strictTurnOrder;
    private final boolean massiveDamage;
    private final Long diceSeed;
    private final boolean archiveEnabled;
    private final String archiveUrl;
    private final String eventThreadName;

    private EngineConfig(boolean strictTurnOrder, boolean massiveDamage, Long diceSeed,
                         boolean archiveEnabled, String archiveUrl, String eventThreadName) {
        this.strictTurnOrder = strictTurnOrder;
        this.massiveDamage = massiveDamage;
        this.diceSeed = diceSeed;
        this.archiveEnabled = archiveEnabled;
        this.archiveUrl = archiveUrl;
        this.eventThreadName = eventThreadName;
    }

    /** Built-in defaults, no file or system properties consulted. */
    public static EngineConfig defaults() {
        return new EngineConfig(false, true, null, false, DEFAULT_ARCHIVE_URL, "combat-events");
    }

    /** Classpath defaults plus system property overrides. */
    public static EngineConfig load() {
        return load(DEFAULT_RESOURCE, System.getProperties());
    }

    public static EngineConfig load(String resourcePath, Properties overrides) {
        EngineConfig base = defaults();
        try (InputStream in = EngineConfig.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                logger.warn("[EngineConfig] {} not found on classpath, using built-in defaults", resourcePath);
            } else {
                base = fromYaml(in, base);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read engine config " + resourcePath, e);
        }
        EngineConfig cfg = base.withOverrides(overrides);
        logger.info("[EngineConfig] strictTurnOrder={} massiveDamage={} diceSeed={} archive={}",
            cfg.strictTurnOrder, cfg.massiveDamage, cfg.diceSeed, cfg.archiveEnabled ? cfg.archiveUrl : "off");
        return cfg;
    }

    @SuppressWarnings("unchecked")
    static EngineConfig fromYaml(InputStream in, EngineConfig fallback) {
        Map<String, Object> root = new Yaml().load(in);
        if (root == null) return fallback;

        boolean strict = fallback.strictTurnOrder;
        boolean massive = fallback.massiveDamage;
        Long seed = fallback.diceSeed;
        boolean archiveOn = fallback.archiveEnabled;
        String url = fallback.archiveUrl;
        String thread = fallback.eventThreadName;

        Object combatObj = root.get("combat");
        if (combatObj instanceof Map) {
            Map<String, Object> combat = (Map<String, Object>) combatObj;
            strict = bool(combat.get("strictTurnOrder"), strict);
            massive = bool(combat.get("massiveDamage"), massive);
        }
        Object diceObj = root.get("dice");
        if (diceObj instanceof Map) {
            Object s = ((Map<String, Object>) diceObj).get("seed");
            if (s != null) seed = parseLong(s.toString(), "dice.seed");
        }
        Object archiveObj = root.get("archive");
        if (archiveObj instanceof Map) {
            Map<String, Object> archive = (Map<String, Object>) archiveObj;
            archiveOn = bool(archive.get("enabled"), archiveOn);
            if (archive.get("url") != null) url = archive.get("url").toString();
        }
        Object eventsObj = root.get("events");
        if (eventsObj instanceof Map) {
            Object t = ((Map<String, Object>) eventsObj).get("threadName");
            if (t != null) thread = t.toString();
        }
        return new EngineConfig(strict, massive, seed, archiveOn, url, thread);
    }

    EngineConfig withOverrides(Properties props) {
        if (props == null) return this;
        boolean strict = bool(props.getProperty(PROP_STRICT_TURN_ORDER), strictTurnOrder);
        boolean massive = bool(props.getProperty(PROP_MASSIVE_DAMAGE), massiveDamage);
        String seedProp = props.getProperty(PROP_DICE_SEED);
        Long seed = seedProp != null && !seedProp.isBlank() ? parseLong(seedProp, PROP_DICE_SEED) : diceSeed;
        boolean archiveOn = bool(props.getProperty(PROP_ARCHIVE_ENABLED), archiveEnabled);
        String url = props.getProperty(PROP_ARCHIVE_URL, archiveUrl);
        String thread = props.getProperty(PROP_EVENT_THREAD, eventThreadName);
        return new EngineConfig(strict, massive, seed, archiveOn, url, thread);
    }

    private static boolean bool(Object value, boolean fallback) {
        if (value == null) return fallback;
        if (value instanceof Boolean) return (Boolean) value;
        String s = value.toString().trim();
        if (s.isEmpty()) return fallback;
        return Boolean.parseBoolean(s);
    }

    private static Long parseLong(String value, String key) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    public boolean isStrictTurnOrder() { return strictTurnOrder; }
    public boolean isMassiveDamage() { return massiveDamage; }
    public Long getDiceSeed() { return diceSeed; }
    public boolean isArchiveEnabled() { return archiveEnabled; }
    public String getArchiveUrl() { return archiveUrl; }
    public String getEventThreadName() { return eventThreadName; }

    public EngineConfig withStrictTurnOrder(boolean strict) {
        return new EngineConfig(strict, massiveDamage, diceSeed, archiveEnabled, archiveUrl, eventThreadName);
    }

    public EngineConfig withMassiveDamage(boolean enabled) {
        return new EngineConfig(strictTurnOrder, enabled, diceSeed, archiveEnabled, archiveUrl, eventThreadName);
    }

    public EngineConfig withDiceSeed(Long seed) {
        return new EngineConfig(strictTurnOrder, massiveDamage, seed, archiveEnabled, archiveUrl, eventThreadName);
    }

    public EngineConfig withArchive(boolean enabled, String url) {
        return new EngineConfig(strictTurnOrder, massiveDamage, diceSeed, enabled, url, eventThreadName);
    }

    @Override
    public String toString() {
        return "EngineConfig[strictTurnOrder=" + strictTurnOrder + ", massiveDamage=" + massiveDamage
            + ", diceSeed=" + diceSeed + ", archiveEnabled=" + archiveEnabled + ", archiveUrl=" + archiveUrl
            + ", eventThreadName=" + eventThreadName + "]";
    }
}
