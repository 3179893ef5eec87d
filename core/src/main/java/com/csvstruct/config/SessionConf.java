package com.csvstruct.config;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Session-level configuration consulted when CSV expressions are bound.
 *
 * <p>Holds engine settings that are not per-expression options: the session time
 * zone used to bind time zone aware expressions, and the default name of the
 * corrupt-record column. Keys follow Spark's configuration names so that settings
 * carried over from a Spark session keep their meaning.
 *
 * <p>Instances are immutable. The active configuration is set once via
 * {@link #configure(SessionConf)} and read everywhere via {@link #active()}.
 */
public final class SessionConf {

    public static final String SESSION_TIME_ZONE = "spark.sql.session.timeZone";
    public static final String COLUMN_NAME_OF_CORRUPT_RECORD = "spark.sql.columnNameOfCorruptRecord";

    public static final String DEFAULT_CORRUPT_RECORD_COLUMN = "_corrupt_record";

    private static volatile SessionConf active = new SessionConf(Collections.emptyMap());

    private final Map<String, String> settings;

    private SessionConf(Map<String, String> overrides) {
        Map<String, String> merged = new HashMap<>(getDefaults());
        merged.putAll(overrides);
        this.settings = Collections.unmodifiableMap(merged);
    }

    /**
     * Get the default configuration values.
     *
     * @return Map of default configuration key-value pairs
     */
    public static Map<String, String> getDefaults() {
        Map<String, String> defaults = new HashMap<>();
        defaults.put(SESSION_TIME_ZONE, TimeZone.getDefault().getID());
        defaults.put(COLUMN_NAME_OF_CORRUPT_RECORD, DEFAULT_CORRUPT_RECORD_COLUMN);
        return defaults;
    }

    /**
     * Creates a configuration with the given settings layered over the defaults.
     *
     * @param overrides settings that replace defaults
     * @return the configuration
     * @throws IllegalArgumentException if the session time zone is not a valid zone id
     */
    public static SessionConf of(Map<String, String> overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        SessionConf conf = new SessionConf(overrides);
        try {
            ZoneId.of(conf.sessionTimeZone(), ZoneId.SHORT_IDS);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException(
                "Invalid value for " + SESSION_TIME_ZONE + ": '" + conf.sessionTimeZone() + "'", e);
        }
        return conf;
    }

    public static SessionConf active() {
        return active;
    }

    public static void configure(SessionConf conf) {
        active = Objects.requireNonNull(conf, "conf must not be null");
    }

    /**
     * Reset to defaults. Intended for tests only.
     */
    public static void reset() {
        active = new SessionConf(Collections.emptyMap());
    }

    public String get(String key) {
        return settings.get(key);
    }

    public String sessionTimeZone() {
        return settings.get(SESSION_TIME_ZONE);
    }

    public String columnNameOfCorruptRecord() {
        return settings.get(COLUMN_NAME_OF_CORRUPT_RECORD);
    }

    @Override
    public String toString() {
        return "SessionConf" + settings;
    }
}
