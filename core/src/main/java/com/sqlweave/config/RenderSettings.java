package com.sqlweave.config;

import com.sqlweave.scope.Dialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Process-wide rendering settings.
 *
 * <ul>
 *   <li>{@code sqlweave.dialect} - dialect used for identifier quoting when a
 *       scope carries no database handle (default {@code mysql})</li>
 *   <li>{@code sqlweave.timezone} - zone used to print zone-less instants such
 *       as {@link java.time.Instant} and {@link java.util.Date} (default
 *       {@code UTC})</li>
 * </ul>
 *
 * <p>Initial values come from system properties. Set once at startup via
 * {@link #configure(Dialect, ZoneId)}, read everywhere via the getters.
 */
public final class RenderSettings {

    private static final Logger logger = LoggerFactory.getLogger(RenderSettings.class);

    public static final String DIALECT_PROPERTY = "sqlweave.dialect";
    public static final String TIMEZONE_PROPERTY = "sqlweave.timezone";

    private static volatile Dialect defaultDialect = Dialect.parse(System.getProperty(DIALECT_PROPERTY));
    private static volatile ZoneId timeZone = parseZone(System.getProperty(TIMEZONE_PROPERTY));

    public static void configure(Dialect dialect, ZoneId zone) {
        if (dialect == null || zone == null) {
            throw new IllegalArgumentException("dialect and zone must not be null");
        }
        defaultDialect = dialect;
        timeZone = zone;
        logger.info("Render settings configured: dialect={}, timezone={}", dialect, zone);
    }

    public static Dialect getDefaultDialect() {
        return defaultDialect;
    }

    public static ZoneId getTimeZone() {
        return timeZone;
    }

    /**
     * Parse a time zone id.
     *
     * @param value a zone id such as "UTC" or "Europe/Berlin", or null for UTC
     * @return the parsed zone
     * @throws IllegalArgumentException if value is not a valid zone id
     */
    public static ZoneId parseZone(String value) {
        if (value == null || value.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(value.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown time zone: '%s'".formatted(value), e);
        }
    }

    /**
     * Reset to defaults. Intended for tests only.
     */
    static void reset() {
        defaultDialect = Dialect.MYSQL;
        timeZone = ZoneOffset.UTC;
    }

    private RenderSettings() {}
}
