package com.csvstruct.expression;

import java.time.ZoneId;
import java.util.Optional;

/**
 * An expression whose result depends on a time zone.
 *
 * <p>The analyzer binds the session time zone with {@link #withTimeZone(String)},
 * which returns a new expression. An expression without a time zone is not
 * resolved and must not be evaluated.
 */
public interface TimeZoneAware {

    Optional<String> timeZoneId();

    /**
     * Returns a copy of this expression bound to the given time zone.
     *
     * @param timeZoneId the zone id, e.g. {@code UTC} or {@code America/Los_Angeles}
     * @return the bound expression
     */
    Expression withTimeZone(String timeZoneId);

    default boolean timeZoneResolved() {
        return timeZoneId().isPresent();
    }

    /**
     * Returns the bound zone.
     *
     * @return the zone
     * @throws IllegalStateException if no time zone is bound
     */
    default ZoneId zoneId() {
        String id = timeZoneId().orElseThrow(
            () -> new IllegalStateException("Expression is not bound to a time zone"));
        return ZoneId.of(id, ZoneId.SHORT_IDS);
    }
}
