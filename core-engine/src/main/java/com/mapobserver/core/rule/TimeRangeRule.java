package com.mapobserver.core.rule;

import com.fasterxml.jackson.databind.JsonNode;
import com.mapobserver.core.model.GeoObject;
import com.mapobserver.core.model.RuleConfig;
import com.mapobserver.core.spi.Criterion;
import com.mapobserver.core.spi.GeoObjectQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Time-of-day window.
 *
 * <pre>
 * "time_range": { "start_time": "09:00", "end_time": "17:30", "timezone": "Europe/Berlin" }
 * </pre>
 *
 * <p>
 * Objects are visible while the current wall-clock time in {@code timezone}
 * lies within {@code [start_time, end_time]}. When {@code end_time} is not
 * after {@code start_time} the window spans midnight, so {@code 22:00} to
 * {@code 06:00} covers the night. Outside the window both phases yield
 * nothing.
 * </p>
 *
 * <p>
 * A missing bound, an unknown zone or a malformed time leaves the window
 * open. Evaluated first (priority 10) as the cheapest hard gate.
 * </p>
 */
public class TimeRangeRule extends AbstractObserverRule {

    private static final Logger LOG = LoggerFactory.getLogger(TimeRangeRule.class);

    public static final String NAME = "time_range";

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm")
            .withResolverStyle(ResolverStyle.STRICT);

    private final Clock clock;
    private final ZoneId defaultZone;

    public TimeRangeRule() {
        this(Clock.systemUTC(), ZoneOffset.UTC);
    }

    /**
     * @param clock       source of the current instant; must not be {@code null}
     * @param defaultZone zone used when the config names none; must not be
     *                    {@code null}
     */
    public TimeRangeRule(Clock clock, ZoneId defaultZone) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.defaultZone = Objects.requireNonNull(defaultZone, "Default zone must not be null");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public GeoObjectQuery applyToQuery(GeoObjectQuery query, RuleConfig config) {
        if (!isWithinTimeRange(config)) {
            return query.andWhere(Criterion.none());
        }
        return query;
    }

    @Override
    public List<GeoObject> applyToObjects(List<GeoObject> objects, RuleConfig config) {
        if (!isWithinTimeRange(config)) {
            return List.of();
        }
        return objects;
    }

    /**
     * Check whether the current time falls inside the configured window.
     *
     * @param config the rule slice
     * @return {@code true} if inside the window or the window cannot be
     *         evaluated
     */
    boolean isWithinTimeRange(RuleConfig config) {
        Optional<String> start = config.parameter("start_time").map(JsonNode::asText);
        Optional<String> end = config.parameter("end_time").map(JsonNode::asText);
        if (start.isEmpty() || end.isEmpty()) {
            return true;
        }

        try {
            ZoneId zone = config.parameter("timezone")
                    .map(JsonNode::asText)
                    .map(ZoneId::of)
                    .orElse(defaultZone);
            LocalTime now = LocalTime.now(clock.withZone(zone));
            LocalTime startTime = LocalTime.parse(start.get(), TIME_FORMAT);
            LocalTime endTime = LocalTime.parse(end.get(), TIME_FORMAT);

            if (!endTime.isAfter(startTime)) {
                // Spans midnight
                return !now.isBefore(startTime) || !now.isAfter(endTime);
            }
            return !now.isBefore(startTime) && !now.isAfter(endTime);
        } catch (DateTimeException e) {
            LOG.debug("Time range {} cannot be evaluated, leaving it open: {}", config, e.getMessage());
            return true;
        }
    }
}
