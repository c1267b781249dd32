package com.tessera.query.time;

import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One grammar rule of the date range language: a pattern matched against the
 * lower-cased, whitespace-collapsed expression, and the function that turns a
 * match into an absolute range anchored at "now".
 */
final class DateRangeRule {

    @FunctionalInterface
    interface Resolution {
        ResolvedDateRange resolve(Matcher match, ZonedDateTime now);
    }

    private final String name;
    private final Pattern pattern;
    private final Resolution resolution;

    DateRangeRule(String name, String regex, Resolution resolution) {
        this.name = name;
        this.pattern = Pattern.compile(regex);
        this.resolution = resolution;
    }

    String getName() {
        return name;
    }

    /**
     * Applies the rule, or returns empty if the expression does not match it.
     */
    Optional<ResolvedDateRange> apply(String expression, ZonedDateTime now) {
        Matcher match = pattern.matcher(expression);
        if (!match.matches()) {
            return Optional.empty();
        }
        return Optional.of(resolution.resolve(match, now));
    }
}
