package com.tessera.funnel;

import com.tessera.error.InvalidFunnelException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.Period;
import java.time.ZoneId;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An ISO-8601 duration such as {@code P7D}, {@code PT12H} or {@code P1M2DT3H}.
 *
 * Date components (years, months, weeks, days) are applied with calendar
 * arithmetic in the compiler's zone; time components are exact.
 */
public final class ConversionWindow {

    private static final Pattern ISO_DURATION = Pattern.compile(
        "P(?:(\\d+)Y)?(?:(\\d+)M)?(?:(\\d+)W)?(?:(\\d+)D)?"
            + "(?:T(?:(\\d+)H)?(?:(\\d+)M)?(?:(\\d+(?:\\.\\d{1,9})?)S)?)?",
        Pattern.CASE_INSENSITIVE);

    private final String expression;
    private final Period period;
    private final Duration duration;

    private ConversionWindow(String expression, Period period, Duration duration) {
        this.expression = expression;
        this.period = period;
        this.duration = duration;
    }

    /**
     * @throws InvalidFunnelException if the text is not a positive ISO-8601 duration
     */
    public static ConversionWindow parse(String expression) {
        if (expression == null || expression.trim().isEmpty()) {
            throw new InvalidFunnelException("Duration must not be empty");
        }
        String text = expression.trim();
        Matcher matcher = ISO_DURATION.matcher(text);
        if (!matcher.matches() || text.endsWith("T") || text.endsWith("t")) {
            throw new InvalidFunnelException("Invalid ISO-8601 duration: '" + expression + "'");
        }

        try {
            Period period = Period.of(
                    toInt(matcher.group(1)),
                    toInt(matcher.group(2)),
                    Math.addExact(Math.multiplyExact(toInt(matcher.group(3)), 7), toInt(matcher.group(4))));
            Duration duration = Duration.ofHours(toInt(matcher.group(5)))
                .plusMinutes(toInt(matcher.group(6)));
            if (matcher.group(7) != null) {
                duration = duration.plusNanos(
                    new BigDecimal(matcher.group(7)).movePointRight(9).longValueExact());
            }
            if (period.isZero() && duration.isZero()) {
                throw new InvalidFunnelException("Duration must be positive: '" + expression + "'");
            }
            return new ConversionWindow(text.toUpperCase(), period, duration);
        } catch (ArithmeticException | NumberFormatException e) {
            throw new InvalidFunnelException("Duration out of range: '" + expression + "'", e);
        }
    }

    public static ConversionWindow ofDuration(Duration duration) {
        return new ConversionWindow(duration.toString(), Period.ZERO, duration);
    }

    private static int toInt(String group) {
        return group == null ? 0 : Integer.parseInt(group);
    }

    /**
     * Latest instant still inside the window opened at {@code from}.
     */
    public Instant deadline(Instant from, ZoneId zone) {
        return from.atZone(zone).plus(period).toInstant().plus(duration);
    }

    /**
     * True when {@code to} lies strictly beyond the window opened at {@code from}.
     */
    public boolean isExceeded(Instant from, Instant to, ZoneId zone) {
        return to.isAfter(deadline(from, zone));
    }

    public Period getPeriod() {
        return period;
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConversionWindow)) return false;
        ConversionWindow that = (ConversionWindow) o;
        return period.equals(that.period) && duration.equals(that.duration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(period, duration);
    }

    @Override
    public String toString() {
        return expression;
    }
}
