package com.tessera.query.time;

import com.tessera.error.InvalidDateRangeException;
import com.tessera.query.DateRangeExpression;
import com.tessera.query.TimeGranularity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves date range expressions into absolute, inclusive intervals.
 *
 * Supported grammar, tried in order (first match wins):
 * <pre>
 * today | yesterday | tomorrow
 * (this|last|next) (week|month|quarter|year)
 * last N (day|week|month|quarter|year)[s]      N &gt;= 1
 * YYYY-MM-DD                                    that whole day
 * [start, end]                                  literal interval
 * </pre>
 *
 * Named periods resolve to the full calendar period in the configured zone,
 * ending one millisecond before the next period starts. {@code last N unit}
 * resolves to {@code [now - N unit, now]} using calendar arithmetic for months,
 * quarters and years. An expression that matches no rule is always an error;
 * it is never treated as "no date filter".
 *
 * Resolution depends only on the expression, the zone and the supplied "now".
 * Time granularity plays no part in it.
 */
public class DateRangeResolver {

    private static final Logger log = LoggerFactory.getLogger(DateRangeResolver.class);

    private static final Pattern DATE_ONLY = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final DateTimeFormatter SPACED_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    private final ZoneId zone;
    private final DayOfWeek weekStart;
    private final List<DateRangeRule> rules;

    public DateRangeResolver(ZoneId zone, DayOfWeek weekStart) {
        this.zone = zone;
        this.weekStart = weekStart;
        this.rules = List.of(
            new DateRangeRule("relative day", "(today|yesterday|tomorrow)", (m, now) -> {
                int offset = switch (m.group(1)) {
                    case "yesterday" -> -1;
                    case "tomorrow" -> 1;
                    default -> 0;
                };
                return period(now, CalendarUnit.DAY, offset);
            }),
            new DateRangeRule("named period", "(this|last|next) (week|month|quarter|year)", (m, now) -> {
                int offset = switch (m.group(1)) {
                    case "last" -> -1;
                    case "next" -> 1;
                    default -> 0;
                };
                return period(now, CalendarUnit.fromWord(m.group(2)), offset);
            }),
            new DateRangeRule("trailing window", "last (\\d+) (day|week|month|quarter|year)s?", (m, now) ->
                trailing(now, m.group(1), CalendarUnit.fromWord(m.group(2)))),
            new DateRangeRule("single date", "(\\d{4}-\\d{2}-\\d{2})", (m, now) -> {
                LocalDate date = parseDate(m.group(1));
                return new ResolvedDateRange(startOfDay(date), endOfDay(date));
            })
        );
    }

    public DateRangeResolver() {
        this(ZoneId.of("UTC"), DayOfWeek.MONDAY);
    }

    public ZoneId getZone() {
        return zone;
    }

    /**
     * Resolves a date range clause.
     *
     * @param dateRange the expression or literal interval
     * @param now the reference instant relative expressions are anchored to
     * @return the absolute inclusive range
     * @throws InvalidDateRangeException if the expression matches no rule or the
     *         resulting interval is inverted
     */
    public ResolvedDateRange resolve(DateRangeExpression dateRange, Instant now) {
        if (dateRange.isInterval()) {
            return resolveInterval(dateRange.getStart(), dateRange.getEnd());
        }
        return resolve(dateRange.getExpression(), now);
    }

    /**
     * Same as {@link #resolve(DateRangeExpression, Instant)}. The granularity is
     * accepted for call-site symmetry with time dimensions and deliberately
     * ignored: it buckets rows later and never alters the range.
     */
    public ResolvedDateRange resolve(DateRangeExpression dateRange, Instant now, TimeGranularity granularity) {
        ResolvedDateRange resolved = resolve(dateRange, now);
        log.debug("Resolved date range '{}' (granularity {}) to {}", dateRange, granularity, resolved);
        return resolved;
    }

    /**
     * Resolves a single relative or absolute expression.
     *
     * @throws InvalidDateRangeException if the expression matches no rule
     */
    public ResolvedDateRange resolve(String expression, Instant now) {
        if (expression == null || expression.trim().isEmpty()) {
            throw new InvalidDateRangeException("Date range expression must not be empty", expression);
        }
        String normalized = expression.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        ZonedDateTime anchor = now.atZone(zone);

        for (DateRangeRule rule : rules) {
            Optional<ResolvedDateRange> resolved;
            try {
                resolved = rule.apply(normalized, anchor);
            } catch (DateTimeException | ArithmeticException e) {
                throw new InvalidDateRangeException("Date range is out of the supported calendar range", expression, e);
            }
            if (resolved.isPresent()) {
                log.debug("Date range '{}' matched rule '{}': {}", expression, rule.getName(), resolved.get());
                return resolved.get();
            }
        }
        throw new InvalidDateRangeException("Unsupported date range expression", expression);
    }

    /**
     * Resolves a literal {@code [start, end]} interval. Date-only bounds cover
     * the whole day: the start at midnight, the end at the last millisecond.
     *
     * @throws InvalidDateRangeException if either bound is unparseable or the
     *         interval is inverted
     */
    public ResolvedDateRange resolveInterval(String start, String end) {
        Instant from = toInstant(start, false);
        Instant to = toInstant(end, true);
        if (from.isAfter(to)) {
            throw new InvalidDateRangeException("Date range start is after its end", "[" + start + ", " + end + "]");
        }
        return new ResolvedDateRange(from, to);
    }

    /**
     * Converts a filter or range boundary value to an instant.
     *
     * Accepts {@link Instant}, epoch milliseconds, ISO dates, ISO date-times
     * (with or without offset) and {@code yyyy-MM-dd HH:mm[:ss]}. Values without
     * an offset are read in the configured zone.
     *
     * @param value the boundary value
     * @param endOfDay whether a date-only value stands for the end of that day
     * @throws InvalidDateRangeException if the value is not a recognisable point in time
     */
    public Instant toInstant(Object value, boolean endOfDay) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof Number) {
            return Instant.ofEpochMilli(((Number) value).longValue());
        }
        if (!(value instanceof String)) {
            throw new InvalidDateRangeException("Not a date value", String.valueOf(value));
        }
        String text = ((String) value).trim();
        if (DATE_ONLY.matcher(text).matches()) {
            LocalDate date = parseDate(text);
            return endOfDay ? endOfDay(date) : startOfDay(date);
        }
        Optional<Instant> parsed = parseOffsetDateTime(text)
            .or(() -> parseLocalDateTime(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME))
            .or(() -> parseLocalDateTime(text, SPACED_DATE_TIME));
        return parsed.orElseThrow(() -> new InvalidDateRangeException("Not a date value", text));
    }

    private Optional<Instant> parseOffsetDateTime(String text) {
        try {
            return Optional.of(OffsetDateTime.parse(text).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private Optional<Instant> parseLocalDateTime(String text, DateTimeFormatter formatter) {
        try {
            return Optional.of(LocalDateTime.parse(text, formatter).atZone(zone).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private ResolvedDateRange period(ZonedDateTime now, CalendarUnit unit, int offset) {
        ZonedDateTime start = unit.plus(periodStart(now, unit), offset);
        ZonedDateTime next = unit.plus(start, 1);
        return new ResolvedDateRange(start.toInstant(), next.toInstant().minusMillis(1));
    }

    private ResolvedDateRange trailing(ZonedDateTime now, String count, CalendarUnit unit) {
        long n;
        try {
            n = Long.parseLong(count);
        } catch (NumberFormatException e) {
            throw new InvalidDateRangeException("Window length is too large", "last " + count, e);
        }
        if (n < 1) {
            throw new InvalidDateRangeException("Window length must be at least 1", "last " + count);
        }
        return new ResolvedDateRange(unit.plus(now, -n).toInstant(), now.toInstant());
    }

    private ZonedDateTime periodStart(ZonedDateTime now, CalendarUnit unit) {
        LocalDate date = now.toLocalDate();
        LocalDate start = switch (unit) {
            case DAY -> date;
            case WEEK -> date.with(TemporalAdjusters.previousOrSame(weekStart));
            case MONTH -> date.withDayOfMonth(1);
            case QUARTER -> date.withMonth(((date.getMonthValue() - 1) / 3) * 3 + 1).withDayOfMonth(1);
            case YEAR -> date.withDayOfYear(1);
        };
        return start.atStartOfDay(zone);
    }

    private Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(zone).toInstant();
    }

    private Instant endOfDay(LocalDate date) {
        return date.plusDays(1).atStartOfDay(zone).toInstant().minusMillis(1);
    }

    private static LocalDate parseDate(String text) {
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new InvalidDateRangeException("Not a calendar date", text, e);
        }
    }

    /**
     * Calendar units of the grammar; quarters are three calendar months.
     */
    enum CalendarUnit {
        DAY,
        WEEK,
        MONTH,
        QUARTER,
        YEAR;

        static CalendarUnit fromWord(String word) {
            return valueOf(word.toUpperCase(Locale.ROOT));
        }

        ZonedDateTime plus(ZonedDateTime time, long amount) {
            return switch (this) {
                case DAY -> time.plusDays(amount);
                case WEEK -> time.plusWeeks(amount);
                case MONTH -> time.plusMonths(amount);
                case QUARTER -> time.plusMonths(Math.multiplyExact(amount, 3L));
                case YEAR -> time.plusYears(amount);
            };
        }
    }
}
