package com.driftsentinel.scheduler.trigger;

import com.driftsentinel.core.config.ConfigValidationException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Standard five-field cron expression: {@code minute hour day-of-month month
 * day-of-week}.
 *
 * <p>
 * Each field accepts {@code *}, single values, ranges ({@code 1-5}), steps
 * ({@code *}{@code /15}, {@code 10-40/10}) and comma-separated lists. Month and
 * day-of-week also accept three-letter English names; day-of-week {@code 0} and
 * {@code 7} both mean Sunday. When both day fields are restricted a day matches
 * if <em>either</em> field matches, as in Vixie cron. The macros
 * {@code @hourly}, {@code @daily}, {@code @midnight}, {@code @weekly},
 * {@code @monthly}, {@code @yearly} and {@code @annually} are also accepted.
 * </p>
 *
 * <p>
 * Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class CronExpression {

    private static final Map<String, String> MACROS = Map.of(
            "@hourly", "0 * * * *",
            "@daily", "0 0 * * *",
            "@midnight", "0 0 * * *",
            "@weekly", "0 0 * * 0",
            "@monthly", "0 0 1 * *",
            "@yearly", "0 0 1 1 *",
            "@annually", "0 0 1 1 *");

    private static final List<String> MONTH_NAMES = List.of(
            "JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC");
    private static final List<String> DAY_NAMES = List.of(
            "SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT");

    /** Upper bound on the search horizon; covers every Feb 29 pattern. */
    private static final int MAX_YEARS_AHEAD = 8;

    private final String expression;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;
    private final boolean dayOfMonthRestricted;
    private final boolean dayOfWeekRestricted;

    private CronExpression(String expression, BitSet minutes, BitSet hours, BitSet daysOfMonth,
            BitSet months, BitSet daysOfWeek, boolean dayOfMonthRestricted, boolean dayOfWeekRestricted) {
        this.expression = expression;
        this.minutes = minutes;
        this.hours = hours;
        this.daysOfMonth = daysOfMonth;
        this.months = months;
        this.daysOfWeek = daysOfWeek;
        this.dayOfMonthRestricted = dayOfMonthRestricted;
        this.dayOfWeekRestricted = dayOfWeekRestricted;
    }

    // ---------------------------------------------------------------
    // Parsing
    // ---------------------------------------------------------------

    /**
     * Parse a cron expression.
     *
     * @param expression five whitespace-separated fields or a macro
     * @return the parsed expression
     * @throws ConfigValidationException listing every malformed field
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigValidationException("Cron expression must not be blank");
        }
        String trimmed = expression.trim();
        String source = MACROS.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);
        String[] fields = source.split("\\s+");
        if (fields.length != 5) {
            throw new ConfigValidationException("CronExpression", List.of(
                    "'" + expression + "' must have 5 fields, got " + fields.length));
        }

        List<String> errors = new ArrayList<>();
        BitSet minutes = parseField(fields[0], "minute", 0, 59, List.of(), errors);
        BitSet hours = parseField(fields[1], "hour", 0, 23, List.of(), errors);
        BitSet daysOfMonth = parseField(fields[2], "day-of-month", 1, 31, List.of(), errors);
        BitSet months = parseField(fields[3], "month", 1, 12, MONTH_NAMES, errors);
        BitSet daysOfWeek = parseField(fields[4], "day-of-week", 0, 7, DAY_NAMES, errors);
        if (!errors.isEmpty()) {
            throw new ConfigValidationException("CronExpression '" + expression + "'", errors);
        }

        if (daysOfWeek.get(7)) {
            daysOfWeek.set(0);
            daysOfWeek.clear(7);
        }
        return new CronExpression(trimmed, minutes, hours, daysOfMonth, months, daysOfWeek,
                !isWildcard(fields[2]), !isWildcard(fields[4]));
    }

    private static boolean isWildcard(String field) {
        return field.equals("*") || field.equals("?");
    }

    private static BitSet parseField(String field, String name, int min, int max,
            List<String> names, List<String> errors) {
        BitSet bits = new BitSet(max + 1);
        for (String part : field.split(",", -1)) {
            try {
                parsePart(part, min, max, names, bits);
            } catch (IllegalArgumentException e) {
                errors.add(name + " field '" + field + "': " + e.getMessage());
                return bits;
            }
        }
        return bits;
    }

    private static void parsePart(String part, int min, int max, List<String> names, BitSet bits) {
        if (part.isEmpty()) {
            throw new IllegalArgumentException("empty list element");
        }
        String range = part;
        int step = 1;
        int slash = part.indexOf('/');
        if (slash >= 0) {
            range = part.substring(0, slash);
            step = parseNumber(part.substring(slash + 1), 1, max - min + 1, List.of());
        }

        int from;
        int to;
        if (isWildcard(range)) {
            from = min;
            to = max;
        } else {
            int dash = range.indexOf('-');
            if (dash >= 0) {
                from = parseNumber(range.substring(0, dash), min, max, names);
                to = parseNumber(range.substring(dash + 1), min, max, names);
                if (from > to) {
                    throw new IllegalArgumentException("range " + range + " is reversed");
                }
            } else {
                from = parseNumber(range, min, max, names);
                to = slash >= 0 ? max : from;
            }
        }
        for (int v = from; v <= to; v += step) {
            bits.set(v);
        }
    }

    private static int parseNumber(String token, int min, int max, List<String> names) {
        int index = names.indexOf(token.toUpperCase(Locale.ROOT));
        int value;
        if (index >= 0) {
            // month names start at 1, day names at 0
            value = index + min;
        } else {
            try {
                value = Integer.parseInt(token);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("'" + token + "' is not a number", e);
            }
        }
        if (value < min || value > max) {
            throw new IllegalArgumentException(value + " is outside " + min + "-" + max);
        }
        return value;
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    /**
     * @param after reference time; its zone is the zone the fields are read in
     * @return the first matching minute strictly after {@code after}, or empty
     *         if nothing matches within the search horizon (e.g. {@code 0 0 30 2 *})
     */
    public Optional<ZonedDateTime> next(ZonedDateTime after) {
        LocalDateTime t = after.toLocalDateTime().truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        LocalDateTime limit = t.plusYears(MAX_YEARS_AHEAD);

        while (t.isBefore(limit)) {
            if (!months.get(t.getMonthValue())) {
                t = t.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay();
                continue;
            }
            if (!dayMatches(t.toLocalDate())) {
                t = t.toLocalDate().plusDays(1).atStartOfDay();
                continue;
            }
            if (!hours.get(t.getHour())) {
                t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!minutes.get(t.getMinute())) {
                t = t.plusMinutes(1);
                continue;
            }
            ZonedDateTime candidate = ZonedDateTime.of(t, after.getZone());
            // a local time inside a DST gap resolves forward and may repeat an earlier instant
            if (candidate.isAfter(after)) {
                return Optional.of(candidate);
            }
            t = t.plusMinutes(1);
        }
        return Optional.empty();
    }

    private boolean dayMatches(LocalDate date) {
        boolean dom = daysOfMonth.get(date.getDayOfMonth());
        boolean dow = daysOfWeek.get(date.getDayOfWeek().getValue() % 7);
        if (dayOfMonthRestricted && dayOfWeekRestricted) {
            return dom || dow;
        }
        return dom && dow;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronExpression that)) return false;
        return expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
