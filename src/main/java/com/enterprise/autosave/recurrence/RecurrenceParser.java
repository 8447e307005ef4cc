package com.enterprise.autosave.recurrence;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.enterprise.autosave.exception.RecurrenceParseException;
import com.enterprise.autosave.exception.RecurrenceParseException.ErrorKind;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parses five-field cron-style recurrence expressions (minute, hour, day-of-month, month,
 * day-of-week) into {@link RecurrenceDescriptor}s bound to a fixed timezone.
 *
 * <p>Each field is a comma separated list of items. An item is {@code *}, a value, a range
 * {@code a-b}, optionally followed by a step {@code /n}; {@code a/n} means from {@code a} to the
 * end of the field's domain. Months and days of week also accept three-letter English names.
 * Day of week 0 is Sunday.
 *
 * <p>Fields are checked and normalized here, then handed to a cron-utils UNIX parser. When both
 * day fields are restricted a day matches either one; when either starts with {@code *} a day
 * must match both.
 */
public class RecurrenceParser {
    
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NUMBER = Pattern.compile("\\d{1,9}");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern NAME = Pattern.compile("[A-Za-z]{3}");
    private static final int FIELD_COUNT = 5;
    private static final int LEAP_YEAR = 2028;
    
    private final ZoneId zone;
    private final CronParser cronParser;
    
    public RecurrenceParser(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "Zone cannot be null");
        this.cronParser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    }
    
    public ZoneId getZone() {
        return zone;
    }
    
    /**
     * Parse and validate an expression. An expression that can never fire is rejected.
     */
    public RecurrenceDescriptor parse(String expression) throws RecurrenceParseException {
        if (expression == null || expression.isBlank()) {
            throw new RecurrenceParseException(ErrorKind.MALFORMED_EXPRESSION, expression, null,
                "expression is empty");
        }
    
        String trimmed = expression.trim();
        String[] parts = WHITESPACE.split(trimmed);
        if (parts.length != FIELD_COUNT) {
            throw new RecurrenceParseException(ErrorKind.MALFORMED_EXPRESSION, trimmed, null,
                String.format("expected %d fields but found %d", FIELD_COUNT, parts.length));
        }
    
        CronField[] fields = CronField.values();
        String[] f = new String[FIELD_COUNT];
        for (int i = 0; i < FIELD_COUNT; i++) {
            f[i] = normalizeField(fields[i], parts[i], trimmed);
        }
        String normalized = String.join(" ", f);
    
        String minute = f[0];
        String hour = f[1];
        String dayOfMonth = f[2];
        String month = f[3];
        String dayOfWeek = f[4];
        boolean dayOfMonthStar = parts[2].startsWith("*");
        boolean dayOfWeekStar = parts[4].startsWith("*");
    
        List<ExecutionTime> schedules = new ArrayList<>();
        ExecutionTime dayOfWeekFilter = null;
        boolean dayOfMonthFeasible = hasMatchingDate(dayOfMonth, month, trimmed);
    
        if (dayOfWeek.equals("*") || dayOfMonth.equals("*")) {
            if (dayOfMonthFeasible) {
                schedules.add(schedule(trimmed, minute, hour, dayOfMonth, month, dayOfWeek));
            }
        } else if (dayOfMonthStar || dayOfWeekStar) {
            if (dayOfMonthFeasible) {
                schedules.add(schedule(trimmed, minute, hour, dayOfMonth, month, "*"));
                dayOfWeekFilter = schedule(trimmed, "0", "0", "*", "*", dayOfWeek);
            }
        } else {
            if (dayOfMonthFeasible) {
                schedules.add(schedule(trimmed, minute, hour, dayOfMonth, month, "*"));
            }
            schedules.add(schedule(trimmed, minute, hour, "*", month, dayOfWeek));
        }
    
        RecurrenceDescriptor descriptor = new RecurrenceDescriptor(trimmed, normalized, zone, schedules, dayOfWeekFilter);
        if (schedules.isEmpty() || descriptor.findNextFire(Instant.EPOCH).isEmpty()) {
            throw new RecurrenceParseException(ErrorKind.FIELD_OUT_OF_RANGE, trimmed,
                CronField.DAY_OF_MONTH.getDisplayName(), "no matching date exists, expression would never fire");
        }
        return descriptor;
    }
    
    /**
     * Earliest instant strictly after {@code from} matching the descriptor
     */
    public Instant nextFireAfter(RecurrenceDescriptor descriptor, Instant from) {
        return descriptor.nextFireAfter(from);
    }
    
    // Day and month matchers that always fire, so checking dates against them terminates
    private boolean hasMatchingDate(String dayOfMonth, String month, String expression) throws RecurrenceParseException {
        ExecutionTime days = schedule(expression, "0", "0", dayOfMonth, "*", "*");
        ExecutionTime months = schedule(expression, "0", "0", "1", month, "*");
        for (LocalDate date = LocalDate.of(LEAP_YEAR, 1, 1); date.getYear() == LEAP_YEAR; date = date.plusDays(1)) {
            if (RecurrenceDescriptor.firesAt(days, date.atStartOfDay())
                    && RecurrenceDescriptor.firesAt(months, date.withDayOfMonth(1).atStartOfDay())) {
                return true;
            }
        }
        return false;
    }
    
    private ExecutionTime schedule(String expression, String... fields) throws RecurrenceParseException {
        try {
            return ExecutionTime.forCron(cronParser.parse(String.join(" ", fields)));
        } catch (IllegalArgumentException e) {
            throw new RecurrenceParseException(ErrorKind.MALFORMED_EXPRESSION, expression, null, e.getMessage());
        }
    }
    
    /**
     * Checks one field and rewrites it into plain numeric cron syntax: names become numbers,
     * {@code a/n} and inner {@code *} become explicit ranges.
     */
    private String normalizeField(CronField field, String text, String expression) throws RecurrenceParseException {
        if (text.equals("*")) {
            return text;
        }
        List<String> items = new ArrayList<>();
    
        for (String item : text.split(",", -1)) {
            if (item.isEmpty()) {
                throw malformed(field, expression, "empty list item in '" + text + "'");
            }
    
            String range = item;
            String step = "";
            int slash = item.indexOf('/');
            if (slash >= 0) {
                range = item.substring(0, slash);
                step = "/" + parseStep(field, item.substring(slash + 1), expression);
            }
    
            int low;
            int high;
            if (range.equals("*")) {
                low = field.getMin();
                high = field.getMax();
            } else {
                int dash = range.indexOf('-');
                if (dash >= 0) {
                    low = parseValue(field, range.substring(0, dash), expression);
                    high = parseValue(field, range.substring(dash + 1), expression);
                    if (low > high) {
                        throw malformed(field, expression, "reversed range '" + range + "'");
                    }
                } else {
                    low = parseValue(field, range, expression);
                    high = slash >= 0 ? field.getMax() : low;
                }
            }
    
            items.add(low == high && step.isEmpty() ? Integer.toString(low) : low + "-" + high + step);
        }
        return String.join(",", items);
    }
    
    private int parseStep(CronField field, String text, String expression) throws RecurrenceParseException {
        if (!NUMBER.matcher(text).matches()) {
            throw malformed(field, expression, "invalid step '" + text + "'");
        }
        int step = Integer.parseInt(text);
        if (step == 0) {
            throw malformed(field, expression, "step must be greater than 0");
        }
        return step;
    }
    
    private int parseValue(CronField field, String text, String expression) throws RecurrenceParseException {
        int value;
        if (NUMBER.matcher(text).matches()) {
            value = Integer.parseInt(text);
        } else if (NAME.matcher(text).matches() && field.valueOfName(text) >= 0) {
            return field.valueOfName(text);
        } else if (DIGITS.matcher(text).matches()) {
            // Too many digits to be anything but out of range
            value = Integer.MAX_VALUE;
        } else {
            throw malformed(field, expression, "invalid value '" + text + "'");
        }
    
        if (!field.inRange(value)) {
            throw new RecurrenceParseException(ErrorKind.FIELD_OUT_OF_RANGE, expression, field.getDisplayName(),
                String.format("value %s outside %d-%d", text, field.getMin(), field.getMax()));
        }
        return value;
    }
    
    private static RecurrenceParseException malformed(CronField field, String expression, String message) {
        return new RecurrenceParseException(ErrorKind.MALFORMED_EXPRESSION, expression, field.getDisplayName(), message);
    }
}
