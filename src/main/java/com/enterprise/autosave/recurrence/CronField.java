package com.enterprise.autosave.recurrence;

import java.util.Locale;

/**
 * The five fields of a recurrence expression, in expression order, with their valid domains
 */
enum CronField {
    
    MINUTE("minute", 0, 59),
    HOUR("hour", 0, 23),
    DAY_OF_MONTH("day-of-month", 1, 31),
    MONTH("month", 1, 12,
        "JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC"),
    DAY_OF_WEEK("day-of-week", 0, 6,
        "SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT");
    
    private final String displayName;
    private final int min;
    private final int max;
    private final String[] names;
    
    CronField(String displayName, int min, int max, String... names) {
        this.displayName = displayName;
        this.min = min;
        this.max = max;
        this.names = names;
    }
    
    String getDisplayName() { return displayName; }
    int getMin() { return min; }
    int getMax() { return max; }
    
    boolean inRange(int value) {
        return value >= min && value <= max;
    }
    
    /**
     * Resolves a three-letter alias (JAN, MON, ...) to its numeric value, or -1 if unknown
     */
    int valueOfName(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        for (int i = 0; i < names.length; i++) {
            if (names[i].equals(upper)) {
                return min + i;
            }
        }
        return -1;
    }
}
