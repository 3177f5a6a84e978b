package org.Aayush.schedule.directive;

import org.Aayush.schedule.time.TimeMapException;

import java.util.Map;

/**
 * Fixed month-name table for date records.
 *
 * <p>Names are upper-case and matched case-sensitively. Regional spellings
 * {@code MAI}, {@code JLY}, {@code OKT} and {@code DES} map to the same months as
 * {@code MAY}, {@code JUL}, {@code OCT} and {@code DEC}.</p>
 */
public final class MonthNames {

    private static final Map<String, Integer> MONTH_INDICES = Map.ofEntries(
            Map.entry("JAN", 1),
            Map.entry("FEB", 2),
            Map.entry("MAR", 3),
            Map.entry("APR", 4),
            Map.entry("MAI", 5),
            Map.entry("MAY", 5),
            Map.entry("JUN", 6),
            Map.entry("JUL", 7),
            Map.entry("JLY", 7),
            Map.entry("AUG", 8),
            Map.entry("SEP", 9),
            Map.entry("OCT", 10),
            Map.entry("OKT", 10),
            Map.entry("NOV", 11),
            Map.entry("DEC", 12),
            Map.entry("DES", 12)
    );

    private MonthNames() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Resolves a month token to its month number.
     *
     * @param name month token.
     * @return month in {@code [1, 12]}.
     * @throws TimeMapException with {@link TimeMapException#REASON_UNKNOWN_MONTH_NAME}
     *                          when the token is not in the table.
     */
    public static int monthIndex(String name) {
        Integer month = name == null ? null : MONTH_INDICES.get(name);
        if (month == null) {
            throw new TimeMapException(
                    TimeMapException.REASON_UNKNOWN_MONTH_NAME,
                    "unknown month name: " + name
            );
        }
        return month;
    }

    /**
     * Immutable view of the full table.
     */
    public static Map<String, Integer> monthIndices() {
        return MONTH_INDICES;
    }
}
