package com.scrapehub.jobs.util;

import org.springframework.scheduling.support.CronExpression;

import java.util.Locale;
import java.util.Set;

/**
 * Parses job trigger expressions. Jobs use the classic five-field form
 * (minute hour day-of-month month day-of-week); a leading seconds field and the
 * {@code @hourly}-style macros are accepted as well.
 */
public final class CronExpressions {
    private static final Set<String> MACROS = Set.of(
        "@yearly", "@annually", "@monthly", "@weekly", "@daily", "@midnight", "@hourly"
    );

    private CronExpressions() {
    }

    /**
     * @throws IllegalArgumentException when the expression is blank or not a valid cron pattern
     */
    public static CronExpression parse(String expression) {
        return CronExpression.parse(toSpringPattern(expression));
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** Spring cron patterns always carry a seconds field. */
    public static String toSpringPattern(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression must not be blank");
        }
        String trimmed = expression.trim();
        if (trimmed.startsWith("@")) {
            String macro = trimmed.toLowerCase(Locale.ROOT);
            if (!MACROS.contains(macro)) {
                throw new IllegalArgumentException("Unsupported cron macro '" + trimmed + "'");
            }
            return macro;
        }
        String[] fields = trimmed.split("\\s+");
        if (fields.length == 5) {
            return "0 " + String.join(" ", fields);
        }
        if (fields.length == 6) {
            return String.join(" ", fields);
        }
        throw new IllegalArgumentException(
            "Cron expression '" + trimmed + "' must have 5 or 6 fields, found " + fields.length
        );
    }
}
