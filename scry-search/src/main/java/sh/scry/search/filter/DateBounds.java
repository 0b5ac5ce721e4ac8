// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search.filter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

import sh.scry.core.error.InvalidFilterException;

/**
 * Converts date filter inputs to epoch seconds.
 *
 * <p>Accepted forms: a plain integer (already epoch seconds), an ISO date
 * ({@code 2025-01-31}, UTC midnight), an ISO date-time without offset (UTC), or an
 * ISO date-time with {@code Z} or an explicit offset.
 */
public final class DateBounds {

    private DateBounds() {
    }

    /**
     * @param field filter name, for error messages
     * @return epoch seconds as a decimal string, the form backend {@code BigInt} fields compare against
     * @throws InvalidFilterException if the value is blank or not a recognised date
     */
    public static String toEpochSeconds(final String field, final String value) {
        final String s = value == null ? "" : value.trim();
        if (s.isEmpty()) {
            throw new InvalidFilterException(field, "empty date");
        }
        if (isInteger(s)) {
            return Long.toString(Long.parseLong(s));
        }
        try {
            if (s.length() == 10) {
                return Long.toString(LocalDate.parse(s).atStartOfDay().toEpochSecond(ZoneOffset.UTC));
            }
            if (hasOffset(s)) {
                return Long.toString(OffsetDateTime.parse(s).toEpochSecond());
            }
            return Long.toString(LocalDateTime.parse(s).toEpochSecond(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            throw new InvalidFilterException(field, "unrecognised date '" + s + "'", e);
        }
    }

    private static boolean isInteger(final String s) {
        final int start = s.charAt(0) == '-' ? 1 : 0;
        if (start == s.length() || s.length() - start > 18) {
            return false;
        }
        for (int i = start; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasOffset(final String s) {
        final char last = s.charAt(s.length() - 1);
        if (last == 'Z' || last == 'z') {
            return true;
        }
        final int time = s.indexOf('T');
        if (time < 0) {
            return false;
        }
        final String clock = s.substring(time);
        return clock.indexOf('+') >= 0 || clock.indexOf('-') >= 0;
    }
}
