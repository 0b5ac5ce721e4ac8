// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts hosted-gateway API keys, bearer tokens and {@code "apiKey"} JSON values</li>
 * <li>Truncates excessively long logs to prevent memory issues</li>
 * </ul>
 */
public final class LogSanitizer {

    /**
     * Maximum length for sanitized log output. Logs exceeding this will be truncated.
     */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final String REDACTED = "***[REDACTED]***";

    /** Hosted subgraph gateways embed the key as a path segment: {@code /api/<key>/subgraphs/...}. */
    private static final Pattern GATEWAY_KEY_PATTERN =
            Pattern.compile("/api/[^/\\s\"]+/subgraphs");

    private static final Pattern BEARER_PATTERN =
            Pattern.compile("(?i)bearer\\s+[^\\s\",}]+");

    private static final Pattern API_KEY_PATTERN =
            Pattern.compile("\"apiKey\"\\s*:\\s*\"[^\"]*\"");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("/api/")) {
            sanitized = GATEWAY_KEY_PATTERN.matcher(sanitized).replaceAll("/api/" + REDACTED + "/subgraphs");
        }

        if (containsIgnoreCase(sanitized, "bearer")) {
            sanitized = BEARER_PATTERN.matcher(sanitized).replaceAll("Bearer " + REDACTED);
        }

        if (sanitized.contains("\"apiKey\"")) {
            sanitized = API_KEY_PATTERN.matcher(sanitized).replaceAll("\"apiKey\":\"" + REDACTED + "\"");
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }

    private static boolean containsIgnoreCase(final String haystack, final String needle) {
        return haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
