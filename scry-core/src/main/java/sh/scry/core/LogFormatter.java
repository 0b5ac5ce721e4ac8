// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core;

import static sh.scry.core.AnsiColors.*;

import java.util.Collection;

/**
 * Log formatter for scry with colored, structured output.
 *
 * <p>
 * Produces consistent single-line output for backend queries, semantic relevance
 * calls, schema compatibility rewrites and search planning. Status symbols (✓ ✗ ○)
 * indicate success, failure and skipped work; every line uses the
 * {@code [OPERATION]} style.
 *
 * <h2>Log Types</h2>
 * <table border="1">
 * <tr><th>Method</th><th>Format</th><th>Use Case</th></tr>
 * <tr><td>formatQuery</td><td>[QUERY]</td><td>Successful GraphQL round trips</td></tr>
 * <tr><td>formatQueryError</td><td>✗ [QUERY-ERROR]</td><td>Transport or GraphQL failures</td></tr>
 * <tr><td>formatSemantic</td><td>[SEMANTIC]</td><td>Relevance service calls</td></tr>
 * <tr><td>formatShim</td><td>[SHIM]</td><td>Schema compatibility rules being activated</td></tr>
 * <tr><td>formatSearch</td><td>✓ [SEARCH]</td><td>Completed cross-chain searches</td></tr>
 * <tr><td>formatChainSkip</td><td>○ [CHAIN-SKIP]</td><td>Chains skipped during fan-out</td></tr>
 * </table>
 *
 * <pre>{@code
 * DebugLogger.logQuery(LogFormatter.formatQuery("SearchAgents", 1_500));
 * // Output: [QUERY] op=SearchAgents duration=1.50ms
 * }</pre>
 *
 * @see AnsiColors
 * @see DebugLogger
 */
public final class LogFormatter {

    /** Longest keyword echoed back into a log line. */
    private static final int MAX_KEYWORD_LENGTH = 48;

    private LogFormatter() {
    }

    /**
     * Format: [QUERY] op=SearchAgents duration=1.06ms
     */
    public static String formatQuery(String operation, long durationMicros) {
        return String.format(
                "%s[QUERY]%s op=%s %s",
                INDIGO, RESET,
                operation,
                duration(durationMicros));
    }

    /**
     * Format: ✗ [QUERY-ERROR] op=SearchAgents status=500 message=HTTP 500 duration=1.5ms
     */
    public static String formatQueryError(String operation, Object status, String message, long durationMicros) {
        return String.format(
                "%s✗%s %s[QUERY-ERROR]%s op=%s status=%s message=%s %s",
                CORAL, RESET,
                CORAL, RESET,
                operation,
                status,
                CORAL + message + RESET,
                duration(durationMicros));
    }

    /**
     * Format: [SEMANTIC] query="defi agent" hits=42 duration=120.00ms
     */
    public static String formatSemantic(String query, int hits, long durationMicros) {
        return String.format(
                "%s[SEMANTIC]%s query=\"%s\" hits=%d %s",
                LAVENDER, RESET,
                shorten(query),
                hits,
                duration(durationMicros));
    }

    /**
     * Format: [SHIM] rule=X402_SUPPORT_LOWERCASE op=SearchAgents
     */
    public static String formatShim(String rule, String operation) {
        return String.format(
                "%s[SHIM]%s rule=%s op=%s",
                AMBER, RESET,
                rule,
                operation);
    }

    /**
     * Format: ✓ [SEARCH] chains=[1, 11155111] keyword=true results=17 duration=310.00ms
     */
    public static String formatSearch(Collection<Long> chains, boolean keyword, int results, long durationMicros) {
        return String.format(
                "%s✓%s %s[SEARCH]%s chains=%s%s%s keyword=%s results=%d %s",
                TEAL, RESET,
                TEAL, RESET,
                SKY, chains, RESET,
                keyword,
                results,
                duration(durationMicros));
    }

    /**
     * Format: [SEARCH-PLAN] routes={NAME=PUSHDOWN, KEYWORD=SEMANTIC}
     */
    public static String formatPlan(Object routes) {
        return String.format(
                "%s[SEARCH-PLAN]%s routes=%s",
                INDIGO, RESET,
                routes);
    }

    /**
     * Format: ○ [CHAIN-SKIP] chain=59144 reason=no backend configured
     */
    public static String formatChainSkip(long chainId, String reason) {
        return String.format(
                "%s○%s %s[CHAIN-SKIP]%s chain=%s%d%s reason=%s",
                SLATE, RESET,
                SLATE, RESET,
                SKY, chainId, RESET,
                reason);
    }

    /**
     * Helper: format duration in microseconds as human-readable string
     */
    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format("%.2fms", ms);
        } else {
            formatted = String.format("%.2fs", ms / 1000.0);
        }
        return SLATE + "duration=" + formatted + RESET;
    }

    private static String shorten(String value) {
        if (value == null || value.length() <= MAX_KEYWORD_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_KEYWORD_LENGTH) + "...";
    }
}
