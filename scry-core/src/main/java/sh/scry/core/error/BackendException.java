// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.error;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a structured backend query fails.
 *
 * <p>
 * Covers transport failures (connection refused, timeouts), non-2xx HTTP
 * statuses, unparsable bodies and GraphQL {@code errors} arrays. For GraphQL
 * errors the individual messages are kept so callers can react to schema
 * drift, see {@link #isMissingField(String)}.
 *
 * <p>
 * {@link #status()} is the HTTP status code, or {@code -1} when the request
 * never produced a response.
 */
public final class BackendException extends ScryException {

    private static final Pattern TYPE_NAME = Pattern.compile("(?i)\\btype\\s+[`\"']([A-Za-z_][A-Za-z0-9_]*)[`\"']");

    private final int status;
    private final String operation;
    private final List<String> graphqlErrors;
    private final @Nullable Long chainId;

    public BackendException(
            final int status,
            final String operation,
            final String message,
            final List<String> graphqlErrors,
            final @Nullable Long chainId,
            final @Nullable Throwable cause) {
        super(augmentMessage(message, chainId), cause);
        this.status = status;
        this.operation = operation;
        this.graphqlErrors = graphqlErrors == null ? List.of() : List.copyOf(graphqlErrors);
        this.chainId = chainId;
    }

    public BackendException(final int status, final String operation, final String message, final Throwable cause) {
        this(status, operation, message, List.of(), null, cause);
    }

    public BackendException(final String operation, final List<String> graphqlErrors) {
        this(200, operation, "GraphQL errors for " + operation + ": " + String.join("; ", graphqlErrors),
                graphqlErrors, null, null);
    }

    public int status() {
        return status;
    }

    public String operation() {
        return operation;
    }

    public List<String> graphqlErrors() {
        return graphqlErrors;
    }

    public @Nullable Long chainId() {
        return chainId;
    }

    public boolean isGraphQlError() {
        return !graphqlErrors.isEmpty();
    }

    /**
     * Returns a copy of this exception tagged with the chain it was raised for.
     */
    public BackendException onChain(final long chainId) {
        if (this.chainId != null) {
            return this;
        }
        return new BackendException(status, operation, getMessage(), graphqlErrors, chainId, getCause());
    }

    /**
     * Checks whether the backend rejected the query because a field does not exist.
     *
     * <p>Both graph-node style ({@code Type `X` has no field `f`}) and graphql-js
     * style ({@code Cannot query field "f" on type "X"}) messages are recognised.
     * The field name must match exactly, so {@code agentWallet} does not match
     * {@code agentWalletChainId}.
     *
     * @param field the field name to look for
     * @return true if any GraphQL error reports {@code field} as unknown, on any type
     */
    public boolean isMissingField(final String field) {
        return isMissingField(null, field);
    }

    /**
     * Like {@link #isMissingField(String)}, but when an error names the type it must be
     * {@code typeName} or one of its generated input types ({@code X_filter}, {@code X_orderBy}).
     * Errors that name no type match on the field alone.
     */
    public boolean isMissingField(final @Nullable String typeName, final String field) {
        for (String message : graphqlErrors) {
            if (message == null) {
                continue;
            }
            final String lower = message.toLowerCase(Locale.ROOT);
            final boolean unknownField = lower.contains("has no field")
                    || lower.contains("cannot query field")
                    || lower.contains("unknown field")
                    || lower.contains("unknown argument");
            if (!unknownField) {
                continue;
            }
            final boolean namesField = message.contains("`" + field + "`")
                    || message.contains("\"" + field + "\"")
                    || message.contains("'" + field + "'");
            if (namesField && (typeName == null || onType(message, typeName))) {
                return true;
            }
        }
        return false;
    }

    private static boolean onType(final String message, final String typeName) {
        final Matcher m = TYPE_NAME.matcher(message);
        if (!m.find()) {
            return true;
        }
        final String named = m.group(1);
        return named.equals(typeName) || named.startsWith(typeName + "_");
    }

    @Override
    public String toString() {
        return "BackendException{"
                + "status="
                + status
                + ", operation="
                + operation
                + ", message="
                + getMessage()
                + ", chainId="
                + chainId
                + "}";
    }

    private static String augmentMessage(final String message, final @Nullable Long chainId) {
        if (chainId == null || message == null || message.isBlank()) {
            return message;
        }
        return "[chainId=" + chainId + "] " + message;
    }
}
