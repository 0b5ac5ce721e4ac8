// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.error;

/**
 * Exception thrown when search filters or sort keys cannot be evaluated.
 *
 * <p>Raised before any network traffic, e.g. for an unprefixed agent id while
 * several chains are in scope, an unparsable date bound, or a
 * {@code hasNoFeedback} request with no candidate universe to test against.
 */
public final class InvalidFilterException extends ScryException {

    private final String field;

    public InvalidFilterException(final String field, final String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public InvalidFilterException(final String field, final String message, final Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
