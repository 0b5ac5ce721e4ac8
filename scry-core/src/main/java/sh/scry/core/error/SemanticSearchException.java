// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when the semantic relevance service cannot be reached or
 * returns a body that is not JSON.
 *
 * <p>Individual malformed hits inside an otherwise valid response are dropped
 * silently and never raise this exception.
 */
public final class SemanticSearchException extends ScryException {

    private final int status;

    public SemanticSearchException(final int status, final String message, final @Nullable Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * @return the HTTP status, or {@code -1} if no response was received
     */
    public int status() {
        return status;
    }
}
