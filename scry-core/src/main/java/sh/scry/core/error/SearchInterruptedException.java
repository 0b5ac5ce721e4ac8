// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.error;

/**
 * Exception thrown when the calling thread is interrupted while per-chain work
 * is still in flight. The interrupt flag is restored before this is thrown.
 */
public final class SearchInterruptedException extends ScryException {

    public SearchInterruptedException(final String message, final InterruptedException cause) {
        super(message, cause);
    }
}
