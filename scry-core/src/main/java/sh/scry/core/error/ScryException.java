// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.error;

/**
 * Base runtime exception for all scry failures.
 *
 * <p>
 * This sealed class forms the root of the exception hierarchy, so every
 * scry-specific error can be caught with a single catch clause.
 *
 * <pre>
 * ScryException
 * ├── {@link BackendException} - structured backend (subgraph) failures
 * ├── {@link SemanticSearchException} - relevance service failures
 * ├── {@link InvalidFilterException} - filters that cannot be evaluated
 * ├── {@link AgentNotFoundException} - unknown agent on lookup
 * └── {@link SearchInterruptedException} - caller thread interrupted mid-search
 * </pre>
 *
 * <pre>{@code
 * try {
 *     indexer.search(filters, SearchOptions.defaults());
 * } catch (InvalidFilterException e) {
 *     // Bad request from the caller
 * } catch (BackendException e) {
 *     // Network or GraphQL failure on one chain
 * } catch (ScryException e) {
 *     // Anything else
 * }
 * }</pre>
 */
public sealed class ScryException extends RuntimeException
        permits BackendException,
        SemanticSearchException,
        InvalidFilterException,
        AgentNotFoundException,
        SearchInterruptedException {

    public ScryException(final String message) {
        super(message);
    }

    public ScryException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
