// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search.refresh;

import java.io.IOException;

/**
 * Loads the registration file an agent URI points to.
 */
@FunctionalInterface
public interface RegistrationFetcher {

    /**
     * @return the raw JSON document
     * @throws IOException if the document cannot be retrieved
     */
    String fetch(String uri) throws IOException;
}
