// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.scry.core.model.ChainSelector;

/**
 * Decides which chains participate in a search.
 *
 * <ul>
 * <li>{@code all}: every configured chain, ascending</li>
 * <li>explicit list: entries parsed as integers, unparsable ones dropped, duplicates removed, order kept</li>
 * <li>absent (or an empty list): the configured default chains</li>
 * </ul>
 * Resolution never fails; a chain without a backend is skipped later.
 */
public final class ChainResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ChainResolver.class);

    private final List<Long> defaultChains;
    private final Supplier<List<Long>> configuredChains;

    public ChainResolver(final List<Long> defaultChains, final Supplier<List<Long>> configuredChains) {
        this.defaultChains = List.copyOf(distinct(defaultChains));
        this.configuredChains = Objects.requireNonNull(configuredChains, "configuredChains");
    }

    /**
     * The conventional default: mainnet plus the engine's own chain.
     */
    public static List<Long> defaultChainsFor(final long defaultChainId) {
        return List.copyOf(distinct(List.of(1L, defaultChainId)));
    }

    public List<Long> defaultChains() {
        return defaultChains;
    }

    public List<Long> resolve(final @Nullable ChainSelector selector) {
        if (selector == null) {
            return defaultChains;
        }
        if (selector.isAll()) {
            final Set<Long> sorted = new TreeSet<>(configuredChains.get());
            return List.copyOf(sorted);
        }
        if (selector.entries().isEmpty()) {
            return defaultChains;
        }
        final Set<Long> out = new LinkedHashSet<>();
        for (String entry : selector.entries()) {
            if (entry == null) {
                continue;
            }
            try {
                out.add(Long.parseLong(entry.trim()));
            } catch (NumberFormatException e) {
                LOG.debug("Ignoring unparsable chain id '{}'", entry);
            }
        }
        return List.copyOf(out);
    }

    private static List<Long> distinct(final List<Long> chains) {
        return new ArrayList<>(new LinkedHashSet<>(chains));
    }
}
