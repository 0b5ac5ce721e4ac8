// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Which chains a search spans: every configured chain, or an explicit list.
 *
 * <p>Explicit entries are kept as raw strings because callers frequently pass
 * user input through; entries that do not parse as integers are dropped when
 * the selector is resolved.
 */
public final class ChainSelector {

    private static final ChainSelector ALL = new ChainSelector(true, List.of());

    private final boolean all;
    private final List<String> entries;

    private ChainSelector(boolean all, List<String> entries) {
        this.all = all;
        this.entries = entries;
    }

    /** Every chain with a configured backend. */
    public static ChainSelector allChains() {
        return ALL;
    }

    public static ChainSelector of(long... chainIds) {
        final List<String> entries = new ArrayList<>(chainIds.length);
        for (long chainId : chainIds) {
            entries.add(Long.toString(chainId));
        }
        return new ChainSelector(false, Collections.unmodifiableList(entries));
    }

    public static ChainSelector of(List<?> entries) {
        Objects.requireNonNull(entries, "entries");
        final List<String> copy = new ArrayList<>(entries.size());
        for (Object entry : entries) {
            copy.add(entry == null ? null : entry.toString());
        }
        return new ChainSelector(false, Collections.unmodifiableList(copy));
    }

    /**
     * Parses {@code "all"} or a comma separated list of chain ids.
     */
    public static ChainSelector parse(String value) {
        Objects.requireNonNull(value, "value");
        if ("all".equalsIgnoreCase(value.trim())) {
            return ALL;
        }
        return of(Arrays.asList(value.split(",")));
    }

    public boolean isAll() {
        return all;
    }

    /**
     * @return the raw explicit entries, possibly containing unparsable values; empty for {@link #allChains()}
     */
    public List<String> entries() {
        return entries;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChainSelector other)) {
            return false;
        }
        return all == other.all && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(all, entries);
    }

    @Override
    public String toString() {
        return all ? "all" : entries.toString();
    }
}
