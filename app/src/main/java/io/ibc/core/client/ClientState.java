package io.ibc.core.client;

import java.util.Collection;
import java.util.Collections;
import java.util.OptionalLong;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Light-client record for one counterparty chain: the set of heights that were
 * verified and accepted. Immutable; {@link #withHeight(long)} returns a copy.
 *
 * A client with no heights is the "absent" sentinel returned for unallocated ids.
 */
public final class ClientState {

    private static final ClientState ABSENT = new ClientState(new TreeSet<>());

    private final SortedSet<Long> heights;

    private ClientState(TreeSet<Long> heights) {
        this.heights = Collections.unmodifiableSortedSet(heights);
    }

    public static ClientState absent() {
        return ABSENT;
    }

    /** A freshly created client anchored at a single height. */
    public static ClientState anchoredAt(long height) {
        requireHeight(height);
        TreeSet<Long> set = new TreeSet<>();
        set.add(height);
        return new ClientState(set);
    }

    public static ClientState of(Collection<Long> heights) {
        if (heights == null || heights.isEmpty()) {
            return ABSENT;
        }
        TreeSet<Long> set = new TreeSet<>();
        for (Long h : heights) {
            if (h == null) {
                throw new IllegalArgumentException("Height must not be null");
            }
            requireHeight(h);
            set.add(h);
        }
        return new ClientState(set);
    }

    public boolean exists() {
        return !heights.isEmpty();
    }

    /** Ascending, unmodifiable. */
    public SortedSet<Long> heights() {
        return heights;
    }

    public boolean hasHeight(long height) {
        return heights.contains(height);
    }

    /**
     * Highest accepted height.
     *
     * @throws IllegalStateException for the absent client
     */
    public long latestHeight() {
        if (heights.isEmpty()) {
            throw new IllegalStateException("Absent client has no latest height");
        }
        return heights.last();
    }

    public OptionalLong latestHeightIfPresent() {
        return heights.isEmpty() ? OptionalLong.empty() : OptionalLong.of(heights.last());
    }

    /** Union with {@code height}; this instance is left unchanged. */
    public ClientState withHeight(long height) {
        requireHeight(height);
        TreeSet<Long> set = new TreeSet<>(heights);
        set.add(height);
        return new ClientState(set);
    }

    static void requireHeight(long height) {
        if (height < 0) {
            throw new IllegalArgumentException("Height must be non-negative: " + height);
        }
    }

    @Override public boolean equals(Object o) { return o instanceof ClientState && heights.equals(((ClientState) o).heights); }
    @Override public int hashCode() { return heights.hashCode(); }
    @Override public String toString() { return exists() ? "ClientState" + heights : "ClientState(absent)"; }
}
