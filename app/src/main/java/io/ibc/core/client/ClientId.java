package io.ibc.core.client;

/**
 * Sequentially allocated client identifier. Ordered by its numeric value.
 */
public final class ClientId implements Comparable<ClientId> {
    private final long value;

    private ClientId(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Client id must be non-negative: " + value);
        }
        this.value = value;
    }

    public static ClientId of(long value) {
        return new ClientId(value);
    }

    /** Same as {@link #parse(String, String)} with the default ICS-07 prefix. */
    public static ClientId parse(String text) {
        return parse(text, RegistryConfig.DEFAULT_CLIENT_PREFIX);
    }

    /**
     * Accepts a bare number ("3") or {@code <prefix>-<n>} ("07-tendermint-3").
     * Any other prefix, a sign, or a value outside {@code long} is rejected.
     */
    public static ClientId parse(String text, String prefix) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Client id required");
        }
        String trimmed = text.trim();
        String digits = trimmed;
        int dash = trimmed.lastIndexOf('-');
        if (dash >= 0) {
            String given = trimmed.substring(0, dash);
            if (prefix == null || prefix.isBlank() || !given.equals(prefix)) {
                throw new IllegalArgumentException("Invalid client id: " + text
                        + (prefix == null || prefix.isBlank() ? "" : " (expected prefix " + prefix + ")"));
            }
            digits = trimmed.substring(dash + 1);
        }
        if (digits.isEmpty() || !digits.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new IllegalArgumentException("Invalid client id: " + text);
        }
        try {
            return new ClientId(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Client id out of range: " + text);
        }
    }

    public long value() { return value; }

    /** Display form, e.g. {@code 07-tendermint-0}. */
    public String format(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return Long.toString(value);
        }
        return prefix + "-" + value;
    }

    @Override public int compareTo(ClientId o) { return Long.compare(value, o.value); }
    @Override public boolean equals(Object o) { return o instanceof ClientId && ((ClientId) o).value == value; }
    @Override public int hashCode() { return Long.hashCode(value); }
    @Override public String toString() { return "ClientId(" + value + ")"; }
}
