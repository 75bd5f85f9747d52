package io.ibc.core.client;

/** Simple config holder for a client registry. */
public final class RegistryConfig {
    public static final String DEFAULT_CLIENT_PREFIX = "07-tendermint";

    public final long originClientId;
    public final String clientIdPrefix;

    public RegistryConfig(long originClientId, String clientIdPrefix) {
        if (originClientId < 0) {
            throw new IllegalArgumentException("originClientId must be non-negative");
        }
        this.originClientId = originClientId;
        this.clientIdPrefix = clientIdPrefix;
    }

    public static RegistryConfig defaults() {
        return new RegistryConfig(
                0L,                     // first allocated id
                DEFAULT_CLIENT_PREFIX   // ICS-07 tendermint client type
        );
    }

    public RegistryConfig withOrigin(long originClientId) {
        return new RegistryConfig(originClientId, this.clientIdPrefix);
    }

    public RegistryConfig withClientIdPrefix(String clientIdPrefix) {
        return new RegistryConfig(this.originClientId, clientIdPrefix);
    }

    public String display(ClientId clientId) {
        return clientId.format(clientIdPrefix);
    }
}
