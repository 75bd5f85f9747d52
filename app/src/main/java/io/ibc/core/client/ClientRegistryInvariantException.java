package io.ibc.core.client;

/**
 * Raised when the id allocator and the client map disagree: the id about to be
 * allocated is already taken. Not a protocol failure and not retryable.
 */
public final class ClientRegistryInvariantException extends IllegalStateException {
    private final ClientId clientId;
    private final long nextClientId;

    public ClientRegistryInvariantException(ClientId clientId, long nextClientId) {
        super("Client id " + clientId.value() + " already allocated (nextClientId=" + nextClientId + ")");
        this.clientId = clientId;
        this.nextClientId = nextClientId;
    }

    public ClientId clientId() { return clientId; }
    public long nextClientId() { return nextClientId; }
}
