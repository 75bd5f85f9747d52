package io.ibc.core.client;

import io.ibc.core.metrics.RegistryMetrics;
import io.ibc.core.store.ClientStore;
import io.ibc.core.store.InMemoryClientStore;
import io.ibc.core.store.RegistrySnapshot;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ICS02 client registry: allocates client ids and records verified counterparty
 * heights per client.
 *
 * Heights passed in are trusted as already verified against the counterparty's
 * consensus. The registry enforces only the structural rules:
 * - ids are handed out sequentially and never reused;
 * - a client's heights only grow, and an update must be strictly above the latest one.
 *
 * All operations are serialized on this instance, so creates never share an id and
 * racing updates to one client are judged against each other's results.
 */
public final class ClientRegistry {
    private static final Logger LOG = Logger.getLogger(ClientRegistry.class.getName());

    private final ClientStore store;
    private final RegistryConfig config;

    public ClientRegistry(ClientStore store, RegistryConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
    }

    /** Empty in-memory registry starting at the configured origin id. */
    public static ClientRegistry inMemory(RegistryConfig config) {
        return new ClientRegistry(new InMemoryClientStore(config.originClientId), config);
    }

    public static ClientRegistry inMemory() {
        return inMemory(RegistryConfig.defaults());
    }

    /** Rebuild a registry from state previously taken with {@link #snapshot()}. */
    public static ClientRegistry restore(RegistrySnapshot snapshot, RegistryConfig config) {
        Objects.requireNonNull(snapshot, "snapshot");
        return new ClientRegistry(InMemoryClientStore.from(snapshot), config);
    }

    public static ClientRegistry restore(RegistrySnapshot snapshot) {
        return restore(snapshot, RegistryConfig.defaults());
    }

    public synchronized boolean clientExists(ClientId clientId) {
        return lookup(clientId).isPresent();
    }

    /** Stored client, or {@link ClientState#absent()} when the id was never created. */
    public synchronized ClientState getClient(ClientId clientId) {
        return lookup(clientId).orElse(ClientState.absent());
    }

    /**
     * Allocate the next id and anchor a new client at {@code height}.
     *
     * @throws ClientRegistryInvariantException if the id to allocate is already in use;
     *         nothing is modified in that case
     * @throws IllegalStateException if the id space is exhausted; nothing is modified
     */
    public synchronized CreateResult createClient(long height) {
        ClientState.requireHeight(height);
        long next = store.nextClientId();
        if (next == Long.MAX_VALUE) {
            throw new IllegalStateException("Client id space exhausted (nextClientId=" + next + ")");
        }
        long following = next + 1L;
        ClientId clientId = ClientId.of(next);

        if (store.contains(clientId)) {
            RegistryMetrics.incrementInvariantViolations();
            ClientRegistryInvariantException ex = new ClientRegistryInvariantException(clientId, next);
            LOG.log(Level.SEVERE, "Client allocator out of sync with store", ex);
            throw ex;
        }

        store.put(clientId, ClientState.anchoredAt(height));
        store.setNextClientId(following);
        RegistryMetrics.incrementCreated();
        LOG.info("Created client " + config.display(clientId) + " at height " + height);
        return new CreateResult(clientId, Outcome.CREATE_OK);
    }

    /**
     * Record a newly verified height for an existing client.
     *
     * @return UPDATE_OK when the height was added, CLIENT_NOT_FOUND when the client does
     *         not exist, HEADER_VERIFICATION_FAILURE when the height is not above the latest
     */
    public synchronized Outcome updateClient(ClientId clientId, long height) {
        Objects.requireNonNull(clientId, "clientId");
        ClientState.requireHeight(height);

        Optional<ClientState> current = store.get(clientId);
        Outcome outcome;
        if (current.isEmpty()) {
            outcome = Outcome.CLIENT_NOT_FOUND;
        } else {
            long latest = current.get().latestHeight();
            if (latest < height) {
                store.put(clientId, current.get().withHeight(height));
                outcome = Outcome.UPDATE_OK;
            } else {
                outcome = Outcome.HEADER_VERIFICATION_FAILURE;
            }
        }

        RegistryMetrics.recordUpdate(outcome);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("updateClient " + config.display(clientId) + " height=" + height + " -> " + outcome);
        }
        return outcome;
    }

    public synchronized RegistrySnapshot snapshot() {
        return RegistrySnapshot.of(store);
    }

    /** Number of existing clients. */
    public synchronized int size() {
        return store.size();
    }

    public synchronized long nextClientId() {
        return store.nextClientId();
    }

    public RegistryConfig config() {
        return config;
    }

    private Optional<ClientState> lookup(ClientId clientId) {
        if (clientId == null) {
            return Optional.empty();
        }
        return store.get(clientId).filter(ClientState::exists);
    }
}
