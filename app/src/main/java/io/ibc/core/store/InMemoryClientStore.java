package io.ibc.core.store;

import io.ibc.core.client.ClientId;
import io.ibc.core.client.ClientState;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * In-memory implementation of ClientStore.
 * Not persistent, resets every process run.
 */
public final class InMemoryClientStore implements ClientStore {

    private final Map<ClientId, ClientState> clients = new HashMap<>();
    private long nextClientId;

    public InMemoryClientStore() {
        this(0L);
    }

    public InMemoryClientStore(long originClientId) {
        if (originClientId < 0) {
            throw new IllegalArgumentException("Origin client id must be non-negative");
        }
        this.nextClientId = originClientId;
    }

    /** Seed a store from a snapshot (restore path). */
    public static InMemoryClientStore from(RegistrySnapshot snapshot) {
        InMemoryClientStore store = new InMemoryClientStore(snapshot.nextClientId());
        store.clients.putAll(snapshot.clients());
        return store;
    }

    @Override
    public synchronized Optional<ClientState> get(ClientId clientId) {
        if (clientId == null) return Optional.empty();
        return Optional.ofNullable(clients.get(clientId));
    }

    @Override
    public synchronized void put(ClientId clientId, ClientState state) {
        if (clientId == null || state == null) {
            throw new IllegalArgumentException("Client id and state required");
        }
        if (!state.exists()) {
            throw new IllegalArgumentException("Cannot store an absent client");
        }
        clients.put(clientId, state);
    }

    @Override
    public synchronized long nextClientId() {
        return nextClientId;
    }

    @Override
    public synchronized void setNextClientId(long nextClientId) {
        if (nextClientId < 0) {
            throw new IllegalArgumentException("nextClientId must be non-negative");
        }
        this.nextClientId = nextClientId;
    }

    @Override
    public synchronized int size() {
        return clients.size();
    }

    @Override
    public synchronized SortedMap<ClientId, ClientState> entries() {
        return new TreeMap<>(clients);
    }
}
