package io.ibc.core.store;

import io.ibc.core.client.ClientId;
import io.ibc.core.client.ClientState;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable copy of a registry's clients and allocator, handed to whatever persists it.
 * Construction checks that the allocator is ahead of every stored id.
 */
public record RegistrySnapshot(long nextClientId, SortedMap<ClientId, ClientState> clients) {

    public RegistrySnapshot {
        if (nextClientId < 0) {
            throw new IllegalArgumentException("nextClientId must be non-negative");
        }
        TreeMap<ClientId, ClientState> copy = new TreeMap<>();
        if (clients != null) {
            for (Map.Entry<ClientId, ClientState> entry : clients.entrySet()) {
                ClientId id = entry.getKey();
                ClientState state = entry.getValue();
                if (id == null || state == null || !state.exists()) {
                    throw new IllegalArgumentException("Snapshot contains an absent client: " + id);
                }
                if (id.value() >= nextClientId) {
                    throw new IllegalArgumentException("Client id " + id.value()
                            + " is not below nextClientId " + nextClientId);
                }
                copy.put(id, state);
            }
        }
        clients = Collections.unmodifiableSortedMap(copy);
    }

    public static RegistrySnapshot empty(long originClientId) {
        return new RegistrySnapshot(originClientId, new TreeMap<>());
    }

    public static RegistrySnapshot of(ClientStore store) {
        return new RegistrySnapshot(store.nextClientId(), store.entries());
    }
}
