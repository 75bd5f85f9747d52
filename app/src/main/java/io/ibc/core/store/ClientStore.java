package io.ibc.core.store;

import io.ibc.core.client.ClientId;
import io.ibc.core.client.ClientState;

import java.util.Optional;
import java.util.SortedMap;

/**
 * Backing state of a client registry: a partial mapping of ids to client records plus
 * the next id to allocate.
 *
 * Notes:
 * - Unallocated ids are simply missing; the absent sentinel is never stored.
 * - The store does not enforce protocol rules, ClientRegistry does.
 */
public interface ClientStore {

    /** Stored client for this id, empty if never created. */
    Optional<ClientState> get(ClientId clientId);

    /** Insert or replace a record. Rejects the absent sentinel. */
    void put(ClientId clientId, ClientState state);

    long nextClientId();

    void setNextClientId(long nextClientId);

    /** Number of stored clients. */
    int size();

    /** Ordered copy of every stored client. */
    SortedMap<ClientId, ClientState> entries();

    default boolean contains(ClientId clientId) {
        return get(clientId).isPresent();
    }
}
