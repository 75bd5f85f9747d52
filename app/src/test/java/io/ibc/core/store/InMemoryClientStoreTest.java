package io.ibc.core.store;

import io.ibc.core.client.ClientId;
import io.ibc.core.client.ClientState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryClientStoreTest {

    @Test
    void putGetEntries() {
        ClientStore store = new InMemoryClientStore();
        assertEquals(0L, store.nextClientId());
        assertTrue(store.get(ClientId.of(0)).isEmpty());

        store.put(ClientId.of(1), ClientState.anchoredAt(20));
        store.put(ClientId.of(0), ClientState.anchoredAt(10));
        store.setNextClientId(2);

        assertEquals(2, store.size());
        assertTrue(store.contains(ClientId.of(1)));
        SortedMap<ClientId, ClientState> entries = store.entries();
        assertEquals(List.of(ClientId.of(0), ClientId.of(1)), List.copyOf(entries.keySet()));

        entries.clear();
        assertEquals(2, store.size());
    }

    @Test
    void rejectsAbsentAndNegativeValues() {
        ClientStore store = new InMemoryClientStore();
        assertThrows(IllegalArgumentException.class, () -> store.put(ClientId.of(0), ClientState.absent()));
        assertThrows(IllegalArgumentException.class, () -> store.put(null, ClientState.anchoredAt(1)));
        assertThrows(IllegalArgumentException.class, () -> store.setNextClientId(-1));
        assertThrows(IllegalArgumentException.class, () -> new InMemoryClientStore(-4));
        assertTrue(store.get(null).isEmpty());
    }

    @Test
    void seedsFromSnapshot() {
        InMemoryClientStore source = new InMemoryClientStore(3);
        source.put(ClientId.of(3), ClientState.of(List.of(5L, 9L)));
        source.setNextClientId(4);

        InMemoryClientStore copy = InMemoryClientStore.from(RegistrySnapshot.of(source));

        assertEquals(4L, copy.nextClientId());
        assertEquals(source.entries(), copy.entries());
    }
}
