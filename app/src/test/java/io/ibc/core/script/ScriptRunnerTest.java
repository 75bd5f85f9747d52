package io.ibc.core.script;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ibc.core.client.ClientId;
import io.ibc.core.client.ClientRegistry;
import io.ibc.core.client.ClientRegistryInvariantException;
import io.ibc.core.client.ClientState;
import io.ibc.core.client.Outcome;
import io.ibc.core.client.RegistryConfig;
import io.ibc.core.store.InMemoryClientStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScriptRunnerTest {

    private final ObjectMapper json = new ObjectMapper();

    @Test
    void reportsEachOutcomeAndFinalSnapshot() {
        ClientRegistry registry = ClientRegistry.inMemory();
        ClientId zero = ClientId.of(0);

        ObjectNode report = new ScriptRunner(registry, json).run(List.of(
                RegistryCommand.create(100),
                RegistryCommand.update(zero, 150),
                RegistryCommand.update(zero, 150),
                RegistryCommand.update(zero, 90),
                RegistryCommand.update(ClientId.of(7), 200),
                RegistryCommand.exists(ClientId.of(7)),
                RegistryCommand.query(zero)
        ));

        JsonNode results = report.get("results");
        assertEquals(7, results.size());
        assertEquals("07-tendermint-0", results.get(0).get("clientId").asText());
        assertEquals("CREATE_OK", results.get(0).get("outcome").asText());
        assertEquals("UPDATE_OK", results.get(1).get("outcome").asText());
        assertEquals("HEADER_VERIFICATION_FAILURE", results.get(2).get("outcome").asText());
        assertEquals("HEADER_VERIFICATION_FAILURE", results.get(3).get("outcome").asText());
        assertEquals("CLIENT_NOT_FOUND", results.get(4).get("outcome").asText());
        assertFalse(results.get(5).get("exists").asBoolean());
        assertEquals(150L, results.get(6).get("latestHeight").asLong());
        assertEquals("[100,150]", results.get(6).get("heights").toString());

        JsonNode snapshot = report.get("snapshot");
        assertEquals(1L, snapshot.get("nextClientId").asLong());
        assertEquals("[100,150]", snapshot.get("clients").get("07-tendermint-0").toString());
    }

    @Test
    void queryOfAbsentClientHasNoLatestHeight() {
        ClientRegistry registry = ClientRegistry.inMemory(RegistryConfig.defaults().withClientIdPrefix(null));
        ObjectNode entry = json.createObjectNode();
        assertNull(new ScriptRunner(registry, json).execute(RegistryCommand.query(ClientId.of(4)), entry));

        assertEquals("4", entry.get("clientId").asText());
        assertFalse(entry.get("exists").asBoolean());
        assertEquals(0, entry.get("heights").size());
        assertFalse(entry.has("latestHeight"));
    }

    @Test
    void executeReturnsTheRegistryOutcome() {
        ClientRegistry registry = ClientRegistry.inMemory();
        ScriptRunner runner = new ScriptRunner(registry, json);

        assertEquals(Outcome.CREATE_OK, runner.execute(RegistryCommand.create(10), json.createObjectNode()));
        ObjectNode stale = json.createObjectNode();
        assertEquals(Outcome.HEADER_VERIFICATION_FAILURE,
                runner.execute(RegistryCommand.update(ClientId.of(0), 10), stale));
        assertEquals("HEADER_VERIFICATION_FAILURE", stale.get("outcome").asText());
        assertNull(runner.execute(RegistryCommand.exists(ClientId.of(0)), json.createObjectNode()));
    }

    @Test
    void invariantViolationAbortsTheRun() {
        InMemoryClientStore store = new InMemoryClientStore();
        store.put(ClientId.of(0), ClientState.anchoredAt(1));
        ClientRegistry registry = new ClientRegistry(store, RegistryConfig.defaults());

        assertThrows(ClientRegistryInvariantException.class,
                () -> new ScriptRunner(registry, json).run(List.of(RegistryCommand.create(5))));
    }
}
