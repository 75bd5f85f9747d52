package io.ibc.core.script;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ibc.core.client.ClientId;
import io.ibc.core.client.ClientRegistry;
import io.ibc.core.client.ClientState;
import io.ibc.core.client.CreateResult;
import io.ibc.core.client.Outcome;
import io.ibc.core.client.RegistryConfig;
import io.ibc.core.store.RegistrySnapshot;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Drives a registry through a list of commands the way a handshake/relay
 * orchestrator would, and collects every result into a JSON report.
 *
 * Rejected updates are ordinary entries in the report. An allocator invariant
 * violation is not caught here and aborts the run.
 */
public final class ScriptRunner {
    private static final Logger LOG = Logger.getLogger(ScriptRunner.class.getName());

    private final ClientRegistry registry;
    private final ObjectMapper json;

    public ScriptRunner(ClientRegistry registry, ObjectMapper json) {
        this.registry = registry;
        this.json = json;
    }

    public ObjectNode run(List<RegistryCommand> commands) {
        ObjectNode report = json.createObjectNode();
        ArrayNode results = report.putArray("results");
        int rejected = 0;
        for (RegistryCommand command : commands) {
            ObjectNode entry = json.createObjectNode();
            Outcome outcome = execute(command, entry);
            if (outcome != null && !outcome.isSuccess()) {
                rejected++;
            }
            results.add(entry);
        }
        report.set("snapshot", snapshotNode(registry.snapshot()));
        LOG.info("Ran " + commands.size() + " commands (" + rejected + " rejected), "
                + registry.size() + " clients tracked");
        return report;
    }

    /**
     * Runs one command and fills {@code entry} with its result.
     *
     * @return the operation's outcome, or null for read-only commands
     */
    Outcome execute(RegistryCommand command, ObjectNode entry) {
        RegistryConfig config = registry.config();
        Outcome outcome = null;
        entry.put("op", command.op().label());
        switch (command.op()) {
            case CREATE -> {
                CreateResult result = registry.createClient(command.height());
                entry.put("clientId", config.display(result.clientId()));
                entry.put("height", command.height());
                outcome = result.outcome();
                entry.put("outcome", outcome.name());
            }
            case UPDATE -> {
                outcome = registry.updateClient(command.clientId(), command.height());
                entry.put("clientId", config.display(command.clientId()));
                entry.put("height", command.height());
                entry.put("outcome", outcome.name());
            }
            case EXISTS -> {
                entry.put("clientId", config.display(command.clientId()));
                entry.put("exists", registry.clientExists(command.clientId()));
            }
            case QUERY -> {
                ClientState state = registry.getClient(command.clientId());
                entry.put("clientId", config.display(command.clientId()));
                entry.put("exists", state.exists());
                ArrayNode heights = entry.putArray("heights");
                state.heights().forEach(h -> heights.add(h.longValue()));
                state.latestHeightIfPresent().ifPresent(h -> entry.put("latestHeight", h));
            }
        }
        return outcome;
    }

    ObjectNode snapshotNode(RegistrySnapshot snapshot) {
        ObjectNode node = json.createObjectNode();
        node.put("nextClientId", snapshot.nextClientId());
        ObjectNode clients = node.putObject("clients");
        for (Map.Entry<ClientId, ClientState> e : snapshot.clients().entrySet()) {
            ArrayNode heights = clients.putArray(registry.config().display(e.getKey()));
            e.getValue().heights().forEach(h -> heights.add(h.longValue()));
        }
        return node;
    }
}
