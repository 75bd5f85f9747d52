package io.ibc.core.script;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ibc.core.client.ClientId;
import io.ibc.core.client.RegistryConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a JSON array of registry commands, e.g.
 * <pre>
 * [ {"op": "create", "height": 100},
 *   {"op": "update", "clientId": "07-tendermint-0", "height": 150} ]
 * </pre>
 */
public final class CommandScript {
    private static final ObjectMapper JSON = new ObjectMapper();

    private CommandScript() {}

    public static List<RegistryCommand> load(Path path) {
        return load(path, RegistryConfig.DEFAULT_CLIENT_PREFIX);
    }

    /** Textual client ids must carry {@code clientIdPrefix} (or be bare numbers). */
    public static List<RegistryCommand> load(Path path, String clientIdPrefix) {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Script not found: " + path);
        }
        try {
            return parse(JSON.readTree(path.toFile()), clientIdPrefix);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read command script from " + path, e);
        }
    }

    public static List<RegistryCommand> parse(String json) {
        return parse(json, RegistryConfig.DEFAULT_CLIENT_PREFIX);
    }

    public static List<RegistryCommand> parse(String json, String clientIdPrefix) {
        try {
            return parse(JSON.readTree(json), clientIdPrefix);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed command script: " + e.getOriginalMessage(), e);
        }
    }

    static List<RegistryCommand> parse(JsonNode root, String clientIdPrefix) {
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Command script must be a JSON array");
        }
        List<RegistryCommand> commands = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            JsonNode node = root.get(i);
            try {
                commands.add(toCommand(node, clientIdPrefix));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Command #" + i + ": " + e.getMessage(), e);
            }
        }
        return commands;
    }

    private static RegistryCommand toCommand(JsonNode node, String clientIdPrefix) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("expected an object");
        }
        RegistryCommand.Op op = RegistryCommand.Op.parse(node.path("op").asText(null));
        return new RegistryCommand(op, clientId(node.get("clientId"), clientIdPrefix), height(node.get("height")));
    }

    private static ClientId clientId(JsonNode node, String clientIdPrefix) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                throw new IllegalArgumentException("clientId out of range: " + node.asText());
            }
            return ClientId.of(node.asLong());
        }
        if (node.isTextual()) {
            return ClientId.parse(node.asText(), clientIdPrefix);
        }
        throw new IllegalArgumentException("clientId must be a number or string");
    }

    private static Long height(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new IllegalArgumentException("height must be an integer");
        }
        return node.asLong();
    }
}
