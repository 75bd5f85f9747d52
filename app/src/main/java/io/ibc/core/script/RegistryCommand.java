package io.ibc.core.script;

import io.ibc.core.client.ClientId;

import java.util.Locale;
import java.util.Objects;

/**
 * One step of a command script. {@code clientId} is null for create,
 * {@code height} is null for exists/query.
 */
public record RegistryCommand(Op op, ClientId clientId, Long height) {

    public enum Op {
        CREATE, UPDATE, EXISTS, QUERY;

        public static Op parse(String text) {
            if (text == null || text.isBlank()) {
                throw new IllegalArgumentException("Missing op");
            }
            try {
                return Op.valueOf(text.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown op: " + text);
            }
        }

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public RegistryCommand {
        Objects.requireNonNull(op, "op");
        switch (op) {
            case CREATE -> {
                if (height == null) throw new IllegalArgumentException("create requires height");
            }
            case UPDATE -> {
                if (clientId == null) throw new IllegalArgumentException("update requires clientId");
                if (height == null) throw new IllegalArgumentException("update requires height");
            }
            case EXISTS, QUERY -> {
                if (clientId == null) throw new IllegalArgumentException(op.label() + " requires clientId");
            }
        }
        if (height != null && height < 0) {
            throw new IllegalArgumentException("height must be non-negative: " + height);
        }
    }

    public static RegistryCommand create(long height) {
        return new RegistryCommand(Op.CREATE, null, height);
    }

    public static RegistryCommand update(ClientId clientId, long height) {
        return new RegistryCommand(Op.UPDATE, clientId, height);
    }

    public static RegistryCommand exists(ClientId clientId) {
        return new RegistryCommand(Op.EXISTS, clientId, null);
    }

    public static RegistryCommand query(ClientId clientId) {
        return new RegistryCommand(Op.QUERY, clientId, null);
    }
}
