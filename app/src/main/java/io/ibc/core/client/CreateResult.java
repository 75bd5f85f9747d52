package io.ibc.core.client;

import java.util.Objects;

public record CreateResult(ClientId clientId, Outcome outcome) {
    public CreateResult {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(outcome, "outcome");
    }
}
