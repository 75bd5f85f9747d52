package io.ibc.core.client;

/**
 * Protocol-level result of a registry operation. Every value is a normal result the
 * caller branches on; internal invariant violations are raised as
 * {@link ClientRegistryInvariantException} instead.
 */
public enum Outcome {
    CREATE_OK,
    UPDATE_OK,
    /** Update targeted an id that was never created. */
    CLIENT_NOT_FOUND,
    /** Update height was not strictly above the client's latest height. */
    HEADER_VERIFICATION_FAILURE;

    public boolean isSuccess() {
        return this == CREATE_OK || this == UPDATE_OK;
    }
}
