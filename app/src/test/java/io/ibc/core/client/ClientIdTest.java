package io.ibc.core.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClientIdTest {

    @Test
    void ordersByValue() {
        assertTrue(ClientId.of(2).compareTo(ClientId.of(10)) < 0);
        assertEquals(ClientId.of(7).hashCode(), ClientId.of(7).hashCode());
    }

    @Test
    void parsesBareAndPrefixedForms() {
        assertEquals(ClientId.of(3), ClientId.parse("3"));
        assertEquals(ClientId.of(12), ClientId.parse("07-tendermint-12"));
        assertEquals("07-tendermint-12", ClientId.of(12).format(RegistryConfig.DEFAULT_CLIENT_PREFIX));
        assertEquals("12", ClientId.of(12).format(null));
    }

    @Test
    void rejectsMalformedIds() {
        assertThrows(IllegalArgumentException.class, () -> ClientId.of(-1));
        assertThrows(IllegalArgumentException.class, () -> ClientId.parse(""));
        assertThrows(IllegalArgumentException.class, () -> ClientId.parse("07-tendermint-x"));
        assertThrows(IllegalArgumentException.class, () -> ClientId.parse("abc"));
    }

    @Test
    void rejectsSignsAndForeignPrefixes() {
        assertThrows(IllegalArgumentException.class, () -> ClientId.parse("-5"));
        assertThrows(IllegalArgumentException.class, () -> ClientId.parse("+5"));
        assertThrows(IllegalArgumentException.class, () -> ClientId.parse("foo-3"));
        assertThrows(IllegalArgumentException.class, () -> ClientId.parse("07-tendermint-"));
        assertThrows(IllegalArgumentException.class, () -> ClientId.parse("07-tendermint--3"));
        assertThrows(IllegalArgumentException.class, () -> ClientId.parse("9223372036854775808"));
    }

    @Test
    void checksAgainstConfiguredPrefix() {
        assertEquals(ClientId.of(3), ClientId.parse("06-solomachine-3", "06-solomachine"));
        assertThrows(IllegalArgumentException.class, () -> ClientId.parse("07-tendermint-3", "06-solomachine"));
        assertEquals(ClientId.of(3), ClientId.parse("3", null));
        assertThrows(IllegalArgumentException.class, () -> ClientId.parse("07-tendermint-3", null));
    }
}
