package io.ibc.core.metrics;

import io.ibc.core.client.Outcome;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RegistryMetricsTest {

    @Test
    void scrapeListsRegistryMeters() {
        RegistryMetrics.incrementCreated();
        RegistryMetrics.recordUpdate(Outcome.UPDATE_OK);

        String scrape = RegistryMetrics.scrapeMetrics();
        assertTrue(scrape.contains("registry.clients.created{stat=COUNT}"));
        assertTrue(scrape.contains("registry.client.updates{outcome=UPDATE_OK}{stat=COUNT}"));
        assertTrue(scrape.contains("registry.invariant.violations"));
    }

    @Test
    void createOutcomeIsNotAnUpdate() {
        assertThrows(IllegalArgumentException.class, () -> RegistryMetrics.recordUpdate(Outcome.CREATE_OK));
        assertEquals(0.0, RegistryMetrics.updateCount(Outcome.CREATE_OK));
    }
}
