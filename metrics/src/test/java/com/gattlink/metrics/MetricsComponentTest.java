package com.gattlink.metrics;

import com.gattlink.config.ComponentState;
import com.gattlink.config.ConfigLoader;
import com.gattlink.gatt.GattClient;
import com.gattlink.gatt.config.GattClientConfig;
import com.gattlink.gatt.permission.PermissionGate;
import com.gattlink.gatt.testing.SimulatedGattStack;
import com.gattlink.metrics.factory.MetricsFactory;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetricsComponentTest {

    @Test
    void bindClient_exposesClientMetricsInScrape() throws Exception {
        MetricsComponent metrics = new MetricsComponent("metrics", MetricsConfig.defaults());
        metrics.initialize();
        metrics.start();

        SimulatedGattStack stack = new SimulatedGattStack();
        GattClient client = new GattClient(GattClientConfig.builder().name("wearables").build(),
                stack, PermissionGate.ALLOW_ALL);
        client.initialize();
        client.start();
        metrics.bindClient(client);

        client.registerDevice("AA:BB:CC:11:22:33");
        client.connect("AA:BB:CC:11:22:33");
        stack.lastConnection("AA:BB:CC:11:22:33").acceptConnection();

        String scrape = metrics.scrape();
        assertTrue(scrape.contains("gattlink_session_connected_count"), scrape);
        assertTrue(scrape.contains("client=\"wearables\""), scrape);
        assertTrue(scrape.contains("gattlink_session_connect_total"), scrape);

        client.stop();
        metrics.stop();
        assertEquals(ComponentState.STOPPED, metrics.getState());
    }

    @Test
    void disabledComponentHasNoRegistry() throws Exception {
        Config config = ConfigFactory.parseString("gattlink.metrics.enabled = false");
        MetricsComponent metrics = new MetricsFactory().create(null, config);

        metrics.initialize();

        assertEquals("metrics", metrics.getName());
        assertNull(metrics.getRegistry());
        assertEquals("", metrics.scrape());
        GattClient client = new GattClient(GattClientConfig.builder().build(),
                new SimulatedGattStack(), PermissionGate.ALLOW_ALL);
        assertDoesNotThrow(() -> metrics.bindClient(client));
    }

    @Test
    void configDefaultsComeFromReferenceConf() {
        Config root = ConfigLoader.builder()
                .withApplicationConf(false)
                .withSystemProperties(false)
                .build();

        MetricsConfig config = MetricsConfig.fromConfig(root);

        assertTrue(config.isEnabled());
        assertFalse(config.isIncludeJvm());
    }

    @Test
    void initializeTwiceFails() throws Exception {
        MetricsComponent metrics = new MetricsComponent("metrics", MetricsConfig.defaults());
        metrics.initialize();

        assertThrows(IllegalStateException.class, metrics::initialize);
        metrics.stop();
    }
}
