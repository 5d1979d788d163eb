package com.componentwatch.monitor;

import com.componentwatch.config.WatchProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class WatchPropertiesGuardrailTest {

    @Test
    void configPathFallsBackToDefault() {
        WatchProperties properties = new WatchProperties();
        properties.setConfigPath("   ");
        assertEquals("config_components.json", properties.getConfigPath());
    }

    @Test
    void blankWebhookMeansNotConfigured() {
        WatchProperties properties = new WatchProperties();
        properties.getDigest().setWebhookUrl(" ");
        assertNull(properties.getDigest().getWebhookUrl());
    }

    @Test
    void numericSettingsAreClamped() {
        WatchProperties properties = new WatchProperties();
        properties.getCrawl().setMaxWorkers(-3);
        properties.getRender().setTimeoutMs(10);
        properties.getRender().setSettleMs(-1);
        properties.getDigest().setWindowHours(0);
        properties.getApi().setMaxAlertLimit(0);
        assertEquals(0, properties.getCrawl().getMaxWorkers());
        assertEquals(4, properties.getCrawl().resolveWorkerCount(4));
        assertEquals(1, properties.getCrawl().resolveWorkerCount(0));
        assertEquals(1000, properties.getRender().getTimeoutMs());
        assertEquals(0, properties.getRender().getSettleMs());
        assertEquals(1, properties.getDigest().getWindowHours());
        assertEquals(1, properties.getApi().getMaxAlertLimit());
    }
}
