package com.fhi.libraries.app_unittest.config;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HarnessPropertiesTest
{
    @Test
    @DisplayName("Kebab-case YAML keys and ISO durations are read; unknown keys are ignored")
    void testLoadFromYaml()
    {
        // WHEN
        HarnessProperties props = HarnessProperties.load("harness-properties-sample.yaml");

        // THEN
        assertFalse(props.getClient().isUseCookies());
        assertEquals("0.0.0.0", props.getLive().getHost());
        assertEquals(8123, props.getLive().getPort());
        assertEquals(Duration.ofSeconds(3), props.getLive().getReadinessTimeout());
        assertEquals(Duration.ofMillis(100), props.getLive().getPollInterval());
        assertTrue(props.getApp().isIsolateDataDirectory());
        assertEquals("greeting.data-dir", props.getApp().getDataDirectoryProperty());
    }

    @Test
    @DisplayName("A missing configuration resource means defaults")
    void testDefaults()
    {
        HarnessProperties props = HarnessProperties.load("no-such-file.yaml");

        assertTrue(props.getClient().isUseCookies());
        assertEquals("127.0.0.1", props.getLive().getHost());
        assertEquals(5000, props.getLive().getPort());
        assertEquals(Duration.ofSeconds(10), props.getLive().getReadinessTimeout());
        assertEquals(Duration.ofMillis(50), props.getLive().getPollInterval());
        assertFalse(props.getApp().isIsolateDataDirectory());
        assertEquals("app.data-dir", props.getApp().getDataDirectoryProperty());
    }

    @Test
    @DisplayName("The process-wide instance is loaded once, from app-unittest.yaml")
    void testProcessWideInstance()
    {
        HarnessProperties props = HarnessProperties.get();

        assertSame(props, HarnessProperties.get());
        assertEquals(Duration.ofSeconds(5), props.getLive().getReadinessTimeout());
    }
}
