/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.flowgraph.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for FlowgraphConfiguration.
 * Validates default values, explicit properties, system property overrides and type conversion.
 */
class FlowgraphConfigurationTest {

    private FlowgraphConfiguration config;

    @BeforeEach
    void setUp() {
        config = new FlowgraphConfiguration(new Properties());
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(FlowgraphConfiguration.RETRY_MAX_ATTEMPTS);
        System.clearProperty(FlowgraphConfiguration.METRICS_ENABLED);
    }

    // ========== Default Configuration Tests ==========

    @Test
    void testDefaultRetrySettings() {
        assertEquals(1, config.getDefaultMaxAttempts());
        assertEquals(1000, config.getDefaultRetryInitialDelayMs());
        assertEquals(300000, config.getDefaultRetryMaxDelayMs());
    }

    @Test
    void testDefaultEngineSettings() {
        assertEquals(2, config.getSchedulerThreads());
        assertEquals(30000, config.getServiceTimeoutMs());
        assertEquals(86400000, config.getStoreMaxAgeMs());
        assertEquals(60000, config.getStorePurgeIntervalMs());
        assertTrue(config.isMetricsEnabled());
    }

    // ========== Explicit Properties ==========

    @Test
    void testExplicitPropertiesOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty(FlowgraphConfiguration.RETRY_MAX_ATTEMPTS, "5");
        props.setProperty(FlowgraphConfiguration.SERVICE_TIMEOUT_MS, "2500");
        props.setProperty(FlowgraphConfiguration.METRICS_ENABLED, "false");

        FlowgraphConfiguration custom = new FlowgraphConfiguration(props);

        assertEquals(5, custom.getDefaultMaxAttempts());
        assertEquals(2500, custom.getServiceTimeoutMs());
        assertFalse(custom.isMetricsEnabled());
    }

    @Test
    void testInvalidNumbersFallBackToDefaults() {
        Properties props = new Properties();
        props.setProperty(FlowgraphConfiguration.RETRY_MAX_ATTEMPTS, "many");
        props.setProperty(FlowgraphConfiguration.SERVICE_TIMEOUT_MS, "soon");

        FlowgraphConfiguration custom = new FlowgraphConfiguration(props);

        assertEquals(1, custom.getDefaultMaxAttempts());
        assertEquals(30000, custom.getServiceTimeoutMs());
    }

    @Test
    void testAttemptsAndThreadsNeverBelowOne() {
        Properties props = new Properties();
        props.setProperty(FlowgraphConfiguration.RETRY_MAX_ATTEMPTS, "0");
        props.setProperty(FlowgraphConfiguration.SCHEDULER_THREADS, "-3");

        FlowgraphConfiguration custom = new FlowgraphConfiguration(props);

        assertEquals(1, custom.getDefaultMaxAttempts());
        assertEquals(1, custom.getSchedulerThreads());
    }

    // ========== System Properties ==========

    @Test
    void testSystemPropertiesOverrideDefaults() {
        System.setProperty(FlowgraphConfiguration.RETRY_MAX_ATTEMPTS, "4");
        System.setProperty(FlowgraphConfiguration.METRICS_ENABLED, "false");

        FlowgraphConfiguration loaded = new FlowgraphConfiguration();

        assertEquals(4, loaded.getDefaultMaxAttempts());
        assertFalse(loaded.isMetricsEnabled());
    }

    // ========== Generic Access ==========

    @Test
    void testGenericPropertyAccess() {
        assertNull(config.getProperty("flowgraph.unknown"));
        assertEquals("fallback", config.getProperty("flowgraph.unknown", "fallback"));

        config.setProperty("flowgraph.custom", "value");
        assertEquals("value", config.getProperty("flowgraph.custom"));
    }

    @Test
    void testToStringMentionsKeySettings() {
        String text = config.toString();
        assertTrue(text.contains("defaultMaxAttempts=1"));
        assertTrue(text.contains("metricsEnabled=true"));
    }
}
