package com.alertengine.service;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {
    @Test
    void defaultsWithoutEnvironment() {
        List<String> warnings = new ArrayList<>();

        Main.RuntimeFlags flags = Main.resolveRuntimeFlags(Map.of(), warnings::add);

        assertEquals(8080, flags.apiPort());
        assertEquals("state/alerts.json", flags.alertStore());
        assertEquals(Path.of("config"), flags.configDir());
        assertFalse(flags.augmentationEnabled());
        assertTrue(warnings.isEmpty());
    }

    @Test
    void readsOverridesAndEnablesAugmentationWithKey() {
        Main.RuntimeFlags flags = Main.resolveRuntimeFlags(Map.of(
                "API_PORT", "9090",
                "ALERT_STORE", Main.MEMORY_STORE,
                "LLM_API_KEY", "sk-test",
                "LLM_MODEL", "small-model"
        ), message -> {
        });

        assertEquals(9090, flags.apiPort());
        assertEquals(Main.MEMORY_STORE, flags.alertStore());
        assertTrue(flags.augmentationEnabled());
        assertEquals("small-model", flags.llmModel());
        assertEquals("https://api.openai.com/v1", flags.llmBaseUrl());
    }

    @Test
    void invalidPortWarnsAndFallsBack() {
        List<String> warnings = new ArrayList<>();

        Main.RuntimeFlags flags = Main.resolveRuntimeFlags(Map.of("API_PORT", "eighty"), warnings::add);

        assertEquals(8080, flags.apiPort());
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).contains("API_PORT=eighty"));
    }
}
