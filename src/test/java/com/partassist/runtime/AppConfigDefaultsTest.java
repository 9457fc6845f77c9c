package com.partassist.runtime;

import java.io.IOException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.partassist.match.MatcherSettings;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigDefaultsTest {

    @Test
    void shouldDefaultToSafeLocalSettings() {
        AppConfig config = new AppConfig();

        assertTrue(config.getProviders().isEmpty());
        assertEquals(MatcherSettings.defaults(), config.getMatcher().toSettings());
        assertEquals(1_800_000, config.getSessions().getIdleTimeoutMs());
        assertEquals(10, config.getSessions().getContextTurns());
        assertEquals("PARTASSIST_JWT_SECRET", config.getAuth().getSecretEnv());
        assertNull(config.getAuth().getSecret());
        assertFalse(config.getFallback().getMessage().isBlank());
        assertTrue(config.getRouting().isEnabled());
    }

    @Test
    void shouldLoadShippedConfiguration() throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

        AppConfig config = mapper.readValue(Path.of("src/main/resources/application.yml").toFile(), AppConfig.class);

        assertEquals(3, config.getProviders().size());
        assertEquals("openai", config.getProviders().get(0).getName());
        assertEquals("OPENAI_API_KEY", config.getProviders().get(0).getApiKeyEnv());
        assertEquals("deepseek", config.getProviders().get(1).getName());
        assertFalse(config.getProviders().get(2).isEnabled());
        assertEquals("text-generation", config.getProviders().get(2).getType());
        assertEquals(0.20, config.getMatcher().getThreshold(), 1e-9);
        assertTrue(config.getMatcher().getDomainTerms().contains("refrigerator"));
        assertTrue(config.getAuth().getSecret().length() >= 32);
        assertTrue(config.getRouting().isEnabled());
    }
}
