package io.leavesfly.meer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LLMProviderConfig 单元测试
 */
class LLMProviderConfigTest {

    @Test
    void testExplicitBaseUrlWins() {
        LLMProviderConfig config = LLMProviderConfig.builder()
                .type(LLMProviderConfig.ProviderType.OPENAI)
                .baseUrl("http://proxy.internal/v1")
                .build();

        assertEquals("http://proxy.internal/v1", config.resolveBaseUrl());
    }

    @Test
    void testBaseUrlInferredFromType() {
        assertEquals("https://api.deepseek.com/v1", LLMProviderConfig.builder()
                .type(LLMProviderConfig.ProviderType.DEEPSEEK)
                .build()
                .resolveBaseUrl());
        assertEquals("http://localhost:11434/v1", LLMProviderConfig.builder()
                .type(LLMProviderConfig.ProviderType.OLLAMA)
                .baseUrl("  ")
                .build()
                .resolveBaseUrl());
    }

    @Test
    void testCustomTypeHasNoDefault() {
        LLMProviderConfig config = LLMProviderConfig.builder().build();

        assertEquals(LLMProviderConfig.ProviderType.CUSTOM, config.getType());
        assertNull(config.resolveBaseUrl());
    }

    @Test
    void testTypeReadFromJson() throws Exception {
        LLMProviderConfig config = new ObjectMapper()
                .readValue("{\"type\": \"openrouter\", \"api_key\": \"sk-1\"}", LLMProviderConfig.class);

        assertEquals(LLMProviderConfig.ProviderType.OPENROUTER, config.getType());
        assertEquals("https://openrouter.ai/api/v1", config.resolveBaseUrl());
    }
}
