package com.cratemind.core.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LlmProviderTest {

    @Test
    @DisplayName("identifiers resolve ignoring case and whitespace")
    void fromId() {
        assertEquals(LlmProvider.OPENAI, LlmProvider.fromId("openai"));
        assertEquals(LlmProvider.ANTHROPIC, LlmProvider.fromId("  Anthropic "));
    }

    @Test
    @DisplayName("unknown and null identifiers are configuration errors")
    void unknown() {
        assertThrows(ClassifierConfigurationException.class, () -> LlmProvider.fromId("mistral"));
        assertThrows(ClassifierConfigurationException.class, () -> LlmProvider.fromId(null));
    }

    @Test
    @DisplayName("each provider names its credential variable")
    void credentialVariables() {
        assertEquals("OPENAI_API_KEY", LlmProvider.OPENAI.credentialVariable());
        assertEquals("ANTHROPIC_API_KEY", LlmProvider.ANTHROPIC.credentialVariable());
        assertEquals("'openai' or 'anthropic'", LlmProvider.supportedIds());
    }
}
