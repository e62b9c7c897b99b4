package com.openforge.numen.contract;

import lombok.Builder;

import java.util.ArrayList;
import java.util.List;

/**
 * Runtime configuration of one agent: model selection, generation limits,
 * capability toggles and retrieval tuning.
 *
 * Every component is nullable on the wire; {@link #withDefaults(int, int)}
 * resolves the missing ones before the contract is stored.
 */
@Builder(toBuilder = true)
public record AgentConfiguration(
        String llmProvider,
        String llmModel,
        Integer maxTokens,
        Double temperature,
        Boolean memoryEnabled,
        Boolean voiceEnabled,
        Boolean toolsEnabled,
        Integer memoryK,
        Integer threadWindow
) {

    public static final String DEFAULT_PROVIDER = "openai";
    public static final String DEFAULT_MODEL    = "gpt-4o-mini";
    public static final int    DEFAULT_MAX_TOKENS = 500;
    public static final double DEFAULT_TEMPERATURE = 0.7;

    public static AgentConfiguration defaults(int memoryK, int threadWindow) {
        return AgentConfiguration.builder().build().withDefaults(memoryK, threadWindow);
    }

    public AgentConfiguration withDefaults(int defaultMemoryK, int defaultThreadWindow) {
        return new AgentConfiguration(
                llmProvider != null ? llmProvider : DEFAULT_PROVIDER,
                llmModel != null ? llmModel : DEFAULT_MODEL,
                maxTokens != null ? maxTokens : DEFAULT_MAX_TOKENS,
                temperature != null ? temperature : DEFAULT_TEMPERATURE,
                memoryEnabled != null ? memoryEnabled : Boolean.TRUE,
                voiceEnabled != null ? voiceEnabled : Boolean.FALSE,
                toolsEnabled != null ? toolsEnabled : Boolean.FALSE,
                memoryK != null ? memoryK : defaultMemoryK,
                threadWindow != null ? threadWindow : defaultThreadWindow);
    }

    /** Field-wise overlay: non-null fields of {@code patch} win. */
    public AgentConfiguration merge(AgentConfiguration patch) {
        if (patch == null) return this;
        return new AgentConfiguration(
                patch.llmProvider != null ? patch.llmProvider : llmProvider,
                patch.llmModel != null ? patch.llmModel : llmModel,
                patch.maxTokens != null ? patch.maxTokens : maxTokens,
                patch.temperature != null ? patch.temperature : temperature,
                patch.memoryEnabled != null ? patch.memoryEnabled : memoryEnabled,
                patch.voiceEnabled != null ? patch.voiceEnabled : voiceEnabled,
                patch.toolsEnabled != null ? patch.toolsEnabled : toolsEnabled,
                patch.memoryK != null ? patch.memoryK : memoryK,
                patch.threadWindow != null ? patch.threadWindow : threadWindow);
    }

    public boolean usesMemory() {
        return !Boolean.FALSE.equals(memoryEnabled);
    }

    List<String> violations() {
        List<String> out = new ArrayList<>();
        if (maxTokens != null && (maxTokens < 50 || maxTokens > 4000))
            out.add("configuration.max_tokens must be within [50,4000]");
        if (temperature != null && (temperature < 0.0 || temperature > 2.0))
            out.add("configuration.temperature must be within [0.0,2.0]");
        if (memoryK != null && (memoryK < 1 || memoryK > 20))
            out.add("configuration.memory_k must be within [1,20]");
        if (threadWindow != null && (threadWindow < 5 || threadWindow > 50))
            out.add("configuration.thread_window must be within [5,50]");
        return out;
    }
}
