package com.openforge.numen.llm;

import com.openforge.numen.error.ProviderException;
import com.openforge.numen.llm.model.ChatRequest;
import com.openforge.numen.llm.model.ChatResponse;

/**
 * Text generation behind the orchestrator.
 */
public interface CompletionProvider {

    /**
     * Blocking completion. Honors thread interruption.
     *
     * @throws ProviderException on any provider failure, including
     *         {@link com.openforge.numen.error.ProviderTimeoutException}
     */
    ChatResponse complete(ChatRequest request);
}
