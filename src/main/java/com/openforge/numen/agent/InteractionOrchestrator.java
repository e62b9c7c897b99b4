package com.openforge.numen.agent;

import com.openforge.numen.config.RuntimeProperties;
import com.openforge.numen.contract.AgentConfiguration;
import com.openforge.numen.contract.AgentContract;
import com.openforge.numen.contract.ContractService;
import com.openforge.numen.domain.ConversationThread;
import com.openforge.numen.domain.ThreadMessage;
import com.openforge.numen.llm.CompletionProvider;
import com.openforge.numen.llm.model.ChatRequest;
import com.openforge.numen.llm.model.Message;
import com.openforge.numen.memory.MemoryContext;
import com.openforge.numen.memory.MemoryManager;
import com.openforge.numen.persona.TraitModulator;
import com.openforge.numen.thread.ThreadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * One conversational turn, end to end:
 *
 *   1. LOAD       the agent's contract (NotFound when unknown or archived)
 *   2. THREAD     resolve or open the conversation thread
 *   3. RECALL     memory context: retrieved memories + recent turns
 *   4. RENDER     persona prompt from the trait modulator, plus the context
 *   5. COMPLETE   completion provider call
 *   6. RECORD     both turns to the thread, the exchange to long-term memory
 *
 * No turn is written before step 5 succeeds, so a provider failure leaves no
 * partial turn behind. Step 2 may already have opened an empty thread and
 * step 3 bumps access counters of recalled memories. Once step 5 has returned, the turn is recorded even if
 * the caller cancelled meanwhile: the user may already have seen the reply.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InteractionOrchestrator {

    private final ContractService    contractService;
    private final ThreadService      threadService;
    private final MemoryManager      memoryManager;
    private final TraitModulator     modulator;
    private final CompletionProvider completionProvider;
    private final RuntimeProperties  runtimeProperties;
    private final ExecutorService    interactionExecutor;

    // ── Entry points ─────────────────────────────────────────────────────────

    public InteractionResult process(String agentId, String tenantId, String userId,
                                     String userInput, String threadId) {
        if (userInput == null || userInput.isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }

        AgentContract contract = contractService.get(agentId, tenantId);
        ConversationThread thread = threadService.getOrCreate(agentId, userId, tenantId, threadId);
        AgentConfiguration config = contract.configuration() != null
                ? contract.configuration()
                : AgentConfiguration.defaults(runtimeProperties.memoryK(), runtimeProperties.threadWindow());

        int k = contract.usesMemory() ? config.memoryK() : 0;
        MemoryContext context = memoryManager.assembleContext(
                tenantId, agentId, userInput, thread.getId(), userId, k, config.threadWindow());

        ChatRequest request = ChatRequest.builder()
                .model(config.llmModel())
                .messages(buildMessages(contract, context, userInput))
                .temperature(config.temperature())
                .maxTokens(config.maxTokens())
                .build();
        String reply = completionProvider.complete(request).firstContent();

        Map<String, Object> turnMetadata = new LinkedHashMap<>();
        turnMetadata.put("memory_confidence", context.confidence());
        turnMetadata.put("retrieved_memories", context.retrieved().size());

        List<ThreadMessage> turns;
        boolean interrupted = Thread.interrupted();
        try {
            turns = memoryManager.recordTurn(tenantId, agentId, thread.getId(), userInput, reply,
                    userId, contract.usesMemory(), turnMetadata);
            contractService.recordInteraction(agentId);
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("memory_confidence", context.confidence());
        metadata.put("message_count", turns.get(turns.size() - 1).getSequence());
        metadata.put("retrieved_memories", context.retrieved().size());
        metadata.put("agent_version", contract.version());

        log.info("[Interaction] agent={} thread={} messages={} confidence={}",
                agentId, thread.getId(), metadata.get("message_count"), context.confidence());
        return new InteractionResult(thread.getId(), reply, metadata);
    }

    /**
     * Runs {@link #process} on the interaction pool. Cancelling the Future
     * with interruption aborts a turn whose completion call is still pending.
     */
    public Future<InteractionResult> processAsync(String agentId, String tenantId, String userId,
                                                  String userInput, String threadId) {
        return interactionExecutor.submit(() -> process(agentId, tenantId, userId, userInput, threadId));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<Message> buildMessages(AgentContract contract, MemoryContext context, String userInput) {
        String systemPrompt = modulator.render(contract).systemPrompt();
        String memoryBlock = context.formatForPrompt();
        if (memoryBlock != null) {
            systemPrompt = systemPrompt + "\n" + memoryBlock;
        }

        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(systemPrompt));
        for (ThreadMessage turn : context.recent()) {
            messages.add(new Message(turn.getRole().wireName(), turn.getContent()));
        }
        messages.add(Message.user(userInput));
        return messages;
    }
}
