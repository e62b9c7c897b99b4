package com.openforge.numen.memory;

import com.openforge.numen.config.RuntimeProperties;
import com.openforge.numen.domain.MemoryEntry;
import com.openforge.numen.domain.ThreadMessage;
import com.openforge.numen.error.PersistenceException;
import com.openforge.numen.thread.ThreadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the memory context of a turn and records finished turns.
 *
 * Reads never fail: an embedding or store fault leaves the retrieved set
 * empty and is logged. Of the writes, only the thread append is fatal;
 * the derived long-term memory is best-effort.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@EnableConfigurationProperties({RuntimeProperties.class, MemoryScoringProperties.class})
public class MemoryManager {

    private final MemoryStore        store;
    private final EmbeddingProvider  embeddings;
    private final HybridMemoryScorer scorer;
    private final ThreadService      threads;
    private final RuntimeProperties  runtime;

    // ── Read path ────────────────────────────────────────────────────────────

    /**
     * Retrieves up to {@code k} agent memories (plus a few of the user's own
     * when {@code userId} is given) and the last {@code window} thread turns.
     * {@code k <= 0} skips retrieval entirely.
     */
    public MemoryContext assembleContext(String tenantId, String agentId, String userInput,
                                         String threadId, String userId, int k, int window) {
        List<ThreadMessage> recent = recentTurns(threadId, window);
        List<MemoryRecord> retrieved = k > 0 ? retrieve(tenantId, agentId, userInput, userId, k) : List.of();
        double confidence = confidence(retrieved);

        if (!retrieved.isEmpty()) {
            try {
                store.touch(retrieved.stream().map(MemoryRecord::id).toList());
            } catch (RuntimeException e) {
                log.warn("[Memory] Failed to reinforce {} entries: {}", retrieved.size(), e.getMessage());
            }
        }
        log.debug("[Memory] agent={} thread={} retrieved={} recent={} confidence={}",
                agentId, threadId, retrieved.size(), recent.size(), confidence);
        return new MemoryContext(retrieved, recent, confidence);
    }

    /**
     * Metadata of the best-matching preference the user has stored with this
     * agent, or an empty map.
     */
    public Map<String, Object> recallUserPreferences(String tenantId, String agentId, String userId, String query) {
        try {
            float[] embedding = embeddings.embed(query);
            return store.search(MemoryQuery.exact(MemoryNamespace.user(tenantId, agentId, userId), embedding, 1)
                            .ofType(MemoryEntry.TYPE_PREFERENCE))
                    .stream()
                    .findFirst()
                    .map(MemoryRecord::metadata)
                    .orElse(Map.of());
        } catch (RuntimeException e) {
            log.warn("[Memory] Preference recall failed for user {}: {}", userId, e.getMessage());
            return Map.of();
        }
    }

    // ── Write path ───────────────────────────────────────────────────────────

    /**
     * Appends the user and assistant turns to the thread, then stores the
     * exchange as a conversation memory of the agent when {@code remember}.
     *
     * @throws PersistenceException when the thread append fails; nothing of
     *         the turn is recorded in that case
     */
    public List<ThreadMessage> recordTurn(String tenantId, String agentId, String threadId, String userInput,
                                          String response, String userId, boolean remember,
                                          Map<String, Object> assistantMetadata) {
        List<ThreadMessage> turns;
        try {
            turns = threads.appendExchange(threadId, userInput, response, assistantMetadata);
        } catch (DataAccessException | TransactionException e) {
            throw new PersistenceException("Failed to record turn on thread " + threadId, e);
        }

        if (remember) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("thread_id", threadId);
            if (userId != null) metadata.put("user_id", userId);
            try {
                String content = "User: " + userInput + "\nAssistant: " + response;
                store.put(new MemoryDraft(MemoryNamespace.agent(tenantId, agentId), content,
                        embeddings.embed(content), MemoryEntry.TYPE_CONVERSATION, metadata));
            } catch (RuntimeException e) {
                log.warn("[Memory] Conversation memory not stored for thread {}: {}", threadId, e.getMessage());
            }
        }
        return turns;
    }

    /**
     * Stores {@code content} in the user's namespace under this agent.
     *
     * @return the entry id
     */
    public String rememberForUser(String tenantId, String agentId, String userId, String content,
                                  String memoryType, Map<String, Object> metadata) {
        MemoryNamespace ns = MemoryNamespace.user(tenantId, agentId, userId);
        String id = store.put(new MemoryDraft(ns, content, embeddings.embed(content),
                memoryType != null ? memoryType : MemoryEntry.TYPE_PREFERENCE, metadata));
        log.info("[Memory] Stored {} memory {} for user {}", memoryType, id, userId);
        return id;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<MemoryRecord> retrieve(String tenantId, String agentId, String userInput, String userId, int k) {
        if (userInput == null || userInput.isBlank()) return List.of();
        try {
            float[] query = embeddings.embed(userInput);
            LocalDateTime now = LocalDateTime.now();

            List<MemoryRecord> hits = new ArrayList<>(
                    ranked(MemoryNamespace.agent(tenantId, agentId), query, k, now));
            if (userId != null && !userId.isBlank()) {
                int userK = Math.min(runtime.userMemoryK(), k);
                if (userK > 0) {
                    hits.addAll(ranked(MemoryNamespace.user(tenantId, agentId, userId), query, userK, now));
                }
            }

            Map<String, MemoryRecord> unique = new LinkedHashMap<>();
            hits.forEach(r -> unique.putIfAbsent(r.id(), r));
            return unique.values().stream().sorted(HybridMemoryScorer.BY_SCORE).toList();
        } catch (RuntimeException e) {
            log.warn("[Memory] Retrieval degraded to empty for agent {}: {}", agentId, e.getMessage());
            return List.of();
        }
    }

    private List<MemoryRecord> ranked(MemoryNamespace ns, float[] query, int limit, LocalDateTime now) {
        int candidates = limit * Math.max(runtime.candidateMultiplier(), 1);
        return scorer.rank(store.search(MemoryQuery.exact(ns, query, candidates)), limit, now);
    }

    private List<ThreadMessage> recentTurns(String threadId, int window) {
        if (threadId == null || window <= 0) return List.of();
        try {
            return threads.recent(threadId, window);
        } catch (RuntimeException e) {
            log.warn("[Memory] Recent turns unavailable for thread {}: {}", threadId, e.getMessage());
            return List.of();
        }
    }

    static double confidence(List<MemoryRecord> retrieved) {
        if (retrieved.isEmpty()) return 0.0;
        double mean = retrieved.stream().mapToDouble(MemoryRecord::similarity).average().orElse(0.0);
        return Math.max(0.0, Math.min(1.0, mean));
    }
}
