package com.openforge.numen.thread;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.numen.domain.ConversationThread;
import com.openforge.numen.domain.ConversationThread.ThreadStatus;
import com.openforge.numen.domain.ThreadMessage;
import com.openforge.numen.domain.ThreadMessage.Role;
import com.openforge.numen.error.NotFoundException;
import com.openforge.numen.repository.ConversationThreadRepository;
import com.openforge.numen.repository.ThreadMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Conversation threads and their ordered messages.
 *
 * Appends lock the thread row, so the message sequence and the thread's
 * message_count move together and concurrent appends to one thread are
 * serialized by the database. Appends to different threads never contend.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ThreadService {

    static final int TITLE_MAX_CHARS = 60;

    private final ConversationThreadRepository threadRepository;
    private final ThreadMessageRepository      messageRepository;
    private final ObjectMapper                 objectMapper;

    // ── Resolve ──────────────────────────────────────────────────────────────

    /**
     * Returns the caller's active thread {@code threadId}, or a new thread
     * when the id is absent or does not resolve to an active thread owned by
     * this agent, user and tenant. The caller cannot tell the two apart.
     */
    @Transactional
    public ConversationThread getOrCreate(String agentId, String userId, String tenantId, String threadId) {
        if (threadId != null && !threadId.isBlank()) {
            var existing = threadRepository.findByIdAndAgentIdAndUserIdAndTenantIdAndStatus(
                    threadId, agentId, userId, tenantId, ThreadStatus.ACTIVE);
            if (existing.isPresent()) {
                return existing.get();
            }
            log.debug("[Thread] {} not usable for agent={} user={}, starting a new thread", threadId, agentId, userId);
        }
        ConversationThread created = threadRepository.save(ConversationThread.builder()
                .agentId(agentId)
                .userId(userId)
                .tenantId(tenantId)
                .build());
        log.info("[Thread] Created thread {} for agent={} user={} tenant={}",
                created.getId(), agentId, userId, tenantId);
        return created;
    }

    @Transactional(readOnly = true)
    public ConversationThread get(String threadId, String tenantId) {
        return threadRepository.findById(threadId)
                .filter(t -> t.getTenantId().equals(tenantId))
                .orElseThrow(() -> NotFoundException.thread(threadId));
    }

    @Transactional(readOnly = true)
    public List<ConversationThread> listActive(String tenantId, String agentId, String userId) {
        return threadRepository.findByTenantIdAndAgentIdAndUserIdAndStatusOrderByLastMessageAtDesc(
                tenantId, agentId, userId, ThreadStatus.ACTIVE);
    }

    // ── Append ───────────────────────────────────────────────────────────────

    /**
     * Inserts a message and advances the thread's counter in one transaction.
     *
     * @throws NotFoundException when the thread does not exist
     */
    @Transactional
    public ThreadMessage append(String threadId, Role role, String content, Map<String, Object> metadata) {
        ConversationThread thread = threadRepository.lockById(threadId)
                .orElseThrow(() -> NotFoundException.thread(threadId));
        return appendLocked(thread, role, content, metadata);
    }

    /** User turn then assistant turn, both or neither. */
    @Transactional
    public List<ThreadMessage> appendExchange(String threadId, String userInput, String response,
                                              Map<String, Object> assistantMetadata) {
        ConversationThread thread = threadRepository.lockById(threadId)
                .orElseThrow(() -> NotFoundException.thread(threadId));
        ThreadMessage user = appendLocked(thread, Role.USER, userInput, null);
        ThreadMessage assistant = appendLocked(thread, Role.ASSISTANT, response, assistantMetadata);
        return List.of(user, assistant);
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    /** The last {@code limit} messages, oldest first. */
    @Transactional(readOnly = true)
    public List<ThreadMessage> recent(String threadId, int limit) {
        if (limit <= 0) return List.of();
        List<ThreadMessage> newestFirst = new ArrayList<>(
                messageRepository.findByThreadIdOrderBySequenceDesc(threadId, PageRequest.of(0, limit)));
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    @Transactional
    public boolean archive(String threadId, String tenantId) {
        ConversationThread thread = threadRepository.findById(threadId)
                .filter(t -> t.getTenantId().equals(tenantId))
                .orElse(null);
        if (thread == null || thread.getStatus() == ThreadStatus.ARCHIVED) {
            return false;
        }
        thread.setStatus(ThreadStatus.ARCHIVED);
        threadRepository.save(thread);
        log.info("[Thread] Archived thread {}", threadId);
        return true;
    }

    /** Removes the thread and all of its messages. */
    @Transactional
    public boolean delete(String threadId, String tenantId) {
        ConversationThread thread = threadRepository.findById(threadId)
                .filter(t -> t.getTenantId().equals(tenantId))
                .orElse(null);
        if (thread == null) {
            return false;
        }
        int removed = messageRepository.deleteByThreadId(threadId);
        threadRepository.delete(thread);
        log.info("[Thread] Deleted thread {} ({} messages)", threadId, removed);
        return true;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private ThreadMessage appendLocked(ConversationThread thread, Role role, String content,
                                       Map<String, Object> metadata) {
        int sequence = thread.getMessageCount() + 1;
        ThreadMessage message = messageRepository.save(ThreadMessage.builder()
                .threadId(thread.getId())
                .sequence(sequence)
                .role(role)
                .content(content)
                .metadata(writeMetadata(metadata))
                .build());

        thread.setMessageCount(sequence);
        thread.setLastMessageAt(LocalDateTime.now());
        if (thread.getTitle() == null && role == Role.USER) {
            thread.setTitle(title(content));
        }
        threadRepository.save(thread);
        log.debug("[Thread] {} #{} {}", thread.getId(), sequence, role.wireName());
        return message;
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Message metadata is not serializable", e);
        }
    }

    static String title(String content) {
        String line = content.strip().replaceAll("\\s+", " ");
        return line.length() <= TITLE_MAX_CHARS ? line : line.substring(0, TITLE_MAX_CHARS - 3) + "...";
    }
}
