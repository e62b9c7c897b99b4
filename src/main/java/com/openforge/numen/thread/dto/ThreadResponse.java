package com.openforge.numen.thread.dto;

import com.openforge.numen.domain.ConversationThread;

import java.time.LocalDateTime;

/**
 * A conversation thread as returned by the thread endpoints.
 */
public record ThreadResponse(
        String threadId,
        String agentId,
        String userId,
        String title,
        String status,
        int messageCount,
        LocalDateTime lastMessageAt,
        LocalDateTime createTime
) {

    public static ThreadResponse from(ConversationThread thread) {
        return new ThreadResponse(
                thread.getId(),
                thread.getAgentId(),
                thread.getUserId(),
                thread.getTitle(),
                thread.getStatus().name().toLowerCase(),
                thread.getMessageCount(),
                thread.getLastMessageAt(),
                thread.getCreateTime()
        );
    }
}
