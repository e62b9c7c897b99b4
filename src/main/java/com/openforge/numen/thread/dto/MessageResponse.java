package com.openforge.numen.thread.dto;

import com.openforge.numen.domain.ThreadMessage;

import java.time.LocalDateTime;

/**
 * One thread message as returned by GET /api/threads/{threadId}/messages.
 */
public record MessageResponse(
        int sequence,
        String role,
        String content,
        LocalDateTime createTime
) {

    public static MessageResponse from(ThreadMessage message) {
        return new MessageResponse(
                message.getSequence(),
                message.getRole().wireName(),
                message.getContent(),
                message.getCreateTime()
        );
    }
}
