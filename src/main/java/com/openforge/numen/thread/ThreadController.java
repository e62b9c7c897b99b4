package com.openforge.numen.thread;

import com.openforge.numen.error.NotFoundException;
import com.openforge.numen.thread.dto.MessageResponse;
import com.openforge.numen.thread.dto.ThreadResponse;
import com.openforge.numen.web.RequestHeaders;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Thread browsing and lifecycle.
 *
 *   GET    /api/agents/{agentId}/threads       caller's active threads with the agent
 *   GET    /api/threads/{threadId}/messages    last ?limit= messages, oldest first
 *   POST   /api/threads/{threadId}/archive
 *   DELETE /api/threads/{threadId}             thread and its messages
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ThreadController {

    private static final int MAX_PAGE = 200;

    private final ThreadService threadService;

    @GetMapping("/agents/{agentId}/threads")
    public List<ThreadResponse> listActive(@RequestHeader(RequestHeaders.TENANT) String tenantId,
                                           @RequestHeader(RequestHeaders.USER) String userId,
                                           @PathVariable String agentId) {
        return threadService.listActive(tenantId, agentId, userId).stream()
                .map(ThreadResponse::from)
                .toList();
    }

    @GetMapping("/threads/{threadId}/messages")
    public List<MessageResponse> messages(@RequestHeader(RequestHeaders.TENANT) String tenantId,
                                          @PathVariable String threadId,
                                          @RequestParam(defaultValue = "50") int limit) {
        threadService.get(threadId, tenantId);
        return threadService.recent(threadId, Math.min(limit, MAX_PAGE)).stream()
                .map(MessageResponse::from)
                .toList();
    }

    @PostMapping("/threads/{threadId}/archive")
    public ResponseEntity<Void> archive(@RequestHeader(RequestHeaders.TENANT) String tenantId,
                                        @PathVariable String threadId) {
        if (!threadService.archive(threadId, tenantId)) {
            throw NotFoundException.thread(threadId);
        }
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/threads/{threadId}")
    public ResponseEntity<Void> delete(@RequestHeader(RequestHeaders.TENANT) String tenantId,
                                       @PathVariable String threadId) {
        if (!threadService.delete(threadId, tenantId)) {
            throw NotFoundException.thread(threadId);
        }
        return ResponseEntity.noContent().build();
    }
}
