package com.openforge.numen.memory;

import com.openforge.numen.contract.ContractService;
import com.openforge.numen.memory.dto.UserMemoryRequest;
import com.openforge.numen.web.RequestHeaders;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * User-scoped memory of an agent.
 *
 *   POST /api/agents/{agentId}/memories       store a memory for the calling user
 *   GET  /api/agents/{agentId}/preferences    best matching preference, ?query=
 */
@RestController
@RequestMapping("/api/agents/{agentId}")
@RequiredArgsConstructor
public class MemoryController {

    private final MemoryManager   memoryManager;
    private final ContractService contractService;

    @PostMapping("/memories")
    public ResponseEntity<Map<String, String>> remember(
            @RequestHeader(RequestHeaders.TENANT) String tenantId,
            @RequestHeader(RequestHeaders.USER) String userId,
            @PathVariable String agentId,
            @Valid @RequestBody UserMemoryRequest request) {

        contractService.get(agentId, tenantId);
        String id = memoryManager.rememberForUser(tenantId, agentId, userId,
                request.content(), request.memoryType(), request.metadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", id));
    }

    @GetMapping("/preferences")
    public Map<String, Object> preferences(
            @RequestHeader(RequestHeaders.TENANT) String tenantId,
            @RequestHeader(RequestHeaders.USER) String userId,
            @PathVariable String agentId,
            @RequestParam String query) {

        contractService.get(agentId, tenantId);
        return memoryManager.recallUserPreferences(tenantId, agentId, userId, query);
    }
}
