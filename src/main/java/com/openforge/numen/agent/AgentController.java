package com.openforge.numen.agent;

import com.openforge.numen.agent.dto.RollbackRequest;
import com.openforge.numen.contract.AgentContract;
import com.openforge.numen.contract.AgentStatus;
import com.openforge.numen.contract.AgentType;
import com.openforge.numen.contract.ContractFilter;
import com.openforge.numen.contract.ContractPatch;
import com.openforge.numen.contract.ContractService;
import com.openforge.numen.contract.ContractSnapshot;
import com.openforge.numen.error.NotFoundException;
import com.openforge.numen.web.RequestHeaders;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for agent contracts.
 *
 * Endpoints:
 *   POST   /api/agents                       create (201)
 *   GET    /api/agents                       list, ?status=&type=&tag=&limit=&offset=
 *   GET    /api/agents/{agentId}             current contract
 *   PATCH  /api/agents/{agentId}             partial update, bumps the version
 *   DELETE /api/agents/{agentId}             archive (204)
 *   GET    /api/agents/{agentId}/versions    version history, oldest first
 *   POST   /api/agents/{agentId}/rollback    re-apply a historical version
 *
 * Tenant and caller come from the X-Tenant-Id / X-User-Id headers.
 */
@Slf4j
@RestController
@RequestMapping("/api/agents")
@RequiredArgsConstructor
public class AgentController {

    private final ContractService contractService;

    // ── Create ───────────────────────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<AgentContract> create(
            @RequestHeader(RequestHeaders.TENANT) String tenantId,
            @RequestHeader(RequestHeaders.USER) String userId,
            @RequestBody AgentContract body) {

        AgentContract draft = body.toBuilder()
                .tenantId(tenantId)
                .ownerId(body.ownerId() != null ? body.ownerId() : userId)
                .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(contractService.create(draft));
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    @GetMapping
    public List<AgentContract> list(
            @RequestHeader(RequestHeaders.TENANT) String tenantId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String tag,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {

        return contractService.list(tenantId, new ContractFilter(
                AgentStatus.fromWire(status), AgentType.fromWire(type), tag, limit, offset));
    }

    @GetMapping("/{agentId}")
    public AgentContract get(@RequestHeader(RequestHeaders.TENANT) String tenantId,
                             @PathVariable String agentId) {
        return contractService.get(agentId, tenantId);
    }

    @GetMapping("/{agentId}/versions")
    public List<ContractSnapshot> history(@RequestHeader(RequestHeaders.TENANT) String tenantId,
                                          @PathVariable String agentId) {
        return contractService.history(agentId, tenantId);
    }

    // ── Mutate ───────────────────────────────────────────────────────────────

    @PatchMapping("/{agentId}")
    public AgentContract update(
            @RequestHeader(RequestHeaders.TENANT) String tenantId,
            @RequestHeader(value = RequestHeaders.USER, required = false) String userId,
            @PathVariable String agentId,
            @RequestBody ContractPatch patch) {

        ContractPatch effective = patch.updatedBy() != null ? patch : patch.toBuilder().updatedBy(userId).build();
        return contractService.update(agentId, tenantId, effective);
    }

    @PostMapping("/{agentId}/rollback")
    public AgentContract rollback(
            @RequestHeader(RequestHeaders.TENANT) String tenantId,
            @RequestHeader(value = RequestHeaders.USER, required = false) String userId,
            @PathVariable String agentId,
            @Valid @RequestBody RollbackRequest request) {

        return contractService.rollback(agentId, tenantId, request.version(), userId);
    }

    @DeleteMapping("/{agentId}")
    public ResponseEntity<Void> archive(
            @RequestHeader(RequestHeaders.TENANT) String tenantId,
            @RequestHeader(value = RequestHeaders.USER, required = false) String userId,
            @PathVariable String agentId) {

        if (!contractService.archive(agentId, tenantId, userId)) {
            throw NotFoundException.agent(agentId, tenantId);
        }
        log.info("[Controller] Archived agent {} (tenant {})", agentId, tenantId);
        return ResponseEntity.noContent().build();
    }
}
