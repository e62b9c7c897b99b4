package com.openforge.numen.contract;

import com.openforge.numen.web.RequestHeaders;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * Contract/artifact reconciliation.
 *
 *   POST /api/contracts/validate?auto_repair=true    bulk run over the tenant's agents
 *   GET  /api/contracts/{agentId}/check              differences, no writes
 *   POST /api/contracts/{agentId}/repair             rewrite the artifact from the store
 */
@RestController
@RequestMapping("/api/contracts")
@RequiredArgsConstructor
public class ContractController {

    private final ContractService   contractService;
    private final ContractValidator validator;

    @PostMapping("/validate")
    public ValidationReport.Summary validateAll(
            @RequestHeader(RequestHeaders.TENANT) String tenantId,
            @RequestParam(name = "auto_repair", defaultValue = "true") boolean autoRepair) {
        return validator.validateAll(tenantId, autoRepair);
    }

    @GetMapping("/{agentId}/check")
    public ValidationReport.Check check(@RequestHeader(RequestHeaders.TENANT) String tenantId,
                                        @PathVariable String agentId) {
        contractService.get(agentId, tenantId);
        return validator.check(agentId);
    }

    @PostMapping("/{agentId}/repair")
    public ValidationReport.Repair repair(@RequestHeader(RequestHeaders.TENANT) String tenantId,
                                          @PathVariable String agentId) {
        contractService.get(agentId, tenantId);
        return validator.repair(agentId);
    }
}
