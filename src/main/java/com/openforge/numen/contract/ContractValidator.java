package com.openforge.numen.contract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.numen.domain.AgentRecord;
import com.openforge.numen.error.NotFoundException;
import com.openforge.numen.repository.AgentRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reconciles the derived prompt artifact with the stored contract.
 *
 * The store always wins: {@link #repair} rewrites the artifact from the
 * stored contract and never the other way round. A repair on a consistent
 * agent writes nothing, so running it twice is a no-op the second time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContractValidator {

    private static final Set<String> IGNORED_FIELDS = Set.of("created_at", "updated_at");

    private final AgentRecordRepository agentRepository;
    private final ContractService       contractService;
    private final ContractCodec         codec;
    private final PromptArtifactCache   artifactCache;

    // ── Single agent ─────────────────────────────────────────────────────────

    public ValidationReport.Check check(String agentId) {
        AgentContract stored = loadStored(agentId);
        List<String> differences = differences(stored, artifactCache.read(agentId));
        return new ValidationReport.Check(agentId, differences.isEmpty(), differences);
    }

    public ValidationReport.Repair repair(String agentId) {
        AgentContract stored = loadStored(agentId);
        Optional<PromptArtifactCache.Artifact> cached = artifactCache.read(agentId);
        List<String> differences = differences(stored, cached);
        if (differences.isEmpty()) {
            return new ValidationReport.Repair(agentId, false, RepairAction.NONE, differences);
        }

        artifactCache.write(agentId, contractService.renderArtifact(stored));
        RepairAction action = cached.isEmpty()
                ? RepairAction.CREATED_ARTIFACT
                : RepairAction.OVERWROTE_ARTIFACT_FROM_STORE;
        log.info("[Validator] Repaired agent {} ({}): {}", agentId, action.wireName(), differences);
        return new ValidationReport.Repair(agentId, true, action, differences);
    }

    // ── Bulk ─────────────────────────────────────────────────────────────────

    /**
     * Checks every non-archived agent, of one tenant or of all tenants when
     * {@code tenantId} is null. A failure on one agent is recorded and the
     * run moves on.
     */
    public ValidationReport.Summary validateAll(String tenantId, boolean autoRepair) {
        List<AgentRecord> rows = tenantId == null
                ? agentRepository.findByStatusNot(AgentStatus.ARCHIVED)
                : agentRepository.findByTenantIdAndStatusNot(tenantId, AgentStatus.ARCHIVED);

        int valid = 0;
        int repaired = 0;
        List<ValidationReport.FailedAgent> failed = new ArrayList<>();

        for (AgentRecord row : rows) {
            try {
                if (autoRepair) {
                    ValidationReport.Repair result = repair(row.getId());
                    valid++;
                    if (result.repaired()) repaired++;
                } else {
                    ValidationReport.Check result = check(row.getId());
                    if (result.valid()) {
                        valid++;
                    } else {
                        failed.add(new ValidationReport.FailedAgent(
                                row.getId(), row.getName(), String.join("; ", result.differences())));
                    }
                }
            } catch (RuntimeException e) {
                log.error("[Validator] Validation failed for {} ({}): {}", row.getName(), row.getId(), e.getMessage());
                failed.add(new ValidationReport.FailedAgent(row.getId(), row.getName(), e.getMessage()));
            }
        }

        ValidationReport.Summary summary =
                new ValidationReport.Summary(rows.size(), valid, repaired, failed.size(), failed);
        log.info("[Validator] tenant={} total={} valid={} repaired={} failed={}",
                tenantId == null ? "*" : tenantId, summary.total(), valid, repaired, summary.failed());
        return summary;
    }

    // ── Diff ─────────────────────────────────────────────────────────────────

    private AgentContract loadStored(String agentId) {
        AgentRecord row = agentRepository.findById(agentId)
                .orElseThrow(() -> new NotFoundException("Agent not found: " + agentId));
        return codec.decode(row.getContract());
    }

    private List<String> differences(AgentContract stored, Optional<PromptArtifactCache.Artifact> cached) {
        if (cached.isEmpty()) {
            return List.of("artifact missing");
        }
        PromptArtifactCache.Artifact artifact = cached.get();
        PromptArtifactCache.Artifact expected = contractService.renderArtifact(stored);
        List<String> out = new ArrayList<>();

        if (artifact.contractJson() == null) {
            out.add("agent_contract.json missing");
        } else {
            try {
                diff("", codec.toTree(stored), codec.readTree(artifact.contractJson()), out);
            } catch (JsonProcessingException e) {
                out.add("agent_contract.json is not valid JSON");
            }
        }

        if (artifact.systemPrompt() == null) {
            out.add("system_prompt.txt missing");
        } else if (!artifact.systemPrompt().equals(expected.systemPrompt())) {
            out.add("system_prompt.txt differs from the rendered prompt");
        }
        return out;
    }

    /** Recursive structural diff; {@code stored} is the reference side. */
    static void diff(String path, JsonNode stored, JsonNode cached, List<String> out) {
        if (stored.isObject() && cached.isObject()) {
            Set<String> names = new LinkedHashSet<>();
            stored.fieldNames().forEachRemaining(names::add);
            cached.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                if (path.isEmpty() && IGNORED_FIELDS.contains(name)) continue;
                String child = path.isEmpty() ? name : path + "." + name;
                JsonNode s = stored.get(name);
                JsonNode c = cached.get(name);
                if (s == null) {
                    out.add(child + ": not in store");
                } else if (c == null) {
                    out.add(child + ": missing from artifact");
                } else {
                    diff(child, s, c, out);
                }
            }
            return;
        }
        if (stored.isArray() && cached.isArray() && stored.size() == cached.size()) {
            Iterator<JsonNode> s = stored.elements();
            Iterator<JsonNode> c = cached.elements();
            for (int i = 0; s.hasNext(); i++) {
                diff(path + "[" + i + "]", s.next(), c.next(), out);
            }
            return;
        }
        if (!stored.equals(cached)) {
            out.add("%s: store=%s artifact=%s".formatted(path.isEmpty() ? "$" : path, stored, cached));
        }
    }
}
