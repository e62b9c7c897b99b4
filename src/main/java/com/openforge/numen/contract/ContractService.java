package com.openforge.numen.contract;

import com.openforge.numen.config.RuntimeProperties;
import com.openforge.numen.domain.AgentRecord;
import com.openforge.numen.domain.ContractVersion;
import com.openforge.numen.error.ConflictException;
import com.openforge.numen.error.ContractValidationException;
import com.openforge.numen.error.NotFoundException;
import com.openforge.numen.persona.TraitModulator;
import com.openforge.numen.repository.AgentRecordRepository;
import com.openforge.numen.repository.ContractVersionRepository;
import com.openforge.numen.repository.OffsetPageRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Contract store: the single owner of {@link AgentRecord} and
 * {@link ContractVersion} rows.
 *
 * Every mutation runs the same sequence inside one transaction:
 *
 *   1. load the current row, check the caller's expected version
 *   2. compute and validate the next contract (nothing written yet)
 *   3. insert a {@link ContractVersion} holding the <em>current</em> payload
 *   4. write the next payload with a bumped patch version
 *
 * Step 4 flushes through the row's JPA {@code @Version}, so two concurrent
 * mutations of one agent cannot both commit: the loser rolls back together
 * with its snapshot and surfaces as {@link ConflictException}.
 *
 * The prompt artifact is regenerated after each successful write. It is a
 * cache; a failed write is logged and later healed by {@link ContractValidator}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@EnableConfigurationProperties(ContractProperties.class)
public class ContractService {

    private final AgentRecordRepository     agentRepository;
    private final ContractVersionRepository versionRepository;
    private final ContractCodec             codec;
    private final TraitModulator            modulator;
    private final PromptArtifactCache       artifactCache;
    private final ContractProperties        properties;
    private final RuntimeProperties         runtimeProperties;

    // ── Create ───────────────────────────────────────────────────────────────

    /**
     * Validates and stores a new contract at version 1.0.0.
     *
     * @throws ContractValidationException before anything is persisted
     */
    @Transactional
    public AgentContract create(AgentContract draft) {
        draft.validate();
        if (draft.status() == AgentStatus.ARCHIVED) {
            throw new ContractValidationException("a new agent cannot start archived");
        }

        LocalDateTime now = LocalDateTime.now();
        AgentConfiguration configuration = draft.configuration() != null
                ? draft.configuration()
                : AgentConfiguration.builder().build();
        AgentContract resolved = draft.toBuilder()
                .id(null)
                .version(SemanticVersion.INITIAL.toString())
                .status(draft.status() != null ? draft.status() : AgentStatus.ACTIVE)
                .traits(draft.traits().withDefaults(properties.traitDefaults()))
                .configuration(configuration.withDefaults(
                        runtimeProperties.memoryK(), runtimeProperties.threadWindow()))
                .voice(draft.voice() != null ? draft.voice().withDefaults() : null)
                .createdAt(now)
                .updatedAt(now)
                .build()
                .validate();

        AgentRecord row = agentRepository.save(AgentRecord.builder()
                .tenantId(resolved.tenantId())
                .ownerId(resolved.ownerId())
                .name(resolved.name())
                .type(resolved.type())
                .status(resolved.status())
                .contractVersion(resolved.version())
                .tags(joinTags(resolved.tags()))
                .contract(codec.encode(resolved))
                .build());

        AgentContract created = resolved.toBuilder().id(row.getId()).build();
        row.setContract(codec.encode(created));
        agentRepository.saveAndFlush(row);

        log.info("[Contract] Created agent {} '{}' ({}) for tenant {}",
                created.id(), created.name(), created.type().wireName(), created.tenantId());
        regenerateArtifact(created);
        return created;
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    /**
     * @throws NotFoundException when the agent is unknown to this tenant or archived
     */
    @Transactional(readOnly = true)
    public AgentContract get(String agentId, String tenantId) {
        return codec.decode(loadLive(agentId, tenantId).getContract());
    }

    /** Newest first. Archived agents appear only when the filter asks for them. */
    @Transactional(readOnly = true)
    public List<AgentContract> list(String tenantId, ContractFilter filter) {
        ContractFilter f = filter != null ? filter : ContractFilter.all();
        return agentRepository.search(tenantId, f.status(), AgentStatus.ARCHIVED, f.type(), f.tag(),
                        new OffsetPageRequest(f.offset(), f.limit()))
                .stream()
                .map(row -> codec.decode(row.getContract()))
                .toList();
    }

    /** Oldest first; each entry holds the payload as it was before that change. */
    @Transactional(readOnly = true)
    public List<ContractSnapshot> history(String agentId, String tenantId) {
        agentRepository.findByIdAndTenantId(agentId, tenantId)
                .orElseThrow(() -> NotFoundException.agent(agentId, tenantId));
        return versionRepository.findByAgentIdAndTenantIdOrderByCreateTimeAsc(agentId, tenantId)
                .stream()
                .map(v -> new ContractSnapshot(v.getVersion(), v.getChangeSummary(), v.getCreatedBy(),
                        v.getCreateTime(), codec.decode(v.getContract())))
                .toList();
    }

    // ── Mutate ───────────────────────────────────────────────────────────────

    /**
     * Applies {@code patch} and bumps the patch version.
     *
     * @throws ConflictException when {@code patch.expectedVersion()} is stale
     *         or a concurrent update committed first
     */
    @Transactional
    public AgentContract update(String agentId, String tenantId, ContractPatch patch) {
        Objects.requireNonNull(patch, "patch");
        if (patch.status() == AgentStatus.ARCHIVED) {
            throw new ContractValidationException("use archive to archive an agent");
        }
        return mutate(agentId, tenantId, patch.expectedVersion(),
                summaryOr(patch.changeSummary(), "update"), patch.updatedBy(),
                current -> applyPatch(current, patch));
    }

    /**
     * Moves the agent to ARCHIVED. Returns false when the agent does not
     * exist for this tenant or is already archived.
     */
    @Transactional
    public boolean archive(String agentId, String tenantId, String actor) {
        AgentRecord row = agentRepository.findByIdAndTenantId(agentId, tenantId).orElse(null);
        if (row == null || row.getStatus() == AgentStatus.ARCHIVED) {
            return false;
        }
        mutateRow(row, null, "archived", actor,
                current -> current.toBuilder().status(AgentStatus.ARCHIVED).build());
        return true;
    }

    /**
     * Re-applies the payload stored with history entry {@code version} as a
     * new update; the state being replaced is snapshotted like any other.
     */
    @Transactional
    public AgentContract rollback(String agentId, String tenantId, String version, String actor) {
        ContractVersion snapshot = versionRepository
                .findFirstByAgentIdAndTenantIdAndVersionOrderByCreateTimeDesc(agentId, tenantId, version)
                .orElseThrow(() -> new NotFoundException(
                        "Version %s not found for agent %s".formatted(version, agentId)));
        AgentContract target = codec.decode(snapshot.getContract());
        return mutate(agentId, tenantId, null, "rollback to " + version, actor,
                current -> current.toBuilder()
                        .name(target.name())
                        .tags(target.tags())
                        .identity(target.identity())
                        .traits(target.traits())
                        .configuration(target.configuration())
                        .voice(target.voice())
                        .build());
    }

    /** Usage counters after a completed turn. Never fails the caller. */
    public void recordInteraction(String agentId) {
        try {
            agentRepository.recordInteraction(agentId, LocalDateTime.now());
        } catch (RuntimeException e) {
            log.warn("[Contract] Failed to record interaction for agent {}: {}", agentId, e.getMessage());
        }
    }

    /**
     * Renders the artifact pair for {@code contract}. Shared with the
     * validator so both sides compare the same bytes.
     */
    public PromptArtifactCache.Artifact renderArtifact(AgentContract contract) {
        return new PromptArtifactCache.Artifact(
                codec.encodePretty(contract),
                modulator.render(contract).systemPrompt());
    }

    // ── Internals ────────────────────────────────────────────────────────────

    private AgentContract mutate(String agentId, String tenantId, String expectedVersion,
                                 String summary, String actor, UnaryOperator<AgentContract> change) {
        AgentRecord row = loadLive(agentId, tenantId);
        if (expectedVersion != null && !expectedVersion.equals(row.getContractVersion())) {
            throw new ConflictException("Agent %s is at version %s, expected %s"
                    .formatted(agentId, row.getContractVersion(), expectedVersion));
        }
        return mutateRow(row, expectedVersion, summary, actor, change);
    }

    private AgentContract mutateRow(AgentRecord row, String expectedVersion, String summary,
                                    String actor, UnaryOperator<AgentContract> change) {
        AgentContract current = codec.decode(row.getContract());
        String nextVersion = SemanticVersion.parse(row.getContractVersion()).bumpPatch().toString();
        AgentContract next = change.apply(current).toBuilder()
                .id(current.id())
                .tenantId(current.tenantId())
                .ownerId(current.ownerId())
                .type(current.type())
                .createdAt(current.createdAt())
                .version(nextVersion)
                .updatedAt(LocalDateTime.now())
                .build()
                .validate();

        versionRepository.save(ContractVersion.builder()
                .agentId(row.getId())
                .tenantId(row.getTenantId())
                .version(row.getContractVersion())
                .contract(row.getContract())
                .changeSummary(summary)
                .createdBy(actor)
                .build());

        row.setName(next.name());
        row.setStatus(next.status());
        row.setTags(joinTags(next.tags()));
        row.setContractVersion(nextVersion);
        row.setContract(codec.encode(next));
        try {
            agentRepository.saveAndFlush(row);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new ConflictException("Agent %s was modified concurrently%s".formatted(row.getId(),
                    expectedVersion != null ? " (expected " + expectedVersion + ")" : ""), e);
        }

        log.info("[Contract] Agent {} {} → {} ({})", row.getId(), current.version(), nextVersion, summary);
        regenerateArtifact(next);
        return next;
    }

    private AgentRecord loadLive(String agentId, String tenantId) {
        return agentRepository.findByIdAndTenantId(agentId, tenantId)
                .filter(row -> row.getStatus() != AgentStatus.ARCHIVED)
                .orElseThrow(() -> NotFoundException.agent(agentId, tenantId));
    }

    private AgentContract applyPatch(AgentContract current, ContractPatch patch) {
        AgentContract.AgentContractBuilder b = current.toBuilder();
        if (patch.name() != null) b.name(patch.name());
        if (patch.tags() != null) b.tags(patch.tags());
        if (patch.status() != null) b.status(patch.status());
        if (patch.identity() != null) {
            b.identity(current.identity() != null ? current.identity().merge(patch.identity()) : patch.identity());
        }
        if (patch.traits() != null) b.traits(current.traits().merge(patch.traits()));
        if (patch.configuration() != null) {
            AgentConfiguration base = current.configuration() != null
                    ? current.configuration()
                    : AgentConfiguration.defaults(runtimeProperties.memoryK(), runtimeProperties.threadWindow());
            b.configuration(base.merge(patch.configuration()));
        }
        if (patch.voice() != null) b.voice(patch.voice().withDefaults());
        return b.build();
    }

    private void regenerateArtifact(AgentContract contract) {
        try {
            artifactCache.write(contract.id(), renderArtifact(contract));
        } catch (RuntimeException e) {
            log.warn("[Contract] Artifact regeneration failed for agent {}, validator will repair: {}",
                    contract.id(), e.getMessage());
        }
    }

    private static String joinTags(List<String> tags) {
        if (tags == null || tags.isEmpty()) return null;
        return "," + String.join(",", tags) + ",";
    }

    private static String summaryOr(String summary, String fallback) {
        return summary != null && !summary.isBlank() ? summary : fallback;
    }
}
