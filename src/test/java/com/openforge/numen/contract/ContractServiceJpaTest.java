package com.openforge.numen.contract;

import com.openforge.numen.config.AppConfig;
import com.openforge.numen.config.JpaConfig;
import com.openforge.numen.config.RuntimeProperties;
import com.openforge.numen.domain.AgentRecord;
import com.openforge.numen.error.ConflictException;
import com.openforge.numen.error.ContractValidationException;
import com.openforge.numen.error.NotFoundException;
import com.openforge.numen.persona.TraitModulator;
import com.openforge.numen.repository.AgentRecordRepository;
import com.openforge.numen.repository.ContractVersionRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({JpaConfig.class, AppConfig.class, ContractService.class, ContractCodec.class, TraitModulator.class,
        ContractServiceJpaTest.Properties.class})
class ContractServiceJpaTest {

    @TestConfiguration
    @EnableConfigurationProperties(RuntimeProperties.class)
    static class Properties {}

    @MockBean private PromptArtifactCache artifactCache;

    @Autowired private ContractService service;
    @Autowired private AgentRecordRepository agents;
    @Autowired private ContractVersionRepository versions;

    @Test
    void voiceAgentWithoutVoiceConfigIsNeverPersisted() {
        AgentContract draft = TestContracts.draft().type(AgentType.VOICE).build();

        assertThatThrownBy(() -> service.create(draft)).isInstanceOf(ContractValidationException.class);
        assertThat(agents.count()).isZero();
    }

    @Test
    void eachUpdateAddsOneSnapshotOfThePreviousState() {
        AgentContract created = service.create(TestContracts.draft().build());

        service.update(created.id(), "T", ContractPatch.builder().name("Sage II").build());
        service.update(created.id(), "T", ContractPatch.builder().traits(Map.of("empathy", 90)).build());

        List<ContractSnapshot> history = service.history(created.id(), "T");
        assertThat(history).hasSize(2);
        assertThat(history).extracting(ContractSnapshot::version).containsExactlyInAnyOrder("1.0.0", "1.0.1");
        ContractSnapshot first = history.stream().filter(s -> s.version().equals("1.0.0")).findFirst().orElseThrow();
        assertThat(first.contract().name()).isEqualTo("Sage");

        AgentContract current = service.get(created.id(), "T");
        assertThat(current.version()).isEqualTo("1.0.2");
        assertThat(current.name()).isEqualTo("Sage II");
        assertThat(current.traits().resolved()).containsEntry(Trait.EMPATHY, 90);
    }

    @Test
    void rollbackReappliesAnOldPayloadAsANewVersion() {
        AgentContract created = service.create(TestContracts.draft().build());
        service.update(created.id(), "T", ContractPatch.builder().name("Renamed").build());

        AgentContract rolledBack = service.rollback(created.id(), "T", "1.0.0", "owner-1");

        assertThat(rolledBack.name()).isEqualTo("Sage");
        assertThat(rolledBack.version()).isEqualTo("1.0.2");
        assertThat(versions.count()).isEqualTo(2);
        assertThatThrownBy(() -> service.rollback(created.id(), "T", "9.9.9", "owner-1"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void staleExpectedVersionIsAConflict() {
        AgentContract created = service.create(TestContracts.draft().build());
        service.update(created.id(), "T", ContractPatch.builder().name("A").expectedVersion("1.0.0").build());

        assertThatThrownBy(() -> service.update(created.id(), "T",
                ContractPatch.builder().name("B").expectedVersion("1.0.0").build()))
                .isInstanceOf(ConflictException.class);
        assertThat(service.get(created.id(), "T").name()).isEqualTo("A");
    }

    @Test
    void listFiltersByTagAndHidesArchived() {
        AgentContract coach = service.create(TestContracts.draft().build());
        AgentContract other = service.create(TestContracts.draft().name("Scribe").tags(List.of("writer")).build());
        service.create(TestContracts.draft().tenantId("T2").build());

        assertThat(service.list("T", new ContractFilter(null, null, "coach", 10, 0)))
                .extracting(AgentContract::id).containsExactly(coach.id());
        assertThat(service.list("T", ContractFilter.all())).hasSize(2);

        assertThat(service.archive(other.id(), "T", "owner-1")).isTrue();
        assertThat(service.list("T", ContractFilter.all())).extracting(AgentContract::id).containsExactly(coach.id());
        assertThat(service.list("T", new ContractFilter(AgentStatus.ARCHIVED, null, null, 10, 0)))
                .extracting(AgentContract::id).containsExactly(other.id());
        assertThatThrownBy(() -> service.get(other.id(), "T")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void listSkipsExactlyTheRequestedNumberOfRows() {
        for (int i = 0; i < 4; i++) {
            service.create(TestContracts.draft().name("Agent " + i).build());
        }

        assertThat(service.list("T", new ContractFilter(null, null, null, 2, 3))).hasSize(1);
        assertThat(service.list("T", new ContractFilter(null, null, null, 3, 1))).hasSize(3);
        assertThat(service.list("T", new ContractFilter(null, null, null, 2, 4))).isEmpty();
    }

    @Test
    void otherTenantsCannotSeeTheAgent() {
        AgentContract created = service.create(TestContracts.draft().build());

        assertThatThrownBy(() -> service.get(created.id(), "T2")).isInstanceOf(NotFoundException.class);
        assertThat(service.archive(created.id(), "T2", "x")).isFalse();
    }

    @Test
    void interactionsAreCounted() {
        AgentContract created = service.create(TestContracts.draft().build());

        service.recordInteraction(created.id());
        service.recordInteraction(created.id());

        AgentRecord row = agents.findById(created.id()).orElseThrow();
        assertThat(row.getInteractionCount()).isEqualTo(2L);
        assertThat(row.getLastInteractionAt()).isNotNull();
    }
}
