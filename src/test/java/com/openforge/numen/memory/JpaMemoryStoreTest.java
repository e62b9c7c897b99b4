package com.openforge.numen.memory;

import com.openforge.numen.config.AppConfig;
import com.openforge.numen.config.JpaConfig;
import com.openforge.numen.domain.MemoryEntry;
import com.openforge.numen.repository.MemoryEntryRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DataJpaTest
@Import({JpaConfig.class, AppConfig.class, JpaMemoryStore.class})
class JpaMemoryStoreTest {

    private static final float[] NORTH = {1f, 0f, 0f};
    private static final float[] NORTH_EAST = {0.7f, 0.7f, 0f};
    private static final float[] EAST = {0f, 1f, 0f};

    @Autowired
    private JpaMemoryStore store;

    @Autowired
    private MemoryEntryRepository repository;

    private String put(MemoryNamespace ns, String content, float[] embedding, String type) {
        return store.put(new MemoryDraft(ns, content, embedding, type, Map.of("source", "test")));
    }

    @Test
    @DisplayName("an entry written under A:1 is never returned for B:1")
    void namespacesAreIsolated() {
        put(MemoryNamespace.agent("A", "1"), "secret of A", NORTH, MemoryEntry.TYPE_FACT);

        assertThat(store.search(MemoryQuery.subtree(MemoryNamespace.agent("B", "1"), NORTH, 10))).isEmpty();
        assertThat(store.search(MemoryQuery.subtree(MemoryNamespace.agent("A", "1"), NORTH, 10)))
                .extracting(MemoryRecord::content).containsExactly("secret of A");
    }

    @Test
    void siblingWithCommonPrefixIsNotADescendant() {
        put(MemoryNamespace.agent("T", "AB"), "other agent", NORTH, MemoryEntry.TYPE_FACT);

        assertThat(store.search(MemoryQuery.subtree(MemoryNamespace.agent("T", "A"), NORTH, 10))).isEmpty();
    }

    @Test
    void subtreeSearchIncludesDescendantsExactDoesNot() {
        MemoryNamespace agent = MemoryNamespace.agent("T", "A");
        put(agent, "agent fact", NORTH, MemoryEntry.TYPE_FACT);
        put(MemoryNamespace.user("T", "A", "U"), "user preference", NORTH, MemoryEntry.TYPE_PREFERENCE);

        assertThat(store.search(MemoryQuery.subtree(agent, NORTH, 10)))
                .extracting(MemoryRecord::content).containsExactlyInAnyOrder("agent fact", "user preference");
        assertThat(store.search(MemoryQuery.exact(agent, NORTH, 10)))
                .extracting(MemoryRecord::content).containsExactly("agent fact");
    }

    @Test
    void resultsAreOrderedBySimilarityAndLimited() {
        MemoryNamespace ns = MemoryNamespace.agent("T", "A");
        put(ns, "east", EAST, MemoryEntry.TYPE_FACT);
        put(ns, "north", NORTH, MemoryEntry.TYPE_FACT);
        put(ns, "north-east", NORTH_EAST, MemoryEntry.TYPE_FACT);

        List<MemoryRecord> hits = store.search(MemoryQuery.subtree(ns, NORTH, 2));

        assertThat(hits).extracting(MemoryRecord::content).containsExactly("north", "north-east");
        assertThat(hits.get(0).similarity()).isCloseTo(1.0, within(1e-6));
        assertThat(hits.get(0).metadata()).containsEntry("source", "test");
    }

    @Test
    void typeFilterRestrictsResults() {
        MemoryNamespace ns = MemoryNamespace.agent("T", "A");
        put(ns, "a fact", NORTH, MemoryEntry.TYPE_FACT);
        put(ns, "a conversation", NORTH, MemoryEntry.TYPE_CONVERSATION);

        assertThat(store.search(MemoryQuery.subtree(ns, NORTH, 10).ofType(MemoryEntry.TYPE_CONVERSATION)))
                .extracting(MemoryRecord::content).containsExactly("a conversation");
    }

    @Test
    void identicalContentRefreshesTheExistingEntry() {
        MemoryNamespace ns = MemoryNamespace.agent("T", "A");
        String first = put(ns, "same words", NORTH, MemoryEntry.TYPE_FACT);
        String second = put(ns, "same words", EAST, MemoryEntry.TYPE_FACT);

        assertThat(second).isEqualTo(first);
        assertThat(store.count(ns)).isEqualTo(1);
        assertThat(repository.findById(first)).hasValueSatisfying(e -> assertThat(e.getEmbedding()).containsExactly(EAST));

        String elsewhere = put(MemoryNamespace.agent("T", "B"), "same words", NORTH, MemoryEntry.TYPE_FACT);
        assertThat(elsewhere).isNotEqualTo(first);
    }

    @Test
    void storeReportsWhetherTheRowIsNew() {
        MemoryDraft draft = new MemoryDraft(MemoryNamespace.agent("T", "A"), "once", NORTH, null, Map.of());

        JpaMemoryStore.Stored first = store.store(draft);
        JpaMemoryStore.Stored again = store.store(draft);

        assertThat(first.created()).isTrue();
        assertThat(again.created()).isFalse();
        assertThat(again.id()).isEqualTo(first.id());
    }

    @Test
    void touchReinforcesEntries() {
        MemoryNamespace ns = MemoryNamespace.agent("T", "A");
        String id = put(ns, "remember me", NORTH, MemoryEntry.TYPE_FACT);

        store.touch(id);
        store.touch(List.of(id));

        MemoryEntry entry = repository.findById(id).orElseThrow();
        assertThat(entry.getAccessCount()).isEqualTo(2);
        assertThat(entry.getLastAccessedAt()).isNotNull();
    }

    @Test
    void deleteRemovesTheEntry() {
        MemoryNamespace ns = MemoryNamespace.agent("T", "A");
        String id = put(ns, "forget me", NORTH, MemoryEntry.TYPE_FACT);

        assertThat(store.delete(id)).isTrue();
        assertThat(store.delete(id)).isFalse();
        assertThat(store.count(ns)).isZero();
    }

    @Test
    @DisplayName("equal similarity: the newer entry ranks first")
    void tiesBreakOnNewestFirst() {
        LocalDateTime t0 = LocalDateTime.of(2026, 5, 1, 10, 0);
        MemoryRecord older = new MemoryRecord("1", "T:A", "old", "fact", Map.of(), 0.5, 0.5, 0, t0, null);
        MemoryRecord newer = new MemoryRecord("2", "T:A", "new", "fact", Map.of(), 0.5, 0.5, 0, t0.plusHours(1), null);

        assertThat(List.of(older, newer).stream().sorted(JpaMemoryStore.BY_SIMILARITY).toList())
                .extracting(MemoryRecord::id).containsExactly("2", "1");
    }
}
