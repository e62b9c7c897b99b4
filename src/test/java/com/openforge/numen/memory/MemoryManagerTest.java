package com.openforge.numen.memory;

import com.openforge.numen.config.RuntimeProperties;
import com.openforge.numen.domain.MemoryEntry;
import com.openforge.numen.domain.ThreadMessage;
import com.openforge.numen.error.PersistenceException;
import com.openforge.numen.error.ProviderException;
import com.openforge.numen.thread.ThreadService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MemoryManagerTest {

    private static final float[] VECTOR = {1f, 0f, 0f};

    @Mock private MemoryStore store;
    @Mock private EmbeddingProvider embeddings;
    @Mock private ThreadService threads;

    private MemoryManager manager;

    @BeforeEach
    void setUp() {
        manager = new MemoryManager(store, embeddings,
                new HybridMemoryScorer(MemoryScoringProperties.defaults()), threads, RuntimeProperties.defaults());
    }

    private static MemoryRecord record(String id, String namespace, double similarity) {
        return new MemoryRecord(id, namespace, "content " + id, MemoryEntry.TYPE_FACT, Map.of("k", id),
                similarity, similarity, 0, LocalDateTime.now(), null);
    }

    private static ThreadMessage message(int sequence, ThreadMessage.Role role, String content) {
        return ThreadMessage.builder().threadId("th-1").sequence(sequence).role(role).content(content).build();
    }

    @Nested
    @DisplayName("assembleContext")
    class AssembleContext {

        @Test
        void emptyStoreGivesZeroConfidence() {
            when(embeddings.embed("hello")).thenReturn(VECTOR);
            when(store.search(any())).thenReturn(List.of());
            when(threads.recent("th-1", 20)).thenReturn(List.of());

            MemoryContext ctx = manager.assembleContext("T", "A", "hello", "th-1", null, 6, 20);

            assertThat(ctx.retrieved()).isEmpty();
            assertThat(ctx.recent()).isEmpty();
            assertThat(ctx.confidence()).isZero();
            assertThat(ctx.formatForPrompt()).isNull();
            verify(store, never()).touch(anyCollection());
        }

        @Test
        void embeddingFailureDegradesToRecentTurnsOnly() {
            List<ThreadMessage> recent = List.of(
                    message(1, ThreadMessage.Role.USER, "hi"),
                    message(2, ThreadMessage.Role.ASSISTANT, "hello"));
            when(threads.recent("th-1", 20)).thenReturn(recent);
            when(embeddings.embed(anyString())).thenThrow(new ProviderException("embedding down"));

            MemoryContext ctx = manager.assembleContext("T", "A", "hello", "th-1", "U", 6, 20);

            assertThat(ctx.retrieved()).isEmpty();
            assertThat(ctx.recent()).extracting(ThreadMessage::getSequence).containsExactly(1, 2);
            assertThat(ctx.confidence()).isZero();
            verify(store, never()).search(any());
        }

        @Test
        void recentTurnFailureDoesNotBlockRetrieval() {
            when(threads.recent("th-1", 20)).thenThrow(new DataIntegrityViolationException("boom"));
            when(embeddings.embed("hello")).thenReturn(VECTOR);
            when(store.search(any())).thenReturn(List.of(record("m1", "T:A", 0.9)));

            MemoryContext ctx = manager.assembleContext("T", "A", "hello", "th-1", null, 6, 20);

            assertThat(ctx.recent()).isEmpty();
            assertThat(ctx.retrieved()).extracting(MemoryRecord::id).containsExactly("m1");
        }

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("agent and user memories are merged without duplicates and reinforced")
        void mergesUserMemories() {
            when(embeddings.embed("hello")).thenReturn(VECTOR);
            when(store.search(any())).thenAnswer(inv -> {
                MemoryQuery q = inv.getArgument(0);
                assertThat(q.includeDescendants()).isFalse();
                return q.namespace().equals(MemoryNamespace.agent("T", "A"))
                        ? List.of(record("a1", "T:A", 0.9), record("shared", "T:A", 0.8))
                        : List.of(record("shared", "T:A", 0.8), record("u1", "T:A:user:U", 0.7));
            });

            MemoryContext ctx = manager.assembleContext("T", "A", "hello", null, "U", 6, 20);

            assertThat(ctx.retrieved()).extracting(MemoryRecord::id).containsExactly("a1", "shared", "u1");
            assertThat(ctx.confidence()).isCloseTo(0.8, within(1e-9));

            ArgumentCaptor<Collection<String>> touched = ArgumentCaptor.forClass(Collection.class);
            verify(store).touch(touched.capture());
            assertThat(touched.getValue()).containsExactlyInAnyOrder("a1", "shared", "u1");
            verifyNoInteractions(threads);
        }

        @Test
        void candidatePoolIsWiderThanK() {
            when(embeddings.embed("hello")).thenReturn(VECTOR);
            when(store.search(any())).thenReturn(List.of());

            manager.assembleContext("T", "A", "hello", null, null, 4, 0);

            ArgumentCaptor<MemoryQuery> query = ArgumentCaptor.forClass(MemoryQuery.class);
            verify(store).search(query.capture());
            assertThat(query.getValue().limit()).isEqualTo(12);
            assertThat(query.getValue().namespace().value()).isEqualTo("T:A");
        }

        @Test
        void zeroKSkipsRetrieval() {
            MemoryContext ctx = manager.assembleContext("T", "A", "hello", null, "U", 0, 0);

            assertThat(ctx).isEqualTo(MemoryContext.empty());
            verifyNoInteractions(embeddings, store, threads);
        }

        @Test
        void touchFailureIsTolerated() {
            when(embeddings.embed("hello")).thenReturn(VECTOR);
            when(store.search(any())).thenReturn(List.of(record("m1", "T:A", 0.6)));
            doThrow(new PersistenceException("down", null)).when(store).touch(anyCollection());

            MemoryContext ctx = manager.assembleContext("T", "A", "hello", null, null, 6, 0);

            assertThat(ctx.retrieved()).hasSize(1);
            assertThat(ctx.confidence()).isCloseTo(0.6, within(1e-9));
        }
    }

    @Nested
    @DisplayName("recordTurn")
    class RecordTurn {

        @Test
        void storesConversationMemoryInAgentNamespace() {
            List<ThreadMessage> turns = List.of(
                    message(1, ThreadMessage.Role.USER, "hi"),
                    message(2, ThreadMessage.Role.ASSISTANT, "hello"));
            when(threads.appendExchange(eq("th-1"), eq("hi"), eq("hello"), any())).thenReturn(turns);
            when(embeddings.embed("User: hi\nAssistant: hello")).thenReturn(VECTOR);

            List<ThreadMessage> result = manager.recordTurn("T", "A", "th-1", "hi", "hello", "U", true, Map.of());

            assertThat(result).isEqualTo(turns);
            ArgumentCaptor<MemoryDraft> draft = ArgumentCaptor.forClass(MemoryDraft.class);
            verify(store).put(draft.capture());
            assertThat(draft.getValue().namespace().value()).isEqualTo("T:A");
            assertThat(draft.getValue().memoryType()).isEqualTo(MemoryEntry.TYPE_CONVERSATION);
            assertThat(draft.getValue().content()).isEqualTo("User: hi\nAssistant: hello");
            assertThat(draft.getValue().metadata()).containsEntry("thread_id", "th-1").containsEntry("user_id", "U");
        }

        @Test
        void threadAppendFailureIsFatalAndStoresNothing() {
            when(threads.appendExchange(anyString(), anyString(), anyString(), any()))
                    .thenThrow(new DataIntegrityViolationException("duplicate sequence"));

            assertThatThrownBy(() -> manager.recordTurn("T", "A", "th-1", "hi", "hello", "U", true, Map.of()))
                    .isInstanceOf(PersistenceException.class)
                    .hasMessageContaining("th-1");
            verifyNoInteractions(store, embeddings);
        }

        @Test
        void memoryWriteFailureIsSwallowed() {
            List<ThreadMessage> turns = List.of(message(1, ThreadMessage.Role.USER, "hi"));
            when(threads.appendExchange(anyString(), anyString(), anyString(), any())).thenReturn(turns);
            when(embeddings.embed(anyString())).thenThrow(new ProviderException("embedding down"));

            assertThat(manager.recordTurn("T", "A", "th-1", "hi", "hello", null, true, Map.of())).isEqualTo(turns);
            verify(store, never()).put(any());
        }

        @Test
        void notRememberingSkipsLongTermMemory() {
            when(threads.appendExchange(anyString(), anyString(), anyString(), any())).thenReturn(List.of());

            manager.recordTurn("T", "A", "th-1", "hi", "hello", "U", false, Map.of());

            verifyNoInteractions(store, embeddings);
        }
    }

    @Nested
    @DisplayName("user memory")
    class UserMemory {

        @Test
        void rememberForUserDefaultsToPreference() {
            when(embeddings.embed("likes short answers")).thenReturn(VECTOR);
            when(store.put(any())).thenReturn("m-9");

            String id = manager.rememberForUser("T", "A", "U", "likes short answers", null, Map.of("length", "short"));

            assertThat(id).isEqualTo("m-9");
            ArgumentCaptor<MemoryDraft> draft = ArgumentCaptor.forClass(MemoryDraft.class);
            verify(store).put(draft.capture());
            assertThat(draft.getValue().namespace().value()).isEqualTo("T:A:user:U");
            assertThat(draft.getValue().memoryType()).isEqualTo(MemoryEntry.TYPE_PREFERENCE);
        }

        @Test
        void recallReturnsMetadataOfBestPreference() {
            when(embeddings.embed("tone")).thenReturn(VECTOR);
            when(store.search(any())).thenReturn(List.of(record("p1", "T:A:user:U", 0.9)));

            assertThat(manager.recallUserPreferences("T", "A", "U", "tone")).containsEntry("k", "p1");

            ArgumentCaptor<MemoryQuery> query = ArgumentCaptor.forClass(MemoryQuery.class);
            verify(store).search(query.capture());
            assertThat(query.getValue().typeFilter()).isEqualTo(MemoryEntry.TYPE_PREFERENCE);
            assertThat(query.getValue().includeDescendants()).isFalse();
        }

        @Test
        void recallWithoutMatchIsEmpty() {
            when(embeddings.embed("tone")).thenReturn(VECTOR);
            when(store.search(any())).thenReturn(List.of());

            assertThat(manager.recallUserPreferences("T", "A", "U", "tone")).isEmpty();
        }
    }
}
