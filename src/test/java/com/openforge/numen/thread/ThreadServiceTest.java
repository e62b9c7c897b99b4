package com.openforge.numen.thread;

import com.openforge.numen.config.AppConfig;
import com.openforge.numen.config.JpaConfig;
import com.openforge.numen.domain.ConversationThread;
import com.openforge.numen.domain.ThreadMessage;
import com.openforge.numen.domain.ThreadMessage.Role;
import com.openforge.numen.error.NotFoundException;
import com.openforge.numen.repository.ThreadMessageRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({JpaConfig.class, AppConfig.class, ThreadService.class})
class ThreadServiceTest {

    @Autowired
    private ThreadService threads;

    @Autowired
    private ThreadMessageRepository messages;

    @Nested
    @DisplayName("getOrCreate")
    class GetOrCreate {

        @Test
        void createsWhenNoIdGiven() {
            ConversationThread thread = threads.getOrCreate("A", "U", "T", null);

            assertThat(thread.getId()).isNotBlank();
            assertThat(thread.getStatus()).isEqualTo(ConversationThread.ThreadStatus.ACTIVE);
            assertThat(thread.getMessageCount()).isZero();
        }

        @Test
        void reusesTheCallersActiveThread() {
            String id = threads.getOrCreate("A", "U", "T", null).getId();

            assertThat(threads.getOrCreate("A", "U", "T", id).getId()).isEqualTo(id);
        }

        @Test
        @DisplayName("a thread of another user, agent or tenant silently yields a new thread")
        void foreignThreadIsNotReused() {
            String id = threads.getOrCreate("A", "U", "T", null).getId();

            assertThat(threads.getOrCreate("A", "other", "T", id).getId()).isNotEqualTo(id);
            assertThat(threads.getOrCreate("B", "U", "T", id).getId()).isNotEqualTo(id);
            assertThat(threads.getOrCreate("A", "U", "T2", id).getId()).isNotEqualTo(id);
            assertThat(threads.getOrCreate("A", "U", "T", "no-such-thread").getId()).isNotEqualTo(id);
        }

        @Test
        void archivedThreadIsNotReused() {
            String id = threads.getOrCreate("A", "U", "T", null).getId();
            threads.archive(id, "T");

            assertThat(threads.getOrCreate("A", "U", "T", id).getId()).isNotEqualTo(id);
        }
    }

    @Nested
    @DisplayName("append")
    class Append {

        @Test
        void sequencesAreContiguousAndCountFollows() {
            String id = threads.getOrCreate("A", "U", "T", null).getId();

            threads.appendExchange(id, "hi", "hello", Map.of("memory_confidence", 0.5));
            List<ThreadMessage> second = threads.appendExchange(id, "how are you?", "fine", null);

            assertThat(second).extracting(ThreadMessage::getSequence).containsExactly(3, 4);
            assertThat(second).extracting(ThreadMessage::getRole).containsExactly(Role.USER, Role.ASSISTANT);

            ConversationThread thread = threads.get(id, "T");
            assertThat(thread.getMessageCount()).isEqualTo(4);
            assertThat(thread.getLastMessageAt()).isNotNull();
            assertThat(messages.countByThreadId(id)).isEqualTo(4);
        }

        @Test
        void assistantMetadataIsStoredAsJson() {
            String id = threads.getOrCreate("A", "U", "T", null).getId();

            List<ThreadMessage> turn = threads.appendExchange(id, "hi", "hello", Map.of("memory_confidence", 0.5));

            assertThat(turn.get(0).getMetadata()).isNull();
            assertThat(turn.get(1).getMetadata()).isEqualTo("{\"memory_confidence\":0.5}");
        }

        @Test
        void titleComesFromTheFirstUserMessage() {
            String id = threads.getOrCreate("A", "U", "T", null).getId();

            threads.append(id, Role.SYSTEM, "system note", null);
            threads.append(id, Role.USER, "  Plan my   week ", null);
            threads.append(id, Role.USER, "something else", null);

            assertThat(threads.get(id, "T").getTitle()).isEqualTo("Plan my week");
        }

        @Test
        void appendToMissingThreadFails() {
            assertThatThrownBy(() -> threads.appendExchange("missing", "hi", "hello", null))
                    .isInstanceOf(NotFoundException.class);
        }
    }

    @Nested
    @DisplayName("read and lifecycle")
    class ReadAndLifecycle {

        @Test
        void recentIsChronologicalAndBounded() {
            String id = threads.getOrCreate("A", "U", "T", null).getId();
            threads.appendExchange(id, "q1", "a1", null);
            threads.appendExchange(id, "q2", "a2", null);

            assertThat(threads.recent(id, 3)).extracting(ThreadMessage::getContent).containsExactly("a1", "q2", "a2");
            assertThat(threads.recent(id, 50)).extracting(ThreadMessage::getSequence).containsExactly(1, 2, 3, 4);
            assertThat(threads.recent(id, 0)).isEmpty();
        }

        @Test
        void getChecksTenant() {
            String id = threads.getOrCreate("A", "U", "T", null).getId();

            assertThatThrownBy(() -> threads.get(id, "other-tenant")).isInstanceOf(NotFoundException.class);
        }

        @Test
        void listActiveSkipsArchived() {
            String keep = threads.getOrCreate("A", "U", "T", null).getId();
            String gone = threads.getOrCreate("A", "U", "T", null).getId();
            threads.archive(gone, "T");

            assertThat(threads.listActive("T", "A", "U")).extracting(ConversationThread::getId).containsExactly(keep);
        }

        @Test
        void archiveIsOneShotAndTenantScoped() {
            String id = threads.getOrCreate("A", "U", "T", null).getId();

            assertThat(threads.archive(id, "other-tenant")).isFalse();
            assertThat(threads.archive(id, "T")).isTrue();
            assertThat(threads.archive(id, "T")).isFalse();
        }

        @Test
        void deleteRemovesMessagesToo() {
            String id = threads.getOrCreate("A", "U", "T", null).getId();
            threads.appendExchange(id, "hi", "hello", null);

            assertThat(threads.delete(id, "other-tenant")).isFalse();
            assertThat(threads.delete(id, "T")).isTrue();
            assertThat(messages.countByThreadId(id)).isZero();
            assertThatThrownBy(() -> threads.get(id, "T")).isInstanceOf(NotFoundException.class);
        }
    }

    @Test
    void longTitlesAreTruncated() {
        String title = ThreadService.title("x".repeat(100));

        assertThat(title).hasSize(ThreadService.TITLE_MAX_CHARS).endsWith("...");
        assertThat(ThreadService.title("short")).isEqualTo("short");
    }
}
