package bbt.tao.conversation.store;

import bbt.tao.conversation.entity.ChatMessage;
import bbt.tao.conversation.entity.ChatRole;
import bbt.tao.conversation.exception.CacheStateException;
import com.github.benmanes.caffeine.cache.Scheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

class CaffeineMessageHistoryStoreTest {

    private static final Duration EXPIRATION = Duration.ofMinutes(5);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private final AtomicLong nanos = new AtomicLong();
    private CaffeineMessageHistoryStore store;

    @BeforeEach
    void setUp() {
        store = newStore(new HistoryTrimmer(4));
    }

    @Test
    void unknownConversationReadsAsEmpty() {
        assertThat(store.get(UUID.randomUUID())).isEmpty();
        assertThat(store.get(null)).isEmpty();
    }

    @Test
    void appendKeepsInsertionOrder() {
        UUID id = UUID.randomUUID();

        store.append(id, user("first"));
        store.append(id, assistant("second"));
        store.append(id, user("third"));

        assertThat(store.get(id)).extracting(ChatMessage::content).containsExactly("first", "second", "third");
    }

    @Test
    void appendTrimsOldestNonSystemMessages() {
        UUID id = UUID.randomUUID();
        store.reset(id, ChatMessage.system("sys", CLOCK.instant()));

        for (int i = 0; i < 10; i++) {
            store.append(id, user("m" + i));
        }

        List<ChatMessage> history = store.get(id);
        assertThat(history).hasSize(4);
        assertThat(history.get(0).role()).isEqualTo(ChatRole.SYSTEM);
        assertThat(history).extracting(ChatMessage::content).containsExactly("sys", "m7", "m8", "m9");
    }

    @Test
    void resetReplacesHistoryWithSystemMessage() {
        UUID id = UUID.randomUUID();
        store.append(id, user("old"));

        store.reset(id, ChatMessage.system("be brief", CLOCK.instant()));
        store.reset(id, ChatMessage.system("be brief", CLOCK.instant()));

        assertThat(store.get(id)).extracting(ChatMessage::content).containsExactly("be brief");
    }

    @Test
    void deleteRemovesConversation() {
        UUID id = UUID.randomUUID();
        store.append(id, user("hello"));

        store.delete(id);
        store.delete(id);

        assertThat(store.get(id)).isEmpty();
    }

    @Test
    void idleConversationExpires() {
        UUID id = UUID.randomUUID();
        store.append(id, user("hello"));

        nanos.addAndGet(EXPIRATION.plusSeconds(1).toNanos());

        assertThat(store.get(id)).isEmpty();
    }

    @Test
    void activityKeepsConversationAlive() {
        UUID id = UUID.randomUUID();
        store.append(id, user("hello"));

        nanos.addAndGet(EXPIRATION.minusMinutes(1).toNanos());
        store.append(id, assistant("hi"));
        nanos.addAndGet(EXPIRATION.minusMinutes(1).toNanos());

        assertThat(store.get(id)).extracting(ChatMessage::content).containsExactly("hello", "hi");
    }

    @Test
    void readsRefreshLastActivity() {
        Instant start = Instant.parse("2024-05-01T10:00:00Z");
        Clock clock = Mockito.mock(Clock.class);
        when(clock.instant()).thenReturn(start, start.plusSeconds(60));
        CaffeineMessageHistoryStore timedStore = new CaffeineMessageHistoryStore(EXPIRATION, new HistoryTrimmer(4),
                clock, nanos::get, Scheduler.disabledScheduler());
        UUID id = UUID.randomUUID();

        timedStore.append(id, user("hello"));
        assertThat(timedStore.lastActivity(id)).contains(start);

        timedStore.get(id);

        assertThat(timedStore.lastActivity(id)).contains(start.plusSeconds(60));
        assertThat(timedStore.lastActivity(UUID.randomUUID())).isEmpty();
    }

    @Test
    void appendAfterExpirationStartsFreshHistory() {
        UUID id = UUID.randomUUID();
        store.append(id, user("stale"));
        nanos.addAndGet(EXPIRATION.plusSeconds(1).toNanos());

        store.append(id, user("fresh"));

        assertThat(store.get(id)).extracting(ChatMessage::content).containsExactly("fresh");
    }

    @Test
    void conversationsAreIndependent() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();

        store.append(first, user("one"));
        store.append(second, user("two"));
        store.delete(first);

        assertThat(store.get(first)).isEmpty();
        assertThat(store.get(second)).extracting(ChatMessage::content).containsExactly("two");
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void inconsistentTrimResetsEntryToSystemMessages() {
        HistoryTrimmer broken = Mockito.mock(HistoryTrimmer.class);
        when(broken.trim(anyList())).thenThrow(new CacheStateException("broken"));
        CaffeineMessageHistoryStore brokenStore = newStore(broken);
        UUID id = UUID.randomUUID();
        brokenStore.reset(id, ChatMessage.system("sys", CLOCK.instant()));

        brokenStore.append(id, user("hello"));

        assertThat(brokenStore.get(id)).extracting(ChatMessage::content).containsExactly("sys");
    }

    private CaffeineMessageHistoryStore newStore(HistoryTrimmer trimmer) {
        return new CaffeineMessageHistoryStore(EXPIRATION, trimmer, CLOCK, nanos::get, Scheduler.disabledScheduler());
    }

    private static ChatMessage user(String content) {
        return ChatMessage.user(content, CLOCK.instant());
    }

    private static ChatMessage assistant(String content) {
        return ChatMessage.assistant(content, CLOCK.instant());
    }
}
