package bbt.tao.conversation.store;

import bbt.tao.conversation.conf.ConversationProperties;
import bbt.tao.conversation.entity.ChatMessage;
import bbt.tao.conversation.entity.ConversationEntry;
import bbt.tao.conversation.exception.CacheStateException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Scheduler;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory history backed by Caffeine. Entries expire after a period without reads or writes;
 * every read and mutation runs inside {@code asMap().compute*}, which is atomic per conversation
 * and keeps {@link ConversationEntry#lastActivity()} in step with the access-based expiration.
 */
@Component
public class CaffeineMessageHistoryStore implements MessageHistoryStore {

    private static final Logger log = LoggerFactory.getLogger(CaffeineMessageHistoryStore.class);

    private final Cache<UUID, ConversationEntry> cache;
    private final HistoryTrimmer trimmer;
    private final Clock clock;

    @Autowired
    public CaffeineMessageHistoryStore(ConversationProperties properties,
                                       HistoryTrimmer trimmer,
                                       Clock clock,
                                       Ticker ticker) {
        this(properties.getMessageExpiration(), trimmer, clock, ticker, Scheduler.systemScheduler());
    }

    public CaffeineMessageHistoryStore(Duration expiration,
                                       HistoryTrimmer trimmer,
                                       Clock clock,
                                       Ticker ticker,
                                       Scheduler scheduler) {
        Assert.isTrue(expiration != null && !expiration.isZero() && !expiration.isNegative(),
                "Message expiration must be positive");
        this.trimmer = trimmer;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .expireAfterAccess(expiration)
                .ticker(ticker)
                .scheduler(scheduler)
                .<UUID, ConversationEntry>removalListener((id, entry, cause) -> {
                    if (cause == RemovalCause.EXPIRED && entry != null) {
                        log.debug("Conversation {} expired, last active at {}", id, entry.lastActivity());
                    }
                })
                .build();
    }

    @Override
    public List<ChatMessage> get(UUID conversationId) {
        if (conversationId == null) {
            return List.of();
        }
        ConversationEntry entry = cache.asMap().computeIfPresent(conversationId,
                (id, current) -> new ConversationEntry(id, current.messages(), clock.instant()));
        return entry == null ? List.of() : entry.messages();
    }

    @Override
    public void append(UUID conversationId, ChatMessage message) {
        cache.asMap().compute(conversationId, (id, current) -> {
            List<ChatMessage> messages = new ArrayList<>(current == null ? List.of() : current.messages());
            messages.add(message);
            return new ConversationEntry(id, trimOrReset(id, messages), clock.instant());
        });
    }

    @Override
    public void reset(UUID conversationId, ChatMessage systemMessage) {
        cache.put(conversationId, new ConversationEntry(conversationId, List.of(systemMessage), clock.instant()));
    }

    @Override
    public void delete(UUID conversationId) {
        cache.invalidate(conversationId);
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }

    /**
     * Last activity of a live entry, read without counting as access.
     */
    Optional<Instant> lastActivity(UUID conversationId) {
        return Optional.ofNullable(cache.policy().getIfPresentQuietly(conversationId))
                .map(ConversationEntry::lastActivity);
    }

    private List<ChatMessage> trimOrReset(UUID conversationId, List<ChatMessage> messages) {
        try {
            return trimmer.trim(messages);
        } catch (CacheStateException ex) {
            log.error("Inconsistent history for conversation {}, keeping system messages only", conversationId, ex);
            return messages.stream()
                    .filter(ChatMessage::isSystem)
                    .toList();
        }
    }
}
