package bbt.tao.conversation.store;

import bbt.tao.conversation.conf.ConversationProperties;
import bbt.tao.conversation.entity.ChatMessage;
import bbt.tao.conversation.exception.CacheStateException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Keeps a conversation within the configured message limit by dropping the oldest
 * non-system messages. System messages are never dropped, so a history made of more
 * system messages than the limit stays above it.
 */
@Component
public class HistoryTrimmer {

    private final int messageLimit;

    @Autowired
    public HistoryTrimmer(ConversationProperties properties) {
        this(properties.getMessageLimit());
    }

    public HistoryTrimmer(int messageLimit) {
        Assert.isTrue(messageLimit >= 1, "Message limit must be at least 1");
        this.messageLimit = messageLimit;
    }

    public List<ChatMessage> trim(List<ChatMessage> messages) {
        if (messages.size() <= messageLimit) {
            return messages;
        }

        List<ChatMessage> trimmed = new ArrayList<>(messages);
        int excess = trimmed.size() - messageLimit;
        Iterator<ChatMessage> iterator = trimmed.iterator();
        while (excess > 0 && iterator.hasNext()) {
            if (!iterator.next().isSystem()) {
                iterator.remove();
                excess--;
            }
        }

        verify(trimmed);
        return trimmed;
    }

    public int getMessageLimit() {
        return messageLimit;
    }

    void verify(List<ChatMessage> messages) {
        boolean hasNonSystem = messages.stream().anyMatch(message -> !message.isSystem());
        if (hasNonSystem && messages.size() > messageLimit) {
            throw new CacheStateException("History holds " + messages.size()
                    + " messages after trimming, limit is " + messageLimit);
        }
    }
}
