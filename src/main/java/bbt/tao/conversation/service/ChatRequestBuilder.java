package bbt.tao.conversation.service;

import bbt.tao.conversation.conf.ConversationProperties;
import bbt.tao.conversation.dto.ChatParameters;
import bbt.tao.conversation.dto.ChatRequest;
import bbt.tao.conversation.entity.ChatMessage;
import bbt.tao.conversation.store.MessageHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Turns a user message into a completion request carrying the retained history followed by
 * the new message. The request is built from the history as it was before the message is
 * stored; trimming applies to what is kept, not to what is sent. The user message is stored
 * before the request leaves, so it stays in history even when the completion call fails.
 */
@Component
public class ChatRequestBuilder {

    private static final Logger log = LoggerFactory.getLogger(ChatRequestBuilder.class);

    private final MessageHistoryStore store;
    private final Clock clock;
    private final String defaultModel;
    private final ChatParameters defaultParameters;

    public ChatRequestBuilder(MessageHistoryStore store, ConversationProperties properties, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.defaultModel = properties.getDefaultModel();
        this.defaultParameters = properties.getDefaultParameters();
    }

    public ChatRequest build(UUID conversationId, String message, ChatParameters parameters, String model, boolean stream) {
        requireMessage(message);

        ChatMessage userMessage = ChatMessage.user(message, clock.instant());
        List<ChatMessage> history = new ArrayList<>(store.get(conversationId));
        history.add(userMessage);
        store.append(conversationId, userMessage);

        String resolvedModel = StringUtils.hasText(model) ? model : defaultModel;
        ChatParameters resolvedParameters = ChatParameters.merge(defaultParameters, parameters);

        log.debug("Built request for conversation {}: model={}, messages={}, stream={}",
                conversationId, resolvedModel, history.size(), stream);
        return new ChatRequest(conversationId, resolvedModel, List.copyOf(history), resolvedParameters, stream);
    }

    static void requireMessage(String message) {
        if (!StringUtils.hasText(message)) {
            throw new IllegalArgumentException("Message must not be empty");
        }
    }
}
