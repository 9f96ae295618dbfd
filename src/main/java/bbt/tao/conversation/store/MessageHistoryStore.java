package bbt.tao.conversation.store;

import bbt.tao.conversation.entity.ChatMessage;

import java.util.List;
import java.util.UUID;

public interface MessageHistoryStore {

    /**
     * @return the messages of a live conversation in insertion order, or an empty list when the
     * conversation is unknown or has expired
     */
    List<ChatMessage> get(UUID conversationId);

    void append(UUID conversationId, ChatMessage message);

    void reset(UUID conversationId, ChatMessage systemMessage);

    void delete(UUID conversationId);

    long size();
}
