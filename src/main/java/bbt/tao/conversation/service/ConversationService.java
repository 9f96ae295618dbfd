package bbt.tao.conversation.service;

import bbt.tao.conversation.dto.ChatParameters;
import bbt.tao.conversation.dto.ConversationResponse;
import bbt.tao.conversation.entity.ChatMessage;
import bbt.tao.conversation.exception.UpstreamException;
import bbt.tao.conversation.service.client.ChatCompletionClient;
import bbt.tao.conversation.service.client.UpstreamErrors;
import bbt.tao.conversation.store.MessageHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Entry point for conversations. A {@code null} conversation id starts a new conversation with a
 * random id. Chat interactions on the same conversation run one after another; blank messages are
 * rejected with {@link IllegalArgumentException} before anything is stored or sent.
 */
@Service
public class ConversationService {

    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    private final MessageHistoryStore store;
    private final ChatRequestBuilder requestBuilder;
    private final ResponseAssembler assembler;
    private final ChatCompletionClient client;
    private final ConversationLocks locks;
    private final Clock clock;

    public ConversationService(MessageHistoryStore store,
                               ChatRequestBuilder requestBuilder,
                               ResponseAssembler assembler,
                               ChatCompletionClient client,
                               ConversationLocks locks,
                               Clock clock) {
        this.store = store;
        this.requestBuilder = requestBuilder;
        this.assembler = assembler;
        this.client = client;
        this.locks = locks;
        this.clock = clock;
    }

    /**
     * Starts (or restarts) a conversation with a system message that steers the assistant.
     * Any history already stored under the id is cleared.
     *
     * @return the conversation id, generated when {@code conversationId} is {@code null}
     */
    public Mono<UUID> setup(UUID conversationId, String systemMessage) {
        if (!StringUtils.hasText(systemMessage)) {
            throw new IllegalArgumentException("System message must not be empty");
        }
        UUID id = resolve(conversationId);
        return locks.withLock(id, () -> Mono.fromCallable(() -> {
            store.reset(id, ChatMessage.system(systemMessage, clock.instant()));
            log.info("Conversation {} set up with a system message ({} conversations cached)", id, store.size());
            return id;
        }));
    }

    public Mono<ConversationResponse> ask(UUID conversationId, String message, ChatParameters parameters, String model) {
        ChatRequestBuilder.requireMessage(message);
        UUID id = resolve(conversationId);
        return locks.withLock(id, () -> Mono.fromCallable(() -> requestBuilder.build(id, message, parameters, model, false))
                .flatMap(request -> client.complete(request)
                        .switchIfEmpty(Mono.error(() -> new UpstreamException(UpstreamException.Kind.UNKNOWN,
                                "Completion service returned no response", null)))
                        .onErrorMap(UpstreamErrors::translate)
                        .map(completion -> assembler.assemble(id, completion))
                        .onErrorResume(UpstreamException.class, error -> assembler.recover(id, error))))
                .doOnSuccess(response -> log.debug("Conversation {} answered, successful={}",
                        id, response != null && response.isSuccessful()))
                .doOnError(error -> log.error("Ask failed for conversation {}: {}", id, error.getMessage()));
    }

    /**
     * Like {@link #ask} but yields the reply as it is generated, one delta per response. Each
     * subscription issues its own upstream call.
     */
    public Flux<ConversationResponse> askStream(UUID conversationId, String message, ChatParameters parameters, String model) {
        ChatRequestBuilder.requireMessage(message);
        UUID id = resolve(conversationId);
        return locks.streamWithLock(id, () -> Mono.fromCallable(() -> requestBuilder.build(id, message, parameters, model, true))
                .flatMapMany(request -> assembler.assembleStream(id, client.completeStream(request)
                        .onErrorMap(UpstreamErrors::translate)))
                .onErrorResume(UpstreamException.class, error -> assembler.recover(id, error).flux()))
                .doOnComplete(() -> log.debug("Stream completed for conversation {}", id))
                .doOnError(error -> log.error("Stream failed for conversation {}: {}", id, error.getMessage()));
    }

    /**
     * @return the stored messages in chronological order, empty when the conversation does not
     * exist or has expired
     */
    public Mono<List<ChatMessage>> getConversation(UUID conversationId) {
        return Mono.fromSupplier(() -> store.get(conversationId));
    }

    public Mono<Void> deleteConversation(UUID conversationId) {
        return Mono.fromRunnable(() -> {
            store.delete(conversationId);
            log.info("Conversation {} deleted ({} conversations cached)", conversationId, store.size());
        });
    }

    private UUID resolve(UUID conversationId) {
        return conversationId != null ? conversationId : UUID.randomUUID();
    }
}
