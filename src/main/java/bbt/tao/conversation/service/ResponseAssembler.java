package bbt.tao.conversation.service;

import bbt.tao.conversation.conf.ConversationProperties;
import bbt.tao.conversation.dto.ChatError;
import bbt.tao.conversation.dto.Completion;
import bbt.tao.conversation.dto.CompletionChunk;
import bbt.tao.conversation.dto.ConversationResponse;
import bbt.tao.conversation.entity.ChatMessage;
import bbt.tao.conversation.entity.ChatRole;
import bbt.tao.conversation.exception.UpstreamException;
import bbt.tao.conversation.store.MessageHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Writes assistant replies back into history. A streamed reply is stored only once the stream
 * has completed normally; an aborted or failed stream leaves history untouched.
 */
@Component
public class ResponseAssembler {

    private static final Logger log = LoggerFactory.getLogger(ResponseAssembler.class);

    private final MessageHistoryStore store;
    private final Clock clock;
    private final boolean throwExceptionOnError;

    public ResponseAssembler(MessageHistoryStore store, ConversationProperties properties, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.throwExceptionOnError = properties.isThrowExceptionOnError();
    }

    public ConversationResponse assemble(UUID conversationId, Completion completion) {
        store.append(conversationId, ChatMessage.assistant(completion.content(), clock.instant()));
        return new ConversationResponse(
                conversationId,
                completion.id(),
                completion.model(),
                completion.created() != null ? completion.created() : clock.instant(),
                ChatRole.ASSISTANT,
                completion.content(),
                completion.finishReason(),
                completion.usage(),
                null
        );
    }

    public Flux<ConversationResponse> assembleStream(UUID conversationId, Flux<CompletionChunk> chunks) {
        return Flux.defer(() -> {
            StringBuilder buffer = new StringBuilder();
            Instant created = clock.instant();
            return chunks
                    .map(chunk -> {
                        buffer.append(chunk.delta());
                        return toResponse(conversationId, chunk, created);
                    })
                    .concatWith(Mono.<ConversationResponse>fromRunnable(() -> commit(conversationId, buffer)))
                    .doOnCancel(() -> log.warn("Stream for conversation {} cancelled, discarding {} buffered characters",
                            conversationId, buffer.length()));
        });
    }

    /**
     * Either propagates the failure or turns it into a response whose error field is set,
     * depending on {@code conversation.throw-exception-on-error}.
     */
    public Mono<ConversationResponse> recover(UUID conversationId, UpstreamException error) {
        if (throwExceptionOnError) {
            return Mono.error(error);
        }
        log.warn("Completion failed for conversation {} ({}): {}", conversationId, error.getKind(), error.getMessage());
        return Mono.just(ConversationResponse.failed(conversationId, ChatError.from(error)));
    }

    private void commit(UUID conversationId, StringBuilder buffer) {
        store.append(conversationId, ChatMessage.assistant(buffer.toString(), clock.instant()));
        log.debug("Committed streamed reply for conversation {} ({} characters)", conversationId, buffer.length());
    }

    private ConversationResponse toResponse(UUID conversationId, CompletionChunk chunk, Instant created) {
        return new ConversationResponse(
                conversationId,
                chunk.id(),
                chunk.model(),
                created,
                ChatRole.ASSISTANT,
                chunk.delta(),
                chunk.finishReason(),
                null,
                null
        );
    }
}
