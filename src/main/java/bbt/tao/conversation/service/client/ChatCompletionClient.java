package bbt.tao.conversation.service.client;

import bbt.tao.conversation.dto.ChatRequest;
import bbt.tao.conversation.dto.Completion;
import bbt.tao.conversation.dto.CompletionChunk;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Stateless access to the upstream chat completion API. Failures are signalled as
 * {@link bbt.tao.conversation.exception.UpstreamException}.
 */
public interface ChatCompletionClient {

    Mono<Completion> complete(ChatRequest request);

    /**
     * Completes normally only after the upstream end-of-stream marker; a dropped connection
     * surfaces as an error.
     */
    Flux<CompletionChunk> completeStream(ChatRequest request);
}
