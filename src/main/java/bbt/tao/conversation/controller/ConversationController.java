package bbt.tao.conversation.controller;

import bbt.tao.conversation.dto.AskRequest;
import bbt.tao.conversation.dto.ConversationResponse;
import bbt.tao.conversation.dto.SetupRequest;
import bbt.tao.conversation.dto.SetupResponse;
import bbt.tao.conversation.entity.ChatMessage;
import bbt.tao.conversation.service.ConversationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

    private static final Logger log = LoggerFactory.getLogger(ConversationController.class);

    private final ConversationService conversationService;

    @Autowired
    public ConversationController(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    /**
     * Creates a conversation, or clears an existing one, with a system message.
     * @param request system message and optional conversation id
     * @return id of the conversation
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<SetupResponse>> setup(@RequestBody SetupRequest request) {
        log.info("Received setup request for conversation {}", request.conversationId());
        return conversationService.setup(request.conversationId(), request.message())
                .map(id -> ResponseEntity.ok(new SetupResponse(id)));
    }

    /**
     * Sends a message and waits for the whole reply. Without a conversation id a new
     * conversation is started; its id is part of the response.
     */
    @PostMapping(value = "/ask", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ConversationResponse> ask(@RequestBody AskRequest request) {
        log.info("Received ask request for conversation {}", request.conversationId());
        return conversationService.ask(request.conversationId(), request.message(), request.parameters(), request.model());
    }

    @PostMapping(value = "/ask/stream", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ConversationResponse>> askStream(@RequestBody AskRequest request) {
        log.info("Received stream request for conversation {}", request.conversationId());
        return conversationService.askStream(request.conversationId(), request.message(), request.parameters(), request.model())
                .map(response -> ServerSentEvent.builder(response).build())
                .doOnCancel(() -> log.warn("Stream was canceled for conversation: {}", request.conversationId()));
    }

    /**
     * @param conversationId conversation id
     * @return messages in chronological order, empty for an unknown or expired conversation
     */
    @GetMapping("/{conversationId}")
    public Mono<List<ChatMessage>> getConversation(@PathVariable UUID conversationId) {
        return conversationService.getConversation(conversationId);
    }

    @DeleteMapping("/{conversationId}")
    public Mono<ResponseEntity<Void>> deleteConversation(@PathVariable UUID conversationId) {
        return conversationService.deleteConversation(conversationId)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }
}
