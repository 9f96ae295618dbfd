package bbt.tao.conversation.service.client;

import bbt.tao.conversation.dto.ChatParameters;
import bbt.tao.conversation.dto.ChatRequest;
import bbt.tao.conversation.dto.ChatUsage;
import bbt.tao.conversation.dto.Completion;
import bbt.tao.conversation.dto.CompletionChunk;
import bbt.tao.conversation.entity.ChatMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.List;

@Slf4j
@Component
public class SpringAiChatCompletionClient implements ChatCompletionClient {

    private final ChatModel chatModel;
    private final Clock clock;

    public SpringAiChatCompletionClient(ChatModel chatModel, Clock clock) {
        this.chatModel = chatModel;
        this.clock = clock;
    }

    @Override
    public Mono<Completion> complete(ChatRequest request) {
        log.debug("Sending completion request for conversation {} to model {}", request.conversationId(), request.model());
        return Mono.fromCallable(() -> chatModel.call(toPrompt(request)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(this::toCompletion)
                .onErrorMap(UpstreamErrors::translate);
    }

    @Override
    public Flux<CompletionChunk> completeStream(ChatRequest request) {
        log.debug("Sending streaming request for conversation {} to model {}", request.conversationId(), request.model());
        return Flux.defer(() -> chatModel.stream(toPrompt(request)))
                .filter(response -> response.getResult() != null)
                .map(this::toChunk)
                .onErrorMap(UpstreamErrors::translate);
    }

    Prompt toPrompt(ChatRequest request) {
        List<Message> messages = request.messages().stream()
                .map(this::toSpringMessage)
                .toList();

        ChatParameters parameters = request.parameters();
        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(request.model())
                .temperature(parameters.temperature())
                .topP(parameters.topP())
                .maxTokens(parameters.maxTokens())
                .presencePenalty(parameters.presencePenalty())
                .frequencyPenalty(parameters.frequencyPenalty())
                .user(parameters.user())
                .build();

        return new Prompt(messages, options);
    }

    private Message toSpringMessage(ChatMessage message) {
        return switch (message.role()) {
            case SYSTEM -> new SystemMessage(message.content());
            case USER -> new UserMessage(message.content());
            case ASSISTANT -> new AssistantMessage(message.content());
        };
    }

    private Completion toCompletion(ChatResponse response) {
        Generation generation = response.getResult();
        ChatResponseMetadata metadata = response.getMetadata();
        return new Completion(
                textOrNull(metadata.getId()),
                textOrNull(metadata.getModel()),
                clock.instant(),
                generation == null ? "" : textOf(generation),
                generation == null ? null : generation.getMetadata().getFinishReason(),
                toUsage(metadata.getUsage())
        );
    }

    private CompletionChunk toChunk(ChatResponse response) {
        Generation generation = response.getResult();
        ChatResponseMetadata metadata = response.getMetadata();
        return new CompletionChunk(
                textOrNull(metadata.getId()),
                textOrNull(metadata.getModel()),
                textOf(generation),
                generation.getMetadata().getFinishReason()
        );
    }

    private String textOf(Generation generation) {
        AssistantMessage output = generation.getOutput();
        return output == null || output.getText() == null ? "" : output.getText();
    }

    private ChatUsage toUsage(Usage usage) {
        if (usage == null) {
            return null;
        }
        return new ChatUsage(usage.getPromptTokens(), usage.getCompletionTokens(), usage.getTotalTokens());
    }

    private String textOrNull(String value) {
        return StringUtils.hasText(value) ? value : null;
    }
}
