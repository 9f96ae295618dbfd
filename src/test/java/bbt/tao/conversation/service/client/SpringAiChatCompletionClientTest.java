package bbt.tao.conversation.service.client;

import bbt.tao.conversation.dto.ChatParameters;
import bbt.tao.conversation.dto.ChatRequest;
import bbt.tao.conversation.dto.CompletionChunk;
import bbt.tao.conversation.entity.ChatMessage;
import bbt.tao.conversation.exception.UpstreamException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.metadata.ChatGenerationMetadata;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.DefaultUsage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SpringAiChatCompletionClientTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private ChatModel chatModel;
    private SpringAiChatCompletionClient client;

    @BeforeEach
    void setUp() {
        chatModel = Mockito.mock(ChatModel.class);
        client = new SpringAiChatCompletionClient(chatModel, CLOCK);
    }

    @Test
    void mapsHistoryAndParametersToPrompt() {
        when(chatModel.call(any(Prompt.class))).thenReturn(response("Ahoy", "STOP"));

        StepVerifier.create(client.complete(request()))
                .expectNextCount(1)
                .verifyComplete();

        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        Prompt prompt = captor.getValue();

        assertThat(prompt.getInstructions()).extracting(Message::getMessageType)
                .containsExactly(MessageType.SYSTEM, MessageType.USER, MessageType.ASSISTANT, MessageType.USER);
        assertThat(prompt.getInstructions()).extracting(Message::getText)
                .containsExactly("be a pirate", "hi", "Ahoy", "where is the treasure?");

        OpenAiChatOptions options = (OpenAiChatOptions) prompt.getOptions();
        assertThat(options.getModel()).isEqualTo("gpt-4");
        assertThat(options.getTemperature()).isEqualTo(0.3);
        assertThat(options.getMaxTokens()).isEqualTo(128);
        assertThat(options.getUser()).isEqualTo("tester");
        assertThat(options.getTopP()).isNull();
    }

    @Test
    void mapsResponseToCompletion() {
        when(chatModel.call(any(Prompt.class))).thenReturn(response("Under the palm tree", "STOP"));

        StepVerifier.create(client.complete(request()))
                .assertNext(completion -> {
                    assertThat(completion.id()).isEqualTo("chatcmpl-1");
                    assertThat(completion.model()).isEqualTo("gpt-4-0613");
                    assertThat(completion.content()).isEqualTo("Under the palm tree");
                    assertThat(completion.finishReason()).isEqualTo("STOP");
                    assertThat(completion.created()).isEqualTo(CLOCK.instant());
                    assertThat(completion.usage().promptTokens()).isEqualTo(12);
                    assertThat(completion.usage().completionTokens()).isEqualTo(3);
                    assertThat(completion.usage().totalTokens()).isEqualTo(15);
                })
                .verifyComplete();
    }

    @Test
    void streamsDeltasAndSkipsEmptyResults() {
        ChatResponse usageOnly = new ChatResponse(List.of(), metadata());
        when(chatModel.stream(any(Prompt.class)))
                .thenReturn(Flux.just(response("Under ", null), response("the palm", "STOP"), usageOnly));

        StepVerifier.create(client.completeStream(request()))
                .assertNext(chunk -> assertThat(chunk.delta()).isEqualTo("Under "))
                .assertNext(chunk -> {
                    assertThat(chunk.delta()).isEqualTo("the palm");
                    assertThat(chunk.finishReason()).isEqualTo("STOP");
                })
                .verifyComplete();
    }

    @Test
    void translatesCallFailure() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new NonTransientAiException("401 - invalid api key"));

        StepVerifier.create(client.complete(request()))
                .verifyErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(UpstreamException.class);
                    assertThat(((UpstreamException) error).getKind()).isEqualTo(UpstreamException.Kind.AUTHENTICATION);
                    assertThat(error.getCause()).isInstanceOf(NonTransientAiException.class);
                });
    }

    @Test
    void translatesStreamFailure() {
        when(chatModel.stream(any(Prompt.class)))
                .thenReturn(Flux.<ChatResponse>error(new TransientAiException("503 - overloaded")));

        StepVerifier.create(client.completeStream(request()))
                .verifyErrorSatisfies(error -> assertThat(((UpstreamException) error).getKind())
                        .isEqualTo(UpstreamException.Kind.SERVER));
    }

    @Test
    void streamCallIsDeferredUntilSubscription() {
        Flux<CompletionChunk> stream = client.completeStream(request());

        Mockito.verifyNoInteractions(chatModel);
        assertThat(stream).isNotNull();
    }

    private static ChatRequest request() {
        Instant now = CLOCK.instant();
        return new ChatRequest(
                UUID.randomUUID(),
                "gpt-4",
                List.of(ChatMessage.system("be a pirate", now),
                        ChatMessage.user("hi", now),
                        ChatMessage.assistant("Ahoy", now),
                        ChatMessage.user("where is the treasure?", now)),
                new ChatParameters(0.3, null, 128, null, null, "tester"),
                false);
    }

    private static ChatResponse response(String text, String finishReason) {
        Generation generation = new Generation(new AssistantMessage(text),
                ChatGenerationMetadata.builder().finishReason(finishReason).build());
        return new ChatResponse(List.of(generation), metadata());
    }

    private static ChatResponseMetadata metadata() {
        return ChatResponseMetadata.builder()
                .id("chatcmpl-1")
                .model("gpt-4-0613")
                .usage(new DefaultUsage(12, 3))
                .build();
    }
}
