package bbt.tao.conversation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Generation knobs sent with a completion request. Every field is optional; a {@code null}
 * field means "use the default".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatParameters(
        Double temperature,
        Double topP,
        Integer maxTokens,
        Double presencePenalty,
        Double frequencyPenalty,
        String user
) {

    public static ChatParameters empty() {
        return new ChatParameters(null, null, null, null, null, null);
    }

    /**
     * Returns the defaults with every non-null field of {@code override} laid over them.
     */
    public static ChatParameters merge(ChatParameters defaults, ChatParameters override) {
        ChatParameters base = defaults == null ? empty() : defaults;
        if (override == null) {
            return base;
        }
        return new ChatParameters(
                pick(override.temperature(), base.temperature()),
                pick(override.topP(), base.topP()),
                pick(override.maxTokens(), base.maxTokens()),
                pick(override.presencePenalty(), base.presencePenalty()),
                pick(override.frequencyPenalty(), base.frequencyPenalty()),
                pick(override.user(), base.user())
        );
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
