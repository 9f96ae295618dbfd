package bbt.tao.conversation.dto;

/**
 * Well-known chat completion model identifiers.
 */
public final class ChatModels {

    public static final String GPT_35_TURBO = "gpt-3.5-turbo";
    public static final String GPT_35_TURBO_16K = "gpt-3.5-turbo-16k";
    public static final String GPT_4 = "gpt-4";
    public static final String GPT_4_32K = "gpt-4-32k";

    private ChatModels() {
    }
}
