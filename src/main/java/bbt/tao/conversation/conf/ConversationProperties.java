package bbt.tao.conversation.conf;

import bbt.tao.conversation.dto.ChatModels;
import bbt.tao.conversation.dto.ChatParameters;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "conversation")
public class ConversationProperties {

    private String defaultModel = ChatModels.GPT_35_TURBO;

    /**
     * Maximum number of messages kept per conversation, system messages included.
     */
    private int messageLimit = 10;

    /**
     * How long an idle conversation is kept before it is forgotten.
     */
    private Duration messageExpiration = Duration.ofHours(1);

    /**
     * When false, upstream failures come back as a response with the error field set.
     */
    private boolean throwExceptionOnError = true;

    private ChatParameters defaultParameters;

    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public int getMessageLimit() {
        return messageLimit;
    }

    public void setMessageLimit(int messageLimit) {
        this.messageLimit = messageLimit;
    }

    public Duration getMessageExpiration() {
        return messageExpiration;
    }

    public void setMessageExpiration(Duration messageExpiration) {
        this.messageExpiration = messageExpiration;
    }

    public boolean isThrowExceptionOnError() {
        return throwExceptionOnError;
    }

    public void setThrowExceptionOnError(boolean throwExceptionOnError) {
        this.throwExceptionOnError = throwExceptionOnError;
    }

    public ChatParameters getDefaultParameters() {
        return defaultParameters == null ? ChatParameters.empty() : defaultParameters;
    }

    public void setDefaultParameters(ChatParameters defaultParameters) {
        this.defaultParameters = defaultParameters;
    }
}
