package bbt.tao.conversation.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChatRole {
    SYSTEM("system"),
    USER("user"),
    ASSISTANT("assistant");

    private final String value;

    ChatRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
