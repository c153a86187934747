package com.pensionai.orchestration.model;

import org.springframework.lang.Nullable;

/**
 * One role-tagged entry of the conversation. {@code author} names the step that produced a
 * worker or note message and is null for user input.
 */
public record ConversationMessage(MessageRole role, String content, @Nullable String author) {

    public ConversationMessage {
        if (role == null) {
            throw new IllegalArgumentException("role is required");
        }
        content = content == null ? "" : content;
    }

    public static ConversationMessage user(String content) {
        return new ConversationMessage(MessageRole.USER, content, null);
    }

    public static ConversationMessage worker(String author, String content) {
        return new ConversationMessage(MessageRole.WORKER, content, author);
    }

    public static ConversationMessage note(String author, String content) {
        return new ConversationMessage(MessageRole.SYSTEM_NOTE, content, author);
    }

    public String render() {
        String label = switch (role) {
            case USER -> "user";
            case WORKER -> author != null ? author : "worker";
            case SYSTEM_NOTE -> "note";
        };
        return label + ": " + content;
    }
}
