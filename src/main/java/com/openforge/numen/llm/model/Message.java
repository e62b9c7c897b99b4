package com.openforge.numen.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One entry of the chat history sent to the completion endpoint.
 *
 * role: "system" | "user" | "assistant"
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(String role, String content) {

    public static Message system(String content) {
        return new Message("system", content);
    }

    public static Message user(String content) {
        return new Message("user", content);
    }

    public static Message assistant(String content) {
        return new Message("assistant", content);
    }
}
