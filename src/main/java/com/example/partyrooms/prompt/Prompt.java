package com.example.partyrooms.prompt;

import com.example.partyrooms.model.Difficulty;

import java.util.Objects;

/** One unit of round content with its (possibly hidden) answer. */
public record Prompt(String id, PromptPayload payload, String category, Difficulty difficulty) {

    public Prompt {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(payload, "payload");
    }

    public PromptKind kind() {
        return payload.kind();
    }

    public boolean isCorrect(int answerIndex) {
        return payload.answerKey().isPresent() && payload.answerKey().getAsInt() == answerIndex;
    }
}
