package com.example.partyrooms.prompt;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Typed prompt content. Exactly three shapes exist; each is validated in its constructor,
 * so code holding a payload never re-checks it.
 */
public interface PromptPayload {

    PromptKind kind();

    /** Index of the correct option, for payloads that have one. */
    default OptionalInt answerKey() {
        return OptionalInt.empty();
    }

    record Question(String text, List<String> options, int correctIndex) implements PromptPayload {
        public Question {
            if (text == null || text.isBlank()) throw new IllegalArgumentException("question text is required");
            if (options == null || options.size() < 2) throw new IllegalArgumentException("question needs at least two options");
            if (options.stream().anyMatch(Objects::isNull)) throw new IllegalArgumentException("question options must not be null");
            if (correctIndex < 0 || correctIndex >= options.size()) {
                throw new IllegalArgumentException("correct index " + correctIndex + " outside 0.." + (options.size() - 1));
            }
            options = List.copyOf(options);
        }

        @Override public PromptKind kind() { return PromptKind.QUESTION; }
        @Override public OptionalInt answerKey() { return OptionalInt.of(correctIndex); }
    }

    record Word(String term) implements PromptPayload {
        public Word {
            if (term == null || term.isBlank()) throw new IllegalArgumentException("word term is required");
        }

        @Override public PromptKind kind() { return PromptKind.WORD; }
    }

    record Phrase(String text) implements PromptPayload {
        public Phrase {
            if (text == null || text.isBlank()) throw new IllegalArgumentException("phrase text is required");
        }

        @Override public PromptKind kind() { return PromptKind.PHRASE; }
    }
}
