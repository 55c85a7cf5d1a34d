package com.example.partyrooms.prompt;

import com.example.partyrooms.model.Difficulty;
import com.example.partyrooms.model.GameContent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.*;

class PromptCodecTest {

    private static GameContent row(PromptKind kind, String json) {
        return new GameContent("c1", "quiz", kind, json, "history", Difficulty.MEDIUM, true);
    }

    @Test
    void decodesQuestion() {
        Prompt p = PromptCodec.decode(row(PromptKind.QUESTION,
                "{\"question\":\"Capital of Estonia?\",\"options\":[\"Riga\",\"Tallinn\"],\"correctAnswer\":1}"));

        assertEquals(PromptKind.QUESTION, p.kind());
        assertEquals(new PromptPayload.Question("Capital of Estonia?", List.of("Riga", "Tallinn"), 1), p.payload());
        assertTrue(p.isCorrect(1));
        assertFalse(p.isCorrect(0));
        assertEquals("history", p.category());
    }

    @ParameterizedTest
    @ValueSource(strings = {"word", "term", "activity"})
    void wordAcceptsAliases(String field) {
        Prompt p = PromptCodec.decode(row(PromptKind.WORD, "{\"" + field + "\":\"lighthouse\"}"));
        assertEquals(new PromptPayload.Word("lighthouse"), p.payload());
        assertFalse(p.isCorrect(0), "words have no answer key");
    }

    @ParameterizedTest
    @ValueSource(strings = {"proverb", "phrase", "text"})
    void phraseAcceptsAliases(String field) {
        Prompt p = PromptCodec.decode(row(PromptKind.PHRASE, "{\"" + field + "\":\"Early bird gets the worm\"}"));
        assertEquals(new PromptPayload.Phrase("Early bird gets the worm"), p.payload());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "not json",
            "[1,2]",
            "{\"question\":\"Q?\",\"options\":[\"a\",\"b\"]}",
            "{\"question\":\"Q?\",\"options\":[\"a\"],\"correctAnswer\":0}",
            "{\"question\":\"Q?\",\"options\":[\"a\",\"b\"],\"correctAnswer\":5}",
            "{\"options\":[\"a\",\"b\"],\"correctAnswer\":0}"
    })
    void malformedQuestionsAreRejected(String json) {
        assertThrows(IllegalArgumentException.class, () -> PromptCodec.decode(row(PromptKind.QUESTION, json)));
    }

    @Test
    void blankWordIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> PromptCodec.decode(row(PromptKind.WORD, "{\"word\":\"  \"}")));
    }

    @Test
    void publicViewHidesAnswerKey() {
        Prompt p = PromptCodec.decode(row(PromptKind.QUESTION,
                "{\"question\":\"2+2?\",\"options\":[\"3\",\"4\"],\"correctAnswer\":1}"));

        Map<String, Object> view = PromptCodec.publicView(p);

        assertEquals("2+2?", view.get("text"));
        assertEquals(List.of("3", "4"), view.get("options"));
        assertEquals("MEDIUM", view.get("difficulty"));
        assertThat(view, not(hasKey("correctAnswer")));
        assertThat(view, not(hasKey("correctIndex")));
    }

    @Test
    void encodedPayloadDecodesToSamePrompt() {
        PromptPayload.Question q = new PromptPayload.Question("Largest planet?", List.of("Mars", "Jupiter"), 1);
        Prompt p = PromptCodec.decode(row(PromptKind.QUESTION, PromptCodec.encode(q)));
        assertEquals(q, p.payload());
    }
}
