package com.example.partyrooms.prompt;

/** Content kinds a round can serve. */
public enum PromptKind {
    QUESTION,
    WORD,
    PHRASE
}
