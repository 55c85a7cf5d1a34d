package com.example.partyrooms.prompt;

import com.example.partyrooms.model.GameContent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog JSON <-> typed prompts.
 *
 * Accepted payload shapes per kind:
 * - QUESTION: {"question": "...", "options": ["..", ".."], "correctAnswer": 1}
 * - WORD:     {"word": "..."}   ("term" and "activity" are accepted aliases)
 * - PHRASE:   {"proverb": "..."} ("phrase" and "text" are accepted aliases)
 */
public final class PromptCodec {
  private PromptCodec() {}

  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Catalog row -> typed prompt. Throws IllegalArgumentException for malformed content. */
  public static Prompt decode(GameContent row) {
    if (row == null) throw new IllegalArgumentException("content row is null");
    if (row.getKind() == null) throw new IllegalArgumentException("content " + row.getId() + " has no kind");

    JsonNode json;
    try {
      json = MAPPER.readTree(row.getPayload() == null ? "" : row.getPayload());
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("content " + row.getId() + " is not valid JSON", e);
    }
    if (json == null || !json.isObject()) {
      throw new IllegalArgumentException("content " + row.getId() + " payload must be a JSON object");
    }

    PromptPayload payload = switch (row.getKind()) {
      case QUESTION -> decodeQuestion(json);
      case WORD     -> new PromptPayload.Word(firstText(json, "word", "term", "activity"));
      case PHRASE   -> new PromptPayload.Phrase(firstText(json, "proverb", "phrase", "text"));
    };
    return new Prompt(row.getId(), payload, row.getCategory(), row.getDifficulty());
  }

  private static PromptPayload decodeQuestion(JsonNode json) {
    String text = firstText(json, "question", "text");
    List<String> options = new ArrayList<>();
    JsonNode opts = json.get("options");
    if (opts != null && opts.isArray()) {
      for (JsonNode o : opts) options.add(o.asText());
    }
    JsonNode key = json.get("correctAnswer");
    if (key == null || !key.canConvertToInt()) {
      throw new IllegalArgumentException("question has no numeric correctAnswer");
    }
    return new PromptPayload.Question(text, options, key.asInt());
  }

  private static String firstText(JsonNode json, String... fields) {
    for (String f : fields) {
      JsonNode n = json.get(f);
      if (n != null && n.isTextual() && !n.asText().isBlank()) return n.asText();
    }
    return null;
  }

  /** Typed prompt -> catalog JSON (used when seeding the demo catalog). */
  public static String encode(PromptPayload payload) {
    Map<String, Object> out = new LinkedHashMap<>();
    if (payload instanceof PromptPayload.Question q) {
      out.put("question", q.text());
      out.put("options", q.options());
      out.put("correctAnswer", q.correctIndex());
    } else if (payload instanceof PromptPayload.Word w) {
      out.put("word", w.term());
    } else if (payload instanceof PromptPayload.Phrase p) {
      out.put("proverb", p.text());
    }
    try {
      return MAPPER.writeValueAsString(out);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("cannot encode prompt payload", e);
    }
  }

  /** Outbound view: everything a player may see while the round runs. The answer key is never included. */
  public static Map<String, Object> publicView(Prompt prompt) {
    Map<String, Object> view = new LinkedHashMap<>();
    view.put("id", prompt.id());
    view.put("kind", prompt.kind().name());
    view.put("category", prompt.category());
    view.put("difficulty", prompt.difficulty() == null ? null : prompt.difficulty().name());

    PromptPayload payload = prompt.payload();
    if (payload instanceof PromptPayload.Question q) {
      view.put("text", q.text());
      view.put("options", q.options());
    } else if (payload instanceof PromptPayload.Word w) {
      view.put("term", w.term());
    } else if (payload instanceof PromptPayload.Phrase p) {
      view.put("text", p.text());
    }
    return view;
  }
}
