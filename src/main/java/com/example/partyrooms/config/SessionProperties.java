package com.example.partyrooms.config;

import com.example.partyrooms.prompt.PromptKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/** Round pacing and scoring. */
@ConfigurationProperties(prefix = "app.session")
public class SessionProperties {
  private int pointsPerCorrectAnswer = 10;

  /** Pause between a round's reveal and the next prompt. */
  private Duration revealPause = Duration.ofSeconds(3);

  /** Upper bound of approved prompts cached per session. */
  private int promptPoolSize = 100;

  private PromptKind promptKind = PromptKind.QUESTION;

  public int getPointsPerCorrectAnswer() { return pointsPerCorrectAnswer; }
  public void setPointsPerCorrectAnswer(int v) { this.pointsPerCorrectAnswer = v; }

  public Duration getRevealPause() { return revealPause; }
  public void setRevealPause(Duration revealPause) { this.revealPause = revealPause; }

  public int getPromptPoolSize() { return promptPoolSize; }
  public void setPromptPoolSize(int promptPoolSize) { this.promptPoolSize = promptPoolSize; }

  public PromptKind getPromptKind() { return promptKind; }
  public void setPromptKind(PromptKind promptKind) { this.promptKind = promptKind; }
}
