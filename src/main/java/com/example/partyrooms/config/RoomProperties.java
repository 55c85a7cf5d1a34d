package com.example.partyrooms.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** Room creation defaults and the bounds settings must stay within. */
@ConfigurationProperties(prefix = "app.rooms")
public class RoomProperties {
  /** Random codes tried before giving up with CODE_EXHAUSTED. */
  private int codeAttempts = 10;

  private int defaultRoundCount = 5;
  private int defaultTimePerPromptSeconds = 30;

  private int minRoundCount = 1;
  private int maxRoundCount = 20;
  private int minTimePerPromptSeconds = 5;
  private int maxTimePerPromptSeconds = 120;
  private int minPlayersLimit = 2;
  private int maxPlayersLimit = 20;

  /** Worker threads shared by all room actors. */
  private int workerThreads = 4;

  public int getCodeAttempts() { return codeAttempts; }
  public void setCodeAttempts(int codeAttempts) { this.codeAttempts = codeAttempts; }

  public int getDefaultRoundCount() { return defaultRoundCount; }
  public void setDefaultRoundCount(int defaultRoundCount) { this.defaultRoundCount = defaultRoundCount; }

  public int getDefaultTimePerPromptSeconds() { return defaultTimePerPromptSeconds; }
  public void setDefaultTimePerPromptSeconds(int v) { this.defaultTimePerPromptSeconds = v; }

  public int getMinRoundCount() { return minRoundCount; }
  public void setMinRoundCount(int minRoundCount) { this.minRoundCount = minRoundCount; }

  public int getMaxRoundCount() { return maxRoundCount; }
  public void setMaxRoundCount(int maxRoundCount) { this.maxRoundCount = maxRoundCount; }

  public int getMinTimePerPromptSeconds() { return minTimePerPromptSeconds; }
  public void setMinTimePerPromptSeconds(int v) { this.minTimePerPromptSeconds = v; }

  public int getMaxTimePerPromptSeconds() { return maxTimePerPromptSeconds; }
  public void setMaxTimePerPromptSeconds(int v) { this.maxTimePerPromptSeconds = v; }

  public int getMinPlayersLimit() { return minPlayersLimit; }
  public void setMinPlayersLimit(int minPlayersLimit) { this.minPlayersLimit = minPlayersLimit; }

  public int getMaxPlayersLimit() { return maxPlayersLimit; }
  public void setMaxPlayersLimit(int maxPlayersLimit) { this.maxPlayersLimit = maxPlayersLimit; }

  public int getWorkerThreads() { return workerThreads; }
  public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
}
