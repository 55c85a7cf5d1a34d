package com.example.partyrooms.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.security.password")
public class PasswordProperties {
  /** BCrypt cost/strength (valid 4..31). */
  private int bcryptCost = 10;

  /** Optional global pepper appended to every password before hashing. */
  private String pepper = "";

  /** Failed-or-not join attempts allowed per client within {@link #window}. */
  private int maxAttempts = 5;

  /** Rolling window for {@link #maxAttempts}. */
  private Duration window = Duration.ofSeconds(60);

  public int getBcryptCost() { return bcryptCost; }
  public void setBcryptCost(int bcryptCost) { this.bcryptCost = bcryptCost; }

  public String getPepper() { return pepper; }
  public void setPepper(String pepper) { this.pepper = pepper; }

  public int getMaxAttempts() { return maxAttempts; }
  public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

  public Duration getWindow() { return window; }
  public void setWindow(Duration window) { this.window = window; }
}
