package com.example.partyrooms.security;

import com.example.partyrooms.config.PasswordProperties;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

@Component
public class PasswordHasher {
  private final BCryptPasswordEncoder enc;
  private final String pepper;

  public PasswordHasher(PasswordProperties props) {
    this.enc = new BCryptPasswordEncoder(props.getBcryptCost());
    this.pepper = (props.getPepper() == null ? "" : props.getPepper());
  }

  public String hash(String raw) {
    return enc.encode((raw == null ? "" : raw) + pepper);
  }

  public boolean matches(String raw, String hash) {
    if (hash == null || hash.isBlank()) return (raw == null || raw.isBlank());
    return enc.matches((raw == null ? "" : raw) + pepper, hash);
  }
}
