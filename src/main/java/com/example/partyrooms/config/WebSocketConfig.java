package com.example.partyrooms.config;

import com.example.partyrooms.handler.GameWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

  private final GameWebSocketHandler handler;
  private final String roomsPath;
  private final List<String> originPatterns;

  public WebSocketConfig(
      GameWebSocketHandler handler,
      @Value("${app.websocket.path:/ws/rooms}") String roomsPath,
      @Value("${app.websocket.allowed-origins:http://localhost:8080}") String originsCsv,
      // troubleshooting switch: accept any origin
      @Value("${app.websocket.debug-open:false}") boolean debugOpen
  ) {
    this.handler = handler;
    this.roomsPath = roomsPath;
    this.originPatterns = debugOpen ? List.of("*") : originPatterns(originsCsv);
  }

  /** CSV of allowed origins -> origin patterns; nothing configured means any origin. */
  static List<String> originPatterns(String originsCsv) {
    Set<String> patterns = new LinkedHashSet<>();
    if (originsCsv != null) {
      for (String raw : originsCsv.split(",")) {
        String origin = raw.trim();
        if (origin.isEmpty()) continue;
        patterns.add(origin);
        if (isLocalDev(origin)) {
          // dev front ends run on arbitrary ports
          String scheme = origin.substring(0, origin.indexOf("://"));
          patterns.add(scheme + "://localhost:*");
          patterns.add(scheme + "://127.0.0.1:*");
        }
      }
    }
    return patterns.isEmpty() ? List.of("*") : List.copyOf(patterns);
  }

  private static boolean isLocalDev(String origin) {
    return origin.startsWith("http://localhost") || origin.startsWith("https://localhost")
        || origin.startsWith("http://127.0.0.1") || origin.startsWith("https://127.0.0.1");
  }

  @Override
  public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
    log.info("Room socket at {} (origins {})", roomsPath, originPatterns);
    registry.addHandler(handler, roomsPath)
            .setAllowedOriginPatterns(originPatterns.toArray(String[]::new));
  }
}
