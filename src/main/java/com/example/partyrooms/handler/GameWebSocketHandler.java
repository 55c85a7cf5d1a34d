package com.example.partyrooms.handler;

import com.example.partyrooms.broadcast.RoomEvent;
import com.example.partyrooms.error.ErrorKind;
import com.example.partyrooms.gateway.ClientCommand;
import com.example.partyrooms.gateway.ClientConnection;
import com.example.partyrooms.gateway.ConnectionGateway;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket adapter for the connection gateway (path app.websocket.path, default /ws/rooms).
 * - Frames are JSON commands: {"type": "join-room", "roomCode": ..., ...}
 * - Heartbeat: replies "pong" to a plain "ping" frame
 * - Identity: X-User-Id handshake header, or the userId query parameter
 * - Outbound sends go through a ConcurrentWebSocketSessionDecorator, since room events
 *   (room actor threads) and direct replies (this thread) can overlap
 */
@Component
public class GameWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(GameWebSocketHandler.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT = 512 * 1024;

    private final ConnectionGateway gateway;
    private final ObjectMapper mapper;

    /** WebSocket session id → connection */
    private final Map<String, WsConnection> bySession = new ConcurrentHashMap<>();

    public GameWebSocketHandler(ConnectionGateway gateway, ObjectMapper mapper) {
        this.gateway = gateway;
        this.mapper = mapper;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        WsConnection conn = new WsConnection(
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT),
                userIdOf(session), clientKeyOf(session), mapper);
        bySession.put(session.getId(), conn);
        log.info("WS OPEN sid={} user={} client={}", session.getId(), conn.userId(), conn.clientKey());
        gateway.connect(conn);
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) throws Exception {
        WsConnection conn = bySession.get(session.getId());
        if (conn == null) {
            log.warn("WS message from unknown session sid={}", session.getId());
            return;
        }
        String payload = message.getPayload();

        if ("ping".equals(payload)) {
            try { conn.sendRaw("pong"); }
            catch (IOException e) { log.warn("WS pong send failed (sid={}): {}", session.getId(), e.toString()); }
            return;
        }

        ClientCommand cmd;
        try {
            cmd = mapper.readValue(payload, ClientCommand.class);
        } catch (JsonProcessingException e) {
            log.debug("WS unparseable frame sid={}: {}", session.getId(), e.getOriginalMessage());
            conn.reply(ConnectionGateway.error("INVALID_INPUT", ErrorKind.INVALID_INPUT, "Malformed command frame"));
            return;
        }
        gateway.handle(conn, cmd);
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.warn("WS ERROR sid={} uri={} : {}", session.getId(), safeUri(session), exception.toString());
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        WsConnection conn = bySession.remove(session.getId());
        log.info("WS CLOSE sid={} code={} reason={}", session.getId(), status.getCode(), status.getReason());
        if (conn != null) gateway.disconnect(conn);
    }

    /* ---------------- helpers ---------------- */

    private static String userIdOf(WebSocketSession session) {
        String header = session.getHandshakeHeaders().getFirst("X-User-Id");
        if (header != null && !header.isBlank()) return header.trim();
        String q = parseQuery(session.getUri()).get("userId");
        return (q == null || q.isBlank()) ? null : q.trim();
    }

    private static String clientKeyOf(WebSocketSession session) {
        InetSocketAddress remote = session.getRemoteAddress();
        if (remote == null) return "unknown";
        return remote.getAddress() != null ? remote.getAddress().getHostAddress() : remote.getHostString();
    }

    private static Map<String, String> parseQuery(URI uri) {
        Map<String, String> map = new HashMap<>();
        if (uri == null || uri.getQuery() == null) return map;
        for (String kv : uri.getRawQuery().split("&")) {
            int i = kv.indexOf('=');
            if (i > 0) {
                String k = URLDecoder.decode(kv.substring(0, i), StandardCharsets.UTF_8);
                String v = URLDecoder.decode(kv.substring(i + 1), StandardCharsets.UTF_8);
                map.put(k, v);
            }
        }
        return map;
    }

    private String safeUri(WebSocketSession session) {
        try { return String.valueOf(session.getUri()); } catch (Exception e) { return "n/a"; }
    }

    /** Gateway view of one WebSocket session. */
    static final class WsConnection implements ClientConnection {
        private final WebSocketSession session;
        private final String userId;
        private final String clientKey;
        private final ObjectMapper mapper;

        WsConnection(WebSocketSession session, String userId, String clientKey, ObjectMapper mapper) {
            this.session = session;
            this.userId = userId;
            this.clientKey = clientKey;
            this.mapper = mapper;
        }

        @Override public String id() { return session.getId(); }
        @Override public boolean isOpen() { return session.isOpen(); }
        @Override public String userId() { return userId; }
        @Override public String clientKey() { return clientKey; }

        @Override
        public void deliver(RoomEvent event) throws IOException {
            sendRaw(mapper.writeValueAsString(event.toWire()));
        }

        @Override
        public void reply(Map<String, Object> message) throws IOException {
            sendRaw(mapper.writeValueAsString(message));
        }

        void sendRaw(String text) throws IOException {
            if (session.isOpen()) session.sendMessage(new TextMessage(text));
        }
    }
}
