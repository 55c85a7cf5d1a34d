package com.example.partyrooms.rooms.web;

import com.example.partyrooms.error.RoomException;
import com.example.partyrooms.model.Visibility;
import com.example.partyrooms.rooms.CreateRoomRequest;
import com.example.partyrooms.rooms.JoinRequest;
import com.example.partyrooms.rooms.PlayerView;
import com.example.partyrooms.rooms.RoomService;
import com.example.partyrooms.rooms.RoomSummary;
import com.example.partyrooms.rooms.RoomView;
import com.example.partyrooms.rooms.SettingsPatch;
import com.example.partyrooms.session.SessionCoordinator;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

/**
 * HTTP surface of the room commands. Caller identity is the optional X-User-Id header
 * (authentication happens upstream); password attempts are limited per remote address.
 */
@RestController
@RequestMapping("/api/rooms")
public class RoomsController {

  static final String USER_HEADER = "X-User-Id";

  private final RoomService rooms;

  public RoomsController(RoomService rooms) {
    this.rooms = rooms;
  }

  // --- Create / list / get -------------------------------------------------

  @PostMapping
  public ResponseEntity<RoomView> create(
      @RequestHeader(value = USER_HEADER, required = false) String userId,
      @RequestBody CreateRequest body
  ) {
    CreateRoomRequest req = new CreateRoomRequest(
        body.gameId, body.name, parseVisibility(body.visibility), body.password, body.settings);
    return ResponseEntity.status(HttpStatus.CREATED).body(rooms.createRoom(req, userId));
  }

  @GetMapping
  public List<RoomSummary> listPublic() {
    return rooms.listPublicRooms();
  }

  @GetMapping("/{code}")
  public RoomView get(@PathVariable String code) {
    return rooms.snapshot(norm(code));
  }

  // --- Membership ----------------------------------------------------------

  @PostMapping("/{code}/join")
  public PlayerView join(
      @PathVariable String code,
      @RequestHeader(value = USER_HEADER, required = false) String userId,
      @RequestBody JoinBody body,
      HttpServletRequest request
  ) {
    JoinRequest req = new JoinRequest(body.displayName, body.team, body.password);
    return rooms.join(norm(code), req, userId, request.getRemoteAddr());
  }

  @DeleteMapping("/{code}/players/{playerId}")
  public ResponseEntity<Void> leave(@PathVariable String code, @PathVariable String playerId) {
    rooms.leave(norm(code), playerId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{code}/players/{playerId}/team")
  public PlayerView changeTeam(@PathVariable String code, @PathVariable String playerId,
                               @RequestBody TeamBody body) {
    return rooms.changeTeam(norm(code), playerId, body.team);
  }

  @PostMapping("/{code}/players/{playerId}/ready")
  public PlayerView setReady(@PathVariable String code, @PathVariable String playerId,
                             @RequestBody(required = false) ReadyBody body) {
    boolean ready = (body == null || body.ready == null) || body.ready;
    return rooms.setReady(norm(code), playerId, ready);
  }

  // --- Host actions --------------------------------------------------------

  @PatchMapping("/{code}/settings")
  public RoomView updateSettings(
      @PathVariable String code,
      @RequestHeader(value = USER_HEADER, required = false) String userId,
      @RequestBody SettingsPatch patch
  ) {
    return rooms.updateSettings(norm(code), patch, userId);
  }

  @PostMapping("/{code}/start")
  public RoomView start(@PathVariable String code,
                        @RequestHeader(value = USER_HEADER, required = false) String userId) {
    return rooms.startGame(norm(code), userId);
  }

  @PostMapping("/{code}/next")
  public ResponseEntity<Void> next(@PathVariable String code,
                                   @RequestHeader(value = USER_HEADER, required = false) String userId) {
    rooms.requestNextPrompt(norm(code), userId);
    return ResponseEntity.accepted().build();
  }

  // --- Rounds --------------------------------------------------------------

  @PostMapping("/{code}/players/{playerId}/answer")
  public SessionCoordinator.AnswerResult answer(@PathVariable String code, @PathVariable String playerId,
                                                @RequestBody AnswerBody body) {
    return rooms.submitAnswer(norm(code), playerId, body.answerIndex);
  }

  // ===== helpers ============================================================

  private static String norm(String code) {
    return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
  }

  private static Visibility parseVisibility(String raw) {
    if (raw == null || raw.isBlank()) return Visibility.PUBLIC;
    return Visibility.parse(raw)
        .orElseThrow(() -> RoomException.invalid("INVALID_INPUT", "visibility must be public or private, got '" + raw + "'"));
  }

  // ===== DTOs (Requests) ====================================================

  /** POST / body */
  public static final class CreateRequest {
    public String gameId;
    public String name;
    public String visibility;
    public String password;
    public SettingsPatch settings;
  }

  /** POST /{code}/join body */
  public static final class JoinBody {
    public String displayName;
    public String team;
    public String password;
  }

  public static final class TeamBody {
    public String team;
  }

  public static final class ReadyBody {
    public Boolean ready;
  }

  public static final class AnswerBody {
    public Integer answerIndex;
  }
}
