package cafe.woden.relaybot.config;

import cafe.woden.relaybot.routing.RoomConfiguration;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes {@code relaybot.project-configuration}.
 *
 * <pre>
 * { "&lt;project&gt;": { "rooms": ["a"], "simple_rooms": ["b"], "secret": "s" }, ... }
 * </pre>
 *
 * <p>{@code rooms} and {@code simple_rooms} default to empty and {@code secret} is optional. The
 * schema is strict: unknown fields, null entries and lists, non-string rooms or secrets and blank
 * secrets are rejected.
 */
public final class ProjectConfigurationCodec {

  private static final String PROPERTY = "relaybot.project-configuration";

  private static final List<String> ROOM_FIELDS = List.of("rooms", "simple_rooms");

  private static final ObjectMapper JSON = strictMapper();

  private static final JavaType ENTRIES =
      JSON.getTypeFactory()
          .constructType(new TypeReference<LinkedHashMap<String, ProjectEntry>>() {});

  record ProjectEntry(
      @JsonProperty("rooms") List<String> rooms,
      @JsonProperty("simple_rooms") List<String> simpleRooms,
      @JsonProperty("secret") String secret) {}

  private ProjectConfigurationCodec() {}

  /**
   * @throws IllegalArgumentException if {@code json} is not valid JSON or violates the schema
   */
  public static Map<String, RoomConfiguration> decode(String json) {
    LinkedHashMap<String, ProjectEntry> raw;
    try {
      JsonNode root = JSON.readTree(json);
      if (root == null || !root.isObject()) {
        throw new IllegalArgumentException(PROPERTY + " should be a JSON object");
      }
      rejectNullRoomLists(root);
      raw = JSON.treeToValue(root, ENTRIES);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          PROPERTY + " should be valid JSON: " + e.getOriginalMessage(), e);
    }

    LinkedHashMap<String, RoomConfiguration> out = new LinkedHashMap<>();
    for (Map.Entry<String, ProjectEntry> e : raw.entrySet()) {
      String project = e.getKey();
      ProjectEntry entry = e.getValue();
      if (entry == null) {
        throw new IllegalArgumentException(PROPERTY + ": entry for '" + project + "' is null");
      }
      out.put(project, toConfiguration(project, entry));
    }
    return out;
  }

  // An absent list means "no rooms"; an explicit null is a mistake.
  private static void rejectNullRoomLists(JsonNode root) {
    Iterator<Map.Entry<String, JsonNode>> projects = root.fields();
    while (projects.hasNext()) {
      Map.Entry<String, JsonNode> project = projects.next();
      JsonNode entry = project.getValue();
      if (!entry.isObject()) continue;
      for (String field : ROOM_FIELDS) {
        JsonNode rooms = entry.get(field);
        if (rooms != null && rooms.isNull()) {
          throw new IllegalArgumentException(
              PROPERTY + ": " + field + " for '" + project.getKey() + "' is null");
        }
      }
    }
  }

  private static RoomConfiguration toConfiguration(String project, ProjectEntry entry) {
    List<String> rooms = rooms(project, "rooms", entry.rooms());
    List<String> simpleRooms = rooms(project, "simple_rooms", entry.simpleRooms());
    if (entry.secret() != null && entry.secret().isBlank()) {
      throw new IllegalArgumentException(PROPERTY + ": secret for '" + project + "' is blank");
    }
    return new RoomConfiguration(rooms, simpleRooms, entry.secret());
  }

  private static List<String> rooms(String project, String field, List<String> rooms) {
    if (rooms == null) return List.of();
    for (String room : rooms) {
      if (room == null || room.isBlank()) {
        throw new IllegalArgumentException(
            PROPERTY + ": " + field + " for '" + project + "' contains a blank room");
      }
    }
    return List.copyOf(rooms);
  }

  private static ObjectMapper strictMapper() {
    ObjectMapper mapper =
        new ObjectMapper()
            .enable(
                DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES,
                DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    // Rooms and secrets must be JSON strings, not numbers or booleans.
    mapper
        .coercionConfigFor(LogicalType.Textual)
        .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
    return mapper;
  }
}
