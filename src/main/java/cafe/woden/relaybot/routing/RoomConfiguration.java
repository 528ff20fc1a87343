package cafe.woden.relaybot.routing;

import java.util.List;
import java.util.Optional;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Per-project notification targets.
 *
 * <p>{@code rooms} receive the full notification, {@code simpleRooms} the reduced variant. A
 * non-null {@code secret} overrides the global webhook secret for this project.
 */
@ValueObject
public record RoomConfiguration(List<String> rooms, List<String> simpleRooms, String secret) {

  public RoomConfiguration {
    rooms = rooms == null ? List.of() : List.copyOf(rooms);
    simpleRooms = simpleRooms == null ? List.of() : List.copyOf(simpleRooms);
    if (secret != null && secret.isBlank()) {
      throw new IllegalArgumentException("secret override must not be blank");
    }
  }

  public static RoomConfiguration of(List<String> rooms) {
    return new RoomConfiguration(rooms, List.of(), null);
  }

  public Optional<String> secretOverride() {
    return Optional.ofNullable(secret);
  }

  /** True when no room of either tier is notified. */
  public boolean isSilent() {
    return rooms.isEmpty() && simpleRooms.isEmpty();
  }

  @Override
  public String toString() {
    // Keep the secret out of logs.
    return "RoomConfiguration[rooms="
        + rooms
        + ", simpleRooms="
        + simpleRooms
        + ", secret="
        + (secret == null ? "<global>" : "<override>")
        + "]";
  }
}
