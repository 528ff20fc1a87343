package cafe.woden.relaybot.routing;

import java.util.List;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Result of {@link RoomResolver#resolve(String)}.
 *
 * <p>The lists are the resolver's own immutable instances; callers only read them. {@code
 * secret} is never null.
 */
@ValueObject
public record RoomConfigurationRef(List<String> rooms, List<String> simpleRooms, String secret) {

  public RoomConfigurationRef {
    Objects.requireNonNull(rooms, "rooms");
    Objects.requireNonNull(simpleRooms, "simpleRooms");
    Objects.requireNonNull(secret, "secret");
  }

  public boolean notifiesAnyone() {
    return !rooms.isEmpty() || !simpleRooms.isEmpty();
  }

  @Override
  public String toString() {
    return "RoomConfigurationRef[rooms=" + rooms + ", simpleRooms=" + simpleRooms + "]";
  }
}
