package cafe.woden.relaybot.routing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Maps a project name to the rooms that should hear about it and the secret its webhooks are
 * signed with.
 *
 * <p>Built once at startup and never mutated afterwards, so it can be shared by every event
 * handler without synchronization. Resolution runs an ordered rule list:
 *
 * <ol>
 *   <li>exact (case-sensitive) project match, using the project's secret override if it has one
 *   <li>the default room (if any) with the global secret
 * </ol>
 *
 * <p>A project with no rooms but a secret override resolves to "notify nobody" while still
 * checking signatures against its own secret.
 */
@ApplicationLayer
public final class RoomResolver {

  @FunctionalInterface
  private interface ResolutionRule {
    /** @return the resolution, or {@code null} to fall through to the next rule */
    RoomConfigurationRef apply(String projectName);
  }

  private final String defaultRoom;
  private final Map<String, RoomConfiguration> projects;
  private final Map<String, RoomConfigurationRef> resolvedProjects;
  private final RoomConfigurationRef fallback;
  private final List<ResolutionRule> rules;

  public RoomResolver(
      String defaultRoom, Map<String, RoomConfiguration> projects, String globalSecret) {
    String secret = Objects.requireNonNull(globalSecret, "globalSecret");
    if (secret.isBlank()) {
      throw new IllegalArgumentException("global secret must not be blank");
    }
    this.defaultRoom = norm(defaultRoom);

    LinkedHashMap<String, RoomConfiguration> copy = new LinkedHashMap<>();
    LinkedHashMap<String, RoomConfigurationRef> resolved = new LinkedHashMap<>();
    if (projects != null) {
      for (Map.Entry<String, RoomConfiguration> e : projects.entrySet()) {
        String name = Objects.requireNonNull(e.getKey(), "project name");
        RoomConfiguration cfg =
            Objects.requireNonNull(e.getValue(), () -> "configuration for " + name);
        copy.put(name, cfg);
        String effectiveSecret = cfg.secretOverride().orElse(secret);
        resolved.put(
            name, new RoomConfigurationRef(cfg.rooms(), cfg.simpleRooms(), effectiveSecret));
      }
    }
    this.projects = Collections.unmodifiableMap(copy);
    this.resolvedProjects = Collections.unmodifiableMap(resolved);

    List<String> fallbackRooms = this.defaultRoom == null ? List.of() : List.of(this.defaultRoom);
    this.fallback = new RoomConfigurationRef(fallbackRooms, List.of(), secret);
    this.rules = List.of(this::exactProjectMatch, this::globalDefault);
  }

  /** Resolve the destinations and signing secret for {@code projectName}. Never fails. */
  public RoomConfigurationRef resolve(String projectName) {
    for (ResolutionRule rule : rules) {
      RoomConfigurationRef ref = rule.apply(projectName);
      if (ref != null) return ref;
    }
    // globalDefault always answers.
    return fallback;
  }

  /**
   * Every room named anywhere in the configuration plus the default room.
   *
   * <p>Used once at startup to decide which rooms to join. Iteration order carries no meaning.
   */
  public Set<String> allRooms() {
    LinkedHashSet<String> out = new LinkedHashSet<>();
    for (RoomConfiguration cfg : projects.values()) {
      out.addAll(cfg.rooms());
      out.addAll(cfg.simpleRooms());
    }
    if (defaultRoom != null) {
      out.add(defaultRoom);
    }
    return Collections.unmodifiableSet(out);
  }

  public Optional<String> defaultRoom() {
    return Optional.ofNullable(defaultRoom);
  }

  /** Configured projects, keyed by exact name. */
  public Map<String, RoomConfiguration> projects() {
    return projects;
  }

  private RoomConfigurationRef exactProjectMatch(String projectName) {
    if (projectName == null) return null;
    return resolvedProjects.get(projectName);
  }

  private RoomConfigurationRef globalDefault(String projectName) {
    return fallback;
  }

  private static String norm(String s) {
    String v = Objects.toString(s, "").trim();
    return v.isEmpty() ? null : v;
  }

  @Override
  public String toString() {
    return "RoomResolver[projects="
        + projects.keySet()
        + ", defaultRoom="
        + defaultRoom
        + "]";
  }
}
