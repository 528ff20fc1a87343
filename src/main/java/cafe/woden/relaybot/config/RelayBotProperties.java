package cafe.woden.relaybot.config;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Relay bot settings.
 *
 * <p>Everything binds through Spring's relaxed binding, so {@code RELAYBOT_SERVER}, {@code
 * RELAYBOT_PROJECT_CONFIGURATION} etc. work from the environment.
 *
 * <p>Example YAML:
 * <pre>
 * relaybot:
 *   server: wss://sim.example.net/showdown/websocket
 *   user: devbot
 *   password: hunter2
 *   secret: webhook-secret
 *   room: development
 *   project-configuration: '{"server":{"rooms":["development"],"secret":"s1"}}'
 *   username-aliases: '{"Steve":"Steve the Great"}'
 * </pre>
 *
 * <p>Invalid settings throw from the constructor; the bot does not start half-configured.
 */
@ConfigurationProperties(prefix = "relaybot")
public record RelayBotProperties(
    URI server,
    String user,
    String password,
    String secret,
    /** Webhook listen port; {@link #DEFAULT_PORT} when unset. */
    Integer port,
    String room,
    /** Raw JSON object: project name to rooms/simple_rooms/secret. */
    String projectConfiguration,
    /** Raw JSON object: username (any case) to display name. */
    String usernameAliases,
    GithubApi githubApi
) {

  public static final int DEFAULT_PORT = 3030;

  /** Optional GitHub API credentials, used to look up pull request details. */
  public record GithubApi(String user, String password) {
    public GithubApi {
      user = Objects.toString(user, "").trim();
      password = Objects.toString(password, "");
    }

    /** Both halves are needed; a user without a password disables the API client. */
    public boolean isConfigured() {
      return !user.isEmpty() && !password.isEmpty();
    }

    @Override
    public String toString() {
      return "GithubApi[user=" + user + "]";
    }
  }

  public RelayBotProperties {
    if (server == null) {
      throw new IllegalArgumentException("relaybot.server is required");
    }
    if (!server.isAbsolute()) {
      throw new IllegalArgumentException("relaybot.server must be an absolute URI: " + server);
    }
    if (user == null || user.isBlank()) {
      throw new IllegalArgumentException("relaybot.user is required");
    }
    if (password == null) {
      throw new IllegalArgumentException("relaybot.password is required");
    }
    if (secret == null || secret.isBlank()) {
      throw new IllegalArgumentException("relaybot.secret is required");
    }
    if (port == null) {
      port = DEFAULT_PORT;
    }
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("relaybot.port is invalid: " + port);
    }
    room = blankToNull(room);
    projectConfiguration = blankToNull(projectConfiguration);
    usernameAliases = blankToNull(usernameAliases);
    if (room == null && projectConfiguration == null) {
      throw new IllegalArgumentException(
          "At least one of relaybot.room or relaybot.project-configuration needs to be provided");
    }
    if (githubApi == null) {
      githubApi = new GithubApi(null, null);
    }
  }

  public Optional<String> defaultRoom() {
    return Optional.ofNullable(room);
  }

  private static String blankToNull(String s) {
    String v = Objects.toString(s, "").trim();
    return v.isEmpty() ? null : v;
  }

  @Override
  public String toString() {
    return "RelayBotProperties[server="
        + server
        + ", user="
        + user
        + ", port="
        + port
        + ", room="
        + room
        + ", githubApi="
        + githubApi
        + "]";
  }
}
