package cafe.woden.relaybot.config;

import cafe.woden.relaybot.alias.UsernameAliases;
import cafe.woden.relaybot.routing.RoomConfiguration;
import cafe.woden.relaybot.routing.RoomResolver;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the read-only routing tables from {@link RelayBotProperties}.
 *
 * <p>Both beans are created once while the context starts and are never modified afterwards.
 * Any decoding failure propagates and aborts startup.
 */
@Configuration
public class RoutingConfig {
  private static final Logger log = LoggerFactory.getLogger(RoutingConfig.class);

  @Bean
  public RoomResolver roomResolver(RelayBotProperties props) {
    Map<String, RoomConfiguration> projects =
        props.projectConfiguration() == null
            ? Map.of()
            : ProjectConfigurationCodec.decode(props.projectConfiguration());

    RoomResolver resolver = new RoomResolver(props.room(), projects, props.secret());
    long overrides = projects.values().stream().filter(c -> c.secret() != null).count();
    long silent = projects.values().stream().filter(RoomConfiguration::isSilent).count();
    log.info(
        "[relaybot] Routing {} project(s) ({} with own secret, {} silent); default room: {}",
        projects.size(),
        overrides,
        silent,
        resolver.defaultRoom().orElse("<none>"));
    return resolver;
  }

  @Bean
  public UsernameAliases usernameAliases(RelayBotProperties props) {
    if (props.usernameAliases() == null) {
      log.debug("[relaybot] No username aliases configured");
      return new UsernameAliases();
    }
    UsernameAliases aliases = UsernameAliasCodec.decode(props.usernameAliases());
    log.info("[relaybot] Loaded {} username alias(es)", aliases.size());
    return aliases;
  }
}
